package sb3;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

public final class ProjectAssembler {
  private static final Logger logger = Logger.getLogger(ProjectAssembler.class.getName());

  private static final String PLACEHOLDER_COSTUME = "costume1";

  // Opcode prefixes of the extension categories.
  private static final ImmutableList<String> EXTENSIONS =
      ImmutableList.of("music", "pen", "videoSensing", "text2speech", "translate");

  private final StageConfig config;
  private final AssetLibrary library;
  private final EmbeddedAssets embedded;

  public ProjectAssembler(StageConfig config, AssetLibrary library) {
    this.config = config;
    this.library = library;
    this.embedded = EmbeddedAssets.instance();
  }

  public Project assemble(CompilationResult compiled) {
    Target stage =
        compiled
            .stage()
            .toBuilder()
            .setCostumes(ImmutableList.of(embedded.backdrop(config.backdropName())))
            .setCurrentCostume(0)
            .setLayerOrder(0)
            .build();

    ImmutableList.Builder<Target> sprites = ImmutableList.builder();
    ImmutableList<Target> targets = compiled.sprites();
    for (int i = 0; i < targets.size(); i++) {
      sprites.add(assembleSprite(targets.get(i), i));
    }
    ImmutableList<Target> assembled = sprites.build();

    return Project.create(
        stage, assembled, ImmutableList.of(), extensions(stage, assembled), config.meta());
  }

  private Target assembleSprite(Target sprite, int index) {
    Optional<AssetLibrary.SpriteAssets> assets = Optional.empty();
    try {
      assets = library.resolveSpriteAssets(sprite.name());
    } catch (AssetResolutionException ex) {
      logger.warning(
          String.format("cannot resolve assets of '%s': %s", sprite.name(), ex.getMessage()));
    }

    ImmutableList<Asset.Costume> costumes =
        assets.map(AssetLibrary.SpriteAssets::costumes).orElse(ImmutableList.of());
    if (costumes.isEmpty()) {
      logger.info(String.format("sprite '%s' uses the placeholder costume", sprite.name()));
      costumes = ImmutableList.of(embedded.placeholderCostume(PLACEHOLDER_COSTUME));
    }

    List<Asset.Sound> sounds =
        new ArrayList<>(assets.map(AssetLibrary.SpriteAssets::sounds).orElse(ImmutableList.of()));
    for (String referenced : sprite.referencedSounds()) {
      if (hasSound(sounds, referenced)) continue;
      resolveSound(referenced).ifPresent(sounds::add);
    }

    return sprite
        .toBuilder()
        .setCostumes(costumes)
        .setSounds(ImmutableList.copyOf(sounds))
        .setCurrentCostume(0)
        .setLayerOrder(index + 1)
        .setVisible(true)
        .setX(index * config.spriteSpacing() - config.spriteSpacing())
        .setY(0)
        .build();
  }

  private static boolean hasSound(List<Asset.Sound> sounds, String name) {
    return sounds.stream().anyMatch(s -> s.name().equalsIgnoreCase(name));
  }

  // The sound keeps the name the scripts refer to it by.
  private Optional<Asset.Sound> resolveSound(String name) {
    try {
      Optional<Asset.Sound> sound = library.resolveSound(name);
      if (!sound.isPresent()) {
        logger.warning(String.format("sound '%s' not found in the library", name));
      }
      return sound.map(
          s -> Asset.Sound.create(name, s.assetId(), s.dataFormat(), s.rate(), s.sampleCount()));
    } catch (AssetResolutionException ex) {
      logger.warning(String.format("cannot resolve sound '%s': %s", name, ex.getMessage()));
      return Optional.empty();
    }
  }

  // A project using music_setTempo must load the music extension.
  private static ImmutableList<String> extensions(Target stage, ImmutableList<Target> sprites) {
    Set<String> extensions = new TreeSet<>();
    for (Target target : ImmutableList.<Target>builder().add(stage).addAll(sprites).build()) {
      for (Block block : target.blocks().blocks().values()) {
        for (String extension : EXTENSIONS) {
          if (block.opcode().startsWith(extension + "_")) extensions.add(extension);
        }
      }
    }
    return ImmutableList.copyOf(extensions);
  }
}
