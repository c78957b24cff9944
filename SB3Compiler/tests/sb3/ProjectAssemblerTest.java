package sb3;

import static com.google.common.truth.Truth.assertThat;
import static sb3.PythonAst.*;

import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

public class ProjectAssemblerTest {

  private static Project assemble(AssetLibrary library, JsonObject... body)
      throws CompilerException {
    StageConfig config = StageConfig.defaults();
    CompilationResult compiled = new ScratchCompiler(config).compile(read(module(body)));
    return new ProjectAssembler(config, library).assemble(compiled);
  }

  private static Project assemble(JsonObject... body) throws Exception {
    return assemble(CatalogAssetLibrary.bundled(), body);
  }

  @Test
  public void knownSpriteGetsLibraryLooks() throws Exception {
    Project project = assemble(classDef("Cat", method("when_clicked", run("show"))));

    Target cat = project.sprite("Cat").get();
    assertThat(cat.costumes()).hasSize(2);
    assertThat(cat.costumes().get(0).name()).isEqualTo("cat-a");
    assertThat(cat.sounds().get(0).name()).isEqualTo("Meow");
    assertThat(cat.currentCostume()).isEqualTo(0);
  }

  @Test
  public void numberedSpriteFindsLibrarySprite() throws Exception {
    Project project = assemble(classDef("Ball2"));

    assertThat(project.sprite("Ball2").get().costumes().get(0).name()).isEqualTo("ball-a");
  }

  @Test
  public void unknownSpriteGetsPlaceholder() throws Exception {
    Project project = assemble(classDef("Zorg"));

    Target zorg = project.sprite("Zorg").get();
    assertThat(zorg.costumes())
        .containsExactly(EmbeddedAssets.instance().placeholderCostume("costume1"));
    assertThat(zorg.sounds()).isEmpty();
  }

  @Test
  public void playedSoundIsAdded() throws Exception {
    Project project =
        assemble(classDef("Ball", method("when_clicked", run("play_sound", str("Pop")))));

    Target ball = project.sprite("Ball").get();
    assertThat(ball.sounds().stream().map(Asset::name).collect(Collectors.toList()))
        .containsExactly("Boing", "Pop")
        .inOrder();
  }

  @Test
  public void ownSoundIsNotAddedTwice() throws Exception {
    Project project =
        assemble(classDef("Cat", method("when_clicked", run("play_sound", str("meow")))));

    assertThat(project.sprite("Cat").get().sounds()).hasSize(1);
  }

  @Test
  public void failingLibraryFallsBackToPlaceholder() throws Exception {
    AssetLibrary broken =
        new AssetLibrary() {
          @Override
          public Optional<SpriteAssets> resolveSpriteAssets(String spriteName)
              throws AssetResolutionException {
            throw new AssetResolutionException("offline");
          }

          @Override
          public Optional<Asset.Sound> resolveSound(String soundName)
              throws AssetResolutionException {
            throw new AssetResolutionException("offline");
          }
        };

    Project project =
        assemble(broken, classDef("Cat", method("when_clicked", run("play_sound", str("Meow")))));

    Target cat = project.sprite("Cat").get();
    assertThat(cat.costumes().get(0).name()).isEqualTo("costume1");
    assertThat(cat.sounds()).isEmpty();
  }

  @Test
  public void spritesAreLayeredAndSpaced() throws Exception {
    Project project = assemble(classDef("Cat"), classDef("Ball"), classDef("Dog2"));

    assertThat(project.stage().layerOrder()).isEqualTo(0);
    for (int i = 0; i < 3; i++) {
      Target sprite = project.sprites().get(i);
      assertThat(sprite.layerOrder()).isEqualTo(i + 1);
      assertThat(sprite.x()).isEqualTo(i * 100.0 - 100.0);
      assertThat(sprite.visible()).isTrue();
    }
  }

  @Test
  public void stageGetsBackdrop() throws Exception {
    Project project = assemble(classDef("Cat"));

    assertThat(project.stage().costumes())
        .containsExactly(EmbeddedAssets.instance().backdrop("backdrop1"));
    assertThat(project.meta().semver()).isEqualTo("3.0.0");
    String backdrop = project.stage().costumes().get(0).md5ext();
    assertThat(project.assetFileNames()).contains(backdrop);
    assertThat(EmbeddedAssets.instance().contents(backdrop)).isPresent();
    assertThat(EmbeddedAssets.instance().contents("missing.svg")).isEmpty();
  }

  @Test
  public void extensionsFollowOpcodes() throws Exception {
    Project project =
        assemble(
            classDef("Cat", method("when_clicked", run("set_tempo", num(90)), run("show"))));

    assertThat(project.extensions()).containsExactly("music");
  }

  @Test
  public void noExtensionsByDefault() throws Exception {
    Project project = assemble(classDef("Cat", method("when_clicked", run("show"))));

    assertThat(project.extensions()).isEmpty();
  }
}
