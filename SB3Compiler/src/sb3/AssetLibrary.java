package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

public interface AssetLibrary {

  @AutoValue
  abstract class SpriteAssets {
    public abstract ImmutableList<Asset.Costume> costumes();

    public abstract ImmutableList<Asset.Sound> sounds();

    public static SpriteAssets create(
        ImmutableList<Asset.Costume> costumes, ImmutableList<Asset.Sound> sounds) {
      return new AutoValue_AssetLibrary_SpriteAssets(costumes, sounds);
    }
  }

  Optional<SpriteAssets> resolveSpriteAssets(String spriteName) throws AssetResolutionException;

  Optional<Asset.Sound> resolveSound(String soundName) throws AssetResolutionException;
}
