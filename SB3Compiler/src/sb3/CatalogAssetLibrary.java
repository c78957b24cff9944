package sb3;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

public final class CatalogAssetLibrary implements AssetLibrary {
  private static final Logger logger = Logger.getLogger(CatalogAssetLibrary.class.getName());

  private static final String BUNDLED_CATALOG = "catalog.json";

  private final ImmutableMap<String, SpriteAssets> sprites;
  private final ImmutableMap<String, Asset.Sound> sounds;

  CatalogAssetLibrary(
      ImmutableMap<String, SpriteAssets> sprites, ImmutableMap<String, Asset.Sound> sounds) {
    this.sprites = sprites;
    this.sounds = sounds;
  }

  public static CatalogAssetLibrary bundled() throws AssetResolutionException {
    String json;
    try {
      json =
          Resources.toString(
              Resources.getResource(CatalogAssetLibrary.class, BUNDLED_CATALOG),
              StandardCharsets.UTF_8);
    } catch (IOException | IllegalArgumentException ex) {
      throw new AssetResolutionException("cannot read the bundled catalog", ex);
    }
    return parse(json);
  }

  public static CatalogAssetLibrary parse(String json) throws AssetResolutionException {
    try {
      JsonObject root = JsonParser.parseString(json).getAsJsonObject();
      ImmutableMap.Builder<String, SpriteAssets> sprites = ImmutableMap.builder();
      for (JsonElement element : array(root, "sprites")) {
        JsonObject sprite = element.getAsJsonObject();
        sprites.put(
            sprite.get("name").getAsString(),
            SpriteAssets.create(
                entries(sprite, "costumes", CatalogAssetLibrary::costume),
                entries(sprite, "sounds", CatalogAssetLibrary::sound)));
      }
      ImmutableMap.Builder<String, Asset.Sound> sounds = ImmutableMap.builder();
      for (Asset.Sound sound : entries(root, "sounds", CatalogAssetLibrary::sound)) {
        sounds.put(sound.name(), sound);
      }
      CatalogAssetLibrary library =
          new CatalogAssetLibrary(sprites.buildKeepingLast(), sounds.buildKeepingLast());
      logger.fine(
          String.format(
              "catalog: %d sprites, %d sounds", library.sprites.size(), library.sounds.size()));
      return library;
    } catch (JsonParseException
        | IllegalStateException
        | ClassCastException
        | UnsupportedOperationException
        | NullPointerException ex) {
      throw new AssetResolutionException("malformed asset catalog: " + ex.getMessage(), ex);
    }
  }

  @Override
  public Optional<SpriteAssets> resolveSpriteAssets(String spriteName) {
    return match(sprites, spriteName);
  }

  @Override
  public Optional<Asset.Sound> resolveSound(String soundName) {
    return match(sounds, soundName);
  }

  static <T> Optional<T> match(ImmutableMap<String, T> entries, String name) {
    if (entries.containsKey(name)) return Optional.of(entries.get(name));
    String lower = name.toLowerCase();
    for (String key : entries.keySet()) {
      if (key.toLowerCase().equals(lower)) return Optional.of(entries.get(key));
    }
    if (!lower.isEmpty()) {
      for (String key : entries.keySet()) {
        if (key.toLowerCase().contains(lower)) return Optional.of(entries.get(key));
      }
    }
    String stripped = name.replaceAll("\\d+$", "");
    if (!stripped.isEmpty() && !stripped.equals(name)) return match(entries, stripped);
    return Optional.empty();
  }

  private static JsonArray array(JsonObject object, String key) {
    return object.has(key) ? object.getAsJsonArray(key) : new JsonArray();
  }

  private static <T> ImmutableList<T> entries(
      JsonObject object, String key, Function<JsonObject, T> parser) {
    ImmutableList.Builder<T> entries = ImmutableList.builder();
    for (JsonElement element : array(object, key)) {
      entries.add(parser.apply(element.getAsJsonObject()));
    }
    return entries.build();
  }

  private static Asset.Costume costume(JsonObject json) {
    return Asset.Costume.create(
        json.get("name").getAsString(),
        json.get("assetId").getAsString(),
        json.get("dataFormat").getAsString(),
        json.has("bitmapResolution") ? json.get("bitmapResolution").getAsInt() : 1,
        json.has("rotationCenterX") ? json.get("rotationCenterX").getAsDouble() : 0,
        json.has("rotationCenterY") ? json.get("rotationCenterY").getAsDouble() : 0);
  }

  private static Asset.Sound sound(JsonObject json) {
    return Asset.Sound.create(
        json.get("name").getAsString(),
        json.get("assetId").getAsString(),
        json.has("dataFormat") ? json.get("dataFormat").getAsString() : "wav",
        json.has("rate") ? json.get("rate").getAsInt() : 44100,
        json.has("sampleCount") ? json.get("sampleCount").getAsInt() : 0);
  }
}
