package sb3;

import java.io.IOException;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import com.google.common.io.Resources;

public final class EmbeddedAssets {
  private static final String COSTUME_RESOURCE = "placeholder_costume.svg";
  private static final String BACKDROP_RESOURCE = "backdrop.svg";

  private static final EmbeddedAssets INSTANCE = new EmbeddedAssets();

  private final byte[] costume;
  private final byte[] backdrop;
  private final ImmutableMap<String, byte[]> byMd5ext;

  private EmbeddedAssets() {
    costume = load(COSTUME_RESOURCE);
    backdrop = load(BACKDROP_RESOURCE);
    byMd5ext =
        ImmutableMap.of(
            md5(costume) + ".svg", costume,
            md5(backdrop) + ".svg", backdrop);
  }

  public static EmbeddedAssets instance() {
    return INSTANCE;
  }

  public Asset.Costume placeholderCostume(String name) {
    return Asset.Costume.create(name, md5(costume), "svg", 1, 48, 50);
  }

  public Asset.Costume backdrop(String name) {
    return Asset.Costume.create(name, md5(backdrop), "svg", 1, 240, 180);
  }

  public Optional<byte[]> contents(String md5ext) {
    byte[] bytes = byMd5ext.get(md5ext);
    return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
  }

  @SuppressWarnings("deprecation") // Asset ids are MD5 by format.
  static String md5(byte[] bytes) {
    return Hashing.md5().hashBytes(bytes).toString();
  }

  private static byte[] load(String resource) {
    try {
      return Resources.toByteArray(Resources.getResource(EmbeddedAssets.class, resource));
    } catch (IOException | IllegalArgumentException ex) {
      throw new IllegalStateException("missing bundled asset " + resource, ex);
    }
  }
}
