package sb3;

import com.google.auto.value.AutoValue;

public abstract class Asset {
  Asset() {}

  public abstract String name();

  public abstract String assetId();

  public abstract String dataFormat();

  public String md5ext() {
    return assetId() + "." + dataFormat();
  }

  @AutoValue
  public abstract static class Costume extends Asset {
    public abstract int bitmapResolution();

    public abstract double rotationCenterX();

    public abstract double rotationCenterY();

    public static Costume create(
        String name,
        String assetId,
        String dataFormat,
        int bitmapResolution,
        double rotationCenterX,
        double rotationCenterY) {
      return new AutoValue_Asset_Costume(
          name, assetId, dataFormat, bitmapResolution, rotationCenterX, rotationCenterY);
    }
  }

  @AutoValue
  public abstract static class Sound extends Asset {
    public abstract int rate();

    public abstract int sampleCount();

    public static Sound create(
        String name, String assetId, String dataFormat, int rate, int sampleCount) {
      return new AutoValue_Asset_Sound(name, assetId, dataFormat, rate, sampleCount);
    }
  }
}
