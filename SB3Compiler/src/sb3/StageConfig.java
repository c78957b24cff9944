package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class StageConfig {
  public abstract String stageName();

  public abstract String backdropName();

  public abstract double tempo();

  public abstract double volume();

  public abstract double videoTransparency();

  public abstract String videoState();

  public abstract Optional<String> textToSpeechLanguage();

  public abstract String defaultSpriteName();

  public abstract int spriteSpacing();

  public abstract String semver();

  public abstract String vm();

  public abstract String agent();

  public Project.Meta meta() {
    return Project.Meta.create(semver(), vm(), agent());
  }

  public abstract Builder toBuilder();

  public static StageConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_StageConfig.Builder()
        .setStageName("Stage")
        .setBackdropName("backdrop1")
        .setTempo(60)
        .setVolume(100)
        .setVideoTransparency(50)
        .setVideoState("on")
        .setDefaultSpriteName("Sprite1")
        .setSpriteSpacing(100)
        .setSemver("3.0.0")
        .setVm("0.2.0")
        .setAgent("sb3-compiler");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStageName(String stageName);

    public abstract Builder setBackdropName(String backdropName);

    public abstract Builder setTempo(double tempo);

    public abstract Builder setVolume(double volume);

    public abstract Builder setVideoTransparency(double videoTransparency);

    public abstract Builder setVideoState(String videoState);

    public abstract Builder setTextToSpeechLanguage(String textToSpeechLanguage);

    public abstract Builder setDefaultSpriteName(String defaultSpriteName);

    public abstract Builder setSpriteSpacing(int spriteSpacing);

    public abstract Builder setSemver(String semver);

    public abstract Builder setVm(String vm);

    public abstract Builder setAgent(String agent);

    public abstract StageConfig build();
  }
}
