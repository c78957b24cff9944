package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;

@AutoValue
public abstract class Project {

  @AutoValue
  public abstract static class Meta {
    public abstract String semver();

    public abstract String vm();

    public abstract String agent();

    public static Meta create(String semver, String vm, String agent) {
      return new AutoValue_Project_Meta(semver, vm, agent);
    }
  }

  public abstract Target stage();

  public abstract ImmutableList<Target> sprites();

  // Carried through from documents as-is; the compiler emits none.
  public abstract ImmutableList<JsonElement> monitors();

  public abstract ImmutableList<String> extensions();

  public abstract Meta meta();

  public static Project create(
      Target stage,
      ImmutableList<Target> sprites,
      ImmutableList<JsonElement> monitors,
      ImmutableList<String> extensions,
      Meta meta) {
    return new AutoValue_Project(stage, sprites, monitors, extensions, meta);
  }

  public ImmutableList<Target> targets() {
    return ImmutableList.<Target>builder().add(stage()).addAll(sprites()).build();
  }

  public Optional<Target> sprite(String name) {
    return sprites().stream().filter(t -> t.name().equals(name)).findFirst();
  }

  public ImmutableSet<String> assetFileNames() {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (Target target : targets()) {
      target.costumes().forEach(c -> names.add(c.md5ext()));
      target.sounds().forEach(s -> names.add(s.md5ext()));
    }
    return names.build();
  }
}
