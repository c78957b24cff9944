package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class CompilationResult {
  public abstract Target stage();

  public abstract ImmutableList<Target> sprites();

  public abstract ImmutableList<CompilerException> warnings();

  public static CompilationResult create(
      Target stage, ImmutableList<Target> sprites, ImmutableList<CompilerException> warnings) {
    return new AutoValue_CompilationResult(stage, sprites, warnings);
  }

  public Optional<Target> sprite(String name) {
    return sprites().stream().filter(t -> t.name().equals(name)).findFirst();
  }
}
