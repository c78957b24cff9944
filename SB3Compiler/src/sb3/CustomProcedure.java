package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// Proccode and argument id order are fixed at registration; calls copy both verbatim.
@AutoValue
public abstract class CustomProcedure {
  public abstract String name();

  // "name %s %s": one placeholder per argument.
  public abstract String proccode();

  public abstract ImmutableList<String> argumentIds();

  public abstract ImmutableList<String> argumentNames();

  public abstract ImmutableList<String> argumentDefaults();

  public abstract String definitionId();

  public abstract String prototypeId();

  public abstract boolean warp();

  public int argumentCount() {
    return argumentIds().size();
  }

  public Optional<String> argumentId(String argumentName) {
    int index = argumentNames().indexOf(argumentName);
    return index < 0 ? Optional.empty() : Optional.of(argumentIds().get(index));
  }

  public static String proccodeOf(String name, int argumentCount) {
    StringBuilder sb = new StringBuilder(name);
    for (int i = 0; i < argumentCount; i++) {
      sb.append(" %s");
    }
    return sb.toString();
  }

  // The leading word of a proccode, which names the procedure.
  public static String nameOf(String proccode) {
    int space = proccode.indexOf(' ');
    return space < 0 ? proccode : proccode.substring(0, space);
  }

  public static Builder builder() {
    return new AutoValue_CustomProcedure.Builder().setWarp(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setProccode(String proccode);

    public abstract Builder setArgumentIds(ImmutableList<String> argumentIds);

    public abstract Builder setArgumentNames(ImmutableList<String> argumentNames);

    public abstract Builder setArgumentDefaults(ImmutableList<String> argumentDefaults);

    public abstract Builder setDefinitionId(String definitionId);

    public abstract Builder setPrototypeId(String prototypeId);

    public abstract Builder setWarp(boolean warp);

    abstract CustomProcedure autoBuild();

    public CustomProcedure build() {
      CustomProcedure procedure = autoBuild();
      Preconditions.checkState(
          procedure.argumentNames().size() == procedure.argumentCount()
              && procedure.argumentDefaults().size() == procedure.argumentCount(),
          "argument ids, names and defaults of %s differ in length",
          procedure.proccode());
      return procedure;
    }
  }
}
