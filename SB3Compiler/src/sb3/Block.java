package sb3;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

public final class Block {

  public enum Kind {
    HAT,
    STACK,
    REPORTER,
    BOOLEAN_REPORTER,
    SHADOW_MENU;

    public boolean isReporter() {
      return this == REPORTER || this == BOOLEAN_REPORTER;
    }

    // Only these kinds take part in next-linked chains.
    public boolean isChained() {
      return this == HAT || this == STACK;
    }
  }

  // [value, id]; the id is present for variable, list and broadcast fields.
  @AutoValue
  public abstract static class Field {
    public abstract String value();

    public abstract Optional<String> id();

    public static Field of(String value) {
      return new AutoValue_Block_Field(value, Optional.empty());
    }

    public static Field of(String value, String id) {
      return new AutoValue_Block_Field(value, Optional.of(id));
    }

    public static Field of(String value, Optional<String> id) {
      return new AutoValue_Block_Field(value, id);
    }
  }

  // List-valued attributes are kept as the JSON-encoded strings the document stores.
  @AutoValue
  public abstract static class Mutation {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static final String PROCCODE = "proccode";
    public static final String ARGUMENT_IDS = "argumentids";
    public static final String ARGUMENT_NAMES = "argumentnames";
    public static final String ARGUMENT_DEFAULTS = "argumentdefaults";
    public static final String WARP = "warp";

    public abstract ImmutableMap<String, String> attributes();

    public static Mutation of(Map<String, String> attributes) {
      return new AutoValue_Block_Mutation(ImmutableMap.copyOf(attributes));
    }

    public static Mutation procedurePrototype(CustomProcedure procedure) {
      return of(
          ImmutableMap.of(
              PROCCODE, procedure.proccode(),
              ARGUMENT_IDS, GSON.toJson(procedure.argumentIds()),
              ARGUMENT_NAMES, GSON.toJson(procedure.argumentNames()),
              ARGUMENT_DEFAULTS, GSON.toJson(procedure.argumentDefaults()),
              WARP, Boolean.toString(procedure.warp())));
    }

    public static Mutation procedureCall(CustomProcedure procedure) {
      return of(
          ImmutableMap.of(
              PROCCODE, procedure.proccode(),
              ARGUMENT_IDS, GSON.toJson(procedure.argumentIds()),
              WARP, Boolean.toString(procedure.warp())));
    }

    public Optional<String> attribute(String name) {
      return Optional.ofNullable(attributes().get(name));
    }

    public Optional<String> proccode() {
      return attribute(PROCCODE);
    }

    public Optional<ImmutableList<String>> argumentIds() {
      return stringList(ARGUMENT_IDS);
    }

    public Optional<ImmutableList<String>> argumentNames() {
      return stringList(ARGUMENT_NAMES);
    }

    public Optional<ImmutableList<String>> argumentDefaults() {
      return stringList(ARGUMENT_DEFAULTS);
    }

    public boolean warp() {
      return attribute(WARP).map(Boolean::parseBoolean).orElse(false);
    }

    // Empty if the attribute is absent or not a JSON list.
    private Optional<ImmutableList<String>> stringList(String name) {
      Optional<String> raw = attribute(name);
      if (!raw.isPresent()) return Optional.empty();
      try {
        JsonElement element = JsonParser.parseString(raw.get());
        if (!element.isJsonArray()) return Optional.empty();
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        JsonArray array = element.getAsJsonArray();
        for (JsonElement item : array) {
          builder.add(item.isJsonNull() ? "" : item.getAsString());
        }
        return Optional.of(builder.build());
      } catch (JsonParseException | IllegalStateException | UnsupportedOperationException ex) {
        return Optional.empty();
      }
    }
  }

  private final String id;
  private final String opcode;
  private final Kind kind;
  private final Optional<String> parent;
  private final Optional<String> next;
  private final ImmutableMap<String, InputValue> inputs;
  private final ImmutableMap<String, Field> fields;
  private final boolean topLevel;
  private final int x;
  private final int y;
  private final Optional<Mutation> mutation;

  private Block(Builder builder) {
    this.id = builder.id;
    this.opcode = builder.opcode;
    this.kind = builder.kind;
    this.parent = Optional.ofNullable(builder.parent);
    this.next = Optional.ofNullable(builder.next);
    this.inputs = ImmutableMap.copyOf(builder.inputs);
    this.fields = ImmutableMap.copyOf(builder.fields);
    this.topLevel = builder.topLevel;
    this.x = builder.x;
    this.y = builder.y;
    this.mutation = Optional.ofNullable(builder.mutation);
  }

  public String id() {
    return id;
  }

  public String opcode() {
    return opcode;
  }

  public Kind kind() {
    return kind;
  }

  public boolean shadow() {
    return kind == Kind.SHADOW_MENU;
  }

  public Optional<String> parent() {
    return parent;
  }

  public Optional<String> next() {
    return next;
  }

  public ImmutableMap<String, InputValue> inputs() {
    return inputs;
  }

  public Optional<InputValue> input(String name) {
    return Optional.ofNullable(inputs.get(name));
  }

  public ImmutableMap<String, Field> fields() {
    return fields;
  }

  public Optional<Field> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public boolean topLevel() {
    return topLevel;
  }

  public int x() {
    return x;
  }

  public int y() {
    return y;
  }

  public Optional<Mutation> mutation() {
    return mutation;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Block)) return false;
    Block that = (Block) o;
    return id.equals(that.id)
        && opcode.equals(that.opcode)
        && kind == that.kind
        && parent.equals(that.parent)
        && next.equals(that.next)
        && inputs.equals(that.inputs)
        && fields.equals(that.fields)
        && topLevel == that.topLevel
        && x == that.x
        && y == that.y
        && mutation.equals(that.mutation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, opcode, kind, parent, next, inputs, fields, topLevel, mutation);
  }

  @Override
  public String toString() {
    return String.format("%s[%s]", opcode, id);
  }

  public static Builder builder(String id, String opcode, Kind kind) {
    return new Builder(id, opcode, kind);
  }

  public Builder toBuilder() {
    Builder builder = new Builder(id, opcode, kind);
    builder.parent = parent.orElse(null);
    builder.next = next.orElse(null);
    builder.inputs.putAll(inputs);
    builder.fields.putAll(fields);
    builder.topLevel = topLevel;
    builder.x = x;
    builder.y = y;
    builder.mutation = mutation.orElse(null);
    return builder;
  }

  public static final class Builder {
    private final String id;
    private final String opcode;
    private final Kind kind;
    private String parent;
    private String next;
    private final Map<String, InputValue> inputs = new LinkedHashMap<>();
    private final Map<String, Field> fields = new LinkedHashMap<>();
    private boolean topLevel;
    private int x;
    private int y;
    private Mutation mutation;

    private Builder(String id, String opcode, Kind kind) {
      this.id = Preconditions.checkNotNull(id);
      this.opcode = Preconditions.checkNotNull(opcode);
      this.kind = Preconditions.checkNotNull(kind);
    }

    public String id() {
      return id;
    }

    public Kind kind() {
      return kind;
    }

    public Builder setParent(String parent) {
      this.parent = parent;
      return this;
    }

    public Builder setNext(String next) {
      Preconditions.checkState(
          next == null || kind.isChained(), "%s block %s cannot have a successor", kind, id);
      this.next = next;
      return this;
    }

    public Optional<String> next() {
      return Optional.ofNullable(next);
    }

    public Builder putInput(String name, InputValue value) {
      inputs.put(name, value);
      return this;
    }

    public Builder putField(String name, Field field) {
      fields.put(name, field);
      return this;
    }

    public Builder setTopLevel(boolean topLevel) {
      this.topLevel = topLevel;
      return this;
    }

    public Builder setPosition(int x, int y) {
      this.x = x;
      this.y = y;
      return this;
    }

    public Builder setMutation(Mutation mutation) {
      this.mutation = mutation;
      return this;
    }

    public Block build() {
      if (kind == Kind.HAT) {
        Preconditions.checkState(topLevel && parent == null, "hat block %s must be top level", id);
      }
      return new Block(this);
    }
  }
}
