package sb3;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The value held by one input slot of a block.
 *
 * <p>Serialized as {@code [shadowKind, ...]}: {@code 1} for a shadow-only value, {@code 2} for a
 * block without a shadow, {@code 3} for a block covering a shadow.
 */
public abstract class InputValue {

  public enum Type {
    NUMBER_LITERAL,
    COLOR_LITERAL,
    STRING_LITERAL,
    BROADCAST_LITERAL,
    VARIABLE_LITERAL,
    LIST_LITERAL,
    BLOCK_REF,
    SHADOW_BLOCK_REF,
    SHADOW_REF;

    public boolean isLiteral() {
      return ordinal() <= LIST_LITERAL.ordinal();
    }
  }

  // Primitive codes of the document format.
  public static final int MATH_NUMBER = 4;
  public static final int POSITIVE_NUMBER = 5;
  public static final int WHOLE_NUMBER = 6;
  public static final int INTEGER = 7;
  public static final int ANGLE = 8;
  public static final int COLOR = 9;
  public static final int TEXT = 10;
  public static final int BROADCAST = 11;
  public static final int VARIABLE = 12;
  public static final int LIST = 13;

  InputValue() {}

  public abstract Type type();

  public ImmutableList<String> referencedBlocks() {
    return ImmutableList.of();
  }

  @SuppressWarnings("unchecked")
  public <T extends InputValue> T cast() {
    return (T) this;
  }

  public static Literal number(String value) {
    return Literal.of(MATH_NUMBER, value);
  }

  public static Literal string(String value) {
    return Literal.of(TEXT, value);
  }

  public static Literal color(String value) {
    return Literal.of(COLOR, value);
  }

  public static BroadcastLiteral broadcast(String name, String id) {
    return new AutoValue_InputValue_BroadcastLiteral(name, id);
  }

  public static VariableLiteral variable(String name, String id) {
    return new AutoValue_InputValue_VariableLiteral(Type.VARIABLE_LITERAL, name, id);
  }

  public static VariableLiteral list(String name, String id) {
    return new AutoValue_InputValue_VariableLiteral(Type.LIST_LITERAL, name, id);
  }

  public static BlockRef block(String id) {
    return new AutoValue_InputValue_BlockRef(id);
  }

  public static ShadowBlockRef shadowedBlock(String id, InputValue shadow) {
    Preconditions.checkArgument(
        shadow.type().isLiteral() || shadow.type() == Type.SHADOW_REF,
        "a block can only cover a literal or a shadow block, not %s",
        shadow.type());
    return new AutoValue_InputValue_ShadowBlockRef(id, shadow);
  }

  public static ShadowRef menu(String id) {
    return new AutoValue_InputValue_ShadowRef(id);
  }

  @AutoValue
  public abstract static class Literal extends InputValue {
    public abstract int code();

    public abstract String value();

    @Override
    public Type type() {
      if (code() == COLOR) return Type.COLOR_LITERAL;
      if (code() == TEXT) return Type.STRING_LITERAL;
      return Type.NUMBER_LITERAL;
    }

    public static Literal of(int code, String value) {
      Preconditions.checkArgument(code >= MATH_NUMBER && code <= TEXT, "bad literal code %s", code);
      return new AutoValue_InputValue_Literal(code, value);
    }
  }

  @AutoValue
  public abstract static class BroadcastLiteral extends InputValue {
    public abstract String name();

    public abstract String id();

    @Override
    public Type type() {
      return Type.BROADCAST_LITERAL;
    }
  }

  @AutoValue
  public abstract static class VariableLiteral extends InputValue {
    @Override
    public abstract Type type();

    public abstract String name();

    public abstract String id();

    public int code() {
      return type() == Type.LIST_LITERAL ? LIST : VARIABLE;
    }
  }

  @AutoValue
  public abstract static class BlockRef extends InputValue {
    public abstract String id();

    @Override
    public Type type() {
      return Type.BLOCK_REF;
    }

    @Override
    public ImmutableList<String> referencedBlocks() {
      return ImmutableList.of(id());
    }
  }

  @AutoValue
  public abstract static class ShadowBlockRef extends InputValue {
    public abstract String id();

    public abstract InputValue shadow();

    @Override
    public Type type() {
      return Type.SHADOW_BLOCK_REF;
    }

    @Override
    public ImmutableList<String> referencedBlocks() {
      return ImmutableList.<String>builder().add(id()).addAll(shadow().referencedBlocks()).build();
    }
  }

  @AutoValue
  public abstract static class ShadowRef extends InputValue {
    public abstract String id();

    @Override
    public Type type() {
      return Type.SHADOW_REF;
    }

    @Override
    public ImmutableList<String> referencedBlocks() {
      return ImmutableList.of(id());
    }
  }
}
