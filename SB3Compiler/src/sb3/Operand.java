package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Operand {

  public enum Type {
    NUMBER,
    STRING,
    VARIABLE,
    BLOCK;
  }

  private static final Operand ZERO = number("0");

  public abstract Type type();

  public abstract String text();

  public abstract Optional<String> variableId();

  public boolean isLiteral() {
    return type() == Type.NUMBER || type() == Type.STRING;
  }

  public static Operand zero() {
    return ZERO;
  }

  public static Operand number(String text) {
    return new AutoValue_Operand(Type.NUMBER, text, Optional.empty());
  }

  public static Operand number(long value) {
    return number(Long.toString(value));
  }

  public static Operand string(String text) {
    return new AutoValue_Operand(Type.STRING, text, Optional.empty());
  }

  public static Operand variable(String name, String id) {
    return new AutoValue_Operand(Type.VARIABLE, name, Optional.of(id));
  }

  public static Operand block(String id) {
    return new AutoValue_Operand(Type.BLOCK, id, Optional.empty());
  }
}
