package sb3;

import java.math.BigInteger;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonPrimitive;

public final class ExpressionCompiler {

  private final SpriteScope scope;
  private final BlockGraphBuilder blocks;
  private final Optional<CustomProcedure> procedure;
  private final Diagnostics diagnostics;
  private final CallCompiler calls;

  public ExpressionCompiler(
      SpriteScope scope, Optional<CustomProcedure> procedure, Diagnostics diagnostics) {
    this.scope = scope;
    this.blocks = scope.blocks();
    this.procedure = procedure;
    this.diagnostics = diagnostics;
    this.calls = new CallCompiler(this, scope, diagnostics);
  }

  public CallCompiler calls() {
    return calls;
  }

  public static Optional<JsonPrimitive> constantValue(Expression expr) {
    switch (expr.type()) {
      case INTEGER_CONSTANT:
        return Optional.of(new JsonPrimitive(expr.<Expression.IntegerConstant>cast().value()));
      case FLOAT_CONSTANT:
        return Optional.of(new JsonPrimitive(expr.<Expression.FloatConstant>cast().value()));
      case STRING_CONSTANT:
        return Optional.of(new JsonPrimitive(expr.<Expression.StringConstant>cast().value()));
      case BOOLEAN_CONSTANT:
        return Optional.of(new JsonPrimitive(expr.<Expression.BooleanConstant>cast().value()));
      case NONE_CONSTANT:
        return Optional.of(new JsonPrimitive(0));
      case UNARY:
        {
          Expression.Unary unary = expr.cast();
          if (unary.op() == Expression.UnaryOperator.NEGATE) {
            if (unary.operand().type() == Expression.Type.INTEGER_CONSTANT) {
              BigInteger value = unary.operand().<Expression.IntegerConstant>cast().value();
              return Optional.of(new JsonPrimitive(value.negate()));
            }
            return negatedConstant(unary.operand())
                .map(text -> new JsonPrimitive(Double.parseDouble(text)))
                .map(ExpressionCompiler::narrow);
          }
          return unary.op() == Expression.UnaryOperator.PLUS
              ? constantValue(unary.operand())
              : Optional.empty();
        }
      default:
        return Optional.empty();
    }
  }

  public static Optional<String> negatedConstant(Expression expr) {
    switch (expr.type()) {
      case INTEGER_CONSTANT:
        return Optional.of(expr.<Expression.IntegerConstant>cast().value().negate().toString());
      case FLOAT_CONSTANT:
        return Optional.of(Double.toString(-expr.<Expression.FloatConstant>cast().value()));
      default:
        return Optional.empty();
    }
  }

  public static String negate(String number) {
    if (number.startsWith("-")) return number.substring(1);
    return "-" + number;
  }

  public Operand value(Expression expr) {
    switch (expr.type()) {
      case INTEGER_CONSTANT:
        return Operand.number(expr.<Expression.IntegerConstant>cast().value().toString());
      case FLOAT_CONSTANT:
        return Operand.number(Double.toString(expr.<Expression.FloatConstant>cast().value()));
      case STRING_CONSTANT:
        return Operand.string(expr.<Expression.StringConstant>cast().value());
      case BOOLEAN_CONSTANT:
        // Spelled the way the source language prints them.
        return Operand.string(expr.<Expression.BooleanConstant>cast().value() ? "True" : "False");
      case NONE_CONSTANT:
        return Operand.zero();
      case NAME:
        return name(expr.cast());
      case UNARY:
        return unary(expr.cast());
      case BINARY:
        return binary(expr.cast()).map(Operand::block).orElse(Operand.zero());
      case COMPARE:
      case BOOLEAN_CHAIN:
        return condition(expr).map(Operand::block).orElse(Operand.zero());
      case CALL:
        return calls.reporter(expr.cast()).map(Operand::block).orElse(Operand.zero());
      case LIST_LITERAL:
        diagnostics.warn(expr.pos(), "a list literal can only initialize a list; using 0");
        return Operand.zero();
      case UNSUPPORTED:
        return Operand.zero();
      default:
        throw new AssertionError("Unknown expression type: " + expr.type());
    }
  }

  public InputValue input(Expression expr, String consumerId) {
    return blocks.input(value(expr), consumerId);
  }

  public Optional<String> condition(Expression expr) {
    switch (expr.type()) {
      case COMPARE:
        return compare(expr.cast());
      case BOOLEAN_CHAIN:
        return booleanChain(expr.cast());
      case UNARY:
        {
          Expression.Unary unary = expr.cast();
          if (unary.op() != Expression.UnaryOperator.NOT) break;
          Optional<String> operand = condition(unary.operand());
          Block.Builder not = blocks.reporter(Opcodes.NOT);
          operand.ifPresent(id -> not.putInput("OPERAND", blocks.attach(id, not.id())));
          return Optional.of(not.id());
        }
      case BOOLEAN_CONSTANT:
        // No literal boolean block exists: True is "1" = "1", False is "1" = "0".
        return Optional.of(
            tautology(expr.<Expression.BooleanConstant>cast().value() ? "1" : "0"));
      case CALL:
        {
          Optional<String> id = calls.reporter(expr.cast());
          if (!id.isPresent()) return Optional.empty();
          if (blocks.block(id.get()).kind() != Block.Kind.BOOLEAN_REPORTER) {
            diagnostics.warn(expr.pos(), "this call does not report a boolean");
          }
          return id;
        }
      case UNSUPPORTED:
        return Optional.empty();
      default:
        break;
    }
    diagnostics.warn(expr.pos(), "expected a condition; the condition is left empty");
    return Optional.empty();
  }

  private String tautology(String rhs) {
    Block.Builder equals = blocks.reporter(Opcodes.EQUALS);
    equals.putInput("OPERAND1", InputValue.string("1"));
    equals.putInput("OPERAND2", InputValue.string(rhs));
    return equals.id();
  }

  private Operand name(Expression.Name name) {
    if (procedure.isPresent() && procedure.get().argumentId(name.id()).isPresent()) {
      Block.Builder reporter =
          blocks
              .reporter(Opcodes.ARGUMENT_REPORTER_STRING_NUMBER)
              .putField("VALUE", Block.Field.of(name.id()));
      return Operand.block(reporter.id());
    }
    Target.Variable variable = scope.variable(name.id());
    return Operand.variable(variable.name(), variable.id());
  }

  private Operand unary(Expression.Unary unary) {
    switch (unary.op()) {
      case PLUS:
        return value(unary.operand());
      case NEGATE:
        {
          Optional<String> folded = negatedConstant(unary.operand());
          if (folded.isPresent()) return Operand.number(folded.get());
          return Operand.block(subtractFromZero(value(unary.operand())));
        }
      case NOT:
        return condition(unary).map(Operand::block).orElse(Operand.zero());
      case INVERT:
        return Operand.zero();
      default:
        throw new AssertionError("Unknown unary operator: " + unary.op());
    }
  }

  public String subtractFromZero(Operand operand) {
    Block.Builder subtract = blocks.reporter(Opcodes.SUBTRACT);
    subtract.putInput("NUM1", InputValue.number("0"));
    subtract.putInput("NUM2", blocks.input(operand, subtract.id()));
    return subtract.id();
  }

  private Optional<String> binary(Expression.Binary binary) {
    String opcode;
    switch (binary.op()) {
      case ADD:
        opcode = Opcodes.ADD;
        break;
      case SUBTRACT:
        opcode = Opcodes.SUBTRACT;
        break;
      case MULTIPLY:
        opcode = Opcodes.MULTIPLY;
        break;
      case DIVIDE:
      case FLOOR_DIVIDE:
        opcode = Opcodes.DIVIDE;
        break;
      case MODULO:
        opcode = Opcodes.MOD;
        break;
      case POWER:
        return Optional.empty();
      default:
        throw new AssertionError("Unknown binary operator: " + binary.op());
    }
    Operand lhs = value(binary.lhs());
    Operand rhs = value(binary.rhs());
    Block.Builder block = blocks.reporter(opcode);
    block.putInput("NUM1", blocks.input(lhs, block.id()));
    block.putInput("NUM2", blocks.input(rhs, block.id()));
    return Optional.of(block.id());
  }

  // a != b is NOT(a = b), a >= b is NOT(a < b) and a <= b is NOT(a > b).
  private Optional<String> compare(Expression.Compare compare) {
    Expression.CompareOperator op = compare.ops().get(0);
    if (!op.hasBlockEquivalent()) return Optional.empty();

    Operand lhs = value(compare.lhs());
    Operand rhs = value(compare.comparators().get(0));
    switch (op) {
      case GREATER_THAN:
        return Optional.of(comparison(Opcodes.GT, lhs, rhs));
      case LESS_THAN:
        return Optional.of(comparison(Opcodes.LT, lhs, rhs));
      case EQUAL:
        return Optional.of(comparison(Opcodes.EQUALS, lhs, rhs));
      case NOT_EQUAL:
        return Optional.of(not(comparison(Opcodes.EQUALS, lhs, rhs)));
      case GREATER_THAN_OR_EQUAL:
        return Optional.of(not(comparison(Opcodes.LT, lhs, rhs)));
      case LESS_THAN_OR_EQUAL:
        return Optional.of(not(comparison(Opcodes.GT, lhs, rhs)));
      default:
        throw new AssertionError("Unknown comparison: " + op);
    }
  }

  private String comparison(String opcode, Operand lhs, Operand rhs) {
    Block.Builder block = blocks.reporter(opcode);
    block.putInput("OPERAND1", blocks.input(lhs, block.id()));
    block.putInput("OPERAND2", blocks.input(rhs, block.id()));
    return block.id();
  }

  private String not(String operandId) {
    Block.Builder not = blocks.reporter(Opcodes.NOT);
    not.putInput("OPERAND", blocks.attach(operandId, not.id()));
    return not.id();
  }

  // Folds from the right: a and b and c is AND(a, AND(b, c)).
  private Optional<String> booleanChain(Expression.BooleanChain chain) {
    String opcode = chain.op() == Expression.BooleanOperator.AND ? Opcodes.AND : Opcodes.OR;
    ImmutableList<Expression> operands = chain.operands();
    if (operands.size() < 2) {
      return operands.isEmpty() ? Optional.empty() : condition(operands.get(0));
    }

    Optional<String> right = condition(operands.get(operands.size() - 1));
    for (int i = operands.size() - 2; i >= 0; i--) {
      Optional<String> left = condition(operands.get(i));
      Block.Builder block = blocks.reporter(opcode);
      left.ifPresent(id -> block.putInput("OPERAND1", blocks.attach(id, block.id())));
      right.ifPresent(id -> block.putInput("OPERAND2", blocks.attach(id, block.id())));
      right = Optional.of(block.id());
    }
    return right;
  }

  // 3.0 reads back as 3.
  private static JsonPrimitive narrow(JsonPrimitive number) {
    double value = number.getAsDouble();
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return new JsonPrimitive((long) value);
    }
    return number;
  }
}
