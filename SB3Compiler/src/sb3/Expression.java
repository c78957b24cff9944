package sb3;

import java.math.BigInteger;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import sb3.processor.ASTChild;
import sb3.processor.ASTNode;

public abstract class Expression implements ASTNodeInterface {

  public enum Type {
    CALL,
    BINARY,
    BOOLEAN_CHAIN,
    COMPARE,
    UNARY,
    INTEGER_CONSTANT,
    FLOAT_CONSTANT,
    STRING_CONSTANT,
    BOOLEAN_CONSTANT,
    NONE_CONSTANT,
    NAME,
    LIST_LITERAL,
    UNSUPPORTED
  }

  public enum BinaryOperator {
    ADD("+", "Add"),
    SUBTRACT("-", "Sub"),
    MULTIPLY("*", "Mult"),
    DIVIDE("/", "Div"),
    // No floor division block exists; it compiles as plain division.
    FLOOR_DIVIDE("//", "FloorDiv"),
    MODULO("%", "Mod"),
    POWER("**", "Pow");

    private final String repr;
    private final String nodeType;

    BinaryOperator(String repr, String nodeType) {
      this.repr = repr;
      this.nodeType = nodeType;
    }

    public String repr() {
      return repr;
    }

    public static Optional<BinaryOperator> fromNodeType(String nodeType) {
      for (BinaryOperator op : values()) {
        if (op.nodeType.equals(nodeType)) return Optional.of(op);
      }
      return Optional.empty();
    }
  }

  public enum BooleanOperator {
    AND("and", "And"),
    OR("or", "Or");

    private final String repr;
    private final String nodeType;

    BooleanOperator(String repr, String nodeType) {
      this.repr = repr;
      this.nodeType = nodeType;
    }

    public String repr() {
      return repr;
    }

    public static Optional<BooleanOperator> fromNodeType(String nodeType) {
      for (BooleanOperator op : values()) {
        if (op.nodeType.equals(nodeType)) return Optional.of(op);
      }
      return Optional.empty();
    }
  }

  public enum CompareOperator {
    EQUAL("==", "Eq"),
    NOT_EQUAL("!=", "NotEq"),
    LESS_THAN("<", "Lt"),
    LESS_THAN_OR_EQUAL("<=", "LtE"),
    GREATER_THAN(">", "Gt"),
    GREATER_THAN_OR_EQUAL(">=", "GtE"),
    IS("is", "Is"),
    IS_NOT("is not", "IsNot"),
    IN("in", "In"),
    NOT_IN("not in", "NotIn");

    private final String repr;
    private final String nodeType;

    CompareOperator(String repr, String nodeType) {
      this.repr = repr;
      this.nodeType = nodeType;
    }

    public String repr() {
      return repr;
    }

    public boolean hasBlockEquivalent() {
      return ordinal() <= GREATER_THAN_OR_EQUAL.ordinal();
    }

    public static Optional<CompareOperator> fromNodeType(String nodeType) {
      for (CompareOperator op : values()) {
        if (op.nodeType.equals(nodeType)) return Optional.of(op);
      }
      return Optional.empty();
    }
  }

  public enum UnaryOperator {
    NEGATE("-", "USub"),
    PLUS("+", "UAdd"),
    NOT("not", "Not"),
    INVERT("~", "Invert");

    private final String repr;
    private final String nodeType;

    UnaryOperator(String repr, String nodeType) {
      this.repr = repr;
      this.nodeType = nodeType;
    }

    public String repr() {
      return repr;
    }

    public static Optional<UnaryOperator> fromNodeType(String nodeType) {
      for (UnaryOperator op : values()) {
        if (op.nodeType.equals(nodeType)) return Optional.of(op);
      }
      return Optional.empty();
    }
  }

  private final Type type;
  private final SourceReader.Pos pos;

  private Expression(Type type, SourceReader.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  @Override
  public SourceReader.Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  @ASTNode
  public static class Call extends Expression implements Expression_Call_ASTNode {
    private final Optional<String> receiver;
    private final String name;
    private final ImmutableList<Expression> args;

    public Call(
        Optional<String> receiver,
        String name,
        ImmutableList<Expression> args,
        SourceReader.Pos pos) {
      super(Type.CALL, pos);
      this.receiver = receiver;
      this.name = name;
      this.args = args;
    }

    public static Call internal(String name, Expression... args) {
      return new Call(
          Optional.empty(), name, ImmutableList.copyOf(args), SourceReader.Pos.internal());
    }

    public Optional<String> receiver() {
      return receiver;
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> args() {
      return args;
    }
  }

  @ASTNode
  public static class Binary extends Expression implements Expression_Binary_ASTNode {
    private final Expression lhs;
    private final BinaryOperator op;
    private final Expression rhs;

    public Binary(Expression lhs, BinaryOperator op, Expression rhs, SourceReader.Pos pos) {
      super(Type.BINARY, pos);
      this.lhs = lhs;
      this.op = op;
      this.rhs = rhs;
    }

    public static Binary internal(Expression lhs, BinaryOperator op, Expression rhs) {
      return new Binary(lhs, op, rhs, SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression rhs() {
      return rhs;
    }
  }

  @ASTNode
  public static class BooleanChain extends Expression implements Expression_BooleanChain_ASTNode {
    private final BooleanOperator op;
    private final ImmutableList<Expression> operands;

    public BooleanChain(
        BooleanOperator op, ImmutableList<Expression> operands, SourceReader.Pos pos) {
      super(Type.BOOLEAN_CHAIN, pos);
      this.op = op;
      this.operands = operands;
    }

    public static BooleanChain internal(BooleanOperator op, Expression... operands) {
      return new BooleanChain(op, ImmutableList.copyOf(operands), SourceReader.Pos.internal());
    }

    public BooleanOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> operands() {
      return operands;
    }
  }

  // lhs op1 c1 op2 c2 ...; only the first comparison has a block equivalent.
  @ASTNode
  public static class Compare extends Expression implements Expression_Compare_ASTNode {
    private final Expression lhs;
    private final ImmutableList<CompareOperator> ops;
    private final ImmutableList<Expression> comparators;

    public Compare(
        Expression lhs,
        ImmutableList<CompareOperator> ops,
        ImmutableList<Expression> comparators,
        SourceReader.Pos pos) {
      super(Type.COMPARE, pos);
      this.lhs = lhs;
      this.ops = ops;
      this.comparators = comparators;
    }

    public static Compare internal(Expression lhs, CompareOperator op, Expression rhs) {
      return new Compare(
          lhs, ImmutableList.of(op), ImmutableList.of(rhs), SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression lhs() {
      return lhs;
    }

    public ImmutableList<CompareOperator> ops() {
      return ops;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> comparators() {
      return comparators;
    }

    public boolean isChained() {
      return ops.size() > 1;
    }
  }

  @ASTNode
  public static class Unary extends Expression implements Expression_Unary_ASTNode {
    private final UnaryOperator op;
    private final Expression operand;

    public Unary(UnaryOperator op, Expression operand, SourceReader.Pos pos) {
      super(Type.UNARY, pos);
      this.op = op;
      this.operand = operand;
    }

    public static Unary internal(UnaryOperator op, Expression operand) {
      return new Unary(op, operand, SourceReader.Pos.internal());
    }

    public UnaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression operand() {
      return operand;
    }
  }

  @ASTNode
  public static class IntegerConstant extends Expression
      implements Expression_IntegerConstant_ASTNode {
    private final BigInteger value;

    public IntegerConstant(BigInteger value, SourceReader.Pos pos) {
      super(Type.INTEGER_CONSTANT, pos);
      this.value = value;
    }

    public static IntegerConstant internal(long value) {
      return new IntegerConstant(BigInteger.valueOf(value), SourceReader.Pos.internal());
    }

    public BigInteger value() {
      return value;
    }
  }

  @ASTNode
  public static class FloatConstant extends Expression implements Expression_FloatConstant_ASTNode {
    private final double value;

    public FloatConstant(double value, SourceReader.Pos pos) {
      super(Type.FLOAT_CONSTANT, pos);
      this.value = value;
    }

    public static FloatConstant internal(double value) {
      return new FloatConstant(value, SourceReader.Pos.internal());
    }

    public double value() {
      return value;
    }
  }

  @ASTNode
  public static class StringConstant extends Expression
      implements Expression_StringConstant_ASTNode {
    private final String value;

    public StringConstant(String value, SourceReader.Pos pos) {
      super(Type.STRING_CONSTANT, pos);
      this.value = value;
    }

    public static StringConstant internal(String value) {
      return new StringConstant(value, SourceReader.Pos.internal());
    }

    public String value() {
      return value;
    }
  }

  @ASTNode
  public static class BooleanConstant extends Expression
      implements Expression_BooleanConstant_ASTNode {
    private final boolean value;

    public BooleanConstant(boolean value, SourceReader.Pos pos) {
      super(Type.BOOLEAN_CONSTANT, pos);
      this.value = value;
    }

    public static BooleanConstant internal(boolean value) {
      return new BooleanConstant(value, SourceReader.Pos.internal());
    }

    public boolean value() {
      return value;
    }
  }

  @ASTNode
  public static class NoneConstant extends Expression implements Expression_NoneConstant_ASTNode {
    public NoneConstant(SourceReader.Pos pos) {
      super(Type.NONE_CONSTANT, pos);
    }
  }

  @ASTNode
  public static class Name extends Expression implements Expression_Name_ASTNode {
    private final String id;

    public Name(String id, SourceReader.Pos pos) {
      super(Type.NAME, pos);
      this.id = id;
    }

    public static Name internal(String id) {
      return new Name(id, SourceReader.Pos.internal());
    }

    public String id() {
      return id;
    }
  }

  @ASTNode
  public static class ListLiteral extends Expression implements Expression_ListLiteral_ASTNode {
    private final ImmutableList<Expression> elements;

    public ListLiteral(ImmutableList<Expression> elements, SourceReader.Pos pos) {
      super(Type.LIST_LITERAL, pos);
      this.elements = elements;
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> elements() {
      return elements;
    }
  }

  @ASTNode
  public static class Unsupported extends Expression implements Expression_Unsupported_ASTNode {
    private final String kind;

    public Unsupported(String kind, SourceReader.Pos pos) {
      super(Type.UNSUPPORTED, pos);
      this.kind = kind;
    }

    public String kind() {
      return kind;
    }
  }
}
