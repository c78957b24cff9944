package sb3;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

import sb3.processor.ASTChild;
import sb3.processor.ASTNode;

public abstract class Statement implements ASTNodeInterface {

  public enum Type {
    CLASS_DEF,
    FUNCTION_DEF,
    ASSIGN,
    AUG_ASSIGN,
    FOR,
    WHILE,
    IF,
    EXPRESSION,
    PASS,
    UNSUPPORTED;
  }

  private final Type type;
  private final SourceReader.Pos pos;

  private Statement(Type type, SourceReader.Pos pos) {
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
  public <T extends Statement> T cast() {
    return (T) this;
  }

  // True for `while True:`, which never falls through to its successor.
  public boolean isInfiniteLoop() {
    if (type != Type.WHILE) return false;
    Expression test = this.<While>cast().test();
    return test.type() == Expression.Type.BOOLEAN_CONSTANT
        && test.<Expression.BooleanConstant>cast().value();
  }

  @ASTNode
  public static class ClassDef extends Statement implements Statement_ClassDef_ASTNode {
    private final String name;
    private final ImmutableList<Statement> body;

    public ClassDef(String name, ImmutableList<Statement> body, SourceReader.Pos pos) {
      super(Type.CLASS_DEF, pos);
      this.name = name;
      this.body = body;
    }

    public static ClassDef internal(String name, Statement... body) {
      return new ClassDef(name, ImmutableList.copyOf(body), SourceReader.Pos.internal());
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class FunctionDef extends Statement implements Statement_FunctionDef_ASTNode {
    private final String name;
    private final ImmutableList<String> params;
    private final ImmutableList<Statement> body;

    public FunctionDef(
        String name,
        ImmutableList<String> params,
        ImmutableList<Statement> body,
        SourceReader.Pos pos) {
      super(Type.FUNCTION_DEF, pos);
      this.name = name;
      this.params = params;
      this.body = body;
    }

    public static FunctionDef internal(
        String name, ImmutableList<String> params, Statement... body) {
      return new FunctionDef(name, params, ImmutableList.copyOf(body), SourceReader.Pos.internal());
    }

    public String name() {
      return name;
    }

    public ImmutableList<String> params() {
      return params;
    }

    public ImmutableList<String> valueParams() {
      if (!params.isEmpty() && params.get(0).equals("self")) {
        return params.subList(1, params.size());
      }
      return params;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class Assign extends Statement implements Statement_Assign_ASTNode {
    private final ImmutableList<Expression> targets;
    private final Expression value;

    public Assign(ImmutableList<Expression> targets, Expression value, SourceReader.Pos pos) {
      super(Type.ASSIGN, pos);
      this.targets = targets;
      this.value = value;
    }

    public static Assign internal(String target, Expression value) {
      return new Assign(
          ImmutableList.of(Expression.Name.internal(target)), value, SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public ImmutableList<Expression> targets() {
      return targets;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    public Optional<String> targetName() {
      if (targets.isEmpty() || targets.get(0).type() != Expression.Type.NAME) {
        return Optional.empty();
      }
      return Optional.of(targets.get(0).<Expression.Name>cast().id());
    }
  }

  @ASTNode
  public static class AugAssign extends Statement implements Statement_AugAssign_ASTNode {
    private final Expression target;
    private final Expression.BinaryOperator op;
    private final Expression value;

    public AugAssign(
        Expression target, Expression.BinaryOperator op, Expression value, SourceReader.Pos pos) {
      super(Type.AUG_ASSIGN, pos);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    public static AugAssign internal(
        String target, Expression.BinaryOperator op, Expression value) {
      return new AugAssign(
          Expression.Name.internal(target), op, value, SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression target() {
      return target;
    }

    public Expression.BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }

  @ASTNode
  public static class For extends Statement implements Statement_For_ASTNode {
    private final Expression target;
    private final Expression iter;
    private final ImmutableList<Statement> body;

    public For(
        Expression target, Expression iter, ImmutableList<Statement> body, SourceReader.Pos pos) {
      super(Type.FOR, pos);
      this.target = target;
      this.iter = iter;
      this.body = body;
    }

    public static For internal(String target, Expression iter, Statement... body) {
      return new For(
          Expression.Name.internal(target),
          iter,
          ImmutableList.copyOf(body),
          SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression target() {
      return target;
    }

    @ASTChild
    @Override
    public Expression iter() {
      return iter;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    // The first argument of `range(...)`, if iterating over a range.
    public Optional<Expression> rangeCount() {
      if (iter.type() != Expression.Type.CALL) return Optional.empty();
      Expression.Call call = iter.cast();
      if (!call.name().equals("range") || call.receiver().isPresent() || call.args().isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(call.args().get(0));
    }
  }

  @ASTNode
  public static class While extends Statement implements Statement_While_ASTNode {
    private final Expression test;
    private final ImmutableList<Statement> body;

    public While(Expression test, ImmutableList<Statement> body, SourceReader.Pos pos) {
      super(Type.WHILE, pos);
      this.test = test;
      this.body = body;
    }

    public static While internal(Expression test, Statement... body) {
      return new While(test, ImmutableList.copyOf(body), SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression test() {
      return test;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  @ASTNode
  public static class If extends Statement implements Statement_If_ASTNode {
    private final Expression test;
    private final ImmutableList<Statement> body;
    private final ImmutableList<Statement> orElse;

    public If(
        Expression test,
        ImmutableList<Statement> body,
        ImmutableList<Statement> orElse,
        SourceReader.Pos pos) {
      super(Type.IF, pos);
      this.test = test;
      this.body = body;
      this.orElse = orElse;
    }

    public static If internal(
        Expression test, ImmutableList<Statement> body, ImmutableList<Statement> orElse) {
      return new If(test, body, orElse, SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression test() {
      return test;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> orElse() {
      return orElse;
    }
  }

  @ASTNode
  public static class ExpressionStatement extends Statement
      implements Statement_ExpressionStatement_ASTNode {
    private final Expression value;

    public ExpressionStatement(Expression value, SourceReader.Pos pos) {
      super(Type.EXPRESSION, pos);
      this.value = value;
    }

    public static ExpressionStatement internal(Expression value) {
      return new ExpressionStatement(value, SourceReader.Pos.internal());
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }
  }

  @ASTNode
  public static class Pass extends Statement implements Statement_Pass_ASTNode {
    public Pass(SourceReader.Pos pos) {
      super(Type.PASS, pos);
    }
  }

  @ASTNode
  public static class Unsupported extends Statement implements Statement_Unsupported_ASTNode {
    private final String kind;

    public Unsupported(String kind, SourceReader.Pos pos) {
      super(Type.UNSUPPORTED, pos);
      this.kind = kind;
    }

    public String kind() {
      return kind;
    }

    public boolean isImport() {
      return kind.equals("Import") || kind.equals("ImportFrom");
    }
  }
}
