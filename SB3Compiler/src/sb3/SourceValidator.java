package sb3;

import com.google.common.collect.ImmutableList;

public final class SourceValidator extends DiagnosticCollectingValidator {

  @Override
  public void visitImpl(SourceModule module) {
    super.visitImpl(module);
    checkReachable(module.body());
  }

  @Override
  public void visitImpl(Statement.ClassDef classDef) {
    super.visitImpl(classDef);
    checkReachable(classDef.body());
  }

  @Override
  public void visitImpl(Statement.FunctionDef functionDef) {
    super.visitImpl(functionDef);
    checkReachable(functionDef.body());
  }

  @Override
  public void visitImpl(Statement.For forLoop) {
    super.visitImpl(forLoop);
    checkReachable(forLoop.body());
    if (!forLoop.rangeCount().isPresent()) {
      logWarning(
          forLoop.pos(), "only 'for ... in range(n)' loops are supported; repeating 10 times");
    }
  }

  @Override
  public void visitImpl(Statement.While whileLoop) {
    super.visitImpl(whileLoop);
    checkReachable(whileLoop.body());
  }

  @Override
  public void visitImpl(Statement.If ifStatement) {
    super.visitImpl(ifStatement);
    checkReachable(ifStatement.body());
    checkReachable(ifStatement.orElse());
  }

  @Override
  public void visitImpl(Statement.AugAssign augAssign) {
    super.visitImpl(augAssign);
    if (augAssign.op() != Expression.BinaryOperator.ADD
        && augAssign.op() != Expression.BinaryOperator.SUBTRACT) {
      logWarning(
          augAssign.pos(),
          String.format("'%s=' has no block equivalent; statement ignored", augAssign.op().repr()));
    }
  }

  @Override
  public void visitImpl(Statement.Unsupported unsupported) {
    if (unsupported.isImport()) return;
    logWarning(unsupported.pos(), "unsupported statement ignored: " + unsupported.kind());
  }

  @Override
  public void visitImpl(Expression.Unsupported unsupported) {
    logWarning(unsupported.pos(), "unsupported expression replaced by 0: " + unsupported.kind());
  }

  @Override
  public void visitImpl(Expression.Binary binary) {
    super.visitImpl(binary);
    if (binary.op() == Expression.BinaryOperator.POWER) {
      logWarning(binary.pos(), "'**' has no block equivalent; using 0");
    }
  }

  @Override
  public void visitImpl(Expression.Unary unary) {
    super.visitImpl(unary);
    if (unary.op() == Expression.UnaryOperator.INVERT) {
      logWarning(unary.pos(), "'~' has no block equivalent; using 0");
    }
  }

  @Override
  public void visitImpl(Expression.Compare compare) {
    super.visitImpl(compare);
    if (compare.isChained()) {
      logWarning(compare.pos(), "only the first comparison of a chain is compiled");
    }
    if (!compare.ops().get(0).hasBlockEquivalent()) {
      logWarning(
          compare.pos(),
          String.format(
              "'%s' has no block equivalent; condition ignored", compare.ops().get(0).repr()));
    }
  }

  // Nothing after `while True:` is reachable, and the forever block has no successor.
  private void checkReachable(ImmutableList<Statement> body) {
    for (int i = 0; i < body.size() - 1; i++) {
      if (body.get(i).isInfiniteLoop()) {
        logWarning(
            body.get(i + 1).pos(),
            "unreachable after 'while True:'; the remaining statements are not compiled");
        return;
      }
    }
  }
}
