package sb3;

import com.google.common.collect.ImmutableList;

import sb3.processor.ASTChild;
import sb3.processor.ASTNode;

@ASTNode
public class SourceModule implements SourceModule_ASTNode {
  private final ImmutableList<Statement> body;
  private final SourceReader.Pos pos;

  public SourceModule(ImmutableList<Statement> body, SourceReader.Pos pos) {
    this.body = body;
    this.pos = pos;
  }

  public static SourceModule internal(Statement... body) {
    return new SourceModule(ImmutableList.copyOf(body), SourceReader.Pos.internal());
  }

  @ASTChild
  @Override
  public ImmutableList<Statement> body() {
    return body;
  }

  @Override
  public SourceReader.Pos pos() {
    return pos;
  }
}
