package sb3;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class DiagnosticCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompilerException> warnings = new ArrayList<>();

  protected ImmutableList<CompilerException> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  protected void logWarning(SourceReader.Pos pos, String msg) {
    warnings.add(new CompilerException(pos, msg));
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  public void validate(SourceModule module, Diagnostics diagnostics) {
    module.accept(this, null);
    diagnostics.addAll(warnings);
    warnings.clear();
  }
}
