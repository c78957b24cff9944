package sb3;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

// The forward compiler never fails on a well-formed tree; what it cannot express is reported here.
public final class Diagnostics {
  private static final Logger logger = Logger.getLogger(Diagnostics.class.getName());

  private final List<CompilerException> warnings = new ArrayList<>();

  public void warn(SourceReader.Pos pos, String msg) {
    warn(new CompilerException(pos, msg));
  }

  public void warn(CompilerException warning) {
    logger.warning(warning.format());
    warnings.add(warning);
  }

  public void addAll(Iterable<CompilerException> others) {
    others.forEach(this::warn);
  }

  public ImmutableList<CompilerException> warnings() {
    return warnings.stream()
        .sorted(Comparator.comparing(CompilerException::pos))
        .collect(ImmutableList.toImmutableList());
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }
}
