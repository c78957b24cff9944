package sb3;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final SourceReader.Pos pos;
  private final String errorMsg;

  public CompilerException(SourceReader.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public SourceReader.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public String format() {
    return String.format("%s@%d:%d %s", pos.file(), pos.lineNumber(), pos.column() + 1, errorMsg);
  }

  public void print() {
    System.out.println("ERROR: " + format());
  }
}
