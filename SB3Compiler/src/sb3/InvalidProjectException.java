package sb3;

public class InvalidProjectException extends Exception {
  private static final long serialVersionUID = 1L;

  public InvalidProjectException(String message) {
    super(message);
  }

  public InvalidProjectException(String message, Throwable cause) {
    super(message, cause);
  }

  public static InvalidProjectException inBlock(String target, String blockId, String message) {
    return new InvalidProjectException(
        String.format("invalid project: target '%s', block '%s': %s", target, blockId, message));
  }

  public static InvalidProjectException inTarget(String target, String message) {
    return new InvalidProjectException(
        String.format("invalid project: target '%s': %s", target, message));
  }

  public static InvalidProjectException inTarget(String target, String message, Throwable cause) {
    return new InvalidProjectException(
        String.format("invalid project: target '%s': %s", target, message), cause);
  }
}
