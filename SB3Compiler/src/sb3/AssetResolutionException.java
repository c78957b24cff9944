package sb3;

public class AssetResolutionException extends Exception {
  private static final long serialVersionUID = 1L;

  public AssetResolutionException(String message) {
    super(message);
  }

  public AssetResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
