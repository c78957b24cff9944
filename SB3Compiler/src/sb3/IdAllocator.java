package sb3;

// Ids are <namespace>-<kind><n> with one counter shared by all kinds.
public final class IdAllocator {
  private final String namespace;
  private int next = 1;

  public IdAllocator(String namespace) {
    this.namespace = namespace;
  }

  public String namespace() {
    return namespace;
  }

  public String block() {
    return allocate('b');
  }

  public String variable() {
    return allocate('v');
  }

  public String list() {
    return allocate('l');
  }

  public String argument() {
    return allocate('a');
  }

  public String broadcast() {
    return allocate('m');
  }

  public int allocated() {
    return next - 1;
  }

  private String allocate(char kind) {
    return String.format("%s-%c%d", namespace, kind, next++);
  }
}
