package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableBiMap;

@AutoValue
public abstract class EventHat {

  public enum Type {
    FLAG_CLICKED("when_flag_clicked", Opcodes.WHEN_FLAG_CLICKED),
    KEY_PRESSED("when_key_", Opcodes.WHEN_KEY_PRESSED),
    SPRITE_CLICKED("when_clicked", Opcodes.WHEN_THIS_SPRITE_CLICKED),
    BACKDROP_SWITCHES_TO("when_backdrop_", Opcodes.WHEN_BACKDROP_SWITCHES_TO),
    BROADCAST_RECEIVED("when_broadcast_", Opcodes.WHEN_BROADCAST_RECEIVED),
    START_AS_CLONE("when_i_start_as_clone", Opcodes.START_AS_CLONE),
    LOUDNESS_GREATER_THAN("when_loudness_gt_", Opcodes.WHEN_GREATER_THAN),
    TIMER_GREATER_THAN("when_timer_gt_", Opcodes.WHEN_GREATER_THAN);

    private final String methodPrefix;
    private final String opcode;

    Type(String methodPrefix, String opcode) {
      this.methodPrefix = methodPrefix;
      this.opcode = opcode;
    }

    public String opcode() {
      return opcode;
    }

    public boolean hasArgument() {
      return methodPrefix.endsWith("_");
    }
  }

  public static final String KEY_OPTION = "KEY_OPTION";
  public static final String BACKDROP = "BACKDROP";
  public static final String BROADCAST_OPTION = "BROADCAST_OPTION";
  public static final String WHEN_GREATER_THAN_MENU = "WHENGREATERTHANMENU";
  public static final String VALUE = "VALUE";

  private static final String DEFAULT_THRESHOLD = "10";

  // Method-name key to key option.
  static final ImmutableBiMap<String, String> KEYS =
      ImmutableBiMap.of(
          "up", "up arrow",
          "down", "down arrow",
          "left", "left arrow",
          "right", "right arrow");

  public abstract Type type();

  public abstract String argument();

  public static EventHat of(Type type, String argument) {
    return new AutoValue_EventHat(type, argument);
  }

  public static boolean isEventName(String methodName) {
    return methodName.startsWith("when_");
  }

  public static Optional<EventHat> parse(String methodName) {
    for (Type type : Type.values()) {
      if (!type.hasArgument()) {
        if (methodName.equals(type.methodPrefix)) return Optional.of(of(type, ""));
        continue;
      }
      if (!methodName.startsWith(type.methodPrefix)) continue;
      String suffix = methodName.substring(type.methodPrefix.length());
      if (suffix.isEmpty()) return Optional.empty();
      switch (type) {
        case KEY_PRESSED:
          return Optional.of(of(type, KEYS.getOrDefault(suffix, suffix.replace('_', ' '))));
        case LOUDNESS_GREATER_THAN:
        case TIMER_GREATER_THAN:
          return Optional.of(of(type, parseThreshold(suffix)));
        default:
          return Optional.of(of(type, suffix));
      }
    }
    return Optional.empty();
  }

  public static Optional<EventHat> fromBlock(Block hat) {
    switch (hat.opcode()) {
      case Opcodes.WHEN_FLAG_CLICKED:
        return Optional.of(of(Type.FLAG_CLICKED, ""));
      case Opcodes.WHEN_THIS_SPRITE_CLICKED:
      case Opcodes.WHEN_STAGE_CLICKED:
        return Optional.of(of(Type.SPRITE_CLICKED, ""));
      case Opcodes.START_AS_CLONE:
        return Optional.of(of(Type.START_AS_CLONE, ""));
      case Opcodes.WHEN_KEY_PRESSED:
        return hat.field(KEY_OPTION).map(f -> of(Type.KEY_PRESSED, f.value()));
      case Opcodes.WHEN_BACKDROP_SWITCHES_TO:
        return hat.field(BACKDROP).map(f -> of(Type.BACKDROP_SWITCHES_TO, f.value()));
      case Opcodes.WHEN_BROADCAST_RECEIVED:
        return hat.field(BROADCAST_OPTION).map(f -> of(Type.BROADCAST_RECEIVED, f.value()));
      case Opcodes.WHEN_GREATER_THAN:
        {
          Type type =
              hat.field(WHEN_GREATER_THAN_MENU).map(f -> f.value()).orElse("").equals("TIMER")
                  ? Type.TIMER_GREATER_THAN
                  : Type.LOUDNESS_GREATER_THAN;
          String threshold =
              hat.input(VALUE)
                  .filter(v -> v.type() == InputValue.Type.NUMBER_LITERAL)
                  .map(v -> v.<InputValue.Literal>cast().value())
                  .orElse(DEFAULT_THRESHOLD);
          return Optional.of(of(type, threshold));
        }
      default:
        return Optional.empty();
    }
  }

  public String sensor() {
    return type() == Type.TIMER_GREATER_THAN ? "TIMER" : "LOUDNESS";
  }

  public String methodName() {
    if (!type().hasArgument()) return type().methodPrefix;
    String suffix;
    switch (type()) {
      case KEY_PRESSED:
        suffix = KEYS.inverse().getOrDefault(argument(), argument());
        break;
      case LOUDNESS_GREATER_THAN:
      case TIMER_GREATER_THAN:
        suffix = argument().replace('.', '_');
        break;
      default:
        suffix = argument();
        break;
    }
    return type().methodPrefix + Decompiler.sanitize(suffix);
  }

  // `_` stands for a decimal point: when_timer_gt_2_5 waits for 2.5 seconds.
  private static String parseThreshold(String suffix) {
    String text = suffix.replace('_', '.');
    try {
      Double.parseDouble(text);
      return text;
    } catch (NumberFormatException ex) {
      return DEFAULT_THRESHOLD;
    }
  }
}
