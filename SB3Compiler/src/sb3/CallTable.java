package sb3;

import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

public final class CallTable {

  public enum Shape {
    VALUE_REPORTER,
    BOOLEAN_REPORTER,
    // A reporter with one fixed field, e.g. costume number vs. name.
    FIELD_REPORTER,
    NO_ARGUMENT_STATEMENT,
    SINGLE_ARGUMENT_STATEMENT,
    MULTI_ARGUMENT_STATEMENT,
    // First argument names a field value, second is a numeric input.
    FIELD_INPUT_STATEMENT,
    // Leading numeric inputs, then a dropdown target.
    MENU_STATEMENT,
    FIELD_STATEMENT,
    MENU_REPORTER,
    COLOR_REPORTER,
    MATH_OPERATION,
    RANDOM,
    BROADCAST,
    // Arguments map to inputs in order; the LIST marker takes the list name.
    LIST_OPERATION,
    VARIABLE_VISIBILITY,
    PROPERTY_OF,
    WAIT_UNTIL;
  }

  public static final String LIST = "LIST";

  public static final String VARIABLE = "VARIABLE";

  @AutoValue
  public abstract static class MenuSpec {
    public abstract String input();

    public abstract String opcode();

    public abstract String field();

    // The first name for each value is the canonical one.
    public abstract ImmutableMap<String, String> symbols();

    public static MenuSpec create(
        String input, String opcode, String field, ImmutableMap<String, String> symbols) {
      return new AutoValue_CallTable_MenuSpec(input, opcode, field, symbols);
    }

    public String encode(String name) {
      String symbol = symbols().get(name.toLowerCase());
      return symbol != null ? symbol : name;
    }

    public String decode(String value) {
      for (Map.Entry<String, String> entry : symbols().entrySet()) {
        if (entry.getValue().equals(value)) return entry.getKey();
      }
      return value;
    }
  }

  @AutoValue
  public abstract static class CallSpec {
    public abstract String name();

    public abstract Shape shape();

    public abstract String opcode();

    public abstract ImmutableList<String> inputs();

    public abstract Optional<String> field();

    public abstract Optional<String> fieldValue();

    public abstract Optional<MenuSpec> menu();

    public abstract boolean uppercaseField();

    public abstract boolean tracksSound();

    public boolean isReporter() {
      return Opcodes.kindOf(opcode()).isReporter();
    }

    public boolean isBoolean() {
      return Opcodes.kindOf(opcode()) == Block.Kind.BOOLEAN_REPORTER;
    }

    static Builder builder(String name, Shape shape, String opcode) {
      return new AutoValue_CallTable_CallSpec.Builder()
          .setName(name)
          .setShape(shape)
          .setOpcode(opcode)
          .setInputs(ImmutableList.of())
          .setUppercaseField(false)
          .setTracksSound(false);
    }

    @AutoValue.Builder
    abstract static class Builder {
      abstract Builder setName(String name);

      abstract Builder setShape(Shape shape);

      abstract Builder setOpcode(String opcode);

      abstract Builder setInputs(ImmutableList<String> inputs);

      abstract Builder setField(String field);

      abstract Builder setFieldValue(String fieldValue);

      abstract Builder setMenu(MenuSpec menu);

      abstract Builder setUppercaseField(boolean uppercaseField);

      abstract Builder setTracksSound(boolean tracksSound);

      abstract CallSpec build();
    }
  }

  static final ImmutableMap<String, String> MOTION_TARGETS =
      ImmutableMap.of(
          "random", "_random_",
          "mouse", "_mouse_",
          "random_position", "_random_",
          "mouse_pointer", "_mouse_");

  static final ImmutableMap<String, String> TOUCHING_TARGETS =
      ImmutableMap.of(
          "mouse", "_mouse_",
          "edge", "_edge_",
          "mouse_pointer", "_mouse_");

  static final ImmutableMap<String, String> DISTANCE_TARGETS =
      ImmutableMap.of("mouse", "_mouse_", "mouse_pointer", "_mouse_");

  static final ImmutableMap<String, String> CLONE_TARGETS = ImmutableMap.of("myself", "_myself_");

  static final ImmutableMap<String, String> OBJECT_TARGETS = ImmutableMap.of("stage", "_stage_");

  private static final ImmutableMap<String, CallSpec> BY_NAME;
  private static final ImmutableListMultimap<String, CallSpec> BY_OPCODE;

  static {
    ImmutableMap.Builder<String, CallSpec> table = ImmutableMap.builder();

    // Motion
    single(table, "move", "motion_movesteps", "STEPS");
    single(table, "turn_right", "motion_turnright", "DEGREES");
    single(table, "turn_left", "motion_turnleft", "DEGREES");
    single(table, "point_in_direction", "motion_pointindirection", "DIRECTION");
    single(table, "change_x", "motion_changexby", "DX");
    single(table, "set_x", "motion_setx", "X");
    single(table, "change_y", "motion_changeyby", "DY");
    single(table, "set_y", "motion_sety", "Y");
    multi(table, "go_to_xy", "motion_gotoxy", "X", "Y");
    multi(table, "glide_to_xy", "motion_glidesecstoxy", "SECS", "X", "Y");
    menu(table, "go_to", "motion_goto", menu("TO", "motion_goto_menu", MOTION_TARGETS));
    menu(
        table,
        "glide_to",
        "motion_glideto",
        menu("TO", "motion_glideto_menu", MOTION_TARGETS),
        "SECS");
    menu(
        table,
        "point_towards",
        "motion_pointtowards",
        menu("TOWARDS", "motion_pointtowards_menu", MOTION_TARGETS));
    noArgument(table, "if_on_edge_bounce", "motion_ifonedgebounce");
    field(table, "set_rotation_style", "motion_setrotationstyle", "STYLE");
    valueReporter(table, "x_position", "motion_xposition");
    valueReporter(table, "y_position", "motion_yposition");
    valueReporter(table, "direction", "motion_direction");

    // Looks
    single(table, "say", "looks_say", "MESSAGE");
    single(table, "think", "looks_think", "MESSAGE");
    multi(table, "say_for_secs", "looks_sayforsecs", "MESSAGE", "SECS");
    multi(table, "think_for_secs", "looks_thinkforsecs", "MESSAGE", "SECS");
    menu(
        table,
        "switch_costume",
        "looks_switchcostumeto",
        menu("COSTUME", "looks_costume", ImmutableMap.of()));
    menu(
        table,
        "switch_backdrop",
        "looks_switchbackdropto",
        menu("BACKDROP", "looks_backdrops", ImmutableMap.of()));
    noArgument(table, "next_costume", "looks_nextcostume");
    noArgument(table, "next_backdrop", "looks_nextbackdrop");
    single(table, "change_size", "looks_changesizeby", "CHANGE");
    single(table, "set_size", "looks_setsizeto", "SIZE");
    fieldInput(table, "change_effect", "looks_changeeffectby", "EFFECT", "CHANGE", true);
    fieldInput(table, "set_effect", "looks_seteffectto", "EFFECT", "VALUE", true);
    noArgument(table, "clear_effects", "looks_cleargraphiceffects");
    noArgument(table, "show", "looks_show");
    noArgument(table, "hide", "looks_hide");
    field(table, "go_to_layer", "looks_gotofrontback", "FRONT_BACK");
    fieldInput(
        table, "change_layer", "looks_goforwardbackwardlayers", "FORWARD_BACKWARD", "NUM", false);
    fieldReporter(table, "costume_number", "looks_costumenumbername", "NUMBER_NAME", "number");
    fieldReporter(table, "costume_name", "looks_costumenumbername", "NUMBER_NAME", "name");
    fieldReporter(table, "backdrop_number", "looks_backdropnumbername", "NUMBER_NAME", "number");
    fieldReporter(table, "backdrop_name", "looks_backdropnumbername", "NUMBER_NAME", "name");
    valueReporter(table, "size", "looks_size");

    // Sound
    MenuSpec sounds = menu("SOUND_MENU", "sound_sounds_menu", ImmutableMap.of());
    soundMenu(table, "play_sound", "sound_play", sounds);
    soundMenu(table, "start_sound", "sound_play", sounds);
    soundMenu(table, "play_sound_until_done", "sound_playuntildone", sounds);
    noArgument(table, "stop_all_sounds", "sound_stopallsounds");
    fieldInput(table, "change_sound_effect", "sound_changeeffectby", "EFFECT", "VALUE", true);
    fieldInput(table, "set_sound_effect", "sound_seteffectto", "EFFECT", "VALUE", true);
    noArgument(table, "clear_sound_effects", "sound_cleareffects");
    single(table, "change_volume", "sound_changevolumeby", "VOLUME");
    single(table, "set_volume", "sound_setvolumeto", "VOLUME");
    valueReporter(table, "volume", "sound_volume");
    single(table, "change_tempo", "music_changeTempo", "TEMPO");
    single(table, "set_tempo", "music_setTempo", "TEMPO");

    // Events
    special(table, "broadcast", Shape.BROADCAST, "event_broadcast");
    special(table, "broadcast_and_wait", Shape.BROADCAST, "event_broadcastandwait");

    // Control
    single(table, "wait", "control_wait", "DURATION");
    special(table, "wait_until", Shape.WAIT_UNTIL, "control_wait_until");
    field(table, "stop", "control_stop", "STOP_OPTION");
    MenuSpec clones = menu("CLONE_OPTION", "control_create_clone_of_menu", CLONE_TARGETS);
    menu(table, "create_clone", "control_create_clone_of", clones);
    menu(table, "create_clone_of", "control_create_clone_of", clones);
    noArgument(table, "delete_this_clone", "control_delete_this_clone");

    // Sensing
    single(table, "ask", "sensing_askandwait", "QUESTION");
    valueReporter(table, "answer", "sensing_answer");
    menuReporter(
        table,
        "key_pressed",
        "sensing_keypressed",
        menu("KEY_OPTION", "sensing_keyoptions", EventHat.KEYS));
    menuReporter(
        table,
        "touching",
        "sensing_touchingobject",
        menu("TOUCHINGOBJECTMENU", "sensing_touchingobjectmenu", TOUCHING_TARGETS));
    menuReporter(
        table,
        "distance_to",
        "sensing_distanceto",
        menu("DISTANCETOMENU", "sensing_distancetomenu", DISTANCE_TARGETS));
    colorReporter(table, "touching_color", "sensing_touchingcolor", "COLOR");
    colorReporter(table, "color_touching_color", "sensing_coloristouchingcolor", "COLOR", "COLOR2");
    booleanReporter(table, "mouse_down", "sensing_mousedown");
    valueReporter(table, "mouse_x", "sensing_mousex");
    valueReporter(table, "mouse_y", "sensing_mousey");
    valueReporter(table, "loudness", "sensing_loudness");
    valueReporter(table, "timer", "sensing_timer");
    noArgument(table, "reset_timer", "sensing_resettimer");
    valueReporter(table, "days_since_2000", "sensing_dayssince2000");
    valueReporter(table, "username", "sensing_username");
    fieldReporter(table, "current_year", "sensing_current", "CURRENTMENU", "YEAR");
    fieldReporter(table, "current_month", "sensing_current", "CURRENTMENU", "MONTH");
    fieldReporter(table, "current_date", "sensing_current", "CURRENTMENU", "DATE");
    fieldReporter(table, "current_day", "sensing_current", "CURRENTMENU", "DAYOFWEEK");
    fieldReporter(table, "current_hour", "sensing_current", "CURRENTMENU", "HOUR");
    fieldReporter(table, "current_minute", "sensing_current", "CURRENTMENU", "MINUTE");
    fieldReporter(table, "current_second", "sensing_current", "CURRENTMENU", "SECOND");
    field(table, "set_drag_mode", "sensing_setdragmode", "DRAG_MODE");
    put(
        table,
        CallSpec.builder("property_of", Shape.PROPERTY_OF, "sensing_of")
            .setField("PROPERTY")
            .setMenu(menu("OBJECT", "sensing_of_object_menu", OBJECT_TARGETS))
            .build());

    // Operators
    special(table, "pick_random", Shape.RANDOM, "operator_random");
    special(table, "random", Shape.RANDOM, "operator_random");
    valueReporter(table, "join", "operator_join", "STRING1", "STRING2");
    valueReporter(table, "letter_of", "operator_letter_of", "LETTER", "STRING");
    valueReporter(table, "length", "operator_length", "STRING");
    booleanReporter(table, "contains", "operator_contains", "STRING1", "STRING2");
    valueReporter(table, "round", "operator_round", "NUM");
    for (String function :
        ImmutableList.of(
            "abs", "floor", "ceiling", "sqrt", "sin", "cos", "tan", "asin", "acos", "atan", "ln",
            "log")) {
      mathOperation(table, function, function);
    }
    mathOperation(table, "e_pow", "e ^");
    mathOperation(table, "ten_pow", "10 ^");

    // Data
    list(table, "add_to_list", "data_addtolist", "ITEM", LIST);
    list(table, "delete_of_list", "data_deleteoflist", "INDEX", LIST);
    list(table, "delete_all_of_list", "data_deletealloflist", LIST);
    list(table, "insert_at_list", "data_insertatlist", "INDEX", "ITEM", LIST);
    list(table, "replace_item_of_list", "data_replaceitemoflist", "INDEX", "ITEM", LIST);
    list(table, "item_of_list", "data_itemoflist", "INDEX", LIST);
    list(table, "item_num_of_list", "data_itemnumoflist", "ITEM", LIST);
    list(table, "length_of_list", "data_lengthoflist", LIST);
    list(table, "list_contains", "data_listcontainsitem", LIST, "ITEM");
    list(table, "show_list", "data_showlist", LIST);
    list(table, "hide_list", "data_hidelist", LIST);
    special(table, "show_variable", Shape.VARIABLE_VISIBILITY, "data_showvariable");
    special(table, "hide_variable", Shape.VARIABLE_VISIBILITY, "data_hidevariable");

    BY_NAME = table.buildOrThrow();

    ImmutableListMultimap.Builder<String, CallSpec> byOpcode = ImmutableListMultimap.builder();
    BY_NAME.values().forEach(spec -> byOpcode.put(spec.opcode(), spec));
    BY_OPCODE = byOpcode.build();
  }

  public static Optional<CallSpec> lookup(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  public static boolean contains(String name) {
    return BY_NAME.containsKey(name);
  }

  public static ImmutableList<CallSpec> forOpcode(String opcode) {
    return BY_OPCODE.get(opcode);
  }

  public static ImmutableMap<String, CallSpec> all() {
    return BY_NAME;
  }

  private static MenuSpec menu(String input, String opcode, ImmutableMap<String, String> symbols) {
    return MenuSpec.create(input, opcode, input, symbols);
  }

  private static void put(ImmutableMap.Builder<String, CallSpec> table, CallSpec spec) {
    table.put(spec.name(), spec);
  }

  private static void valueReporter(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String... inputs) {
    put(
        table,
        CallSpec.builder(name, Shape.VALUE_REPORTER, opcode)
            .setInputs(ImmutableList.copyOf(inputs))
            .build());
  }

  private static void booleanReporter(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String... inputs) {
    put(
        table,
        CallSpec.builder(name, Shape.BOOLEAN_REPORTER, opcode)
            .setInputs(ImmutableList.copyOf(inputs))
            .build());
  }

  private static void fieldReporter(
      ImmutableMap.Builder<String, CallSpec> table,
      String name,
      String opcode,
      String field,
      String value) {
    put(
        table,
        CallSpec.builder(name, Shape.FIELD_REPORTER, opcode)
            .setField(field)
            .setFieldValue(value)
            .build());
  }

  private static void noArgument(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode) {
    put(table, CallSpec.builder(name, Shape.NO_ARGUMENT_STATEMENT, opcode).build());
  }

  private static void single(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String input) {
    put(
        table,
        CallSpec.builder(name, Shape.SINGLE_ARGUMENT_STATEMENT, opcode)
            .setInputs(ImmutableList.of(input))
            .build());
  }

  private static void multi(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String... inputs) {
    put(
        table,
        CallSpec.builder(name, Shape.MULTI_ARGUMENT_STATEMENT, opcode)
            .setInputs(ImmutableList.copyOf(inputs))
            .build());
  }

  private static void fieldInput(
      ImmutableMap.Builder<String, CallSpec> table,
      String name,
      String opcode,
      String field,
      String input,
      boolean uppercase) {
    put(
        table,
        CallSpec.builder(name, Shape.FIELD_INPUT_STATEMENT, opcode)
            .setField(field)
            .setInputs(ImmutableList.of(input))
            .setUppercaseField(uppercase)
            .build());
  }

  private static void menu(
      ImmutableMap.Builder<String, CallSpec> table,
      String name,
      String opcode,
      MenuSpec menu,
      String... leadingInputs) {
    put(
        table,
        CallSpec.builder(name, Shape.MENU_STATEMENT, opcode)
            .setInputs(ImmutableList.copyOf(leadingInputs))
            .setMenu(menu)
            .build());
  }

  private static void soundMenu(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, MenuSpec menu) {
    put(
        table,
        CallSpec.builder(name, Shape.MENU_STATEMENT, opcode)
            .setMenu(menu)
            .setTracksSound(true)
            .build());
  }

  private static void field(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String field) {
    put(table, CallSpec.builder(name, Shape.FIELD_STATEMENT, opcode).setField(field).build());
  }

  private static void menuReporter(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, MenuSpec menu) {
    put(table, CallSpec.builder(name, Shape.MENU_REPORTER, opcode).setMenu(menu).build());
  }

  private static void colorReporter(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String... inputs) {
    put(
        table,
        CallSpec.builder(name, Shape.COLOR_REPORTER, opcode)
            .setInputs(ImmutableList.copyOf(inputs))
            .build());
  }

  private static void mathOperation(
      ImmutableMap.Builder<String, CallSpec> table, String name, String operator) {
    put(
        table,
        CallSpec.builder(name, Shape.MATH_OPERATION, "operator_mathop")
            .setField("OPERATOR")
            .setFieldValue(operator)
            .setInputs(ImmutableList.of("NUM"))
            .build());
  }

  private static void special(
      ImmutableMap.Builder<String, CallSpec> table, String name, Shape shape, String opcode) {
    put(table, CallSpec.builder(name, shape, opcode).build());
  }

  private static void list(
      ImmutableMap.Builder<String, CallSpec> table, String name, String opcode, String... inputs) {
    put(
        table,
        CallSpec.builder(name, Shape.LIST_OPERATION, opcode)
            .setInputs(ImmutableList.copyOf(inputs))
            .build());
  }

  private CallTable() {}
}
