package sb3;

import com.google.common.collect.ImmutableSet;

public final class Opcodes {

  // Hats.
  public static final String WHEN_FLAG_CLICKED = "event_whenflagclicked";
  public static final String WHEN_KEY_PRESSED = "event_whenkeypressed";
  public static final String WHEN_THIS_SPRITE_CLICKED = "event_whenthisspriteclicked";
  public static final String WHEN_BACKDROP_SWITCHES_TO = "event_whenbackdropswitchesto";
  public static final String WHEN_GREATER_THAN = "event_whengreaterthan";
  public static final String WHEN_BROADCAST_RECEIVED = "event_whenbroadcastreceived";
  public static final String WHEN_STAGE_CLICKED = "event_whenstageclicked";
  public static final String START_AS_CLONE = "control_start_as_clone";

  // Control.
  public static final String FOREVER = "control_forever";
  public static final String REPEAT = "control_repeat";
  public static final String REPEAT_UNTIL = "control_repeat_until";
  public static final String IF = "control_if";
  public static final String IF_ELSE = "control_if_else";

  // Data.
  public static final String VARIABLE = "data_variable";
  public static final String LIST_CONTENTS = "data_listcontents";
  public static final String SET_VARIABLE_TO = "data_setvariableto";
  public static final String CHANGE_VARIABLE_BY = "data_changevariableby";
  public static final String ADD_TO_LIST = "data_addtolist";
  public static final String DELETE_ALL_OF_LIST = "data_deletealloflist";

  // Operators.
  public static final String ADD = "operator_add";
  public static final String SUBTRACT = "operator_subtract";
  public static final String MULTIPLY = "operator_multiply";
  public static final String DIVIDE = "operator_divide";
  public static final String MOD = "operator_mod";
  public static final String GT = "operator_gt";
  public static final String LT = "operator_lt";
  public static final String EQUALS = "operator_equals";
  public static final String AND = "operator_and";
  public static final String OR = "operator_or";
  public static final String NOT = "operator_not";

  // Procedures.
  public static final String PROCEDURES_DEFINITION = "procedures_definition";
  public static final String PROCEDURES_PROTOTYPE = "procedures_prototype";
  public static final String PROCEDURES_CALL = "procedures_call";
  public static final String ARGUMENT_REPORTER_STRING_NUMBER = "argument_reporter_string_number";
  public static final String ARGUMENT_REPORTER_BOOLEAN = "argument_reporter_boolean";

  public static final ImmutableSet<String> HATS =
      ImmutableSet.of(
          WHEN_FLAG_CLICKED,
          WHEN_KEY_PRESSED,
          WHEN_THIS_SPRITE_CLICKED,
          WHEN_BACKDROP_SWITCHES_TO,
          WHEN_GREATER_THAN,
          WHEN_BROADCAST_RECEIVED,
          WHEN_STAGE_CLICKED,
          START_AS_CLONE,
          PROCEDURES_DEFINITION);

  public static final ImmutableSet<String> BOOLEAN_REPORTERS =
      ImmutableSet.of(
          GT,
          LT,
          EQUALS,
          AND,
          OR,
          NOT,
          "operator_contains",
          "sensing_touchingobject",
          "sensing_touchingcolor",
          "sensing_coloristouchingcolor",
          "sensing_keypressed",
          "sensing_mousedown",
          "data_listcontainsitem",
          ARGUMENT_REPORTER_BOOLEAN);

  public static final ImmutableSet<String> REPORTERS =
      ImmutableSet.of(
          VARIABLE,
          LIST_CONTENTS,
          "data_itemoflist",
          "data_itemnumoflist",
          "data_lengthoflist",
          ARGUMENT_REPORTER_STRING_NUMBER,
          "motion_xposition",
          "motion_yposition",
          "motion_direction",
          "looks_size",
          "looks_costumenumbername",
          "looks_backdropnumbername",
          "sound_volume",
          "sensing_mousex",
          "sensing_mousey",
          "sensing_loudness",
          "sensing_timer",
          "sensing_dayssince2000",
          "sensing_username",
          "sensing_answer",
          "sensing_current",
          "sensing_distanceto",
          "sensing_of",
          "music_getTempo");

  public static boolean isHat(String opcode) {
    return HATS.contains(opcode);
  }

  public static Block.Kind kindOf(String opcode) {
    if (HATS.contains(opcode)) return Block.Kind.HAT;
    if (BOOLEAN_REPORTERS.contains(opcode)) return Block.Kind.BOOLEAN_REPORTER;
    if (REPORTERS.contains(opcode) || opcode.startsWith("operator_")) return Block.Kind.REPORTER;
    return Block.Kind.STACK;
  }

  private Opcodes() {}
}
