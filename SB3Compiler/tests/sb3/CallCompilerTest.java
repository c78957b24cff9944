package sb3;

import static com.google.common.truth.Truth.assertThat;
import static sb3.BlockQueries.*;
import static sb3.PythonAst.*;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

public class CallCompilerTest {

  private CompilationResult result;

  private Target compileFlagScript(JsonObject... body) throws CompilerException {
    result = compile(classDef("Cat", method("when_flag_clicked", body)));
    return sprite(result, "Cat");
  }

  @Test
  public void singleArgumentStatement() throws CompilerException {
    Target cat = compileFlagScript(run("say", str("Hi")));

    assertThat(only(cat, "looks_say").input("MESSAGE")).hasValue(InputValue.string("Hi"));
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void multiArgumentStatement() throws CompilerException {
    Target cat = compileFlagScript(run("glide_to_xy", num(1), num(-20), num(30)));

    Block glide = only(cat, "motion_glidesecstoxy");
    assertThat(glide.input("SECS")).hasValue(InputValue.number("1"));
    assertThat(glide.input("X")).hasValue(InputValue.number("-20"));
    assertThat(glide.input("Y")).hasValue(InputValue.number("30"));
  }

  @Test
  public void menuArgumentUsesSymbol() throws CompilerException {
    Target cat = compileFlagScript(run("go_to", str("mouse")));

    Block menu = inputBlock(cat, only(cat, "motion_goto"), "TO");
    assertThat(menu.opcode()).isEqualTo("motion_goto_menu");
    assertThat(menu.shadow()).isTrue();
    assertThat(menu.field("TO").get().value()).isEqualTo("_mouse_");
  }

  @Test
  public void menuArgumentKeepsSpriteNames() throws CompilerException {
    Target cat = compileFlagScript(run("point_towards", str("Ball")));

    Block menu = inputBlock(cat, only(cat, "motion_pointtowards"), "TOWARDS");
    assertThat(menu.field("TOWARDS").get().value()).isEqualTo("Ball");
  }

  @Test
  public void menuArgumentFromVariableCoversEmptyMenu() throws CompilerException {
    Target cat = compileFlagScript(run("switch_costume", name("next")));

    Block switchCostume = only(cat, "looks_switchcostumeto");
    InputValue.ShadowBlockRef ref = switchCostume.input("COSTUME").get().cast();
    assertThat(cat.blocks().get(ref.id()).get().opcode()).isEqualTo(Opcodes.VARIABLE);
    Block menu = cat.blocks().get(ref.shadow().<InputValue.ShadowRef>cast().id()).get();
    assertThat(menu.opcode()).isEqualTo("looks_costume");
    assertThat(menu.field("COSTUME").get().value()).isEmpty();
  }

  @Test
  public void effectNameIsUppercased() throws CompilerException {
    Target cat = compileFlagScript(run("change_effect", str("color"), num(25)));

    Block change = only(cat, "looks_changeeffectby");
    assertThat(change.field("EFFECT").get().value()).isEqualTo("COLOR");
    assertThat(change.input("CHANGE")).hasValue(InputValue.number("25"));
  }

  @Test
  public void fieldStatementNeedsLiteral() throws CompilerException {
    Target cat = compileFlagScript(run("stop", name("what")));

    assertThat(only(cat, "control_stop").field("STOP_OPTION")).isEmpty();
    assertThat(result.warnings()).hasSize(1);
  }

  @Test
  public void broadcastDeclaresStageMessage() throws CompilerException {
    Target cat =
        compileFlagScript(run("broadcast", str("go")), run("broadcast_and_wait", str("go")));

    assertThat(result.stage().broadcasts()).hasSize(1);
    String id = result.stage().broadcasts().keySet().iterator().next();
    InputValue message = only(cat, "event_broadcast").input("BROADCAST_INPUT").get();
    assertThat(message).isEqualTo(InputValue.broadcast("go", id));
    assertThat(only(cat, "event_broadcastandwait").input("BROADCAST_INPUT")).hasValue(message);
  }

  @Test
  public void broadcastNeedsLiteral() throws CompilerException {
    Target cat = compileFlagScript(run("broadcast", name("message")));

    assertThat(all(cat, "event_broadcast")).isEmpty();
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).errorMsg()).contains("message name literal");
  }

  @Test
  public void playSoundRecordsReference() throws CompilerException {
    Target cat = compileFlagScript(run("play_sound", str("Meow")));

    Block menu = inputBlock(cat, only(cat, "sound_play"), "SOUND_MENU");
    assertThat(menu.field("SOUND_MENU").get().value()).isEqualTo("Meow");
    assertThat(cat.referencedSounds()).containsExactly("Meow");
  }

  @Test
  public void randomWithOneArgumentStartsAtOne() throws CompilerException {
    Target cat = compileFlagScript(run("move", call("random", num(6))));

    Block random = inputBlock(cat, only(cat, "motion_movesteps"), "STEPS");
    assertThat(random.opcode()).isEqualTo("operator_random");
    assertThat(random.input("FROM")).hasValue(InputValue.number("1"));
    assertThat(random.input("TO")).hasValue(InputValue.number("6"));
  }

  @Test
  public void keyPressedMapsArrowKeys() throws CompilerException {
    Target cat = compileFlagScript(ifThen(call("key_pressed", str("up")), run("move", num(1))));

    Block pressed = inputBlock(cat, only(cat, Opcodes.IF), "CONDITION");
    assertThat(pressed.opcode()).isEqualTo("sensing_keypressed");
    assertThat(pressed.kind()).isEqualTo(Block.Kind.BOOLEAN_REPORTER);
    Block menu = inputBlock(cat, pressed, "KEY_OPTION");
    assertThat(menu.field("KEY_OPTION").get().value()).isEqualTo("up arrow");
  }

  @Test
  public void mathOperationSetsOperator() throws CompilerException {
    Target cat = compileFlagScript(run("move", call("sqrt", num(16))));

    Block mathop = inputBlock(cat, only(cat, "motion_movesteps"), "STEPS");
    assertThat(mathop.opcode()).isEqualTo("operator_mathop");
    assertThat(mathop.field("OPERATOR").get().value()).isEqualTo("sqrt");
    assertThat(mathop.input("NUM")).hasValue(InputValue.number("16"));
  }

  @Test
  public void fieldReporterCarriesItsValue() throws CompilerException {
    Target cat = compileFlagScript(run("say", call("current_year")));

    Block current = inputBlock(cat, only(cat, "looks_say"), "MESSAGE");
    assertThat(current.field("CURRENTMENU").get().value()).isEqualTo("YEAR");
  }

  @Test
  public void propertyOfTakesPropertyAndObject() throws CompilerException {
    Target cat =
        compileFlagScript(run("say", call("property_of", str("x position"), str("Ball"))));

    Block of = inputBlock(cat, only(cat, "looks_say"), "MESSAGE");
    assertThat(of.opcode()).isEqualTo("sensing_of");
    assertThat(of.field("PROPERTY").get().value()).isEqualTo("x position");
    assertThat(inputBlock(cat, of, "OBJECT").field("OBJECT").get().value()).isEqualTo("Ball");
  }

  @Test
  public void listOperationsUseListField() throws CompilerException {
    Target cat =
        compileFlagScript(
            run("add_to_list", str("apple"), str("basket")),
            run("say", call("item_of_list", num(1), str("basket"))));

    String listId = cat.listNamed("basket").get().id();
    Block add = only(cat, "data_addtolist");
    assertThat(add.field(CallTable.LIST)).hasValue(Block.Field.of("basket", listId));
    assertThat(add.input("ITEM")).hasValue(InputValue.string("apple"));
    assertThat(add.input(CallTable.LIST)).isEmpty();

    Block item = only(cat, "data_itemoflist");
    assertThat(item.field(CallTable.LIST)).hasValue(Block.Field.of("basket", listId));
    assertThat(item.input("INDEX")).hasValue(InputValue.number("1"));
  }

  @Test
  public void listOperationNeedsListName() throws CompilerException {
    Target cat = compileFlagScript(run("delete_all_of_list", name("basket")));

    assertThat(all(cat, "data_deletealloflist")).isEmpty();
    assertThat(result.warnings()).hasSize(1);
  }

  @Test
  public void variableVisibility() throws CompilerException {
    Target cat = compileFlagScript(run("show_variable", str("score")));

    Block show = only(cat, "data_showvariable");
    String id = cat.variableNamed("score").get().id();
    assertThat(show.field(CallTable.VARIABLE)).hasValue(Block.Field.of("score", id));
  }

  @Test
  public void waitUntilTakesCondition() throws CompilerException {
    Target cat = compileFlagScript(run("wait_until", call("mouse_down")));

    Block wait = only(cat, "control_wait_until");
    assertThat(inputBlock(cat, wait, "CONDITION").opcode()).isEqualTo("sensing_mousedown");
  }

  @Test
  public void colorArgumentsAreColorLiterals() throws CompilerException {
    Target cat =
        compileFlagScript(ifThen(call("touching_color", str("#ff0000")), run("move", num(1))));

    Block touching = inputBlock(cat, only(cat, Opcodes.IF), "CONDITION");
    assertThat(touching.input("COLOR")).hasValue(InputValue.color("#ff0000"));
  }

  @Test
  public void unknownCallWarns() throws CompilerException {
    Target cat = compileFlagScript(run("fly", num(3)), run("move", num(1)));

    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).errorMsg()).isEqualTo("unknown call 'fly' ignored");
    Block hat = only(cat, Opcodes.WHEN_FLAG_CLICKED);
    assertThat(chainOpcodes(cat, hat))
        .containsExactly(Opcodes.WHEN_FLAG_CLICKED, "motion_movesteps")
        .inOrder();
  }

  @Test
  public void reporterInStatementPositionWarns() throws CompilerException {
    Target cat = compileFlagScript(run("x_position"));

    assertThat(cat.blocks().size()).isEqualTo(1);
    assertThat(result.warnings().get(0).errorMsg()).contains("reports a value");
  }

  @Test
  public void statementInValuePositionUsesZero() throws CompilerException {
    Target cat = compileFlagScript(run("say", call("show")));

    assertThat(only(cat, "looks_say").input("MESSAGE")).hasValue(InputValue.number("0"));
    assertThat(all(cat, "looks_show")).isEmpty();
    assertThat(result.warnings().get(0).errorMsg()).contains("does not report a value");
  }

  @Test
  public void wrongArgumentCountWarns() throws CompilerException {
    Target cat = compileFlagScript(run("go_to_xy", num(1)));

    Block goTo = only(cat, "motion_gotoxy");
    assertThat(goTo.input("X")).hasValue(InputValue.number("1"));
    assertThat(goTo.input("Y")).isEmpty();
    assertThat(result.warnings().get(0).errorMsg())
        .isEqualTo("'go_to_xy' takes 2 arguments, got 1");
  }
}
