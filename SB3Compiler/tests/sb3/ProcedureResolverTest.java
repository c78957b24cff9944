package sb3;

import static com.google.common.truth.Truth.assertThat;
import static sb3.BlockQueries.*;
import static sb3.PythonAst.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

public class ProcedureResolverTest {

  private CompilationResult result;

  private Target compileCat(JsonObject... classBody) throws CompilerException {
    result = compile(classDef("Cat", classBody));
    return sprite(result, "Cat");
  }

  @Test
  public void forwardCallMatchesDefinition() throws CompilerException {
    Target cat =
        compileCat(
            method("when_flag_clicked", runSelf("jump", num(10))),
            method("jump", Arrays.asList("height"), run("change_y", name("height"))));

    CustomProcedure jump = cat.procedureByProccode("jump %s").get();
    Block call = only(cat, Opcodes.PROCEDURES_CALL);
    assertThat(call.mutation().get().proccode()).hasValue(jump.proccode());
    assertThat(call.mutation().get().argumentIds()).hasValue(jump.argumentIds());
    assertThat(call.input(jump.argumentIds().get(0))).hasValue(InputValue.number("10"));
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void definitionHasPrototypeAndArguments() throws CompilerException {
    Target cat = compileCat(method("jump", Arrays.asList("height", "speed"), run("show")));

    CustomProcedure jump = cat.procedures().get(0);
    assertThat(jump.name()).isEqualTo("jump");
    assertThat(jump.proccode()).isEqualTo("jump %s %s");
    assertThat(jump.argumentNames()).containsExactly("height", "speed").inOrder();
    assertThat(jump.argumentDefaults()).containsExactly("", "");

    Block definition = only(cat, Opcodes.PROCEDURES_DEFINITION);
    assertThat(definition.id()).isEqualTo(jump.definitionId());
    assertThat(definition.topLevel()).isTrue();
    assertThat(definition.input("custom_block"))
        .hasValue(InputValue.menu(jump.prototypeId()));
    assertThat(cat.blocks().get(definition.next().get()).get().opcode()).isEqualTo("looks_show");

    Block prototype = only(cat, Opcodes.PROCEDURES_PROTOTYPE);
    assertThat(prototype.shadow()).isTrue();
    assertThat(prototype.parent()).hasValue(definition.id());
    Block.Mutation mutation = prototype.mutation().get();
    assertThat(mutation.proccode()).hasValue("jump %s %s");
    assertThat(mutation.argumentNames().get()).containsExactly("height", "speed").inOrder();

    Block height = inputBlock(cat, prototype, jump.argumentIds().get(0));
    assertThat(height.opcode()).isEqualTo(Opcodes.ARGUMENT_REPORTER_STRING_NUMBER);
    assertThat(height.field("VALUE").get().value()).isEqualTo("height");
  }

  @Test
  public void parameterShadowsSpriteVariable() throws CompilerException {
    Target cat =
        compileCat(
            assign("height", num(1)),
            method("jump", Arrays.asList("height"), run("change_y", name("height"))));

    Block change = only(cat, "motion_changeyby");
    Block reporter = inputBlock(cat, change, "DY");
    assertThat(reporter.opcode()).isEqualTo(Opcodes.ARGUMENT_REPORTER_STRING_NUMBER);
    assertThat(reporter.shadow()).isFalse();
    assertThat(reporter.field("VALUE").get().value()).isEqualTo("height");
  }

  @Test
  public void missingArgumentsUseDefaults() throws CompilerException {
    Target cat =
        compileCat(
            method("when_clicked", runSelf("greet")),
            method("greet", Arrays.asList("who"), run("say", name("who"))));

    CustomProcedure greet = cat.procedures().get(0);
    Block call = only(cat, Opcodes.PROCEDURES_CALL);
    assertThat(call.input(greet.argumentIds().get(0))).hasValue(InputValue.string(""));
  }

  @Test
  public void extraArgumentsWarn() throws CompilerException {
    Target cat =
        compileCat(
            method("when_clicked", runSelf("greet", str("a"), str("b"))),
            method("greet", Arrays.asList("who"), run("say", name("who"))));

    assertThat(only(cat, Opcodes.PROCEDURES_CALL).inputs()).hasSize(1);
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).errorMsg()).contains("takes 1 arguments");
  }

  @Test
  public void duplicateProcedureKeepsFirst() throws CompilerException {
    Target cat = compileCat(method("jump", run("show")), method("jump", run("hide")));

    assertThat(cat.procedures()).hasSize(1);
    assertThat(all(cat, Opcodes.PROCEDURES_DEFINITION)).hasSize(1);
    assertThat(all(cat, "looks_show")).hasSize(1);
    assertThat(all(cat, "looks_hide")).isEmpty();
    assertThat(result.warnings()).hasSize(1);
  }

  @Test
  public void escapedEventNameDefinesProcedure() throws CompilerException {
    Target cat =
        compileCat(
            method("define_when_ready", run("show")),
            method("when_flag_clicked", runSelf("define_when_ready")));

    assertThat(cat.procedures().get(0).name()).isEqualTo("when_ready");
    assertThat(only(cat, Opcodes.PROCEDURES_CALL).mutation().get().proccode())
        .hasValue("when_ready");
  }

  @Test
  public void dunderMethodsAreSkipped() throws CompilerException {
    Target cat = compileCat(method("__init__", run("show")));

    assertThat(cat.procedures()).isEmpty();
    assertThat(cat.blocks().isEmpty()).isTrue();
  }

  @Test
  public void builtinNameWarns() throws CompilerException {
    Target cat = compileCat(method("move", run("show")));

    assertThat(cat.procedures()).hasSize(1);
    assertThat(result.warnings().get(0).errorMsg()).contains("built-in block");
  }

  @Test
  public void procedureAndMethodNames() {
    assertThat(ProcedureResolver.procedureName("define_when_x")).isEqualTo("when_x");
    assertThat(ProcedureResolver.procedureName("define_other")).isEqualTo("define_other");
    assertThat(ProcedureResolver.procedureName("jump")).isEqualTo("jump");
    assertThat(ProcedureResolver.methodName("when_x")).isEqualTo("define_when_x");
    assertThat(ProcedureResolver.methodName("__init__")).isEqualTo("define___init__");
    assertThat(ProcedureResolver.methodName("jump")).isEqualTo("jump");
    assertThat(CustomProcedure.proccodeOf("jump", 2)).isEqualTo("jump %s %s");
    assertThat(CustomProcedure.nameOf("jump %s %s")).isEqualTo("jump");
  }
}
