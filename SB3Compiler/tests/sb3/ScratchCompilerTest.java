package sb3;

import static com.google.common.truth.Truth.assertThat;
import static sb3.BlockQueries.*;
import static sb3.PythonAst.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

public class ScratchCompilerTest {

  private static JsonObject[] game() {
    return new JsonObject[] {
      assign("score", num(0)),
      assign("high_scores", list(num(10), num(5))),
      classDef(
          "Cat",
          assign("lives", num(3)),
          method("when_flag_clicked", run("say", str("Hi")), run("move", num(10))),
          method(
              "when_key_space",
              ifElse(
                  compare(name("lives"), "Gt", num(0)),
                  Arrays.asList(augAssign("score", "Add", num(1))),
                  Arrays.asList(run("broadcast", str("game_over"))))),
          method("when_broadcast_game_over", runSelf("celebrate", num(3))),
          method(
              "celebrate",
              Arrays.asList("times"),
              forRange("i", name("times"), run("turn_right", num(15))))),
      classDef(
          "Ball",
          assign("lives", num(1)),
          method(
              "when_flag_clicked",
              whileLoop(bool(true), run("move", num(5)), run("if_on_edge_bounce")))),
    };
  }

  @Test
  public void catSaysHiThenMoves() throws CompilerException {
    CompilationResult result =
        compile(
            classDef(
                "Cat",
                method("when_flag_clicked", run("say", str("Hi")), run("move", num(10)))));

    Target cat = sprite(result, "Cat");
    Block hat = only(cat, Opcodes.WHEN_FLAG_CLICKED);
    assertThat(chainOpcodes(cat, hat))
        .containsExactly(Opcodes.WHEN_FLAG_CLICKED, "looks_say", "motion_movesteps")
        .inOrder();
    assertThat(only(cat, "looks_say").input("MESSAGE")).hasValue(InputValue.string("Hi"));
    assertThat(only(cat, "motion_movesteps").input("STEPS")).hasValue(InputValue.number("10"));
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void blockIdsAreDistinctAndReferencesResolve() throws Exception {
    CompilationResult result = compile(game());

    Set<String> ids = new HashSet<>();
    for (Target sprite : result.sprites()) {
      sprite.blocks().checkIntegrity(sprite.name());
      for (String id : sprite.blocks().blocks().keySet()) {
        assertThat(ids.add(id)).isTrue();
      }
    }
    assertThat(ids).isNotEmpty();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  public void compilingTwiceGivesIdenticalGraphs() throws CompilerException {
    CompilationResult first = compile(game());
    CompilationResult second = compile(game());

    assertThat(second.sprites()).hasSize(first.sprites().size());
    for (int i = 0; i < first.sprites().size(); i++) {
      assertThat(second.sprites().get(i).blocks()).isEqualTo(first.sprites().get(i).blocks());
      assertThat(second.sprites().get(i).variables())
          .isEqualTo(first.sprites().get(i).variables());
    }
    assertThat(second.stage().variables()).isEqualTo(first.stage().variables());
  }

  @Test
  public void moduleAssignmentsBecomeStageData() throws CompilerException {
    CompilationResult result = compile(game());

    Target stage = result.stage();
    assertThat(stage.isStage()).isTrue();
    Target.Variable score = stage.variableNamed("score").get();
    assertThat(score.value()).isEqualTo(new JsonPrimitive(0L));
    assertThat(stage.listNamed("high_scores").get().contents()).hasSize(2);
    assertThat(stage.broadcasts()).containsExactly("stage-m3", "game_over");

    Target cat = sprite(result, "Cat");
    assertThat(cat.variableNamed("score")).isEmpty();
    Block change = only(cat, Opcodes.CHANGE_VARIABLE_BY);
    assertThat(change.field(CallTable.VARIABLE)).hasValue(Block.Field.of("score", score.id()));
  }

  @Test
  public void spritesDoNotShareData() throws CompilerException {
    CompilationResult result = compile(game());

    Target.Variable catLives = sprite(result, "Cat").variableNamed("lives").get();
    Target.Variable ballLives = sprite(result, "Ball").variableNamed("lives").get();
    assertThat(catLives.id()).isNotEqualTo(ballLives.id());
    assertThat(catLives.value()).isEqualTo(new JsonPrimitive(3L));
    assertThat(ballLives.value()).isEqualTo(new JsonPrimitive(1L));
    assertThat(result.stage().variableNamed("lives")).isEmpty();
  }

  @Test
  public void spritesKeepSourceOrder() throws CompilerException {
    CompilationResult result = compile(game());

    assertThat(result.sprites().stream().map(Target::name).collect(Collectors.toList()))
        .containsExactly("Cat", "Ball")
        .inOrder();
  }

  @Test
  public void moduleLevelEventsFormImplicitSprite() throws CompilerException {
    CompilationResult result =
        compile(function("when_flag_clicked", run("say", str("hello"))), classDef("Cat"));

    assertThat(result.sprites()).hasSize(2);
    Target implicit = result.sprites().get(0);
    assertThat(implicit.name()).isEqualTo(StageConfig.defaults().defaultSpriteName());
    assertThat(only(implicit, "looks_say").input("MESSAGE"))
        .hasValue(InputValue.string("hello"));
  }

  @Test
  public void otherModuleStatementsWarn() throws CompilerException {
    CompilationResult result =
        compile(
            expr(str("Module docstring.")),
            at(2, node("Import")),
            at(3, function("helper", run("show"))),
            at(4, run("show")));

    assertThat(result.sprites()).isEmpty();
    assertThat(result.warnings()).hasSize(2);
    assertThat(result.warnings().get(0).pos().lineNumber()).isEqualTo(3);
    assertThat(result.warnings().get(1).pos().lineNumber()).isEqualTo(4);
  }

  @Test
  public void duplicateClassIsIgnored() throws CompilerException {
    CompilationResult result =
        compile(
            classDef("Cat", method("when_clicked", run("show"))),
            at(5, classDef("Cat", method("when_clicked", run("hide")))));

    assertThat(result.sprites()).hasSize(1);
    assertThat(all(result.sprites().get(0), "looks_hide")).isEmpty();
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).errorMsg()).contains("already defined");
  }

  @Test
  public void unsupportedConstructsAreReportedOnce() throws CompilerException {
    CompilationResult result =
        compile(
            classDef(
                "Cat",
                method(
                    "when_clicked",
                    at(2, node("Try")),
                    run("say", at(3, node("Lambda"))),
                    run("say", at(4, compare(name("a"), "In", name("b")))))));

    assertThat(result.warnings()).hasSize(3);
    assertThat(result.warnings().get(0).errorMsg()).contains("Try");
    assertThat(result.warnings().get(1).errorMsg()).contains("Lambda");
    assertThat(result.warnings().get(2).errorMsg()).contains("'in'");
  }

  @Test
  public void stageTakesConfiguredSettings() throws CompilerException {
    StageConfig config = StageConfig.defaults().toBuilder().setTempo(90).setVolume(50).build();
    CompilationResult result =
        new ScratchCompiler(config).compile(read(module(classDef("Cat"))));

    assertThat(result.stage().name()).isEqualTo(config.stageName());
    assertThat(result.stage().tempo()).isEqualTo(90.0);
    assertThat(result.stage().volume()).isEqualTo(50.0);
    assertThat(result.stage().blocks().isEmpty()).isTrue();
  }
}
