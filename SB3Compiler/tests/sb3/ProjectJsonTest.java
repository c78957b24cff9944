package sb3;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sb3.PythonAst.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class ProjectJsonTest {

  private static Project project(JsonObject... body) throws Exception {
    StageConfig config = StageConfig.defaults();
    CompilationResult compiled = new ScratchCompiler(config).compile(read(module(body)));
    return new ProjectAssembler(config, CatalogAssetLibrary.bundled()).assemble(compiled);
  }

  // Single quotes keep the fixtures readable.
  private static Project parse(String json) throws InvalidProjectException {
    return ProjectJson.read(json.replace('\'', '"'));
  }

  private static JsonObject blockWithOpcode(JsonObject target, String opcode) {
    for (String id : target.getAsJsonObject("blocks").keySet()) {
      JsonObject block = target.getAsJsonObject("blocks").getAsJsonObject(id);
      if (block.get("opcode").getAsString().equals(opcode)) return block;
    }
    throw new AssertionError("no block " + opcode);
  }

  private static final String EDITOR_PROJECT =
      "{'targets': ["
          + "{'isStage': true, 'name': 'Stage',"
          + " 'variables': {'v1': ['my variable', 0], 'c1': ['cloud high', 5, true]},"
          + " 'lists': {'l1': ['names', ['a', 2]]},"
          + " 'broadcasts': {'m1': 'start'}, 'blocks': {}, 'costumes': [], 'sounds': []},"
          + "{'isStage': false, 'name': 'Sprite1', 'variables': {}, 'lists': {},"
          + " 'blocks': {"
          + "  'hat': {'opcode': 'event_whenflagclicked', 'next': 'say', 'parent': null,"
          + "   'inputs': {}, 'fields': {}, 'shadow': false, 'topLevel': true, 'x': 12, 'y': 30},"
          + "  'say': {'opcode': 'looks_say', 'next': null, 'parent': 'hat',"
          + "   'inputs': {'MESSAGE': [3, [12, 'my variable', 'v1'], [10, '']]},"
          + "   'fields': {}, 'shadow': false, 'topLevel': false},"
          + "  'loose': [12, 'my variable', 'v1', 300, 200]},"
          + " 'costumes': [], 'sounds': [], 'x': 5, 'direction': 45}],"
          + " 'meta': {'semver': '3.0.0', 'vm': '0.2.0', 'agent': ''}}";

  @Test
  public void compiledProjectHasDocumentShape() throws Exception {
    JsonObject root =
        ProjectJson.toJson(
            project(
                classDef(
                    "Cat",
                    method("when_flag_clicked", run("say", str("Hi")), run("move", num(10))))));

    assertThat(root.getAsJsonObject("meta").get("semver").getAsString()).isEqualTo("3.0.0");
    JsonArray targets = root.getAsJsonArray("targets");
    assertThat(targets.size()).isEqualTo(2);

    JsonObject stage = targets.get(0).getAsJsonObject();
    assertThat(stage.get("isStage").getAsBoolean()).isTrue();
    assertThat(stage.get("textToSpeechLanguage")).isEqualTo(JsonNull.INSTANCE);
    assertThat(stage.has("x")).isFalse();

    JsonObject cat = targets.get(1).getAsJsonObject();
    assertThat(cat.get("name").getAsString()).isEqualTo("Cat");
    assertThat(cat.get("layerOrder").getAsInt()).isEqualTo(1);
    assertThat(cat.has("tempo")).isFalse();

    JsonObject hat = blockWithOpcode(cat, Opcodes.WHEN_FLAG_CLICKED);
    assertThat(hat.get("topLevel").getAsBoolean()).isTrue();
    assertThat(hat.get("parent")).isEqualTo(JsonNull.INSTANCE);
    assertThat(hat.has("x")).isTrue();

    JsonObject say = blockWithOpcode(cat, "looks_say");
    assertThat(say.has("x")).isFalse();
    assertThat(say.getAsJsonObject("inputs").get("MESSAGE"))
        .isEqualTo(JsonParser.parseString("[1, [10, \"Hi\"]]"));
    JsonObject move = blockWithOpcode(cat, "motion_movesteps");
    assertThat(move.get("next")).isEqualTo(JsonNull.INSTANCE);
    assertThat(say.get("next").getAsString()).isEqualTo(move.get("parent").getAsString());
  }

  @Test
  public void inputEncodings() {
    assertThat(ProjectJson.input(InputValue.number("10")).toString()).isEqualTo("[1,[4,\"10\"]]");
    assertThat(ProjectJson.input(InputValue.broadcast("go", "m1")).toString())
        .isEqualTo("[1,[11,\"go\",\"m1\"]]");
    assertThat(ProjectJson.input(InputValue.variable("score", "v1")).toString())
        .isEqualTo("[3,[12,\"score\",\"v1\"],[10,\"\"]]");
    assertThat(ProjectJson.input(InputValue.block("b2")).toString()).isEqualTo("[2,\"b2\"]");
    assertThat(ProjectJson.input(InputValue.menu("b3")).toString()).isEqualTo("[1,\"b3\"]");
    assertThat(
            ProjectJson.input(InputValue.shadowedBlock("b4", InputValue.menu("b5"))).toString())
        .isEqualTo("[3,\"b4\",\"b5\"]");
  }

  @Test
  public void writtenProjectReadsBack() throws Exception {
    Project original =
        project(
            assign("score", num(0)),
            assign("names", list(str("a"), str("b"))),
            classDef(
                "Cat",
                assign("lives", num(3)),
                method(
                    "when_key_space",
                    ifElse(
                        compare(name("lives"), "Gt", num(0)),
                        Arrays.asList(augAssign("score", "Add", num(1))),
                        Arrays.asList(run("broadcast", str("game_over"))))),
                method("when_flag_clicked", runSelf("jump", name("lives"))),
                method("jump", Arrays.asList("height"), run("change_y", name("height")))));

    Project copy = ProjectJson.read(ProjectJson.write(original));

    assertThat(copy.targets()).hasSize(original.targets().size());
    for (int i = 0; i < original.targets().size(); i++) {
      Target before = original.targets().get(i);
      Target after = copy.targets().get(i);
      assertThat(after.name()).isEqualTo(before.name());
      assertThat(after.blocks()).isEqualTo(before.blocks());
      assertThat(after.variables()).isEqualTo(before.variables());
      assertThat(after.lists()).isEqualTo(before.lists());
      assertThat(after.broadcasts()).isEqualTo(before.broadcasts());
      assertThat(after.procedures()).isEqualTo(before.procedures());
      assertThat(after.costumes()).isEqualTo(before.costumes());
    }
    assertThat(copy.meta()).isEqualTo(original.meta());
  }

  @Test
  public void readsEditorDocument() throws InvalidProjectException {
    Project project = parse(EDITOR_PROJECT);

    Target stage = project.stage();
    assertThat(stage.variables()).hasSize(2);
    assertThat(stage.variables().get("c1").name()).isEqualTo("cloud high");
    assertThat(stage.listNamed("names").get().contents()).hasSize(2);
    assertThat(stage.broadcasts()).containsExactly("m1", "start");

    Target sprite = project.sprite("Sprite1").get();
    assertThat(sprite.blocks().size()).isEqualTo(2);
    assertThat(sprite.x()).isEqualTo(5.0);
    assertThat(sprite.direction()).isEqualTo(45.0);
    assertThat(sprite.size()).isEqualTo(100.0);
    Block hat = sprite.blocks().get("hat").get();
    assertThat(hat.x()).isEqualTo(12);
    assertThat(hat.next()).hasValue("say");
    assertThat(sprite.blocks().get("say").get().input("MESSAGE"))
        .hasValue(InputValue.variable("my variable", "v1"));
  }

  @Test
  public void emptySlotsAreSkipped() throws InvalidProjectException {
    Project project =
        parse(
            "{'targets': [{'isStage': true, 'name': 'Stage', 'blocks': {"
                + " 'hat': {'opcode': 'event_whenflagclicked', 'next': 'loop', 'topLevel': true},"
                + " 'loop': {'opcode': 'control_forever', 'parent': 'hat',"
                + "  'inputs': {'SUBSTACK': [2, null]}}}}]}");

    Block loop = project.stage().blocks().get("loop").get();
    assertThat(loop.inputs()).isEmpty();
    assertThat(project.sprites()).isEmpty();
    assertThat(project.meta().semver()).isEmpty();
  }

  @Test
  public void invalidDocuments() {
    InvalidProjectException malformed =
        assertThrows(InvalidProjectException.class, () -> ProjectJson.read("{"));
    assertThat(malformed).hasMessageThat().startsWith("invalid project: malformed JSON");

    InvalidProjectException noTargets =
        assertThrows(InvalidProjectException.class, () -> parse("{'meta': {}}"));
    assertThat(noTargets).hasMessageThat().isEqualTo("invalid project: missing 'targets'");

    InvalidProjectException noStage =
        assertThrows(
            InvalidProjectException.class,
            () -> parse("{'targets': [{'isStage': false, 'name': 'Cat'}]}"));
    assertThat(noStage).hasMessageThat().isEqualTo("invalid project: no stage target");

    InvalidProjectException twoStages =
        assertThrows(
            InvalidProjectException.class,
            () ->
                parse(
                    "{'targets': [{'isStage': true, 'name': 'Stage'},"
                        + " {'isStage': true, 'name': 'Other'}]}"));
    assertThat(twoStages).hasMessageThat().contains("a second stage");

    InvalidProjectException noOpcode =
        assertThrows(
            InvalidProjectException.class,
            () ->
                parse(
                    "{'targets': [{'isStage': true, 'name': 'Stage',"
                        + " 'blocks': {'b1': {'next': null}}}]}"));
    assertThat(noOpcode).hasMessageThat().contains("block 'b1': missing opcode");

    assertThrows(InvalidProjectException.class, () -> parse("[]"));
    assertThrows(InvalidProjectException.class, () -> parse("{'targets': [{'isStage': true}]}"));
  }
}
