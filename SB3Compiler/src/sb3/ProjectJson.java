package sb3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

// Writing keeps key order stable and spells out nulls, so equal projects serialize to equal text.
public final class ProjectJson {
  private static final Logger logger = Logger.getLogger(ProjectJson.class.getName());

  private static final Gson COMPACT =
      new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
  private static final Gson PRETTY =
      new GsonBuilder().serializeNulls().disableHtmlEscaping().setPrettyPrinting().create();

  // Shadow kinds: the first element of every input.
  private static final int SHADOW_ONLY = 1;
  private static final int NO_SHADOW = 2;
  private static final int OBSCURED = 3;

  private static final String MUTATION_TAG = "tagName";
  private static final String MUTATION_CHILDREN = "children";

  public static String write(Project project) {
    return COMPACT.toJson(toJson(project));
  }

  public static String writePretty(Project project) {
    return PRETTY.toJson(toJson(project));
  }

  public static JsonObject toJson(Project project) {
    JsonObject root = new JsonObject();
    JsonArray targets = new JsonArray();
    project.targets().forEach(t -> targets.add(target(t)));
    root.add("targets", targets);

    JsonArray monitors = new JsonArray();
    project.monitors().forEach(monitors::add);
    root.add("monitors", monitors);

    JsonArray extensions = new JsonArray();
    project.extensions().forEach(extensions::add);
    root.add("extensions", extensions);

    JsonObject meta = new JsonObject();
    meta.addProperty("semver", project.meta().semver());
    meta.addProperty("vm", project.meta().vm());
    meta.addProperty("agent", project.meta().agent());
    root.add("meta", meta);
    return root;
  }

  private static JsonObject target(Target target) {
    JsonObject json = new JsonObject();
    json.addProperty("isStage", target.isStage());
    json.addProperty("name", target.name());

    JsonObject variables = new JsonObject();
    for (Target.Variable variable : target.variables().values()) {
      JsonArray entry = new JsonArray();
      entry.add(variable.name());
      entry.add(variable.value());
      variables.add(variable.id(), entry);
    }
    json.add("variables", variables);

    JsonObject lists = new JsonObject();
    for (Target.ListVariable list : target.lists().values()) {
      JsonArray contents = new JsonArray();
      list.contents().forEach(contents::add);
      JsonArray entry = new JsonArray();
      entry.add(list.name());
      entry.add(contents);
      lists.add(list.id(), entry);
    }
    json.add("lists", lists);

    JsonObject broadcasts = new JsonObject();
    target.broadcasts().forEach(broadcasts::addProperty);
    json.add("broadcasts", broadcasts);

    JsonObject blocks = new JsonObject();
    for (Block block : target.blocks().blocks().values()) {
      blocks.add(block.id(), block(block));
    }
    json.add("blocks", blocks);
    json.add("comments", new JsonObject());

    json.addProperty("currentCostume", target.currentCostume());
    JsonArray costumes = new JsonArray();
    target.costumes().forEach(c -> costumes.add(costume(c)));
    json.add("costumes", costumes);
    JsonArray sounds = new JsonArray();
    target.sounds().forEach(s -> sounds.add(sound(s)));
    json.add("sounds", sounds);
    json.add("volume", number(target.volume()));
    json.addProperty("layerOrder", target.layerOrder());

    if (target.isStage()) {
      json.add("tempo", number(target.tempo()));
      json.add("videoTransparency", number(target.videoTransparency()));
      json.addProperty("videoState", target.videoState());
      json.add("textToSpeechLanguage", nullable(target.textToSpeechLanguage()));
    } else {
      json.addProperty("visible", target.visible());
      json.add("x", number(target.x()));
      json.add("y", number(target.y()));
      json.add("size", number(target.size()));
      json.add("direction", number(target.direction()));
      json.addProperty("draggable", target.draggable());
      json.addProperty("rotationStyle", target.rotationStyle());
    }
    return json;
  }

  private static JsonObject block(Block block) {
    JsonObject json = new JsonObject();
    json.addProperty("opcode", block.opcode());
    json.add("next", nullable(block.next()));
    json.add("parent", nullable(block.parent()));

    JsonObject inputs = new JsonObject();
    block.inputs().forEach((name, value) -> inputs.add(name, input(value)));
    json.add("inputs", inputs);

    JsonObject fields = new JsonObject();
    for (Map.Entry<String, Block.Field> entry : block.fields().entrySet()) {
      JsonArray field = new JsonArray();
      field.add(entry.getValue().value());
      field.add(nullable(entry.getValue().id()));
      fields.add(entry.getKey(), field);
    }
    json.add("fields", fields);

    json.addProperty("shadow", block.shadow());
    json.addProperty("topLevel", block.topLevel());
    if (block.topLevel()) {
      json.addProperty("x", block.x());
      json.addProperty("y", block.y());
    }
    if (block.mutation().isPresent()) {
      JsonObject mutation = new JsonObject();
      mutation.addProperty(MUTATION_TAG, "mutation");
      mutation.add(MUTATION_CHILDREN, new JsonArray());
      block.mutation().get().attributes().forEach(mutation::addProperty);
      json.add("mutation", mutation);
    }
    return json;
  }

  static JsonArray input(InputValue value) {
    JsonArray json = new JsonArray();
    switch (value.type()) {
      case NUMBER_LITERAL:
      case COLOR_LITERAL:
      case STRING_LITERAL:
      case BROADCAST_LITERAL:
        json.add(SHADOW_ONLY);
        json.add(primitive(value));
        break;
      case VARIABLE_LITERAL:
      case LIST_LITERAL:
        json.add(OBSCURED);
        json.add(primitive(value));
        json.add(primitive(InputValue.string("")));
        break;
      case BLOCK_REF:
        json.add(NO_SHADOW);
        json.add(value.<InputValue.BlockRef>cast().id());
        break;
      case SHADOW_BLOCK_REF:
        {
          InputValue.ShadowBlockRef ref = value.cast();
          json.add(OBSCURED);
          json.add(ref.id());
          json.add(
              ref.shadow().type() == InputValue.Type.SHADOW_REF
                  ? new JsonPrimitive(ref.shadow().<InputValue.ShadowRef>cast().id())
                  : primitive(ref.shadow()));
          break;
        }
      case SHADOW_REF:
        json.add(SHADOW_ONLY);
        json.add(value.<InputValue.ShadowRef>cast().id());
        break;
      default:
        throw new AssertionError("Unknown input type: " + value.type());
    }
    return json;
  }

  private static JsonArray primitive(InputValue value) {
    JsonArray json = new JsonArray();
    switch (value.type()) {
      case NUMBER_LITERAL:
      case COLOR_LITERAL:
      case STRING_LITERAL:
        {
          InputValue.Literal literal = value.cast();
          json.add(literal.code());
          json.add(literal.value());
          break;
        }
      case BROADCAST_LITERAL:
        {
          InputValue.BroadcastLiteral broadcast = value.cast();
          json.add(InputValue.BROADCAST);
          json.add(broadcast.name());
          json.add(broadcast.id());
          break;
        }
      case VARIABLE_LITERAL:
      case LIST_LITERAL:
        {
          InputValue.VariableLiteral variable = value.cast();
          json.add(variable.code());
          json.add(variable.name());
          json.add(variable.id());
          break;
        }
      default:
        throw new IllegalArgumentException("Not a primitive: " + value.type());
    }
    return json;
  }

  private static JsonObject costume(Asset.Costume costume) {
    JsonObject json = new JsonObject();
    json.addProperty("assetId", costume.assetId());
    json.addProperty("name", costume.name());
    json.addProperty("bitmapResolution", costume.bitmapResolution());
    json.addProperty("md5ext", costume.md5ext());
    json.addProperty("dataFormat", costume.dataFormat());
    json.add("rotationCenterX", number(costume.rotationCenterX()));
    json.add("rotationCenterY", number(costume.rotationCenterY()));
    return json;
  }

  private static JsonObject sound(Asset.Sound sound) {
    JsonObject json = new JsonObject();
    json.addProperty("assetId", sound.assetId());
    json.addProperty("name", sound.name());
    json.addProperty("dataFormat", sound.dataFormat());
    json.addProperty("format", "");
    json.addProperty("rate", sound.rate());
    json.addProperty("sampleCount", sound.sampleCount());
    json.addProperty("md5ext", sound.md5ext());
    return json;
  }

  // Integral values are written without a fractional part.
  private static JsonPrimitive number(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return new JsonPrimitive((long) value);
    }
    return new JsonPrimitive(value);
  }

  private static JsonElement nullable(Optional<String> value) {
    return value.isPresent() ? new JsonPrimitive(value.get()) : JsonNull.INSTANCE;
  }

  public static Project read(String json) throws InvalidProjectException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new InvalidProjectException("invalid project: malformed JSON: " + ex.getMessage(), ex);
    }
    if (!root.isJsonObject()) {
      throw new InvalidProjectException("invalid project: the document is not a JSON object");
    }
    return fromJson(root.getAsJsonObject());
  }

  public static Project fromJson(JsonObject root) throws InvalidProjectException {
    JsonElement targets = root.get("targets");
    if (targets == null || !targets.isJsonArray()) {
      throw new InvalidProjectException("invalid project: missing 'targets'");
    }

    Target stage = null;
    ImmutableList.Builder<Target> sprites = ImmutableList.builder();
    for (JsonElement element : targets.getAsJsonArray()) {
      if (!element.isJsonObject()) {
        throw new InvalidProjectException("invalid project: a target is not a JSON object");
      }
      Target target = readTarget(element.getAsJsonObject());
      if (!target.isStage()) {
        sprites.add(target);
      } else if (stage == null) {
        stage = target;
      } else {
        throw InvalidProjectException.inTarget(target.name(), "a second stage");
      }
    }
    if (stage == null) throw new InvalidProjectException("invalid project: no stage target");

    ImmutableList.Builder<JsonElement> monitors = ImmutableList.builder();
    ImmutableList.Builder<String> extensions = ImmutableList.builder();
    Project.Meta meta;
    try {
      array(root, "monitors").forEach(monitors::add);
      for (JsonElement extension : array(root, "extensions")) {
        extensions.add(extension.getAsString());
      }
      JsonObject metaJson = object(root, "meta");
      meta =
          Project.Meta.create(
              string(metaJson, "semver").orElse(""),
              string(metaJson, "vm").orElse(""),
              string(metaJson, "agent").orElse(""));
    } catch (IllegalStateException | UnsupportedOperationException ex) {
      throw new InvalidProjectException("invalid project: " + ex.getMessage(), ex);
    }
    return Project.create(stage, sprites.build(), monitors.build(), extensions.build(), meta);
  }

  private static Target readTarget(JsonObject json) throws InvalidProjectException {
    Optional<String> optionalName;
    try {
      optionalName = string(json, "name");
    } catch (IllegalStateException | UnsupportedOperationException ex) {
      throw new InvalidProjectException("invalid project: a target name is not a string", ex);
    }
    if (!optionalName.isPresent()) {
      throw new InvalidProjectException("invalid project: a target has no name");
    }
    String name = optionalName.get();

    try {
      boolean isStage = bool(json, "isStage", false);
      Target.Builder target = isStage ? Target.stageBuilder(name) : Target.spriteBuilder(name);

      for (Map.Entry<String, JsonElement> entry : object(json, "variables").entrySet()) {
        // Cloud variables carry a third element.
        JsonArray variable = entry.getValue().getAsJsonArray();
        target.addVariable(
            Target.Variable.create(
                entry.getKey(),
                variable.get(0).getAsString(),
                variable.get(1).getAsJsonPrimitive()));
      }
      for (Map.Entry<String, JsonElement> entry : object(json, "lists").entrySet()) {
        JsonArray list = entry.getValue().getAsJsonArray();
        List<JsonPrimitive> contents = new ArrayList<>();
        for (JsonElement item : list.get(1).getAsJsonArray()) {
          contents.add(item.getAsJsonPrimitive());
        }
        target.addList(
            Target.ListVariable.create(entry.getKey(), list.get(0).getAsString(), contents));
      }
      for (Map.Entry<String, JsonElement> entry : object(json, "broadcasts").entrySet()) {
        target.broadcastsBuilder().put(entry.getKey(), entry.getValue().getAsString());
      }

      BlockGraph blocks = readBlocks(name, object(json, "blocks"));
      target.setBlocks(blocks);
      target.proceduresBuilder().addAll(procedures(name, blocks));

      ImmutableList.Builder<Asset.Costume> costumes = ImmutableList.builder();
      for (JsonElement costume : array(json, "costumes")) {
        costumes.add(readCostume(costume.getAsJsonObject()));
      }
      ImmutableList.Builder<Asset.Sound> sounds = ImmutableList.builder();
      for (JsonElement sound : array(json, "sounds")) {
        sounds.add(readSound(sound.getAsJsonObject()));
      }
      target
          .setCostumes(costumes.build())
          .setSounds(sounds.build())
          .setCurrentCostume((int) number(json, "currentCostume", 0))
          .setVolume(number(json, "volume", 100))
          .setLayerOrder((int) number(json, "layerOrder", 0));

      if (isStage) {
        target
            .setTempo(number(json, "tempo", 60))
            .setVideoTransparency(number(json, "videoTransparency", 50))
            .setVideoState(string(json, "videoState").orElse("on"))
            .setTextToSpeechLanguage(string(json, "textToSpeechLanguage"));
      } else {
        target
            .setVisible(bool(json, "visible", true))
            .setX(number(json, "x", 0))
            .setY(number(json, "y", 0))
            .setSize(number(json, "size", 100))
            .setDirection(number(json, "direction", 90))
            .setDraggable(bool(json, "draggable", false))
            .setRotationStyle(string(json, "rotationStyle").orElse("all around"));
      }
      return target.build();
    } catch (IllegalStateException
        | IllegalArgumentException
        | UnsupportedOperationException
        | IndexOutOfBoundsException ex) {
      throw InvalidProjectException.inTarget(name, "malformed target: " + ex.getMessage(), ex);
    }
  }

  private static BlockGraph readBlocks(String target, JsonObject json)
      throws InvalidProjectException {
    List<Block> blocks = new ArrayList<>();
    for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
      if (entry.getValue().isJsonArray()) {
        // A variable or list reporter dropped on the canvas on its own.
        logger.fine(String.format("%s: skipping loose reporter %s", target, entry.getKey()));
        continue;
      }
      if (!entry.getValue().isJsonObject()) {
        throw InvalidProjectException.inBlock(target, entry.getKey(), "not a JSON object");
      }
      blocks.add(readBlock(target, entry.getKey(), entry.getValue().getAsJsonObject()));
    }
    try {
      return BlockGraph.of(blocks);
    } catch (IllegalArgumentException ex) {
      throw InvalidProjectException.inTarget(target, "duplicate block ids", ex);
    }
  }

  private static Block readBlock(String target, String id, JsonObject json)
      throws InvalidProjectException {
    JsonElement opcode = json.get("opcode");
    if (opcode == null || !opcode.isJsonPrimitive()) {
      throw InvalidProjectException.inBlock(target, id, "missing opcode");
    }
    try {
      boolean shadow = bool(json, "shadow", false);
      boolean topLevel = bool(json, "topLevel", false);
      Block.Builder block =
          Block.builder(
                  id,
                  opcode.getAsString(),
                  shadow ? Block.Kind.SHADOW_MENU : Opcodes.kindOf(opcode.getAsString()))
              .setParent(string(json, "parent").orElse(null))
              .setNext(string(json, "next").orElse(null))
              .setTopLevel(topLevel);
      if (topLevel) {
        block.setPosition(
            (int) Math.round(number(json, "x", 0)), (int) Math.round(number(json, "y", 0)));
      }

      for (Map.Entry<String, JsonElement> input : object(json, "inputs").entrySet()) {
        Optional<InputValue> value = readInput(target, id, input.getKey(), input.getValue());
        if (value.isPresent()) block.putInput(input.getKey(), value.get());
      }
      for (Map.Entry<String, JsonElement> field : object(json, "fields").entrySet()) {
        JsonArray array = field.getValue().getAsJsonArray();
        String value = array.get(0).isJsonNull() ? "" : array.get(0).getAsString();
        Optional<String> fieldId =
            array.size() > 1 && !array.get(1).isJsonNull()
                ? Optional.of(array.get(1).getAsString())
                : Optional.empty();
        block.putField(field.getKey(), Block.Field.of(value, fieldId));
      }

      JsonElement mutation = json.get("mutation");
      if (mutation != null && mutation.isJsonObject()) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> attribute : mutation.getAsJsonObject().entrySet()) {
          if (attribute.getKey().equals(MUTATION_TAG)
              || attribute.getKey().equals(MUTATION_CHILDREN)
              || !attribute.getValue().isJsonPrimitive()) {
            continue;
          }
          attributes.put(attribute.getKey(), attribute.getValue().getAsString());
        }
        block.setMutation(Block.Mutation.of(attributes));
      }
      return block.build();
    } catch (IllegalStateException
        | IllegalArgumentException
        | UnsupportedOperationException
        | IndexOutOfBoundsException ex) {
      throw InvalidProjectException.inBlock(target, id, ex.getMessage());
    }
  }

  // Empty for an empty substack or condition: [2, null].
  private static Optional<InputValue> readInput(
      String target, String blockId, String name, JsonElement json)
      throws InvalidProjectException {
    if (!json.isJsonArray() || json.getAsJsonArray().size() < 2) {
      throw InvalidProjectException.inBlock(target, blockId, "malformed input " + name);
    }
    JsonArray array = json.getAsJsonArray();
    int shadowKind = array.get(0).getAsInt();
    JsonElement value = array.get(1);
    if (value.isJsonNull()) return Optional.empty();
    if (value.isJsonArray()) {
      return Optional.of(readPrimitive(target, blockId, value.getAsJsonArray()));
    }

    String id = value.getAsString();
    switch (shadowKind) {
      case SHADOW_ONLY:
        return Optional.of(InputValue.menu(id));
      case NO_SHADOW:
        return Optional.of(InputValue.block(id));
      case OBSCURED:
        {
          JsonElement shadow = array.size() > 2 ? array.get(2) : JsonNull.INSTANCE;
          if (shadow.isJsonNull()) return Optional.of(InputValue.block(id));
          InputValue covered =
              shadow.isJsonArray()
                  ? readPrimitive(target, blockId, shadow.getAsJsonArray())
                  : InputValue.menu(shadow.getAsString());
          return Optional.of(InputValue.shadowedBlock(id, covered));
        }
      default:
        throw InvalidProjectException.inBlock(
            target, blockId, String.format("input %s has shadow kind %d", name, shadowKind));
    }
  }

  private static InputValue readPrimitive(String target, String blockId, JsonArray array)
      throws InvalidProjectException {
    int code = array.get(0).getAsInt();
    switch (code) {
      case InputValue.MATH_NUMBER:
      case InputValue.POSITIVE_NUMBER:
      case InputValue.WHOLE_NUMBER:
      case InputValue.INTEGER:
      case InputValue.ANGLE:
      case InputValue.COLOR:
      case InputValue.TEXT:
        return InputValue.Literal.of(
            code, array.get(1).isJsonNull() ? "" : array.get(1).getAsString());
      case InputValue.BROADCAST:
        return InputValue.broadcast(array.get(1).getAsString(), array.get(2).getAsString());
      case InputValue.VARIABLE:
        return InputValue.variable(array.get(1).getAsString(), array.get(2).getAsString());
      case InputValue.LIST:
        return InputValue.list(array.get(1).getAsString(), array.get(2).getAsString());
      default:
        throw InvalidProjectException.inBlock(target, blockId, "unknown primitive code " + code);
    }
  }

  // Definitions without a usable prototype are left to the decompiler's integrity check.
  private static ImmutableList<CustomProcedure> procedures(String target, BlockGraph blocks)
      throws InvalidProjectException {
    ImmutableList.Builder<CustomProcedure> procedures = ImmutableList.builder();
    for (Block definition : blocks.blocks().values()) {
      if (!definition.opcode().equals(Opcodes.PROCEDURES_DEFINITION)) continue;
      Optional<Block> prototype = prototypeOf(definition, blocks);
      if (!prototype.isPresent() || !prototype.get().mutation().isPresent()) continue;
      Block.Mutation mutation = prototype.get().mutation().get();
      if (!mutation.proccode().isPresent()) continue;

      ImmutableList<String> ids = mutation.argumentIds().orElse(ImmutableList.of());
      ImmutableList<String> names = mutation.argumentNames().orElse(ids);
      if (names.size() != ids.size()) {
        throw InvalidProjectException.inBlock(
            target, prototype.get().id(), "argument ids and names differ in length");
      }
      ImmutableList<String> defaults =
          mutation
              .argumentDefaults()
              .filter(d -> d.size() == ids.size())
              .orElse(ImmutableList.copyOf(Collections.nCopies(ids.size(), "")));
      procedures.add(
          CustomProcedure.builder()
              .setName(CustomProcedure.nameOf(mutation.proccode().get()))
              .setProccode(mutation.proccode().get())
              .setArgumentIds(ids)
              .setArgumentNames(names)
              .setArgumentDefaults(defaults)
              .setDefinitionId(definition.id())
              .setPrototypeId(prototype.get().id())
              .setWarp(mutation.warp())
              .build());
    }
    return procedures.build();
  }

  static Optional<Block> prototypeOf(Block definition, BlockGraph blocks) {
    Optional<InputValue> input = definition.input("custom_block");
    if (!input.isPresent() || input.get().referencedBlocks().isEmpty()) return Optional.empty();
    return blocks.get(input.get().referencedBlocks().get(0));
  }

  private static Asset.Costume readCostume(JsonObject json) {
    return Asset.Costume.create(
        json.get("name").getAsString(),
        json.get("assetId").getAsString(),
        json.get("dataFormat").getAsString(),
        (int) number(json, "bitmapResolution", 1),
        number(json, "rotationCenterX", 0),
        number(json, "rotationCenterY", 0));
  }

  private static Asset.Sound readSound(JsonObject json) {
    return Asset.Sound.create(
        json.get("name").getAsString(),
        json.get("assetId").getAsString(),
        json.get("dataFormat").getAsString(),
        (int) number(json, "rate", 48000),
        (int) number(json, "sampleCount", 0));
  }

  private static JsonObject object(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? new JsonObject() : value.getAsJsonObject();
  }

  private static JsonArray array(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? new JsonArray() : value.getAsJsonArray();
  }

  private static Optional<String> string(JsonObject json, String key) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull()
        ? Optional.empty()
        : Optional.of(value.getAsString());
  }

  private static double number(JsonObject json, String key, double fallback) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? fallback : value.getAsDouble();
  }

  private static boolean bool(JsonObject json, String key, boolean fallback) {
    JsonElement value = json.get(key);
    return value == null || value.isJsonNull() ? fallback : value.getAsBoolean();
  }

  private ProjectJson() {}
}
