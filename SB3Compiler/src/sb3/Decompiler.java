package sb3;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonPrimitive;

public final class Decompiler {
  private static final Logger logger = Logger.getLogger(Decompiler.class.getName());

  private static final String INDENT = "    ";

  private static final Pattern INTEGER = Pattern.compile("-?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield");

  // Blocks whose rendering needs parentheses when nested in another operator.
  private static final ImmutableSet<String> COMPARISONS =
      ImmutableSet.of(Opcodes.GT, Opcodes.LT, Opcodes.EQUALS, Opcodes.NOT);

  public static String sanitize(String name) {
    return CharMatcher.forPredicate(Character::isLetterOrDigit)
        .or(CharMatcher.is('_'))
        .negate()
        .replaceFrom(name, '_');
  }

  public static String toIdentifier(String name) {
    String identifier = sanitize(name);
    if (identifier.isEmpty()) return "_";
    if (Character.isDigit(identifier.charAt(0))) identifier = "_" + identifier;
    if (KEYWORDS.contains(identifier)) identifier = identifier + "_";
    return identifier;
  }

  public String decompile(Project project) throws InvalidProjectException {
    List<String> lines = new ArrayList<>();

    Target stage = project.stage();
    checkTarget(stage);
    declarations(stage, 0, lines);
    if (!lines.isEmpty()) lines.add("");

    // Scripts of the stage itself become module-level functions.
    ScriptWriter stageScripts = new ScriptWriter(stage, false);
    for (Block hat : findHatBlocks(stage)) {
      stageScripts.convertScript(hat, 0, lines);
      lines.add("");
    }

    for (Target sprite : project.sprites()) {
      lines.addAll(decompileSprite(sprite));
      lines.add("");
    }
    logger.info(
        String.format(
            "decompiled %d sprites into %d lines", project.sprites().size(), lines.size()));
    return Joiner.on('\n').join(lines);
  }

  public ImmutableList<String> decompileSprite(Target sprite) throws InvalidProjectException {
    checkTarget(sprite);
    List<String> lines = new ArrayList<>();
    lines.add(String.format("class %s:", toIdentifier(sprite.name())));
    declarations(sprite, 1, lines);

    ImmutableList<Block> hats = findHatBlocks(sprite);
    if (hats.isEmpty()) {
      if (lines.size() == 1) lines.add(INDENT + "pass");
      return ImmutableList.copyOf(lines);
    }

    ScriptWriter writer = new ScriptWriter(sprite, true);
    for (Block hat : hats) {
      if (lines.size() > 1) lines.add("");
      writer.convertScript(hat, 1, lines);
    }
    return ImmutableList.copyOf(lines);
  }

  public static ImmutableList<Block> findHatBlocks(Target target) {
    return target.blocks().topLevelBlocks().stream()
        .filter(b -> Opcodes.isHat(b.opcode()))
        .collect(ImmutableList.toImmutableList());
  }

  // Rejects graphs no source could have produced.
  static void checkTarget(Target target) throws InvalidProjectException {
    target.blocks().checkIntegrity(target.name());
    for (Block block : target.blocks().blocks().values()) {
      switch (block.opcode()) {
        case Opcodes.PROCEDURES_DEFINITION:
          {
            Optional<Block> prototype = ProjectJson.prototypeOf(block, target.blocks());
            if (!prototype.isPresent()) {
              throw InvalidProjectException.inBlock(
                  target.name(), block.id(), "procedure definition has no prototype");
            }
            if (!prototype.get().mutation().flatMap(Block.Mutation::proccode).isPresent()) {
              throw InvalidProjectException.inBlock(
                  target.name(), prototype.get().id(), "procedure prototype has no proccode");
            }
            break;
          }
        case Opcodes.PROCEDURES_CALL:
          if (!block.mutation().flatMap(Block.Mutation::proccode).isPresent()) {
            throw InvalidProjectException.inBlock(
                target.name(), block.id(), "procedure call has no proccode");
          }
          break;
        case Opcodes.VARIABLE:
        case Opcodes.SET_VARIABLE_TO:
        case Opcodes.CHANGE_VARIABLE_BY:
        case "data_showvariable":
        case "data_hidevariable":
          requireField(target, block, CallTable.VARIABLE);
          break;
        default:
          if (block.opcode().startsWith("data_") && block.opcode().contains("list")) {
            requireField(target, block, CallTable.LIST);
          }
          break;
      }
    }
  }

  private static void requireField(Target target, Block block, String field)
      throws InvalidProjectException {
    if (!block.field(field).isPresent()) {
      throw InvalidProjectException.inBlock(
          target.name(), block.id(), String.format("%s has no %s field", block.opcode(), field));
    }
  }

  private static void declarations(Target target, int indent, List<String> lines) {
    String prefix = prefix(indent);
    for (Target.Variable variable : target.variables().values()) {
      lines.add(
          String.format(
              "%s%s = %s", prefix, toIdentifier(variable.name()), constant(variable.value())));
    }
    for (Target.ListVariable list : target.lists().values()) {
      List<String> items = new ArrayList<>();
      list.contents().forEach(item -> items.add(constant(item)));
      lines.add(
          String.format(
              "%s%s = [%s]", prefix, toIdentifier(list.name()), Joiner.on(", ").join(items)));
    }
  }

  static String constant(JsonPrimitive value) {
    if (value.isBoolean()) return value.getAsBoolean() ? "True" : "False";
    return literal(value.getAsString());
  }

  static String literal(String text) {
    Optional<String> number = number(text);
    return number.isPresent() ? number.get() : quote(text);
  }

  static Optional<String> number(String text) {
    String trimmed = text.trim();
    if (INTEGER.matcher(trimmed).matches()) {
      return Optional.of(new BigInteger(trimmed).toString());
    }
    if (DECIMAL.matcher(trimmed).matches()) return Optional.of(trimmed);
    return Optional.empty();
  }

  static String quote(String text) {
    StringBuilder sb = new StringBuilder("\"");
    for (char c : text.toCharArray()) {
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
          break;
      }
    }
    return sb.append('"').toString();
  }

  private static String prefix(int depth) {
    return Strings.repeat(INDENT, depth);
  }

  private static final class ScriptWriter {
    private final Target target;
    private final BlockGraph blocks;
    private final boolean methods;
    // Opcodes of unknown reporters met while rendering the current line.
    private final List<String> unknown = new ArrayList<>();

    ScriptWriter(Target target, boolean methods) {
      this.target = target;
      this.blocks = target.blocks();
      this.methods = methods;
    }

    void convertScript(Block hat, int indent, List<String> lines) throws InvalidProjectException {
      String prefix = prefix(indent);
      List<String> params = new ArrayList<>();
      if (methods) params.add("self");
      String name;
      if (hat.opcode().equals(Opcodes.PROCEDURES_DEFINITION)) {
        CustomProcedure procedure = definedProcedure(hat);
        name = procedureMethodName(procedure);
        procedure.argumentNames().forEach(p -> params.add(toIdentifier(p)));
      } else {
        Optional<EventHat> event = EventHat.fromBlock(hat);
        if (!event.isPresent()) {
          throw InvalidProjectException.inBlock(
              target.name(), hat.id(), "unrecognized hat " + hat.opcode());
        }
        name = event.get().methodName();
      }
      lines.add(String.format("%sdef %s(%s):", prefix, name, Joiner.on(", ").join(params)));
      body(hat.next(), indent + 1, lines);
    }

    private CustomProcedure definedProcedure(Block definition) throws InvalidProjectException {
      for (CustomProcedure procedure : target.procedures()) {
        if (procedure.definitionId().equals(definition.id())) return procedure;
      }
      throw InvalidProjectException.inBlock(
          target.name(), definition.id(), "procedure definition without a signature");
    }

    private static String procedureMethodName(CustomProcedure procedure) {
      return ProcedureResolver.methodName(toIdentifier(procedure.name()));
    }

    private void body(Optional<String> startId, int indent, List<String> lines) {
      List<String> converted =
          startId.isPresent() ? convertBlockChain(startId.get(), indent) : ImmutableList.of();
      lines.addAll(converted);
      if (converted.stream().allMatch(line -> line.trim().startsWith("#"))) {
        lines.add(prefix(indent) + "pass");
      }
    }

    List<String> convertBlockChain(String startId, int indent) {
      List<String> lines = new ArrayList<>();
      for (Block block : blocks.chain(startId)) {
        convertBlock(block, indent, lines);
      }
      return lines;
    }

    void convertBlock(Block block, int indent, List<String> lines) {
      String prefix = prefix(indent);
      switch (block.opcode()) {
        case Opcodes.FOREVER:
          lines.add(prefix + "while True:");
          body(substack(block, "SUBSTACK"), indent + 1, lines);
          return;
        case Opcodes.REPEAT:
          lines.add(line(prefix, String.format("for i in range(%s):", value(block, "TIMES"))));
          body(substack(block, "SUBSTACK"), indent + 1, lines);
          return;
        case Opcodes.REPEAT_UNTIL:
          lines.add(line(prefix, String.format("while not (%s):", condition(block))));
          body(substack(block, "SUBSTACK"), indent + 1, lines);
          return;
        case Opcodes.IF:
          lines.add(line(prefix, String.format("if %s:", condition(block))));
          body(substack(block, "SUBSTACK"), indent + 1, lines);
          return;
        case Opcodes.IF_ELSE:
          lines.add(line(prefix, String.format("if %s:", condition(block))));
          body(substack(block, "SUBSTACK"), indent + 1, lines);
          lines.add(prefix + "else:");
          body(substack(block, "SUBSTACK2"), indent + 1, lines);
          return;
        case Opcodes.SET_VARIABLE_TO:
          lines.add(
              line(
                  prefix,
                  String.format("%s = %s", variable(block), value(block, "VALUE"))));
          return;
        case Opcodes.CHANGE_VARIABLE_BY:
          {
            String delta = value(block, "VALUE");
            String statement =
                delta.startsWith("-") && number(delta).isPresent()
                    ? String.format("%s -= %s", variable(block), delta.substring(1))
                    : String.format("%s += %s", variable(block), delta);
            lines.add(line(prefix, statement));
            return;
          }
        case Opcodes.PROCEDURES_CALL:
          lines.add(line(prefix, procedureCall(block)));
          return;
        default:
          break;
      }

      Optional<CallTable.CallSpec> spec = specFor(block);
      if (!spec.isPresent()) {
        logger.fine(String.format("%s: unknown block %s", target.name(), block.opcode()));
        lines.add(String.format("%s# unknown block: %s", prefix, block.opcode()));
        return;
      }
      lines.add(line(prefix, call(block, spec.get())));
    }

    // Appends the opcodes of unknown reporters on the line as a trailing comment.
    private String line(String prefix, String statement) {
      String line = prefix + statement;
      if (!unknown.isEmpty()) {
        line += "  # unknown: " + Joiner.on(", ").join(unknown);
        unknown.clear();
      }
      return line;
    }

    private Optional<String> substack(Block block, String input) {
      return block
          .input(input)
          .map(InputValue::referencedBlocks)
          .filter(refs -> !refs.isEmpty())
          .map(refs -> refs.get(0));
    }

    private String variable(Block block) {
      return toIdentifier(block.field(CallTable.VARIABLE).get().value());
    }

    private String procedureCall(Block block) {
      String proccode = block.mutation().flatMap(Block.Mutation::proccode).get();
      Optional<CustomProcedure> procedure = target.procedureByProccode(proccode);
      String name =
          procedure.isPresent()
              ? procedureMethodName(procedure.get())
              : ProcedureResolver.methodName(toIdentifier(CustomProcedure.nameOf(proccode)));
      ImmutableList<String> argumentIds =
          block.mutation().flatMap(Block.Mutation::argumentIds).orElse(ImmutableList.of());
      List<String> args = new ArrayList<>();
      for (String argumentId : argumentIds) {
        args.add(block.input(argumentId).isPresent() ? value(block, argumentId) : quote(""));
      }
      String receiver = methods ? "self." : "";
      return String.format("%s%s(%s)", receiver, name, Joiner.on(", ").join(args));
    }

    // Field values tell apart specs sharing an opcode.
    private Optional<CallTable.CallSpec> specFor(Block block) {
      ImmutableList<CallTable.CallSpec> specs = CallTable.forOpcode(block.opcode());
      if (specs.isEmpty()) return Optional.empty();
      for (CallTable.CallSpec spec : specs) {
        if (!spec.fieldValue().isPresent()) continue;
        String expected = normalizeField(spec.fieldValue().get());
        Optional<Block.Field> field = block.field(spec.field().get());
        if (field.isPresent() && normalizeField(field.get().value()).equals(expected)) {
          return Optional.of(spec);
        }
      }
      return Optional.of(specs.get(0));
    }

    private static String normalizeField(String value) {
      return CharMatcher.whitespace().removeFrom(value).toLowerCase();
    }

    private String call(Block block, CallTable.CallSpec spec) {
      List<String> args = new ArrayList<>();
      switch (spec.shape()) {
        case NO_ARGUMENT_STATEMENT:
        case FIELD_REPORTER:
          break;
        case VALUE_REPORTER:
        case BOOLEAN_REPORTER:
        case SINGLE_ARGUMENT_STATEMENT:
        case MULTI_ARGUMENT_STATEMENT:
        case COLOR_REPORTER:
        case MATH_OPERATION:
          spec.inputs().forEach(input -> args.add(value(block, input)));
          break;
        case FIELD_INPUT_STATEMENT:
          args.add(fieldArgument(block, spec));
          spec.inputs().forEach(input -> args.add(value(block, input)));
          break;
        case MENU_STATEMENT:
          spec.inputs().forEach(input -> args.add(value(block, input)));
          args.add(menu(block, spec.menu().get()));
          break;
        case MENU_REPORTER:
          args.add(menu(block, spec.menu().get()));
          break;
        case FIELD_STATEMENT:
          args.add(fieldArgument(block, spec));
          break;
        case RANDOM:
          args.add(value(block, "FROM"));
          args.add(value(block, "TO"));
          break;
        case BROADCAST:
          args.add(value(block, "BROADCAST_INPUT"));
          break;
        case LIST_OPERATION:
          for (String input : spec.inputs()) {
            args.add(
                input.equals(CallTable.LIST)
                    ? quote(block.field(CallTable.LIST).get().value())
                    : value(block, input));
          }
          break;
        case VARIABLE_VISIBILITY:
          args.add(quote(block.field(CallTable.VARIABLE).get().value()));
          break;
        case PROPERTY_OF:
          args.add(fieldArgument(block, spec));
          args.add(menu(block, spec.menu().get()));
          break;
        case WAIT_UNTIL:
          args.add(condition(block));
          break;
        default:
          throw new AssertionError("Unknown shape: " + spec.shape());
      }
      return String.format("%s(%s)", spec.name(), Joiner.on(", ").join(args));
    }

    private String fieldArgument(Block block, CallTable.CallSpec spec) {
      String value = block.field(spec.field().get()).map(Block.Field::value).orElse("");
      return quote(spec.uppercaseField() ? value.toLowerCase() : value);
    }

    private String menu(Block block, CallTable.MenuSpec menu) {
      Optional<InputValue> input = block.input(menu.input());
      if (!input.isPresent()) return quote("");
      if (input.get().type() != InputValue.Type.SHADOW_REF) return render(input.get());
      Optional<Block> shadow = blocks.get(input.get().<InputValue.ShadowRef>cast().id());
      String value =
          shadow.flatMap(s -> s.field(menu.field())).map(Block.Field::value).orElse("");
      return quote(menu.decode(value));
    }

    private String condition(Block block) {
      Optional<InputValue> input = block.input("CONDITION");
      // An empty condition slot is false.
      return input.isPresent() ? render(input.get()) : "False";
    }

    private String value(Block block, String input) {
      Optional<InputValue> value = block.input(input);
      return value.isPresent() ? render(value.get()) : "0";
    }

    // Parenthesizes comparisons nested inside another operator.
    private String operand(Block block, String input) {
      Optional<InputValue> value = block.input(input);
      if (!value.isPresent()) return "0";
      String rendered = render(value.get());
      ImmutableList<String> refs = value.get().referencedBlocks();
      if (!refs.isEmpty()
          && blocks.get(refs.get(0)).map(b -> COMPARISONS.contains(b.opcode())).orElse(false)) {
        return "(" + rendered + ")";
      }
      return rendered;
    }

    private String render(InputValue value) {
      switch (value.type()) {
        case NUMBER_LITERAL:
          {
            String text = value.<InputValue.Literal>cast().value();
            if (text.isEmpty()) return "0";
            return literal(text);
          }
        case STRING_LITERAL:
          {
            // Boolean constants compile to their printed names.
            String text = value.<InputValue.Literal>cast().value();
            return text.equals("True") || text.equals("False") ? text : quote(text);
          }
        case COLOR_LITERAL:
          return quote(value.<InputValue.Literal>cast().value());
        case BROADCAST_LITERAL:
          return quote(value.<InputValue.BroadcastLiteral>cast().name());
        case VARIABLE_LITERAL:
        case LIST_LITERAL:
          return toIdentifier(value.<InputValue.VariableLiteral>cast().name());
        case BLOCK_REF:
          return convertReporter(value.<InputValue.BlockRef>cast().id());
        case SHADOW_BLOCK_REF:
          return convertReporter(value.<InputValue.ShadowBlockRef>cast().id());
        case SHADOW_REF:
          return convertReporter(value.<InputValue.ShadowRef>cast().id());
        default:
          throw new AssertionError("Unknown input type: " + value.type());
      }
    }

    String convertReporter(String id) {
      Optional<Block> found = blocks.get(id);
      if (!found.isPresent()) return "0";
      Block block = found.get();
      switch (block.opcode()) {
        case Opcodes.VARIABLE:
          return variable(block);
        case Opcodes.LIST_CONTENTS:
          return toIdentifier(block.field(CallTable.LIST).get().value());
        case Opcodes.ARGUMENT_REPORTER_STRING_NUMBER:
        case Opcodes.ARGUMENT_REPORTER_BOOLEAN:
          return toIdentifier(block.field("VALUE").map(Block.Field::value).orElse(""));
        case Opcodes.ADD:
          return infix(block, "+", "NUM1", "NUM2");
        case Opcodes.SUBTRACT:
          return infix(block, "-", "NUM1", "NUM2");
        case Opcodes.MULTIPLY:
          return infix(block, "*", "NUM1", "NUM2");
        case Opcodes.DIVIDE:
          return infix(block, "/", "NUM1", "NUM2");
        case Opcodes.MOD:
          return infix(block, "%", "NUM1", "NUM2");
        case Opcodes.GT:
          return comparison(block, ">");
        case Opcodes.LT:
          return comparison(block, "<");
        case Opcodes.EQUALS:
          return comparison(block, "==");
        case Opcodes.AND:
          return infix(block, "and", "OPERAND1", "OPERAND2");
        case Opcodes.OR:
          return infix(block, "or", "OPERAND1", "OPERAND2");
        case Opcodes.NOT:
          return "not " + operand(block, "OPERAND");
        default:
          break;
      }

      if (block.shadow()) return shadowValue(block);

      Optional<CallTable.CallSpec> spec = specFor(block);
      if (!spec.isPresent()) {
        logger.fine(String.format("%s: unknown reporter %s", target.name(), block.opcode()));
        unknown.add(block.opcode());
        return "0";
      }
      return call(block, spec.get());
    }

    private String infix(Block block, String operator, String lhs, String rhs) {
      return String.format(
          "(%s %s %s)", operand(block, lhs), operator, operand(block, rhs));
    }

    private String comparison(Block block, String operator) {
      return String.format(
          "%s %s %s", operand(block, "OPERAND1"), operator, operand(block, "OPERAND2"));
    }

    // A menu reached outside its usual slot, e.g. under a reporter: its decoded field value.
    private String shadowValue(Block shadow) {
      if (shadow.fields().isEmpty()) return quote("");
      Block.Field field = shadow.fields().values().iterator().next();
      for (CallTable.CallSpec spec : CallTable.all().values()) {
        if (spec.menu().isPresent() && spec.menu().get().opcode().equals(shadow.opcode())) {
          return quote(spec.menu().get().decode(field.value()));
        }
      }
      return quote(field.value());
    }
  }
}
