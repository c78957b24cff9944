package sb3;

import java.util.Comparator;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Reads the JSON dump of a Python syntax tree into {@link SourceModule} nodes.
 *
 * <p>Every node is an object whose {@code "type"} names the node kind, with {@code lineno} and
 * {@code col_offset} positions. Node kinds outside the supported vocabulary are kept as
 * {@link Statement.Unsupported} or {@link Expression.Unsupported} nodes rather than rejected.
 */
public final class SourceReader {

  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber, column + 1);
    }
  }

  private final String file;
  private final String content;

  public SourceReader(String file, String content) {
    this.file = file;
    this.content = content;
  }

  public SourceModule read() throws CompilerException {
    Pos start = new Pos(file, 1, 0);
    JsonElement root;
    try {
      root = JsonParser.parseString(content);
    } catch (JsonParseException ex) {
      throw new CompilerException(start, "malformed syntax tree: " + ex.getMessage());
    }
    if (!root.isJsonObject()) throw new CompilerException(start, "expected a Module node");

    JsonObject module = root.getAsJsonObject();
    if (!getType(module).equals("Module")) {
      throw new CompilerException(start, "expected a Module node, found " + getType(module));
    }
    return new SourceModule(parseStatements(module, "body"), start);
  }

  private Pos pos(JsonObject node) {
    return new Pos(file, getInt(node, "lineno", 0), getInt(node, "col_offset", 0));
  }

  private ImmutableList<Statement> parseStatements(JsonObject parent, String attr)
      throws CompilerException {
    ImmutableList.Builder<Statement> builder = ImmutableList.builder();
    for (JsonElement element : getArray(parent, attr)) {
      builder.add(parseStatement(asObject(element, parent)));
    }
    return builder.build();
  }

  private Statement parseStatement(JsonObject node) throws CompilerException {
    Pos pos = pos(node);
    String type = getType(node);
    switch (type) {
      case "ClassDef":
        return new Statement.ClassDef(getString(node, "name"), parseStatements(node, "body"), pos);
      case "FunctionDef":
        {
          JsonObject arguments = asObject(getAttr(node, "args"), node);
          ImmutableList.Builder<String> params = ImmutableList.builder();
          for (JsonElement arg : getArray(arguments, "args")) {
            params.add(getString(asObject(arg, arguments), "arg"));
          }
          return new Statement.FunctionDef(
              getString(node, "name"), params.build(), parseStatements(node, "body"), pos);
        }
      case "Assign":
        return new Statement.Assign(
            parseExpressions(node, "targets"), parseExpression(getObject(node, "value")), pos);
      case "AugAssign":
        {
          String opType = getType(getObject(node, "op"));
          Optional<Expression.BinaryOperator> op =
              Expression.BinaryOperator.fromNodeType(opType);
          if (!op.isPresent()) return new Statement.Unsupported("AugAssign(" + opType + ")", pos);
          return new Statement.AugAssign(
              parseExpression(getObject(node, "target")),
              op.get(),
              parseExpression(getObject(node, "value")),
              pos);
        }
      case "For":
        return new Statement.For(
            parseExpression(getObject(node, "target")),
            parseExpression(getObject(node, "iter")),
            parseStatements(node, "body"),
            pos);
      case "While":
        return new Statement.While(
            parseExpression(getObject(node, "test")), parseStatements(node, "body"), pos);
      case "If":
        return new Statement.If(
            parseExpression(getObject(node, "test")),
            parseStatements(node, "body"),
            node.has("orelse") ? parseStatements(node, "orelse") : ImmutableList.of(),
            pos);
      case "Expr":
        return new Statement.ExpressionStatement(parseExpression(getObject(node, "value")), pos);
      case "Pass":
        return new Statement.Pass(pos);
      default:
        return new Statement.Unsupported(type, pos);
    }
  }

  private ImmutableList<Expression> parseExpressions(JsonObject parent, String attr)
      throws CompilerException {
    ImmutableList.Builder<Expression> builder = ImmutableList.builder();
    for (JsonElement element : getArray(parent, attr)) {
      builder.add(parseExpression(asObject(element, parent)));
    }
    return builder.build();
  }

  private Expression parseExpression(JsonObject node) throws CompilerException {
    Pos pos = pos(node);
    String type = getType(node);
    switch (type) {
      case "Constant":
        return parseConstant(node, pos);
      case "Name":
        return new Expression.Name(getString(node, "id"), pos);
      case "Attribute":
        {
          // `self.attr` names a sprite variable.
          JsonObject value = getObject(node, "value");
          if (getType(value).equals("Name") && getString(value, "id").equals("self")) {
            return new Expression.Name(getString(node, "attr"), pos);
          }
          return new Expression.Unsupported("Attribute", pos);
        }
      case "Call":
        return parseCall(node, pos);
      case "BinOp":
        {
          String opType = getType(getObject(node, "op"));
          Optional<Expression.BinaryOperator> op =
              Expression.BinaryOperator.fromNodeType(opType);
          if (!op.isPresent()) return new Expression.Unsupported("BinOp(" + opType + ")", pos);
          return new Expression.Binary(
              parseExpression(getObject(node, "left")),
              op.get(),
              parseExpression(getObject(node, "right")),
              pos);
        }
      case "BoolOp":
        {
          String opType = getType(getObject(node, "op"));
          Optional<Expression.BooleanOperator> op =
              Expression.BooleanOperator.fromNodeType(opType);
          if (!op.isPresent()) return new Expression.Unsupported("BoolOp(" + opType + ")", pos);
          return new Expression.BooleanChain(op.get(), parseExpressions(node, "values"), pos);
        }
      case "Compare":
        {
          ImmutableList.Builder<Expression.CompareOperator> ops = ImmutableList.builder();
          for (JsonElement op : getArray(node, "ops")) {
            String opType = getType(asObject(op, node));
            Optional<Expression.CompareOperator> compareOp =
                Expression.CompareOperator.fromNodeType(opType);
            if (!compareOp.isPresent()) {
              return new Expression.Unsupported("Compare(" + opType + ")", pos);
            }
            ops.add(compareOp.get());
          }
          ImmutableList<Expression> comparators = parseExpressions(node, "comparators");
          if (comparators.isEmpty()) {
            throw new CompilerException(pos, "comparison without comparators");
          }
          return new Expression.Compare(
              parseExpression(getObject(node, "left")), ops.build(), comparators, pos);
        }
      case "UnaryOp":
        {
          String opType = getType(getObject(node, "op"));
          Optional<Expression.UnaryOperator> op = Expression.UnaryOperator.fromNodeType(opType);
          if (!op.isPresent()) return new Expression.Unsupported("UnaryOp(" + opType + ")", pos);
          return new Expression.Unary(op.get(), parseExpression(getObject(node, "operand")), pos);
        }
      case "List":
        return new Expression.ListLiteral(parseExpressions(node, "elts"), pos);
      default:
        return new Expression.Unsupported(type, pos);
    }
  }

  private Expression parseCall(JsonObject node, Pos pos) throws CompilerException {
    JsonObject func = getObject(node, "func");
    ImmutableList<Expression> args = parseExpressions(node, "args");
    switch (getType(func)) {
      case "Name":
        return new Expression.Call(Optional.empty(), getString(func, "id"), args, pos);
      case "Attribute":
        {
          JsonObject receiver = getObject(func, "value");
          if (getType(receiver).equals("Name")) {
            return new Expression.Call(
                Optional.of(getString(receiver, "id")), getString(func, "attr"), args, pos);
          }
          return new Expression.Unsupported("Call", pos);
        }
      default:
        return new Expression.Unsupported("Call", pos);
    }
  }

  // Accepts both {"typename": ..., "value": ...} dumps and bare JSON values.
  private Expression parseConstant(JsonObject node, Pos pos) throws CompilerException {
    JsonElement value = node.get("value");
    String typename = node.has("typename") ? getString(node, "typename") : inferTypename(value);
    try {
      switch (typename) {
        case "int":
          return new Expression.IntegerConstant(value.getAsBigInteger(), pos);
        case "float":
          return new Expression.FloatConstant(value.getAsDouble(), pos);
        case "str":
          return new Expression.StringConstant(value.getAsString(), pos);
        case "bool":
          return new Expression.BooleanConstant(value.getAsBoolean(), pos);
        case "NoneType":
          return new Expression.NoneConstant(pos);
        default:
          return new Expression.Unsupported("Constant(" + typename + ")", pos);
      }
    } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
      throw new CompilerException(pos, String.format("bad %s constant: %s", typename, value));
    }
  }

  private static String inferTypename(JsonElement value) {
    if (value == null || value.isJsonNull()) return "NoneType";
    if (!value.isJsonPrimitive()) return "unknown";
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    if (primitive.isBoolean()) return "bool";
    if (primitive.isString()) return "str";
    String raw = primitive.getAsString();
    return raw.contains(".") || raw.contains("e") || raw.contains("E") ? "float" : "int";
  }

  private String getType(JsonObject node) throws CompilerException {
    return getString(node, "type");
  }

  private JsonElement getAttr(JsonObject node, String attr) throws CompilerException {
    JsonElement element = node.get(attr);
    if (element == null || element.isJsonNull()) {
      throw new CompilerException(pos(node), String.format("missing '%s' in syntax tree", attr));
    }
    return element;
  }

  private JsonObject getObject(JsonObject node, String attr) throws CompilerException {
    return asObject(getAttr(node, attr), node);
  }

  private JsonArray getArray(JsonObject node, String attr) throws CompilerException {
    JsonElement element = getAttr(node, attr);
    if (!element.isJsonArray()) {
      throw new CompilerException(pos(node), String.format("'%s' must be a list", attr));
    }
    return element.getAsJsonArray();
  }

  private String getString(JsonObject node, String attr) throws CompilerException {
    JsonElement element = getAttr(node, attr);
    if (!element.isJsonPrimitive()) {
      throw new CompilerException(pos(node), String.format("'%s' must be a string", attr));
    }
    return element.getAsString();
  }

  private JsonObject asObject(JsonElement element, JsonObject parent) throws CompilerException {
    if (!element.isJsonObject()) {
      throw new CompilerException(pos(parent), "expected a syntax tree node, found " + element);
    }
    return element.getAsJsonObject();
  }

  private static int getInt(JsonObject node, String attr, int defaultValue) {
    JsonElement element = node.get(attr);
    if (element == null || !element.isJsonPrimitive()) return defaultValue;
    if (!element.getAsJsonPrimitive().isNumber()) return defaultValue;
    return element.getAsInt();
  }
}
