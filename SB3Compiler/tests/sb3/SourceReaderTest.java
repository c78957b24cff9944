package sb3;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sb3.PythonAst.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

public class SourceReaderTest {

  private static SourceModule parse(String json) throws CompilerException {
    return new SourceReader("/test/game.json", json).read();
  }

  @Test
  public void emptyModule() throws CompilerException {
    assertThat(read(module()).body()).isEmpty();
  }

  @Test
  public void classWithMethod() throws CompilerException {
    SourceModule module =
        read(
            module(
                classDef(
                    "Cat",
                    assign("lives", num(3)),
                    method("when_flag_clicked", run("say", str("Hi")), run("move", num(10))))));

    Statement.ClassDef cat = module.body().get(0).cast();
    assertThat(cat.name()).isEqualTo("Cat");
    assertThat(cat.body()).hasSize(2);

    Statement.FunctionDef method = cat.body().get(1).cast();
    assertThat(method.name()).isEqualTo("when_flag_clicked");
    assertThat(method.params()).containsExactly("self");
    assertThat(method.valueParams()).isEmpty();
    assertThat(method.body()).hasSize(2);

    Expression.Call say =
        method.body().get(0).<Statement.ExpressionStatement>cast().value().cast();
    assertThat(say.name()).isEqualTo("say");
    assertThat(say.args().get(0).<Expression.StringConstant>cast().value()).isEqualTo("Hi");
  }

  @Test
  public void selfAttributeReadsAsName() throws CompilerException {
    SourceModule module = read(module(expr(selfAttr("score"))));

    Expression value = module.body().get(0).<Statement.ExpressionStatement>cast().value();
    assertThat(value.type()).isEqualTo(Expression.Type.NAME);
    assertThat(value.<Expression.Name>cast().id()).isEqualTo("score");
  }

  @Test
  public void selfCallKeepsReceiver() throws CompilerException {
    SourceModule module = read(module(runSelf("jump", num(1))));

    Expression.Call call =
        module.body().get(0).<Statement.ExpressionStatement>cast().value().cast();
    assertThat(call.receiver()).hasValue("self");
    assertThat(call.name()).isEqualTo("jump");
  }

  @Test
  public void constantsWithoutTypename() throws CompilerException {
    SourceModule module =
        parse(
            "{\"type\":\"Module\",\"body\":["
                + "{\"type\":\"Expr\",\"value\":{\"type\":\"Constant\",\"value\":1.5}},"
                + "{\"type\":\"Expr\",\"value\":{\"type\":\"Constant\",\"value\":7}},"
                + "{\"type\":\"Expr\",\"value\":{\"type\":\"Constant\",\"value\":true}},"
                + "{\"type\":\"Expr\",\"value\":{\"type\":\"Constant\",\"value\":null}}]}");

    assertThat(valueType(module, 0)).isEqualTo(Expression.Type.FLOAT_CONSTANT);
    assertThat(valueType(module, 1)).isEqualTo(Expression.Type.INTEGER_CONSTANT);
    assertThat(valueType(module, 2)).isEqualTo(Expression.Type.BOOLEAN_CONSTANT);
    assertThat(valueType(module, 3)).isEqualTo(Expression.Type.NONE_CONSTANT);
  }

  @Test
  public void unknownStatementIsUnsupported() throws CompilerException {
    SourceModule module = read(module(at(4, node("Import")), at(5, node("Try"))));

    Statement.Unsupported importStatement = module.body().get(0).cast();
    assertThat(importStatement.isImport()).isTrue();
    Statement.Unsupported tryStatement = module.body().get(1).cast();
    assertThat(tryStatement.kind()).isEqualTo("Try");
    assertThat(tryStatement.pos().lineNumber()).isEqualTo(5);
  }

  @Test
  public void unknownOperatorsAreUnsupported() throws CompilerException {
    SourceModule module =
        read(
            module(
                augAssign("x", "BitOr", num(1)),
                expr(binOp(num(1), "LShift", num(2))),
                expr(node("Lambda"))));

    assertThat(module.body().get(0).type()).isEqualTo(Statement.Type.UNSUPPORTED);
    assertThat(valueType(module, 1)).isEqualTo(Expression.Type.UNSUPPORTED);
    assertThat(valueType(module, 2)).isEqualTo(Expression.Type.UNSUPPORTED);
  }

  @Test
  public void operators() throws CompilerException {
    SourceModule module =
        read(
            module(
                expr(binOp(name("a"), "FloorDiv", num(2))),
                expr(boolOp("Or", name("a"), name("b"), name("c"))),
                expr(compare(name("a"), "GtE", num(1))),
                expr(unary("USub", name("a")))));

    Expression.Binary binary = value(module, 0).cast();
    assertThat(binary.op()).isEqualTo(Expression.BinaryOperator.FLOOR_DIVIDE);
    Expression.BooleanChain chain = value(module, 1).cast();
    assertThat(chain.op()).isEqualTo(Expression.BooleanOperator.OR);
    assertThat(chain.operands()).hasSize(3);
    Expression.Compare compare = value(module, 2).cast();
    assertThat(compare.ops()).containsExactly(Expression.CompareOperator.GREATER_THAN_OR_EQUAL);
    Expression.Unary unary = value(module, 3).cast();
    assertThat(unary.op()).isEqualTo(Expression.UnaryOperator.NEGATE);
  }

  @Test
  public void forRangeCount() throws CompilerException {
    SourceModule module = read(module(forRange("i", num(5), pass())));

    Statement.For loop = module.body().get(0).cast();
    assertThat(loop.rangeCount()).isPresent();
    assertThat(loop.rangeCount().get().<Expression.IntegerConstant>cast().value())
        .isEqualTo(BigInteger.valueOf(5));
  }

  @Test
  public void malformedJson() {
    CompilerException ex = assertThrows(CompilerException.class, () -> parse("{\"type\":"));
    assertThat(ex).hasMessageThat().contains("malformed syntax tree");
  }

  @Test
  public void topNodeMustBeModule() {
    CompilerException ex = assertThrows(CompilerException.class, () -> read(classDef("Cat")));
    assertThat(ex).hasMessageThat().contains("expected a Module node");
  }

  @Test
  public void missingAttributeReportsPosition() {
    JsonObject whileLoop = at(7, node("While"));
    whileLoop.add("body", new JsonArray());

    CompilerException ex = assertThrows(CompilerException.class, () -> read(module(whileLoop)));
    assertThat(ex).hasMessageThat().contains("missing 'test'");
    assertThat(ex.pos().lineNumber()).isEqualTo(7);
  }

  @Test
  public void comparisonWithoutComparators() {
    JsonObject compare = compare(name("a"), "Lt", num(1));
    compare.add("comparators", new JsonArray());

    assertThrows(CompilerException.class, () -> read(module(expr(compare))));
  }

  private static Expression value(SourceModule module, int index) {
    return module.body().get(index).<Statement.ExpressionStatement>cast().value();
  }

  private static Expression.Type valueType(SourceModule module, int index) {
    return value(module, index).type();
  }
}
