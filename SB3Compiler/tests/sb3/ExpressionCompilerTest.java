package sb3;

import static com.google.common.truth.Truth.assertThat;
import static sb3.BlockQueries.*;
import static sb3.PythonAst.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

public class ExpressionCompilerTest {

  private CompilationResult result;

  private Target compileFlagScript(JsonObject... body) throws CompilerException {
    result = compile(classDef("Cat", method("when_flag_clicked", body)));
    return sprite(result, "Cat");
  }

  private Target compileCondition(JsonObject test) throws CompilerException {
    return compileFlagScript(ifThen(test, run("move", num(1))));
  }

  private static Block condition(Target cat) {
    return inputBlock(cat, only(cat, Opcodes.IF), "CONDITION");
  }

  @Test
  public void notEqualIsNegatedEquals() throws CompilerException {
    Target cat = compileCondition(compare(name("a"), "NotEq", num(1)));

    Block not = condition(cat);
    assertThat(not.opcode()).isEqualTo(Opcodes.NOT);
    assertThat(inputBlock(cat, not, "OPERAND").opcode()).isEqualTo(Opcodes.EQUALS);
  }

  @Test
  public void greaterOrEqualIsNegatedLessThan() throws CompilerException {
    Target cat = compileCondition(compare(name("a"), "GtE", num(1)));

    Block not = condition(cat);
    assertThat(not.opcode()).isEqualTo(Opcodes.NOT);
    Block lt = inputBlock(cat, not, "OPERAND");
    assertThat(lt.opcode()).isEqualTo(Opcodes.LT);
    assertThat(lt.input("OPERAND2")).hasValue(InputValue.number("1"));
  }

  @Test
  public void lessOrEqualIsNegatedGreaterThan() throws CompilerException {
    Target cat = compileCondition(compare(name("a"), "LtE", num(1)));

    Block not = condition(cat);
    assertThat(not.opcode()).isEqualTo(Opcodes.NOT);
    assertThat(inputBlock(cat, not, "OPERAND").opcode()).isEqualTo(Opcodes.GT);
  }

  @Test
  public void andChainNestsToTheRight() throws CompilerException {
    Target cat =
        compileCondition(
            boolOp(
                "And",
                compare(name("a"), "Gt", num(1)),
                compare(name("a"), "Gt", num(2)),
                compare(name("a"), "Gt", num(3))));

    Block outer = condition(cat);
    assertThat(outer.opcode()).isEqualTo(Opcodes.AND);
    Block first = inputBlock(cat, outer, "OPERAND1");
    assertThat(first.opcode()).isEqualTo(Opcodes.GT);
    assertThat(first.input("OPERAND2")).hasValue(InputValue.number("1"));

    Block inner = inputBlock(cat, outer, "OPERAND2");
    assertThat(inner.opcode()).isEqualTo(Opcodes.AND);
    assertThat(inputBlock(cat, inner, "OPERAND1").input("OPERAND2"))
        .hasValue(InputValue.number("2"));
    assertThat(inputBlock(cat, inner, "OPERAND2").input("OPERAND2"))
        .hasValue(InputValue.number("3"));
  }

  @Test
  public void orUsesOrBlock() throws CompilerException {
    Target cat =
        compileCondition(
            boolOp("Or", compare(name("a"), "Eq", num(1)), compare(name("a"), "Eq", num(2))));

    assertThat(condition(cat).opcode()).isEqualTo(Opcodes.OR);
  }

  @Test
  public void notOfCondition() throws CompilerException {
    Target cat = compileCondition(unary("Not", call("mouse_down")));

    Block not = condition(cat);
    assertThat(not.opcode()).isEqualTo(Opcodes.NOT);
    assertThat(inputBlock(cat, not, "OPERAND").opcode()).isEqualTo("sensing_mousedown");
  }

  @Test
  public void trueIsEqualsOfEqualStrings() throws CompilerException {
    Target cat = compileCondition(bool(true));

    Block equals = condition(cat);
    assertThat(equals.opcode()).isEqualTo(Opcodes.EQUALS);
    assertThat(equals.input("OPERAND1")).hasValue(InputValue.string("1"));
    assertThat(equals.input("OPERAND2")).hasValue(InputValue.string("1"));
  }

  @Test
  public void negativeConstantIsFolded() throws CompilerException {
    Target cat = compileFlagScript(run("move", unary("USub", num(5))));

    assertThat(only(cat, "motion_movesteps").input("STEPS")).hasValue(InputValue.number("-5"));
    assertThat(all(cat, Opcodes.SUBTRACT)).isEmpty();
  }

  @Test
  public void negatedVariableSubtractsFromZero() throws CompilerException {
    Target cat = compileFlagScript(run("move", unary("USub", name("speed"))));

    Block subtract = inputBlock(cat, only(cat, "motion_movesteps"), "STEPS");
    assertThat(subtract.opcode()).isEqualTo(Opcodes.SUBTRACT);
    assertThat(subtract.input("NUM1")).hasValue(InputValue.number("0"));
    assertThat(inputBlock(cat, subtract, "NUM2").opcode()).isEqualTo(Opcodes.VARIABLE);
  }

  @Test
  public void arithmeticNestsReporters() throws CompilerException {
    Target cat =
        compileFlagScript(run("move", binOp(binOp(name("speed"), "Mult", num(2)), "Add", num(1))));

    Block add = inputBlock(cat, only(cat, "motion_movesteps"), "STEPS");
    assertThat(add.opcode()).isEqualTo(Opcodes.ADD);
    assertThat(add.input("NUM2")).hasValue(InputValue.number("1"));
    Block multiply = inputBlock(cat, add, "NUM1");
    assertThat(multiply.opcode()).isEqualTo(Opcodes.MULTIPLY);
    assertThat(multiply.parent()).hasValue(add.id());
  }

  @Test
  public void floorDivisionUsesDivide() throws CompilerException {
    Target cat = compileFlagScript(run("move", binOp(name("a"), "FloorDiv", num(2))));

    assertThat(all(cat, Opcodes.DIVIDE)).hasSize(1);
  }

  @Test
  public void powerWarnsAndUsesZero() throws CompilerException {
    Target cat = compileFlagScript(run("move", at(3, binOp(num(2), "Pow", num(3)))));

    assertThat(only(cat, "motion_movesteps").input("STEPS")).hasValue(InputValue.number("0"));
    assertThat(result.warnings()).hasSize(1);
    assertThat(result.warnings().get(0).errorMsg()).contains("'**'");
  }

  @Test
  public void unknownNameBecomesSpriteVariable() throws CompilerException {
    Target cat = compileFlagScript(run("say", name("mood")));

    Target.Variable mood = cat.variableNamed("mood").get();
    assertThat(mood.value()).isEqualTo(new JsonPrimitive(0));
    Block reporter = inputBlock(cat, only(cat, "looks_say"), "MESSAGE");
    assertThat(reporter.field("VARIABLE")).hasValue(Block.Field.of("mood", mood.id()));
  }

  @Test
  public void nonBooleanConditionIsLeftEmpty() throws CompilerException {
    Target cat = compileCondition(num(1));

    assertThat(only(cat, Opcodes.IF).input("CONDITION")).isEmpty();
    assertThat(result.warnings()).hasSize(1);
  }

  @Test
  public void integersBeyondLongKeepTheirDigits() throws CompilerException {
    BigInteger huge = new BigInteger("100000000000000000000");
    Target cat =
        compileFlagScript(
            assign("big", num(huge)),
            run("move", num(huge)),
            run("move", unary("USub", num(huge))));

    assertThat(cat.variableNamed("big").get().value()).isEqualTo(new JsonPrimitive(huge));
    assertThat(only(cat, Opcodes.SET_VARIABLE_TO).input("VALUE"))
        .hasValue(InputValue.number("100000000000000000000"));
    assertThat(all(cat, "motion_movesteps").get(0).input("STEPS"))
        .hasValue(InputValue.number("100000000000000000000"));
    assertThat(all(cat, "motion_movesteps").get(1).input("STEPS"))
        .hasValue(InputValue.number("-100000000000000000000"));
    assertThat(
            ExpressionCompiler.constantValue(
                Expression.Unary.internal(
                    Expression.UnaryOperator.NEGATE,
                    new Expression.IntegerConstant(huge, SourceReader.Pos.internal()))))
        .hasValue(new JsonPrimitive(huge.negate()));
  }

  @Test
  public void booleanValuesAreCapitalized() throws CompilerException {
    Target cat = compileFlagScript(run("say", bool(true)), run("think", bool(false)));

    assertThat(only(cat, "looks_say").input("MESSAGE")).hasValue(InputValue.string("True"));
    assertThat(only(cat, "looks_think").input("MESSAGE")).hasValue(InputValue.string("False"));
  }

  @Test
  public void constantValues() {
    assertThat(ExpressionCompiler.constantValue(Expression.IntegerConstant.internal(3)))
        .hasValue(new JsonPrimitive(3L));
    assertThat(
            ExpressionCompiler.constantValue(
                Expression.Unary.internal(
                    Expression.UnaryOperator.NEGATE, Expression.IntegerConstant.internal(4))))
        .hasValue(new JsonPrimitive(-4L));
    assertThat(ExpressionCompiler.constantValue(Expression.Name.internal("x"))).isEmpty();
    assertThat(ExpressionCompiler.negate("-5")).isEqualTo("5");
    assertThat(ExpressionCompiler.negate("2.5")).isEqualTo("-2.5");
  }
}
