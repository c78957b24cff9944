package sb3;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonPrimitive;

public final class StatementCompiler {
  private static final int DEFAULT_REPEAT_COUNT = 10;

  private final SpriteScope scope;
  private final BlockGraphBuilder blocks;
  private final ExpressionCompiler expressions;
  private final Diagnostics diagnostics;

  StatementCompiler(
      SpriteScope scope, Optional<CustomProcedure> procedure, Diagnostics diagnostics) {
    this.scope = scope;
    this.blocks = scope.blocks();
    this.expressions = new ExpressionCompiler(scope, procedure, diagnostics);
    this.diagnostics = diagnostics;
  }

  // Procedures must already be registered in the scope.
  public static void compileSprite(
      SpriteScope scope, ImmutableList<Statement> body, Diagnostics diagnostics) {
    Set<String> defined = new HashSet<>();
    for (Statement statement : body) {
      switch (statement.type()) {
        case FUNCTION_DEF:
          compileMethod(scope, statement.cast(), defined, diagnostics);
          break;
        case ASSIGN:
          declare(scope, statement.cast(), diagnostics);
          break;
        case EXPRESSION:
          if (!isDocstring(statement)) {
            diagnostics.warn(statement.pos(), "only declarations and methods belong in a class");
          }
          break;
        case PASS:
        case UNSUPPORTED:
          break;
        default:
          diagnostics.warn(statement.pos(), "only declarations and methods belong in a class");
          break;
      }
    }
  }

  static void compileMethod(
      SpriteScope scope,
      Statement.FunctionDef method,
      Set<String> defined,
      Diagnostics diagnostics) {
    if (EventHat.isEventName(method.name())) {
      Optional<EventHat> hat = EventHat.parse(method.name());
      if (!hat.isPresent()) {
        diagnostics.warn(
            method.pos(), String.format("'%s' names no known event; ignored", method.name()));
        return;
      }
      BlockGraphBuilder.Chain chain = startHat(scope, hat.get());
      new StatementCompiler(scope, Optional.empty(), diagnostics)
          .compileBody(chain, method.body());
      return;
    }
    if (!ProcedureResolver.isProcedure(method)) return;

    Optional<CustomProcedure> procedure = scope.procedures().lookup(method.name());
    // Duplicates were reported at registration.
    if (!procedure.isPresent() || !defined.add(procedure.get().name())) return;

    BlockGraphBuilder.Chain chain = ProcedureResolver.define(procedure.get(), scope.blocks());
    new StatementCompiler(scope, procedure, diagnostics).compileBody(chain, method.body());
  }

  private static BlockGraphBuilder.Chain startHat(SpriteScope scope, EventHat hat) {
    BlockGraphBuilder blocks = scope.blocks();
    BlockGraphBuilder.Chain chain = blocks.startScript(hat.type().opcode());
    Block.Builder block = blocks.block(chain.head().get());
    switch (hat.type()) {
      case FLAG_CLICKED:
      case SPRITE_CLICKED:
      case START_AS_CLONE:
        break;
      case KEY_PRESSED:
        block.putField(EventHat.KEY_OPTION, Block.Field.of(hat.argument()));
        break;
      case BACKDROP_SWITCHES_TO:
        block.putField(EventHat.BACKDROP, Block.Field.of(hat.argument()));
        break;
      case BROADCAST_RECEIVED:
        block.putField(
            EventHat.BROADCAST_OPTION,
            Block.Field.of(hat.argument(), scope.broadcast(hat.argument())));
        break;
      case LOUDNESS_GREATER_THAN:
      case TIMER_GREATER_THAN:
        block.putField(EventHat.WHEN_GREATER_THAN_MENU, Block.Field.of(hat.sensor()));
        block.putInput(EventHat.VALUE, InputValue.number(hat.argument()));
        break;
      default:
        throw new AssertionError("Unknown event: " + hat.type());
    }
    return chain;
  }

  // `name = literal` or `name = [...]` declares sprite data without emitting a block.
  private static void declare(SpriteScope scope, Statement.Assign assign, Diagnostics diagnostics) {
    Optional<String> name = assign.targetName();
    if (!name.isPresent()) {
      diagnostics.warn(assign.pos(), "only plain names can be declared");
      return;
    }
    if (assign.value().type() == Expression.Type.LIST_LITERAL) {
      scope.declareList(name.get(), listContents(assign.value().cast(), diagnostics));
      return;
    }
    Optional<JsonPrimitive> value = ExpressionCompiler.constantValue(assign.value());
    if (!value.isPresent()) {
      diagnostics.warn(
          assign.value().pos(),
          String.format("'%s' must start from a literal; starting from 0", name.get()));
    }
    scope.declareVariable(name.get(), value.orElse(new JsonPrimitive(0)));
  }

  static ImmutableList<JsonPrimitive> listContents(
      Expression.ListLiteral list, Diagnostics diagnostics) {
    ImmutableList.Builder<JsonPrimitive> contents = ImmutableList.builder();
    for (Expression element : list.elements()) {
      Optional<JsonPrimitive> value = ExpressionCompiler.constantValue(element);
      if (value.isPresent()) {
        contents.add(value.get());
      } else {
        diagnostics.warn(element.pos(), "list items must be literals; item dropped");
      }
    }
    return contents.build();
  }

  private static boolean isDocstring(Statement statement) {
    return statement.<Statement.ExpressionStatement>cast().value().type()
        == Expression.Type.STRING_CONSTANT;
  }

  // Statements after the chain closes are dropped; SourceValidator reports them.
  public BlockGraphBuilder.Chain compileBody(
      BlockGraphBuilder.Chain chain, ImmutableList<Statement> body) {
    for (Statement statement : body) {
      if (chain.closed()) break;
      chain = compile(statement, chain);
    }
    return chain;
  }

  private BlockGraphBuilder.Chain compile(Statement statement, BlockGraphBuilder.Chain chain) {
    switch (statement.type()) {
      case ASSIGN:
        return assign(statement.cast(), chain);
      case AUG_ASSIGN:
        return augAssign(statement.cast(), chain);
      case FOR:
        return forLoop(statement.cast(), chain);
      case WHILE:
        return whileLoop(statement.cast(), chain);
      case IF:
        return ifStatement(statement.cast(), chain);
      case EXPRESSION:
        {
          Expression value = statement.<Statement.ExpressionStatement>cast().value();
          if (value.type() == Expression.Type.CALL) {
            return expressions.calls().statement(value.cast(), chain);
          }
          if (value.type() != Expression.Type.STRING_CONSTANT) {
            diagnostics.warn(statement.pos(), "expression has no effect; ignored");
          }
          return chain;
        }
      case PASS:
      case UNSUPPORTED:
        return chain;
      case CLASS_DEF:
      case FUNCTION_DEF:
        diagnostics.warn(statement.pos(), "nested definitions are not supported; ignored");
        return chain;
      default:
        throw new AssertionError("Unknown statement type: " + statement.type());
    }
  }

  private BlockGraphBuilder.Chain assign(Statement.Assign assign, BlockGraphBuilder.Chain chain) {
    Optional<String> name = assign.targetName();
    if (!name.isPresent()) {
      diagnostics.warn(assign.pos(), "only plain names can be assigned; ignored");
      return chain;
    }
    if (assign.value().type() == Expression.Type.LIST_LITERAL) {
      return refillList(name.get(), assign.value().cast(), chain);
    }

    Operand value = expressions.value(assign.value());
    Target.Variable variable =
        scope.variable(
            name.get(),
            ExpressionCompiler.constantValue(assign.value()).orElse(new JsonPrimitive(0)));
    BlockGraphBuilder.Chain next = blocks.append(chain, Opcodes.SET_VARIABLE_TO);
    String id = next.tail().get();
    blocks
        .block(id)
        .putField(CallTable.VARIABLE, Block.Field.of(variable.name(), variable.id()))
        .putInput("VALUE", blocks.input(value, id));
    return next;
  }

  // `items = [a, b]` in a script empties the list, then adds each item.
  private BlockGraphBuilder.Chain refillList(
      String name, Expression.ListLiteral list, BlockGraphBuilder.Chain chain) {
    Target.ListVariable target = scope.list(name);
    Block.Field field = Block.Field.of(target.name(), target.id());
    chain = blocks.append(chain, Opcodes.DELETE_ALL_OF_LIST);
    blocks.block(chain.tail().get()).putField(CallTable.LIST, field);
    for (Expression element : list.elements()) {
      Operand value = expressions.value(element);
      chain = blocks.append(chain, Opcodes.ADD_TO_LIST);
      String id = chain.tail().get();
      blocks.block(id).putField(CallTable.LIST, field).putInput("ITEM", blocks.input(value, id));
    }
    return chain;
  }

  private BlockGraphBuilder.Chain augAssign(
      Statement.AugAssign augAssign, BlockGraphBuilder.Chain chain) {
    if (augAssign.target().type() != Expression.Type.NAME) {
      diagnostics.warn(augAssign.pos(), "only plain names can be assigned; ignored");
      return chain;
    }
    Operand value;
    switch (augAssign.op()) {
      case ADD:
        value = expressions.value(augAssign.value());
        break;
      case SUBTRACT:
        {
          Operand operand = expressions.value(augAssign.value());
          value =
              operand.type() == Operand.Type.NUMBER
                  ? Operand.number(ExpressionCompiler.negate(operand.text()))
                  : Operand.block(expressions.subtractFromZero(operand));
          break;
        }
      default:
        // Reported by SourceValidator.
        return chain;
    }

    Target.Variable variable =
        scope.variable(augAssign.target().<Expression.Name>cast().id());
    BlockGraphBuilder.Chain next = blocks.append(chain, Opcodes.CHANGE_VARIABLE_BY);
    String id = next.tail().get();
    blocks
        .block(id)
        .putField(CallTable.VARIABLE, Block.Field.of(variable.name(), variable.id()))
        .putInput("VALUE", blocks.input(value, id));
    return next;
  }

  private BlockGraphBuilder.Chain forLoop(Statement.For forLoop, BlockGraphBuilder.Chain chain) {
    Operand times =
        forLoop.rangeCount().isPresent()
            ? expressions.value(forLoop.rangeCount().get())
            : Operand.number(DEFAULT_REPEAT_COUNT);
    BlockGraphBuilder.Chain next = blocks.append(chain, Opcodes.REPEAT);
    String id = next.tail().get();
    blocks.block(id).putInput("TIMES", blocks.input(times, id));
    substack(id, "SUBSTACK", forLoop.body());
    return next;
  }

  private BlockGraphBuilder.Chain whileLoop(
      Statement.While whileLoop, BlockGraphBuilder.Chain chain) {
    if (whileLoop.isInfiniteLoop()) {
      BlockGraphBuilder.Chain next = blocks.append(chain, Opcodes.FOREVER);
      substack(next.tail().get(), "SUBSTACK", whileLoop.body());
      return next.close();
    }

    // The condition is used as written: the loop repeats until it holds.
    Optional<String> condition = expressions.condition(whileLoop.test());
    BlockGraphBuilder.Chain next = blocks.append(chain, Opcodes.REPEAT_UNTIL);
    String id = next.tail().get();
    condition.ifPresent(c -> blocks.block(id).putInput("CONDITION", blocks.attach(c, id)));
    substack(id, "SUBSTACK", whileLoop.body());
    return next;
  }

  private BlockGraphBuilder.Chain ifStatement(
      Statement.If ifStatement, BlockGraphBuilder.Chain chain) {
    Optional<String> condition = expressions.condition(ifStatement.test());
    boolean hasElse = !ifStatement.orElse().isEmpty();
    BlockGraphBuilder.Chain next = blocks.append(chain, hasElse ? Opcodes.IF_ELSE : Opcodes.IF);
    String id = next.tail().get();
    condition.ifPresent(c -> blocks.block(id).putInput("CONDITION", blocks.attach(c, id)));
    substack(id, "SUBSTACK", ifStatement.body());
    if (hasElse) substack(id, "SUBSTACK2", ifStatement.orElse());
    return next;
  }

  private void substack(String containerId, String input, ImmutableList<Statement> body) {
    BlockGraphBuilder.Chain inner =
        compileBody(BlockGraphBuilder.Chain.substack(containerId), body);
    inner.head().ifPresent(h -> blocks.block(containerId).putInput(input, InputValue.block(h)));
  }
}
