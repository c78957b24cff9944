package sb3;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

public final class CallCompiler {

  private final ExpressionCompiler expressions;
  private final SpriteScope scope;
  private final BlockGraphBuilder blocks;
  private final Diagnostics diagnostics;

  CallCompiler(ExpressionCompiler expressions, SpriteScope scope, Diagnostics diagnostics) {
    this.expressions = expressions;
    this.scope = scope;
    this.blocks = scope.blocks();
    this.diagnostics = diagnostics;
  }

  public BlockGraphBuilder.Chain statement(Expression.Call call, BlockGraphBuilder.Chain chain) {
    Optional<CallTable.CallSpec> spec = CallTable.lookup(call.name());
    if (spec.isPresent()) {
      if (spec.get().isReporter()) {
        diagnostics.warn(
            call.pos(), String.format("'%s' reports a value; call ignored", call.name()));
        return chain;
      }
      checkArity(call, spec.get());
      return builtinStatement(call, spec.get(), chain);
    }

    Optional<CustomProcedure> procedure = scope.procedures().lookup(call.name());
    if (procedure.isPresent()) return procedureCall(call, procedure.get(), chain);

    diagnostics.warn(call.pos(), String.format("unknown call '%s' ignored", call.name()));
    return chain;
  }

  public Optional<String> reporter(Expression.Call call) {
    Optional<CallTable.CallSpec> spec = CallTable.lookup(call.name());
    if (!spec.isPresent()) {
      String reason =
          scope.procedures().lookup(call.name()).isPresent()
              ? "custom blocks do not report values"
              : "unknown call";
      diagnostics.warn(call.pos(), String.format("%s '%s'; using 0", reason, call.name()));
      return Optional.empty();
    }
    if (!spec.get().isReporter()) {
      diagnostics.warn(
          call.pos(), String.format("'%s' does not report a value; using 0", call.name()));
      return Optional.empty();
    }
    checkArity(call, spec.get());
    return builtinReporter(call, spec.get());
  }

  private BlockGraphBuilder.Chain builtinStatement(
      Expression.Call call, CallTable.CallSpec spec, BlockGraphBuilder.Chain chain) {
    ImmutableList<Expression> args = call.args();
    switch (spec.shape()) {
      case NO_ARGUMENT_STATEMENT:
        return blocks.append(chain, spec.opcode());
      case SINGLE_ARGUMENT_STATEMENT:
      case MULTI_ARGUMENT_STATEMENT:
        {
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          putInputs(next.tail().get(), spec.inputs(), args, 0);
          return next;
        }
      case FIELD_INPUT_STATEMENT:
        {
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          Block.Builder block = blocks.block(next.tail().get());
          if (!args.isEmpty()) {
            fieldArgument(args.get(0), spec)
                .ifPresent(v -> block.putField(spec.field().get(), Block.Field.of(v)));
          }
          putInputs(block.id(), spec.inputs(), args, 1);
          return next;
        }
      case MENU_STATEMENT:
        {
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          String id = next.tail().get();
          putInputs(id, spec.inputs(), args, 0);
          int menuIndex = spec.inputs().size();
          if (args.size() > menuIndex) putMenu(id, spec, args.get(menuIndex));
          return next;
        }
      case FIELD_STATEMENT:
        {
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          if (!args.isEmpty()) {
            fieldArgument(args.get(0), spec)
                .ifPresent(
                    v ->
                        blocks
                            .block(next.tail().get())
                            .putField(spec.field().get(), Block.Field.of(v)));
          }
          return next;
        }
      case BROADCAST:
        {
          Optional<String> message = args.isEmpty() ? Optional.empty() : stringLiteral(args.get(0));
          if (!message.isPresent()) {
            diagnostics.warn(
                call.pos(), String.format("'%s' needs a message name literal", call.name()));
            return chain;
          }
          String broadcastId = scope.broadcast(message.get());
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          blocks
              .block(next.tail().get())
              .putInput("BROADCAST_INPUT", InputValue.broadcast(message.get(), broadcastId));
          return next;
        }
      case LIST_OPERATION:
        {
          Optional<Target.ListVariable> list = listArgument(call, spec);
          if (!list.isPresent()) return chain;
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          putListInputs(next.tail().get(), spec, list.get(), args);
          return next;
        }
      case VARIABLE_VISIBILITY:
        {
          Optional<String> name = args.isEmpty() ? Optional.empty() : stringLiteral(args.get(0));
          if (!name.isPresent()) {
            diagnostics.warn(
                call.pos(), String.format("'%s' needs a variable name literal", call.name()));
            return chain;
          }
          Target.Variable variable = scope.variable(name.get());
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          blocks
              .block(next.tail().get())
              .putField(CallTable.VARIABLE, Block.Field.of(variable.name(), variable.id()));
          return next;
        }
      case WAIT_UNTIL:
        {
          BlockGraphBuilder.Chain next = blocks.append(chain, spec.opcode());
          String id = next.tail().get();
          if (!args.isEmpty()) {
            expressions
                .condition(args.get(0))
                .ifPresent(c -> blocks.block(id).putInput("CONDITION", blocks.attach(c, id)));
          }
          return next;
        }
      default:
        throw new AssertionError("Not a statement shape: " + spec.shape());
    }
  }

  private Optional<String> builtinReporter(Expression.Call call, CallTable.CallSpec spec) {
    ImmutableList<Expression> args = call.args();
    switch (spec.shape()) {
      case VALUE_REPORTER:
      case BOOLEAN_REPORTER:
        {
          Block.Builder block = blocks.reporter(spec.opcode());
          putInputs(block.id(), spec.inputs(), args, 0);
          return Optional.of(block.id());
        }
      case FIELD_REPORTER:
        return Optional.of(
            blocks
                .reporter(spec.opcode())
                .putField(spec.field().get(), Block.Field.of(spec.fieldValue().get()))
                .id());
      case MENU_REPORTER:
        {
          Block.Builder block = blocks.reporter(spec.opcode());
          if (!args.isEmpty()) putMenu(block.id(), spec, args.get(0));
          return Optional.of(block.id());
        }
      case COLOR_REPORTER:
        {
          Block.Builder block = blocks.reporter(spec.opcode());
          for (int i = 0; i < spec.inputs().size() && i < args.size(); i++) {
            Optional<String> color = stringLiteral(args.get(i));
            block.putInput(
                spec.inputs().get(i),
                color.isPresent()
                    ? InputValue.color(color.get())
                    : expressions.input(args.get(i), block.id()));
          }
          return Optional.of(block.id());
        }
      case MATH_OPERATION:
        {
          Block.Builder block =
              blocks
                  .reporter(spec.opcode())
                  .putField(spec.field().get(), Block.Field.of(spec.fieldValue().get()));
          putInputs(block.id(), spec.inputs(), args, 0);
          return Optional.of(block.id());
        }
      case RANDOM:
        {
          // random(n) picks from 1 to n.
          Block.Builder block = blocks.reporter(spec.opcode());
          if (args.size() == 1) {
            block.putInput("FROM", InputValue.number("1"));
            block.putInput("TO", expressions.input(args.get(0), block.id()));
          } else if (args.size() >= 2) {
            block.putInput("FROM", expressions.input(args.get(0), block.id()));
            block.putInput("TO", expressions.input(args.get(1), block.id()));
          }
          return Optional.of(block.id());
        }
      case LIST_OPERATION:
        {
          Optional<Target.ListVariable> list = listArgument(call, spec);
          if (!list.isPresent()) return Optional.empty();
          Block.Builder block = blocks.reporter(spec.opcode());
          putListInputs(block.id(), spec, list.get(), args);
          return Optional.of(block.id());
        }
      case PROPERTY_OF:
        {
          Block.Builder block = blocks.reporter(spec.opcode());
          if (!args.isEmpty()) {
            fieldArgument(args.get(0), spec)
                .ifPresent(p -> block.putField(spec.field().get(), Block.Field.of(p)));
          }
          if (args.size() > 1) putMenu(block.id(), spec, args.get(1));
          return Optional.of(block.id());
        }
      default:
        throw new AssertionError("Not a reporter shape: " + spec.shape());
    }
  }

  // Missing arguments fall back to the procedure's defaults.
  private BlockGraphBuilder.Chain procedureCall(
      Expression.Call call, CustomProcedure procedure, BlockGraphBuilder.Chain chain) {
    ImmutableList<Expression> args = call.args();
    if (args.size() > procedure.argumentCount()) {
      diagnostics.warn(
          call.pos(),
          String.format(
              "'%s' takes %d arguments; the rest are ignored",
              procedure.name(), procedure.argumentCount()));
    }
    BlockGraphBuilder.Chain next = blocks.append(chain, Opcodes.PROCEDURES_CALL);
    Block.Builder block =
        blocks.block(next.tail().get()).setMutation(Block.Mutation.procedureCall(procedure));
    for (int i = 0; i < procedure.argumentCount(); i++) {
      block.putInput(
          procedure.argumentIds().get(i),
          i < args.size()
              ? expressions.input(args.get(i), block.id())
              : InputValue.string(procedure.argumentDefaults().get(i)));
    }
    return next;
  }

  private void putInputs(
      String blockId, ImmutableList<String> inputs, ImmutableList<Expression> args, int offset) {
    Block.Builder block = blocks.block(blockId);
    for (int i = 0; i < inputs.size() && i + offset < args.size(); i++) {
      block.putInput(inputs.get(i), expressions.input(args.get(i + offset), blockId));
    }
  }

  // The list argument sits at the LIST marker; the others fill inputs in order.
  private void putListInputs(
      String blockId,
      CallTable.CallSpec spec,
      Target.ListVariable list,
      ImmutableList<Expression> args) {
    Block.Builder block =
        blocks.block(blockId).putField(CallTable.LIST, Block.Field.of(list.name(), list.id()));
    for (int i = 0; i < spec.inputs().size() && i < args.size(); i++) {
      String input = spec.inputs().get(i);
      if (input.equals(CallTable.LIST)) continue;
      block.putInput(input, expressions.input(args.get(i), blockId));
    }
  }

  private Optional<Target.ListVariable> listArgument(
      Expression.Call call, CallTable.CallSpec spec) {
    int index = spec.inputs().indexOf(CallTable.LIST);
    Optional<String> name =
        index < call.args().size() ? stringLiteral(call.args().get(index)) : Optional.empty();
    if (!name.isPresent()) {
      diagnostics.warn(
          call.pos(), String.format("'%s' needs a list name literal; call ignored", call.name()));
      return Optional.empty();
    }
    return Optional.of(scope.list(name.get()));
  }

  // A literal selects a menu value; anything else sits over a menu holding the empty value.
  private void putMenu(String blockId, CallTable.CallSpec spec, Expression arg) {
    CallTable.MenuSpec menu = spec.menu().get();
    Operand value = expressions.value(arg);
    if (value.isLiteral()) {
      if (spec.tracksSound()) scope.referenceSound(value.text());
      blocks
          .block(blockId)
          .putInput(
              menu.input(),
              blocks.menu(menu.opcode(), menu.field(), menu.encode(value.text()), blockId));
      return;
    }
    InputValue.ShadowBlockRef reporter = blocks.input(value, blockId).cast();
    InputValue shadow = blocks.menu(menu.opcode(), menu.field(), "", blockId);
    blocks
        .block(blockId)
        .putInput(menu.input(), InputValue.shadowedBlock(reporter.id(), shadow));
  }

  private Optional<String> fieldArgument(Expression arg, CallTable.CallSpec spec) {
    Optional<String> value = stringLiteral(arg);
    if (!value.isPresent()) {
      diagnostics.warn(
          arg.pos(), String.format("'%s' needs a literal for %s", spec.name(), spec.field().get()));
      return Optional.empty();
    }
    return Optional.of(spec.uppercaseField() ? value.get().toUpperCase() : value.get());
  }

  private void checkArity(Expression.Call call, CallTable.CallSpec spec) {
    int min;
    int max;
    switch (spec.shape()) {
      case NO_ARGUMENT_STATEMENT:
      case FIELD_REPORTER:
        min = max = 0;
        break;
      case FIELD_INPUT_STATEMENT:
      case MENU_STATEMENT:
        min = max = spec.inputs().size() + 1;
        break;
      case FIELD_STATEMENT:
      case MENU_REPORTER:
      case BROADCAST:
      case VARIABLE_VISIBILITY:
      case WAIT_UNTIL:
      case MATH_OPERATION:
        min = max = 1;
        break;
      case RANDOM:
        min = 1;
        max = 2;
        break;
      case PROPERTY_OF:
        min = max = 2;
        break;
      default:
        min = max = spec.inputs().size();
        break;
    }
    int count = call.args().size();
    if (count < min || count > max) {
      diagnostics.warn(
          call.pos(),
          String.format(
              "'%s' takes %s arguments, got %d",
              call.name(), min == max ? Integer.toString(min) : min + " to " + max, count));
    }
  }

  private static Optional<String> stringLiteral(Expression expr) {
    if (expr.type() != Expression.Type.STRING_CONSTANT) return Optional.empty();
    return Optional.of(expr.<Expression.StringConstant>cast().value());
  }
}
