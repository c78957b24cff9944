package sb3;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// register() fixes every signature of a class before any body compiles, so a method may call a
// procedure declared after it.
public final class ProcedureResolver {

  // Escapes method names that would otherwise read as an event or a special method.
  public static final String DEFINE_PREFIX = "define_";

  private static final String ARGUMENT_DEFAULT = "";

  public static boolean isProcedure(Statement.FunctionDef method) {
    return !EventHat.isEventName(method.name()) && !method.name().startsWith("__");
  }

  // define_when_x declares when_x.
  public static String procedureName(String methodName) {
    if (methodName.startsWith(DEFINE_PREFIX)) {
      String rest = methodName.substring(DEFINE_PREFIX.length());
      if (EventHat.isEventName(rest) || rest.startsWith("__")) return rest;
    }
    return methodName;
  }

  public static String methodName(String procedureName) {
    if (EventHat.isEventName(procedureName) || procedureName.startsWith("__")) {
      return DEFINE_PREFIX + procedureName;
    }
    return procedureName;
  }

  public static ProcedureTable register(
      Iterable<Statement> classBody, IdAllocator ids, Diagnostics diagnostics) {
    Map<String, CustomProcedure> procedures = new LinkedHashMap<>();
    for (Statement statement : classBody) {
      if (statement.type() != Statement.Type.FUNCTION_DEF) continue;
      Statement.FunctionDef method = statement.cast();
      if (!isProcedure(method)) continue;

      String name = procedureName(method.name());
      if (procedures.containsKey(name)) {
        diagnostics.warn(
            method.pos(), String.format("procedure '%s' is already defined; ignoring", name));
        continue;
      }
      if (CallTable.contains(name)) {
        diagnostics.warn(
            method.pos(),
            String.format("calls to '%s' use the built-in block, not this procedure", name));
      }

      ImmutableList<String> params = method.valueParams();
      String definitionId = ids.block();
      String prototypeId = ids.block();
      ImmutableList.Builder<String> argumentIds = ImmutableList.builder();
      params.forEach(p -> argumentIds.add(ids.argument()));
      procedures.put(
          name,
          CustomProcedure.builder()
              .setName(name)
              .setProccode(CustomProcedure.proccodeOf(name, params.size()))
              .setArgumentIds(argumentIds.build())
              .setArgumentNames(params)
              .setArgumentDefaults(
                  ImmutableList.copyOf(Collections.nCopies(params.size(), ARGUMENT_DEFAULT)))
              .setDefinitionId(definitionId)
              .setPrototypeId(prototypeId)
              .build());
    }
    return new ProcedureTable(ImmutableMap.copyOf(procedures));
  }

  public static BlockGraphBuilder.Chain define(
      CustomProcedure procedure, BlockGraphBuilder blocks) {
    BlockGraphBuilder.Chain chain =
        blocks.startScript(procedure.definitionId(), Opcodes.PROCEDURES_DEFINITION);
    blocks
        .block(procedure.definitionId())
        .putInput("custom_block", InputValue.menu(procedure.prototypeId()));

    Block.Builder prototype =
        blocks
            .shadow(procedure.prototypeId(), Opcodes.PROCEDURES_PROTOTYPE, procedure.definitionId())
            .setMutation(Block.Mutation.procedurePrototype(procedure));
    for (int i = 0; i < procedure.argumentCount(); i++) {
      Block.Builder reporter =
          blocks
              .shadow(Opcodes.ARGUMENT_REPORTER_STRING_NUMBER, procedure.prototypeId())
              .putField("VALUE", Block.Field.of(procedure.argumentNames().get(i)));
      prototype.putInput(procedure.argumentIds().get(i), InputValue.menu(reporter.id()));
    }
    return chain;
  }

  private ProcedureResolver() {}
}
