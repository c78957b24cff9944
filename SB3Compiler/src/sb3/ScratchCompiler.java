package sb3;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonPrimitive;

public final class ScratchCompiler {
  private static final Logger logger = Logger.getLogger(ScratchCompiler.class.getName());

  private final StageConfig config;

  public ScratchCompiler(StageConfig config) {
    this.config = config;
  }

  public CompilationResult compile(SourceModule module) {
    Diagnostics diagnostics = new Diagnostics();
    new SourceValidator().validate(module, diagnostics);

    GlobalScope globals = new GlobalScope();
    ImmutableList.Builder<Statement.FunctionDef> events = ImmutableList.builder();
    ImmutableList.Builder<Statement.ClassDef> classes = ImmutableList.builder();
    for (Statement statement : module.body()) {
      switch (statement.type()) {
        case ASSIGN:
          declareGlobal(globals, statement.cast(), diagnostics);
          break;
        case FUNCTION_DEF:
          {
            Statement.FunctionDef function = statement.cast();
            if (EventHat.isEventName(function.name())) {
              events.add(function);
            } else {
              diagnostics.warn(
                  function.pos(),
                  String.format(
                      "module-level function '%s' ignored; only events and classes compile",
                      function.name()));
            }
            break;
          }
        case CLASS_DEF:
          classes.add(statement.cast());
          break;
        case PASS:
        case UNSUPPORTED:
          break;
        case EXPRESSION:
          if (statement.<Statement.ExpressionStatement>cast().value().type()
              == Expression.Type.STRING_CONSTANT) {
            break;
          }
          diagnostics.warn(statement.pos(), "module-level statement ignored");
          break;
        default:
          diagnostics.warn(statement.pos(), "module-level statement ignored");
          break;
      }
    }

    ImmutableList.Builder<Target> sprites = ImmutableList.builder();
    Set<String> names = new LinkedHashSet<>();
    int ordinal = 0;

    ImmutableList<Statement.FunctionDef> implicitEvents = events.build();
    if (!implicitEvents.isEmpty()) {
      SpriteScope scope =
          new SpriteScope(
              config.defaultSpriteName(),
              globals,
              new IdAllocator("s" + ordinal),
              ProcedureTable.empty());
      Set<String> defined = new HashSet<>();
      implicitEvents.forEach(
          f -> StatementCompiler.compileMethod(scope, f, defined, diagnostics));
      sprites.add(finish(scope));
      names.add(scope.name());
    }

    for (Statement.ClassDef classDef : classes.build()) {
      ordinal++;
      if (!names.add(classDef.name())) {
        diagnostics.warn(
            classDef.pos(),
            String.format("sprite '%s' is already defined; class ignored", classDef.name()));
        continue;
      }
      IdAllocator ids = new IdAllocator("s" + ordinal);
      ProcedureTable procedures = ProcedureResolver.register(classDef.body(), ids, diagnostics);
      SpriteScope scope = new SpriteScope(classDef.name(), globals, ids, procedures);
      StatementCompiler.compileSprite(scope, classDef.body(), diagnostics);
      sprites.add(finish(scope));
    }

    Target.Builder stage =
        Target.stageBuilder(config.stageName())
            .setTempo(config.tempo())
            .setVolume(config.volume())
            .setVideoTransparency(config.videoTransparency())
            .setVideoState(config.videoState())
            .setTextToSpeechLanguage(config.textToSpeechLanguage());
    globals.contributeTo(stage);

    ImmutableList<Target> compiled = sprites.build();
    logger.info(
        String.format(
            "compiled %d sprites with %d warnings",
            compiled.size(),
            diagnostics.warnings().size()));
    return CompilationResult.create(stage.build(), compiled, diagnostics.warnings());
  }

  private Target finish(SpriteScope scope) {
    Target target = scope.toTarget().build();
    Verify.verify(
        target.blocks().topLevelBlocks().stream().allMatch(b -> Opcodes.isHat(b.opcode())),
        "sprite %s has a top-level block that is not a hat",
        target.name());
    logger.fine(
        String.format(
            "sprite %s: %d blocks, %d procedures",
            target.name(), target.blocks().size(), target.procedures().size()));
    return target;
  }

  // Module-level `name = literal` and `name = [...]` declare stage data.
  private static void declareGlobal(
      GlobalScope globals, Statement.Assign assign, Diagnostics diagnostics) {
    if (!assign.targetName().isPresent()) {
      diagnostics.warn(assign.pos(), "only plain names can be declared");
      return;
    }
    String name = assign.targetName().get();
    if (assign.value().type() == Expression.Type.LIST_LITERAL) {
      globals.declareList(name, StatementCompiler.listContents(assign.value().cast(), diagnostics));
      return;
    }
    if (!ExpressionCompiler.constantValue(assign.value()).isPresent()) {
      diagnostics.warn(
          assign.value().pos(),
          String.format("global '%s' must start from a literal; starting from 0", name));
    }
    globals.declareVariable(
        name, ExpressionCompiler.constantValue(assign.value()).orElse(new JsonPrimitive(0)));
  }
}
