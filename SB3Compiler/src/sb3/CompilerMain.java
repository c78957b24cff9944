package sb3;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.io.Files;

public class CompilerMain {

  private static final String USAGE =
      "Usage: $COMPILER compile ast_json project_json [--agent name] [--pretty]\n"
          + "       $COMPILER decompile project_json python_file";

  public static void main(String[] args) throws IOException {
    List<String> argList = Arrays.asList(args);
    if (argList.size() < 3) usage();

    switch (argList.get(0)) {
      case "compile":
        compile(argList);
        break;
      case "decompile":
        if (argList.size() != 3) usage();
        decompile(new File(argList.get(1)), new File(argList.get(2)));
        break;
      default:
        usage();
    }
  }

  private static void compile(List<String> args) throws IOException {
    StageConfig.Builder config = StageConfig.defaults().toBuilder();
    boolean pretty = false;
    for (int i = 3; i < args.size(); i++) {
      switch (args.get(i)) {
        case "--agent":
          if (++i == args.size()) usage();
          config.setAgent(args.get(i));
          break;
        case "--pretty":
          pretty = true;
          break;
        default:
          usage();
      }
    }

    File in = new File(args.get(1));
    SourceModule module;
    try {
      module = new SourceReader(in.toString(), read(in)).read();
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
      return;
    }

    StageConfig stageConfig = config.build();
    CompilationResult compiled = new ScratchCompiler(stageConfig).compile(module);
    compiled.warnings().forEach(CompilerException::print);

    AssetLibrary library;
    try {
      library = CatalogAssetLibrary.bundled();
    } catch (AssetResolutionException ex) {
      System.out.println("Asset catalog unavailable; using placeholders: " + ex.getMessage());
      library = new NoAssets();
    }
    Project project = new ProjectAssembler(stageConfig, library).assemble(compiled);
    write(
        pretty ? ProjectJson.writePretty(project) : ProjectJson.write(project),
        new File(args.get(2)));

    System.out.println(
        String.format(
            "Compilation succeeded with %d warnings: %d sprites, %d assets.",
            compiled.warnings().size(),
            project.sprites().size(),
            project.assetFileNames().size()));
  }

  private static void decompile(File in, File out) throws IOException {
    try {
      Project project = ProjectJson.read(read(in));
      write(new Decompiler().decompile(project), out);
      System.out.println(
          String.format("Decompiled %d sprites into %s", project.sprites().size(), out));
    } catch (InvalidProjectException ex) {
      System.err.println(ex.getMessage());
      System.out.println("Decompilation failed.");
      System.exit(1);
    }
  }

  // Every sprite gets the placeholder costume.
  private static final class NoAssets implements AssetLibrary {
    @Override
    public Optional<SpriteAssets> resolveSpriteAssets(String spriteName) {
      return Optional.empty();
    }

    @Override
    public Optional<Asset.Sound> resolveSound(String soundName) {
      return Optional.empty();
    }
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(1);
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
