package sb3;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonPrimitive;

public final class SpriteScope {
  private static final JsonPrimitive DEFAULT_VALUE = new JsonPrimitive(0);

  private final String name;
  private final GlobalScope globals;
  private final BlockGraphBuilder blocks;
  private final ProcedureTable procedures;
  private final Map<String, Target.Variable> variables = new LinkedHashMap<>();
  private final Map<String, Target.ListVariable> lists = new LinkedHashMap<>();
  private final Set<String> sounds = new LinkedHashSet<>();

  public SpriteScope(String name, GlobalScope globals, IdAllocator ids, ProcedureTable procedures) {
    this.name = name;
    this.globals = globals;
    this.blocks = new BlockGraphBuilder(ids);
    this.procedures = procedures;
  }

  public String name() {
    return name;
  }

  public GlobalScope globals() {
    return globals;
  }

  public BlockGraphBuilder blocks() {
    return blocks;
  }

  public ProcedureTable procedures() {
    return procedures;
  }

  // The sprite variable, else the global one, else a new sprite variable set to 0.
  public Target.Variable variable(String name) {
    return variable(name, DEFAULT_VALUE);
  }

  public Target.Variable variable(String name, JsonPrimitive initialValue) {
    Target.Variable own = variables.get(name);
    if (own != null) return own;
    return globals.variable(name).orElseGet(() -> declareVariable(name, initialValue));
  }

  public Target.Variable declareVariable(String name, JsonPrimitive value) {
    return variables.computeIfAbsent(
        name, n -> Target.Variable.create(blocks.ids().variable(), n, value));
  }

  public Target.ListVariable list(String name) {
    Target.ListVariable own = lists.get(name);
    if (own != null) return own;
    return globals.list(name).orElseGet(() -> declareList(name, ImmutableList.of()));
  }

  public Target.ListVariable declareList(String name, Iterable<JsonPrimitive> contents) {
    return lists.computeIfAbsent(
        name, n -> Target.ListVariable.create(blocks.ids().list(), n, contents));
  }

  public String broadcast(String message) {
    return globals.broadcast(message);
  }

  public void referenceSound(String sound) {
    sounds.add(sound);
  }

  public Target.Builder toTarget() {
    Target.Builder target = Target.spriteBuilder(name).setBlocks(blocks.build());
    variables.values().forEach(target::addVariable);
    lists.values().forEach(target::addList);
    target.proceduresBuilder().addAll(procedures.procedures());
    target.referencedSoundsBuilder().addAll(sounds);
    return target;
  }
}
