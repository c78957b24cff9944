package sb3;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.gson.JsonPrimitive;

public final class GlobalScope {
  private final IdAllocator ids = new IdAllocator("stage");
  private final Map<String, Target.Variable> variables = new LinkedHashMap<>();
  private final Map<String, Target.ListVariable> lists = new LinkedHashMap<>();
  private final Map<String, String> broadcasts = new LinkedHashMap<>();

  public Optional<Target.Variable> variable(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  public Optional<Target.ListVariable> list(String name) {
    return Optional.ofNullable(lists.get(name));
  }

  public Target.Variable declareVariable(String name, JsonPrimitive value) {
    return variables.computeIfAbsent(name, n -> Target.Variable.create(ids.variable(), n, value));
  }

  public Target.ListVariable declareList(String name, Iterable<JsonPrimitive> contents) {
    return lists.computeIfAbsent(name, n -> Target.ListVariable.create(ids.list(), n, contents));
  }

  public String broadcast(String name) {
    return broadcasts.computeIfAbsent(name, n -> ids.broadcast());
  }

  public Target.Builder contributeTo(Target.Builder stage) {
    variables.values().forEach(stage::addVariable);
    lists.values().forEach(stage::addList);
    broadcasts.forEach((name, id) -> stage.broadcastsBuilder().put(id, name));
    return stage;
  }
}
