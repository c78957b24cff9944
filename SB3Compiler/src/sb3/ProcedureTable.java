package sb3;

import java.util.Optional;

import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;

public final class ProcedureTable {
  private static final ProcedureTable EMPTY = new ProcedureTable(ImmutableMap.of());

  private final ImmutableMap<String, CustomProcedure> byName;

  ProcedureTable(ImmutableMap<String, CustomProcedure> byName) {
    this.byName = byName;
  }

  public static ProcedureTable empty() {
    return EMPTY;
  }

  public Optional<CustomProcedure> lookup(String name) {
    return Optional.ofNullable(byName.get(ProcedureResolver.procedureName(name)));
  }

  public ImmutableCollection<CustomProcedure> procedures() {
    return byName.values();
  }

  public int size() {
    return byName.size();
  }
}
