package sb3;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Blocks of one target, keyed by id in allocation order.
public final class BlockGraph {
  private static final BlockGraph EMPTY = new BlockGraph(ImmutableMap.of());

  private final ImmutableMap<String, Block> blocks;

  private BlockGraph(ImmutableMap<String, Block> blocks) {
    this.blocks = blocks;
  }

  public static BlockGraph empty() {
    return EMPTY;
  }

  public static BlockGraph of(Iterable<Block> blocks) {
    ImmutableMap.Builder<String, Block> builder = ImmutableMap.builder();
    blocks.forEach(b -> builder.put(b.id(), b));
    // Fails on duplicate ids.
    return new BlockGraph(builder.buildOrThrow());
  }

  public ImmutableMap<String, Block> blocks() {
    return blocks;
  }

  public int size() {
    return blocks.size();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  public Optional<Block> get(String id) {
    return Optional.ofNullable(blocks.get(id));
  }

  public ImmutableList<Block> topLevelBlocks() {
    return blocks.values().stream()
        .filter(Block::topLevel)
        .collect(ImmutableList.toImmutableList());
  }

  // Terminates only on graphs that passed checkIntegrity().
  public ImmutableList<Block> chain(String startId) {
    ImmutableList.Builder<Block> builder = ImmutableList.builder();
    Optional<String> current = Optional.of(startId);
    while (current.isPresent()) {
      Block block = blocks.get(current.get());
      if (block == null) break;
      builder.add(block);
      current = block.next();
    }
    return builder.build();
  }

  public void checkIntegrity(String target) throws InvalidProjectException {
    for (Block block : blocks.values()) {
      if (block.parent().isPresent() && !blocks.containsKey(block.parent().get())) {
        throw InvalidProjectException.inBlock(
            target, block.id(), "parent '" + block.parent().get() + "' does not exist");
      }
      if (block.next().isPresent()) {
        if (!blocks.containsKey(block.next().get())) {
          throw InvalidProjectException.inBlock(
              target, block.id(), "next '" + block.next().get() + "' does not exist");
        }
        if (!block.kind().isChained()) {
          throw InvalidProjectException.inBlock(
              target, block.id(), block.kind() + " block cannot have a next block");
        }
      }
      for (Map.Entry<String, InputValue> input : block.inputs().entrySet()) {
        for (String ref : input.getValue().referencedBlocks()) {
          if (!blocks.containsKey(ref)) {
            throw InvalidProjectException.inBlock(
                target,
                block.id(),
                String.format("input %s references missing block '%s'", input.getKey(), ref));
          }
        }
      }
    }

    checkAcyclic(target);
  }

  // Iterative depth-first walk over next and input edges. A block seen again while it is still
  // on the current path closes a cycle.
  private void checkAcyclic(String target) throws InvalidProjectException {
    Map<String, Boolean> onPath = new HashMap<>();
    for (String root : blocks.keySet()) {
      if (onPath.containsKey(root)) continue;
      Deque<String> path = new ArrayDeque<>();
      Deque<Iterator<String>> pending = new ArrayDeque<>();
      path.push(root);
      pending.push(successors(blocks.get(root)).iterator());
      onPath.put(root, true);
      while (!path.isEmpty()) {
        Iterator<String> edges = pending.peek();
        if (!edges.hasNext()) {
          onPath.put(path.pop(), false);
          pending.pop();
          continue;
        }
        String next = edges.next();
        Boolean active = onPath.get(next);
        if (active == null) {
          path.push(next);
          pending.push(successors(blocks.get(next)).iterator());
          onPath.put(next, true);
        } else if (active) {
          throw InvalidProjectException.inBlock(
              target, path.peek(), "cycle back to block '" + next + "'");
        }
      }
    }
  }

  private static ImmutableList<String> successors(Block block) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    block.next().ifPresent(builder::add);
    for (InputValue input : block.inputs().values()) {
      builder.addAll(input.referencedBlocks());
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BlockGraph && blocks.equals(((BlockGraph) o).blocks);
  }

  @Override
  public int hashCode() {
    return blocks.hashCode();
  }
}
