package sb3;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Allocates the blocks of one target and threads stack blocks into chains. Chains are values:
 * every append returns the advanced {@link Chain}, and nested bodies get a chain of their own.
 */
public final class BlockGraphBuilder {

  public static final int SCRIPT_SPACING = 200;

  @AutoValue
  public abstract static class Chain {
    public abstract Optional<String> container();

    public abstract Optional<String> head();

    public abstract Optional<String> tail();

    // Set after a block that never falls through, such as a forever loop.
    public abstract boolean closed();

    public static Chain script(String hatId) {
      return new AutoValue_BlockGraphBuilder_Chain(
          Optional.empty(), Optional.of(hatId), Optional.of(hatId), false);
    }

    public static Chain substack(String containerId) {
      return new AutoValue_BlockGraphBuilder_Chain(
          Optional.of(containerId), Optional.empty(), Optional.empty(), false);
    }

    public Chain advance(String id) {
      return new AutoValue_BlockGraphBuilder_Chain(
          container(), Optional.of(head().orElse(id)), Optional.of(id), closed());
    }

    public Chain close() {
      return new AutoValue_BlockGraphBuilder_Chain(container(), head(), tail(), true);
    }
  }

  private final IdAllocator ids;
  private final Map<String, Block.Builder> blocks = new LinkedHashMap<>();
  private int scripts = 0;

  public BlockGraphBuilder(IdAllocator ids) {
    this.ids = ids;
  }

  public IdAllocator ids() {
    return ids;
  }

  public Block.Builder block(String id) {
    Block.Builder block = blocks.get(id);
    Preconditions.checkArgument(block != null, "no block %s", id);
    return block;
  }

  public int size() {
    return blocks.size();
  }

  public Chain startScript(String opcode) {
    return startScript(ids.block(), opcode);
  }

  public Chain startScript(String hatId, String opcode) {
    register(Block.builder(hatId, opcode, Block.Kind.HAT))
        .setTopLevel(true)
        .setPosition(0, SCRIPT_SPACING * scripts++);
    return Chain.script(hatId);
  }

  // Links after the tail, or under the container while the chain is still empty.
  public Chain append(Chain chain, String opcode) {
    Preconditions.checkState(!chain.closed(), "appending %s to a closed chain", opcode);
    String id = ids.block();
    Block.Builder block = register(Block.builder(id, opcode, Block.Kind.STACK));
    if (chain.tail().isPresent()) {
      block(chain.tail().get()).setNext(id);
      block.setParent(chain.tail().get());
    } else {
      chain.container().ifPresent(block::setParent);
    }
    return chain.advance(id);
  }

  public Block.Builder reporter(String opcode) {
    Block.Kind kind = Opcodes.kindOf(opcode);
    return register(
        Block.builder(ids.block(), opcode, kind.isReporter() ? kind : Block.Kind.REPORTER));
  }

  public Block.Builder shadow(String opcode, String parentId) {
    return register(Block.builder(ids.block(), opcode, Block.Kind.SHADOW_MENU))
        .setParent(parentId);
  }

  public Block.Builder shadow(String id, String opcode, String parentId) {
    return register(Block.builder(id, opcode, Block.Kind.SHADOW_MENU)).setParent(parentId);
  }

  public InputValue menu(String opcode, String field, String value, String consumerId) {
    Block.Builder menu = shadow(opcode, consumerId).putField(field, Block.Field.of(value));
    return InputValue.menu(menu.id());
  }

  // Literals become shadow values. Compiled reporters are reparented to consumerId.
  public InputValue input(Operand operand, String consumerId) {
    switch (operand.type()) {
      case NUMBER:
        return InputValue.number(operand.text());
      case STRING:
        return InputValue.string(operand.text());
      case VARIABLE:
        {
          Block.Builder reporter =
              reporter(Opcodes.VARIABLE)
                  .putField(
                      "VARIABLE", Block.Field.of(operand.text(), operand.variableId().get()));
          reporter.setParent(consumerId);
          return InputValue.shadowedBlock(reporter.id(), InputValue.number("0"));
        }
      case BLOCK:
        block(operand.text()).setParent(consumerId);
        return InputValue.shadowedBlock(operand.text(), InputValue.number("0"));
      default:
        throw new AssertionError("Unknown operand type: " + operand.type());
    }
  }

  public InputValue attach(String id, String consumerId) {
    block(id).setParent(consumerId);
    return InputValue.block(id);
  }

  public BlockGraph build() {
    ImmutableList.Builder<Block> built = ImmutableList.builder();
    blocks.values().forEach(b -> built.add(b.build()));
    return BlockGraph.of(built.build());
  }

  private Block.Builder register(Block.Builder block) {
    Preconditions.checkState(
        blocks.putIfAbsent(block.id(), block) == null, "duplicate block id %s", block.id());
    return block;
  }
}
