package sb3;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;

/** Lookups over compiled block graphs. */
final class BlockQueries {

  static ImmutableList<Block> all(Target target, String opcode) {
    return target.blocks().blocks().values().stream()
        .filter(b -> b.opcode().equals(opcode))
        .collect(ImmutableList.toImmutableList());
  }

  /** The one block of {@code target} with {@code opcode}. */
  static Block only(Target target, String opcode) {
    ImmutableList<Block> blocks = all(target, opcode);
    assertThat(blocks).hasSize(1);
    return blocks.get(0);
  }

  /** The block an input of {@code block} refers to. */
  static Block inputBlock(Target target, Block block, String input) {
    InputValue value = block.input(input).get();
    assertThat(value.referencedBlocks()).isNotEmpty();
    return target.blocks().get(value.referencedBlocks().get(0)).get();
  }

  /** Opcodes of the chain starting at {@code start}. */
  static ImmutableList<String> chainOpcodes(Target target, Block start) {
    return target.blocks().chain(start.id()).stream()
        .map(Block::opcode)
        .collect(ImmutableList.toImmutableList());
  }

  static Target sprite(CompilationResult result, String name) {
    return result.sprite(name).get();
  }

  private BlockQueries() {}
}
