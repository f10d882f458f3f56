/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stmtcfg.code;

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.stmtcfg.code.BasicBlock.State;
import org.stmtcfg.code.Instruction.Branch;

/**
 * A CfgBuilder is used to assemble the block graph for a single function. The lifecycle of a
 * CfgBuilder is <nl>
 * <li>Create it; the entry block is allocated, placed, and becomes the current block.
 * <li>Allocate blocks with {@link #newBlock} (they may be branched to before they are placed), and
 *     append instructions to the current block with {@link #emit}.
 * <li>Move on to a new block with {@link #openBlock} (after a fallthrough) or {@link
 *     #startPlaceholder} (after an unconditional transfer).
 * <li>Call {@link #build} to get the finished {@link Cfg}. </nl>
 *
 * <p>Blocks live in an arena ({@link #arena}) indexed by {@link BasicBlock#id}; discarding a block
 * removes it from the layout but leaves it in the arena, so handles held elsewhere never dangle.
 */
public class CfgBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public final DebugInfo debugInfo = new DebugInfo();

  /** Every block that has been allocated ({@code arena.get(i).id() == i}). Never shrinks. */
  private final List<BasicBlock> arena = new ArrayList<>();

  /** The blocks that have been placed and not discarded, in the order they were placed. */
  private final List<BasicBlock> layout = new ArrayList<>();

  /** All registers that have been created ({@code registers.get(i).index == i}). */
  private final List<Register> registers = new ArrayList<>();

  /** The block that {@link #emit} appends to. */
  private BasicBlock current;

  private boolean built;

  /**
   * If true, {@link #build} will save a listing of the finished graph in {@link
   * DebugInfo#blocks}.
   */
  public boolean verbose;

  /** Creates a new CfgBuilder whose current block is a placed block named "entry". */
  public CfgBuilder() {
    current = newBlock("entry");
    place(current);
  }

  /** Allocates a new, detached block with the given name (null for an anonymous block). */
  public BasicBlock newBlock(@Nullable String name) {
    checkBuilding();
    BasicBlock result = new BasicBlock(this, arena.size(), name);
    arena.add(result);
    return result;
  }

  /** Returns the block with the given handle, whatever its state. */
  public BasicBlock block(int id) {
    BasicBlock result = arena.get(id);
    assert result.id() == id;
    return result;
  }

  /** The number of blocks that have been allocated, including any that were discarded. */
  public int numAllocated() {
    return arena.size();
  }

  /** The placed blocks, in order. */
  public ImmutableList<BasicBlock> blocks() {
    return ImmutableList.copyOf(layout);
  }

  /** The block that instructions are currently appended to. */
  public BasicBlock current() {
    return current;
  }

  /** Creates a new Register with the given type. */
  public Register newRegister(IrType type) {
    checkBuilding();
    Register result = new Register(registers.size(), type);
    registers.add(result);
    return result;
  }

  public int numRegisters() {
    return registers.size();
  }

  /** Appends {@code inst} to the current block. */
  public void emit(Instruction inst) {
    checkBuilding();
    current.append(inst);
  }

  /** Terminates the current block with an unconditional branch to {@code target}. */
  public void branchTo(BasicBlock target) {
    emit(new Branch(target));
  }

  /**
   * Makes {@code block} the current block, first deciding what to do with the previous one:
   *
   * <ul>
   *   <li>if it has already been terminated it is left alone;
   *   <li>if it is a placeholder (see {@link BasicBlock#isPlaceholder}) it is discarded;
   *   <li>otherwise it falls through to {@code block}, so it gets an explicit branch.
   * </ul>
   *
   * {@code block} must not have been placed already.
   */
  public void openBlock(BasicBlock block) {
    checkBuilding();
    Preconditions.checkArgument(block.cb() == this, "%s is from another function", block.label());
    Preconditions.checkState(
        block.state() == State.DETACHED, "%s is already %s", block.label(), block.state());
    BasicBlock prev = current;
    if (prev.isTerminated() || prev.state() == State.DISCARDED) {
      // Its exits are already explicit, or it's gone.
    } else if (prev.isPlaceholder()) {
      discard(prev);
    } else {
      prev.append(new Branch(block));
    }
    place(block);
    current = block;
  }

  /**
   * Places a new anonymous block and makes it current, without touching the previous block. Used
   * after an unconditional transfer so that any code that follows has some place to go; if nothing
   * is added to it, the next {@link #openBlock} or {@link #discardIfPlaceholder} drops it.
   */
  @CanIgnoreReturnValue
  public BasicBlock startPlaceholder() {
    BasicBlock result = newBlock(null);
    place(result);
    current = result;
    ++debugInfo.numPlaceholders;
    return result;
  }

  /**
   * If the current block is a placeholder, discards it and returns true. The current block is left
   * pointing at the discarded block, so this should only be called when no more instructions will
   * be emitted.
   */
  @CanIgnoreReturnValue
  public boolean discardIfPlaceholder() {
    checkBuilding();
    if (current.isPlaceholder()) {
      discard(current);
      return true;
    }
    return false;
  }

  private void place(BasicBlock block) {
    block.setState(State.PLACED);
    layout.add(block);
  }

  /**
   * Removes a placeholder from the layout. The block stays in the arena (as a tombstone) so that
   * its handle remains meaningful.
   */
  private void discard(BasicBlock block) {
    // A block that is pinned or branched to has an identity that someone else depends on.
    assert block.isPlaceholder() && block.state() == State.PLACED;
    // Placeholders are almost always the last block placed.
    int i = layout.lastIndexOf(block);
    layout.remove(i);
    block.setState(State.DISCARDED);
    ++debugInfo.numDiscarded;
  }

  /** Returns a string representation of the placed blocks, in order. */
  public String printBlocks() {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock b : layout) {
      if (sb.length() != 0) {
        sb.append("\n");
      }
      sb.append(b);
    }
    return sb.toString();
  }

  /**
   * Finishes construction and returns the block graph. No further changes may be made to this
   * CfgBuilder or its blocks.
   */
  public Cfg build(String functionName) {
    checkBuilding();
    built = true;
    if (verbose) {
      debugInfo.blocks = printBlocks();
    }
    logger.atFine().log(
        "%s: %s blocks placed, %s allocated, %s placeholders discarded",
        functionName, layout.size(), arena.size(), debugInfo.numDiscarded);
    logger.atFinest().log("Blocks for %s:\n%s", functionName, lazy(this::printBlocks));
    return new Cfg(functionName, ImmutableList.copyOf(layout), arena.size(), debugInfo);
  }

  /** True once {@link #build} has been called. */
  boolean isBuilt() {
    return built;
  }

  private void checkBuilding() {
    Preconditions.checkState(!built, "CfgBuilder has already been built");
  }
}
