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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.stmtcfg.code.Instruction.Terminator;
import org.stmtcfg.util.StringUtil;

/**
 * A BasicBlock is a straight-line sequence of {@link Instruction}s. If the block has been
 * terminated its last instruction is a {@link Terminator}, and no further instructions may be
 * added. Blocks are connected to each other only through the successors of their terminators.
 *
 * <p>Every block belongs to the {@link CfgBuilder} that allocated it, and has a handle ({@link
 * #id}) that is assigned at allocation and never changes, even if the block is later discarded.
 */
public final class BasicBlock {

  /** Where a block is relative to its function's block list. */
  public enum State {
    /** Allocated but not yet placed; may already be the target of branches. */
    DETACHED,
    /** In the function's block list. */
    PLACED,
    /** Removed from the block list; the handle remains valid but the block must not be reused. */
    DISCARDED
  }

  private final CfgBuilder cb;

  /** The index of this block in its CfgBuilder's arena. */
  private final int id;

  /**
   * Either a label name or a structural name (such as "ifthen"); null for anonymous blocks. A
   * named block is never considered a placeholder, even if it is empty.
   */
  private final @Nullable String name;

  private final List<Instruction> instructions = new ArrayList<>();

  /** One entry for each terminator that can transfer control here (with repeats). */
  private final List<BasicBlock> predecessors = new ArrayList<>();

  /** True if some other structure (e.g. a label table) holds on to this block. */
  private boolean pinned;

  private State state = State.DETACHED;

  BasicBlock(CfgBuilder cb, int id, @Nullable String name) {
    this.cb = cb;
    this.id = id;
    this.name = name;
  }

  /** The stable handle of this block within its function. */
  public int id() {
    return id;
  }

  public @Nullable String name() {
    return name;
  }

  /** Returns a short identifier for this block, used when printing branches to it. */
  public String label() {
    return (name == null ? "bb" : name) + "." + id;
  }

  public State state() {
    return state;
  }

  void setState(State state) {
    this.state = state;
  }

  final CfgBuilder cb() {
    return cb;
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  public boolean isEmpty() {
    return instructions.isEmpty();
  }

  /** Returns this block's terminator, or null if it has not been terminated. */
  public @Nullable Terminator terminator() {
    if (instructions.isEmpty()) {
      return null;
    }
    return (instructions.get(instructions.size() - 1) instanceof Terminator t) ? t : null;
  }

  public boolean isTerminated() {
    return terminator() != null;
  }

  /** The successors of this block's terminator; empty if it is unterminated or returns. */
  public ImmutableList<BasicBlock> successors() {
    Terminator t = terminator();
    return (t == null) ? ImmutableList.of() : t.successors();
  }

  /** The blocks whose terminators may transfer control here. */
  public List<BasicBlock> predecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  public boolean hasPredecessors() {
    return !predecessors.isEmpty();
  }

  /** Marks this block as referenced from outside the block graph; see {@link #isPlaceholder}. */
  @CanIgnoreReturnValue
  public BasicBlock pin() {
    pinned = true;
    return this;
  }

  public boolean isPinned() {
    return pinned;
  }

  /**
   * True if this block is an anonymous, empty, unreferenced block; such a block exists only to give
   * subsequent instructions somewhere to go, and may be discarded if nothing is added to it.
   */
  public boolean isPlaceholder() {
    return name == null && instructions.isEmpty() && predecessors.isEmpty() && !pinned;
  }

  /**
   * Appends an instruction. Throws an IllegalStateException if this block has already been
   * terminated or discarded, or if its CfgBuilder has been built. If the instruction is a terminator, records this block as a
   * predecessor of each of its successors.
   */
  void append(Instruction inst) {
    Preconditions.checkState(!cb.isBuilt(), "Block %s belongs to a finished graph", label());
    Preconditions.checkState(
        !isTerminated(), "Can't append \"%s\" to terminated block %s", inst, label());
    Preconditions.checkState(state != State.DISCARDED, "Block %s was discarded", label());
    if (inst instanceof Terminator t) {
      for (BasicBlock succ : t.successors()) {
        Preconditions.checkArgument(succ.cb == cb, "Branch to %s crosses functions", succ.label());
        Preconditions.checkArgument(succ.state != State.DISCARDED, "%s is discarded", succ.label());
        succ.predecessors.add(this);
      }
    }
    instructions.add(inst);
  }

  @Override
  public String toString() {
    return label()
        + ":\n"
        + StringUtil.indentLines("  ", instructions.size(), instructions::get);
  }
}
