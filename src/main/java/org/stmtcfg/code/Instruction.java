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
import org.jspecify.annotations.Nullable;
import org.stmtcfg.util.StringUtil;

/**
 * An Instruction is one step within a {@link BasicBlock}. Most instructions compute a value into a
 * {@link Register}; the exceptions are the {@link Terminator}s, which end a block by transferring
 * control. There are subclasses of Terminator with zero successors ({@link Return}), one successor
 * ({@link Branch}), and two successors ({@link CondBranch}).
 */
public abstract class Instruction {

  /** The register set by this instruction, or null if it does not produce a value. */
  public @Nullable Register result() {
    return null;
  }

  /** True if this instruction must be the last in its block. */
  public final boolean isTerminator() {
    return this instanceof Terminator;
  }

  /**
   * A generic computation; used by the expression and declaration collaborators for everything
   * that does not affect control flow (arithmetic, loads, stores, calls, ...).
   */
  public static final class Op extends Instruction {
    public final String opcode;
    public final ImmutableList<CodeValue> operands;
    private final @Nullable Register result;

    public Op(@Nullable Register result, String opcode, CodeValue... operands) {
      Preconditions.checkArgument(!opcode.isEmpty());
      this.result = result;
      this.opcode = opcode;
      this.operands = ImmutableList.copyOf(operands);
    }

    @Override
    public @Nullable Register result() {
      return result;
    }

    @Override
    public String toString() {
      String call =
          operands.isEmpty()
              ? opcode
              : opcode + StringUtil.joinElements(" ", "", operands.size(), operands::get);
      return (result == null) ? call : (result + " = " + call);
    }
  }

  /** Sets a boolean register to the result of comparing two scalars of the same type. */
  public static final class Compare extends Instruction {
    /** The comparisons emitted by statement lowering. */
    public enum Predicate {
      NE("ne");

      final String mnemonic;

      Predicate(String mnemonic) {
        this.mnemonic = mnemonic;
      }
    }

    public final Predicate predicate;
    public final CodeValue lhs;
    public final CodeValue rhs;
    private final Register result;

    public Compare(Register result, Predicate predicate, CodeValue lhs, CodeValue rhs) {
      Preconditions.checkArgument(result.type().equals(IrType.BOOL));
      Preconditions.checkArgument(
          lhs.type().equals(rhs.type()), "Mismatched types %s and %s", lhs.type(), rhs.type());
      this.result = result;
      this.predicate = predicate;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Register result() {
      return result;
    }

    @Override
    public String toString() {
      return String.format("%s = %s %s %s, %s", result, predicate.mnemonic, lhs.type(), lhs, rhs);
    }
  }

  /** An instruction that ends a block; it must be the block's last instruction. */
  public abstract static class Terminator extends Instruction {
    /** The blocks that control may be transferred to, in order; empty for a {@link Return}. */
    public abstract ImmutableList<BasicBlock> successors();
  }

  /** An unconditional transfer to {@code target}. */
  public static final class Branch extends Terminator {
    public final BasicBlock target;

    public Branch(BasicBlock target) {
      this.target = target;
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return "br " + target.label();
    }
  }

  /**
   * Transfers control to {@code ifTrue} if {@code condition} is true and to {@code ifFalse}
   * otherwise. The two targets may be the same block.
   */
  public static final class CondBranch extends Terminator {
    public final CodeValue condition;
    public final BasicBlock ifTrue;
    public final BasicBlock ifFalse;

    public CondBranch(CodeValue condition, BasicBlock ifTrue, BasicBlock ifFalse) {
      Preconditions.checkArgument(
          condition.type().equals(IrType.BOOL), "Condition must be i1, got %s", condition.type());
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return ImmutableList.of(ifTrue, ifFalse);
    }

    @Override
    public String toString() {
      return String.format("condbr %s, %s, %s", condition, ifTrue.label(), ifFalse.label());
    }
  }

  /** Returns from the function, with a value unless {@code value} is null. */
  public static final class Return extends Terminator {
    public final @Nullable CodeValue value;

    public Return(@Nullable CodeValue value) {
      this.value = value;
    }

    /** True if this is a return from a void function. */
    public boolean isVoid() {
      return value == null;
    }

    @Override
    public ImmutableList<BasicBlock> successors() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return (value == null) ? "ret void" : ("ret " + value.type() + " " + value);
    }
  }
}
