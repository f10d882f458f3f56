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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stmtcfg.code.Instruction.Branch;
import org.stmtcfg.code.Instruction.CondBranch;
import org.stmtcfg.code.Instruction.Op;
import org.stmtcfg.code.Instruction.Return;

@RunWith(JUnit4.class)
public class BasicBlockTest {

  private CfgBuilder cb;

  @Before
  public void setup() {
    cb = new CfgBuilder();
  }

  @Test
  public void labels() {
    BasicBlock named = cb.newBlock("ifthen");
    BasicBlock anonymous = cb.newBlock(null);
    assertThat(named.label()).isEqualTo("ifthen.1");
    assertThat(anonymous.label()).isEqualTo("bb.2");
    assertThat(anonymous.name()).isNull();
    assertThat(named.state()).isEqualTo(BasicBlock.State.DETACHED);
  }

  @Test
  public void appendAfterTerminator() {
    BasicBlock b = cb.current();
    b.append(new Return(null));
    assertThat(b.isTerminated()).isTrue();
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> b.append(new Op(null, "call f")));
    assertThat(e).hasMessageThat().contains("terminated block entry.0");
  }

  @Test
  public void appendAfterBuild() {
    BasicBlock entry = cb.current();
    var unused = cb.build("f");
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> entry.append(new Return(null)));
    assertThat(e).hasMessageThat().contains("finished graph");
    assertThat(entry.isEmpty()).isTrue();
  }

  @Test
  public void terminatorRecordsPredecessors() {
    BasicBlock entry = cb.current();
    BasicBlock target = cb.newBlock("target");
    Register cond = cb.newRegister(IrType.BOOL);
    // Both arms go to the same block, so it gets the predecessor twice.
    entry.append(new CondBranch(cond, target, target));
    assertThat(target.predecessors()).containsExactly(entry, entry);
    assertThat(entry.successors()).containsExactly(target, target).inOrder();
    assertThat(target.successors()).isEmpty();
  }

  @Test
  public void nonTerminatorsAddNoEdges() {
    BasicBlock entry = cb.current();
    entry.append(new Op(null, "call f"));
    assertThat(entry.isTerminated()).isFalse();
    assertThat(entry.terminator()).isNull();
    assertThat(entry.successors()).isEmpty();
  }

  @Test
  public void placeholderRules() {
    BasicBlock anonymous = cb.newBlock(null);
    assertThat(anonymous.isPlaceholder()).isTrue();
    assertThat(cb.newBlock("ifend").isPlaceholder()).isFalse();
    assertThat(cb.newBlock(null).pin().isPlaceholder()).isFalse();

    BasicBlock nonEmpty = cb.newBlock(null);
    nonEmpty.append(new Op(null, "call f"));
    assertThat(nonEmpty.isPlaceholder()).isFalse();

    cb.current().append(new Branch(anonymous));
    assertThat(anonymous.isPlaceholder()).isFalse();
  }

  @Test
  public void branchToBlockFromAnotherFunction() {
    BasicBlock other = new CfgBuilder().current();
    assertThrows(IllegalArgumentException.class, () -> cb.current().append(new Branch(other)));
    assertThat(cb.current().isTerminated()).isFalse();
  }

  @Test
  public void printed() {
    BasicBlock entry = cb.current();
    Register r = cb.newRegister(IrType.I32);
    entry.append(new Op(r, "load x"));
    entry.append(new Return(r));
    assertThat(entry.toString()).isEqualTo("entry.0:\n  %0 = load x\n  ret i32 %0\n");
  }
}
