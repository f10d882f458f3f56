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
import org.stmtcfg.code.Instruction.Op;
import org.stmtcfg.code.Instruction.Return;

@RunWith(JUnit4.class)
public class CfgBuilderTest {

  private CfgBuilder cb;

  @Before
  public void setup() {
    cb = new CfgBuilder();
    cb.verbose = true;
  }

  @Test
  public void entryBlock() {
    BasicBlock entry = cb.current();
    assertThat(entry.id()).isEqualTo(0);
    assertThat(entry.label()).isEqualTo("entry.0");
    assertThat(entry.state()).isEqualTo(BasicBlock.State.PLACED);
    assertThat(cb.blocks()).containsExactly(entry);
    assertThat(cb.block(0)).isSameInstanceAs(entry);
  }

  @Test
  public void fallthroughGetsBranch() {
    BasicBlock next = cb.newBlock("next");
    cb.emit(new Op(null, "call f"));
    cb.openBlock(next);
    assertThat(cb.current()).isSameInstanceAs(next);
    assertThat(cb.block(0).instructions().get(1).toString()).isEqualTo("br next.1");
    assertThat(next.predecessors()).containsExactly(cb.block(0));
  }

  @Test
  public void emptyEntryFallsThrough() {
    // The entry block is named, so it isn't a placeholder even when empty.
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThat(cb.block(0).toString()).isEqualTo("entry.0:\n  br next.1\n");
    assertThat(cb.blocks()).hasSize(2);
  }

  @Test
  public void terminatedBlockLeftAlone() {
    cb.emit(new Return(null));
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThat(cb.block(0).instructions()).hasSize(1);
    assertThat(next.hasPredecessors()).isFalse();
    assertThat(cb.blocks()).containsExactly(cb.block(0), next).inOrder();
  }

  @Test
  public void placeholderDiscarded() {
    cb.emit(new Return(null));
    BasicBlock placeholder = cb.startPlaceholder();
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThat(placeholder.state()).isEqualTo(BasicBlock.State.DISCARDED);
    assertThat(cb.blocks()).containsExactly(cb.block(0), next).inOrder();
    // The handle is still valid.
    assertThat(cb.block(placeholder.id())).isSameInstanceAs(placeholder);
    assertThat(cb.numAllocated()).isEqualTo(3);
    assertThat(cb.debugInfo.numPlaceholders).isEqualTo(1);
    assertThat(cb.debugInfo.numDiscarded).isEqualTo(1);
  }

  @Test
  public void usedPlaceholderKept() {
    cb.emit(new Return(null));
    BasicBlock placeholder = cb.startPlaceholder();
    cb.emit(new Op(null, "call f"));
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThat(placeholder.state()).isEqualTo(BasicBlock.State.PLACED);
    assertThat(placeholder.toString()).isEqualTo("bb.1:\n  call f\n  br next.2\n");
    assertThat(cb.debugInfo.numDiscarded).isEqualTo(0);
  }

  @Test
  public void pinnedAnonymousBlockKept() {
    cb.emit(new Return(null));
    cb.startPlaceholder().pin();
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThat(cb.block(1).state()).isEqualTo(BasicBlock.State.PLACED);
    assertThat(cb.block(1).successors()).containsExactly(next);
  }

  @Test
  public void openTwice() {
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThrows(IllegalStateException.class, () -> cb.openBlock(next));
  }

  @Test
  public void openDiscardedBlock() {
    cb.emit(new Return(null));
    BasicBlock placeholder = cb.startPlaceholder();
    cb.openBlock(cb.newBlock("next"));
    assertThrows(IllegalStateException.class, () -> cb.openBlock(placeholder));
  }

  @Test
  public void openBlockFromAnotherBuilder() {
    BasicBlock other = new CfgBuilder().newBlock("other");
    assertThrows(IllegalArgumentException.class, () -> cb.openBlock(other));
  }

  @Test
  public void discardIfPlaceholder() {
    assertThat(cb.discardIfPlaceholder()).isFalse();
    cb.emit(new Return(null));
    BasicBlock placeholder = cb.startPlaceholder();
    assertThat(cb.discardIfPlaceholder()).isTrue();
    assertThat(placeholder.state()).isEqualTo(BasicBlock.State.DISCARDED);
    // Nothing may be added once the current block has been discarded.
    assertThrows(IllegalStateException.class, () -> cb.emit(new Op(null, "call f")));
  }

  @Test
  public void openAfterDiscard() {
    cb.emit(new Return(null));
    cb.startPlaceholder();
    cb.discardIfPlaceholder();
    BasicBlock next = cb.newBlock("next");
    cb.openBlock(next);
    assertThat(cb.blocks()).containsExactly(cb.block(0), next).inOrder();
    assertThat(cb.debugInfo.numDiscarded).isEqualTo(1);
  }

  @Test
  public void registersNumberedInOrder() {
    Register r0 = cb.newRegister(IrType.I32);
    Register r1 = cb.newRegister(IrType.BOOL);
    assertThat(r0.index).isEqualTo(0);
    assertThat(r1.index).isEqualTo(1);
    assertThat(r1.type()).isEqualTo(IrType.BOOL);
    assertThat(cb.numRegisters()).isEqualTo(2);
  }

  @Test
  public void build() {
    Register x = cb.newRegister(IrType.I32);
    cb.emit(new Op(x, "load x"));
    BasicBlock exit = cb.newBlock("exit");
    cb.openBlock(exit);
    cb.emit(new Return(x));

    Cfg cfg = cb.build("f");

    String expected =
        """
        entry.0:
          %0 = load x
          br exit.1

        exit.1:
          ret i32 %0
        """;
    assertThat(cfg.debugInfo().blocks).isEqualTo(expected);
    assertThat(cfg.entry()).isSameInstanceAs(cb.block(0));
    assertThat(cfg.blockNamed("exit")).hasValue(exit);
    assertThat(cfg.block(1)).hasValue(exit);
    assertThat(cfg.block(2)).isEmpty();
    assertThat(cfg.numAllocated()).isEqualTo(2);
    assertThat(cfg.toString()).startsWith("f:\nentry.0:\n");
  }

  @Test
  public void noChangesAfterBuild() {
    cb.emit(new Return(null));
    var unused = cb.build("f");
    assertThrows(IllegalStateException.class, () -> cb.newBlock("late"));
    assertThrows(IllegalStateException.class, () -> cb.emit(new Op(null, "call f")));
    assertThrows(IllegalStateException.class, () -> cb.build("f"));
  }

  @Test
  public void quietBuildHasNoListing() {
    CfgBuilder quiet = new CfgBuilder();
    quiet.emit(new Return(null));
    assertThat(quiet.build("g").debugInfo().blocks).isNull();
  }
}
