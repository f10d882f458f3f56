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

package org.stmtcfg.lower;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.stmtcfg.code.BasicBlock;
import org.stmtcfg.code.CfgBuilder;
import org.stmtcfg.code.IrType;

/**
 * The state of lowering a single function: the {@link CfgBuilder} (which owns the blocks and the
 * current insertion point), the label table, and the function's declared return type.
 *
 * <p>A LoweringContext is passed explicitly to every lowering call and is only used by one thread;
 * functions can be lowered in parallel by giving each its own context.
 */
public final class LoweringContext {
  private final String functionName;
  private final IrType returnType;
  private final CfgBuilder cfg = new CfgBuilder();

  /**
   * Each label that has been referenced so far, and its block. Entries are added on first
   * reference (by a goto or by the labeled statement) and never replaced. Labels are keyed by
   * identity, since {@link Label} does not override {@code equals}.
   */
  private final Map<Label, BasicBlock> labels = new LinkedHashMap<>();

  public LoweringContext(String functionName, IrType returnType) {
    this.functionName = functionName;
    this.returnType = returnType;
  }

  public String functionName() {
    return functionName;
  }

  /** The function's declared return type. */
  public IrType returnType() {
    return returnType;
  }

  public boolean returnsVoid() {
    return returnType.isVoid();
  }

  public CfgBuilder cfg() {
    return cfg;
  }

  /**
   * Returns the block for the given label, allocating it (named after the label, and not yet
   * placed) the first time the label is referenced. The block is pinned, so it will never be
   * discarded as a placeholder.
   */
  public BasicBlock labelBlock(Label label) {
    return labels.computeIfAbsent(label, l -> cfg.newBlock(l.name).pin());
  }

  /** Returns the label table, in order of first reference. */
  public ImmutableMap<Label, BasicBlock> labels() {
    return ImmutableMap.copyOf(labels);
  }
}
