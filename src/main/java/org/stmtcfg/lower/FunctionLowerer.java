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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.Map;
import org.stmtcfg.code.BasicBlock;
import org.stmtcfg.code.Cfg;
import org.stmtcfg.code.CfgVerifier;

/**
 * Lowers a complete function: creates its {@link LoweringContext}, lowers the body, finishes the
 * last block, and checks the result.
 */
public class FunctionLowerer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final StatementLowerer lowerer;
  private final LoweringOptions options;

  public FunctionLowerer(StatementLowerer lowerer, LoweringOptions options) {
    this.lowerer = lowerer;
    this.options = options;
  }

  public FunctionLowerer(StatementLowerer lowerer) {
    this(lowerer, LoweringOptions.DEFAULT);
  }

  /**
   * Returns the block graph for the given function. Throws a {@link LoweringException} if the
   * function uses a construct that can't be lowered.
   */
  public Cfg lower(FunctionDecl fn) {
    LoweringContext cx = new LoweringContext(fn.name(), fn.returnType());
    cx.cfg().verbose = options.verbose();
    lowerer.lowerStmt(fn.body(), cx);
    lowerer.finishFunction(cx);
    for (Map.Entry<Label, BasicBlock> entry : cx.labels().entrySet()) {
      Preconditions.checkState(
          entry.getValue().state() == BasicBlock.State.PLACED,
          "Label %s in %s is used but not defined",
          entry.getKey(),
          fn.name());
    }
    Cfg result = cx.cfg().build(fn.name());
    if (options.verify()) {
      ImmutableList<String> problems = CfgVerifier.verify(result);
      if (!problems.isEmpty()) {
        throw new IllegalStateException(
            "Malformed block graph for " + fn.name() + ":\n  " + String.join("\n  ", problems));
      }
    }
    logger.atFine().log(
        "Lowered %s: %s blocks (%s)", fn.name(), result.blocks().size(), result.debugInfo());
    return result;
  }
}
