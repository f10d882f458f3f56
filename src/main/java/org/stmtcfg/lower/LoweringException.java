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

import org.stmtcfg.code.IrType;

/**
 * Thrown when a function uses a construct that cannot be lowered. Lowering of that function is
 * abandoned; no partial block graph is produced.
 */
public abstract class LoweringException extends RuntimeException {
  /** The statement that could not be lowered. */
  public final Stmt node;

  LoweringException(String message, Stmt node) {
    super(message);
    this.node = node;
  }

  /** The statement is of a kind that has no lowering. */
  public static class UnsupportedStatementKind extends LoweringException {
    public final Stmt.Unlowered.Kind kind;

    UnsupportedStatementKind(Stmt.Unlowered node) {
      super("Unimplemented statement kind " + node.kind() + ": " + node.source(), node);
      this.kind = node.kind();
    }
  }

  /** A {@code return} whose operand is an aggregate. */
  public static class UnsupportedAggregateReturn extends LoweringException {
    public final IrType type;

    UnsupportedAggregateReturn(Stmt.Return node, IrType type) {
      super("Unimplemented return of aggregate " + type, node);
      this.type = type;
    }
  }
}
