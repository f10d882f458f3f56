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
 * An expression. Expressions are defined (and lowered) by the {@link ExprLowering} collaborator;
 * this package only needs their type and the ability to use one as a statement, in which case it
 * is evaluated for its side effects and the result is discarded.
 */
public non-sealed interface Expr extends Stmt {

  /** The type of the value this expression computes ({@link IrType#VOID} if none). */
  IrType type();

  @Override
  default <C> void accept(StmtVisitor<C> visitor, C context) {
    visitor.visitExpr(this, context);
  }
}
