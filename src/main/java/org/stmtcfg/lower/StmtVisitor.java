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

/**
 * Called by {@link Stmt#accept} with the statement and a caller-supplied context; there is one
 * method for each kind of statement.
 */
public interface StmtVisitor<C> {
  void visitNull(Stmt.Null stmt, C context);

  void visitCompound(Stmt.Compound stmt, C context);

  void visitLabeled(Stmt.Labeled stmt, C context);

  void visitGoto(Stmt.Goto stmt, C context);

  void visitIf(Stmt.If stmt, C context);

  void visitReturn(Stmt.Return stmt, C context);

  void visitDecl(Stmt.Decl stmt, C context);

  void visitExpr(Expr expr, C context);

  void visitUnlowered(Stmt.Unlowered stmt, C context);
}
