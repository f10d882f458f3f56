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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.stmtcfg.code.IrType;

/**
 * A node in the statement tree of a function body, as produced by semantic analysis. There are
 * exactly nine kinds: the eight records defined in this file and {@link Expr} (an expression used
 * as a statement).
 *
 * <p>Statements are dispatched with {@link #accept}; since StmtVisitor has a method for each kind,
 * adding a kind to this interface forces each visitor to decide how to handle it.
 */
public sealed interface Stmt
    permits Stmt.Null,
        Stmt.Compound,
        Stmt.Labeled,
        Stmt.Goto,
        Stmt.If,
        Stmt.Return,
        Stmt.Decl,
        Stmt.Unlowered,
        Expr {

  /** Calls the {@code visitor} method that corresponds to this statement's kind. */
  <C> void accept(StmtVisitor<C> visitor, C context);

  /** The empty statement ({@code ;}). */
  Null NULL = new Null();

  /** Returns a compound statement containing the given statements. */
  static Compound compound(Stmt... body) {
    return new Compound(ImmutableList.copyOf(body));
  }

  /** {@code ;} */
  record Null() implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitNull(this, context);
    }
  }

  /** <code>{ s1; s2; ... }</code> */
  record Compound(ImmutableList<Stmt> body) implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitCompound(this, context);
    }
  }

  /** {@code label: body} */
  record Labeled(Label label, Stmt body) implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitLabeled(this, context);
    }
  }

  /** {@code goto label;} */
  record Goto(Label label) implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitGoto(this, context);
    }
  }

  /** {@code if (condition) then else otherwise}; {@code otherwise} is null if there is no else. */
  record If(Expr condition, Stmt then, @Nullable Stmt otherwise) implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitIf(this, context);
    }
  }

  /** {@code return value;}, or {@code return;} if value is null. */
  record Return(@Nullable Expr value) implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitReturn(this, context);
    }
  }

  /** A local variable declaration, {@code type name = init;} ({@code init} may be null). */
  record Decl(String name, IrType type, @Nullable Expr init) implements Stmt {
    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitDecl(this, context);
    }
  }

  /**
   * A statement that semantic analysis accepts but that cannot be lowered yet. Lowering one is an
   * error, never a no-op.
   */
  record Unlowered(Kind kind, String source) implements Stmt {
    /** The statement forms with no lowering. */
    public enum Kind {
      WHILE,
      DO,
      FOR,
      SWITCH,
      CASE,
      DEFAULT,
      BREAK,
      CONTINUE,
      INDIRECT_GOTO,
      ASM
    }

    @Override
    public <C> void accept(StmtVisitor<C> visitor, C context) {
      visitor.visitUnlowered(this, context);
    }
  }
}
