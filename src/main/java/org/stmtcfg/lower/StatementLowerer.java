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
import org.stmtcfg.code.BasicBlock;
import org.stmtcfg.code.CfgBuilder;
import org.stmtcfg.code.CodeValue;
import org.stmtcfg.code.Instruction.Compare;
import org.stmtcfg.code.Instruction.CondBranch;
import org.stmtcfg.code.Instruction.Return;
import org.stmtcfg.code.IrType;
import org.stmtcfg.code.Register;

/**
 * Lowers statements into the block graph of a {@link LoweringContext}.
 *
 * <p>Each statement is lowered starting at the context's current block, and leaves the context
 * positioned at an unterminated block where the following statement should go. That block may be
 * unreachable (e.g. after a {@code goto} or {@code return}); control flow is only ever shaped
 * through {@link CfgBuilder#openBlock}, {@link CfgBuilder#startPlaceholder}, and terminators.
 *
 * <p>A StatementLowerer has no state of its own, so one instance can be shared by any number of
 * threads lowering different functions.
 */
public class StatementLowerer implements StmtVisitor<LoweringContext> {
  private final ExprLowering exprLowering;
  private final DeclLowering declLowering;
  private final Diagnostics diagnostics;

  public StatementLowerer(
      ExprLowering exprLowering, DeclLowering declLowering, Diagnostics diagnostics) {
    this.exprLowering = exprLowering;
    this.declLowering = declLowering;
    this.diagnostics = diagnostics;
  }

  /** Lowers {@code stmt}, appending to the current block of {@code cx}. */
  public void lowerStmt(Stmt stmt, LoweringContext cx) {
    stmt.accept(this, cx);
  }

  @Override
  public void visitNull(Stmt.Null stmt, LoweringContext cx) {}

  @Override
  public void visitCompound(Stmt.Compound stmt, LoweringContext cx) {
    for (Stmt s : stmt.body()) {
      lowerStmt(s, cx);
    }
  }

  @Override
  public void visitExpr(Expr expr, LoweringContext cx) {
    // Evaluated only for its side effects.
    var unused = exprLowering.evaluate(expr, cx);
  }

  @Override
  public void visitDecl(Stmt.Decl stmt, LoweringContext cx) {
    declLowering.lowerDecl(stmt, cx);
  }

  @Override
  public void visitUnlowered(Stmt.Unlowered stmt, LoweringContext cx) {
    diagnostics.reportUnimplemented(stmt.kind().toString(), stmt);
    throw new LoweringException.UnsupportedStatementKind(stmt);
  }

  @Override
  public void visitLabeled(Stmt.Labeled stmt, LoweringContext cx) {
    cx.cfg().openBlock(cx.labelBlock(stmt.label()));
    lowerStmt(stmt.body(), cx);
  }

  @Override
  public void visitGoto(Stmt.Goto stmt, LoweringContext cx) {
    CfgBuilder cfg = cx.cfg();
    cfg.branchTo(cx.labelBlock(stmt.label()));
    // Any code that follows is dead unless it's labeled, but it still needs a place to go.
    cfg.startPlaceholder();
  }

  @Override
  public void visitIf(Stmt.If stmt, LoweringContext cx) {
    CfgBuilder cfg = cx.cfg();
    CodeValue condition = emitTruthValue(exprLowering.evaluate(stmt.condition(), cx), cx);
    BasicBlock contBlock = cfg.newBlock("ifend");
    BasicBlock thenBlock = cfg.newBlock("ifthen");
    BasicBlock elseBlock = (stmt.otherwise() == null) ? contBlock : cfg.newBlock("ifelse");
    cfg.emit(new CondBranch(condition, thenBlock, elseBlock));

    cfg.openBlock(thenBlock);
    lowerStmt(stmt.then(), cx);
    cfg.branchTo(contBlock);

    if (stmt.otherwise() != null) {
      cfg.openBlock(elseBlock);
      lowerStmt(stmt.otherwise(), cx);
      cfg.branchTo(contBlock);
    }

    cfg.openBlock(contBlock);
  }

  /**
   * Returns an {@code i1} that is true if the given scalar compares unequal to the zero value of
   * its type.
   */
  private static CodeValue emitTruthValue(RValue cond, LoweringContext cx) {
    Preconditions.checkArgument(
        cond.isScalar() && cond.type().isScalar(),
        "Condition in %s must be a scalar, not %s",
        cx.functionName(),
        cond.type());
    CodeValue value = cond.value();
    if (value.type().equals(IrType.BOOL)) {
      return value;
    }
    Register result = cx.cfg().newRegister(IrType.BOOL);
    cx.cfg().emit(new Compare(result, Compare.Predicate.NE, value, value.type().zero()));
    return result;
  }

  /**
   * A return operand is always evaluated, even if the function returns void; a missing operand in a
   * function that returns a value is lowered as a return of undef.
   */
  @Override
  public void visitReturn(Stmt.Return stmt, LoweringContext cx) {
    RValue result = (stmt.value() == null) ? null : exprLowering.evaluate(stmt.value(), cx);
    CodeValue returned;
    if (cx.returnsVoid()) {
      returned = null;
    } else if (result == null) {
      returned = CodeValue.undef(cx.returnType());
    } else if (result.isScalar()) {
      // Any conversion to the declared type was done by ExprLowering.
      returned = result.value();
      Preconditions.checkArgument(
          returned != null, "Void operand of return in %s", cx.functionName());
    } else {
      diagnostics.reportUnimplemented("aggregate return", stmt);
      throw new LoweringException.UnsupportedAggregateReturn(stmt, result.type());
    }
    CfgBuilder cfg = cx.cfg();
    cfg.emit(new Return(returned));
    // As for goto, dead code that follows needs a place to go.
    cfg.startPlaceholder();
  }

  /**
   * Called after the function's body has been lowered. Drops the final block if it's an unused
   * placeholder; otherwise control can fall off the end of the function, so adds the implicit
   * return (of undef, if the function returns a value).
   */
  public void finishFunction(LoweringContext cx) {
    CfgBuilder cfg = cx.cfg();
    if (cfg.discardIfPlaceholder() || cfg.current().isTerminated()) {
      return;
    }
    cfg.emit(new Return(cx.returnsVoid() ? null : CodeValue.undef(cx.returnType())));
  }
}
