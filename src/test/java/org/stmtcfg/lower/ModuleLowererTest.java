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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.stmtcfg.lower.TestExprs.call;
import static org.stmtcfg.lower.TestExprs.lit;
import static org.stmtcfg.lower.TestExprs.var;

import com.google.common.collect.ImmutableList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.stmtcfg.code.IrType;
import org.stmtcfg.lower.TestExprs.FakeDeclLowering;
import org.stmtcfg.lower.TestExprs.FakeExprLowering;
import org.stmtcfg.lower.TestExprs.RecordingDiagnostics;

@RunWith(JUnit4.class)
public class ModuleLowererTest {

  private ExecutorService executor;
  private RecordingDiagnostics diags;
  private ModuleLowerer moduleLowerer;

  @Before
  public void setup() {
    executor = Executors.newFixedThreadPool(4);
    diags = new RecordingDiagnostics();
    FakeExprLowering exprs = new FakeExprLowering();
    StatementLowerer lowerer = new StatementLowerer(exprs, new FakeDeclLowering(exprs), diags);
    moduleLowerer = new ModuleLowerer(new FunctionLowerer(lowerer), executor);
  }

  @After
  public void shutdown() {
    executor.shutdownNow();
  }

  private static FunctionDecl returnsX(String name) {
    return new FunctionDecl(
        name, IrType.I32, new Stmt.If(var("x"), new Stmt.Return(lit(1)), new Stmt.Return(lit(0))));
  }

  @Test
  public void failuresAreIsolated() {
    ImmutableList.Builder<FunctionDecl> functions = ImmutableList.builder();
    for (int i = 0; i < 20; i++) {
      functions.add(returnsX("f" + i));
    }
    functions.add(
        new FunctionDecl(
            "loops", IrType.VOID, new Stmt.Unlowered(Stmt.Unlowered.Kind.WHILE, "while (x) ;")));
    functions.add(new FunctionDecl("calls", IrType.VOID, call("g")));

    ModuleLowerer.Result result = moduleLowerer.lowerAll(functions.build());

    assertThat(result.lowered()).hasSize(21);
    assertThat(result.lowered().keySet()).doesNotContain("loops");
    assertThat(result.failures().keySet()).containsExactly("loops");
    assertThat(result.failures().get("loops"))
        .isInstanceOf(LoweringException.UnsupportedStatementKind.class);
    assertThat(diags.reports).hasSize(1);
    // Each function was lowered in its own context.
    for (int i = 0; i < 20; i++) {
      assertThat(result.lowered().get("f" + i).toString())
          .isEqualTo(result.lowered().get("f0").toString().replaceFirst("f0", "f" + i));
    }
  }

  @Test
  public void resultsInInputOrder() {
    ModuleLowerer.Result result =
        moduleLowerer.lowerAll(ImmutableList.of(returnsX("c"), returnsX("a"), returnsX("b")));
    assertThat(result.lowered().keySet()).containsExactly("c", "a", "b").inOrder();
    assertThat(result.failures()).isEmpty();
  }

  @Test
  public void duplicateNames() {
    ImmutableList<FunctionDecl> functions = ImmutableList.of(returnsX("f"), returnsX("f"));
    assertThrows(IllegalArgumentException.class, () -> moduleLowerer.lowerAll(functions));
  }

  @Test
  public void otherExceptionsPropagate() {
    Stmt body = new Stmt.Goto(new Label("nowhere"));
    ImmutableList<FunctionDecl> functions =
        ImmutableList.of(returnsX("f"), new FunctionDecl("g", IrType.VOID, body));
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> moduleLowerer.lowerAll(functions));
    assertThat(e).hasMessageThat().contains("nowhere");
  }

  @Test
  public void sequential() {
    FakeExprLowering exprs = new FakeExprLowering();
    StatementLowerer lowerer = new StatementLowerer(exprs, new FakeDeclLowering(exprs), diags);
    ModuleLowerer sequential = new ModuleLowerer(new FunctionLowerer(lowerer), Runnable::run);
    ModuleLowerer.Result result = sequential.lowerAll(ImmutableList.of(returnsX("f")));
    assertThat(result.lowered().get("f").blocks()).hasSize(6);
  }
}
