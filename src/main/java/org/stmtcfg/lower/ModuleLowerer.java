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
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.stmtcfg.code.Cfg;

/**
 * Lowers a group of functions, each independently (and possibly in parallel). A function that
 * can't be lowered doesn't prevent the others from being lowered.
 */
public class ModuleLowerer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FunctionLowerer functionLowerer;
  private final Executor executor;

  /**
   * {@code executor} is used to run one task for each function; for sequential lowering, use
   * {@code Runnable::run}.
   */
  public ModuleLowerer(FunctionLowerer functionLowerer, Executor executor) {
    this.functionLowerer = functionLowerer;
    this.executor = executor;
  }

  /**
   * The outcome of {@link #lowerAll}.
   *
   * @param lowered the block graph for each function that was lowered, in input order
   * @param failures the exception for each function that could not be lowered, in input order
   */
  public record Result(
      ImmutableMap<String, Cfg> lowered, ImmutableMap<String, LoweringException> failures) {}

  /**
   * Lowers each of the given functions, which must have distinct names. Any exception other than a
   * {@link LoweringException} indicates a bug (here or upstream) and is rethrown.
   */
  public Result lowerAll(List<FunctionDecl> functions) {
    Set<String> names = new HashSet<>();
    for (FunctionDecl fn : functions) {
      Preconditions.checkArgument(names.add(fn.name()), "Duplicate function %s", fn.name());
    }
    ImmutableList<CompletableFuture<Cfg>> futures =
        functions.stream()
            .map(fn -> CompletableFuture.supplyAsync(() -> functionLowerer.lower(fn), executor))
            .collect(ImmutableList.toImmutableList());
    ImmutableMap.Builder<String, Cfg> lowered = ImmutableMap.builder();
    ImmutableMap.Builder<String, LoweringException> failures = ImmutableMap.builder();
    for (int i = 0; i < futures.size(); i++) {
      String name = functions.get(i).name();
      try {
        lowered.put(name, futures.get(i).join());
      } catch (CompletionException e) {
        if (e.getCause() instanceof LoweringException loweringException) {
          logger.atFine().log("Lowering %s failed: %s", name, loweringException.getMessage());
          failures.put(name, loweringException);
        } else {
          Throwables.throwIfUnchecked(e.getCause());
          throw e;
        }
      }
    }
    Result result = new Result(lowered.buildOrThrow(), failures.buildOrThrow());
    logger.atFine().log(
        "Lowered %s of %s functions", result.lowered().size(), functions.size());
    return result;
  }
}
