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

/** Lowers local declarations; supplied by the client of this package. */
public interface DeclLowering {
  /**
   * Appends whatever instructions are needed to create (and initialize, if {@code decl.init()} is
   * non-null) the declared variable. The same restrictions apply as for {@link
   * ExprLowering#evaluate}.
   */
  void lowerDecl(Stmt.Decl decl, LoweringContext cx);
}
