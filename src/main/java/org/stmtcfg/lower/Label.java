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

/**
 * The identity of a label in the source program. Labels are compared by identity: every {@link
 * Stmt.Goto} that refers to a label and the {@link Stmt.Labeled} that defines it must share the
 * same Label object (this is the job of semantic analysis), while two distinct Labels with the same
 * name (e.g. in different functions) are unrelated.
 */
public final class Label {
  public final String name;

  public Label(String name) {
    Preconditions.checkArgument(!name.isEmpty());
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
