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

package org.stmtcfg.code;

/**
 * A DebugInfo aggregates information from a single CfgBuilder instance that may be useful for
 * understanding its results (e.g. when a later pass rejects the graph).
 */
public class DebugInfo {
  /**
   * A listing of the finished block graph, in layout order. Only created if {@link
   * CfgBuilder#verbose} is set.
   */
  public String blocks;

  /** The number of anonymous blocks started after an unconditional transfer. */
  public int numPlaceholders;

  /**
   * The number of placeholders that were discarded because nothing was added to them before the
   * next block was opened.
   */
  public int numDiscarded;

  @Override
  public String toString() {
    return String.format("%s placeholders, %s discarded", numPlaceholders, numDiscarded);
  }
}
