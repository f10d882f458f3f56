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

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * The finished block graph for one function, as returned by {@link CfgBuilder#build}.
 *
 * @param name the function's name
 * @param blocks the placed blocks in layout order; the first is always the entry block
 * @param numAllocated the number of block handles that were handed out, including handles of
 *     discarded blocks
 */
public record Cfg(
    String name, ImmutableList<BasicBlock> blocks, int numAllocated, DebugInfo debugInfo) {

  public BasicBlock entry() {
    return blocks.get(0);
  }

  /** Returns the placed block with the given handle, if there is one. */
  public Optional<BasicBlock> block(int id) {
    return blocks.stream().filter(b -> b.id() == id).findFirst();
  }

  /** Returns the placed block with the given name, if there is exactly one. */
  public Optional<BasicBlock> blockNamed(String blockName) {
    ImmutableList<BasicBlock> matches =
        blocks.stream()
            .filter(b -> blockName.equals(b.name()))
            .collect(ImmutableList.toImmutableList());
    return (matches.size() == 1) ? Optional.of(matches.get(0)) : Optional.empty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name).append(":\n");
    for (BasicBlock b : blocks) {
      sb.append(b);
    }
    return sb.toString();
  }
}
