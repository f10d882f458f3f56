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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural invariants that later passes rely on:
 *
 * <ul>
 *   <li>each placed block ends with exactly one terminator, and has no other terminators;
 *   <li>each successor of a placed block is itself placed;
 *   <li>predecessor lists agree with terminator successors;
 *   <li>block handles are unique.
 * </ul>
 */
public class CfgVerifier {

  private CfgVerifier() {}

  /** Returns a description of each problem found; empty if the graph is well formed. */
  public static ImmutableList<String> verify(Cfg cfg) {
    ImmutableList.Builder<String> problems = ImmutableList.builder();
    Set<Integer> ids = new HashSet<>();
    if (cfg.blocks().isEmpty()) {
      return ImmutableList.of(cfg.name() + " has no blocks");
    }
    for (BasicBlock b : cfg.blocks()) {
      if (!ids.add(b.id())) {
        problems.add("Duplicate block id " + b.id());
      }
      if (b.state() != BasicBlock.State.PLACED) {
        problems.add(b.label() + " is in the block list but " + b.state());
      }
      List<Instruction> insts = b.instructions();
      int numTerminators = 0;
      for (int i = 0; i < insts.size(); i++) {
        if (insts.get(i).isTerminator()) {
          ++numTerminators;
          if (i != insts.size() - 1) {
            problems.add(b.label() + " has terminator \"" + insts.get(i) + "\" before its end");
          }
        }
      }
      if (numTerminators == 0) {
        problems.add(b.label() + " has no terminator");
      } else if (numTerminators > 1) {
        problems.add(b.label() + " has " + numTerminators + " terminators");
      }
      for (BasicBlock succ : b.successors()) {
        if (succ.state() != BasicBlock.State.PLACED) {
          problems.add(b.label() + " branches to " + succ.label() + ", which is " + succ.state());
        } else if (!succ.predecessors().contains(b)) {
          problems.add(succ.label() + " is missing predecessor " + b.label());
        }
      }
    }
    return problems.build();
  }
}
