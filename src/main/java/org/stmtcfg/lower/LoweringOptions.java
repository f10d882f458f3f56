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
 * Options that control {@link FunctionLowerer}.
 *
 * @param verbose if true, each resulting Cfg's {@link org.stmtcfg.code.DebugInfo#blocks} will
 *     contain a listing of its blocks
 * @param verify if true, each resulting Cfg is checked with {@link
 *     org.stmtcfg.code.CfgVerifier} and an IllegalStateException is thrown if it is malformed
 */
public record LoweringOptions(boolean verbose, boolean verify) {
  public static final LoweringOptions DEFAULT = new LoweringOptions(false, true);

  public LoweringOptions withVerbose(boolean verbose) {
    return new LoweringOptions(verbose, verify);
  }

  public LoweringOptions withVerify(boolean verify) {
    return new LoweringOptions(verbose, verify);
  }
}
