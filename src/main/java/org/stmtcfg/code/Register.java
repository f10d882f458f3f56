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
 * A Register holds the result of a single instruction. Registers are created by {@link
 * CfgBuilder#newRegister} and are numbered sequentially within a function; they are never deleted
 * or renumbered.
 */
public final class Register implements CodeValue {
  public final int index;
  private final IrType type;

  Register(int index, IrType type) {
    assert type.isScalar();
    this.index = index;
    this.type = type;
  }

  @Override
  public IrType type() {
    return type;
  }

  @Override
  public String toString() {
    return "%" + index;
  }
}
