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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A CodeValue is an operand of an {@link Instruction}: a constant, an undefined value, or a {@link
 * Register} holding the result of an earlier instruction.
 */
public sealed interface CodeValue permits CodeValue.Const, CodeValue.Undef, Register {

  CodeValue.Const ZERO = of(IrType.I32, 0L);

  CodeValue.Const ONE = of(IrType.I32, 1L);

  /** The type of this value. */
  IrType type();

  /** Returns an integer constant of the given type. */
  static Const of(IrType.Int type, long value) {
    return new Const(type, value);
  }

  /** Returns a floating point constant of the given type. */
  static Const of(IrType.Float type, double value) {
    return new Const(type, value);
  }

  /** Returns the null constant of the given pointer type. */
  static Const nullOf(IrType.Pointer type) {
    return new Const(type, null);
  }

  /** Returns a value of the given type whose contents are unspecified. */
  static Undef undef(IrType type) {
    Preconditions.checkArgument(!type.isVoid());
    return new Undef(type);
  }

  /**
   * A constant scalar. {@code value} is a Long for integers, a Double for floats, and null for the
   * null pointer.
   */
  record Const(IrType type, @Nullable Number value) implements CodeValue {
    public Const {
      Preconditions.checkArgument(type.isScalar(), "Not a scalar type: %s", type);
      assert (value == null) == (type instanceof IrType.Pointer);
    }

    /** True if this is the zero value of its type. */
    public boolean isZero() {
      return value == null || value.doubleValue() == 0;
    }

    @Override
    public String toString() {
      return value == null ? "null" : value.toString();
    }
  }

  /** A value whose contents are unspecified; LLVM's {@code undef}. */
  record Undef(IrType type) implements CodeValue {
    @Override
    public String toString() {
      return "undef";
    }
  }
}
