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
import com.google.common.collect.ImmutableList;
import org.stmtcfg.util.StringUtil;

/**
 * The types that values in the block graph may have. There are exactly five implementations, all
 * defined in this file: VoidType, Int, Float, Pointer, and Aggregate. Int, Float, and Pointer are
 * scalars; Aggregate values are never held in a single register.
 */
public sealed interface IrType {

  /** The type of a function that returns no value. */
  IrType VOID = new VoidType();

  /** The type of the result of a comparison. */
  Int BOOL = new Int(1);

  Int I32 = new Int(32);

  Int I64 = new Int(64);

  Float F64 = new Float(64);

  /** True if values of this type can be compared against zero and held in a register. */
  default boolean isScalar() {
    return false;
  }

  default boolean isVoid() {
    return this == VOID;
  }

  /**
   * Returns the constant that a scalar of this type is compared against to decide its truth (0,
   * 0.0, or null). Should only be called on scalar types.
   */
  default CodeValue.Const zero() {
    throw new AssertionError("No zero value for " + this);
  }

  /** The return type of a function with no result. */
  final class VoidType implements IrType {
    private VoidType() {}

    @Override
    public String toString() {
      return "void";
    }
  }

  /** An integer with the given number of bits; {@code Int(1)} is the boolean type. */
  record Int(int bits) implements IrType {
    public Int {
      Preconditions.checkArgument(bits > 0, "Bad width %s", bits);
    }

    @Override
    public boolean isScalar() {
      return true;
    }

    @Override
    public CodeValue.Const zero() {
      return CodeValue.of(this, 0L);
    }

    @Override
    public String toString() {
      return "i" + bits;
    }
  }

  /** A binary floating point number (32 or 64 bits). */
  record Float(int bits) implements IrType {
    public Float {
      Preconditions.checkArgument(bits == 32 || bits == 64, "Bad width %s", bits);
    }

    @Override
    public boolean isScalar() {
      return true;
    }

    @Override
    public CodeValue.Const zero() {
      return CodeValue.of(this, 0.0);
    }

    @Override
    public String toString() {
      return "f" + bits;
    }
  }

  /** A pointer to a value of the given type; its zero value is null. */
  record Pointer(IrType pointee) implements IrType {
    @Override
    public boolean isScalar() {
      return true;
    }

    @Override
    public CodeValue.Const zero() {
      return CodeValue.nullOf(this);
    }

    @Override
    public String toString() {
      return pointee + "*";
    }
  }

  /** A struct, union, or array; {@code name} is only used for printing. */
  record Aggregate(String name, ImmutableList<IrType> fields) implements IrType {
    @Override
    public String toString() {
      return StringUtil.joinElements(name + "{", "}", fields.size(), fields::get);
    }
  }
}
