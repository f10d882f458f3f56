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
import org.jspecify.annotations.Nullable;
import org.stmtcfg.code.CodeValue;
import org.stmtcfg.code.IrType;

/**
 * The result of evaluating an expression. A scalar result is held in a single {@link CodeValue};
 * an aggregate result is identified by the address of the memory holding it.
 *
 * @param value for a scalar, the value itself (null only if the expression has type void); for an
 *     aggregate, its address
 */
public record RValue(Kind kind, IrType type, @Nullable CodeValue value) {

  /** Whether the result fits in a register. */
  public enum Kind {
    SCALAR,
    AGGREGATE
  }

  /** The result of an expression of type void, e.g. a call to a function with no result. */
  public static final RValue VOID = new RValue(Kind.SCALAR, IrType.VOID, null);

  public RValue {
    assert (value == null) == (type == IrType.VOID);
    Preconditions.checkArgument(
        kind == Kind.SCALAR || type instanceof IrType.Aggregate, "Bad aggregate type %s", type);
  }

  public static RValue scalar(CodeValue value) {
    return new RValue(Kind.SCALAR, value.type(), value);
  }

  public static RValue aggregate(IrType.Aggregate type, CodeValue address) {
    return new RValue(Kind.AGGREGATE, type, address);
  }

  public boolean isScalar() {
    return kind == Kind.SCALAR;
  }
}
