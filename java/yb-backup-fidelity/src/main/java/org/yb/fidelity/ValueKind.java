// Copyright (c) YugaByte, Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
// in compliance with the License.  You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software distributed under the License
// is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
// or implied.  See the License for the specific language governing permissions and limitations
// under the License.
//
package org.yb.fidelity;

import com.google.common.base.Objects;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * The Java representations a cell or default value can take. Every {@link Type} maps to exactly
 * one kind, and each kind knows how two of its values are compared.
 */
public enum ValueKind {
  BOOL(Boolean.class),
  INT8(Byte.class),
  INT16(Short.class),
  INT32(Integer.class),
  INT64(Long.class),
  FLOAT(Float.class),
  DOUBLE(Double.class),
  DECIMAL(BigDecimal.class),
  STRING(String.class),
  BINARY(byte[].class) {
    @Override
    boolean sameValue(Object a, Object b) {
      // byte[] only has identity equality, compare the contents.
      return Arrays.equals((byte[]) a, (byte[]) b);
    }

    @Override
    public String render(Object value) {
      return value == null ? "null" : Arrays.toString((byte[]) value);
    }
  };

  private final Class<?> javaClass;

  ValueKind(Class<?> javaClass) {
    this.javaClass = javaClass;
  }

  /**
   * @return the class every value of this kind is an instance of
   */
  public Class<?> getJavaClass() {
    return javaClass;
  }

  /**
   * @return true if {@code value} is a non-null instance of this kind
   */
  public boolean accepts(Object value) {
    return javaClass.isInstance(value);
  }

  /**
   * Compares two values of this kind. Nulls are equal only to nulls.
   */
  public boolean valuesEqual(Object a, Object b) {
    if (a == b) return true;
    if (a == null || b == null) return false;
    if (!accepts(a) || !accepts(b)) return false;
    return sameValue(a, b);
  }

  boolean sameValue(Object a, Object b) {
    return Objects.equal(a, b);
  }

  /**
   * Renders a value for diagnostics and row dumps.
   */
  public String render(Object value) {
    return String.valueOf(value);
  }

  /**
   * Finds the kind whose Java class matches the runtime class of {@code value}.
   * @return the matching kind, or null for null and for values outside the union
   */
  public static ValueKind forValue(Object value) {
    if (value == null) {
      return null;
    }
    for (ValueKind kind : values()) {
      if (kind.accepts(value)) {
        return kind;
      }
    }
    return null;
  }
}
