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
package org.yb.fidelity.util;

import com.google.common.base.Preconditions;
import org.yb.fidelity.ColumnTypeAttributes;
import org.yb.fidelity.ColumnTypeAttributes.ColumnTypeAttributesBuilder;

import java.math.BigDecimal;
import java.math.BigInteger;

public final class DecimalUtil {
  public static final int MAX_DECIMAL_PRECISION = 38;

  private DecimalUtil() {
  }

  /**
   * Returns the largest decimal value that fits a column with the given precision and scale.
   */
  public static BigDecimal maxValue(int precision, int scale) {
    BigInteger unscaled = BigInteger.TEN.pow(precision).subtract(BigInteger.ONE);
    return new BigDecimal(unscaled, scale);
  }

  /**
   * Returns the smallest decimal value that fits a column with the given precision and scale.
   */
  public static BigDecimal minValue(int precision, int scale) {
    return maxValue(precision, scale).negate();
  }

  /**
   * @return true if {@code value} can be stored unchanged in a column with these attributes
   */
  public static boolean fits(BigDecimal value, ColumnTypeAttributes typeAttributes) {
    return value.scale() == typeAttributes.getScale() &&
        value.precision() <= typeAttributes.getPrecision();
  }

  public static ColumnTypeAttributes typeAttributes(int precision, int scale) {
    Preconditions.checkArgument(precision >= 1 && precision <= MAX_DECIMAL_PRECISION,
        "Invalid decimal precision: %s", precision);
    Preconditions.checkArgument(scale >= 0 && scale <= precision,
        "Invalid decimal scale %s for precision %s", scale, precision);
    return new ColumnTypeAttributesBuilder()
        .precision(precision)
        .scale(scale)
        .build();
  }
}
