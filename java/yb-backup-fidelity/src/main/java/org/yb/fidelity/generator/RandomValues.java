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
package org.yb.fidelity.generator;

import org.apache.commons.lang3.RandomStringUtils;
import org.yb.fidelity.ColumnSchema;
import org.yb.fidelity.ColumnTypeAttributes;
import org.yb.fidelity.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Random;

/**
 * Draws random values from the value domain of a column.
 */
final class RandomValues {
  /** Exclusive upper bound of string lengths (in chars) and binary lengths (in bytes). */
  static final int MAX_VARLEN_LENGTH = 100;

  private RandomValues() {
  }

  static Object randomValue(ColumnSchema column, Random random) {
    Type type = column.getType();
    switch (type) {
      case BOOL:
        return random.nextBoolean();
      case INT8:
        return (byte) random.nextInt();
      case INT16:
        return (short) random.nextInt();
      case INT32:
        return random.nextInt();
      case INT64:
      case UNIXTIME_MICROS:
        return random.nextLong();
      case FLOAT:
        return random.nextFloat();
      case DOUBLE:
        return random.nextDouble();
      case DECIMAL:
        return randomDecimal(column, random);
      case STRING:
        return RandomStringUtils.random(random.nextInt(MAX_VARLEN_LENGTH), 0, 0, false, false,
            null, random);
      case BINARY:
        byte[] bytes = new byte[random.nextInt(MAX_VARLEN_LENGTH)];
        random.nextBytes(bytes);
        return bytes;
      default:
        throw new GenerationException("Unsupported type " + type + " for column " +
            column.getName());
    }
  }

  /**
   * A decimal with at most {@code precision} digits, at exactly the column's scale.
   */
  static BigDecimal randomDecimal(ColumnSchema column, Random random) {
    ColumnTypeAttributes attributes = column.getTypeAttributes();
    BigInteger bound = BigInteger.TEN.pow(attributes.getPrecision());
    BigInteger unscaled = new BigInteger(bound.bitLength() + 8, random).mod(bound);
    if (random.nextBoolean()) {
      unscaled = unscaled.negate();
    }
    return new BigDecimal(unscaled, attributes.getScale());
  }
}
