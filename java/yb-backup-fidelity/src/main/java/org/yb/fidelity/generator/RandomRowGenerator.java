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

import com.google.common.base.Preconditions;
import org.yb.fidelity.ColumnSchema;
import org.yb.fidelity.Schema;
import org.yb.fidelity.client.PartialRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fills rows with random values that are valid for their schema. Nullable columns are set to
 * null about one time in ten, and non-key columns with a default are left unset about one time
 * in ten so that the stored default is used.
 */
public class RandomRowGenerator {
  public static final int NULL_ONE_IN = 10;
  public static final int DEFAULT_ONE_IN = 10;

  private final Random random;

  public RandomRowGenerator(Random random) {
    this.random = Preconditions.checkNotNull(random);
  }

  public static RandomRowGenerator forSeed(long seed) {
    return new RandomRowGenerator(new Random(seed));
  }

  /**
   * Generates {@code rowCount} rows of {@code schema}. The rows are not retained.
   */
  public List<PartialRow> generateRows(Schema schema, int rowCount) {
    Preconditions.checkArgument(rowCount >= 0, "Negative row count: %s", rowCount);
    List<PartialRow> rows = new ArrayList<>(rowCount);
    for (int i = 0; i < rowCount; i++) {
      PartialRow row = schema.newPartialRow();
      fillRow(row);
      rows.add(row);
    }
    return rows;
  }

  /**
   * Sets every column of {@code row} to a random value, to null, or leaves it to its default.
   */
  public void fillRow(PartialRow row) {
    Schema schema = row.getSchema();
    for (int i = 0; i < schema.getColumnCount(); i++) {
      ColumnSchema column = schema.getColumnByIndex(i);
      if (column.isNullable() && random.nextInt(NULL_ONE_IN) == 0) {
        row.setNull(i);
      } else if (column.getDefaultValue() != null && !column.isKey() &&
          random.nextInt(DEFAULT_ONE_IN) == 0) {
        // Use the default value.
        continue;
      } else {
        row.addObject(i, RandomValues.randomValue(column, random));
      }
    }
  }
}
