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
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yb.fidelity.ColumnSchema;
import org.yb.fidelity.ColumnSchema.ColumnSchemaBuilder;
import org.yb.fidelity.ColumnSchema.CompressionAlgorithm;
import org.yb.fidelity.Schema;
import org.yb.fidelity.Type;
import org.yb.fidelity.client.CreateTableOptions;
import org.yb.fidelity.client.PartialRow;
import org.yb.fidelity.util.DecimalUtil;
import org.yb.fidelity.util.FidelityConf;
import org.yb.fidelity.util.RandomUtil;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Generates random table definitions that the storage engine accepts: every column gets a
 * random type, nullability, compression, block size, encoding valid for its type and
 * sometimes a default value; the table gets one to three hash partitioning levels and
 * sometimes a range partitioning on an int64 key column with distinct split points.
 *
 * Not thread-safe; all randomness comes from the {@link Random} passed in.
 */
public class RandomTableGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(RandomTableGenerator.class);

  // Max out at 3 levels to avoid being excessive.
  public static final int MAX_HASH_LEVELS = 3;
  public static final int MIN_HASH_BUCKETS = 2;
  public static final int MAX_HASH_BUCKETS = 9;
  public static final int MAX_RANGE_SPLITS = 7;

  // Default, min, middle, max.
  static final List<Integer> BLOCK_SIZES = ImmutableList.of(0, 4096, 524288, 1048576);

  private static final List<Type> ALL_TYPES = ImmutableList.copyOf(Type.values());
  private static final List<Type> KEY_TYPES = Type.keyTypes();
  private static final List<CompressionAlgorithm> COMPRESSIONS = compressions();

  private final Random random;
  private final int maxColumns;

  public RandomTableGenerator(Random random) {
    this(random, FidelityConf.DEFAULT_MAX_COLUMNS);
  }

  public RandomTableGenerator(Random random, int maxColumns) {
    Preconditions.checkArgument(maxColumns >= 1, "maxColumns must be positive: %s", maxColumns);
    this.random = Preconditions.checkNotNull(random);
    this.maxColumns = maxColumns;
  }

  /**
   * @return a generator whose output only depends on {@code seed}
   */
  public static RandomTableGenerator forSeed(long seed) {
    return new RandomTableGenerator(new Random(seed));
  }

  /**
   * Generates a schema and its partitioning.
   */
  public GeneratedTable generate() {
    int columnCount = random.nextInt(maxColumns) + 1; // At least one column.
    int keyCount = random.nextInt(columnCount) + 1; // At least one key.

    List<ColumnSchema> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      columns.add(randomColumn(i, i < keyCount));
    }
    Schema schema = new Schema(columns);

    CreateTableOptions options = new CreateTableOptions();
    addHashPartitions(schema, options);
    addRangePartitions(schema, options);

    GeneratedTable table = new GeneratedTable(schema, options);
    LOG.debug("Generated {}", table);
    return table;
  }

  ColumnSchema randomColumn(int index, boolean key) {
    Type type = RandomUtil.getRandomElement(key ? KEY_TYPES : ALL_TYPES, random);
    ColumnSchemaBuilder builder = new ColumnSchemaBuilder(type.getName() + "-" + index, type)
        .key(key)
        .nullable(!key && random.nextBoolean())
        .compressionAlgorithm(RandomUtil.getRandomElement(COMPRESSIONS, random))
        .desiredBlockSize(RandomUtil.getRandomElement(BLOCK_SIZES, random))
        .encoding(RandomUtil.getRandomElement(type.getValidEncodings(), random));

    if (type == Type.DECIMAL) {
      int precision = random.nextInt(DecimalUtil.MAX_DECIMAL_PRECISION) + 1;
      int scale = random.nextInt(precision);
      builder.typeAttributes(DecimalUtil.typeAttributes(precision, scale));
    }
    ColumnSchema column = builder.build();

    // Half the non-key columns have defaults, key columns cannot have one.
    if (!key && random.nextBoolean()) {
      column = new ColumnSchemaBuilder(column)
          .defaultValue(RandomValues.randomValue(column, random))
          .build();
    }
    return column;
  }

  private void addHashPartitions(Schema schema, CreateTableOptions options) {
    List<ColumnSchema> keyColumns = schema.getPrimaryKeyColumns();
    int levels = random.nextInt(Math.min(keyColumns.size(), MAX_HASH_LEVELS)) + 1;
    for (int level = 0; level < levels; level++) {
      ColumnSchema hashColumn = keyColumns.get(level);
      int buckets = random.nextInt(MAX_HASH_BUCKETS - MIN_HASH_BUCKETS + 1) + MIN_HASH_BUCKETS;
      int seed = random.nextInt();
      options.addHashPartitions(ImmutableList.of(hashColumn.getName()), buckets, seed);
    }
  }

  private void addRangePartitions(Schema schema, CreateTableOptions options) {
    ColumnSchema rangeColumn = null;
    for (ColumnSchema column : schema.getPrimaryKeyColumns()) {
      if (column.getType() == Type.INT64) {
        rangeColumn = column;
        break;
      }
    }
    if (!random.nextBoolean() || rangeColumn == null) {
      return;
    }
    options.setRangePartitionColumns(ImmutableList.of(rangeColumn.getName()));
    int splits = random.nextInt(MAX_RANGE_SPLITS + 1);
    Set<Long> used = new HashSet<>();
    while (used.size() < splits) {
      long value = random.nextLong();
      if (used.add(value)) {
        PartialRow split = schema.newPartialRow();
        split.addLong(rangeColumn.getName(), value);
        options.addSplitRow(split);
      }
    }
  }

  private static List<CompressionAlgorithm> compressions() {
    ImmutableList.Builder<CompressionAlgorithm> builder = ImmutableList.builder();
    for (CompressionAlgorithm compression : CompressionAlgorithm.values()) {
      if (compression != CompressionAlgorithm.UNKNOWN) {
        builder.add(compression);
      }
    }
    return builder.build();
  }
}
