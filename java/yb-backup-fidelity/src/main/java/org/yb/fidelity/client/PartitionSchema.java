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
package org.yb.fidelity.client;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A partition schema describes how the rows of a table are distributed among
 * tablets, as reported by the cluster for an existing table.
 *
 * The partition schema is made up of zero or more hash bucket components,
 * followed by a single range component. Both refer to columns by column id.
 *
 * Each hash bucket component includes one or more columns from the primary key
 * column set, with the restriction that an individual primary key column may
 * only be included in a single hash component.
 */
public class PartitionSchema {

  private final RangeSchema rangeSchema;
  private final List<HashBucketSchema> hashBucketSchemas;

  /**
   * Creates a new partition schema from the range and hash bucket schemas.
   *
   * @param rangeSchema the range schema
   * @param hashBucketSchemas the hash bucket schemas
   */
  public PartitionSchema(RangeSchema rangeSchema, List<HashBucketSchema> hashBucketSchemas) {
    this.rangeSchema = rangeSchema;
    this.hashBucketSchemas = ImmutableList.copyOf(hashBucketSchemas);
  }

  public RangeSchema getRangeSchema() {
    return rangeSchema;
  }

  public List<HashBucketSchema> getHashBucketSchemas() {
    return hashBucketSchemas;
  }

  @Override
  public String toString() {
    return "PartitionSchema(hash=" + hashBucketSchemas + ", range=" + rangeSchema + ")";
  }

  public static class RangeSchema {
    private final List<Integer> columnIds;

    /**
     * @param columnIds the range columns, empty for a table without range partitioning
     */
    public RangeSchema(List<Integer> columnIds) {
      this.columnIds = ImmutableList.copyOf(columnIds);
    }

    /**
     * Gets the column IDs of the columns in the range partition.
     */
    public List<Integer> getColumnIds() {
      return columnIds;
    }

    @Override
    public String toString() {
      return "RangeSchema" + columnIds;
    }
  }

  public static class HashBucketSchema {
    private final List<Integer> columnIds;
    private final int numBuckets;
    private final int seed;

    public HashBucketSchema(List<Integer> columnIds, int numBuckets, int seed) {
      this.columnIds = ImmutableList.copyOf(columnIds);
      this.numBuckets = numBuckets;
      this.seed = seed;
    }

    /**
     * Gets the column IDs of the columns in the hash partition.
     * @return the column IDs of the columns in the has partition
     */
    public List<Integer> getColumnIds() {
      return columnIds;
    }

    public int getNumBuckets() {
      return numBuckets;
    }

    public int getSeed() {
      return seed;
    }

    @Override
    public String toString() {
      return "HashBucketSchema(columns=" + columnIds + ", buckets=" + numBuckets +
          ", seed=" + seed + ")";
    }
  }
}
