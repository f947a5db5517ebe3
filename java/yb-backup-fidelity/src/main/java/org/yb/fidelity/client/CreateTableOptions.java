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
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

/**
 * This is a builder class for all the options that can be provided while creating a table:
 * its partitioning rules and its replication factor.
 */
public class CreateTableOptions {

  private final List<HashPartition> hashPartitions = Lists.newArrayList();
  private final List<PartialRow> splitRows = Lists.newArrayList();
  private List<String> rangePartitionColumns = null;
  private Integer numReplicas = null;

  public CreateTableOptions() {
  }

  /**
   * Copies the partitioning rules and replication factor of another instance.
   */
  public CreateTableOptions(CreateTableOptions other) {
    hashPartitions.addAll(other.hashPartitions);
    splitRows.addAll(other.splitRows);
    rangePartitionColumns = other.rangePartitionColumns;
    numReplicas = other.numReplicas;
  }

  /**
   * Add a split point for the table. The table in the end will have splits + 1 tablets.
   * The row may be reused or modified safely after this call without changing the split point.
   *
   * @param row a key row for the split point
   * @return this instance
   */
  public CreateTableOptions addSplitRow(PartialRow row) {
    splitRows.add(new PartialRow(row));
    return this;
  }

  /**
   * Add a set of hash partitions to the table.
   *
   * Each column must be a part of the table's primary key, and an individual
   * column may only appear in a single hash component.
   *
   * @param columns the columns to hash
   * @param buckets the number of buckets to hash into
   * @return this instance
   */
  public CreateTableOptions addHashPartitions(List<String> columns, int buckets) {
    return addHashPartitions(columns, buckets, 0);
  }

  /**
   * Add a set of hash partitions to the table.
   *
   * The seed can be used to randomize the mapping of rows to hash buckets.
   *
   * @param columns the columns to hash
   * @param buckets the number of buckets to hash into
   * @param seed a hash seed
   * @return this instance
   */
  public CreateTableOptions addHashPartitions(List<String> columns, int buckets, int seed) {
    hashPartitions.add(new HashPartition(columns, buckets, seed));
    return this;
  }

  /**
   * Set the columns on which the table will be range-partitioned.
   *
   * Every column must be a part of the table's primary key. If not set, the
   * table will be created with the primary-key columns as the range-partition
   * columns. If called with an empty list, the table will be created without
   * range partitioning.
   *
   * @param columns the range partitioned columns
   * @return this instance
   */
  public CreateTableOptions setRangePartitionColumns(List<String> columns) {
    this.rangePartitionColumns = ImmutableList.copyOf(columns);
    return this;
  }

  /**
   * Sets the number of replicas that each tablet will have. If not specified, it uses the
   * server-side default.
   *
   * @param numReplicas the number of replicas to use
   * @return this instance
   */
  public CreateTableOptions setNumReplicas(int numReplicas) {
    this.numReplicas = numReplicas;
    return this;
  }

  public List<HashPartition> getHashPartitions() {
    return Collections.unmodifiableList(hashPartitions);
  }

  /**
   * @return the range partition columns, or null if they were never set
   */
  public List<String> getRangePartitionColumns() {
    return rangePartitionColumns;
  }

  public List<PartialRow> getSplitRows() {
    return Collections.unmodifiableList(splitRows);
  }

  /**
   * @return the requested replica count, or null for the server-side default
   */
  public Integer getNumReplicas() {
    return numReplicas;
  }

  @Override
  public String toString() {
    return "CreateTableOptions(hash=" + hashPartitions + ", range=" + rangePartitionColumns +
        ", splits=" + splitRows.size() + ", replicas=" + numReplicas + ")";
  }

  /**
   * One hash partitioning level, by column name.
   */
  public static class HashPartition {
    private final List<String> columns;
    private final int numBuckets;
    private final int seed;

    HashPartition(List<String> columns, int numBuckets, int seed) {
      this.columns = ImmutableList.copyOf(columns);
      this.numBuckets = numBuckets;
      this.seed = seed;
    }

    public List<String> getColumns() {
      return columns;
    }

    public int getNumBuckets() {
      return numBuckets;
    }

    public int getSeed() {
      return seed;
    }

    @Override
    public String toString() {
      return columns + " into " + numBuckets + " buckets (seed " + seed + ")";
    }
  }
}
