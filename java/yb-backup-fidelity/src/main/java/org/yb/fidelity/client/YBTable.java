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

import org.yb.fidelity.Schema;

/**
 * A YBTable represents a table on a particular cluster, as read back from it. It holds the
 * schema, partition schema and replication factor as of the moment it was opened; it is not
 * kept in sync with the cluster.
 *
 * This class is thread-safe.
 */
public class YBTable {

  private final String name;
  private final String tableId;
  private final Schema schema;
  private final PartitionSchema partitionSchema;
  private final int numReplicas;

  public YBTable(String name, String tableId, Schema schema,
                 PartitionSchema partitionSchema, int numReplicas) {
    this.name = name;
    this.tableId = tableId;
    this.schema = schema;
    this.partitionSchema = partitionSchema;
    this.numReplicas = numReplicas;
  }

  /**
   * Get this table's schema, as of the moment this instance was created.
   * @return this table's schema
   */
  public Schema getSchema() {
    return this.schema;
  }

  /**
   * Gets the table's partition schema.
   * @return the table's partition schema.
   */
  public PartitionSchema getPartitionSchema() {
    return partitionSchema;
  }

  /**
   * Get this table's name.
   * @return this table's name
   */
  public String getName() {
    return this.name;
  }

  /**
   * Get this table's unique identifier.
   * @return this table's tableId
   */
  public String getTableId() {
    return tableId;
  }

  /**
   * @return the number of replicas of every tablet of this table
   */
  public int getNumReplicas() {
    return numReplicas;
  }

  /**
   * Get a new upsert configured with this table's schema. The returned object should not be
   * reused.
   * @return an upsert with this table's schema
   */
  public Upsert newUpsert() {
    return new Upsert(this, schema.newPartialRow());
  }

  /**
   * Get a new upsert carrying an already populated row, which must have been built from this
   * table's schema.
   */
  public Upsert newUpsert(PartialRow row) {
    return new Upsert(this, row);
  }

  @Override
  public String toString() {
    return "YBTable(" + name + ", id=" + tableId + ")";
  }
}
