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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.yb.fidelity.client.PartialRow;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents table's schema which is essentially a list of columns.
 * This class offers a few utility methods for querying it.
 */
public class Schema {

  /**
   * Mapping of column index to column.
   */
  private final List<ColumnSchema> columnsByIndex;

  /**
   * The primary key columns.
   */
  private final List<ColumnSchema> primaryKeyColumns;

  /**
   * Mapping of column name to index.
   */
  private final Map<String, Integer> columnsByName;

  /**
   * Mapping of column ID to index, or null if the schema does not have assigned column IDs.
   */
  private final Map<Integer, Integer> columnsById;

  /**
   * Constructs a schema using the specified columns. Column ids are taken from the columns
   * themselves; they must be set on all columns or on none.
   * @param columns the columns in index order
   */
  public Schema(List<ColumnSchema> columns) {
    Preconditions.checkArgument(!columns.isEmpty(), "A schema needs at least one column");
    this.columnsByIndex = ImmutableList.copyOf(columns);
    this.columnsByName = new HashMap<>(columns.size());
    boolean hasIds = columns.get(0).getId() != null;
    this.columnsById = hasIds ? new HashMap<>(columns.size()) : null;
    ImmutableList.Builder<ColumnSchema> keys = ImmutableList.builder();

    int index = 0;
    for (ColumnSchema column : columns) {
      Preconditions.checkArgument(columnsByName.put(column.getName(), index) == null,
          "Duplicate column name %s", column.getName());
      Preconditions.checkArgument(hasIds == (column.getId() != null),
          "Column ids must be set on all columns or on none");
      if (hasIds) {
        Preconditions.checkArgument(columnsById.put(column.getId(), index) == null,
            "Duplicate column id %s", column.getId());
      }
      if (column.isKey()) {
        keys.add(column);
      }
      index++;
    }
    this.primaryKeyColumns = keys.build();
    Preconditions.checkArgument(!primaryKeyColumns.isEmpty(),
        "A schema needs at least one key column");
  }

  /**
   * Get the list of columns used to create this schema
   * @return list of columns
   */
  public List<ColumnSchema> getColumns() {
    return this.columnsByIndex;
  }

  /**
   * Get the count of columns in this schema
   * @return count of columns
   */
  public int getColumnCount() {
    return this.columnsByIndex.size();
  }

  /**
   * Get the index at which this column can be found
   * @param columnName column to search for
   * @return an index in the schema
   */
  public int getColumnIndex(String columnName) {
    Integer index = this.columnsByName.get(columnName);
    if (index == null) {
      throw new IllegalArgumentException(
          String.format("Unknown column: %s", columnName));
    }
    return index;
  }

  /**
   * Get the index of the column with the given id.
   */
  public int getColumnIndex(int columnId) {
    Preconditions.checkState(hasColumnIds(), "Schema does not have column ids");
    Integer index = this.columnsById.get(columnId);
    if (index == null) {
      throw new IllegalArgumentException(
          String.format("Unknown column id: %s", columnId));
    }
    return index;
  }

  /**
   * Get the column at this index
   * @param idx column's index
   * @return the column
   */
  public ColumnSchema getColumnByIndex(int idx) {
    return this.columnsByIndex.get(idx);
  }

  /**
   * Get the column associated with the specified name
   * @param columnName column's name
   * @return the column
   */
  public ColumnSchema getColumn(String columnName) {
    return columnsByIndex.get(getColumnIndex(columnName));
  }

  public boolean hasColumn(String columnName) {
    return columnsByName.containsKey(columnName);
  }

  /**
   * Get the count of columns that are part of the primary key.
   * @return count of primary key columns.
   */
  public int getPrimaryKeyColumnCount() {
    return this.primaryKeyColumns.size();
  }

  /**
   * Get the primary key columns.
   * @return the primary key columns.
   */
  public List<ColumnSchema> getPrimaryKeyColumns() {
    return primaryKeyColumns;
  }

  /**
   * Tells whether this schema includes IDs for columns.
   * @return true if IDs are included, else false.
   */
  public boolean hasColumnIds() {
    return columnsById != null;
  }

  /**
   * Get a new PartialRow for this schema, with no column set.
   */
  public PartialRow newPartialRow() {
    return new PartialRow(this);
  }

  @Override
  public String toString() {
    return "Schema" + columnsByIndex;
  }
}
