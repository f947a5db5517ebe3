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

import com.google.common.base.Preconditions;

/**
 * Base class for the row mutations a {@link TableSession} applies.
 */
public abstract class Operation {

  /**
   * The kinds of mutations a session understands.
   */
  public enum ChangeType {
    UPSERT
  }

  private final YBTable table;
  private final PartialRow row;

  protected Operation(YBTable table, PartialRow row) {
    Preconditions.checkArgument(row.getSchema() == table.getSchema(),
        "Row was not built from the schema of table %s", table.getName());
    this.table = table;
    this.row = row;
  }

  public abstract ChangeType getChangeType();

  /**
   * Get the underlying row to modify.
   * @return a partial row that will be sent with this operation
   */
  public PartialRow getRow() {
    return this.row;
  }

  public YBTable getTable() {
    return table;
  }

  /**
   * Called by sessions once the operation is accepted; the row cannot change afterwards.
   */
  public void freeze() {
    row.freeze();
  }

  @Override
  public String toString() {
    return getChangeType() + " " + row.stringifyRowKey() + " into " + table.getName();
  }
}
