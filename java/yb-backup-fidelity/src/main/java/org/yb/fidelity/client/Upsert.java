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

/**
 * Represents a single row upsert: an insert, or an update of the non-key columns that are set
 * when a row with the same primary key already exists.
 */
public class Upsert extends Operation {

  Upsert(YBTable table, PartialRow row) {
    super(table, row);
  }

  @Override
  public ChangeType getChangeType() {
    return ChangeType.UPSERT;
  }
}
