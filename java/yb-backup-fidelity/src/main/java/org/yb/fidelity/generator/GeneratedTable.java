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

import org.yb.fidelity.Schema;
import org.yb.fidelity.client.CreateTableOptions;

/**
 * A randomly generated table definition: the schema and the partitioning it is created with.
 */
public class GeneratedTable {
  private final Schema schema;
  private final CreateTableOptions options;

  GeneratedTable(Schema schema, CreateTableOptions options) {
    this.schema = schema;
    this.options = options;
  }

  public Schema getSchema() {
    return schema;
  }

  public CreateTableOptions getOptions() {
    return options;
  }

  @Override
  public String toString() {
    return "GeneratedTable(" + schema.getColumnCount() + " columns, " +
        schema.getPrimaryKeyColumnCount() + " keys, " + options + ")";
  }
}
