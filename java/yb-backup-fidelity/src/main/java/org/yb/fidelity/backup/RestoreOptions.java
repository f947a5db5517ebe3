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
package org.yb.fidelity.backup;

import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Options for a restore. Restored tables are named after the backed up table plus
 * {@link #getTableSuffix()}.
 */
public class RestoreOptions extends BackupOptions {
  public static final String DEFAULT_TABLE_SUFFIX = "-restore";

  private final String tableSuffix;

  public RestoreOptions(List<String> tables, String rootPath, String masterAddresses) {
    this(tables, rootPath, masterAddresses, DEFAULT_TABLE_SUFFIX);
  }

  public RestoreOptions(List<String> tables, String rootPath, String masterAddresses,
                        String tableSuffix) {
    super(tables, rootPath, masterAddresses);
    Preconditions.checkArgument(tableSuffix != null && !tableSuffix.isEmpty(),
        "Restored tables need a suffix to not collide with the originals");
    this.tableSuffix = tableSuffix;
  }

  public String getTableSuffix() {
    return tableSuffix;
  }

  /**
   * @return the name the given table is restored as
   */
  public String restoredTableName(String table) {
    return table + tableSuffix;
  }

  @Override
  public String toString() {
    return "RestoreOptions(tables=" + getTables() + ", rootPath=" + getRootPath() +
        ", masters=" + getMasterAddresses() + ", suffix=" + tableSuffix + ")";
  }
}
