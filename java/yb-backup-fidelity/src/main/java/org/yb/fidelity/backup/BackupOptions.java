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
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Options for a backup: which tables, where to put the backup and which cluster to read from.
 */
public class BackupOptions {
  private final List<String> tables;
  private final String rootPath;
  private final String masterAddresses;

  /**
   * @param tables names of the tables to back up
   * @param rootPath URI of the staging location the backup is written to
   * @param masterAddresses comma separated host:port list of the cluster masters
   */
  public BackupOptions(List<String> tables, String rootPath, String masterAddresses) {
    Preconditions.checkArgument(!tables.isEmpty(), "No tables to back up");
    this.tables = ImmutableList.copyOf(tables);
    this.rootPath = Preconditions.checkNotNull(rootPath);
    this.masterAddresses = Preconditions.checkNotNull(masterAddresses);
  }

  public List<String> getTables() {
    return tables;
  }

  public String getRootPath() {
    return rootPath;
  }

  public String getMasterAddresses() {
    return masterAddresses;
  }

  @Override
  public String toString() {
    return "BackupOptions(tables=" + tables + ", rootPath=" + rootPath +
        ", masters=" + masterAddresses + ")";
  }
}
