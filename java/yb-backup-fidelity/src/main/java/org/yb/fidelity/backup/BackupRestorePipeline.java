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

/**
 * Runs full-table backups and restores against a cluster. Both operations block until the
 * pipeline reports completion and throw on any failure.
 */
public interface BackupRestorePipeline {

  /**
   * Writes a full snapshot of every table in {@code options.getTables()} under the root path.
   */
  void backup(BackupOptions options) throws Exception;

  /**
   * Recreates every table in {@code options.getTables()} from the backup under the root path,
   * naming each restored table {@code <table name><table suffix>}.
   */
  void restore(RestoreOptions options) throws Exception;
}
