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

import com.google.common.net.HostAndPort;
import org.yb.fidelity.Schema;

import java.util.List;

/**
 * Blocking client for the table cluster under test. Implementations report failures with
 * {@link ExternalOperationException} or their own exceptions; callers propagate them as is.
 */
public interface TableClient extends AutoCloseable {

  /**
   * @return the master addresses the backup pipeline should connect to
   */
  List<HostAndPort> getMasterHostPorts();

  /**
   * @return the master addresses as a comma separated host:port list
   */
  String getMasterAddresses();

  /**
   * Create a table on the cluster with the specified name, schema, and table configurations.
   * Fails if the cluster rejects the schema or partitioning.
   * @param name the table's name
   * @param schema the table's schema
   * @param options the partitioning and replication options
   * @return an object to communicate with the created table
   */
  YBTable createTable(String name, Schema schema, CreateTableOptions options) throws Exception;

  /**
   * Open the table with the given name, reading its current schema, partition schema and
   * replication factor from the cluster.
   */
  YBTable openTable(String name) throws Exception;

  boolean tableExists(String name) throws Exception;

  /**
   * Create a new session for interacting with the cluster.
   */
  TableSession newSession();

  /**
   * Reads every row of the table. Every column of a returned row is set, to a value or to null.
   */
  List<PartialRow> scanRows(YBTable table) throws Exception;

  @Override
  void close() throws Exception;
}
