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

import java.util.List;

/**
 * A session applies row operations to the cluster. Implementations may buffer operations and
 * write them in the background; only {@link #flush()} guarantees that everything applied so
 * far has reached the cluster. Rows rejected by the cluster show up as pending errors rather
 * than exceptions.
 */
public interface TableSession extends AutoCloseable {

  /**
   * Queues an operation. The operation's row cannot be modified afterwards.
   */
  void apply(Operation operation) throws Exception;

  /**
   * Blocks until every operation applied so far has been written or rejected.
   */
  void flush() throws Exception;

  /**
   * Drops the operations applied since the last flush without writing them.
   */
  void discardPendingOperations();

  /**
   * @return the number of row errors collected since the last call to
   * {@link #getPendingErrors()}
   */
  int countPendingErrors();

  /**
   * Returns and clears the row errors collected so far.
   */
  List<RowError> getPendingErrors();

  /**
   * Flushes and releases the session.
   */
  @Override
  void close() throws Exception;
}
