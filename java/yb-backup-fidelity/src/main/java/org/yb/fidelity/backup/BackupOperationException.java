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

import org.yb.fidelity.client.ExternalOperationException;

/**
 * Thrown by backup pipelines when a backup or restore does not complete.
 */
@SuppressWarnings("serial")
public class BackupOperationException extends ExternalOperationException {
  /**
   * Constructor.
   * @param msg The message of the exception, potentially including a stack
   * trace.
   */
  public BackupOperationException(final String msg) {
    super(msg);
  }

  /**
   * Constructor.
   * @param msg The message of the exception, potentially including a stack
   * trace.
   * @param cause The exception that caused this one to be thrown.
   */
  public BackupOperationException(final String msg, final Exception cause) {
    super(msg, cause);
  }
}
