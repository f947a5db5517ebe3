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
 * Thrown when the cluster or the backup pipeline fails an operation: a rejected table
 * definition, a missing table, row errors after a flush, a failed backup or restore.
 * The harness never retries these.
 */
@SuppressWarnings("serial")
public class ExternalOperationException extends FidelityException {

  public ExternalOperationException(final String msg) {
    super(msg);
  }

  public ExternalOperationException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
