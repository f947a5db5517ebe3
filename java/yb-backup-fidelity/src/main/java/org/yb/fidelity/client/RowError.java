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
 * Wrapper class for a single row error.
 */
public class RowError {
  private final String status;
  private final String message;
  private final Operation operation;

  public RowError(String errorStatus, String errorMessage, Operation operation) {
    this.status = errorStatus;
    this.message = errorMessage;
    this.operation = operation;
  }

  /**
   * Get the string-representation of the error code that the server returned.
   * @return A short string representation of the error.
   */
  public String getStatus() {
    return status;
  }

  /**
   * Get the error message the server sent.
   * @return The error message.
   */
  public String getMessage() {
    return message;
  }

  /**
   * Get the Operation that failed.
   * @return The same Operation instance that failed.
   */
  public Operation getOperation() {
    return operation;
  }

  @Override
  public String toString() {
    return "Row error for primary key=" + operation.getRow().stringifyRowKey() +
        ", table=" + operation.getTable().getName() +
        ", status=" + status +
        ", message=" + message;
  }
}
