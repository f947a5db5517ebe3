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

import org.yb.fidelity.client.FidelityException;

/**
 * Thrown when the random generators reach a state they were not written for, such as a type
 * they have no value domain for. This is a bug in the generator, never a cluster condition.
 */
@SuppressWarnings("serial")
public class GenerationException extends FidelityException {

  public GenerationException(final String msg) {
    super(msg);
  }
}
