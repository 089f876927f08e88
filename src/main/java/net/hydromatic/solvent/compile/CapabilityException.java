/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.solvent.compile;

import net.hydromatic.solvent.util.SolventException;

/**
 * A well-typed expression uses a type or operation that the selected backend
 * cannot encode.
 *
 * <p>Thrown while translating, before the engine is asked to solve anything.
 */
public class CapabilityException extends SolventException {
  public final String backend;

  public CapabilityException(String backend, String message) {
    super(backend + " backend: " + message);
    this.backend = backend;
  }

  @Override
  protected String kind() {
    return "capability error";
  }
}

// End CapabilityException.java
