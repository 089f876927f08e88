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
package net.hydromatic.solvent.solve;

import net.hydromatic.solvent.util.SolventException;

/**
 * The solver engine failed: it threw, gave up ("unknown"), or ran out of
 * time.
 *
 * <p>An engine failure is never reported as "unsatisfiable". The engine's own
 * exception, if any, is the cause.
 */
public class EngineException extends SolventException {
  public EngineException(String message) {
    super(message);
  }

  public EngineException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  protected String kind() {
    return "engine failure";
  }
}

// End EngineException.java
