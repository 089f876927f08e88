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

import java.util.Map;
import net.hydromatic.solvent.ast.Core;

/**
 * Session with a solver engine.
 *
 * <p>A session owns the engine's state. Constraints added to one session are
 * never seen by another. A session must be closed when no longer needed.
 *
 * <p>Typical use: {@link #add} constraints, {@link #check}, read the
 * {@link #value values} of variables, {@link #block} the model, and
 * {@link #check} again.
 */
public interface SolverSession extends AutoCloseable {
  /** Returns the backend. */
  Backend backend();

  /**
   * Asserts a boolean expression.
   *
   * @throws net.hydromatic.solvent.compile.CapabilityException if the
   *     backend cannot encode the expression
   */
  void add(Core.Exp constraint);

  /**
   * Returns whether the constraints asserted so far are satisfiable.
   *
   * @throws EngineException if the engine fails or cannot decide
   */
  boolean check();

  /** Returns the value of a variable in the model found by the last
   * successful {@link #check}. A variable that occurs in no constraint has
   * the default value of its type. */
  Object value(Core.Var var);

  /** Asserts that the given variables do not all have the given values, so
   * that the next {@link #check} finds a different model. */
  void block(Map<Core.Var, Object> values);

  /** Releases the engine's resources. Does not throw. */
  @Override void close();
}

// End SolverSession.java
