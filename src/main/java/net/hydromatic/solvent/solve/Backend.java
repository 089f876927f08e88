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

/**
 * Engine that solves predicates.
 *
 * @see net.hydromatic.solvent.eval.Prop#BACKEND
 */
public enum Backend {
  /** Satisfiability modulo theories, using Z3. Supports every type. */
  SMT,

  /** Binary decision diagrams. Supports only types with a finite number of
   * values, and general maps whose key has few bits. */
  BDD;

  /** Whether the backend can encode a sequence whose elements are records or
   * options. */
  public boolean supportsCompositeSequences() {
    return this == SMT;
  }
}

// End Backend.java
