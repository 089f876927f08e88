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
package net.hydromatic.solvent.eval;

/**
 * Function of one argument, that computes the value of an operator from the
 * value of its operand.
 *
 * <p>The same applicable is used by the {@link Interpreter} and by compiled
 * code, so that both produce the same results.
 *
 * @see Applicable2
 * @see Applicable3
 * @param <R> return type
 * @param <A0> type of argument
 */
@FunctionalInterface
public interface Applicable1<R, A0> extends Describable {
  /** Applies this function to its argument. */
  R apply(A0 a0);

  /**
   * {@inheritDoc}
   *
   * <p>This default implementation throws; applicables that occur in plans
   * are created by {@link Codes}, which overrides it.
   */
  @Override
  default Describer describe(Describer describer) {
    throw new UnsupportedOperationException("describe");
  }
}

// End Applicable1.java
