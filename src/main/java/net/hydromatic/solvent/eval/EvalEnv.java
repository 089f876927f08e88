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
 * Evaluation environment of compiled code.
 *
 * <p>Holds the values of the parameters, followed by slots that memoize the
 * values of sub-expressions that occur more than once. A new environment is
 * created for each invocation, so compiled code can be called from several
 * threads at once.
 */
public final class EvalEnv {
  private final Object[] slots;

  EvalEnv(Object[] slots) {
    this.slots = slots;
  }

  /** Creates an environment with the given parameter values and
   * {@code memoCount} empty memo slots. */
  public static EvalEnv of(Object[] args, int memoCount) {
    final Object[] slots = new Object[args.length + memoCount];
    System.arraycopy(args, 0, slots, 0, args.length);
    return new EvalEnv(slots);
  }

  /** Returns the value in a slot, or null if it has not been assigned. */
  public Object get(int slot) {
    return slots[slot];
  }

  void set(int slot, Object value) {
    slots[slot] = value;
  }
}

// End EvalEnv.java
