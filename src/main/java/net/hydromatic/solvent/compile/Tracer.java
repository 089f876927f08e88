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

import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.eval.Code;
import net.hydromatic.solvent.solve.Backend;

/** Called on various events during compilation and solving. */
public interface Tracer {
  /** Called when default-valued maps in a predicate have been lowered to
   * records, before the predicate is translated for a backend. */
  void onLowered(Core.Exp before, Core.Exp after);

  /** Called when code is generated. */
  void onPlan(Code code);

  /** Called on the result of an evaluation. */
  void onResult(Object o);

  /** Called when a backend has decided whether a predicate is satisfiable. */
  void onSolve(Backend backend, Core.Exp predicate, boolean satisfiable);
}

// End Tracer.java
