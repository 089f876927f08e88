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
 * A malformed model: a null literal, operands of the wrong type, a map nested
 * where it is not allowed, a missing binding, an unmatched marshaling name, or
 * a read from a solution that has no model.
 */
public class ModelingException extends SolventException {
  public ModelingException(String message) {
    super(message);
  }

  public ModelingException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  protected String kind() {
    return "modeling error";
  }
}

// End ModelingException.java
