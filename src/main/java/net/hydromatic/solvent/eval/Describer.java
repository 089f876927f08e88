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

import java.util.function.Consumer;

/** Renders a plan (tree of {@link Code} and {@link Applicable1} objects) as
 * text. */
public interface Describer {
  /** Starts a node, and calls {@code detail} to add its arguments. */
  Describer start(String name, Consumer<Detail> detail);

  /** Adds arguments to the current node. */
  interface Detail {
    /** Adds an argument. If {@code value} is {@link Describable}, it is
     * rendered as a sub-plan, otherwise as a value. */
    Detail arg(String name, Object value);

    /** Adds a list of arguments. */
    Detail args(String name, Iterable<?> values);
  }
}

// End Describer.java
