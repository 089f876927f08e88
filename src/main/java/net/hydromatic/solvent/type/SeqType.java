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
package net.hydromatic.solvent.type;

import static java.util.Objects.requireNonNull;

/** Sequence type, e.g. "{@code int32 seq}". */
public class SeqType implements Type {
  public final Type elementType;

  SeqType(Type elementType) {
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public String moniker() {
    return Types.parenthesize(elementType) + " seq";
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isSequence() {
    return true;
  }

  @Override
  public int hashCode() {
    return elementType.hashCode() * 31 + 2;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SeqType
            && elementType.equals(((SeqType) o).elementType);
  }
}

// End SeqType.java
