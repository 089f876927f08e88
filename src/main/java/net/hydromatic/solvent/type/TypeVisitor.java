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

/**
 * Visitor over {@link Type} objects.
 *
 * <p>The default implementations visit each component type and return null.
 *
 * @param <R> return type
 */
public class TypeVisitor<R> {
  public R visit(PrimitiveType primitiveType) {
    return null;
  }

  public R visit(RecordType recordType) {
    recordType.fieldTypes.forEach(t -> t.accept(this));
    return null;
  }

  public R visit(OptionType optionType) {
    optionType.elementType.accept(this);
    return null;
  }

  public R visit(SeqType seqType) {
    seqType.elementType.accept(this);
    return null;
  }

  public R visit(MapType mapType) {
    mapType.keyType.accept(this);
    mapType.valueType.accept(this);
    return null;
  }

  public R visit(DefaultMapType defaultMapType) {
    defaultMapType.keyType.accept(this);
    defaultMapType.valueType.accept(this);
    return null;
  }
}

// End TypeVisitor.java
