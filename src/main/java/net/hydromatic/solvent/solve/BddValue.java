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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.logicng.knowledgecompilation.bdds.BDD;

/**
 * Value of an expression in the decision-diagram encoding.
 *
 * <p>Each variant is built from diagrams, so it represents a function from
 * assignments of the BDD variables to values of the expression's type.
 */
abstract class BddValue {
  private BddValue() {}

  /** Bits of a {@code bool}, fixed-width integer or {@code char}; least
   * significant first. */
  static final class Bits extends BddValue {
    final BDD[] bits;

    Bits(BDD[] bits) {
      this.bits = requireNonNull(bits);
    }

    int width() {
      return bits.length;
    }
  }

  /** Fields of a record. */
  static final class Record extends BddValue {
    final ImmutableList<BddValue> fields;

    Record(ImmutableList<BddValue> fields) {
      this.fields = requireNonNull(fields);
    }
  }

  /** An option: whether it is present, and its value if it is. If the
   * option is absent, the value is unconstrained. */
  static final class Option extends BddValue {
    final BDD present;
    final BddValue value;

    Option(BDD present, BddValue value) {
      this.present = requireNonNull(present);
      this.value = requireNonNull(value);
    }
  }

  /** A general map over a small key type: one {@link Option} per possible
   * key, indexed by the bits of the key. */
  static final class Table extends BddValue {
    final ImmutableList<Option> entries;

    Table(ImmutableList<Option> entries) {
      this.entries = requireNonNull(entries);
    }
  }
}

// End BddValue.java
