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
package net.hydromatic.solvent.ast;

/** Operator of a {@link Core.Exp}. */
public enum Op {
  // leaves
  LITERAL(0, "literal"),
  VAR(0, "var"),

  // logic
  AND(2, "&&"),
  OR(2, "||"),
  NOT(1, "!"),

  // comparison
  EQ(2, "=="),
  LT(2, "<"),
  LE(2, "<="),

  // arithmetic
  ADD(2, "+"),
  SUB(2, "-"),
  MUL(2, "*"),
  BIT_AND(2, "&"),
  BIT_OR(2, "|"),
  BIT_XOR(2, "^"),
  BIT_NOT(1, "~"),

  IF(3, "if"),
  /** Conversion between fixed-width integer types. */
  CAST(1, "cast"),

  // records
  RECORD(-1, "record"),
  FIELD(1, "field"),
  WITH_FIELD(2, "withField"),

  // options
  SOME(1, "some"),
  IS_SOME(1, "isSome"),
  OPTION_VALUE(1, "optionValue"),

  // sequences and strings
  SEQ_UNIT(1, "seqUnit"),
  SEQ_CONCAT(2, "concat"),
  SEQ_LENGTH(1, "length"),
  SEQ_SLICE(3, "slice"),
  SEQ_AT(2, "at"),
  SEQ_INDEX_OF(3, "indexOf"),
  SEQ_CONTAINS(2, "contains"),
  SEQ_STARTS_WITH(2, "startsWith"),
  SEQ_ENDS_WITH(2, "endsWith"),
  SEQ_REPLACE_FIRST(3, "replaceFirst"),
  REGEX_MATCH(1, "matches"),

  // general maps
  MAP_SET(3, "mapSet"),
  MAP_GET(2, "mapGet"),
  MAP_DELETE(2, "mapDelete"),

  // default-valued maps
  DMAP_SET(3, "dmapSet"),
  DMAP_GET(2, "dmapGet"),
  DMAP_COUNT(1, "dmapCount");

  /** Number of operands, or -1 if variable. */
  public final int arity;

  /** Name used when printing, e.g. "&&" or "concat". */
  public final String opName;

  Op(int arity, String opName) {
    this.arity = arity;
    this.opName = opName;
  }

  /** Whether this operator is printed between its two operands. */
  public boolean isInfix() {
    switch (this) {
      case AND:
      case OR:
      case EQ:
      case LT:
      case LE:
      case ADD:
      case SUB:
      case MUL:
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
        return true;
      default:
        return false;
    }
  }

  /** Whether this operator operates on sequences or strings. */
  public boolean isSequenceOp() {
    return name().startsWith("SEQ_") || this == REGEX_MATCH;
  }
}

// End Op.java
