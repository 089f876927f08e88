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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.solvent.compile.ModelingException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Types} and the type classes. */
public class TypesTest {
  /** Structurally equal types are the same object. */
  @Test
  void testInterned() {
    assertThat(Types.option(PrimitiveType.INT32),
        sameInstance(Types.option(PrimitiveType.INT32)));
    assertThat(Types.tuple(PrimitiveType.BOOL, PrimitiveType.CHAR),
        sameInstance(
            Types.record(ImmutableList.of("1", "2"),
                ImmutableList.of(PrimitiveType.BOOL, PrimitiveType.CHAR))));
    assertThat(
        Types.defaultMap(PrimitiveType.STRING, Types.seq(PrimitiveType.UINT8)),
        sameInstance(
            Types.defaultMap(PrimitiveType.STRING,
                Types.seq(PrimitiveType.UINT8))));
  }

  @Test
  void testMoniker() {
    assertThat(Types.option(PrimitiveType.INT32).moniker(),
        is("int32 option"));
    assertThat(Types.seq(Types.option(PrimitiveType.CHAR)).moniker(),
        is("(char option) seq"));
    assertThat(Types.tuple(PrimitiveType.BOOL, PrimitiveType.STRING).moniker(),
        is("(bool, string)"));
    assertThat(
        Types.record(ImmutableList.of("a", "b"),
                ImmutableList.of(PrimitiveType.BIG_INT, PrimitiveType.INT8))
            .moniker(),
        is("{a: bigint, b: int8}"));
    assertThat(
        Types.map(PrimitiveType.UINT16, PrimitiveType.BOOL).toString(),
        is("(uint16, bool) map"));
  }

  /** Maps may not be nested in maps or sequences. */
  @Test
  void testNestedMap() {
    final MapType map = Types.map(PrimitiveType.INT8, PrimitiveType.INT8);
    final DefaultMapType dmap =
        Types.defaultMap(PrimitiveType.INT8, PrimitiveType.INT8);
    assertThat(map.containsMap(), is(true));
    assertThat(Types.tuple(PrimitiveType.BOOL, dmap).containsMap(), is(true));
    assertThat(Types.option(PrimitiveType.INT8).containsMap(), is(false));
    assertThrows(ModelingException.class,
        () -> Types.map(PrimitiveType.INT8, map));
    assertThrows(ModelingException.class,
        () -> Types.defaultMap(Types.option(dmap), PrimitiveType.BOOL));
    assertThrows(ModelingException.class, () -> Types.seq(map));
    assertThrows(ModelingException.class,
        () -> Types.record(ImmutableList.of("a", "a"),
            ImmutableList.of(PrimitiveType.BOOL, PrimitiveType.BOOL)));
  }

  @Test
  void testPrimitiveRanges() {
    assertThat(PrimitiveType.INT8.minValue(), is(-128L));
    assertThat(PrimitiveType.UINT16.maxValue(), is(65535L));
    assertThat(PrimitiveType.INT64.maxValue(), is(Long.MAX_VALUE));
    assertThat(PrimitiveType.UINT8.wrap(256 + 7), is(7L));
    assertThat(PrimitiveType.INT8.wrap(200), is(-56L));
    assertThat(PrimitiveType.INT16.wrap(-1), is(-1L));
    assertThat(PrimitiveType.CHAR.isBitVector(), is(true));
    assertThat(PrimitiveType.BOOL.isBitVector(), is(false));
    assertThat(PrimitiveType.BIG_INT.isFinite(), is(false));
    assertThat(Types.tuple(PrimitiveType.BOOL, PrimitiveType.UINT8).isFinite(),
        is(true));
    assertThrows(UnsupportedOperationException.class,
        PrimitiveType.STRING::minValue);
  }
}

// End TypesTest.java
