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

import static net.hydromatic.solvent.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.CoreBuilder;
import net.hydromatic.solvent.eval.Interpreter;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.value.DefaultMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link DefaultMapLowering} and {@link KeyUniverse}. */
public class DefaultMapLoweringTest {
  private static final DefaultMapType TYPE =
      Types.defaultMap(PrimitiveType.INT32, PrimitiveType.INT32);
  private static final DefaultMap EMPTY = DefaultMap.empty(0L);

  @Test
  void testKeyUniverse() {
    final Core.Var m = core.var("m", TYPE);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.literal(TYPE, EMPTY.set(1L, 10L).set(2L, 20L)));
    final KeyUniverse universe = KeyUniverse.of(predicate);
    assertThat(universe.isEmpty(), is(false));
    assertThat(universe.keys(TYPE), is(ImmutableList.of(1L, 2L)));
    assertThat(universe.ordinal(TYPE, 2L), is(1));

    // An expression without maps has an empty universe
    final Core.Var x = core.var("x", PrimitiveType.INT32);
    assertThat(KeyUniverse.of(core.lt(x, core.int32Literal(3))).isEmpty(),
        is(true));
  }

  @Test
  void testLowerType() {
    final Core.Var m = core.var("m", TYPE);
    final Core.Exp predicate =
        core.eq(core.dmapGet(m, core.int32Literal(5)), core.int32Literal(1));
    final DefaultMapLowering lowering = DefaultMapLowering.of(predicate);
    assertThat(lowering.lowerType(TYPE),
        is(Types.tuple(PrimitiveType.INT32)));
    final Type recordType =
        Types.record(ImmutableList.of("a", "b"),
            ImmutableList.of(PrimitiveType.BOOL, TYPE));
    assertThat(lowering.lowerType(recordType),
        is(
            Types.record(ImmutableList.of("a", "b"),
                ImmutableList.of(PrimitiveType.BOOL,
                    Types.tuple(PrimitiveType.INT32)))));
    assertThat(lowering.lowerType(PrimitiveType.STRING),
        sameInstance(PrimitiveType.STRING));

    final Core.Var m2 = lowering.lower(m);
    assertThat(m2, not(sameInstance(m)));
    assertThat(lowering.lower(m), sameInstance(m2));
    assertThat(m2.type, is(Types.tuple(PrimitiveType.INT32)));
    assertThat(lowering.vars(), is(ImmutableMap.of(m, m2)));
  }

  @Test
  void testLowerAndLiftValues() {
    final Core.Var m = core.var("m", TYPE);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.literal(TYPE, EMPTY.set(1L, 10L).set(2L, 20L)));
    final DefaultMapLowering lowering = DefaultMapLowering.of(predicate);
    assertThat(lowering.lowerValue(TYPE, EMPTY.set(2L, 20L)),
        is(ImmutableList.of(0L, 20L)));
    assertThat(lowering.lift(TYPE, ImmutableList.of(7L, 0L)),
        is(EMPTY.set(1L, 7L)));
    assertThat(((DefaultMap) lowering.lift(TYPE, ImmutableList.of(0L, 0L)))
        .count(), is(0));
  }

  /** The lowered predicate is true for exactly the lowered values that
   * satisfy the original. */
  @Test
  void testLoweredPredicate() {
    final Core.Var m = core.var("m", TYPE);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.literal(TYPE, EMPTY.set(1L, 10L).set(2L, 20L)));
    final DefaultMapLowering lowering = DefaultMapLowering.of(predicate);
    final Core.Exp lowered = lowering.lower(predicate);
    final Core.Var m2 = lowering.lower(m);
    assertThat(CoreBuilder.freeVars(lowered), is(ImmutableList.of(m2)));
    for (DefaultMap map : ImmutableList.of(EMPTY, EMPTY.set(2L, 20L),
        EMPTY.set(1L, 3L).set(2L, 20L), EMPTY.set(2L, 21L))) {
      final Object expected =
          Interpreter.evaluate(predicate, ImmutableMap.of(m, map));
      final Object actual =
          Interpreter.evaluate(lowered,
              ImmutableMap.of(m2, lowering.lowerValue(TYPE, map)));
      assertThat("map " + map, actual, is(expected));
    }
  }

  /** Reads become field accesses; counts become sums. A key that is only
   * read is tracked too. */
  @Test
  void testGetAndCount() {
    final Core.Var m = core.var("m", TYPE);
    final Core.Exp m2 = core.dmapSet(m, 1, core.int32Literal(10));
    final Core.Exp e =
        core.tuple(core.dmapGet(m, 1), core.dmapGet(m2, 3),
            core.dmapCount(m), core.dmapCount(m2), core.dmapGet(m, 4));
    final DefaultMapLowering lowering = DefaultMapLowering.of(e);
    assertThat(lowering.universe.keys(TYPE),
        is(ImmutableList.of(1L, 3L, 4L)));
    final Core.Exp lowered = lowering.lower(e);
    final Core.Var mLowered = lowering.lower(m);
    for (DefaultMap map : ImmutableList.of(EMPTY, EMPTY.set(1L, 5L),
        EMPTY.set(3L, 10L), EMPTY.set(4L, -1L).set(1L, 2L))) {
      assertThat("map " + map,
          Interpreter.evaluate(lowered,
              ImmutableMap.of(mLowered, lowering.lowerValue(TYPE, map))),
          is(Interpreter.evaluate(e, ImmutableMap.of(m, map))));
    }
  }

  /** An expression without default-valued maps is unchanged. */
  @Test
  void testNoMaps() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Core.Exp e = core.contains(s, core.stringLiteral("x"));
    assertThat(DefaultMapLowering.of(e).lower(e), sameInstance(e));
  }
}

// End DefaultMapLoweringTest.java
