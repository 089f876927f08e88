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

import static net.hydromatic.solvent.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.CapabilityException;
import net.hydromatic.solvent.compile.Tracers;
import net.hydromatic.solvent.eval.Interpreter;
import net.hydromatic.solvent.eval.Prop;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.value.DefaultMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link Solvers} with the BDD backend. */
public class BddSolverTest {
  private static final DefaultMapType DMAP =
      Types.defaultMap(PrimitiveType.INT32, PrimitiveType.INT32);

  private static Solvers solvers(Backend backend) {
    return solvers(backend, ImmutableMap.of());
  }

  private static Solvers solvers(Backend backend, Map<Prop, Object> props) {
    final Map<Prop, Object> map = new HashMap<>(props);
    Prop.BACKEND.set(map, backend);
    return new Solvers(map, Tracers.empty());
  }

  private static Solution solveAndCheck(Core.Exp predicate) {
    final Solution solution = solvers(Backend.BDD).solve(predicate);
    if (solution.isSatisfiable()) {
      assertThat(solution.toString(),
          Interpreter.evaluate(predicate, solution.values()), is(true));
    }
    return solution;
  }

  /** Returns the set of solutions, each as a list of variable values. */
  private static Set<List<Object>> findAll(Backend backend,
      Core.Exp predicate, List<Core.Var> vars) {
    final Set<List<Object>> set = new HashSet<>();
    for (Solution solution : solvers(backend).findAll(predicate)) {
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      vars.forEach(v -> b.add(solution.get(v)));
      assertThat(set.add(b.build()), is(true));
    }
    return set;
  }

  @Test
  void testStringsNotSupported() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final CapabilityException e =
        assertThrows(CapabilityException.class,
            () -> solvers(Backend.BDD)
                .solve(core.eq(s, core.stringLiteral("x"))));
    assertThat(e.backend, is("BDD"));
    assertThrows(CapabilityException.class,
        () -> solvers(Backend.BDD).solve(core.regexMatch(s, "a+b+")));

    final Core.Var n = core.var("n", PrimitiveType.BIG_INT);
    assertThrows(CapabilityException.class,
        () -> solvers(Backend.BDD).solve(core.lt(n, core.bigIntLiteral(3))));
  }

  /** A map is a table with one entry per key, so its key must be narrow. */
  @Test
  void testMapKeyTooWide() {
    final Core.Var m =
        core.var("m", Types.map(PrimitiveType.INT8, PrimitiveType.BOOL));
    final Core.Exp predicate =
        core.mapContainsKey(m, core.intLiteral(PrimitiveType.INT8, 3));
    final Map<Prop, Object> props = new HashMap<>();
    Prop.BDD_MAX_MAP_KEY_BITS.set(props, 4);
    final CapabilityException e =
        assertThrows(CapabilityException.class,
            () -> solvers(Backend.BDD, props).solve(predicate));
    assertThat(e.getMessage(), containsString("the limit is 4"));

    // Within the default limit of 8 bits, it is fine
    assertThat(solvers(Backend.BDD).solve(predicate).isSatisfiable(),
        is(true));
  }

  /** A default-valued map whose values are sequences of records is not
   * supported. */
  @Test
  void testDefaultMapOfCompositeSequences() {
    final RecordType pair =
        Types.tuple(PrimitiveType.BOOL, PrimitiveType.INT8);
    final Core.Var m =
        core.var("m", Types.defaultMap(PrimitiveType.INT8, Types.seq(pair)));
    final Core.Exp predicate =
        core.eq(
            core.length(
                core.dmapGet(m, core.intLiteral(PrimitiveType.INT8, 1))),
            core.bigIntLiteral(2));
    assertThrows(CapabilityException.class,
        () -> solvers(Backend.BDD).solve(predicate));
  }

  @Test
  void testDefaultMapUnsatisfiable() {
    final Core.Var m = core.var("m", DMAP);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.emptyDefaultMap(DMAP));
    assertThat(solveAndCheck(predicate).isSatisfiable(), is(false));
  }

  @Test
  void testDefaultMapSatisfiable() {
    final Core.Var m = core.var("m", DMAP);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.literal(DMAP, DefaultMap.empty(0L).set(1L, 10L).set(2L, 20L)));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    assertThat(((DefaultMap) solution.get(m)).get(2L), is(20L));
  }

  /** A free map may hold any value at a key that is only read. */
  @Test
  void testDefaultMapGetOfUnsetKey() {
    final Core.Var m = core.var("m", DMAP);
    final Core.Exp isZero =
        core.eq(core.dmapGet(m, 7), core.int32Literal(0));
    assertThat(solvers(Backend.BDD).isValid(isZero), is(false));
    final Solution solution =
        solveAndCheck(core.eq(core.dmapGet(m, 7), core.int32Literal(5)));
    assertThat(((DefaultMap) solution.get(m)).get(7L), is(5L));
  }

  @Test
  void testMap() {
    final MapType type = Types.map(PrimitiveType.BOOL, PrimitiveType.INT8);
    final Core.Var m = core.var("m", type);
    final Core.Exp predicate =
        core.and(
            core.eq(core.mapGet(m, core.trueLiteral()),
                core.some(core.intLiteral(PrimitiveType.INT8, 5))),
            core.not(core.mapContainsKey(m, core.falseLiteral())));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.get(m), is(ImmutableMap.of(true, 5L)));

    // Deleting a key leaves the other
    final Core.Exp predicate2 =
        core.and(predicate,
            core.eq(core.mapDelete(m, core.falseLiteral()), m));
    assertThat(solveAndCheck(predicate2).isSatisfiable(), is(true));
    final Core.Exp predicate3 =
        core.and(predicate,
            core.eq(core.mapDelete(m, core.trueLiteral()), m));
    assertThat(solveAndCheck(predicate3).isSatisfiable(), is(false));
  }

  /** A set of {@code int8} is a table of 256 entries. */
  @Test
  void testSets() {
    final Core.Var s = core.var("s", Types.set(PrimitiveType.INT8));
    final Core.Exp one = core.intLiteral(PrimitiveType.INT8, 1);
    final Core.Exp predicate =
        core.setContains(core.setDelete(s, one), one);
    assertThat(solveAndCheck(predicate).isSatisfiable(), is(false));

    final Core.Exp predicate2 =
        core.and(
            core.eq(core.setAdd(s, one),
                core.setOf(PrimitiveType.INT8, ImmutableList.of(1L, -3L))),
            core.not(core.setContains(s, one)));
    final Set<List<Object>> expected =
        ImmutableSet.of(ImmutableList.of(ImmutableMap.of(-3L, true)));
    assertThat(findAll(Backend.BDD, predicate2, ImmutableList.of(s)),
        is(expected));
  }

  @Test
  void testArithmetic() {
    final Core.Var x = core.var("x", PrimitiveType.INT16);
    final Core.Var y = core.var("y", PrimitiveType.UINT8);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.eq(
                    core.sub(
                        core.mul(x, core.intLiteral(PrimitiveType.INT16, 5)),
                        core.intLiteral(PrimitiveType.INT16, 1)),
                    core.intLiteral(PrimitiveType.INT16, -31)),
                core.eq(core.cast(x, PrimitiveType.UINT8), y),
                core.eq(core.bitAnd(y, core.intLiteral(PrimitiveType.UINT8, 1)),
                    core.intLiteral(PrimitiveType.UINT8, 0))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.get(x), is(-6L));
    assertThat(solution.get(y), is(250L));
  }

  @Test
  void testRecordsAndOptions() {
    final RecordType type =
        Types.record(ImmutableList.of("ok", "code"),
            ImmutableList.of(PrimitiveType.BOOL, PrimitiveType.CHAR));
    final Core.Var o = core.var("o", Types.option(type));
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.isSome(o),
                core.field(core.optionValue(o), "ok"),
                core.eq(core.field(core.optionValue(o), "code"),
                    core.charLiteral('z'))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.get(o),
        is(Optional.of(ImmutableList.of(true, 'z'))));
  }

  /** Two booleans that are unconstrained in effect have four solutions. */
  @Test
  void testEnumerateBooleans() {
    final Core.Var a = core.var("a", PrimitiveType.BOOL);
    final Core.Var b = core.var("b", PrimitiveType.BOOL);
    final Core.Exp predicate = core.or(core.eq(a, b), core.neq(a, b));
    assertThat(findAll(Backend.BDD, predicate, ImmutableList.of(a, b)),
        hasSize(4));
    assertThat(solvers(Backend.BDD).isValid(predicate), is(true));
  }

  /** Both backends find the same set of solutions. */
  @Test
  void testAgreesWithSmt() {
    final Core.Var x = core.var("x", PrimitiveType.INT8);
    final Core.Var y = core.var("y", PrimitiveType.INT8);
    final Core.Exp zero = core.intLiteral(PrimitiveType.INT8, 0);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.eq(core.add(x, y), core.intLiteral(PrimitiveType.INT8, 3)),
                core.ge(x, zero),
                core.ge(y, zero)));
    final List<Core.Var> vars = ImmutableList.of(x, y);
    final Set<List<Object>> expected =
        ImmutableSet.of(ImmutableList.of(0L, 3L), ImmutableList.of(1L, 2L),
            ImmutableList.of(2L, 1L), ImmutableList.of(3L, 0L));
    assertThat(findAll(Backend.BDD, predicate, vars), is(expected));
    assertThat(findAll(Backend.SMT, predicate, vars), is(expected));
  }

  @Test
  void testSession() {
    final Core.Var x = core.var("x", PrimitiveType.UINT8);
    try (BddSession session = new BddSession(8)) {
      session.add(core.lt(x, core.intLiteral(PrimitiveType.UINT8, 2)));
      assertThat(session.check(), is(true));
      final Object v = session.value(x);
      session.block(ImmutableMap.of(x, v));
      assertThat(session.check(), is(true));
      assertThat(session.value(x), is(1L - (Long) v));
      session.block(ImmutableMap.of(x, session.value(x)));
      assertThat(session.check(), is(false));
    }
  }
}

// End BddSolverTest.java
