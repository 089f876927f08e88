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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dk.brics.automaton.Automaton;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.CoreBuilder;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.compile.Tracer;
import net.hydromatic.solvent.compile.Tracers;
import net.hydromatic.solvent.eval.Interpreter;
import net.hydromatic.solvent.eval.Prop;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.util.Regexes;
import net.hydromatic.solvent.value.DefaultMap;
import org.junit.jupiter.api.Test;

/** Tests for {@link Solvers} with the SMT backend. */
public class SmtSolverTest {
  private static final DefaultMapType DMAP =
      Types.defaultMap(PrimitiveType.INT32, PrimitiveType.INT32);

  private static Solvers solvers() {
    return solvers(ImmutableMap.of());
  }

  private static Solvers solvers(Map<Prop, Object> props) {
    final Map<Prop, Object> map = new HashMap<>(props);
    Prop.BACKEND.set(map, Backend.SMT);
    return new Solvers(map, Tracers.empty());
  }

  /** Solves a predicate, and checks that the interpreter agrees that the
   * solution satisfies it. */
  private static Solution solveAndCheck(Core.Exp predicate) {
    final Solution solution = solvers().solve(predicate);
    if (solution.isSatisfiable()) {
      assertThat(solution.toString(),
          Interpreter.evaluate(predicate, solution.values()), is(true));
    }
    return solution;
  }

  /** Setting a key to a non-default value cannot give an empty map. */
  @Test
  void testDefaultMapUnsatisfiable() {
    final Core.Var m = core.var("m", DMAP);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.emptyDefaultMap(DMAP));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(false));
    assertThrows(ModelingException.class, () -> solution.get(m));
  }

  @Test
  void testDefaultMapSatisfiable() {
    final Core.Var m = core.var("m", DMAP);
    final DefaultMap expected =
        DefaultMap.empty(0L).set(1L, 10L).set(2L, 20L);
    final Core.Exp predicate =
        core.eq(core.dmapSet(m, 1, core.int32Literal(10)),
            core.literal(DMAP, expected));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    final DefaultMap map = (DefaultMap) solution.get(m);
    assertThat(map.get(2L), is(20L));
    assertThat(map.get(3L), is(0L));
  }

  @Test
  void testDefaultMapGetAndCount() {
    final Core.Var m = core.var("m", DMAP);
    // m has exactly three non-default keys; the value at 5 is 7, and the
    // values at 2 and 3 are equal and not 7
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.eq(core.dmapGet(m, core.int32Literal(2)),
                    core.dmapGet(m, core.int32Literal(3))),
                core.eq(core.dmapCount(m), core.int32Literal(3)),
                core.eq(core.dmapGet(m, 5), core.int32Literal(7)),
                core.neq(core.dmapGet(m, 2), core.int32Literal(7))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    final DefaultMap map = (DefaultMap) solution.get(m);
    assertThat(map.count(), is(3));
    assertThat(map.get(5L), is(7L));
    assertThat(map.get(2L), is(map.get(3L)));
  }

  /** A key that is only read is a key like any other: a free map may hold
   * any value there. A key that is not a literal cannot be read. */
  @Test
  void testDefaultMapGetOfUnsetKey() {
    final Core.Var m = core.var("m", DMAP);
    final Core.Var k = core.var("k", PrimitiveType.INT32);
    assertThrows(ModelingException.class, () -> core.dmapGet(m, k));

    final Core.Exp isZero =
        core.eq(core.dmapGet(m, 7), core.int32Literal(0));
    assertThat(solvers().isValid(isZero), is(false));

    final Core.Exp predicate =
        core.eq(core.dmapGet(m, 7), core.int32Literal(5));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    assertThat(((DefaultMap) solution.get(m)).get(7L), is(5L));
  }

  @Test
  void testArithmetic() {
    final Core.Var x = core.var("x", PrimitiveType.INT32);
    final Core.Var y = core.var("y", PrimitiveType.UINT8);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.eq(core.mul(x, core.int32Literal(3)),
                    core.int32Literal(-21)),
                core.gt(y, core.intLiteral(PrimitiveType.UINT8, 200)),
                core.eq(core.bitAnd(y, core.intLiteral(PrimitiveType.UINT8, 1)),
                    core.intLiteral(PrimitiveType.UINT8, 1)),
                core.eq(core.cast(y, PrimitiveType.INT8),
                    core.intLiteral(PrimitiveType.INT8, -45))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    assertThat(solution.get(y), is(211L));
  }

  @Test
  void testBigInt() {
    final Core.Var x = core.var("x", PrimitiveType.BIG_INT);
    final Core.Exp predicate =
        core.and(
            core.eq(core.add(core.mul(x, core.bigIntLiteral(3)),
                    core.bigIntLiteral(1)),
                core.bigIntLiteral(-(3L << 40) + 1)),
            core.lt(x, core.bigIntLiteral(0)));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.get(x), is(BigInteger.valueOf(-(1L << 40))));
  }

  @Test
  void testStrings() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.startsWith(s, core.stringLiteral("brown")),
                core.endsWith(s, core.stringLiteral("cow")),
                core.eq(core.length(s), core.bigIntLiteral(10)),
                core.eq(core.at(s, core.bigIntLiteral(5)),
                    core.stringLiteral("n"))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    final String value = (String) solution.get(s);
    assertThat(value.length(), is(10));
    assertThat(value.charAt(5), is('n'));
  }

  @Test
  void testRecordsAndOptions() {
    final RecordType type =
        Types.record(ImmutableList.of("name", "age"),
            ImmutableList.of(PrimitiveType.STRING, PrimitiveType.INT16));
    final Core.Var p = core.var("p", type);
    final Core.Var o = core.var("o", Types.option(type));
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.eq(core.field(p, "name"), core.stringLiteral("ann")),
                core.gt(core.field(p, "age"),
                    core.intLiteral(PrimitiveType.INT16, 30)),
                core.lt(core.field(p, "age"),
                    core.intLiteral(PrimitiveType.INT16, 32)),
                core.eq(o, core.some(p))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.get(p), is(ImmutableList.of("ann", 31L)));
    assertThat(solution.get(o),
        is(Optional.of(ImmutableList.of("ann", 31L))));
  }

  @Test
  void testGeneralMap() {
    final MapType type = Types.map(PrimitiveType.STRING, PrimitiveType.BOOL);
    final Core.Var m = core.var("m", type);
    final Core.Exp predicate =
        core.and(
            core.eq(core.mapGet(m, core.stringLiteral("a")),
                core.some(core.trueLiteral())),
            core.isNone(core.mapGet(m, core.stringLiteral("b"))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.get(m), is(ImmutableMap.of("a", true)));
  }

  @Test
  void testSets() {
    final Core.Var s = core.var("s", Types.set(PrimitiveType.INT32));
    final Core.Exp two = core.int32Literal(2);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.setContains(s, two),
                core.setContains(s, core.int32Literal(5)),
                core.not(core.setContains(s, core.int32Literal(7)))));
    final Solution solution = solveAndCheck(predicate);
    assertThat(solution.isSatisfiable(), is(true));
    final Map<?, ?> set = (Map<?, ?>) solution.get(s);
    assertThat(set.get(2L), is(true));
    assertThat(set.get(5L), is(true));
    assertThat(set.containsKey(7L), is(false));

    // Adding then deleting an element leaves it absent
    assertThat(
        solvers().isValid(
            core.not(core.setContains(core.setDelete(core.setAdd(s, two), two),
                two))),
        is(true));
    assertThat(
        solveAndCheck(
            core.eq(core.setAdd(s, two),
                core.setOf(PrimitiveType.INT32, ImmutableList.of(2L, 3L))))
            .isSatisfiable(),
        is(true));
  }

  /** A map that must differ from another map has a key that no constraint
   * names. */
  @Test
  void testMapNotEqual() {
    final MapType type = Types.map(PrimitiveType.INT32, PrimitiveType.BOOL);
    final Core.Var m = core.var("m", type);
    final Solution solution =
        solveAndCheck(core.neq(m, core.emptyMap(type)));
    assertThat(solution.isSatisfiable(), is(true));
    assertThat(((Map<?, ?>) solution.get(m)).isEmpty(), is(false));

    // Two maps that differ, one inside a record
    final Core.Var n = core.var("n", type);
    final Core.Var r = core.var("r", Types.tuple(type, PrimitiveType.BOOL));
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.neq(m, n),
                core.eq(core.mapGet(m, core.int32Literal(3)),
                    core.some(core.trueLiteral())),
                core.eq(core.field(r, 0), n),
                core.not(core.mapContainsKey(n, core.int32Literal(3)))));
    final Solution solution2 = solveAndCheck(predicate);
    assertThat(solution2.isSatisfiable(), is(true));
    assertThat(((Map<?, ?>) solution2.get(m)).get(3L), is(true));
    assertThat(((List<?>) solution2.get(r)).get(0), is(solution2.get(n)));
  }

  /** Every solution of a regular expression is accepted by its
   * automaton. */
  @Test
  void testFindAllRegex() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Core.Exp predicate = core.regexMatch(s, "a+b+");
    final Automaton automaton = Regexes.compile("a+b+");
    final Map<Prop, Object> props = new HashMap<>();
    Prop.FIND_ALL_LIMIT.set(props, 5);
    final List<String> strings = new ArrayList<>();
    for (Solution solution : solvers(props).findAll(predicate)) {
      strings.add((String) solution.get(s));
    }
    assertThat(strings, hasSize(5));
    assertThat(new HashSet<>(strings).size(), is(5));
    for (String string : strings) {
      assertThat(string, Regexes.matches(automaton, string), is(true));
    }
  }

  /** Enumerates every solution of a small problem. */
  @Test
  void testFindAllExhaustive() {
    final Core.Var x = core.var("x", PrimitiveType.INT8);
    final Core.Var b = core.var("b", PrimitiveType.BOOL);
    final Core.Exp zero = core.intLiteral(PrimitiveType.INT8, 0);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.le(core.intLiteral(PrimitiveType.INT8, -2), x),
                core.le(x, core.intLiteral(PrimitiveType.INT8, 1)),
                core.eq(b, core.lt(x, zero))));
    final Set<List<Object>> set = new HashSet<>();
    for (Solution solution : solvers().findAll(predicate)) {
      assertThat(set.add(ImmutableList.of(solution.get(x), solution.get(b))),
          is(true));
    }
    assertThat(set,
        is(
            ImmutableSet.of(ImmutableList.of(-2L, true),
                ImmutableList.of(-1L, true), ImmutableList.of(0L, false),
                ImmutableList.of(1L, false))));
  }

  /** An iterator that is closed early releases its session, and later
   * solves are unaffected. */
  @Test
  void testIteratorClose() {
    final Core.Var x = core.var("x", PrimitiveType.UINT16);
    final Core.Exp predicate =
        core.lt(x, core.intLiteral(PrimitiveType.UINT16, 1000));
    final Solvers solvers = solvers();
    try (SolutionIterator iterator = solvers.iterator(predicate, null)) {
      assertThat(iterator.hasNext(), is(true));
      assertThat(iterator.next().isSatisfiable(), is(true));
      assertThat(iterator.isClosed(), is(false));
      iterator.close();
      assertThat(iterator.isClosed(), is(true));
      assertThat(iterator.hasNext(), is(false));
    }
    assertThat(solvers.solve(predicate).isSatisfiable(), is(true));
  }

  /** Closing the result of findAll releases the sessions of enumerations
   * that stopped early. */
  @Test
  void testFindAllClose() {
    final Core.Var x = core.var("x", PrimitiveType.UINT16);
    final Core.Exp predicate =
        core.lt(x, core.intLiteral(PrimitiveType.UINT16, 1000));
    final SolutionIterator iterator;
    final Solutions solutions = solvers().findAll(predicate);
    try (Solutions s = solutions) {
      iterator = s.iterator();
      for (int i = 0; i < 3; i++) {
        assertThat(iterator.next().isSatisfiable(), is(true));
      }
      assertThat(iterator.isClosed(), is(false));
      assertThat(s.openCount(), is(1));
    }
    assertThat(iterator.isClosed(), is(true));
    assertThat(solutions.openCount(), is(0));
    assertThrows(IllegalStateException.class, solutions::iterator);

    // A stream that is closed early also releases its session
    final List<Solution> first;
    final Solutions solutions2 = solvers().findAll(predicate);
    try (Stream<Solution> stream = solutions2.stream()) {
      first = stream.limit(2).collect(Collectors.toList());
    }
    assertThat(first, hasSize(2));
    assertThat(solutions2.isClosed(), is(true));
    assertThat(solutions2.openCount(), is(0));
  }

  @Test
  void testIsValid() {
    final Core.Var x = core.var("x", PrimitiveType.INT32);
    assertThat(
        solvers().isValid(
            core.eq(core.bitXor(x, x), core.int32Literal(0))),
        is(true));
    assertThat(
        solvers().isValid(core.lt(x, core.add(x, core.int32Literal(1)))),
        is(false));
  }

  @Test
  void testNoVariables() {
    final List<Solution> solutions = new ArrayList<>();
    solvers().findAll(core.trueLiteral()).forEach(solutions::add);
    assertThat(solutions, hasSize(1));
    assertThat(solvers().solve(core.falseLiteral()).isSatisfiable(),
        is(false));
  }

  @Test
  void testNotPredicate() {
    final Core.Var x = core.var("x", PrimitiveType.INT32);
    assertThrows(ModelingException.class, () -> solvers().solve(x));
  }

  /** A variable that does not occur in the predicate has its default
   * value. */
  @Test
  void testUnconstrainedVariable() {
    final Core.Var x = core.var("x", PrimitiveType.INT32);
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Solution solution =
        solvers().solve(core.eq(x, core.int32Literal(4)));
    assertThat(solution.get(x), is(4L));
    assertThat(solution.get(s), is(""));
    assertThat(solution.get(x, Long.class), instanceOf(Long.class));
  }

  @Test
  void testTracer() {
    final List<Core.Exp> lowered = new ArrayList<>();
    final List<Boolean> results = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnSolve(
            Tracers.withOnLowered(Tracers.empty(),
                (before, after) -> lowered.add(after)),
            (backend, satisfiable) -> results.add(satisfiable));
    final Map<Prop, Object> props = new HashMap<>();
    Prop.BACKEND.set(props, Backend.SMT);
    final Solvers solvers = new Solvers(props, tracer);

    final Core.Var m = core.var("m", DMAP);
    solvers.solve(
        core.eq(core.dmapGet(m, core.int32Literal(1)), core.int32Literal(2)));
    assertThat(lowered, hasSize(1));
    assertThat(CoreBuilder.freeVars(lowered.get(0)).get(0).type,
        is(Types.tuple(PrimitiveType.INT32)));
    assertThat(results, is(ImmutableList.of(true)));

    // No maps, so nothing is lowered
    final Core.Var x = core.var("x", PrimitiveType.BOOL);
    solvers.solve(core.and(x, core.not(x)));
    assertThat(lowered, hasSize(1));
    assertThat(results, is(ImmutableList.of(true, false)));
  }
}

// End SmtSolverTest.java
