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
package net.hydromatic.solvent;

import static net.hydromatic.solvent.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.compile.Tracers;
import net.hydromatic.solvent.eval.Prop;
import net.hydromatic.solvent.solve.Backend;
import net.hydromatic.solvent.solve.Solution;
import net.hydromatic.solvent.solve.SolutionIterator;
import net.hydromatic.solvent.solve.Solutions;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Types;
import org.junit.jupiter.api.Test;

/** Tests for {@link Solvent} and {@link ExprFunction}. */
public class SolventTest {
  private static final Core.Var X = core.var("x", PrimitiveType.INT32);

  /** Returns the function {@code x * 2 + 1}. */
  private static ExprFunction f(Solvent solvent) {
    return solvent.function(ImmutableList.of(X),
        core.add(core.mul(X, core.int32Literal(2)), core.int32Literal(1)));
  }

  @Test
  void testEvaluate() {
    final ExprFunction f = f(Solvent.create());
    assertThat(f.isCompiled(), is(false));
    assertThat(f.evaluate(3), is(7L));
    final ExprFunction g = f.compile();
    assertThat(g.isCompiled(), is(true));
    assertThat(g.compile(), is(g));
    assertThat(g.evaluate(3), is(7L));
    assertThat(g.evaluate(Integer.MAX_VALUE),
        is(f.evaluate(Integer.MAX_VALUE)));
    assertThrows(ModelingException.class, () -> f.evaluate(1, 2));
    assertThrows(ModelingException.class, () -> g.evaluate());
  }

  /** Runs a function backwards: finds an argument that gives a result. */
  @Test
  void testFind() {
    for (Backend backend : Backend.values()) {
      final ExprFunction f = f(Solvent.create().withBackend(backend));
      final Optional<ImmutableList<Object>> found =
          f.find(out -> core.eq(out, core.int32Literal(11)));
      assertThat(found.isPresent(), is(true));
      assertThat(f.evaluate(found.get().toArray()), is(11L));

      // The result is always odd
      assertThat(
          f.find(out -> core.eq(out, core.int32Literal(10))).isPresent(),
          is(false));

      final List<ImmutableList<Object>> all;
      try (Stream<ImmutableList<Object>> stream =
               f.findAll(out -> core.eq(out, core.int32Literal(11)))) {
        all = stream.collect(Collectors.toList());
      }
      // 5 and 5 + 2^31 both give 11
      assertThat(all, hasSize(2));
    }
  }

  @Test
  void testProps() {
    final Solvent solvent =
        Solvent.create()
            .withProp(Prop.FIND_ALL_LIMIT, "2")
            .withProps(ImmutableMap.of(Prop.BACKEND, "bdd"));
    assertThat(solvent.props(),
        is(ImmutableMap.of(Prop.FIND_ALL_LIMIT, 2, Prop.BACKEND, Backend.BDD)));
    final Core.Var b = core.var("b", PrimitiveType.UINT8);
    final List<Solution> solutions = new ArrayList<>();
    final Core.Exp predicate =
        core.lt(b, core.intLiteral(PrimitiveType.UINT8, 100));
    try (Solutions all = solvent.findAll(predicate)) {
      all.forEach(solutions::add);
    }
    assertThat(solutions, hasSize(2));
    assertThrows(IllegalArgumentException.class,
        () -> solvent.withProp(Prop.SMT_TIMEOUT, "soon"));
  }

  @Test
  void testSolutions() {
    final Core.Var b = core.var("b", PrimitiveType.BOOL);
    try (SolutionIterator iterator =
             Solvent.create().solutions(core.or(b, core.not(b)))) {
      int n = 0;
      while (iterator.hasNext()) {
        iterator.next();
        ++n;
      }
      assertThat(n, is(2));
      assertThat(iterator.isClosed(), is(true));
    }
  }

  /** Results are reported to the tracer. */
  @Test
  void testTracer() {
    final List<Object> results = new ArrayList<>();
    final Solvent solvent =
        Solvent.create()
            .withTracer(Tracers.withOnResult(Tracers.empty(), results::add));
    assertThat(solvent.evaluate(core.add(X, X), ImmutableMap.of(X, 4)),
        is(8L));
    f(solvent).compile().evaluate(0);
    assertThat(results, is(ImmutableList.of(8L, 1L)));
  }

  /** A solution converts to a Java object. */
  @Test
  void testSolutionToObject() {
    final RecordType type =
        Types.record(ImmutableList.of("x", "y"),
            ImmutableList.of(PrimitiveType.INT16, PrimitiveType.INT16));
    final Core.Var p = core.var("p", type);
    final Core.Exp zero = core.intLiteral(PrimitiveType.INT16, 0);
    final Core.Exp predicate =
        core.and(
            ImmutableList.of(
                core.eq(core.add(core.field(p, "x"), core.field(p, "y")),
                    core.intLiteral(PrimitiveType.INT16, 10)),
                core.eq(core.sub(core.field(p, "x"), core.field(p, "y")),
                    core.intLiteral(PrimitiveType.INT16, 4)),
                core.ge(core.field(p, "x"), zero),
                core.ge(core.field(p, "y"), zero)));
    for (Backend backend : Backend.values()) {
      final Solution solution =
          Solvent.create().withBackend(backend).solve(predicate);
      final Point point = solution.get(p, Point.class);
      assertThat(point.x, is((short) 7));
      assertThat(point.y, is((short) 3));
    }
  }

  /** Target of {@link Solution#get(Core.Var, Class)}. */
  public static class Point {
    final short x;
    final short y;

    public Point(short x, short y) {
      this.x = x;
      this.y = y;
    }
  }
}

// End SolventTest.java
