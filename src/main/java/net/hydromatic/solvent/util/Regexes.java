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
package net.hydromatic.solvent.util;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.RegExp;
import dk.brics.automaton.State;
import dk.brics.automaton.Transition;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solvent.compile.ModelingException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for regular expressions.
 *
 * <p>Parsing is done by the {@code dk.brics.automaton} library; the result is
 * a minimal deterministic automaton over 16-bit characters.
 */
public abstract class Regexes {
  private Regexes() {}

  /** Marks an edge that accepts only the empty string. */
  private static final Object EPSILON = new Object();

  /**
   * Parses a pattern into an automaton.
   *
   * @throws ModelingException if the pattern is not valid
   */
  public static Automaton compile(String pattern) {
    if (pattern == null) {
      throw new ModelingException("null regular expression");
    }
    final Automaton automaton;
    try {
      automaton = new RegExp(pattern, RegExp.NONE).toAutomaton();
    } catch (IllegalArgumentException e) {
      throw new ModelingException("invalid regular expression '" + pattern
          + "': " + e.getMessage(), e);
    }
    automaton.determinize();
    automaton.minimize();
    return automaton;
  }

  /** Returns whether an automaton accepts a string. */
  public static boolean matches(Automaton automaton, String s) {
    return automaton.run(s);
  }

  /**
   * Converts an automaton to a regular expression in some other
   * representation, by eliminating states one at a time.
   *
   * @param automaton automaton
   * @param algebra builds regular expressions in the target representation
   * @param <R> type of regular expression
   */
  public static <R> R toRegex(Automaton automaton, RegexAlgebra<R> algebra) {
    final List<State> states = new ArrayList<>(automaton.getStates());
    final Map<State, Integer> ordinals = new HashMap<>();
    for (State state : states) {
      ordinals.put(state, ordinals.size());
    }
    final int n = states.size();
    final int start = n;
    final int end = n + 1;
    // edges[p][q] is null (no edge), EPSILON, or an R.
    final Object[][] edges = new Object[n + 2][n + 2];
    edges[start][ordinals.get(automaton.getInitialState())] = EPSILON;
    for (State state : states) {
      final int p = ordinals.get(state);
      if (state.isAccept()) {
        edges[p][end] = union(algebra, edges[p][end], EPSILON);
      }
      for (Transition t : state.getTransitions()) {
        final int q = ordinals.get(t.getDest());
        edges[p][q] =
            union(algebra, edges[p][q], algebra.range(t.getMin(), t.getMax()));
      }
    }
    for (int k = 0; k < n; k++) {
      final Object loop = edges[k][k];
      for (int p = 0; p < n + 2; p++) {
        if (p == k || edges[p][k] == null) {
          continue;
        }
        for (int q = 0; q < n + 2; q++) {
          if (q == k || edges[k][q] == null) {
            continue;
          }
          Object path = edges[p][k];
          if (loop != null) {
            path = concat(algebra, path, star(algebra, loop));
          }
          path = concat(algebra, path, edges[k][q]);
          edges[p][q] = union(algebra, edges[p][q], path);
        }
      }
      for (int i = 0; i < n + 2; i++) {
        edges[i][k] = null;
        edges[k][i] = null;
      }
    }
    return toR(algebra, edges[start][end]);
  }

  private static <R> Object union(
      RegexAlgebra<R> algebra, @Nullable Object a, Object b) {
    if (a == null) {
      return b;
    }
    if (a == EPSILON && b == EPSILON) {
      return EPSILON;
    }
    return algebra.union(toR(algebra, a), toR(algebra, b));
  }

  private static <R> Object concat(RegexAlgebra<R> algebra, Object a, Object b) {
    if (a == EPSILON) {
      return b;
    }
    if (b == EPSILON) {
      return a;
    }
    return algebra.concat(toR(algebra, a), toR(algebra, b));
  }

  private static <R> Object star(RegexAlgebra<R> algebra, Object a) {
    if (a == EPSILON) {
      return EPSILON;
    }
    return algebra.star(toR(algebra, a));
  }

  @SuppressWarnings("unchecked")
  private static <R> R toR(RegexAlgebra<R> algebra, @Nullable Object o) {
    if (o == null) {
      return algebra.empty();
    }
    if (o == EPSILON) {
      return algebra.epsilon();
    }
    return (R) o;
  }

  /**
   * Builds regular expressions.
   *
   * @param <R> type of regular expression
   */
  public interface RegexAlgebra<R> {
    /** Regular expression that matches nothing. */
    R empty();

    /** Regular expression that matches only the empty string. */
    R epsilon();

    /** Regular expression that matches one character in a range. */
    R range(char min, char max);

    R concat(R a, R b);

    R union(R a, R b);

    R star(R a);
  }
}

// End Regexes.java
