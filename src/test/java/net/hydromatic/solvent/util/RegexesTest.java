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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import dk.brics.automaton.Automaton;
import java.util.List;
import java.util.regex.Pattern;
import net.hydromatic.solvent.compile.ModelingException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Regexes}. */
public class RegexesTest {
  private static final List<String> STRINGS =
      ImmutableList.of("", "a", "b", "ab", "aab", "abb", "ba", "abab", "c",
          "abc", "aaaa", "bbbb", "xyz", "a-b");

  /** Builds regular expressions in {@link java.util.regex} syntax. */
  private static final Regexes.RegexAlgebra<String> JAVA =
      new Regexes.RegexAlgebra<String>() {
        @Override public String empty() {
          return "(?!)";
        }

        @Override public String epsilon() {
          return "(?:)";
        }

        @Override public String range(char min, char max) {
          return "[" + escape(min) + "-" + escape(max) + "]";
        }

        @Override public String concat(String a, String b) {
          return "(?:" + a + ")(?:" + b + ")";
        }

        @Override public String union(String a, String b) {
          return "(?:" + a + "|" + b + ")";
        }

        @Override public String star(String a) {
          return "(?:" + a + ")*";
        }

        private String escape(char c) {
          return String.format("\\x{%x}", (int) c);
        }
      };

  @Test
  void testMatches() {
    final Automaton automaton = Regexes.compile("a+b+");
    assertThat(Regexes.matches(automaton, "ab"), is(true));
    assertThat(Regexes.matches(automaton, "aabbb"), is(true));
    assertThat(Regexes.matches(automaton, "ba"), is(false));
    assertThat(Regexes.matches(automaton, ""), is(false));
  }

  @Test
  void testInvalid() {
    final ModelingException e =
        assertThrows(ModelingException.class, () -> Regexes.compile("a(b"));
    assertThat(e.getMessage(), containsString("'a(b'"));
  }

  /** Converting an automaton back to a regular expression gives an
   * expression that matches the same strings. */
  @Test
  void testToRegex() {
    final List<String> patterns =
        ImmutableList.of("a+b+", "(ab)*", "[a-c]?", "a|bb|()", "x[y-z]*");
    for (String pattern : patterns) {
      final Automaton automaton = Regexes.compile(pattern);
      final String regex = Regexes.toRegex(automaton, JAVA);
      final Pattern javaPattern = Pattern.compile(regex);
      for (String s : STRINGS) {
        assertThat(pattern + " on '" + s + "'",
            javaPattern.matcher(s).matches(),
            is(Regexes.matches(automaton, s)));
      }
    }
  }

  /** An automaton that accepts nothing becomes the empty expression. */
  @Test
  void testToRegexEmpty() {
    final Automaton automaton = Automaton.makeEmpty();
    assertThat(Regexes.toRegex(automaton, JAVA), is("(?!)"));
  }
}

// End RegexesTest.java
