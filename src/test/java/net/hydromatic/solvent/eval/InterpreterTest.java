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
package net.hydromatic.solvent.eval;

import static net.hydromatic.solvent.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.Types;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interpreter}. */
public class InterpreterTest {
  private static Object eval(Core.Exp e) {
    return Interpreter.evaluate(e, ImmutableMap.of());
  }

  private static Object eval(Core.Exp e, Map<Core.Var, Object> bindings) {
    return Interpreter.evaluate(e, bindings);
  }

  private static Core.Exp big(long v) {
    return core.bigIntLiteral(v);
  }

  @Test
  void testStartsWith() {
    assertThat(
        eval(
            core.startsWith(core.stringLiteral("brown cow"),
                core.stringLiteral("bro"))),
        is(true));
    assertThat(
        eval(
            core.startsWith(core.stringLiteral("quick fox"),
                core.stringLiteral("uick"))),
        is(false));

    // Same, with a variable, so that nothing is folded
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Core.Exp e = core.startsWith(s, core.stringLiteral("bro"));
    assertThat(eval(e, ImmutableMap.of(s, "brown cow")), is(true));
    assertThat(eval(e, ImmutableMap.of(s, "br")), is(false));
  }

  /** An out-of-range slice is empty. */
  @Test
  void testSlice() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Core.Var off = core.var("off", PrimitiveType.BIG_INT);
    final Core.Var len = core.var("len", PrimitiveType.BIG_INT);
    final Core.Exp e = core.slice(s, off, len);
    assertThat(eval(core.slice(core.stringLiteral("hello"), big(10), big(3))),
        is(""));
    assertThat(eval(e, bindings(s, "hello", off, 10, len, 3)), is(""));
    assertThat(eval(e, bindings(s, "hello", off, 1, len, 3)), is("ell"));
    assertThat(eval(e, bindings(s, "hello", off, 3, len, 10)), is("lo"));
    assertThat(eval(e, bindings(s, "hello", off, -1, len, 2)), is(""));
    assertThat(eval(e, bindings(s, "hello", off, 0, len, 0)), is(""));
  }

  private static Map<Core.Var, Object> bindings(Core.Var s, String sv,
      Core.Var off, long offv, Core.Var len, long lenv) {
    return ImmutableMap.of(s, sv, off, BigInteger.valueOf(offv), len,
        BigInteger.valueOf(lenv));
  }

  @Test
  void testSequenceOperations() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Map<Core.Var, Object> b = ImmutableMap.of(s, "banana");
    assertThat(eval(core.length(s), b), is(BigInteger.valueOf(6)));
    assertThat(eval(core.at(s, big(1)), b), is("a"));
    assertThat(eval(core.at(s, big(6)), b), is(""));
    assertThat(eval(core.indexOf(s, core.stringLiteral("an"), big(0)), b),
        is(BigInteger.ONE));
    assertThat(eval(core.indexOf(s, core.stringLiteral("an"), big(2)), b),
        is(BigInteger.valueOf(3)));
    assertThat(eval(core.indexOf(s, core.stringLiteral("x"), big(0)), b),
        is(BigInteger.valueOf(-1)));
    assertThat(eval(core.indexOf(s, core.stringLiteral(""), big(6)), b),
        is(BigInteger.valueOf(6)));
    assertThat(eval(core.indexOf(s, core.stringLiteral(""), big(7)), b),
        is(BigInteger.valueOf(-1)));
    assertThat(eval(core.contains(s, core.stringLiteral("nan")), b),
        is(true));
    assertThat(eval(core.endsWith(s, core.stringLiteral("na")), b), is(true));
    assertThat(
        eval(
            core.replaceFirst(s, core.stringLiteral("an"),
                core.stringLiteral("AN")), b),
        is("bANana"));
    assertThat(
        eval(
            core.replaceFirst(s, core.stringLiteral(""),
                core.stringLiteral(">")), b),
        is(">banana"));
    assertThat(
        eval(
            core.replaceFirst(s, core.stringLiteral("x"),
                core.stringLiteral("y")), b),
        is("banana"));

    // General sequences behave like strings
    final Core.Var q = core.var("q", Types.seq(PrimitiveType.INT32));
    final Map<Core.Var, Object> b2 =
        ImmutableMap.of(q, ImmutableList.of(1L, 2L, 3L, 2L));
    assertThat(eval(core.concat(q, core.seqUnit(core.int32Literal(9))), b2),
        is(ImmutableList.of(1L, 2L, 3L, 2L, 9L)));
    assertThat(
        eval(core.indexOf(q, core.seqUnit(core.int32Literal(2)), big(2)), b2),
        is(BigInteger.valueOf(3)));
    assertThat(eval(core.slice(q, big(1), big(2)), b2),
        is(ImmutableList.of(2L, 3L)));
  }

  @Test
  void testRegex() {
    final Core.Var s = core.var("s", PrimitiveType.STRING);
    final Core.Exp e = core.regexMatch(s, "a+b+");
    assertThat(eval(e, ImmutableMap.of(s, "aab")), is(true));
    assertThat(eval(e, ImmutableMap.of(s, "ab")), is(true));
    assertThat(eval(e, ImmutableMap.of(s, "ba")), is(false));
    assertThat(eval(e, ImmutableMap.of(s, "")), is(false));
    assertThat(eval(core.regexMatch(core.stringLiteral("abbb"), "a+b+")),
        is(true));
  }

  /** Fixed-width arithmetic wraps; comparison respects signedness. */
  @Test
  void testArithmetic() {
    final Core.Var x = core.var("x", PrimitiveType.UINT8);
    final Core.Var y = core.var("y", PrimitiveType.INT8);
    assertThat(
        eval(core.add(x, core.intLiteral(PrimitiveType.UINT8, 10)),
            ImmutableMap.of(x, 250)),
        is(4L));
    assertThat(
        eval(core.mul(y, core.intLiteral(PrimitiveType.INT8, 2)),
            ImmutableMap.of(y, 100)),
        is(-56L));
    assertThat(
        eval(core.lt(y, core.intLiteral(PrimitiveType.INT8, 0)),
            ImmutableMap.of(y, -1)),
        is(true));
    assertThat(
        eval(core.lt(x, core.intLiteral(PrimitiveType.UINT8, 128)),
            ImmutableMap.of(x, 255)),
        is(false));
    assertThat(
        eval(core.cast(y, PrimitiveType.UINT16), ImmutableMap.of(y, -1)),
        is(65535L));
    assertThat(
        eval(core.cast(x, PrimitiveType.INT8), ImmutableMap.of(x, 200)),
        is(-56L));
    assertThat(
        eval(core.bitNot(x), ImmutableMap.of(x, 0)),
        is(255L));
  }

  @Test
  void testOptionsAndRecords() {
    final Core.Var o = core.var("o", Types.option(PrimitiveType.INT32));
    assertThat(eval(core.optionValue(o), ImmutableMap.of(o, Optional.empty())),
        is(0L));
    assertThat(eval(core.optionValue(o), ImmutableMap.of(o, Optional.of(5))),
        is(5L));
    assertThat(
        eval(core.valueOr(o, core.int32Literal(9)),
            ImmutableMap.of(o, Optional.empty())),
        is(9L));

    final Core.Var r =
        core.var("r",
            Types.record(ImmutableList.of("a", "b"),
                ImmutableList.of(PrimitiveType.BOOL, PrimitiveType.STRING)));
    final Map<Core.Var, Object> b =
        ImmutableMap.of(r, ImmutableList.of(true, "x"));
    assertThat(eval(core.field(r, "b"), b), is("x"));
    assertThat(eval(core.withField(r, "b", core.stringLiteral("y")), b),
        is(ImmutableList.of(true, "y")));
  }

  @Test
  void testMaps() {
    final MapType type = Types.map(PrimitiveType.STRING, PrimitiveType.INT32);
    final Core.Var m = core.var("m", type);
    final Map<Core.Var, Object> b = ImmutableMap.of(m, ImmutableMap.of("a", 1));
    final Core.Exp set = core.mapSet(m, core.stringLiteral("b"),
        core.int32Literal(2));
    assertThat(eval(set, b), is(ImmutableMap.of("a", 1L, "b", 2L)));
    assertThat(eval(core.mapGet(m, core.stringLiteral("a")), b),
        is(Optional.of(1L)));
    assertThat(eval(core.mapGet(m, core.stringLiteral("z")), b),
        is(Optional.empty()));
    assertThat(eval(core.mapDelete(m, core.stringLiteral("a")), b),
        is(ImmutableMap.of()));
    assertThat(eval(core.mapContainsKey(set, core.stringLiteral("b")), b),
        is(true));
  }

  @Test
  void testMissingBinding() {
    final Core.Var x = core.var("x", PrimitiveType.INT32);
    final ModelingException e =
        assertThrows(ModelingException.class,
            () -> eval(core.add(x, core.int32Literal(1))));
    assertThat(e.getMessage(), containsString("'x'"));

    // Wrong kind of value
    assertThrows(ModelingException.class,
        () -> eval(x, ImmutableMap.of(x, "one")));
  }
}

// End InterpreterTest.java
