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
package net.hydromatic.solvent.value;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import net.hydromatic.solvent.compile.ModelingException;
import org.junit.jupiter.api.Test;

/** Tests for {@link ObjectConstructor}. */
public class ObjectConstructorTest {
  /** Matches constructor parameters by name, ignoring case, and converts
   * {@code Long} values to narrower types. */
  @Test
  void testConstructor() {
    final Point p =
        ObjectConstructor.reflective(Point.class)
            .construct(ImmutableMap.of("Y", 2L, "x", 1L));
    assertThat(p.x, is(1));
    assertThat(p.y, is((short) 2));
  }

  @Test
  void testFields() {
    final Account a =
        ObjectConstructor.reflective(Account.class)
            .construct(ImmutableMap.of("owner", "ann", "balance", 100L));
    assertThat(a.owner, is("ann"));
    assertThat(a.balance, is(BigInteger.valueOf(100)));
  }

  @Test
  void testNoMatch() {
    final ModelingException e =
        assertThrows(ModelingException.class,
            () -> ObjectConstructor.reflective(Account.class)
                .construct(ImmutableMap.of("owner", "ann", "age", 3L)));
    assertThat(e.getMessage(), containsString("'age'"));
    assertThrows(ModelingException.class,
        () -> ObjectConstructor.reflective(Point.class)
            .construct(ImmutableMap.of("x", 1L, "z", 2L)));
  }

  /** Class with a constructor. */
  public static class Point {
    final int x;
    final short y;

    public Point(int x, short y) {
      this.x = x;
      this.y = y;
    }
  }

  /** Class with settable fields. */
  public static class Account {
    public String owner;
    public BigInteger balance;

    public Account() {
    }
  }
}

// End ObjectConstructorTest.java
