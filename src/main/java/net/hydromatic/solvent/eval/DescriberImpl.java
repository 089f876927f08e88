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

import java.util.function.Consumer;
import net.hydromatic.solvent.ast.Core;

/** Implementation of {@link Describer} that writes to a string builder.
 *
 * <p>A node renders as {@code name(arg, label arg, ...)}, or just
 * {@code name} if it has no arguments. */
class DescriberImpl implements Describer {
  private final StringBuilder buf = new StringBuilder();

  @Override public String toString() {
    return buf.toString();
  }

  @Override public Describer start(String name, Consumer<Detail> consumer) {
    buf.append(name);
    final int mark = buf.length();
    consumer.accept(new Detail() {
      @Override public Detail arg(String label, Object value) {
        open(mark, label);
        append(value);
        return this;
      }

      @Override public Detail args(String label, Iterable<?> values) {
        open(mark, label);
        buf.append('[');
        String sep = "";
        for (Object value : values) {
          buf.append(sep);
          append(value);
          sep = ", ";
        }
        buf.append(']');
        return this;
      }
    });
    if (buf.length() > mark) {
      buf.append(')');
    }
    return this;
  }

  /** Writes the separator before an argument, and its label if any. */
  private void open(int mark, String label) {
    buf.append(buf.length() == mark ? "(" : ", ");
    if (!label.isEmpty()) {
      buf.append(label).append(' ');
    }
  }

  private void append(Object value) {
    if (value instanceof Describable) {
      ((Describable) value).describe(this);
    } else {
      Core.appendValue(buf, value);
    }
  }
}

// End DescriberImpl.java
