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
package net.hydromatic.solvent.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import dk.brics.automaton.Automaton;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.util.Regexes;
import net.hydromatic.solvent.value.DefaultMap;

/**
 * Expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 *
 * <p>Expressions are created by {@link CoreBuilder} and are hash-consed: two
 * expressions with the same operator, type, payload and operands are the same
 * object. Therefore {@link #equals} on operands compares identity.
 */
public class Core {
  private Core() {}

  /** Abstract base class of expressions. */
  public abstract static class Exp {
    public final Op op;
    public final Type type;

    Exp(Op op, Type type) {
      this.op = requireNonNull(op);
      this.type = requireNonNull(type);
    }

    /** Returns the operands of this expression. */
    public ImmutableList<Exp> operands() {
      return ImmutableList.of();
    }

    /** Returns the {@code i}th operand. */
    public Exp arg(int i) {
      return operands().get(i);
    }

    /** Whether this expression is a literal. */
    public boolean isConstant() {
      return false;
    }

    public abstract Exp accept(Shuttle shuttle);

    public abstract void accept(Visitor visitor);

    /** Appends a description of this expression to a buffer. */
    abstract StringBuilder unparse(StringBuilder buf);

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }
  }

  /** Literal, e.g. {@code 1}, {@code "abc"}, {@code []}. */
  public static class Literal extends Exp {
    /** Value, in canonical representation (see
     * {@link net.hydromatic.solvent.value.Values}). */
    public final Object value;

    Literal(Type type, Object value) {
      super(Op.LITERAL, type);
      this.value = requireNonNull(value);
    }

    /** Returns the value of this literal as a given class. */
    public <T> T unwrap(Class<T> clazz) {
      return clazz.cast(value);
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return appendValue(buf, value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && type == ((Literal) o).type
              && value.equals(((Literal) o).value);
    }
  }

  /**
   * Free variable.
   *
   * <p>Each call to {@link CoreBuilder#var} creates a variable with a new id,
   * so two variables with the same name and type are distinct.
   */
  public static class Var extends Exp {
    public final String name;
    public final int id;

    Var(String name, Type type, int id) {
      super(Op.VAR, type);
      this.name = requireNonNull(name);
      this.id = id;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public int hashCode() {
      return id;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && id == ((Var) o).id;
    }
  }

  /** Call to an operator, e.g. {@code a + b}, {@code concat(s, t)}. */
  public static class Call extends Exp {
    public final ImmutableList<Exp> args;

    Call(Op op, Type type, ImmutableList<Exp> args) {
      super(op, type);
      this.args = requireNonNull(args);
      checkArgument(op.arity < 0 || op.arity == args.size(),
          "wrong number of arguments for %s: %s", op, args);
    }

    @Override
    public ImmutableList<Exp> operands() {
      return args;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      if (op.isInfix()) {
        buf.append('(');
        args.get(0).unparse(buf).append(' ').append(op.opName).append(' ');
        return args.get(1).unparse(buf).append(')');
      }
      switch (op) {
        case NOT:
        case BIT_NOT:
          return args.get(0).unparse(buf.append(op.opName));
        case IF:
          buf.append("(if ");
          args.get(0).unparse(buf).append(" then ");
          args.get(1).unparse(buf).append(" else ");
          return args.get(2).unparse(buf).append(')');
        case CAST:
          buf.append("cast<").append(type.moniker()).append(">(");
          return args.get(0).unparse(buf).append(')');
        case RECORD:
          final RecordType recordType = (RecordType) type;
          buf.append('{');
          for (int i = 0; i < args.size(); i++) {
            buf.append(i > 0 ? ", " : "")
                .append(recordType.fieldNames.get(i))
                .append(": ");
            args.get(i).unparse(buf);
          }
          return buf.append('}');
        default:
          buf.append(op.opName).append('(');
          for (int i = 0; i < args.size(); i++) {
            args.get(i).unparse(buf.append(i > 0 ? ", " : ""));
          }
          return buf.append(')');
      }
    }

    @Override
    public int hashCode() {
      int h = op.hashCode() * 31 + type.hashCode();
      for (Exp arg : args) {
        h = h * 31 + System.identityHashCode(arg);
      }
      return h;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && op == ((Call) o).op
              && type == ((Call) o).type
              && sameOperands(args, ((Call) o).args);
    }
  }

  /** Projection of a field of a record, e.g. {@code r.name}. */
  public static class Field extends Exp {
    public final Exp exp;
    public final int ordinal;

    Field(Type type, Exp exp, int ordinal) {
      super(Op.FIELD, type);
      this.exp = requireNonNull(exp);
      this.ordinal = ordinal;
    }

    /** Returns the name of the field. */
    public String fieldName() {
      return ((RecordType) exp.type).fieldNames.get(ordinal);
    }

    @Override
    public ImmutableList<Exp> operands() {
      return ImmutableList.of(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return exp.unparse(buf).append('.').append(fieldName());
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(exp) * 31 + ordinal;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Field
              && exp == ((Field) o).exp
              && ordinal == ((Field) o).ordinal;
    }
  }

  /** Copy of a record with one field replaced, e.g.
   * {@code r with {name = "x"}}. */
  public static class WithField extends Exp {
    public final Exp exp;
    public final int ordinal;
    public final Exp value;

    WithField(Exp exp, int ordinal, Exp value) {
      super(Op.WITH_FIELD, exp.type);
      this.exp = requireNonNull(exp);
      this.ordinal = ordinal;
      this.value = requireNonNull(value);
    }

    /** Returns the name of the field. */
    public String fieldName() {
      return ((RecordType) type).fieldNames.get(ordinal);
    }

    @Override
    public ImmutableList<Exp> operands() {
      return ImmutableList.of(exp, value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      exp.unparse(buf).append(" with {").append(fieldName()).append(" = ");
      return value.unparse(buf).append('}');
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          System.identityHashCode(exp),
          ordinal,
          System.identityHashCode(value));
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof WithField
              && exp == ((WithField) o).exp
              && ordinal == ((WithField) o).ordinal
              && value == ((WithField) o).value;
    }
  }

  /** Test whether a string matches a regular expression, e.g.
   * {@code matches(s, "a+b+")}. */
  public static class RegexMatch extends Exp {
    public final Exp exp;
    public final String pattern;
    private final Supplier<Automaton> automaton;

    RegexMatch(Exp exp, String pattern) {
      super(Op.REGEX_MATCH, PrimitiveType.BOOL);
      this.exp = requireNonNull(exp);
      this.pattern = requireNonNull(pattern);
      this.automaton = Suppliers.memoize(() -> Regexes.compile(pattern));
    }

    /** Returns the automaton that recognizes the pattern. */
    public Automaton automaton() {
      return automaton.get();
    }

    @Override
    public ImmutableList<Exp> operands() {
      return ImmutableList.of(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(op.opName).append('(');
      return exp.unparse(buf).append(", ")
          .append(quote(pattern)).append(')');
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(exp) * 31 + pattern.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RegexMatch
              && exp == ((RegexMatch) o).exp
              && pattern.equals(((RegexMatch) o).pattern);
    }
  }

  static boolean sameOperands(List<Exp> list0, List<Exp> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }

  /** Appends a value, in the syntax of a literal, to a buffer. */
  public static StringBuilder appendValue(StringBuilder buf, Object value) {
    if (value instanceof String) {
      return buf.append(quote((String) value));
    }
    if (value instanceof Character) {
      return buf.append('\'').append(value).append('\'');
    }
    if (value instanceof BigInteger) {
      return buf.append(value).append('n');
    }
    if (value instanceof Optional) {
      final Optional<?> o = (Optional<?>) value;
      if (!o.isPresent()) {
        return buf.append("none");
      }
      return appendValue(buf.append("some("), o.get()).append(')');
    }
    if (value instanceof List) {
      buf.append('[');
      final List<?> list = (List<?>) value;
      for (int i = 0; i < list.size(); i++) {
        appendValue(buf.append(i > 0 ? ", " : ""), list.get(i));
      }
      return buf.append(']');
    }
    if (value instanceof Map || value instanceof DefaultMap) {
      final Map<?, ?> map =
          value instanceof DefaultMap ? ((DefaultMap) value).asMap()
              : (Map<?, ?>) value;
      buf.append('{');
      int i = 0;
      for (Map.Entry<?, ?> e : map.entrySet()) {
        appendValue(buf.append(i++ > 0 ? ", " : ""), e.getKey());
        appendValue(buf.append(": "), e.getValue());
      }
      return buf.append('}');
    }
    return buf.append(value);
  }

  private static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}

// End Core.java
