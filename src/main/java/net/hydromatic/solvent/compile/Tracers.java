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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.eval.Code;
import net.hydromatic.solvent.solve.Backend;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a lowered
   * predicate, then calls the underlying tracer. */
  public static Tracer withOnLowered(Tracer tracer,
      BiConsumer<Core.Exp, Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onLowered(Core.Exp before, Core.Exp after) {
        consumer.accept(before, after);
        super.onLowered(before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on code,
   * then calls the underlying tracer. */
  public static Tracer withOnPlan(Tracer tracer, Consumer<Code> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPlan(Code code) {
        consumer.accept(code);
        super.onPlan(code);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of an
   * evaluation, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<Object> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Object o) {
        consumer.accept(o);
        super.onResult(o);
      }
    };
  }

  /** Returns a tracer that performs the given action each time a backend
   * answers, then calls the underlying tracer. */
  public static Tracer withOnSolve(Tracer tracer,
      BiConsumer<Backend, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolve(Backend backend, Core.Exp predicate,
          boolean satisfiable) {
        consumer.accept(backend, satisfiable);
        super.onSolve(backend, predicate, satisfiable);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onLowered(Core.Exp before, Core.Exp after) {
    }

    @Override public void onPlan(Code code) {
    }

    @Override public void onResult(Object o) {
    }

    @Override public void onSolve(Backend backend, Core.Exp predicate,
        boolean satisfiable) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onLowered(Core.Exp before, Core.Exp after) {
      tracer.onLowered(before, after);
    }

    @Override public void onPlan(Code code) {
      tracer.onPlan(code);
    }

    @Override public void onResult(Object o) {
      tracer.onResult(o);
    }

    @Override public void onSolve(Backend backend, Core.Exp predicate,
        boolean satisfiable) {
      tracer.onSolve(backend, predicate, satisfiable);
    }
  }
}

// End Tracers.java
