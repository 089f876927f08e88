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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Streams;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * The solutions of a predicate, as returned by {@link Solvers#findAll}.
 *
 * <p>Each call to {@link #iterator()} starts a new enumeration with its own
 * solver session. An iterator releases its session when it is exhausted;
 * {@link #close()} releases the sessions of every iterator that was not,
 * so use this object in a try-with-resources block if you might stop
 * early:
 *
 * <blockquote><pre>
 * try (Solutions solutions = solvers.findAll(predicate)) {
 *   for (Solution solution : solutions) {
 *     if (isGoodEnough(solution)) {
 *       break;
 *     }
 *   }
 * }</pre></blockquote>
 */
public class Solutions implements Iterable<Solution>, AutoCloseable {
  private final Supplier<SolutionIterator> factory;
  private final List<SolutionIterator> iterators = new ArrayList<>();
  private boolean closed;

  Solutions(Supplier<SolutionIterator> factory) {
    this.factory = requireNonNull(factory);
  }

  @Override public synchronized SolutionIterator iterator() {
    checkState(!closed, "solutions are closed");
    iterators.removeIf(SolutionIterator::isClosed);
    final SolutionIterator iterator = factory.get();
    iterators.add(iterator);
    return iterator;
  }

  /** Returns a stream of the solutions. Closing the stream closes this
   * object. */
  public Stream<Solution> stream() {
    return Streams.stream(this).onClose(this::close);
  }

  /** Returns the number of iterators whose session is still open. */
  public synchronized int openCount() {
    iterators.removeIf(SolutionIterator::isClosed);
    return iterators.size();
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /** Releases the session of every iterator that is still open. Further
   * calls to {@link #iterator()} fail. */
  @Override public synchronized void close() {
    closed = true;
    iterators.forEach(SolutionIterator::close);
    iterators.clear();
  }
}

// End Solutions.java
