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

/**
 * Base class for exceptions thrown by Solvent.
 *
 * <p>All failures are synchronous precondition failures surfaced to the
 * caller of the failing operation; none is retried internally.
 */
public abstract class SolventException extends RuntimeException {
  protected SolventException(String message) {
    super(message);
  }

  protected SolventException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Appends a description of this exception to a buffer. */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(kind()).append(": ").append(getMessage());
  }

  /** Short name of the kind of failure, e.g. "modeling error". */
  protected abstract String kind();
}

// End SolventException.java
