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
package net.hydromatic.cicdk.compile;

import static java.util.Objects.requireNonNull;

/**
 * An error occurred during translation.
 *
 * <p>Every such error is fatal to the top-level declaration being
 * translated; none is retried or downgraded.
 */
public class TranslationException extends RuntimeException {
  public final Kind kind;

  /** The construct, universe name or declaration that caused the error. */
  public final String subject;

  private TranslationException(Kind kind, String subject, String message) {
    super(message);
    this.kind = requireNonNull(kind);
    this.subject = requireNonNull(subject);
  }

  /** Creates an exception for a source construct that has no encoding. */
  public static TranslationException notSupported(String construct) {
    return new TranslationException(Kind.NOT_SUPPORTED, construct,
        "Not supported: " + construct);
  }

  /** Creates an exception for a universe name that is not in the universe
   * table. */
  public static TranslationException unresolvedUniverse(String name) {
    return new TranslationException(Kind.UNRESOLVED_UNIVERSE, name,
        "Unresolved universe: " + name);
  }

  /** Creates an exception for an application or a declaration whose number
   * of arguments disagrees with its declared arity. */
  public static TranslationException arityMismatch(String subject,
      String message) {
    return new TranslationException(Kind.ARITY_MISMATCH, subject,
        "Arity mismatch in " + subject + ": " + message);
  }

  /** Kind of translation error. */
  public enum Kind {
    NOT_SUPPORTED,
    UNRESOLVED_UNIVERSE,
    ARITY_MISMATCH
  }
}

// End TranslationException.java
