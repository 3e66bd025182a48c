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
package net.hydromatic.cicdk.type;

import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Universe;
import net.hydromatic.cicdk.compile.Environment;

/**
 * Type checker of the source calculus, as seen by the translator.
 *
 * <p>Every method is a blocking computation that is assumed to terminate.
 * Terms are interpreted in a given environment; references to variables of
 * the named context (such as lifted lets) are resolved using
 * {@link Environment#lookupNamed(String)}.
 */
public interface TypeOracle {
  /** Infers the type of a term. */
  Cic.Term inferType(Environment env, Cic.Term term);

  /** Infers the sort of a type; that is, the universe {@code s} such that
   * {@code type : Sort(s)}. */
  Universe inferSort(Environment env, Cic.Term type);

  /** Returns whether a term whose type is {@code actual} may be used where a
   * term of type {@code expected} is expected. */
  boolean convertible(Environment env, Cic.Term actual, Cic.Term expected);

  /** Reduces a term to weak head normal form. */
  Cic.Term whnf(Environment env, Cic.Term term);
}

// End TypeOracle.java
