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

/** Conversion of source names to target identifiers. */
public abstract class Names {
  /** Prefix of the identifiers of match functions. */
  public static final String MATCH_PREFIX = "match__";

  private Names() {}

  /** Converts a qualified source name, such as {@code Coq.Init.nat}, to a
   * target identifier, {@code Coq__Init__nat}. */
  public static String translate(String name) {
    return name.replace(".", "__");
  }

  /** Returns the identifier of the match function of an inductive
   * type. */
  public static String matchFunction(String inductive) {
    return MATCH_PREFIX + translate(inductive);
  }

  /** Returns the name of the {@code i}th universe parameter of a
   * polymorphic declaration. */
  public static String universeParam(int i) {
    return "s" + i;
  }

  /** Returns the name of the proof of the {@code i}th universe constraint
   * of a polymorphic declaration. */
  public static String constraintParam(int i) {
    return "cstr" + i;
  }
}

// End Names.java
