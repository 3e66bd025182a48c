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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Generates unique global names.
 *
 * <p>Keeps track of how many times each name has been generated, so that a
 * new occurrence of a name can be given a fresh ordinal, and of every name
 * issued, so that no name is issued twice even if an ordinal makes it look
 * like another base name. One generator is shared by all declarations of a
 * library, because the names it generates are global.
 */
public class NameGenerator {
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();
  private final Set<String> issued = new HashSet<>();

  /** Returns the number of times that "name" has been generated. */
  public synchronized int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }

  /**
   * Generates a name that is unique in this library, of the form
   * {@code prefix_hint}, then {@code prefix_hint_1}, and so forth. An
   * anonymous hint ({@code _}) is omitted.
   */
  public String fresh(String prefix, String hint) {
    return fresh(prefix, hint, name -> false);
  }

  /**
   * Generates a name that is unique in this library and that is not
   * {@code taken}, such as the name of a variable bound where the name
   * will be used.
   */
  public synchronized String fresh(String prefix, String hint,
      Predicate<String> taken) {
    final String base =
        hint.equals("_") ? prefix : prefix + "_" + Names.translate(hint);
    for (;;) {
      final int i = inc(base);
      final String name = i == 0 ? base : base + "_" + i;
      if (!taken.test(name) && issued.add(name)) {
        return name;
      }
    }
  }

  /** Returns whether a name has been issued by this generator. */
  public synchronized boolean isIssued(String name) {
    return issued.contains(name);
  }
}

// End NameGenerator.java
