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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.cicdk.type.UniverseGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mapping from global universe names to concrete levels.
 *
 * <p>Populated once per library by solving the universe graph; read-only
 * during translation, and therefore safe to share between translations.
 */
public class UniverseTable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(UniverseTable.class);

  private static final UniverseTable EMPTY =
      new UniverseTable(ImmutableMap.of());

  private final ImmutableMap<String, Integer> levels;

  private UniverseTable(ImmutableMap<String, Integer> levels) {
    this.levels = requireNonNull(levels);
  }

  /** Returns a table with no universes. */
  public static UniverseTable empty() {
    return EMPTY;
  }

  /** Creates a table by solving a universe graph. */
  public static UniverseTable of(UniverseGraph graph) {
    LOGGER.info("Saving universes");
    final ImmutableMap<String, Integer> levels = graph.sortUniverses();
    LOGGER.debug("Saved {} universes", levels.size());
    return new UniverseTable(levels);
  }

  /** Creates a table from a map of names to levels; level {@code i} stands
   * for {@code Type.i}. */
  public static UniverseTable of(Map<String, Integer> levels) {
    return new UniverseTable(ImmutableMap.copyOf(levels));
  }

  /** Returns the concrete level of a global universe.
   *
   * @throws TranslationException if the name is not in the table */
  public int level(String name) {
    final Integer level = levels.get(name);
    if (level == null) {
      throw TranslationException.unresolvedUniverse(name);
    }
    return level;
  }

  /** Returns whether the table contains a universe. */
  public boolean contains(String name) {
    return levels.containsKey(name);
  }

  /** Returns the universe names and their levels. */
  public ImmutableMap<String, Integer> levels() {
    return levels;
  }

  @Override
  public String toString() {
    return levels.toString();
  }
}

// End UniverseTable.java
