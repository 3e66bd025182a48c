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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.cicdk.ast.Cic;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Encodings of fixpoint groups that have already been emitted, keyed by the
 * syntactic identity of the group.
 *
 * <p>At most one encoding is emitted per distinct group. Entries are added
 * when the translation of a top-level declaration succeeds, and are never
 * evicted or updated. The cache may be shared by translations that run
 * concurrently.
 */
public class FixpointCache {
  private final Map<Key, Entry> entries = new HashMap<>();
  private int hitCount;

  /** Returns the entry for a group, or null. */
  public synchronized @Nullable Entry get(Key key) {
    return entries.get(key);
  }

  /** Adds entries; an existing entry is never replaced. */
  synchronized void putAll(Map<Key, Entry> map) {
    map.forEach(entries::putIfAbsent);
  }

  synchronized void recordHit() {
    ++hitCount;
  }

  /** Returns the number of times that a group has been found, in this cache
   * or among the pending entries of a translation. */
  public synchronized int hitCount() {
    return hitCount;
  }

  /** Returns the number of groups in this cache. */
  public synchronized int size() {
    return entries.size();
  }

  /** Identity of a fixpoint group: its names, types and bodies. The focus
   * and the recursive argument positions are not part of the key. */
  public static class Key {
    public final ImmutableList<String> names;
    public final ImmutableList<Cic.Term> types;
    public final ImmutableList<Cic.Term> bodies;

    Key(ImmutableList<String> names, ImmutableList<Cic.Term> types,
        ImmutableList<Cic.Term> bodies) {
      this.names = requireNonNull(names);
      this.types = requireNonNull(types);
      this.bodies = requireNonNull(bodies);
    }

    /** Creates the key of a fixpoint group. */
    public static Key of(Cic.Fix fix) {
      return new Key(fix.names, fix.types, fix.bodies);
    }

    @Override
    public int hashCode() {
      return Objects.hash(names, types, bodies);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Key
              && ((Key) o).names.equals(names)
              && ((Key) o).types.equals(types)
              && ((Key) o).bodies.equals(bodies);
    }

    @Override
    public String toString() {
      return names.toString();
    }
  }

  /** Encoding of a fixpoint group. */
  public static class Entry {
    /** Declarations of the entry, trigger and body functions, with their
     * closed types. */
    public final ImmutableList<Cic.Decl> namedDecls;
    /** Names of the entry functions, one per definition. */
    public final ImmutableList<String> entryNames;
    /** Number of innermost local declarations over which the group is
     * generalized. */
    public final int sliceSize;
    /** Number of declarations in the slice that are not let-bound. */
    public final int assumptionCount;

    Entry(ImmutableList<Cic.Decl> namedDecls, ImmutableList<String> entryNames,
        int sliceSize, int assumptionCount) {
      this.namedDecls = requireNonNull(namedDecls);
      this.entryNames = requireNonNull(entryNames);
      this.sliceSize = sliceSize;
      this.assumptionCount = assumptionCount;
    }
  }
}

// End FixpointCache.java
