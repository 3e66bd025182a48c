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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Solved universe constraint graph of a source library.
 *
 * <p>Nodes are global universe names, or the literals {@code Prop},
 * {@code Set} and {@code Type.i}. Edges are constraints {@code l < r},
 * {@code l <= r} and {@code l = r}.
 */
public class UniverseGraph {
  private static final Pattern TYPE_PATTERN = Pattern.compile("Type\\.(\\d+)");

  /** Ordinal of {@code Set}; {@code type i} has ordinal {@code i + 1}. */
  private static final int SET_ORDINAL = 0;

  private final ImmutableList<Constraint> constraints;

  private UniverseGraph(ImmutableList<Constraint> constraints) {
    this.constraints = requireNonNull(constraints);
  }

  /** Creates a graph from a list of constraints. */
  public static UniverseGraph of(List<Constraint> constraints) {
    return new UniverseGraph(ImmutableList.copyOf(constraints));
  }

  /** Creates a graph in which each name is equal to a concrete level;
   * {@code level} {@code i} stands for {@code Type.i}. */
  public static UniverseGraph ofLevels(Map<String, Integer> levels) {
    final ImmutableList.Builder<Constraint> b = ImmutableList.builder();
    levels.forEach((name, level) -> b.add(eq(name, "Type." + level)));
    return new UniverseGraph(b.build());
  }

  /** Creates a strict constraint, {@code left < right}. */
  public static Constraint lt(String left, String right) {
    return new Constraint(left, Relation.LT, right);
  }

  /** Creates a constraint {@code left <= right}. */
  public static Constraint le(String left, String right) {
    return new Constraint(left, Relation.LE, right);
  }

  /** Creates a constraint {@code left = right}. */
  public static Constraint eq(String left, String right) {
    return new Constraint(left, Relation.EQ, right);
  }

  /** Returns whether a node name is a literal ({@code Prop}, {@code Set} or
   * {@code Type.i}) rather than a global universe name. */
  public static boolean isLiteral(String name) {
    return name.equals("Prop")
        || name.equals("Set")
        || TYPE_PATTERN.matcher(name).matches();
  }

  /** If a name is the literal {@code Type.i}, returns {@code i}; otherwise
   * returns -1. */
  public static int typeLiteral(String name) {
    final Matcher matcher = TYPE_PATTERN.matcher(name);
    return matcher.matches() ? Integer.parseInt(matcher.group(1)) : -1;
  }

  public ImmutableList<Constraint> constraints() {
    return constraints;
  }

  /** Returns the global universe names, in order of first occurrence. */
  public ImmutableSet<String> names() {
    final ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (Constraint c : constraints) {
      if (!isLiteral(c.left)) {
        b.add(c.left);
      }
      if (!isLiteral(c.right)) {
        b.add(c.right);
      }
    }
    return b.build();
  }

  /**
   * Assigns to each global universe name the least concrete level that
   * satisfies every constraint. Level {@code i} stands for
   * {@code Type.i}, so every name is strictly above {@code Set}.
   *
   * <p>Computes longest paths in the graph whose edges have weight 1 for a
   * strict constraint and 0 otherwise.
   *
   * @throws IllegalArgumentException if the constraints are inconsistent
   */
  public ImmutableMap<String, Integer> sortUniverses() {
    final MutableValueGraph<String, Integer> graph =
        ValueGraphBuilder.directed().allowsSelfLoops(true).build();
    for (Constraint c : constraints) {
      switch (c.relation) {
        case EQ:
          addEdge(graph, c.left, c.right, 0);
          addEdge(graph, c.right, c.left, 0);
          break;
        case LE:
          addEdge(graph, c.left, c.right, 0);
          break;
        case LT:
          addEdge(graph, c.left, c.right, 1);
          break;
        default:
          throw new AssertionError(c.relation);
      }
    }

    // Each node starts at its lower bound; literals are also upper bounds.
    final Map<String, Integer> ordinals = new HashMap<>();
    for (String node : graph.nodes()) {
      ordinals.put(node, lowerBound(node));
    }
    final int nodeCount = graph.nodes().size();
    for (int iteration = 0;; iteration++) {
      boolean changed = false;
      for (String node : graph.nodes()) {
        for (String successor : graph.successors(node)) {
          final int weight =
              graph.edgeValueOrDefault(node, successor, 0);
          final int ordinal = ordinals.get(node) + weight;
          if (ordinal > ordinals.get(successor)) {
            ordinals.put(successor, ordinal);
            changed = true;
          }
        }
      }
      if (!changed) {
        break;
      }
      if (iteration > nodeCount) {
        throw new IllegalArgumentException(
            "universe inconsistency: strict cycle in constraints");
      }
    }

    final ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    for (String node : graph.nodes()) {
      final int ordinal = ordinals.get(node);
      if (isLiteral(node)) {
        if (ordinal > lowerBound(node)) {
          throw new IllegalArgumentException("universe inconsistency: "
              + node + " is forced above itself");
        }
      } else {
        b.put(node, ordinal - 1);
      }
    }
    return b.buildOrThrow();
  }

  private static void addEdge(MutableValueGraph<String, Integer> graph,
      String source, String target, int weight) {
    final int previous = graph.edgeValueOrDefault(source, target, -1);
    if (weight > previous) {
      graph.putEdgeValue(source, target, weight);
    }
  }

  /** Returns the least ordinal of a node: -1 for {@code Prop}, 0 for
   * {@code Set}, {@code i + 1} for {@code Type.i}, and 1 for a name. */
  private static int lowerBound(String node) {
    switch (node) {
      case "Prop":
        return SET_ORDINAL - 1;
      case "Set":
        return SET_ORDINAL;
      default:
        final int i = typeLiteral(node);
        return i >= 0 ? i + 1 : SET_ORDINAL + 1;
    }
  }

  @Override
  public String toString() {
    return constraints.toString();
  }

  /** Relation between two universes. */
  public enum Relation {
    LT("<"),
    LE("<="),
    EQ("=");

    public final String symbol;

    Relation(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Constraint between two universes. */
  public static class Constraint {
    public final String left;
    public final Relation relation;
    public final String right;

    Constraint(String left, Relation relation, String right) {
      this.left = requireNonNull(left);
      this.relation = requireNonNull(relation);
      this.right = requireNonNull(right);
      checkArgument(!left.isEmpty() && !right.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, relation, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constraint
              && ((Constraint) o).left.equals(left)
              && ((Constraint) o).relation == relation
              && ((Constraint) o).right.equals(right);
    }

    @Override
    public String toString() {
      return left + " " + relation.symbol + " " + right;
    }
  }
}

// End UniverseGraph.java
