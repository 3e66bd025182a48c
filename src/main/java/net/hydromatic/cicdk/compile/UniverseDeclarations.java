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

import static net.hydromatic.cicdk.ast.DkBuilder.dk;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.ast.Universe;
import net.hydromatic.cicdk.compile.Encoding.UniverseMode;
import net.hydromatic.cicdk.type.UniverseGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the global universes of a library, once, before any term.
 *
 * <p>What is declared depends on the universe mode:
 *
 * <ul>
 * <li>{@link UniverseMode#CONCRETE}: each universe is defined as its
 *   concrete level;
 * <li>{@link UniverseMode#SYMBOLIC}: each universe is a symbol, and each
 *   constraint is either a rewrite rule on {@code sup} or, if
 *   {@link Encoding#UNIVERSE_CONSTRAINTS} is set, an axiom;
 * <li>{@link UniverseMode#NAMED}: each universe is a symbol.
 * </ul>
 */
public class UniverseDeclarations {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(UniverseDeclarations.class);

  private final UniverseMode mode;
  private final boolean constraints;
  private final SortEncoder encoder;

  private UniverseDeclarations(UniverseMode mode, boolean constraints,
      SortEncoder encoder) {
    this.mode = mode;
    this.constraints = constraints;
    this.encoder = encoder;
  }

  /** Creates a declaration generator for the given encoding properties. */
  public static UniverseDeclarations create(Map<Encoding, Object> props) {
    return new UniverseDeclarations(
        Encoding.UNIVERSE_MODE.enumValue(props, UniverseMode.class),
        Encoding.UNIVERSE_CONSTRAINTS.booleanValue(props),
        SortEncoder.create(props));
  }

  /** Returns the instructions that declare the universes of a graph. */
  public ImmutableList<Dk.Instruction> declare(UniverseGraph graph) {
    LOGGER.info("Translating global universes");
    switch (mode) {
      case CONCRETE:
        return concrete(graph);
      case SYMBOLIC:
        return constraints ? axioms(graph) : rules(graph);
      case NAMED:
        return ImmutableList.copyOf(names(graph, false));
      default:
        throw new AssertionError(mode);
    }
  }

  private ImmutableList<Dk.Instruction> concrete(UniverseGraph graph) {
    final ImmutableList.Builder<Dk.Instruction> b = ImmutableList.builder();
    UniverseTable.of(graph).levels().forEach((name, level) ->
        b.add(
            dk.definition(Names.translate(name), encoder.sortType(),
                encoder.sort(Universe.type(level)))));
    return b.build();
  }

  private List<Dk.Instruction> names(UniverseGraph graph, boolean definable) {
    final List<Dk.Instruction> list = new ArrayList<>();
    for (String name : graph.names()) {
      final String id = Names.translate(name);
      list.add(definable
          ? dk.definable(id, encoder.sortType())
          : dk.declaration(id, encoder.sortType()));
    }
    return list;
  }

  /** Declares each universe, then one rewrite rule on {@code sup} per
   * constraint (two for a strict constraint). Universes are definable,
   * because an equality constraint rewrites a universe to another. */
  private ImmutableList<Dk.Instruction> rules(UniverseGraph graph) {
    final List<Dk.Instruction> list = names(graph, true);
    list.add(dk.emptyLine());
    final List<Dk.Rule> rules = new ArrayList<>();
    for (UniverseGraph.Constraint c : graph.constraints()) {
      if (ignore(c)) {
        continue;
      }
      final Universe l = universe(c.left);
      final Universe r = universe(c.right);
      switch (c.relation) {
        case EQ:
          rules.add(rule(l, r));
          break;
        case LE:
          rules.add(rule(Universe.max(l, r), r));
          break;
        case LT:
          rules.add(rule(Universe.max(l, r), r));
          rules.add(rule(Universe.max(Universe.succ(l, 1), r), r));
          break;
        default:
          throw new AssertionError(c.relation);
      }
    }
    if (!rules.isEmpty()) {
      list.add(dk.rules(rules));
    }
    return ImmutableList.copyOf(list);
  }

  private Dk.Rule rule(Universe lhs, Universe rhs) {
    return dk.rule(ImmutableList.of(), encoder.pattern(lhs), encoder.sort(rhs));
  }

  /** Declares each universe, then one axiom per constraint (two for an
   * equality). */
  private ImmutableList<Dk.Instruction> axioms(UniverseGraph graph) {
    final List<Dk.Instruction> list = names(graph, false);
    list.add(dk.emptyLine());
    int counter = 0;
    for (UniverseGraph.Constraint c : graph.constraints()) {
      if (ignore(c)) {
        continue;
      }
      final Universe l = universe(c.left);
      final Universe r = universe(c.right);
      switch (c.relation) {
        case EQ:
          list.add(dk.declaration("cstr_" + ++counter, encoder.cumul(l, r)));
          list.add(dk.declaration("cstr_" + ++counter, encoder.cumul(r, l)));
          break;
        case LE:
          list.add(dk.declaration("cstr_" + ++counter, encoder.cumul(l, r)));
          break;
        case LT:
          list.add(
              dk.declaration("cstr_" + ++counter, encoder.cumulStrict(l, r)));
          break;
        default:
          throw new AssertionError(c.relation);
      }
    }
    return ImmutableList.copyOf(list);
  }

  /** The constraint between {@code Prop} and {@code Set} holds in every
   * encoding. */
  private static boolean ignore(UniverseGraph.Constraint c) {
    return c.left.equals("Prop") && c.right.equals("Set");
  }

  /** Converts a node of the universe graph to a universe. */
  private static Universe universe(String name) {
    switch (name) {
      case "Prop":
        return Universe.PROP;
      case "Set":
        return Universe.SET;
      default:
        final int i = UniverseGraph.typeLiteral(name);
        return i >= 0 ? Universe.type(i) : Universe.globalSort(name);
    }
  }
}

// End UniverseDeclarations.java
