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
import static net.hydromatic.cicdk.ast.DkBuilder.dk;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.ast.Op;
import net.hydromatic.cicdk.ast.Universe;
import net.hydromatic.cicdk.compile.Encoding.UniverseMode;
import net.hydromatic.cicdk.type.ConstantBody;
import net.hydromatic.cicdk.type.InductiveBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates source universes into the universes of the encoding, according
 * to the universe mode.
 *
 * <p>Translation is a pure function of the universe, the mode, the universe
 * table, and the template levels of the environment.
 */
public class UniverseTranslator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(UniverseTranslator.class);

  private final UniverseMode mode;
  private final boolean constraints;
  private final boolean polymorphism;
  private final boolean templatePolymorphism;
  private final UniverseTable table;
  public final SortEncoder encoder;

  private UniverseTranslator(UniverseMode mode, boolean constraints,
      boolean polymorphism, boolean templatePolymorphism, UniverseTable table,
      SortEncoder encoder) {
    this.mode = requireNonNull(mode);
    this.constraints = constraints;
    this.polymorphism = polymorphism;
    this.templatePolymorphism = templatePolymorphism;
    this.table = requireNonNull(table);
    this.encoder = requireNonNull(encoder);
  }

  /** Creates a universe translator. */
  public static UniverseTranslator create(Map<Encoding, Object> props,
      UniverseTable table) {
    return new UniverseTranslator(
        Encoding.UNIVERSE_MODE.enumValue(props, UniverseMode.class),
        Encoding.UNIVERSE_CONSTRAINTS.booleanValue(props),
        Encoding.POLYMORPHISM.booleanValue(props),
        Encoding.TEMPLATE_POLYMORPHISM.booleanValue(props),
        table, SortEncoder.create(props));
  }

  public UniverseMode mode() {
    return mode;
  }

  public boolean isPolymorphismOn() {
    return polymorphism;
  }

  public boolean isTemplatePolymorphismOn() {
    return templatePolymorphism;
  }

  /**
   * Translates a global universe level, as written in a source term.
   *
   * @throws TranslationException if the mode is concrete and the level is
   *   not in the universe table
   */
  public Universe translateLevel(Environment env, String name) {
    if (templatePolymorphism && env.isTemplateLevel(name)) {
      return Universe.template(name);
    }
    switch (mode) {
      case SYMBOLIC:
        return Universe.globalSort(name);
      case NAMED:
        return Universe.namedSort(name);
      case CONCRETE:
        return Universe.type(table.level(name));
      default:
        throw new AssertionError(mode);
    }
  }

  /**
   * Translates a source universe.
   *
   * <p>The result is normalized; in concrete mode, successors and joins of
   * concrete universes are computed.
   *
   * @throws TranslationException if the universe contains a product sort
   *   and constraints are on, or if a level is not in the universe table
   */
  public Universe translate(Environment env, Universe universe) {
    Universe u = map(env, universe).normalize();
    if (mode == UniverseMode.CONCRETE) {
      u = u.reduceConcrete();
    }
    if (constraints
        && mode == UniverseMode.SYMBOLIC
        && u.contains(Op.RULE)) {
      throw TranslationException.notSupported(
          "sort of a product under universe constraints");
    }
    return u;
  }

  private Universe map(Environment env, Universe u) {
    switch (u.op) {
      case GLOBAL_LEVEL:
        return translateLevel(env, ((Universe.Named) u).name);
      case SUCC:
        final Universe.Succ succ = (Universe.Succ) u;
        return Universe.succ(map(env, succ.universe), succ.k);
      case MAX:
        final ImmutableList.Builder<Universe> b = ImmutableList.builder();
        ((Universe.Max) u).universes.forEach(v -> b.add(map(env, v)));
        return Universe.max(b.build());
      case RULE:
        final Universe.Rule rule = (Universe.Rule) u;
        return Universe.rule(map(env, rule.s1), map(env, rule.s2));
      default:
        return u;
    }
  }

  /** Translates a universe and encodes it as a sort. */
  public Dk.Term sort(Environment env, Universe universe) {
    return encoder.sort(translate(env, universe));
  }

  /**
   * Applies the identifier of a universe polymorphic declaration to the
   * sorts of a universe instance.
   *
   * <p>If polymorphism is off, or the declaration has no universe
   * parameters, returns the identifier alone.
   *
   * @throws TranslationException if the instance has fewer levels than the
   *   declaration has parameters
   */
  public Dk.Term instantiate(Environment env, String name, int paramCount,
      List<Universe> instance) {
    return instantiate(env, name, paramCount, 0, instance);
  }

  /**
   * Applies the identifier of a universe polymorphic declaration to the
   * sorts of a universe instance, then to a proof of each of its
   * {@code constraintCount} universe constraints.
   *
   * <p>The proof is the inhabitant of a constraint that holds, so the
   * instance must satisfy the constraints.
   */
  public Dk.Term instantiate(Environment env, String name, int paramCount,
      int constraintCount, List<Universe> instance) {
    final List<Dk.Term> args = new ArrayList<>();
    args.addAll(instanceArgs(env, name, paramCount, instance));
    if (polymorphism) {
      for (int i = 0; i < constraintCount; i++) {
        args.add(encoder.inhabitant());
      }
    }
    return dk.apply(dk.var(Names.translate(name)), args);
  }

  /** Translates the first {@code paramCount} levels of a universe instance
   * to sorts. Empty if polymorphism is off. */
  public ImmutableList<Dk.Term> instanceArgs(Environment env, String name,
      int paramCount, List<Universe> instance) {
    if (!polymorphism || paramCount == 0) {
      return ImmutableList.of();
    }
    if (instance.size() < paramCount) {
      throw TranslationException.arityMismatch(name,
          "expected " + paramCount + " universes, got " + instance.size());
    }
    if (instance.size() > paramCount) {
      LOGGER.warn("Universe instance of {} has {} levels, expected {}",
          name, instance.size(), paramCount);
    }
    LOGGER.debug("Instantiating {} with {}", name, instance);
    final ImmutableList.Builder<Dk.Term> args = ImmutableList.builder();
    for (Universe level : instance.subList(0, paramCount)) {
      args.add(sort(env, level));
    }
    return args.build();
  }

  /** Returns the names of the sort parameters that a declaration with
   * {@code n} universe parameters takes. Empty if polymorphism is off. */
  public ImmutableList<String> polymorphicParams(int n) {
    if (!polymorphism) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(Names.universeParam(i));
    }
    return b.build();
  }

  /** Returns the sort variables and constraint proofs that a universe
   * polymorphic constant takes. Empty if polymorphism is off.
   *
   * @throws TranslationException if a constraint is an equality */
  public ImmutableList<Dk.Binding> polymorphicBindings(Environment env,
      int n, List<ConstantBody.Constraint> constraints) {
    final ImmutableList.Builder<Dk.Binding> b = ImmutableList.builder();
    polymorphicParams(n).forEach(param ->
        b.add(dk.binding(param, encoder.sortType())));
    if (polymorphism) {
      for (int i = 0; i < constraints.size(); i++) {
        b.add(
            dk.binding(Names.constraintParam(i),
                constraintType(env, constraints.get(i))));
      }
    }
    return b.build();
  }

  /** Returns the type of the proofs of a universe constraint:
   * {@code eps (Cumul l r)} if it is {@code l <= r},
   * {@code eps (Cumul (axiom l) r)} if it is {@code l < r}.
   *
   * @throws TranslationException if the constraint is an equality */
  public Dk.Term constraintType(Environment env,
      ConstantBody.Constraint constraint) {
    switch (constraint.relation) {
      case LE:
        return encoder.cumul(translate(env, constraint.left),
            translate(env, constraint.right));
      case LT:
        return encoder.cumulStrict(translate(env, constraint.left),
            translate(env, constraint.right));
      case EQ:
        throw TranslationException.notSupported("equality constraint");
      default:
        throw new AssertionError(constraint.relation);
    }
  }

  /** Returns the template levels of an inductive type, which its
   * translation takes as sort parameters. Empty if template polymorphism is
   * off. */
  public ImmutableList<String> templateParams(InductiveBody inductive) {
    if (!templatePolymorphism) {
      return ImmutableList.of();
    }
    return inductive.templateLevelNames();
  }
}

// End UniverseTranslator.java
