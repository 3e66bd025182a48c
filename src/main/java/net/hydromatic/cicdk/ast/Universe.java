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
package net.hydromatic.cicdk.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Universe expression, the algebra of sorts.
 *
 * <p>The same algebra describes universes as they occur in source terms
 * (where a named universe is a {@link Op#GLOBAL_LEVEL} that has not yet been
 * resolved) and universes as they are about to be encoded.
 *
 * <p>Concrete universes form a linear order: {@code Prop} &lt; {@code Set}
 * &lt; {@code type 0} &lt; {@code type 1} ... The canonical form of
 * {@code type i} is {@code Succ(Prop, i + 1)}.
 */
public abstract class Universe {
  public static final Universe PROP = new Atom(Op.PROP);
  public static final Universe SET = new Atom(Op.SET);
  public static final Universe UNBOUNDED = new Atom(Op.UNBOUNDED);

  public final Op op;

  Universe(Op op) {
    this.op = requireNonNull(op);
  }

  /** Creates a reference to a global named level, as written in a source
   * term. */
  public static Universe globalLevel(String name) {
    return new Named(Op.GLOBAL_LEVEL, name);
  }

  /** Creates a global universe that is declared as a sort in the universe
   * module. */
  public static Universe globalSort(String name) {
    return new Named(Op.GLOBAL_SORT, name);
  }

  /** Creates an uninterpreted named sort. */
  public static Universe namedSort(String name) {
    return new Named(Op.NAMED_SORT, name);
  }

  /** Creates a template universe parameter. */
  public static Universe template(String name) {
    return new Named(Op.TEMPLATE, name);
  }

  /** Creates a universe parameter of a polymorphic declaration. */
  public static Universe local(int index) {
    return new Local(index);
  }

  /** Creates the {@code k}-fold successor of a universe. */
  public static Universe succ(Universe universe, int k) {
    return new Succ(universe, k);
  }

  /** Creates the join of a list of universes. */
  public static Universe max(Iterable<? extends Universe> universes) {
    return new Max(ImmutableList.copyOf(universes));
  }

  /** Creates the join of some universes. */
  public static Universe max(Universe... universes) {
    return max(ImmutableList.copyOf(universes));
  }

  /** Creates the sort of a product whose domain has sort {@code s1} and whose
   * codomain has sort {@code s2}. */
  public static Universe rule(Universe s1, Universe s2) {
    return new Rule(s1, s2);
  }

  /** Creates concrete universe {@code type i}. */
  public static Universe type(int i) {
    checkArgument(i >= 0, "negative level %s", i);
    return succ(PROP, i + 1);
  }

  /** Returns the concrete universe with a given ordinal: -1 for
   * {@code Prop}, 0 for {@code Set}, {@code i + 1} for {@code type i}. */
  public static Universe ofOrdinal(int ordinal) {
    checkArgument(ordinal >= -1, "bad ordinal %s", ordinal);
    switch (ordinal) {
      case -1:
        return PROP;
      case 0:
        return SET;
      default:
        return succ(PROP, ordinal);
    }
  }

  /** Whether this universe is {@code Prop}, {@code Set}, or a successor of
   * one of them. */
  public boolean isConcrete() {
    return false;
  }

  /** Returns the ordinal of a concrete universe.
   *
   * @see #ofOrdinal(int) */
  public int ordinal() {
    throw new IllegalArgumentException("not concrete: " + this);
  }

  /**
   * Returns this universe with successor chains collapsed, zero-fold
   * successors removed, and joins flattened. Joins of one element become that
   * element; the empty join becomes {@code Prop}.
   *
   * <p>Idempotent: {@code u.normalize().normalize()} equals
   * {@code u.normalize()}.
   */
  public abstract Universe normalize();

  /** Returns this normalized universe with successors, joins and rules over
   * concrete universes computed. */
  public Universe reduceConcrete() {
    return this;
  }

  /** Returns whether this universe contains a sub-expression of a given
   * kind. */
  public boolean contains(Op op) {
    return this.op == op;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /** Universe that has no arguments: {@code Prop}, {@code Set},
   * unbounded. */
  private static class Atom extends Universe {
    Atom(Op op) {
      super(op);
    }

    @Override
    public boolean isConcrete() {
      return op != Op.UNBOUNDED;
    }

    @Override
    public int ordinal() {
      switch (op) {
        case PROP:
          return -1;
        case SET:
          return 0;
        default:
          return super.ordinal();
      }
    }

    @Override
    public Universe normalize() {
      return this;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      switch (op) {
        case PROP:
          return buf.append("Prop");
        case SET:
          return buf.append("Set");
        default:
          return buf.append("Unbounded");
      }
    }
  }

  /** Universe identified by name. */
  public static class Named extends Universe {
    public final String name;

    Named(Op op, String name) {
      super(op);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Named
              && ((Named) o).op == op
              && ((Named) o).name.equals(name);
    }

    @Override
    public Universe normalize() {
      return this;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }
  }

  /** Universe parameter of a polymorphic declaration. */
  public static class Local extends Universe {
    public final int index;

    Local(int index) {
      super(Op.LOCAL);
      checkArgument(index >= 0, "negative index %s", index);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return index + 17;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Local && ((Local) o).index == index;
    }

    @Override
    public Universe normalize() {
      return this;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append("Var(").append(index).append(')');
    }
  }

  /** The {@code k}-fold successor of a universe. */
  public static class Succ extends Universe {
    public final Universe universe;
    public final int k;

    Succ(Universe universe, int k) {
      super(Op.SUCC);
      this.universe = requireNonNull(universe);
      this.k = k;
      checkArgument(k >= 0, "negative successor count %s", k);
    }

    @Override
    public int hashCode() {
      return Objects.hash(universe, k);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Succ
              && ((Succ) o).k == k
              && ((Succ) o).universe.equals(universe);
    }

    @Override
    public boolean isConcrete() {
      return universe.op == Op.PROP || universe.op == Op.SET;
    }

    @Override
    public int ordinal() {
      if (!isConcrete()) {
        return super.ordinal();
      }
      return k;
    }

    @Override
    public boolean contains(Op op) {
      return super.contains(op) || universe.contains(op);
    }

    @Override
    public Universe normalize() {
      final Universe u = universe.normalize();
      if (k == 0) {
        return u;
      }
      if (u instanceof Succ) {
        final Succ succ = (Succ) u;
        return succ(succ.universe, succ.k + k);
      }
      return u == universe ? this : succ(u, k);
    }

    @Override
    public Universe reduceConcrete() {
      final Universe u = universe.reduceConcrete();
      if (u.isConcrete()) {
        // The successor of Prop is type 0, the same as the successor of Set.
        return ofOrdinal(Math.max(u.ordinal(), 0) + k);
      }
      return u == universe ? this : succ(u, k).normalize();
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return universe.unparse(buf).append('+').append(k);
    }
  }

  /** Join of a list of universes. */
  public static class Max extends Universe {
    public final ImmutableList<Universe> universes;

    Max(ImmutableList<Universe> universes) {
      super(Op.MAX);
      this.universes = requireNonNull(universes);
    }

    @Override
    public int hashCode() {
      return universes.hashCode() + 31;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Max && ((Max) o).universes.equals(universes);
    }

    @Override
    public boolean contains(Op op) {
      if (super.contains(op)) {
        return true;
      }
      for (Universe universe : universes) {
        if (universe.contains(op)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Universe normalize() {
      final Set<Universe> set = new LinkedHashSet<>();
      for (Universe universe : universes) {
        final Universe u = universe.normalize();
        if (u instanceof Max) {
          set.addAll(((Max) u).universes);
        } else {
          set.add(u);
        }
      }
      switch (set.size()) {
        case 0:
          return PROP;
        case 1:
          return set.iterator().next();
        default:
          final ImmutableList<Universe> list = ImmutableList.copyOf(set);
          return list.equals(universes) ? this : new Max(list);
      }
    }

    @Override
    public Universe reduceConcrete() {
      final List<Universe> others = new ArrayList<>();
      int ordinal = -1;
      for (Universe universe : universes) {
        final Universe u = universe.reduceConcrete();
        if (u.isConcrete()) {
          ordinal = Math.max(ordinal, u.ordinal());
        } else {
          others.add(u);
        }
      }
      if (ordinal >= 0) {
        // Prop is the bottom element, and is absorbed by any other.
        others.add(ofOrdinal(ordinal));
      }
      return max(others).normalize();
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("max(");
      for (int i = 0; i < universes.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        universes.get(i).unparse(buf);
      }
      return buf.append(')');
    }
  }

  /** Sort of a product, impredicative in its second argument. */
  public static class Rule extends Universe {
    public final Universe s1;
    public final Universe s2;

    Rule(Universe s1, Universe s2) {
      super(Op.RULE);
      this.s1 = requireNonNull(s1);
      this.s2 = requireNonNull(s2);
    }

    @Override
    public int hashCode() {
      return Objects.hash(s1, s2);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Rule
              && ((Rule) o).s1.equals(s1)
              && ((Rule) o).s2.equals(s2);
    }

    @Override
    public boolean contains(Op op) {
      return super.contains(op) || s1.contains(op) || s2.contains(op);
    }

    @Override
    public Universe normalize() {
      final Universe u1 = s1.normalize();
      final Universe u2 = s2.normalize();
      return u1 == s1 && u2 == s2 ? this : rule(u1, u2);
    }

    @Override
    public Universe reduceConcrete() {
      final Universe u1 = s1.reduceConcrete();
      final Universe u2 = s2.reduceConcrete();
      if (u2.op == Op.PROP) {
        return PROP;
      }
      if (u1.isConcrete() && u2.isConcrete()) {
        return ofOrdinal(Math.max(u1.ordinal(), u2.ordinal()));
      }
      return rule(u1, u2);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("rule(");
      s1.unparse(buf).append(", ");
      return s2.unparse(buf).append(')');
    }
  }
}

// End Universe.java
