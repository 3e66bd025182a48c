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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds source terms. */
public enum CicBuilder {
  /**
   * The singleton instance of the source term builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  cic;

  private final Cic.Sort prop = new Cic.Sort(Universe.PROP);
  private final Cic.Sort set = new Cic.Sort(Universe.SET);

  /** Creates a reference to the {@code i}th enclosing binder (1-based). */
  public Cic.Rel rel(int i) {
    return new Cic.Rel(i);
  }

  /** Creates a reference to a variable of the named context. */
  public Cic.Var var(String id) {
    return new Cic.Var(id);
  }

  /** Creates a sort. */
  public Cic.Sort sort(Universe universe) {
    if (universe == Universe.PROP) {
      return prop;
    }
    if (universe == Universe.SET) {
      return set;
    }
    return new Cic.Sort(universe);
  }

  /** Returns {@code Prop}. */
  public Cic.Sort prop() {
    return prop;
  }

  /** Returns {@code Set}. */
  public Cic.Sort set() {
    return set;
  }

  /** Creates {@code Type(u)} for a named universe {@code u}. */
  public Cic.Sort type(String level) {
    return sort(Universe.globalLevel(level));
  }

  /** Creates a cast. */
  public Cic.Cast cast(Cic.Term term, Cic.Term type) {
    return new Cic.Cast(term, type);
  }

  /** Creates a dependent product. */
  public Cic.Prod prod(String name, Cic.Term domain, Cic.Term codomain) {
    return new Cic.Prod(name, domain, codomain);
  }

  /** Creates a non-dependent product. The codomain is in the context
   * extended with an anonymous binder, which it must not reference. */
  public Cic.Prod arrow(Cic.Term domain, Cic.Term codomain) {
    return new Cic.Prod("_", domain, codomain);
  }

  /** Creates an abstraction. */
  public Cic.Lambda lambda(String name, Cic.Term domain, Cic.Term body) {
    return new Cic.Lambda(name, domain, body);
  }

  /** Creates a local definition. */
  public Cic.LetIn letIn(String name, Cic.Term value, Cic.Term type,
      Cic.Term body) {
    return new Cic.LetIn(name, value, type, body);
  }

  /** Creates an application, flattening nested applications. */
  public Cic.Term apply(Cic.Term fn, List<? extends Cic.Term> args) {
    if (args.isEmpty()) {
      return fn;
    }
    if (fn instanceof Cic.App) {
      final Cic.App app = (Cic.App) fn;
      return new Cic.App(app.fn,
          ImmutableList.<Cic.Term>builder().addAll(app.args).addAll(args)
              .build());
    }
    return new Cic.App(fn, ImmutableList.copyOf(args));
  }

  /** Creates an application, flattening nested applications. */
  public Cic.Term apply(Cic.Term fn, Cic.Term... args) {
    return apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates a reference to a constant. */
  public Cic.Const constant(String name, Universe... instance) {
    return new Cic.Const(name, ImmutableList.copyOf(instance));
  }

  /** Creates a reference to a constant with a universe instance. */
  public Cic.Const constant(String name, List<Universe> instance) {
    return new Cic.Const(name, ImmutableList.copyOf(instance));
  }

  /** Creates a reference to an inductive type. */
  public Cic.Ind ind(String name, Universe... instance) {
    return new Cic.Ind(name, ImmutableList.copyOf(instance));
  }

  /** Creates a reference to an inductive type with a universe instance. */
  public Cic.Ind ind(String name, List<Universe> instance) {
    return new Cic.Ind(name, ImmutableList.copyOf(instance));
  }

  /** Creates a reference to a constructor. */
  public Cic.Construct construct(String inductive, int index,
      Universe... instance) {
    return new Cic.Construct(inductive, index, ImmutableList.copyOf(instance));
  }

  /** Creates a reference to a constructor with a universe instance. */
  public Cic.Construct construct(String inductive, int index,
      List<Universe> instance) {
    return new Cic.Construct(inductive, index, ImmutableList.copyOf(instance));
  }

  /** Creates a pattern match. */
  public Cic.Case case_(String inductive, Cic.Term motive,
      Cic.Term discriminee, List<? extends Cic.Term> branches) {
    return new Cic.Case(inductive, motive, discriminee,
        ImmutableList.copyOf(branches));
  }

  /** Creates a group of mutually recursive definitions. */
  public Cic.Fix fix(List<Integer> recIndices, int focus, List<String> names,
      List<? extends Cic.Term> types, List<? extends Cic.Term> bodies) {
    return new Cic.Fix(ImmutableList.copyOf(recIndices), focus,
        ImmutableList.copyOf(names), ImmutableList.copyOf(types),
        ImmutableList.copyOf(bodies));
  }

  /** Creates a single recursive definition. */
  public Cic.Fix fix(int recIndex, String name, Cic.Term type,
      Cic.Term body) {
    return fix(ImmutableList.of(recIndex), 0, ImmutableList.of(name),
        ImmutableList.of(type), ImmutableList.of(body));
  }

  /** Creates a group of mutually co-recursive definitions. */
  public Cic.CoFix coFix(int focus, List<String> names,
      List<? extends Cic.Term> types, List<? extends Cic.Term> bodies) {
    return new Cic.CoFix(focus, ImmutableList.copyOf(names),
        ImmutableList.copyOf(types), ImmutableList.copyOf(bodies));
  }

  /** Creates an existential variable. */
  public Cic.Evar evar(int id) {
    return new Cic.Evar(id);
  }

  /** Creates a primitive projection. */
  public Cic.Proj proj(String projection, Cic.Term term) {
    return new Cic.Proj(projection, term);
  }
}

// End CicBuilder.java
