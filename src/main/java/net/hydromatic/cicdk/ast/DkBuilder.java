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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds target terms and instructions. */
public enum DkBuilder {
  /**
   * The singleton instance of the target term builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  dk;

  /** Creates a reference to a symbol or bound variable. */
  public Dk.Var var(String name) {
    return new Dk.Var(name);
  }

  /** Creates an application, flattening nested applications. Returns the
   * function if there are no arguments. */
  public Dk.Term apply(Dk.Term fn, List<? extends Dk.Term> args) {
    if (args.isEmpty()) {
      return fn;
    }
    if (fn instanceof Dk.App) {
      final Dk.App app = (Dk.App) fn;
      return new Dk.App(app.fn,
          ImmutableList.<Dk.Term>builder().addAll(app.args).addAll(args)
              .build());
    }
    return new Dk.App(fn, ImmutableList.copyOf(args));
  }

  /** Creates an application, flattening nested applications. */
  public Dk.Term apply(Dk.Term fn, Dk.Term... args) {
    return apply(fn, ImmutableList.copyOf(args));
  }

  /** Applies a term to the variables of a rule context. */
  public Dk.Term applyContext(Dk.Term fn, List<Dk.Binding> context) {
    final ImmutableList.Builder<Dk.Term> args = ImmutableList.builder();
    context.forEach(binding -> args.add(var(binding.name)));
    return apply(fn, args.build());
  }

  /** Creates an abstraction. */
  public Dk.Lam lam(String name, Dk.@Nullable Term type, Dk.Term body) {
    return new Dk.Lam(name, type, body);
  }

  /** Abstracts a term over each variable of a rule context, outermost
   * first. */
  public Dk.Term lamContext(List<Dk.Binding> context, Dk.Term body) {
    Dk.Term term = body;
    for (Dk.Binding binding : Lists.reverse(context)) {
      term = lam(binding.name, binding.type, term);
    }
    return term;
  }

  /** Creates a dependent product. */
  public Dk.Pi pi(String name, Dk.Term type, Dk.Term body) {
    return new Dk.Pi(name, type, body);
  }

  /** Creates a non-dependent product. */
  public Dk.Pi arrow(Dk.Term type, Dk.Term body) {
    return new Dk.Pi("_", type, body);
  }

  /** Quantifies a term over each variable of a rule context, outermost
   * first. Bindings must be typed. */
  public Dk.Term piContext(List<Dk.Binding> context, Dk.Term body) {
    Dk.Term term = body;
    for (Dk.Binding binding : Lists.reverse(context)) {
      term = pi(binding.name, requireNonNull(binding.type), term);
    }
    return term;
  }

  /** Returns the wildcard pattern. */
  public Dk.Term wildcard() {
    return Dk.Wildcard.INSTANCE;
  }

  /** Creates a typed pattern variable. */
  public Dk.Binding binding(String name, Dk.@Nullable Term type) {
    return new Dk.Binding(name, type);
  }

  /** Creates a declaration of a static symbol. */
  public Dk.Declaration declaration(String name, Dk.Term type) {
    return new Dk.Declaration(name, type, false);
  }

  /** Creates a declaration of a symbol that rewrite rules will define. */
  public Dk.Declaration definable(String name, Dk.Term type) {
    return new Dk.Declaration(name, type, true);
  }

  /** Creates a definition. */
  public Dk.Definition definition(String name, Dk.@Nullable Term type,
      Dk.Term value) {
    return new Dk.Definition(name, type, value);
  }

  /** Creates a rewrite rule. */
  public Dk.Rule rule(List<Dk.Binding> context, Dk.Term lhs, Dk.Term rhs) {
    return new Dk.Rule(ImmutableList.copyOf(context), lhs, rhs);
  }

  /** Creates a block of rewrite rules. */
  public Dk.Rules rules(List<Dk.Rule> rules) {
    return new Dk.Rules(ImmutableList.copyOf(rules));
  }

  /** Creates a block of rewrite rules. */
  public Dk.Rules rules(Dk.Rule... rules) {
    return rules(ImmutableList.copyOf(rules));
  }

  /** Creates a comment. */
  public Dk.Comment comment(String text) {
    return new Dk.Comment(text);
  }

  /** Returns the empty line. */
  public Dk.Instruction emptyLine() {
    return Dk.EmptyLine.INSTANCE;
  }
}

// End DkBuilder.java
