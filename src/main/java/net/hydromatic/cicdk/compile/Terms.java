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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.cicdk.ast.CicBuilder.cic;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cicdk.ast.Cic;

/**
 * Operations on de Bruijn indices of source terms: lifting, substitution,
 * and decomposition of binders into contexts.
 *
 * <p>Contexts are lists of declarations, innermost first.
 */
public abstract class Terms {
  private Terms() {}

  /** Replaces a variable that is free in a term. */
  @FunctionalInterface
  private interface RelShuttle {
    /** Returns the replacement for {@code Rel(index)}, which occurs under
     * {@code depth} binders and is free ({@code index > depth}). */
    Cic.Term apply(int index, int depth);
  }

  /** Adds {@code k} to the index of every free variable. */
  public static Cic.Term lift(int k, Cic.Term term) {
    checkArgument(k >= 0, "negative lift %s", k);
    if (k == 0) {
      return term;
    }
    return map(term, 0, (index, depth) -> cic.rel(index + k));
  }

  /** Substitutes {@code value} for {@code Rel(1)} and lowers the other free
   * variables by one. */
  public static Cic.Term subst1(Cic.Term value, Cic.Term term) {
    return substl(ImmutableList.of(value), term);
  }

  /**
   * Substitutes {@code values.get(i)} for {@code Rel(i + 1)}, and lowers the
   * other free variables by {@code values.size()}. The values are valid in
   * the context outside the substituted variables.
   */
  public static Cic.Term substl(List<? extends Cic.Term> values,
      Cic.Term term) {
    if (values.isEmpty()) {
      return term;
    }
    final int n = values.size();
    return map(term, 0, (index, depth) -> {
      final int i = index - depth;
      if (i <= n) {
        return lift(depth, values.get(i - 1));
      }
      return cic.rel(index - n);
    });
  }

  /** Returns the largest index of a free variable of a term, relative to
   * the term's context, or 0 if the term is closed. */
  public static int freeRelBound(Cic.Term term) {
    final int[] bound = {0};
    map(term, 0, (index, depth) -> {
      bound[0] = Math.max(bound[0], index - depth);
      return cic.rel(index);
    });
    return bound[0];
  }

  /** Returns whether {@code Rel(i)} occurs free in a term. */
  public static boolean occursRel(int i, Cic.Term term) {
    final boolean[] found = {false};
    map(term, 0, (index, depth) -> {
      if (index - depth == i) {
        found[0] = true;
      }
      return cic.rel(index);
    });
    return found[0];
  }

  /** Applies a shuttle to every free variable of a term. */
  private static Cic.Term map(Cic.Term term, int depth, RelShuttle shuttle) {
    switch (term.op) {
      case REL:
        final Cic.Rel rel = (Cic.Rel) term;
        return rel.index > depth ? shuttle.apply(rel.index, depth) : rel;

      case VAR:
      case SORT:
      case CONST:
      case IND:
      case CONSTRUCT:
      case EVAR:
        return term;

      case CAST:
        final Cic.Cast cast = (Cic.Cast) term;
        return cic.cast(map(cast.term, depth, shuttle),
            map(cast.type, depth, shuttle));

      case PROD:
        final Cic.Prod prod = (Cic.Prod) term;
        return cic.prod(prod.name, map(prod.domain, depth, shuttle),
            map(prod.codomain, depth + 1, shuttle));

      case LAMBDA:
        final Cic.Lambda lambda = (Cic.Lambda) term;
        return cic.lambda(lambda.name, map(lambda.domain, depth, shuttle),
            map(lambda.body, depth + 1, shuttle));

      case LET_IN:
        final Cic.LetIn letIn = (Cic.LetIn) term;
        return cic.letIn(letIn.name, map(letIn.value, depth, shuttle),
            map(letIn.type, depth, shuttle),
            map(letIn.body, depth + 1, shuttle));

      case APP:
        final Cic.App app = (Cic.App) term;
        return cic.apply(map(app.fn, depth, shuttle),
            mapList(app.args, depth, shuttle));

      case CASE:
        final Cic.Case case_ = (Cic.Case) term;
        return cic.case_(case_.inductive, map(case_.motive, depth, shuttle),
            map(case_.discriminee, depth, shuttle),
            mapList(case_.branches, depth, shuttle));

      case FIX:
        final Cic.Fix fix = (Cic.Fix) term;
        return cic.fix(fix.recIndices, fix.focus, fix.names,
            mapList(fix.types, depth, shuttle),
            mapList(fix.bodies, depth + fix.names.size(), shuttle));

      case CO_FIX:
        final Cic.CoFix coFix = (Cic.CoFix) term;
        return cic.coFix(coFix.focus, coFix.names,
            mapList(coFix.types, depth, shuttle),
            mapList(coFix.bodies, depth + coFix.names.size(), shuttle));

      case PROJ:
        final Cic.Proj proj = (Cic.Proj) term;
        return cic.proj(proj.projection, map(proj.term, depth, shuttle));

      default:
        throw new AssertionError("unknown term " + term.op);
    }
  }

  private static List<Cic.Term> mapList(List<Cic.Term> terms, int depth,
      RelShuttle shuttle) {
    final ImmutableList.Builder<Cic.Term> b = ImmutableList.builder();
    terms.forEach(t -> b.add(map(t, depth, shuttle)));
    return b.build();
  }

  /**
   * Quantifies a term over every declaration of a context. Let-bound
   * declarations are substituted by their values.
   */
  public static Cic.Term generalize(List<Cic.Decl> context, Cic.Term term) {
    Cic.Term t = term;
    for (Cic.Decl decl : context) {
      t = decl.value != null
          ? subst1(decl.value, t)
          : cic.prod(decl.name, decl.type, t);
    }
    return t;
  }

  /**
   * Abstracts a term over every declaration of a context. Let-bound
   * declarations are substituted by their values.
   */
  public static Cic.Term abstractOver(List<Cic.Decl> context,
      Cic.Term term) {
    Cic.Term t = term;
    for (Cic.Decl decl : context) {
      t = decl.value != null
          ? subst1(decl.value, t)
          : cic.lambda(decl.name, decl.type, t);
    }
    return t;
  }

  /**
   * Applies a term to the variables of a context, outermost first, skipping
   * let-bound declarations. This is the inverse of
   * {@link #abstractOver(List, Cic.Term)}.
   */
  public static Cic.Term applyRelContext(Cic.Term term,
      List<Cic.Decl> context) {
    final List<Cic.Term> args = new ArrayList<>();
    for (int i = context.size(); i >= 1; i--) {
      if (!context.get(i - 1).isLet()) {
        args.add(cic.rel(i));
      }
    }
    return cic.apply(term, args);
  }

  /**
   * Splits the first {@code n} products off a type, together with any
   * local definitions among them.
   *
   * @throws TranslationException if the type has fewer than {@code n}
   *   products
   */
  public static Decomposition decomposeProdNAssum(int n, Cic.Term type) {
    final List<Cic.Decl> context = new ArrayList<>();
    Cic.Term t = type;
    for (int i = 0; i < n;) {
      switch (t.op) {
        case PROD:
          final Cic.Prod prod = (Cic.Prod) t;
          context.add(0, Cic.Decl.of(prod.name, prod.domain));
          t = prod.codomain;
          ++i;
          break;
        case LET_IN:
          final Cic.LetIn letIn = (Cic.LetIn) t;
          context.add(0, Cic.Decl.let(letIn.name, letIn.value, letIn.type));
          t = letIn.body;
          break;
        case CAST:
          t = ((Cic.Cast) t).term;
          break;
        default:
          throw TranslationException.arityMismatch(type.toString(),
              "expected " + n + " products, found " + i);
      }
    }
    return new Decomposition(context, t);
  }

  /** Splits all products and local definitions off a type. */
  public static Decomposition decomposeProdAssum(Cic.Term type) {
    final List<Cic.Decl> context = new ArrayList<>();
    Cic.Term t = type;
    for (;;) {
      switch (t.op) {
        case PROD:
          final Cic.Prod prod = (Cic.Prod) t;
          context.add(0, Cic.Decl.of(prod.name, prod.domain));
          t = prod.codomain;
          break;
        case LET_IN:
          final Cic.LetIn letIn = (Cic.LetIn) t;
          context.add(0, Cic.Decl.let(letIn.name, letIn.value, letIn.type));
          t = letIn.body;
          break;
        case CAST:
          t = ((Cic.Cast) t).term;
          break;
        default:
          return new Decomposition(context, t);
      }
    }
  }

  /**
   * Splits the first {@code n} abstractions off a term, together with any
   * local definitions among them.
   *
   * @throws TranslationException if the term has fewer than {@code n}
   *   abstractions
   */
  public static Decomposition decomposeLamNAssum(int n, Cic.Term term) {
    final List<Cic.Decl> context = new ArrayList<>();
    Cic.Term t = term;
    for (int i = 0; i < n;) {
      switch (t.op) {
        case LAMBDA:
          final Cic.Lambda lambda = (Cic.Lambda) t;
          context.add(0, Cic.Decl.of(lambda.name, lambda.domain));
          t = lambda.body;
          ++i;
          break;
        case LET_IN:
          final Cic.LetIn letIn = (Cic.LetIn) t;
          context.add(0, Cic.Decl.let(letIn.name, letIn.value, letIn.type));
          t = letIn.body;
          break;
        case CAST:
          t = ((Cic.Cast) t).term;
          break;
        default:
          throw TranslationException.arityMismatch(term.toString(),
              "expected " + n + " abstractions, found " + i);
      }
    }
    return new Decomposition(context, t);
  }

  /**
   * Instantiates the leading products of a type with arguments. Local
   * definitions among the products are substituted by their values.
   *
   * @throws TranslationException if the type has fewer products than there
   *   are arguments
   */
  public static Cic.Term instantiateProds(Cic.Term type,
      List<? extends Cic.Term> args) {
    Cic.Term t = type;
    for (int i = 0; i < args.size();) {
      switch (t.op) {
        case PROD:
          t = subst1(args.get(i++), ((Cic.Prod) t).codomain);
          break;
        case LET_IN:
          final Cic.LetIn letIn = (Cic.LetIn) t;
          t = subst1(letIn.value, letIn.body);
          break;
        case CAST:
          t = ((Cic.Cast) t).term;
          break;
        default:
          throw TranslationException.arityMismatch(type.toString(),
              "expected " + args.size() + " products, found " + i);
      }
    }
    return t;
  }

  /** Splits an application into its head and arguments. A term that is not
   * an application has no arguments. */
  public static Application decomposeApp(Cic.Term term) {
    if (term instanceof Cic.App) {
      final Cic.App app = (Cic.App) term;
      return new Application(app.fn, app.args);
    }
    return new Application(term, ImmutableList.of());
  }

  /** A context and a term in that context. */
  public static class Decomposition {
    /** Declarations, innermost first. */
    public final ImmutableList<Cic.Decl> context;
    public final Cic.Term term;

    Decomposition(List<Cic.Decl> context, Cic.Term term) {
      this.context = ImmutableList.copyOf(context);
      this.term = requireNonNull(term);
    }

    /** Returns the number of declarations in the context that are not
     * let-bound. */
    public int assumptionCount() {
      return Cic.Decl.assumptionCount(context);
    }
  }

  /** A head applied to a list of arguments. */
  public static class Application {
    public final Cic.Term head;
    public final ImmutableList<Cic.Term> args;

    Application(Cic.Term head, ImmutableList<Cic.Term> args) {
      this.head = requireNonNull(head);
      this.args = requireNonNull(args);
    }
  }
}

// End Terms.java
