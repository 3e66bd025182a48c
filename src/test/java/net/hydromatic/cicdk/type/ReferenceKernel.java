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

import static net.hydromatic.cicdk.ast.CicBuilder.cic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Op;
import net.hydromatic.cicdk.ast.Universe;
import net.hydromatic.cicdk.compile.Environment;
import net.hydromatic.cicdk.compile.Terms;
import net.hydromatic.cicdk.compile.UniverseTable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Small type checker for tests, with a library of inductive types and
 * constants.
 *
 * <p>Implements weak-head reduction (beta, delta of local and named
 * definitions and of constants, iota of matches and fixpoints) and
 * conversion with cumulativity of sorts. It does not check that terms are
 * well-typed; it only infers their types.
 */
public class ReferenceKernel implements TypeOracle, Signature {
  private final ImmutableMap<String, InductiveBody> inductives;
  private final ImmutableMap<String, ConstantBody> constants;

  private ReferenceKernel(Map<String, InductiveBody> inductives,
      Map<String, ConstantBody> constants) {
    this.inductives = ImmutableMap.copyOf(inductives);
    this.constants = ImmutableMap.copyOf(constants);
  }

  /**
   * Creates a kernel with the fixture library:
   *
   * <ul>
   * <li>{@code nat : Set} with {@code O} and {@code S};
   * <li>{@code bool : Set} with {@code true} and {@code false};
   * <li>{@code list : forall A : Type(list.u0), Type(list.u0)}, template
   *   polymorphic in {@code A}, with {@code nil} and {@code cons};
   * <li>{@code eq : forall (A : Type(eq.u)) (x : A), A -> Prop} with
   *   {@code eq_refl};
   * <li>{@code vec : forall A : Set, nat -> Set} with {@code vnil} and
   *   {@code vcons};
   * <li>constants {@code Top.T}, polymorphic in one universe,
   *   {@code Top.two := S (S O)}, and {@code Top.U}, polymorphic in two
   *   universes {@code u0 < u1}.
   * </ul>
   */
  public static ReferenceKernel fixtures() {
    final Map<String, InductiveBody> inductives = new LinkedHashMap<>();
    final Cic.Ind nat = cic.ind("nat");
    inductives.put("nat",
        InductiveBody.of("nat", 0, 0, cic.set(),
            ImmutableList.of(
                new InductiveBody.Constructor("O", nat),
                new InductiveBody.Constructor("S", cic.arrow(nat, nat)))));

    final Cic.Ind bool = cic.ind("bool");
    inductives.put("bool",
        InductiveBody.of("bool", 0, 0, cic.set(),
            ImmutableList.of(
                new InductiveBody.Constructor("true", bool),
                new InductiveBody.Constructor("false", bool))));

    final Cic.Ind list = cic.ind("list");
    final Cic.Sort listU = cic.type("list.u0");
    inductives.put("list",
        InductiveBody.of("list", 1, 0, cic.prod("A", listU, listU),
            ImmutableList.of(
                new InductiveBody.Constructor("nil",
                    cic.prod("A", listU, cic.apply(list, cic.rel(1)))),
                new InductiveBody.Constructor("cons",
                    cic.prod("A", listU,
                        cic.prod("x", cic.rel(1),
                            cic.prod("l", cic.apply(list, cic.rel(2)),
                                cic.apply(list, cic.rel(3))))))))
            .withTemplateLevels(ImmutableMap.of(0, "list.u0")));

    final Cic.Ind eq = cic.ind("eq");
    inductives.put("eq",
        InductiveBody.of("eq", 2, 1,
            cic.prod("A", cic.type("eq.u"),
                cic.prod("x", cic.rel(1),
                    cic.prod("y", cic.rel(2), cic.prop()))),
            ImmutableList.of(
                new InductiveBody.Constructor("eq_refl",
                    cic.prod("A", cic.type("eq.u"),
                        cic.prod("x", cic.rel(1),
                            cic.apply(eq, cic.rel(2), cic.rel(1),
                                cic.rel(1))))))));

    final Cic.Ind vec = cic.ind("vec");
    inductives.put("vec",
        InductiveBody.of("vec", 1, 1,
            cic.prod("A", cic.set(), cic.arrow(nat, cic.set())),
            ImmutableList.of(
                new InductiveBody.Constructor("vnil",
                    cic.prod("A", cic.set(),
                        cic.apply(vec, cic.rel(1), cic.construct("nat", 0)))),
                new InductiveBody.Constructor("vcons",
                    cic.prod("A", cic.set(),
                        cic.prod("h", cic.rel(1),
                            cic.prod("n", nat,
                                cic.prod("t",
                                    cic.apply(vec, cic.rel(3), cic.rel(1)),
                                    cic.apply(vec, cic.rel(4),
                                        cic.apply(cic.construct("nat", 1),
                                            cic.rel(2)))))))))));

    final Map<String, ConstantBody> constants = new LinkedHashMap<>();
    constants.put("Top.T",
        ConstantBody.axiom("Top.T",
            cic.sort(Universe.succ(Universe.local(0), 1)))
            .withUniverseParams(1));
    final Cic.Term two =
        cic.apply(cic.construct("nat", 1),
            cic.apply(cic.construct("nat", 1), cic.construct("nat", 0)));
    constants.put("Top.two", ConstantBody.definition("Top.two", nat, two));
    constants.put("Top.U",
        ConstantBody.axiom("Top.U",
            cic.sort(Universe.succ(Universe.local(1), 1)))
            .withUniverseParams(2)
            .withConstraints(
                ImmutableList.of(
                    new ConstantBody.Constraint(Universe.local(0),
                        UniverseGraph.Relation.LT, Universe.local(1)))));
    return new ReferenceKernel(inductives, constants);
  }

  /** Returns the universe table of the fixture library. */
  public static UniverseTable universeTable() {
    return UniverseTable.of(
        ImmutableMap.of("list.u0", 0, "eq.u", 0, "Top.1", 1, "Top.2", 2));
  }

  @Override
  public InductiveBody inductive(String name) {
    final InductiveBody inductive = inductives.get(name);
    if (inductive == null) {
      throw new IllegalArgumentException("unknown inductive " + name);
    }
    return inductive;
  }

  @Override
  public ConstantBody constant(String name) {
    final ConstantBody constant = constants.get(name);
    if (constant == null) {
      throw new IllegalArgumentException("unknown constant " + name);
    }
    return constant;
  }

  @Override
  public boolean contains(String name) {
    if (constants.containsKey(name) || inductives.containsKey(name)) {
      return true;
    }
    for (InductiveBody inductive : inductives.values()) {
      for (InductiveBody.Constructor constructor : inductive.constructors) {
        if (constructor.name.equals(name)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public Cic.Term inferType(Environment env, Cic.Term term) {
    switch (term.op) {
      case REL:
        final int i = ((Cic.Rel) term).index;
        return Terms.lift(i, env.lookupRel(i).type);

      case VAR:
        final String id = ((Cic.Var) term).id;
        final Cic.Decl decl = env.lookupNamed(id);
        if (decl == null) {
          throw new IllegalArgumentException("unknown variable " + id);
        }
        return decl.type;

      case SORT:
        return cic.sort(Universe.succ(((Cic.Sort) term).universe, 1));

      case CAST:
        return ((Cic.Cast) term).type;

      case PROD:
        final Cic.Prod prod = (Cic.Prod) term;
        final Universe s1 = inferSort(env, prod.domain);
        final Universe s2 =
            inferSort(env.pushRel(Cic.Decl.of(prod.name, prod.domain)),
                prod.codomain);
        return cic.sort(productSort(s1, s2));

      case LAMBDA:
        final Cic.Lambda lambda = (Cic.Lambda) term;
        return cic.prod(lambda.name, lambda.domain,
            inferType(env.pushRel(Cic.Decl.of(lambda.name, lambda.domain)),
                lambda.body));

      case LET_IN:
        final Cic.LetIn letIn = (Cic.LetIn) term;
        return Terms.subst1(letIn.value,
            inferType(
                env.pushRel(
                    Cic.Decl.let(letIn.name, letIn.value, letIn.type)),
                letIn.body));

      case APP:
        final Cic.App app = (Cic.App) term;
        Cic.Term type = inferType(env, app.fn);
        for (Cic.Term arg : app.args) {
          final Cic.Term whnf = whnf(env, type);
          if (!(whnf instanceof Cic.Prod)) {
            throw new IllegalArgumentException("not a function: " + app.fn);
          }
          type = Terms.subst1(arg, ((Cic.Prod) whnf).codomain);
        }
        return type;

      case CONST:
        return constant(((Cic.Const) term).name).type;

      case IND:
        return inductive(((Cic.Ind) term).name).arity;

      case CONSTRUCT:
        final Cic.Construct construct = (Cic.Construct) term;
        return inductive(construct.name).constructor(construct.index).type;

      case CASE:
        final Cic.Case case_ = (Cic.Case) term;
        final InductiveBody inductive = inductive(case_.inductive);
        final Terms.Application discriminee =
            Terms.decomposeApp(
                whnf(env, inferType(env, case_.discriminee)));
        final ImmutableList.Builder<Cic.Term> args = ImmutableList.builder();
        args.addAll(
            discriminee.args.subList(inductive.nParams,
                discriminee.args.size()));
        args.add(case_.discriminee);
        return beta(case_.motive, args.build());

      case FIX:
        final Cic.Fix fix = (Cic.Fix) term;
        return fix.types.get(fix.focus);

      case CO_FIX:
        final Cic.CoFix coFix = (Cic.CoFix) term;
        return coFix.types.get(coFix.focus);

      default:
        throw new IllegalArgumentException("cannot infer type of " + term);
    }
  }

  /** Returns the sort of a product whose domain has sort {@code s1} and
   * whose codomain has sort {@code s2}. */
  private static Universe productSort(Universe s1, Universe s2) {
    final Universe u1 = s1.normalize();
    final Universe u2 = s2.normalize();
    if (u2.op == Op.PROP || u1.op == Op.PROP || u1.equals(u2)) {
      return u2;
    }
    if (u1.isConcrete() && u2.isConcrete()) {
      return Universe.ofOrdinal(Math.max(u1.ordinal(), u2.ordinal()));
    }
    return Universe.rule(u1, u2);
  }

  @Override
  public Universe inferSort(Environment env, Cic.Term type) {
    final Cic.Term sort = whnf(env, inferType(env, type));
    if (!(sort instanceof Cic.Sort)) {
      throw new IllegalArgumentException("not a type: " + type);
    }
    return ((Cic.Sort) sort).universe;
  }

  @Override
  public boolean convertible(Environment env, Cic.Term actual,
      Cic.Term expected) {
    return convertible(env, actual, expected, true);
  }

  private boolean convertible(Environment env, Cic.Term t1, Cic.Term t2,
      boolean cumulative) {
    final Cic.Term a = whnf(env, t1);
    final Cic.Term b = whnf(env, t2);
    if (a.equals(b)) {
      return true;
    }
    if (a.op != b.op) {
      return false;
    }
    switch (a.op) {
      case SORT:
        final Universe u1 = ((Cic.Sort) a).universe;
        final Universe u2 = ((Cic.Sort) b).universe;
        return cumulative
            ? leq(u1, u2)
            : u1.normalize().equals(u2.normalize());

      case PROD:
        final Cic.Prod p1 = (Cic.Prod) a;
        final Cic.Prod p2 = (Cic.Prod) b;
        return convertible(env, p1.domain, p2.domain, false)
            && convertible(env.pushRel(Cic.Decl.of(p1.name, p1.domain)),
                p1.codomain, p2.codomain, cumulative);

      case LAMBDA:
        final Cic.Lambda l1 = (Cic.Lambda) a;
        final Cic.Lambda l2 = (Cic.Lambda) b;
        return convertible(env, l1.domain, l2.domain, false)
            && convertible(env.pushRel(Cic.Decl.of(l1.name, l1.domain)),
                l1.body, l2.body, false);

      case APP:
        final Cic.App a1 = (Cic.App) a;
        final Cic.App a2 = (Cic.App) b;
        if (a1.args.size() != a2.args.size()
            || !convertible(env, a1.fn, a2.fn, false)) {
          return false;
        }
        for (int i = 0; i < a1.args.size(); i++) {
          if (!convertible(env, a1.args.get(i), a2.args.get(i), false)) {
            return false;
          }
        }
        return true;

      default:
        return false;
    }
  }

  /** Returns whether universe {@code u1} is included in {@code u2}. Named
   * levels are only included in themselves, but include {@code Prop} and
   * {@code Set}. */
  static boolean leq(Universe u1, Universe u2) {
    final Universe a = u1.normalize();
    final Universe b = u2.normalize();
    if (a.equals(b) || a.op == Op.PROP) {
      return true;
    }
    if (a instanceof Universe.Max) {
      for (Universe u : ((Universe.Max) a).universes) {
        if (!leq(u, b)) {
          return false;
        }
      }
      return true;
    }
    if (b instanceof Universe.Max) {
      for (Universe u : ((Universe.Max) b).universes) {
        if (leq(a, u)) {
          return true;
        }
      }
      return false;
    }
    if (a.op == Op.SET) {
      return b.op != Op.PROP;
    }
    if (a.isConcrete() && b.isConcrete()) {
      return a.ordinal() <= b.ordinal();
    }
    return false;
  }

  @Override
  public Cic.Term whnf(Environment env, Cic.Term term) {
    switch (term.op) {
      case REL:
        final int i = ((Cic.Rel) term).index;
        final Cic.Decl decl = env.lookupRel(i);
        return decl.value != null
            ? whnf(env, Terms.lift(i, decl.value))
            : term;

      case VAR:
        final Cic.Decl named = env.lookupNamed(((Cic.Var) term).id);
        return named != null && named.value != null
            ? whnf(env, named.value)
            : term;

      case CAST:
        return whnf(env, ((Cic.Cast) term).term);

      case LET_IN:
        final Cic.LetIn letIn = (Cic.LetIn) term;
        return whnf(env, Terms.subst1(letIn.value, letIn.body));

      case CONST:
        final ConstantBody constant = constant(((Cic.Const) term).name);
        return constant.body != null ? whnf(env, constant.body) : term;

      case APP:
        final Cic.App app = (Cic.App) term;
        final Cic.Term head = whnf(env, app.fn);
        if (head instanceof Cic.Lambda) {
          return whnf(env, beta(head, app.args));
        }
        if (head instanceof Cic.Fix) {
          final Cic.Term unfolded = unfold(env, (Cic.Fix) head, app.args);
          if (unfolded != null) {
            return whnf(env, unfolded);
          }
        }
        return head == app.fn ? term : cic.apply(head, app.args);

      case CASE:
        final Cic.Case case_ = (Cic.Case) term;
        final Terms.Application discriminee =
            Terms.decomposeApp(whnf(env, case_.discriminee));
        if (discriminee.head instanceof Cic.Construct) {
          final Cic.Construct construct = (Cic.Construct) discriminee.head;
          final int nParams = inductive(construct.name).nParams;
          return whnf(env,
              beta(case_.branches.get(construct.index),
                  discriminee.args.subList(nParams,
                      discriminee.args.size())));
        }
        return term;

      default:
        return term;
    }
  }

  /** Unfolds a fixpoint applied to arguments, if its recursive argument is
   * a constructor application; otherwise returns null. */
  private Cic.@Nullable Term unfold(Environment env, Cic.Fix fix,
      List<Cic.Term> args) {
    final int rec = fix.recIndices.get(fix.focus);
    if (args.size() <= rec) {
      return null;
    }
    final Cic.Term recArg =
        Terms.decomposeApp(whnf(env, args.get(rec))).head;
    if (!(recArg instanceof Cic.Construct)) {
      return null;
    }
    final int n = fix.names.size();
    final ImmutableList.Builder<Cic.Term> values = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      values.add(
          cic.fix(fix.recIndices, n - 1 - i, fix.names, fix.types,
              fix.bodies));
    }
    return cic.apply(
        Terms.substl(values.build(), fix.bodies.get(fix.focus)), args);
  }

  /** Applies a term to arguments, reducing beta-redexes at the head. */
  private static Cic.Term beta(Cic.Term fn, List<Cic.Term> args) {
    Cic.Term t = fn;
    int i = 0;
    while (i < args.size() && t instanceof Cic.Lambda) {
      t = Terms.subst1(args.get(i++), ((Cic.Lambda) t).body);
    }
    return cic.apply(t, args.subList(i, args.size()));
  }
}

// End ReferenceKernel.java
