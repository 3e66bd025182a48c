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

import static com.google.common.collect.Lists.reverse;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.cicdk.ast.CicBuilder.cic;
import static net.hydromatic.cicdk.ast.DkBuilder.dk;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.ast.Universe;
import net.hydromatic.cicdk.type.ConstantBody;
import net.hydromatic.cicdk.type.InductiveBody;
import net.hydromatic.cicdk.type.Signature;
import net.hydromatic.cicdk.type.TypeOracle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates source terms and types into target terms.
 *
 * <p>An instance lives for the translation of one top-level declaration. It
 * buffers the auxiliary instructions (lifted definitions, fixpoint
 * functions and their rewrite rules) in the order they are discovered, and
 * the fixpoint encodings that have not yet been committed to the cache.
 */
class TermTranslator {
  final TypeOracle oracle;
  final Signature signature;
  final UniverseTranslator universes;
  final SortEncoder encoder;
  final NameGenerator nameGenerator;
  final FixpointCache fixpointCache;
  final Tracer tracer;
  /** Names of the sort variables that the declaration binds. */
  final ImmutableSet<String> sortParams;

  private final LetLifter letLifter;
  private final FixpointEncoder fixpointEncoder;

  /** Auxiliary instructions, in the order they must be emitted. */
  final List<Dk.Instruction> output = new ArrayList<>();

  /** Fixpoint groups encoded by this translation. */
  final Map<FixpointCache.Key, FixpointCache.Entry> pendingFixpoints =
      new LinkedHashMap<>();

  TermTranslator(TypeOracle oracle, Signature signature,
      UniverseTranslator universes, NameGenerator nameGenerator,
      FixpointCache fixpointCache, Tracer tracer, Set<String> sortParams) {
    this.oracle = requireNonNull(oracle);
    this.signature = requireNonNull(signature);
    this.universes = requireNonNull(universes);
    this.encoder = universes.encoder;
    this.nameGenerator = requireNonNull(nameGenerator);
    this.fixpointCache = requireNonNull(fixpointCache);
    this.tracer = requireNonNull(tracer);
    this.sortParams = ImmutableSet.copyOf(sortParams);
    this.letLifter = new LetLifter(this);
    this.fixpointEncoder = new FixpointEncoder(this);
  }

  /** Adds an auxiliary instruction to the output. */
  void emit(Dk.Instruction instruction) {
    output.add(instruction);
  }

  /** Returns a name for a local variable that does not capture any global
   * symbol that the translation refers to. */
  String freshLocal(Environment env, String hint, String defaultName) {
    return env.freshName(hint, defaultName, this::isGlobal);
  }

  /** Generates a global name that no local variable of an environment
   * shadows. */
  String freshGlobal(Environment env, String prefix, String hint) {
    final Set<String> bound = new HashSet<>();
    env.relContext().forEach(decl -> bound.add(decl.name));
    return nameGenerator.fresh(prefix, hint, bound::contains);
  }

  /** Returns whether an identifier is, or will be, bound outside the
   * declaration: a sort parameter, a name issued by the name generator, a
   * declaration of the signature, or a match function. */
  private boolean isGlobal(String id) {
    return sortParams.contains(id)
        || nameGenerator.isIssued(id)
        || isSignatureName(id)
        || id.startsWith(Names.MATCH_PREFIX)
            && isSignatureName(id.substring(Names.MATCH_PREFIX.length()));
  }

  private boolean isSignatureName(String id) {
    return signature.contains(id)
        || id.contains("__") && signature.contains(id.replace("__", "."));
  }

  /** Translates a term. */
  Dk.Term translate(Environment env, Cic.Term term) {
    return translate(env, term, null);
  }

  /**
   * Translates a term. If an expected type is given and the type of the term
   * is not convertible to it, the term is cast to the expected type.
   */
  Dk.Term translate(Environment env, Cic.Term term,
      Cic.@Nullable Term expectedType) {
    Cic.Term t = term;
    if (expectedType != null) {
      final Cic.Term actualType = oracle.inferType(env, term);
      if (!oracle.convertible(env, actualType, expectedType)) {
        tracer.onCast(term, expectedType);
        t = cic.cast(term, expectedType);
      }
    }
    switch (t.op) {
      case REL:
        final int i = ((Cic.Rel) t).index;
        final Cic.Decl decl = env.lookupRel(i);
        if (decl.value != null) {
          // Expand a let-bound variable to its value
          return translate(env, Terms.lift(i, decl.value));
        }
        return dk.var(decl.name);

      case VAR:
        return dk.var(Names.translate(((Cic.Var) t).id));

      case SORT:
        return encoder.code(universes.translate(env, ((Cic.Sort) t).universe));

      case CAST:
        return translateCast(env, (Cic.Cast) t);

      case PROD:
        final Cic.Prod prod = (Cic.Prod) t;
        final String x = freshLocal(env, prod.name, "x");
        final Environment env2 = env.pushRel(Cic.Decl.of(x, prod.domain));
        final Universe s1 = inferTranslateSort(env, prod.domain);
        final Universe s2 = inferTranslateSort(env2, prod.codomain);
        return encoder.prod(s1, s2, translate(env, prod.domain),
            dk.lam(x, translateType(env, prod.domain),
                translate(env2, prod.codomain)));

      case LAMBDA:
        final Cic.Lambda lambda = (Cic.Lambda) t;
        final String y = freshLocal(env, lambda.name, "var");
        return dk.lam(y, translateType(env, lambda.domain),
            translate(env.pushRel(Cic.Decl.of(y, lambda.domain)),
                lambda.body));

      case LET_IN:
        final Cic.LetIn letIn = (Cic.LetIn) t;
        return translate(pushLet(env, letIn), letIn.body);

      case APP:
        return translateApp(env, (Cic.App) t);

      case CONST:
        final Cic.Const constant = (Cic.Const) t;
        final ConstantBody body = signature.constant(constant.name);
        return universes.instantiate(env, constant.name,
            body.universeParams, body.constraints.size(), constant.instance);

      case IND:
      case CONSTRUCT:
        return translateGlobal(env, (Cic.Global) t, ImmutableList.of());

      case CASE:
        return translateCase(env, (Cic.Case) t);

      case FIX:
        return fixpointEncoder.translate(env, (Cic.Fix) t);

      case CO_FIX:
        throw TranslationException.notSupported("co-fixpoint");

      case EVAR:
        throw TranslationException.notSupported("existential variable");

      case PROJ:
        throw TranslationException.notSupported("primitive projection");

      default:
        throw new AssertionError("unknown term " + t.op);
    }
  }

  private Dk.Term translateCast(Environment env, Cic.Cast cast) {
    if (cast.term.op == cast.op) {
      throw TranslationException.notSupported("nested cast");
    }
    final Cic.Term a = oracle.inferType(env, cast.term);
    final Cic.Term b = cast.type;
    return encoder.cast(inferTranslateSort(env, a),
        inferTranslateSort(env, b), translate(env, a), translate(env, b),
        translate(env, cast.term));
  }

  /** Infers and translates the sort of a type. The type of a sort is
   * computed directly, without calling the type checker. */
  Universe inferTranslateSort(Environment env, Cic.Term type) {
    if (type instanceof Cic.Sort) {
      return universes.translate(env,
          Universe.succ(((Cic.Sort) type).universe, 1));
    }
    return universes.translate(env, oracle.inferSort(env, type));
  }

  /** Lifts a local definition and pushes it, bound to the application of
   * the lifted definition to the context. */
  private Environment pushLet(Environment env, Cic.LetIn letIn) {
    final LetLifter.Lifted lifted =
        letLifter.lift(env, letIn.name, letIn.value, letIn.type);
    return lifted.env.pushRel(
        Cic.Decl.let(freshLocal(lifted.env, letIn.name, "var"), lifted.value,
            letIn.type));
  }

  private Dk.Term translateApp(Environment env, Cic.App app) {
    final Dk.Term fn;
    if (app.fn instanceof Cic.Ind || app.fn instanceof Cic.Construct) {
      fn = translateGlobal(env, (Cic.Global) app.fn, app.args);
    } else {
      fn = translate(env, app.fn);
    }
    Cic.Term type = oracle.inferType(env, app.fn);
    final List<Dk.Term> args = new ArrayList<>();
    for (Cic.Term arg : app.args) {
      final Cic.Term whnf = oracle.whnf(env, type);
      if (!(whnf instanceof Cic.Prod)) {
        throw TranslationException.arityMismatch(app.fn.toString(),
            "applied to " + app.args.size() + " arguments, but its type is "
                + oracle.inferType(env, app.fn));
      }
      final Cic.Prod prod = (Cic.Prod) whnf;
      args.add(translate(env, arg, prod.domain));
      type = Terms.subst1(arg, prod.codomain);
    }
    return dk.apply(fn, args);
  }

  /**
   * Translates a reference to an inductive type or a constructor. If it is
   * template polymorphic, the universe arguments are computed from the
   * sorts of the arguments it is applied to.
   */
  private Dk.Term translateGlobal(Environment env, Cic.Global global,
      List<Cic.Term> args) {
    final InductiveBody inductive = signature.inductive(global.name);
    final String name = global instanceof Cic.Construct
        ? inductive.constructor(((Cic.Construct) global).index).name
        : inductive.name;
    final Dk.Term head = universes.instantiate(env, name,
        inductive.universeParams, global.instance);
    return dk.apply(head, templateArgs(env, inductive, args));
  }

  /**
   * Computes the universe arguments of a template polymorphic inductive
   * type from its parameters. Each template level becomes the join of the
   * sorts of the parameters that it is the level of; a level without
   * parameters keeps its declared value.
   */
  ImmutableList<Dk.Term> templateArgs(Environment env,
      InductiveBody inductive, List<Cic.Term> args) {
    final ImmutableList<String> levels = universes.templateParams(inductive);
    if (levels.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<Dk.Term> b = ImmutableList.builder();
    for (String level : levels) {
      final List<Universe> sorts = new ArrayList<>();
      inductive.templateLevels.forEach((param, paramLevel) -> {
        if (paramLevel.equals(level) && param < args.size()) {
          sorts.add(aritySort(env, args.get(param)));
        }
      });
      final Universe u = sorts.isEmpty()
          ? Universe.globalLevel(level)
          : Universe.max(sorts);
      b.add(encoder.sort(universes.translate(env, u)));
    }
    return b.build();
  }

  /** Returns the sort at the end of the arity of the type of a term. */
  private Universe aritySort(Environment env, Cic.Term term) {
    final Cic.Term type = oracle.whnf(env, oracle.inferType(env, term));
    final Terms.Decomposition decomposition = Terms.decomposeProdAssum(type);
    final Cic.Term sort = oracle.whnf(
        env.pushRelContext(decomposition.context), decomposition.term);
    if (!(sort instanceof Cic.Sort)) {
      throw TranslationException.arityMismatch(term.toString(),
          "template parameter has type " + type + ", which is not an arity");
    }
    return ((Cic.Sort) sort).universe;
  }

  /**
   * Translates a pattern match into an application of the inductive type's
   * match function to: universe arguments, the sort of the motive,
   * parameters, the motive, branches, real arguments, and the
   * discriminee.
   */
  private Dk.Term translateCase(Environment env, Cic.Case case_) {
    final InductiveBody inductive = signature.inductive(case_.inductive);
    final InductiveApp found =
        findInductive(env, oracle.inferType(env, case_.discriminee));
    if (!found.ind.name.equals(inductive.name)) {
      throw TranslationException.arityMismatch(inductive.name,
          "discriminee has type " + found.ind.name);
    }
    final int argCount = inductive.nParams + inductive.nReals;
    if (found.args.size() != argCount) {
      throw TranslationException.arityMismatch(inductive.name,
          "expected " + argCount + " arguments, got " + found.args.size());
    }
    if (case_.branches.size() != inductive.constructors.size()) {
      throw TranslationException.arityMismatch(inductive.name,
          "expected " + inductive.constructors.size() + " branches, got "
              + case_.branches.size());
    }
    final List<Cic.Term> params = found.args.subList(0, inductive.nParams);
    final List<Cic.Term> reals =
        found.args.subList(inductive.nParams, argCount);
    final Terms.Decomposition motive =
        Terms.decomposeLamNAssum(inductive.nReals + 1, case_.motive);
    final Universe returnSort =
        oracle.inferSort(env.pushRelContext(motive.context), motive.term);

    final List<Dk.Term> args = new ArrayList<>();
    args.addAll(
        universes.instanceArgs(env, inductive.name, inductive.universeParams,
            found.ind.instance));
    args.addAll(templateArgs(env, inductive, params));
    args.add(encoder.sort(universes.translate(env, returnSort)));
    params.forEach(param -> args.add(translate(env, param)));
    args.add(translate(env, case_.motive));
    case_.branches.forEach(branch -> args.add(translate(env, branch)));
    reals.forEach(real -> args.add(translate(env, real)));
    args.add(translate(env, case_.discriminee));
    return dk.apply(dk.var(Names.matchFunction(inductive.name)), args);
  }

  /**
   * Reduces a type to an applied inductive type.
   *
   * @throws TranslationException if the type is not an inductive type
   */
  InductiveApp findInductive(Environment env, Cic.Term type) {
    final Terms.Application app =
        Terms.decomposeApp(oracle.whnf(env, type));
    if (!(app.head instanceof Cic.Ind)) {
      throw TranslationException.arityMismatch(type.toString(),
          "not an inductive type");
    }
    return new InductiveApp((Cic.Ind) app.head, app.args);
  }

  /**
   * Translates a type. Sorts, products and local definitions are translated
   * directly; any other type is decoded from the translation of the term.
   */
  Dk.Term translateType(Environment env, Cic.Term type) {
    switch (type.op) {
      case SORT:
        return encoder.univ(
            universes.translate(env, ((Cic.Sort) type).universe));

      case CAST:
        throw TranslationException.notSupported("cast in type position");

      case PROD:
        final Cic.Prod prod = (Cic.Prod) type;
        final String x = prod.name.equals("_")
                && !Terms.occursRel(1, prod.codomain)
            ? "_"
            : freshLocal(env, prod.name, "x");
        return dk.pi(x, translateType(env, prod.domain),
            translateType(env.pushRel(Cic.Decl.of(x, prod.domain)),
                prod.codomain));

      case LET_IN:
        final Cic.LetIn letIn = (Cic.LetIn) type;
        return translateType(pushLet(env, letIn), letIn.body);

      default:
        final Universe s =
            universes.translate(env, oracle.inferSort(env, type));
        return encoder.term(s, translate(env, type));
    }
  }

  /**
   * Translates a context, innermost first, into a list of typed rule
   * variables, outermost first. Let-bound declarations are pushed but have no
   * variable.
   */
  TranslatedContext translateRelContext(Environment env,
      List<Cic.Decl> context) {
    Environment e = env;
    final ImmutableList.Builder<Dk.Binding> bindings = ImmutableList.builder();
    for (Cic.Decl decl : reverse(context)) {
      if (decl.isLet()) {
        e = e.pushRel(decl);
      } else {
        final String x = freshLocal(e, decl.name, "var");
        bindings.add(dk.binding(x, translateType(e, decl.type)));
        e = e.pushRel(decl.withName(x));
      }
    }
    return new TranslatedContext(e, bindings.build());
  }

  /** An inductive type applied to parameters and real arguments. */
  static class InductiveApp {
    final Cic.Ind ind;
    final ImmutableList<Cic.Term> args;

    InductiveApp(Cic.Ind ind, ImmutableList<Cic.Term> args) {
      this.ind = requireNonNull(ind);
      this.args = requireNonNull(args);
    }
  }

  /** Result of translating a context: the extended environment, and the rule
   * variables. */
  static class TranslatedContext {
    final Environment env;
    final ImmutableList<Dk.Binding> bindings;

    TranslatedContext(Environment env, ImmutableList<Dk.Binding> bindings) {
      this.env = requireNonNull(env);
      this.bindings = requireNonNull(bindings);
    }
  }
}

// End TermTranslator.java
