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
import static net.hydromatic.cicdk.ast.CicBuilder.cic;
import static net.hydromatic.cicdk.ast.DkBuilder.dk;
import static net.hydromatic.cicdk.util.Static.concat;
import static net.hydromatic.cicdk.util.Static.skip;
import static net.hydromatic.cicdk.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.type.InductiveBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes groups of structurally recursive definitions as rewrite rules.
 *
 * <p>Each definition {@code f} of a group, with recursive argument {@code x}
 * of inductive type {@code I}, becomes three global functions, each
 * generalized over the local declarations that the group depends on:
 *
 * <ul>
 * <li>the entry function, which has the type of {@code f}, and which
 *   rewrites to the trigger function applied to its arguments, the real
 *   arguments of the type of {@code x}, and {@code x};
 * <li>the trigger function, which has one rule per constructor of
 *   {@code I}, and so rewrites only when {@code x} is a constructor
 *   application;
 * <li>the body function, which rewrites to the body of {@code f}, in which
 *   the definitions of the group are replaced by their entry functions.
 * </ul>
 *
 * <p>A group that has already been encoded, by this declaration or by a
 * previous declaration that succeeded, is not encoded again.
 */
class FixpointEncoder {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(FixpointEncoder.class);

  private final TermTranslator translator;

  FixpointEncoder(TermTranslator translator) {
    this.translator = requireNonNull(translator);
  }

  /** Translates a fixpoint, encoding its group if necessary, to the entry
   * function of its focus applied to the local declarations that the group
   * depends on. */
  Dk.Term translate(Environment env, Cic.Fix fix) {
    final FixpointCache.Key key = FixpointCache.Key.of(fix);
    FixpointCache.Entry entry = translator.pendingFixpoints.get(key);
    if (entry == null) {
      entry = translator.fixpointCache.get(key);
    }
    if (entry != null) {
      LOGGER.debug("Found fixpoint {}", key);
      translator.tracer.onFixpointCacheHit(key);
      translator.fixpointCache.recordHit();
    } else {
      entry = encode(env, fix);
      translator.pendingFixpoints.put(key, entry);
    }

    if (env.relDepth() < entry.sliceSize) {
      throw TranslationException.arityMismatch(key.toString(),
          "fixpoint depends on " + entry.sliceSize
              + " local declarations, but context has " + env.relDepth());
    }
    final List<Cic.Decl> slice =
        env.relContext().subList(0, entry.sliceSize);
    if (Cic.Decl.assumptionCount(slice) != entry.assumptionCount) {
      throw TranslationException.arityMismatch(key.toString(),
          "fixpoint expects " + entry.assumptionCount
              + " local assumptions, got "
              + Cic.Decl.assumptionCount(slice));
    }
    Environment env2 = env;
    for (Cic.Decl decl : entry.namedDecls) {
      env2 = env2.pushNamed(decl);
    }
    return translator.translate(env2,
        Terms.applyRelContext(cic.var(entry.entryNames.get(fix.focus)),
            slice));
  }

  /** Returns the number of innermost local declarations that a fixpoint
   * group depends on, directly or via the types and values of other local
   * declarations. */
  static int sliceSize(Environment env, Cic.Fix fix) {
    final int n = fix.names.size();
    int size = 0;
    for (int i = 0; i < n; i++) {
      size = Math.max(size, Terms.freeRelBound(fix.types.get(i)));
      size = Math.max(size, Terms.freeRelBound(fix.bodies.get(i)) - n);
    }
    if (size > env.relDepth()) {
      throw TranslationException.arityMismatch(fix.names.toString(),
          "fixpoint refers to local declaration #" + size
              + ", but context has " + env.relDepth());
    }
    for (int j = 1; j <= size; j++) {
      final Cic.Decl decl = env.lookupRel(j);
      size = Math.max(size, j + Terms.freeRelBound(decl.type));
      if (decl.value != null) {
        size = Math.max(size, j + Terms.freeRelBound(decl.value));
      }
    }
    return size;
  }

  private FixpointCache.Entry encode(Environment env, Cic.Fix fix) {
    final int n = fix.names.size();
    final int sliceSize = sliceSize(env, fix);
    final List<Cic.Decl> slice = env.relContext().subList(0, sliceSize);
    LOGGER.debug("Encoding fixpoint {} over {} local declarations",
        fix.names, sliceSize);

    final List<String> entryNames = new ArrayList<>();
    final List<String> triggerNames = new ArrayList<>();
    final List<String> bodyNames = new ArrayList<>();
    fix.names.forEach(name ->
        entryNames.add(translator.freshGlobal(env, "fix", name)));
    fix.names.forEach(name ->
        triggerNames.add(translator.freshGlobal(env, "fix", name)));
    fix.names.forEach(name ->
        bodyNames.add(translator.freshGlobal(env, "fix", name)));

    // Signature of each definition: its arguments up to and including the
    // recursive argument, and the inductive type of the recursive argument
    final List<Terms.Decomposition> contexts = new ArrayList<>();
    final List<TermTranslator.InductiveApp> inductives = new ArrayList<>();
    final List<Cic.Term> triggerTypes = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      final Terms.Decomposition d =
          Terms.decomposeProdNAssum(fix.recIndices.get(i) + 1,
              fix.types.get(i));
      final List<Cic.Decl> tail = skip(d.context, 1);
      final TermTranslator.InductiveApp found =
          translator.findInductive(env.pushRelContext(tail),
              d.context.get(0).type);
      contexts.add(d);
      inductives.add(found);
      triggerTypes.add(triggerType(d, found));
    }

    final ImmutableList.Builder<Cic.Decl> namedDecls = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      namedDecls.add(
          Cic.Decl.of(entryNames.get(i),
              Terms.generalize(slice, fix.types.get(i))));
    }
    for (int i = 0; i < n; i++) {
      namedDecls.add(
          Cic.Decl.of(triggerNames.get(i),
              Terms.generalize(slice, triggerTypes.get(i))));
    }
    for (int i = 0; i < n; i++) {
      namedDecls.add(
          Cic.Decl.of(bodyNames.get(i),
              Terms.generalize(slice, fix.types.get(i))));
    }
    final ImmutableList<Cic.Decl> decls = namedDecls.build();

    final Environment globalEnv = env.globalEnv();
    for (Cic.Decl decl : decls) {
      translator.emit(
          dk.definable(Names.translate(decl.name),
              translator.translateType(globalEnv, decl.type)));
    }

    Environment ruleEnv = globalEnv;
    for (Cic.Decl decl : decls) {
      ruleEnv = ruleEnv.pushNamed(decl);
    }
    for (int i = 0; i < n; i++) {
      final List<Dk.Rule> rules = new ArrayList<>();
      rules.add(entryRule(ruleEnv, slice, contexts.get(i), inductives.get(i),
          entryNames.get(i), triggerNames.get(i)));
      rules.addAll(
          triggerRules(ruleEnv, slice, contexts.get(i), inductives.get(i),
              triggerNames.get(i), bodyNames.get(i)));
      rules.add(
          bodyRule(ruleEnv, slice, fix, i, entryNames, bodyNames.get(i)));
      translator.emit(dk.rules(rules));
    }
    return new FixpointCache.Entry(decls, ImmutableList.copyOf(entryNames),
        sliceSize, Cic.Decl.assumptionCount(slice));
  }

  /**
   * Returns the type of the trigger function of a definition, in the
   * context of the definition:
   * {@code forall args, forall reals, I params reals -> T}, where
   * {@code args} are the arguments up to the recursive argument, and
   * {@code T} is the type that remains.
   */
  private Cic.Term triggerType(Terms.Decomposition d,
      TermTranslator.InductiveApp found) {
    final InductiveBody inductive =
        translator.signature.inductive(found.ind.name);
    final List<Cic.Term> params =
        liftAll(1, found.args.subList(0, inductive.nParams));
    final Terms.Decomposition reals =
        Terms.decomposeProdAssum(
            Terms.instantiateProds(inductive.arity, params));
    final int k = reals.context.size();
    final Cic.Term indApp =
        Terms.applyRelContext(cic.apply(found.ind, liftAll(k, params)),
            reals.context);
    return Terms.generalize(d.context,
        Terms.generalize(reals.context,
            cic.prod("x", indApp, Terms.lift(k + 1, d.term))));
  }

  /** Rule {@code fix1 slice args --> fix2 slice args reals x}. */
  private Dk.Rule entryRule(Environment ruleEnv, List<Cic.Decl> slice,
      Terms.Decomposition d, TermTranslator.InductiveApp found,
      String entryName, String triggerName) {
    final InductiveBody inductive =
        translator.signature.inductive(found.ind.name);
    final TermTranslator.TranslatedContext tc =
        translator.translateRelContext(ruleEnv, concat(d.context, slice));
    final List<Dk.Term> args = new ArrayList<>();
    for (Cic.Term real : skip(found.args, inductive.nParams)) {
      args.add(translator.translate(tc.env, Terms.lift(1, real)));
    }
    args.add(dk.var(tc.env.lookupRel(1).name));
    return dk.rule(tc.bindings,
        dk.applyContext(dk.var(Names.translate(entryName)), tc.bindings),
        dk.apply(
            dk.applyContext(dk.var(Names.translate(triggerName)),
                tc.bindings),
            args));
  }

  /** Rules {@code fix2 slice args reals (c params fields) --> fix3 slice
   * args}, one per constructor {@code c}. */
  private List<Dk.Rule> triggerRules(Environment ruleEnv,
      List<Cic.Decl> slice, Terms.Decomposition d,
      TermTranslator.InductiveApp found, String triggerName,
      String bodyName) {
    final InductiveBody inductive =
        translator.signature.inductive(found.ind.name);
    final List<Cic.Term> params =
        liftAll(1, found.args.subList(0, inductive.nParams));
    final List<Cic.Decl> outer = concat(d.context, slice);
    final int outerCount = Cic.Decl.assumptionCount(outer);
    final List<Dk.Rule> rules = new ArrayList<>();
    for (InductiveBody.Constructor constructor : inductive.constructors) {
      final Terms.Decomposition fields =
          Terms.decomposeProdAssum(
              Terms.instantiateProds(constructor.type, params));
      final TermTranslator.TranslatedContext tc =
          translator.translateRelContext(ruleEnv,
              concat(fields.context, outer));
      final List<Dk.Binding> outerBindings =
          tc.bindings.subList(0, outerCount);
      final List<Dk.Binding> fieldBindings = skip(tc.bindings, outerCount);

      final List<Dk.Term> args = new ArrayList<>();
      final Terms.Application conclusion =
          Terms.decomposeApp(fields.term);
      for (Cic.Term real : skip(conclusion.args, inductive.nParams)) {
        args.add(translator.translate(tc.env, real));
      }
      args.add(
          dk.applyContext(constructorPattern(inductive, constructor),
              fieldBindings));
      rules.add(
          dk.rule(tc.bindings,
              dk.apply(
                  dk.applyContext(dk.var(Names.translate(triggerName)),
                      outerBindings),
                  args),
              dk.applyContext(dk.var(Names.translate(bodyName)),
                  outerBindings)));
    }
    return rules;
  }

  /** Rule {@code fix3 slice --> body}, where each definition of the group
   * in the body is replaced by its entry function. */
  private Dk.Rule bodyRule(Environment ruleEnv, List<Cic.Decl> slice,
      Cic.Fix fix, int i, List<String> entryNames, String bodyName) {
    final int n = fix.names.size();
    final TermTranslator.TranslatedContext tc =
        translator.translateRelContext(ruleEnv, slice);
    Environment env = tc.env;
    for (int k = 0; k < n; k++) {
      final Cic.Term value =
          Terms.applyRelContext(cic.var(entryNames.get(k)), slice);
      env = env.pushRel(
          Cic.Decl.let(fix.names.get(k), Terms.lift(k, value),
              Terms.lift(k, fix.types.get(k))));
    }
    final Dk.Term body =
        translator.translate(env, fix.bodies.get(i),
            Terms.lift(n, fix.types.get(i)));
    return dk.rule(tc.bindings,
        dk.applyContext(dk.var(Names.translate(bodyName)), tc.bindings),
        body);
  }

  /** Returns the pattern of a constructor: its identifier applied to
   * wildcards for universe arguments and parameters. */
  private Dk.Term constructorPattern(InductiveBody inductive,
      InductiveBody.Constructor constructor) {
    final UniverseTranslator universes = translator.universes;
    int wildcards = inductive.nParams
        + universes.templateParams(inductive).size();
    if (universes.isPolymorphismOn()) {
      wildcards += inductive.universeParams;
    }
    final List<Dk.Term> args = new ArrayList<>();
    for (int i = 0; i < wildcards; i++) {
      args.add(dk.wildcard());
    }
    return dk.apply(dk.var(Names.translate(constructor.name)), args);
  }

  private static List<Cic.Term> liftAll(int k, List<Cic.Term> terms) {
    return transformEager(terms, t -> Terms.lift(k, t));
  }
}

// End FixpointEncoder.java
