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
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.type.ConstantBody;
import net.hydromatic.cicdk.type.Signature;
import net.hydromatic.cicdk.type.TypeOracle;
import net.hydromatic.cicdk.type.UniverseGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates the declarations of a library.
 *
 * <p>Each top-level declaration is translated in isolation. Its auxiliary
 * instructions (lifted local definitions, encoded fixpoints) are returned,
 * before the declaration itself, only if its translation succeeds; if it
 * fails, fixpoint groups that it encoded are forgotten, the tracer is
 * notified, and the exception is rethrown. Output of earlier declarations
 * remains valid.
 *
 * <p>Translators that share a fixpoint cache may be called from several
 * threads, but their runs are serialized on the cache, so that a fixpoint
 * group is encoded at most once. Everything other than the cache and the
 * name generator is per declaration.
 */
public class Translator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Translator.class);

  private final TypeOracle oracle;
  private final Signature signature;
  private final UniverseTranslator universes;
  private final UniverseDeclarations universeDeclarations;
  private final FixpointCache fixpointCache;
  private final NameGenerator nameGenerator;
  private final Tracer tracer;

  private Translator(TypeOracle oracle, Signature signature,
      UniverseTranslator universes, UniverseDeclarations universeDeclarations,
      FixpointCache fixpointCache, NameGenerator nameGenerator,
      Tracer tracer) {
    this.oracle = requireNonNull(oracle);
    this.signature = requireNonNull(signature);
    this.universes = requireNonNull(universes);
    this.universeDeclarations = requireNonNull(universeDeclarations);
    this.fixpointCache = requireNonNull(fixpointCache);
    this.nameGenerator = requireNonNull(nameGenerator);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a translator. */
  public static Translator create(Map<Encoding, Object> props,
      TypeOracle oracle, Signature signature, UniverseTable table,
      FixpointCache fixpointCache, NameGenerator nameGenerator,
      Tracer tracer) {
    final Map<Encoding, Object> map = new EnumMap<>(Encoding.class);
    map.putAll(props);
    return new Translator(oracle, signature,
        UniverseTranslator.create(map, table),
        UniverseDeclarations.create(map), fixpointCache, nameGenerator,
        tracer);
  }

  /** Creates a translator with default settings, a fresh cache and name
   * generator, and no tracing. */
  public static Translator create(Map<Encoding, Object> props,
      TypeOracle oracle, Signature signature, UniverseTable table) {
    return create(props, oracle, signature, table, new FixpointCache(),
        new NameGenerator(), Tracers.empty());
  }

  public SortEncoder encoder() {
    return universes.encoder;
  }

  public UniverseTranslator universes() {
    return universes;
  }

  public FixpointCache fixpointCache() {
    return fixpointCache;
  }

  /** Returns the instructions that declare the global universes. They must
   * precede every translated declaration. */
  public ImmutableList<Dk.Instruction> declareUniverses(UniverseGraph graph) {
    final ImmutableList<Dk.Instruction> instructions =
        universeDeclarations.declare(graph);
    instructions.forEach(tracer::onDeclaration);
    return instructions;
  }

  /** Translates a term. */
  public Translation translateTerm(Environment env, Cic.Term term) {
    return run(term.toString(), ImmutableList.of(),
        t -> t.translate(env, term));
  }

  /** Translates a term, casting it if its type is not convertible to an
   * expected type. */
  public Translation translateTerm(Environment env, Cic.Term term,
      Cic.Term expectedType) {
    return run(term.toString(), ImmutableList.of(),
        t -> t.translate(env, term, expectedType));
  }

  /** Translates a type. */
  public Translation translateType(Environment env, Cic.Term type) {
    return run(type.toString(), ImmutableList.of(),
        t -> t.translateType(env, type));
  }

  /**
   * Translates a definition {@code name : type := body}.
   *
   * <p>The definition is abstracted over the template levels of the
   * environment, then over {@code universeParams} universe parameters if
   * polymorphism is on. Returns the auxiliary instructions followed by the
   * definition.
   */
  public ImmutableList<Dk.Instruction> translateDefinition(Environment env,
      String name, Cic.Term type, Cic.Term body, int universeParams) {
    return translateDefinition(env, name, type, body, universeParams,
        ImmutableList.of());
  }

  /** Translates a definition that is polymorphic in {@code universeParams}
   * universes, abstracting it also over proofs of its universe
   * constraints. */
  public ImmutableList<Dk.Instruction> translateDefinition(Environment env,
      String name, Cic.Term type, Cic.Term body, int universeParams,
      List<ConstantBody.Constraint> constraints) {
    LOGGER.debug("Translating definition {}", name);
    final ImmutableList<Dk.Binding> params =
        sortParams(name, env, universeParams, constraints);
    final Translation translation =
        run(name, params, t -> {
          final Dk.Term type2 = t.translateType(env, type);
          final Dk.Term body2 = t.translate(env, body, type);
          t.emit(
              dk.definition(Names.translate(name),
                  dk.piContext(params, type2), dk.lamContext(params, body2)));
          return body2;
        });
    return translation.instructions;
  }

  /** Translates an axiom {@code name : type}. */
  public ImmutableList<Dk.Instruction> translateAxiom(Environment env,
      String name, Cic.Term type, int universeParams) {
    return translateAxiom(env, name, type, universeParams,
        ImmutableList.of());
  }

  /** Translates an axiom that is polymorphic in {@code universeParams}
   * universes and assumes some universe constraints. */
  public ImmutableList<Dk.Instruction> translateAxiom(Environment env,
      String name, Cic.Term type, int universeParams,
      List<ConstantBody.Constraint> constraints) {
    LOGGER.debug("Translating axiom {}", name);
    final ImmutableList<Dk.Binding> params =
        sortParams(name, env, universeParams, constraints);
    final Translation translation =
        run(name, params, t -> {
          final Dk.Term type2 = t.translateType(env, type);
          t.emit(
              dk.declaration(Names.translate(name),
                  dk.piContext(params, type2)));
          return type2;
        });
    return translation.instructions;
  }

  /** Translates a constant of the signature: a definition if it has a
   * body, otherwise an axiom. */
  public ImmutableList<Dk.Instruction> translateConstant(Environment env,
      ConstantBody constant) {
    if (constant.body == null) {
      return translateAxiom(env, constant.name, constant.type,
          constant.universeParams, constant.constraints);
    }
    return translateDefinition(env, constant.name, constant.type,
        constant.body, constant.universeParams, constant.constraints);
  }

  /** Returns the variables that a declaration binds: its template levels,
   * then its universe parameters, then proofs of its constraints. */
  private ImmutableList<Dk.Binding> sortParams(String declaration,
      Environment env, int universeParams,
      List<ConstantBody.Constraint> constraints) {
    final ImmutableList.Builder<Dk.Binding> b = ImmutableList.builder();
    final Dk.Term sortType = universes.encoder.sortType();
    if (universes.isTemplatePolymorphismOn()) {
      env.templateLevels().forEach(level ->
          b.add(dk.binding(Names.translate(level), sortType)));
    }
    try {
      b.addAll(
          universes.polymorphicBindings(env, universeParams, constraints));
    } catch (TranslationException e) {
      throw failed(declaration, e);
    }
    return b.build();
  }

  /** Runs the translation of a top-level declaration. */
  private Translation run(String declaration, List<Dk.Binding> params,
      Function<TermTranslator, Dk.Term> action) {
    final Set<String> sortParams = new HashSet<>();
    params.forEach(param -> sortParams.add(param.name));
    synchronized (fixpointCache) {
      final TermTranslator translator =
          new TermTranslator(oracle, signature, universes, nameGenerator,
              fixpointCache, tracer, sortParams);
      final Dk.Term term;
      try {
        term = action.apply(translator);
      } catch (TranslationException e) {
        throw failed(declaration, e);
      }
      fixpointCache.putAll(translator.pendingFixpoints);
      translator.output.forEach(tracer::onDeclaration);
      return new Translation(term, ImmutableList.copyOf(translator.output));
    }
  }

  /** Reports that the translation of a declaration failed, and returns the
   * exception, for the caller to throw. */
  private TranslationException failed(String declaration,
      TranslationException e) {
    LOGGER.debug("Translation of {} failed", declaration, e);
    tracer.onFailure(declaration, e);
    return e;
  }
}

// End Translator.java
