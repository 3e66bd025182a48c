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

import java.util.List;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifts local definitions to global definitions.
 *
 * <p>The target calculus has no local definitions. A definition
 * {@code let x : A := v in b}, in a local context {@code G}, becomes a
 * global definition {@code def y : (forall G, A) := (fun G => v).}, emitted
 * before the enclosing declaration, and {@code x} is bound to
 * {@code y G}. Let-bound declarations of {@code G} are substituted, not
 * abstracted.
 */
class LetLifter {
  private static final Logger LOGGER = LoggerFactory.getLogger(LetLifter.class);

  private final TermTranslator translator;

  LetLifter(TermTranslator translator) {
    this.translator = requireNonNull(translator);
  }

  /**
   * Lifts a local definition.
   *
   * <p>The value and type are translated, and the definition emitted, before
   * this method returns; so a definition that occurs inside the value of
   * another is emitted first.
   */
  Lifted lift(Environment env, String name, Cic.Term value, Cic.Term type) {
    final String y = translator.freshGlobal(env, "let", name);
    final List<Cic.Decl> context = env.relContext();
    final Cic.Term closedType = Terms.generalize(context, type);
    final Cic.Term closedValue = Terms.abstractOver(context, value);
    LOGGER.debug("Lifting {} as {} over {} local declarations", name, y,
        context.size());

    final Environment env2 =
        env.pushNamed(Cic.Decl.let(y, closedValue, closedType));
    final Environment global = env2.globalEnv();
    final Dk.Term type2 = translator.translateType(global, closedType);
    final Dk.Term value2 =
        translator.translate(global, closedValue, closedType);
    translator.emit(dk.definition(Names.translate(y), type2, value2));
    translator.tracer.onLetLifted(y);
    return new Lifted(env2, Terms.applyRelContext(cic.var(y), context));
  }

  /** Result of lifting a local definition: the environment extended with
   * the global definition, and the term that replaces the local
   * variable. */
  static class Lifted {
    final Environment env;
    final Cic.Term value;

    Lifted(Environment env, Cic.Term value) {
      this.env = requireNonNull(env);
      this.value = requireNonNull(value);
    }
  }
}

// End LetLifter.java
