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

import static net.hydromatic.cicdk.ast.CicBuilder.cic;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.ast.Universe;
import net.hydromatic.cicdk.type.ConstantBody;
import net.hydromatic.cicdk.type.ReferenceKernel;
import net.hydromatic.cicdk.type.UniverseGraph;
import org.junit.jupiter.api.Test;

/** Tests {@link Translator}: translation of terms, local definitions,
 * pattern matches and fixpoints against the fixture library. */
public class TranslatorTest {
  private static final ReferenceKernel KERNEL = ReferenceKernel.fixtures();
  private static final Environment EMPTY = Environments.empty();

  private static final Cic.Term NAT = cic.ind("nat");
  private static final Cic.Term BOOL = cic.ind("bool");
  private static final Cic.Term O = cic.construct("nat", 0);
  private static final Cic.Term S = cic.construct("nat", 1);

  /** Symbols that the fixture library declares. */
  private static final Set<String> GLOBALS =
      ImmutableSet.of("nat", "O", "S", "bool", "true", "false", "list", "nil",
          "cons", "eq", "eq_refl", "vec", "vnil", "vcons", "Top__T",
          "Top__two", "Top__U", "match__nat", "match__bool", "match__list",
          "match__eq", "match__vec");

  /** {@code fix f (n : nat) : nat := match n with O => O | S p => f p}. */
  private static final Cic.Fix FIX_F =
      cic.fix(0, "f", cic.prod("n", NAT, NAT),
          cic.lambda("n", NAT,
              cic.case_("nat", cic.lambda("m", NAT, NAT), cic.rel(1),
                  ImmutableList.of(O,
                      cic.lambda("p", NAT,
                          cic.apply(cic.rel(3), cic.rel(1)))))));

  private static Translator translator(Map<Encoding, Object> props) {
    return Translator.create(props, KERNEL, KERNEL,
        ReferenceKernel.universeTable());
  }

  private static Translator translator(Tracer tracer) {
    return Translator.create(ImmutableMap.of(), KERNEL, KERNEL,
        ReferenceKernel.universeTable(), new FixpointCache(),
        new NameGenerator(), tracer);
  }

  private static List<String> strings(List<Dk.Instruction> instructions) {
    return instructions.stream()
        .map(Dk.Instruction::toString)
        .collect(Collectors.toList());
  }

  @Test void testLambda() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Term term = cic.lambda("x", cic.set(), cic.rel(1));
    final Translation translation = t.translateTerm(EMPTY, term);
    assertThat(translation.toString(), is("x : coq.Univ coq.set => x"));
    assertThat(translation.instructions.isEmpty(), is(true));

    // The type is convertible, so there is no cast.
    assertThat(
        t.translateTerm(EMPTY, term, cic.arrow(cic.set(), cic.set()))
            .toString(),
        is("x : coq.Univ coq.set => x"));

    final Translator readable =
        translator(ImmutableMap.of(Encoding.READABLE, true));
    assertThat(readable.translateTerm(EMPTY, term).toString(),
        is("x : _Set => x"));
  }

  @Test void testSortAndProduct() {
    final Translator t = translator(ImmutableMap.of());
    assertThat(t.translateTerm(EMPTY, cic.set()).toString(),
        is("coq.univ coq.set"));
    assertThat(t.translateTerm(EMPTY, cic.arrow(NAT, NAT)).toString(),
        is("coq.prod coq.set coq.set nat (x : coq.Term coq.set nat => nat)"));
    assertThat(t.translateType(EMPTY, cic.arrow(NAT, NAT)).toString(),
        is("coq.Term coq.set nat -> coq.Term coq.set nat"));
    assertThat(t.translateType(EMPTY, cic.type("Top.1")).toString(),
        is("coq.Univ (coq.type (coq.uSucc coq.uType0))"));
  }

  @Test void testCast() {
    final List<String> casts = new ArrayList<>();
    final Translator t =
        translator(
            Tracers.withOnCast(Tracers.empty(),
                (term, type) -> casts.add(term + " : " + type)));
    assertThat(t.translateTerm(EMPTY, O, BOOL).toString(),
        is("coq.cast coq.set coq.set nat bool O"));
    assertThat(casts, is(ImmutableList.of("nat#0 : bool")));

    final TranslationException e =
        assertThrows(TranslationException.class,
            () -> t.translateTerm(EMPTY, cic.cast(cic.cast(O, NAT), NAT)));
    assertThat(e.kind, is(TranslationException.Kind.NOT_SUPPORTED));
    assertThat(e.subject, is("nested cast"));

    final TranslationException e2 =
        assertThrows(TranslationException.class,
            () -> t.translateType(EMPTY, cic.cast(NAT, cic.set())));
    assertThat(e2.subject, is("cast in type position"));
  }

  @Test void testLet() {
    final List<String> lifted = new ArrayList<>();
    final Translator t =
        translator(Tracers.withOnLetLifted(Tracers.empty(), lifted::add));
    final Translation translation =
        t.translateTerm(EMPTY,
            cic.letIn("y", O, NAT, cic.apply(S, cic.rel(1))));
    assertThat(translation.toString(), is("S let_y"));
    assertThat(strings(translation.instructions),
        is(ImmutableList.of("def let_y : coq.Term coq.set nat := O.")));
    assertThat(lifted, is(ImmutableList.of("let_y")));
    checkScoped(translation);
  }

  /** Tests that a local definition under a binder is abstracted over the
   * binder, and applied to it. */
  @Test void testLetUnderBinder() {
    final Translator t = translator(ImmutableMap.of());
    final Translation translation =
        t.translateTerm(EMPTY,
            cic.lambda("n", NAT,
                cic.letIn("y", cic.apply(S, cic.rel(1)), NAT, cic.rel(1))));
    assertThat(translation.toString(),
        is("n : coq.Term coq.set nat => let_y n"));
    assertThat(strings(translation.instructions),
        is(
            ImmutableList.of("def let_y : n : coq.Term coq.set nat -> "
                + "coq.Term coq.set nat := n : coq.Term coq.set nat => S n.")));
    checkScoped(translation);
  }

  /** Tests that a definition inside the value of another is emitted
   * first. */
  @Test void testNestedLet() {
    final Translator t = translator(ImmutableMap.of());
    final Translation translation =
        t.translateTerm(EMPTY,
            cic.letIn("b", cic.letIn("a", O, NAT, cic.apply(S, cic.rel(1))),
                NAT, cic.rel(1)));
    assertThat(translation.toString(), is("let_b"));
    assertThat(strings(translation.instructions),
        is(
            ImmutableList.of("def let_a : coq.Term coq.set nat := O.",
                "def let_b : coq.Term coq.set nat := S let_a.")));
    checkScoped(translation);
  }

  @Test void testCase() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Term motive = cic.lambda("n", NAT, NAT);
    final Cic.Term term =
        cic.case_("nat", motive, O,
            ImmutableList.of(O, cic.lambda("p", NAT, cic.rel(1))));
    assertThat(t.translateTerm(EMPTY, term).toString(),
        is("match__nat coq.set (n : coq.Term coq.set nat => nat) O "
            + "(p : coq.Term coq.set nat => p) O"));

    final TranslationException e =
        assertThrows(TranslationException.class,
            () -> t.translateTerm(EMPTY,
                cic.case_("nat", motive, O, ImmutableList.of(O))));
    assertThat(e.kind, is(TranslationException.Kind.ARITY_MISMATCH));
    assertThat(e.getMessage(), containsString("expected 2 branches, got 1"));
  }

  /** Tests a match on an inductive type with a parameter and a real
   * argument, which are recovered from the type of the discriminee. */
  @Test void testCaseIndexed() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Term vec = cic.ind("vec");
    // A : Set, n : nat, v : vec A n
    final Environment env =
        EMPTY.pushRel(Cic.Decl.of("A", cic.set()))
            .pushRel(Cic.Decl.of("n", NAT))
            .pushRel(Cic.Decl.of("v", cic.apply(vec, cic.rel(2), cic.rel(1))));
    final Cic.Term motive =
        cic.lambda("m", NAT,
            cic.lambda("w", cic.apply(vec, cic.rel(4), cic.rel(1)), NAT));
    final Cic.Term vconsBranch =
        cic.lambda("h", cic.rel(3),
            cic.lambda("k", NAT,
                cic.lambda("t", cic.apply(vec, cic.rel(5), cic.rel(1)),
                    cic.rel(2))));
    final Cic.Term term =
        cic.case_("vec", motive, cic.rel(1),
            ImmutableList.of(O, vconsBranch));
    final Translation translation = t.translateTerm(env, term);
    assertThat(translation.toString(),
        is("match__vec coq.set A "
            + "(m : coq.Term coq.set nat => "
            + "w : coq.Term coq.set (vec A m) => nat) O "
            + "(h : coq.Term coq.set A => k : coq.Term coq.set nat => "
            + "t : coq.Term coq.set (vec A k) => k) n v"));

    // universe arguments + sort + parameters + motive + branches + real
    // arguments + discriminee
    final Dk.App app = (Dk.App) translation.term;
    assertThat(app.args.size(), is(0 + 1 + 1 + 1 + 2 + 1 + 1));
  }

  /** Tests that the universe argument of a match on a template polymorphic
   * inductive type is computed from the type of its parameter. */
  @Test void testCaseTemplate() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Term listNat = cic.apply(cic.ind("list"), NAT);
    final Environment env = EMPTY.pushRel(Cic.Decl.of("l", listNat));
    final Cic.Term motive = cic.lambda("x", listNat, NAT);
    final Cic.Term consBranch =
        cic.lambda("a", NAT, cic.lambda("r", listNat, O));
    final Cic.Term term =
        cic.case_("list", motive, cic.rel(1),
            ImmutableList.of(O, consBranch));
    final Dk.App app = (Dk.App) t.translateTerm(env, term).term;
    assertThat(app.fn.toString(), is("match__list"));
    assertThat(app.args.size(), is(1 + 1 + 1 + 1 + 2 + 0 + 1));
    final List<String> args =
        app.args.stream().map(Dk.Term::toString).collect(Collectors.toList());
    // template universe, sort of the motive, parameter
    assertThat(args.subList(0, 3),
        is(ImmutableList.of("coq.set", "coq.set", "nat")));
    assertThat(args.get(4), is("O"));
    assertThat(args.get(6), is("l"));

    final Translator off =
        translator(ImmutableMap.of(Encoding.TEMPLATE_POLYMORPHISM, false));
    final Dk.App app2 = (Dk.App) off.translateTerm(env, term).term;
    assertThat(app2.args.size(), is(6));
    assertThat(app2.args.get(1).toString(), is("nat"));
  }

  /** Tests that the universe of a template polymorphic inductive type is
   * computed from its parameter. */
  @Test void testTemplate() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Term list = cic.ind("list");
    assertThat(t.translateTerm(EMPTY, cic.apply(list, NAT)).toString(),
        is("list coq.set nat"));
    assertThat(t.translateTerm(EMPTY, list).toString(),
        is("list (coq.type coq.uType0)"));

    final Translator off =
        translator(ImmutableMap.of(Encoding.TEMPLATE_POLYMORPHISM, false));
    assertThat(off.translateTerm(EMPTY, cic.apply(list, NAT)).toString(),
        is("list nat"));
  }

  @Test void testTemplateDefinition() {
    final Translator t = translator(ImmutableMap.of());
    final Universe level = Universe.globalLevel("list.u0");
    final Environment env =
        EMPTY.withTemplateLevels(ImmutableSet.of("list.u0"));
    final List<Dk.Instruction> instructions =
        t.translateDefinition(env, "mylist",
            cic.sort(Universe.succ(level, 1)), cic.sort(level), 0);
    assertThat(strings(instructions),
        is(
            ImmutableList.of("def mylist : list__u0 : coq.Sort -> "
                + "coq.Univ (coq.axiom list__u0) := "
                + "list__u0 : coq.Sort => coq.univ list__u0.")));
  }

  @Test void testPolymorphicDefinition() {
    final Translator t = translator(ImmutableMap.of());
    final Universe s0 = Universe.local(0);
    final List<Dk.Instruction> instructions =
        t.translateDefinition(EMPTY, "Top.T",
            cic.sort(Universe.succ(s0, 1)), cic.sort(s0), 1);
    assertThat(strings(instructions),
        is(
            ImmutableList.of("def Top__T : s0 : coq.Sort -> "
                + "coq.Univ (coq.axiom s0) := s0 : coq.Sort => coq.univ s0.")));

    assertThat(
        t.translateTerm(EMPTY, cic.constant("Top.T", Universe.SET))
            .toString(),
        is("Top__T coq.set"));
    final TranslationException e =
        assertThrows(TranslationException.class,
            () -> t.translateTerm(EMPTY, cic.constant("Top.T")));
    assertThat(e.kind, is(TranslationException.Kind.ARITY_MISMATCH));
  }

  /** Tests a constant that is polymorphic in two universes and assumes a
   * constraint between them. */
  @Test void testPolymorphicConstraints() {
    final Translator t = translator(ImmutableMap.of());
    final ConstantBody u = KERNEL.constant("Top.U");
    assertThat(strings(t.translateConstant(EMPTY, u)),
        is(
            ImmutableList.of("Top__U : s0 : coq.Sort -> s1 : coq.Sort -> "
                + "cstr0 : coq.eps (coq.Cumul (coq.axiom s0) s1) -> "
                + "coq.Univ (coq.axiom s1).")));
    assertThat(
        t.translateTerm(EMPTY,
            cic.constant("Top.U", Universe.PROP, Universe.SET)).toString(),
        is("Top__U coq.prop coq.set coq.I"));

    final Translator off =
        translator(ImmutableMap.of(Encoding.POLYMORPHISM, false));
    assertThat(
        off.translateTerm(EMPTY,
            cic.constant("Top.U", Universe.PROP, Universe.SET)).toString(),
        is("Top__U"));

    final List<String> failures = new ArrayList<>();
    final Translator traced =
        translator(
            Tracers.withOnFailure(Tracers.empty(),
                (name, e) -> failures.add(name)));
    final ConstantBody eq =
        u.withConstraints(
            ImmutableList.of(
                new ConstantBody.Constraint(Universe.local(0),
                    UniverseGraph.Relation.EQ, Universe.local(1))));
    final TranslationException e =
        assertThrows(TranslationException.class,
            () -> traced.translateConstant(EMPTY, eq));
    assertThat(e.kind, is(TranslationException.Kind.NOT_SUPPORTED));
    assertThat(e.subject, is("equality constraint"));
    assertThat(failures, is(ImmutableList.of("Top.U")));
  }

  @Test void testAxiom() {
    final Translator t = translator(ImmutableMap.of());
    assertThat(strings(t.translateAxiom(EMPTY, "ax", cic.arrow(NAT, NAT), 0)),
        is(
            ImmutableList.of(
                "ax : coq.Term coq.set nat -> coq.Term coq.set nat.")));
  }

  @Test void testUniverseModes() {
    final Cic.Term top99 = cic.sort(Universe.globalLevel("Top.99"));
    final TranslationException e =
        assertThrows(TranslationException.class,
            () -> translator(ImmutableMap.of()).translateTerm(EMPTY, top99));
    assertThat(e.kind, is(TranslationException.Kind.UNRESOLVED_UNIVERSE));

    final Translator symbolic =
        translator(
            ImmutableMap.of(Encoding.UNIVERSE_MODE,
                Encoding.UniverseMode.SYMBOLIC));
    assertThat(
        symbolic.translateTerm(EMPTY, cic.type("Top.1")).toString(),
        is("coq.univ U.Top__1"));
  }

  @Test void testNotSupported() {
    final Translator t = translator(ImmutableMap.of());
    final List<Cic.Term> terms =
        ImmutableList.of(
            cic.coFix(0, ImmutableList.of("f"), ImmutableList.of(NAT),
                ImmutableList.of(O)),
            cic.evar(1),
            cic.proj("fst", O));
    final List<String> subjects = new ArrayList<>();
    for (Cic.Term term : terms) {
      final TranslationException e =
          assertThrows(TranslationException.class,
              () -> t.translateTerm(EMPTY, term));
      assertThat(e.kind, is(TranslationException.Kind.NOT_SUPPORTED));
      subjects.add(e.subject);
    }
    assertThat(subjects,
        is(
            ImmutableList.of("co-fixpoint", "existential variable",
                "primitive projection")));
  }

  @Test void testFix() {
    final List<Dk.Instruction> declared = new ArrayList<>();
    final Translator t =
        translator(Tracers.withOnDeclaration(Tracers.empty(), declared::add));
    final Translation translation = t.translateTerm(EMPTY, FIX_F);
    assertThat(translation.toString(), is("fix_f"));
    assertThat(strings(translation.instructions),
        is(
            ImmutableList.of(
                "def fix_f : n : coq.Term coq.set nat -> coq.Term coq.set nat.",
                "def fix_f_1 : n : coq.Term coq.set nat -> "
                    + "x : coq.Term coq.set nat -> coq.Term coq.set nat.",
                "def fix_f_2 : n : coq.Term coq.set nat -> "
                    + "coq.Term coq.set nat.",
                "[n : coq.Term coq.set nat] fix_f n --> fix_f_1 n n.\n"
                    + "[n : coq.Term coq.set nat] fix_f_1 n O --> fix_f_2 n.\n"
                    + "[n : coq.Term coq.set nat, var : coq.Term coq.set nat] "
                    + "fix_f_1 n (S var) --> fix_f_2 n.\n"
                    + "[] fix_f_2 --> n : coq.Term coq.set nat => "
                    + "match__nat coq.set (m : coq.Term coq.set nat => nat) O "
                    + "(p : coq.Term coq.set nat => fix_f p) n.")));
    assertThat(declared, is(translation.instructions));
    assertThat(t.fixpointCache().size(), is(1));
    checkScoped(translation);

    assertThat(t.translateTerm(EMPTY, cic.apply(FIX_F, O)).toString(),
        is("fix_f O"));
  }

  /** Tests that a group is encoded once, whether it occurs again in the same
   * declaration or in a later one. */
  @Test void testFixSharing() {
    final List<FixpointCache.Key> hits = new ArrayList<>();
    final Translator t =
        translator(
            Tracers.withOnFixpointCacheHit(Tracers.empty(), hits::add));
    final Translation t1 =
        t.translateTerm(EMPTY, cic.apply(FIX_F, cic.apply(FIX_F, O)));
    assertThat(t1.toString(), is("fix_f (fix_f O)"));
    assertThat(t1.instructions.size(), is(4));
    assertThat(t.fixpointCache().hitCount(), is(1));

    final Translation t2 = t.translateTerm(EMPTY, FIX_F);
    assertThat(t2.toString(), is("fix_f"));
    assertThat(t2.instructions.isEmpty(), is(true));
    assertThat(t.fixpointCache().hitCount(), is(2));
    assertThat(t.fixpointCache().size(), is(1));

    // The key ignores template levels of the environment.
    final Translation t3 =
        t.translateTerm(EMPTY.withTemplateLevels(ImmutableSet.of("list.u0")),
            FIX_F);
    assertThat(t3.instructions.isEmpty(), is(true));
    assertThat(hits.size(), is(3));
    assertThat(hits.get(0).names, is(ImmutableList.of("f")));
  }

  /** Tests that when a declaration fails, the fixpoint groups that it
   * encoded are not cached. */
  @Test void testFixRollback() {
    final List<String> failures = new ArrayList<>();
    final List<Dk.Instruction> declared = new ArrayList<>();
    final Translator t =
        translator(
            Tracers.withOnFailure(
                Tracers.withOnDeclaration(Tracers.empty(), declared::add),
                (name, e) -> failures.add(e.kind.name())));
    final Cic.Term bad =
        cic.apply(FIX_F,
            cic.case_("nat", cic.lambda("n", NAT, NAT), O,
                ImmutableList.of(O)));
    final TranslationException e =
        assertThrows(TranslationException.class,
            () -> t.translateTerm(EMPTY, bad));
    assertThat(e.kind, is(TranslationException.Kind.ARITY_MISMATCH));
    assertThat(failures, is(ImmutableList.of("ARITY_MISMATCH")));
    assertThat(declared.isEmpty(), is(true));
    assertThat(t.fixpointCache().size(), is(0));

    // The group is encoded again, with fresh names.
    final Translation translation = t.translateTerm(EMPTY, FIX_F);
    assertThat(translation.toString(), is("fix_f_3"));
    assertThat(translation.instructions.size(), is(4));
    assertThat(t.fixpointCache().size(), is(1));
  }

  /** Tests a fixpoint whose recursive argument has an inductive type with a
   * parameter and a real argument. */
  @Test void testFixIndexed() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Term vecAn =
        cic.apply(cic.ind("vec"), cic.rel(2), cic.rel(1));
    final Cic.Fix len =
        cic.fix(2, "len",
            cic.prod("A", cic.set(),
                cic.prod("n", NAT, cic.prod("v", vecAn, NAT))),
            cic.lambda("A", cic.set(),
                cic.lambda("n", NAT, cic.lambda("v", vecAn, O))));
    final Translation translation = t.translateTerm(EMPTY, len);
    assertThat(translation.toString(), is("fix_len"));
    final List<Dk.Instruction> instructions = translation.instructions;
    assertThat(instructions.size(), is(4));
    assertThat(instructions.get(0).toString(),
        is("def fix_len : A : coq.Univ coq.set -> n : coq.Term coq.set nat -> "
            + "v : coq.Term coq.set (vec A n) -> coq.Term coq.set nat."));

    final Dk.Rules rules = (Dk.Rules) instructions.get(3);
    final String context = "[A : coq.Univ coq.set, n : coq.Term coq.set nat, "
        + "v : coq.Term coq.set (vec A n)";
    assertThat(rules.rules.size(), is(4));
    assertThat(rules.rules.get(0).toString(),
        is(context + "] fix_len A n v --> fix_len_1 A n v n v."));
    assertThat(rules.rules.get(1).toString(),
        is(context + "] fix_len_1 A n v O (vnil _) --> fix_len_2 A n v."));
    assertThat(rules.rules.get(2).toString(),
        is(context + ", h : coq.Term coq.set A, n0 : coq.Term coq.set nat, "
            + "t : coq.Term coq.set (vec A n0)] "
            + "fix_len_1 A n v (S n0) (vcons _ h n0 t) --> fix_len_2 A n v."));
    assertThat(rules.rules.get(3).toString(),
        is("[] fix_len_2 --> A : coq.Univ coq.set => "
            + "n : coq.Term coq.set nat => "
            + "v : coq.Term coq.set (vec A n) => O."));
    checkScoped(translation);
  }

  /** Tests a fixpoint that refers to a variable bound outside it. */
  @Test void testFixUnderBinder() {
    final Translator t = translator(ImmutableMap.of());
    // fun k : nat => fix g (n : nat) : nat := k
    final Cic.Term term =
        cic.lambda("k", NAT,
            cic.fix(0, "g", cic.prod("n", NAT, NAT),
                cic.lambda("n", NAT, cic.rel(3))));
    final Translation translation = t.translateTerm(EMPTY, term);
    assertThat(translation.toString(),
        is("k : coq.Term coq.set nat => fix_g k"));
    assertThat(translation.instructions.get(0).toString(),
        is("def fix_g : k : coq.Term coq.set nat -> "
            + "n : coq.Term coq.set nat -> coq.Term coq.set nat."));
    final Dk.Rules rules = (Dk.Rules) translation.instructions.get(3);
    assertThat(rules.rules.get(0).toString(),
        is("[k : coq.Term coq.set nat, n : coq.Term coq.set nat] "
            + "fix_g k n --> fix_g_1 k n n."));
    assertThat(rules.rules.get(3).toString(),
        is("[k : coq.Term coq.set nat] fix_g_2 k --> "
            + "n : coq.Term coq.set nat => k."));
    checkScoped(translation);
  }

  /** Tests that a bound variable is renamed if its name is that of a global
   * symbol, so that it does not capture references to the symbol. */
  @Test void testBinderAvoidsGlobals() {
    final Translator t = translator(ImmutableMap.of());
    // fun S : nat => S S
    final Translation t1 =
        t.translateTerm(EMPTY, cic.lambda("S", NAT, cic.apply(S, cic.rel(1))));
    assertThat(t1.toString(), is("S0 : coq.Term coq.set nat => S S0"));

    // fun nat : nat => fun k : nat => k
    final Translation t2 =
        t.translateTerm(EMPTY,
            cic.lambda("nat", NAT, cic.lambda("k", NAT, cic.rel(1))));
    assertThat(t2.toString(),
        is("nat0 : coq.Term coq.set nat => "
            + "k : coq.Term coq.set nat => k"));

    // fun fix_g : nat => (fix g (n : nat) : nat := n) fix_g
    final Cic.Fix fixG =
        cic.fix(0, "g", cic.prod("n", NAT, NAT),
            cic.lambda("n", NAT, cic.rel(1)));
    final Translation t3 =
        t.translateTerm(EMPTY,
            cic.lambda("fix_g", NAT, cic.apply(fixG, cic.rel(1))));
    assertThat(t3.toString(),
        is("fix_g : coq.Term coq.set nat => fix_g_1 fix_g"));
    checkScoped(t3);

    // fun fix_f : nat => f fix_f, where the group of f is already encoded
    t.translateTerm(EMPTY, FIX_F);
    final Translation t4 =
        t.translateTerm(EMPTY,
            cic.lambda("fix_f", NAT, cic.apply(FIX_F, cic.rel(1))));
    assertThat(t4.toString(),
        is("fix_f0 : coq.Term coq.set nat => fix_f fix_f0"));
  }

  /** Tests that two groups whose names would give the same global name are
   * given distinct names. */
  @Test void testFixNamesAreUnique() {
    final Translator t = translator(ImmutableMap.of());
    final Cic.Fix fix1 =
        cic.fix(0, "f_1", cic.prod("n", NAT, NAT),
            cic.lambda("n", NAT, O));
    final Translation t1 = t.translateTerm(EMPTY, FIX_F);
    final Translation t2 = t.translateTerm(EMPTY, fix1);
    assertThat(t2.toString(), is("fix_f_1_1"));
    final List<String> names = new ArrayList<>();
    for (Translation translation : ImmutableList.of(t1, t2)) {
      for (Dk.Instruction instruction : translation.instructions) {
        if (instruction instanceof Dk.Declaration) {
          names.add(((Dk.Declaration) instruction).name);
        }
      }
    }
    assertThat(names,
        is(
            ImmutableList.of("fix_f", "fix_f_1", "fix_f_2", "fix_f_1_1",
                "fix_f_1_2", "fix_f_1_3")));
  }

  /** Tests that a group met by declarations translated on several threads
   * is encoded once. */
  @Test void testFixConcurrent() throws Exception {
    final Translator t = translator(ImmutableMap.of());
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<Translation>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(executor.submit(() -> t.translateTerm(EMPTY, FIX_F)));
      }
      int instructionCount = 0;
      for (Future<Translation> future : futures) {
        final Translation translation = future.get();
        assertThat(translation.toString(), is("fix_f"));
        instructionCount += translation.instructions.size();
      }
      assertThat(instructionCount, is(4));
      assertThat(t.fixpointCache().size(), is(1));
      assertThat(t.fixpointCache().hitCount(), is(3));
    } finally {
      executor.shutdown();
    }
  }

  @Test void testDeclareUniverses() {
    final List<Dk.Instruction> declared = new ArrayList<>();
    final Translator t =
        translator(Tracers.withOnDeclaration(Tracers.empty(), declared::add));
    final List<Dk.Instruction> instructions =
        t.declareUniverses(
            UniverseGraph.ofLevels(
                ImmutableMap.of("Top.1", 1)));
    assertThat(strings(instructions),
        is(
            ImmutableList.of("def Top__1 : coq.Sort := "
                + "coq.type (coq.uSucc coq.uType0).")));
    assertThat(declared, is(instructions));
  }

  /** Checks that every symbol in a translation is declared before it is
   * used, or is bound. */
  private static void checkScoped(Translation translation) {
    final Set<String> defined = new HashSet<>(GLOBALS);
    for (Dk.Instruction instruction : translation.instructions) {
      switch (instruction.op) {
        case DECLARATION:
          final Dk.Declaration declaration = (Dk.Declaration) instruction;
          checkScoped(declaration.type, defined, ImmutableSet.of());
          defined.add(declaration.name);
          break;
        case DEFINITION:
          final Dk.Definition definition = (Dk.Definition) instruction;
          if (definition.type != null) {
            checkScoped(definition.type, defined, ImmutableSet.of());
          }
          checkScoped(definition.value, defined, ImmutableSet.of());
          defined.add(definition.name);
          break;
        case RULES:
          for (Dk.Rule rule : ((Dk.Rules) instruction).rules) {
            final Set<String> bound = new HashSet<>();
            for (Dk.Binding binding : rule.context) {
              if (binding.type != null) {
                checkScoped(binding.type, defined, bound);
              }
              bound.add(binding.name);
            }
            checkScoped(rule.lhs, defined, bound);
            checkScoped(rule.rhs, defined, bound);
          }
          break;
        default:
          break;
      }
    }
    checkScoped(translation.term, defined, ImmutableSet.of());
  }

  private static void checkScoped(Dk.Term term, Set<String> defined,
      Set<String> bound) {
    switch (term.op) {
      case DK_VAR:
        final String name = ((Dk.Var) term).name;
        if (!name.startsWith("coq.")
            && !defined.contains(name)
            && !bound.contains(name)) {
          fail("unbound symbol " + name + " in " + term);
        }
        break;
      case DK_APP:
        final Dk.App app = (Dk.App) term;
        checkScoped(app.fn, defined, bound);
        app.args.forEach(arg -> checkScoped(arg, defined, bound));
        break;
      case DK_LAMBDA:
        final Dk.Lam lam = (Dk.Lam) term;
        if (lam.type != null) {
          checkScoped(lam.type, defined, bound);
        }
        checkScoped(lam.body, defined, plus(bound, lam.name));
        break;
      case DK_PI:
        final Dk.Pi pi = (Dk.Pi) term;
        checkScoped(pi.type, defined, bound);
        checkScoped(pi.body, defined, plus(bound, pi.name));
        break;
      default:
        break;
    }
  }

  private static Set<String> plus(Set<String> set, String name) {
    return ImmutableSet.<String>builder().addAll(set).add(name).build();
  }
}

// End TranslatorTest.java
