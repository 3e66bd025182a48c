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
import java.util.List;
import java.util.Map;
import net.hydromatic.cicdk.ast.Dk;
import net.hydromatic.cicdk.ast.Universe;

/**
 * Encodes translated universes as target terms.
 *
 * <p>A universe has three encodings: as a sort (a term of type
 * {@code Sort}), as a level (a term of type {@code Nat}), and as a sort
 * that occurs in the left-hand side of a rewrite rule. The encoding is a
 * pure function of the universe; the same universe always yields the same
 * term.
 *
 * <p>If the encoding is readable, small numerals, sorts and codes are
 * written using the abbreviations that {@link #header()} defines.
 */
public class SortEncoder {
  /** Largest numeral that has an abbreviation. */
  private static final int MAX_SHORT = 9;

  private final String encodingModule;
  private final String universeModule;
  private final boolean readable;

  private SortEncoder(String encodingModule, String universeModule,
      boolean readable) {
    this.encodingModule = requireNonNull(encodingModule);
    this.universeModule = requireNonNull(universeModule);
    this.readable = readable;
  }

  /** Creates an encoder for the given encoding properties. */
  public static SortEncoder create(Map<Encoding, Object> props) {
    return new SortEncoder(Encoding.ENCODING_MODULE.stringValue(props),
        Encoding.UNIVERSE_MODULE.stringValue(props),
        Encoding.READABLE.booleanValue(props));
  }

  /** Returns a symbol of the encoding module. */
  public Dk.Var symbol(String name) {
    return dk.var(encodingModule + "." + name);
  }

  /** Returns the type of sorts, {@code Sort}. */
  public Dk.Term sortType() {
    return symbol("Sort");
  }

  /** Encodes a natural number as a level. */
  public Dk.Term nat(int n) {
    if (readable && n <= MAX_SHORT) {
      return dk.var(natName(n));
    }
    if (readable) {
      return dk.apply(symbol("uSucc"), nat(n - 1));
    }
    Dk.Term t = symbol("uType0");
    for (int i = 0; i < n; i++) {
      t = dk.apply(symbol("uSucc"), t);
    }
    return t;
  }

  /** Encodes the concrete sort {@code type i}. */
  private Dk.Term type(int i) {
    if (readable && i <= MAX_SHORT) {
      return dk.var(sortName(i));
    }
    return dk.apply(symbol("type"), nat(i));
  }

  /** Encodes a universe as a sort. */
  public Dk.Term sort(Universe universe) {
    final Universe u = universe.normalize();
    switch (u.op) {
      case PROP:
        return symbol("prop");
      case SET:
        return symbol("set");
      case GLOBAL_SORT:
        return dk.var(universeModule + "."
            + Names.translate(((Universe.Named) u).name));
      case GLOBAL_LEVEL:
        return dk.apply(symbol("type"),
            dk.var(universeModule + "."
                + Names.translate(((Universe.Named) u).name)));
      case NAMED_SORT:
      case TEMPLATE:
        return dk.var(Names.translate(((Universe.Named) u).name));
      case LOCAL:
        return dk.var(Names.universeParam(((Universe.Local) u).index));
      case SUCC:
        final Universe.Succ succ = (Universe.Succ) u;
        if (succ.isConcrete()) {
          return type(succ.k - 1);
        }
        return axioms(sort(succ.universe), succ.k);
      case MAX:
        return sup(sorts(((Universe.Max) u).universes));
      case RULE:
        final Universe.Rule rule = (Universe.Rule) u;
        return dk.apply(symbol("rule"), sort(rule.s1), sort(rule.s2));
      default:
        throw new IllegalArgumentException("cannot encode " + u);
    }
  }

  /** Encodes a universe as a sort in the left-hand side of a rewrite rule.
   * Successors are expanded to applications of {@code axiom}, which a
   * pattern can match. */
  public Dk.Term pattern(Universe universe) {
    final Universe u = universe.normalize();
    switch (u.op) {
      case SUCC:
        final Universe.Succ succ = (Universe.Succ) u;
        return axioms(sort(succ.universe), succ.k);
      case MAX:
        final ImmutableList.Builder<Dk.Term> b = ImmutableList.builder();
        ((Universe.Max) u).universes.forEach(v -> b.add(pattern(v)));
        return sup(b.build());
      case RULE:
        final Universe.Rule rule = (Universe.Rule) u;
        return dk.apply(symbol("rule"), pattern(rule.s1), pattern(rule.s2));
      default:
        return sort(u);
    }
  }

  /** Encodes a universe as a level.
   *
   * @throws TranslationException if the universe has no level, such as
   *   {@code Prop} or a sort of a product */
  public Dk.Term level(Universe universe) {
    final Universe u = universe.normalize();
    switch (u.op) {
      case SET:
        return symbol("uSet");
      case GLOBAL_LEVEL:
      case TEMPLATE:
        return dk.var(Names.translate(((Universe.Named) u).name));
      case LOCAL:
        return dk.var(Names.universeParam(((Universe.Local) u).index));
      case SUCC:
        final Universe.Succ succ = (Universe.Succ) u;
        if (succ.isConcrete()) {
          return nat(succ.k - 1);
        }
        Dk.Term t = level(succ.universe);
        for (int i = 0; i < succ.k; i++) {
          t = dk.apply(symbol("uSucc"), t);
        }
        return t;
      case MAX:
        final List<Universe> universes = ((Universe.Max) u).universes;
        Dk.Term max = level(universes.get(universes.size() - 1));
        for (int i = universes.size() - 2; i >= 0; i--) {
          max = dk.apply(symbol("uMax"), level(universes.get(i)), max);
        }
        return max;
      case PROP:
        throw TranslationException.notSupported("level of Prop");
      case RULE:
        throw TranslationException.notSupported("level of a product sort");
      default:
        throw TranslationException.notSupported("level of " + u);
    }
  }

  private List<Dk.Term> sorts(List<Universe> universes) {
    final ImmutableList.Builder<Dk.Term> b = ImmutableList.builder();
    universes.forEach(u -> b.add(sort(u)));
    return b.build();
  }

  /** Applies {@code axiom} {@code k} times. */
  private Dk.Term axioms(Dk.Term sort, int k) {
    Dk.Term t = sort;
    for (int i = 0; i < k; i++) {
      t = axiom(t);
    }
    return t;
  }

  /** Returns the successor of an encoded sort, {@code axiom s}. */
  public Dk.Term axiom(Dk.Term sort) {
    return dk.apply(symbol("axiom"), sort);
  }

  /** Returns the join of encoded sorts; the empty join is {@code prop}. */
  public Dk.Term sup(List<Dk.Term> sorts) {
    if (sorts.isEmpty()) {
      return symbol("prop");
    }
    Dk.Term t = sorts.get(sorts.size() - 1);
    for (int i = sorts.size() - 2; i >= 0; i--) {
      t = dk.apply(symbol("sup"), sorts.get(i), t);
    }
    return t;
  }

  /** Returns the type of the codes of sort {@code s}, {@code Univ s}. */
  public Dk.Term univ(Universe s) {
    if (readable && s.normalize() == Universe.SET) {
      return dk.var("_Set");
    }
    if (readable && s.normalize() == Universe.PROP) {
      return dk.var("_Prop");
    }
    return dk.apply(symbol("Univ"), sort(s));
  }

  /** Returns the type of the terms of a type whose code is {@code a} and
   * whose sort is {@code s}, {@code Term s a}. */
  public Dk.Term term(Universe s, Dk.Term a) {
    return dk.apply(symbol("Term"), sort(s), a);
  }

  /** Returns the code of sort {@code s}, {@code univ s}, a term of type
   * {@code Univ (axiom s)}. */
  public Dk.Term code(Universe s) {
    final Universe u = s.normalize();
    if (readable) {
      switch (u.op) {
        case PROP:
          return dk.var("_prop");
        case SET:
          return dk.var("_set");
        case SUCC:
          final Universe.Succ succ = (Universe.Succ) u;
          if (succ.isConcrete() && succ.k - 1 <= MAX_SHORT) {
            return dk.var(codeName(succ.k - 1));
          }
          break;
        default:
          break;
      }
    }
    return dk.apply(symbol("univ"), sort(u));
  }

  /** Returns the code of a product, {@code prod s1 s2 a b}. */
  public Dk.Term prod(Universe s1, Universe s2, Dk.Term a, Dk.Term b) {
    return dk.apply(symbol("prod"), sort(s1), sort(s2), a, b);
  }

  /** Returns a cast of term {@code t} from type {@code a} of sort
   * {@code s1} to type {@code b} of sort {@code s2}. */
  public Dk.Term cast(Universe s1, Universe s2, Dk.Term a, Dk.Term b,
      Dk.Term t) {
    return dk.apply(symbol("cast"), sort(s1), sort(s2), a, b, t);
  }

  /** Returns the proposition that {@code a} is included in {@code b},
   * {@code eps (Cumul a b)}. */
  public Dk.Term cumul(Universe a, Universe b) {
    return dk.apply(symbol("eps"),
        dk.apply(symbol("Cumul"), sort(a), sort(b)));
  }

  /** Returns the proposition that {@code a} is strictly included in
   * {@code b}, {@code eps (Cumul (axiom a) b)}. */
  public Dk.Term cumulStrict(Universe a, Universe b) {
    return dk.apply(symbol("eps"),
        dk.apply(symbol("Cumul"), axiom(sort(a)), sort(b)));
  }

  /** Returns {@code I}, the proof of a constraint that holds. */
  public Dk.Term inhabitant() {
    return symbol("I");
  }

  /** Returns the instructions that precede a translated library. If the
   * encoding is readable, they define the abbreviations. */
  public ImmutableList<Dk.Instruction> header() {
    final ImmutableList.Builder<Dk.Instruction> b = ImmutableList.builder();
    b.add(dk.comment("This file was generated by cicdk."),
        dk.comment("Encoding module: " + encodingModule + "."),
        dk.emptyLine());
    if (readable) {
      b.add(dk.comment("Short definitions"), dk.emptyLine());
      b.add(dk.definition(natName(0), null, symbol("uType0")));
      for (int i = 1; i <= MAX_SHORT; i++) {
        b.add(dk.definition(natName(i), null,
            dk.apply(symbol("uSucc"), dk.var(natName(i - 1)))));
      }
      for (int i = 0; i <= MAX_SHORT; i++) {
        b.add(dk.definition(sortName(i), null,
            dk.apply(symbol("type"), dk.var(natName(i)))));
      }
      for (int i = 0; i <= MAX_SHORT; i++) {
        b.add(dk.definition(codeName(i), null,
            dk.apply(symbol("univ"), dk.var(sortName(i)))));
      }
      b.add(dk.definition("_Set", null,
          dk.apply(symbol("Univ"), symbol("set"))));
      b.add(dk.definition("_Prop", null,
          dk.apply(symbol("Univ"), symbol("prop"))));
      b.add(dk.definition("_set", null,
          dk.apply(symbol("univ"), symbol("set"))));
      b.add(dk.definition("_prop", null,
          dk.apply(symbol("univ"), symbol("prop"))));
      b.add(dk.emptyLine(), dk.comment("Beginning of translation"),
          dk.emptyLine());
    }
    return b.build();
  }

  /** Returns the instructions that follow a translated library. */
  public ImmutableList<Dk.Instruction> footer() {
    return ImmutableList.of(dk.comment("End of translation."));
  }

  private static String natName(int i) {
    return "_n" + i;
  }

  private static String sortName(int i) {
    return "_" + i;
  }

  private static String codeName(int i) {
    return "_u" + i;
  }
}

// End SortEncoder.java
