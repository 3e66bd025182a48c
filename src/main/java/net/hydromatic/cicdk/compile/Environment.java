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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.hydromatic.cicdk.ast.Cic;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for translation.
 *
 * <p>An environment has a stack of local declarations, addressed by de Bruijn
 * index; a table of named declarations, such as lifted local definitions and
 * the auxiliary functions of fixpoints; and the set of template universe
 * levels that are bound by the declaration being translated.
 *
 * <p>Every environment is immutable; when you call {@link #pushRel}, a new
 * environment is created that inherits from the previous environment. Neither
 * the new nor the old will ever change.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /** Visits every local declaration, innermost first. */
  abstract void visitRel(Consumer<Cic.Decl> consumer);

  /** Prints the local declarations, outermost first, one per line. */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    reverse(relContext()).forEach(decl -> b.append(decl).append("\n"));
    return b.toString();
  }

  /** Returns the number of local declarations. */
  public abstract int relDepth();

  /**
   * Returns the local declaration with de Bruijn index {@code i}. Its type,
   * and its value if any, are valid in the context that precedes it; lift
   * them by {@code i} to use them in this environment.
   */
  public abstract Cic.Decl lookupRel(int i);

  /** Returns the named declaration {@code id} if present, null if not. */
  public abstract Cic.@Nullable Decl lookupNamed(String id);

  /** Returns whether a universe level is a template level bound by the
   * declaration being translated. */
  public abstract boolean isTemplateLevel(String level);

  /** Returns the template levels bound by the declaration being
   * translated. */
  public abstract ImmutableSet<String> templateLevels();

  /** Returns the local declarations, innermost first. */
  public ImmutableList<Cic.Decl> relContext() {
    final ImmutableList.Builder<Cic.Decl> b = ImmutableList.builder();
    visitRel(b::add);
    return b.build();
  }

  /** Returns an environment with the same named declarations and template
   * levels as this, but no local declarations. */
  public abstract Environment globalEnv();

  /** Creates an environment that is the same as this, plus one local
   * declaration. */
  public Environment pushRel(Cic.Decl decl) {
    return new Environments.SubEnvironment(this, decl);
  }

  /** Creates an environment that is the same as this, plus the declarations
   * of a context. The context is ordered innermost first. */
  public Environment pushRelContext(List<Cic.Decl> context) {
    Environment env = this;
    for (Cic.Decl decl : reverse(context)) {
      env = env.pushRel(decl);
    }
    return env;
  }

  /** Creates an environment that is the same as this, plus a named
   * declaration. */
  public abstract Environment pushNamed(Cic.Decl decl);

  /** Creates an environment that is the same as this, but with a given set
   * of template levels. */
  public abstract Environment withTemplateLevels(Set<String> levels);

  /**
   * Returns a name, based on {@code hint}, that is different from the names
   * of all local and named declarations. If the hint is anonymous
   * ({@code _}), starts from {@code defaultName}.
   */
  public String freshName(String hint, String defaultName) {
    return freshName(hint, defaultName, name -> false);
  }

  /**
   * Returns a name, based on {@code hint}, that is different from the names
   * of all local and named declarations and is not {@code reserved}. If the
   * hint is anonymous ({@code _}), starts from {@code defaultName}.
   *
   * <p>Candidates are the base name, then the base name followed by 0, 1,
   * and so forth; {@code reserved} must reject only finitely many of them.
   */
  public String freshName(String hint, String defaultName,
      Predicate<String> reserved) {
    final String base = hint.equals("_") ? defaultName : hint;
    final Set<String> names = new HashSet<>();
    visitRel(decl -> names.add(decl.name));
    final Predicate<String> taken = name -> names.contains(name)
        || lookupNamed(name) != null
        || reserved.test(name);
    if (!taken.test(base)) {
      return base;
    }
    for (int i = 0;; i++) {
      final String name = base + i;
      if (!taken.test(name)) {
        return name;
      }
    }
  }
}

// End Environment.java
