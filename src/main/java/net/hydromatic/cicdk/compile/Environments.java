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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.cicdk.ast.Cic;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an empty environment. */
  public static Environment empty() {
    return GlobalEnvironment.EMPTY;
  }

  /** Creates an environment that has the given named declarations and no
   * local declarations. */
  public static Environment named(Iterable<Cic.Decl> decls) {
    Environment env = empty();
    for (Cic.Decl decl : decls) {
      env = env.pushNamed(decl);
    }
    return env;
  }

  /**
   * Environment that has named declarations and template levels, but no
   * local declarations. It is at the root of every chain of
   * {@link SubEnvironment}.
   */
  static class GlobalEnvironment extends Environment {
    static final GlobalEnvironment EMPTY =
        new GlobalEnvironment(ImmutableMap.of(), ImmutableSet.of());

    private final ImmutableMap<String, Cic.Decl> namedDecls;
    private final ImmutableSet<String> templateLevels;

    GlobalEnvironment(ImmutableMap<String, Cic.Decl> namedDecls,
        ImmutableSet<String> templateLevels) {
      this.namedDecls = requireNonNull(namedDecls);
      this.templateLevels = requireNonNull(templateLevels);
    }

    @Override
    public String toString() {
      return "{named: " + namedDecls.keySet() + "}";
    }

    @Override
    void visitRel(Consumer<Cic.Decl> consumer) {}

    @Override
    public int relDepth() {
      return 0;
    }

    @Override
    public Cic.Decl lookupRel(int i) {
      throw new IllegalArgumentException("unbound variable #" + i);
    }

    @Override
    public Cic.@Nullable Decl lookupNamed(String id) {
      return namedDecls.get(id);
    }

    @Override
    public boolean isTemplateLevel(String level) {
      return templateLevels.contains(level);
    }

    @Override
    public ImmutableSet<String> templateLevels() {
      return templateLevels;
    }

    @Override
    public Environment globalEnv() {
      return this;
    }

    @Override
    public Environment pushNamed(Cic.Decl decl) {
      final Map<String, Cic.Decl> map = new LinkedHashMap<>(namedDecls);
      map.put(decl.name, decl);
      return new GlobalEnvironment(ImmutableMap.copyOf(map), templateLevels);
    }

    @Override
    public Environment withTemplateLevels(Set<String> levels) {
      return new GlobalEnvironment(namedDecls, ImmutableSet.copyOf(levels));
    }
  }

  /**
   * Environment that inherits from a parent environment and adds one local
   * declaration.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Cic.Decl decl;
    private final int depth;

    SubEnvironment(Environment parent, Cic.Decl decl) {
      this.parent = requireNonNull(parent);
      this.decl = requireNonNull(decl);
      this.depth = parent.relDepth() + 1;
    }

    @Override
    public String toString() {
      return decl + ", ...";
    }

    @Override
    void visitRel(Consumer<Cic.Decl> consumer) {
      consumer.accept(decl);
      parent.visitRel(consumer);
    }

    @Override
    public int relDepth() {
      return depth;
    }

    @Override
    public Cic.Decl lookupRel(int i) {
      checkArgument(i >= 1 && i <= depth, "unbound variable #%s", i);
      Environment env = this;
      for (int j = 1; j < i; j++) {
        env = ((SubEnvironment) env).parent;
      }
      return ((SubEnvironment) env).decl;
    }

    @Override
    public Cic.@Nullable Decl lookupNamed(String id) {
      return parent.lookupNamed(id);
    }

    @Override
    public boolean isTemplateLevel(String level) {
      return parent.isTemplateLevel(level);
    }

    @Override
    public ImmutableSet<String> templateLevels() {
      return parent.templateLevels();
    }

    @Override
    public Environment globalEnv() {
      return parent.globalEnv();
    }

    @Override
    public Environment pushNamed(Cic.Decl decl) {
      return parent.pushNamed(decl).pushRel(this.decl);
    }

    @Override
    public Environment withTemplateLevels(Set<String> levels) {
      return parent.withTemplateLevels(levels).pushRel(decl);
    }
  }
}

// End Environments.java
