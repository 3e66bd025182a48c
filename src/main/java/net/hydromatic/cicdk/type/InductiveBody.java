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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cicdk.ast.Cic;

/**
 * Declaration of an inductive type.
 *
 * <p>The arity is the closed type
 * {@code forall (p1 : P1) ... (pr : Pr) (x1 : A1) ... (xn : An), Sort(s)},
 * with {@link #nParams} parameters and {@link #nReals} real arguments. Each
 * constructor type is closed, of the form
 * {@code forall (p1 : P1) ... (pr : Pr) (y1 : B1) ... (yk : Bk),
 * I p1 ... pr u1 ... un}.
 */
public class InductiveBody {
  public final String name;
  public final int universeParams;
  /** For a template polymorphic inductive type, the universe level of each
   * template parameter, keyed by (0-based) parameter position. */
  public final ImmutableSortedMap<Integer, String> templateLevels;
  public final int nParams;
  public final int nReals;
  public final Cic.Term arity;
  public final ImmutableList<Constructor> constructors;

  private InductiveBody(String name, int universeParams,
      ImmutableSortedMap<Integer, String> templateLevels, int nParams,
      int nReals, Cic.Term arity, ImmutableList<Constructor> constructors) {
    this.name = requireNonNull(name);
    this.universeParams = universeParams;
    this.templateLevels = requireNonNull(templateLevels);
    this.nParams = nParams;
    this.nReals = nReals;
    this.arity = requireNonNull(arity);
    this.constructors = requireNonNull(constructors);
    checkArgument(nParams >= 0 && nReals >= 0);
    templateLevels.keySet().forEach(i ->
        checkArgument(i >= 0 && i < nParams,
            "template parameter %s out of range", i));
  }

  /** Creates an inductive type. */
  public static InductiveBody of(String name, int nParams, int nReals,
      Cic.Term arity, List<Constructor> constructors) {
    return new InductiveBody(name, 0, ImmutableSortedMap.of(), nParams,
        nReals, arity, ImmutableList.copyOf(constructors));
  }

  /** Returns a copy of this inductive type that is template polymorphic
   * over the given parameters. */
  public InductiveBody withTemplateLevels(Map<Integer, String> levels) {
    return new InductiveBody(name, universeParams,
        ImmutableSortedMap.copyOf(levels), nParams, nReals, arity,
        constructors);
  }

  /** Returns a copy of this inductive type that has universe
   * parameters. */
  public InductiveBody withUniverseParams(int universeParams) {
    return new InductiveBody(name, universeParams, templateLevels, nParams,
        nReals, arity, constructors);
  }

  /** Returns the distinct template levels, in order of first parameter. */
  public ImmutableList<String> templateLevelNames() {
    return ImmutableSet.copyOf(templateLevels.values()).asList();
  }

  /** Returns the {@code i}th (0-based) constructor. */
  public Constructor constructor(int i) {
    checkArgument(i >= 0 && i < constructors.size(),
        "inductive %s has no constructor %s", name, i);
    return constructors.get(i);
  }

  @Override
  public String toString() {
    return name + " : " + arity;
  }

  /** Constructor of an inductive type. */
  public static class Constructor {
    public final String name;
    public final Cic.Term type;

    public Constructor(String name, Cic.Term type) {
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      return name + " : " + type;
    }
  }
}

// End InductiveBody.java
