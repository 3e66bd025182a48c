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
import java.util.List;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Universe;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Declaration of a global constant: an axiom, or a definition with a
 * body. */
public class ConstantBody {
  public final String name;
  /** Closed type. */
  public final Cic.Term type;
  /** Closed body; null for an axiom. */
  public final Cic.@Nullable Term body;
  /** Number of universe parameters if the constant is universe polymorphic,
   * otherwise 0. */
  public final int universeParams;
  /** Constraints between the universe parameters, and between them and
   * global universes, that the constant assumes. */
  public final ImmutableList<Constraint> constraints;

  private ConstantBody(String name, Cic.Term type, Cic.@Nullable Term body,
      int universeParams, ImmutableList<Constraint> constraints) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.body = body;
    this.universeParams = universeParams;
    this.constraints = requireNonNull(constraints);
    checkArgument(universeParams >= 0);
    checkArgument(constraints.isEmpty() || universeParams > 0,
        "constraints without universe parameters");
  }

  /** Creates a definition. */
  public static ConstantBody definition(String name, Cic.Term type,
      Cic.Term body) {
    return new ConstantBody(name, type, requireNonNull(body), 0,
        ImmutableList.of());
  }

  /** Creates an axiom. */
  public static ConstantBody axiom(String name, Cic.Term type) {
    return new ConstantBody(name, type, null, 0, ImmutableList.of());
  }

  /** Returns a copy of this constant with a given number of universe
   * parameters. */
  public ConstantBody withUniverseParams(int universeParams) {
    return new ConstantBody(name, type, body, universeParams, constraints);
  }

  /** Returns a copy of this constant with given universe constraints. */
  public ConstantBody withConstraints(List<Constraint> constraints) {
    return new ConstantBody(name, type, body, universeParams,
        ImmutableList.copyOf(constraints));
  }

  @Override
  public String toString() {
    return name + " : " + type;
  }

  /** Constraint between two universes of a polymorphic constant. */
  public static class Constraint {
    public final Universe left;
    public final UniverseGraph.Relation relation;
    public final Universe right;

    public Constraint(Universe left, UniverseGraph.Relation relation,
        Universe right) {
      this.left = requireNonNull(left);
      this.relation = requireNonNull(relation);
      this.right = requireNonNull(right);
    }

    @Override
    public String toString() {
      return left + " " + relation.symbol + " " + right;
    }
  }
}

// End ConstantBody.java
