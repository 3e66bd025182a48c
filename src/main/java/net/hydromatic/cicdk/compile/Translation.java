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

import com.google.common.collect.ImmutableList;
import net.hydromatic.cicdk.ast.Dk;

/** Result of translating a term: the target term, and the auxiliary
 * instructions that must be emitted before it. */
public class Translation {
  public final Dk.Term term;
  public final ImmutableList<Dk.Instruction> instructions;

  Translation(Dk.Term term, ImmutableList<Dk.Instruction> instructions) {
    this.term = requireNonNull(term);
    this.instructions = requireNonNull(instructions);
  }

  @Override
  public String toString() {
    return term.toString();
  }
}

// End Translation.java
