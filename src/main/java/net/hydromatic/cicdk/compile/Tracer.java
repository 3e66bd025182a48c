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

import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;

/** Called on various events during translation. */
public interface Tracer {
  /** Called when an instruction is emitted. Instructions of a declaration
   * whose translation fails are not reported. */
  void onDeclaration(Dk.Instruction instruction);

  /** Called when a term is wrapped in a cast because its type is not
   * convertible to the expected type. */
  void onCast(Cic.Term term, Cic.Term expectedType);

  /** Called when a fixpoint group is found in the fixpoint cache. */
  void onFixpointCacheHit(FixpointCache.Key key);

  /** Called when a local definition is lifted to a global definition. */
  void onLetLifted(String name);

  /** Called when the translation of a top-level declaration fails, before
   * the exception is rethrown. */
  void onFailure(String declaration, TranslationException e);
}

// End Tracer.java
