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
package net.hydromatic.cicdk.ast;

/** Sub-types of {@link Cic.Term}, {@link Universe} and {@link Dk.Node}. */
public enum Op {
  // source terms
  REL("variable"),
  VAR("named variable"),
  SORT("sort"),
  CAST("cast"),
  PROD("product"),
  LAMBDA("abstraction"),
  LET_IN("let"),
  APP("application"),
  CONST("constant"),
  IND("inductive type"),
  CONSTRUCT("constructor"),
  CASE("match"),
  FIX("fixpoint"),
  CO_FIX("co-fixpoint"),
  EVAR("existential variable"),
  PROJ("primitive projection"),

  // universes
  PROP("Prop"),
  SET("Set"),
  /** Global universe used as a sort; declared in the universe module. */
  GLOBAL_SORT("global sort"),
  /** Global universe used as a level. Source universes are written with
   * this op until they are resolved. */
  GLOBAL_LEVEL("global level"),
  NAMED_SORT("named sort"),
  /** Universe parameter bound by a polymorphic declaration. */
  LOCAL("local universe"),
  /** Universe parameter of a template polymorphic inductive type. */
  TEMPLATE("template universe"),
  SUCC("successor"),
  MAX("max"),
  RULE("rule"),
  /** Top element; never emitted. */
  UNBOUNDED("unbounded universe"),

  // target terms
  DK_VAR("symbol"),
  DK_APP("application"),
  DK_LAMBDA("abstraction"),
  DK_PI("product"),
  DK_WILDCARD("wildcard"),

  // target instructions
  DECLARATION("declaration"),
  DEFINITION("definition"),
  RULES("rewrite rules"),
  COMMENT("comment"),
  EMPTY_LINE("empty line");

  /** Description, used in messages. */
  public final String description;

  Op(String description) {
    this.description = description;
  }
}

// End Op.java
