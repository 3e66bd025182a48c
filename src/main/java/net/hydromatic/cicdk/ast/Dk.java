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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Terms and instructions of the target calculus, a lambda-Pi calculus modulo
 * rewriting.
 *
 * <p>Target terms refer to variables by name. Use {@link DkBuilder#dk} to
 * create instances.
 */
public class Dk {
  private Dk() {}

  /** Base class of all target nodes. */
  public abstract static class Node {
    public final Op op;

    Node(Op op) {
      this.op = requireNonNull(op);
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    abstract StringBuilder unparse(StringBuilder buf);
  }

  /** Target term. */
  public abstract static class Term extends Node {
    Term(Op op) {
      super(op);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparse(buf, 0);
    }

    /** Writes this term; {@code prec} is 0 at top level, 1 in the domain of
     * a product, 2 in argument position. */
    abstract StringBuilder unparse(StringBuilder buf, int prec);
  }

  /** Reference to a symbol or a bound variable. */
  public static class Var extends Term {
    public final String name;

    Var(String name) {
      super(Op.DK_VAR);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).name.equals(name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int prec) {
      return buf.append(name);
    }
  }

  /** Application. The function is never itself an application. */
  public static class App extends Term {
    public final Term fn;
    public final ImmutableList<Term> args;

    App(Term fn, ImmutableList<Term> args) {
      super(Op.DK_APP);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof App
              && ((App) o).fn.equals(fn)
              && ((App) o).args.equals(args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int prec) {
      if (prec >= 2) {
        return unparse(buf.append('('), 0).append(')');
      }
      fn.unparse(buf, 2);
      args.forEach(arg -> arg.unparse(buf.append(' '), 2));
      return buf;
    }
  }

  /** Abstraction, {@code x : A => t}. The type is optional. */
  public static class Lam extends Term {
    public final String name;
    public final @Nullable Term type;
    public final Term body;

    Lam(String name, @Nullable Term type, Term body) {
      super(Op.DK_LAMBDA);
      this.name = requireNonNull(name);
      this.type = type;
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, type, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lam
              && ((Lam) o).name.equals(name)
              && Objects.equals(((Lam) o).type, type)
              && ((Lam) o).body.equals(body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int prec) {
      if (prec >= 1) {
        return unparse(buf.append('('), 0).append(')');
      }
      buf.append(name);
      if (type != null) {
        type.unparse(buf.append(" : "), 1);
      }
      return body.unparse(buf.append(" => "), 0);
    }
  }

  /** Dependent product, {@code x : A -> B}. If the name is {@code _}, the
   * product is printed as an arrow. */
  public static class Pi extends Term {
    public final String name;
    public final Term type;
    public final Term body;

    Pi(String name, Term type, Term body) {
      super(Op.DK_PI);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, type, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Pi
              && ((Pi) o).name.equals(name)
              && ((Pi) o).type.equals(type)
              && ((Pi) o).body.equals(body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int prec) {
      if (prec >= 1) {
        return unparse(buf.append('('), 0).append(')');
      }
      if (!name.equals("_")) {
        buf.append(name).append(" : ");
      }
      type.unparse(buf, 1);
      return body.unparse(buf.append(" -> "), 0);
    }
  }

  /** Wildcard pattern, {@code _}. */
  public static class Wildcard extends Term {
    static final Wildcard INSTANCE = new Wildcard();

    private Wildcard() {
      super(Op.DK_WILDCARD);
    }

    @Override
    StringBuilder unparse(StringBuilder buf, int prec) {
      return buf.append('_');
    }
  }

  /** Top-level instruction of a target program. */
  public abstract static class Instruction extends Node {
    Instruction(Op op) {
      super(op);
    }
  }

  /** Declaration of a symbol, {@code x : A.}; if definable, rewrite rules
   * may be added to it later, {@code def x : A.}. */
  public static class Declaration extends Instruction {
    public final String name;
    public final Term type;
    public final boolean definable;

    Declaration(String name, Term type, boolean definable) {
      super(Op.DECLARATION);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.definable = definable;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, definable);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Declaration
              && ((Declaration) o).name.equals(name)
              && ((Declaration) o).type.equals(type)
              && ((Declaration) o).definable == definable;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(definable ? "def " : "").append(name).append(" : ");
      return type.unparse(buf, 0).append('.');
    }
  }

  /** Definition of a symbol, {@code def x : A := t.}. */
  public static class Definition extends Instruction {
    public final String name;
    public final @Nullable Term type;
    public final Term value;

    Definition(String name, @Nullable Term type, Term value) {
      super(Op.DEFINITION);
      this.name = requireNonNull(name);
      this.type = type;
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Definition
              && ((Definition) o).name.equals(name)
              && Objects.equals(((Definition) o).type, type)
              && ((Definition) o).value.equals(value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("def ").append(name);
      if (type != null) {
        type.unparse(buf.append(" : "), 0);
      }
      return value.unparse(buf.append(" := "), 0).append('.');
    }
  }

  /** Pattern variable of a rewrite rule, optionally typed. */
  public static class Binding {
    public final String name;
    public final @Nullable Term type;

    Binding(String name, @Nullable Term type) {
      this.name = requireNonNull(name);
      this.type = type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binding
              && ((Binding) o).name.equals(name)
              && Objects.equals(((Binding) o).type, type);
    }

    @Override
    public String toString() {
      return type == null ? name : name + " : " + type;
    }
  }

  /** Rewrite rule, {@code [ctx] lhs --> rhs}. */
  public static class Rule {
    public final ImmutableList<Binding> context;
    public final Term lhs;
    public final Term rhs;

    Rule(ImmutableList<Binding> context, Term lhs, Term rhs) {
      this.context = requireNonNull(context);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(context, lhs, rhs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Rule
              && ((Rule) o).context.equals(context)
              && ((Rule) o).lhs.equals(lhs)
              && ((Rule) o).rhs.equals(rhs);
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    StringBuilder unparse(StringBuilder buf) {
      buf.append('[');
      for (int i = 0; i < context.size(); i++) {
        buf.append(i > 0 ? ", " : "").append(context.get(i));
      }
      buf.append("] ");
      lhs.unparse(buf, 0).append(" --> ");
      return rhs.unparse(buf, 0).append('.');
    }
  }

  /** Block of rewrite rules, one per line. */
  public static class Rules extends Instruction {
    public final ImmutableList<Rule> rules;

    Rules(ImmutableList<Rule> rules) {
      super(Op.RULES);
      this.rules = requireNonNull(rules);
    }

    @Override
    public int hashCode() {
      return rules.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Rules && ((Rules) o).rules.equals(rules);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      for (int i = 0; i < rules.size(); i++) {
        rules.get(i).unparse(buf.append(i > 0 ? "\n" : ""));
      }
      return buf;
    }
  }

  /** Comment, {@code (; text ;)}. */
  public static class Comment extends Instruction {
    public final String text;

    Comment(String text) {
      super(Op.COMMENT);
      this.text = requireNonNull(text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Comment && ((Comment) o).text.equals(text);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append("(; ").append(text).append(" ;)");
    }
  }

  /** Blank line between groups of instructions. */
  public static class EmptyLine extends Instruction {
    static final EmptyLine INSTANCE = new EmptyLine();

    private EmptyLine() {
      super(Op.EMPTY_LINE);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf;
    }
  }
}

// End Dk.java
