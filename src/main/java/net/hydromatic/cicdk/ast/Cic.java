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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Terms of the source calculus, the Calculus of Inductive Constructions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Use {@link CicBuilder#cic} to create instances.
 *
 * <p>Bound variables are de Bruijn indices, starting at 1 for the innermost
 * binder. Binder names are hints only, but take part in equality, because
 * syntactic identity is what the fixpoint cache is keyed on.
 */
public class Cic {
  private Cic() {}

  /** Abstract base class of source terms. */
  public abstract static class Term {
    public final Op op;

    Term(Op op) {
      this.op = requireNonNull(op);
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }

    abstract StringBuilder unparse(StringBuilder buf);
  }

  /** Local variable, identified by its de Bruijn index. */
  public static class Rel extends Term {
    public final int index;

    Rel(int index) {
      super(Op.REL);
      checkArgument(index >= 1, "de Bruijn index must be positive: %s", index);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Rel && ((Rel) o).index == index;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append('#').append(index);
    }
  }

  /** Variable of the named context; for example, a lifted let. */
  public static class Var extends Term {
    public final String id;

    Var(String id) {
      super(Op.VAR);
      this.id = requireNonNull(id);
    }

    @Override
    public int hashCode() {
      return id.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).id.equals(id);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(id);
    }
  }

  /** Sort, such as {@code Prop}, {@code Set} or {@code Type(u)}. */
  public static class Sort extends Term {
    public final Universe universe;

    Sort(Universe universe) {
      super(Op.SORT);
      this.universe = requireNonNull(universe);
    }

    @Override
    public int hashCode() {
      return universe.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Sort && ((Sort) o).universe.equals(universe);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      switch (universe.op) {
        case PROP:
        case SET:
          return buf.append(universe);
        default:
          return buf.append("Type(").append(universe).append(')');
      }
    }
  }

  /** Term with an explicit type. */
  public static class Cast extends Term {
    public final Term term;
    public final Term type;

    Cast(Term term, Term type) {
      super(Op.CAST);
      this.term = requireNonNull(term);
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return Objects.hash(term, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Cast
              && ((Cast) o).term.equals(term)
              && ((Cast) o).type.equals(type);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      term.unparse(buf).append(" : ");
      return type.unparse(buf).append(')');
    }
  }

  /** Dependent product, {@code forall (x : A), B}. */
  public static class Prod extends Term {
    public final String name;
    public final Term domain;
    public final Term codomain;

    Prod(String name, Term domain, Term codomain) {
      super(Op.PROD);
      this.name = requireNonNull(name);
      this.domain = requireNonNull(domain);
      this.codomain = requireNonNull(codomain);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, domain, codomain);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Prod
              && ((Prod) o).name.equals(name)
              && ((Prod) o).domain.equals(domain)
              && ((Prod) o).codomain.equals(codomain);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("(forall (").append(name).append(" : ");
      domain.unparse(buf).append("), ");
      return codomain.unparse(buf).append(')');
    }
  }

  /** Abstraction, {@code fun (x : A) => t}. */
  public static class Lambda extends Term {
    public final String name;
    public final Term domain;
    public final Term body;

    Lambda(String name, Term domain, Term body) {
      super(Op.LAMBDA);
      this.name = requireNonNull(name);
      this.domain = requireNonNull(domain);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, domain, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lambda
              && ((Lambda) o).name.equals(name)
              && ((Lambda) o).domain.equals(domain)
              && ((Lambda) o).body.equals(body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("(fun (").append(name).append(" : ");
      domain.unparse(buf).append(") => ");
      return body.unparse(buf).append(')');
    }
  }

  /** Local definition, {@code let x : A := u in t}. */
  public static class LetIn extends Term {
    public final String name;
    public final Term value;
    public final Term type;
    public final Term body;

    LetIn(String name, Term value, Term type, Term body) {
      super(Op.LET_IN);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.type = requireNonNull(type);
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value, type, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LetIn
              && ((LetIn) o).name.equals(name)
              && ((LetIn) o).value.equals(value)
              && ((LetIn) o).type.equals(type)
              && ((LetIn) o).body.equals(body);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("(let ").append(name).append(" : ");
      type.unparse(buf).append(" := ");
      value.unparse(buf).append(" in ");
      return body.unparse(buf).append(')');
    }
  }

  /** Application of a function to one or more arguments. The function is
   * never itself an application. */
  public static class App extends Term {
    public final Term fn;
    public final ImmutableList<Term> args;

    App(Term fn, ImmutableList<Term> args) {
      super(Op.APP);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "application without arguments");
      checkArgument(fn.op != Op.APP, "nested application");
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
    StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      fn.unparse(buf);
      args.forEach(arg -> arg.unparse(buf.append(' ')));
      return buf.append(')');
    }
  }

  /** Reference to a global declaration: a constant, an inductive type or a
   * constructor. */
  public abstract static class Global extends Term {
    public final String name;
    /** Universe levels that instantiate the declaration's universe
     * parameters. Empty unless the declaration is polymorphic. */
    public final ImmutableList<Universe> instance;

    Global(Op op, String name, ImmutableList<Universe> instance) {
      super(op);
      this.name = requireNonNull(name);
      this.instance = requireNonNull(instance);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(name);
      if (!instance.isEmpty()) {
        buf.append("@{");
        for (int i = 0; i < instance.size(); i++) {
          buf.append(i > 0 ? " " : "");
          instance.get(i).unparse(buf);
        }
        buf.append('}');
      }
      return buf;
    }
  }

  /** Reference to a constant. */
  public static class Const extends Global {
    Const(String name, ImmutableList<Universe> instance) {
      super(Op.CONST, name, instance);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, instance);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Const
              && ((Const) o).name.equals(name)
              && ((Const) o).instance.equals(instance);
    }
  }

  /** Reference to an inductive type. */
  public static class Ind extends Global {
    Ind(String name, ImmutableList<Universe> instance) {
      super(Op.IND, name, instance);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, instance);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Ind
              && ((Ind) o).name.equals(name)
              && ((Ind) o).instance.equals(instance);
    }
  }

  /** Reference to the {@code index}th (0-based) constructor of an inductive
   * type. */
  public static class Construct extends Global {
    public final int index;

    Construct(String inductive, int index, ImmutableList<Universe> instance) {
      super(Op.CONSTRUCT, inductive, instance);
      checkArgument(index >= 0, "negative constructor index %s", index);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, index, instance);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Construct
              && ((Construct) o).name.equals(name)
              && ((Construct) o).index == index
              && ((Construct) o).instance.equals(instance);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return super.unparse(buf).append('#').append(index);
    }
  }

  /**
   * Pattern match.
   *
   * <p>The motive is an abstraction over the real arguments of the inductive
   * type and then over the discriminee; there is one branch per
   * constructor.
   */
  public static class Case extends Term {
    public final String inductive;
    public final Term motive;
    public final Term discriminee;
    public final ImmutableList<Term> branches;

    Case(String inductive, Term motive, Term discriminee,
        ImmutableList<Term> branches) {
      super(Op.CASE);
      this.inductive = requireNonNull(inductive);
      this.motive = requireNonNull(motive);
      this.discriminee = requireNonNull(discriminee);
      this.branches = requireNonNull(branches);
    }

    @Override
    public int hashCode() {
      return Objects.hash(inductive, motive, discriminee, branches);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Case
              && ((Case) o).inductive.equals(inductive)
              && ((Case) o).motive.equals(motive)
              && ((Case) o).discriminee.equals(discriminee)
              && ((Case) o).branches.equals(branches);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("(match ");
      discriminee.unparse(buf).append(" in ").append(inductive)
          .append(" return ");
      motive.unparse(buf).append(" with");
      branches.forEach(branch -> branch.unparse(buf.append(" | ")));
      return buf.append(" end)");
    }
  }

  /** Group of mutually recursive definitions, and the index of the
   * definition that the term denotes. */
  public static class Fix extends Term {
    /** For each definition, the (0-based) position of the argument on which
     * it is structurally recursive. */
    public final ImmutableList<Integer> recIndices;
    public final int focus;
    public final ImmutableList<String> names;
    public final ImmutableList<Term> types;
    /** Bodies; each is in the context extended with the group's
     * definitions, the last of which is {@code #1}. */
    public final ImmutableList<Term> bodies;

    Fix(ImmutableList<Integer> recIndices, int focus,
        ImmutableList<String> names, ImmutableList<Term> types,
        ImmutableList<Term> bodies) {
      super(Op.FIX);
      this.recIndices = requireNonNull(recIndices);
      this.focus = focus;
      this.names = requireNonNull(names);
      this.types = requireNonNull(types);
      this.bodies = requireNonNull(bodies);
      checkArgument(!names.isEmpty(), "empty fixpoint group");
      checkArgument(names.size() == types.size()
          && names.size() == bodies.size()
          && names.size() == recIndices.size(),
          "inconsistent fixpoint group");
      checkArgument(focus >= 0 && focus < names.size(),
          "focus %s out of range", focus);
    }

    @Override
    public int hashCode() {
      return Objects.hash(recIndices, focus, names, types, bodies);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fix
              && ((Fix) o).recIndices.equals(recIndices)
              && ((Fix) o).focus == focus
              && ((Fix) o).names.equals(names)
              && ((Fix) o).types.equals(types)
              && ((Fix) o).bodies.equals(bodies);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("(fix");
      for (int i = 0; i < names.size(); i++) {
        buf.append(i > 0 ? " with " : " ").append(names.get(i))
            .append(" {struct ").append(recIndices.get(i)).append("} : ");
        types.get(i).unparse(buf).append(" := ");
        bodies.get(i).unparse(buf);
      }
      return buf.append(" for ").append(names.get(focus)).append(')');
    }
  }

  /** Group of mutually co-recursive definitions. Not supported by the
   * translation. */
  public static class CoFix extends Term {
    public final int focus;
    public final ImmutableList<String> names;
    public final ImmutableList<Term> types;
    public final ImmutableList<Term> bodies;

    CoFix(int focus, ImmutableList<String> names, ImmutableList<Term> types,
        ImmutableList<Term> bodies) {
      super(Op.CO_FIX);
      this.focus = focus;
      this.names = requireNonNull(names);
      this.types = requireNonNull(types);
      this.bodies = requireNonNull(bodies);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, focus, names, types, bodies);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof CoFix
              && ((CoFix) o).focus == focus
              && ((CoFix) o).names.equals(names)
              && ((CoFix) o).types.equals(types)
              && ((CoFix) o).bodies.equals(bodies);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append("(cofix ").append(names.get(focus)).append(')');
    }
  }

  /** Existential variable, a hole left by elaboration. Not supported by the
   * translation. */
  public static class Evar extends Term {
    public final int id;

    Evar(int id) {
      super(Op.EVAR);
      this.id = id;
    }

    @Override
    public int hashCode() {
      return id + 101;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Evar && ((Evar) o).id == id;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append("?e").append(id);
    }
  }

  /** Primitive projection of a record field. Not supported by the
   * translation. */
  public static class Proj extends Term {
    public final String projection;
    public final Term term;

    Proj(String projection, Term term) {
      super(Op.PROJ);
      this.projection = requireNonNull(projection);
      this.term = requireNonNull(term);
    }

    @Override
    public int hashCode() {
      return Objects.hash(projection, term);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Proj
              && ((Proj) o).projection.equals(projection)
              && ((Proj) o).term.equals(term);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return term.unparse(buf).append(".(").append(projection).append(')');
    }
  }

  /**
   * Entry of a context: a name, a type, and, for let-bound entries, a value.
   *
   * <p>Contexts are lists of declarations, innermost first; each declaration
   * is valid in the context formed by the declarations after it.
   */
  public static class Decl {
    public final String name;
    public final @Nullable Term value;
    public final Term type;

    Decl(String name, @Nullable Term value, Term type) {
      this.name = requireNonNull(name);
      this.value = value;
      this.type = requireNonNull(type);
    }

    /** Creates a declaration without a value. */
    public static Decl of(String name, Term type) {
      return new Decl(name, null, type);
    }

    /** Creates a let-bound declaration. */
    public static Decl let(String name, Term value, Term type) {
      return new Decl(name, requireNonNull(value), type);
    }

    /** Whether this declaration is let-bound. */
    public boolean isLet() {
      return value != null;
    }

    /** Returns a copy of this declaration with a different name. */
    public Decl withName(String name) {
      return name.equals(this.name) ? this : new Decl(name, value, type);
    }

    /** Counts the declarations of a context that are not let-bound. */
    public static int assumptionCount(List<Decl> context) {
      int n = 0;
      for (Decl decl : context) {
        if (!decl.isLet()) {
          ++n;
        }
      }
      return n;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Decl
              && ((Decl) o).name.equals(name)
              && Objects.equals(((Decl) o).value, value)
              && ((Decl) o).type.equals(type);
    }

    @Override
    public String toString() {
      final StringBuilder buf = new StringBuilder(name);
      if (value != null) {
        value.unparse(buf.append(" := "));
      }
      return type.unparse(buf.append(" : ")).toString();
    }
  }
}

// End Cic.java
