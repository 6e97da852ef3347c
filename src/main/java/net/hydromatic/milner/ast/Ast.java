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
package net.hydromatic.milner.ast;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Parse tree node of a literal (constant). The value is a {@link Boolean},
   * a {@link java.math.BigDecimal} with no fractional part, or {@link
   * Unit#INSTANCE}.
   */
  public static class Literal extends Exp {
    public final Comparable<?> value;

    /** Creates a Literal. */
    Literal(Op op, Comparable<?> value) {
      super(op);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && this.op == ((Literal) o).op
              && this.value.equals(((Literal) o).value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Lambda expression, "{@code fn x => e}". */
  public static class Fn extends Exp {
    public final String param;
    public final Exp exp;

    Fn(String param, Exp exp) {
      super(Op.FN);
      this.param = requireNonNull(param);
      this.exp = requireNonNull(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("fn ").id(param).append(op.padded).append(exp, 0, right);
    }
  }

  /** Application of a function to an argument, "{@code f x}". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Exp fn, Exp arg) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }
  }

  /** "If ... then ... else" expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ")
          .append(condition, 0, 0)
          .append(" then ")
          .append(ifTrue, 0, 0)
          .append(" else ")
          .append(ifFalse, 0, right);
    }
  }

  /** "Let" expression, "{@code let val x = e1 in e2 end}". */
  public static class Let extends Exp {
    public final ValDecl decl;
    public final Exp exp;

    Let(ValDecl decl, Exp exp) {
      super(Op.LET);
      this.decl = requireNonNull(decl);
      this.exp = requireNonNull(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("let ")
          .append(decl, 0, 0)
          .append(" in ")
          .append(exp, 0, 0)
          .append(" end");
    }
  }

  /**
   * Value declaration, "{@code val x = e}", or, if {@link #rec}, "{@code val
   * rec x = e}". In a recursive declaration, {@code x} is in scope within
   * {@code e}.
   */
  public static class ValDecl extends AstNode {
    public final String name;
    public final Exp exp;
    public final boolean rec;

    ValDecl(String name, Exp exp, boolean rec) {
      super(rec ? Op.REC_VAL_DECL : Op.VAL_DECL);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.rec = rec;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(rec ? "val rec " : "val ")
          .id(name)
          .append(op.padded)
          .append(exp, 0, right);
    }
  }
}

// End Ast.java
