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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigDecimal;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a reference to a value. */
  public Ast.Id id(String name) {
    return new Ast.Id(name);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(boolean b) {
    return new Ast.Literal(Op.BOOL_LITERAL, b);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(BigDecimal value) {
    checkArgument(
        value.stripTrailingZeros().scale() <= 0,
        "not an integer: %s",
        value);
    return new Ast.Literal(Op.INT_LITERAL, value);
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(int value) {
    return intLiteral(BigDecimal.valueOf(value));
  }

  /** Creates a unit literal, "{@code ()}". */
  public Ast.Literal unitLiteral() {
    return new Ast.Literal(Op.UNIT_LITERAL, Unit.INSTANCE);
  }

  /** Creates a lambda, "{@code fn param => exp}". */
  public Ast.Fn fn(String param, Ast.Exp exp) {
    return new Ast.Fn(param, exp);
  }

  /**
   * Creates a curried lambda; {@code fn("x", "y", e)} is "{@code fn x => fn y
   * => e}".
   */
  public Ast.Fn fn(String param0, String param1, Ast.Exp exp) {
    return fn(param0, fn(param1, exp));
  }

  /** Creates an application, "{@code fn arg}". */
  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(fn, arg);
  }

  /**
   * Creates a curried application; {@code apply(f, a, b)} is "{@code (f a)
   * b}".
   */
  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg0, Ast.Exp... args) {
    Ast.Apply apply = apply(fn, arg0);
    for (Ast.Exp arg : args) {
      apply = apply(apply, arg);
    }
    return apply;
  }

  /** Creates an "if ... then ... else" expression. */
  public Ast.If ifThenElse(Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.If(condition, ifTrue, ifFalse);
  }

  /** Creates a value declaration, "{@code val name = exp}". */
  public Ast.ValDecl valDecl(String name, Ast.Exp exp) {
    return new Ast.ValDecl(name, exp, false);
  }

  /** Creates a recursive value declaration, "{@code val rec name = exp}". */
  public Ast.ValDecl recValDecl(String name, Ast.Exp exp) {
    return new Ast.ValDecl(name, exp, true);
  }

  /** Creates a "let" expression with a given declaration. */
  public Ast.Let let(Ast.ValDecl decl, Ast.Exp exp) {
    return new Ast.Let(decl, exp);
  }

  /** Creates "{@code let val name = value in exp end}". */
  public Ast.Let let(String name, Ast.Exp value, Ast.Exp exp) {
    return let(valDecl(name, value), exp);
  }

  /** Creates "{@code let val rec name = value in exp end}". */
  public Ast.Let letRec(String name, Ast.Exp value, Ast.Exp exp) {
    return let(recValDecl(name, value), exp);
  }
}

// End AstBuilder.java
