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

/** Sub-types of {@link AstNode}, and operators of types. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  UNIT_LITERAL(true),

  // declarations
  VAL_DECL(" = "),
  REC_VAL_DECL(" = "),

  // expressions
  FN(" => ", 0, 0),
  APPLY(" ", 8, true),
  IF(" then ", 0, 0),
  LET(true),

  // types
  TY_VAR(true),
  PRIMITIVE_TYPE(true),
  FUNCTION_TYPE(" -> ", 6, false);

  /** Padded name, e.g. " -> ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  /**
   * Creates a binary operator. A left-associative operator binds more tightly
   * on its right; a right-associative operator (such as the arrow of a
   * function type) binds more tightly on its left.
   */
  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
