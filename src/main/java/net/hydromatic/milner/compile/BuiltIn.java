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
package net.hydromatic.milner.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.milner.type.PrimitiveType.BOOL;
import static net.hydromatic.milner.type.PrimitiveType.INT;
import static net.hydromatic.milner.type.PrimitiveType.UNIT;

import com.google.common.collect.ImmutableMap;
import java.util.function.Function;
import net.hydromatic.milner.type.ForallType;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions.
 *
 * <p>Infix operators are bound under names such as "{@code op +}"; since the
 * syntax tree has no infix application, "{@code 1 + 2}" is written as the
 * curried application "{@code op + 1 2}".
 */
public enum BuiltIn {
  /** Function "not", of type "bool &rarr; bool". */
  NOT("not", ts -> ts.fnType(BOOL, BOOL)),

  /** Infix operator "+", of type "int &rarr; int &rarr; int". */
  OP_PLUS("op +", ts -> ts.fnType(INT, INT, INT)),

  /** Infix operator "-", of type "int &rarr; int &rarr; int". */
  OP_MINUS("op -", ts -> ts.fnType(INT, INT, INT)),

  /** Infix operator "*", of type "int &rarr; int &rarr; int". */
  OP_TIMES("op *", ts -> ts.fnType(INT, INT, INT)),

  /** Infix operator "&lt;", of type "int &rarr; int &rarr; bool". */
  OP_LT("op <", ts -> ts.fnType(INT, INT, BOOL)),

  /** Infix operator "=", of type "&alpha; &rarr; &alpha; &rarr; bool". */
  OP_EQ("op =", ts -> ts.fnType(ts.typeVariable(0), ts.typeVariable(0), BOOL)),

  /** Function "ignore", of type "&alpha; &rarr; unit". */
  IGNORE("ignore", ts -> ts.fnType(ts.typeVariable(0), UNIT)),

  /**
   * Infix operator "o" (function composition), of type "(&beta; &rarr;
   * &gamma;) &rarr; (&alpha; &rarr; &beta;) &rarr; &alpha; &rarr; &gamma;".
   */
  OP_O(
      "op o",
      ts ->
          ts.fnType(
              ts.fnType(ts.typeVariable(1), ts.typeVariable(2)),
              ts.fnType(ts.typeVariable(0), ts.typeVariable(1)),
              ts.typeVariable(0),
              ts.typeVariable(2)));

  /** Name in the environment, e.g. "not" or "op +". */
  public final String mlName;

  /** Computes the type; type variables are quantified by {@link #scheme}. */
  private final Function<TypeSystem, Type> typeFunction;

  private static final ImmutableMap<String, BuiltIn> BY_ML_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.mlName, builtIn);
    }
    BY_ML_NAME = b.build();
  }

  BuiltIn(String mlName, Function<TypeSystem, Type> typeFunction) {
    this.mlName = requireNonNull(mlName, "mlName");
    this.typeFunction = requireNonNull(typeFunction, "typeFunction");
  }

  /** Looks up a built-in by name, returning null if not found. */
  public static @Nullable BuiltIn lookupOpt(String mlName) {
    return BY_ML_NAME.get(mlName);
  }

  /**
   * Returns the type scheme of this built-in, quantified over all of its type
   * variables.
   */
  public ForallType scheme(TypeSystem typeSystem) {
    final Type type = typeFunction.apply(typeSystem);
    return ForallType.of(type.freeTypeVars(), type);
  }
}

// End BuiltIn.java
