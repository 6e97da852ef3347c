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
package net.hydromatic.milner.type;

import com.google.common.collect.ImmutableSortedSet;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import net.hydromatic.milner.ast.Op;

/**
 * Type, also known as a monotype.
 *
 * <p>A type is one of a closed set of variants: a {@link PrimitiveType}, a
 * {@link FnType}, or a {@link TypeVar}. Types are immutable and compare
 * structurally.
 *
 * <p>A type that is universally quantified over some of its variables is a
 * {@link ForallType}, and is not itself a {@code Type}.
 */
public interface Type {
  /** Type operator. */
  Op op();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   */
  Type copy(UnaryOperator<Type> transform);

  /**
   * Writes a description of this type to a string builder, e.g. "{@code int}",
   * "{@code 'a -> 'a}", "{@code (int -> bool) -> int}".
   *
   * <p>{@code left} and {@code right} are the precedences of the operators on
   * either side; the description is enclosed in parentheses if it binds less
   * tightly than they do.
   */
  StringBuilder describe(StringBuilder buf, int left, int right);

  /** Returns the type variables that occur in this type. */
  default SortedSet<TypeVar> freeTypeVars() {
    final SortedSet<TypeVar> typeVars = new TreeSet<>();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(TypeVar typeVar) {
            typeVars.add(typeVar);
            return null;
          }
        });
    return ImmutableSortedSet.copyOfSorted(typeVars);
  }

  /** Returns whether a given type variable occurs in this type. */
  default boolean contains(TypeVar typeVar) {
    return freeTypeVars().contains(typeVar);
  }

  /** Returns whether this type contains no type variables. */
  default boolean isGround() {
    return freeTypeVars().isEmpty();
  }
}

// End Type.java
