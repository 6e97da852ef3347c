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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Universally quantified type, also known as a type scheme or polytype.
 *
 * <p>For example, the type of the identity function is {@code forall 'a. 'a ->
 * 'a}. Each use of an identifier whose type is a scheme gets a fresh copy of
 * the body, via {@link #instantiate(TypeSystem)}.
 *
 * <p>The quantified variables are always a subset of the variables that occur
 * in the body.
 */
public class ForallType {
  public final ImmutableSortedSet<TypeVar> typeVars;
  public final Type type;

  private ForallType(ImmutableSortedSet<TypeVar> typeVars, Type type) {
    this.typeVars = requireNonNull(typeVars);
    this.type = requireNonNull(type);
  }

  /**
   * Creates a type scheme. Variables in {@code typeVars} that do not occur in
   * {@code type} are ignored.
   */
  public static ForallType of(Iterable<TypeVar> typeVars, Type type) {
    final SortedSet<TypeVar> free = type.freeTypeVars();
    final ImmutableSortedSet.Builder<TypeVar> b =
        ImmutableSortedSet.naturalOrder();
    for (TypeVar typeVar : typeVars) {
      if (free.contains(typeVar)) {
        b.add(typeVar);
      }
    }
    return new ForallType(b.build(), type);
  }

  /** Creates a type scheme with no quantified variables. */
  public static ForallType mono(Type type) {
    return new ForallType(ImmutableSortedSet.of(), type);
  }

  /**
   * Converts a type into a scheme by quantifying over the variables that are
   * not fixed by the surrounding environment.
   *
   * <p>For example, generalizing {@code 'a -> 'b} where {@code 'b} is fixed
   * gives {@code forall 'a. 'a -> 'b}.
   *
   * @param type Type
   * @param fixedTypeVars Type variables that occur free in the environment
   */
  public static ForallType generalize(Type type, Set<TypeVar> fixedTypeVars) {
    return new ForallType(
        ImmutableSortedSet.copyOf(
            Sets.difference(type.freeTypeVars(), fixedTypeVars)),
        type);
  }

  /** Returns whether this scheme has no quantified variables. */
  public boolean isMono() {
    return typeVars.isEmpty();
  }

  /** Returns the variables that occur in the body but are not quantified. */
  public SortedSet<TypeVar> freeTypeVars() {
    if (typeVars.isEmpty()) {
      return type.freeTypeVars();
    }
    return ImmutableSortedSet.copyOf(
        Sets.difference(type.freeTypeVars(), typeVars));
  }

  /**
   * Creates a type from this scheme by replacing each quantified variable
   * with a new variable.
   */
  public Type instantiate(TypeSystem typeSystem) {
    if (typeVars.isEmpty()) {
      return type;
    }
    final ImmutableSortedMap.Builder<TypeVar, Type> b =
        ImmutableSortedMap.naturalOrder();
    for (TypeVar typeVar : typeVars) {
      b.put(typeVar, typeSystem.newTypeVar());
    }
    return Substitution.of(b.build()).apply(type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeVars, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ForallType
            && typeVars.equals(((ForallType) o).typeVars)
            && type.equals(((ForallType) o).type);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes a description of this scheme, e.g. "forall 'a. 'a -> 'a". */
  public StringBuilder describe(StringBuilder buf) {
    if (!typeVars.isEmpty()) {
      buf.append("forall");
      for (TypeVar typeVar : typeVars) {
        buf.append(' ').append(typeVar);
      }
      buf.append(". ");
    }
    return type.describe(buf, 0, 0);
  }
}

// End ForallType.java
