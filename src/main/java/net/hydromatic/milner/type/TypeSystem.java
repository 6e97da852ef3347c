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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factory for types, and the supply of fresh type variables for one inference
 * session.
 *
 * <p>Every type variable allocated by {@link #newTypeVar()} has an ordinal
 * that has not been used by this type system before. The counter is atomic, so
 * concurrent sessions that share a type system never allocate the same
 * variable twice.
 */
public class TypeSystem {
  private static final ImmutableMap<String, PrimitiveType> PRIMITIVES_BY_NAME;

  static {
    final ImmutableMap.Builder<String, PrimitiveType> b =
        ImmutableMap.builder();
    for (PrimitiveType primitiveType : PrimitiveType.values()) {
      b.put(primitiveType.moniker, primitiveType);
    }
    PRIMITIVES_BY_NAME = b.build();
  }

  /** Ordinal of the next type variable to be allocated. */
  private final AtomicInteger nextOrdinal = new AtomicInteger();

  public TypeSystem() {}

  /** Looks up a primitive type by name, returning null if not found. */
  public @Nullable PrimitiveType lookupOpt(String name) {
    return PRIMITIVES_BY_NAME.get(name);
  }

  /** Looks up a primitive type by name. */
  public PrimitiveType lookup(String name) {
    final PrimitiveType type = lookupOpt(name);
    if (type == null) {
      throw new AssertionError("unknown type: " + name);
    }
    return type;
  }

  /** Creates a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    return new FnType(paramType, resultType);
  }

  /**
   * Creates a multi-step function type.
   *
   * <p>For example, {@code fnType(a, b, c, d)} returns the same as
   * <!-- prevent wrapping -->
   * {@code fnType(a, fnType(b, fnType(c, d)))},
   * <!-- prevent wrapping -->
   * viz <code>a &rarr; b &rarr; c &rarr; d</code>.
   */
  public FnType fnType(
      Type paramType, Type type1, Type type2, Type... moreTypes) {
    final List<Type> types =
        ImmutableList.<Type>builder()
            .add(paramType)
            .add(type1)
            .add(type2)
            .add(moreTypes)
            .build();
    Type t = null;
    for (Type type : Lists.reverse(types)) {
      if (t == null) {
        t = type;
      } else {
        t = fnType(type, t);
      }
    }
    return (FnType) requireNonNull(t);
  }

  /** Allocates a type variable that has not been used before. */
  public TypeVar newTypeVar() {
    return new TypeVar(nextOrdinal.getAndIncrement());
  }

  /**
   * Returns a type variable with a given ordinal, and ensures that {@link
   * #newTypeVar()} will never allocate a variable with that ordinal.
   */
  public TypeVar typeVariable(int ordinal) {
    reserve(ordinal);
    return new TypeVar(ordinal);
  }

  /**
   * Ensures that future calls to {@link #newTypeVar()} return variables whose
   * ordinal is greater than {@code ordinal}.
   */
  public void reserve(int ordinal) {
    nextOrdinal.accumulateAndGet(ordinal + 1, Math::max);
  }

  /** Returns the number of type variables allocated so far. */
  public int typeVarCount() {
    return nextOrdinal.get();
  }

  /**
   * Renumbers the type variables in a type in order of their first occurrence.
   *
   * <p>Two types that are equivalent up to a consistent renaming of variables
   * have the same normalized form. For example, both {@code 'c -> 'b -> 'c}
   * and {@code 'e -> 'a -> 'e} normalize to {@code 'a -> 'b -> 'a}.
   *
   * <p>The result is for describing and comparing types; its variables may
   * coincide with variables allocated by this type system.
   */
  public Type normalize(Type type) {
    return type.accept(
        new TypeShuttle() {
          final Map<TypeVar, TypeVar> map = new HashMap<>();

          @Override
          public Type visit(TypeVar typeVar) {
            return map.computeIfAbsent(typeVar, v -> new TypeVar(map.size()));
          }
        });
  }

  /**
   * Renumbers the type variables in a scheme; as {@link #normalize(Type)}, but
   * the quantified variables are renamed too.
   */
  public ForallType normalize(ForallType forallType) {
    final Map<TypeVar, TypeVar> map = new HashMap<>();
    final Type type =
        forallType.type.accept(
            new TypeShuttle() {
              @Override
              public Type visit(TypeVar typeVar) {
                return map.computeIfAbsent(
                    typeVar, v -> new TypeVar(map.size()));
              }
            });
    return ForallType.of(
        Lists.transform(forallType.typeVars.asList(), map::get), type);
  }
}

// End TypeSystem.java
