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
import com.google.common.collect.Maps;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Map from type variables to types.
 *
 * <p>A substitution is immutable. It is created by {@link #bind}, which
 * performs the occurs check, and combined with others by {@link #compose}.
 * Substitutions created by unification are idempotent: applying one twice has
 * the same effect as applying it once, because no variable in its domain
 * occurs in any type in its range.
 */
public final class Substitution implements TypeUnifier.Result {
  /** The empty substitution. */
  public static final Substitution EMPTY =
      new Substitution(ImmutableSortedMap.of());

  private final ImmutableSortedMap<TypeVar, Type> map;

  private Substitution(ImmutableSortedMap<TypeVar, Type> map) {
    this.map = requireNonNull(map);
  }

  /**
   * Creates a substitution from a map, without checking for cycles.
   *
   * <p>Use only for maps whose range contains no variable in the domain, such
   * as a map from variables to new variables.
   */
  static Substitution of(Map<TypeVar, ? extends Type> map) {
    return map.isEmpty()
        ? EMPTY
        : new Substitution(ImmutableSortedMap.copyOf(map));
  }

  /**
   * Creates a substitution that maps one variable to a type.
   *
   * <p>Returns the empty substitution if {@code type} is the variable itself;
   * fails with {@link TypeError.OccursCheckFailure} if the variable occurs in
   * {@code type}, because the solution would be an infinite type.
   */
  public static TypeUnifier.Result bind(TypeVar typeVar, Type type) {
    if (type.equals(typeVar)) {
      return EMPTY;
    }
    if (type.contains(typeVar)) {
      return TypeError.occursCheckFailure(typeVar, type);
    }
    return new Substitution(ImmutableSortedMap.of(typeVar, type));
  }

  /** Returns whether this substitution has no entries. */
  public boolean isEmpty() {
    return map.isEmpty();
  }

  /** Returns the number of entries. */
  public int size() {
    return map.size();
  }

  /** Returns the variables that this substitution replaces. */
  public ImmutableSortedSet<TypeVar> domain() {
    return map.keySet();
  }

  /** Returns the type that a variable maps to, or null. */
  public @Nullable Type get(TypeVar typeVar) {
    return map.get(typeVar);
  }

  /** Returns the entries of this substitution, sorted by variable. */
  public SortedMap<TypeVar, Type> asMap() {
    return map;
  }

  /** Applies this substitution to a type. */
  public Type apply(Type type) {
    if (map.isEmpty()) {
      return type;
    }
    return type.accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar) {
            final Type t = map.get(typeVar);
            return t != null ? t : typeVar;
          }
        });
  }

  /**
   * Applies this substitution to a type scheme. The scheme's quantified
   * variables are bound, so they are not replaced.
   */
  public ForallType apply(ForallType forallType) {
    if (map.isEmpty()) {
      return forallType;
    }
    final Substitution s = without(forallType.typeVars);
    final Type type = s.apply(forallType.type);
    return type == forallType.type
        ? forallType
        : ForallType.of(forallType.typeVars, type);
  }

  /** Returns this substitution minus the entries for the given variables. */
  public Substitution without(Set<TypeVar> typeVars) {
    if (typeVars.isEmpty()) {
      return this;
    }
    final Map<TypeVar, Type> filtered =
        Maps.filterKeys(map, typeVar -> !typeVars.contains(typeVar));
    return filtered.size() == map.size() ? this : of(filtered);
  }

  /**
   * Returns a substitution equivalent to applying this substitution, then
   * {@code next}.
   *
   * <p>For any type {@code t}, {@code s1.compose(s2).apply(t)} equals {@code
   * s2.apply(s1.apply(t))}.
   */
  public Substitution compose(Substitution next) {
    if (next.map.isEmpty()) {
      return this;
    }
    if (map.isEmpty()) {
      return next;
    }
    final SortedMap<TypeVar, Type> composed = new TreeMap<>();
    map.forEach((typeVar, type) -> composed.put(typeVar, next.apply(type)));
    next.map.forEach(composed::putIfAbsent);
    return new Substitution(ImmutableSortedMap.copyOfSorted(composed));
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Substitution && map.equals(((Substitution) obj).map);
  }

  /** Returns a description, e.g. "['a -> int, 'b -> bool -> bool]". */
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    map.forEach(
        (typeVar, type) -> {
          if (buf.length() > 1) {
            buf.append(", ");
          }
          buf.append(typeVar).append(" -> ");
          type.describe(buf, 0, 0);
        });
    return buf.append("]").toString();
  }
}

// End Substitution.java
