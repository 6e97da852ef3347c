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

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;
import net.hydromatic.milner.type.Binding;
import net.hydromatic.milner.type.ForallType;
import net.hydromatic.milner.type.Substitution;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment for type inference; a map from names to type schemes.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  abstract void visit(Consumer<Binding> consumer);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we did,
   * debuggers would invoke it automatically, burning lots of CPU and memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    getValueMap().forEach((k, v) -> b.append(v).append("\n"));
    return b.toString();
  }

  /** Returns the binding of {@code name} if bound, null if not. */
  public abstract @Nullable Binding getOpt(String name);

  /**
   * Creates an environment that is the same as this, plus a name bound to a
   * type scheme. The new binding obscures any existing binding of the same
   * name.
   */
  public Environment bind(String name, ForallType scheme) {
    return bind(Binding.of(name, scheme));
  }

  /**
   * Creates an environment that is the same as this, plus a name bound to a
   * type with no quantified variables.
   */
  public Environment bindMono(String name, Type type) {
    return bind(Binding.mono(name, type));
  }

  protected Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /**
   * Returns a map of the visible bindings, most recent first. Does not include
   * obscured bindings.
   */
  public final Map<String, Binding> getValueMap() {
    final Map<String, Binding> valueMap = new LinkedHashMap<>();
    visit(binding -> valueMap.putIfAbsent(binding.name, binding));
    return valueMap;
  }

  /**
   * Creates an environment that is the same as this, plus the given bindings.
   */
  public final Environment bindAll(Iterable<Binding> bindings) {
    return Environments.bind(this, bindings);
  }

  /**
   * If this environment only defines bindings in the given set, returns its
   * parent. Never returns null. The empty environment returns itself.
   */
  abstract Environment nearestAncestorNotObscuredBy(Set<String> names);

  /**
   * Returns the type variables that occur free in the visible bindings.
   *
   * <p>These are the variables that {@link #generalize(Type)} must not
   * quantify over.
   */
  public SortedSet<TypeVar> freeTypeVars() {
    final SortedSet<TypeVar> typeVars = new TreeSet<>();
    final Set<String> names = new HashSet<>();
    visit(
        binding -> {
          if (names.add(binding.name)) {
            typeVars.addAll(binding.scheme.freeTypeVars());
          }
        });
    return typeVars;
  }

  /**
   * Returns an environment in which a substitution has been applied to the
   * type scheme of every binding. Returns this environment if no binding
   * changes.
   */
  public abstract Environment apply(Substitution substitution);

  /**
   * Converts a type to a scheme by quantifying over the type variables that
   * are not free in this environment.
   */
  public ForallType generalize(Type type) {
    if (type.isGround()) {
      return ForallType.mono(type);
    }
    return ForallType.generalize(type, freeTypeVars());
  }

  /** Applies a substitution to the scheme of a binding. */
  static Binding apply(Substitution substitution, Binding binding) {
    final SortedSet<TypeVar> typeVars = binding.scheme.freeTypeVars();
    for (TypeVar typeVar : typeVars) {
      if (substitution.get(typeVar) != null) {
        return binding.withScheme(substitution.apply(binding.scheme));
      }
    }
    return binding;
  }
}

// End Environment.java
