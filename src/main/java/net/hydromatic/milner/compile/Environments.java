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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.milner.type.Binding;
import net.hydromatic.milner.type.Substitution;
import net.hydromatic.milner.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Returns an environment with no bindings. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /**
   * Creates an environment containing the built-in functions, such as
   * "{@code not}" and "{@code op +}".
   */
  public static Environment env(TypeSystem typeSystem) {
    final List<Binding> bindings = new ArrayList<>();
    for (BuiltIn builtIn : BuiltIn.values()) {
      bindings.add(Binding.of(builtIn.mlName, builtIn.scheme(typeSystem)));
    }
    return bind(EmptyEnvironment.INSTANCE, bindings);
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    if (Iterables.size(bindings) < 5) {
      for (Binding binding : bindings) {
        env = env.bind(binding);
      }
      return env;
    } else {
      // If two bindings have the same name, the later one wins.
      final ImmutableMap.Builder<String, Binding> b = ImmutableMap.builder();
      bindings.forEach(binding -> b.put(binding.name, binding));
      final ImmutableMap<String, Binding> map = b.buildKeepingLast();
      env = env.nearestAncestorNotObscuredBy(map.keySet());
      return new MapEnvironment(env, map);
    }
  }

  /**
   * Environment that inherits from a parent environment and adds one binding.
   */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override
    public String toString() {
      return binding.name + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      if (name.equals(binding.name)) {
        return binding;
      }
      return parent.getOpt(name);
    }

    @Override
    protected Environment bind(Binding binding) {
      Environment env;
      if (this.binding.name.equals(binding.name)) {
        // The new binding obscures this environment's binding. Bind the parent
        // instead, so that chains of obscured bindings do not form.
        env = parent;
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).binding.name.equals(binding.name)) {
          env = ((SubEnvironment) env).parent;
        }
      } else {
        env = this;
      }
      return new SubEnvironment(env, binding);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return names.contains(binding.name)
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }

    @Override
    public Environment apply(Substitution substitution) {
      if (substitution.isEmpty()) {
        return this;
      }
      final Environment parent2 = parent.apply(substitution);
      final Binding binding2 = apply(substitution, binding);
      return parent2 == parent && binding2 == binding
          ? this
          : new SubEnvironment(parent2, binding2);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(Consumer<Binding> consumer) {}

    @Override
    public @Nullable Binding getOpt(String name) {
      return null;
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return this;
    }

    @Override
    public Environment apply(Substitution substitution) {
      return this;
    }
  }

  /** Environment that keeps bindings in a map. */
  static class MapEnvironment extends Environment {
    private final Environment parent;
    private final ImmutableMap<String, Binding> map;

    MapEnvironment(Environment parent, ImmutableMap<String, Binding> map) {
      this.parent = requireNonNull(parent);
      this.map = requireNonNull(map);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      map.values().forEach(consumer);
      parent.visit(consumer);
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      final Binding binding = map.get(name);
      return binding != null ? binding : parent.getOpt(name);
    }

    @Override
    Environment nearestAncestorNotObscuredBy(Set<String> names) {
      return names.containsAll(map.keySet())
          ? parent.nearestAncestorNotObscuredBy(names)
          : this;
    }

    @Override
    public Environment apply(Substitution substitution) {
      if (substitution.isEmpty()) {
        return this;
      }
      final Environment parent2 = parent.apply(substitution);
      final ImmutableMap.Builder<String, Binding> b = ImmutableMap.builder();
      boolean changed = parent2 != parent;
      for (Map.Entry<String, Binding> entry : map.entrySet()) {
        final Binding binding2 = apply(substitution, entry.getValue());
        changed |= binding2 != entry.getValue();
        b.put(entry.getKey(), binding2);
      }
      return changed ? new MapEnvironment(parent2, b.build()) : this;
    }
  }
}

// End Environments.java
