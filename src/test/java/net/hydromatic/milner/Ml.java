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
package net.hydromatic.milner;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.milner.Matchers.hasMoniker;
import static net.hydromatic.milner.Matchers.isAst;
import static net.hydromatic.milner.Matchers.isTypeError;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import net.hydromatic.milner.ast.Ast;
import net.hydromatic.milner.ast.AstNode;
import net.hydromatic.milner.compile.Environment;
import net.hydromatic.milner.compile.Environments;
import net.hydromatic.milner.compile.Prop;
import net.hydromatic.milner.compile.Session;
import net.hydromatic.milner.compile.Tracer;
import net.hydromatic.milner.compile.Tracers;
import net.hydromatic.milner.compile.TypeResolver;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeError;
import net.hydromatic.milner.type.TypeSystem;
import net.hydromatic.milner.type.TypeUnifier;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Ml {
  private final Ast.Exp exp;
  private final boolean builtIns;
  private final Map<String, Function<TypeSystem, Type>> bindings;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;
  private final TypeUnifier.Tracer unifierTracer;

  Ml(
      Ast.Exp exp,
      boolean builtIns,
      Map<String, Function<TypeSystem, Type>> bindings,
      Map<Prop, Object> propMap,
      Tracer tracer,
      TypeUnifier.Tracer unifierTracer) {
    this.exp = requireNonNull(exp);
    this.builtIns = builtIns;
    this.bindings = ImmutableMap.copyOf(bindings);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
    this.unifierTracer = requireNonNull(unifierTracer);
  }

  /** Creates an {@code Ml}. */
  static Ml ml(Ast.Exp exp) {
    return new Ml(
        exp,
        false,
        ImmutableMap.of(),
        ImmutableMap.of(),
        Tracers.empty(),
        net.hydromatic.milner.util.Tracers.nullTracer());
  }

  /** Returns a copy of this {@code Ml} whose environment has the built-ins. */
  Ml withBuiltIns() {
    return new Ml(exp, true, bindings, propMap, tracer, unifierTracer);
  }

  /** Returns a copy of this {@code Ml} with a variable in the environment. */
  Ml withBinding(String name, Type type) {
    return withBinding(name, typeSystem -> type);
  }

  /**
   * Returns a copy of this {@code Ml} with a variable in the environment
   * whose type is created by a function, typically because it contains type
   * variables.
   */
  Ml withBinding(String name, Function<TypeSystem, Type> typeFunction) {
    final Map<String, Function<TypeSystem, Type>> map =
        new LinkedHashMap<>(bindings);
    map.put(name, typeFunction);
    return new Ml(exp, builtIns, map, propMap, tracer, unifierTracer);
  }

  Ml withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Ml(exp, builtIns, bindings, map, tracer, unifierTracer);
  }

  Ml withTracer(Tracer tracer) {
    return new Ml(exp, builtIns, bindings, propMap, tracer, unifierTracer);
  }

  Ml withUnifierTracer(TypeUnifier.Tracer unifierTracer) {
    return new Ml(exp, builtIns, bindings, propMap, tracer, unifierTracer);
  }

  private Session session() {
    final Session session =
        new Session().withTracer(tracer).withUnifierTracer(unifierTracer);
    propMap.forEach(session::set);
    return session;
  }

  private Environment env(TypeSystem typeSystem) {
    Environment env =
        builtIns ? Environments.env(typeSystem) : Environments.empty();
    for (Map.Entry<String, Function<TypeSystem, Type>> entry
        : bindings.entrySet()) {
      env = env.bindMono(entry.getKey(), entry.getValue().apply(typeSystem));
    }
    return env;
  }

  /** Checks that the expression unparses to a given string. */
  @CanIgnoreReturnValue
  Ml assertUnparse(String expected) {
    assertThat(exp, isAst(AstNode.class, expected));
    return this;
  }

  /** Deduces the type of the expression and passes it to an action. */
  @CanIgnoreReturnValue
  Ml withResolved(Consumer<TypeResolver.Resolved> action) {
    final Session session = session();
    final Environment env = env(session.typeSystem);
    final TypeResolver.Resolved resolved = session.deduceType(env, exp);
    assertThat(resolved, notNullValue());
    action.accept(resolved);
    return this;
  }

  /**
   * Checks the type of the expression, after its type variables have been
   * renamed in order of appearance.
   */
  @CanIgnoreReturnValue
  Ml assertType(Matcher<Type> matcher) {
    final Session session = session();
    final Environment env = env(session.typeSystem);
    final TypeResolver.Outcome outcome = session.infer(env, exp);
    if (outcome.type == null) {
      fail("expected type, got error: " + outcome.error);
    }
    assertThat(session.typeSystem.normalize(outcome.type), matcher);
    return this;
  }

  @CanIgnoreReturnValue
  Ml assertType(String expected) {
    return assertType(hasMoniker(expected));
  }

  /** Checks that the expression cannot be typed, and the error. */
  @CanIgnoreReturnValue
  Ml assertTypeError(Matcher<TypeError> matcher) {
    final Session session = session();
    final Environment env = env(session.typeSystem);
    final TypeResolver.Outcome outcome = session.infer(env, exp);
    assertThat(outcome.isSuccess(), is(false));
    assertThat(requireNonNull(outcome.error), matcher);
    return this;
  }

  @CanIgnoreReturnValue
  Ml assertTypeError(TypeError.Kind kind, String message) {
    return assertTypeError(isTypeError(kind, message));
  }
}

// End Ml.java
