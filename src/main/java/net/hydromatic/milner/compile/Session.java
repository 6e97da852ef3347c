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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.milner.ast.Ast;
import net.hydromatic.milner.type.TypeSystem;
import net.hydromatic.milner.type.TypeUnifier;

/**
 * Session for type inference.
 *
 * <p>Holds the {@link TypeSystem} that supplies fresh type variables, the
 * property values that limit inference, and the tracers that observe it. Each
 * call to {@link #deduceType} or {@link #infer} uses a new {@link
 * TypeResolver}, but they share the type system, so type variables in one
 * result never clash with those in another.
 *
 * <p>A session is not thread-safe.
 */
public class Session {
  public final TypeSystem typeSystem;

  /** Property values. */
  public final Map<Prop, Object> map = new LinkedHashMap<>();

  private Tracer tracer = Tracers.empty();
  private TypeUnifier.Tracer unifierTracer =
      net.hydromatic.milner.util.Tracers.nullTracer();

  /** Creates a Session with a new type system. */
  public Session() {
    this(new TypeSystem());
  }

  /** Creates a Session that allocates type variables from a type system. */
  public Session(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  /** Sets the tracer that is called on inference events. */
  @CanIgnoreReturnValue
  public Session withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
    return this;
  }

  /** Sets the tracer that is called on unification events. */
  @CanIgnoreReturnValue
  public Session withUnifierTracer(TypeUnifier.Tracer unifierTracer) {
    this.unifierTracer = requireNonNull(unifierTracer);
    return this;
  }

  /** Sets the value of a property. */
  @CanIgnoreReturnValue
  public Session set(Prop prop, Object value) {
    prop.set(map, value);
    return this;
  }

  /** Returns an environment containing the built-in functions. */
  public Environment builtInEnvironment() {
    return Environments.env(typeSystem);
  }

  private TypeResolver resolver() {
    return new TypeResolver(
        typeSystem,
        new TypeUnifier(unifierTracer),
        tracer,
        Prop.MAX_DEPTH.intValue(map),
        Prop.MAX_STEPS.optionalIntValue(map));
  }

  /**
   * Deduces the type of an expression.
   *
   * @throws TypeException if the expression cannot be typed
   */
  public TypeResolver.Resolved deduceType(Environment env, Ast.Exp exp) {
    return resolver().resolve(env, exp);
  }

  /**
   * Infers the type of an expression, returning either the type or the error
   * that prevented it from being typed. Never throws {@link TypeException}.
   */
  public TypeResolver.Outcome infer(Environment env, Ast.Exp exp) {
    try {
      return TypeResolver.Outcome.success(deduceType(env, exp).type);
    } catch (TypeException e) {
      return TypeResolver.Outcome.failure(e.error);
    }
  }

  /**
   * Deduces the types of a sequence of declarations, as at the top level of a
   * program, and returns the environment extended with them.
   *
   * @throws TypeException if a declaration cannot be typed
   */
  public TypeResolver.Declared deduceDecls(
      Environment env, List<Ast.ValDecl> decls) {
    return resolver().resolveDecls(env, decls);
  }
}

// End Session.java
