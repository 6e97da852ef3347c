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

import java.util.Objects;

/**
 * Reason why the type of an expression could not be deduced.
 *
 * <p>A type error is a value, not an exception; each sub-class is tagged with
 * a {@link Kind}. Components that can fail return a type error as their
 * {@link TypeUnifier.Result}.
 *
 * @see net.hydromatic.milner.compile.TypeException
 */
public abstract class TypeError implements TypeUnifier.Failure {
  public final Kind kind;

  private TypeError(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Creates an error for a reference to a name that is not bound. */
  public static UndefinedVariable undefinedVariable(String name) {
    return new UndefinedVariable(name);
  }

  /** Creates an error for two types that cannot be unified. */
  public static TypeMismatch typeMismatch(Type expected, Type actual) {
    return new TypeMismatch(expected, actual);
  }

  /** Creates an error for a variable that would have an infinite type. */
  public static OccursCheckFailure occursCheckFailure(
      TypeVar typeVar, Type type) {
    return new OccursCheckFailure(typeVar, type);
  }

  /** Creates an error for an inference that exceeded a resource limit. */
  public static InferenceTooComplex inferenceTooComplex(
      String limitName, int limit) {
    return new InferenceTooComplex(limitName, limit);
  }

  @Override
  public TypeError error() {
    return this;
  }

  /** Returns a description of the error. */
  public abstract String message();

  @Override
  public String toString() {
    return message();
  }

  /** Kinds of type error. */
  public enum Kind {
    UNDEFINED_VARIABLE,
    TYPE_MISMATCH,
    OCCURS_CHECK_FAILURE,
    INFERENCE_TOO_COMPLEX
  }

  /** An identifier references a name absent from the environment. */
  public static final class UndefinedVariable extends TypeError {
    public final String name;

    UndefinedVariable(String name) {
      super(Kind.UNDEFINED_VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override
    public String message() {
      return "unbound variable or constructor: " + name;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof UndefinedVariable
              && name.equals(((UndefinedVariable) o).name);
    }
  }

  /** Unification reached types of incompatible shapes. */
  public static final class TypeMismatch extends TypeError {
    public final Type expected;
    public final Type actual;

    TypeMismatch(Type expected, Type actual) {
      super(Kind.TYPE_MISMATCH);
      this.expected = requireNonNull(expected);
      this.actual = requireNonNull(actual);
    }

    @Override
    public String message() {
      return "type mismatch: expected " + expected + ", actual " + actual;
    }

    @Override
    public int hashCode() {
      return Objects.hash(expected, actual);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TypeMismatch
              && expected.equals(((TypeMismatch) o).expected)
              && actual.equals(((TypeMismatch) o).actual);
    }
  }

  /** Unification would require a variable to contain itself. */
  public static final class OccursCheckFailure extends TypeError {
    public final TypeVar typeVar;
    public final Type type;

    OccursCheckFailure(TypeVar typeVar, Type type) {
      super(Kind.OCCURS_CHECK_FAILURE);
      this.typeVar = requireNonNull(typeVar);
      this.type = requireNonNull(type);
    }

    @Override
    public String message() {
      return "circularity: " + typeVar + " occurs in " + type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(typeVar, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof OccursCheckFailure
              && typeVar.equals(((OccursCheckFailure) o).typeVar)
              && type.equals(((OccursCheckFailure) o).type);
    }
  }

  /** Inference exceeded a limit set by the caller. */
  public static final class InferenceTooComplex extends TypeError {
    /** Name of the property that sets the limit, e.g. "maxDepth". */
    public final String limitName;
    public final int limit;

    InferenceTooComplex(String limitName, int limit) {
      super(Kind.INFERENCE_TOO_COMPLEX);
      this.limitName = requireNonNull(limitName);
      this.limit = limit;
    }

    @Override
    public String message() {
      return "inference too complex: exceeded " + limitName + " " + limit;
    }

    @Override
    public int hashCode() {
      return Objects.hash(limitName, limit);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InferenceTooComplex
              && limitName.equals(((InferenceTooComplex) o).limitName)
              && limit == ((InferenceTooComplex) o).limit;
    }
  }
}

// End TypeError.java
