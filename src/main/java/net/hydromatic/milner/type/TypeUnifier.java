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

import net.hydromatic.milner.ast.Op;

/**
 * Computes the most general unifier of two types.
 *
 * <p>This is Robinson's algorithm, specialized to {@link Type}. It is
 * stateless apart from its {@link Tracer}, and may be used by several threads.
 */
public class TypeUnifier {
  private final Tracer tracer;

  /** Creates a TypeUnifier that reports events to a given tracer. */
  public TypeUnifier(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Finds the most general substitution that makes two types equal.
   *
   * <p>Returns a {@link Substitution} on success, otherwise a {@link
   * TypeError}: {@link TypeError.TypeMismatch} if the types have incompatible
   * shapes, {@link TypeError.OccursCheckFailure} if the solution would be an
   * infinite type.
   *
   * <p>If both types are variables, the left variable is bound to the right.
   */
  public Result unify(Type type1, Type type2) {
    tracer.onUnify(type1, type2);
    if (type1.equals(type2)) {
      return Substitution.EMPTY;
    }
    if (type1.op() == Op.TY_VAR) {
      return bind((TypeVar) type1, type2);
    }
    if (type2.op() == Op.TY_VAR) {
      return bind((TypeVar) type2, type1);
    }
    switch (type1.op()) {
      case FUNCTION_TYPE:
        if (type2.op() != type1.op()) {
          break;
        }
        final FnType fnType1 = (FnType) type1;
        final FnType fnType2 = (FnType) type2;
        tracer.onDecompose(fnType1, fnType2);
        final Result r1 = unify(fnType1.paramType, fnType2.paramType);
        if (!(r1 instanceof Substitution)) {
          return r1;
        }
        final Substitution s1 = (Substitution) r1;
        final Result r2 =
            unify(s1.apply(fnType1.resultType), s1.apply(fnType2.resultType));
        if (!(r2 instanceof Substitution)) {
          return r2;
        }
        return s1.compose((Substitution) r2);

      case PRIMITIVE_TYPE:
        // Equal primitive types were handled above
        break;

      default:
        throw new AssertionError("unknown type " + type1);
    }
    tracer.onConflict(type1, type2);
    return TypeError.typeMismatch(type1, type2);
  }

  private Result bind(TypeVar typeVar, Type type) {
    final Result result = Substitution.bind(typeVar, type);
    if (result instanceof Failure) {
      tracer.onCycle(typeVar, type);
    } else {
      tracer.onBind(typeVar, type);
    }
    return result;
  }

  /**
   * Result of attempting unification. A success is {@link Substitution}; a
   * failure is {@link Failure}.
   */
  public interface Result {}

  /** Result indicating that unification was not possible. */
  public interface Failure extends Result {
    TypeError error();
  }

  /** Called on various events during unification. */
  public interface Tracer {
    /** Called when unification of two types starts. */
    void onUnify(Type left, Type right);

    /** Called when two function types are unified component-wise. */
    void onDecompose(FnType left, FnType right);

    /** Called when a variable is bound to a type. */
    void onBind(TypeVar typeVar, Type type);

    /** Called when two types have incompatible shapes. */
    void onConflict(Type left, Type right);

    /** Called when a variable occurs in the type it would be bound to. */
    void onCycle(TypeVar typeVar, Type type);
  }
}

// End TypeUnifier.java
