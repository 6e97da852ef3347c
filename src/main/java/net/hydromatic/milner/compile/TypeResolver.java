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
import static net.hydromatic.milner.type.PrimitiveType.BOOL;

import com.google.common.collect.ImmutableList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.milner.ast.Ast;
import net.hydromatic.milner.ast.Visitor;
import net.hydromatic.milner.type.Binding;
import net.hydromatic.milner.type.ForallType;
import net.hydromatic.milner.type.PrimitiveType;
import net.hydromatic.milner.type.Substitution;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeError;
import net.hydromatic.milner.type.TypeSystem;
import net.hydromatic.milner.type.TypeUnifier;
import net.hydromatic.milner.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deduces the types of expressions, using Hindley-Milner "Algorithm W".
 *
 * <p>A resolver is used for one inference and then discarded. It throws
 * {@link TypeException} on the first inconsistency it finds; {@link
 * Session#infer} converts that into an {@link Outcome}.
 */
public class TypeResolver {
  private final TypeSystem typeSystem;
  private final TypeUnifier unifier;
  private final Tracer tracer;
  private final int maxDepth;
  private final @Nullable Integer maxSteps;

  /** Type of each expression, before the final substitution is applied. */
  private final Map<Ast.Exp, Type> typeMap = new IdentityHashMap<>();

  private int depth;
  private int steps;

  TypeResolver(
      TypeSystem typeSystem,
      TypeUnifier unifier,
      Tracer tracer,
      int maxDepth,
      @Nullable Integer maxSteps) {
    this.typeSystem = requireNonNull(typeSystem);
    this.unifier = requireNonNull(unifier);
    this.tracer = requireNonNull(tracer);
    this.maxDepth = maxDepth;
    this.maxSteps = maxSteps;
  }

  /**
   * Deduces the type of an expression in an environment, with no tracing and
   * default limits.
   */
  public static Resolved deduceType(
      Environment env, Ast.Exp exp, TypeSystem typeSystem) {
    return new Session(typeSystem).deduceType(env, exp);
  }

  /** Deduces the type of an expression. */
  Resolved resolve(Environment env, Ast.Exp exp) {
    reserve(env);
    try {
      final Typed typed = deduce(env, exp);
      tracer.onResult(typed.type);
      return new Resolved(env, exp, typed.type, typed.substitution, typeMap);
    } catch (TypeException e) {
      tracer.onTypeException(e);
      throw e;
    }
  }

  /**
   * Deduces the types of a sequence of declarations. Each declaration is in
   * scope in the declarations that follow it.
   */
  Declared resolveDecls(Environment env, List<Ast.ValDecl> decls) {
    reserve(env);
    try {
      Substitution substitution = Substitution.EMPTY;
      final ImmutableList.Builder<Binding> bindings = ImmutableList.builder();
      for (Ast.ValDecl decl : decls) {
        final TypedDecl typed = deduceValDecl(env, decl);
        final Binding binding = Binding.of(decl.name, typed.scheme);
        bindings.add(binding);
        env = env.apply(typed.substitution).bind(decl.name, typed.scheme);
        substitution = substitution.compose(typed.substitution);
      }
      return new Declared(env, bindings.build(), substitution);
    } catch (TypeException e) {
      tracer.onTypeException(e);
      throw e;
    }
  }

  /**
   * Ensures that the type system will not allocate a variable that already
   * occurs in the environment.
   */
  private void reserve(Environment env) {
    env.visit(
        binding -> {
          for (TypeVar typeVar : binding.scheme.type.freeTypeVars()) {
            typeSystem.reserve(typeVar.ordinal);
          }
        });
  }

  private Typed deduce(Environment env, Ast.Exp exp) {
    if (depth >= maxDepth) {
      throw new TypeException(
          TypeError.inferenceTooComplex(Prop.MAX_DEPTH.camelName, maxDepth));
    }
    if (maxSteps != null && steps >= maxSteps) {
      throw new TypeException(
          TypeError.inferenceTooComplex(Prop.MAX_STEPS.camelName, maxSteps));
    }
    ++depth;
    ++steps;
    try {
      final Typed typed = deduceExp(env, exp);
      typeMap.put(exp, typed.type);
      return typed;
    } finally {
      --depth;
    }
  }

  private Typed deduceExp(Environment env, Ast.Exp exp) {
    switch (exp.op) {
      case BOOL_LITERAL:
        return new Typed(BOOL, Substitution.EMPTY);

      case INT_LITERAL:
        return new Typed(PrimitiveType.INT, Substitution.EMPTY);

      case UNIT_LITERAL:
        return new Typed(PrimitiveType.UNIT, Substitution.EMPTY);

      case ID:
        return deduceId(env, (Ast.Id) exp);

      case FN:
        return deduceFn(env, (Ast.Fn) exp);

      case APPLY:
        return deduceApply(env, (Ast.Apply) exp);

      case IF:
        return deduceIf(env, (Ast.If) exp);

      case LET:
        return deduceLet(env, (Ast.Let) exp);

      default:
        throw new AssertionError("cannot deduce type for " + exp.op);
    }
  }

  private Typed deduceId(Environment env, Ast.Id id) {
    final Binding binding = env.getOpt(id.name);
    if (binding == null) {
      throw new TypeException(TypeError.undefinedVariable(id.name));
    }
    final Type type = binding.scheme.instantiate(typeSystem);
    tracer.onInstantiate(id, binding.scheme, type);
    return new Typed(type, Substitution.EMPTY);
  }

  private Typed deduceFn(Environment env, Ast.Fn fn) {
    final TypeVar paramType = typeSystem.newTypeVar();
    final Typed body = deduce(env.bindMono(fn.param, paramType), fn.exp);
    final Substitution s = body.substitution;
    return new Typed(typeSystem.fnType(s.apply(paramType), body.type), s);
  }

  private Typed deduceApply(Environment env, Ast.Apply apply) {
    final Typed fn = deduce(env, apply.fn);
    final Typed arg = deduce(env.apply(fn.substitution), apply.arg);
    final TypeVar resultType = typeSystem.newTypeVar();
    final Substitution s3 =
        unify(
            arg.substitution.apply(fn.type),
            typeSystem.fnType(arg.type, resultType));
    return new Typed(
        s3.apply(resultType),
        fn.substitution.compose(arg.substitution).compose(s3));
  }

  private Typed deduceIf(Environment env, Ast.If ifThen) {
    final Typed condition = deduce(env, ifThen.condition);
    Substitution s =
        condition.substitution.compose(unify(condition.type, BOOL));
    final Typed ifTrue = deduce(env.apply(s), ifThen.ifTrue);
    s = s.compose(ifTrue.substitution);
    final Typed ifFalse = deduce(env.apply(s), ifThen.ifFalse);
    s = s.compose(ifFalse.substitution);
    final Substitution s5 =
        unify(ifFalse.substitution.apply(ifTrue.type), ifFalse.type);
    return new Typed(s5.apply(ifFalse.type), s.compose(s5));
  }

  private Typed deduceLet(Environment env, Ast.Let let) {
    final TypedDecl decl = deduceValDecl(env, let.decl);
    final Environment env2 =
        env.apply(decl.substitution).bind(let.decl.name, decl.scheme);
    final Typed body = deduce(env2, let.exp);
    return new Typed(body.type, decl.substitution.compose(body.substitution));
  }

  /**
   * Deduces the type of the value in a declaration, and generalizes it.
   *
   * <p>In a recursive declaration, the name is bound to a fresh type variable
   * while the value is deduced, so it is monomorphic within its own
   * definition.
   */
  private TypedDecl deduceValDecl(Environment env, Ast.ValDecl decl) {
    final Substitution s;
    final Type type;
    if (decl.rec) {
      final TypeVar typeVar = typeSystem.newTypeVar();
      final Typed value = deduce(env.bindMono(decl.name, typeVar), decl.exp);
      final Substitution s2 =
          unify(value.substitution.apply(typeVar), value.type);
      s = value.substitution.compose(s2);
      type = s2.apply(value.type);
    } else {
      final Typed value = deduce(env, decl.exp);
      s = value.substitution;
      type = value.type;
    }
    final ForallType scheme = env.apply(s).generalize(s.apply(type));
    tracer.onGeneralize(decl.name, scheme);
    return new TypedDecl(scheme, s);
  }

  /** Unifies two types, throwing if they cannot be unified. */
  private Substitution unify(Type type1, Type type2) {
    final TypeUnifier.Result result = unifier.unify(type1, type2);
    if (result instanceof TypeUnifier.Failure) {
      throw new TypeException(((TypeUnifier.Failure) result).error());
    }
    return (Substitution) result;
  }

  /** A type and the substitution that was found while deducing it. */
  private static class Typed {
    final Type type;
    final Substitution substitution;

    Typed(Type type, Substitution substitution) {
      this.type = requireNonNull(type);
      this.substitution = requireNonNull(substitution);
    }
  }

  /** The scheme of a declaration, and the substitution found deducing it. */
  private static class TypedDecl {
    final ForallType scheme;
    final Substitution substitution;

    TypedDecl(ForallType scheme, Substitution substitution) {
      this.scheme = requireNonNull(scheme);
      this.substitution = requireNonNull(substitution);
    }
  }

  /** Result of deducing the type of an expression. */
  public static class Resolved {
    public final Environment env;
    public final Ast.Exp exp;
    public final Type type;
    public final Substitution substitution;
    private final Map<Ast.Exp, Type> typeMap;

    Resolved(
        Environment env,
        Ast.Exp exp,
        Type type,
        Substitution substitution,
        Map<Ast.Exp, Type> typeMap) {
      this.env = requireNonNull(env);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
      this.substitution = requireNonNull(substitution);
      this.typeMap = requireNonNull(typeMap);
    }

    /**
     * Returns the type of an expression within the tree, with all
     * substitutions applied.
     *
     * @throws IllegalArgumentException if the expression is not part of the
     *     tree that was resolved
     */
    public Type getType(Ast.Exp exp) {
      final Type type = typeMap.get(exp);
      if (type == null) {
        throw new IllegalArgumentException("not in tree: " + exp);
      }
      return substitution.apply(type);
    }

    /** Calls a consumer for each expression in the tree, and its type. */
    public void forEachType(BiConsumer<Ast.Exp, Type> consumer) {
      final Visitor visitor =
          new Visitor() {
            @Override
            public void visit(Ast.Id id) {
              consumer.accept(id, getType(id));
            }

            @Override
            public void visit(Ast.Literal literal) {
              consumer.accept(literal, getType(literal));
            }

            @Override
            public void visit(Ast.Fn fn) {
              consumer.accept(fn, getType(fn));
              super.visit(fn);
            }

            @Override
            public void visit(Ast.Apply apply) {
              consumer.accept(apply, getType(apply));
              super.visit(apply);
            }

            @Override
            public void visit(Ast.If ifThen) {
              consumer.accept(ifThen, getType(ifThen));
              super.visit(ifThen);
            }

            @Override
            public void visit(Ast.Let let) {
              consumer.accept(let, getType(let));
              super.visit(let);
            }
          };
      exp.accept(visitor);
    }
  }

  /** Result of deducing the types of a sequence of declarations. */
  public static class Declared {
    /** The environment plus a binding for each declaration. */
    public final Environment env;

    /** Binding of each declared name to its scheme, in declaration order. */
    public final List<Binding> bindings;

    public final Substitution substitution;

    Declared(
        Environment env, List<Binding> bindings, Substitution substitution) {
      this.env = requireNonNull(env);
      this.bindings = ImmutableList.copyOf(bindings);
      this.substitution = requireNonNull(substitution);
    }
  }

  /**
   * Outcome of type inference: either a type, or the error that prevented
   * a type from being deduced.
   */
  public static class Outcome {
    public final @Nullable Type type;
    public final @Nullable TypeError error;

    private Outcome(@Nullable Type type, @Nullable TypeError error) {
      this.type = type;
      this.error = error;
    }

    static Outcome success(Type type) {
      return new Outcome(requireNonNull(type), null);
    }

    static Outcome failure(TypeError error) {
      return new Outcome(null, requireNonNull(error));
    }

    public boolean isSuccess() {
      return type != null;
    }

    @Override
    public String toString() {
      return type != null ? type.toString() : String.valueOf(error);
    }
  }
}

// End TypeResolver.java
