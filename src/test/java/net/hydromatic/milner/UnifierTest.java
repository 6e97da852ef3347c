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

import static net.hydromatic.milner.Matchers.equalsOrdered;
import static net.hydromatic.milner.type.PrimitiveType.BOOL;
import static net.hydromatic.milner.type.PrimitiveType.INT;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.milner.type.Substitution;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeError;
import net.hydromatic.milner.type.TypeSystem;
import net.hydromatic.milner.type.TypeUnifier;
import net.hydromatic.milner.type.TypeVar;
import net.hydromatic.milner.util.Tracers;
import org.junit.jupiter.api.Test;

/** Test for {@link TypeUnifier}. */
public class UnifierTest {
  final TypeSystem typeSystem = new TypeSystem();
  final TypeUnifier unifier = new TypeUnifier(Tracers.nullTracer());

  // Turn off checkstyle, because non-static fields are conventionally
  // lower-case.
  // CHECKSTYLE: IGNORE 3
  final TypeVar A = typeSystem.typeVariable(0);
  final TypeVar B = typeSystem.typeVariable(1);
  final TypeVar C = typeSystem.typeVariable(2);

  Type fn(Type paramType, Type resultType) {
    return typeSystem.fnType(paramType, resultType);
  }

  /** Unifies two types, and checks that the result is a substitution. */
  Substitution assertUnify(Type t1, Type t2, String expected) {
    final TypeUnifier.Result result = unifier.unify(t1, t2);
    assertThat(result, instanceOf(Substitution.class));
    final Substitution substitution = (Substitution) result;
    assertThat(substitution.toString(), is(expected));

    // The substitution makes the types equal
    assertThat(substitution.apply(t1), is(substitution.apply(t2)));

    // The substitution is idempotent
    for (Type type : substitution.asMap().values()) {
      for (TypeVar typeVar : substitution.domain()) {
        assertThat(type.contains(typeVar), is(false));
      }
    }
    assertThat(
        substitution.apply(substitution.apply(t1)),
        is(substitution.apply(t1)));
    return substitution;
  }

  /** Unifies two types, and checks that the result is an error. */
  void assertCannotUnify(
      Type t1, Type t2, TypeError.Kind kind, String expected) {
    final TypeUnifier.Result result = unifier.unify(t1, t2);
    assertThat(result, instanceOf(TypeError.class));
    final TypeError error = ((TypeUnifier.Failure) result).error();
    assertThat(error.kind, is(kind));
    assertThat(error.message(), is(expected));
  }

  void assertMismatch(Type t1, Type t2, String expected) {
    assertCannotUnify(t1, t2, TypeError.Kind.TYPE_MISMATCH, expected);
  }

  void assertCycle(Type t1, Type t2, String expected) {
    assertCannotUnify(t1, t2, TypeError.Kind.OCCURS_CHECK_FAILURE, expected);
  }

  @Test
  void testEqual() {
    assertUnify(INT, INT, "[]");
    assertUnify(A, A, "[]");
    assertUnify(fn(A, INT), fn(A, INT), "[]");
    assertThat(
        unifier.unify(BOOL, BOOL), is((TypeUnifier.Result) Substitution.EMPTY));
  }

  @Test
  void testVariable() {
    assertUnify(A, INT, "['a -> int]");
    assertUnify(INT, A, "['a -> int]");
    assertUnify(A, fn(B, BOOL), "['a -> 'b -> bool]");
    assertUnify(fn(B, BOOL), A, "['a -> 'b -> bool]");
  }

  /** When both types are variables, the left variable is bound. */
  @Test
  void testTieBreak() {
    assertUnify(A, B, "['a -> 'b]");
    assertUnify(B, A, "['b -> 'a]");
  }

  @Test
  void testFunction() {
    assertUnify(fn(A, BOOL), fn(INT, B), "['a -> int, 'b -> bool]");
    assertUnify(
        fn(fn(A, B), C),
        fn(fn(INT, BOOL), A),
        "['a -> int, 'b -> bool, 'c -> int]");
  }

  /** The result is the most general unifier. */
  @Test
  void testMostGeneral() {
    // 'a -> 'a and 'b -> int; 'a and 'b are both int
    assertUnify(fn(A, A), fn(B, INT), "['a -> int, 'b -> int]");

    // 'a -> 'b and 'c -> 'c; the unifier does not bind more than it must
    final Substitution s =
        assertUnify(fn(A, B), fn(C, C), "['a -> 'c, 'b -> 'c]");
    assertThat(s.apply(fn(A, B)).toString(), is("'c -> 'c"));
  }

  @Test
  void testMismatch() {
    assertMismatch(INT, BOOL, "type mismatch: expected int, actual bool");
    assertMismatch(
        INT, fn(A, B), "type mismatch: expected int, actual 'a -> 'b");
    assertMismatch(
        fn(A, B), INT, "type mismatch: expected 'a -> 'b, actual int");

    // The mismatch is found after 'a has been bound to int
    assertMismatch(
        fn(A, A), fn(INT, BOOL), "type mismatch: expected int, actual bool");
  }

  @Test
  void testOccursCheck() {
    assertCycle(A, fn(A, INT), "circularity: 'a occurs in 'a -> int");
    assertCycle(fn(A, INT), A, "circularity: 'a occurs in 'a -> int");
    assertCycle(
        fn(A, B), fn(B, fn(A, INT)), "circularity: 'b occurs in 'b -> int");
  }

  /**
   * Applying the composition of two substitutions is the same as applying
   * one, then the other.
   */
  @Test
  void testCompose() {
    final Substitution s1 = assertUnify(A, fn(B, C), "['a -> 'b -> 'c]");
    final Substitution s2 = assertUnify(B, INT, "['b -> int]");
    final Substitution s12 = s1.compose(s2);
    assertThat(s12.toString(), is("['a -> int -> 'c, 'b -> int]"));
    for (Type type : new Type[] {A, B, C, fn(A, B), fn(fn(C, A), B)}) {
      assertThat(s12.apply(type), is(s2.apply(s1.apply(type))));
    }

    // Entries of the first substitution take precedence
    final Substitution s3 = assertUnify(A, BOOL, "['a -> bool]");
    assertThat(s1.compose(s3).toString(), is("['a -> 'b -> 'c]"));
    assertThat(s3.compose(s1).toString(), is("['a -> bool]"));

    assertThat(s1.compose(Substitution.EMPTY), is(s1));
    assertThat(Substitution.EMPTY.compose(s1), is(s1));
  }

  @Test
  void testTracer() {
    final List<String> list = new ArrayList<>();
    final TypeUnifier unifier =
        new TypeUnifier(
            Tracers.nullTracer()
                .withBindHandler((v, t) -> list.add("bind " + v + " " + t))
                .withDecomposeHandler(
                    (t1, t2) -> list.add("decompose " + t1 + " " + t2))
                .withConflictHandler(
                    (t1, t2) -> list.add("conflict " + t1 + " " + t2))
                .withCycleHandler((v, t) -> list.add("cycle " + v + " " + t)));
    unifier.unify(fn(A, BOOL), fn(INT, INT));
    assertThat(
        list,
        equalsOrdered(
            "decompose 'a -> bool int -> int",
            "bind 'a int",
            "conflict bool int"));

    list.clear();
    unifier.unify(A, fn(A, A));
    assertThat(list, equalsOrdered("cycle 'a 'a -> 'a"));
  }
}

// End UnifierTest.java
