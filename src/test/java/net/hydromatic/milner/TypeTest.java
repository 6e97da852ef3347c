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
import static net.hydromatic.milner.type.PrimitiveType.UNIT;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.milner.type.ForallType;
import net.hydromatic.milner.type.PrimitiveType;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeSystem;
import net.hydromatic.milner.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for types and the type system. */
public class TypeTest {
  final TypeSystem typeSystem = new TypeSystem();

  // CHECKSTYLE: IGNORE 3
  final TypeVar A = typeSystem.typeVariable(0);
  final TypeVar B = typeSystem.typeVariable(1);
  final TypeVar C = typeSystem.typeVariable(2);

  Type fn(Type paramType, Type resultType) {
    return typeSystem.fnType(paramType, resultType);
  }

  @Test
  void testTypeVarName() {
    assertThat(A.toString(), is("'a"));
    assertThat(typeSystem.typeVariable(25).toString(), is("'z"));
    assertThat(typeSystem.typeVariable(26).toString(), is("'ba"));
    assertThat(typeSystem.typeVariable(27).toString(), is("'bb"));
    assertThat(typeSystem.typeVariable(675).toString(), is("'zz"));
    assertThat(typeSystem.typeVariable(676).toString(), is("'baa"));
    assertThrows(
        IllegalArgumentException.class, () -> typeSystem.typeVariable(-1));
  }

  /** Variables are compared by ordinal, not by object identity. */
  @Test
  void testTypeVarEquality() {
    final TypeVar a2 = new TypeSystem().typeVariable(0);
    assertThat(a2, is(A));
    assertThat(a2.hashCode(), is(A.hashCode()));
    assertThat(A.compareTo(B) < 0, is(true));
    assertThat(fn(A, INT), is(fn(a2, INT)));
    assertThat(fn(A, INT), not(is(fn(INT, A))));
  }

  @Test
  void testNewTypeVar() {
    final TypeSystem typeSystem = new TypeSystem();
    assertThat(typeSystem.newTypeVar().toString(), is("'a"));
    assertThat(typeSystem.newTypeVar().toString(), is("'b"));

    // Reserving an ordinal skips past it; reserving a lower one has no effect
    typeSystem.typeVariable(5);
    typeSystem.reserve(3);
    assertThat(typeSystem.typeVarCount(), is(6));
    assertThat(typeSystem.newTypeVar().toString(), is("'g"));
  }

  @Test
  void testDescribe() {
    assertThat(INT.toString(), is("int"));
    assertThat(UNIT.toString(), is("unit"));
    assertThat(fn(INT, BOOL).toString(), is("int -> bool"));

    // Arrow is right-associative
    assertThat(fn(INT, fn(BOOL, INT)).toString(), is("int -> bool -> int"));
    assertThat(fn(fn(INT, BOOL), INT).toString(), is("(int -> bool) -> int"));
    assertThat(
        fn(fn(A, B), fn(fn(B, C), fn(A, C))).toString(),
        is("('a -> 'b) -> ('b -> 'c) -> 'a -> 'c"));
    assertThat(
        typeSystem.fnType(INT, BOOL, UNIT).toString(),
        is("int -> bool -> unit"));
    assertThat(
        typeSystem.fnType(fn(A, A), A, BOOL, UNIT).toString(),
        is("('a -> 'a) -> 'a -> bool -> unit"));
  }

  @Test
  void testLookup() {
    assertThat(typeSystem.lookup("int"), is(INT));
    assertThat(typeSystem.lookup("bool"), is(BOOL));
    assertThat(typeSystem.lookupOpt("string"), nullValue());
    assertThrows(AssertionError.class, () -> typeSystem.lookup("real"));
    assertThat(PrimitiveType.valueOf("UNIT").moniker, is("unit"));
  }

  @Test
  void testFreeTypeVars() {
    assertThat(INT.freeTypeVars().isEmpty(), is(true));
    assertThat(INT.isGround(), is(true));
    assertThat(A.freeTypeVars(), equalsOrdered(A));
    final Type t = fn(B, fn(A, B));
    assertThat(t.freeTypeVars(), equalsOrdered(A, B));
    assertThat(t.isGround(), is(false));
    assertThat(t.contains(A), is(true));
    assertThat(t.contains(C), is(false));
    assertThat(fn(INT, fn(BOOL, UNIT)).isGround(), is(true));
  }

  @Test
  void testForallType() {
    // Variables that do not occur in the body are not quantified
    final ForallType f = ForallType.of(ImmutableList.of(A, B), fn(A, INT));
    assertThat(f.typeVars, equalsOrdered(A));
    assertThat(f.toString(), is("forall 'a. 'a -> int"));
    assertThat(f.isMono(), is(false));

    final ForallType m = ForallType.mono(fn(A, INT));
    assertThat(m.isMono(), is(true));
    assertThat(m.toString(), is("'a -> int"));
    assertThat(m.freeTypeVars(), equalsOrdered(A));
    assertThat(m, not(is(f)));

    // 'b is fixed by the environment, so is not quantified
    final ForallType g = ForallType.generalize(fn(A, B), ImmutableSet.of(B));
    assertThat(g.toString(), is("forall 'a. 'a -> 'b"));
    assertThat(g.freeTypeVars(), equalsOrdered(B));
    assertThat(
        ForallType.generalize(fn(C, fn(A, B)), ImmutableSet.of()).toString(),
        is("forall 'a 'b 'c. 'c -> 'a -> 'b"));
  }

  @Test
  void testInstantiate() {
    final ForallType g = ForallType.generalize(fn(A, B), ImmutableSet.of(B));
    final Type t1 = g.instantiate(typeSystem);
    final Type t2 = g.instantiate(typeSystem);
    assertThat(t1.toString(), is("'d -> 'b"));
    assertThat(t2.toString(), is("'e -> 'b"));

    // A scheme with no quantified variables instantiates to its body
    final ForallType m = ForallType.mono(fn(A, B));
    assertThat(m.instantiate(typeSystem), is(m.type));
  }

  @Test
  void testNormalize() {
    assertThat(
        typeSystem.normalize(fn(C, fn(B, C))).toString(),
        is("'a -> 'b -> 'a"));
    assertThat(
        typeSystem.normalize(fn(fn(B, A), INT)).toString(),
        is("('a -> 'b) -> int"));
    assertThat(typeSystem.normalize(INT), is(INT));

    final ForallType f = ForallType.of(ImmutableList.of(C), fn(C, B));
    assertThat(f.toString(), is("forall 'c. 'c -> 'b"));
    assertThat(typeSystem.normalize(f).toString(), is("forall 'a. 'a -> 'b"));

    // Normalizing does not allocate variables
    assertThat(typeSystem.typeVarCount(), is(3));
  }
}

// End TypeTest.java
