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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.util.function.UnaryOperator;
import net.hydromatic.milner.ast.Op;

/**
 * Type variable (e.g. {@code 'a}).
 *
 * <p>A type variable is identified by its ordinal, which is unique within the
 * {@link TypeSystem} that allocated it. Ordering is by ordinal.
 */
public class TypeVar implements Type, Comparable<TypeVar> {
  private static final char[] ALPHAS =
      "abcdefghijklmnopqrstuvwxyz".toCharArray();

  private static final LoadingCache<Integer, String> NAME_CACHE =
      CacheBuilder.newBuilder().build(CacheLoader.from(TypeVar::name));

  public final int ordinal;
  private final String name;

  /**
   * Creates a type variable with a given ordinal.
   *
   * <p>Ordinal 0 is printed "'a", ordinal 1 is printed "'b", etc.
   *
   * <p>To create a variable that is distinct from all others in a session,
   * call {@link TypeSystem#newTypeVar()}.
   */
  TypeVar(int ordinal) {
    checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
    this.ordinal = ordinal;
    this.name = requireNonNull(NAME_CACHE.getUnchecked(ordinal));
  }

  @Override
  public int hashCode() {
    return ordinal + 6563;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeVar && this.ordinal == ((TypeVar) obj).ordinal;
  }

  @Override
  public int compareTo(TypeVar o) {
    return Integer.compare(ordinal, o.ordinal);
  }

  /** Returns a string for debugging. */
  @Override
  public String toString() {
    return name;
  }

  /**
   * Generates a name for a type variable.
   *
   * <p>0 &rarr; 'a, 1 &rarr; 'b, 25 &rarr; 'z, 26 &rarr; 'ba, 27 &rarr; 'bb,
   * 675 &rarr; 'zz, 676 &rarr; 'baa, etc. (Think of it is a base 26 number,
   * with "a" as 0, "z" as 25.)
   */
  static String name(int i) {
    if (i < 0) {
      throw new IllegalArgumentException();
    }
    final StringBuilder s = new StringBuilder();
    for (; ; ) {
      final int mod = i % 26;
      s.append(ALPHAS[mod]);
      i /= 26;
      if (i == 0) {
        return s.append("'").reverse().toString();
      }
    }
  }

  @Override
  public Op op() {
    return Op.TY_VAR;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public Type copy(UnaryOperator<Type> transform) {
    return transform.apply(this);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, int left, int right) {
    return buf.append(name);
  }

  @Override
  public boolean contains(TypeVar typeVar) {
    return equals(typeVar);
  }
}

// End TypeVar.java
