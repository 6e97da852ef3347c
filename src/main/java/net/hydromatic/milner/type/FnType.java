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
import java.util.function.UnaryOperator;
import net.hydromatic.milner.ast.Op;

/** The type of a function value. */
public class FnType implements Type {
  public final Type paramType;
  public final Type resultType;

  FnType(Type paramType, Type resultType) {
    this.paramType = requireNonNull(paramType);
    this.resultType = requireNonNull(resultType);
  }

  @Override
  public Op op() {
    return Op.FUNCTION_TYPE;
  }

  @Override
  public int hashCode() {
    return Objects.hash(paramType, resultType);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof FnType
            && paramType.equals(((FnType) o).paramType)
            && resultType.equals(((FnType) o).resultType);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder(), 0, 0).toString();
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public FnType copy(UnaryOperator<Type> transform) {
    final Type paramType2 = transform.apply(paramType);
    final Type resultType2 = transform.apply(resultType);
    return paramType2 == paramType && resultType2 == resultType
        ? this
        : new FnType(paramType2, resultType2);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, int left, int right) {
    final Op op = op();
    if (left > op.left || op.right < right) {
      buf.append('(');
      describe(buf, 0, 0);
      return buf.append(')');
    }
    paramType.describe(buf, left, op.left);
    buf.append(op.padded);
    return resultType.describe(buf, op.right, right);
  }

  @Override
  public boolean contains(TypeVar typeVar) {
    return paramType.contains(typeVar) || resultType.contains(typeVar);
  }
}

// End FnType.java
