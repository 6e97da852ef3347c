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

import com.google.common.collect.Lists;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.milner.ast.AstNode;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeError;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Milner tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a type by its description, e.g. "'a -> int". */
  public static Matcher<Type> hasMoniker(String expected) {
    return new CustomTypeSafeMatcher<Type>("type with moniker " + expected) {
      @Override
      protected boolean matchesSafely(Type type) {
        return type.toString().equals(expected);
      }
    };
  }

  /** Matches an AST node by its string representation. */
  public static <T extends AstNode> Matcher<T> isAst(
      Class<? extends T> clazz, String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override
      protected boolean matchesSafely(T t) {
        return clazz.isInstance(t) && t.toString().equals(expected);
      }
    };
  }

  /** Matches a type error by kind and message. */
  public static Matcher<TypeError> isTypeError(
      TypeError.Kind kind, String message) {
    return new TypeSafeMatcher<TypeError>() {
      @Override
      protected boolean matchesSafely(TypeError error) {
        return error.kind == kind && error.message().equals(message);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("type error " + kind + " \"" + message + "\"");
      }
    };
  }

  /** Matches a throwable of a given class whose message contains a string. */
  public static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, String message) {
    return new CustomTypeSafeMatcher<Throwable>(
        clazz + " with message " + message) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && item.getMessage() != null
            && item.getMessage().contains(message);
      }
    };
  }

  @SafeVarargs
  public static <E> Matcher<Iterable<E>> equalsOrdered(E... elements) {
    final List<E> expectedList = Arrays.asList(elements);
    return new TypeSafeMatcher<Iterable<E>>() {
      @Override
      protected boolean matchesSafely(Iterable<E> item) {
        return Lists.newArrayList(item).equals(expectedList);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("equalsOrdered").appendValue(expectedList);
      }
    };
  }
}

// End Matchers.java
