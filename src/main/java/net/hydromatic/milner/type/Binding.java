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
 * Binding of a name to a type scheme.
 *
 * <p>Used in {@link net.hydromatic.milner.compile.Environment}. A function
 * parameter is bound to a scheme with no quantified variables; a name declared
 * by "{@code let}" is bound to the generalized type of its value.
 */
public class Binding {
  public final String name;
  public final ForallType scheme;

  private Binding(String name, ForallType scheme) {
    this.name = requireNonNull(name);
    this.scheme = requireNonNull(scheme);
  }

  /** Creates a binding of a name to a type scheme. */
  public static Binding of(String name, ForallType scheme) {
    return new Binding(name, scheme);
  }

  /** Creates a binding of a name to a type, with no quantified variables. */
  public static Binding mono(String name, Type type) {
    return new Binding(name, ForallType.mono(type));
  }

  /** Returns a binding with the same name and a given scheme. */
  public Binding withScheme(ForallType scheme) {
    return scheme.equals(this.scheme) ? this : new Binding(name, scheme);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, scheme);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof Binding
            && name.equals(((Binding) o).name)
            && scheme.equals(((Binding) o).scheme);
  }

  @Override
  public String toString() {
    return name + " : " + scheme;
  }
}

// End Binding.java
