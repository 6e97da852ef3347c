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

import net.hydromatic.milner.type.TypeError;

/**
 * Exception that aborts type inference.
 *
 * <p>Carries the {@link TypeError} that describes the first inconsistency
 * found. {@link Session#infer} catches it and returns the error as a value.
 */
public class TypeException extends CompileException {
  public final TypeError error;

  public TypeException(TypeError error) {
    super(error.message());
    this.error = requireNonNull(error);
  }
}

// End TypeException.java
