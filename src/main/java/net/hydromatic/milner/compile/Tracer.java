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

import net.hydromatic.milner.ast.Ast;
import net.hydromatic.milner.type.ForallType;
import net.hydromatic.milner.type.Type;

/** Called on various events during type inference. */
public interface Tracer {
  /**
   * Called when the type scheme of an identifier is instantiated to a type at
   * the point of use.
   */
  void onInstantiate(Ast.Id id, ForallType scheme, Type type);

  /** Called when a declared name is bound to its generalized type. */
  void onGeneralize(String name, ForallType scheme);

  /** Called with the type deduced for a whole expression. */
  void onResult(Type type);

  /** Called with the exception that aborted type inference. */
  void onTypeException(TypeException e);
}

// End Tracer.java
