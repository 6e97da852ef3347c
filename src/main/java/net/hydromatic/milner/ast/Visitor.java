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
package net.hydromatic.milner.ast;

/**
 * Visits syntax trees.
 *
 * <p>Each {@code visit} method visits the node's children; override to do
 * something before or after.
 */
public class Visitor {
  public void visit(Ast.Id id) {}

  public void visit(Ast.Literal literal) {}

  public void visit(Ast.Fn fn) {
    fn.exp.accept(this);
  }

  public void visit(Ast.Apply apply) {
    apply.fn.accept(this);
    apply.arg.accept(this);
  }

  public void visit(Ast.If ifThen) {
    ifThen.condition.accept(this);
    ifThen.ifTrue.accept(this);
    ifThen.ifFalse.accept(this);
  }

  public void visit(Ast.Let let) {
    let.decl.accept(this);
    let.exp.accept(this);
  }

  public void visit(Ast.ValDecl valDecl) {
    valDecl.exp.accept(this);
  }
}

// End Visitor.java
