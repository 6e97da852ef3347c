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

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.milner.ast.Ast;
import net.hydromatic.milner.type.ForallType;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.util.TriConsumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that writes a line for each event to a writer, then calls
   * the underlying tracer.
   */
  public static Tracer printing(Tracer tracer, PrintWriter w) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInstantiate(Ast.Id id, ForallType scheme, Type type) {
        w.println("instantiate " + id + " : " + scheme + " as " + type);
        w.flush();
        super.onInstantiate(id, scheme, type);
      }

      @Override
      public void onGeneralize(String name, ForallType scheme) {
        w.println("generalize " + name + " : " + scheme);
        w.flush();
        super.onGeneralize(name, scheme);
      }

      @Override
      public void onResult(Type type) {
        w.println("result " + type);
        w.flush();
        super.onResult(type);
      }

      @Override
      public void onTypeException(TypeException e) {
        w.println(e.describeTo(new StringBuilder()));
        w.flush();
        super.onTypeException(e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when an identifier is
   * instantiated, then calls the underlying tracer.
   */
  public static Tracer withOnInstantiate(
      Tracer tracer, TriConsumer<Ast.Id, ForallType, Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInstantiate(Ast.Id id, ForallType scheme, Type type) {
        consumer.accept(id, scheme, type);
        super.onInstantiate(id, scheme, type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a declared name is
   * generalized, then calls the underlying tracer.
   */
  public static Tracer withOnGeneralize(
      Tracer tracer, BiConsumer<String, ForallType> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onGeneralize(String name, ForallType scheme) {
        consumer.accept(name, scheme);
        super.onGeneralize(name, scheme);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of an
   * inference, then calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer, Consumer<Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Type type) {
        consumer.accept(type);
        super.onResult(type);
      }
    };
  }

  public static Tracer withOnTypeException(
      Tracer tracer, Consumer<TypeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTypeException(TypeException e) {
        consumer.accept(e);
        super.onTypeException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onInstantiate(Ast.Id id, ForallType scheme, Type type) {}

    @Override
    public void onGeneralize(String name, ForallType scheme) {}

    @Override
    public void onResult(Type type) {}

    @Override
    public void onTypeException(TypeException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onInstantiate(Ast.Id id, ForallType scheme, Type type) {
      tracer.onInstantiate(id, scheme, type);
    }

    @Override
    public void onGeneralize(String name, ForallType scheme) {
      tracer.onGeneralize(name, scheme);
    }

    @Override
    public void onResult(Type type) {
      tracer.onResult(type);
    }

    @Override
    public void onTypeException(TypeException e) {
      tracer.onTypeException(e);
    }
  }
}

// End Tracers.java
