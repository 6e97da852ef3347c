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
package net.hydromatic.milner.util;

import static java.util.Objects.requireNonNull;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.function.BiConsumer;
import net.hydromatic.milner.type.FnType;
import net.hydromatic.milner.type.Type;
import net.hydromatic.milner.type.TypeUnifier;
import net.hydromatic.milner.type.TypeVar;

/** Implementations of {@link TypeUnifier.Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static ConfigurableTracer nullTracer() {
    return ConfigurableTracerImpl.INITIAL;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static ConfigurableTracer printTracer(PrintWriter w) {
    final PrintTracer p = new PrintTracer(w);
    return ConfigurableTracerImpl.INITIAL
        .withUnifyHandler(p::onUnify)
        .withDecomposeHandler(p::onDecompose)
        .withBindHandler(p::onBind)
        .withConflictHandler(p::onConflict)
        .withCycleHandler(p::onCycle);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static ConfigurableTracer printTracer(OutputStream stream) {
    return printTracer(
        new PrintWriter(
            new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
  }

  /**
   * Implementation of {@link TypeUnifier.Tracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements TypeUnifier.Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(b);
      w.flush();
      b.setLength(0);
    }

    public void onUnify(Type left, Type right) {
      b.append("unify ").append(left).append(' ').append(right);
      flush();
    }

    public void onDecompose(FnType left, FnType right) {
      b.append("decompose ").append(left).append(' ').append(right);
      flush();
    }

    public void onBind(TypeVar typeVar, Type type) {
      b.append("bind ").append(typeVar).append(' ').append(type);
      flush();
    }

    public void onConflict(Type left, Type right) {
      b.append("conflict ").append(left).append(' ').append(right);
      flush();
    }

    public void onCycle(TypeVar typeVar, Type type) {
      b.append("cycle ").append(typeVar).append(' ').append(type);
      flush();
    }
  }

  /** Tracer that allows each of its methods to be modified using a handler. */
  public interface ConfigurableTracer extends TypeUnifier.Tracer {
    /** Sets handler for {@link #onUnify(Type, Type)}. */
    ConfigurableTracer withUnifyHandler(BiConsumer<Type, Type> handler);
    /** Sets handler for {@link #onDecompose(FnType, FnType)}. */
    ConfigurableTracer withDecomposeHandler(
        BiConsumer<FnType, FnType> handler);
    /** Sets handler for {@link #onBind(TypeVar, Type)}. */
    ConfigurableTracer withBindHandler(BiConsumer<TypeVar, Type> handler);
    /** Sets handler for {@link #onConflict(Type, Type)}. */
    ConfigurableTracer withConflictHandler(BiConsumer<Type, Type> handler);
    /** Sets handler for {@link #onCycle(TypeVar, Type)}. */
    ConfigurableTracer withCycleHandler(BiConsumer<TypeVar, Type> handler);
  }

  /**
   * Implementation of {@link ConfigurableTracer} that has a field for each
   * handler.
   */
  private static class ConfigurableTracerImpl implements ConfigurableTracer {
    static final ConfigurableTracerImpl INITIAL =
        new ConfigurableTracerImpl(
            (left, right) -> {},
            (left, right) -> {},
            (typeVar, type) -> {},
            (left, right) -> {},
            (typeVar, type) -> {});

    private final BiConsumer<Type, Type> unifyHandler;
    private final BiConsumer<FnType, FnType> decomposeHandler;
    private final BiConsumer<TypeVar, Type> bindHandler;
    private final BiConsumer<Type, Type> conflictHandler;
    private final BiConsumer<TypeVar, Type> cycleHandler;

    private ConfigurableTracerImpl(
        BiConsumer<Type, Type> unifyHandler,
        BiConsumer<FnType, FnType> decomposeHandler,
        BiConsumer<TypeVar, Type> bindHandler,
        BiConsumer<Type, Type> conflictHandler,
        BiConsumer<TypeVar, Type> cycleHandler) {
      this.unifyHandler = requireNonNull(unifyHandler);
      this.decomposeHandler = requireNonNull(decomposeHandler);
      this.bindHandler = requireNonNull(bindHandler);
      this.conflictHandler = requireNonNull(conflictHandler);
      this.cycleHandler = requireNonNull(cycleHandler);
    }

    @Override
    public ConfigurableTracer withUnifyHandler(
        BiConsumer<Type, Type> unifyHandler) {
      return new ConfigurableTracerImpl(
          unifyHandler, decomposeHandler, bindHandler, conflictHandler,
          cycleHandler);
    }

    @Override
    public ConfigurableTracer withDecomposeHandler(
        BiConsumer<FnType, FnType> decomposeHandler) {
      return new ConfigurableTracerImpl(
          unifyHandler, decomposeHandler, bindHandler, conflictHandler,
          cycleHandler);
    }

    @Override
    public ConfigurableTracer withBindHandler(
        BiConsumer<TypeVar, Type> bindHandler) {
      return new ConfigurableTracerImpl(
          unifyHandler, decomposeHandler, bindHandler, conflictHandler,
          cycleHandler);
    }

    @Override
    public ConfigurableTracer withConflictHandler(
        BiConsumer<Type, Type> conflictHandler) {
      return new ConfigurableTracerImpl(
          unifyHandler, decomposeHandler, bindHandler, conflictHandler,
          cycleHandler);
    }

    @Override
    public ConfigurableTracer withCycleHandler(
        BiConsumer<TypeVar, Type> cycleHandler) {
      return new ConfigurableTracerImpl(
          unifyHandler, decomposeHandler, bindHandler, conflictHandler,
          cycleHandler);
    }

    @Override
    public void onUnify(Type left, Type right) {
      unifyHandler.accept(left, right);
    }

    @Override
    public void onDecompose(FnType left, FnType right) {
      decomposeHandler.accept(left, right);
    }

    @Override
    public void onBind(TypeVar typeVar, Type type) {
      bindHandler.accept(typeVar, type);
    }

    @Override
    public void onConflict(Type left, Type right) {
      conflictHandler.accept(left, right);
    }

    @Override
    public void onCycle(TypeVar typeVar, Type type) {
      cycleHandler.accept(typeVar, type);
    }
  }
}

// End Tracers.java
