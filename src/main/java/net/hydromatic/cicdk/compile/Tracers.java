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
package net.hydromatic.cicdk.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.cicdk.ast.Cic;
import net.hydromatic.cicdk.ast.Dk;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on an emitted
   * instruction, then calls the underlying tracer.
   */
  public static Tracer withOnDeclaration(Tracer tracer,
      Consumer<Dk.Instruction> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDeclaration(Dk.Instruction instruction) {
        consumer.accept(instruction);
        super.onDeclaration(instruction);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a cast, then calls
   * the underlying tracer.
   */
  public static Tracer withOnCast(Tracer tracer,
      BiConsumer<Cic.Term, Cic.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCast(Cic.Term term, Cic.Term expectedType) {
        consumer.accept(term, expectedType);
        super.onCast(term, expectedType);
      }
    };
  }

  public static Tracer withOnFixpointCacheHit(Tracer tracer,
      Consumer<FixpointCache.Key> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFixpointCacheHit(FixpointCache.Key key) {
        consumer.accept(key);
        super.onFixpointCacheHit(key);
      }
    };
  }

  public static Tracer withOnLetLifted(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLetLifted(String name) {
        consumer.accept(name);
        super.onLetLifted(name);
      }
    };
  }

  public static Tracer withOnFailure(Tracer tracer,
      BiConsumer<String, TranslationException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFailure(String declaration, TranslationException e) {
        consumer.accept(declaration, e);
        super.onFailure(declaration, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onDeclaration(Dk.Instruction instruction) {}

    @Override
    public void onCast(Cic.Term term, Cic.Term expectedType) {}

    @Override
    public void onFixpointCacheHit(FixpointCache.Key key) {}

    @Override
    public void onLetLifted(String name) {}

    @Override
    public void onFailure(String declaration, TranslationException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onDeclaration(Dk.Instruction instruction) {
      tracer.onDeclaration(instruction);
    }

    @Override
    public void onCast(Cic.Term term, Cic.Term expectedType) {
      tracer.onCast(term, expectedType);
    }

    @Override
    public void onFixpointCacheHit(FixpointCache.Key key) {
      tracer.onFixpointCacheHit(key);
    }

    @Override
    public void onLetLifted(String name) {
      tracer.onLetLifted(name);
    }

    @Override
    public void onFailure(String declaration, TranslationException e) {
      tracer.onFailure(declaration, e);
    }
  }
}

// End Tracers.java
