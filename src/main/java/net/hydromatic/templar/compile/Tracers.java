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
package net.hydromatic.templar.compile;

import net.hydromatic.templar.irb.IrB;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the module produced
   * by a given pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, String passName,
      Consumer<IrB.Module> consumer) {
    final String expectedPassName = passName;
    return new DelegatingTracer(tracer) {
      @Override public void onPass(String passName, IrB.Module module) {
        if (passName.equals(expectedPassName)) {
          consumer.accept(module);
        }
        super.onPass(passName, module);
      }
    };
  }

  /** Returns a tracer that performs the given action on the module produced
   * by every pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer,
      BiConsumer<String, IrB.Module> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPass(String passName, IrB.Module module) {
        consumer.accept(passName, module);
        super.onPass(passName, module);
      }
    };
  }

  /** Returns a tracer that performs the given action on the text of each
   * dumped module, then calls the underlying tracer. */
  public static Tracer withOnDump(Tracer tracer,
      BiConsumer<String, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDump(String passName, String text) {
        consumer.accept(passName, text);
        super.onDump(passName, text);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onPass(String passName, IrB.Module module) {
    }

    @Override public void onDump(String passName, String text) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onPass(String passName, IrB.Module module) {
      tracer.onPass(passName, module);
    }

    @Override public void onDump(String passName, String text) {
      tracer.onDump(passName, text);
    }
  }
}

// End Tracers.java
