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
package net.hydromatic.transmute.rule;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each verdict,
   * then calls the underlying tracer. */
  public static Tracer withOnVerdict(Tracer tracer,
      Consumer<Check> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onVerdict(Check check) {
        consumer.accept(check);
        super.onVerdict(check);
      }
    };
  }

  /** Returns a tracer that performs the given action on each diagnostic,
   * then calls the underlying tracer. */
  public static Tracer withOnDiagnostic(Tracer tracer,
      Consumer<Diagnostic> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDiagnostic(Diagnostic diagnostic) {
        consumer.accept(diagnostic);
        super.onDiagnostic(diagnostic);
      }
    };
  }

  public static Tracer withOnEdits(Tracer tracer,
      BiConsumer<Diagnostic, List<Edit>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onEdits(Diagnostic diagnostic, List<Edit> edits) {
        consumer.accept(diagnostic, edits);
        super.onEdits(diagnostic, edits);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onVerdict(Check check) {
    }

    @Override public void onDiagnostic(Diagnostic diagnostic) {
    }

    @Override public void onEdits(Diagnostic diagnostic, List<Edit> edits) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onVerdict(Check check) {
      tracer.onVerdict(check);
    }

    @Override public void onDiagnostic(Diagnostic diagnostic) {
      tracer.onDiagnostic(diagnostic);
    }

    @Override public void onEdits(Diagnostic diagnostic, List<Edit> edits) {
      tracer.onEdits(diagnostic, edits);
    }
  }
}

// End Tracers.java
