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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A diagnostic and the edits that fix it.
 *
 * <p>The edits are empty if autocorrection was not requested.
 */
public class Offense {
  public final Diagnostic diagnostic;
  public final List<Edit> edits;

  public Offense(Diagnostic diagnostic, List<Edit> edits) {
    this.diagnostic = requireNonNull(diagnostic);
    this.edits = ImmutableList.copyOf(edits);
  }

  /** Returns whether any edit of this offense overlaps any edit of
   * another. */
  public boolean overlaps(Offense offense) {
    for (Edit edit : edits) {
      for (Edit edit2 : offense.edits) {
        if (edit.overlaps(edit2)) {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return diagnostic + " " + edits;
  }
}

// End Offense.java
