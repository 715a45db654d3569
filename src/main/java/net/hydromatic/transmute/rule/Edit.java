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

import java.util.Objects;
import net.hydromatic.transmute.ast.Pos;

/** Replacement of a range of source text. */
public class Edit {
  public final Pos pos;
  public final String replacement;

  private Edit(Pos pos, String replacement) {
    this.pos = requireNonNull(pos);
    this.replacement = requireNonNull(replacement);
  }

  /** Creates an edit that deletes a range. */
  public static Edit remove(Pos pos) {
    return new Edit(pos, "");
  }

  /** Creates an edit that replaces a range with new text. */
  public static Edit replace(Pos pos, String replacement) {
    return new Edit(pos, replacement);
  }

  /** Returns whether this edit touches any character that another edit
   * touches. */
  public boolean overlaps(Edit edit) {
    return pos.overlaps(edit.pos);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pos.startOffset, pos.endOffset, replacement);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Edit
            && pos.equals(((Edit) o).pos)
            && replacement.equals(((Edit) o).replacement);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    if (replacement.isEmpty()) {
      buf.append("remove ");
      pos.describeTo(buf);
    } else {
      buf.append("replace ");
      pos.describeTo(buf);
      buf.append(" with '").append(replacement).append('\'');
    }
    return buf.toString();
  }
}

// End Edit.java
