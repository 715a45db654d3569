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
package net.hydromatic.transmute.correct;

import static java.util.Objects.requireNonNull;

import net.hydromatic.transmute.ast.Pos;
import net.hydromatic.transmute.rule.Edit;
import net.hydromatic.transmute.util.TransmuteException;

/** Exception thrown when two edits change the same piece of text. */
public class ClobberingException extends RuntimeException
    implements TransmuteException {
  public final Edit edit;
  public final Edit edit2;

  ClobberingException(Edit edit, Edit edit2) {
    super("edit [" + edit + "] overlaps edit [" + edit2 + "]");
    this.edit = requireNonNull(edit);
    this.edit2 = requireNonNull(edit2);
  }

  /** Returns the position of the second edit, where the clash starts. */
  @Override
  public Pos pos() {
    return edit2.pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos().describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End ClobberingException.java
