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

/**
 * Outcome of checking one rule against one node.
 *
 * @see Inspector#check
 */
public enum Verdict {
  /** The node is not one of the surface shapes. */
  NO_MATCH,
  /** The rule is disabled, or the target version is too old. */
  SKIPPED,
  /** The shape matched, but the pair does not belong to this rule. */
  REJECTED,
  /** The kept expression reads the parameter that would be dropped. */
  REJECTED_REFERENCE,
  /** A diagnostic was reported; autocorrection was not requested. */
  REPORTED_ONLY,
  /** A diagnostic was reported and edits were planned. */
  EDITS_PLANNED;

  /** Returns whether a diagnostic was reported. */
  public boolean isReported() {
    return this == REPORTED_ONLY || this == EDITS_PLANNED;
  }
}

// End Verdict.java
