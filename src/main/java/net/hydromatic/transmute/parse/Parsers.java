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
package net.hydromatic.transmute.parse;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given a quoted string returns its value.
   *
   * <p>For a double-quoted string, {@code "abc"} returns {@code abc} and
   * {@code "\t"} returns the tab character. For a single-quoted string, the
   * only escapes are {@code \\} and {@code \'}; {@code 'a\tb'} returns the
   * four characters {@code a\tb}.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    final char quote = s.charAt(0);
    checkArgument(quote == '"' || quote == '\'');
    checkArgument(s.charAt(s.length() - 1) == quote);
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != '\\') {
        b.append(c);
        continue;
      }
      if (++i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      final char c2 = s.charAt(i);
      if (quote == '\'') {
        if (c2 != '\\' && c2 != '\'') {
          b.append('\\');
        }
        b.append(c2);
      } else {
        b.append(unescape(c2));
      }
    }
    return b.toString();
  }

  /** Returns the character denoted by an escape sequence "\c". */
  private static char unescape(char c) {
    switch (c) {
      case 'a':
        return 7;
      case 'b':
        return '\b';
      case 'e':
        return 27;
      case 'f':
        return '\f';
      case 'n':
        return '\n';
      case 'r':
        return '\r';
      case 's':
        return ' ';
      case 't':
        return '\t';
      case 'v':
        return 11;
      case '0':
        return 0;
      default:
        // "\\" is backslash, "\"" is double-quote; any other character
        // escapes to itself.
        return c;
    }
  }

  /**
   * Given symbol {@code :abc} returns {@code abc}; {@code :"a b"} returns
   * {@code a b}.
   */
  public static String unquoteSymbol(String s) {
    checkArgument(s.length() >= 2);
    checkArgument(s.charAt(0) == ':');
    s = s.substring(1);
    return s.charAt(0) == '"' ? unquoteString(s) : s;
  }

  /** Returns whether a string is a valid local variable or method name. */
  public static boolean isIdentifier(String s) {
    if (s.isEmpty()) {
      return false;
    }
    final char c0 = s.charAt(0);
    if (!(c0 == '_' || Character.isLowerCase(c0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (!(c == '_' || Character.isLetterOrDigit(c))) {
        return false;
      }
    }
    return true;
  }
}

// End Parsers.java
