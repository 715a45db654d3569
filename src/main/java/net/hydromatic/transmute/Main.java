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
package net.hydromatic.transmute;

import com.google.common.collect.ImmutableList;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.transmute.ast.AstNode;
import net.hydromatic.transmute.config.Prop;
import net.hydromatic.transmute.config.Props;
import net.hydromatic.transmute.correct.ClobberingException;
import net.hydromatic.transmute.correct.Corrector;
import net.hydromatic.transmute.parse.ParseException;
import net.hydromatic.transmute.parse.RubyParser;
import net.hydromatic.transmute.rule.Inspector;
import net.hydromatic.transmute.rule.Offense;
import net.hydromatic.transmute.rule.Tracers;
import net.hydromatic.transmute.util.TransmuteException;

/**
 * Command-line tool that finds, and optionally rewrites, hash
 * transformations in Ruby files.
 *
 * <p>Usage: {@code transmute [--autocorrect] [--config=file]
 * [--property=value]... file...}
 *
 * <p>Prints one line per offense and exits with status 1 if there are any
 * offenses or errors.
 */
public class Main {
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;
  private final List<String> files;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Writer out =
        new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
    final int status;
    try {
      status = new Main(ImmutableList.copyOf(args), out).run();
    } catch (IllegalArgumentException e) {
      System.err.println("transmute: " + e.getMessage());
      System.exit(2);
      return;
    }
    System.exit(status);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out) {
    this.out = buffer(out);
    this.propMap = new LinkedHashMap<>();
    this.files = new ArrayList<>();
    for (String arg : argList) {
      if (arg.equals("--autocorrect")) {
        Prop.AUTOCORRECT.set(propMap, true);
      } else if (arg.startsWith("--config=")) {
        loadConfig(Paths.get(arg.substring("--config=".length())));
      } else if (arg.startsWith("--") && arg.indexOf('=') > 2) {
        final int i = arg.indexOf('=');
        final Prop prop = Prop.lookup(arg.substring(2, i));
        prop.setLenient(propMap, arg.substring(i + 1));
      } else if (arg.startsWith("-")) {
        throw new IllegalArgumentException("unknown option '" + arg + "'");
      } else {
        files.add(arg);
      }
    }
  }

  /** Loads properties from a file. A file that cannot be read is a bad
   * argument, like an unknown option. */
  private void loadConfig(Path path) {
    try (Reader reader =
        Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Props.load(reader, propMap);
    } catch (IOException | UncheckedIOException e) {
      throw new IllegalArgumentException("cannot read config file " + path
          + ": " + e.getMessage(), e);
    }
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  /** Returns the property values set by the command line. */
  public Map<Prop, Object> propMap() {
    return propMap;
  }

  /** Inspects each file, and returns the exit status. */
  public int run() {
    final Inspector inspector = new Inspector(propMap, Tracers.empty());
    int status = 0;
    for (String file : files) {
      if (!process(inspector, file)) {
        status = 1;
      }
    }
    out.flush();
    return status;
  }

  /** Inspects one file; returns whether it was clean. */
  private boolean process(Inspector inspector, String file) {
    final Path path = Paths.get(file);
    final String source;
    try {
      source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      out.println(file + ": Error: cannot read file: " + e.getMessage());
      return false;
    }
    final List<Offense> offenses;
    try {
      offenses = inspector.inspect(RubyParser.parse(source, file));
    } catch (ParseException e) {
      out.println(describe(e));
      return false;
    }
    for (Offense offense : offenses) {
      out.println(offense.diagnostic);
    }
    if (offenses.isEmpty() || !Prop.AUTOCORRECT.booleanValue(propMap)) {
      return offenses.isEmpty();
    }

    final String corrected;
    try {
      corrected =
          Corrector.correctFully(source, s -> {
            final AstNode root = RubyParser.parse(s, file);
            return inspector.inspect(root);
          });
    } catch (ParseException | ClobberingException e) {
      out.println(describe(e));
      return false;
    }
    if (!corrected.equals(source)) {
      try {
        Files.write(path, corrected.getBytes(StandardCharsets.UTF_8));
      } catch (IOException e) {
        out.println(file + ": Error: cannot write file: " + e.getMessage());
        return false;
      }
      out.println("[corrected " + file + "]");
    }
    return false;
  }

  private static String describe(TransmuteException e) {
    return e.describeTo(new StringBuilder()).toString();
  }
}

// End Main.java
