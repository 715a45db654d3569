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
package net.hydromatic.transmute.config;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/** Utilities for {@link Prop}. */
public abstract class Props {
  private Props() {}

  /**
   * Copies the entries of a {@link Properties} into a property map.
   *
   * <p>Keys may be either the camel-case name ("targetVersion") or the enum
   * name ("TARGET_VERSION") of a {@link Prop}. Throws if a key is not a known
   * property or a value is not valid for its property.
   */
  public static Map<Prop, Object> load(Properties properties,
      Map<Prop, Object> map) {
    for (String key : properties.stringPropertyNames()) {
      final Prop prop = Prop.lookup(key);
      prop.setLenient(map, properties.getProperty(key));
    }
    return map;
  }

  /** Reads properties from a reader, in {@link Properties} format, into a
   * property map. */
  public static Map<Prop, Object> load(Reader reader, Map<Prop, Object> map) {
    final Properties properties = new Properties();
    try {
      properties.load(reader);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return load(properties, map);
  }
}

// End Props.java
