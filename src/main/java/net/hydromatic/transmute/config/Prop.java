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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.transmute.parse.Parsers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Property values are held in a {@code Map<Prop, Object>}; a property
 * that is not in the map has its default value.
 *
 * @see Props
 */
public enum Prop {
  /**
   * Boolean property "autocorrect" controls whether the inspector plans the
   * edits that rewrite each offense. If false (the default), the inspector
   * only reports diagnostics.
   */
  AUTOCORRECT("autocorrect", Boolean.class, true, false),

  /**
   * Boolean property "hashTransformation" enables the rule that replaces
   * {@code map { |k, v| [v, k] }.to_h} with {@code to_h { |k, v| [v, k] }}.
   * Default is true.
   */
  HASH_TRANSFORMATION("hashTransformation", Boolean.class, true, true),

  /**
   * Boolean property "keyTransformation" enables the rule that replaces
   * {@code map { |k, v| [f(k), v] }.to_h} with {@code transform_keys}.
   * Default is true.
   */
  KEY_TRANSFORMATION("keyTransformation", Boolean.class, true, true),

  /**
   * String property "mappingConstructor" is the name of the constant whose
   * {@code []} method builds a hash from an array of pairs. Default is
   * "Hash".
   */
  MAPPING_CONSTRUCTOR("mappingConstructor", String.class, true, "Hash"),

  /**
   * Property "targetVersion" is the version of Ruby that the code will run
   * on. A rule is only applied if the call it rewrites to exists in that
   * version. Default is 2.4.
   */
  TARGET_VERSION("targetVersion", FeatureTier.class, true,
      FeatureTier.RUBY_2_4),

  /**
   * Boolean property "valueTransformation" enables the rule that replaces
   * {@code map { |k, v| [k, f(v)] }.to_h} with {@code transform_values}.
   * Default is true.
   */
  VALUE_TRANSFORMATION("valueTransformation", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(validValue(type, defaultValue));
    }
  }

  private boolean validValue(Class<?> type, Object value) {
    if (type == Boolean.class || type == String.class || type.isEnum()) {
      return type.isInstance(value);
    }
    return false;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing strings for enum, boolean and
   * target-version types.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type == FeatureTier.class && value instanceof String) {
      set(map, FeatureTier.of((String) value));
      return;
    }
    if (type == Boolean.class && value instanceof String) {
      final String s = ((String) value).trim().toLowerCase(Locale.ROOT);
      if (!s.equals("true") && !s.equals("false")) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be 'true' or 'false'");
      }
      set(map, Boolean.valueOf(s));
      return;
    }
    if (type == String.class && value instanceof String) {
      final String s = ((String) value).trim();
      if (this == MAPPING_CONSTRUCTOR && !isConstantName(s)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be a constant name");
      }
      set(map, s);
      return;
    }
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    set(map, value);
  }

  private static boolean isConstantName(String s) {
    return !s.isEmpty()
        && Character.isUpperCase(s.charAt(0))
        && Parsers.isIdentifier(s.toLowerCase(Locale.ROOT));
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }

  /**
   * Removes the value of this property from a map, returning the previous value
   * or null.
   */
  public @Nullable Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
