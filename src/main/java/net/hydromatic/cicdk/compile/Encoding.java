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
package net.hydromatic.cicdk.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property of the encoding that the translator targets.
 *
 * <p>Values are held in a {@code Map<Encoding, Object>}; a property that has
 * no entry in the map has its default value.
 */
public enum Encoding {
  /**
   * Enum property "universeMode" controls how global universes are encoded.
   * Default is {@link UniverseMode#CONCRETE}.
   */
  UNIVERSE_MODE("universeMode", UniverseMode.class, true,
      UniverseMode.CONCRETE),

  /**
   * Boolean property "universeConstraints" controls whether, in
   * {@link UniverseMode#SYMBOLIC} mode, constraints between global universes
   * are declared as axioms over the cumulativity relation (true) or as
   * rewrite rules on {@code sup} (false). Default is false.
   */
  UNIVERSE_CONSTRAINTS("universeConstraints", Boolean.class, true, false),

  /**
   * Boolean property "polymorphism" controls whether universe polymorphic
   * declarations take their universes as parameters. Default is true.
   */
  POLYMORPHISM("polymorphism", Boolean.class, true, true),

  /**
   * Boolean property "templatePolymorphism" controls whether template
   * polymorphic inductive types take their template universes as
   * parameters. Default is true.
   */
  TEMPLATE_POLYMORPHISM("templatePolymorphism", Boolean.class, true, true),

  /**
   * Boolean property "readable" controls whether small universes are written
   * using abbreviations such as {@code _n3} and {@code _u0}, defined in a
   * header. Default is false.
   */
  READABLE("readable", Boolean.class, true, false),

  /** String property "encodingModule" is the module that defines the symbols
   * of the encoding. Default is "coq". */
  ENCODING_MODULE("encodingModule", String.class, true, "coq"),

  /** String property "universeModule" is the module in which global
   * universes are declared. Default is "U". */
  UNIVERSE_MODULE("universeModule", String.class, true, "U");

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Encoding> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Encoding> BY_CAMEL_NAME;

  static {
    final List<Encoding> list = Arrays.asList(values());
    final Ordering<Encoding> ordering =
        Ordering.from(Comparator.comparing((Encoding o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Encoding> map = new LinkedHashMap<>();
    for (Encoding value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Encoding(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Encoding lookup(String propName) {
    Encoding prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Converts a set of properties, such as the contents of an
   * {@code encoding.properties} file, to a property map. */
  public static Map<Encoding, Object> fromProperties(Properties properties) {
    final Map<Encoding, Object> map = new EnumMap<>(Encoding.class);
    for (String name : properties.stringPropertyNames()) {
      lookup(name).setLenient(map, properties.getProperty(name).trim());
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Encoding, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Encoding, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Encoding, Object> map) {
    checkType(String.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Encoding, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of a property, allowing strings for enum and boolean
   * types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Encoding, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value for property "
            + camelName + " must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    if (type == Boolean.class && value instanceof String) {
      final String s = ((String) value).toLowerCase(Locale.ROOT);
      checkArgument(s.equals("true") || s.equals("false"),
          "value for property %s must be true or false", camelName);
      set(map, Boolean.valueOf(s));
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Encoding, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #UNIVERSE_MODE} property. */
  public enum UniverseMode {
    /** Every global universe is replaced by its concrete level, taken from
     * the universe table. The default. */
    CONCRETE,
    /** Global universes are symbols declared in the universe module, related
     * by rewrite rules or constraint axioms. */
    SYMBOLIC,
    /** Global universes are uninterpreted symbols. */
    NAMED
  }
}

// End Encoding.java
