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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests {@link Encoding}. */
public class EncodingTest {
  @Test void testDefaults() {
    final Map<Encoding, Object> map = new EnumMap<>(Encoding.class);
    assertThat(
        Encoding.UNIVERSE_MODE.enumValue(map, Encoding.UniverseMode.class),
        is(Encoding.UniverseMode.CONCRETE));
    assertThat(Encoding.POLYMORPHISM.booleanValue(map), is(true));
    assertThat(Encoding.READABLE.booleanValue(map), is(false));
    assertThat(Encoding.ENCODING_MODULE.stringValue(map), is("coq"));
    assertThat(Encoding.UNIVERSE_MODULE.get(map), is("U"));
  }

  @Test void testLookup() {
    assertThat(Encoding.lookup("readable"), is(Encoding.READABLE));
    assertThat(Encoding.lookup("READABLE"), is(Encoding.READABLE));
    assertThat(Encoding.BY_CAMEL_NAME.get(0), is(Encoding.ENCODING_MODULE));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Encoding.lookup("verbose"));
    assertThat(e.getMessage(), is("property verbose not found"));
  }

  @Test void testSetLenient() {
    final Map<Encoding, Object> map = new EnumMap<>(Encoding.class);
    Encoding.UNIVERSE_MODE.setLenient(map, "named");
    assertThat(
        Encoding.UNIVERSE_MODE.enumValue(map, Encoding.UniverseMode.class),
        is(Encoding.UniverseMode.NAMED));
    Encoding.TEMPLATE_POLYMORPHISM.setLenient(map, "FALSE");
    assertThat(Encoding.TEMPLATE_POLYMORPHISM.booleanValue(map), is(false));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Encoding.UNIVERSE_MODE.setLenient(map, "abstract"));
    assertThat(e.getMessage(),
        is("value for property universeMode must be one of: "
            + "'CONCRETE', 'SYMBOLIC', 'NAMED'"));
    e = assertThrows(IllegalArgumentException.class,
        () -> Encoding.READABLE.setLenient(map, "yes"));
    assertThat(e.getMessage(), containsString("must be true or false"));
    e = assertThrows(IllegalArgumentException.class,
        () -> Encoding.READABLE.set(map, 1));
    assertThat(e.getMessage(),
        is("value for property readable must have type Boolean"));
    e = assertThrows(IllegalArgumentException.class,
        () -> Encoding.READABLE.set(map, null));
    assertThat(e.getMessage(), is("property readable is required"));
  }

  @Test void testWrongType() {
    final Map<Encoding, Object> map = new EnumMap<>(Encoding.class);
    assertThrows(IllegalArgumentException.class,
        () -> Encoding.ENCODING_MODULE.booleanValue(map));
  }

  /** Reads a property file from the class path. */
  @Test void testFromProperties() throws IOException {
    final Properties properties = new Properties();
    try (InputStream stream =
             EncodingTest.class.getResourceAsStream(
                 "/encoding-readable.properties")) {
      assertThat(stream == null, is(false));
      properties.load(stream);
    }
    final Map<Encoding, Object> map = Encoding.fromProperties(properties);
    assertThat(map.size(), is(3));
    assertThat(Encoding.READABLE.booleanValue(map), is(true));
    assertThat(
        Encoding.UNIVERSE_MODE.enumValue(map, Encoding.UniverseMode.class),
        is(Encoding.UniverseMode.SYMBOLIC));
    assertThat(Encoding.ENCODING_MODULE.stringValue(map), is("cic"));
  }
}

// End EncodingTest.java
