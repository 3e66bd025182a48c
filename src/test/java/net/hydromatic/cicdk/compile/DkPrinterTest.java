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

import static net.hydromatic.cicdk.ast.DkBuilder.dk;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

/** Tests {@link DkPrinter}. */
public class DkPrinterTest {
  @Test void testPrint() {
    final StringWriter sw = new StringWriter();
    final DkPrinter printer =
        new DkPrinter(SortEncoder.create(ImmutableMap.of()), sw);
    printer.header();
    printer.printAll(
        ImmutableList.of(dk.declaration("nat", dk.var("coq.Univ coq.set")),
            dk.rules(
                dk.rule(ImmutableList.of(), dk.var("a"), dk.var("b")),
                dk.rule(ImmutableList.of(), dk.var("c"), dk.var("d")))));
    printer.footer();
    final String expected = "(; This file was generated by cicdk. ;)\n"
        + "(; Encoding module: coq. ;)\n"
        + "\n"
        + "nat : coq.Univ coq.set.\n"
        + "[] a --> b.\n"
        + "[] c --> d.\n"
        + "(; End of translation. ;)\n";
    assertThat(sw.toString(), is(expected));
  }
}

// End DkPrinterTest.java
