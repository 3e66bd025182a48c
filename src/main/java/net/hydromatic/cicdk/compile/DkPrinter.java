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

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.io.Writer;
import net.hydromatic.cicdk.ast.Dk;

/**
 * Writes target instructions in concrete syntax, one per line.
 *
 * <p>A library is written as the encoder's header, the instructions of each
 * declaration, and the encoder's footer.
 */
public class DkPrinter {
  private final SortEncoder encoder;
  private final PrintWriter out;

  public DkPrinter(SortEncoder encoder, Writer writer) {
    this.encoder = requireNonNull(encoder);
    this.out = writer instanceof PrintWriter
        ? (PrintWriter) writer
        : new PrintWriter(writer);
  }

  /** Writes the header. */
  public void header() {
    printAll(encoder.header());
  }

  /** Writes the footer, and flushes. */
  public void footer() {
    printAll(encoder.footer());
    out.flush();
  }

  /** Writes an instruction. */
  public void print(Dk.Instruction instruction) {
    out.print(instruction);
    out.print('\n');
  }

  /** Writes instructions. */
  public void printAll(Iterable<? extends Dk.Instruction> instructions) {
    instructions.forEach(this::print);
  }

  public void flush() {
    out.flush();
  }
}

// End DkPrinter.java
