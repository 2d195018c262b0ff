/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qua.frontend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.qua.frontend.SymbolAllocator.SymbolKind;

public class SymbolAllocatorTest {

  @Test
  public void testKindsCountSeparately() {
    SymbolAllocator symbols = new SymbolAllocator();
    assertEquals("v1", symbols.nextScalar());
    assertEquals("a1", symbols.nextArray());
    assertEquals("v2", symbols.nextScalar());
    assertEquals("r1", symbols.nextStream(false));
    assertEquals("a2", symbols.nextArray());

    assertEquals(2, symbols.count(SymbolKind.SCALAR));
    assertEquals(2, symbols.count(SymbolKind.ARRAY));
    assertEquals(1, symbols.count(SymbolKind.STREAM));
  }

  @Test
  public void testAdcTraceStreams() {
    SymbolAllocator symbols = new SymbolAllocator();
    assertEquals("r1", symbols.nextStream(false));
    // ADC traces share the stream counter
    assertEquals("atr_r2", symbols.nextStream(true));
    assertEquals("r3", symbols.nextStream(false));
  }

  @Test
  public void testAllocatorsIndependent() {
    SymbolAllocator first = new SymbolAllocator();
    SymbolAllocator second = new SymbolAllocator();
    first.nextScalar();
    first.nextScalar();
    assertEquals("v1", second.nextScalar());
    assertEquals(0, second.count(SymbolKind.ARRAY));
  }
}
