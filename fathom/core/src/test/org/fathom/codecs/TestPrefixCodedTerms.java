/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.fathom.codecs;


import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;

import org.fathom.store.ByteBuffersDataInput;
import org.fathom.store.ByteBuffersDataOutput;
import org.fathom.util.BytesRef;
import org.fathom.util.BytesRefBuilder;
import org.fathom.util.FathomTestCase;

public class TestPrefixCodedTerms extends FathomTestCase {

  public void testEmpty() {
    PrefixCodedTerms pct = new PrefixCodedTerms.Builder().finish();
    assertEquals(0, pct.size());
    assertNull(pct.iterator().next());
  }

  public void testOne() {
    PrefixCodedTerms.Builder b = new PrefixCodedTerms.Builder();
    b.add(new BytesRef("foo"));
    PrefixCodedTerms pct = b.finish();
    PrefixCodedTerms.TermIterator iterator = pct.iterator();
    assertEquals(new BytesRef("foo"), iterator.next());
    assertNull(iterator.next());
  }

  public void testRandom() {
    Set<BytesRef> terms = new TreeSet<>();
    int nterms = atLeast(1000);
    for (int i = 0; i < nterms; i++) {
      terms.add(new BytesRef(randomUnicodeOfLengthBetween(0, 12)));
    }

    PrefixCodedTerms.Builder b = new PrefixCodedTerms.Builder();
    for (BytesRef ref : terms) {
      b.add(ref);
    }
    PrefixCodedTerms pb = b.finish();
    assertEquals(terms.size(), pb.size());

    PrefixCodedTerms.TermIterator iter = pb.iterator();
    Iterator<BytesRef> expected = terms.iterator();
    BytesRef term;
    while ((term = iter.next()) != null) {
      assertTrue(expected.hasNext());
      assertEquals(expected.next(), term);
    }
    assertFalse(expected.hasNext());
  }

  public void testOutOfOrder() {
    PrefixCodedTerms.Builder b = new PrefixCodedTerms.Builder();
    b.add(new BytesRef("b"));
    assertThrows(IllegalArgumentException.class, () -> b.add(new BytesRef("a")));
    assertThrows(IllegalArgumentException.class, () -> b.add(new BytesRef("b")));
  }

  public void testSharedPrefixIsCapped() throws Exception {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 300; i++) {
      sb.append('x');
    }
    BytesRef first = new BytesRef(sb + "a");
    BytesRef second = new BytesRef(sb + "b");

    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    PrefixCodedTerms.writeEntry(out, new BytesRef(), first);
    PrefixCodedTerms.writeEntry(out, first, second);

    ByteBuffersDataInput in = out.toDataInput();
    BytesRefBuilder previous = new BytesRefBuilder();
    PrefixCodedTerms.readEntry(in, previous);
    assertEquals(first, previous.get());
    long secondEntry = in.position();
    PrefixCodedTerms.readEntry(in, previous);
    assertEquals(second, previous.get());

    // shared length byte, then the suffix length: 301 - 255
    assertEquals((byte) PrefixCodedTerms.MAX_SHARED_PREFIX, in.readByte(secondEntry));
    assertEquals(46, in.readByte(secondEntry + 1));
  }
}
