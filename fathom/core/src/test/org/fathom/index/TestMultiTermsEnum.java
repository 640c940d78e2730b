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
package org.fathom.index;


import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.fathom.index.TermsEnum.SeekStatus;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestMultiTermsEnum extends FathomTestCase {

  /** A sorted in-memory dictionary whose every term has the same info. */
  private static final class SortedTermsEnum extends TermsEnum {
    private final List<BytesRef> terms = new ArrayList<>();
    private final Map<BytesRef, TermInfo> infos = new TreeMap<>();
    private int upto = -1;

    SortedTermsEnum add(String term, TermInfo info) {
      infos.put(new BytesRef(term), info);
      terms.clear();
      terms.addAll(infos.keySet());
      return this;
    }

    @Override
    public BytesRef next() {
      upto++;
      return upto < terms.size() ? terms.get(upto) : null;
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      for (upto = 0; upto < terms.size(); upto++) {
        int cmp = terms.get(upto).compareTo(text);
        if (cmp == 0) {
          return SeekStatus.FOUND;
        } else if (cmp > 0) {
          return SeekStatus.NOT_FOUND;
        }
      }
      return SeekStatus.END;
    }

    @Override
    public BytesRef term() {
      return terms.get(upto);
    }

    @Override
    public TermInfo termInfo() {
      return infos.get(term());
    }

    @Override
    public int docFreq() {
      return termInfo().docFreq();
    }

    @Override
    public float totalWeight() {
      return termInfo().totalWeight();
    }

    @Override
    public PostingsEnum postings() {
      throw new UnsupportedOperationException();
    }
  }

  private static TermInfo info(int docFreq, float minWeight, float maxWeight, int minLength, int maxLength) {
    return new TermInfo(docFreq, docFreq * maxWeight, minLength, maxLength, minWeight, maxWeight, TermInfo.NO_POSTINGS, 0);
  }

  private static TermsEnum merge(SortedTermsEnum... subs) throws Exception {
    ReaderSlice[] slices = new ReaderSlice[subs.length];
    MultiTermsEnum.TermsEnumIndex[] indexes = new MultiTermsEnum.TermsEnumIndex[subs.length];
    for (int i = 0; i < subs.length; i++) {
      slices[i] = new ReaderSlice(i * 10, 10, i);
      indexes[i] = new MultiTermsEnum.TermsEnumIndex(subs[i], i);
    }
    return new MultiTermsEnum(slices).reset(indexes);
  }

  private static List<String> remaining(TermsEnum te) throws Exception {
    List<String> terms = new ArrayList<>();
    for (BytesRef term = te.next(); term != null; term = te.next()) {
      terms.add(term.utf8ToString());
    }
    return terms;
  }

  public void testTermsAreMergedInOrder() throws Exception {
    TermInfo one = info(1, 1f, 1f, 1, 1);
    TermsEnum te = merge(
        new SortedTermsEnum().add("bravo", one).add("delta", one),
        new SortedTermsEnum().add("alfa", one).add("delta", one).add("echo", one),
        new SortedTermsEnum().add("charlie", one));
    assertEquals("[alfa, bravo, charlie, delta, echo]", remaining(te).toString());
  }

  public void testNoTermsIsEmpty() throws Exception {
    assertSame(TermsEnum.EMPTY, merge(new SortedTermsEnum(), new SortedTermsEnum()));
  }

  public void testSeekExactThenNext() throws Exception {
    TermInfo one = info(1, 1f, 1f, 1, 1);
    TermsEnum te = merge(
        new SortedTermsEnum().add("alfa", one).add("charlie", one),
        new SortedTermsEnum().add("bravo", one).add("delta", one));
    assertTrue(te.seekExact(new BytesRef("bravo")));
    assertEquals(1, ((MultiTermsEnum) te).getMatchCount());
    // the sub-enum that missed bravo resumes at charlie
    assertEquals("[charlie, delta]", remaining(te).toString());
    assertFalse(te.seekExact(new BytesRef("beta")));
  }

  public void testSeekCeil() throws Exception {
    TermInfo one = info(1, 1f, 1f, 1, 1);
    TermsEnum te = merge(
        new SortedTermsEnum().add("alfa", one).add("echo", one),
        new SortedTermsEnum().add("charlie", one).add("echo", one));
    assertEquals(SeekStatus.NOT_FOUND, te.seekCeil(new BytesRef("bravo")));
    assertEquals("charlie", te.term().utf8ToString());
    assertEquals(SeekStatus.FOUND, te.seekCeil(new BytesRef("echo")));
    assertEquals(2, te.docFreq());
    assertEquals(SeekStatus.END, te.seekCeil(new BytesRef("foxtrot")));
    assertNull(te.term());
    assertEquals(SeekStatus.FOUND, te.seekCeil(new BytesRef("alfa")));
    assertEquals("[charlie, echo]", remaining(te).toString());
  }

  public void testStatisticsAreCombined() throws Exception {
    TermsEnum te = merge(
        new SortedTermsEnum().add("alfa", info(2, 0.5f, 3f, 2, 9)),
        new SortedTermsEnum().add("alfa", info(3, 0.25f, 2f, 1, 4)));
    assertEquals(SeekStatus.FOUND, te.seekCeil(new BytesRef("alfa")));
    TermInfo combined = te.termInfo();
    assertEquals(5, combined.docFreq());
    assertEquals(12f, combined.totalWeight(), 0f);
    assertEquals(1, combined.minLength());
    assertEquals(9, combined.maxLength());
    assertEquals(0.25f, combined.minWeight(), 0f);
    assertEquals(3f, combined.maxWeight(), 0f);
    assertEquals(TermInfo.NO_POSTINGS, combined.postingsFP());
  }

  public void testMaxWeightBelowZero() throws Exception {
    TermsEnum te = merge(
        new SortedTermsEnum().add("alfa", info(1, -2f, -1.5f, 1, 1)),
        new SortedTermsEnum().add("alfa", info(1, -3f, -0.5f, 1, 1)));
    assertEquals(SeekStatus.FOUND, te.seekCeil(new BytesRef("alfa")));
    assertEquals(-0.5f, te.termInfo().maxWeight(), 0f);
    assertEquals(-3f, te.termInfo().minWeight(), 0f);
  }
}
