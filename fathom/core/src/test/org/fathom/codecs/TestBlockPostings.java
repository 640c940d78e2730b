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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.fathom.document.FieldType;
import org.fathom.index.CorruptIndexException;
import org.fathom.index.FieldInfo;
import org.fathom.index.FieldInfos;
import org.fathom.index.IndexOptions;
import org.fathom.index.PostingsEnum;
import org.fathom.index.SegmentInfo;
import org.fathom.index.SegmentReadState;
import org.fathom.index.SegmentWriteState;
import org.fathom.index.TermInfo;
import org.fathom.search.DocIdSetIterator;
import org.fathom.store.Directory;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;
import org.fathom.util.InfoStream;
import org.fathom.util.StringHelper;

public class TestBlockPostings extends FathomTestCase {

  private static class Posting {
    final int doc;
    final float weight;
    final int[] positions;
    final BytesRef value;

    Posting(int doc, float weight, int[] positions, BytesRef value) {
      this.doc = doc;
      this.weight = weight;
      this.positions = positions;
      this.value = value;
    }
  }

  private static List<Posting> randomPostings(int maxDoc, int count) {
    List<Posting> postings = new ArrayList<>();
    int doc = -1;
    for (int i = 0; i < count; i++) {
      doc += randomIntBetween(1, 1 + maxDoc / count);
      float weight = randomBoolean() ? randomIntBetween(1, 5) : randomIntBetween(1, 40) / 8f;
      int[] positions = new int[randomIntBetween(1, 4)];
      int pos = 0;
      for (int j = 0; j < positions.length; j++) {
        pos += random().nextInt(10);
        positions[j] = pos;
      }
      byte[] bytes = new byte[random().nextInt(6)];
      random().nextBytes(bytes);
      postings.add(new Posting(doc, weight, positions, new BytesRef(bytes)));
    }
    return postings;
  }

  private static TermInfo write(BlockPostingsWriter writer, FieldInfo field, List<Posting> postings) throws Exception {
    writer.setField(field);
    writer.startTerm();
    for (Posting p : postings) {
      writer.startDoc(p.doc, p.weight, p.positions.length);
      for (int pos : p.positions) {
        writer.addPosition(pos);
      }
      writer.finishDoc(p.value);
    }
    return writer.finishTerm();
  }

  private static FieldInfo fieldInfo(IndexOptions options) {
    return new FieldInfo("f", 0, new FieldType().setIndexOptions(options).freeze());
  }

  private void doTestRoundTrip(IndexOptions options) throws Exception {
    Directory dir = newDirectory();
    FieldInfo field = fieldInfo(options);
    SegmentInfo si = new SegmentInfo(dir, "_0", 10000, Collections.<String,String>emptyMap(), StringHelper.randomId());
    FieldInfos infos = new FieldInfos(new FieldInfo[] {field}, 1);

    List<List<Posting>> terms = new ArrayList<>();
    int numTerms = randomIntBetween(1, 8);
    for (int i = 0; i < numTerms; i++) {
      int count = rarely() ? 1 : randomIntBetween(1, 3 * BlockPostingsWriter.BLOCK_SIZE + 10);
      terms.add(randomPostings(10000, count));
    }

    TermInfo[] termInfos = new TermInfo[numTerms];
    try (BlockPostingsWriter writer = new BlockPostingsWriter(new SegmentWriteState(InfoStream.NO_OUTPUT, dir, si, infos))) {
      for (int i = 0; i < numTerms; i++) {
        termInfos[i] = write(writer, field, terms.get(i));
      }
    }

    try (BlockPostingsReader reader = new BlockPostingsReader(new SegmentReadState(dir, si, infos))) {
      reader.checkIntegrity();
      for (int i = 0; i < numTerms; i++) {
        List<Posting> expected = terms.get(i);
        assertEquals(expected.size(), termInfos[i].docFreq());
        PostingsEnum postings = reader.postings(field, termInfos[i]);
        assertFalse(postings.isActive());
        for (Posting p : expected) {
          assertEquals(p.doc, postings.nextDoc());
          assertTrue(postings.isActive());
          if (options.hasFreqs()) {
            assertEquals(p.weight, postings.weight(), 0f);
          } else {
            assertEquals(1f, postings.weight(), 0f);
          }
          if (options.hasPositions()) {
            assertTrue(Arrays.equals(p.positions, postings.positions()));
          } else {
            assertEquals(0, postings.positions().length);
          }
          if (options.hasPayloads()) {
            assertEquals(p.value, postings.value());
          } else {
            assertNull(postings.value());
          }
        }
        assertEquals(DocIdSetIterator.NO_MORE_DOCS, postings.nextDoc());
        assertFalse(postings.isActive());
        assertEquals(DocIdSetIterator.NO_MORE_DOCS, postings.nextDoc());
        try {
          postings.weight();
          fail("expected IllegalStateException");
        } catch (IllegalStateException expectedException) {
          // exhausted
        }
      }
    }
  }

  public void testRoundTripDocs() throws Exception {
    doTestRoundTrip(IndexOptions.DOCS);
  }

  public void testRoundTripFreqs() throws Exception {
    doTestRoundTrip(IndexOptions.DOCS_AND_FREQS);
  }

  public void testRoundTripPositions() throws Exception {
    doTestRoundTrip(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS);
  }

  public void testRoundTripValues() throws Exception {
    doTestRoundTrip(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_PAYLOADS);
  }

  public void testAdvance() throws Exception {
    Directory dir = newDirectory();
    FieldInfo field = fieldInfo(IndexOptions.DOCS_AND_FREQS);
    SegmentInfo si = new SegmentInfo(dir, "_0", 100000, Collections.<String,String>emptyMap(), StringHelper.randomId());
    FieldInfos infos = new FieldInfos(new FieldInfo[] {field}, 1);
    List<Posting> postings = randomPostings(50000, randomIntBetween(2, 5 * BlockPostingsWriter.BLOCK_SIZE));
    TermInfo termInfo;
    try (BlockPostingsWriter writer = new BlockPostingsWriter(new SegmentWriteState(InfoStream.NO_OUTPUT, dir, si, infos))) {
      termInfo = write(writer, field, postings);
    }
    int[] docs = new int[postings.size()];
    for (int i = 0; i < docs.length; i++) {
      docs[i] = postings.get(i).doc;
    }

    try (BlockPostingsReader reader = new BlockPostingsReader(new SegmentReadState(dir, si, infos))) {
      for (int iter = 0; iter < 20; iter++) {
        PostingsEnum it = reader.postings(field, termInfo);
        int target = -1;
        while (true) {
          target += randomIntBetween(1, 400);
          int doc = it.advance(target);
          int idx = Arrays.binarySearch(docs, target);
          if (idx < 0) {
            idx = -idx - 1;
          }
          if (idx == docs.length) {
            assertEquals(DocIdSetIterator.NO_MORE_DOCS, doc);
            break;
          }
          assertEquals(docs[idx], doc);
          assertTrue(doc >= target);
          assertEquals(postings.get(idx).weight, it.weight(), 0f);
          // advancing to a target at or before the current doc stays put
          assertEquals(doc, it.advance(doc));
          target = doc;
        }
      }
    }
  }

  public void testSingletonIsInlined() throws Exception {
    Directory dir = newDirectory();
    FieldInfo field = fieldInfo(IndexOptions.DOCS_AND_FREQS);
    SegmentInfo si = new SegmentInfo(dir, "_0", 10, Collections.<String,String>emptyMap(), StringHelper.randomId());
    FieldInfos infos = new FieldInfos(new FieldInfo[] {field}, 1);
    TermInfo termInfo;
    try (BlockPostingsWriter writer = new BlockPostingsWriter(new SegmentWriteState(InfoStream.NO_OUTPUT, dir, si, infos))) {
      termInfo = write(writer, field, Collections.singletonList(new Posting(7, 3f, new int[] {0}, null)));
    }
    assertTrue(termInfo.isSingleton());
    assertEquals(7, termInfo.singletonDocID());
    try (BlockPostingsReader reader = new BlockPostingsReader(new SegmentReadState(dir, si, infos))) {
      PostingsEnum postings = reader.postings(field, termInfo);
      assertEquals(7, postings.advance(5));
      assertEquals(3f, postings.weight(), 0f);
      assertEquals(DocIdSetIterator.NO_MORE_DOCS, postings.nextDoc());
    }
  }

  public void testDocsOutOfOrder() throws Exception {
    Directory dir = newDirectory();
    FieldInfo field = fieldInfo(IndexOptions.DOCS);
    SegmentInfo si = new SegmentInfo(dir, "_0", 10, Collections.<String,String>emptyMap(), StringHelper.randomId());
    FieldInfos infos = new FieldInfos(new FieldInfo[] {field}, 1);
    try (BlockPostingsWriter writer = new BlockPostingsWriter(new SegmentWriteState(InfoStream.NO_OUTPUT, dir, si, infos))) {
      writer.setField(field);
      writer.startTerm();
      writer.startDoc(3, 1f, 1);
      writer.finishDoc(null);
      try {
        writer.startDoc(3, 1f, 1);
        fail("expected CorruptIndexException");
      } catch (CorruptIndexException expected) {
        assertTrue(expected.getMessage().contains("out of order"));
      }
    }
  }
}
