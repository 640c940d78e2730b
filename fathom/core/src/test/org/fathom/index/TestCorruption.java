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


import java.io.IOException;

import org.fathom.codecs.CodecUtil;
import org.fathom.store.CorruptingIndexOutput;
import org.fathom.store.Directory;
import org.fathom.store.IndexInput;
import org.fathom.store.IndexOutput;
import org.fathom.util.BytesRef;
import org.fathom.util.FathomTestCase;

public class TestCorruption extends FathomTestCase {

  private Directory indexWithOneSegment() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir, newIndexWriterConfig().setMaxBufferedDocs(1000));
    final int numDocs = atLeast(20);
    for (int i = 0; i < numDocs; i++) {
      writer.addDocument(newDocument(Integer.toString(i), "term" + i + " common"));
    }
    writer.commit();
    return dir;
  }

  private static String termsFile(Directory dir) throws IOException {
    for (String file : dir.listAll()) {
      if (file.endsWith("." + IndexFileNames.TERMS_EXTENSION)) {
        return file;
      }
    }
    throw new AssertionError("no terms dictionary in " + dir);
  }

  /** Rewrites {@code name} with one bit flipped at {@code byteToCorrupt}. */
  private static void corrupt(Directory dir, String name, long byteToCorrupt) throws IOException {
    final byte[] bytes;
    try (IndexInput in = dir.openInput(name)) {
      bytes = new byte[(int) in.length()];
      in.readBytes(bytes, 0, bytes.length);
    }
    dir.deleteFile(name);
    try (IndexOutput out = new CorruptingIndexOutput(dir.createOutput(name), byteToCorrupt)) {
      out.writeBytes(bytes, 0, bytes.length);
    }
  }

  private static void readAllTerms(IndexReader reader) throws IOException {
    for (String field : reader.fieldNames()) {
      final Terms terms = reader.terms(field);
      if (terms == null) {
        continue;
      }
      final TermsEnum termsEnum = terms.iterator();
      for (BytesRef term = termsEnum.next(); term != null; term = termsEnum.next()) {
        termsEnum.docFreq();
      }
    }
  }

  public void testCorruptTermBlock() throws Exception {
    Directory dir = indexWithOneSegment();
    final String name = termsFile(dir);
    final long length = dir.fileLength(name);
    // the last byte before the footer belongs to the checksum of the last block
    corrupt(dir, name, length - CodecUtil.footerLength() - 1);

    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertThrows(CorruptIndexException.class, () -> readAllTerms(reader));
    }
  }

  public void testCheckIntegrityDetectsFlippedBit() throws Exception {
    Directory dir = indexWithOneSegment();
    final String name = termsFile(dir);
    final long length = dir.fileLength(name);
    final int headerLength = CodecUtil.indexHeaderLength("FathomTermsDict", "");
    corrupt(dir, name, randomIntBetween(headerLength, (int) (length - CodecUtil.footerLength() - 1)));

    // the reader opens: only the header and the stored checksum are read eagerly
    try (DirectoryReader reader = DirectoryReader.open(dir)) {
      assertEquals(1, reader.leaves().size());
      LeafReader leaf = reader.leaves().get(0).reader();
      CorruptIndexException expected = assertThrows(CorruptIndexException.class, leaf::checkIntegrity);
      assertTrue(expected.getMessage(), expected.getMessage().contains("checksum failed"));
    }
  }
}
