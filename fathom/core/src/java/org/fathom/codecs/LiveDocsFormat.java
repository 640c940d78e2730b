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


import java.io.IOException;
import java.util.Collection;

import org.fathom.index.CorruptIndexException;
import org.fathom.index.IndexFileNames;
import org.fathom.index.SegmentCommitInfo;
import org.fathom.store.ChecksumIndexInput;
import org.fathom.store.DataOutput;
import org.fathom.store.Directory;
import org.fathom.store.IndexOutput;
import org.fathom.util.Bits;
import org.fathom.util.FixedBitSet;

/**
 * Deletions of a segment, as a bit set of its live documents.
 * <p>A segment without deletions has no such file. Each round of deletions
 * writes the complete set under a new generation; other segment files are
 * never rewritten.
 * <p>Deletions (.liv) --&gt; IndexHeader, Words, Footer
 * <ul>
 *   <li>IndexHeader --&gt; {@link CodecUtil#writeIndexHeader IndexHeader} whose suffix is the generation in base 36</li>
 *   <li>Words --&gt; &lt;{@link DataOutput#writeLong Int64}&gt;<sup>ceil(maxDoc / 64)</sup>; bit {@code d % 64}
 *       of word {@code d / 64} is set when document {@code d} is live</li>
 * </ul>
 */
public final class LiveDocsFormat {

  static final String CODEC_NAME = "FathomLiveDocs";

  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  private LiveDocsFormat() {}

  private static String fileName(SegmentCommitInfo info, long gen) {
    return IndexFileNames.fileNameFromGeneration(info.info.name, IndexFileNames.LIVE_DOCS_EXTENSION, gen);
  }

  private static String suffix(long gen) {
    return Long.toString(gen, Character.MAX_RADIX);
  }

  /** Reads the live documents of the current deletion generation of {@code info}. */
  public static Bits readLiveDocs(Directory dir, SegmentCommitInfo info) throws IOException {
    long gen = info.getDelGen();
    int maxDoc = info.info.maxDoc();
    Bits live = null;
    try (ChecksumIndexInput in = dir.openChecksumInput(fileName(info, gen))) {
      Throwable failure = null;
      try {
        CodecUtil.checkIndexHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT, info.info.getId(), suffix(gen));
        long[] words = new long[FixedBitSet.bits2words(maxDoc)];
        for (int i = 0; i < words.length; i++) {
          words[i] = in.readLong();
        }
        FixedBitSet bits = new FixedBitSet(words, maxDoc);
        int deleted = maxDoc - bits.cardinality();
        if (deleted != info.getDelCount()) {
          throw new CorruptIndexException(deleted + " documents marked deleted but the segment records "
              + info.getDelCount(), in);
        }
        live = bits.asReadOnlyBits();
      } catch (Throwable t) {
        failure = t;
      } finally {
        CodecUtil.checkFooter(in, failure);
      }
    }
    return live;
  }

  /**
   * Writes {@code live} under the next deletion generation of {@code info}
   * and returns the file name. {@code newDelCount} counts the deletions
   * made since the current generation.
   */
  public static String writeLiveDocs(Bits live, Directory dir, SegmentCommitInfo info, int newDelCount) throws IOException {
    long gen = info.getNextDelGen();
    String name = fileName(info, gen);
    long[] words = new long[FixedBitSet.bits2words(live.length())];
    int deleted = 0;
    for (int doc = 0; doc < live.length(); doc++) {
      if (live.get(doc)) {
        words[doc >>> 6] |= 1L << doc;
      } else {
        deleted++;
      }
    }
    int expected = info.getDelCount() + newDelCount;
    if (deleted != expected) {
      throw new CorruptIndexException(deleted + " documents marked deleted, expected " + expected, name);
    }
    try (IndexOutput out = dir.createOutput(name)) {
      CodecUtil.writeIndexHeader(out, CODEC_NAME, VERSION_CURRENT, info.info.getId(), suffix(gen));
      for (long word : words) {
        out.writeLong(word);
      }
      CodecUtil.writeFooter(out);
    }
    return name;
  }

  /** Adds the deletions file of {@code info}, if it has one, to {@code files}. */
  public static void files(SegmentCommitInfo info, Collection<String> files) {
    if (info.hasDeletions()) {
      files.add(fileName(info, info.getDelGen()));
    }
  }
}
