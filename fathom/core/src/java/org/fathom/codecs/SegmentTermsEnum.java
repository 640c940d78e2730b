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

import org.fathom.index.PostingsEnum;
import org.fathom.index.TermInfo;
import org.fathom.index.TermsEnum;
import org.fathom.store.IndexInput;
import org.fathom.util.BytesRef;

/** Iterates through the terms of a {@link FieldReader}, one decoded block at a time. */
final class SegmentTermsEnum extends TermsEnum {

  private final FieldReader fr;
  private IndexInput in;

  private FieldReader.TermBlock block;
  private int upto;
  private boolean exhausted;

  SegmentTermsEnum(FieldReader fr) {
    this.fr = fr;
  }

  private void load(int blockIndex) throws IOException {
    if (block != null && block.index == blockIndex) {
      return;
    }
    if (in == null) {
      in = fr.parent.termsIn.clone();
    }
    block = fr.loadBlock(in, blockIndex);
  }

  private BytesRef end() {
    block = null;
    exhausted = true;
    return null;
  }

  @Override
  public BytesRef next() throws IOException {
    if (block == null) {
      if (exhausted) {
        return null;
      }
      load(0);
      upto = 0;
      return block.terms[upto];
    }
    upto++;
    if (upto == block.terms.length) {
      if (block.index + 1 == fr.numBlocks()) {
        return end();
      }
      load(block.index + 1);
      upto = 0;
    }
    return block.terms[upto];
  }

  @Override
  public SeekStatus seekCeil(BytesRef target) throws IOException {
    exhausted = false;
    final int blockIndex = Math.max(0, fr.findBlock(target));
    load(blockIndex);
    final int idx = block.find(target);
    if (idx >= 0) {
      upto = idx;
      return SeekStatus.FOUND;
    }
    final int insertion = -idx - 1;
    if (insertion < block.terms.length) {
      upto = insertion;
      return SeekStatus.NOT_FOUND;
    }
    if (blockIndex + 1 < fr.numBlocks()) {
      load(blockIndex + 1);
      upto = 0;
      return SeekStatus.NOT_FOUND;
    }
    end();
    return SeekStatus.END;
  }

  @Override
  public BytesRef term() {
    return block == null ? null : block.terms[upto];
  }

  private TermInfo current() {
    if (block == null) {
      throw new IllegalStateException("terms enum is not positioned");
    }
    return block.infos[upto];
  }

  @Override
  public TermInfo termInfo() {
    return current();
  }

  @Override
  public int docFreq() {
    return current().docFreq();
  }

  @Override
  public float totalWeight() {
    return current().totalWeight();
  }

  @Override
  public PostingsEnum postings() throws IOException {
    return fr.parent.postingsReader.postings(fr.fieldInfo, current());
  }

  @Override
  public String toString() {
    return "SegmentTermsEnum(field=" + fr.fieldInfo.name + ",term=" + term() + ")";
  }
}
