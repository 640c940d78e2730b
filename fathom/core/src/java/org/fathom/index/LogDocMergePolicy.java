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

/** A {@link LogMergePolicy} that measures segments in documents. This is
 *  the default policy of {@link IndexWriterConfig}. */
public class LogDocMergePolicy extends LogMergePolicy {

  /** Default size of the lowest tier.  @see #setMinMergeDocs */
  public static final int DEFAULT_MIN_MERGE_DOCS = 1000;

  /** Creates the policy with default settings. */
  public LogDocMergePolicy() {
    setMinMergeSize(DEFAULT_MIN_MERGE_DOCS);
  }

  @Override
  protected long size(SegmentCommitInfo info, MergeContext mergeContext) throws IOException {
    return sizeDocs(info, mergeContext);
  }

  /** Segments with fewer documents than this share the lowest tier and are
   *  merged as soon as {@code mergeFactor} of them pile up. */
  public LogDocMergePolicy setMinMergeDocs(int minMergeDocs) {
    setMinMergeSize(minMergeDocs);
    return this;
  }

  /** @see #setMinMergeDocs */
  public int getMinMergeDocs() {
    return (int) getMinMergeSize();
  }
}
