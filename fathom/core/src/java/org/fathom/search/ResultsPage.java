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
package org.fathom.search;


import java.util.Arrays;

/**
 * One page of the hits of a search, as returned by
 * {@link IndexSearcher#searchPage(Query, int, int)}.
 */
public final class ResultsPage {

  private final int pageNum;
  private final int pageLen;
  private final int pageCount;
  private final int offset;
  private final long total;
  private final ScoreDoc[] scoreDocs;
  private final boolean partial;

  ResultsPage(TopDocs all, int requestedPage, int pageLen) {
    this.pageLen = pageLen;
    this.total = all.totalHits;
    this.partial = all.isPartial();
    this.pageCount = (int) ((total + pageLen - 1) / pageLen);
    // past the end: show the last page
    this.pageNum = Math.max(1, Math.min(requestedPage, pageCount));
    this.offset = (pageNum - 1) * pageLen;
    final int end = Math.min(all.scoreDocs.length, offset + pageLen);
    this.scoreDocs = offset >= end ? new ScoreDoc[0] : Arrays.copyOfRange(all.scoreDocs, offset, end);
  }

  /** The 1-based number of this page. */
  public int getPageNum() {
    return pageNum;
  }

  /** The requested number of hits per page. */
  public int getPageLen() {
    return pageLen;
  }

  /** The number of pages, 0 when nothing matched. */
  public int getPageCount() {
    return pageCount;
  }

  /** The rank of the first hit of this page among all hits, 0-based. */
  public int getOffset() {
    return offset;
  }

  /** The total number of matching documents. */
  public long getTotal() {
    return total;
  }

  /** The hits of this page, best first. */
  public ScoreDoc[] getScoreDocs() {
    return scoreDocs;
  }

  /** True if this is the last page. */
  public boolean isLastPage() {
    return pageCount == 0 || pageNum == pageCount;
  }

  /** True if the search terminated early. */
  public boolean isPartial() {
    return partial;
  }

  @Override
  public String toString() {
    return "ResultsPage(page " + pageNum + "/" + pageCount + ", total=" + total + ", hits=" + scoreDocs.length + ")";
  }
}
