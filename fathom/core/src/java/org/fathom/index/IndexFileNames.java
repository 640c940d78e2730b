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


import java.util.regex.Pattern;

/**
 * Names of the files in an index directory. A segment's files are named
 * {@code <segment>[_<suffix>].<ext>}, generational files
 * {@code <base>_<gen>[.<ext>]} with the generation in base 36.
 *
 * @fathom.internal
 */
public final class IndexFileNames {

  private IndexFileNames() {}

  /** Prefix of commit points, {@code segments_N}. */
  public static final String SEGMENTS = "segments";

  /** Prefix of a commit point that is still being written. */
  public static final String PENDING_SEGMENTS = "pending_segments";

  public static final String WRITE_LOCK_NAME = "write.lock";

  /** Segment metadata. */
  public static final String SEGMENT_INFO_EXTENSION = "si";
  /** Term dictionary blocks. */
  public static final String TERMS_EXTENSION = "tim";
  /** Sparse term index. */
  public static final String TERMS_INDEX_EXTENSION = "tip";
  /** Postings lists. */
  public static final String POSTINGS_EXTENSION = "pst";
  /** Stored fields. */
  public static final String FIELDS_EXTENSION = "fdt";
  /** Offsets into the stored fields. */
  public static final String FIELDS_INDEX_EXTENSION = "fdx";
  /** Column values. */
  public static final String COLUMNS_EXTENSION = "col";
  /** Per-document field lengths. */
  public static final String LENGTHS_EXTENSION = "len";
  /** Term vectors. */
  public static final String VECTORS_EXTENSION = "tvd";
  /** Offsets into the term vectors. */
  public static final String VECTORS_INDEX_EXTENSION = "tvx";
  /** One generation of a deletion bitmap. */
  public static final String LIVE_DOCS_EXTENSION = "liv";

  /** Matches every per-segment file name. */
  public static final Pattern CODEC_FILE_PATTERN = Pattern.compile("_[a-z0-9]+(_.*)?\\..*");

  /**
   * {@code base.ext} for generation 0 and {@code base_gen.ext} above it;
   * null for generation -1. The dot is left out with an empty extension.
   */
  public static String fileNameFromGeneration(String base, String ext, long gen) {
    if (gen == -1) {
      return null;
    }
    assert gen >= 0 : "gen=" + gen;
    String name = gen == 0 ? base : base + "_" + Long.toString(gen, Character.MAX_RADIX);
    return ext.isEmpty() ? name : name + "." + ext;
  }

  /** {@code segment_suffix.ext}, leaving out the parts that are empty. */
  public static String segmentFileName(String segmentName, String segmentSuffix, String ext) {
    assert ext.startsWith(".") == false;
    StringBuilder sb = new StringBuilder(segmentName);
    if (segmentSuffix.isEmpty() == false) {
      sb.append('_').append(segmentSuffix);
    }
    if (ext.isEmpty() == false) {
      sb.append('.').append(ext);
    }
    return sb.toString();
  }

  /**
   * The segment a file belongs to: everything before the second
   * underscore or, lacking one, before the first dot.
   */
  public static String parseSegmentName(String filename) {
    int end = filename.indexOf('_', 1);
    if (end == -1) {
      end = filename.indexOf('.');
    }
    return end == -1 ? filename : filename.substring(0, end);
  }
}
