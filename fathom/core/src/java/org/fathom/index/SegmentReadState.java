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


import org.fathom.store.Directory;

/**
 * Holder class for common parameters used during read.
 * @fathom.experimental
 */
public class SegmentReadState {
  /** {@link Directory} where this segment is read from. */
  public final Directory directory;

  /** {@link SegmentInfo} describing this segment. */
  public final SegmentInfo segmentInfo;

  /** The schema the segment is read under: fields missing from it are not
   *  exposed even if the segment holds data for them. */
  public final FieldInfos fieldInfos;

  /** Create a {@code SegmentReadState}. */
  public SegmentReadState(Directory dir, SegmentInfo info, FieldInfos fieldInfos) {
    this.directory = dir;
    this.segmentInfo = info;
    this.fieldInfos = fieldInfos;
  }
}
