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


/**
 * The type of the per-document column a field keeps for sorting and faceting.
 */
public enum ColumnType {
  /** No column for this field. */
  NONE,
  /**
   * A single long per document, stored with a fixed number of bits
   * derived from the range of values in the segment.
   */
  NUMERIC,
  /**
   * A single byte string per document, stored with an offset table.
   */
  BINARY
}
