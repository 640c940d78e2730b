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

import org.fathom.util.BytesRef;

/**
 * Random access to the per-document byte values of a binary column.
 * <p>
 * Instances are not thread-safe: every thread should obtain its own
 * instance from the reader.
 */
public abstract class BinaryColumn {

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected BinaryColumn() {}

  /** True if {@code docID} has a value in this column. */
  public abstract boolean exists(int docID) throws IOException;

  /**
   * Returns the value of {@code docID}, or null when the document has no
   * value. An empty value is returned as an empty {@link BytesRef}. The
   * returned bytes may be reused by the next call.
   */
  public abstract BytesRef get(int docID) throws IOException;
}
