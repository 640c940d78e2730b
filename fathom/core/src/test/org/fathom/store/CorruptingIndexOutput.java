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
package org.fathom.store;

import java.io.IOException;
import java.util.zip.CRC32;

/**
 * Writes through to another output but flips the lowest bit of one byte.
 * {@link #getChecksum()} reports the checksum of the bytes as they were
 * meant to be, so a footer written through this output no longer matches
 * the file.
 */
public class CorruptingIndexOutput extends IndexOutput {
  private final IndexOutput delegate;
  private final long position;
  private final CRC32 intended = new CRC32();
  private long written;

  public CorruptingIndexOutput(IndexOutput delegate, long position) {
    super("corrupting " + delegate, delegate.getName());
    this.delegate = delegate;
    this.position = position;
  }

  @Override
  public void writeByte(byte b) throws IOException {
    intended.update(b);
    delegate.writeByte(written++ == position ? (byte) (b ^ 1) : b);
  }

  @Override
  public void writeBytes(byte[] b, int offset, int length) throws IOException {
    for (int i = offset; i < offset + length; i++) {
      writeByte(b[i]);
    }
  }

  @Override
  public long getFilePointer() {
    return written;
  }

  @Override
  public long getChecksum() {
    return intended.getValue();
  }

  @Override
  public void close() throws IOException {
    try {
      if (written <= position) {
        throw new IllegalStateException("only " + written + " bytes written to " + getName()
            + ", nothing to corrupt at " + position);
      }
    } finally {
      delegate.close();
    }
  }
}
