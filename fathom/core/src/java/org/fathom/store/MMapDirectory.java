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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.fathom.util.Constants;

/**
 * An {@link FSDirectory} that reads files through read-only memory maps.
 *
 * <p>A file is mapped in chunks of {@link #getChunkSize()} bytes, a power of
 * two, and read as one {@link ByteBuffersDataInput}. Mappings are released
 * when the buffers are garbage collected, not on close: deleting a file
 * that a reader still maps works on POSIX file systems but fails on
 * Windows until the mapping is gone.</p>
 */
public class MMapDirectory extends FSDirectory {

  /** Default chunk size: 1 GiB on 64 bit JVMs, 256 MiB otherwise. */
  public static final int DEFAULT_CHUNK_SIZE = Constants.JRE_IS_64BIT ? (1 << 30) : (1 << 28);

  private final int chunkBits;

  /** Opens the directory at {@code path} with the default lock factory. */
  public MMapDirectory(Path path) throws IOException {
    this(path, FSLockFactory.getDefault(), DEFAULT_CHUNK_SIZE);
  }

  /** Opens the directory at {@code path}, creating it if needed.
   *  @param chunkSize upper bound for one mapping, rounded down to a power of two */
  public MMapDirectory(Path path, LockFactory lockFactory, int chunkSize) throws IOException {
    super(path, lockFactory);
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
    }
    this.chunkBits = 31 - Integer.numberOfLeadingZeros(chunkSize);
  }

  /** Size of one mapping. */
  public final int getChunkSize() {
    return 1 << chunkBits;
  }

  @Override
  public IndexInput openInput(String name) throws IOException {
    ensureOpen();
    ensureCanRead(name);
    final Path path = directory.resolve(name);
    final String description = "MMapIndexInput(path=\"" + path + "\")";
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      return new ByteBuffersIndexInput(new ByteBuffersDataInput(map(channel, description)), description);
    }
  }

  private List<ByteBuffer> map(FileChannel channel, String description) throws IOException {
    final long length = channel.size();
    final long chunkSize = 1L << chunkBits;
    final List<ByteBuffer> chunks = new ArrayList<>();
    long offset = 0;
    do {
      final long size = Math.min(chunkSize, length - offset);
      try {
        chunks.add(channel.map(FileChannel.MapMode.READ_ONLY, offset, size));
      } catch (IOException e) {
        throw new IOException(String.format(Locale.ROOT,
            "could not map %d bytes at offset %d of %s; the address space may be exhausted",
            size, offset, description), e);
      }
      offset += size;
    } while (offset < length);
    return chunks;
  }
}
