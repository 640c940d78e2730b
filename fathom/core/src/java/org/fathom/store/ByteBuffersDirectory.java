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
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import org.fathom.index.IndexFileNames;

/**
 * Keeps index files on the heap.
 *
 * <p>A file can be opened once its output is closed; until then it is
 * listed with length 0. Renaming moves the finished file under its new
 * name, so readers see the whole file or none of it. Sync is a no-op.
 */
public final class ByteBuffersDirectory extends BaseDirectory {

  private final ConcurrentMap<String, HeapFile> files = new ConcurrentHashMap<>();
  private final AtomicLong tempCounter = new AtomicLong();

  public ByteBuffersDirectory() {
    this(new SingleInstanceLockFactory());
  }

  public ByteBuffersDirectory(LockFactory lockFactory) {
    super(lockFactory);
  }

  @Override
  public String[] listAll() throws IOException {
    ensureOpen();
    return new TreeSet<>(files.keySet()).toArray(new String[0]);
  }

  public boolean fileExists(String name) {
    ensureOpen();
    return files.containsKey(name);
  }

  @Override
  public long fileLength(String name) throws IOException {
    ensureOpen();
    return get(name).length;
  }

  @Override
  public void deleteFile(String name) throws IOException {
    ensureOpen();
    if (files.remove(name) == null) {
      throw new NoSuchFileException(name);
    }
  }

  @Override
  public IndexOutput createOutput(String name) throws IOException {
    ensureOpen();
    HeapFile file = new HeapFile(name);
    if (files.putIfAbsent(name, file) != null) {
      throw new FileAlreadyExistsException(name);
    }
    return file.output();
  }

  @Override
  public IndexOutput createTempOutput(String prefix, String suffix) throws IOException {
    ensureOpen();
    HeapFile file;
    do {
      String counter = Long.toString(tempCounter.getAndIncrement(), Character.MAX_RADIX);
      file = new HeapFile(IndexFileNames.segmentFileName(prefix, suffix + "_" + counter, "tmp"));
    } while (files.putIfAbsent(file.name, file) != null);
    return file.output();
  }

  @Override
  public void rename(String source, String dest) throws IOException {
    ensureOpen();
    HeapFile file = get(source);
    if (files.putIfAbsent(dest, file) != null) {
      throw new FileAlreadyExistsException(dest);
    }
    if (files.remove(source, file) == false) {
      throw new IllegalStateException(source + " was replaced during rename");
    }
  }

  @Override
  public IndexInput openInput(String name) throws IOException {
    ensureOpen();
    HeapFile file = get(name);
    IndexInput content = file.content;
    if (content == null) {
      throw new AccessDeniedException(name + " is still open for writing");
    }
    return content.clone();
  }

  @Override
  public void sync(Collection<String> names) throws IOException {
    ensureOpen();
  }

  @Override
  public void syncMetaData() throws IOException {
    ensureOpen();
  }

  @Override
  public void close() throws IOException {
    isOpen = false;
    files.clear();
  }

  private HeapFile get(String name) throws NoSuchFileException {
    HeapFile file = files.get(name);
    if (file == null) {
      throw new NoSuchFileException(name);
    }
    return file;
  }

  /** A file's bytes, published when its single output closes. */
  private static final class HeapFile {
    final String name;
    volatile IndexInput content;
    volatile long length;

    HeapFile(String name) {
      this.name = name;
    }

    IndexOutput output() {
      return new ByteBuffersIndexOutput(new ByteBuffersDataOutput(), "heap output (file=" + name + ")", name,
          out -> {
            content = new ByteBuffersIndexInput(out.toDataInput(), "heap input (file=" + name + ")");
            length = out.size();
          });
    }
  }
}
