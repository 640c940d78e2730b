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


import java.io.PrintStream;
import java.util.Objects;

import org.fathom.util.InfoStream;
import org.fathom.util.PrintStreamInfoStream;

/**
 * Holds all the configuration of {@link IndexWriter}.  You
 * should instantiate this class, call the setters to set
 * your configuration, then pass it to {@link IndexWriter}.
 *
 * <p>
 * All setter methods return {@link IndexWriterConfig} to allow chaining
 * settings conveniently, for example:
 *
 * <pre class="prettyprint">
 * IndexWriterConfig conf = new IndexWriterConfig();
 * conf.setter1().setter2();
 * </pre>
 *
 * <p>A config can be used by one writer only.
 */
public final class IndexWriterConfig {

  /**
   * Specifies the open mode for {@link IndexWriter}.
   */
  public enum OpenMode {
    /**
     * Creates a new index or overwrites an existing one.
     */
    CREATE,

    /**
     * Opens an existing index.
     */
    APPEND,

    /**
     * Creates a new index if one does not exist,
     * otherwise it opens the index and documents will be appended.
     */
    CREATE_OR_APPEND
  }

  /** Default value is 10 000 documents. Change using {@link #setMaxBufferedDocs(int)}. */
  public static final int DEFAULT_MAX_BUFFERED_DOCS = 10000;

  /** Default write lock timeout: fail immediately. */
  public static final long DEFAULT_WRITE_LOCK_TIMEOUT = 0;

  /** Default setting for {@link #setCommitOnClose}. */
  public static final boolean DEFAULT_COMMIT_ON_CLOSE = true;

  private OpenMode openMode = OpenMode.CREATE_OR_APPEND;
  private int maxBufferedDocs = DEFAULT_MAX_BUFFERED_DOCS;
  private MergePolicy mergePolicy = new LogDocMergePolicy();
  private MergeScheduler mergeScheduler = new SerialMergeScheduler();
  private InfoStream infoStream = InfoStream.getDefault();
  private long writeLockTimeout = DEFAULT_WRITE_LOCK_TIMEOUT;
  private boolean commitOnClose = DEFAULT_COMMIT_ON_CLOSE;

  // indicates whether this config instance is already attached to a writer.
  private boolean inUse;

  /**
   * Creates a new config with the defaults: {@link OpenMode#CREATE_OR_APPEND},
   * {@link LogDocMergePolicy} and {@link SerialMergeScheduler}.
   */
  public IndexWriterConfig() {
  }

  /**
   * Sets this config to be attached to the given writer.
   * @throws IllegalStateException if this config is already attached to a writer.
   */
  IndexWriterConfig setIndexWriter(IndexWriter writer) {
    if (inUse) {
      throw new IllegalStateException("do not share IndexWriterConfig instances across IndexWriters");
    }
    inUse = true;
    return this;
  }

  /** Specifies {@link OpenMode} of the index.
   *
   * <p>Only takes effect when IndexWriter is first created. */
  public IndexWriterConfig setOpenMode(OpenMode openMode) {
    this.openMode = Objects.requireNonNull(openMode, "openMode must not be null");
    return this;
  }

  /** Returns the {@link OpenMode} set by {@link #setOpenMode(OpenMode)}. */
  public OpenMode getOpenMode() {
    return openMode;
  }

  /**
   * Determines the number of buffered documents after which the buffer is
   * flushed to a new segment of the current session. The segment becomes
   * visible to readers with the next commit.
   *
   * @throws IllegalArgumentException if maxBufferedDocs is smaller than 1
   */
  public IndexWriterConfig setMaxBufferedDocs(int maxBufferedDocs) {
    if (maxBufferedDocs < 1) {
      throw new IllegalArgumentException("maxBufferedDocs must at least be 1 when enabled");
    }
    this.maxBufferedDocs = maxBufferedDocs;
    return this;
  }

  /**
   * Returns the number of buffered added documents that will trigger a flush.
   */
  public int getMaxBufferedDocs() {
    return maxBufferedDocs;
  }

  /**
   * Expert: {@link MergePolicy} is invoked whenever there are changes to the
   * segments in the index. Its role is to select which merges to do, if any,
   * and return a {@link MergePolicy.MergeSpecification} describing the merges.
   */
  public IndexWriterConfig setMergePolicy(MergePolicy mergePolicy) {
    this.mergePolicy = Objects.requireNonNull(mergePolicy, "mergePolicy must not be null");
    return this;
  }

  /**
   * Returns the current MergePolicy in use by this writer.
   *
   * @see #setMergePolicy(MergePolicy)
   */
  public MergePolicy getMergePolicy() {
    return mergePolicy;
  }

  /**
   * Expert: sets the merge scheduler used by this writer. The default is
   * {@link SerialMergeScheduler}.
   */
  public IndexWriterConfig setMergeScheduler(MergeScheduler mergeScheduler) {
    this.mergeScheduler = Objects.requireNonNull(mergeScheduler, "mergeScheduler must not be null");
    return this;
  }

  /**
   * Returns the {@link MergeScheduler} that was set by
   * {@link #setMergeScheduler(MergeScheduler)}.
   */
  public MergeScheduler getMergeScheduler() {
    return mergeScheduler;
  }

  /**
   * Information about flushes, merges and deletes will be printed
   * to this. Must not be null, but {@link InfoStream#NO_OUTPUT}
   * may be used to suppress output.
   */
  public IndexWriterConfig setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream, "Cannot set InfoStream implementation to null. "
        + "To disable logging use InfoStream.NO_OUTPUT");
    return this;
  }

  /**
   * Convenience method that uses {@link PrintStreamInfoStream}.  Must not be null.
   */
  public IndexWriterConfig setInfoStream(PrintStream printStream) {
    Objects.requireNonNull(printStream, "printStream must not be null");
    return setInfoStream(new PrintStreamInfoStream(printStream));
  }

  /** Returns the {@link InfoStream} used for debugging. */
  public InfoStream getInfoStream() {
    return infoStream;
  }

  /**
   * Sets the maximum time to wait for the write lock, in milliseconds.
   * 0 fails immediately when another writer holds the lock.
   */
  public IndexWriterConfig setWriteLockTimeout(long writeLockTimeout) {
    if (writeLockTimeout < 0) {
      throw new IllegalArgumentException("writeLockTimeout must be >= 0, got " + writeLockTimeout);
    }
    this.writeLockTimeout = writeLockTimeout;
    return this;
  }

  /** Returns the allowed timeout when acquiring the write lock. */
  public long getWriteLockTimeout() {
    return writeLockTimeout;
  }

  /**
   * Sets if calls {@link IndexWriter#close()} should first commit
   * before closing. Defaults to <code>true</code>.
   */
  public IndexWriterConfig setCommitOnClose(boolean commitOnClose) {
    this.commitOnClose = commitOnClose;
    return this;
  }

  /**
   * Returns <code>true</code> if {@link IndexWriter#close()} should first commit before closing.
   */
  public boolean getCommitOnClose() {
    return commitOnClose;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("openMode=").append(getOpenMode()).append("\n");
    sb.append("maxBufferedDocs=").append(getMaxBufferedDocs()).append("\n");
    sb.append("mergePolicy=").append(getMergePolicy()).append("\n");
    sb.append("mergeScheduler=").append(getMergeScheduler()).append("\n");
    sb.append("writeLockTimeout=").append(getWriteLockTimeout()).append("\n");
    sb.append("commitOnClose=").append(getCommitOnClose()).append("\n");
    return sb.toString();
  }
}
