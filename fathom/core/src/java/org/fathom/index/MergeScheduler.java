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


import java.io.Closeable;
import java.io.IOException;

import org.fathom.index.MergePolicy.OneMerge;
import org.fathom.util.InfoStream;

/** <p>Expert: {@link IndexWriter} uses an instance
 *  implementing this interface to execute the merges
 *  selected by a {@link MergePolicy}.  The default
 *  MergeScheduler is {@link SerialMergeScheduler}.</p>
 * @fathom.experimental
*/
public abstract class MergeScheduler implements Closeable {

  /** For messages about merge scheduling */
  protected InfoStream infoStream;

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected MergeScheduler() {
  }

  /** Run the merges provided by {@link MergeSource#getNextMerge()}.
   * @param mergeSource the {@link IndexWriter} to obtain the merges from.
   * @param trigger the {@link MergeTrigger} that caused this merge to happen */
  public abstract void merge(MergeSource mergeSource, MergeTrigger trigger) throws IOException;

  /** Blocks until every merge started by this scheduler has finished. */
  public abstract void sync();

  /** Close this MergeScheduler. */
  @Override
  public abstract void close() throws IOException;

  /** Returns true if the writer should look for merges each time it flushes
   *  a segment, before the commit. Schedulers that run merges in the
   *  calling thread leave merging to the commit. */
  protected boolean mergeOnFlush() {
    return false;
  }

  /** IndexWriter calls this on init. */
  void initialize(InfoStream infoStream) {
    this.infoStream = infoStream;
  }

  /**
   * Returns true if infoStream messages are enabled. This method is usually used in
   * conjunction with {@link #message(String)}:
   *
   * <pre class="prettyprint">
   * if (verbose()) {
   *   message(&quot;your message&quot;);
   * }
   * </pre>
   */
  protected boolean verbose() {
    return infoStream != null && infoStream.isEnabled("MS");
  }

  /**
   * Outputs the given message - this method assumes {@link #verbose()} was
   * called and returned true.
   */
  protected void message(String message) {
    infoStream.message("MS", message);
  }

  /**
   * Provides access to new merges and executes the actual merge
   * @fathom.experimental
   */
  public interface MergeSource {
    /**
     * The {@link MergeScheduler} calls this method to retrieve the next
     * merge requested by the MergePolicy
     */
    OneMerge getNextMerge();

    /**
     * Does finishing for a merge.
     */
    void onMergeFinished(OneMerge merge);

    /**
     * Expert: returns true if there are merges waiting to be scheduled.
     */
    boolean hasPendingMerges();

    /**
     * Merges the indicated segments, replacing them in the stack with a
     * single segment.
     */
    void merge(OneMerge merge) throws IOException;
  }
}
