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


import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import org.fathom.index.LeafReaderContext;

/**
 * Stops a search once a time budget is spent by throwing
 * {@link TimeExceededException}, on which
 * {@link IndexSearcher#search(Query, Collector)} returns {@code false}; the
 * wrapped collector keeps what it gathered. The clock is read before every
 * segment and every hit.
 */
public class TimeLimitingCollector implements Collector {

  /** The time budget ran out. */
  @SuppressWarnings("serial")
  public static class TimeExceededException extends EarlyTerminationException {
    private final long timeAllowed;
    private final long timeElapsed;
    private final int lastDocCollected;

    private TimeExceededException(long timeAllowed, long timeElapsed, int lastDocCollected) {
      super("search took " + timeElapsed + " of " + timeAllowed + " allowed ticks");
      this.timeAllowed = timeAllowed;
      this.timeElapsed = timeElapsed;
      this.lastDocCollected = lastDocCollected;
    }

    public long getTimeAllowed() {
      return timeAllowed;
    }

    public long getTimeElapsed() {
      return timeElapsed;
    }

    /** Global id of the hit being collected when time ran out, or -1 between segments. */
    public int getLastDocCollected() {
      return lastDocCollected;
    }
  }

  private static final LongSupplier MILLIS = () -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime());

  private final Collector collector;
  private final LongSupplier clock;
  private final long allowed;
  private long start;
  private boolean greedy;

  /** Allows {@code millisAllowed} milliseconds from now. */
  public TimeLimitingCollector(Collector collector, long millisAllowed) {
    this(collector, MILLIS, millisAllowed);
  }

  /** Allows {@code ticksAllowed} ticks of {@code clock} from now. */
  public TimeLimitingCollector(Collector collector, LongSupplier clock, long ticksAllowed) {
    if (ticksAllowed < 0) {
      throw new IllegalArgumentException("allowed time cannot be negative: " + ticksAllowed);
    }
    this.collector = collector;
    this.clock = clock;
    this.allowed = ticksAllowed;
    setBaseline();
  }

  /** Starts the budget over, for reuse in another search. */
  public void setBaseline() {
    start = clock.getAsLong();
  }

  public boolean isGreedy() {
    return greedy;
  }

  /** Whether the hit that finds the budget spent is still passed on before stopping. */
  public void setGreedy(boolean greedy) {
    this.greedy = greedy;
  }

  private void checkTime(int lastDoc) {
    long elapsed = clock.getAsLong() - start;
    if (elapsed > allowed) {
      throw new TimeExceededException(allowed, elapsed, lastDoc);
    }
  }

  @Override
  public LeafCollector getLeafCollector(LeafReaderContext context) throws IOException {
    checkTime(-1);
    final int docBase = context.docBase;
    final LeafCollector in = collector.getLeafCollector(context);
    return new LeafCollector() {
      @Override
      public void setScorer(Scorable scorer) throws IOException {
        in.setScorer(scorer);
      }

      @Override
      public void collect(int doc) throws IOException {
        long elapsed = clock.getAsLong() - start;
        if (elapsed > allowed) {
          if (greedy) {
            in.collect(doc);
          }
          throw new TimeExceededException(allowed, elapsed, docBase + doc);
        }
        in.collect(doc);
      }
    };
  }

  @Override
  public boolean needsScores() {
    return collector.needsScores();
  }
}
