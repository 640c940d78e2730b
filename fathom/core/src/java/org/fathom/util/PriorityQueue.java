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
package org.fathom.util;


import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * A bounded binary min-heap ordered by {@link #lessThan}. The least element
 * is at {@link #top()}; adding and popping take logarithmic time.
 *
 * <p>Collectors that keep the best {@code n} hits create the queue full of
 * sentinels, which compare below every real entry, and then only replace
 * the top.
 *
 * @fathom.internal
 */
public abstract class PriorityQueue<T> implements Iterable<T> {

  // 1-based: the children of slot i are 2i and 2i+1, slot 0 stays empty
  private final T[] heap;
  private final int maxSize;
  private int size;

  public PriorityQueue(int maxSize) {
    this(maxSize, null);
  }

  /**
   * @param sentinels if not null and it returns non-null values, the queue
   *        starts full of them
   */
  public PriorityQueue(int maxSize, Supplier<T> sentinels) {
    if (maxSize < 0 || maxSize >= ArrayUtil.MAX_ARRAY_LENGTH) {
      throw new IllegalArgumentException("maxSize must be in [0, " + ArrayUtil.MAX_ARRAY_LENGTH + "): " + maxSize);
    }
    @SuppressWarnings("unchecked")
    final T[] h = (T[]) new Object[Math.max(2, maxSize + 1)];
    this.heap = h;
    this.maxSize = maxSize;
    if (sentinels != null && maxSize > 0) {
      T first = sentinels.get();
      if (first != null) {
        heap[1] = first;
        for (int i = 2; i <= maxSize; i++) {
          heap[i] = sentinels.get();
        }
        size = maxSize;
      }
    }
  }

  /** @return true if {@code a} sorts before {@code b} */
  protected abstract boolean lessThan(T a, T b);

  /**
   * Adds {@code element} and returns the new top.
   *
   * @throws ArrayIndexOutOfBoundsException if the queue is full
   */
  public final T add(T element) {
    heap[++size] = element;
    siftUp(size);
    return heap[1];
  }

  /**
   * Adds {@code element}, evicting the least element if the queue is full.
   * Returns whatever did not stay: null if nothing was evicted, the old
   * top, or {@code element} itself when it does not beat the top.
   */
  public T insertWithOverflow(T element) {
    if (size < maxSize) {
      add(element);
      return null;
    }
    if (size == 0 || lessThan(heap[1], element) == false) {
      return element;
    }
    T evicted = heap[1];
    heap[1] = element;
    siftDown(1);
    return evicted;
  }

  /** The least element, or null if the queue is empty. */
  public final T top() {
    return heap[1];
  }

  /** Removes and returns the least element, or null if the queue is empty. */
  public final T pop() {
    if (size == 0) {
      return null;
    }
    T least = heap[1];
    heap[1] = heap[size];
    heap[size--] = null;
    siftDown(1);
    return least;
  }

  /** Restores the heap after the top element changed in place, and returns the new top. */
  public final T updateTop() {
    siftDown(1);
    return heap[1];
  }

  public final int size() {
    return size;
  }

  public final void clear() {
    for (int i = 1; i <= size; i++) {
      heap[i] = null;
    }
    size = 0;
  }

  private void siftUp(int slot) {
    T moving = heap[slot];
    while (slot > 1 && lessThan(moving, heap[slot >>> 1])) {
      heap[slot] = heap[slot >>> 1];
      slot >>>= 1;
    }
    heap[slot] = moving;
  }

  private void siftDown(int slot) {
    T moving = heap[slot];
    while (true) {
      int child = slot << 1;
      if (child > size) {
        break;
      }
      if (child < size && lessThan(heap[child + 1], heap[child])) {
        child++;
      }
      if (lessThan(heap[child], moving) == false) {
        break;
      }
      heap[slot] = heap[child];
      slot = child;
    }
    heap[slot] = moving;
  }

  /** The backing array; slot 0 is unused and slots past {@link #size()} are null. */
  protected final Object[] getHeapArray() {
    return heap;
  }

  /** Iterates in heap order, not in sorted order. */
  @Override
  public Iterator<T> iterator() {
    return new Iterator<T>() {
      private int next = 1;

      @Override
      public boolean hasNext() {
        return next <= size;
      }

      @Override
      public T next() {
        if (next > size) {
          throw new NoSuchElementException();
        }
        return heap[next++];
      }
    };
  }
}
