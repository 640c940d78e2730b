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
package org.fathom.search.grouping;

/**
 * Represents a group that is found during the first pass search.
 *
 * @param <T> the type of the group value
 */
public class SearchGroup<T> {

  /** The value that defines this group, null for documents without a value */
  public T groupValue;

  /** The best score of the group's hits. */
  public float score;

  /** Global id of the hit that gave the best score. */
  public int topDoc;

  SearchGroup(T groupValue, float score, int topDoc) {
    this.groupValue = groupValue;
    this.score = score;
    this.topDoc = topDoc;
  }

  @Override
  public String toString() {
    return "SearchGroup(groupValue=" + groupValue + " score=" + score + " topDoc=" + topDoc + ")";
  }
}
