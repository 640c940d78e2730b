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
package org.fathom.analysis;


import java.io.Closeable;
import java.io.IOException;

/**
 * A <code>TokenStream</code> enumerates the sequence of tokens of one field
 * value. Streams are produced outside the index: the index only consumes
 * them.
 * <p>
 * <b>The workflow of the <code>TokenStream</code> API is as follows:</b>
 * <ol>
 * <li>The consumer calls {@link TokenStream#reset()}.
 * <li>The consumer calls {@link #incrementToken()} until it returns false,
 * reading {@link #token()} after each call.
 * <li>The consumer calls {@link #end()} so that any end-of-stream operations
 * can be performed.
 * <li>The consumer calls {@link #close()} to release any resource when finished
 * using the <code>TokenStream</code>.
 * </ol>
 * A stream is consumed exactly once. Token positions must not decrease.
 */
public abstract class TokenStream implements Closeable {

  /** The token filled by {@link #incrementToken()}. */
  protected final Token token = new Token();

  /**
   * Sole constructor.
   */
  protected TokenStream() {
  }

  /**
   * Consumers use this method to advance the stream to
   * the next token. Implementing classes must implement this method and update
   * {@link #token} with the attributes of the next token.
   *
   * @return false for end of stream; true otherwise
   */
  public abstract boolean incrementToken() throws IOException;

  /** Returns the current token; valid until the next call to {@link #incrementToken()}. */
  public final Token token() {
    return token;
  }

  /**
   * This method is called by the consumer after the last token has been
   * consumed, after {@link #incrementToken()} returned <code>false</code>.
   */
  public void end() throws IOException {
  }

  /**
   * This method is called by a consumer before it begins consumption using
   * {@link #incrementToken()}.
   */
  public void reset() throws IOException {
  }

  /** Releases resources associated with this stream. */
  @Override
  public void close() throws IOException {
  }
}
