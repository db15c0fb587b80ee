/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package software.amazon.teeseeker.streams;

import java.io.EOFException;
import java.io.IOException;
import java.util.Objects;
import lombok.NonNull;
import software.amazon.teeseeker.SeekableInputStream;

/**
 * A {@link SeekableInputStream} over a byte array that hands out at most {@code maxBytesPerRead}
 * bytes per read call, so callers relying on full reads get caught. Seeking beyond the end fails.
 */
public class InMemorySeekableStream extends SeekableInputStream {
  private final byte[] data;
  private final int maxBytesPerRead;
  private int position;

  /**
   * Creates a stream that returns as much as requested on every read.
   *
   * @param data contents of the stream
   */
  public InMemorySeekableStream(@NonNull byte[] data) {
    this(data, Integer.MAX_VALUE);
  }

  /**
   * Creates a stream that returns at most {@code maxBytesPerRead} bytes on every read.
   *
   * @param data contents of the stream
   * @param maxBytesPerRead upper bound on bytes returned by a single read
   */
  public InMemorySeekableStream(@NonNull byte[] data, int maxBytesPerRead) {
    if (maxBytesPerRead <= 0) {
      throw new IllegalArgumentException("maxBytesPerRead must be positive");
    }
    this.data = data.clone();
    this.maxBytesPerRead = maxBytesPerRead;
    this.position = 0;
  }

  @Override
  public int read() {
    if (position >= data.length) {
      return -1;
    }
    return data[position++] & 0xFF;
  }

  @Override
  public int read(byte[] buffer, int offset, int length) {
    Objects.checkFromIndexSize(offset, length, buffer.length);
    if (length == 0) {
      return 0;
    }
    if (position >= data.length) {
      return -1;
    }
    int count = Math.min(Math.min(length, maxBytesPerRead), data.length - position);
    System.arraycopy(data, position, buffer, offset, count);
    position += count;
    return count;
  }

  @Override
  public void seek(long pos) throws IOException {
    if (pos < 0) {
      throw new IOException("seeking before start of stream: " + pos);
    }
    if (pos > data.length) {
      throw new EOFException("seeking behind EOF: " + pos);
    }
    this.position = (int) pos;
  }

  @Override
  public long getPos() {
    return position;
  }

  @Override
  public int available() {
    return data.length - position;
  }
}
