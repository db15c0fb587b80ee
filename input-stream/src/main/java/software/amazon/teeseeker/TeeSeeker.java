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
package software.amazon.teeseeker;

import com.google.common.base.Preconditions;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.teeseeker.exceptions.SeekOffsetOutOfRangeException;
import software.amazon.teeseeker.exceptions.UnsupportedSeekOriginException;

/**
 * A seekable stream that copies every byte it sees for the first time from a source into a sink.
 *
 * <p>The sink always holds exactly the first {@link #getHighWaterMark()} bytes of the source, in
 * order and without duplicates. Seeking backward, or forward within that prefix, only repositions
 * the source. Seeking past the prefix reads the skipped bytes from the source and writes them to
 * the sink, because the sink cannot have gaps. Seeks relative to the end of the source are
 * rejected.
 *
 * <p>The tee owns both streams: {@link #close()} closes them, and the sink is only flushed when
 * {@link #flushSink()} is called. Reads and seeks start at offset 0 without asking the source
 * where it is.
 *
 * <p>Don't share between threads. Calling {@link #seek(SeekRequest) seek} and {@link #read()
 * read} concurrently from two different threads is undefined.
 */
public class TeeSeeker extends SeekableInputStream {
  private static final Logger LOG = LoggerFactory.getLogger(TeeSeeker.class);

  private final SeekableInputStream source;
  private final OutputStream sink;
  private final TeeSeekerConfiguration configuration;
  private final byte[] singleByte = new byte[1];

  private long position;

  /**
   * Length of the source prefix already written to the sink; the furthest offset ever reached.
   *
   * @return the high water mark
   */
  @Getter private long highWaterMark;

  /**
   * Creates a new instance of {@link TeeSeeker} with default settings.
   *
   * @param source stream to read from; must be positioned at offset 0
   * @param sink stream receiving the mirrored prefix of {@code source}
   */
  public TeeSeeker(@NonNull SeekableInputStream source, @NonNull OutputStream sink) {
    this(source, sink, TeeSeekerConfiguration.DEFAULT);
  }

  /**
   * Creates a new instance of {@link TeeSeeker}.
   *
   * @param source stream to read from; must be positioned at offset 0
   * @param sink stream receiving the mirrored prefix of {@code source}
   * @param configuration an instance of {@link TeeSeekerConfiguration}
   */
  public TeeSeeker(
      @NonNull SeekableInputStream source,
      @NonNull OutputStream sink,
      @NonNull TeeSeekerConfiguration configuration) {
    this.source = source;
    this.sink = sink;
    this.configuration = configuration;
    this.position = 0;
    this.highWaterMark = 0;
  }

  @Override
  public int read() throws IOException {
    int bytesRead = read(singleByte, 0, 1);
    return bytesRead <= 0 ? -1 : singleByte[0] & 0xFF;
  }

  @Override
  public int read(byte[] buffer, int offset, int length) throws IOException {
    Objects.checkFromIndexSize(offset, length, buffer.length);
    checkPositionInvariant();
    if (length == 0) {
      return 0;
    }

    int bytesRead = source.read(buffer, offset, length);
    if (bytesRead <= 0) {
      return bytesRead;
    }

    this.position += bytesRead;
    if (this.position > this.highWaterMark) {
      // Only the tail past the old high water mark is new to the sink
      int unseen = (int) (this.position - this.highWaterMark);
      mirror(buffer, offset + bytesRead - unseen, unseen);
    }
    return bytesRead;
  }

  /**
   * Seeks to an absolute position. Equivalent to {@code seek(SeekRequest.start(pos))}.
   *
   * @param pos the position to jump to, in bytes (zero-indexed)
   * @throws IOException if the source fails, the sink fails, or the source ends before {@code pos}
   */
  @Override
  public void seek(long pos) throws IOException {
    seek(SeekRequest.start(pos));
  }

  /**
   * Moves the read position. Destinations inside the mirrored prefix only reposition the source.
   * Destinations beyond it first copy the bytes between the high water mark and the destination
   * from the source into the sink.
   *
   * <p>If the source ends before the destination, the bytes that were available stay mirrored and
   * the position is left at the end of the source.
   *
   * @param request where to seek to
   * @return the new position
   * @throws SeekOffsetOutOfRangeException if the destination is negative or overflows a long
   * @throws UnsupportedSeekOriginException if the request is relative to the end of the stream
   * @throws EOFException if the source ends before the destination
   * @throws IOException if the source or the sink fail
   */
  public long seek(@NonNull SeekRequest request) throws IOException {
    checkPositionInvariant();
    long destination = resolve(request);
    LOG.debug(
        "Seeking to {} from position {} with high water mark {}",
        destination,
        this.position,
        this.highWaterMark);

    if (destination <= this.highWaterMark) {
      source.seek(destination);
      this.position = destination;
      return this.position;
    }

    source.seek(this.highWaterMark);
    this.position = this.highWaterMark;
    copyToSink(destination - this.highWaterMark);
    if (this.position != destination) {
      LOG.debug("Source ended at {} before seek destination {}", this.position, destination);
      throw new EOFException("seek behind EOF");
    }
    return this.position;
  }

  @Override
  public long getPos() {
    return this.position;
  }

  /**
   * Flushes the sink. The tee never flushes on its own.
   *
   * @throws IOException if the sink fails to flush
   */
  public void flushSink() throws IOException {
    sink.flush();
  }

  @Override
  public int available() throws IOException {
    return source.available();
  }

  /**
   * Closes the source and then the sink. The sink is closed even if closing the source fails.
   *
   * @throws IOException if either stream fails to close
   */
  @Override
  public void close() throws IOException {
    try {
      source.close();
    } finally {
      sink.close();
    }
  }

  private long resolve(SeekRequest request) throws SeekOffsetOutOfRangeException {
    long destination;
    switch (request.getOrigin()) {
      case START:
        destination = request.getOffset();
        break;
      case CURRENT:
        try {
          destination = Math.addExact(this.position, request.getOffset());
        } catch (ArithmeticException e) {
          throw new SeekOffsetOutOfRangeException(
              "offset change overflows a signed 64-bit position", e);
        }
        break;
      default:
        throw new UnsupportedSeekOriginException(request.getOrigin());
    }

    if (destination < 0) {
      throw new SeekOffsetOutOfRangeException("resultant offset is negative: " + destination);
    }
    return destination;
  }

  /**
   * Copies up to {@code length} bytes from the source into the sink, stopping early at the end of
   * the source. Position and high water mark advance together with every chunk written.
   */
  private void copyToSink(long length) throws IOException {
    byte[] buffer = new byte[(int) Math.min(configuration.getCopyBufferSize(), length)];
    long remaining = length;
    while (remaining > 0) {
      int bytesRead = source.read(buffer, 0, (int) Math.min(buffer.length, remaining));
      if (bytesRead <= 0) {
        break;
      }
      this.position += bytesRead;
      mirror(buffer, 0, bytesRead);
      remaining -= bytesRead;
    }
  }

  /**
   * Writes bytes that extend the mirrored prefix. The source has already moved past them, so if
   * the sink fails the source is rewound to the high water mark and the next read or seek mirrors
   * them again.
   */
  private void mirror(byte[] buffer, int offset, int length) throws IOException {
    try {
      sink.write(buffer, offset, length);
    } catch (IOException e) {
      rewindToHighWaterMark(e);
      throw e;
    }
    this.highWaterMark += length;
  }

  private void rewindToHighWaterMark(IOException cause) {
    try {
      source.seek(this.highWaterMark);
      this.position = this.highWaterMark;
    } catch (IOException rewindFailure) {
      cause.addSuppressed(rewindFailure);
    }
  }

  private void checkPositionInvariant() {
    Preconditions.checkState(
        this.position <= this.highWaterMark,
        "position %s is past the high water mark %s",
        this.position,
        this.highWaterMark);
  }
}
