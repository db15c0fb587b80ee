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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A position to seek to, expressed relative to an {@link Origin}. The offset is signed: it may be
 * negative for {@link Origin#CURRENT} and {@link Origin#END}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SeekRequest {
  @NonNull Origin origin;
  long offset;

  /** Reference point a {@link SeekRequest} offset is applied to. */
  public enum Origin {
    /** Offset counts from the first byte of the stream. */
    START,
    /** Offset is added to the current position. */
    CURRENT,
    /** Offset is added to the length of the stream. */
    END
  }

  /**
   * Seek to an absolute offset.
   *
   * @param offset distance from the start of the stream
   * @return the request
   */
  public static SeekRequest start(long offset) {
    return new SeekRequest(Origin.START, offset);
  }

  /**
   * Seek relative to the current position.
   *
   * @param delta signed distance from the current position
   * @return the request
   */
  public static SeekRequest current(long delta) {
    return new SeekRequest(Origin.CURRENT, delta);
  }

  /**
   * Seek relative to the end of the stream.
   *
   * @param delta signed distance from the end of the stream
   * @return the request
   */
  public static SeekRequest end(long delta) {
    return new SeekRequest(Origin.END, delta);
  }
}
