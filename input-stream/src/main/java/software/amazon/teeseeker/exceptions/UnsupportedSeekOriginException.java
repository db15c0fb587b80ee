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
package software.amazon.teeseeker.exceptions;

import lombok.Getter;
import software.amazon.teeseeker.SeekRequest;

/**
 * Thrown when a stream is asked to seek relative to an origin it cannot resolve. A tee cannot
 * learn the length of its source without reading all of it, so {@link SeekRequest.Origin#END} is
 * rejected rather than approximated.
 */
public class UnsupportedSeekOriginException extends UnsupportedOperationException {
  private static final long serialVersionUID = 1L;

  @Getter private final SeekRequest.Origin origin;

  /**
   * Creates a new {@link UnsupportedSeekOriginException}.
   *
   * @param origin the rejected origin
   */
  public UnsupportedSeekOriginException(SeekRequest.Origin origin) {
    super("Seeking relative to " + origin + " is not supported");
    this.origin = origin;
  }
}
