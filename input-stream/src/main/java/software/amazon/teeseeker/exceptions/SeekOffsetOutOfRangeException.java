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

import java.io.IOException;

/** Thrown when a seek request resolves to an offset that a stream position cannot hold. */
public class SeekOffsetOutOfRangeException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new {@link SeekOffsetOutOfRangeException}.
   *
   * @param message description of the offending offset
   */
  public SeekOffsetOutOfRangeException(String message) {
    super(message);
  }

  /**
   * Creates a new {@link SeekOffsetOutOfRangeException}.
   *
   * @param message description of the offending offset
   * @param cause arithmetic failure that was detected
   */
  public SeekOffsetOutOfRangeException(String message, Throwable cause) {
    super(message, cause);
  }
}
