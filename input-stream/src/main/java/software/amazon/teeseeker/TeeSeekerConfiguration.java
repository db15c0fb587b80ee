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
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import software.amazon.teeseeker.common.ConnectorConfiguration;

/** Configuration for {@link TeeSeeker} */
@Getter
@EqualsAndHashCode
public class TeeSeekerConfiguration {
  private static final int ONE_KB = 1024;
  private static final int DEFAULT_COPY_BUFFER_SIZE = 8 * ONE_KB;

  /**
   * Size of the buffer used to copy skipped bytes into the sink on a forward seek. {@link
   * TeeSeekerConfiguration#DEFAULT_COPY_BUFFER_SIZE} by default.
   */
  private final int copyBufferSize;

  private static final String COPY_BUFFER_SIZE_KEY = "copy.buffer.size";

  /** Default set of settings for {@link TeeSeeker} */
  public static final TeeSeekerConfiguration DEFAULT = TeeSeekerConfiguration.builder().build();

  /**
   * Constructs {@link TeeSeekerConfiguration} from {@link ConnectorConfiguration} object.
   *
   * @param configuration Configuration object to generate TeeSeekerConfiguration from
   * @return TeeSeekerConfiguration
   */
  public static TeeSeekerConfiguration fromConfiguration(ConnectorConfiguration configuration) {
    return TeeSeekerConfiguration.builder()
        .copyBufferSize(configuration.getInt(COPY_BUFFER_SIZE_KEY, DEFAULT_COPY_BUFFER_SIZE))
        .build();
  }

  /**
   * Constructs {@link TeeSeekerConfiguration}.
   *
   * @param copyBufferSize forward seek copy buffer size, in bytes
   */
  @Builder
  private TeeSeekerConfiguration(Integer copyBufferSize) {
    int bufferSize = copyBufferSize == null ? DEFAULT_COPY_BUFFER_SIZE : copyBufferSize;
    Preconditions.checkArgument(bufferSize > 0, "`copyBufferSize` must be positive");

    this.copyBufferSize = bufferSize;
  }
}
