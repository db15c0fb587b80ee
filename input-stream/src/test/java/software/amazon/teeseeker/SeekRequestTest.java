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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class SeekRequestTest {

  @Test
  void testFactoriesSetOrigin() {
    assertEquals(SeekRequest.Origin.START, SeekRequest.start(3).getOrigin());
    assertEquals(SeekRequest.Origin.CURRENT, SeekRequest.current(-3).getOrigin());
    assertEquals(SeekRequest.Origin.END, SeekRequest.end(0).getOrigin());
    assertEquals(-3, SeekRequest.current(-3).getOffset());
  }

  @Test
  void testEquality() {
    assertEquals(SeekRequest.start(5), SeekRequest.start(5));
    assertNotEquals(SeekRequest.start(5), SeekRequest.current(5));
    assertNotEquals(SeekRequest.start(5), SeekRequest.start(6));
  }
}
