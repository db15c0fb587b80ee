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
package software.amazon.teeseeker.common;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.Getter;
import lombok.NonNull;

/**
 * Key-value settings handed down by whoever embeds a tee stream. All keys share a common prefix;
 * entries whose key does not start with that prefix are dropped on construction.
 *
 * <p>Given the entries {@code teeseeker.copy.buffer.size = 4096} and {@code other.key = 1}, the
 * instance {@code new ConnectorConfiguration(map, "teeseeker")} answers {@code
 * getInt("copy.buffer.size", 0)} with 4096 and never sees {@code other.key}. Use {@link
 * #map(String)} to narrow the prefix further for a nested component.
 */
public class ConnectorConfiguration {

  /**
   * Common prefix of every key held by this configuration.
   *
   * @return the prefix, without a trailing dot
   */
  @Getter private final String prefix;

  private final Map<String, String> configuration;

  /**
   * Creates a {@link ConnectorConfiguration} from a map of settings.
   *
   * @param configurationMap upstream settings
   * @param prefix prefix that keys must start with to be kept
   */
  public ConnectorConfiguration(
      @NonNull Map<String, String> configurationMap, @NonNull String prefix) {
    this(configurationMap.entrySet(), prefix);
  }

  /**
   * Creates a {@link ConnectorConfiguration} from an iterable of entries.
   *
   * @param iterableConfiguration upstream settings
   * @param prefix prefix that keys must start with to be kept
   */
  public ConnectorConfiguration(
      @NonNull Iterable<Map.Entry<String, String>> iterableConfiguration, @NonNull String prefix) {
    this.prefix = prefix;
    this.configuration =
        StreamSupport.stream(iterableConfiguration.spliterator(), false)
            .filter(entry -> entry.getKey().startsWith(prefix))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  /**
   * Returns a view of this configuration scoped to {@code getPrefix() + "." + appendPrefix}.
   *
   * @param appendPrefix segment appended to the current prefix
   * @return the narrowed configuration
   */
  public ConnectorConfiguration map(@NonNull String appendPrefix) {
    return new ConnectorConfiguration(this.configuration, fullKey(appendPrefix));
  }

  /**
   * Reads an int setting.
   *
   * @param key key relative to the prefix
   * @param defaultValue value returned when the key is absent
   * @return the parsed value, or {@code defaultValue}
   * @throws NumberFormatException if the stored value is not an int
   */
  public int getInt(String key, int defaultValue) throws NumberFormatException {
    String value = configuration.get(fullKey(key));
    return value != null ? Integer.parseInt(value.trim()) : defaultValue;
  }

  /**
   * Reads a long setting.
   *
   * @param key key relative to the prefix
   * @param defaultValue value returned when the key is absent
   * @return the parsed value, or {@code defaultValue}
   * @throws NumberFormatException if the stored value is not a long
   */
  public long getLong(String key, long defaultValue) throws NumberFormatException {
    String value = configuration.get(fullKey(key));
    return value != null ? Long.parseLong(value.trim()) : defaultValue;
  }

  /**
   * Reads a boolean setting. Anything other than "true" (ignoring case) reads as false.
   *
   * @param key key relative to the prefix
   * @param defaultValue value returned when the key is absent
   * @return the parsed value, or {@code defaultValue}
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = configuration.get(fullKey(key));
    return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
  }

  /**
   * Reads a string setting.
   *
   * @param key key relative to the prefix
   * @param defaultValue value returned when the key is absent
   * @return the stored value, or {@code defaultValue}
   */
  public String getString(String key, String defaultValue) {
    return configuration.getOrDefault(fullKey(key), defaultValue);
  }

  private String fullKey(String key) {
    return this.prefix + '.' + key;
  }
}
