/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.elasticquota.resource;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.lang.StringUtils;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

import com.google.common.collect.ImmutableSortedMap;

/**
 * An immutable vector of named resource quantities, e.g.
 * <code>cpu=4000,memory=8192,nvidia.com/gpu=1</code>.
 * <p>
 * A resource which is not present in the list has a quantity of zero, so
 * zero entries are dropped on construction and two lists are equal when they
 * agree on every non-zero dimension. Quantities are never negative.
 */
@Public
@Unstable
public final class ResourceList {

  public static final ResourceList NONE =
      new ResourceList(ImmutableSortedMap.<String, Long>of());

  private static final String ENTRY_SEPARATOR = ",";
  private static final String VALUE_SEPARATOR = "=";

  private final ImmutableSortedMap<String, Long> quantities;

  private ResourceList(ImmutableSortedMap<String, Long> quantities) {
    this.quantities = quantities;
  }

  /**
   * Create a resource list from a name to quantity mapping.
   * @throws IllegalArgumentException if a quantity is negative
   */
  public static ResourceList newInstance(Map<String, Long> quantities) {
    if (quantities == null || quantities.isEmpty()) {
      return NONE;
    }
    ImmutableSortedMap.Builder<String, Long> builder =
        ImmutableSortedMap.naturalOrder();
    boolean empty = true;
    for (Map.Entry<String, Long> entry : quantities.entrySet()) {
      String name = entry.getKey();
      Long value = entry.getValue();
      if (StringUtils.isBlank(name)) {
        throw new IllegalArgumentException("Resource name must not be empty");
      }
      if (value == null || value < 0) {
        throw new IllegalArgumentException("Illegal quantity " + value
            + " for resource " + name);
      }
      if (value > 0) {
        builder.put(name.trim(), value);
        empty = false;
      }
    }
    return empty ? NONE : new ResourceList(builder.build());
  }

  public static ResourceList of(String name, long value) {
    Map<String, Long> map = new TreeMap<String, Long>();
    map.put(name, value);
    return newInstance(map);
  }

  public static ResourceList of(String name1, long value1,
      String name2, long value2) {
    Map<String, Long> map = new TreeMap<String, Long>();
    map.put(name1, value1);
    map.put(name2, value2);
    return newInstance(map);
  }

  /**
   * Parse the text form <code>name=quantity[,name=quantity...]</code>.
   * A null or blank string yields {@link #NONE}.
   * @throws IllegalArgumentException on a malformed entry or negative value
   */
  public static ResourceList parse(String text) {
    if (StringUtils.isBlank(text)) {
      return NONE;
    }
    Map<String, Long> map = new TreeMap<String, Long>();
    for (String entry : StringUtils.split(text, ENTRY_SEPARATOR)) {
      if (StringUtils.isBlank(entry)) {
        continue;
      }
      String[] pair = entry.split(VALUE_SEPARATOR, 2);
      if (pair.length != 2 || StringUtils.isBlank(pair[0])) {
        throw new IllegalArgumentException("Malformed resource entry '"
            + entry + "' in '" + text + "'");
      }
      long value;
      try {
        value = Long.parseLong(pair[1].trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Malformed quantity '" + pair[1]
            + "' for resource " + pair[0].trim(), e);
      }
      map.put(pair[0].trim(), value);
    }
    return newInstance(map);
  }

  /**
   * @return the quantity of the named resource, zero when absent
   */
  public long get(String name) {
    Long value = quantities.get(name);
    return value == null ? 0L : value;
  }

  public Set<String> getResourceNames() {
    return quantities.keySet();
  }

  public boolean isEmpty() {
    return quantities.isEmpty();
  }

  public Map<String, Long> asMap() {
    return quantities;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ResourceList)) {
      return false;
    }
    return quantities.equals(((ResourceList) obj).quantities);
  }

  @Override
  public int hashCode() {
    return quantities.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Long> entry : quantities.entrySet()) {
      if (sb.length() > 0) {
        sb.append(ENTRY_SEPARATOR);
      }
      sb.append(entry.getKey()).append(VALUE_SEPARATOR)
          .append(entry.getValue());
    }
    return sb.toString();
  }
}
