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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

/**
 * Per-dimension arithmetic and comparison over {@link ResourceList}s.
 * Every operation treats a missing dimension as zero.
 */
@Public
@Unstable
public final class Resources {

  private Resources() {
  }

  public static ResourceList none() {
    return ResourceList.NONE;
  }

  /**
   * Union of the resource names of all the given lists.
   */
  public static Set<String> resourceNames(ResourceList... lists) {
    Set<String> names = new TreeSet<String>();
    for (ResourceList list : lists) {
      if (list != null) {
        names.addAll(list.getResourceNames());
      }
    }
    return names;
  }

  public static ResourceList add(ResourceList lhs, ResourceList rhs) {
    Map<String, Long> result = new TreeMap<String, Long>(lhs.asMap());
    for (Map.Entry<String, Long> entry : rhs.asMap().entrySet()) {
      Long current = result.get(entry.getKey());
      result.put(entry.getKey(),
          (current == null ? 0L : current) + entry.getValue());
    }
    return ResourceList.newInstance(result);
  }

  /**
   * <code>lhs - rhs</code> with every dimension floored at zero.
   */
  public static ResourceList subtractNonNegative(ResourceList lhs,
      ResourceList rhs) {
    Map<String, Long> result = new TreeMap<String, Long>();
    for (Map.Entry<String, Long> entry : lhs.asMap().entrySet()) {
      long value = entry.getValue() - rhs.get(entry.getKey());
      if (value > 0) {
        result.put(entry.getKey(), value);
      }
    }
    return ResourceList.newInstance(result);
  }

  public static ResourceList componentwiseMin(ResourceList lhs,
      ResourceList rhs) {
    Map<String, Long> result = new TreeMap<String, Long>();
    for (String name : resourceNames(lhs, rhs)) {
      result.put(name, Math.min(lhs.get(name), rhs.get(name)));
    }
    return ResourceList.newInstance(result);
  }

  public static ResourceList componentwiseMax(ResourceList lhs,
      ResourceList rhs) {
    Map<String, Long> result = new TreeMap<String, Long>();
    for (String name : resourceNames(lhs, rhs)) {
      result.put(name, Math.max(lhs.get(name), rhs.get(name)));
    }
    return ResourceList.newInstance(result);
  }

  /**
   * Keep only the named dimensions of <code>list</code>.
   */
  public static ResourceList mask(ResourceList list, Collection<String> names) {
    Map<String, Long> result = new TreeMap<String, Long>();
    for (String name : names) {
      result.put(name, list.get(name));
    }
    return ResourceList.newInstance(result);
  }

  /**
   * @return true if every dimension of <code>lhs</code> is no greater than
   *         the same dimension of <code>rhs</code>
   */
  public static boolean fitsIn(ResourceList lhs, ResourceList rhs) {
    return exceededDimensions(lhs, rhs).isEmpty();
  }

  /**
   * The dimensions on which <code>lhs</code> is greater than
   * <code>rhs</code>, sorted by name.
   */
  public static List<String> exceededDimensions(ResourceList lhs,
      ResourceList rhs) {
    return exceededDimensions(lhs, rhs, lhs.getResourceNames());
  }

  /**
   * The dimensions among <code>names</code> on which <code>lhs</code> is
   * greater than <code>rhs</code>, sorted by name.
   */
  public static List<String> exceededDimensions(ResourceList lhs,
      ResourceList rhs, Collection<String> names) {
    List<String> exceeded = new ArrayList<String>();
    for (String name : new TreeSet<String>(names)) {
      if (lhs.get(name) > rhs.get(name)) {
        exceeded.add(name);
      }
    }
    return exceeded;
  }

  /**
   * @return true if <code>list</code> has a non-zero quantity for any of
   *         <code>names</code>
   */
  public static boolean intersects(ResourceList list,
      Collection<String> names) {
    for (String name : names) {
      if (list.get(name) > 0) {
        return true;
      }
    }
    return false;
  }
}
