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

package org.apache.elasticquota.scheduler.quota;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.elasticquota.resource.ResourceList;
import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

/**
 * Splits the runtime of a parent group among its children.
 * <p>
 * Every dimension is handled on its own. A child is first guaranteed its
 * min. What is left is water-filled among the children that still ask for
 * more, weighted by shared weight and capped at
 * <code>max(min, min(max, request))</code>. If the mins alone do not fit in
 * the parent, the parent is split by weight with each child capped at its min
 * and the result is flagged as over committed.
 * <p>
 * The calculator holds no state and is safe to share.
 */
@Private
@Unstable
public class RuntimeQuotaCalculator {

  /** Input describing one child. */
  public static class ChildDemand {
    private final String name;
    private final ResourceList min;
    private final ResourceList max;
    private final ResourceList weight;
    private final ResourceList request;

    public ChildDemand(String name, ResourceList min, ResourceList max,
        ResourceList weight, ResourceList request) {
      this.name = name;
      this.min = min;
      this.max = max;
      this.weight = weight;
      this.request = request;
    }

    public String getName() {
      return name;
    }
  }

  /** Runtime of every child plus the dimensions whose mins did not fit. */
  public static class Result {
    private final Map<String, ResourceList> runtimes;
    private final Set<String> overCommittedResources;

    Result(Map<String, ResourceList> runtimes,
        Set<String> overCommittedResources) {
      this.runtimes = Collections.unmodifiableMap(runtimes);
      this.overCommittedResources =
          Collections.unmodifiableSet(overCommittedResources);
    }

    public ResourceList getRuntime(String child) {
      ResourceList runtime = runtimes.get(child);
      return runtime == null ? ResourceList.NONE : runtime;
    }

    public Map<String, ResourceList> getRuntimes() {
      return runtimes;
    }

    public boolean isOverCommitted() {
      return !overCommittedResources.isEmpty();
    }

    public Set<String> getOverCommittedResources() {
      return overCommittedResources;
    }
  }

  public Result computeChildrenRuntime(ResourceList parentRuntime,
      List<ChildDemand> children) {
    Set<String> resourceNames =
        new TreeSet<String>(parentRuntime.getResourceNames());
    for (ChildDemand child : children) {
      resourceNames.addAll(child.min.getResourceNames());
      resourceNames.addAll(child.request.getResourceNames());
    }

    int n = children.size();
    List<Map<String, Long>> quantities = new ArrayList<Map<String, Long>>(n);
    for (int i = 0; i < n; i++) {
      quantities.add(new TreeMap<String, Long>());
    }
    Set<String> overCommitted = new TreeSet<String>();

    long[] min = new long[n];
    long[] max = new long[n];
    long[] weight = new long[n];
    long[] request = new long[n];
    for (String resource : resourceNames) {
      for (int i = 0; i < n; i++) {
        ChildDemand child = children.get(i);
        min[i] = child.min.get(resource);
        max[i] = child.max.get(resource);
        weight[i] = child.weight.get(resource);
        request[i] = child.request.get(resource);
      }
      long[] allocated = computeDimension(parentRuntime.get(resource), min,
          max, weight, request);
      if (allocated == null) {
        overCommitted.add(resource);
        allocated = computeOverCommitted(parentRuntime.get(resource), min,
            weight);
      }
      for (int i = 0; i < n; i++) {
        quantities.get(i).put(resource, allocated[i]);
      }
    }

    Map<String, ResourceList> runtimes = new HashMap<String, ResourceList>();
    for (int i = 0; i < n; i++) {
      runtimes.put(children.get(i).name,
          ResourceList.newInstance(quantities.get(i)));
    }
    return new Result(runtimes, overCommitted);
  }

  /**
   * @return the per child share of <code>bound</code>, or null if the sum of
   *         the mins does not fit in it
   */
  static long[] computeDimension(long bound, long[] min, long[] max,
      long[] weight, long[] request) {
    int n = min.length;
    long sumMin = 0;
    for (int i = 0; i < n; i++) {
      sumMin = saturatedAdd(sumMin, min[i]);
    }
    if (sumMin > bound) {
      return null;
    }
    long[] allocated = new long[n];
    long[] limit = new long[n];
    for (int i = 0; i < n; i++) {
      allocated[i] = min[i];
      // a child never gets more than it asks for nor more than its max
      limit[i] = Math.max(min[i], Math.min(max[i], request[i]));
    }
    waterFill(allocated, limit, weight, bound - sumMin);
    return allocated;
  }

  /**
   * Split <code>bound</code> by weight with every child capped at its min.
   * A child without weight is weighted by its min so it is not starved.
   */
  static long[] computeOverCommitted(long bound, long[] min, long[] weight) {
    int n = min.length;
    long[] allocated = new long[n];
    long[] scaleWeight = new long[n];
    for (int i = 0; i < n; i++) {
      scaleWeight[i] = weight[i] > 0 ? weight[i] : min[i];
    }
    waterFill(allocated, min, scaleWeight, bound);
    return allocated;
  }

  private static void waterFill(long[] allocated, long[] limit, long[] weight,
      long remaining) {
    List<Integer> active = new ArrayList<Integer>();
    for (int i = 0; i < allocated.length; i++) {
      if (allocated[i] < limit[i] && weight[i] > 0) {
        active.add(i);
      }
    }

    while (remaining > 0 && !active.isEmpty()) {
      BigInteger totalWeight = BigInteger.ZERO;
      for (int i : active) {
        totalWeight = totalWeight.add(BigInteger.valueOf(weight[i]));
      }

      boolean capped = false;
      long granted = 0;
      for (Iterator<Integer> it = active.iterator(); it.hasNext();) {
        int i = it.next();
        long share = share(remaining, weight[i], totalWeight);
        if (share >= limit[i] - allocated[i]) {
          granted += limit[i] - allocated[i];
          allocated[i] = limit[i];
          it.remove();
          capped = true;
        }
      }
      remaining -= granted;
      if (capped) {
        // re-split what is left among the children still below their cap
        continue;
      }

      for (int i : active) {
        long share = share(remaining, weight[i], totalWeight);
        allocated[i] += share;
        granted += share;
      }
      // the floored remainder stays with the parent
      remaining -= granted;
      break;
    }
  }

  private static long share(long remaining, long weight,
      BigInteger totalWeight) {
    return BigInteger.valueOf(remaining).multiply(BigInteger.valueOf(weight))
        .divide(totalWeight).longValue();
  }

  private static long saturatedAdd(long a, long b) {
    long sum = a + b;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }
}
