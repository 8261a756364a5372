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

package org.apache.elasticquota.scheduler.controller;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.resource.Resources;
import org.apache.elasticquota.scheduler.quota.QuotaInfo;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.yarn.util.Clock;

/**
 * Watches one quota group for a used vector staying above its runtime.
 * The over used timestamp lives in memory only.
 */
class QuotaOverUsedGroupMonitor {

  private static final Log LOG =
      LogFactory.getLog(QuotaOverUsedGroupMonitor.class);

  private final String quotaName;
  private final long delayEvictTimeMs;
  private final long evictionRetryTimeoutMs;
  private final Clock clock;

  private long overUsedSince = -1;
  //evictions issued but not yet reflected in the tree, by issue time
  private final Map<String, Long> evicting = new HashMap<String, Long>();

  QuotaOverUsedGroupMonitor(String quotaName, long delayEvictTimeMs,
      long evictionRetryTimeoutMs, Clock clock) {
    this.quotaName = quotaName;
    this.delayEvictTimeMs = delayEvictTimeMs;
    this.evictionRetryTimeoutMs = evictionRetryTimeoutMs;
    this.clock = clock;
  }

  /**
   * @return true once used has been above runtime for the whole grace period
   */
  boolean isOverUsedLongEnough(QuotaInfo info) {
    if (Resources.fitsIn(info.getUsed(), info.getRuntime())) {
      if (overUsedSince >= 0) {
        LOG.info("Quota " + quotaName + " is no longer over used");
      }
      overUsedSince = -1;
      return false;
    }
    long now = clock.getTime();
    if (overUsedSince < 0) {
      overUsedSince = now;
      LOG.info("Quota " + quotaName + " is over used, used: <"
          + info.getUsed() + ">, runtime: <" + info.getRuntime() + ">");
    }
    return now - overUsedSince >= delayEvictTimeMs;
  }

  /**
   * Pick up to <code>limit</code> workloads whose eviction brings used back
   * within runtime. Workloads which do not use any exceeded dimension are
   * skipped. A workload evicted longer than the retry timeout ago is a
   * candidate again.
   */
  List<Workload> selectVictims(QuotaInfo info, List<Workload> assigned,
      Comparator<Workload> order, int limit) {
    Set<String> live = new HashSet<String>();
    for (Workload workload : assigned) {
      live.add(workload.getUid());
    }
    long now = clock.getTime();
    for (Iterator<Map.Entry<String, Long>> it =
        evicting.entrySet().iterator(); it.hasNext();) {
      Map.Entry<String, Long> entry = it.next();
      if (!live.contains(entry.getKey())) {
        it.remove();
      } else if (now - entry.getValue() >= evictionRetryTimeoutMs) {
        LOG.warn("Workload " + entry.getKey() + " of quota " + quotaName
            + " survived its eviction for " + (now - entry.getValue())
            + " ms, evicting it again");
        it.remove();
      }
    }
    ResourceList used = info.getUsed();
    for (Workload workload : assigned) {
      if (evicting.containsKey(workload.getUid())) {
        used = Resources.subtractNonNegative(used, workload.getRequest());
      }
    }

    List<Workload> candidates = new ArrayList<Workload>(assigned);
    Collections.sort(candidates, order);
    List<Workload> victims = new ArrayList<Workload>();
    for (Workload candidate : candidates) {
      List<String> exceeded =
          Resources.exceededDimensions(used, info.getRuntime());
      if (exceeded.isEmpty() || victims.size() >= limit) {
        break;
      }
      if (evicting.containsKey(candidate.getUid())
          || candidate.isReservation()
          || !Resources.intersects(candidate.getRequest(), exceeded)) {
        continue;
      }
      victims.add(candidate);
      used = Resources.subtractNonNegative(used, candidate.getRequest());
    }
    return victims;
  }

  void markEvicting(Workload workload) {
    evicting.put(workload.getUid(), clock.getTime());
  }

  long getOverUsedSince() {
    return overUsedSince;
  }

  String getQuotaName() {
    return quotaName;
  }
}
