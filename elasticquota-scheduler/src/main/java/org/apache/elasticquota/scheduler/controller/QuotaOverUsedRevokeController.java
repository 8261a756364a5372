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

import static org.apache.elasticquota.conf.ElasticQuotaConfiguration.ROOT_QUOTA_NAME;
import static org.apache.elasticquota.conf.ElasticQuotaConfiguration.SYSTEM_QUOTA_NAME;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.PriorityVictimComparator;
import org.apache.elasticquota.scheduler.quota.QuotaInfo;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.util.ReflectionUtils;
import org.apache.hadoop.yarn.util.Clock;
import org.apache.hadoop.yarn.util.SystemClock;

import com.google.common.annotations.VisibleForTesting;

/**
 * Evicts workloads from leaf groups whose used stays above their runtime
 * for longer than the configured grace period.
 * <p>
 * The number of evictions per tick is limited across all groups. A failed
 * eviction is logged and the group is looked at again on the next tick.
 */
public class QuotaOverUsedRevokeController implements ElasticQuotaController {

  private static final Log LOG =
      LogFactory.getLog(QuotaOverUsedRevokeController.class);

  private final GroupQuotaManager manager;
  private final ClusterActionClient client;
  private final Clock clock;
  private final long delayEvictTimeMs;
  private final long evictionRetryTimeoutMs;
  private final long monitoringInterval;
  private final int maxEvictionsPerTick;
  private final boolean monitorAllQuotas;
  private final Comparator<Workload> victimOrder;

  private final Map<String, QuotaOverUsedGroupMonitor> monitors =
      new TreeMap<String, QuotaOverUsedGroupMonitor>();

  public QuotaOverUsedRevokeController(ElasticQuotaConfiguration conf,
      GroupQuotaManager manager, ClusterActionClient client) {
    this(conf, manager, client, SystemClock.getInstance());
  }

  @SuppressWarnings("unchecked")
  @VisibleForTesting
  QuotaOverUsedRevokeController(ElasticQuotaConfiguration conf,
      GroupQuotaManager manager, ClusterActionClient client, Clock clock) {
    this.manager = manager;
    this.client = client;
    this.clock = clock;
    this.delayEvictTimeMs = conf.getRevokeDelayEvictTimeMs();
    this.evictionRetryTimeoutMs = conf.getRevokeEvictionRetryTimeoutMs();
    this.monitoringInterval = conf.getRevokeIntervalMs();
    this.maxEvictionsPerTick = conf.getRevokeMaxEvictionsPerTick();
    this.monitorAllQuotas = conf.isRevokeMonitorAllQuotas();
    this.victimOrder = ReflectionUtils.newInstance(
        conf.getRevokeVictimComparatorClass(PriorityVictimComparator.class,
            Comparator.class), conf);
  }

  @Override
  public void reconcile() {
    List<QuotaInfo> infos = manager.getAllQuotaInfos();
    Map<String, QuotaInfo> monitored = new TreeMap<String, QuotaInfo>();
    for (QuotaInfo info : infos) {
      if (shouldMonitor(info)) {
        monitored.put(info.getName(), info);
        if (!monitors.containsKey(info.getName())) {
          monitors.put(info.getName(), new QuotaOverUsedGroupMonitor(
              info.getName(), delayEvictTimeMs, evictionRetryTimeoutMs,
              clock));
        }
      }
    }
    monitors.keySet().retainAll(monitored.keySet());

    int budget = maxEvictionsPerTick;
    for (QuotaOverUsedGroupMonitor monitor : monitors.values()) {
      QuotaInfo info = monitored.get(monitor.getQuotaName());
      if (!monitor.isOverUsedLongEnough(info) || budget <= 0) {
        continue;
      }
      List<Workload> victims = monitor.selectVictims(info,
          manager.getAssignedWorkloads(info.getName()), victimOrder, budget);
      for (Workload victim : victims) {
        String reason = "Quota " + info.getName() + " used <"
            + info.getUsed() + "> over its runtime <" + info.getRuntime()
            + "> for more than " + delayEvictTimeMs + " ms";
        try {
          client.evictWorkload(victim, reason);
          monitor.markEvicting(victim);
          budget--;
          LOG.info("Evicted " + victim + ": " + reason);
        } catch (IOException e) {
          LOG.warn("Failed to evict " + victim + " from quota "
              + info.getName() + ", will retry", e);
        }
      }
    }
  }

  private boolean shouldMonitor(QuotaInfo info) {
    if (info.isParent() || ROOT_QUOTA_NAME.equals(info.getName())
        || SYSTEM_QUOTA_NAME.equals(info.getName())) {
      return false;
    }
    return monitorAllQuotas || info.isRevokeEnabled();
  }

  @VisibleForTesting
  QuotaOverUsedGroupMonitor getMonitor(String quotaName) {
    return monitors.get(quotaName);
  }

  @Override
  public long getMonitoringInterval() {
    return monitoringInterval;
  }

  @Override
  public String getControllerName() {
    return "QuotaOverUsedRevokeController";
  }
}
