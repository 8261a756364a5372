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

package org.apache.elasticquota.scheduler.admission;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.PriorityVictimComparator;
import org.apache.elasticquota.scheduler.quota.QuotaNameResolver;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

/**
 * Entry point of the scheduling pipeline into the quota tree.
 * <p>
 * For every placement attempt the scheduler creates a
 * {@link QuotaAdmissionAttempt} and drives it through
 * pre-admission, optional simulations, reserve and then bind or unreserve.
 * Only reserve and unreserve change the shared tree.
 */
@Public
@Unstable
public class ElasticQuotaPlugin {

  private static final Log LOG = LogFactory.getLog(ElasticQuotaPlugin.class);

  private final GroupQuotaManager manager;
  private final QuotaNameResolver resolver;
  private final boolean checkParentQuota;
  private final Comparator<Workload> victimOrder =
      new PriorityVictimComparator();

  public ElasticQuotaPlugin(ElasticQuotaConfiguration conf,
      GroupQuotaManager manager) {
    this.manager = manager;
    this.resolver = new QuotaNameResolver(conf, manager);
    this.checkParentQuota = conf.isCheckParentQuotaEnabled();
  }

  /**
   * Start an attempt for <code>workload</code>, resolving its quota now.
   */
  public QuotaAdmissionAttempt newAttempt(Workload workload) {
    String quotaName = resolver.resolve(workload);
    List<String> checkedPath;
    if (quotaName == null) {
      checkedPath = Collections.emptyList();
    } else if (checkParentQuota) {
      checkedPath = manager.getQuotaPath(quotaName);
    } else {
      checkedPath = Collections.singletonList(quotaName);
    }
    return new QuotaAdmissionAttempt(workload, quotaName, checkedPath,
        manager);
  }

  /**
   * Check whether the quota of the workload, and its ancestors if parent
   * checking is on, can take the request. Never changes the tree.
   */
  public AdmissionStatus preAdmission(QuotaAdmissionAttempt attempt) {
    AdmissionStatus status =
        attempt.handle(new AdmissionEvent(AdmissionEventType.PRE_ADMIT));
    if (!status.isSuccess() && LOG.isDebugEnabled()) {
      LOG.debug("Rejected " + attempt.getWorkload() + ": " + status);
    }
    return status;
  }

  /**
   * Pretend <code>candidate</code> is running in the attempt's quota.
   */
  public AdmissionStatus simulatedAdd(QuotaAdmissionAttempt attempt,
      Workload candidate) {
    return attempt.handle(
        new AdmissionEvent(AdmissionEventType.SIMULATE_ADD, candidate));
  }

  /**
   * Pretend <code>candidate</code> is gone from the attempt's quota.
   */
  public AdmissionStatus simulatedRemove(QuotaAdmissionAttempt attempt,
      Workload candidate) {
    return attempt.handle(
        new AdmissionEvent(AdmissionEventType.SIMULATE_REMOVE, candidate));
  }

  public AdmissionStatus reserve(QuotaAdmissionAttempt attempt) {
    return attempt.handle(new AdmissionEvent(AdmissionEventType.RESERVE));
  }

  public AdmissionStatus unreserve(QuotaAdmissionAttempt attempt) {
    return attempt.handle(new AdmissionEvent(AdmissionEventType.UNRESERVE));
  }

  public AdmissionStatus bind(QuotaAdmissionAttempt attempt) {
    return attempt.handle(new AdmissionEvent(AdmissionEventType.BIND));
  }

  public AdmissionStatus cancel(QuotaAdmissionAttempt attempt) {
    return attempt.handle(new AdmissionEvent(AdmissionEventType.CANCEL));
  }

  /**
   * Pick the workloads whose removal lets the preemptor fit. Candidates must
   * be in the preemptor's quota subtree and of strictly lower priority; they
   * are removed lowest priority first until the request fits. When it never
   * fits every simulated removal is undone and nothing is returned.
   */
  public List<Workload> selectVictims(QuotaAdmissionAttempt attempt,
      Collection<Workload> candidates) {
    AdmissionState state = attempt.getState();
    if (attempt.getQuotaName() == null || (state != AdmissionState.ACCEPTED
        && state != AdmissionState.REJECTED)) {
      return Collections.emptyList();
    }
    Workload preemptor = attempt.getWorkload();
    List<Workload> eligible = new ArrayList<Workload>();
    for (Workload candidate : candidates) {
      String tracked = manager.getTrackedQuotaName(candidate.getUid());
      if (tracked != null
          && candidate.getPriority() < preemptor.getPriority()
          && !candidate.getUid().equals(preemptor.getUid())
          && manager.isInSubtree(attempt.getQuotaName(), tracked)) {
        eligible.add(candidate);
      }
    }
    Collections.sort(eligible, victimOrder);

    List<Workload> victims = new ArrayList<Workload>();
    for (Workload candidate : eligible) {
      if (attempt.checkFits().isSuccess()) {
        break;
      }
      int before = attempt.getSimulatedRemovals().size();
      simulatedRemove(attempt, candidate);
      if (attempt.getSimulatedRemovals().size() > before) {
        victims.add(candidate);
      }
    }
    if (!attempt.checkFits().isSuccess()) {
      for (Workload victim : victims) {
        simulatedAdd(attempt, victim);
      }
      return Collections.emptyList();
    }
    if (!victims.isEmpty()) {
      LOG.info("Selected victims " + victims + " for " + preemptor
          + " in quota " + attempt.getQuotaName());
    }
    return victims;
  }

  public GroupQuotaManager getGroupQuotaManager() {
    return manager;
  }

  public QuotaNameResolver getQuotaNameResolver() {
    return resolver;
  }
}
