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

import static org.apache.elasticquota.conf.ElasticQuotaConfiguration.DEFAULT_QUOTA_NAME;

import java.io.IOException;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.QuotaNameResolver;
import org.apache.elasticquota.scheduler.quota.Workload;

/**
 * Reconciles workload records with the live workloads: picks up workloads
 * the tree never saw, and moves workloads parked in the default group to the
 * group their label names once that group exists.
 */
public class DefaultQuotaMigrationController implements
    ElasticQuotaController {

  private static final Log LOG =
      LogFactory.getLog(DefaultQuotaMigrationController.class);

  private final GroupQuotaManager manager;
  private final QuotaNameResolver resolver;
  private final WorkloadLister lister;
  private final long monitoringInterval;

  public DefaultQuotaMigrationController(ElasticQuotaConfiguration conf,
      GroupQuotaManager manager, QuotaNameResolver resolver,
      WorkloadLister lister) {
    this.manager = manager;
    this.resolver = resolver;
    this.lister = lister;
    this.monitoringInterval = conf.getMigrateDefaultIntervalMs();
  }

  @Override
  public void reconcile() {
    List<Workload> workloads;
    try {
      workloads = lister.listWorkloads();
    } catch (IOException e) {
      LOG.warn("Failed to list workloads, will retry", e);
      return;
    }
    for (Workload workload : workloads) {
      String tracked = manager.getTrackedQuotaName(workload.getUid());
      if (tracked == null) {
        String target = resolver.resolve(workload);
        if (target != null) {
          manager.onPodAdd(target, workload);
          LOG.info("Picked up untracked " + workload + " into quota "
              + target);
        }
      } else if (DEFAULT_QUOTA_NAME.equals(tracked)) {
        String labeled = resolver.getLabeledQuotaName(workload);
        if (labeled != null && !DEFAULT_QUOTA_NAME.equals(labeled)
            && manager.isLeafQuota(labeled)) {
          manager.migratePod(DEFAULT_QUOTA_NAME, labeled, workload);
        }
      }
    }
  }

  @Override
  public long getMonitoringInterval() {
    return monitoringInterval;
  }

  @Override
  public String getControllerName() {
    return "DefaultQuotaMigrationController";
  }
}
