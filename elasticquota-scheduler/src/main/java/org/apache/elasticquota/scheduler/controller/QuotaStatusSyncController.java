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

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.QuotaInfo;

/**
 * Publishes used, request and runtime of every group whenever they differ
 * from the last successful publication.
 */
public class QuotaStatusSyncController implements ElasticQuotaController {

  private static final Log LOG =
      LogFactory.getLog(QuotaStatusSyncController.class);

  private final GroupQuotaManager manager;
  private final ClusterActionClient client;
  private final long monitoringInterval;
  private final Map<String, List<ResourceList>> published =
      new HashMap<String, List<ResourceList>>();

  public QuotaStatusSyncController(ElasticQuotaConfiguration conf,
      GroupQuotaManager manager, ClusterActionClient client) {
    this.manager = manager;
    this.client = client;
    this.monitoringInterval = conf.getStatusSyncIntervalMs();
  }

  @Override
  public void reconcile() {
    Set<String> names = new HashSet<String>();
    for (QuotaInfo info : manager.getAllQuotaInfos()) {
      names.add(info.getName());
      List<ResourceList> status = Arrays.asList(info.getUsed(),
          info.getRequest(), info.getRuntime());
      if (status.equals(published.get(info.getName()))) {
        continue;
      }
      try {
        client.updateQuotaStatus(info);
        published.put(info.getName(), status);
        if (LOG.isDebugEnabled()) {
          LOG.debug("Published status of " + info);
        }
      } catch (IOException e) {
        LOG.warn("Failed to publish status of quota " + info.getName()
            + ", will retry", e);
      }
    }
    published.keySet().retainAll(names);
  }

  @Override
  public long getMonitoringInterval() {
    return monitoringInterval;
  }

  @Override
  public String getControllerName() {
    return "QuotaStatusSyncController";
  }
}
