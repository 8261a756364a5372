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

package org.apache.elasticquota.scheduler.event;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.exceptions.ElasticQuotaException;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.QuotaNameResolver;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.yarn.event.EventHandler;

/**
 * Applies quota, node and workload lifecycle events to the quota tree.
 * Runs on the dispatcher thread; a rejected edit is logged and dropped.
 */
public class ElasticQuotaEventHandler implements
    EventHandler<ElasticQuotaEvent> {

  private static final Log LOG =
      LogFactory.getLog(ElasticQuotaEventHandler.class);

  private final GroupQuotaManager manager;
  private final QuotaNameResolver resolver;

  public ElasticQuotaEventHandler(GroupQuotaManager manager,
      QuotaNameResolver resolver) {
    this.manager = manager;
    this.resolver = resolver;
  }

  @Override
  public void handle(ElasticQuotaEvent event) {
    try {
      switch (event.getType()) {
      case QUOTA_ADDED:
      case QUOTA_UPDATED:
        manager.addOrUpdateQuota(((QuotaEvent) event).getSpec());
        break;
      case QUOTA_REMOVED:
        manager.deleteQuota(((QuotaEvent) event).getSpec().getName());
        break;
      case NODE_ADDED: {
        NodeEvent nodeEvent = (NodeEvent) event;
        manager.onNodeAdd(nodeEvent.getNodeName(),
            nodeEvent.getAllocatable());
        break;
      }
      case NODE_UPDATED: {
        NodeEvent nodeEvent = (NodeEvent) event;
        manager.onNodeUpdate(nodeEvent.getNodeName(),
            nodeEvent.getAllocatable());
        break;
      }
      case NODE_REMOVED:
        manager.onNodeDelete(((NodeEvent) event).getNodeName());
        break;
      case POD_ADDED: {
        Workload workload = ((PodEvent) event).getWorkload();
        manager.onPodAdd(resolver.resolve(workload), workload);
        break;
      }
      case POD_UPDATED: {
        PodEvent podEvent = (PodEvent) event;
        Workload oldWorkload = podEvent.getOldWorkload();
        Workload workload = podEvent.getWorkload();
        manager.onPodUpdate(
            oldWorkload == null ? null : resolver.resolve(oldWorkload),
            resolver.resolve(workload), oldWorkload, workload);
        break;
      }
      case POD_REMOVED:
        manager.onPodDelete(((PodEvent) event).getWorkload());
        break;
      default:
        LOG.error("Unknown event arrived at ElasticQuotaEventHandler: "
            + event.toString());
      }
    } catch (ElasticQuotaException e) {
      LOG.warn("Failed to handle " + event.getType() + ": " + e.getMessage());
    }
  }
}
