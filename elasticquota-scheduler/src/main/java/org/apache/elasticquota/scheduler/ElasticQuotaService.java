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

package org.apache.elasticquota.scheduler;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.scheduler.admission.ElasticQuotaPlugin;
import org.apache.elasticquota.scheduler.controller.ClusterActionClient;
import org.apache.elasticquota.scheduler.controller.DefaultQuotaMigrationController;
import org.apache.elasticquota.scheduler.controller.QuotaControllerMonitor;
import org.apache.elasticquota.scheduler.controller.QuotaOverUsedRevokeController;
import org.apache.elasticquota.scheduler.controller.QuotaStatusSyncController;
import org.apache.elasticquota.scheduler.controller.WorkloadLister;
import org.apache.elasticquota.scheduler.event.ElasticQuotaEvent;
import org.apache.elasticquota.scheduler.event.ElasticQuotaEventHandler;
import org.apache.elasticquota.scheduler.event.ElasticQuotaEventType;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.service.CompositeService;
import org.apache.hadoop.yarn.event.AsyncDispatcher;
import org.apache.hadoop.yarn.event.Dispatcher;

import com.google.common.annotations.VisibleForTesting;

/**
 * Wires the quota tree, the admission plugin, the event dispatcher and the
 * background controllers under one lifecycle.
 * <p>
 * Lifecycle events are queued through {@link #handle(ElasticQuotaEvent)} and
 * applied on the dispatcher thread. The scheduler calls the plugin returned by
 * {@link #getPlugin()} directly.
 */
public class ElasticQuotaService extends CompositeService {

  private static final Log LOG = LogFactory.getLog(ElasticQuotaService.class);

  private final ClusterActionClient client;
  private final WorkloadLister lister;

  private ElasticQuotaConfiguration conf;
  private Dispatcher dispatcher;
  private GroupQuotaManager manager;
  private ElasticQuotaPlugin plugin;

  public ElasticQuotaService(ClusterActionClient client,
      WorkloadLister lister) {
    super(ElasticQuotaService.class.getName());
    this.client = client;
    this.lister = lister;
  }

  @Override
  protected void serviceInit(Configuration configuration) throws Exception {
    if (configuration instanceof ElasticQuotaConfiguration) {
      conf = (ElasticQuotaConfiguration) configuration;
    } else {
      conf = new ElasticQuotaConfiguration(configuration);
    }
    conf.validate();

    manager = new GroupQuotaManager(conf);
    plugin = new ElasticQuotaPlugin(conf, manager);

    dispatcher = createDispatcher();
    addIfService(dispatcher);
    dispatcher.register(ElasticQuotaEventType.class,
        new ElasticQuotaEventHandler(manager, plugin.getQuotaNameResolver()));

    addService(new QuotaControllerMonitor(
        new QuotaOverUsedRevokeController(conf, manager, client)));
    addService(new QuotaControllerMonitor(
        new DefaultQuotaMigrationController(conf, manager,
            plugin.getQuotaNameResolver(), lister)));
    addService(new QuotaControllerMonitor(
        new QuotaStatusSyncController(conf, manager, client)));

    LOG.info("Initialized elastic quota service with quota label "
        + conf.getQuotaLabel());
    super.serviceInit(conf);
  }

  @VisibleForTesting
  protected Dispatcher createDispatcher() {
    return new AsyncDispatcher();
  }

  /**
   * Queue a quota, node or workload lifecycle event.
   */
  public void handle(ElasticQuotaEvent event) {
    dispatcher.getEventHandler().handle(event);
  }

  public GroupQuotaManager getGroupQuotaManager() {
    return manager;
  }

  public ElasticQuotaPlugin getPlugin() {
    return plugin;
  }

  public ElasticQuotaConfiguration getElasticQuotaConfiguration() {
    return conf;
  }
}
