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

import static org.apache.elasticquota.scheduler.QuotaTestUtils.leaf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.newConf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.pending;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Collections;

import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.scheduler.admission.AdmissionStatus;
import org.apache.elasticquota.scheduler.admission.ElasticQuotaPlugin;
import org.apache.elasticquota.scheduler.admission.QuotaAdmissionAttempt;
import org.apache.elasticquota.scheduler.controller.ClusterActionClient;
import org.apache.elasticquota.scheduler.controller.WorkloadLister;
import org.apache.elasticquota.scheduler.event.ElasticQuotaEventType;
import org.apache.elasticquota.scheduler.event.NodeEvent;
import org.apache.elasticquota.scheduler.event.PodEvent;
import org.apache.elasticquota.scheduler.event.QuotaEvent;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.service.Service.STATE;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestElasticQuotaService {

  private ElasticQuotaService service;

  @Before
  public void setUp() throws Exception {
    WorkloadLister lister = mock(WorkloadLister.class);
    when(lister.listWorkloads()).thenReturn(Collections.<Workload>emptyList());
    service = new ElasticQuotaService(mock(ClusterActionClient.class),
        lister);
  }

  @After
  public void tearDown() {
    service.stop();
  }

  private static void waitFor(String what, Check check)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10000;
    while (!check.done()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("Timed out waiting for " + what);
      }
      Thread.sleep(10);
    }
  }

  private interface Check {
    boolean done();
  }

  @Test(timeout = 30000)
  public void testEventsReachTheTree() throws Exception {
    service.init(newConf());
    service.start();
    assertEquals(STATE.STARTED, service.getServiceState());
    assertEquals(4, service.getServices().size());

    final GroupQuotaManager manager = service.getGroupQuotaManager();
    service.handle(new NodeEvent(ElasticQuotaEventType.NODE_ADDED, "n1",
        ResourceList.parse("cpu=100")));
    service.handle(new QuotaEvent(ElasticQuotaEventType.QUOTA_ADDED,
        leaf("a", null, "cpu=10")));
    final Workload workload = pending("w1", "a", "cpu=4", 0, 0);
    service.handle(new PodEvent(ElasticQuotaEventType.POD_ADDED, workload));
    waitFor("w1 to be tracked", new Check() {
      @Override
      public boolean done() {
        return manager.isWorkloadTracked("a", "w1");
      }
    });

    ElasticQuotaPlugin plugin = service.getPlugin();
    QuotaAdmissionAttempt attempt = plugin.newAttempt(workload);
    AdmissionStatus status = plugin.preAdmission(attempt);
    assertTrue(status.toString(), status.isSuccess());
    assertTrue(plugin.reserve(attempt).isSuccess());
    assertEquals(ResourceList.parse("cpu=4"),
        manager.getQuotaInfoByName("a").getUsed());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadConfigurationFailsInit() {
    ElasticQuotaConfiguration conf = newConf();
    conf.setLong(ElasticQuotaConfiguration.REVOKE_INTERVAL_MS, 0);
    service.init(conf);
  }

  @Test
  public void testPlainConfigurationIsWrapped() {
    service.init(new org.apache.hadoop.conf.Configuration(false));
    assertNotNull(service.getElasticQuotaConfiguration());
    assertEquals(ElasticQuotaConfiguration.DEFAULT_QUOTA_LABEL,
        service.getElasticQuotaConfiguration().getQuotaLabel());
  }
}
