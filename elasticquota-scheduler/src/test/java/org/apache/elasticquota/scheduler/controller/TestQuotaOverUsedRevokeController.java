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

import static org.apache.elasticquota.scheduler.QuotaTestUtils.leaf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.newConf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.parent;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.running;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.scheduler.quota.ElasticQuotaSpec;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.yarn.util.Clock;
import org.junit.Before;
import org.junit.Test;

public class TestQuotaOverUsedRevokeController {

  private ElasticQuotaConfiguration conf;
  private GroupQuotaManager manager;
  private ClusterActionClient client;
  private Clock clock;

  @Before
  public void setUp() {
    conf = newConf();
    conf.setLong(ElasticQuotaConfiguration.REVOKE_DELAY_EVICT_TIME_MS, 1000);
    manager = new GroupQuotaManager(conf);
    manager.onNodeAdd("n1", ResourceList.parse("cpu=100,memory=1000"));
    client = mock(ClusterActionClient.class);
    clock = mock(Clock.class);
  }

  private QuotaOverUsedRevokeController newController() {
    return new QuotaOverUsedRevokeController(conf, manager, client, clock);
  }

  private Workload add(Workload workload) {
    manager.onPodAdd(workload.getLabel(
        ElasticQuotaConfiguration.DEFAULT_QUOTA_LABEL), workload);
    return workload;
  }

  @Test
  public void testEvictAfterGracePeriod() throws Exception {
    manager.addOrUpdateQuota(leaf("a", null, "cpu=10"));
    Workload older = add(running("p1", "a", "cpu=6", 1, 100));
    Workload newer = add(running("p2", "a", "cpu=6", 1, 200));
    QuotaOverUsedRevokeController controller = newController();

    when(clock.getTime()).thenReturn(0L);
    controller.reconcile();
    assertEquals(0L, controller.getMonitor("a").getOverUsedSince());
    when(clock.getTime()).thenReturn(999L);
    controller.reconcile();
    verify(client, never()).evictWorkload(any(Workload.class), anyString());

    when(clock.getTime()).thenReturn(1000L);
    controller.reconcile();
    verify(client).evictWorkload(eq(newer), anyString());
    verify(client, never()).evictWorkload(eq(older), anyString());

    // the eviction is in flight, nothing more to do
    when(clock.getTime()).thenReturn(1100L);
    controller.reconcile();
    verify(client, times(1)).evictWorkload(any(Workload.class), anyString());

    manager.onPodDelete(newer);
    controller.reconcile();
    assertEquals(-1L, controller.getMonitor("a").getOverUsedSince());
  }

  @Test
  public void testLowerPriorityEvictedFirst() throws Exception {
    conf.setInt(ElasticQuotaConfiguration.REVOKE_MAX_EVICTIONS_PER_TICK, 5);
    conf.setLong(ElasticQuotaConfiguration.REVOKE_DELAY_EVICT_TIME_MS, 0);
    manager.addOrUpdateQuota(leaf("a", null, "cpu=10,memory=1000"));
    Workload important = add(running("p1", "a", "cpu=6", 9, 300));
    Workload cheap = add(running("p2", "a", "cpu=6", 1, 100));
    Workload memoryOnly = add(running("p3", "a", "memory=100", 0, 400));

    newController().reconcile();
    verify(client).evictWorkload(eq(cheap), anyString());
    verify(client, never()).evictWorkload(eq(important), anyString());
    verify(client, never()).evictWorkload(eq(memoryOnly), anyString());
  }

  @Test
  public void testEvictionLimitIsGlobal() throws Exception {
    conf.setLong(ElasticQuotaConfiguration.REVOKE_DELAY_EVICT_TIME_MS, 0);
    manager.addOrUpdateQuota(leaf("a", null, "cpu=10"));
    manager.addOrUpdateQuota(leaf("b", null, "cpu=10"));
    add(running("a1", "a", "cpu=6", 1, 100));
    add(running("a2", "a", "cpu=6", 1, 200));
    add(running("b1", "b", "cpu=6", 1, 100));
    add(running("b2", "b", "cpu=6", 1, 200));

    QuotaOverUsedRevokeController controller = newController();
    controller.reconcile();
    verify(client, times(1)).evictWorkload(any(Workload.class), anyString());
    controller.reconcile();
    verify(client, times(2)).evictWorkload(any(Workload.class), anyString());
  }

  @Test
  public void testFailedEvictionIsRetried() throws Exception {
    conf.setLong(ElasticQuotaConfiguration.REVOKE_DELAY_EVICT_TIME_MS, 0);
    manager.addOrUpdateQuota(leaf("a", null, "cpu=10"));
    add(running("p1", "a", "cpu=6", 1, 100));
    Workload newer = add(running("p2", "a", "cpu=6", 1, 200));
    doThrow(new IOException("injected")).doNothing()
        .when(client).evictWorkload(any(Workload.class), anyString());

    QuotaOverUsedRevokeController controller = newController();
    controller.reconcile();
    controller.reconcile();
    verify(client, times(2)).evictWorkload(eq(newer), anyString());
  }

  @Test
  public void testSurvivingWorkloadIsEvictedAgain() throws Exception {
    conf.setLong(ElasticQuotaConfiguration.REVOKE_DELAY_EVICT_TIME_MS, 0);
    conf.setLong(
        ElasticQuotaConfiguration.REVOKE_EVICTION_RETRY_TIMEOUT_MS, 5000);
    manager.addOrUpdateQuota(leaf("a", null, "cpu=10"));
    add(running("p1", "a", "cpu=6", 1, 100));
    Workload newer = add(running("p2", "a", "cpu=6", 1, 200));
    QuotaOverUsedRevokeController controller = newController();

    when(clock.getTime()).thenReturn(0L);
    controller.reconcile();
    verify(client, times(1)).evictWorkload(eq(newer), anyString());

    // the eviction was accepted but the workload keeps running
    when(clock.getTime()).thenReturn(4999L);
    controller.reconcile();
    verify(client, times(1)).evictWorkload(any(Workload.class), anyString());

    when(clock.getTime()).thenReturn(5000L);
    controller.reconcile();
    verify(client, times(2)).evictWorkload(eq(newer), anyString());
    verify(client, times(2)).evictWorkload(any(Workload.class), anyString());
  }

  @Test
  public void testMonitoredQuotas() throws Exception {
    manager.addOrUpdateQuota(parent("p", null, "cpu=10"));
    manager.addOrUpdateQuota(leaf("a", "p", "cpu=10"));
    QuotaOverUsedRevokeController controller = newController();
    controller.reconcile();
    assertNull(controller.getMonitor("root"));
    assertNull(controller.getMonitor("system"));
    assertNull(controller.getMonitor("p"));
    assertNotNull(controller.getMonitor("default"));
    assertNotNull(controller.getMonitor("a"));

    conf.setBoolean(ElasticQuotaConfiguration.REVOKE_MONITOR_ALL_QUOTAS,
        false);
    ElasticQuotaSpec revocable = leaf("b", "p", "cpu=10");
    revocable.setRevokeEnabled(true);
    manager.addOrUpdateQuota(revocable);
    controller = newController();
    controller.reconcile();
    assertNull(controller.getMonitor("a"));
    assertNull(controller.getMonitor("default"));
    assertNotNull(controller.getMonitor("b"));

    manager.deleteQuota("b");
    controller.reconcile();
    assertNull(controller.getMonitor("b"));
  }
}
