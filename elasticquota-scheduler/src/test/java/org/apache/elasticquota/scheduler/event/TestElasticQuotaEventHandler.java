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

import static org.apache.elasticquota.scheduler.QuotaTestUtils.leaf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.newConf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.pending;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.QuotaNameResolver;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.junit.Before;
import org.junit.Test;

public class TestElasticQuotaEventHandler {

  private GroupQuotaManager manager;
  private ElasticQuotaEventHandler handler;

  @Before
  public void setUp() {
    ElasticQuotaConfiguration conf = newConf();
    manager = new GroupQuotaManager(conf);
    handler = new ElasticQuotaEventHandler(manager,
        new QuotaNameResolver(conf, manager));
  }

  @Test
  public void testNodeEvents() {
    handler.handle(new NodeEvent(ElasticQuotaEventType.NODE_ADDED, "n1",
        ResourceList.parse("cpu=10")));
    handler.handle(new NodeEvent(ElasticQuotaEventType.NODE_ADDED, "n2",
        ResourceList.parse("cpu=20")));
    assertEquals(ResourceList.parse("cpu=30"),
        manager.getClusterTotalResource());
    handler.handle(new NodeEvent(ElasticQuotaEventType.NODE_UPDATED, "n2",
        ResourceList.parse("cpu=5")));
    handler.handle(new NodeEvent(ElasticQuotaEventType.NODE_REMOVED, "n1",
        null));
    assertEquals(ResourceList.parse("cpu=5"),
        manager.getClusterTotalResource());
  }

  @Test
  public void testQuotaAndPodEvents() {
    handler.handle(new QuotaEvent(ElasticQuotaEventType.QUOTA_ADDED,
        leaf("a", null, "cpu=10")));
    assertTrue(manager.quotaExists("a"));

    Workload w1 = pending("w1", "a", "cpu=2", 0, 0);
    handler.handle(new PodEvent(ElasticQuotaEventType.POD_ADDED, w1));
    assertEquals("a", manager.getTrackedQuotaName("w1"));

    Workload bound = w1.assignedTo("n1");
    handler.handle(new PodEvent(ElasticQuotaEventType.POD_UPDATED, w1,
        bound));
    assertEquals(ResourceList.parse("cpu=2"),
        manager.getQuotaInfoByName("a").getUsed());

    // still in use, the removal is logged and dropped
    handler.handle(new QuotaEvent(ElasticQuotaEventType.QUOTA_REMOVED,
        leaf("a", null, "")));
    assertTrue(manager.quotaExists("a"));

    handler.handle(new PodEvent(ElasticQuotaEventType.POD_REMOVED, bound));
    assertNull(manager.getTrackedQuotaName("w1"));
    handler.handle(new QuotaEvent(ElasticQuotaEventType.QUOTA_REMOVED,
        leaf("a", null, "")));
    assertFalse(manager.quotaExists("a"));
  }

  @Test
  public void testInvalidQuotaIsDropped() {
    handler.handle(new QuotaEvent(ElasticQuotaEventType.QUOTA_UPDATED,
        leaf("x", "missing", "cpu=10")));
    assertFalse(manager.quotaExists("x"));
  }
}
