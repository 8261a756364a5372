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

package org.apache.elasticquota.scheduler.quota;

import static org.apache.elasticquota.scheduler.QuotaTestUtils.leaf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.newConf;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.parent;
import static org.apache.elasticquota.scheduler.QuotaTestUtils.pending;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Collections;

import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.resource.ResourceList;
import org.junit.Test;

public class TestQuotaNameResolver {

  @Test
  public void testResolve() throws Exception {
    ElasticQuotaConfiguration conf = newConf();
    GroupQuotaManager manager = new GroupQuotaManager(conf);
    manager.addOrUpdateQuota(leaf("a", null, "cpu=1"));
    QuotaNameResolver resolver = new QuotaNameResolver(conf, manager);

    assertEquals("a", resolver.resolve(pending("w1", "a", "cpu=1", 0, 0)));
    assertEquals("default",
        resolver.resolve(pending("w2", null, "cpu=1", 0, 0)));
    assertEquals("default",
        resolver.resolve(pending("w3", "nope", "cpu=1", 0, 0)));
    assertEquals("nope",
        resolver.getLabeledQuotaName(pending("w3", "nope", "cpu=1", 0, 0)));
  }

  @Test
  public void testStrictAndCustomLabel() {
    ElasticQuotaConfiguration conf = newConf();
    conf.setBoolean(ElasticQuotaConfiguration.STRICT_QUOTA_LOOKUP, true);
    conf.set(ElasticQuotaConfiguration.QUOTA_LABEL, "team");
    QuotaNameResolver resolver =
        new QuotaNameResolver(conf, new GroupQuotaManager(conf));

    Workload unknown = Workload.newInstance("w1", "w1",
        Collections.singletonMap("team", "nope"), ResourceList.NONE, 0, 0);
    assertNull(resolver.resolve(unknown));
    Workload system = Workload.newInstance("w2", "w2",
        Collections.singletonMap("team", "system"), ResourceList.NONE, 0, 0);
    assertEquals("system", resolver.resolve(system));
    // the default label key is ignored
    assertEquals("default",
        resolver.resolve(pending("w3", "system", "cpu=1", 0, 0)));
  }

  @Test
  public void testParentLabelIsNotALeaf() throws Exception {
    for (boolean strict : new boolean[] {false, true}) {
      ElasticQuotaConfiguration conf = newConf();
      conf.setBoolean(ElasticQuotaConfiguration.STRICT_QUOTA_LOOKUP, strict);
      GroupQuotaManager manager = new GroupQuotaManager(conf);
      manager.addOrUpdateQuota(parent("p", null, "cpu=10"));
      manager.addOrUpdateQuota(leaf("a", "p", "cpu=10"));
      QuotaNameResolver resolver = new QuotaNameResolver(conf, manager);

      String expected = strict ? null : "default";
      assertEquals(expected,
          resolver.resolve(pending("w1", "p", "cpu=1", 0, 0)));
      assertEquals(expected,
          resolver.resolve(pending("w2", "root", "cpu=1", 0, 0)));
      assertEquals("a", resolver.resolve(pending("w3", "a", "cpu=1", 0, 0)));
    }
  }
}
