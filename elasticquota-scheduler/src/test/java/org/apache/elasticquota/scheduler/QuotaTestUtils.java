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

import java.util.Collections;
import java.util.Map;

import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.scheduler.quota.ElasticQuotaSpec;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.conf.Configuration;

public final class QuotaTestUtils {

  private QuotaTestUtils() {
  }

  public static ElasticQuotaConfiguration newConf() {
    return new ElasticQuotaConfiguration(new Configuration(false), false);
  }

  public static ElasticQuotaSpec leaf(String name, String parent, String max) {
    return ElasticQuotaSpec.newInstance(name, parent, false,
        ResourceList.NONE, ResourceList.parse(max));
  }

  public static ElasticQuotaSpec parent(String name, String parent,
      String max) {
    return ElasticQuotaSpec.newInstance(name, parent, true,
        ResourceList.NONE, ResourceList.parse(max));
  }

  /**
   * A pending workload labelled with <code>quota</code>.
   */
  public static Workload pending(String uid, String quota, String request,
      int priority, long creationTime) {
    return Workload.newInstance(uid, uid, labels(quota),
        ResourceList.parse(request), priority, creationTime);
  }

  /**
   * A workload labelled with <code>quota</code> running on node n1.
   */
  public static Workload running(String uid, String quota, String request,
      int priority, long creationTime) {
    return pending(uid, quota, request, priority, creationTime)
        .assignedTo("n1");
  }

  public static Map<String, String> labels(String quota) {
    if (quota == null) {
      return Collections.emptyMap();
    }
    return Collections.singletonMap(
        ElasticQuotaConfiguration.DEFAULT_QUOTA_LABEL, quota);
  }
}
