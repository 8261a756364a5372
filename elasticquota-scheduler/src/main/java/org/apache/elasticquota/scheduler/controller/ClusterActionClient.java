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

import org.apache.elasticquota.scheduler.quota.QuotaInfo;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;

/**
 * Actions the controllers take on the cluster. Only controllers call it.
 */
@Public
@Evolving
public interface ClusterActionClient {

  /**
   * Ask the cluster to evict a running workload.
   */
  void evictWorkload(Workload workload, String reason) throws IOException;

  /**
   * Publish the used, request and runtime of a quota group.
   */
  void updateQuotaStatus(QuotaInfo info) throws IOException;
}
