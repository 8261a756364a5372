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

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.elasticquota.resource.ResourceList;

/**
 * Mutable tree node owned by {@link GroupQuotaManager}.
 * Shape fields are guarded by the manager's lock; <code>used</code>,
 * <code>request</code> and <code>workloads</code> by the node's monitor.
 */
class QuotaNode {

  static class TrackedWorkload {
    Workload workload;
    boolean assigned;
    //the record was created by a reservation, not by a workload event
    boolean addedByReserve;

    TrackedWorkload(Workload workload, boolean assigned,
        boolean addedByReserve) {
      this.workload = workload;
      this.assigned = assigned;
      this.addedByReserve = addedByReserve;
    }

    ResourceList usedContribution() {
      return assigned ? workload.getRequest() : ResourceList.NONE;
    }
  }

  final String name;
  String parentName;
  boolean parent;
  ResourceList min = ResourceList.NONE;
  ResourceList max = ResourceList.NONE;
  ResourceList sharedWeight;
  //max follows the cluster capacity
  boolean unboundedMax;
  boolean revokeEnabled;
  final Set<String> children = new TreeSet<String>();

  volatile ResourceList runtime = ResourceList.NONE;
  //runtime of the children has to be recomputed
  volatile boolean childrenDirty = true;

  ResourceList used = ResourceList.NONE;
  ResourceList request = ResourceList.NONE;
  final Map<String, TrackedWorkload> workloads =
      new HashMap<String, TrackedWorkload>();

  QuotaNode(String name, String parentName, boolean parent) {
    this.name = name;
    this.parentName = parentName;
    this.parent = parent;
  }

  ResourceList getEffectiveMax(ResourceList clusterTotal) {
    return unboundedMax ? clusterTotal : max;
  }

  ResourceList getEffectiveWeight(ResourceList clusterTotal) {
    return sharedWeight != null ? sharedWeight : getEffectiveMax(clusterTotal);
  }

  @Override
  public String toString() {
    return name;
  }
}
