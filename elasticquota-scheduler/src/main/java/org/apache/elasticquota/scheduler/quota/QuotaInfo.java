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

import java.util.Set;

import org.apache.elasticquota.resource.ResourceList;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

import com.google.common.collect.ImmutableSet;

/**
 * Point-in-time snapshot of one quota group. Max and shared weight are the
 * effective values, so a group whose max follows the cluster reports the
 * cluster capacity.
 */
@Public
@Unstable
public final class QuotaInfo {

  private final String name;
  private final String parentName;
  private final boolean parent;
  private final ResourceList min;
  private final ResourceList max;
  private final ResourceList sharedWeight;
  private final ResourceList used;
  private final ResourceList request;
  private final ResourceList runtime;
  private final Set<String> childNames;
  private final int workloadCount;
  private final boolean revokeEnabled;

  QuotaInfo(String name, String parentName, boolean parent, ResourceList min,
      ResourceList max, ResourceList sharedWeight, ResourceList used,
      ResourceList request, ResourceList runtime, Set<String> childNames,
      int workloadCount, boolean revokeEnabled) {
    this.name = name;
    this.parentName = parentName;
    this.parent = parent;
    this.min = min;
    this.max = max;
    this.sharedWeight = sharedWeight;
    this.used = used;
    this.request = request;
    this.runtime = runtime;
    this.childNames = ImmutableSet.copyOf(childNames);
    this.workloadCount = workloadCount;
    this.revokeEnabled = revokeEnabled;
  }

  public String getName() {
    return name;
  }

  /**
   * @return the parent name, null for the root group
   */
  public String getParentName() {
    return parentName;
  }

  public boolean isParent() {
    return parent;
  }

  public ResourceList getMin() {
    return min;
  }

  public ResourceList getMax() {
    return max;
  }

  public ResourceList getSharedWeight() {
    return sharedWeight;
  }

  public ResourceList getUsed() {
    return used;
  }

  public ResourceList getRequest() {
    return request;
  }

  public ResourceList getRuntime() {
    return runtime;
  }

  public Set<String> getChildNames() {
    return childNames;
  }

  public int getWorkloadCount() {
    return workloadCount;
  }

  public boolean isRevokeEnabled() {
    return revokeEnabled;
  }

  @Override
  public String toString() {
    return "QuotaInfo{name=" + name + ", used=<" + used + ">, request=<"
        + request + ">, runtime=<" + runtime + ">, min=<" + min + ">, max=<"
        + max + ">}";
  }
}
