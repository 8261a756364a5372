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

import org.apache.elasticquota.resource.ResourceList;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

/**
 * The desired shape of one quota group as submitted by a tenant:
 * its place in the tree and its min, max and shared weight.
 */
@Public
@Unstable
public class ElasticQuotaSpec {

  private String name;
  private String parentName;
  private boolean parent;
  private ResourceList min = ResourceList.NONE;
  private ResourceList max = ResourceList.NONE;
  //null means "same as max"
  private ResourceList sharedWeight;
  private boolean revokeEnabled;

  public static ElasticQuotaSpec newInstance(String name, String parentName,
      boolean isParent, ResourceList min, ResourceList max) {
    ElasticQuotaSpec spec = new ElasticQuotaSpec();
    spec.setName(name);
    spec.setParentName(parentName);
    spec.setParent(isParent);
    spec.setMin(min);
    spec.setMax(max);
    return spec;
  }

  public static ElasticQuotaSpec newInstance(String name, String parentName,
      boolean isParent, ResourceList min, ResourceList max,
      ResourceList sharedWeight) {
    ElasticQuotaSpec spec = newInstance(name, parentName, isParent, min, max);
    spec.setSharedWeight(sharedWeight);
    return spec;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  /**
   * @return the parent group name; null or empty means the root group
   */
  public String getParentName() {
    return parentName;
  }

  public void setParentName(String parentName) {
    this.parentName = parentName;
  }

  public boolean isParent() {
    return parent;
  }

  public void setParent(boolean parent) {
    this.parent = parent;
  }

  public ResourceList getMin() {
    return min;
  }

  public void setMin(ResourceList min) {
    this.min = min == null ? ResourceList.NONE : min;
  }

  public ResourceList getMax() {
    return max;
  }

  public void setMax(ResourceList max) {
    this.max = max == null ? ResourceList.NONE : max;
  }

  public ResourceList getSharedWeight() {
    return sharedWeight;
  }

  public void setSharedWeight(ResourceList sharedWeight) {
    this.sharedWeight = sharedWeight;
  }

  /**
   * Whether the revoke controller watches this group when it is not
   * configured to monitor every group.
   */
  public boolean isRevokeEnabled() {
    return revokeEnabled;
  }

  public void setRevokeEnabled(boolean revokeEnabled) {
    this.revokeEnabled = revokeEnabled;
  }

  @Override
  public String toString() {
    return "ElasticQuotaSpec{name=" + name + ", parent=" + parentName
        + ", isParent=" + parent + ", min=<" + min + ">, max=<" + max
        + ">, sharedWeight=<" + sharedWeight + ">}";
  }
}
