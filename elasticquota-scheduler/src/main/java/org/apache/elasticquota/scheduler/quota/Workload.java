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

import java.util.Collections;
import java.util.Map;

import org.apache.elasticquota.resource.ResourceList;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

import com.google.common.collect.ImmutableMap;

/**
 * Immutable view of a schedulable workload as far as quota accounting is
 * concerned. A workload without a node name is still pending.
 */
@Public
@Unstable
public final class Workload {

  private final String uid;
  private final String name;
  private final Map<String, String> labels;
  private final ResourceList request;
  private final int priority;
  private final long creationTime;
  private final String nodeName;
  //placeholder holding resources for a future workload; never charged twice
  private final boolean reservation;

  private Workload(String uid, String name, Map<String, String> labels,
      ResourceList request, int priority, long creationTime, String nodeName,
      boolean reservation) {
    this.uid = uid;
    this.name = name;
    this.labels = labels == null ? Collections.<String, String>emptyMap()
        : ImmutableMap.copyOf(labels);
    this.request = request == null ? ResourceList.NONE : request;
    this.priority = priority;
    this.creationTime = creationTime;
    this.nodeName = nodeName;
    this.reservation = reservation;
  }

  public static Workload newInstance(String uid, String name,
      Map<String, String> labels, ResourceList request, int priority,
      long creationTime) {
    return new Workload(uid, name, labels, request, priority, creationTime,
        null, false);
  }

  public static Workload newInstance(String uid, String name,
      Map<String, String> labels, ResourceList request, int priority,
      long creationTime, String nodeName, boolean reservation) {
    return new Workload(uid, name, labels, request, priority, creationTime,
        nodeName, reservation);
  }

  /**
   * @return a copy of this workload bound to <code>node</code>
   */
  public Workload assignedTo(String node) {
    return new Workload(uid, name, labels, request, priority, creationTime,
        node, reservation);
  }

  public String getUid() {
    return uid;
  }

  public String getName() {
    return name;
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public String getLabel(String key) {
    return labels.get(key);
  }

  public ResourceList getRequest() {
    return request;
  }

  public int getPriority() {
    return priority;
  }

  public long getCreationTime() {
    return creationTime;
  }

  public String getNodeName() {
    return nodeName;
  }

  public boolean isAssigned() {
    return nodeName != null && !nodeName.isEmpty();
  }

  public boolean isReservation() {
    return reservation;
  }

  @Override
  public String toString() {
    return name + "(" + uid + ")";
  }
}
