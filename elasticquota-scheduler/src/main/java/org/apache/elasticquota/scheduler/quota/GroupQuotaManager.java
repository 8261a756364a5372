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

import static org.apache.elasticquota.conf.ElasticQuotaConfiguration.DEFAULT_QUOTA_NAME;
import static org.apache.elasticquota.conf.ElasticQuotaConfiguration.ROOT_QUOTA_NAME;
import static org.apache.elasticquota.conf.ElasticQuotaConfiguration.SYSTEM_QUOTA_NAME;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.elasticquota.exceptions.QuotaInUseException;
import org.apache.elasticquota.exceptions.QuotaNotFoundException;
import org.apache.elasticquota.exceptions.ValidationException;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.resource.Resources;
import org.apache.elasticquota.scheduler.quota.QuotaNode.TrackedWorkload;
import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Owner of the quota tree.
 * <p>
 * The shape of the tree is guarded by a read/write lock. Structural edits
 * and runtime recomputation take the write lock. Reservations, workload
 * events and queries take the read lock and change used/request under the
 * monitor of each node they touch, so concurrent admissions do not serialize
 * on the manager.
 */
@Private
@Unstable
public class GroupQuotaManager {

  private static final Log LOG = LogFactory.getLog(GroupQuotaManager.class);

  private final Map<String, QuotaNode> quotas =
      new HashMap<String, QuotaNode>();
  //workload uid -> name of the quota it is charged to
  private final ConcurrentMap<String, String> workloadToQuota =
      new ConcurrentHashMap<String, String>();
  private final Map<String, ResourceList> nodeAllocatable =
      new HashMap<String, ResourceList>();
  private volatile ResourceList clusterTotal = ResourceList.NONE;

  private final RuntimeQuotaCalculator calculator =
      new RuntimeQuotaCalculator();
  private final boolean strictLookup;

  private final ReadLock readLock;
  private final WriteLock writeLock;

  public GroupQuotaManager(ElasticQuotaConfiguration conf) {
    ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    readLock = lock.readLock();
    writeLock = lock.writeLock();
    strictLookup = conf.isStrictQuotaLookup();

    QuotaNode root = new QuotaNode(ROOT_QUOTA_NAME, null, true);
    root.unboundedMax = true;
    quotas.put(ROOT_QUOTA_NAME, root);
    addWellKnownQuota(SYSTEM_QUOTA_NAME, conf.getSystemQuotaGroupMax());
    addWellKnownQuota(DEFAULT_QUOTA_NAME, conf.getDefaultQuotaGroupMax());
  }

  private void addWellKnownQuota(String name, ResourceList max) {
    QuotaNode node = new QuotaNode(name, ROOT_QUOTA_NAME, false);
    if (max == null) {
      node.unboundedMax = true;
    } else {
      node.max = max;
    }
    quotas.put(name, node);
    quotas.get(ROOT_QUOTA_NAME).children.add(name);
    LOG.info("Initialized quota " + name + " with max "
        + (max == null ? "<cluster>" : "<" + max + ">"));
  }

  public static boolean isWellKnownQuota(String name) {
    return ROOT_QUOTA_NAME.equals(name) || SYSTEM_QUOTA_NAME.equals(name)
        || DEFAULT_QUOTA_NAME.equals(name);
  }

  /**
   * Insert a quota group or update an existing one, re-linking it when its
   * parent changed.
   * @throws ValidationException if the spec is inconsistent with itself or
   *         with the tree
   */
  public void addOrUpdateQuota(ElasticQuotaSpec spec)
      throws ValidationException {
    Preconditions.checkNotNull(spec, "spec");
    String name = spec.getName();
    if (StringUtils.isBlank(name)) {
      throw new ValidationException("Quota name must not be empty");
    }
    if (ROOT_QUOTA_NAME.equals(name)) {
      throw new ValidationException("Quota " + ROOT_QUOTA_NAME
          + " cannot be modified");
    }
    // an empty max keeps the configured max of system and default
    boolean keepsMax = isWellKnownQuota(name) && spec.getMax().isEmpty();
    if (!keepsMax) {
      checkMinWithinMax(name, spec.getMin(), spec.getMax());
    }
    String parentName = StringUtils.isBlank(spec.getParentName())
        ? ROOT_QUOTA_NAME : spec.getParentName();
    if (isWellKnownQuota(name)
        && (!ROOT_QUOTA_NAME.equals(parentName) || spec.isParent())) {
      throw new ValidationException("Quota " + name
          + " must stay a leaf directly below " + ROOT_QUOTA_NAME);
    }

    try {
      writeLock.lock();
      QuotaNode parent = quotas.get(parentName);
      if (parent == null) {
        throw new ValidationException("Parent quota " + parentName
            + " of quota " + name + " does not exist");
      }
      if (!parent.parent) {
        throw new ValidationException("Quota " + parentName
            + " is not a parent quota and cannot hold " + name);
      }
      for (QuotaNode n = parent; n != null; n = getParent(n)) {
        if (n.name.equals(name)) {
          throw new ValidationException("Setting parent of " + name + " to "
              + parentName + " would create a cycle");
        }
      }

      QuotaNode node = quotas.get(name);
      if (keepsMax && !node.unboundedMax) {
        checkMinWithinMax(name, spec.getMin(), node.max);
      }
      if (node == null) {
        node = new QuotaNode(name, parentName, spec.isParent());
        quotas.put(name, node);
        parent.children.add(name);
        LOG.info("Added quota " + spec);
      } else {
        if (!spec.isParent() && !node.children.isEmpty()) {
          throw new ValidationException("Quota " + name
              + " still has children " + node.children
              + " and cannot become a leaf");
        }
        synchronized (node) {
          if (spec.isParent() && !node.workloads.isEmpty()) {
            throw new ValidationException("Quota " + name + " still holds "
                + node.workloads.size()
                + " workloads and cannot become a parent");
          }
        }
        if (!parentName.equals(node.parentName)) {
          relink(node, parent);
        }
        node.parent = spec.isParent();
        LOG.info("Updated quota " + spec);
      }

      node.min = spec.getMin();
      if (!isWellKnownQuota(name)) {
        node.max = spec.getMax();
        node.unboundedMax = false;
      } else if (!spec.getMax().isEmpty()) {
        node.max = spec.getMax();
        node.unboundedMax = false;
      }
      node.sharedWeight = spec.getSharedWeight();
      node.revokeEnabled = spec.isRevokeEnabled();
      node.childrenDirty = true;
      markPathDirty(parent);
    } finally {
      writeLock.unlock();
    }
  }

  private static void checkMinWithinMax(String name, ResourceList min,
      ResourceList max) throws ValidationException {
    List<String> exceeded = Resources.exceededDimensions(min, max);
    if (!exceeded.isEmpty()) {
      throw new ValidationException("Min of quota " + name
          + " is larger than its max on " + exceeded);
    }
  }

  // caller holds the write lock
  private void relink(QuotaNode node, QuotaNode newParent) {
    QuotaNode oldParent = getParent(node);
    ResourceList used;
    ResourceList request;
    synchronized (node) {
      used = node.used;
      request = node.request;
    }
    applyToPath(oldParent, used, ResourceList.NONE, request,
        ResourceList.NONE);
    oldParent.children.remove(node.name);
    markPathDirty(oldParent);

    node.parentName = newParent.name;
    newParent.children.add(node.name);
    applyToPath(newParent, ResourceList.NONE, used, ResourceList.NONE,
        request);
    LOG.info("Moved quota " + node.name + " from " + oldParent.name + " to "
        + newParent.name);
  }

  /**
   * Remove a quota group which holds neither children nor workloads.
   * Workloads still labelled with it fall back to the default group.
   */
  public void deleteQuota(String name) throws ValidationException,
      QuotaInUseException, QuotaNotFoundException {
    if (isWellKnownQuota(name)) {
      throw new ValidationException("Quota " + name + " cannot be deleted");
    }
    try {
      writeLock.lock();
      QuotaNode node = quotas.get(name);
      if (node == null) {
        throw new QuotaNotFoundException(name);
      }
      if (!node.children.isEmpty()) {
        throw new QuotaInUseException("Quota " + name
            + " still has children " + node.children);
      }
      synchronized (node) {
        if (!node.workloads.isEmpty()) {
          throw new QuotaInUseException("Quota " + name + " still holds "
              + node.workloads.size() + " workloads");
        }
      }
      QuotaNode parent = getParent(node);
      parent.children.remove(name);
      quotas.remove(name);
      markPathDirty(parent);
      LOG.info("Deleted quota " + name);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Bring the runtime of <code>name</code> up to date by recomputing every
   * dirty level between the root and the group.
   */
  public void refreshRuntime(String name) {
    List<QuotaNode> path;
    try {
      readLock.lock();
      QuotaNode node = resolve(name);
      if (node == null) {
        return;
      }
      path = new LinkedList<QuotaNode>();
      boolean dirty = false;
      for (QuotaNode n = getParent(node); n != null; n = getParent(n)) {
        path.add(0, n);
        dirty |= n.childrenDirty;
      }
      if (!dirty) {
        return;
      }
    } finally {
      readLock.unlock();
    }

    try {
      writeLock.lock();
      for (QuotaNode n : path) {
        // the group may have been removed while no lock was held
        if (quotas.get(n.name) == n && n.childrenDirty) {
          recomputeChildren(n);
        }
      }
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Recompute every dirty level of the tree.
   */
  public void refreshAll() {
    try {
      readLock.lock();
      boolean dirty = false;
      for (QuotaNode node : quotas.values()) {
        dirty |= node.parent && node.childrenDirty;
      }
      if (!dirty) {
        return;
      }
    } finally {
      readLock.unlock();
    }

    try {
      writeLock.lock();
      Deque<QuotaNode> queue = new ArrayDeque<QuotaNode>();
      queue.add(quotas.get(ROOT_QUOTA_NAME));
      while (!queue.isEmpty()) {
        QuotaNode node = queue.poll();
        if (node.childrenDirty) {
          recomputeChildren(node);
        }
        for (String child : node.children) {
          QuotaNode c = quotas.get(child);
          if (c.parent) {
            queue.add(c);
          }
        }
      }
    } finally {
      writeLock.unlock();
    }
  }

  // caller holds the write lock
  private void recomputeChildren(QuotaNode node) {
    ResourceList total = clusterTotal;
    List<RuntimeQuotaCalculator.ChildDemand> demands =
        new ArrayList<RuntimeQuotaCalculator.ChildDemand>();
    for (String child : node.children) {
      QuotaNode c = quotas.get(child);
      ResourceList request;
      synchronized (c) {
        request = c.request;
      }
      demands.add(new RuntimeQuotaCalculator.ChildDemand(c.name, c.min,
          c.getEffectiveMax(total), c.getEffectiveWeight(total), request));
    }
    RuntimeQuotaCalculator.Result result =
        calculator.computeChildrenRuntime(node.runtime, demands);
    if (result.isOverCommitted()) {
      LOG.warn("Quota " + node.name + " is over committed on "
          + result.getOverCommittedResources()
          + ": the sum of the mins of its children exceeds its runtime <"
          + node.runtime + ">, mins are scaled down");
    }
    for (String child : node.children) {
      QuotaNode c = quotas.get(child);
      ResourceList runtime = result.getRuntime(child);
      if (!runtime.equals(c.runtime)) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Runtime of quota " + child + " changed from <"
              + c.runtime + "> to <" + runtime + ">");
        }
        c.runtime = runtime;
        if (c.parent) {
          c.childrenDirty = true;
        }
      }
    }
    node.childrenDirty = false;
  }

  /**
   * @return a snapshot of the named group; an unknown name maps to the
   *         default group unless lookup is strict, in which case null
   */
  public QuotaInfo getQuotaInfoByName(String name) {
    try {
      readLock.lock();
      QuotaNode node = resolve(name);
      return node == null ? null : snapshot(node);
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Every group in name order after a full refresh.
   */
  public List<QuotaInfo> getAllQuotaInfos() {
    refreshAll();
    try {
      readLock.lock();
      List<String> names = new ArrayList<String>(quotas.keySet());
      Collections.sort(names);
      List<QuotaInfo> infos = new ArrayList<QuotaInfo>(names.size());
      for (String name : names) {
        infos.add(snapshot(quotas.get(name)));
      }
      return infos;
    } finally {
      readLock.unlock();
    }
  }

  private QuotaInfo snapshot(QuotaNode node) {
    ResourceList total = clusterTotal;
    synchronized (node) {
      return new QuotaInfo(node.name, node.parentName, node.parent, node.min,
          node.getEffectiveMax(total), node.getEffectiveWeight(total),
          node.used, node.request, node.runtime, node.children,
          node.workloads.size(), node.revokeEnabled);
    }
  }

  /**
   * Charge an admitted workload to <code>quotaName</code>. Repeating the call
   * for a workload which is already reserved changes nothing.
   * @return false if the quota cannot take workloads or the workload is
   *         charged to another quota
   */
  public boolean reservePod(String quotaName, Workload workload) {
    try {
      readLock.lock();
      QuotaNode node = resolve(quotaName);
      if (node == null || node.parent) {
        LOG.warn("Cannot reserve " + workload + " in quota " + quotaName
            + ", it is unknown or a parent quota");
        return false;
      }
      String tracked = workloadToQuota.get(workload.getUid());
      if (tracked != null && !tracked.equals(node.name)) {
        LOG.warn("Cannot reserve " + workload + " in quota " + node.name
            + ", it is already tracked in " + tracked);
        return false;
      }

      ResourceList used;
      ResourceList request = ResourceList.NONE;
      synchronized (node) {
        TrackedWorkload record = node.workloads.get(workload.getUid());
        if (record == null) {
          tracked = workloadToQuota.putIfAbsent(workload.getUid(), node.name);
          if (tracked != null) {
            LOG.warn("Cannot reserve " + workload + " in quota " + node.name
                + ", it was just tracked in " + tracked);
            return false;
          }
          record = new TrackedWorkload(workload, true, true);
          node.workloads.put(workload.getUid(), record);
          request = workload.getRequest();
        } else if (!record.assigned) {
          record.assigned = true;
        } else {
          return true;
        }
        used = record.workload.getRequest();
      }
      applyToPath(node, ResourceList.NONE, used, ResourceList.NONE, request);
      if (!request.isEmpty()) {
        markPathDirty(getParent(node));
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Reserved " + workload + " in quota " + node.name
            + ", used +<" + used + ">, request +<" + request + ">");
      }
      return true;
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Undo exactly what {@link #reservePod} added for the workload.
   * @return false if the workload was not reserved
   */
  public boolean unreservePod(String quotaName, Workload workload) {
    try {
      readLock.lock();
      String tracked = workloadToQuota.get(workload.getUid());
      QuotaNode node = tracked == null ? null : quotas.get(tracked);
      if (node == null) {
        return false;
      }
      if (quotaName != null && !quotaName.equals(tracked)
          && LOG.isDebugEnabled()) {
        LOG.debug("Unreserving " + workload + " from " + tracked
            + " instead of " + quotaName);
      }

      ResourceList used;
      ResourceList request = ResourceList.NONE;
      synchronized (node) {
        TrackedWorkload record = node.workloads.get(workload.getUid());
        if (record == null || !record.assigned) {
          return false;
        }
        record.assigned = false;
        used = record.workload.getRequest();
        if (record.addedByReserve) {
          node.workloads.remove(workload.getUid());
          workloadToQuota.remove(workload.getUid(), node.name);
          request = record.workload.getRequest();
        }
      }
      applyToPath(node, used, ResourceList.NONE, request, ResourceList.NONE);
      if (!request.isEmpty()) {
        markPathDirty(getParent(node));
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Unreserved " + workload + " from quota " + node.name);
      }
      return true;
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Start tracking a workload reported by the cluster. A workload already
   * known from a reservation is confirmed instead.
   */
  public void onPodAdd(String quotaName, Workload workload) {
    try {
      readLock.lock();
      String tracked = workloadToQuota.get(workload.getUid());
      if (tracked != null) {
        updateTracked(quotas.get(tracked), workload);
        return;
      }
      QuotaNode node = resolveLeaf(quotaName, workload);
      if (node == null) {
        return;
      }
      addTracked(node, new TrackedWorkload(workload, workload.isAssigned(),
          false));
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Re-account a workload whose quota, node assignment or request changed.
   */
  public void onPodUpdate(String oldQuotaName, String newQuotaName,
      Workload oldWorkload, Workload newWorkload) {
    try {
      readLock.lock();
      String tracked = workloadToQuota.get(newWorkload.getUid());
      QuotaNode target = resolveLeaf(newQuotaName, newWorkload);
      if (tracked == null) {
        if (target != null) {
          addTracked(target, new TrackedWorkload(newWorkload,
              newWorkload.isAssigned(), false));
        }
        return;
      }
      QuotaNode current = quotas.get(tracked);
      if (target == null || target == current) {
        updateTracked(current, newWorkload);
        return;
      }
      TrackedWorkload record = removeTracked(current, newWorkload.getUid());
      if (record != null) {
        record.workload = newWorkload;
        record.assigned |= newWorkload.isAssigned();
        record.addedByReserve = false;
        addTracked(target, record);
        LOG.info("Moved " + newWorkload + " from quota " + current.name
            + " to " + target.name);
      }
    } finally {
      readLock.unlock();
    }
  }

  public void onPodDelete(Workload workload) {
    try {
      readLock.lock();
      String tracked = workloadToQuota.get(workload.getUid());
      if (tracked != null) {
        removeTracked(quotas.get(tracked), workload.getUid());
      }
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Move a tracked workload together with its used and request.
   * @return false if the workload is not tracked in <code>from</code> or
   *         <code>to</code> cannot hold workloads
   */
  public boolean migratePod(String from, String to, Workload workload) {
    try {
      readLock.lock();
      QuotaNode source = quotas.get(from);
      QuotaNode target = quotas.get(to);
      if (source == null || target == null || target.parent
          || !from.equals(workloadToQuota.get(workload.getUid()))) {
        return false;
      }
      if (source == target) {
        return true;
      }
      TrackedWorkload record = removeTracked(source, workload.getUid());
      if (record == null) {
        return false;
      }
      addTracked(target, record);
      LOG.info("Migrated " + workload + " from quota " + from + " to " + to);
      return true;
    } finally {
      readLock.unlock();
    }
  }

  // caller holds the read lock
  private void addTracked(QuotaNode node, TrackedWorkload record) {
    String uid = record.workload.getUid();
    String tracked;
    synchronized (node) {
      tracked = workloadToQuota.putIfAbsent(uid, node.name);
      if (tracked == null) {
        node.workloads.put(uid, record);
      }
    }
    if (tracked != null) {
      // claimed meanwhile by a reservation or another event
      updateTracked(quotas.get(tracked), record.workload);
      return;
    }
    applyToPath(node, ResourceList.NONE, record.usedContribution(),
        ResourceList.NONE, record.workload.getRequest());
    markPathDirty(getParent(node));
  }

  // caller holds the read lock
  private TrackedWorkload removeTracked(QuotaNode node, String uid) {
    TrackedWorkload record;
    synchronized (node) {
      record = node.workloads.remove(uid);
      workloadToQuota.remove(uid, node.name);
    }
    if (record != null) {
      applyToPath(node, record.usedContribution(), ResourceList.NONE,
          record.workload.getRequest(), ResourceList.NONE);
      markPathDirty(getParent(node));
    }
    return record;
  }

  // caller holds the read lock
  private void updateTracked(QuotaNode node, Workload workload) {
    ResourceList oldUsed;
    ResourceList oldRequest;
    ResourceList newUsed;
    synchronized (node) {
      TrackedWorkload record = node.workloads.get(workload.getUid());
      if (record == null) {
        return;
      }
      oldUsed = record.usedContribution();
      oldRequest = record.workload.getRequest();
      record.workload = workload;
      record.assigned |= workload.isAssigned();
      record.addedByReserve = false;
      newUsed = record.usedContribution();
    }
    if (oldUsed.equals(newUsed)
        && oldRequest.equals(workload.getRequest())) {
      return;
    }
    applyToPath(node, oldUsed, newUsed, oldRequest, workload.getRequest());
    if (!oldRequest.equals(workload.getRequest())) {
      markPathDirty(getParent(node));
    }
  }

  private void applyToPath(QuotaNode start, ResourceList removeUsed,
      ResourceList addUsed, ResourceList removeRequest,
      ResourceList addRequest) {
    for (QuotaNode n = start; n != null; n = getParent(n)) {
      synchronized (n) {
        n.used = Resources.add(
            Resources.subtractNonNegative(n.used, removeUsed), addUsed);
        n.request = Resources.add(
            Resources.subtractNonNegative(n.request, removeRequest),
            addRequest);
      }
    }
  }

  private void markPathDirty(QuotaNode start) {
    for (QuotaNode n = start; n != null; n = getParent(n)) {
      n.childrenDirty = true;
    }
  }

  public void onNodeAdd(String nodeName, ResourceList allocatable) {
    updateNode(nodeName, allocatable);
  }

  public void onNodeUpdate(String nodeName, ResourceList allocatable) {
    updateNode(nodeName, allocatable);
  }

  public void onNodeDelete(String nodeName) {
    updateNode(nodeName, null);
  }

  private void updateNode(String nodeName, ResourceList allocatable) {
    try {
      writeLock.lock();
      ResourceList previous = allocatable == null
          ? nodeAllocatable.remove(nodeName)
          : nodeAllocatable.put(nodeName, allocatable);
      if (allocatable == null ? previous == null
          : allocatable.equals(previous)) {
        return;
      }
      ResourceList total = ResourceList.NONE;
      for (ResourceList node : nodeAllocatable.values()) {
        total = Resources.add(total, node);
      }
      clusterTotal = total;
      QuotaNode root = quotas.get(ROOT_QUOTA_NAME);
      root.min = total;
      root.max = total;
      root.runtime = total;
      // the max of groups following the cluster moved as well
      for (QuotaNode node : quotas.values()) {
        if (node.parent) {
          node.childrenDirty = true;
        }
      }
      LOG.info("Cluster capacity changed to <" + total + "> after node "
          + nodeName + (allocatable == null ? " was removed" : " changed"));
    } finally {
      writeLock.unlock();
    }
  }

  public ResourceList getClusterTotalResource() {
    return clusterTotal;
  }

  public List<String> getQuotaNames() {
    try {
      readLock.lock();
      List<String> names = new ArrayList<String>(quotas.keySet());
      Collections.sort(names);
      return names;
    } finally {
      readLock.unlock();
    }
  }

  public boolean quotaExists(String name) {
    try {
      readLock.lock();
      return name != null && quotas.containsKey(name);
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return true if the group exists and can hold workloads
   */
  public boolean isLeafQuota(String name) {
    try {
      readLock.lock();
      QuotaNode node = name == null ? null : quotas.get(name);
      return node != null && !node.parent;
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return the workloads of the group which are bound or reserved
   */
  public List<Workload> getAssignedWorkloads(String quotaName) {
    try {
      readLock.lock();
      QuotaNode node = quotas.get(quotaName);
      if (node == null) {
        return Collections.emptyList();
      }
      List<Workload> assigned = new ArrayList<Workload>();
      synchronized (node) {
        for (TrackedWorkload record : node.workloads.values()) {
          if (record.assigned) {
            assigned.add(record.workload);
          }
        }
      }
      return assigned;
    } finally {
      readLock.unlock();
    }
  }

  public String getTrackedQuotaName(String uid) {
    return workloadToQuota.get(uid);
  }

  public boolean isWorkloadTracked(String quotaName, String uid) {
    return quotaName != null && quotaName.equals(workloadToQuota.get(uid));
  }

  /**
   * @return the group and its ancestors, nearest first, without the root
   */
  public List<String> getQuotaPath(String name) {
    try {
      readLock.lock();
      List<String> path = new ArrayList<String>();
      for (QuotaNode n = quotas.get(name); n != null
          && !ROOT_QUOTA_NAME.equals(n.name); n = getParent(n)) {
        path.add(n.name);
      }
      return path;
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return true if <code>name</code> is <code>ancestor</code> or below it
   */
  public boolean isInSubtree(String ancestor, String name) {
    try {
      readLock.lock();
      for (QuotaNode n = quotas.get(name); n != null; n = getParent(n)) {
        if (n.name.equals(ancestor)) {
          return true;
        }
      }
      return false;
    } finally {
      readLock.unlock();
    }
  }

  private QuotaNode getParent(QuotaNode node) {
    return node.parentName == null ? null : quotas.get(node.parentName);
  }

  private QuotaNode resolve(String name) {
    QuotaNode node = name == null ? null : quotas.get(name);
    if (node == null && !strictLookup) {
      node = quotas.get(DEFAULT_QUOTA_NAME);
    }
    return node;
  }

  private QuotaNode resolveLeaf(String quotaName, Workload workload) {
    QuotaNode node = resolve(quotaName);
    if (node != null && node.parent) {
      LOG.warn("Workload " + workload + " names parent quota " + quotaName
          + " which cannot hold workloads");
      node = strictLookup ? null : quotas.get(DEFAULT_QUOTA_NAME);
    }
    if (node == null) {
      LOG.warn("Workload " + workload + " names unknown quota " + quotaName
          + ", it is not tracked");
    }
    return node;
  }

  @VisibleForTesting
  boolean isDirty(String name) {
    QuotaNode node = quotas.get(name);
    return node != null && node.childrenDirty;
  }
}
