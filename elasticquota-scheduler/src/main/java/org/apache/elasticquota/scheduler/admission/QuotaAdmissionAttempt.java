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

package org.apache.elasticquota.scheduler.admission;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.elasticquota.resource.Resources;
import org.apache.elasticquota.scheduler.quota.GroupQuotaManager;
import org.apache.elasticquota.scheduler.quota.QuotaInfo;
import org.apache.elasticquota.scheduler.quota.Workload;
import org.apache.hadoop.yarn.state.InvalidStateTransitionException;
import org.apache.hadoop.yarn.state.MultipleArcTransition;
import org.apache.hadoop.yarn.state.SingleArcTransition;
import org.apache.hadoop.yarn.state.StateMachine;
import org.apache.hadoop.yarn.state.StateMachineFactory;

/**
 * One scheduling attempt of one workload against its quota.
 * <p>
 * The attempt keeps a private copy of the used vector of its quota (and of
 * its ancestors when parent checking is on). Simulations only touch that copy;
 * the shared tree is changed by reserve and unreserve alone.
 * <p>
 * An attempt is driven by a single scheduling thread and is not thread safe.
 */
public class QuotaAdmissionAttempt {

  private static final Log LOG =
      LogFactory.getLog(QuotaAdmissionAttempt.class);

  private static final StateMachineFactory<QuotaAdmissionAttempt,
      AdmissionState, AdmissionEventType, AdmissionEvent> stateMachineFactory =
      new StateMachineFactory<QuotaAdmissionAttempt, AdmissionState,
          AdmissionEventType, AdmissionEvent>(AdmissionState.INIT)

          // Transitions from INIT state
          .addTransition(AdmissionState.INIT,
              EnumSet.of(AdmissionState.ACCEPTED, AdmissionState.REJECTED),
              AdmissionEventType.PRE_ADMIT, new PreAdmitTransition())
          .addTransition(AdmissionState.INIT, AdmissionState.CANCELLED,
              AdmissionEventType.CANCEL)

          // Transitions from ACCEPTED state
          .addTransition(AdmissionState.ACCEPTED, AdmissionState.ACCEPTED,
              AdmissionEventType.SIMULATE_ADD, new SimulateAddTransition())
          .addTransition(AdmissionState.ACCEPTED, AdmissionState.ACCEPTED,
              AdmissionEventType.SIMULATE_REMOVE,
              new SimulateRemoveTransition())
          .addTransition(AdmissionState.ACCEPTED,
              EnumSet.of(AdmissionState.RESERVED, AdmissionState.ACCEPTED),
              AdmissionEventType.RESERVE, new ReserveTransition())
          .addTransition(AdmissionState.ACCEPTED, AdmissionState.CANCELLED,
              AdmissionEventType.CANCEL)

          // Transitions from REJECTED state
          .addTransition(AdmissionState.REJECTED, AdmissionState.REJECTED,
              AdmissionEventType.SIMULATE_ADD, new SimulateAddTransition())
          .addTransition(AdmissionState.REJECTED, AdmissionState.REJECTED,
              AdmissionEventType.SIMULATE_REMOVE,
              new SimulateRemoveTransition())
          .addTransition(AdmissionState.REJECTED, AdmissionState.CANCELLED,
              AdmissionEventType.CANCEL)

          // Transitions from RESERVED state
          .addTransition(AdmissionState.RESERVED,
              EnumSet.of(AdmissionState.RESERVED),
              AdmissionEventType.RESERVE, new ReserveTransition())
          .addTransition(AdmissionState.RESERVED, AdmissionState.BOUND,
              AdmissionEventType.BIND, new BindTransition())
          .addTransition(AdmissionState.RESERVED, AdmissionState.UNRESERVED,
              AdmissionEventType.UNRESERVE, new UnreserveTransition())

          .installTopology();

  private final StateMachine<AdmissionState, AdmissionEventType,
      AdmissionEvent> stateMachine;

  private final Workload workload;
  private final GroupQuotaManager manager;
  private final String quotaName;
  //the quota first, then the ancestors that are checked as well
  private final List<String> checkedPath;

  private final Map<String, ResourceList> used =
      new LinkedHashMap<String, ResourceList>();
  private final Map<String, ResourceList> runtime =
      new HashMap<String, ResourceList>();
  //uid -> amount taken off by a simulated removal
  private final Map<String, ResourceList> simulatedRemovals =
      new HashMap<String, ResourceList>();
  private AdmissionStatus status = AdmissionStatus.success();

  QuotaAdmissionAttempt(Workload workload, String quotaName,
      List<String> checkedPath, GroupQuotaManager manager) {
    this.workload = workload;
    this.quotaName = quotaName;
    this.checkedPath = checkedPath;
    this.manager = manager;
    this.stateMachine = stateMachineFactory.make(this);
  }

  /**
   * Apply the event.
   * @return the status of the step, an error if the event is not allowed in
   *         the current state
   */
  AdmissionStatus handle(AdmissionEvent event) {
    AdmissionState oldState = getState();
    try {
      stateMachine.doTransition(event.getType(), event);
    } catch (InvalidStateTransitionException e) {
      LOG.warn("Can't handle " + event.getType() + " for " + workload
          + " at current state " + oldState);
      return AdmissionStatus.error("Invalid event " + event.getType()
          + " at state " + oldState);
    }
    if (oldState != getState() && LOG.isDebugEnabled()) {
      LOG.debug("Admission of " + workload + " transitioned from " + oldState
          + " to " + getState());
    }
    return status;
  }

  public AdmissionState getState() {
    return stateMachine.getCurrentState();
  }

  public Workload getWorkload() {
    return workload;
  }

  /**
   * @return the resolved quota, null if strict lookup found none
   */
  public String getQuotaName() {
    return quotaName;
  }

  public AdmissionStatus getStatus() {
    return status;
  }

  /**
   * @return the attempt's private used vector of its own quota
   */
  public ResourceList getUsed() {
    ResourceList u = used.get(quotaName);
    return u == null ? ResourceList.NONE : u;
  }

  public ResourceList getRuntime() {
    ResourceList r = runtime.get(quotaName);
    return r == null ? ResourceList.NONE : r;
  }

  Map<String, ResourceList> getSimulatedRemovals() {
    return Collections.unmodifiableMap(simulatedRemovals);
  }

  /**
   * Check the request against the private used copy of every checked group.
   * Every dimension of the group's runtime is compared, together with the
   * dimensions the workload asks for.
   */
  AdmissionStatus checkFits() {
    ResourceList request = workload.getRequest();
    for (String name : checkedPath) {
      ResourceList usedAfter = Resources.add(used.get(name), request);
      List<String> exceeded = Resources.exceededDimensions(usedAfter,
          runtime.get(name), Resources.resourceNames(runtime.get(name),
              request));
      if (!exceeded.isEmpty()) {
        return AdmissionStatus.unschedulable("Insufficient quotas, quotaName: "
            + name + ", runtime: <" + runtime.get(name) + ">, used: <"
            + used.get(name) + ">, request: <" + request
            + ">, exceedDimensions: " + exceeded);
      }
    }
    return AdmissionStatus.success();
  }

  private boolean isSimulatable(Workload candidate) {
    return candidate != null && !candidate.isReservation()
        && manager.isWorkloadTracked(quotaName, candidate.getUid());
  }

  private static class PreAdmitTransition implements
      MultipleArcTransition<QuotaAdmissionAttempt, AdmissionEvent,
          AdmissionState> {
    @Override
    public AdmissionState transition(QuotaAdmissionAttempt attempt,
        AdmissionEvent event) {
      if (attempt.quotaName == null) {
        attempt.status = AdmissionStatus.error("Could not find the "
            + "specified elastic quota of " + attempt.workload);
        return AdmissionState.REJECTED;
      }
      attempt.manager.refreshRuntime(attempt.quotaName);
      for (String name : attempt.checkedPath) {
        QuotaInfo info = attempt.manager.getQuotaInfoByName(name);
        if (info == null) {
          attempt.status = AdmissionStatus.error("Quota " + name
              + " disappeared while admitting " + attempt.workload);
          return AdmissionState.REJECTED;
        }
        attempt.used.put(name, info.getUsed());
        attempt.runtime.put(name, info.getRuntime());
      }
      attempt.status = attempt.checkFits();
      return attempt.status.isSuccess() ? AdmissionState.ACCEPTED
          : AdmissionState.REJECTED;
    }
  }

  private static class SimulateAddTransition implements
      SingleArcTransition<QuotaAdmissionAttempt, AdmissionEvent> {
    @Override
    public void transition(QuotaAdmissionAttempt attempt,
        AdmissionEvent event) {
      Workload candidate = event.getCandidate();
      if (!attempt.isSimulatable(candidate)) {
        return;
      }
      ResourceList removed =
          attempt.simulatedRemovals.remove(candidate.getUid());
      ResourceList delta = removed != null ? removed : candidate.getRequest();
      for (Map.Entry<String, ResourceList> entry : attempt.used.entrySet()) {
        entry.setValue(Resources.add(entry.getValue(), delta));
      }
      attempt.status = attempt.checkFits();
    }
  }

  private static class SimulateRemoveTransition implements
      SingleArcTransition<QuotaAdmissionAttempt, AdmissionEvent> {
    @Override
    public void transition(QuotaAdmissionAttempt attempt,
        AdmissionEvent event) {
      Workload candidate = event.getCandidate();
      if (!attempt.isSimulatable(candidate)
          || attempt.simulatedRemovals.containsKey(candidate.getUid())) {
        return;
      }
      // record what was actually taken so a later add restores it exactly
      ResourceList removed = Resources.componentwiseMin(
          candidate.getRequest(), attempt.getUsed());
      attempt.simulatedRemovals.put(candidate.getUid(), removed);
      for (Map.Entry<String, ResourceList> entry : attempt.used.entrySet()) {
        entry.setValue(
            Resources.subtractNonNegative(entry.getValue(), removed));
      }
      attempt.status = attempt.checkFits();
    }
  }

  private static class ReserveTransition implements
      MultipleArcTransition<QuotaAdmissionAttempt, AdmissionEvent,
          AdmissionState> {
    @Override
    public AdmissionState transition(QuotaAdmissionAttempt attempt,
        AdmissionEvent event) {
      if (attempt.manager.reservePod(attempt.quotaName, attempt.workload)) {
        attempt.status = AdmissionStatus.success();
        return AdmissionState.RESERVED;
      }
      attempt.status = AdmissionStatus.error("Failed to reserve "
          + attempt.workload + " in quota " + attempt.quotaName);
      return attempt.getState();
    }
  }

  private static class UnreserveTransition implements
      SingleArcTransition<QuotaAdmissionAttempt, AdmissionEvent> {
    @Override
    public void transition(QuotaAdmissionAttempt attempt,
        AdmissionEvent event) {
      attempt.manager.unreservePod(attempt.quotaName, attempt.workload);
      attempt.status = AdmissionStatus.success();
    }
  }

  private static class BindTransition implements
      SingleArcTransition<QuotaAdmissionAttempt, AdmissionEvent> {
    @Override
    public void transition(QuotaAdmissionAttempt attempt,
        AdmissionEvent event) {
      LOG.info("Bound " + attempt.workload + " in quota "
          + attempt.quotaName);
      attempt.status = AdmissionStatus.success();
    }
  }
}
