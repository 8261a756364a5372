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

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

/**
 * Outcome of an admission step: a code plus a human readable reason.
 */
@Public
@Unstable
public final class AdmissionStatus {

  public enum Code {
    SUCCESS,
    //the quota has no room, the workload may be retried or preempt
    UNSCHEDULABLE,
    ERROR
  }

  private static final AdmissionStatus SUCCESS_STATUS =
      new AdmissionStatus(Code.SUCCESS, "");

  private final Code code;
  private final String reason;

  private AdmissionStatus(Code code, String reason) {
    this.code = code;
    this.reason = reason;
  }

  public static AdmissionStatus success() {
    return SUCCESS_STATUS;
  }

  public static AdmissionStatus unschedulable(String reason) {
    return new AdmissionStatus(Code.UNSCHEDULABLE, reason);
  }

  public static AdmissionStatus error(String reason) {
    return new AdmissionStatus(Code.ERROR, reason);
  }

  public Code getCode() {
    return code;
  }

  public String getReason() {
    return reason;
  }

  public boolean isSuccess() {
    return code == Code.SUCCESS;
  }

  @Override
  public String toString() {
    return reason.isEmpty() ? code.toString() : code + ": " + reason;
  }
}
