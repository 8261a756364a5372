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

import org.apache.commons.lang.StringUtils;
import org.apache.elasticquota.conf.ElasticQuotaConfiguration;
import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.classification.InterfaceStability.Unstable;

/**
 * Maps a workload to the quota group it is charged to by reading a single
 * configurable label.
 */
@Private
@Unstable
public class QuotaNameResolver {

  private final String labelKey;
  private final boolean strict;
  private final GroupQuotaManager manager;

  public QuotaNameResolver(ElasticQuotaConfiguration conf,
      GroupQuotaManager manager) {
    this.labelKey = conf.getQuotaLabel();
    this.strict = conf.isStrictQuotaLookup();
    this.manager = manager;
  }

  /**
   * @return the label value, or null when the workload carries none
   */
  public String getLabeledQuotaName(Workload workload) {
    String name = workload.getLabel(labelKey);
    return StringUtils.isBlank(name) ? null : name.trim();
  }

  /**
   * An unlabelled workload belongs to the default group. A label naming a
   * group which does not exist, or a parent group, maps to the default group
   * as well, unless lookup is strict.
   * @return the group name, or null if strict lookup failed
   */
  public String resolve(Workload workload) {
    String name = getLabeledQuotaName(workload);
    if (name == null) {
      return ElasticQuotaConfiguration.DEFAULT_QUOTA_NAME;
    }
    if (manager.isLeafQuota(name)) {
      return name;
    }
    return strict ? null : ElasticQuotaConfiguration.DEFAULT_QUOTA_NAME;
  }

  public String getLabelKey() {
    return labelKey;
  }
}
