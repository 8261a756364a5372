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

package org.apache.elasticquota.conf;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.elasticquota.resource.ResourceList;
import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;

/**
 * Settings of the elastic quota scheduler plugin and its controllers.
 * Values are read from <code>elastic-quota.xml</code> on the classpath on top
 * of the wrapped configuration.
 */
@Public
@Evolving
public class ElasticQuotaConfiguration extends Configuration {

  private static final Log LOG =
      LogFactory.getLog(ElasticQuotaConfiguration.class);

  private static final String EQ_CONFIGURATION_FILE = "elastic-quota.xml";

  @Private
  public static final String PREFIX = "elasticquota.";

  public static final String ROOT_QUOTA_NAME = "root";
  public static final String SYSTEM_QUOTA_NAME = "system";
  public static final String DEFAULT_QUOTA_NAME = "default";

  /** Max of the well-known system group; follows the cluster when unset. */
  public static final String SYSTEM_QUOTA_GROUP_MAX =
      PREFIX + "system-quota-group.max";

  /** Max of the well-known default group; follows the cluster when unset. */
  public static final String DEFAULT_QUOTA_GROUP_MAX =
      PREFIX + "default-quota-group.max";

  /** Workload label naming the quota group the workload is charged to. */
  public static final String QUOTA_LABEL = PREFIX + "quota-label";
  public static final String DEFAULT_QUOTA_LABEL = "elasticquota/name";

  //check every ancestor below root as well as the workload's own group
  public static final String CHECK_PARENT_QUOTA_ENABLE =
      PREFIX + "admission.check-parent-quota.enable";
  public static final boolean DEFAULT_CHECK_PARENT_QUOTA_ENABLE = false;

  //when true an unknown quota name is an error instead of mapping to default
  public static final String STRICT_QUOTA_LOOKUP =
      PREFIX + "quota-lookup.strict";
  public static final boolean DEFAULT_STRICT_QUOTA_LOOKUP = false;

  /** Grace period a group may stay over its runtime before eviction. */
  public static final String REVOKE_DELAY_EVICT_TIME_MS =
      PREFIX + "revoke.delay-evict-time-ms";
  public static final long DEFAULT_REVOKE_DELAY_EVICT_TIME_MS = 120 * 1000L;

  public static final String REVOKE_INTERVAL_MS =
      PREFIX + "revoke.interval-ms";
  public static final long DEFAULT_REVOKE_INTERVAL_MS = 1000L;

  public static final String REVOKE_MAX_EVICTIONS_PER_TICK =
      PREFIX + "revoke.max-evictions-per-tick";
  public static final int DEFAULT_REVOKE_MAX_EVICTIONS_PER_TICK = 1;

  /** An eviction still running after this long is issued again. */
  public static final String REVOKE_EVICTION_RETRY_TIMEOUT_MS =
      PREFIX + "revoke.eviction-retry-timeout-ms";
  public static final long DEFAULT_REVOKE_EVICTION_RETRY_TIMEOUT_MS =
      60 * 1000L;

  //false: only groups whose spec enables revocation are monitored
  public static final String REVOKE_MONITOR_ALL_QUOTAS =
      PREFIX + "revoke.monitor-all-quotas";
  public static final boolean DEFAULT_REVOKE_MONITOR_ALL_QUOTAS = true;

  public static final String REVOKE_VICTIM_COMPARATOR_CLASS =
      PREFIX + "revoke.victim-comparator.class";

  public static final String MIGRATE_DEFAULT_INTERVAL_MS =
      PREFIX + "migrate-default.interval-ms";
  public static final long DEFAULT_MIGRATE_DEFAULT_INTERVAL_MS = 1000L;

  public static final String STATUS_SYNC_INTERVAL_MS =
      PREFIX + "status-sync.interval-ms";
  public static final long DEFAULT_STATUS_SYNC_INTERVAL_MS = 1000L;

  public ElasticQuotaConfiguration() {
    this(new Configuration());
  }

  public ElasticQuotaConfiguration(Configuration configuration) {
    this(configuration, true);
  }

  public ElasticQuotaConfiguration(Configuration configuration,
      boolean useLocalConfigurationProvider) {
    super(configuration);
    if (useLocalConfigurationProvider) {
      addResource(EQ_CONFIGURATION_FILE);
    }
  }

  /**
   * @return the configured vector, or null if the key is not set
   */
  public ResourceList getResourceList(String key) {
    String value = getTrimmed(key);
    if (value == null || value.isEmpty()) {
      return null;
    }
    return ResourceList.parse(value);
  }

  public void setResourceList(String key, ResourceList resources) {
    set(key, resources.toString());
  }

  public ResourceList getSystemQuotaGroupMax() {
    return getResourceList(SYSTEM_QUOTA_GROUP_MAX);
  }

  public ResourceList getDefaultQuotaGroupMax() {
    return getResourceList(DEFAULT_QUOTA_GROUP_MAX);
  }

  public String getQuotaLabel() {
    return getTrimmed(QUOTA_LABEL, DEFAULT_QUOTA_LABEL);
  }

  public boolean isCheckParentQuotaEnabled() {
    return getBoolean(CHECK_PARENT_QUOTA_ENABLE,
        DEFAULT_CHECK_PARENT_QUOTA_ENABLE);
  }

  public boolean isStrictQuotaLookup() {
    return getBoolean(STRICT_QUOTA_LOOKUP, DEFAULT_STRICT_QUOTA_LOOKUP);
  }

  public long getRevokeDelayEvictTimeMs() {
    return getLong(REVOKE_DELAY_EVICT_TIME_MS,
        DEFAULT_REVOKE_DELAY_EVICT_TIME_MS);
  }

  public long getRevokeIntervalMs() {
    return getLong(REVOKE_INTERVAL_MS, DEFAULT_REVOKE_INTERVAL_MS);
  }

  public int getRevokeMaxEvictionsPerTick() {
    return getInt(REVOKE_MAX_EVICTIONS_PER_TICK,
        DEFAULT_REVOKE_MAX_EVICTIONS_PER_TICK);
  }

  public long getRevokeEvictionRetryTimeoutMs() {
    return getLong(REVOKE_EVICTION_RETRY_TIMEOUT_MS,
        DEFAULT_REVOKE_EVICTION_RETRY_TIMEOUT_MS);
  }

  public boolean isRevokeMonitorAllQuotas() {
    return getBoolean(REVOKE_MONITOR_ALL_QUOTAS,
        DEFAULT_REVOKE_MONITOR_ALL_QUOTAS);
  }

  public <U> Class<? extends U> getRevokeVictimComparatorClass(
      Class<? extends U> defaultValue, Class<U> xface) {
    return getClass(REVOKE_VICTIM_COMPARATOR_CLASS, defaultValue, xface);
  }

  public long getMigrateDefaultIntervalMs() {
    return getLong(MIGRATE_DEFAULT_INTERVAL_MS,
        DEFAULT_MIGRATE_DEFAULT_INTERVAL_MS);
  }

  public long getStatusSyncIntervalMs() {
    return getLong(STATUS_SYNC_INTERVAL_MS, DEFAULT_STATUS_SYNC_INTERVAL_MS);
  }

  /**
   * Check the settings before any service is started.
   * @throws IllegalArgumentException describing the first bad value
   */
  public void validate() {
    if (getRevokeDelayEvictTimeMs() < 0) {
      throw new IllegalArgumentException("Illegal "
          + REVOKE_DELAY_EVICT_TIME_MS + " of " + getRevokeDelayEvictTimeMs());
    }
    checkPositive(REVOKE_INTERVAL_MS, getRevokeIntervalMs());
    checkPositive(REVOKE_MAX_EVICTIONS_PER_TICK,
        getRevokeMaxEvictionsPerTick());
    checkPositive(REVOKE_EVICTION_RETRY_TIMEOUT_MS,
        getRevokeEvictionRetryTimeoutMs());
    checkPositive(MIGRATE_DEFAULT_INTERVAL_MS, getMigrateDefaultIntervalMs());
    checkPositive(STATUS_SYNC_INTERVAL_MS, getStatusSyncIntervalMs());
    if (getQuotaLabel().isEmpty()) {
      throw new IllegalArgumentException(QUOTA_LABEL + " must not be empty");
    }
    // parse eagerly so a typo fails at startup
    ResourceList systemMax = getSystemQuotaGroupMax();
    ResourceList defaultMax = getDefaultQuotaGroupMax();
    if (LOG.isDebugEnabled()) {
      LOG.debug("EQConf - systemMax=" + systemMax + ", defaultMax="
          + defaultMax + ", delayEvictTimeMs=" + getRevokeDelayEvictTimeMs());
    }
  }

  private static void checkPositive(String key, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException("Illegal " + key + " of " + value
          + ", it must be positive");
    }
  }
}
