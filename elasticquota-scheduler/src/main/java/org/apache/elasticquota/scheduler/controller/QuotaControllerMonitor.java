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

import java.util.Timer;
import java.util.TimerTask;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.service.AbstractService;

import com.google.common.annotations.VisibleForTesting;

/**
 * Runs an {@link ElasticQuotaController} on a daemon timer.
 */
public class QuotaControllerMonitor extends AbstractService {

  private static final Log LOG =
      LogFactory.getLog(QuotaControllerMonitor.class);

  private final ElasticQuotaController controller;
  private Timer timer;

  public QuotaControllerMonitor(ElasticQuotaController controller) {
    super("QuotaControllerMonitor (" + controller.getControllerName() + ")");
    this.controller = controller;
  }

  private class ReconcileTask extends TimerTask {
    @Override
    public void run() {
      try {
        invokeController();
      } catch (RuntimeException e) {
        // keep the timer alive, the next tick starts from fresh state
        LOG.error("Controller " + controller.getControllerName()
            + " failed", e);
      }
    }
  }

  @Override
  protected void serviceStart() throws Exception {
    timer = new Timer(controller.getControllerName() + "-Timer", true);
    timer.scheduleAtFixedRate(new ReconcileTask(), 0,
        controller.getMonitoringInterval());
    LOG.info("Started " + controller.getControllerName() + " every "
        + controller.getMonitoringInterval() + " ms");
    super.serviceStart();
  }

  @Override
  protected void serviceStop() throws Exception {
    if (timer != null) {
      timer.cancel();
    }
    super.serviceStop();
  }

  @VisibleForTesting
  void invokeController() {
    controller.reconcile();
  }

  public ElasticQuotaController getController() {
    return controller;
  }
}
