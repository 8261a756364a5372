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

import java.util.Comparator;

/**
 * Orders eviction candidates: lowest priority first, and among equal
 * priorities the most recently created first.
 */
public class PriorityVictimComparator implements Comparator<Workload> {

  @Override
  public int compare(Workload w1, Workload w2) {
    int result = Integer.compare(w1.getPriority(), w2.getPriority());
    if (result != 0) {
      return result;
    }
    result = Long.compare(w2.getCreationTime(), w1.getCreationTime());
    if (result != 0) {
      return result;
    }
    return w1.getUid().compareTo(w2.getUid());
  }
}
