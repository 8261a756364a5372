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

package org.apache.elasticquota.resource;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class TestResources {

  @Test
  public void testParseAndToString() {
    ResourceList r = ResourceList.parse(" memory=2048, cpu=4000 ,gpu=0");
    assertEquals(4000L, r.get("cpu"));
    assertEquals(2048L, r.get("memory"));
    assertEquals(0L, r.get("gpu"));
    assertFalse(r.getResourceNames().contains("gpu"));
    assertEquals("cpu=4000,memory=2048", r.toString());
    assertEquals(r, ResourceList.parse(r.toString()));
    assertTrue(ResourceList.parse("  ").isEmpty());
    assertTrue(ResourceList.parse(null).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeQuantityRejected() {
    ResourceList.parse("cpu=-1");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedEntryRejected() {
    ResourceList.parse("cpu");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedQuantityRejected() {
    ResourceList.parse("cpu=four");
  }

  @Test
  public void testAbsentEntriesAreZero() {
    Map<String, Long> map = new HashMap<String, Long>();
    map.put("cpu", 10L);
    map.put("memory", 0L);
    assertEquals(ResourceList.of("cpu", 10), ResourceList.newInstance(map));
    assertEquals(ResourceList.NONE,
        ResourceList.newInstance(Collections.singletonMap("cpu", 0L)));
  }

  @Test
  public void testArithmetic() {
    ResourceList a = ResourceList.of("cpu", 10, "memory", 5);
    ResourceList b = ResourceList.of("cpu", 4, "gpu", 1);

    assertEquals(ResourceList.parse("cpu=14,gpu=1,memory=5"),
        Resources.add(a, b));
    assertEquals(ResourceList.of("cpu", 6, "memory", 5),
        Resources.subtractNonNegative(a, b));
    assertEquals(ResourceList.NONE, Resources.subtractNonNegative(b, b));
    assertEquals(ResourceList.of("gpu", 1),
        Resources.subtractNonNegative(b, a));
    assertEquals(ResourceList.of("cpu", 4), Resources.componentwiseMin(a, b));
    assertEquals(ResourceList.parse("cpu=10,gpu=1,memory=5"),
        Resources.componentwiseMax(a, b));
    assertEquals(ResourceList.of("cpu", 10),
        Resources.mask(a, Arrays.asList("cpu", "gpu")));
  }

  @Test
  public void testComparison() {
    ResourceList used = ResourceList.of("cpu", 50, "memory", 80);
    ResourceList runtime = ResourceList.of("cpu", 50, "memory", 60);

    assertFalse(Resources.fitsIn(used, runtime));
    assertEquals(Arrays.asList("memory"),
        Resources.exceededDimensions(used, runtime));
    assertTrue(Resources.exceededDimensions(used, runtime,
        Arrays.asList("cpu")).isEmpty());
    assertTrue(Resources.fitsIn(ResourceList.NONE, runtime));
    assertFalse(Resources.fitsIn(ResourceList.of("gpu", 1), runtime));
    assertTrue(Resources.intersects(used, Arrays.asList("gpu", "memory")));
    assertFalse(Resources.intersects(used, Arrays.asList("gpu")));
  }
}
