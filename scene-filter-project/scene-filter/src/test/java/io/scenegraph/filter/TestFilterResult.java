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
package io.scenegraph.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestFilterResult {

  @Test
  public void testMax() {
    assertEquals(FilterResult.MATCH,
        FilterResult.max(FilterResult.MATCH, FilterResult.DESCENDANT_MATCH));
    assertEquals(FilterResult.MATCH,
        FilterResult.max(FilterResult.NO_MATCH, FilterResult.MATCH));
    assertEquals(FilterResult.DESCENDANT_MATCH,
        FilterResult.max(FilterResult.DESCENDANT_MATCH, FilterResult.NO_MATCH));
    assertEquals(FilterResult.NO_MATCH,
        FilterResult.max(FilterResult.NO_MATCH, FilterResult.NO_MATCH));
  }

  @Test
  public void testDescendable() {
    assertFalse(FilterResult.NO_MATCH.isDescendable());
    assertTrue(FilterResult.DESCENDANT_MATCH.isDescendable());
    assertTrue(FilterResult.MATCH.isDescendable());
  }
}
