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
package io.scenegraph.filter.matcher;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class TestSegmentComparator {

  private final SegmentComparator comparator = new SegmentComparator('*');

  @Test
  public void testLiteralOrder() {
    assertTrue(comparator.compare("a", "b") < 0);
    assertTrue(comparator.compare("b", "a") > 0);
    assertTrue(comparator.compare("ab", "abc") < 0);
    assertTrue(comparator.compare("abc", "ab") > 0);
    assertEquals(0, comparator.compare("abc", "abc"));
    assertTrue(comparator.compare("", "a") < 0);

    List<String> labels = new ArrayList<String>(
        Arrays.asList("foo", "bar", "ba", "z", "foobar"));
    List<String> natural = new ArrayList<String>(labels);
    Collections.sort(labels, comparator);
    Collections.sort(natural);
    assertEquals(natural, labels);
  }

  @Test
  public void testWildcardEquivalence() {
    assertEquals(0, comparator.compare("a*", "aa"));
    assertEquals(0, comparator.compare("a*", "ab"));
    assertEquals(0, comparator.compare("ab", "a*"));
    assertEquals(0, comparator.compare("*", "anything"));
    assertEquals(0, comparator.compare("ab*", "ab"));
    // Not transitive: both are equivalent to "a*" but not to each other
    assertTrue(comparator.compare("aa", "ab") < 0);
    // Divergence before the wildcard still orders
    assertTrue(comparator.compare("b*", "a") > 0);
    assertTrue(comparator.compare("a", "b*") < 0);
  }

  @Test
  public void testCandidates() {
    assertEquals(0, comparator.compare("x*y", "xzzy"));
    assertEquals(0, comparator.compare("foo", "foo"));
    assertTrue(comparator.compare("foo", "bar") != 0);
    // Equivalent labels still need the wildcard matcher to confirm
    assertEquals(0, comparator.compare("x*y", "xz"));
    assertFalse(WildcardMatch.matches("xz", "x*y"));
  }

  @Test
  public void testCustomWildcard() {
    SegmentComparator percent = new SegmentComparator('%');
    assertEquals('%', percent.getWildcard());
    assertEquals(0, percent.compare("a%", "ab"));
    assertTrue(percent.compare("a*", "ab") < 0);
  }
}
