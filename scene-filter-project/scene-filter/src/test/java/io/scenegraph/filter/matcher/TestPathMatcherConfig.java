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

import static io.scenegraph.filter.FilterResult.DESCENDANT_MATCH;
import static io.scenegraph.filter.FilterResult.MATCH;
import static io.scenegraph.filter.FilterResult.NO_MATCH;
import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_SEPARATOR_KEY;
import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_WILDCARD_KEY;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.apache.hadoop.conf.Configuration;
import org.junit.Test;

public class TestPathMatcherConfig {

  @Test
  public void testDefaults() {
    PathMatcher matcher = new PathMatcher(new Configuration(false));
    assertEquals("/", matcher.getSeparator());
    assertEquals('*', matcher.getWildcard());
  }

  @Test
  public void testDefaultResource() {
    // Loading the class registers the default resource
    new PathMatcher();
    Configuration conf = new Configuration();
    assertEquals("*", conf.get(PATH_MATCHER_WILDCARD_KEY));
    assertEquals("/", conf.get(PATH_MATCHER_SEPARATOR_KEY));
  }

  @Test
  public void testCustomWildcard() {
    Configuration conf = new Configuration(false);
    conf.set(PATH_MATCHER_WILDCARD_KEY, "%");
    PathMatcher matcher = new PathMatcher(conf);
    matcher.addPath("/a/%/c");
    matcher.addPath("/lights/key%");
    assertEquals(MATCH, matcher.match("/a/b/c"));
    assertEquals(MATCH, matcher.match("/lights/keyLight"));
    assertEquals(DESCENDANT_MATCH, matcher.match("/a/b"));

    // The default token is a literal character now
    matcher.addPath("/x/*");
    assertEquals(MATCH, matcher.match("/x/*"));
    assertEquals(NO_MATCH, matcher.match("/x/y"));
  }

  @Test
  public void testCustomSeparator() {
    Configuration conf = new Configuration(false);
    conf.set(PATH_MATCHER_SEPARATOR_KEY, ".");
    PathMatcher matcher = new PathMatcher(conf);
    matcher.addPath("world.*.shape");
    assertEquals(MATCH, matcher.match(".world.geo.shape"));
    assertEquals(DESCENDANT_MATCH, matcher.match("world"));
    assertEquals(NO_MATCH, matcher.match("/world/geo/shape"));
    assertEquals(Arrays.asList(".world.*.shape"), matcher.getPaths());
  }

  @Test
  public void testLastCharacterWildcard() {
    Configuration conf = new Configuration(false);
    conf.set(PATH_MATCHER_WILDCARD_KEY, String.valueOf(Character.MAX_VALUE));
    PathMatcher matcher = new PathMatcher(conf);
    matcher.addPath("/a" + Character.MAX_VALUE);
    matcher.addPath("/" + Character.MAX_VALUE + "/b");
    matcher.addPath("/x/y");
    assertEquals(MATCH, matcher.match("/abc"));
    assertEquals(MATCH, matcher.match("/a"));
    assertEquals(MATCH, matcher.match("/z/b"));
    assertEquals(DESCENDANT_MATCH, matcher.match("/x"));
    assertEquals(NO_MATCH, matcher.match("/z/c"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLongWildcard() {
    Configuration conf = new Configuration(false);
    conf.set(PATH_MATCHER_WILDCARD_KEY, "**");
    new PathMatcher(conf);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptySeparator() {
    Configuration conf = new Configuration(false);
    conf.set(PATH_MATCHER_SEPARATOR_KEY, " ");
    new PathMatcher(conf);
  }

  @Test
  public void testWildcardEqualsSeparator() {
    Configuration conf = new Configuration(false);
    conf.set(PATH_MATCHER_WILDCARD_KEY, "/");
    try {
      new PathMatcher(conf);
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("must differ"));
      return;
    }
    throw new AssertionError("Wildcard equal to the separator was accepted");
  }
}
