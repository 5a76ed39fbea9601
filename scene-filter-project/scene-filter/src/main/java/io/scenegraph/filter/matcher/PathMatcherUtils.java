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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

/**
 * Utilities for managing {@link PathMatcher}.
 */
public final class PathMatcherUtils {

  private PathMatcherUtils() {
    // Utility class
  }

  /**
   * Split a path into its segments. Empty segments, from leading, trailing or
   * repeated separators, are dropped.
   *
   * @param splitter Splitter on the path separator, omitting empty strings.
   * @param path Input path.
   * @return Segments of the path.
   */
  public static String[] pathSplit(Splitter splitter, String path) {
    List<String> segments = splitter.splitToList(path);
    return segments.toArray(new String[segments.size()]);
  }

  /**
   * Add every pattern of a matcher into another matcher.
   * @param base Matcher receiving the patterns.
   * @param other Matcher providing the patterns.
   * @return Number of patterns that were not already in the base.
   */
  public static int addAll(PathMatcher base, PathMatcher other) {
    Preconditions.checkArgument(
        base.getSeparator().equals(other.getSeparator())
            && base.getWildcard() == other.getWildcard(),
        "Matchers use different separators or wildcards");
    int added = 0;
    for (String path : other.getPaths()) {
      if (base.addPath(path)) {
        added++;
      }
    }
    return added;
  }
}
