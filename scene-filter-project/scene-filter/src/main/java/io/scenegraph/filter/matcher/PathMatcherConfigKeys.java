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

import org.apache.hadoop.classification.InterfaceAudience;

/**
 * Configuration keys for the path matcher, with their defaults.
 */
@InterfaceAudience.Public
public final class PathMatcherConfigKeys {

  private PathMatcherConfigKeys() {
    // Constants
  }

  /** Resource with the documented defaults. */
  public static final String PATH_MATCHER_DEFAULT_RESOURCE =
      "path-matcher-default.xml";

  public static final String PATH_MATCHER_PREFIX =
      "scene.filter.path-matcher.";

  /** Character matching any run of characters inside a segment. */
  public static final String PATH_MATCHER_WILDCARD_KEY =
      PATH_MATCHER_PREFIX + "wildcard";
  public static final String PATH_MATCHER_WILDCARD_DEFAULT =
      String.valueOf(WildcardMatch.DEFAULT_WILDCARD);

  /** Separator between the segments of a path. */
  public static final String PATH_MATCHER_SEPARATOR_KEY =
      PATH_MATCHER_PREFIX + "separator";
  public static final String PATH_MATCHER_SEPARATOR_DEFAULT = "/";
}
