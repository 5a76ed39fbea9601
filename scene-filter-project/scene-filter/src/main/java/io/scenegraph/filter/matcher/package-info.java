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

/**
 * Index of hierarchical path patterns used to filter scene locations while
 * traversing a scene graph. Each pattern is stored in a tree, one node for
 * each path segment. Segments may contain a wildcard matching any run of
 * characters inside that segment.
 * <p>
 * A new matcher can be instantiated, updated and queried using the
 * {@link io.scenegraph.filter.matcher.PathMatcher}.
 * <p>
 * Common APIs available:
 * <ul>
 * <li>public boolean addPath(String path) -> Adds a pattern to the tree
 * <li>public boolean removePath(String path) -> Removes a pattern from the
 * tree and prunes the branches left without patterns
 * <li>public FilterResult match(String path) -> Tells if the path matches a
 * pattern, is an ancestor of a match or neither
 * <li>public List&lt;String&gt; getPaths() -> Get all the patterns in the tree
 * </ul>
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
package io.scenegraph.filter.matcher;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;
