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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Cleans up the matcher tree by detaching nodes that no longer lead to a
 * pattern. Used to walk upwards from a removed pattern and collect the
 * dangling nodes.
 */
public class PathMatcherRemoveNodeCleanup implements PathMatcherTraverse {

  /** Tracks the nodes in the tree that need to be detached. */
  private final List<PathMatcherNode> nodesToDelete =
      new ArrayList<PathMatcherNode>();
  private boolean foundValidNode = false;

  public PathMatcherRemoveNodeCleanup(PathMatcherNode node) {
    nodesToDelete.add(node);
  }

  @Override
  public void traverse(PathMatcherNode node) {
    if (foundValidNode) {
      return;
    }
    if (node.getParent() == null || node.isTerminator()
        || node.getNumOfChildren() > 1) {
      // Root, another pattern or a branch towards one, stop
      foundValidNode = true;
      return;
    }
    nodesToDelete.add(node);
  }

  public Collection<PathMatcherNode> getTraversedNodes() {
    return nodesToDelete;
  }
}
