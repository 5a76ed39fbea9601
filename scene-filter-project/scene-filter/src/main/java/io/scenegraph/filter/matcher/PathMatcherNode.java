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

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

import io.scenegraph.filter.FilterResult;

/**
 * Node of the path matcher tree. Each node is reached from its parent through
 * one segment label, which may contain wildcards. Children are exclusively
 * owned by their parent.
 * <p>
 * Literal labels and wildcard labels are kept in separate indexes. Literal
 * children are ordered with the {@link SegmentComparator}, which is a total
 * order as long as no wildcard is involved. Wildcard children are ordered
 * naturally and grouped by the literal text before their first wildcard, so
 * the children that may match a segment are found with one lookup per prefix
 * of the segment.
 */
public class PathMatcherNode {
  /** Label of the edge from the parent. */
  private final String name;
  /** If a pattern ends at this node. */
  private boolean terminator;

  private PathMatcherNode parent;

  private final SegmentComparator comparator;

  /** Children without wildcards. */
  private final Map<String, PathMatcherNode> literalChildren;
  /** Children with at least one wildcard. */
  private final TreeMap<String, PathMatcherNode> wildcardChildren;
  /** Longest literal prefix among the wildcard children ever added. */
  private int maxWildcardPrefix = 0;

  public PathMatcherNode(String name, SegmentComparator comparator) {
    this.name = name;
    this.comparator = comparator;
    this.literalChildren = new TreeMap<String, PathMatcherNode>(comparator);
    this.wildcardChildren = new TreeMap<String, PathMatcherNode>();
  }

  public String getName() {
    return this.name;
  }

  public PathMatcherNode getParent() {
    return this.parent;
  }

  public void setParent(PathMatcherNode newParent) {
    this.parent = newParent;
  }

  public boolean isTerminator() {
    return this.terminator;
  }

  public void setTerminator(boolean isTerminator) {
    this.terminator = isTerminator;
  }

  public boolean hasChildren() {
    return !this.literalChildren.isEmpty() || !this.wildcardChildren.isEmpty();
  }

  public int getNumOfChildren() {
    return this.literalChildren.size() + this.wildcardChildren.size();
  }

  private boolean isWildcard(String label) {
    return WildcardMatch.hasWildcard(label, comparator.getWildcard());
  }

  /**
   * Get the child with exactly this label. Wildcards are not expanded.
   * @param label Label of the child.
   * @return The child or null if there is none.
   */
  public PathMatcherNode getChild(String label) {
    if (isWildcard(label)) {
      return this.wildcardChildren.get(label);
    }
    return this.literalChildren.get(label);
  }

  /**
   * Get the children in natural order of their labels.
   * @return Snapshot of the children.
   */
  public Collection<PathMatcherNode> getChildren() {
    TreeMap<String, PathMatcherNode> all =
        new TreeMap<String, PathMatcherNode>();
    all.putAll(this.literalChildren);
    all.putAll(this.wildcardChildren);
    return all.values();
  }

  /**
   * Add the nodes for a pattern below this node.
   * @param path Pattern segments.
   * @param index First segment to add.
   * @return True if the pattern was not stored before.
   */
  public boolean add(String[] path, int index) {
    if (index == path.length) {
      boolean added = !this.terminator;
      this.terminator = true;
      return added;
    }
    String curName = path[index];
    PathMatcherNode child = getChild(curName);
    if (child == null) {
      child = new PathMatcherNode(curName, comparator);
      child.parent = this;
      if (isWildcard(curName)) {
        this.wildcardChildren.put(curName, child);
        int prefix =
            WildcardMatch.literalPrefix(curName, comparator.getWildcard())
                .length();
        this.maxWildcardPrefix = Math.max(this.maxWildcardPrefix, prefix);
      } else {
        this.literalChildren.put(curName, child);
      }
    }
    return child.add(path, index + 1);
  }

  /**
   * Detach a child from this node.
   * @param child Child to detach.
   */
  public void removeChild(PathMatcherNode child) {
    if (isWildcard(child.getName())) {
      this.wildcardChildren.remove(child.getName());
    } else {
      this.literalChildren.remove(child.getName());
    }
    child.setParent(null);
  }

  /**
   * Locate the node whose labels equal the path, without wildcard expansion.
   * @param path Pattern segments.
   * @param index First segment to look for.
   * @return The node or null if not found.
   */
  public PathMatcherNode find(String[] path, int index) {
    if (index == path.length) {
      return this;
    }
    PathMatcherNode child = getChild(path[index]);
    if (child == null) {
      return null;
    }
    return child.find(path, index + 1);
  }

  /**
   * Match the rest of a query below this node. Each child that may match the
   * next segment is confirmed with the wildcard matcher and explored; the
   * strongest result among all of them is kept.
   *
   * @param path Query segments.
   * @param index Next segment to match.
   * @return Result for the remaining segments.
   */
  public FilterResult matchDown(String[] path, int index) {
    if (index == path.length) {
      if (this.terminator) {
        return FilterResult.MATCH;
      }
      return hasChildren() ? FilterResult.DESCENDANT_MATCH
          : FilterResult.NO_MATCH;
    }

    String segment = path[index];
    FilterResult best = FilterResult.NO_MATCH;

    // Exact literal child
    PathMatcherNode literal = this.literalChildren.get(segment);
    if (literal != null && literal.getName().equals(segment)) {
      best = literal.matchDown(path, index + 1);
      if (best == FilterResult.MATCH) {
        return best;
      }
    }

    // Wildcard children whose literal prefix starts the segment
    if (!this.wildcardChildren.isEmpty()) {
      char wildcard = comparator.getWildcard();
      int maxPrefix = Math.min(segment.length(), this.maxWildcardPrefix);
      for (int i = 0; i <= maxPrefix; i++) {
        String start = segment.substring(0, i) + wildcard;
        for (PathMatcherNode child
            : this.wildcardChildren.tailMap(start, true).values()) {
          if (!child.getName().startsWith(start)) {
            // Past the labels with this literal prefix
            break;
          }
          if (!WildcardMatch.matches(segment, child.getName(), wildcard)) {
            continue;
          }
          best = FilterResult.max(best, child.matchDown(path, index + 1));
          if (best == FilterResult.MATCH) {
            return best;
          }
        }
      }
    }
    return best;
  }

  /**
   * Depth first search of all nodes below this node.
   *
   * @param traverse Callback for each node found.
   */
  public void traverseAll(PathMatcherTraverse traverse) {
    traverse.traverse(this);
    for (PathMatcherNode child : getChildren()) {
      child.traverseAll(traverse);
    }
  }

  /**
   * Traverse upwards.
   *
   * @param traverse Callback for each node found.
   */
  public void traverseUp(PathMatcherTraverse traverse) {
    traverse.traverse(this);
    if (this.parent != null) {
      this.parent.traverseUp(traverse);
    }
  }

  /**
   * Get the pattern ending at this node.
   * @param separator Separator between segments.
   * @return Full path of the node.
   */
  public String getPath(String separator) {
    if (this.parent == null) {
      return separator;
    }
    String aux = this.parent.getPath(separator);
    if (aux.endsWith(separator)) {
      return aux + this.name;
    }
    return aux + separator + this.name;
  }

  @Override
  public String toString() {
    return this.toString(0);
  }

  public String toString(int level) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < level; i++) {
      sb.append(" ");
    }
    sb.append(this.name);
    if (this.terminator) {
      sb.append(" (terminator)");
    }
    for (PathMatcherNode child : getChildren()) {
      sb.append("\n");
      sb.append(child.toString(level + 2));
    }
    return sb.toString();
  }

  /**
   * Return the number of nodes under this node.
   * @return Number of nodes under this node, including itself.
   */
  public int size() {
    int ret = 1;
    for (PathMatcherNode child : this.literalChildren.values()) {
      ret += child.size();
    }
    for (PathMatcherNode child : this.wildcardChildren.values()) {
      ret += child.size();
    }
    return ret;
  }

  /**
   * Return the number of patterns ending at or under this node.
   * @return Number of terminators under this node.
   */
  public int getNumOfTerminators() {
    int ret = this.terminator ? 1 : 0;
    for (PathMatcherNode child : this.literalChildren.values()) {
      ret += child.getNumOfTerminators();
    }
    for (PathMatcherNode child : this.wildcardChildren.values()) {
      ret += child.getNumOfTerminators();
    }
    return ret;
  }
}
