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

import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_DEFAULT_RESOURCE;
import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_SEPARATOR_DEFAULT;
import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_SEPARATOR_KEY;
import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_WILDCARD_DEFAULT;
import static io.scenegraph.filter.matcher.PathMatcherConfigKeys.PATH_MATCHER_WILDCARD_KEY;

import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import io.scenegraph.filter.FilterResult;

/**
 * Index of path patterns used to filter scene locations. Patterns are
 * separator delimited paths whose segments may contain a wildcard matching
 * any run of characters, for example {@code /world/*Light/shape}. A query
 * path either matches a pattern, is an ancestor of one, or neither; see
 * {@link FilterResult}.
 * <p>
 * Queries run under a shared lock so any number of them can proceed in
 * parallel. Updates take an exclusive lock.
 */
public class PathMatcher {

  private static final Log LOG = LogFactory.getLog(PathMatcher.class);

  static {
    Configuration.addDefaultResource(PATH_MATCHER_DEFAULT_RESOURCE);
  }

  /** Root of the tree. */
  private PathMatcherNode root;

  /** Separator in the path. */
  private final String separator;
  private final Splitter splitter;
  /** Orders the children of each node. */
  private final SegmentComparator comparator;

  /** Synchronization. */
  private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
  private final Lock readLock = readWriteLock.readLock();
  private final Lock writeLock = readWriteLock.writeLock();

  /**
   * Create an empty matcher with the default wildcard and separator.
   */
  public PathMatcher() {
    this(PATH_MATCHER_SEPARATOR_DEFAULT,
        PATH_MATCHER_WILDCARD_DEFAULT.charAt(0));
  }

  /**
   * Create an empty matcher configured from the given configuration.
   * @param conf Configuration with the separator and wildcard.
   */
  public PathMatcher(Configuration conf) {
    this(conf.getTrimmed(PATH_MATCHER_SEPARATOR_KEY,
            PATH_MATCHER_SEPARATOR_DEFAULT),
        singleChar(conf.getTrimmed(PATH_MATCHER_WILDCARD_KEY,
            PATH_MATCHER_WILDCARD_DEFAULT), PATH_MATCHER_WILDCARD_KEY));
  }

  /**
   * Create a matcher holding an initial set of patterns.
   * @param paths Patterns to add.
   */
  public PathMatcher(Collection<String> paths) {
    this();
    addPaths(paths);
  }

  private PathMatcher(String separator, char wildcard) {
    singleChar(separator, PATH_MATCHER_SEPARATOR_KEY);
    Preconditions.checkArgument(separator.charAt(0) != wildcard,
        "Wildcard and separator must differ: %s", separator);
    this.separator = separator;
    this.splitter = Splitter.on(separator).omitEmptyStrings();
    this.comparator = new SegmentComparator(wildcard);
    this.root = new PathMatcherNode("", comparator);
  }

  private static char singleChar(String value, String key) {
    Preconditions.checkArgument(value != null && value.length() == 1,
        "%s must be a single character: %s", key, value);
    return value.charAt(0);
  }

  public String getSeparator() {
    return this.separator;
  }

  public char getWildcard() {
    return this.comparator.getWildcard();
  }

  /**
   * Remove all the patterns.
   */
  public void clear() {
    writeLock.lock();
    try {
      LOG.info("Clearing all path patterns.");
      this.root = new PathMatcherNode("", comparator);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Add a pattern. Adding a pattern already present has no effect.
   * @param path Pattern to add.
   * @return True if the pattern was not present yet.
   */
  public boolean addPath(String path) {
    Preconditions.checkNotNull(path, "Null path");
    String[] pathSplit = PathMatcherUtils.pathSplit(splitter, path);
    writeLock.lock();
    try {
      boolean added = this.root.add(pathSplit, 0);
      if (LOG.isDebugEnabled()) {
        LOG.debug((added ? "Added" : "Already present") + " pattern " + path);
      }
      return added;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Add a set of patterns.
   * @param paths Patterns to add.
   * @return Number of patterns that were not present yet.
   */
  public int addPaths(Collection<String> paths) {
    int added = 0;
    for (String path : paths) {
      if (addPath(path)) {
        added++;
      }
    }
    return added;
  }

  /**
   * Remove a pattern. Nodes that no longer lead to a pattern are detached
   * from the tree.
   *
   * @param path Pattern exactly as added.
   * @return True if the pattern was present and has been removed.
   */
  public boolean removePath(String path) {
    Preconditions.checkNotNull(path, "Null path");
    String[] pathSplit = PathMatcherUtils.pathSplit(splitter, path);
    writeLock.lock();
    try {
      PathMatcherNode locatedNode = this.root.find(pathSplit, 0);
      if (locatedNode == null || !locatedNode.isTerminator()) {
        LOG.warn("Attempt to remove a non present pattern: " + path);
        return false;
      }
      locatedNode.setTerminator(false);

      // Other patterns below keep this node alive. Otherwise detach it and
      // every ancestor up to the next pattern or branch.
      if (!locatedNode.hasChildren() && locatedNode.getParent() != null) {
        PathMatcherRemoveNodeCleanup traverse =
            new PathMatcherRemoveNodeCleanup(locatedNode);
        locatedNode.getParent().traverseUp(traverse);
        for (PathMatcherNode deleteNode : traverse.getTraversedNodes()) {
          deleteNode.getParent().removeChild(deleteNode);
        }
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Removed pattern " + path);
      }
      return true;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Match a path against the patterns.
   * @param path Literal path to match.
   * @return {@link FilterResult#MATCH} if a pattern matches the path,
   *         {@link FilterResult#DESCENDANT_MATCH} if a pattern matches a
   *         descendant of the path and {@link FilterResult#NO_MATCH}
   *         otherwise.
   */
  public FilterResult match(String path) {
    Preconditions.checkNotNull(path, "Null path");
    String[] pathSplit = PathMatcherUtils.pathSplit(splitter, path);
    readLock.lock();
    try {
      FilterResult result = this.root.matchDown(pathSplit, 0);
      if (LOG.isTraceEnabled()) {
        LOG.trace("Matched " + path + ": " + result);
      }
      return result;
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Check if there are no patterns.
   * @return If the matcher holds no pattern.
   */
  public boolean isEmpty() {
    readLock.lock();
    try {
      return !this.root.isTerminator() && !this.root.hasChildren();
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Get the size of this tree.
   * @return Number of nodes including the root.
   */
  public int size() {
    readLock.lock();
    try {
      return this.root.size();
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Get the number of patterns.
   * @return Number of patterns in the matcher.
   */
  public int getNumOfPaths() {
    readLock.lock();
    try {
      return this.root.getNumOfTerminators();
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Returns all the patterns, depth first.
   * @return List with every pattern.
   */
  public List<String> getPaths() {
    readLock.lock();
    try {
      final List<String> ret = new LinkedList<String>();
      this.root.traverseAll(new PathMatcherTraverse() {
        @Override
        public void traverse(PathMatcherNode node) {
          if (node.isTerminator()) {
            ret.add(node.getPath(separator));
          }
        }
      });
      return ret;
    } finally {
      readLock.unlock();
    }
  }

  @Override
  public String toString() {
    readLock.lock();
    try {
      return this.root.toString();
    } finally {
      readLock.unlock();
    }
  }
}
