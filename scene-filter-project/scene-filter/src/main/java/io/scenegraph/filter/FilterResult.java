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

/**
 * Outcome of matching a scene location against a filter. Values are declared
 * in increasing priority, so {@link #max(FilterResult, FilterResult)} keeps
 * the strongest of two results.
 */
public enum FilterResult {

  /** The location is neither a match nor above one. */
  NO_MATCH,
  /** The location is a strict ancestor of a match. */
  DESCENDANT_MATCH,
  /** The location matches exactly. */
  MATCH;

  /**
   * Get the higher priority of two results.
   * @param a First result.
   * @param b Second result.
   * @return The result with the higher priority.
   */
  public static FilterResult max(FilterResult a, FilterResult b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  /**
   * Check if traversal should continue below a location with this result.
   * @return If children may still match.
   */
  public boolean isDescendable() {
    return this != NO_MATCH;
  }
}
