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

/**
 * Wildcard matching for a single path segment. The only metacharacter is the
 * wildcard token, which matches zero or more arbitrary characters. There is
 * no escaping, no character class and no single character wildcard.
 */
public final class WildcardMatch {

  /** Default wildcard token. */
  public static final char DEFAULT_WILDCARD = '*';

  private WildcardMatch() {
    // Utility class
  }

  /**
   * Check if a segment matches a pattern using the default wildcard.
   * @param candidate Literal segment being tested.
   * @param pattern Pattern segment which may contain wildcards.
   * @return If the candidate matches the pattern.
   */
  static boolean matches(String candidate, String pattern) {
    return matches(candidate, pattern, DEFAULT_WILDCARD);
  }

  /**
   * Check if a segment matches a pattern.
   * @param candidate Literal segment being tested.
   * @param pattern Pattern segment which may contain wildcards.
   * @param wildcard Character used as the wildcard token.
   * @return If the candidate matches the pattern.
   */
  public static boolean matches(
      String candidate, String pattern, char wildcard) {
    return matches(candidate, 0, pattern, 0, wildcard);
  }

  private static boolean matches(String s, int sPos,
      String pattern, int pPos, char wildcard) {
    while (pPos < pattern.length()) {
      char c = pattern.charAt(pPos++);
      if (c == wildcard) {
        if (pPos == pattern.length()) {
          // Trailing wildcard takes whatever is left
          return true;
        }
        for (int i = sPos; i <= s.length(); i++) {
          if (matches(s, i, pattern, pPos, wildcard)) {
            return true;
          }
        }
        return false;
      }
      if (sPos == s.length() || s.charAt(sPos++) != c) {
        return false;
      }
    }
    return sPos == s.length();
  }

  /**
   * Check if a label contains the wildcard token.
   * @param label Segment label.
   * @param wildcard Character used as the wildcard token.
   * @return If the label has at least one wildcard.
   */
  public static boolean hasWildcard(String label, char wildcard) {
    return label.indexOf(wildcard) >= 0;
  }

  /**
   * Get the literal text that precedes the first wildcard of a label.
   * @param label Segment label.
   * @param wildcard Character used as the wildcard token.
   * @return Text before the first wildcard, or the full label if it has none.
   */
  public static String literalPrefix(String label, char wildcard) {
    int idx = label.indexOf(wildcard);
    return idx < 0 ? label : label.substring(0, idx);
  }
}
