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

import java.util.Comparator;

/**
 * Relaxed ordering of segment labels used to find the children that may match
 * a query segment. Two labels are compared character by character; at the
 * first difference, if either label holds the wildcard the pair is considered
 * equivalent, otherwise the differing characters decide. When one label is a
 * prefix of the other the shorter one goes first.
 * <p>
 * The relation is not transitive once wildcards are involved ("a*" is
 * equivalent to both "aa" and "ab", which are not equivalent to each other).
 * It must only be used to decide which labels fall in the equal range of a
 * query, and to order labels that hold no wildcard, where it is the natural
 * string order. Never use it to sort a mix of literal and wildcard labels.
 */
public final class SegmentComparator implements Comparator<String> {

  private final char wildcard;

  public SegmentComparator(char wildcard) {
    this.wildcard = wildcard;
  }

  public char getWildcard() {
    return this.wildcard;
  }

  @Override
  public int compare(String s1, String s2) {
    int len1 = s1.length();
    int len2 = s2.length();
    int i = 0;
    while (i < len1 && i < len2 && s1.charAt(i) == s2.charAt(i)) {
      i++;
    }

    if ((i < len1 && s1.charAt(i) == wildcard)
        || (i < len2 && s2.charAt(i) == wildcard)) {
      return 0;
    }
    if (i == len1 || i == len2) {
      return len1 - len2;
    }
    return s1.charAt(i) - s2.charAt(i);
  }
}
