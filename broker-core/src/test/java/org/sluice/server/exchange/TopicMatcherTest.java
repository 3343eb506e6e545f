/*
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 *
 */
package org.sluice.server.exchange;

import org.sluice.test.utils.SluiceTestCase;

public class TopicMatcherTest extends SluiceTestCase
{
    public void testLiteralPattern()
    {
        assertTrue(TopicMatcher.matches("a.b", "a.b"));
        assertFalse(TopicMatcher.matches("a.b", "a.c"));
        assertFalse(TopicMatcher.matches("a.b", "a.b.c"));
        assertFalse(TopicMatcher.matches("a.b.c", "a.b"));
    }

    public void testStarMatchesExactlyOneWord()
    {
        assertTrue(TopicMatcher.matches("kern.*", "kern.critical"));
        assertTrue(TopicMatcher.matches("*.critical", "kern.critical"));
        assertTrue(TopicMatcher.matches("a.*.c", "a.b.c"));
        assertFalse(TopicMatcher.matches("kern.*", "kern"));
        assertFalse(TopicMatcher.matches("kern.*", "kern.a.b"));
        assertFalse(TopicMatcher.matches("*.critical", "critical"));
        assertFalse(TopicMatcher.matches("*.critical", "a.b.critical"));
    }

    public void testTrailingHashMatchesAnyRemainder()
    {
        assertTrue(TopicMatcher.matches("#", "a"));
        assertTrue(TopicMatcher.matches("#", "a.b.c"));
        assertTrue(TopicMatcher.matches("#", ""));
        assertTrue(TopicMatcher.matches("a.#", "a"));
        assertTrue(TopicMatcher.matches("a.#", "a.b"));
        assertTrue(TopicMatcher.matches("a.#", "a.b.c.d"));
        assertFalse(TopicMatcher.matches("a.#", "b.a"));
    }

    public void testLeadingHashMatchesZeroOrMoreWords()
    {
        assertTrue(TopicMatcher.matches("#.b", "b"));
        assertTrue(TopicMatcher.matches("#.b", "a.b"));
        assertTrue(TopicMatcher.matches("#.b", "a.a.a.b"));
        assertFalse(TopicMatcher.matches("#.b", "a.b.c"));
    }

    public void testHashFollowedByMoreTokensBacktracks()
    {
        assertTrue(TopicMatcher.matches("a.#.b", "a.b"));
        assertTrue(TopicMatcher.matches("a.#.b", "a.x.b"));
        assertTrue(TopicMatcher.matches("a.#.b", "a.x.y.z.b"));
        assertTrue(TopicMatcher.matches("a.#.b", "a.b.b"));
        assertFalse(TopicMatcher.matches("a.#.b", "a.b.c"));

        assertTrue(TopicMatcher.matches("#.*.c", "a.b.c"));
        assertTrue(TopicMatcher.matches("#.*.c", "b.c"));
        assertFalse(TopicMatcher.matches("#.*.c", "c"));

        assertTrue(TopicMatcher.matches("a.#.*.#.d", "a.b.c.d"));
        assertTrue(TopicMatcher.matches("a.#.*.#.d", "a.x.d"));
        assertFalse(TopicMatcher.matches("a.#.*.#.d", "a.d"));
    }

    public void testStarAndHashNeedEnoughWords()
    {
        assertFalse(TopicMatcher.matches("a.*.#.b", "a.b"));
        assertTrue(TopicMatcher.matches("a.*.#.b", "a.x.b"));
        assertTrue(TopicMatcher.matches("a.*.#.b", "a.x.y.b"));
    }

    public void testEmptyWords()
    {
        assertTrue(TopicMatcher.matches("", ""));
        assertFalse(TopicMatcher.matches("a", ""));
        assertTrue(TopicMatcher.matches("a..b", "a..b"));
        assertTrue(TopicMatcher.matches("a.*.b", "a..b"));
        assertFalse(TopicMatcher.matches("a.b", "a..b"));
    }

    public void testNullRoutingKeyIsEmpty()
    {
        assertTrue(TopicMatcher.matches("#", null));
        assertFalse(TopicMatcher.matches("a", null));
    }
}
