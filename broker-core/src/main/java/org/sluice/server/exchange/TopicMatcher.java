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

import java.util.regex.Pattern;

import org.sluice.exchange.ExchangeDefaults;

/**
 * Matches topic routing keys against binding patterns.
 * <p>
 * Keys and patterns are sequences of words separated by '.'. In a pattern, '*' matches exactly one word and
 * '#' matches zero or more words; any other word matches only itself.
 */
public final class TopicMatcher
{
    private static final Pattern SEPARATOR =
            Pattern.compile(Pattern.quote(String.valueOf(ExchangeDefaults.TOPIC_SEPARATOR)));

    private TopicMatcher()
    {
    }

    public static boolean matches(String pattern, String routingKey)
    {
        return matches(split(pattern), 0, split(routingKey), 0);
    }

    static String[] split(String key)
    {
        // keep empty words: "a..b" has three words and "" has one
        return SEPARATOR.split(key == null ? "" : key, -1);
    }

    private static boolean matches(String[] pattern, int patternIndex, String[] key, int keyIndex)
    {
        if (patternIndex == pattern.length)
        {
            return keyIndex == key.length;
        }

        String token = pattern[patternIndex];
        if (ExchangeDefaults.TOPIC_HASH_TOKEN.equals(token))
        {
            if (patternIndex == pattern.length - 1)
            {
                return true;
            }
            // '#' swallows key[keyIndex..start); the rest of the pattern must match the tail from start, so try
            // the shortest tail first and the whole remaining key last
            for (int start = key.length; start >= keyIndex; start--)
            {
                if (matches(pattern, patternIndex + 1, key, start))
                {
                    return true;
                }
            }
            return false;
        }

        if (keyIndex == key.length)
        {
            return false;
        }

        if (ExchangeDefaults.TOPIC_STAR_TOKEN.equals(token) || token.equals(key[keyIndex]))
        {
            return matches(pattern, patternIndex + 1, key, keyIndex + 1);
        }
        return false;
    }
}
