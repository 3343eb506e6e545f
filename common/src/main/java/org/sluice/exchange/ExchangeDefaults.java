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
package org.sluice.exchange;

public class ExchangeDefaults
{
    public final static String DIRECT_EXCHANGE_CLASS = "direct";

    public final static String FANOUT_EXCHANGE_CLASS = "fanout";

    public final static String TOPIC_EXCHANGE_CLASS = "topic";

    /** Separates the words of a topic routing key or binding pattern. */
    public final static char TOPIC_SEPARATOR = '.';

    /** Matches exactly one word of a topic routing key. */
    public final static String TOPIC_STAR_TOKEN = "*";

    /** Matches zero or more words of a topic routing key. */
    public final static String TOPIC_HASH_TOKEN = "#";

    public final static String DEFAULT_VIRTUAL_HOST = "/";

    private ExchangeDefaults()
    {
    }
}
