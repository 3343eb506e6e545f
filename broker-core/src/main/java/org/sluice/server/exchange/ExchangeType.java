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

import org.sluice.exchange.ExchangeDefaults;

public enum ExchangeType
{
    DIRECT(ExchangeDefaults.DIRECT_EXCHANGE_CLASS),
    FANOUT(ExchangeDefaults.FANOUT_EXCHANGE_CLASS),
    TOPIC(ExchangeDefaults.TOPIC_EXCHANGE_CLASS);

    private final String _typeName;

    ExchangeType(String typeName)
    {
        _typeName = typeName;
    }

    /**
     * @return the name clients use for the type when declaring an exchange
     */
    public String getTypeName()
    {
        return _typeName;
    }

    /**
     * @return the type with the given name, or null if there is no such type
     */
    public static ExchangeType forTypeName(String typeName)
    {
        for (ExchangeType type : values())
        {
            if (type._typeName.equals(typeName))
            {
                return type;
            }
        }
        return null;
    }
}
