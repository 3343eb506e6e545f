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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.codehaus.jackson.annotate.JsonCreator;
import org.codehaus.jackson.annotate.JsonProperty;

import org.sluice.server.model.ExchangeName;

/**
 * An exchange as declared by a client. Exchanges are never modified once declared.
 */
public final class Exchange
{
    private final ExchangeName _name;
    private final ExchangeType _type;
    private final boolean _durable;

    /**
     * Whether the exchange is automatically deleted once all queues have detached from it
     */
    private final boolean _autoDelete;

    private final Map<String, Object> _arguments;

    @JsonCreator
    public Exchange(@JsonProperty("name") ExchangeName name,
                    @JsonProperty("type") ExchangeType type,
                    @JsonProperty("durable") boolean durable,
                    @JsonProperty("autoDelete") boolean autoDelete,
                    @JsonProperty("arguments") Map<String, Object> arguments)
    {
        if (name == null || type == null)
        {
            throw new IllegalArgumentException("Exchange name and type must be supplied");
        }
        _name = name;
        _type = type;
        _durable = durable;
        _autoDelete = autoDelete;
        _arguments = arguments == null
                ? Collections.<String, Object>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(arguments));
    }

    public ExchangeName getName()
    {
        return _name;
    }

    public ExchangeType getType()
    {
        return _type;
    }

    public boolean isDurable()
    {
        return _durable;
    }

    public boolean isAutoDelete()
    {
        return _autoDelete;
    }

    public Map<String, Object> getArguments()
    {
        return _arguments;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        Exchange exchange = (Exchange) o;
        return _durable == exchange._durable
               && _autoDelete == exchange._autoDelete
               && _name.equals(exchange._name)
               && _type == exchange._type
               && _arguments.equals(exchange._arguments);
    }

    @Override
    public int hashCode()
    {
        return 31 * _name.hashCode() + _type.hashCode();
    }

    public String toString()
    {
        return getClass().getSimpleName() + "[" + _name.getName() + "]";
    }
}
