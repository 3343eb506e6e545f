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
package org.sluice.server.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.codehaus.jackson.annotate.JsonCreator;
import org.codehaus.jackson.annotate.JsonProperty;

import org.sluice.server.model.ExchangeName;
import org.sluice.server.model.QueueName;

/**
 * Identifies a binding: the queue receives messages from the exchange whose routing key matches the pattern.
 */
public final class BindingKey
{
    private final ExchangeName _exchangeName;
    private final QueueName _queueName;
    private final String _pattern;
    private final Map<String, Object> _arguments;

    @JsonCreator
    public BindingKey(@JsonProperty("exchangeName") ExchangeName exchangeName,
                      @JsonProperty("queueName") QueueName queueName,
                      @JsonProperty("pattern") String pattern,
                      @JsonProperty("arguments") Map<String, Object> arguments)
    {
        if (exchangeName == null || queueName == null)
        {
            throw new IllegalArgumentException("Exchange and queue of a binding must be supplied");
        }
        _exchangeName = exchangeName;
        _queueName = queueName;
        _pattern = pattern == null ? "" : pattern;
        _arguments = arguments == null
                ? Collections.<String, Object>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(arguments));
    }

    public ExchangeName getExchangeName()
    {
        return _exchangeName;
    }

    public QueueName getQueueName()
    {
        return _queueName;
    }

    public String getPattern()
    {
        return _pattern;
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
        BindingKey that = (BindingKey) o;
        return _exchangeName.equals(that._exchangeName)
               && _queueName.equals(that._queueName)
               && _pattern.equals(that._pattern)
               && _arguments.equals(that._arguments);
    }

    @Override
    public int hashCode()
    {
        int result = _exchangeName.hashCode();
        result = 31 * result + _queueName.hashCode();
        result = 31 * result + _pattern.hashCode();
        return result;
    }

    @Override
    public String toString()
    {
        return "Binding[" + _exchangeName.getName() + " -> " + _queueName.getName() + " with '" + _pattern + "'"
               + (_arguments.isEmpty() ? "" : " " + _arguments) + "]";
    }
}
