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
package org.sluice.server.message;

import java.util.Arrays;

import org.sluice.server.model.ExchangeName;

/**
 * A message as published by a client: the exchange it was sent to, its routing key, content type and body.
 */
public final class BasicMessage
{
    private final ExchangeName _exchangeName;
    private final String _routingKey;
    private final String _contentType;
    private final byte[] _body;

    public BasicMessage(ExchangeName exchangeName, String routingKey, String contentType, byte[] body)
    {
        _exchangeName = exchangeName;
        _routingKey = routingKey == null ? "" : routingKey;
        _contentType = contentType;
        _body = body == null ? new byte[0] : body;
    }

    public ExchangeName getExchangeName()
    {
        return _exchangeName;
    }

    public String getRoutingKey()
    {
        return _routingKey;
    }

    public String getContentType()
    {
        return _contentType;
    }

    public byte[] getBody()
    {
        return _body;
    }

    public int getSize()
    {
        return _body.length;
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

        BasicMessage that = (BasicMessage) o;
        return _exchangeName.equals(that._exchangeName)
               && _routingKey.equals(that._routingKey)
               && (_contentType == null ? that._contentType == null : _contentType.equals(that._contentType))
               && Arrays.equals(_body, that._body);
    }

    @Override
    public int hashCode()
    {
        int result = _exchangeName.hashCode();
        result = 31 * result + _routingKey.hashCode();
        result = 31 * result + Arrays.hashCode(_body);
        return result;
    }

    @Override
    public String toString()
    {
        return "BasicMessage[exchange=" + _exchangeName + ", routingKey='" + _routingKey + "', contentType="
               + _contentType + ", size=" + _body.length + "]";
    }
}
