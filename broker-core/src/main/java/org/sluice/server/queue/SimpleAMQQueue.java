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
package org.sluice.server.queue;

import org.sluice.server.model.QueueName;

public class SimpleAMQQueue implements AMQQueue
{
    private final QueueName _name;
    private final boolean _durable;

    public SimpleAMQQueue(QueueName name, boolean durable)
    {
        _name = name;
        _durable = durable;
    }

    @Override
    public QueueName getName()
    {
        return _name;
    }

    @Override
    public boolean isDurable()
    {
        return _durable;
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
        SimpleAMQQueue that = (SimpleAMQQueue) o;
        return _durable == that._durable && _name.equals(that._name);
    }

    @Override
    public int hashCode()
    {
        return _name.hashCode();
    }

    public String toString()
    {
        return getClass().getSimpleName() + "[" + _name.getName() + "]";
    }
}
