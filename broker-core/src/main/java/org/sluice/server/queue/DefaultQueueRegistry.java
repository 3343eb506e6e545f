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

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.sluice.server.model.QueueName;

public class DefaultQueueRegistry implements QueueRegistry
{
    private final ConcurrentMap<QueueName, AMQQueue> _queueMap = new ConcurrentHashMap<QueueName, AMQQueue>();

    @Override
    public void registerQueue(AMQQueue queue)
    {
        _queueMap.put(queue.getName(), queue);
    }

    @Override
    public void unregisterQueue(QueueName name)
    {
        _queueMap.remove(name);
    }

    @Override
    public Collection<AMQQueue> getQueues()
    {
        return new ArrayList<AMQQueue>(_queueMap.values());
    }

    @Override
    public AMQQueue getQueue(QueueName name)
    {
        return name == null ? null : _queueMap.get(name);
    }
}
