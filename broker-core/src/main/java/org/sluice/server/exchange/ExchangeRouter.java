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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.log4j.Logger;

import org.sluice.server.binding.BindingKey;
import org.sluice.server.binding.BindingStore;
import org.sluice.server.model.QueueName;
import org.sluice.server.queue.AMQQueue;
import org.sluice.server.queue.QueueRegistry;
import org.sluice.server.store.StoreReader;

/**
 * Computes the queues a message published to an exchange should be delivered to.
 * <p>
 * Routing reads the committed state of the store without a transaction. Each queue appears at most once in the
 * result, however many of its bindings match.
 */
public class ExchangeRouter
{
    private static final Logger _logger = Logger.getLogger(ExchangeRouter.class);

    private final StoreReader _reader;
    private final BindingStore _bindingStore;
    private final QueueRegistry _queueRegistry;

    public ExchangeRouter(StoreReader reader, BindingStore bindingStore, QueueRegistry queueRegistry)
    {
        _reader = reader;
        _bindingStore = bindingStore;
        _queueRegistry = queueRegistry;
    }

    public Set<AMQQueue> route(Exchange exchange, String routingKey)
    {
        if (routingKey == null)
        {
            routingKey = "";
        }

        Set<QueueName> queueNames = new LinkedHashSet<QueueName>();
        switch (exchange.getType())
        {
            case FANOUT:
                addQueueNames(queueNames, _bindingStore.scanByExchange(_reader, exchange.getName()));
                break;
            case DIRECT:
                addQueueNames(queueNames, _bindingStore.scanByExchange(_reader, exchange.getName(), routingKey));
                break;
            case TOPIC:
                for (BindingKey binding : _bindingStore.scanByExchange(_reader, exchange.getName()))
                {
                    if (TopicMatcher.matches(binding.getPattern(), routingKey))
                    {
                        queueNames.add(binding.getQueueName());
                    }
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown exchange type " + exchange.getType());
        }

        Set<AMQQueue> queues = new LinkedHashSet<AMQQueue>();
        for (QueueName queueName : queueNames)
        {
            AMQQueue queue = _queueRegistry.getQueue(queueName);
            if (queue == null)
            {
                if (_logger.isDebugEnabled())
                {
                    _logger.debug("Exchange: " + exchange.getName() + " - ignoring binding to deleted "
                                  + queueName.getDescriptor());
                }
            }
            else
            {
                queues.add(queue);
            }
        }

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Exchange: " + exchange.getName() + " - routed key '" + routingKey + "' to "
                          + queues.size() + " queue(s)");
        }
        return queues;
    }

    private static void addQueueNames(Set<QueueName> queueNames, Collection<BindingKey> bindings)
    {
        for (BindingKey binding : bindings)
        {
            queueNames.add(binding.getQueueName());
        }
    }
}
