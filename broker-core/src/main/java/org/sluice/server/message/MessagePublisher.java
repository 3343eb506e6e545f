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

import java.util.Set;

import org.apache.log4j.Logger;

import org.sluice.server.exchange.Exchange;
import org.sluice.server.exchange.ExchangeNotFoundException;
import org.sluice.server.exchange.ExchangeRegistry;
import org.sluice.server.exchange.ExchangeRouter;
import org.sluice.server.model.ExchangeName;
import org.sluice.server.queue.AMQQueue;

/**
 * Entry point for publishing: finds the exchange, routes the message and passes it on for delivery.
 */
public class MessagePublisher
{
    private static final Logger _logger = Logger.getLogger(MessagePublisher.class);

    private final ExchangeRegistry _exchangeRegistry;
    private final ExchangeRouter _router;
    private final MessageDelivery _delivery;

    public MessagePublisher(ExchangeRegistry exchangeRegistry, ExchangeRouter router, MessageDelivery delivery)
    {
        _exchangeRegistry = exchangeRegistry;
        _router = router;
        _delivery = delivery;
    }

    /**
     * @return the result of delivery, exactly as the {@link MessageDelivery} reported it
     * @throws ExchangeNotFoundException if the message names an exchange that does not exist
     */
    public DeliveryResult publish(boolean mandatory, boolean immediate, BasicMessage message)
            throws ExchangeNotFoundException
    {
        Exchange exchange = _exchangeRegistry.lookupOrDie(message.getExchangeName());
        Set<AMQQueue> queues = _router.route(exchange, message.getRoutingKey());

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Publishing " + message + " to " + queues.size() + " queue(s), mandatory=" + mandatory
                          + ", immediate=" + immediate);
        }
        return _delivery.deliver(queues, mandatory, immediate, message);
    }

    public DeliveryResult publish(boolean mandatory,
                                  boolean immediate,
                                  ExchangeName exchangeName,
                                  String routingKey,
                                  String contentType,
                                  byte[] body) throws ExchangeNotFoundException
    {
        return publish(mandatory, immediate, new BasicMessage(exchangeName, routingKey, contentType, body));
    }
}
