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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.sluice.server.queue.AMQQueue;

/**
 * The outcome of handing a published message to its queues.
 */
public final class DeliveryResult
{
    public static enum Status
    {
        /** Enqueued on at least one queue */
        DELIVERED,
        /** No binding matched */
        UNROUTABLE,
        /** Routed, but no queue could take the message, e.g. an immediate message without consumers */
        NOT_DELIVERED
    }

    private final Status _status;
    private final Set<AMQQueue> _queues;

    public DeliveryResult(Status status, Set<? extends AMQQueue> queues)
    {
        _status = status;
        _queues = queues == null
                ? Collections.<AMQQueue>emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<AMQQueue>(queues));
    }

    public static DeliveryResult delivered(Set<? extends AMQQueue> queues)
    {
        return new DeliveryResult(Status.DELIVERED, queues);
    }

    public static DeliveryResult unroutable()
    {
        return new DeliveryResult(Status.UNROUTABLE, null);
    }

    public static DeliveryResult notDelivered()
    {
        return new DeliveryResult(Status.NOT_DELIVERED, null);
    }

    public Status getStatus()
    {
        return _status;
    }

    /**
     * @return the queues the message was enqueued on
     */
    public Set<AMQQueue> getQueues()
    {
        return _queues;
    }

    @Override
    public String toString()
    {
        return "DeliveryResult[" + _status + ", " + _queues.size() + " queue(s)]";
    }
}
