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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;
import org.codehaus.jackson.map.ObjectMapper;

import org.sluice.server.model.ExchangeName;
import org.sluice.server.model.QueueName;
import org.sluice.server.store.StoreException;
import org.sluice.server.store.StoreKey;
import org.sluice.server.store.StoreReader;
import org.sluice.server.store.StoreRecord;
import org.sluice.server.store.StoreTable;
import org.sluice.server.store.StoreTransaction;

/**
 * Stores bindings under two orders at once.
 * <p>
 * The route table is ordered by exchange, then pattern, then queue, so that the bindings of an exchange, or of
 * an exchange and an exact pattern, form one range. The reverse route table holds the same bindings ordered by
 * queue first, for removing every binding of a queue. Bindings of durable queues are also written to the
 * durable route table, from which {@link #recoverDurableRoutes} rebuilds both live tables after a restart.
 * <p>
 * Every method that writes changes both live tables together, within the caller's transaction.
 */
public class BindingStore
{
    private static final Logger _logger = Logger.getLogger(BindingStore.class);

    public static final StoreTable<BindingKey> ROUTES =
            new StoreTable<BindingKey>("route", BindingKey.class, false);
    public static final StoreTable<BindingKey> REVERSE_ROUTES =
            new StoreTable<BindingKey>("reverse_route", BindingKey.class, false);
    public static final StoreTable<BindingKey> DURABLE_ROUTES =
            new StoreTable<BindingKey>("durable_routes", BindingKey.class, true);

    private final ObjectMapper _objectMapper = new ObjectMapper();

    public void put(StoreTransaction txn, BindingKey binding, boolean durable)
    {
        StoreKey routeKey = routeKey(binding);
        if (durable)
        {
            txn.write(DURABLE_ROUTES, routeKey, binding);
        }
        txn.write(ROUTES, routeKey, binding);
        txn.write(REVERSE_ROUTES, reverseRouteKey(binding), binding);

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Stored " + (durable ? "durable " : "") + binding);
        }
    }

    public void remove(StoreTransaction txn, BindingKey binding, boolean durable)
    {
        StoreKey routeKey = routeKey(binding);
        if (durable)
        {
            txn.delete(DURABLE_ROUTES, routeKey);
        }
        txn.delete(REVERSE_ROUTES, reverseRouteKey(binding));
        txn.delete(ROUTES, routeKey);

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Removed " + (durable ? "durable " : "") + binding);
        }
    }

    /**
     * @return every binding of the exchange
     */
    public List<BindingKey> scanByExchange(StoreReader reader, ExchangeName exchangeName)
    {
        return values(reader.scan(ROUTES, exchangePrefix(exchangeName), 0));
    }

    /**
     * @return the bindings of the exchange whose pattern is exactly the given one
     */
    public List<BindingKey> scanByExchange(StoreReader reader, ExchangeName exchangeName, String pattern)
    {
        return values(reader.scan(ROUTES, exchangePrefix(exchangeName).append(pattern), 0));
    }

    /**
     * @return the distinct exchanges the queue is bound to
     */
    public Set<ExchangeName> scanByQueue(StoreReader reader, QueueName queueName)
    {
        Set<ExchangeName> exchangeNames = new LinkedHashSet<ExchangeName>();
        for (StoreRecord<BindingKey> record : reader.scan(REVERSE_ROUTES, queuePrefix(queueName), 0))
        {
            exchangeNames.add(record.getValue().getExchangeName());
        }
        return exchangeNames;
    }

    public boolean hasAny(StoreReader reader, ExchangeName exchangeName)
    {
        return !reader.scan(ROUTES, exchangePrefix(exchangeName), 1).isEmpty();
    }

    public void deleteAllForExchange(StoreTransaction txn, ExchangeName exchangeName)
    {
        for (StoreRecord<BindingKey> record : txn.scan(ROUTES, exchangePrefix(exchangeName), 0))
        {
            deleteRoute(txn, record.getKey(), record.getValue());
        }
    }

    /**
     * @return the distinct exchanges the queue was bound to
     */
    public Set<ExchangeName> deleteAllForQueue(StoreTransaction txn, QueueName queueName)
    {
        Set<ExchangeName> exchangeNames = new LinkedHashSet<ExchangeName>();
        for (StoreRecord<BindingKey> record : txn.scan(REVERSE_ROUTES, queuePrefix(queueName), 0))
        {
            BindingKey binding = record.getValue();
            deleteRoute(txn, routeKey(binding), binding);
            exchangeNames.add(binding.getExchangeName());
        }
        return exchangeNames;
    }

    /**
     * Writes every durable binding back into the route and reverse route tables.
     *
     * @return the number of bindings recovered
     */
    public int recoverDurableRoutes(StoreTransaction txn)
    {
        int recovered = 0;
        for (StoreRecord<BindingKey> record : txn.scan(DURABLE_ROUTES, StoreKey.EMPTY, 0))
        {
            BindingKey binding = record.getValue();
            txn.write(ROUTES, record.getKey(), binding);
            txn.write(REVERSE_ROUTES, reverseRouteKey(binding), binding);
            recovered++;
        }
        return recovered;
    }

    private void deleteRoute(StoreTransaction txn, StoreKey routeKey, BindingKey binding)
    {
        txn.delete(REVERSE_ROUTES, reverseRouteKey(binding));
        txn.delete(ROUTES, routeKey);
        txn.delete(DURABLE_ROUTES, routeKey);
    }

    StoreKey routeKey(BindingKey binding)
    {
        return exchangePrefix(binding.getExchangeName()).append(binding.getPattern(),
                                                                binding.getQueueName().getVirtualHost(),
                                                                binding.getQueueName().getName(),
                                                                encodeArguments(binding.getArguments()));
    }

    StoreKey reverseRouteKey(BindingKey binding)
    {
        return queuePrefix(binding.getQueueName()).append(binding.getExchangeName().getVirtualHost(),
                                                          binding.getExchangeName().getName(),
                                                          binding.getPattern(),
                                                          encodeArguments(binding.getArguments()));
    }

    private static StoreKey exchangePrefix(ExchangeName exchangeName)
    {
        return new StoreKey(exchangeName.getVirtualHost(), exchangeName.getName());
    }

    private static StoreKey queuePrefix(QueueName queueName)
    {
        return new StoreKey(queueName.getVirtualHost(), queueName.getName());
    }

    private String encodeArguments(Map<String, Object> arguments)
    {
        try
        {
            return _objectMapper.writeValueAsString(canonicalize(arguments));
        }
        catch (IOException e)
        {
            throw new StoreException("Cannot encode binding arguments " + arguments, e);
        }
    }

    /**
     * Sorts the entries of the argument table and of every table nested in it, so that equal argument tables
     * always give equal keys.
     */
    private static Object canonicalize(Object value)
    {
        if (value instanceof Map)
        {
            Map<String, Object> sorted = new TreeMap<String, Object>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
            {
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List)
        {
            List<Object> elements = new ArrayList<Object>();
            for (Object element : (List<?>) value)
            {
                elements.add(canonicalize(element));
            }
            return elements;
        }
        return value;
    }

    private static List<BindingKey> values(List<StoreRecord<BindingKey>> records)
    {
        List<BindingKey> bindings = new ArrayList<BindingKey>(records.size());
        for (StoreRecord<BindingKey> record : records)
        {
            bindings.add(record.getValue());
        }
        return bindings;
    }
}
