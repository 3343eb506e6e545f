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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;

import org.apache.log4j.Logger;

import org.sluice.AMQException;
import org.sluice.AMQUnknownExchangeType;
import org.sluice.server.binding.BindingStore;
import org.sluice.server.model.ExchangeName;
import org.sluice.server.store.StoreException;
import org.sluice.server.store.StoreKey;
import org.sluice.server.store.StoreReader;
import org.sluice.server.store.StoreRecord;
import org.sluice.server.store.StoreTable;
import org.sluice.server.store.StoreTransaction;
import org.sluice.server.store.TransactionRunner;
import org.sluice.server.store.TransactionalWork;

public class DefaultExchangeRegistry implements ExchangeRegistry
{
    private static final Logger LOGGER = Logger.getLogger(DefaultExchangeRegistry.class);

    public static final StoreTable<Exchange> EXCHANGES =
            new StoreTable<Exchange>("exchange", Exchange.class, false);
    public static final StoreTable<Exchange> DURABLE_EXCHANGES =
            new StoreTable<Exchange>("durable_exchanges", Exchange.class, true);

    private final TransactionRunner _transactionRunner;
    private final BindingStore _bindingStore;

    public DefaultExchangeRegistry(TransactionRunner transactionRunner, BindingStore bindingStore)
    {
        _transactionRunner = transactionRunner;
        _bindingStore = bindingStore;
    }

    public static StoreKey exchangeKey(ExchangeName name)
    {
        return new StoreKey(name.getVirtualHost(), name.getName());
    }

    @Override
    public void recover()
    {
        int[] recovered;
        try
        {
            recovered = _transactionRunner.execute(new TransactionalWork<int[]>()
            {
                @Override
                public int[] execute(StoreTransaction txn)
                {
                    int exchanges = 0;
                    for (StoreRecord<Exchange> record : txn.scan(DURABLE_EXCHANGES, StoreKey.EMPTY, 0))
                    {
                        txn.write(EXCHANGES, record.getKey(), record.getValue());
                        exchanges++;
                    }
                    int routes = _bindingStore.recoverDurableRoutes(txn);
                    return new int[] { exchanges, routes };
                }
            });
        }
        catch (AMQException e)
        {
            throw new StoreException("Unexpected failure recovering exchanges", e);
        }
        LOGGER.info("Recovered " + recovered[0] + " durable exchange(s) and " + recovered[1] + " durable binding(s)");
    }

    @Override
    public Exchange declare(final ExchangeName name,
                            final ExchangeType type,
                            final boolean durable,
                            final boolean autoDelete,
                            final Map<String, Object> arguments) throws AMQException
    {
        final Exchange exchange = new Exchange(name, type, durable, autoDelete, arguments);
        Exchange declared = _transactionRunner.execute(new TransactionalWork<Exchange>()
        {
            @Override
            public Exchange execute(StoreTransaction txn)
            {
                StoreKey key = exchangeKey(name);
                Exchange existing = txn.read(EXCHANGES, key);
                if (existing != null)
                {
                    return existing;
                }
                txn.write(EXCHANGES, key, exchange);
                if (durable)
                {
                    txn.write(DURABLE_EXCHANGES, key, exchange);
                }
                return exchange;
            }
        });

        if (declared == exchange)
        {
            LOGGER.info("Created " + name.getDescriptor() + " of type '" + type.getTypeName() + "'"
                        + (durable ? " durable" : "") + (autoDelete ? " auto-delete" : ""));
        }
        else if (LOGGER.isDebugEnabled())
        {
            LOGGER.debug(name.getDescriptor() + " already exists, returning existing exchange");
        }
        return declared;
    }

    @Override
    public Exchange lookup(ExchangeName name)
    {
        return name == null ? null : getExchange(_transactionRunner.getStore(), name);
    }

    @Override
    public Exchange lookupOrDie(ExchangeName name) throws ExchangeNotFoundException
    {
        Exchange exchange = lookup(name);
        if (exchange == null)
        {
            throw new ExchangeNotFoundException(name);
        }
        return exchange;
    }

    @Override
    public Collection<Exchange> listForVirtualHost(String virtualHost)
    {
        Collection<Exchange> exchanges = new ArrayList<Exchange>();
        for (StoreRecord<Exchange> record : _transactionRunner.getStore().scan(EXCHANGES, new StoreKey(virtualHost), 0))
        {
            exchanges.add(record.getValue());
        }
        return exchanges;
    }

    @Override
    public ExchangeType checkType(String typeName) throws AMQUnknownExchangeType
    {
        ExchangeType type = ExchangeType.forTypeName(typeName);
        if (type == null)
        {
            throw new AMQUnknownExchangeType(typeName);
        }
        return type;
    }

    @Override
    public void assertType(Exchange exchange, ExchangeType requiredType) throws ExchangeTypeMismatchException
    {
        if (exchange.getType() != requiredType)
        {
            throw new ExchangeTypeMismatchException(exchange, requiredType);
        }
    }

    @Override
    public void delete(final ExchangeName name, final boolean ifUnused) throws AMQException
    {
        _transactionRunner.execute(new TransactionalWork<Void>()
        {
            @Override
            public Void execute(StoreTransaction txn) throws AMQException
            {
                Exchange exchange = getExchange(txn, name);
                if (exchange == null)
                {
                    throw new ExchangeNotFoundException(name);
                }

                if (ifUnused)
                {
                    if (!conditionalDelete(txn, exchange))
                    {
                        throw new ExchangeInUseException(name);
                    }
                }
                else
                {
                    unconditionalDelete(txn, exchange);
                }
                return null;
            }
        });
        LOGGER.info("Deleted " + name.getDescriptor());
    }

    @Override
    public Exchange getExchange(StoreReader reader, ExchangeName name)
    {
        return reader.read(EXCHANGES, exchangeKey(name));
    }

    @Override
    public void unconditionalDelete(StoreTransaction txn, Exchange exchange)
    {
        StoreKey key = exchangeKey(exchange.getName());
        // bindings first, so no route is ever left pointing at a missing exchange
        _bindingStore.deleteAllForExchange(txn, exchange.getName());
        txn.delete(DURABLE_EXCHANGES, key);
        txn.delete(EXCHANGES, key);
    }

    @Override
    public boolean conditionalDelete(StoreTransaction txn, Exchange exchange)
    {
        if (_bindingStore.hasAny(txn, exchange.getName()))
        {
            return false;
        }
        unconditionalDelete(txn, exchange);
        return true;
    }
}
