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
package org.sluice.server;

import org.apache.log4j.Logger;

import org.sluice.server.binding.BindingManager;
import org.sluice.server.binding.BindingStore;
import org.sluice.server.configuration.BrokerConfiguration;
import org.sluice.server.configuration.IllegalConfigurationException;
import org.sluice.server.exchange.DefaultExchangeRegistry;
import org.sluice.server.exchange.ExchangeRegistry;
import org.sluice.server.exchange.ExchangeRouter;
import org.sluice.server.message.MessageDelivery;
import org.sluice.server.message.MessagePublisher;
import org.sluice.server.queue.QueueRegistry;
import org.sluice.server.store.JsonFileTransactionalStore;
import org.sluice.server.store.MemoryTransactionalStore;
import org.sluice.server.store.TransactionRunner;
import org.sluice.server.store.TransactionalStore;

/**
 * Assembles the routing core over a store chosen by configuration.
 * <p>
 * {@link #startup()} opens the store and recovers the durable exchanges and bindings before any of the
 * components are handed out.
 */
public class Broker
{
    private static final Logger _logger = Logger.getLogger(Broker.class);

    private final BrokerConfiguration _configuration;
    private final QueueRegistry _queueRegistry;
    private final MessageDelivery _messageDelivery;

    private TransactionalStore _store;
    private ExchangeRegistry _exchangeRegistry;
    private BindingManager _bindingManager;
    private ExchangeRouter _router;
    private MessagePublisher _publisher;

    public Broker(BrokerConfiguration configuration, QueueRegistry queueRegistry, MessageDelivery messageDelivery)
    {
        _configuration = configuration;
        _queueRegistry = queueRegistry;
        _messageDelivery = messageDelivery;
    }

    public void startup()
    {
        if (_store != null)
        {
            throw new IllegalStateException("Broker is already started");
        }

        TransactionalStore store = createStore();
        TransactionRunner transactionRunner = new TransactionRunner(store,
                                                                    _configuration.getTransactionMaxAttempts(),
                                                                    _configuration.getTransactionRetryDelay());
        store.open();
        try
        {
            BindingStore bindingStore = new BindingStore();
            DefaultExchangeRegistry exchangeRegistry = new DefaultExchangeRegistry(transactionRunner, bindingStore);
            exchangeRegistry.recover();

            _exchangeRegistry = exchangeRegistry;
            _bindingManager = new BindingManager(transactionRunner, exchangeRegistry, bindingStore, _queueRegistry);
            _router = new ExchangeRouter(store, bindingStore, _queueRegistry);
            _publisher = new MessagePublisher(exchangeRegistry, _router, _messageDelivery);
            _store = store;
        }
        catch (RuntimeException e)
        {
            _logger.error("Broker startup failed", e);
            store.close();
            throw e;
        }
        _logger.info("Broker started with " + _configuration.getStoreType() + " store");
    }

    public void shutdown()
    {
        if (_store != null)
        {
            try
            {
                _store.close();
            }
            finally
            {
                _store = null;
                _exchangeRegistry = null;
                _bindingManager = null;
                _router = null;
                _publisher = null;
            }
            _logger.info("Broker shut down");
        }
    }

    private TransactionalStore createStore()
    {
        String storeType = _configuration.getStoreType();
        if (BrokerConfiguration.JSON_STORE_TYPE.equals(storeType))
        {
            String storePath = _configuration.getStorePath();
            if (storePath == null)
            {
                throw new IllegalConfigurationException("'" + BrokerConfiguration.STORE_PATH
                                                        + "' must be set for a " + storeType + " store");
            }
            return new JsonFileTransactionalStore(storePath);
        }
        return new MemoryTransactionalStore();
    }

    public boolean isStarted()
    {
        return _store != null;
    }

    public TransactionalStore getStore()
    {
        return _store;
    }

    public QueueRegistry getQueueRegistry()
    {
        return _queueRegistry;
    }

    public ExchangeRegistry getExchangeRegistry()
    {
        return _exchangeRegistry;
    }

    public BindingManager getBindingManager()
    {
        return _bindingManager;
    }

    public ExchangeRouter getRouter()
    {
        return _router;
    }

    public MessagePublisher getPublisher()
    {
        return _publisher;
    }
}
