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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import org.sluice.AMQException;
import org.sluice.server.exchange.Exchange;
import org.sluice.server.exchange.ExchangeNotFoundException;
import org.sluice.server.exchange.ExchangeRegistry;
import org.sluice.server.model.ExchangeName;
import org.sluice.server.model.QueueName;
import org.sluice.server.queue.AMQQueue;
import org.sluice.server.queue.QueueNotFoundException;
import org.sluice.server.queue.QueueRegistry;
import org.sluice.server.store.StoreException;
import org.sluice.server.store.StoreTransaction;
import org.sluice.server.store.TransactionRunner;
import org.sluice.server.store.TransactionalWork;

/**
 * Adds and removes bindings, and removes the bindings of deleted queues.
 * <p>
 * Each operation is a single transaction, which includes deleting any auto-delete exchange left without
 * bindings by it.
 */
public class BindingManager
{
    private static final Logger _logger = Logger.getLogger(BindingManager.class);

    private final TransactionRunner _transactionRunner;
    private final ExchangeRegistry _exchangeRegistry;
    private final BindingStore _bindingStore;
    private final QueueRegistry _queueRegistry;

    public BindingManager(TransactionRunner transactionRunner,
                          ExchangeRegistry exchangeRegistry,
                          BindingStore bindingStore,
                          QueueRegistry queueRegistry)
    {
        _transactionRunner = transactionRunner;
        _exchangeRegistry = exchangeRegistry;
        _bindingStore = bindingStore;
        _queueRegistry = queueRegistry;
    }

    /**
     * @throws ExchangeNotFoundException if there is no such exchange
     * @throws QueueNotFoundException if there is no such queue
     * @throws DurabilityIncompatibleException if the queue is durable and the exchange is not
     */
    public void addBinding(final ExchangeName exchangeName,
                           final QueueName queueName,
                           final String pattern,
                           final Map<String, Object> arguments) throws AMQException
    {
        final BindingKey binding = new BindingKey(exchangeName, queueName, pattern, arguments);
        _transactionRunner.execute(new TransactionalWork<Void>()
        {
            @Override
            public Void execute(StoreTransaction txn) throws AMQException
            {
                Exchange exchange = getExchange(txn, exchangeName);
                AMQQueue queue = getQueue(queueName);
                if (queue.isDurable() && !exchange.isDurable())
                {
                    throw new DurabilityIncompatibleException(exchangeName, queueName);
                }
                _bindingStore.put(txn, binding, queue.isDurable());
                return null;
            }
        });

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Added " + binding);
        }
    }

    /**
     * Removes a binding. Removing a binding that does not exist is not an error.
     *
     * @throws ExchangeNotFoundException if there is no such exchange
     * @throws QueueNotFoundException if there is no such queue
     */
    public void deleteBinding(final ExchangeName exchangeName,
                              final QueueName queueName,
                              final String pattern,
                              final Map<String, Object> arguments) throws AMQException
    {
        final BindingKey binding = new BindingKey(exchangeName, queueName, pattern, arguments);
        boolean autoDeleted = _transactionRunner.execute(new TransactionalWork<Boolean>()
        {
            @Override
            public Boolean execute(StoreTransaction txn) throws AMQException
            {
                Exchange exchange = getExchange(txn, exchangeName);
                AMQQueue queue = getQueue(queueName);
                _bindingStore.remove(txn, binding, queue.isDurable());
                return maybeAutoDelete(txn, exchange);
            }
        });

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Deleted " + binding);
        }
        if (autoDeleted)
        {
            _logger.info("Auto-deleted " + exchangeName.getDescriptor() + " after its last binding was removed");
        }
    }

    /**
     * Removes every binding of a queue which is being deleted, then deletes any auto-delete exchange which is
     * left without bindings.
     *
     * @return the exchanges that were auto-deleted
     */
    public List<ExchangeName> deleteBindingsForQueue(final QueueName queueName) throws AMQException
    {
        List<ExchangeName> autoDeleted = _transactionRunner.execute(new TransactionalWork<List<ExchangeName>>()
        {
            @Override
            public List<ExchangeName> execute(StoreTransaction txn)
            {
                List<ExchangeName> deleted = new ArrayList<ExchangeName>();
                for (ExchangeName exchangeName : _bindingStore.deleteAllForQueue(txn, queueName))
                {
                    Exchange exchange = _exchangeRegistry.getExchange(txn, exchangeName);
                    if (exchange == null)
                    {
                        throw new StoreException("Binding of " + queueName.getDescriptor()
                                                 + " refers to missing " + exchangeName.getDescriptor());
                    }
                    if (maybeAutoDelete(txn, exchange))
                    {
                        deleted.add(exchangeName);
                    }
                }
                return deleted;
            }
        });

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Deleted bindings of " + queueName.getDescriptor());
        }
        for (ExchangeName exchangeName : autoDeleted)
        {
            _logger.info("Auto-deleted " + exchangeName.getDescriptor() + " after deletion of "
                         + queueName.getDescriptor());
        }
        return autoDeleted;
    }

    /**
     * @see ExchangeRegistry#delete(ExchangeName, boolean)
     */
    public void deleteExchange(ExchangeName exchangeName, boolean ifUnused) throws AMQException
    {
        _exchangeRegistry.delete(exchangeName, ifUnused);
    }

    /**
     * Lists the bindings of an exchange, for management tools. Not used when routing.
     */
    public List<BindingKey> listBindingsForExchange(ExchangeName exchangeName)
    {
        return _bindingStore.scanByExchange(_transactionRunner.getStore(), exchangeName);
    }

    private boolean maybeAutoDelete(StoreTransaction txn, Exchange exchange)
    {
        return exchange.isAutoDelete() && _exchangeRegistry.conditionalDelete(txn, exchange);
    }

    private Exchange getExchange(StoreTransaction txn, ExchangeName exchangeName) throws ExchangeNotFoundException
    {
        Exchange exchange = _exchangeRegistry.getExchange(txn, exchangeName);
        if (exchange == null)
        {
            throw new ExchangeNotFoundException(exchangeName);
        }
        return exchange;
    }

    private AMQQueue getQueue(QueueName queueName) throws QueueNotFoundException
    {
        AMQQueue queue = _queueRegistry.getQueue(queueName);
        if (queue == null)
        {
            throw new QueueNotFoundException(queueName);
        }
        return queue;
    }
}
