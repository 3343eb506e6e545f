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

import static org.sluice.server.util.BrokerTestHelper.arguments;
import static org.sluice.server.util.BrokerTestHelper.createQueue;
import static org.sluice.server.util.BrokerTestHelper.exchangeName;
import static org.sluice.server.util.BrokerTestHelper.noArguments;
import static org.sluice.server.util.BrokerTestHelper.queueName;

import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.sluice.AMQException;
import org.sluice.protocol.AMQConstant;
import org.sluice.server.exchange.DefaultExchangeRegistry;
import org.sluice.server.exchange.Exchange;
import org.sluice.server.exchange.ExchangeInUseException;
import org.sluice.server.exchange.ExchangeNotFoundException;
import org.sluice.server.exchange.ExchangeType;
import org.sluice.server.model.ExchangeName;
import org.sluice.server.queue.DefaultQueueRegistry;
import org.sluice.server.queue.QueueNotFoundException;
import org.sluice.server.queue.QueueRegistry;
import org.sluice.server.store.JsonFileTransactionalStore;
import org.sluice.server.store.MemoryTransactionalStore;
import org.sluice.server.store.StoreException;
import org.sluice.server.store.StoreKey;
import org.sluice.server.store.StoreReader;
import org.sluice.server.store.StoreRecord;
import org.sluice.server.store.StoreTransaction;
import org.sluice.server.store.TransactionRunner;
import org.sluice.server.util.BrokerTestHelper;
import org.sluice.test.utils.SluiceTestCase;
import org.sluice.test.utils.TestFileUtils;

public class BindingManagerTest extends SluiceTestCase
{
    private MemoryTransactionalStore _store;
    private BindingStore _bindingStore;
    private DefaultExchangeRegistry _exchangeRegistry;
    private QueueRegistry _queueRegistry;
    private BindingManager _bindingManager;

    @Override
    public void setUp() throws Exception
    {
        super.setUp();
        _store = BrokerTestHelper.createOpenMemoryStore();
        TransactionRunner transactionRunner = BrokerTestHelper.createTransactionRunner(_store);
        _bindingStore = new BindingStore();
        _exchangeRegistry = new DefaultExchangeRegistry(transactionRunner, _bindingStore);
        _queueRegistry = new DefaultQueueRegistry();
        _bindingManager = new BindingManager(transactionRunner, _exchangeRegistry, _bindingStore, _queueRegistry);
    }

    @Override
    public void tearDown() throws Exception
    {
        try
        {
            _store.close();
        }
        finally
        {
            super.tearDown();
        }
    }

    public void testAddAndListBindings() throws Exception
    {
        declare("logs", ExchangeType.TOPIC, false, false);
        createQueue(_queueRegistry, "q1", false);
        createQueue(_queueRegistry, "q2", false);

        _bindingManager.addBinding(exchangeName("logs"), queueName("q1"), "kern.*", noArguments());
        _bindingManager.addBinding(exchangeName("logs"), queueName("q2"), "*.critical", arguments("x-match", "all"));

        List<BindingKey> bindings = _bindingManager.listBindingsForExchange(exchangeName("logs"));
        assertEquals(2, bindings.size());
        assertTrue(bindings.contains(new BindingKey(exchangeName("logs"), queueName("q1"), "kern.*", null)));
        assertTrue(bindings.contains(new BindingKey(exchangeName("logs"), queueName("q2"), "*.critical",
                                                    arguments("x-match", "all"))));
        assertTrue(_bindingManager.listBindingsForExchange(exchangeName("other")).isEmpty());
    }

    public void testAddToUnknownExchange() throws Exception
    {
        createQueue(_queueRegistry, "q1", false);
        try
        {
            _bindingManager.addBinding(exchangeName("missing"), queueName("q1"), "key", noArguments());
            fail("Exception not thrown");
        }
        catch (ExchangeNotFoundException e)
        {
            assertEquals(AMQConstant.NOT_FOUND, e.getErrorCode());
        }
    }

    public void testAddForUnknownQueue() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, false, false);
        try
        {
            _bindingManager.addBinding(exchangeName("orders"), queueName("missing"), "key", noArguments());
            fail("Exception not thrown");
        }
        catch (QueueNotFoundException e)
        {
            assertEquals(AMQConstant.NOT_FOUND, e.getErrorCode());
            assertEquals(queueName("missing"), e.getQueueName());
        }
        assertNoRoutes();
    }

    public void testDurableQueueCannotBindToTransientExchange() throws Exception
    {
        declare("transient", ExchangeType.DIRECT, false, false);
        createQueue(_queueRegistry, "durable", true);
        try
        {
            _bindingManager.addBinding(exchangeName("transient"), queueName("durable"), "key", noArguments());
            fail("Exception not thrown");
        }
        catch (DurabilityIncompatibleException e)
        {
            assertEquals(AMQConstant.NOT_ALLOWED, e.getErrorCode());
        }
        assertNoRoutes();
    }

    public void testBindingDurabilityFollowsQueue() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, true, false);
        createQueue(_queueRegistry, "durable", true);
        createQueue(_queueRegistry, "transient", false);

        _bindingManager.addBinding(exchangeName("orders"), queueName("durable"), "new", noArguments());
        _bindingManager.addBinding(exchangeName("orders"), queueName("transient"), "new", noArguments());

        List<StoreRecord<BindingKey>> durableRoutes = _store.scan(BindingStore.DURABLE_ROUTES, StoreKey.EMPTY, 0);
        assertEquals(1, durableRoutes.size());
        assertEquals(queueName("durable"), durableRoutes.get(0).getValue().getQueueName());
        assertEquals(2, _store.scan(BindingStore.ROUTES, StoreKey.EMPTY, 0).size());
    }

    public void testAddThenDeleteLeavesNoTrace() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, true, false);
        createQueue(_queueRegistry, "q1", true);

        _bindingManager.addBinding(exchangeName("orders"), queueName("q1"), "new", arguments("a", "b"));
        _bindingManager.deleteBinding(exchangeName("orders"), queueName("q1"), "new", arguments("a", "b"));

        assertNoRoutes();
        assertNotNull(_exchangeRegistry.lookup(exchangeName("orders")));
    }

    public void testDeleteOfUnknownBindingIsTolerated() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, false, false);
        createQueue(_queueRegistry, "q1", false);
        _bindingManager.addBinding(exchangeName("orders"), queueName("q1"), "new", noArguments());

        _bindingManager.deleteBinding(exchangeName("orders"), queueName("q1"), "old", noArguments());

        assertEquals(1, _bindingManager.listBindingsForExchange(exchangeName("orders")).size());
    }

    public void testDeleteBindingRequiresExchangeAndQueue() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, false, false);
        try
        {
            _bindingManager.deleteBinding(exchangeName("orders"), queueName("missing"), "new", noArguments());
            fail("Exception not thrown");
        }
        catch (QueueNotFoundException e)
        {
            // pass
        }

        createQueue(_queueRegistry, "q1", false);
        try
        {
            _bindingManager.deleteBinding(exchangeName("missing"), queueName("q1"), "new", noArguments());
            fail("Exception not thrown");
        }
        catch (ExchangeNotFoundException e)
        {
            // pass
        }
    }

    public void testAutoDeleteOnLastBindingRemoved() throws Exception
    {
        declare("temp", ExchangeType.FANOUT, true, true);
        createQueue(_queueRegistry, "q1", false);
        createQueue(_queueRegistry, "q2", false);
        _bindingManager.addBinding(exchangeName("temp"), queueName("q1"), "", noArguments());
        _bindingManager.addBinding(exchangeName("temp"), queueName("q2"), "", noArguments());

        _bindingManager.deleteBinding(exchangeName("temp"), queueName("q1"), "", noArguments());
        assertNotNull("Exchange with a remaining binding must survive", _exchangeRegistry.lookup(exchangeName("temp")));

        _bindingManager.deleteBinding(exchangeName("temp"), queueName("q2"), "", noArguments());
        assertNull(_exchangeRegistry.lookup(exchangeName("temp")));
        assertNull(_store.read(DefaultExchangeRegistry.DURABLE_EXCHANGES,
                               DefaultExchangeRegistry.exchangeKey(exchangeName("temp"))));
    }

    public void testExchangeWithoutAutoDeleteSurvivesLastBinding() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, false, false);
        createQueue(_queueRegistry, "q1", false);
        _bindingManager.addBinding(exchangeName("orders"), queueName("q1"), "new", noArguments());

        _bindingManager.deleteBinding(exchangeName("orders"), queueName("q1"), "new", noArguments());

        assertNotNull(_exchangeRegistry.lookup(exchangeName("orders")));
    }

    public void testDeleteBindingsForQueueCascades() throws Exception
    {
        declare("temp", ExchangeType.TOPIC, false, true);
        declare("shared", ExchangeType.TOPIC, false, true);
        declare("plain", ExchangeType.DIRECT, false, false);
        createQueue(_queueRegistry, "q1", false);
        createQueue(_queueRegistry, "q2", false);

        _bindingManager.addBinding(exchangeName("temp"), queueName("q1"), "a.#", noArguments());
        _bindingManager.addBinding(exchangeName("temp"), queueName("q1"), "b.#", noArguments());
        _bindingManager.addBinding(exchangeName("shared"), queueName("q1"), "a.#", noArguments());
        _bindingManager.addBinding(exchangeName("shared"), queueName("q2"), "a.#", noArguments());
        _bindingManager.addBinding(exchangeName("plain"), queueName("q1"), "key", noArguments());

        List<ExchangeName> autoDeleted = _bindingManager.deleteBindingsForQueue(queueName("q1"));

        assertEquals(Collections.singletonList(exchangeName("temp")), autoDeleted);
        assertNull(_exchangeRegistry.lookup(exchangeName("temp")));
        assertNotNull(_exchangeRegistry.lookup(exchangeName("shared")));
        assertNotNull(_exchangeRegistry.lookup(exchangeName("plain")));
        assertTrue(_bindingStore.scanByQueue(_store, queueName("q1")).isEmpty());
        assertEquals(1, _bindingManager.listBindingsForExchange(exchangeName("shared")).size());
        assertTrue(_bindingManager.listBindingsForExchange(exchangeName("plain")).isEmpty());
    }

    public void testDeleteBindingsForUnboundQueue() throws Exception
    {
        assertTrue(_bindingManager.deleteBindingsForQueue(queueName("unbound")).isEmpty());
    }

    public void testDeleteBindingsForQueueWithOrphanedRouteFails() throws Exception
    {
        StoreTransaction txn = _store.beginTransaction();
        _bindingStore.put(txn, new BindingKey(exchangeName("gone"), queueName("q1"), "key", null), false);
        txn.commit();

        try
        {
            _bindingManager.deleteBindingsForQueue(queueName("q1"));
            fail("Exception not thrown");
        }
        catch (StoreException e)
        {
            // pass
        }
        assertFalse("Failed cascade must not be partially applied",
                    _bindingStore.scanByQueue(_store, queueName("q1")).isEmpty());
    }

    public void testDeleteExchange() throws Exception
    {
        declare("orders", ExchangeType.DIRECT, true, false);
        createQueue(_queueRegistry, "q1", true);
        _bindingManager.addBinding(exchangeName("orders"), queueName("q1"), "new", noArguments());

        try
        {
            _bindingManager.deleteExchange(exchangeName("orders"), true);
            fail("Exception not thrown");
        }
        catch (ExchangeInUseException e)
        {
            assertEquals(AMQConstant.PRECONDITION_FAILED, e.getErrorCode());
        }
        assertEquals(1, _bindingManager.listBindingsForExchange(exchangeName("orders")).size());

        _bindingManager.deleteExchange(exchangeName("orders"), false);
        assertNull(_exchangeRegistry.lookup(exchangeName("orders")));
        assertNoRoutes();

        try
        {
            _bindingManager.deleteExchange(exchangeName("orders"), false);
            fail("Exception not thrown");
        }
        catch (ExchangeNotFoundException e)
        {
            // pass
        }
    }

    public void testConcurrentBindAndUnbindLeaveNoOrphanedRoutes() throws Exception
    {
        TransactionRunner patientRunner = new TransactionRunner(_store, 1000, 0l);
        final DefaultExchangeRegistry exchangeRegistry = new DefaultExchangeRegistry(patientRunner, _bindingStore);
        final BindingManager bindingManager =
                new BindingManager(patientRunner, exchangeRegistry, _bindingStore, _queueRegistry);

        exchangeRegistry.declare(exchangeName("temp"), ExchangeType.DIRECT, false, true, noArguments());
        createQueue(_queueRegistry, "binder", false);
        createQueue(_queueRegistry, "anchor", false);
        bindingManager.addBinding(exchangeName("temp"), queueName("anchor"), "key", noArguments());

        final CountDownLatch start = new CountDownLatch(1);
        final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();

        Thread binder = new Thread(new Runnable()
        {
            @Override
            public void run()
            {
                try
                {
                    start.await();
                    for (int i = 0; i < 200; i++)
                    {
                        try
                        {
                            bindingManager.addBinding(exchangeName("temp"), queueName("binder"), "key" + i,
                                                      noArguments());
                        }
                        catch (ExchangeNotFoundException e)
                        {
                            return;
                        }
                    }
                }
                catch (Throwable t)
                {
                    failure.compareAndSet(null, t);
                }
            }
        }, "binder");

        Thread unbinder = new Thread(new Runnable()
        {
            @Override
            public void run()
            {
                try
                {
                    start.await();
                    bindingManager.deleteBindingsForQueue(queueName("anchor"));
                    bindingManager.deleteBindingsForQueue(queueName("binder"));
                }
                catch (Throwable t)
                {
                    failure.compareAndSet(null, t);
                }
            }
        }, "unbinder");

        binder.start();
        unbinder.start();
        start.countDown();
        binder.join(30000);
        unbinder.join(30000);

        if (failure.get() != null)
        {
            throw new AMQException(AMQConstant.INTERNAL_ERROR, "Concurrent binding failed", failure.get());
        }

        boolean exchangeExists = exchangeRegistry.lookup(exchangeName("temp")) != null;
        boolean routesExist = !_bindingStore.scanByExchange(_store, exchangeName("temp")).isEmpty();
        if (!exchangeExists)
        {
            assertFalse("Routes must not outlive their exchange", routesExist);
        }
        assertEquals(_store.scan(BindingStore.ROUTES, StoreKey.EMPTY, 0).size(),
                     _store.scan(BindingStore.REVERSE_ROUTES, StoreKey.EMPTY, 0).size());
    }

    public void testExchangeDeletedDuringQueueCascadeIsRetried() throws Exception
    {
        final AtomicBoolean deleted = new AtomicBoolean();
        final DefaultExchangeRegistry exchangeRegistry =
                new DefaultExchangeRegistry(BrokerTestHelper.createTransactionRunner(_store), _bindingStore)
        {
            @Override
            public Exchange getExchange(StoreReader reader, ExchangeName name)
            {
                // another client deletes the exchange after the cascade has collected the queue's bindings
                if (reader instanceof StoreTransaction && deleted.compareAndSet(false, true))
                {
                    try
                    {
                        delete(name, false);
                    }
                    catch (AMQException e)
                    {
                        throw new RuntimeException(e);
                    }
                }
                return super.getExchange(reader, name);
            }
        };
        BindingManager bindingManager = new BindingManager(BrokerTestHelper.createTransactionRunner(_store),
                                                           exchangeRegistry, _bindingStore, _queueRegistry);
        declare("logs", ExchangeType.TOPIC, false, false);
        createQueue(_queueRegistry, "q1", false);
        _bindingManager.addBinding(exchangeName("logs"), queueName("q1"), "kern.*", noArguments());

        List<ExchangeName> autoDeleted = bindingManager.deleteBindingsForQueue(queueName("q1"));

        assertTrue(deleted.get());
        assertTrue(autoDeleted.isEmpty());
        assertNull(_exchangeRegistry.lookup(exchangeName("logs")));
        assertNoRoutes();
    }

    public void testFailedDurableCommitChangesNothing() throws Exception
    {
        File storeDirectory = TestFileUtils.createTestDirectory(getClass().getSimpleName(), true);
        JsonFileTransactionalStore store = new JsonFileTransactionalStore(storeDirectory.getAbsolutePath());
        store.open();
        try
        {
            TransactionRunner transactionRunner = BrokerTestHelper.createTransactionRunner(store);
            DefaultExchangeRegistry exchangeRegistry = new DefaultExchangeRegistry(transactionRunner, _bindingStore);
            BindingManager bindingManager =
                    new BindingManager(transactionRunner, exchangeRegistry, _bindingStore, _queueRegistry);
            exchangeRegistry.declare(exchangeName("orders"), ExchangeType.DIRECT, true, false, noArguments());
            createQueue(_queueRegistry, "q1", true);

            assertTrue(TestFileUtils.delete(storeDirectory));

            try
            {
                bindingManager.addBinding(exchangeName("orders"), queueName("q1"), "new", noArguments());
                fail("Exception not thrown");
            }
            catch (StoreException e)
            {
                // pass
            }
            assertTrue(store.scan(BindingStore.ROUTES, StoreKey.EMPTY, 0).isEmpty());
            assertTrue(store.scan(BindingStore.REVERSE_ROUTES, StoreKey.EMPTY, 0).isEmpty());
            assertTrue(store.scan(BindingStore.DURABLE_ROUTES, StoreKey.EMPTY, 0).isEmpty());

            try
            {
                exchangeRegistry.declare(exchangeName("audit"), ExchangeType.FANOUT, true, false, noArguments());
                fail("Exception not thrown");
            }
            catch (StoreException e)
            {
                // pass
            }
            assertNull(exchangeRegistry.lookup(exchangeName("audit")));
            assertNull(store.read(DefaultExchangeRegistry.DURABLE_EXCHANGES,
                                  DefaultExchangeRegistry.exchangeKey(exchangeName("audit"))));
            assertNotNull(exchangeRegistry.lookup(exchangeName("orders")));
        }
        finally
        {
            store.close();
            TestFileUtils.delete(storeDirectory);
        }
    }

    private void declare(String name, ExchangeType type, boolean durable, boolean autoDelete) throws AMQException
    {
        _exchangeRegistry.declare(exchangeName(name), type, durable, autoDelete, noArguments());
    }

    private void assertNoRoutes()
    {
        assertTrue(_store.scan(BindingStore.ROUTES, StoreKey.EMPTY, 0).isEmpty());
        assertTrue(_store.scan(BindingStore.REVERSE_ROUTES, StoreKey.EMPTY, 0).isEmpty());
        assertTrue(_store.scan(BindingStore.DURABLE_ROUTES, StoreKey.EMPTY, 0).isEmpty());
    }
}
