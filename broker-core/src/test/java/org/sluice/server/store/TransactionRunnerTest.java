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
package org.sluice.server.store;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.sluice.AMQException;
import org.sluice.protocol.AMQConstant;
import org.sluice.test.utils.SluiceTestCase;

public class TransactionRunnerTest extends SluiceTestCase
{
    private static final StoreTable<String> TABLE = new StoreTable<String>("test", String.class, false);

    private TransactionalStore _store;
    private StoreTransaction _txn;

    @Override
    public void setUp() throws Exception
    {
        super.setUp();
        _store = mock(TransactionalStore.class);
        _txn = mock(StoreTransaction.class);
        when(_store.beginTransaction()).thenReturn(_txn);
    }

    public void testWorkIsCommitted() throws Exception
    {
        TransactionRunner runner = new TransactionRunner(_store, 3, 0l);

        String result = runner.execute(new TransactionalWork<String>()
        {
            @Override
            public String execute(StoreTransaction txn)
            {
                txn.write(TABLE, new StoreKey("a"), "value");
                return "done";
            }
        });

        assertEquals("done", result);
        verify(_txn).write(TABLE, new StoreKey("a"), "value");
        verify(_txn).commit();
        verify(_txn, never()).abort();
    }

    public void testConflictIsRetried() throws Exception
    {
        doThrow(new TransactionConflictException("conflict"))
                .doThrow(new TransactionConflictException("conflict"))
                .doNothing()
                .when(_txn).commit();

        final int[] executions = new int[1];
        TransactionRunner runner = new TransactionRunner(_store, 3, 1l);
        runner.execute(new TransactionalWork<Void>()
        {
            @Override
            public Void execute(StoreTransaction txn)
            {
                executions[0]++;
                return null;
            }
        });

        assertEquals("Work should be re-run for every attempt", 3, executions[0]);
        verify(_store, times(3)).beginTransaction();
        verify(_txn, times(3)).commit();
        verify(_txn, times(2)).abort();
    }

    public void testExhaustedRetriesAreFatal() throws Exception
    {
        doThrow(new TransactionConflictException("conflict")).when(_txn).commit();

        TransactionRunner runner = new TransactionRunner(_store, 2, 0l);
        try
        {
            runner.execute(new TransactionalWork<Void>()
            {
                @Override
                public Void execute(StoreTransaction txn)
                {
                    return null;
                }
            });
            fail("Exception not thrown");
        }
        catch (StoreException e)
        {
            assertFalse("Exhaustion should not be reported as a retryable conflict",
                        e instanceof TransactionConflictException);
            assertTrue(e.getCause() instanceof TransactionConflictException);
        }
        verify(_store, times(2)).beginTransaction();
    }

    public void testFailedWorkIsAbortedAndNotRetried() throws Exception
    {
        final AMQException failure = new AMQException(AMQConstant.NOT_FOUND, "missing");
        TransactionRunner runner = new TransactionRunner(_store, 3, 0l);
        try
        {
            runner.execute(new TransactionalWork<Void>()
            {
                @Override
                public Void execute(StoreTransaction txn) throws AMQException
                {
                    txn.write(TABLE, new StoreKey("a"), "partial");
                    throw failure;
                }
            });
            fail("Exception not thrown");
        }
        catch (AMQException e)
        {
            assertSame(failure, e);
        }
        verify(_store, times(1)).beginTransaction();
        verify(_txn, never()).commit();
        verify(_txn).abort();
    }

    public void testRuntimeFailureIsAborted() throws Exception
    {
        TransactionRunner runner = new TransactionRunner(_store, 3, 0l);
        try
        {
            runner.execute(new TransactionalWork<Void>()
            {
                @Override
                public Void execute(StoreTransaction txn)
                {
                    throw new StoreException("broken");
                }
            });
            fail("Exception not thrown");
        }
        catch (StoreException e)
        {
            assertEquals("broken", e.getMessage());
        }
        verify(_txn, never()).commit();
        verify(_txn).abort();
    }

    public void testAbortFailureDoesNotHideCause() throws Exception
    {
        doThrow(new StoreException("abort failed")).when(_txn).abort();
        TransactionRunner runner = new TransactionRunner(_store, 3, 0l);
        try
        {
            runner.execute(new TransactionalWork<Void>()
            {
                @Override
                public Void execute(StoreTransaction txn) throws AMQException
                {
                    throw new AMQException(AMQConstant.NOT_ALLOWED, "not allowed");
                }
            });
            fail("Exception not thrown");
        }
        catch (AMQException e)
        {
            assertEquals(AMQConstant.NOT_ALLOWED, e.getErrorCode());
        }
    }

    public void testAtLeastOneAttemptRequired()
    {
        try
        {
            new TransactionRunner(_store, 0, 0l);
            fail("Exception not thrown");
        }
        catch (IllegalArgumentException e)
        {
            // pass
        }
    }

    public void testFailureAfterStaleReadIsRetried() throws Exception
    {
        when(_txn.isStale()).thenReturn(true);

        final int[] executions = new int[1];
        TransactionRunner runner = new TransactionRunner(_store, 3, 0l);
        String result = runner.execute(new TransactionalWork<String>()
        {
            @Override
            public String execute(StoreTransaction txn) throws AMQException
            {
                if (++executions[0] == 1)
                {
                    throw new StoreException("inconsistent read");
                }
                return "done";
            }
        });

        assertEquals("done", result);
        assertEquals(2, executions[0]);
        verify(_txn, times(1)).commit();
        verify(_txn, times(1)).abort();
    }

    public void testStaleReadsAgainstRealStoreAreRetried() throws Exception
    {
        final StoreTable<String> other = new StoreTable<String>("other", String.class, false);
        final MemoryTransactionalStore store = new MemoryTransactionalStore();
        store.open();
        try
        {
            StoreTransaction setup = store.beginTransaction();
            setup.write(TABLE, new StoreKey("ref"), "target");
            setup.write(other, new StoreKey("target"), "value");
            setup.commit();

            TransactionRunner runner = new TransactionRunner(store, 3, 0l);
            final int[] executions = new int[1];
            String result = runner.execute(new TransactionalWork<String>()
            {
                @Override
                public String execute(StoreTransaction txn)
                {
                    executions[0]++;
                    String ref = txn.read(TABLE, new StoreKey("ref"));
                    if (executions[0] == 1)
                    {
                        // a competing commit removes both records after only one of them has been read
                        StoreTransaction competing = store.beginTransaction();
                        competing.delete(TABLE, new StoreKey("ref"));
                        competing.delete(other, new StoreKey("target"));
                        competing.commit();
                        assertTrue(txn.isStale());
                    }
                    if (ref == null)
                    {
                        return "none";
                    }
                    String value = txn.read(other, new StoreKey(ref));
                    if (value == null)
                    {
                        throw new StoreException("Record " + ref + " is missing");
                    }
                    return value;
                }
            });

            assertEquals(2, executions[0]);
            assertEquals("none", result);
        }
        finally
        {
            store.close();
        }
    }

    public void testConflictsAgainstRealStoreAreResolved() throws Exception
    {
        final MemoryTransactionalStore store = new MemoryTransactionalStore();
        store.open();
        try
        {
            TransactionRunner runner = new TransactionRunner(store, 3, 0l);
            final int[] executions = new int[1];
            runner.execute(new TransactionalWork<Void>()
            {
                @Override
                public Void execute(StoreTransaction txn)
                {
                    executions[0]++;
                    String current = txn.read(TABLE, new StoreKey("counter"));
                    if (executions[0] == 1)
                    {
                        // a competing commit between our read and our commit
                        StoreTransaction competing = store.beginTransaction();
                        competing.write(TABLE, new StoreKey("counter"), "1");
                        competing.commit();
                    }
                    int value = current == null ? 0 : Integer.parseInt(current);
                    txn.write(TABLE, new StoreKey("counter"), String.valueOf(value + 1));
                    return null;
                }
            });

            assertEquals(2, executions[0]);
            assertEquals("2", store.read(TABLE, new StoreKey("counter")));
        }
        finally
        {
            store.close();
        }
    }
}
