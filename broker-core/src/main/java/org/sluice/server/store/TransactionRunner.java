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

import java.util.Random;

import org.apache.log4j.Logger;

import org.sluice.AMQException;

/**
 * Runs units of work inside store transactions.
 * <p>
 * Every unit of work runs in exactly one transaction, which is committed if the work returns normally and
 * aborted if it throws. When the commit fails with a {@link TransactionConflictException} the whole unit of work
 * is run again in a fresh transaction, after a randomised pause, until it commits or the configured number of
 * attempts is used up. Work that fails in a transaction which has become stale is treated as a conflict too, as
 * the failure may come from an inconsistent read.
 */
public class TransactionRunner
{
    private static final Logger _logger = Logger.getLogger(TransactionRunner.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final long DEFAULT_RETRY_DELAY = 20l;

    private final TransactionalStore _store;
    private final int _maxAttempts;
    private final long _retryDelay;
    private final Random _random = new Random();

    public TransactionRunner(TransactionalStore store)
    {
        this(store, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY);
    }

    public TransactionRunner(TransactionalStore store, int maxAttempts, long retryDelay)
    {
        if (maxAttempts < 1)
        {
            throw new IllegalArgumentException("At least one attempt is required, got " + maxAttempts);
        }
        _store = store;
        _maxAttempts = maxAttempts;
        _retryDelay = retryDelay;
    }

    public TransactionalStore getStore()
    {
        return _store;
    }

    public <T> T execute(TransactionalWork<T> work) throws AMQException
    {
        int attempts = 0;
        while (true)
        {
            StoreTransaction txn = _store.beginTransaction();
            TransactionConflictException conflict;
            try
            {
                T result = work.execute(txn);
                txn.commit();
                txn = null;
                return result;
            }
            catch (TransactionConflictException e)
            {
                conflict = e;
            }
            catch (AMQException e)
            {
                if (!txn.isStale())
                {
                    throw e;
                }
                conflict = staleRead(e);
            }
            catch (RuntimeException e)
            {
                if (!txn.isStale())
                {
                    throw e;
                }
                conflict = staleRead(e);
            }
            finally
            {
                abortSafely(txn);
            }

            if (++attempts >= _maxAttempts)
            {
                // rethrow since we could not solve the conflict by retrying
                throw new StoreException("Unable to commit transaction after " + attempts + " attempts", conflict);
            }
            _logger.warn("Transaction conflict. Retrying (attempt " + (attempts + 1) + " of "
                         + _maxAttempts + ") " + conflict.getMessage());
            pause();
        }
    }

    private TransactionConflictException staleRead(Exception cause)
    {
        return new TransactionConflictException("Work failed after a concurrent transaction changed what it read: "
                                                + cause.getMessage(), cause);
    }

    private void pause()
    {
        if (_retryDelay > 0)
        {
            try
            {
                Thread.sleep(_retryDelay + (long) (_retryDelay * _random.nextDouble()));
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                throw new StoreException("Interrupted while waiting to retry transaction", e);
            }
        }
    }

    private StoreTransaction abortSafely(StoreTransaction txn)
    {
        if (txn != null)
        {
            try
            {
                txn.abort();
            }
            catch (RuntimeException e)
            {
                _logger.warn("Unable to abort transaction", e);
            }
        }
        return null;
    }
}
