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

/**
 * A unit of work against a {@link TransactionalStore}.
 * <p>
 * Reads made through a transaction see the writes and deletes already made by it. Nothing becomes visible to
 * other readers until {@link #commit()} succeeds, and then everything does.
 */
public interface StoreTransaction extends StoreReader
{
    <V> void write(StoreTable<V> table, StoreKey key, V value);

    void delete(StoreTable<?> table, StoreKey key);

    /**
     * @throws TransactionConflictException if a concurrent transaction invalidated what this one read; the
     *         transaction is finished and the whole unit of work may be re-run
     * @throws StoreException if the store cannot apply the transaction
     */
    void commit();

    void abort();

    /**
     * @return true if a concurrent commit has changed a table this transaction has read from, so that what it
     *         read may be inconsistent and its commit would fail with a {@link TransactionConflictException}
     */
    boolean isStale();
}
