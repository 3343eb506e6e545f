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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

/**
 * A {@link TransactionalStore} holding every table in memory.
 * <p>
 * Transactions are optimistic. A transaction buffers its writes and remembers the version of each table at the
 * time it first read from it. On commit the remembered versions are checked under the commit lock: if any table
 * the transaction read has since been changed by another commit, the transaction fails with a
 * {@link TransactionConflictException}; otherwise its writes are applied and the versions of the tables it
 * wrote are advanced. Committed transactions are therefore serializable.
 * <p>
 * Reads made before a conflict is detected may mix states from before and after a concurrent commit.
 * {@link StoreTransaction#isStale()} tells whether that can have happened.
 */
public class MemoryTransactionalStore implements TransactionalStore
{
    private static final Logger _logger = Logger.getLogger(MemoryTransactionalStore.class);

    private static final Object TOMBSTONE = new Object();

    private final ConcurrentMap<StoreTable<?>, TableData> _tables = new ConcurrentHashMap<StoreTable<?>, TableData>();
    private final Object _commitLock = new Object();
    private final AtomicLong _transactionIdGenerator = new AtomicLong();

    private volatile boolean _open;

    @Override
    public void open()
    {
        _open = true;
        _logger.info("Opened " + getClass().getSimpleName());
    }

    @Override
    public void close()
    {
        synchronized (_commitLock)
        {
            _open = false;
            _tables.clear();
        }
        _logger.info("Closed " + getClass().getSimpleName());
    }

    @Override
    public boolean isOpen()
    {
        return _open;
    }

    @Override
    public <V> V read(StoreTable<V> table, StoreKey key)
    {
        checkOpen();
        return table.cast(getTableData(table).getRecords().get(key));
    }

    @Override
    public <V> List<StoreRecord<V>> scan(StoreTable<V> table, StoreKey prefix, int limit)
    {
        checkOpen();
        List<StoreRecord<V>> records = new ArrayList<StoreRecord<V>>();
        for (Map.Entry<StoreKey, Object> entry : getTableData(table).getRecords().tailMap(prefix, true).entrySet())
        {
            if (!entry.getKey().startsWith(prefix) || (limit > 0 && records.size() >= limit))
            {
                break;
            }
            records.add(new StoreRecord<V>(entry.getKey(), table.cast(entry.getValue())));
        }
        return records;
    }

    @Override
    public StoreTransaction beginTransaction()
    {
        checkOpen();
        return new MemoryStoreTransaction(_transactionIdGenerator.incrementAndGet());
    }

    /**
     * Supplies the initial content of a table, the first time the table is used after the store is opened.
     */
    protected <V> Map<StoreKey, V> loadTable(StoreTable<V> table)
    {
        return Collections.emptyMap();
    }

    /**
     * Called under the commit lock once a transaction has been validated, before any of its writes are applied.
     * If this throws, the transaction is finished and none of its writes are applied.
     *
     * @param modifiedTables the tables the transaction wrote to
     * @param committedState the content every table will have once the writes are applied
     */
    protected void beforeApply(Set<StoreTable<?>> modifiedTables, StoreReader committedState)
    {
    }

    /**
     * @return the tables used since the store was opened
     */
    protected Set<StoreTable<?>> getTables()
    {
        return Collections.unmodifiableSet(_tables.keySet());
    }

    private TableData getTableData(StoreTable<?> table)
    {
        TableData data = _tables.get(table);
        if (data == null)
        {
            synchronized (_tables)
            {
                data = _tables.get(table);
                if (data == null)
                {
                    data = new TableData();
                    data.getRecords().putAll(loadTable(table));
                    _tables.put(table, data);
                }
            }
        }
        return data;
    }

    private void checkOpen()
    {
        if (!_open)
        {
            throw new StoreException("Store is not open");
        }
    }

    private static final class TableData
    {
        private final ConcurrentSkipListMap<StoreKey, Object> _records = new ConcurrentSkipListMap<StoreKey, Object>();
        private final AtomicLong _version = new AtomicLong();

        ConcurrentSkipListMap<StoreKey, Object> getRecords()
        {
            return _records;
        }

        AtomicLong getVersion()
        {
            return _version;
        }
    }

    private final class MemoryStoreTransaction implements StoreTransaction
    {
        private final long _id;
        private final Map<StoreTable<?>, Long> _readVersions = new HashMap<StoreTable<?>, Long>();
        private final Map<StoreTable<?>, TreeMap<StoreKey, Object>> _pendingWrites =
                new LinkedHashMap<StoreTable<?>, TreeMap<StoreKey, Object>>();
        private boolean _complete;

        private MemoryStoreTransaction(long id)
        {
            _id = id;
        }

        @Override
        public <V> V read(StoreTable<V> table, StoreKey key)
        {
            checkActive();
            return readThrough(table, key, true);
        }

        @Override
        public <V> List<StoreRecord<V>> scan(StoreTable<V> table, StoreKey prefix, int limit)
        {
            checkActive();
            return scanThrough(table, prefix, limit, recordRead(table));
        }

        private <V> V readThrough(StoreTable<V> table, StoreKey key, boolean trackRead)
        {
            TreeMap<StoreKey, Object> pending = _pendingWrites.get(table);
            if (pending != null && pending.containsKey(key))
            {
                Object value = pending.get(key);
                return value == TOMBSTONE ? null : table.cast(value);
            }
            TableData data = trackRead ? recordRead(table) : getTableData(table);
            return table.cast(data.getRecords().get(key));
        }

        private <V> List<StoreRecord<V>> scanThrough(StoreTable<V> table, StoreKey prefix, int limit, TableData data)
        {
            TreeMap<StoreKey, Object> pending = _pendingWrites.get(table);

            Iterator<Map.Entry<StoreKey, Object>> committedIterator =
                    data.getRecords().tailMap(prefix, true).entrySet().iterator();
            NavigableMap<StoreKey, Object> pendingRange =
                    pending == null ? new TreeMap<StoreKey, Object>() : pending.tailMap(prefix, true);
            Iterator<Map.Entry<StoreKey, Object>> pendingIterator = pendingRange.entrySet().iterator();

            Map.Entry<StoreKey, Object> committed = nextWithin(committedIterator, prefix);
            Map.Entry<StoreKey, Object> written = nextWithin(pendingIterator, prefix);

            List<StoreRecord<V>> records = new ArrayList<StoreRecord<V>>();
            while ((committed != null || written != null) && (limit <= 0 || records.size() < limit))
            {
                int order = committed == null ? 1 : written == null ? -1 : committed.getKey().compareTo(written.getKey());
                if (order < 0)
                {
                    records.add(new StoreRecord<V>(committed.getKey(), table.cast(committed.getValue())));
                    committed = nextWithin(committedIterator, prefix);
                }
                else
                {
                    if (written.getValue() != TOMBSTONE)
                    {
                        records.add(new StoreRecord<V>(written.getKey(), table.cast(written.getValue())));
                    }
                    if (order == 0)
                    {
                        committed = nextWithin(committedIterator, prefix);
                    }
                    written = nextWithin(pendingIterator, prefix);
                }
            }
            return records;
        }

        @Override
        public <V> void write(StoreTable<V> table, StoreKey key, V value)
        {
            checkActive();
            if (value == null)
            {
                throw new IllegalArgumentException("Cannot write null value to " + table + " under " + key);
            }
            getPendingWrites(table).put(key, table.cast(value));
        }

        @Override
        public void delete(StoreTable<?> table, StoreKey key)
        {
            checkActive();
            getPendingWrites(table).put(key, TOMBSTONE);
        }

        @Override
        public boolean isStale()
        {
            return _open && getChangedTable() != null;
        }

        @Override
        public void commit()
        {
            checkActive();
            synchronized (_commitLock)
            {
                _complete = true;
                checkOpen();
                StoreTable<?> changedTable = getChangedTable();
                if (changedTable != null)
                {
                    throw new TransactionConflictException("Transaction " + _id + " read table '" + changedTable
                                                           + "' which a concurrent transaction has changed");
                }

                if (!_pendingWrites.isEmpty())
                {
                    for (StoreTable<?> table : _pendingWrites.keySet())
                    {
                        getTableData(table);
                    }
                    beforeApply(Collections.unmodifiableSet(_pendingWrites.keySet()), new CommittedState());
                }

                Set<StoreTable<?>> modifiedTables = new LinkedHashSet<StoreTable<?>>();
                for (Map.Entry<StoreTable<?>, TreeMap<StoreKey, Object>> tableWrites : _pendingWrites.entrySet())
                {
                    TableData data = getTableData(tableWrites.getKey());
                    for (Map.Entry<StoreKey, Object> write : tableWrites.getValue().entrySet())
                    {
                        if (write.getValue() == TOMBSTONE)
                        {
                            data.getRecords().remove(write.getKey());
                        }
                        else
                        {
                            data.getRecords().put(write.getKey(), write.getValue());
                        }
                    }
                    // advanced only after the writes are in place, so a reader that saw part of them will conflict
                    data.getVersion().incrementAndGet();
                    modifiedTables.add(tableWrites.getKey());
                }

                if (_logger.isDebugEnabled())
                {
                    _logger.debug("Committed transaction " + _id + " modifying " + modifiedTables);
                }
            }
            _pendingWrites.clear();
        }

        @Override
        public void abort()
        {
            if (!_complete)
            {
                _complete = true;
                _pendingWrites.clear();
                if (_logger.isDebugEnabled())
                {
                    _logger.debug("Aborted transaction " + _id);
                }
            }
        }

        private StoreTable<?> getChangedTable()
        {
            for (Map.Entry<StoreTable<?>, Long> readVersion : _readVersions.entrySet())
            {
                if (getTableData(readVersion.getKey()).getVersion().get() != readVersion.getValue())
                {
                    return readVersion.getKey();
                }
            }
            return null;
        }

        private TableData recordRead(StoreTable<?> table)
        {
            TableData data = getTableData(table);
            if (!_readVersions.containsKey(table))
            {
                _readVersions.put(table, data.getVersion().get());
            }
            return data;
        }

        private TreeMap<StoreKey, Object> getPendingWrites(StoreTable<?> table)
        {
            TreeMap<StoreKey, Object> pending = _pendingWrites.get(table);
            if (pending == null)
            {
                pending = new TreeMap<StoreKey, Object>();
                _pendingWrites.put(table, pending);
            }
            return pending;
        }

        private void checkActive()
        {
            if (_complete)
            {
                throw new StoreException("Transaction " + _id + " is already complete");
            }
        }

        private Map.Entry<StoreKey, Object> nextWithin(Iterator<Map.Entry<StoreKey, Object>> iterator,
                                                       StoreKey prefix)
        {
            if (iterator.hasNext())
            {
                Map.Entry<StoreKey, Object> entry = iterator.next();
                if (entry.getKey().startsWith(prefix))
                {
                    return entry;
                }
            }
            return null;
        }

        /**
         * The committed records overlaid with the writes of this transaction, read without tracking.
         */
        private final class CommittedState implements StoreReader
        {
            @Override
            public <V> V read(StoreTable<V> table, StoreKey key)
            {
                return readThrough(table, key, false);
            }

            @Override
            public <V> List<StoreRecord<V>> scan(StoreTable<V> table, StoreKey prefix, int limit)
            {
                return scanThrough(table, prefix, limit, getTableData(table));
            }
        }
    }
}
