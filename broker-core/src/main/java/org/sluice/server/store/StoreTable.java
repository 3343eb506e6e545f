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
 * A named table of a {@link TransactionalStore}.
 * <p>
 * Durable tables are the only ones a persistent store writes to disk; every other table starts empty each time
 * the store is opened. Tables are identified by name.
 *
 * @param <V> the type of the values held in the table
 */
public final class StoreTable<V>
{
    private final String _name;
    private final Class<V> _valueClass;
    private final boolean _durable;

    public StoreTable(String name, Class<V> valueClass, boolean durable)
    {
        _name = name;
        _valueClass = valueClass;
        _durable = durable;
    }

    public String getName()
    {
        return _name;
    }

    public Class<V> getValueClass()
    {
        return _valueClass;
    }

    public boolean isDurable()
    {
        return _durable;
    }

    public V cast(Object value)
    {
        return _valueClass.cast(value);
    }

    @Override
    public boolean equals(Object o)
    {
        return this == o || (o instanceof StoreTable && _name.equals(((StoreTable<?>) o)._name));
    }

    @Override
    public int hashCode()
    {
        return _name.hashCode();
    }

    @Override
    public String toString()
    {
        return _name;
    }
}
