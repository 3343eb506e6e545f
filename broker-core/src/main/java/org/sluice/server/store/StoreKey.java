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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered composite key made of string components.
 * <p>
 * Keys compare component by component, and a key sorts immediately before every key it is a prefix of, so all
 * the keys sharing a prefix form one contiguous range of a sorted table.
 */
public final class StoreKey implements Comparable<StoreKey>
{
    public static final StoreKey EMPTY = new StoreKey(Collections.<String>emptyList());

    private final List<String> _components;

    public StoreKey(String... components)
    {
        this(Arrays.asList(components));
    }

    public StoreKey(List<String> components)
    {
        for (String component : components)
        {
            if (component == null)
            {
                throw new IllegalArgumentException("Store key components cannot be null: " + components);
            }
        }
        _components = Collections.unmodifiableList(new ArrayList<String>(components));
    }

    public List<String> getComponents()
    {
        return _components;
    }

    public String getComponent(int index)
    {
        return _components.get(index);
    }

    public int size()
    {
        return _components.size();
    }

    public StoreKey append(String... components)
    {
        List<String> extended = new ArrayList<String>(_components);
        extended.addAll(Arrays.asList(components));
        return new StoreKey(extended);
    }

    public boolean startsWith(StoreKey prefix)
    {
        return prefix.size() <= size() && _components.subList(0, prefix.size()).equals(prefix._components);
    }

    @Override
    public int compareTo(StoreKey other)
    {
        int common = Math.min(size(), other.size());
        for (int i = 0; i < common; i++)
        {
            int result = _components.get(i).compareTo(other._components.get(i));
            if (result != 0)
            {
                return result;
            }
        }
        return size() - other.size();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }
        return _components.equals(((StoreKey) o)._components);
    }

    @Override
    public int hashCode()
    {
        return _components.hashCode();
    }

    @Override
    public String toString()
    {
        return _components.toString();
    }
}
