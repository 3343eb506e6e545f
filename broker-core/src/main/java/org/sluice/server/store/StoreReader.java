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

import java.util.List;

public interface StoreReader
{
    /**
     * @return the value stored under the key, or null if there is none
     */
    <V> V read(StoreTable<V> table, StoreKey key);

    /**
     * Returns the records whose keys start with the given prefix, in key order.
     *
     * @param limit maximum number of records to return, or zero for no limit
     */
    <V> List<StoreRecord<V>> scan(StoreTable<V> table, StoreKey prefix, int limit);
}
