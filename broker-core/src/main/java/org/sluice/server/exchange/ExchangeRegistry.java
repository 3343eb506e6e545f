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
package org.sluice.server.exchange;

import java.util.Collection;
import java.util.Map;

import org.sluice.AMQException;
import org.sluice.AMQUnknownExchangeType;
import org.sluice.server.model.ExchangeName;
import org.sluice.server.store.StoreReader;
import org.sluice.server.store.StoreTransaction;

public interface ExchangeRegistry
{
    /**
     * Replays the durable exchanges and bindings into the live tables. Must be run once when the broker starts,
     * before any other operation.
     *
     * @throws org.sluice.server.store.StoreException if the replay cannot be committed
     */
    void recover();

    /**
     * Declares an exchange. If an exchange of that name already exists it is returned unchanged, whatever
     * type, durability or arguments were asked for.
     */
    Exchange declare(ExchangeName name, ExchangeType type, boolean durable, boolean autoDelete,
                     Map<String, Object> arguments) throws AMQException;

    /**
     * @return the exchange, or null if there is none of that name
     */
    Exchange lookup(ExchangeName name);

    Exchange lookupOrDie(ExchangeName name) throws ExchangeNotFoundException;

    Collection<Exchange> listForVirtualHost(String virtualHost);

    ExchangeType checkType(String typeName) throws AMQUnknownExchangeType;

    void assertType(Exchange exchange, ExchangeType requiredType) throws ExchangeTypeMismatchException;

    /**
     * Unregister an exchange, together with all its bindings.
     * @param name name of the exchange to delete
     * @param ifUnused if true, do NOT delete the exchange if it is in use (has queues bound to it)
     * @throws ExchangeNotFoundException if there is no such exchange
     * @throws ExchangeInUseException if ifUnused is set and the exchange has bindings
     */
    void delete(ExchangeName name, boolean ifUnused) throws AMQException;

    /**
     * Reads an exchange as part of a larger unit of work.
     */
    Exchange getExchange(StoreReader reader, ExchangeName name);

    /**
     * Deletes the exchange and its bindings as part of a larger unit of work.
     */
    void unconditionalDelete(StoreTransaction txn, Exchange exchange);

    /**
     * Deletes the exchange as part of a larger unit of work, provided it has no bindings.
     *
     * @return true if the exchange was deleted
     */
    boolean conditionalDelete(StoreTransaction txn, Exchange exchange);
}
