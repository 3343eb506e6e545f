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

import org.sluice.AMQException;
import org.sluice.protocol.AMQConstant;
import org.sluice.server.model.ExchangeName;

/**
 * Thrown by a delete-if-unused of an exchange that still has bindings.
 */
public class ExchangeInUseException extends AMQException
{
    private final ExchangeName _exchangeName;

    public ExchangeInUseException(ExchangeName exchangeName)
    {
        super(AMQConstant.PRECONDITION_FAILED, exchangeName.getDescriptor() + " in use");
        _exchangeName = exchangeName;
    }

    public ExchangeName getExchangeName()
    {
        return _exchangeName;
    }
}
