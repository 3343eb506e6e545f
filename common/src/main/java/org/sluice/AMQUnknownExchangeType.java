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
package org.sluice;

import org.sluice.protocol.AMQConstant;

/**
 * Thrown when a client names an exchange type the broker does not implement.
 */
public class AMQUnknownExchangeType extends AMQException
{
    private final String _type;

    public AMQUnknownExchangeType(String type)
    {
        super(AMQConstant.COMMAND_INVALID, "invalid exchange type '" + type + "'");
        _type = type;
    }

    public String getType()
    {
        return _type;
    }
}
