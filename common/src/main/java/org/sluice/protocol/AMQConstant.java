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
package org.sluice.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * Reply codes defined by AMQP 0-9-1, used to tag exceptions raised by the broker so the
 * protocol layer can translate them into channel or connection errors.
 */
public final class AMQConstant
{
    private static final Map<Integer, AMQConstant> _codeMap = new HashMap<Integer, AMQConstant>();

    private final int _code;

    private final String _name;

    private AMQConstant(int code, String name, boolean map)
    {
        _code = code;
        _name = name;
        if (map)
        {
            _codeMap.put(code, this);
        }
    }

    public String toString()
    {
        return _code + ": " + _name;
    }

    public int getCode()
    {
        return _code;
    }

    public String getName()
    {
        return _name;
    }

    public static final AMQConstant REPLY_SUCCESS = new AMQConstant(200, "reply success", true);

    public static final AMQConstant NO_ROUTE = new AMQConstant(312, "no route", true);

    public static final AMQConstant NO_CONSUMERS = new AMQConstant(313, "no consumers", true);

    public static final AMQConstant ACCESS_REFUSED = new AMQConstant(403, "access refused", true);

    public static final AMQConstant NOT_FOUND = new AMQConstant(404, "not found", true);

    public static final AMQConstant RESOURCE_LOCKED = new AMQConstant(405, "resource locked", true);

    public static final AMQConstant PRECONDITION_FAILED = new AMQConstant(406, "precondition failed", true);

    public static final AMQConstant COMMAND_INVALID = new AMQConstant(503, "command invalid", true);

    public static final AMQConstant NOT_ALLOWED = new AMQConstant(530, "not allowed", true);

    public static final AMQConstant NOT_IMPLEMENTED = new AMQConstant(540, "not implemented", true);

    public static final AMQConstant INTERNAL_ERROR = new AMQConstant(541, "internal error", true);

    public static AMQConstant getConstant(int code)
    {
        AMQConstant c = _codeMap.get(code);
        if (c == null)
        {
            c = new AMQConstant(code, "unknown code", false);
        }
        return c;
    }
}
