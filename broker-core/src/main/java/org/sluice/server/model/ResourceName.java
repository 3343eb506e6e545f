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
package org.sluice.server.model;

import org.codehaus.jackson.annotate.JsonIgnore;

/**
 * The name of a broker resource: a name which is unique within its kind and virtual host.
 */
public abstract class ResourceName
{
    public enum Kind
    {
        EXCHANGE("exchange"),
        QUEUE("queue");

        private final String _displayName;

        Kind(String displayName)
        {
            _displayName = displayName;
        }

        public String getDisplayName()
        {
            return _displayName;
        }
    }

    private final Kind _kind;
    private final String _virtualHost;
    private final String _name;

    protected ResourceName(Kind kind, String virtualHost, String name)
    {
        if (virtualHost == null || name == null)
        {
            throw new IllegalArgumentException("Virtual host and name of " + kind.getDisplayName()
                                               + " must be supplied");
        }
        _kind = kind;
        _virtualHost = virtualHost;
        _name = name;
    }

    @JsonIgnore
    public final Kind getKind()
    {
        return _kind;
    }

    public String getVirtualHost()
    {
        return _virtualHost;
    }

    public String getName()
    {
        return _name;
    }

    /**
     * @return a human readable description of the resource, such as {@code exchange 'logs' in vhost '/'}
     */
    @JsonIgnore
    public String getDescriptor()
    {
        return _kind.getDisplayName() + " '" + _name + "' in vhost '" + _virtualHost + "'";
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
        ResourceName that = (ResourceName) o;
        return _virtualHost.equals(that._virtualHost) && _name.equals(that._name);
    }

    @Override
    public int hashCode()
    {
        return 31 * _virtualHost.hashCode() + _name.hashCode();
    }

    @Override
    public String toString()
    {
        return getDescriptor();
    }
}
