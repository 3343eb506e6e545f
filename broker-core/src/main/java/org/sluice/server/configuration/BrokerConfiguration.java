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
package org.sluice.server.configuration;

import java.io.File;

import org.apache.commons.configuration.BaseConfiguration;
import org.apache.commons.configuration.Configuration;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.ConversionException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.log4j.Logger;

import org.sluice.server.store.TransactionRunner;

/**
 * Broker settings, read from any Commons Configuration source.
 */
public class BrokerConfiguration
{
    private static final Logger _logger = Logger.getLogger(BrokerConfiguration.class);

    public static final String STORE_TYPE = "store.type";
    public static final String STORE_PATH = "store.path";
    public static final String TRANSACTION_MAX_ATTEMPTS = "store.transaction.maxAttempts";
    public static final String TRANSACTION_RETRY_DELAY = "store.transaction.retryDelay";

    public static final String MEMORY_STORE_TYPE = "memory";
    public static final String JSON_STORE_TYPE = "json";

    private final Configuration _config;

    public BrokerConfiguration()
    {
        this(new BaseConfiguration());
    }

    public BrokerConfiguration(Configuration config)
    {
        if (config == null)
        {
            throw new IllegalConfigurationException("Configuration must be supplied");
        }
        _config = config;
    }

    public BrokerConfiguration(File configurationFile) throws ConfigurationException
    {
        this(loadConfiguration(configurationFile));
    }

    private static Configuration loadConfiguration(File configurationFile) throws ConfigurationException
    {
        if (configurationFile == null)
        {
            throw new IllegalConfigurationException("Broker configuration file must be supplied!");
        }
        _logger.info("Loading broker configuration from " + configurationFile.getAbsolutePath());
        return new PropertiesConfiguration(configurationFile);
    }

    public Configuration getConfig()
    {
        return _config;
    }

    /**
     * @return {@value #MEMORY_STORE_TYPE} or {@value #JSON_STORE_TYPE}
     */
    public String getStoreType()
    {
        String storeType = getStringValue(STORE_TYPE, MEMORY_STORE_TYPE).trim().toLowerCase();
        if (!MEMORY_STORE_TYPE.equals(storeType) && !JSON_STORE_TYPE.equals(storeType))
        {
            throw new IllegalConfigurationException("Unknown store type '" + storeType + "' in " + STORE_TYPE
                                                    + ", expected '" + MEMORY_STORE_TYPE + "' or '"
                                                    + JSON_STORE_TYPE + "'");
        }
        return storeType;
    }

    public String getStorePath()
    {
        return getStringValue(STORE_PATH, null);
    }

    public int getTransactionMaxAttempts()
    {
        int maxAttempts = getIntValue(TRANSACTION_MAX_ATTEMPTS, TransactionRunner.DEFAULT_MAX_ATTEMPTS);
        if (maxAttempts < 1)
        {
            throw new IllegalConfigurationException("'" + TRANSACTION_MAX_ATTEMPTS
                                                    + "' must be a positive integer, was " + maxAttempts);
        }
        return maxAttempts;
    }

    public long getTransactionRetryDelay()
    {
        long retryDelay = getLongValue(TRANSACTION_RETRY_DELAY, TransactionRunner.DEFAULT_RETRY_DELAY);
        if (retryDelay < 0)
        {
            throw new IllegalConfigurationException("'" + TRANSACTION_RETRY_DELAY
                                                    + "' must not be negative, was " + retryDelay);
        }
        return retryDelay;
    }

    protected String getStringValue(String property, String defaultValue)
    {
        return _config.getString(property, defaultValue);
    }

    protected int getIntValue(String property, int defaultValue)
    {
        try
        {
            return _config.getInt(property, defaultValue);
        }
        catch (ConversionException e)
        {
            throw invalidValue(property, e);
        }
    }

    protected long getLongValue(String property, long defaultValue)
    {
        try
        {
            return _config.getLong(property, defaultValue);
        }
        catch (ConversionException e)
        {
            throw invalidValue(property, e);
        }
    }

    private IllegalConfigurationException invalidValue(String property, ConversionException e)
    {
        return new IllegalConfigurationException(getClass().getSimpleName() + ": unable to configure invalid "
                                                 + property + ":" + _config.getString(property), e);
    }
}
