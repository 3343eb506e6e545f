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

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.log4j.Logger;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.map.SerializationConfig;

/**
 * A {@link MemoryTransactionalStore} which keeps its durable tables in a JSON file.
 * <p>
 * Each commit that touches a durable table rewrites the file before the commit is applied in memory, so a commit
 * whose file cannot be written changes nothing. The new content goes to a temporary file, the current file is
 * renamed to the backup name, then the temporary file takes its place. On open, a missing store
 * file is restored from the backup if there is one. Tables that are not durable are never written, so they are
 * empty every time the store is opened.
 */
public class JsonFileTransactionalStore extends MemoryTransactionalStore
{
    private static final Logger _logger = Logger.getLogger(JsonFileTransactionalStore.class);

    public static final String DEFAULT_FILE_NAME = "routing";

    private static final String KEY = "key";
    private static final String VALUE = "value";

    private final ObjectMapper _objectMapper = new ObjectMapper();
    private final String _storePath;

    /** Raw records read from the file, by table name. */
    private final Map<String, List<Map<String, Object>>> _storedTables =
            new ConcurrentHashMap<String, List<Map<String, Object>>>();

    private String _directoryName;
    private String _storeFileName;
    private String _backupFileName;
    private String _lockFileName;
    private FileLock _fileLock;

    public JsonFileTransactionalStore(String storePath)
    {
        _storePath = storePath;
        _objectMapper.enable(SerializationConfig.Feature.INDENT_OUTPUT);
    }

    @Override
    public void open()
    {
        setup();
        load();
        super.open();
    }

    @Override
    public void close()
    {
        try
        {
            super.close();
        }
        finally
        {
            try
            {
                releaseFileLock();
            }
            finally
            {
                _storedTables.clear();
            }
        }
    }

    public File getStoreFile()
    {
        return _directoryName == null ? null : new File(_directoryName, _storeFileName);
    }

    @Override
    protected <V> Map<StoreKey, V> loadTable(StoreTable<V> table)
    {
        List<Map<String, Object>> records = _storedTables.get(table.getName());
        if (!table.isDurable() || records == null)
        {
            return Collections.emptyMap();
        }

        Map<StoreKey, V> loaded = new LinkedHashMap<StoreKey, V>();
        for (Map<String, Object> record : records)
        {
            @SuppressWarnings("unchecked")
            List<String> keyComponents = (List<String>) record.get(KEY);
            try
            {
                loaded.put(new StoreKey(keyComponents), _objectMapper.convertValue(record.get(VALUE), table.getValueClass()));
            }
            catch (IllegalArgumentException e)
            {
                throw new StoreException("Cannot read record " + keyComponents + " of table '" + table + "' from "
                                         + getStoreFile(), e);
            }
        }

        if (_logger.isDebugEnabled())
        {
            _logger.debug("Loaded " + loaded.size() + " records into table '" + table + "'");
        }
        return loaded;
    }

    @Override
    protected void beforeApply(Set<StoreTable<?>> modifiedTables, StoreReader committedState)
    {
        for (StoreTable<?> table : modifiedTables)
        {
            if (table.isDurable())
            {
                save(committedState);
                return;
            }
        }
    }

    private void save(StoreReader committedState)
    {
        Map<String, Object> data = new TreeMap<String, Object>(_storedTables);
        for (StoreTable<?> table : getTables())
        {
            if (table.isDurable())
            {
                data.put(table.getName(), toJsonRecords(committedState, table));
            }
        }

        try
        {
            File tmpFile = File.createTempFile("routing", "tmp", new File(_directoryName));
            tmpFile.deleteOnExit();
            _objectMapper.writeValue(tmpFile, data);
            renameFile(_storeFileName, _backupFileName);
            renameFile(tmpFile.getName(), _storeFileName);
            tmpFile.delete();
            File backupFile = new File(_directoryName, _backupFileName);
            backupFile.delete();
        }
        catch (IOException e)
        {
            throw new StoreException("Cannot save to store", e);
        }
    }

    private <V> List<Map<String, Object>> toJsonRecords(StoreReader reader, StoreTable<V> table)
    {
        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>();
        for (StoreRecord<V> record : reader.scan(table, StoreKey.EMPTY, 0))
        {
            Map<String, Object> jsonRecord = new LinkedHashMap<String, Object>();
            jsonRecord.put(KEY, record.getKey().getComponents());
            jsonRecord.put(VALUE, record.getValue());
            records.add(jsonRecord);
        }
        return records;
    }

    @SuppressWarnings("unchecked")
    private void load()
    {
        File storeFile = getStoreFile();
        try
        {
            Map<String, List<Map<String, Object>>> data = _objectMapper.readValue(storeFile, Map.class);
            if (data != null)
            {
                _storedTables.putAll(data);
            }
        }
        catch (IOException e)
        {
            releaseFileLock();
            throw new StoreException("Cannot parse the routing store file " + storeFile, e);
        }
        _logger.info("Loaded durable tables " + _storedTables.keySet() + " from " + storeFile);
    }

    private void setup()
    {
        if (_storePath == null)
        {
            throw new StoreException("Cannot determine path for routing storage");
        }
        File fileFromSettings = new File(_storePath).getAbsoluteFile();
        if (fileFromSettings.isFile()
            || (!fileFromSettings.exists() && fileFromSettings.getParentFile() != null
                && fileFromSettings.getParentFile().isDirectory()))
        {
            _directoryName = fileFromSettings.getParent();
            _storeFileName = fileFromSettings.getName();
            _backupFileName = fileFromSettings.getName() + ".bak";
            _lockFileName = fileFromSettings.getName() + ".lck";
        }
        else
        {
            _directoryName = fileFromSettings.getPath();
            _storeFileName = DEFAULT_FILE_NAME + ".json";
            _backupFileName = DEFAULT_FILE_NAME + ".bak";
            _lockFileName = DEFAULT_FILE_NAME + ".lck";
        }

        checkDirectoryIsWritable(_directoryName);
        getFileLock();

        if (!fileExists(_storeFileName))
        {
            if (!fileExists(_backupFileName))
            {
                File newFile = new File(_directoryName, _storeFileName);
                try
                {
                    _objectMapper.writeValue(newFile, Collections.emptyMap());
                }
                catch (IOException e)
                {
                    releaseFileLock();
                    throw new StoreException("Could not write routing store file " + newFile, e);
                }
            }
            else
            {
                _logger.warn("Routing store file is missing, restoring it from " + _backupFileName);
                renameFile(_backupFileName, _storeFileName);
            }
        }
    }

    private void renameFile(String fromFileName, String toFileName)
    {
        File toFile = new File(_directoryName, toFileName);
        if (toFile.exists())
        {
            if (!toFile.delete())
            {
                throw new StoreException("Cannot delete file " + toFile.getAbsolutePath());
            }
        }
        File fromFile = new File(_directoryName, fromFileName);

        if (!fromFile.renameTo(toFile))
        {
            throw new StoreException("Cannot rename file " + fromFile.getAbsolutePath() + " to " + toFile.getAbsolutePath());
        }
    }

    private boolean fileExists(String fileName)
    {
        File file = new File(_directoryName, fileName);
        return file.exists();
    }

    private void getFileLock()
    {
        File lockFile = new File(_directoryName, _lockFileName);
        FileOutputStream out = null;
        try
        {
            lockFile.createNewFile();
            lockFile.deleteOnExit();

            out = new FileOutputStream(lockFile);
            FileChannel channel = out.getChannel();
            _fileLock = channel.tryLock();
        }
        catch (IOException ioe)
        {
            throw new StoreException("Cannot create the lock file " + lockFile.getName(), ioe);
        }
        catch (OverlappingFileLockException e)
        {
            _fileLock = null;
        }

        if (_fileLock == null)
        {
            closeQuietly(out);
            throw new StoreException("Cannot get lock on file " + lockFile.getAbsolutePath() + ". Is another instance running?");
        }
    }

    private void releaseFileLock()
    {
        if (_fileLock != null)
        {
            try
            {
                _fileLock.release();
                _fileLock.channel().close();
            }
            catch (IOException e)
            {
                throw new StoreException("Failed to release lock " + _fileLock, e);
            }
            finally
            {
                _fileLock = null;
            }
        }
    }

    private void closeQuietly(FileOutputStream out)
    {
        if (out != null)
        {
            try
            {
                out.close();
            }
            catch (IOException e)
            {
                _logger.warn("Failed to close lock file stream", e);
            }
        }
    }

    private void checkDirectoryIsWritable(String directoryName)
    {
        File dir = new File(directoryName);
        if (dir.exists())
        {
            if (dir.isDirectory())
            {
                if (!dir.canWrite())
                {
                    throw new StoreException("Store path " + directoryName + " exists, but is not writable");
                }
            }
            else
            {
                throw new StoreException("Store path " + directoryName + " exists, but is not a directory");
            }
        }
        else if (!dir.mkdirs())
        {
            throw new StoreException("Cannot create directory " + directoryName);
        }
    }
}
