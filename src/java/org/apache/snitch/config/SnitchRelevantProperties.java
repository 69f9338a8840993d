/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.snitch.config;

import java.util.HashSet;
import java.util.Set;

import org.apache.snitch.exceptions.ConfigurationException;

// checkstyle: suppress below 'blockSystemPropertyUsage'

/** A class that extracts system properties for the process the snitch runs within. */
public enum SnitchRelevantProperties
{
    /** The classpath resource or URL of the snitch configuration file. */
    CONFIG("snitch.config", "snitch.yaml"),
    /** Fully qualified name of a {@link ConfigurationLoader} to use instead of {@link YamlConfigurationLoader}. */
    CONFIG_LOADER("snitch.config.loader"),
    /** Interval, in milliseconds, between two dropped-sample warnings of the same snitch. */
    DROPPED_SAMPLE_LOG_INTERVAL_MS("snitch.dropped_sample_log_interval_ms", "60000");

    static
    {
        SnitchRelevantProperties[] values = SnitchRelevantProperties.values();
        Set<String> visited = new HashSet<>(values.length);
        SnitchRelevantProperties prev = null;
        for (SnitchRelevantProperties next : values)
        {
            if (!visited.add(next.getKey()))
                throw new IllegalStateException("System properties have duplicate key: " + next.getKey());
            if (prev != null && next.name().compareTo(prev.name()) < 0)
                throw new IllegalStateException("Enum constants are not in alphabetical order: " + prev.name() + " should come before " + next.name());
            else
                prev = next;
        }
    }

    SnitchRelevantProperties(String key, String defaultVal)
    {
        this.key = key;
        this.defaultVal = defaultVal;
    }

    SnitchRelevantProperties(String key)
    {
        this.key = key;
        this.defaultVal = null;
    }

    private final String key;
    private final String defaultVal;

    public String getKey()
    {
        return key;
    }

    /**
     * Gets the value of the indicated system property.
     * @return system property value if it exists, defaultValue otherwise.
     */
    public String getString()
    {
        String value = System.getProperty(key);

        return value == null ? defaultVal : value.trim();
    }

    /**
     * Returns default value.
     *
     * @return default value, if any, otherwise null.
     */
    public String getDefaultValue()
    {
        return defaultVal;
    }

    /**
     * Sets the value into system properties.
     * @param value to set
     */
    public String setString(String value)
    {
        return System.setProperty(key, value);
    }

    /**
     * Gets the value of a system property as a long.
     * @return System property value if it exists, defaultValue otherwise. Throws an exception if no default value is set.
     */
    public long getLong()
    {
        String value = System.getProperty(key);
        if (value == null && defaultVal == null)
            throw new ConfigurationException("Missing property value or default value is not set: " + key);
        try
        {
            return Long.parseLong((value == null ? defaultVal : value).trim());
        }
        catch (NumberFormatException e)
        {
            throw new ConfigurationException(String.format("Invalid value for system property %s: expected a long value but got '%s'", key, value));
        }
    }

    /**
     * Clears the value set in the system property.
     */
    public void clearValue()
    {
        System.clearProperty(key);
    }
}
