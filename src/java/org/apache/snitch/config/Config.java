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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Joiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.snitch.locator.BadnessComparison;

/**
 * A class that contains configuration properties for the endpoint snitch. Public fields are bound by name
 * to the keys of snitch.yaml.
 */
public class Config
{
    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    /** Address the local node is known by to its peers; defaults to the loopback address. */
    public String broadcast_address;
    public int storage_port = 7000;

    public String endpoint_snitch = "SimpleSnitch";
    public boolean dynamic_snitch = true;

    public DurationSpec.IntMillisecondsBound dynamic_snitch_reset_interval = new DurationSpec.IntMillisecondsBound("10m");
    public double dynamic_snitch_badness_threshold = 0.1;
    public BadnessComparison dynamic_snitch_badness_comparison = BadnessComparison.BEST;
    public double dynamic_snitch_decay_factor = 0.9;
    public int dynamic_snitch_minimum_samples = 1;

    public static void log(Config config)
    {
        Map<String, String> configMap = new TreeMap<>();
        for (Field field : Config.class.getFields())
        {
            // ignore the constants
            if (Modifier.isFinal(field.getModifiers()))
                continue;

            String name = field.getName();
            String value;
            try
            {
                // Field.get() can throw NPE if the value of the field is null
                value = field.get(config).toString();
            }
            catch (NullPointerException | IllegalAccessException npe)
            {
                value = "null";
            }
            configMap.put(name, value);
        }

        logger.info("Snitch configuration:[{}]", Joiner.on("; ").join(configMap.entrySet()));
    }
}
