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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.snitch.exceptions.ConfigurationException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.CustomClassLoaderConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.MissingProperty;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import static org.apache.snitch.config.SnitchRelevantProperties.CONFIG;

public class YamlConfigurationLoader implements ConfigurationLoader
{
    private static final Logger logger = LoggerFactory.getLogger(YamlConfigurationLoader.class);

    /**
     * Inspect the classpath to find the snitch configuration file
     */
    @VisibleForTesting
    static URL getConfigURL() throws ConfigurationException
    {
        String configUrl = CONFIG.getString();

        URL url;
        try
        {
            url = new URL(configUrl);
            url.openStream().close(); // catches well-formed but bogus URLs
        }
        catch (Exception e)
        {
            ClassLoader loader = YamlConfigurationLoader.class.getClassLoader();
            url = loader.getResource(configUrl);
            if (url == null)
                throw new ConfigurationException(String.format("Cannot locate %s. If this is a local file, please prefix it with [file:///] " +
                                                               "or make it available on the classpath; the location is read from the " +
                                                               "system property [%s].", configUrl, CONFIG.getKey()), false);
        }

        logger.info("Configuration location: {}", url);

        return url;
    }

    @Override
    public Config loadConfig() throws ConfigurationException
    {
        return loadConfig(getConfigURL());
    }

    public Config loadConfig(URL url) throws ConfigurationException
    {
        return loadConfig(url, Config.class, Config::new);
    }

    @VisibleForTesting
    public <T> T loadConfig(URL url, Class<T> root, Supplier<T> factory) throws ConfigurationException
    {
        byte[] configBytes;
        try (InputStream is = url.openStream())
        {
            configBytes = ByteStreams.toByteArray(is);
        }
        catch (IOException e)
        {
            throw new ConfigurationException("Unable to read " + url, e);
        }

        try
        {
            logger.debug("Loading settings from {}", url);
            return fromBytes(configBytes, root, factory);
        }
        catch (YAMLException e)
        {
            throw new ConfigurationException("Invalid yaml: " + url, e);
        }
    }

    @VisibleForTesting
    public static <T> T fromString(String yaml, Class<T> root, Supplier<T> factory) throws ConfigurationException
    {
        try
        {
            return fromBytes(yaml.getBytes(StandardCharsets.UTF_8), root, factory);
        }
        catch (YAMLException e)
        {
            throw new ConfigurationException("Invalid yaml", e);
        }
    }

    private static <T> T fromBytes(byte[] configBytes, Class<T> root, Supplier<T> factory)
    {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setAllowDuplicateKeys(false);

        PropertiesChecker propertiesChecker = new PropertiesChecker();
        CustomClassLoaderConstructor constructor = new CustomClassLoaderConstructor(root, root.getClassLoader(), loaderOptions);
        constructor.setPropertyUtils(propertiesChecker);
        Yaml yaml = new Yaml(constructor);

        T config = yaml.loadAs(new ByteArrayInputStream(configBytes), root);
        propertiesChecker.check();
        // If the configuration file is empty yaml will return null. In this case we should use the default
        // configuration to avoid hitting a NPE at a later stage.
        return config == null ? factory.get() : config;
    }

    /**
     * Utility class to collect every unknown property instead of failing on the first one.
     */
    private static class PropertiesChecker extends PropertyUtils
    {
        private final Set<String> missingProperties = new TreeSet<>();

        PropertiesChecker()
        {
            setSkipMissingProperties(true);
        }

        @Override
        public Property getProperty(Class<?> type, String name)
        {
            Property result = super.getProperty(type, name);
            if (result instanceof MissingProperty)
                missingProperties.add(result.getName());
            return result;
        }

        public void check() throws ConfigurationException
        {
            if (!missingProperties.isEmpty())
                throw new ConfigurationException("Invalid yaml. Please remove properties " + missingProperties + " from your snitch.yaml", false);
        }
    }
}
