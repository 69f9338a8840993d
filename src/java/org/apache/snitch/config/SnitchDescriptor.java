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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.net.UnknownHostException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.snitch.exceptions.ConfigurationException;
import org.apache.snitch.locator.BadnessComparison;
import org.apache.snitch.locator.DynamicEndpointSnitch;
import org.apache.snitch.locator.IEndpointSnitch;
import org.apache.snitch.locator.InetAddressAndPort;

import static org.apache.snitch.config.SnitchRelevantProperties.CONFIG_LOADER;

/**
 * Validated, mutable view of a {@link Config}. A snitch copies the settings when it is created; changes made
 * through the setters reach a running snitch on its next {@link DynamicEndpointSnitch#applyConfigChanges()}.
 */
public class SnitchDescriptor
{
    private static final Logger logger = LoggerFactory.getLogger(SnitchDescriptor.class);

    private static final String SNITCH_PACKAGE = "org.apache.snitch.locator.";

    private static final AtomicBoolean hasLoggedConfig = new AtomicBoolean();

    private final Config conf;
    private final InetAddressAndPort broadcastAddress;

    public SnitchDescriptor(Config conf) throws ConfigurationException
    {
        validate(conf);
        this.conf = conf;
        this.broadcastAddress = resolveBroadcastAddress(conf);
    }

    /**
     * Loads snitch.yaml (or whatever {@code snitch.config} points at) with the loader named by
     * {@code snitch.config.loader}, defaulting to {@link YamlConfigurationLoader}.
     */
    public static SnitchDescriptor load() throws ConfigurationException
    {
        String loaderClass = CONFIG_LOADER.getString();
        ConfigurationLoader loader = loaderClass == null
                                     ? new YamlConfigurationLoader()
                                     : construct(loaderClass, ConfigurationLoader.class, "configuration loading");
        return load(loader);
    }

    public static SnitchDescriptor load(ConfigurationLoader loader) throws ConfigurationException
    {
        Config config = loader.loadConfig();

        if (hasLoggedConfig.compareAndSet(false, true))
            Config.log(config);

        return new SnitchDescriptor(config);
    }

    /**
     * Creates the configured snitch. A name without a package is looked up in {@code org.apache.snitch.locator}.
     * The snitch is wrapped in a {@link DynamicEndpointSnitch}, and started, when {@code dynamic_snitch} is set.
     */
    public IEndpointSnitch createEndpointSnitch() throws ConfigurationException
    {
        IEndpointSnitch snitch = createSubsnitch(conf.endpoint_snitch, broadcastAddress);
        logger.info("Using snitch {} for local address {}{}", snitch.getClass().getName(), broadcastAddress,
                    conf.dynamic_snitch ? " wrapped in the dynamic snitch" : "");
        if (!conf.dynamic_snitch)
            return snitch;

        DynamicEndpointSnitch dynamic = new DynamicEndpointSnitch(snitch, this);
        dynamic.start();
        return dynamic;
    }

    @VisibleForTesting
    static IEndpointSnitch createSubsnitch(String snitchClassName, InetAddressAndPort localAddress) throws ConfigurationException
    {
        if (!snitchClassName.contains("."))
            snitchClassName = SNITCH_PACKAGE + snitchClassName;

        Class<IEndpointSnitch> cls = classForName(snitchClassName, IEndpointSnitch.class, "snitch");
        try
        {
            Constructor<IEndpointSnitch> withAddress = cls.getConstructor(InetAddressAndPort.class);
            return instantiate(withAddress, "snitch", localAddress);
        }
        catch (NoSuchMethodException e)
        {
            return construct(cls, "snitch");
        }
    }

    static <T> T construct(String className, Class<T> expected, String readable) throws ConfigurationException
    {
        Class<T> cls = classForName(className, expected, readable);
        return construct(cls, readable);
    }

    static <T> T construct(Class<T> cls, String readable) throws ConfigurationException
    {
        try
        {
            return instantiate(cls.getConstructor(), readable);
        }
        catch (NoSuchMethodException e)
        {
            throw new ConfigurationException(String.format("No default constructor for %s class '%s'.", readable, cls.getName()));
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<T> classForName(String className, Class<T> expected, String readable) throws ConfigurationException
    {
        Class<?> cls;
        try
        {
            cls = Class.forName(className);
        }
        catch (ClassNotFoundException | NoClassDefFoundError e)
        {
            throw new ConfigurationException(String.format("Unable to find %s class '%s'", readable, className), e);
        }

        if (!expected.isAssignableFrom(cls))
            throw new ConfigurationException(String.format("Class '%s' is not a %s.", className, readable), false);
        return (Class<T>) cls;
    }

    private static <T> T instantiate(Constructor<T> constructor, String readable, Object... args) throws ConfigurationException
    {
        try
        {
            return constructor.newInstance(args);
        }
        catch (InvocationTargetException e)
        {
            if (e.getCause() instanceof ConfigurationException)
                throw (ConfigurationException) e.getCause();
            throw new ConfigurationException(String.format("Error instantiating %s class '%s'.", readable, constructor.getDeclaringClass().getName()), e.getCause());
        }
        catch (ReflectiveOperationException e)
        {
            throw new ConfigurationException(String.format("Default constructor for %s class '%s' is inaccessible.", readable, constructor.getDeclaringClass().getName()), e);
        }
    }

    private static void validate(Config conf) throws ConfigurationException
    {
        if (conf == null)
            throw new ConfigurationException("Missing snitch configuration", false);
        if (conf.endpoint_snitch == null || conf.endpoint_snitch.trim().isEmpty())
            throw new ConfigurationException("Missing endpoint_snitch directive", false);
        if (conf.storage_port <= 0 || conf.storage_port > 65535)
            throw new ConfigurationException("storage_port must be in the range [1, 65535], got " + conf.storage_port, false);

        checkResetInterval(conf.dynamic_snitch_reset_interval);
        checkBadnessThreshold(conf.dynamic_snitch_badness_threshold);
        checkBadnessComparison(conf.dynamic_snitch_badness_comparison);
        checkDecayFactor(conf.dynamic_snitch_decay_factor);
        checkMinimumSamples(conf.dynamic_snitch_minimum_samples);
    }

    private static void checkResetInterval(DurationSpec.IntMillisecondsBound interval)
    {
        if (interval == null || interval.toMilliseconds() <= 0)
            throw new ConfigurationException("dynamic_snitch_reset_interval must be a positive duration, got " + interval, false);
    }

    private static void checkBadnessThreshold(double threshold)
    {
        if (!(threshold >= 0) || Double.isInfinite(threshold))
            throw new ConfigurationException("dynamic_snitch_badness_threshold must be a finite non-negative number, got " + threshold, false);
    }

    private static void checkBadnessComparison(BadnessComparison comparison)
    {
        if (comparison == null)
            throw new ConfigurationException("dynamic_snitch_badness_comparison must be one of BEST, ABSOLUTE or POSITIONAL", false);
    }

    private static void checkDecayFactor(double decayFactor)
    {
        if (!(decayFactor > 0 && decayFactor < 1))
            throw new ConfigurationException("dynamic_snitch_decay_factor must be in the open interval (0, 1), got " + decayFactor, false);
    }

    private static void checkMinimumSamples(int minimumSamples)
    {
        if (minimumSamples < 1)
            throw new ConfigurationException("dynamic_snitch_minimum_samples must be at least 1, got " + minimumSamples, false);
    }

    private static InetAddressAndPort resolveBroadcastAddress(Config conf) throws ConfigurationException
    {
        if (conf.broadcast_address == null)
            return InetAddressAndPort.getLoopbackAddress().withPort(conf.storage_port);

        try
        {
            return InetAddressAndPort.getByNameOverrideDefaults(conf.broadcast_address, conf.storage_port);
        }
        catch (UnknownHostException | IllegalArgumentException e)
        {
            throw new ConfigurationException("Invalid broadcast_address '" + conf.broadcast_address + '\'', e);
        }
    }

    /**
     * Parses {@code host[:port]}, falling back to this descriptor's {@code storage_port} when the name has no port.
     */
    public InetAddressAndPort endpoint(String name) throws UnknownHostException
    {
        return InetAddressAndPort.getByNameOverrideDefaults(name, conf.storage_port);
    }

    public int getStoragePort()
    {
        return conf.storage_port;
    }

    public InetAddressAndPort getBroadcastAddressAndPort()
    {
        return broadcastAddress;
    }

    public String getEndpointSnitch()
    {
        return conf.endpoint_snitch;
    }

    public boolean isDynamicSnitch()
    {
        return conf.dynamic_snitch;
    }

    public int getDynamicResetInterval()
    {
        return conf.dynamic_snitch_reset_interval.toMilliseconds();
    }

    /** Takes effect once {@link DynamicEndpointSnitch#applyConfigChanges()} is called. */
    public void setDynamicResetInterval(int resetIntervalInMS)
    {
        DurationSpec.IntMillisecondsBound interval = new DurationSpec.IntMillisecondsBound(resetIntervalInMS);
        checkResetInterval(interval);
        conf.dynamic_snitch_reset_interval = interval;
    }

    public double getDynamicBadnessThreshold()
    {
        return conf.dynamic_snitch_badness_threshold;
    }

    public void setDynamicBadnessThreshold(double dynamicBadnessThreshold)
    {
        checkBadnessThreshold(dynamicBadnessThreshold);
        conf.dynamic_snitch_badness_threshold = dynamicBadnessThreshold;
    }

    public BadnessComparison getDynamicBadnessComparison()
    {
        return conf.dynamic_snitch_badness_comparison;
    }

    public void setDynamicBadnessComparison(BadnessComparison comparison)
    {
        checkBadnessComparison(comparison);
        conf.dynamic_snitch_badness_comparison = comparison;
    }

    public double getDynamicDecayFactor()
    {
        return conf.dynamic_snitch_decay_factor;
    }

    public void setDynamicDecayFactor(double decayFactor)
    {
        checkDecayFactor(decayFactor);
        conf.dynamic_snitch_decay_factor = decayFactor;
    }

    public int getDynamicMinimumSamples()
    {
        return conf.dynamic_snitch_minimum_samples;
    }

    public void setDynamicMinimumSamples(int minimumSamples)
    {
        checkMinimumSamples(minimumSamples);
        conf.dynamic_snitch_minimum_samples = minimumSamples;
    }

    /**
     * A descriptor on the built-in defaults, for embedding without a snitch.yaml.
     */
    public static SnitchDescriptor defaults()
    {
        return new SnitchDescriptor(new Config());
    }
}
