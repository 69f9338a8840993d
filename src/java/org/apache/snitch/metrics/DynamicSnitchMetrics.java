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
package org.apache.snitch.metrics;

import java.util.ArrayList;
import java.util.List;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

/**
 * Metrics for {@link org.apache.snitch.locator.DynamicEndpointSnitch}.
 */
public class DynamicSnitchMetrics
{
    public static final String GROUP_NAME = "org.apache.snitch.metrics";
    public static final String TYPE_NAME = "DynamicEndpointSnitch";

    private static final String[] METRIC_NAMES = { "Reports", "DroppedReports", "Reorders", "Resets", "TrackedEndpoints", "MillisSinceLastReset" };

    /** Latency samples folded into a score */
    public final Meter reports;
    /** Latency samples rejected as invalid */
    public final Meter droppedReports;
    /** Ranking calls whose result differs from the subsnitch order */
    public final Meter reorders;
    /** Number of times the score table was cleared */
    public final Counter resets;

    private final MetricRegistry registry;
    private final String prefix;
    private final List<String> registered = new ArrayList<>();

    /**
     * @param instance distinguishes several snitches sharing a registry; may be null
     * @throws IllegalArgumentException if {@code registry} already holds metrics under this instance name
     */
    public DynamicSnitchMetrics(MetricRegistry registry, String instance, Gauge<Integer> trackedEndpoints, Gauge<Long> millisSinceLastReset)
    {
        this.registry = registry;
        this.prefix = instance == null || instance.isEmpty()
                      ? MetricRegistry.name(GROUP_NAME, TYPE_NAME)
                      : MetricRegistry.name(GROUP_NAME, TYPE_NAME, instance);

        // a snitch under the same name already owns these; registering now would share its meters
        for (String name : METRIC_NAMES)
        {
            String fullName = MetricRegistry.name(prefix, name);
            if (registry.getNames().contains(fullName))
                throw new IllegalArgumentException("A metric named " + fullName + " already exists; give each snitch sharing a registry its own instance name");
        }

        reports = registry.meter(createMetricName("Reports"));
        droppedReports = registry.meter(createMetricName("DroppedReports"));
        reorders = registry.meter(createMetricName("Reorders"));
        resets = registry.counter(createMetricName("Resets"));
        registry.register(createMetricName("TrackedEndpoints"), trackedEndpoints);
        registry.register(createMetricName("MillisSinceLastReset"), millisSinceLastReset);
    }

    public String createMetricName(String metricName)
    {
        String name = MetricRegistry.name(prefix, metricName);
        synchronized (registered)
        {
            registered.add(name);
        }
        return name;
    }

    /**
     * Removes every metric this instance registered, so a closed snitch leaves no gauge holding on to it.
     */
    public void release()
    {
        synchronized (registered)
        {
            for (String name : registered)
                registry.remove(name);
            registered.clear();
        }
    }
}
