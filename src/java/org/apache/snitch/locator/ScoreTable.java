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
package org.apache.snitch.locator;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.base.Preconditions;

/**
 * Per-endpoint latency estimates shared by the reporting, ranking and reset paths.
 *
 * Reports replace a single entry atomically through {@link ConcurrentHashMap#compute}, so concurrent
 * reports for one endpoint serialize and none is lost. A reset swaps the whole map for an empty one:
 * readers alias the map once and therefore either see the table as it was before the swap or the
 * fresh one, never a partially cleared table. A report racing with a reset may land in the discarded
 * map; it is lost along with the rest of the pre-reset state.
 */
public class ScoreTable
{
    private volatile ConcurrentHashMap<InetAddressAndPort, LatencyEstimate> estimates = new ConcurrentHashMap<>();
    private volatile double decayFactor;

    public ScoreTable(double decayFactor)
    {
        setDecayFactor(decayFactor);
    }

    /**
     * Folds a latency sample into the endpoint's estimate.
     *
     * @return false if the sample was dropped: a null endpoint, or a negative, NaN or infinite latency
     */
    public boolean record(InetAddressAndPort endpoint, double latencyMillis)
    {
        if (endpoint == null || !isValidLatency(latencyMillis))
            return false;

        // read once: a decay factor change mid-update must not mix two values
        final double decay = decayFactor;
        estimates.compute(endpoint, (host, previous) -> previous == null
                                                        ? LatencyEstimate.first(latencyMillis)
                                                        : previous.update(latencyMillis, decay));
        return true;
    }

    public static boolean isValidLatency(double latencyMillis)
    {
        return latencyMillis >= 0 && !Double.isInfinite(latencyMillis);
    }

    public LatencyEstimate get(InetAddressAndPort endpoint)
    {
        return estimates.get(endpoint);
    }

    /**
     * @return a read-only view of the current table; later resets do not affect it
     */
    public Map<InetAddressAndPort, LatencyEstimate> current()
    {
        return Collections.unmodifiableMap(estimates);
    }

    /**
     * Discards every estimate.
     *
     * @return the number of endpoints that were tracked before the reset
     */
    public int reset()
    {
        Map<InetAddressAndPort, LatencyEstimate> previous = estimates;
        estimates = new ConcurrentHashMap<>();
        return previous.size();
    }

    public int size()
    {
        return estimates.size();
    }

    public double getDecayFactor()
    {
        return decayFactor;
    }

    public void setDecayFactor(double decayFactor)
    {
        Preconditions.checkArgument(decayFactor > 0 && decayFactor < 1,
                                    "decay factor must be in the open interval (0, 1), got %s", decayFactor);
        this.decayFactor = decayFactor;
    }
}
