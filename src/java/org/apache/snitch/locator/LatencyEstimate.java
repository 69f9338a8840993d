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

import com.google.common.base.MoreObjects;

/**
 * An immutable exponentially weighted moving average of the latencies reported for one endpoint,
 * in milliseconds, together with the number of samples folded into it.
 *
 * Unlike a reservoir this keeps constant state per endpoint no matter how many requests complete;
 * a new instance replaces the old one on every sample.
 *
 * @see <a href="http://en.wikipedia.org/wiki/Moving_average#Exponential_moving_average">EMA</a>
 */
public final class LatencyEstimate
{
    public final double score;
    public final long samples;

    private LatencyEstimate(double score, long samples)
    {
        this.score = score;
        this.samples = samples;
    }

    /**
     * The first sample seeds the average, so an endpoint seen once is not penalized by a cold start.
     */
    public static LatencyEstimate first(double latencyMillis)
    {
        return new LatencyEstimate(latencyMillis, 1);
    }

    /**
     * Computes {@code score * decayFactor + latency * (1 - decayFactor)}, written as a step from the previous
     * score towards the sample so a constant input yields exactly that input.
     */
    public LatencyEstimate update(double latencyMillis, double decayFactor)
    {
        double updated = score + (latencyMillis - score) * (1 - decayFactor);
        return new LatencyEstimate(updated, samples + 1);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("score", score)
                          .add("samples", samples)
                          .toString();
    }
}
