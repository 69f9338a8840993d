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

import java.net.InetAddress;
import java.util.Map;

public interface DynamicEndpointSnitchMBean
{
    /**
     * @return the current score, in milliseconds, of every endpoint with enough samples, keyed by {@code host:port}
     */
    public Map<String, Double> getScoresWithPort();
    /** Same as {@link #getScoresWithPort()}, ignoring ports; endpoints sharing an address collapse to one entry. */
    public Map<InetAddress, Double> getScores();
    /**
     * @return the number of samples received per endpoint since the last reset, keyed by {@code host:port}
     */
    public Map<String, Long> getSampleCounts();

    public int getResetInterval();
    public double getBadnessThreshold();
    public String getBadnessComparison();
    public double getDecayFactor();
    public int getMinimumSamples();
    public String getSubsnitchClassName();

    /**
     * @return the wall clock time, in milliseconds since the epoch, at which the scores were last cleared
     */
    public long getLastResetMillis();

    /**
     * Clears every score now instead of waiting for the next scheduled reset.
     */
    public void reset();
}
