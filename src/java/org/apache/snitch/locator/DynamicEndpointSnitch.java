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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.codahale.metrics.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.snitch.concurrent.DebuggableScheduledThreadPoolExecutor;
import org.apache.snitch.config.SnitchDescriptor;
import org.apache.snitch.metrics.DynamicSnitchMetrics;
import org.apache.snitch.net.LatencySubscribers;

import static org.apache.snitch.config.SnitchRelevantProperties.DROPPED_SAMPLE_LOG_INTERVAL_MS;

/**
 * A dynamic snitch that orders endpoints by an exponentially weighted moving average of their observed
 * latency, overriding the order of the wrapped subsnitch only for endpoints that are clearly worse
 * than the best candidate.
 *
 * Scores are updated as timings arrive and periodically discarded, so an endpoint that was routed
 * around gets a fresh chance instead of being penalized forever for a single bad period.
 */
public class DynamicEndpointSnitch extends AbstractEndpointSnitch implements LatencySubscribers.Subscriber, DynamicEndpointSnitchMBean, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DynamicEndpointSnitch.class);

    // the score for a merged set of endpoints must be this much worse than the score for separate endpoints to
    // warrant not merging two ranges into a single range
    private static final double RANGE_MERGING_PREFERENCE = 1.5;

    public final IEndpointSnitch subsnitch;

    private final SnitchDescriptor descriptor;
    private final ScoreTable scores;
    private final DynamicSnitchMetrics metrics;

    private volatile int dynamicResetInterval;
    private volatile double dynamicBadnessThreshold;
    private volatile BadnessComparison dynamicBadnessComparison;
    private volatile int dynamicMinimumSamples;

    private volatile long lastResetMillis = System.currentTimeMillis();

    private final long droppedSampleLogIntervalNanos = TimeUnit.MILLISECONDS.toNanos(DROPPED_SAMPLE_LOG_INTERVAL_MS.getLong());
    private final AtomicLong lastDroppedSampleLog = new AtomicLong(System.nanoTime() - droppedSampleLogIntervalNanos);

    private ScheduledExecutorService executor;
    private final boolean ownsExecutor;
    private ScheduledFuture<?> resetSchedule;
    private boolean closed;

    private final Runnable reset = () -> {
        // we do this so that a host considered bad has a chance to recover, otherwise would we never try
        // to read from it, which would cause its score to never change
        reset();
    };

    /**
     * Creates a snitch with its own metric registry and reset thread.
     */
    public DynamicEndpointSnitch(IEndpointSnitch snitch, SnitchDescriptor descriptor)
    {
        this(snitch, descriptor, null, new MetricRegistry(), null);
    }

    /**
     * @param executor runs the periodic reset; if null the snitch creates, and on close shuts down, its own
     * @param instance distinguishes the metrics of several snitches sharing {@code registry}; may be null
     */
    public DynamicEndpointSnitch(IEndpointSnitch snitch,
                                 SnitchDescriptor descriptor,
                                 @Nullable ScheduledExecutorService executor,
                                 MetricRegistry registry,
                                 @Nullable String instance)
    {
        super(descriptor.getBroadcastAddressAndPort());
        Preconditions.checkArgument(!(snitch instanceof DynamicEndpointSnitch), "You shouldn't wrap the DynamicEndpointSnitch within itself");
        this.subsnitch = Preconditions.checkNotNull(snitch);
        this.descriptor = descriptor;
        this.executor = executor;
        this.ownsExecutor = executor == null;

        readSettings();
        this.scores = new ScoreTable(descriptor.getDynamicDecayFactor());
        this.metrics = new DynamicSnitchMetrics(registry, instance,
                                                scores::size,
                                                () -> System.currentTimeMillis() - lastResetMillis);
    }

    private void readSettings()
    {
        dynamicResetInterval = descriptor.getDynamicResetInterval();
        dynamicBadnessThreshold = descriptor.getDynamicBadnessThreshold();
        dynamicBadnessComparison = descriptor.getDynamicBadnessComparison();
        dynamicMinimumSamples = descriptor.getDynamicMinimumSamples();
    }

    /**
     * Schedules the periodic reset. Calling it again, or after {@link #close()}, does nothing.
     */
    public synchronized void start()
    {
        if (closed || resetSchedule != null)
            return;

        if (executor == null)
            executor = new DebuggableScheduledThreadPoolExecutor("DynamicSnitchReset");
        resetSchedule = executor.scheduleWithFixedDelay(reset, dynamicResetInterval, dynamicResetInterval, TimeUnit.MILLISECONDS);
        logger.info("Dynamic snitch over {} started, resetting scores every {} ms", getSubsnitchClassName(), dynamicResetInterval);
    }

    /**
     * Update configuration from the {@link SnitchDescriptor} and restart the reset task if the configured
     * interval has changed.
     */
    public synchronized void applyConfigChanges()
    {
        int previousResetInterval = dynamicResetInterval;
        readSettings();
        scores.setDecayFactor(descriptor.getDynamicDecayFactor());

        if (previousResetInterval != dynamicResetInterval && resetSchedule != null && !closed)
        {
            resetSchedule.cancel(false);
            resetSchedule = executor.scheduleWithFixedDelay(reset, dynamicResetInterval, dynamicResetInterval, TimeUnit.MILLISECONDS);
            logger.info("Dynamic snitch reset interval changed from {} ms to {} ms", previousResetInterval, dynamicResetInterval);
        }
    }

    public synchronized void close()
    {
        if (closed)
            return;
        closed = true;

        if (resetSchedule != null)
            resetSchedule.cancel(false);
        if (ownsExecutor && executor != null)
            executor.shutdownNow();
        metrics.release();
        logger.info("Dynamic snitch over {} closed", getSubsnitchClassName());
    }

    @VisibleForTesting
    synchronized boolean isResetScheduled()
    {
        return resetSchedule != null && !resetSchedule.isDone();
    }

    public String getRack(InetAddressAndPort endpoint)
    {
        return subsnitch.getRack(endpoint);
    }

    public String getDatacenter(InetAddressAndPort endpoint)
    {
        return subsnitch.getDatacenter(endpoint);
    }

    @Override
    public List<InetAddressAndPort> sortedByProximity(final InetAddressAndPort address, List<InetAddressAndPort> unsortedAddresses)
    {
        if (unsortedAddresses.size() < 2)
            return unsortedAddresses;

        return rank(subsnitch.sortedByProximity(address, unsortedAddresses));
    }

    /**
     * Orders {@code baseline} by health, keeping its relative order among endpoints that are not clearly worse
     * than the best one. The result only depends on {@code baseline} and the scores at the time of the call.
     */
    public List<InetAddressAndPort> rank(List<InetAddressAndPort> baseline)
    {
        if (baseline.size() < 2)
            return baseline;

        // Scores can change concurrently from a call to this method, so read each of them exactly once
        // from a single version of the table.
        Map<InetAddressAndPort, LatencyEstimate> estimates = scores.current();
        int minimumSamples = dynamicMinimumSamples;
        double[] baselineScores = new double[baseline.size()];
        for (int i = 0; i < baselineScores.length; i++)
            baselineScores[i] = scoreOf(estimates.get(baseline.get(i)), minimumSamples);

        // only read these once b/c they are volatile and shouldn't change during the ordering either
        double threshold = dynamicBadnessThreshold;
        List<InetAddressAndPort> ranked = threshold == 0
                                          ? BadnessComparison.sortedByScore(baseline, baselineScores)
                                          : dynamicBadnessComparison.order(baseline, baselineScores, threshold);

        if (ranked != baseline && !ranked.equals(baseline))
            metrics.reorders.mark();
        return ranked;
    }

    // endpoints we know nothing about yet are given the benefit of the doubt
    private static double scoreOf(@Nullable LatencyEstimate estimate, int minimumSamples)
    {
        return estimate == null || estimate.samples < minimumSamples ? 0.0 : estimate.score;
    }

    public int compareEndpoints(InetAddressAndPort target, InetAddressAndPort a1, InetAddressAndPort a2)
    {
        // That function is fundamentally unsafe because the scores can change at any time and so the result of that
        // method is not stable for identical arguments. This is why rank() reads every score once up front.
        throw new UnsupportedOperationException("You shouldn't wrap the DynamicEndpointSnitch (within itself or otherwise)");
    }

    public void receiveTiming(InetAddressAndPort host, long latency, TimeUnit unit) // this is cheap
    {
        // go through nanoseconds so sub-millisecond timings are kept
        receiveTiming(host, unit.toNanos(latency) / 1_000_000d);
    }

    public void receiveTiming(InetAddressAndPort host, double latencyMillis)
    {
        if (scores.record(host, latencyMillis))
        {
            metrics.reports.mark();
            return;
        }

        metrics.droppedReports.mark();
        maybeLogDroppedSample(host, latencyMillis);
    }

    private void maybeLogDroppedSample(InetAddressAndPort host, double latencyMillis)
    {
        long now = System.nanoTime();
        long last = lastDroppedSampleLog.get();
        if (now - last >= droppedSampleLogIntervalNanos && lastDroppedSampleLog.compareAndSet(last, now))
            logger.warn("Ignoring invalid latency sample {} ms for endpoint {} ({} invalid samples so far)",
                        latencyMillis, host, metrics.droppedReports.getCount());
    }

    /**
     * Discards every score. Endpoints are treated as unmeasured until they are reported again.
     */
    public void reset()
    {
        int tracked = scores.reset();
        lastResetMillis = System.currentTimeMillis();
        metrics.resets.inc();
        logger.debug("Reset dynamic snitch scores of {} endpoints", tracked);
    }

    /**
     * @return an immutable copy, sorted by endpoint, of the scores of every endpoint with enough samples
     */
    public Map<InetAddressAndPort, Double> snapshotScores()
    {
        Map<InetAddressAndPort, LatencyEstimate> estimates = scores.current();
        int minimumSamples = dynamicMinimumSamples;
        Map<InetAddressAndPort, Double> snapshot = new TreeMap<>();
        for (Map.Entry<InetAddressAndPort, LatencyEstimate> entry : estimates.entrySet())
        {
            if (entry.getValue().samples >= minimumSamples)
                snapshot.put(entry.getKey(), entry.getValue().score);
        }
        return ImmutableMap.copyOf(snapshot);
    }

    public Map<InetAddress, Double> getScores()
    {
        Map<InetAddress, Double> byAddress = new HashMap<>();
        for (Map.Entry<InetAddressAndPort, Double> entry : snapshotScores().entrySet())
            byAddress.put(entry.getKey().getAddress(), entry.getValue());
        return byAddress;
    }

    public Map<String, Double> getScoresWithPort()
    {
        Map<String, Double> byHost = new HashMap<>();
        for (Map.Entry<InetAddressAndPort, Double> entry : snapshotScores().entrySet())
            byHost.put(entry.getKey().toString(true), entry.getValue());
        return byHost;
    }

    public Map<String, Long> getSampleCounts()
    {
        Map<String, Long> counts = new HashMap<>();
        for (Map.Entry<InetAddressAndPort, LatencyEstimate> entry : scores.current().entrySet())
            counts.put(entry.getKey().toString(true), entry.getValue().samples);
        return counts;
    }

    public int getResetInterval()
    {
        return dynamicResetInterval;
    }

    public double getBadnessThreshold()
    {
        return dynamicBadnessThreshold;
    }

    public String getBadnessComparison()
    {
        return dynamicBadnessComparison.name();
    }

    public double getDecayFactor()
    {
        return scores.getDecayFactor();
    }

    public int getMinimumSamples()
    {
        return dynamicMinimumSamples;
    }

    public String getSubsnitchClassName()
    {
        return subsnitch.getClass().getName();
    }

    public long getLastResetMillis()
    {
        return lastResetMillis;
    }

    @VisibleForTesting
    DynamicSnitchMetrics metrics()
    {
        return metrics;
    }

    public boolean isWorthMergingForRangeQuery(List<InetAddressAndPort> merged, List<InetAddressAndPort> l1, List<InetAddressAndPort> l2)
    {
        if (!subsnitch.isWorthMergingForRangeQuery(merged, l1, l2))
            return false;

        // skip checking scores in the single-node case
        if (l1.size() == 1 && l2.size() == 1 && l1.get(0).equals(l2.get(0)))
            return true;

        // Make sure we return the subsnitch decision (i.e true if we're here) if we lack too much scores
        Map<InetAddressAndPort, Double> snapshot = snapshotScores();
        double maxMerged = maxScore(merged, snapshot);
        double maxL1 = maxScore(l1, snapshot);
        double maxL2 = maxScore(l2, snapshot);
        if (maxMerged < 0 || maxL1 < 0 || maxL2 < 0)
            return true;

        return maxMerged <= (maxL1 + maxL2) * RANGE_MERGING_PREFERENCE;
    }

    // Return the max score for the endpoint in the provided list, or -1.0 if no node have a score.
    private static double maxScore(List<InetAddressAndPort> endpoints, Map<InetAddressAndPort, Double> snapshot)
    {
        double maxScore = -1.0;
        for (InetAddressAndPort endpoint : endpoints)
        {
            Double score = snapshot.get(endpoint);
            if (score == null)
                continue;

            if (score > maxScore)
                maxScore = score;
        }
        return maxScore;
    }
}
