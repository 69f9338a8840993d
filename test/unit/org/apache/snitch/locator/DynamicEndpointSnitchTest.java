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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.codahale.metrics.MetricRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.apache.snitch.config.Config;

import static org.apache.snitch.Util.config;
import static org.apache.snitch.Util.descriptor;
import static org.apache.snitch.Util.endpoint;
import static org.apache.snitch.Util.endpoints;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DynamicEndpointSnitchTest
{
    private static final InetAddressAndPort A = endpoint("127.0.0.2");
    private static final InetAddressAndPort B = endpoint("127.0.0.3");
    private static final InetAddressAndPort C = endpoint("127.0.0.4");
    private static final InetAddressAndPort D = endpoint("127.0.0.5");

    private Config config;
    private DynamicEndpointSnitch dsnitch;

    @Before
    public void setup()
    {
        config = config();
    }

    @After
    public void tearDown()
    {
        if (dsnitch != null)
            dsnitch.close();
    }

    private DynamicEndpointSnitch snitch()
    {
        return snitch(new SimpleSnitch(endpoint("127.0.0.1")));
    }

    private DynamicEndpointSnitch snitch(IEndpointSnitch subsnitch)
    {
        dsnitch = new DynamicEndpointSnitch(subsnitch, descriptor(config), null, new MetricRegistry(), null);
        return dsnitch;
    }

    private static void setScores(DynamicEndpointSnitch dsnitch, int rounds, List<InetAddressAndPort> hosts, double... latencies)
    {
        for (int round = 0; round < rounds; round++)
        {
            for (int i = 0; i < hosts.size(); i++)
                dsnitch.receiveTiming(hosts.get(i), latencies[i]);
        }
    }

    @Test
    public void testConstantLatencyConverges()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        for (int i = 0; i < 3; i++)
            dsnitch.receiveTiming(A, 100, TimeUnit.MILLISECONDS);

        assertThat(dsnitch.snapshotScores().get(A), closeTo(100.0, 1e-9));
        assertEquals(Long.valueOf(3), dsnitch.getSampleCounts().get(A.toString(true)));
    }

    @Test
    public void testSubMillisecondTimingsAreKept()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        dsnitch.receiveTiming(A, 250, TimeUnit.MICROSECONDS);

        assertThat(dsnitch.snapshotScores().get(A), closeTo(0.25, 1e-12));
    }

    @Test
    public void testScoreMovesTowardsRecentLatency()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        dsnitch.receiveTiming(A, 10.0);
        dsnitch.receiveTiming(A, 110.0);

        // 10 * 0.9 + 110 * 0.1
        assertThat(dsnitch.snapshotScores().get(A), closeTo(20.0, 1e-9));
    }

    @Test
    public void testEndpointsWithinThresholdKeepBaselineOrder()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C), 10, 10.5, 50);

        assertThat(dsnitch.rank(Arrays.asList(A, B, C)), contains(A, B, C));
        assertThat(dsnitch.rank(Arrays.asList(C, A, B)), contains(A, B, C));
        assertThat(dsnitch.rank(Arrays.asList(B, C, A)), contains(B, A, C));
    }

    @Test
    public void testRoutesAroundDegradedEndpoint()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 5, Arrays.asList(A, B), 10, 100);

        assertThat(dsnitch.sortedByProximity(endpoint("127.0.0.1"), Arrays.asList(B, A)), contains(A, B));
        assertEquals(1, dsnitch.metrics().reorders.getCount());
    }

    @Test
    public void testRankIsIdempotent()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 3, Arrays.asList(A, B, C, D), 40, 10, 11, 90);

        List<InetAddressAndPort> once = dsnitch.rank(Arrays.asList(D, C, B, A));
        assertEquals(once, dsnitch.rank(once));
    }

    @Test
    public void testNoEndpointIsMovedAheadOfOneWithinThreshold()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C, D), 20, 21, 22, 60);

        List<InetAddressAndPort> baseline = Arrays.asList(D, C, B, A);
        List<InetAddressAndPort> ranked = dsnitch.rank(baseline);
        Map<InetAddressAndPort, Double> scores = dsnitch.snapshotScores();
        double best = Collections.min(scores.values());

        // endpoints within the threshold of the best keep their relative baseline order
        for (int i = 0; i < ranked.size(); i++)
        {
            for (int j = i + 1; j < ranked.size(); j++)
            {
                InetAddressAndPort first = ranked.get(i);
                InetAddressAndPort second = ranked.get(j);
                boolean bothHealthy = scores.get(first) <= best * 1.1 && scores.get(second) <= best * 1.1;
                if (bothHealthy)
                    assertTrue(baseline.indexOf(first) < baseline.indexOf(second));
            }
        }
        assertEquals(D, ranked.get(ranked.size() - 1));
    }

    @Test
    public void testEmptyAndSingleCandidate()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        dsnitch.receiveTiming(A, 500.0);

        assertThat(dsnitch.rank(Collections.emptyList()), empty());
        List<InetAddressAndPort> single = Collections.singletonList(A);
        assertSame(single, dsnitch.rank(single));
    }

    @Test
    public void testUnscoredEndpointsAreTreatedAsBest()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B), 10, 10);

        assertThat(dsnitch.rank(Arrays.asList(A, B, D)), contains(D, A, B));
    }

    @Test
    public void testInvalidSamplesAreDropped()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        dsnitch.receiveTiming(A, -1.0);
        dsnitch.receiveTiming(A, Double.NaN);
        dsnitch.receiveTiming(A, Double.POSITIVE_INFINITY);
        dsnitch.receiveTiming(null, 5, TimeUnit.MILLISECONDS);

        assertTrue(dsnitch.snapshotScores().isEmpty());
        assertEquals(4, dsnitch.metrics().droppedReports.getCount());

        dsnitch.receiveTiming(A, 5.0);
        assertThat(dsnitch.snapshotScores().get(A), closeTo(5.0, 1e-9));
        assertEquals(1, dsnitch.metrics().reports.getCount());
    }

    @Test
    public void testMinimumSamples()
    {
        config.dynamic_snitch_minimum_samples = 3;
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 3, Arrays.asList(A, B), 10, 10.5);
        setScores(dsnitch, 2, Collections.singletonList(C), 50);

        assertThat(dsnitch.snapshotScores(), not(hasKey(C)));
        assertEquals(Long.valueOf(2), dsnitch.getSampleCounts().get(C.toString(true)));
        // C is not scoreable yet, so it counts as the best candidate
        assertThat(dsnitch.rank(Arrays.asList(A, B, C)), contains(C, A, B));

        dsnitch.receiveTiming(C, 50.0);
        assertThat(dsnitch.rank(Arrays.asList(C, A, B)), contains(A, B, C));
    }

    @Test
    public void testZeroThresholdSortsByScore()
    {
        config.dynamic_snitch_badness_threshold = 0;
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C), 10, 10.5, 10);

        // A and C tie and keep their baseline order
        assertThat(dsnitch.rank(Arrays.asList(B, C, A)), contains(C, A, B));
    }

    @Test
    public void testAbsoluteComparison()
    {
        config.dynamic_snitch_badness_comparison = BadnessComparison.ABSOLUTE;
        config.dynamic_snitch_badness_threshold = 5;
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C), 10, 14, 16);

        assertThat(dsnitch.rank(Arrays.asList(C, B, A)), contains(B, A, C));
    }

    @Test
    public void testPositionalComparison()
    {
        config.dynamic_snitch_badness_comparison = BadnessComparison.POSITIONAL;
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C), 10, 10.5, 50);

        assertThat(dsnitch.rank(Arrays.asList(B, A, C)), contains(B, A, C));
        assertThat(dsnitch.rank(Arrays.asList(A, C, B)), contains(A, B, C));
    }

    @Test
    public void testSubsnitchOrderIsTheBaseline()
    {
        config.broadcast_address = "10.0.0.1";
        InetAddressAndPort local = endpoint("10.0.0.1");
        InetAddressAndPort sameRack = endpoint("10.0.0.2");
        InetAddressAndPort sameDc = endpoint("10.0.1.1");
        InetAddressAndPort remote = endpoint("10.1.0.1");
        DynamicEndpointSnitch dsnitch = snitch(new RackInferringSnitch(local));

        assertThat(dsnitch.sortedByProximity(local, Arrays.asList(remote, sameDc, sameRack)), contains(sameRack, sameDc, remote));
        assertEquals("0", dsnitch.getDatacenter(sameDc));
        assertEquals("1", dsnitch.getRack(sameDc));

        setScores(dsnitch, 1, Arrays.asList(sameRack, sameDc, remote), 80, 10, 10);
        assertThat(dsnitch.sortedByProximity(local, Arrays.asList(remote, sameDc, sameRack)), contains(sameDc, remote, sameRack));
    }

    @Test
    public void testResetForgetsScores()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C), 10, 10.5, 50);
        long before = dsnitch.getLastResetMillis();

        dsnitch.reset();

        assertTrue(dsnitch.snapshotScores().isEmpty());
        assertTrue(dsnitch.getSampleCounts().isEmpty());
        assertThat(dsnitch.rank(Arrays.asList(C, A, B)), contains(C, A, B));
        assertTrue(dsnitch.getLastResetMillis() >= before);
        assertEquals(1, dsnitch.metrics().resets.getCount());
    }

    @Test
    public void testSnapshotIsSortedAndImmutable()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(C, A, B), 3, 1, 2);

        Map<InetAddressAndPort, Double> snapshot = dsnitch.snapshotScores();
        assertThat(snapshot.keySet(), contains(A, B, C));
        dsnitch.receiveTiming(D, 4.0);
        assertFalse(snapshot.containsKey(D));

        assertEquals(Double.valueOf(1), dsnitch.getScores().get(A.getAddress()));
        assertEquals(Double.valueOf(2), dsnitch.getScoresWithPort().get(B.toString(true)));
    }

    @Test
    public void testSettings()
    {
        config.dynamic_snitch_decay_factor = 0.5;
        DynamicEndpointSnitch dsnitch = snitch();

        assertEquals(600_000, dsnitch.getResetInterval());
        assertEquals(0.1, dsnitch.getBadnessThreshold(), 0);
        assertEquals("BEST", dsnitch.getBadnessComparison());
        assertEquals(0.5, dsnitch.getDecayFactor(), 0);
        assertEquals(1, dsnitch.getMinimumSamples());
        assertEquals(SimpleSnitch.class.getName(), dsnitch.getSubsnitchClassName());
    }

    @Test
    public void testIsWorthMergingForRangeQuery()
    {
        DynamicEndpointSnitch dsnitch = snitch();
        setScores(dsnitch, 1, Arrays.asList(A, B, C), 10, 10, 50);

        assertTrue(dsnitch.isWorthMergingForRangeQuery(endpoints("127.0.0.2"), endpoints("127.0.0.2"), endpoints("127.0.0.2")));
        assertFalse(dsnitch.isWorthMergingForRangeQuery(Collections.singletonList(C), Collections.singletonList(A), Collections.singletonList(B)));
        assertTrue(dsnitch.isWorthMergingForRangeQuery(Arrays.asList(A, B), Collections.singletonList(A), Collections.singletonList(B)));
        // not enough scores to say otherwise than the subsnitch
        assertTrue(dsnitch.isWorthMergingForRangeQuery(Collections.singletonList(C), Collections.singletonList(D), Collections.singletonList(B)));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testCompareEndpointsIsUnsupported()
    {
        snitch().compareEndpoints(A, B, C);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCannotWrapItself()
    {
        DynamicEndpointSnitch inner = snitch();
        new DynamicEndpointSnitch(inner, descriptor(config), null, new MetricRegistry(), "outer");
    }

    @Test
    public void testSharedRegistryNeedsDistinctInstanceNames()
    {
        MetricRegistry registry = new MetricRegistry();
        dsnitch = new DynamicEndpointSnitch(new SimpleSnitch(), descriptor(config), null, registry, "reads");
        try
        {
            new DynamicEndpointSnitch(new SimpleSnitch(), descriptor(config), null, registry, "reads");
            fail("Expected an IllegalArgumentException");
        }
        catch (IllegalArgumentException e)
        {
            assertThat(e.getMessage(), containsString("reads"));
        }

        try (DynamicEndpointSnitch other = new DynamicEndpointSnitch(new SimpleSnitch(), descriptor(config), null, registry, "writes"))
        {
            dsnitch.receiveTiming(A, 1.0);
            assertEquals(1, dsnitch.metrics().reports.getCount());
            assertEquals(0, other.metrics().reports.getCount());
        }
    }

    @Test
    public void testResetUnderConcurrentReportsAndReads() throws Exception
    {
        DynamicEndpointSnitch dsnitch = snitch();
        List<InetAddressAndPort> candidates = Arrays.asList(B, A);
        AtomicLong published = new AtomicLong();
        AtomicBoolean stop = new AtomicBoolean();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try
        {
            // latencies increase with every report, see ScoreTableTest
            Future<?> writer = executor.submit(() -> {
                for (long i = 1; !stop.get(); i++)
                {
                    dsnitch.receiveTiming(A, (double) i);
                    published.set(i);
                }
            });
            Future<?> reader = executor.submit(() -> {
                while (!stop.get())
                {
                    assertThat(dsnitch.rank(candidates), containsInAnyOrder(A, B));
                    for (double score : dsnitch.snapshotScores().values())
                        assertThat(score, greaterThanOrEqualTo(1.0));
                }
            });

            for (int i = 0; i < 20_000; i++)
            {
                long before = published.get();
                dsnitch.reset();
                Double score = dsnitch.snapshotScores().get(A);
                if (score != null)
                    assertThat(score, greaterThan((double) before));
            }
            stop.set(true);
            writer.get();
            reader.get();
        }
        finally
        {
            stop.set(true);
            executor.shutdownNow();
        }
        assertEquals(20_000, dsnitch.metrics().resets.getCount());
    }
}
