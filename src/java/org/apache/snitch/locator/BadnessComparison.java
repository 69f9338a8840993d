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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * How the dynamic snitch decides that an endpoint is bad enough to override the subsnitch order.
 *
 * Every strategy receives the candidates in baseline (subsnitch) order along with their scores, index for
 * index, and must return the same candidates in the order to contact them. Strategies never look at
 * shared state, so the result only depends on their arguments.
 */
public enum BadnessComparison
{
    /**
     * An endpoint is degraded when its score exceeds the best candidate's score by more than
     * {@code threshold}, as a fraction of the best score (0.1 means 10% worse).
     * Healthy endpoints keep their baseline order and come first, degraded ones follow by score.
     */
    BEST
    {
        public List<InetAddressAndPort> order(List<InetAddressAndPort> baseline, double[] scores, double threshold)
        {
            double limit = min(scores) * (1.0 + threshold);
            return partition(baseline, scores, limit);
        }
    },

    /**
     * Like {@link #BEST}, but the threshold is an absolute margin in milliseconds.
     */
    ABSOLUTE
    {
        public List<InetAddressAndPort> order(List<InetAddressAndPort> baseline, double[] scores, double threshold)
        {
            double limit = min(scores) + threshold;
            return partition(baseline, scores, limit);
        }
    },

    /**
     * Compares the scores in baseline order, position by position, with the same scores sorted. If any
     * baseline score exceeds its sorted counterpart by more than {@code threshold} (as a fraction), the whole
     * list is ordered by score; otherwise the baseline is kept as is.
     */
    POSITIONAL
    {
        public List<InetAddressAndPort> order(List<InetAddressAndPort> baseline, double[] scores, double threshold)
        {
            double[] sortedScores = scores.clone();
            Arrays.sort(sortedScores);

            double badnessThreshold = 1.0 + threshold;
            for (int i = 0; i < scores.length; i++)
            {
                if (scores[i] > sortedScores[i] * badnessThreshold)
                    return sortedByScore(baseline, scores);
            }
            return baseline;
        }
    };

    /**
     * @param baseline candidates in subsnitch order
     * @param scores the score of {@code baseline.get(i)} at index {@code i}
     * @param threshold the configured badness threshold, non-negative
     */
    public abstract List<InetAddressAndPort> order(List<InetAddressAndPort> baseline, double[] scores, double threshold);

    /**
     * Orders by ascending score; equal scores keep their baseline order.
     */
    static List<InetAddressAndPort> sortedByScore(List<InetAddressAndPort> baseline, double[] scores)
    {
        Integer[] indexes = new Integer[scores.length];
        for (int i = 0; i < indexes.length; i++)
            indexes[i] = i;

        // Arrays.sort on objects is stable
        Arrays.sort(indexes, (i1, i2) -> Double.compare(scores[i1], scores[i2]));

        List<InetAddressAndPort> sorted = new ArrayList<>(indexes.length);
        for (int index : indexes)
            sorted.add(baseline.get(index));
        return sorted;
    }

    private static List<InetAddressAndPort> partition(List<InetAddressAndPort> baseline, double[] scores, double limit)
    {
        List<InetAddressAndPort> healthy = new ArrayList<>(scores.length);
        List<InetAddressAndPort> degraded = new ArrayList<>();
        List<Double> degradedScores = new ArrayList<>();
        for (int i = 0; i < scores.length; i++)
        {
            if (scores[i] > limit)
            {
                degraded.add(baseline.get(i));
                degradedScores.add(scores[i]);
            }
            else
            {
                healthy.add(baseline.get(i));
            }
        }

        if (degraded.isEmpty())
            return baseline;

        double[] remaining = new double[degradedScores.size()];
        for (int i = 0; i < remaining.length; i++)
            remaining[i] = degradedScores.get(i);
        healthy.addAll(sortedByScore(degraded, remaining));
        return healthy;
    }

    private static double min(double[] scores)
    {
        double min = Double.POSITIVE_INFINITY;
        for (double score : scores)
            min = Math.min(min, score);
        return min;
    }
}
