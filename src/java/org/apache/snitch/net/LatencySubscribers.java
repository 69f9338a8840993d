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
package org.apache.snitch.net;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.Predicate;

import org.apache.snitch.locator.InetAddressAndPort;

/**
 * Fan-out point through which the request execution layer reports how long each replica took to
 * answer. Subscribing composes the subscribers into a single callback, so reporting is one volatile
 * read and never takes a lock.
 */
public class LatencySubscribers
{
    public interface Subscriber
    {
        void receiveTiming(InetAddressAndPort address, long latency, TimeUnit unit);
    }

    private volatile Subscriber subscribers;
    private static final AtomicReferenceFieldUpdater<LatencySubscribers, Subscriber> subscribersUpdater
        = AtomicReferenceFieldUpdater.newUpdater(LatencySubscribers.class, Subscriber.class, "subscribers");

    private static Subscriber merge(Subscriber a, Subscriber b)
    {
        if (a == null) return b;
        if (b == null) return a;
        return (address, latency, unit) -> {
            a.receiveTiming(address, latency, unit);
            b.receiveTiming(address, latency, unit);
        };
    }

    public void subscribe(Subscriber subscriber)
    {
        subscribersUpdater.accumulateAndGet(this, subscriber, LatencySubscribers::merge);
    }

    public void add(InetAddressAndPort address, long latency, TimeUnit unit)
    {
        Subscriber subscribers = this.subscribers;
        if (subscribers != null)
            subscribers.receiveTiming(address, latency, unit);
    }

    /**
     * Track latency information for the dynamic snitch
     *
     * @param callback    the callback associated with this response
     * @param trackLatency tells whether responses to this kind of callback say anything about replica health
     * @param address     the host that replied
     */
    public <T> void maybeAdd(T callback, Predicate<? super T> trackLatency, InetAddressAndPort address, long latency, TimeUnit unit)
    {
        if (trackLatency.test(callback))
            add(address, latency, unit);
    }
}
