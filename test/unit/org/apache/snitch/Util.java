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
package org.apache.snitch;

import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.awaitility.Awaitility;

import org.apache.snitch.config.Config;
import org.apache.snitch.config.SnitchDescriptor;
import org.apache.snitch.locator.InetAddressAndPort;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class Util
{
    public static InetAddressAndPort endpoint(String host)
    {
        try
        {
            return InetAddressAndPort.getByName(host);
        }
        catch (UnknownHostException e)
        {
            throw new AssertionError(e);
        }
    }

    public static List<InetAddressAndPort> endpoints(String... hosts)
    {
        List<InetAddressAndPort> endpoints = new ArrayList<>(hosts.length);
        for (String host : hosts)
            endpoints.add(endpoint(host));
        return endpoints;
    }

    /**
     * A configuration on the defaults, local to 127.0.0.1, that tests adjust field by field.
     */
    public static Config config()
    {
        Config config = new Config();
        config.broadcast_address = "127.0.0.1";
        return config;
    }

    public static SnitchDescriptor descriptor(Config config)
    {
        return new SnitchDescriptor(config);
    }

    public static void spinAssertEquals(Object expected, Supplier<Object> actualSupplier, int timeoutInSeconds)
    {
        spinAssertEquals(null, expected, actualSupplier, timeoutInSeconds, TimeUnit.SECONDS);
    }

    public static <T> void spinAssertEquals(String message, T expected, Supplier<? extends T> actualSupplier, long timeout, TimeUnit timeUnit)
    {
        Awaitility.await()
                  .pollInterval(Duration.ofMillis(100))
                  .pollDelay(0, TimeUnit.MILLISECONDS)
                  .atMost(timeout, timeUnit)
                  .untilAsserted(() -> assertThat(message, actualSupplier.get(), equalTo(expected)));
    }
}
