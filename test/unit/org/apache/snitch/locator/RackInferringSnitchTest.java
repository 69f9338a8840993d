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

import org.junit.Test;

import static org.apache.snitch.Util.endpoint;
import static org.apache.snitch.Util.endpoints;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RackInferringSnitchTest
{
    @Test
    public void testRackAndDatacenterFromOctets()
    {
        RackInferringSnitch snitch = new RackInferringSnitch();
        InetAddressAndPort endpoint = endpoint("10.20.114.15");

        assertEquals("114", snitch.getRack(endpoint));
        assertEquals("20", snitch.getDatacenter(endpoint));
        assertEquals("254", snitch.getRack(endpoint("10.0.254.1")));
    }

    @Test
    public void testProximity()
    {
        InetAddressAndPort local = endpoint("10.0.0.1");
        RackInferringSnitch snitch = new RackInferringSnitch(local);

        assertThat(snitch.sortedByProximity(local, endpoints("10.1.0.1", "10.0.1.1", "10.0.0.1", "10.0.0.2")),
                   contains(endpoint("10.0.0.1"), endpoint("10.0.0.2"), endpoint("10.0.1.1"), endpoint("10.1.0.1")));
        assertEquals("0", snitch.getLocalDatacenter());
    }

    @Test
    public void testIsWorthMergingForRangeQuery()
    {
        RackInferringSnitch snitch = new RackInferringSnitch(endpoint("10.0.0.1"));

        assertTrue(snitch.isWorthMergingForRangeQuery(endpoints("10.0.0.2", "10.0.1.2"), endpoints("10.0.0.2"), endpoints("10.0.1.2")));
        // merging would add a remote datacenter that neither query needed
        assertFalse(snitch.isWorthMergingForRangeQuery(endpoints("10.1.0.2"), endpoints("10.0.0.2"), endpoints("10.0.1.2")));
        assertTrue(snitch.isWorthMergingForRangeQuery(endpoints("10.1.0.2"), endpoints("10.1.0.2"), endpoints("10.0.1.2")));
    }
}
