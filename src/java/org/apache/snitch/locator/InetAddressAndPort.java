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

import java.io.Serializable;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Comparator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.net.HostAndPort;
import com.google.common.primitives.UnsignedBytes;

/**
 * Identifies a peer by IP address and port. An IP can host several instances, so the port is part of the
 * identity. InetSocketAddress alone is undesirable: it is not comparable, its toString() does not bracket
 * IPv6 literals and it has no notion of a configurable default port.
 */
public final class InetAddressAndPort extends InetSocketAddress implements Comparable<InetAddressAndPort>, Serializable
{
    private static final long serialVersionUID = 0;

    private static final Comparator<byte[]> ADDRESS_COMPARATOR = UnsignedBytes.lexicographicalComparator();

    // used when neither the name nor the caller gives a port; SnitchDescriptor passes its own storage_port
    private static final int DEFAULT_PORT = 7000;

    public final byte[] addressBytes;

    @VisibleForTesting
    InetAddressAndPort(InetAddress address, byte[] addressBytes, int port)
    {
        super(address, port);
        Preconditions.checkNotNull(address);
        Preconditions.checkNotNull(addressBytes);
        validatePortRange(port);
        this.addressBytes = addressBytes;
    }

    public InetAddressAndPort withPort(int port)
    {
        return new InetAddressAndPort(getAddress(), addressBytes, port);
    }

    private static void validatePortRange(int port)
    {
        if (port < 0 | port > 65535)
        {
            throw new IllegalArgumentException("Port " + port + " is not a valid port number in the range 0-65535");
        }
    }

    @Override
    public int compareTo(InetAddressAndPort o)
    {
        int retval = ADDRESS_COMPARATOR.compare(addressBytes, o.addressBytes);
        if (retval != 0)
        {
            return retval;
        }

        return Integer.compare(getPort(), o.getPort());
    }

    public String getHostAddressAndPort()
    {
        return getHostAddress(true);
    }

    public String getHostAddress(boolean withPort)
    {
        if (withPort)
        {
            return HostAndPort.fromParts(getAddress().getHostAddress(), getPort()).toString();
        }
        else
        {
            return getAddress().getHostAddress();
        }
    }

    @Override
    public String toString()
    {
        return toString(true);
    }

    /** Format in the same style as InetAddress.toString: hostname / literal IP address : port.
     *  Literal IPv6 addresses are wrapped with [ ] to make the port number clear. If the host name is
     *  unresolved no reverse lookup is performed and the hostname part is empty.
     */
    public String toString(boolean withPort)
    {
        String addressToString = getAddress().toString(); // cannot use getHostName as it resolves
        if (!withPort)
            return addressToString;

        int nameLength = addressToString.lastIndexOf('/'); // use last index to prevent ambiguity if host name contains /
        assert nameLength >= 0 : "InetAddress.toString format may have changed, expecting /";

        // Check if need to wrap address with [ ] for IPv6 addresses
        if (addressToString.indexOf(':', nameLength) >= 0)
        {
            StringBuilder sb = new StringBuilder(addressToString.length() + 16);
            sb.append(addressToString, 0, nameLength + 1); // append optional host and / char
            sb.append('[');
            sb.append(addressToString, nameLength + 1, addressToString.length());
            sb.append("]:");
            sb.append(getPort());
            return sb.toString();
        }
        else // can just append :port
        {
            return addressToString + ':' + getPort();
        }
    }

    public static InetAddressAndPort getByName(String name) throws UnknownHostException
    {
        return getByNameOverrideDefaults(name, null);
    }

    /**
     * @param name Hostname + optional ports string
     * @param port Port to connect on, overridden by values in hostname string, defaults to 7000 if not specified anywhere.
     */
    public static InetAddressAndPort getByNameOverrideDefaults(String name, Integer port) throws UnknownHostException
    {
        HostAndPort hap = HostAndPort.fromString(name);
        if (hap.hasPort())
        {
            port = hap.getPort();
        }
        return getByAddressOverrideDefaults(InetAddress.getByName(hap.getHost()), port);
    }

    public static InetAddressAndPort getByAddress(byte[] address) throws UnknownHostException
    {
        return getByAddressOverrideDefaults(InetAddress.getByAddress(address), null);
    }

    public static InetAddressAndPort getByAddress(InetAddress address)
    {
        return getByAddressOverrideDefaults(address, null);
    }

    public static InetAddressAndPort getByAddress(InetSocketAddress address)
    {
        if (address instanceof InetAddressAndPort)
            return (InetAddressAndPort) address;
        return new InetAddressAndPort(address.getAddress(), address.getAddress().getAddress(), address.getPort());
    }

    public static InetAddressAndPort getByAddressOverrideDefaults(InetAddress address, Integer port)
    {
        if (port == null)
        {
            port = DEFAULT_PORT;
        }

        return new InetAddressAndPort(address, address.getAddress(), port);
    }

    public static InetAddressAndPort getLoopbackAddress()
    {
        return getByAddress(InetAddress.getLoopbackAddress());
    }

    public static int getDefaultPort()
    {
        return DEFAULT_PORT;
    }
}
