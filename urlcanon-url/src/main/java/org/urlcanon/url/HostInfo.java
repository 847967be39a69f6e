//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.urlcanon.url;

import java.util.Arrays;
import java.util.Objects;

/**
 * The outcome of host canonicalization: what kind of host was found, where
 * it was written and, for IP literals, the address bytes in network order.
 */
public final class HostInfo
{
    private static final byte[] NO_ADDRESS = new byte[0];

    public enum Family
    {
        /**
         * A host name, or an empty host.
         */
        NEUTRAL,
        /**
         * The host looked like an IP address but is not a valid one, or could
         * not be canonicalized at all. The URL must be treated as invalid.
         */
        BROKEN,
        IPV4,
        IPV6
    }

    private final Family _family;
    private final Component _host;
    private final byte[] _address;

    HostInfo(Family family, Component host)
    {
        this(family, host, NO_ADDRESS);
    }

    HostInfo(Family family, Component host, byte[] address)
    {
        _family = Objects.requireNonNull(family);
        _host = Objects.requireNonNull(host);
        _address = address.clone();
    }

    public Family getFamily()
    {
        return _family;
    }

    /**
     * @return the canonical host in the output; for IPv6 literals the
     * brackets are included
     */
    public Component getHost()
    {
        return _host;
    }

    /**
     * @return 4 bytes for IPv4, 16 for IPv6, none otherwise
     */
    public byte[] getAddress()
    {
        return _address.clone();
    }

    public boolean isIPAddress()
    {
        return _family == Family.IPV4 || _family == Family.IPV6;
    }

    public boolean isBroken()
    {
        return _family == Family.BROKEN;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof HostInfo))
            return false;
        HostInfo that = (HostInfo)o;
        return _family == that._family && _host.equals(that._host) && Arrays.equals(_address, that._address);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_family, _host, Arrays.hashCode(_address));
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%s}", getClass().getSimpleName(), hashCode(), _family, _host);
    }
}
