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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * <p>The collaborators a canonicalization runs with, passed explicitly on
 * each call. Instances are immutable; the {@code with...} methods return
 * modified copies.</p>
 *
 * <ul>
 * <li>the {@link CharsetConverter} for queries, none meaning UTF-8;</li>
 * <li>the {@link IdnConverter} for non-ASCII hosts, none meaning such hosts
 * fail to canonicalize;</li>
 * <li>the default port of each scheme, used to drop redundant ports.</li>
 * </ul>
 */
public final class CanonConfig
{
    /**
     * UTF-8 queries, no IDN conversion and no default ports.
     */
    public static final CanonConfig DEFAULT = new CanonConfig(null, null, Collections.emptyMap());

    private final CharsetConverter _charsetConverter;
    private final IdnConverter _idnConverter;
    private final Map<String, Integer> _defaultPorts;

    private CanonConfig(CharsetConverter charsetConverter, IdnConverter idnConverter, Map<String, Integer> defaultPorts)
    {
        _charsetConverter = charsetConverter;
        _idnConverter = idnConverter;
        _defaultPorts = defaultPorts;
    }

    /**
     * @return the query converter, or null for UTF-8
     */
    public CharsetConverter getCharsetConverter()
    {
        return _charsetConverter;
    }

    /**
     * @return the IDN converter, or null if non-ASCII hosts are rejected
     */
    public IdnConverter getIdnConverter()
    {
        return _idnConverter;
    }

    /**
     * @param scheme a canonical (lower case) scheme
     * @return the default port of the scheme, or {@link PortCanonicalizer#PORT_UNSPECIFIED}
     */
    public int getDefaultPort(String scheme)
    {
        if (scheme == null)
            return PortCanonicalizer.PORT_UNSPECIFIED;
        Integer port = _defaultPorts.get(scheme);
        return port == null ? PortCanonicalizer.PORT_UNSPECIFIED : port;
    }

    public Map<String, Integer> getDefaultPorts()
    {
        return _defaultPorts;
    }

    public CanonConfig withCharsetConverter(CharsetConverter charsetConverter)
    {
        return new CanonConfig(charsetConverter, _idnConverter, _defaultPorts);
    }

    public CanonConfig withIdnConverter(IdnConverter idnConverter)
    {
        return new CanonConfig(_charsetConverter, idnConverter, _defaultPorts);
    }

    public CanonConfig withDefaultPort(String scheme, int port)
    {
        if (port < 0 || port > PortCanonicalizer.MAX_PORT)
            throw new IllegalArgumentException("Bad port " + port + " for " + scheme);
        Map<String, Integer> ports = new HashMap<>(_defaultPorts);
        ports.put(scheme.toLowerCase(Locale.ENGLISH), port);
        return new CanonConfig(_charsetConverter, _idnConverter, Collections.unmodifiableMap(ports));
    }

    public CanonConfig withDefaultPorts(Map<String, Integer> defaultPorts)
    {
        CanonConfig config = this;
        for (Map.Entry<String, Integer> entry : defaultPorts.entrySet())
        {
            config = config.withDefaultPort(entry.getKey(), entry.getValue());
        }
        return config;
    }

    @Override
    public String toString()
    {
        return String.format("%s{charset=%s,idn=%s,ports=%s}", getClass().getSimpleName(), _charsetConverter, _idnConverter, _defaultPorts);
    }
}
