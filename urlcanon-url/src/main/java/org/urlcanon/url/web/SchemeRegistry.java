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

package org.urlcanon.url.web;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.urlcanon.url.CanonConfig;
import org.urlcanon.url.PortCanonicalizer;

/**
 * <p>Decides which kind of URL a scheme introduces, and the default port of
 * standard schemes.</p>
 *
 * <p>{@code file} always means a file URL. Registered standard schemes have
 * an authority. Every other scheme is a path URL. Registries are immutable;
 * {@link #withStandardScheme(String, int)} returns a modified copy.</p>
 */
public final class SchemeRegistry
{
    public static final String FILE_SCHEME = "file";

    public enum Shape
    {
        STANDARD,
        FILE,
        PATH
    }

    private final Map<String, Integer> _standardSchemes;

    /**
     * Creates a registry without standard schemes.
     */
    public SchemeRegistry()
    {
        this(Collections.emptyMap());
    }

    private SchemeRegistry(Map<String, Integer> standardSchemes)
    {
        _standardSchemes = standardSchemes;
    }

    /**
     * @return a registry of the common standard schemes: http, https, ftp,
     * gopher, ws and wss
     */
    public static SchemeRegistry standard()
    {
        return new SchemeRegistry()
            .withStandardScheme("http", 80)
            .withStandardScheme("https", 443)
            .withStandardScheme("ftp", 21)
            .withStandardScheme("gopher", 70)
            .withStandardScheme("ws", 80)
            .withStandardScheme("wss", 443);
    }

    /**
     * @param scheme the scheme, in any case
     * @param defaultPort the default port, or {@link PortCanonicalizer#PORT_UNSPECIFIED}
     * @return a copy of this registry with the scheme registered as standard
     */
    public SchemeRegistry withStandardScheme(String scheme, int defaultPort)
    {
        String name = scheme.toLowerCase(Locale.ENGLISH);
        if (FILE_SCHEME.equals(name))
            throw new IllegalArgumentException("file is not a standard scheme");
        if (defaultPort != PortCanonicalizer.PORT_UNSPECIFIED && (defaultPort < 0 || defaultPort > PortCanonicalizer.MAX_PORT))
            throw new IllegalArgumentException("Bad default port " + defaultPort + " for " + scheme);
        Map<String, Integer> schemes = new HashMap<>(_standardSchemes);
        schemes.put(name, defaultPort);
        return new SchemeRegistry(Collections.unmodifiableMap(schemes));
    }

    /**
     * @param scheme a scheme, in any case, or null
     * @return the kind of URL the scheme introduces
     */
    public Shape getShape(String scheme)
    {
        if (scheme == null)
            return Shape.PATH;
        String name = scheme.toLowerCase(Locale.ENGLISH);
        if (FILE_SCHEME.equals(name))
            return Shape.FILE;
        return _standardSchemes.containsKey(name) ? Shape.STANDARD : Shape.PATH;
    }

    public int getDefaultPort(String scheme)
    {
        Integer port = _standardSchemes.get(scheme.toLowerCase(Locale.ENGLISH));
        return port == null ? PortCanonicalizer.PORT_UNSPECIFIED : port;
    }

    /**
     * @return {@code config} with the default ports of the standard schemes added
     */
    public CanonConfig configure(CanonConfig config)
    {
        for (Map.Entry<String, Integer> entry : _standardSchemes.entrySet())
        {
            if (entry.getValue() != PortCanonicalizer.PORT_UNSPECIFIED)
                config = config.withDefaultPort(entry.getKey(), entry.getValue());
        }
        return config;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), _standardSchemes);
    }
}
