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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The replacements to apply to a URL, one per component. Every component
 * starts as {@link Replacement#keepExisting()}.
 */
public class URLComponentSource
{
    private final Map<URLPart, Replacement> _replacements = new EnumMap<>(URLPart.class);

    public URLComponentSource()
    {
        for (URLPart part : URLPart.values())
        {
            _replacements.put(part, Replacement.keepExisting());
        }
    }

    public URLComponentSource setScheme(Replacement scheme)
    {
        return set(URLPart.SCHEME, scheme);
    }

    public URLComponentSource setUsername(Replacement username)
    {
        return set(URLPart.USERNAME, username);
    }

    public URLComponentSource setPassword(Replacement password)
    {
        return set(URLPart.PASSWORD, password);
    }

    public URLComponentSource setHost(Replacement host)
    {
        return set(URLPart.HOST, host);
    }

    public URLComponentSource setPort(Replacement port)
    {
        return set(URLPart.PORT, port);
    }

    public URLComponentSource setPath(Replacement path)
    {
        return set(URLPart.PATH, path);
    }

    public URLComponentSource setQuery(Replacement query)
    {
        return set(URLPart.QUERY, query);
    }

    public URLComponentSource setRef(Replacement ref)
    {
        return set(URLPart.REF, ref);
    }

    public Replacement getScheme()
    {
        return get(URLPart.SCHEME);
    }

    public Replacement getUsername()
    {
        return get(URLPart.USERNAME);
    }

    public Replacement getPassword()
    {
        return get(URLPart.PASSWORD);
    }

    public Replacement getHost()
    {
        return get(URLPart.HOST);
    }

    public Replacement getPort()
    {
        return get(URLPart.PORT);
    }

    public Replacement getPath()
    {
        return get(URLPart.PATH);
    }

    public Replacement getQuery()
    {
        return get(URLPart.QUERY);
    }

    public Replacement getRef()
    {
        return get(URLPart.REF);
    }

    Replacement get(URLPart part)
    {
        return _replacements.get(part);
    }

    private URLComponentSource set(URLPart part, Replacement replacement)
    {
        _replacements.put(part, Objects.requireNonNull(replacement));
        return this;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), _replacements);
    }
}
