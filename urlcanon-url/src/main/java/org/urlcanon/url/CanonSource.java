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
 * The source strings of the parts of a URL being canonicalized. Parts
 * normally all come from one string, but replacement and relative
 * resolution take some parts from a base URL and others from elsewhere.
 */
final class CanonSource
{
    private final Map<URLPart, UrlChars> _sources = new EnumMap<>(URLPart.class);

    CanonSource(UrlChars source)
    {
        for (URLPart part : URLPart.values())
        {
            _sources.put(part, Objects.requireNonNull(source));
        }
    }

    UrlChars get(URLPart part)
    {
        return _sources.get(part);
    }

    CanonSource set(URLPart part, UrlChars source)
    {
        _sources.put(part, Objects.requireNonNull(source));
        return this;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), _sources);
    }
}
