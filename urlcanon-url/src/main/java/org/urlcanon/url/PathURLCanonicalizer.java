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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urlcanon.util.CanonOutput;

/**
 * <p>Canonicalizes URLs that have no authority and an opaque path, such as
 * {@code javascript:} and {@code mailto:} URLs.</p>
 *
 * <p>Only the scheme is canonicalized. The path is copied as it is, except
 * that non-ASCII characters of a wide source are written as UTF-8. A query
 * and ref, which only come from replacements, are canonicalized as usual.</p>
 */
public final class PathURLCanonicalizer
{
    private static final Logger LOG = LoggerFactory.getLogger(PathURLCanonicalizer.class);

    private PathURLCanonicalizer()
    {
    }

    public static boolean canonicalize(byte[] spec, Parsed parsed, CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        return canonicalize(UrlChars.of(spec), parsed, config, output, newParsed);
    }

    public static boolean canonicalize(CharSequence spec, Parsed parsed, CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        return canonicalize(UrlChars.of(spec), parsed, config, output, newParsed);
    }

    /**
     * @return false if the scheme is invalid or a wide path holds invalid
     * UTF-16; the output then holds a best effort canonical form
     */
    public static boolean canonicalize(UrlChars spec, Parsed parsed, CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        return canonicalize(new CanonSource(spec), parsed, config, output, newParsed);
    }

    static boolean canonicalize(CanonSource source, Parsed parsed, CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        boolean success = SchemeCanonicalizer.canonicalize(source.get(URLPart.SCHEME), parsed.getScheme(), output, newParsed);

        newParsed.setUsername(Component.ABSENT);
        newParsed.setPassword(Component.ABSENT);
        newParsed.setHost(Component.ABSENT);
        newParsed.setPort(Component.ABSENT);

        if (parsed.getPath().isPresent())
        {
            int begin = output.length();
            success &= appendOpaquePath(source.get(URLPart.PATH), parsed.getPath(), output);
            newParsed.setPath(Component.range(begin, output.length()));
        }
        else
        {
            newParsed.setPath(Component.ABSENT);
        }

        QueryCanonicalizer.canonicalize(source.get(URLPart.QUERY), parsed.getQuery(), config.getCharsetConverter(), output, newParsed);
        RefCanonicalizer.canonicalize(source.get(URLPart.REF), parsed.getRef(), output, newParsed);

        if (!success && LOG.isDebugEnabled())
            LOG.debug("Invalid path URL {}", output);
        return success;
    }

    private static boolean appendOpaquePath(UrlChars spec, Component path, CanonOutput output)
    {
        if (!spec.isWide())
        {
            CanonUtil.appendRange(spec, path.getBegin(), path.getEnd(), output);
            return true;
        }

        boolean success = true;
        int end = path.getEnd();
        int i = path.getBegin();
        while (i < end)
        {
            int codePoint = spec.codePointAt(i, end);
            if (codePoint < 0)
            {
                codePoint = UrlChars.REPLACEMENT_CHARACTER;
                success = false;
            }
            CanonUtil.appendUtf8Value(codePoint, output);
            i += spec.codePointLength(i, end);
        }
        return success;
    }
}
