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
 * <p>Canonicalizes {@code file} URLs: {@code file://host/path?query#ref}.</p>
 *
 * <p>The host may be empty or absent and user info and port are never
 * written. A Windows drive at the start of the path is normalized to
 * {@code /C:}. A missing scheme is written as {@code file}.</p>
 */
public final class FileURLCanonicalizer
{
    private static final Logger LOG = LoggerFactory.getLogger(FileURLCanonicalizer.class);

    private static final String FILE_SCHEME = "file";

    private FileURLCanonicalizer()
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
     * @return false if the URL is invalid; the output then holds a best effort canonical form
     */
    public static boolean canonicalize(UrlChars spec, Parsed parsed, CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        return canonicalize(new CanonSource(spec), parsed, config, output, newParsed);
    }

    static boolean canonicalize(CanonSource source, Parsed parsed, CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        boolean success = true;
        if (parsed.getScheme().isPresent())
        {
            success = SchemeCanonicalizer.canonicalize(source.get(URLPart.SCHEME), parsed.getScheme(), output, newParsed);
        }
        else
        {
            newParsed.setScheme(Component.of(output.length(), FILE_SCHEME.length()));
            output.append(FILE_SCHEME);
            output.append(':');
        }

        output.append("//");
        newParsed.setUsername(Component.ABSENT);
        newParsed.setPassword(Component.ABSENT);
        success &= HostCanonicalizer.canonicalize(source.get(URLPart.HOST), parsed.getHost(), config.getIdnConverter(), output, newParsed);
        newParsed.setPort(Component.ABSENT);

        if (parsed.getPath().isPresent())
        {
            success &= PathCanonicalizer.canonicalizeFilePath(source.get(URLPart.PATH), parsed.getPath(), output, newParsed);
        }
        else
        {
            newParsed.setPath(Component.of(output.length(), 1));
            output.append('/');
        }

        QueryCanonicalizer.canonicalize(source.get(URLPart.QUERY), parsed.getQuery(), config.getCharsetConverter(), output, newParsed);
        RefCanonicalizer.canonicalize(source.get(URLPart.REF), parsed.getRef(), output, newParsed);

        if (!success && LOG.isDebugEnabled())
            LOG.debug("Invalid file URL {}", output);
        return success;
    }
}
