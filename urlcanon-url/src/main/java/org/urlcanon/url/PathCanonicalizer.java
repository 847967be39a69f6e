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

import org.urlcanon.util.CanonOutput;
import org.urlcanon.util.StringUtil;

/**
 * <p>Canonicalizes the path of hierarchical URLs.</p>
 *
 * <p>The canonical path always starts with {@code /}. Backslashes become
 * slashes, escaped unreserved characters are decoded, and characters that are
 * not valid in a path are escaped. A {@code %} that does not start a valid
 * escape is left alone. Non-ASCII bytes of an 8-bit source are escaped one by
 * one as they are; wide sources are escaped as UTF-8.</p>
 *
 * <p>{@code .} and {@code ..} segments are left in place: only relative
 * resolution removes them.</p>
 */
public final class PathCanonicalizer
{
    private PathCanonicalizer()
    {
    }

    public static boolean canonicalizePath(byte[] spec, Component path, CanonOutput output, Parsed parsed)
    {
        return canonicalizePath(UrlChars.of(spec), path, output, parsed);
    }

    public static boolean canonicalizePath(CharSequence spec, Component path, CanonOutput output, Parsed parsed)
    {
        return canonicalizePath(UrlChars.of(spec), path, output, parsed);
    }

    /**
     * @return false if an invalid wide character sequence was replaced
     */
    public static boolean canonicalizePath(UrlChars spec, Component path, CanonOutput output, Parsed parsed)
    {
        if (!path.isPresent())
        {
            parsed.setPath(Component.ABSENT);
            return true;
        }

        int begin = output.length();
        int i = path.getBegin();
        int end = path.getEnd();
        if (i == end || !URLParser.isSlash(spec.at(i)))
            output.append('/');
        boolean success = appendPartialPath(spec, i, end, output);
        parsed.setPath(Component.range(begin, output.length()));
        return success;
    }

    public static boolean canonicalizeFilePath(byte[] spec, Component path, CanonOutput output, Parsed parsed)
    {
        return canonicalizeFilePath(UrlChars.of(spec), path, output, parsed);
    }

    public static boolean canonicalizeFilePath(CharSequence spec, Component path, CanonOutput output, Parsed parsed)
    {
        return canonicalizeFilePath(UrlChars.of(spec), path, output, parsed);
    }

    /**
     * Canonicalizes a file URL path. A Windows drive at the start of the
     * path, after any number of slashes, is written as {@code /C:}: the
     * letter upper cased and {@code |} replaced by {@code :}.
     *
     * @return false if an invalid wide character sequence was replaced
     */
    public static boolean canonicalizeFilePath(UrlChars spec, Component path, CanonOutput output, Parsed parsed)
    {
        if (!path.isPresent())
        {
            parsed.setPath(Component.ABSENT);
            return true;
        }

        int begin = output.length();
        int end = path.getEnd();
        int afterSlashes = path.getBegin();
        while (afterSlashes < end && URLParser.isSlash(spec.at(afterSlashes)))
        {
            afterSlashes++;
        }

        if (!URLParser.doesBeginWindowsDriveSpec(spec, afterSlashes, end))
            return canonicalizePath(spec, path, output, parsed);

        output.append('/');
        output.append(StringUtil.asciiToUpperCase(spec.at(afterSlashes)));
        output.append(':');
        boolean success = appendPartialPath(spec, afterSlashes + 2, end, output);
        parsed.setPath(Component.range(begin, output.length()));
        return success;
    }

    /**
     * Canonicalizes {@code [begin, end)} as a continuation of a path already
     * in the output, without adding a leading slash.
     */
    static boolean appendPartialPath(UrlChars spec, int begin, int end, CanonOutput output)
    {
        boolean success = true;
        int i = begin;
        while (i < end)
        {
            int c = spec.at(i);
            if (c == '\\')
            {
                output.append('/');
                i++;
            }
            else if (c == '%')
            {
                int value = CanonUtil.decodeEscaped(spec, i, end);
                if (CanonUtil.isCharOfType(value, CanonUtil.UNRESERVED))
                {
                    output.append(value);
                    i += 3;
                }
                else
                {
                    output.append(c);
                    i++;
                }
            }
            else if (c < 0x80)
            {
                if (CanonUtil.isCharOfType(c, CanonUtil.PATH))
                    output.append(c);
                else
                    CanonUtil.appendEscapedChar(c, output);
                i++;
            }
            else if (!spec.isWide())
            {
                CanonUtil.appendEscapedChar(c, output);
                i++;
            }
            else
            {
                success &= CanonUtil.appendUtf8EscapedChar(spec, i, end, output);
                i += spec.codePointLength(i, end);
            }
        }
        return success;
    }
}
