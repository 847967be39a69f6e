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
import org.urlcanon.util.RawCanonOutput;
import org.urlcanon.util.RawCanonOutputW;

/**
 * <p>Canonicalizes the query as {@code ?query}. The {@code ?} is written
 * whenever a query is present, even an empty one.</p>
 *
 * <p>ASCII characters are escaped where the query does not allow them.
 * Non-ASCII text is re-encoded by the {@link CharsetConverter} when one is
 * given, otherwise as UTF-8, and then escaped. Invalid input is replaced by
 * U+FFFD; a query never fails to canonicalize.</p>
 */
public final class QueryCanonicalizer
{
    private QueryCanonicalizer()
    {
    }

    public static void canonicalize(byte[] spec, Component query, CharsetConverter converter, CanonOutput output, Parsed parsed)
    {
        canonicalize(UrlChars.of(spec), query, converter, output, parsed);
    }

    public static void canonicalize(CharSequence spec, Component query, CharsetConverter converter, CanonOutput output, Parsed parsed)
    {
        canonicalize(UrlChars.of(spec), query, converter, output, parsed);
    }

    /**
     * @param converter the query character set, or null for UTF-8
     */
    public static void canonicalize(UrlChars spec, Component query, CharsetConverter converter, CanonOutput output, Parsed parsed)
    {
        if (!query.isPresent())
        {
            parsed.setQuery(Component.ABSENT);
            return;
        }

        output.append('?');
        int begin = output.length();
        int end = query.getEnd();
        if (converter != null && !isAscii(spec, query.getBegin(), end))
            convertQuery(spec, query.getBegin(), end, converter, output);
        else
            appendUtf8Query(spec, query.getBegin(), end, output);
        parsed.setQuery(Component.range(begin, output.length()));
    }

    private static boolean isAscii(UrlChars spec, int begin, int end)
    {
        for (int i = begin; i < end; i++)
        {
            if (spec.at(i) >= 0x80)
                return false;
        }
        return true;
    }

    private static void appendUtf8Query(UrlChars spec, int begin, int end, CanonOutput output)
    {
        int i = begin;
        while (i < end)
        {
            int c = spec.at(i);
            if (c < 0x80)
            {
                appendQueryByte(c, output);
                i++;
            }
            else
            {
                CanonUtil.appendUtf8EscapedChar(spec, i, end, output);
                i += spec.codePointLength(i, end);
            }
        }
    }

    private static void convertQuery(UrlChars spec, int begin, int end, CharsetConverter converter, CanonOutput output)
    {
        RawCanonOutputW utf16 = new RawCanonOutputW();
        spec.appendUtf16(begin, end, utf16);

        RawCanonOutput converted = new RawCanonOutput();
        converter.convertFromUtf16(utf16.getData(), 0, utf16.length(), converted);

        byte[] bytes = converted.getData();
        for (int i = 0; i < converted.length(); i++)
        {
            appendQueryByte(bytes[i] & 0xFF, output);
        }
    }

    private static void appendQueryByte(int b, CanonOutput output)
    {
        if (CanonUtil.isCharOfType(b, CanonUtil.QUERY))
            output.append(b);
        else
            CanonUtil.appendEscapedChar(b, output);
    }
}
