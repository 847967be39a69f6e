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
 * Canonicalizes the scheme: lower case, followed by {@code :}.
 * The output component covers the scheme without the colon.
 */
public final class SchemeCanonicalizer
{
    private SchemeCanonicalizer()
    {
    }

    public static boolean canonicalize(byte[] spec, Component scheme, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), scheme, output, parsed);
    }

    public static boolean canonicalize(CharSequence spec, Component scheme, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), scheme, output, parsed);
    }

    /**
     * A canonical URL always has a scheme; a missing one is written as an
     * empty scheme (just the colon) and reported as a failure.
     *
     * @return false if the scheme is missing or holds characters not allowed in a scheme
     */
    public static boolean canonicalize(UrlChars spec, Component scheme, CanonOutput output, Parsed parsed)
    {
        if (!scheme.isNonEmpty())
        {
            parsed.setScheme(Component.of(output.length(), 0));
            output.append(':');
            return false;
        }

        int begin = output.length();
        boolean success = true;
        int end = scheme.getEnd();
        int i = scheme.getBegin();
        while (i < end)
        {
            int c = spec.at(i);
            if (c >= 0x80)
            {
                CanonUtil.appendUtf8EscapedChar(spec, i, end, output);
                i += spec.codePointLength(i, end);
                success = false;
                continue;
            }
            if (isSchemeChar(c))
            {
                output.append(StringUtil.asciiToLowerCase(c));
            }
            else
            {
                CanonUtil.appendEscapedChar(c, output);
                success = false;
            }
            i++;
        }

        parsed.setScheme(Component.range(begin, output.length()));
        output.append(':');
        return success;
    }

    public static boolean isSchemeChar(int c)
    {
        return StringUtil.isAsciiAlphaNumeric(c) || c == '+' || c == '-' || c == '.';
    }
}
