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

/**
 * <p>Canonicalizes the reference fragment as {@code #ref}. This is the only
 * part of a canonical URL that is not ASCII: non-ASCII characters are kept as
 * raw UTF-8, control characters are escaped and NULs are dropped.</p>
 *
 * <p>Invalid UTF-8 or UTF-16 is replaced by U+FFFD. The return value reports
 * the replacement, but a broken fragment does not make the URL invalid and
 * the whole-URL canonicalizers ignore it.</p>
 */
public final class RefCanonicalizer
{
    private RefCanonicalizer()
    {
    }

    public static boolean canonicalize(byte[] spec, Component ref, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), ref, output, parsed);
    }

    public static boolean canonicalize(CharSequence spec, Component ref, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), ref, output, parsed);
    }

    /**
     * @return false if an invalid character sequence was replaced
     */
    public static boolean canonicalize(UrlChars spec, Component ref, CanonOutput output, Parsed parsed)
    {
        if (!ref.isPresent())
        {
            parsed.setRef(Component.ABSENT);
            return true;
        }

        output.append('#');
        int begin = output.length();
        boolean success = true;
        int end = ref.getEnd();
        int i = ref.getBegin();
        while (i < end)
        {
            int c = spec.at(i);
            if (c == 0)
            {
                i++;
            }
            else if (c < 0x20 || c == 0x7F)
            {
                CanonUtil.appendEscapedChar(c, output);
                i++;
            }
            else if (c < 0x80)
            {
                output.append(c);
                i++;
            }
            else
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
        }

        parsed.setRef(Component.range(begin, output.length()));
        return success;
    }
}
