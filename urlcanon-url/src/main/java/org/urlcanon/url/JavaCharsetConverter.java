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

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.util.Objects;

import org.urlcanon.util.CanonOutput;

/**
 * <p>A {@link CharsetConverter} for any {@link Charset} of the JDK.</p>
 *
 * <p>Characters the charset cannot encode are written as escaped numeric
 * character references. Unpaired surrogates are converted as U+FFFD.
 * Charsets that write a byte order mark or keep shift state across
 * characters are not suitable.</p>
 */
public class JavaCharsetConverter implements CharsetConverter
{
    private final Charset _charset;

    public JavaCharsetConverter(Charset charset)
    {
        _charset = Objects.requireNonNull(charset);
    }

    public Charset getCharset()
    {
        return _charset;
    }

    @Override
    public void convertFromUtf16(char[] input, int offset, int length, CanonOutput output)
    {
        CharsetEncoder encoder = _charset.newEncoder();
        int end = offset + length;
        int i = offset;
        while (i < end)
        {
            char c = input[i];
            int codePoint;
            int count = 1;
            if (Character.isHighSurrogate(c) && i + 1 < end && Character.isLowSurrogate(input[i + 1]))
            {
                codePoint = Character.toCodePoint(c, input[i + 1]);
                count = 2;
            }
            else if (Character.isSurrogate(c))
            {
                codePoint = UrlChars.REPLACEMENT_CHARACTER;
            }
            else
            {
                codePoint = c;
            }

            String character = new String(Character.toChars(codePoint));
            if (encoder.canEncode(character))
            {
                ByteBuffer bytes = _charset.encode(character);
                output.append(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
            }
            else
            {
                output.append("%26%23");
                output.append(Integer.toString(codePoint));
                output.append("%3B");
            }
            i += count;
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), _charset);
    }
}
