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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.urlcanon.util.CanonOutputW;

/**
 * <p>A read-only URL source string in one of the two accepted encodings:
 * 8-bit code units holding UTF-8 ({@link #of(byte[])}) or wide UTF-16
 * code units ({@link #of(CharSequence)}).</p>
 *
 * <p>Canonicalizers only look at the source through this class, so both
 * encodings run through the same code. {@link #at(int)} returns the raw
 * unsigned code unit; {@link #codePointAt(int, int)} decodes a whole
 * character.</p>
 */
public abstract class UrlChars
{
    public static final int REPLACEMENT_CHARACTER = 0xFFFD;

    public static UrlChars of(byte[] utf8)
    {
        return new Utf8(Objects.requireNonNull(utf8));
    }

    public static UrlChars of(CharSequence utf16)
    {
        return new Utf16(Objects.requireNonNull(utf16));
    }

    public abstract int length();

    /**
     * @param index the offset of the code unit
     * @return the unsigned code unit at {@code index}
     */
    public abstract int at(int index);

    /**
     * @return true for UTF-16 sources, false for UTF-8 ones
     */
    public abstract boolean isWide();

    /**
     * Decodes the character starting at {@code index}.
     *
     * @return the code point in the low 32 bits, or -1 if the sequence is
     * invalid, and the number of code units consumed (at least one) in the
     * high 32 bits
     */
    protected abstract long decode(int index, int end);

    public abstract String substring(int begin, int end);

    /**
     * @param index the offset of the first code unit of the character
     * @param end the offset the character may not extend past
     * @return the code point, or -1 if the code units at {@code index} do not
     * form a valid character
     */
    public int codePointAt(int index, int end)
    {
        return (int)decode(index, end);
    }

    /**
     * @param index the offset of the first code unit of the character
     * @param end the offset the character may not extend past
     * @return how many code units the character at {@code index} spans; an
     * invalid sequence spans the code units that were examined, never zero
     */
    public int codePointLength(int index, int end)
    {
        return (int)(decode(index, end) >>> 32);
    }

    /**
     * @return the text of the component, or null if the component is absent
     */
    public String substring(Component component)
    {
        if (!component.isPresent())
            return null;
        return substring(component.getBegin(), component.getEnd());
    }

    /**
     * Appends {@code [begin, end)} as UTF-16 to {@code output}, substituting
     * {@link #REPLACEMENT_CHARACTER} for invalid sequences.
     *
     * @return false if a substitution was made
     */
    public boolean appendUtf16(int begin, int end, CanonOutputW output)
    {
        boolean success = true;
        int i = begin;
        while (i < end)
        {
            long decoded = decode(i, end);
            int codePoint = (int)decoded;
            if (codePoint < 0)
            {
                codePoint = REPLACEMENT_CHARACTER;
                success = false;
            }
            if (codePoint >= Character.MIN_SUPPLEMENTARY_CODE_POINT)
            {
                output.append(Character.highSurrogate(codePoint));
                output.append(Character.lowSurrogate(codePoint));
            }
            else
            {
                output.append(codePoint);
            }
            i += (int)(decoded >>> 32);
        }
        return success;
    }

    @Override
    public String toString()
    {
        return substring(0, length());
    }

    private static long decoded(int codePoint, int length)
    {
        return ((long)length << 32) | (codePoint & 0xFFFFFFFFL);
    }

    private static class Utf8 extends UrlChars
    {
        private final byte[] _bytes;

        private Utf8(byte[] bytes)
        {
            _bytes = bytes;
        }

        @Override
        public int length()
        {
            return _bytes.length;
        }

        @Override
        public int at(int index)
        {
            return _bytes[index] & 0xFF;
        }

        @Override
        public boolean isWide()
        {
            return false;
        }

        @Override
        protected long decode(int index, int end)
        {
            int b = _bytes[index] & 0xFF;

            // Is it plain ASCII?
            if (b < 0x80)
                return decoded(b, 1);

            int expectedContinuationBytes;
            int codePoint;
            int minCodePoint;
            if ((b & 0xe0) == 0xc0)
            {
                //110xxxxx
                expectedContinuationBytes = 1;
                codePoint = b & 0x1f;
                minCodePoint = 0x80;
            }
            else if ((b & 0xf0) == 0xe0)
            {
                //1110xxxx
                expectedContinuationBytes = 2;
                codePoint = b & 0x0f;
                minCodePoint = 0x800;
            }
            else if ((b & 0xf8) == 0xf0)
            {
                //11110xxx
                expectedContinuationBytes = 3;
                codePoint = b & 0x07;
                minCodePoint = 0x10000;
            }
            else
            {
                // continuation byte or 5/6 byte lead
                return decoded(-1, 1);
            }

            for (int i = 1; i <= expectedContinuationBytes; i++)
            {
                if (index + i >= end)
                    return decoded(-1, i);
                int c = _bytes[index + i] & 0xFF;
                // ! 10xxxxxx
                if ((c & 0xc0) != 0x80)
                    return decoded(-1, i);
                codePoint = (codePoint << 6) | (c & 0x3f);
            }

            int length = expectedContinuationBytes + 1;
            if (codePoint < minCodePoint ||
                (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) ||
                codePoint > Character.MAX_CODE_POINT)
                return decoded(-1, length);
            return decoded(codePoint, length);
        }

        @Override
        public String substring(int begin, int end)
        {
            return new String(_bytes, begin, end - begin, StandardCharsets.UTF_8);
        }
    }

    private static class Utf16 extends UrlChars
    {
        private final CharSequence _chars;

        private Utf16(CharSequence chars)
        {
            _chars = chars;
        }

        @Override
        public int length()
        {
            return _chars.length();
        }

        @Override
        public int at(int index)
        {
            return _chars.charAt(index);
        }

        @Override
        public boolean isWide()
        {
            return true;
        }

        @Override
        protected long decode(int index, int end)
        {
            char c = _chars.charAt(index);
            if (!Character.isSurrogate(c))
                return decoded(c, 1);
            if (Character.isHighSurrogate(c) && index + 1 < end)
            {
                char low = _chars.charAt(index + 1);
                if (Character.isLowSurrogate(low))
                    return decoded(Character.toCodePoint(c, low), 2);
            }
            return decoded(-1, 1);
        }

        @Override
        public String substring(int begin, int end)
        {
            return _chars.subSequence(begin, end).toString();
        }
    }
}
