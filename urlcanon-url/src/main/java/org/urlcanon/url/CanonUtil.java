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

import org.urlcanon.util.CanonOutput;
import org.urlcanon.util.StringUtil;
import org.urlcanon.util.TypeUtil;

/**
 * Character classes and escaping shared by the component canonicalizers.
 */
final class CanonUtil
{
    /**
     * Valid unescaped in a query.
     */
    static final int QUERY = 1;
    /**
     * Valid unescaped in a user name or password.
     */
    static final int USERINFO = 1 << 1;
    /**
     * May appear in an IPv4 address in any of its forms.
     */
    static final int IPV4 = 1 << 2;
    static final int HEX = 1 << 3;
    static final int DEC = 1 << 4;
    static final int OCT = 1 << 5;
    /**
     * Valid unescaped in a path.
     */
    static final int PATH = 1 << 6;
    /**
     * Never needs escaping anywhere; escapes of these are decoded in paths.
     */
    static final int UNRESERVED = 1 << 7;

    private static final int[] CHAR_TYPES = new int[0x80];

    static
    {
        for (int c = 0x21; c < 0x7F; c++)
        {
            CHAR_TYPES[c] |= QUERY;
        }
        for (char c : "\"#<>".toCharArray())
        {
            CHAR_TYPES[c] &= ~QUERY;
        }

        for (int c = 0x21; c < 0x7F; c++)
        {
            CHAR_TYPES[c] |= PATH;
        }
        for (char c : "\"#<>?`{}".toCharArray())
        {
            CHAR_TYPES[c] &= ~PATH;
        }

        for (int c = 0; c < 0x80; c++)
        {
            if (StringUtil.isAsciiAlphaNumeric(c))
                CHAR_TYPES[c] |= USERINFO | UNRESERVED;
        }
        for (char c : "-._~".toCharArray())
        {
            CHAR_TYPES[c] |= UNRESERVED;
        }
        for (char c : "-._~!$&'()*+,;=%".toCharArray())
        {
            CHAR_TYPES[c] |= USERINFO;
        }

        for (int c = '0'; c <= '9'; c++)
        {
            CHAR_TYPES[c] |= HEX | DEC | IPV4;
            if (c <= '7')
                CHAR_TYPES[c] |= OCT;
        }
        for (int c = 'a'; c <= 'f'; c++)
        {
            CHAR_TYPES[c] |= HEX | IPV4;
            CHAR_TYPES[StringUtil.asciiToUpperCase(c)] |= HEX | IPV4;
        }
        CHAR_TYPES['x'] |= IPV4;
        CHAR_TYPES['X'] |= IPV4;
        CHAR_TYPES['.'] |= IPV4;
    }

    private CanonUtil()
    {
    }

    static boolean isCharOfType(int c, int type)
    {
        return c >= 0 && c < 0x80 && (CHAR_TYPES[c] & type) != 0;
    }

    /**
     * Appends {@code %XX} for the low 8 bits of {@code b}, upper case hex.
     */
    static void appendEscapedChar(int b, CanonOutput output)
    {
        output.append('%');
        output.append(TypeUtil.toHexDigit(b >> 4));
        output.append(TypeUtil.toHexDigit(b));
    }

    /**
     * Appends the UTF-8 encoding of a code point, unescaped.
     */
    static void appendUtf8Value(int codePoint, CanonOutput output)
    {
        if (codePoint < 0x80)
        {
            output.append(codePoint);
        }
        else if (codePoint < 0x800)
        {
            output.append(0xC0 | (codePoint >> 6));
            output.append(0x80 | (codePoint & 0x3F));
        }
        else if (codePoint < 0x10000)
        {
            output.append(0xE0 | (codePoint >> 12));
            output.append(0x80 | ((codePoint >> 6) & 0x3F));
            output.append(0x80 | (codePoint & 0x3F));
        }
        else
        {
            output.append(0xF0 | (codePoint >> 18));
            output.append(0x80 | ((codePoint >> 12) & 0x3F));
            output.append(0x80 | ((codePoint >> 6) & 0x3F));
            output.append(0x80 | (codePoint & 0x3F));
        }
    }

    /**
     * Appends the UTF-8 encoding of a code point, every byte escaped.
     */
    static void appendUtf8EscapedValue(int codePoint, CanonOutput output)
    {
        if (codePoint < 0x80)
        {
            appendEscapedChar(codePoint, output);
        }
        else if (codePoint < 0x800)
        {
            appendEscapedChar(0xC0 | (codePoint >> 6), output);
            appendEscapedChar(0x80 | (codePoint & 0x3F), output);
        }
        else if (codePoint < 0x10000)
        {
            appendEscapedChar(0xE0 | (codePoint >> 12), output);
            appendEscapedChar(0x80 | ((codePoint >> 6) & 0x3F), output);
            appendEscapedChar(0x80 | (codePoint & 0x3F), output);
        }
        else
        {
            appendEscapedChar(0xF0 | (codePoint >> 18), output);
            appendEscapedChar(0x80 | ((codePoint >> 12) & 0x3F), output);
            appendEscapedChar(0x80 | ((codePoint >> 6) & 0x3F), output);
            appendEscapedChar(0x80 | (codePoint & 0x3F), output);
        }
    }

    /**
     * Reads the character at {@code index} and appends its escaped UTF-8
     * form. The caller advances by {@link UrlChars#codePointLength(int, int)}.
     *
     * @return false if the character was invalid and U+FFFD was written instead
     */
    static boolean appendUtf8EscapedChar(UrlChars source, int index, int end, CanonOutput output)
    {
        int codePoint = source.codePointAt(index, end);
        if (codePoint < 0)
        {
            appendUtf8EscapedValue(UrlChars.REPLACEMENT_CHARACTER, output);
            return false;
        }
        appendUtf8EscapedValue(codePoint, output);
        return true;
    }

    /**
     * @param index the offset of a {@code %}
     * @return the escaped byte value, or -1 if no two hex digits follow
     */
    static int decodeEscaped(UrlChars source, int index, int end)
    {
        if (index + 2 >= end)
            return -1;
        int hi = source.at(index + 1);
        int lo = source.at(index + 2);
        if (!StringUtil.isHex(hi) || !StringUtil.isHex(lo))
            return -1;
        return (TypeUtil.convertHexDigit(hi) << 4) | TypeUtil.convertHexDigit(lo);
    }

    /**
     * Copies {@code [begin, end)} escaping every ASCII character not of the
     * given type; non-ASCII characters are written as escaped UTF-8.
     *
     * @return false if an invalid character sequence was replaced
     */
    static boolean appendStringOfType(UrlChars source, int begin, int end, int type, CanonOutput output)
    {
        boolean success = true;
        int i = begin;
        while (i < end)
        {
            int c = source.at(i);
            if (c < 0x80)
            {
                if (isCharOfType(c, type))
                    output.append(c);
                else
                    appendEscapedChar(c, output);
                i++;
            }
            else
            {
                success &= appendUtf8EscapedChar(source, i, end, output);
                i += source.codePointLength(i, end);
            }
        }
        return success;
    }

    /**
     * Appends an already canonical 8-bit range, such as part of a canonical base URL.
     */
    static void appendRange(UrlChars source, int begin, int end, CanonOutput output)
    {
        for (int i = begin; i < end; i++)
        {
            output.append(source.at(i));
        }
    }

    /**
     * @return the text of an ASCII component already written to the output
     */
    static String outputString(CanonOutput output, Component component)
    {
        if (!component.isPresent())
            return null;
        return new String(output.getData(), component.getBegin(), component.getLength(), StandardCharsets.US_ASCII);
    }
}
