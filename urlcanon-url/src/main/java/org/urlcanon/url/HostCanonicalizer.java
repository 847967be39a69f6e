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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urlcanon.util.CanonOutput;
import org.urlcanon.util.RawCanonOutput;
import org.urlcanon.util.RawCanonOutputW;
import org.urlcanon.util.StringUtil;

/**
 * <p>Canonicalizes the host of an authority.</p>
 *
 * <p>A bracketed host must be an IPv6 literal. Any other host is un-escaped,
 * converted to ASCII by the {@link IdnConverter} if it holds non-ASCII
 * characters, checked against {@link #isValidHostCharacter(int)} and lower
 * cased. The result is then checked for an IPv4 literal, which is replaced
 * by its canonical dotted form.</p>
 *
 * <p>A host that fails is still written, with the offending characters
 * escaped, and reported as {@link HostInfo.Family#BROKEN}.</p>
 */
public final class HostCanonicalizer
{
    private static final Logger LOG = LoggerFactory.getLogger(HostCanonicalizer.class);

    private HostCanonicalizer()
    {
    }

    public static boolean canonicalize(byte[] spec, Component host, IdnConverter idnConverter, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), host, idnConverter, output, parsed);
    }

    public static boolean canonicalize(CharSequence spec, Component host, IdnConverter idnConverter, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), host, idnConverter, output, parsed);
    }

    /**
     * @param idnConverter the converter for non-ASCII host names, or null to reject them
     * @return false if the host could not be canonicalized
     */
    public static boolean canonicalize(UrlChars spec, Component host, IdnConverter idnConverter, CanonOutput output, Parsed parsed)
    {
        HostInfo info = canonicalizeHost(spec, host, idnConverter, output);
        parsed.setHost(info.getHost());
        return !info.isBroken();
    }

    public static HostInfo canonicalizeHost(byte[] spec, Component host, IdnConverter idnConverter, CanonOutput output)
    {
        return canonicalizeHost(UrlChars.of(spec), host, idnConverter, output);
    }

    public static HostInfo canonicalizeHost(CharSequence spec, Component host, IdnConverter idnConverter, CanonOutput output)
    {
        return canonicalizeHost(UrlChars.of(spec), host, idnConverter, output);
    }

    /**
     * @return the kind of host written and where; an absent host gives an
     * absent Component, an empty host an empty one
     */
    public static HostInfo canonicalizeHost(UrlChars spec, Component host, IdnConverter idnConverter, CanonOutput output)
    {
        if (!host.isPresent())
            return new HostInfo(HostInfo.Family.NEUTRAL, Component.ABSENT);
        int begin = output.length();
        if (host.getLength() == 0)
            return new HostInfo(HostInfo.Family.NEUTRAL, Component.of(begin, 0));

        int hostBegin = host.getBegin();
        int hostEnd = host.getEnd();
        if (spec.at(hostBegin) == '[')
        {
            HostInfo info = IPAddressCanonicalizer.canonicalize(spec, host, output);
            if (info.getFamily() == HostInfo.Family.IPV6)
                return info;
            CanonUtil.appendStringOfType(spec, hostBegin, hostEnd, CanonUtil.QUERY, output);
            if (LOG.isDebugEnabled())
                LOG.debug("Invalid IPv6 literal {}", spec.substring(host));
            return new HostInfo(HostInfo.Family.BROKEN, Component.range(begin, output.length()));
        }

        RawCanonOutput unescaped = new RawCanonOutput();
        boolean success = unescape(spec, hostBegin, hostEnd, unescaped);
        UrlChars name = UrlChars.of(Arrays.copyOf(unescaped.getData(), unescaped.length()));
        if (success && !isAscii(unescaped))
        {
            if (idnConverter == null)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("No IDN converter for non-ASCII host {}", spec.substring(host));
                success = false;
            }
            else
            {
                UrlChars ascii = toAscii(name, idnConverter);
                if (ascii == null)
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("IDN conversion failed for host {}", spec.substring(host));
                    success = false;
                }
                else
                {
                    name = ascii;
                }
            }
        }

        success &= appendName(name, output);
        int end = output.length();
        if (!success)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Invalid host {}", spec.substring(host));
            return new HostInfo(HostInfo.Family.BROKEN, Component.range(begin, end));
        }

        byte[] written = Arrays.copyOfRange(output.getData(), begin, end);
        RawCanonOutput address = new RawCanonOutput();
        HostInfo info = IPAddressCanonicalizer.canonicalize(written, Component.of(0, written.length), address);
        switch (info.getFamily())
        {
            case IPV4:
                output.setLength(begin);
                output.append(address.getData(), 0, address.length());
                return new HostInfo(HostInfo.Family.IPV4, Component.range(begin, output.length()), info.getAddress());
            case BROKEN:
                if (LOG.isDebugEnabled())
                    LOG.debug("IPv4 address out of range {}", spec.substring(host));
                return new HostInfo(HostInfo.Family.BROKEN, Component.range(begin, end));
            default:
                return new HostInfo(HostInfo.Family.NEUTRAL, Component.range(begin, end));
        }
    }

    /**
     * @param c a code unit of an un-escaped host name
     * @return true if the character may appear in a canonical host name
     */
    public static boolean isValidHostCharacter(int c)
    {
        return StringUtil.isAsciiAlphaNumeric(c) || c == '-' || c == '.' || c == '_';
    }

    /**
     * Decodes percent escapes and writes non-ASCII characters as UTF-8.
     *
     * @return false if an invalid character sequence was replaced
     */
    private static boolean unescape(UrlChars spec, int begin, int end, CanonOutput output)
    {
        boolean success = true;
        int i = begin;
        while (i < end)
        {
            int c = spec.at(i);
            if (c == '%')
            {
                int value = CanonUtil.decodeEscaped(spec, i, end);
                if (value >= 0)
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
        return success;
    }

    private static boolean isAscii(CanonOutput output)
    {
        byte[] data = output.getData();
        for (int i = 0; i < output.length(); i++)
        {
            if (data[i] < 0)
                return false;
        }
        return true;
    }

    /**
     * @return the converted name, or null if it is not valid UTF-8 or the converter failed
     */
    private static UrlChars toAscii(UrlChars name, IdnConverter idnConverter)
    {
        RawCanonOutputW utf16 = new RawCanonOutputW();
        if (!name.appendUtf16(0, name.length(), utf16))
            return null;
        RawCanonOutputW ascii = new RawCanonOutputW();
        if (!idnConverter.toAscii(utf16.getData(), 0, utf16.length(), ascii))
            return null;
        return UrlChars.of(ascii.toString());
    }

    /**
     * Writes the name lower cased, escaping every character that is not a
     * valid host character. Bytes of an 8-bit name are escaped one by one.
     *
     * @return false if any character had to be escaped
     */
    private static boolean appendName(UrlChars name, CanonOutput output)
    {
        boolean success = true;
        int end = name.length();
        int i = 0;
        while (i < end)
        {
            int c = name.at(i);
            if (c >= 0x80 && name.isWide())
            {
                CanonUtil.appendUtf8EscapedChar(name, i, end, output);
                i += name.codePointLength(i, end);
                success = false;
                continue;
            }
            if (isValidHostCharacter(c))
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
        return success;
    }
}
