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
import org.urlcanon.util.TypeUtil;

/**
 * <p>Detects IP address literals and writes them in canonical form.</p>
 *
 * <p>IPv4 addresses are accepted in 1 to 4 dot separated parts, each one in
 * decimal, octal (leading {@code 0}) or hexadecimal (leading {@code 0x}).
 * The last part fills all remaining bytes, so {@code 127.1} is
 * {@code 127.0.0.1}. A single trailing dot is allowed. The canonical form is
 * four decimal octets.</p>
 *
 * <p>IPv6 addresses must be bracketed. Groups are 1 to 4 hex digits, a single
 * {@code ::} stands for one or more zero groups and the last 32 bits may be
 * written as a dotted IPv4 address. The canonical form is lower case hex
 * without leading zeros, with the first longest run of two or more zero
 * groups compressed to {@code ::}.</p>
 */
public final class IPAddressCanonicalizer
{
    private static final int IPV4_BYTES = 4;
    private static final int IPV6_GROUPS = 8;
    private static final long NEUTRAL_PART = -1;
    private static final long BROKEN_PART = -2;
    private static final long MAX_IPV4 = 0xFFFFFFFFL;

    private IPAddressCanonicalizer()
    {
    }

    public static HostInfo canonicalize(byte[] spec, Component host, CanonOutput output)
    {
        return canonicalize(UrlChars.of(spec), host, output);
    }

    public static HostInfo canonicalize(CharSequence spec, Component host, CanonOutput output)
    {
        return canonicalize(UrlChars.of(spec), host, output);
    }

    /**
     * Writes the canonical address when the host is an IP literal. Nothing
     * is written for {@link HostInfo.Family#NEUTRAL} or
     * {@link HostInfo.Family#BROKEN} results, whose host Component is absent.
     *
     * @param spec the source
     * @param host the host range, without any escapes
     * @param output the buffer receiving a canonical address
     * @return the kind of host found
     */
    public static HostInfo canonicalize(UrlChars spec, Component host, CanonOutput output)
    {
        if (!host.isNonEmpty())
            return new HostInfo(HostInfo.Family.NEUTRAL, Component.ABSENT);

        int begin = host.getBegin();
        int end = host.getEnd();

        byte[] ipv4 = new byte[IPV4_BYTES];
        HostInfo.Family family = parseIPv4(spec, begin, end, ipv4, false);
        if (family == HostInfo.Family.IPV4)
        {
            int outBegin = output.length();
            appendIPv4(ipv4, output);
            return new HostInfo(family, Component.range(outBegin, output.length()), ipv4);
        }
        if (family == HostInfo.Family.BROKEN)
            return new HostInfo(family, Component.ABSENT);

        if (end - begin >= 2 && spec.at(begin) == '[' && spec.at(end - 1) == ']')
        {
            byte[] ipv6 = new byte[IPV6_GROUPS * 2];
            if (!parseIPv6(spec, begin + 1, end - 1, ipv6))
                return new HostInfo(HostInfo.Family.BROKEN, Component.ABSENT);
            int outBegin = output.length();
            output.append('[');
            appendIPv6(ipv6, output);
            output.append(']');
            return new HostInfo(HostInfo.Family.IPV6, Component.range(outBegin, output.length()), ipv6);
        }

        return new HostInfo(HostInfo.Family.NEUTRAL, Component.ABSENT);
    }

    /**
     * @param fourParts true if exactly four dotted parts are required, as in an IPv6 tail
     * @return {@code IPV4} with the address filled in, {@code NEUTRAL} if the
     * text is not an IPv4 address or {@code BROKEN} if it is one that does not fit
     */
    private static HostInfo.Family parseIPv4(UrlChars spec, int begin, int end, byte[] address, boolean fourParts)
    {
        int[] parts = new int[IPV4_BYTES * 2];
        int count = 0;
        int partBegin = begin;
        for (int i = begin; i <= end; i++)
        {
            if (i < end && spec.at(i) != '.')
            {
                if (!CanonUtil.isCharOfType(spec.at(i), CanonUtil.IPV4))
                    return HostInfo.Family.NEUTRAL;
                continue;
            }

            if (i == partBegin)
            {
                // Only the part after a single trailing dot may be empty
                if (i == end && count > 0 && !fourParts)
                    break;
                return HostInfo.Family.NEUTRAL;
            }
            if (count == IPV4_BYTES)
                return HostInfo.Family.NEUTRAL;
            parts[2 * count] = partBegin;
            parts[2 * count + 1] = i;
            count++;
            partBegin = i + 1;
        }
        if (fourParts && count != IPV4_BYTES)
            return HostInfo.Family.NEUTRAL;

        long[] values = new long[count];
        boolean broken = false;
        for (int p = 0; p < count; p++)
        {
            values[p] = parseIPv4Part(spec, parts[2 * p], parts[2 * p + 1]);
            if (values[p] == NEUTRAL_PART)
                return HostInfo.Family.NEUTRAL;
            if (values[p] == BROKEN_PART)
                broken = true;
        }
        if (broken)
            return HostInfo.Family.BROKEN;

        for (int p = 0; p < count - 1; p++)
        {
            if (values[p] > 0xFF)
                return HostInfo.Family.BROKEN;
            address[p] = (byte)values[p];
        }

        long last = values[count - 1];
        int remainingBytes = IPV4_BYTES - (count - 1);
        if (last >= (1L << (8 * remainingBytes)))
            return HostInfo.Family.BROKEN;
        for (int b = IPV4_BYTES - 1; b >= count - 1; b--)
        {
            address[b] = (byte)last;
            last >>= 8;
        }
        return HostInfo.Family.IPV4;
    }

    /**
     * @return the value, {@link #NEUTRAL_PART} if a character is not a digit
     * of the part's radix, or {@link #BROKEN_PART} if the value exceeds 32 bits
     */
    private static long parseIPv4Part(UrlChars spec, int begin, int end)
    {
        int radix = 10;
        int type = CanonUtil.DEC;
        if (end - begin >= 2 && spec.at(begin) == '0' && (spec.at(begin + 1) == 'x' || spec.at(begin + 1) == 'X'))
        {
            radix = 16;
            type = CanonUtil.HEX;
            begin += 2;
        }
        else if (end - begin >= 2 && spec.at(begin) == '0')
        {
            radix = 8;
            type = CanonUtil.OCT;
            begin++;
        }

        long value = 0;
        boolean tooBig = false;
        for (int i = begin; i < end; i++)
        {
            int c = spec.at(i);
            if (!CanonUtil.isCharOfType(c, type))
                return NEUTRAL_PART;
            if (tooBig)
                continue;
            value = value * radix + TypeUtil.convertHexDigit(c);
            if (value > MAX_IPV4)
                tooBig = true;
        }
        return tooBig ? BROKEN_PART : value;
    }

    private static boolean parseIPv6(UrlChars spec, int begin, int end, byte[] address)
    {
        int[] groups = new int[IPV6_GROUPS];
        int count = 0;
        int contraction = -1;

        int i = begin;
        if (i == end)
            return false;
        if (spec.at(i) == ':')
        {
            if (end - i < 2 || spec.at(i + 1) != ':')
                return false;
            contraction = 0;
            i += 2;
        }

        while (i < end)
        {
            int partBegin = i;
            while (i < end && StringUtil.isHex(spec.at(i)))
            {
                i++;
            }

            if (i < end && spec.at(i) == '.')
            {
                // Dotted IPv4 tail, which must end the address
                if (count > IPV6_GROUPS - 2 || spec.at(end - 1) == '.')
                    return false;
                byte[] ipv4 = new byte[IPV4_BYTES];
                if (parseIPv4(spec, partBegin, end, ipv4, true) != HostInfo.Family.IPV4)
                    return false;
                groups[count++] = ((ipv4[0] & 0xFF) << 8) | (ipv4[1] & 0xFF);
                groups[count++] = ((ipv4[2] & 0xFF) << 8) | (ipv4[3] & 0xFF);
                break;
            }

            int length = i - partBegin;
            if (length == 0 || length > 4 || count == IPV6_GROUPS)
                return false;
            int group = 0;
            for (int j = partBegin; j < i; j++)
            {
                group = (group << 4) | TypeUtil.convertHexDigit(spec.at(j));
            }
            groups[count++] = group;

            if (i == end)
                break;
            if (spec.at(i) != ':')
                return false;
            i++;
            if (i == end)
                return false;
            if (spec.at(i) == ':')
            {
                if (contraction >= 0)
                    return false;
                contraction = count;
                i++;
            }
        }

        int zeroGroups = IPV6_GROUPS - count;
        if (contraction < 0 ? zeroGroups != 0 : zeroGroups < 1)
            return false;

        int g = 0;
        for (int p = 0; p < count; p++)
        {
            if (p == contraction)
                g += zeroGroups;
            address[2 * g] = (byte)(groups[p] >> 8);
            address[2 * g + 1] = (byte)groups[p];
            g++;
        }
        return true;
    }

    private static void appendIPv4(byte[] address, CanonOutput output)
    {
        for (int b = 0; b < IPV4_BYTES; b++)
        {
            if (b > 0)
                output.append('.');
            output.append(Integer.toString(address[b] & 0xFF));
        }
    }

    private static void appendIPv6(byte[] address, CanonOutput output)
    {
        int runBegin = -1;
        int runLength = 0;
        int g = 0;
        while (g < IPV6_GROUPS)
        {
            if (group(address, g) != 0)
            {
                g++;
                continue;
            }
            int zeroBegin = g;
            while (g < IPV6_GROUPS && group(address, g) == 0)
            {
                g++;
            }
            if (g - zeroBegin > runLength)
            {
                runBegin = zeroBegin;
                runLength = g - zeroBegin;
            }
        }
        if (runLength < 2)
            runBegin = -1;

        for (g = 0; g < IPV6_GROUPS; g++)
        {
            if (g == runBegin)
            {
                output.append(g == 0 ? "::" : ":");
                g += runLength - 1;
                continue;
            }
            output.append(Integer.toHexString(group(address, g)));
            if (g < IPV6_GROUPS - 1)
                output.append(':');
        }
    }

    private static int group(byte[] address, int g)
    {
        return ((address[2 * g] & 0xFF) << 8) | (address[2 * g + 1] & 0xFF);
    }
}
