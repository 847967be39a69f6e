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
 * <p>Canonicalizes the port as {@code :port} in decimal without leading
 * zeros. The port is left out entirely, colon included, when it is empty
 * or equal to the default port of the scheme.</p>
 *
 * <p>A port that is not all digits or not within {@code 0..65535} fails;
 * the original text is still written after the colon so the broken URL
 * remains recognizable.</p>
 */
public final class PortCanonicalizer
{
    public static final int PORT_UNSPECIFIED = -1;
    public static final int PORT_INVALID = -2;
    public static final int MAX_PORT = 65535;

    private PortCanonicalizer()
    {
    }

    public static boolean canonicalize(byte[] spec, Component port, int defaultPortForScheme, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), port, defaultPortForScheme, output, parsed);
    }

    public static boolean canonicalize(CharSequence spec, Component port, int defaultPortForScheme, CanonOutput output, Parsed parsed)
    {
        return canonicalize(UrlChars.of(spec), port, defaultPortForScheme, output, parsed);
    }

    /**
     * @param defaultPortForScheme the default port, or {@link #PORT_UNSPECIFIED} if the scheme has none
     * @return false if the port is not a valid port number
     */
    public static boolean canonicalize(UrlChars spec, Component port, int defaultPortForScheme, CanonOutput output, Parsed parsed)
    {
        int value = parsePort(spec, port);
        if (value == PORT_UNSPECIFIED || value == defaultPortForScheme)
        {
            parsed.setPort(Component.ABSENT);
            return true;
        }

        output.append(':');
        int begin = output.length();
        if (value == PORT_INVALID)
        {
            CanonUtil.appendStringOfType(spec, port.getBegin(), port.getEnd(), CanonUtil.QUERY, output);
            parsed.setPort(Component.range(begin, output.length()));
            return false;
        }

        output.append(Integer.toString(value));
        parsed.setPort(Component.range(begin, output.length()));
        return true;
    }

    /**
     * @return the port number, {@link #PORT_UNSPECIFIED} if the port is
     * absent or empty, or {@link #PORT_INVALID} if it is not a number
     * within {@code 0..65535}
     */
    public static int parsePort(UrlChars spec, Component port)
    {
        if (!port.isNonEmpty())
            return PORT_UNSPECIFIED;

        int end = port.getEnd();
        int i = port.getBegin();
        while (i < end - 1 && spec.at(i) == '0')
        {
            i++;
        }
        if (end - i > 5)
            return PORT_INVALID;

        int value = 0;
        for (; i < end; i++)
        {
            int c = spec.at(i);
            if (!StringUtil.isAsciiDigit(c))
                return PORT_INVALID;
            value = value * 10 + (c - '0');
        }
        return value > MAX_PORT ? PORT_INVALID : value;
    }
}
