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

import java.net.IDN;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urlcanon.util.CanonOutputW;

/**
 * An {@link IdnConverter} using {@link IDN#toASCII(String, int)}.
 */
public class JavaIdnConverter implements IdnConverter
{
    private static final Logger LOG = LoggerFactory.getLogger(JavaIdnConverter.class);

    private final int _flags;

    public JavaIdnConverter()
    {
        this(0);
    }

    /**
     * @param flags {@link IDN#ALLOW_UNASSIGNED} and {@link IDN#USE_STD3_ASCII_RULES}, or 0
     */
    public JavaIdnConverter(int flags)
    {
        _flags = flags;
    }

    @Override
    public boolean toAscii(char[] input, int offset, int length, CanonOutputW output)
    {
        String name = new String(input, offset, length);
        try
        {
            output.append(IDN.toASCII(name, _flags));
            return true;
        }
        catch (IllegalArgumentException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Cannot convert {} to ASCII", name, x);
            return false;
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{flags=%d}", getClass().getSimpleName(), hashCode(), _flags);
    }
}
