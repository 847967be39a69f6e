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

package org.urlcanon.util;

/**
 * TYPE Utilities.
 * Hex conversions used when escaping and unescaping URL components.
 */
public class TypeUtil
{
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private TypeUtil()
    {
    }

    /**
     * @param c An ASCII encoded character 0-9 a-f A-F
     * @return The value of the character 0-16.
     * @throws NumberFormatException if the character is not a hex digit
     */
    public static int convertHexDigit(int c)
    {
        if (!StringUtil.isHex(c))
            throw new NumberFormatException("!hex " + c);
        return ((c & 0x1f) + ((c >> 6) * 0x19) - 0x10);
    }

    /**
     * @param nibble a value 0-15
     * @return the upper case hex digit for the value
     */
    public static char toHexDigit(int nibble)
    {
        return HEX_DIGITS[nibble & 0xF];
    }
}
