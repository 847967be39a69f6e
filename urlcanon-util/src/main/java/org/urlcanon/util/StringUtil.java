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
 * Fast String Utilities.
 *
 * These utilities work on single code units (8-bit or UTF-16, widened to
 * {@code int}) so the same checks serve both widths of URL input. Case
 * folding only touches ASCII; every other value is returned unchanged.
 */
public class StringUtil
{
    // @checkstyle-disable-check : IllegalTokenTextCheck
    private static final char[] LOWERCASES =
    {
        '\000', '\001', '\002', '\003', '\004', '\005', '\006', '\007',
        '\010', '\011', '\012', '\013', '\014', '\015', '\016', '\017',
        '\020', '\021', '\022', '\023', '\024', '\025', '\026', '\027',
        '\030', '\031', '\032', '\033', '\034', '\035', '\036', '\037',
        '\040', '\041', '\042', '\043', '\044', '\045', '\046', '\047',
        '\050', '\051', '\052', '\053', '\054', '\055', '\056', '\057',
        '\060', '\061', '\062', '\063', '\064', '\065', '\066', '\067',
        '\070', '\071', '\072', '\073', '\074', '\075', '\076', '\077',
        '\100', '\141', '\142', '\143', '\144', '\145', '\146', '\147',
        '\150', '\151', '\152', '\153', '\154', '\155', '\156', '\157',
        '\160', '\161', '\162', '\163', '\164', '\165', '\166', '\167',
        '\170', '\171', '\172', '\133', '\134', '\135', '\136', '\137',
        '\140', '\141', '\142', '\143', '\144', '\145', '\146', '\147',
        '\150', '\151', '\152', '\153', '\154', '\155', '\156', '\157',
        '\160', '\161', '\162', '\163', '\164', '\165', '\166', '\167',
        '\170', '\171', '\172', '\173', '\174', '\175', '\176', '\177'
    };

    private static final char[] UPPERCASES =
    {
        '\000', '\001', '\002', '\003', '\004', '\005', '\006', '\007',
        '\010', '\011', '\012', '\013', '\014', '\015', '\016', '\017',
        '\020', '\021', '\022', '\023', '\024', '\025', '\026', '\027',
        '\030', '\031', '\032', '\033', '\034', '\035', '\036', '\037',
        '\040', '\041', '\042', '\043', '\044', '\045', '\046', '\047',
        '\050', '\051', '\052', '\053', '\054', '\055', '\056', '\057',
        '\060', '\061', '\062', '\063', '\064', '\065', '\066', '\067',
        '\070', '\071', '\072', '\073', '\074', '\075', '\076', '\077',
        '\100', '\101', '\102', '\103', '\104', '\105', '\106', '\107',
        '\110', '\111', '\112', '\113', '\114', '\115', '\116', '\117',
        '\120', '\121', '\122', '\123', '\124', '\125', '\126', '\127',
        '\130', '\131', '\132', '\133', '\134', '\135', '\136', '\137',
        '\140', '\101', '\102', '\103', '\104', '\105', '\106', '\107',
        '\110', '\111', '\112', '\113', '\114', '\115', '\116', '\117',
        '\120', '\121', '\122', '\123', '\124', '\125', '\126', '\127',
        '\130', '\131', '\132', '\173', '\174', '\175', '\176', '\177'
    };
    // @checkstyle-enable-check : IllegalTokenTextCheck

    private StringUtil()
    {
    }

    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param c the code unit to convert
     * @return a lower case version of c
     */
    public static int asciiToLowerCase(int c)
    {
        return (c >= 0 && c < 0x80) ? LOWERCASES[c] : c;
    }

    /**
     * fast upper case conversion. Only works on ascii (not unicode)
     *
     * @param c the code unit to convert
     * @return a upper case version of c
     */
    public static int asciiToUpperCase(int c)
    {
        return (c >= 0 && c < 0x80) ? UPPERCASES[c] : c;
    }

    public static boolean isAsciiAlpha(int c)
    {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isAsciiDigit(int c)
    {
        return c >= '0' && c <= '9';
    }

    public static boolean isAsciiAlphaNumeric(int c)
    {
        return isAsciiAlpha(c) || isAsciiDigit(c);
    }

    public static boolean isHex(int c)
    {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * @param c the code unit
     * @return true for the C0 controls and space, which surround URLs
     * pasted from text and are trimmed from them
     */
    public static boolean isControlOrSpace(int c)
    {
        return c >= 0 && c <= 0x20;
    }

    public static boolean equalsIgnoreCaseAscii(String ascii, byte[] buf, int offset, int length)
    {
        if (ascii.length() != length)
            return false;
        for (int i = 0; i < length; i++)
        {
            if (asciiToLowerCase(ascii.charAt(i)) != asciiToLowerCase(buf[offset + i] & 0xFF))
                return false;
        }
        return true;
    }
}
