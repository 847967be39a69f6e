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

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StringUtilTest
{
    @Test
    public void testAsciiCase()
    {
        assertThat(StringUtil.asciiToLowerCase('A'), is((int)'a'));
        assertThat(StringUtil.asciiToLowerCase('z'), is((int)'z'));
        assertThat(StringUtil.asciiToLowerCase('%'), is((int)'%'));
        assertThat(StringUtil.asciiToUpperCase('c'), is((int)'C'));
        assertThat(StringUtil.asciiToLowerCase(0xC9), is(0xC9));
    }

    @Test
    public void testEqualsIgnoreCaseAscii()
    {
        byte[] buf = "xxFiLe:".getBytes(StandardCharsets.US_ASCII);
        assertTrue(StringUtil.equalsIgnoreCaseAscii("file", buf, 2, 4));
        assertFalse(StringUtil.equalsIgnoreCaseAscii("file", buf, 2, 5));
        assertFalse(StringUtil.equalsIgnoreCaseAscii("http", buf, 2, 4));
    }

    @Test
    public void testControlOrSpace()
    {
        assertTrue(StringUtil.isControlOrSpace(' '));
        assertTrue(StringUtil.isControlOrSpace('\t'));
        assertTrue(StringUtil.isControlOrSpace(0));
        assertFalse(StringUtil.isControlOrSpace('!'));
        assertFalse(StringUtil.isControlOrSpace(0xA0));
    }

    @Test
    public void testConvertHexDigit()
    {
        assertThat(TypeUtil.convertHexDigit('0'), is(0));
        assertThat(TypeUtil.convertHexDigit('9'), is(9));
        assertThat(TypeUtil.convertHexDigit('a'), is(10));
        assertThat(TypeUtil.convertHexDigit('F'), is(15));
        assertThat(TypeUtil.toHexDigit(0xAB), is('B'));
    }

    @ParameterizedTest
    @ValueSource(chars = {'g', 'G', ':', '@', '/', ' '})
    public void testConvertBadHexDigit(char c)
    {
        assertThrows(NumberFormatException.class, () -> TypeUtil.convertHexDigit(c));
    }
}
