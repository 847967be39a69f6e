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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.urlcanon.util.RawCanonOutput;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class JavaCharsetConverterTest
{
    public static Stream<Arguments> conversions()
    {
        return Stream.of(
            Arguments.of(StandardCharsets.UTF_8, "aé", new byte[]{'a', (byte)0xC3, (byte)0xA9}),
            Arguments.of(StandardCharsets.ISO_8859_1, "aé", new byte[]{'a', (byte)0xE9}),
            Arguments.of(StandardCharsets.ISO_8859_1, "你", "%26%2320320%3B".getBytes(StandardCharsets.US_ASCII)),
            Arguments.of(StandardCharsets.US_ASCII, "😀", "%26%23128512%3B".getBytes(StandardCharsets.US_ASCII)),
            Arguments.of(StandardCharsets.ISO_8859_1, "x\uD800", "x%26%2365533%3B".getBytes(StandardCharsets.US_ASCII)),
            Arguments.of(StandardCharsets.UTF_8, "\uDC00", new byte[]{(byte)0xEF, (byte)0xBF, (byte)0xBD}),
            Arguments.of(StandardCharsets.UTF_16BE, "A", new byte[]{0, 'A'}),
            Arguments.of(StandardCharsets.UTF_8, "", new byte[0])
        );
    }

    @ParameterizedTest
    @MethodSource("conversions")
    public void testConvertFromUtf16(Charset charset, String input, byte[] expected)
    {
        RawCanonOutput output = new RawCanonOutput();
        new JavaCharsetConverter(charset).convertFromUtf16(input.toCharArray(), 0, input.length(), output);

        assertThat(charset + " " + input, Arrays.copyOf(output.getData(), output.length()), is(expected));
    }

    @Test
    public void testConvertRange()
    {
        char[] input = "xxéyy".toCharArray();
        RawCanonOutput output = new RawCanonOutput();
        output.append('>');
        new JavaCharsetConverter(StandardCharsets.ISO_8859_1).convertFromUtf16(input, 2, 1, output);

        assertThat(output.length(), is(2));
        assertThat(output.at(0), is((byte)'>'));
        assertThat(output.at(1), is((byte)0xE9));
    }

    @Test
    public void testShiftJis()
    {
        Charset sjis = Charset.forName("Shift_JIS");
        RawCanonOutput output = new RawCanonOutput();
        String input = "あ";
        new JavaCharsetConverter(sjis).convertFromUtf16(input.toCharArray(), 0, input.length(), output);

        assertThat(Arrays.copyOf(output.getData(), output.length()), is(input.getBytes(sjis)));
    }

    @Test
    public void testToString()
    {
        assertThat(new JavaCharsetConverter(StandardCharsets.UTF_8).toString(), containsString("UTF-8"));
        assertThrows(NullPointerException.class, () -> new JavaCharsetConverter(null));
    }
}
