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
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.urlcanon.util.RawCanonOutput;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class RefCanonicalizerTest
{
    public static Stream<Arguments> refs()
    {
        return Stream.of(
            Arguments.of("frag", "#frag"),
            Arguments.of("", "#"),
            Arguments.of("a b", "#a b"),
            Arguments.of("a\tb\u007F", "#a%09b%7F"),
            Arguments.of("a\u0000b", "#ab"),
            Arguments.of("café", "#café"),
            Arguments.of("#/?%41", "##/?%41")
        );
    }

    @ParameterizedTest
    @MethodSource("refs")
    public void testCanonicalizeWide(String ref, String expected)
    {
        RawCanonOutput output = new RawCanonOutput();
        boolean success = RefCanonicalizer.canonicalize(ref, Component.of(0, ref.length()), output, new Parsed());

        assertThat(success, is(true));
        assertThat(output.toString(), is(expected));
    }

    @ParameterizedTest
    @MethodSource("refs")
    public void testCanonicalizeUtf8(String ref, String expected)
    {
        byte[] spec = ref.getBytes(StandardCharsets.UTF_8);
        RawCanonOutput output = new RawCanonOutput();
        boolean success = RefCanonicalizer.canonicalize(spec, Component.of(0, spec.length), output, new Parsed());

        assertThat(success, is(true));
        assertThat(output.toString(), is(expected));
    }

    @Test
    public void testInvalidSequenceReplaced()
    {
        byte[] spec = {'a', (byte)0xFF, 'b'};
        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        boolean success = RefCanonicalizer.canonicalize(spec, Component.of(0, 3), output, parsed);

        assertThat(success, is(false));
        assertThat(output.toString(), is("#a\uFFFDb"));
        assertThat(parsed.getRef(), is(Component.of(1, 5)));
    }

    @Test
    public void testAbsentRef()
    {
        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        boolean success = RefCanonicalizer.canonicalize("x", Component.ABSENT, output, parsed);

        assertThat(success, is(true));
        assertThat(output.length(), is(0));
        assertThat(parsed.getRef(), is(Component.ABSENT));
    }
}
