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

public class QueryCanonicalizerTest
{
    public static Stream<Arguments> queries()
    {
        return Stream.of(
            Arguments.of("a=b&c=d", "?a=b&c=d"),
            Arguments.of("", "?"),
            Arguments.of("a b", "?a%20b"),
            Arguments.of("q=\"<x>\"", "?q=%22%3Cx%3E%22"),
            Arguments.of("a#b", "?a%23b"),
            Arguments.of("a%20b", "?a%20b"),
            Arguments.of("?/:@!$'()*+,;=~[]{}|^`", "??/:@!$'()*+,;=~[]{}|^`"),
            Arguments.of("tab\there", "?tab%09here"),
            Arguments.of("q=é", "?q=%C3%A9"),
            Arguments.of("q=😀", "?q=%F0%9F%98%80")
        );
    }

    @ParameterizedTest
    @MethodSource("queries")
    public void testCanonicalizeWide(String query, String expected)
    {
        assertThat(canonicalize(query, null), is(expected));
    }

    @ParameterizedTest
    @MethodSource("queries")
    public void testCanonicalizeUtf8(String query, String expected)
    {
        byte[] spec = query.getBytes(StandardCharsets.UTF_8);
        RawCanonOutput output = new RawCanonOutput();
        QueryCanonicalizer.canonicalize(spec, Component.of(0, spec.length), null, output, new Parsed());
        assertThat(output.toString(), is(expected));
    }

    @Test
    public void testAbsentQuery()
    {
        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        QueryCanonicalizer.canonicalize("abc", Component.ABSENT, null, output, parsed);

        assertThat(output.length(), is(0));
        assertThat(parsed.getQuery(), is(Component.ABSENT));
    }

    @Test
    public void testComponentExcludesQuestionMark()
    {
        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        QueryCanonicalizer.canonicalize("x=1", Component.of(0, 3), null, output, parsed);

        assertThat(parsed.getQuery(), is(Component.of(1, 3)));
    }

    @Test
    public void testInvalidInputReplaced()
    {
        assertThat(canonicalize("a\uD800b", null), is("?a%EF%BF%BDb"));

        byte[] spec = {'a', (byte)0xC3};
        RawCanonOutput output = new RawCanonOutput();
        QueryCanonicalizer.canonicalize(spec, Component.of(0, 2), null, output, new Parsed());
        assertThat(output.toString(), is("?a%EF%BF%BD"));
    }

    @Test
    public void testCharsetConverter()
    {
        CharsetConverter latin1 = new JavaCharsetConverter(StandardCharsets.ISO_8859_1);

        assertThat(canonicalize("q=é", latin1), is("?q=%E9"));
        assertThat(canonicalize("q=你", latin1), is("?q=%26%2320320%3B"));
        assertThat(canonicalize("q=a b", latin1), is("?q=a%20b"));
    }

    private static String canonicalize(String query, CharsetConverter converter)
    {
        RawCanonOutput output = new RawCanonOutput();
        QueryCanonicalizer.canonicalize(query, Component.of(0, query.length()), converter, output, new Parsed());
        return output.toString();
    }
}
