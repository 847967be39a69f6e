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

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.urlcanon.util.RawCanonOutput;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UserInfoCanonicalizerTest
{
    public static Stream<Arguments> userInfos()
    {
        return Stream.of(
            Arguments.of("user", "pass", "user:pass@"),
            Arguments.of("user", null, "user@"),
            Arguments.of("user", "", "user@"),
            Arguments.of("", "pass", ":pass@"),
            Arguments.of(null, null, ""),
            Arguments.of("", "", ""),
            Arguments.of("us er", "p@ss", "us%20er:p%40ss@"),
            Arguments.of("a:b", null, "a%3Ab@"),
            Arguments.of("%41~!$&'()*+,;=", null, "%41~!$&'()*+,;=@"),
            Arguments.of("ü", "ß", "%C3%BC:%C3%9F@")
        );
    }

    @ParameterizedTest
    @MethodSource("userInfos")
    public void testCanonicalize(String username, String password, String expected)
    {
        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        UserInfoCanonicalizer.canonicalize(
            username == null ? "" : username, component(username),
            password == null ? "" : password, component(password),
            output, parsed);

        assertThat(output.toString(), is(expected));
        if (expected.isEmpty())
        {
            assertThat(parsed.getUsername().isPresent(), is(false));
            assertThat(parsed.getPassword().isPresent(), is(false));
        }
    }

    @Test
    public void testComponentsInOutput()
    {
        String spec = "user:pass";
        RawCanonOutput output = new RawCanonOutput();
        output.append("http://");
        Parsed parsed = new Parsed();
        boolean success = UserInfoCanonicalizer.canonicalize(spec, Component.of(0, 4), spec, Component.of(5, 4), output, parsed);

        assertThat(success, is(true));
        assertThat(output.toString(), is("http://user:pass@"));
        assertThat(parsed.getUsername(), is(Component.of(7, 4)));
        assertThat(parsed.getPassword(), is(Component.of(12, 4)));
    }

    @Test
    public void testInvalidSequenceFails()
    {
        RawCanonOutput output = new RawCanonOutput();
        byte[] user = {'a', (byte)0xFF};
        boolean success = UserInfoCanonicalizer.canonicalize(user, Component.of(0, 2), user, Component.ABSENT, output, new Parsed());

        assertThat(success, is(false));
        assertThat(output.toString(), is("a%EF%BF%BD@"));
    }

    @Test
    public void testOverlappingRanges()
    {
        String spec = "useruser";
        assertThrows(IllegalArgumentException.class, () ->
            UserInfoCanonicalizer.canonicalize(spec, Component.of(0, 5), spec, Component.of(3, 5), new RawCanonOutput(), new Parsed()));
    }

    private static Component component(String text)
    {
        return text == null ? Component.ABSENT : Component.of(0, text.length());
    }
}
