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
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CanonOutputTest
{
    @Test
    public void testAppendWithinFixedBuffer()
    {
        RawCanonOutput output = new RawCanonOutput(8);
        output.append("http:");
        output.append('/');
        output.append('/');

        assertThat(output.length(), is(7));
        assertThat(output.capacity(), is(8));
        assertTrue(output.isUsingFixedBuffer());
        assertThat(output.toString(), is("http://"));
    }

    @Test
    public void testGrowthKeepsContent()
    {
        RawCanonOutput output = new RawCanonOutput(4);
        output.append("abcd");
        byte[] before = Arrays.copyOf(output.getData(), output.length());
        assertTrue(output.isUsingFixedBuffer());

        output.append('e');

        assertFalse(output.isUsingFixedBuffer());
        assertThat(output.capacity(), greaterThan(4));
        assertThat(Arrays.copyOf(output.getData(), 4), is(before));
        assertThat(output.toString(), is("abcde"));
    }

    @Test
    public void testGrowthForLargeAppend()
    {
        RawCanonOutput output = new RawCanonOutput(4);
        output.append('x');
        byte[] large = new byte[100];
        Arrays.fill(large, (byte)'y');

        output.append(large, 0, large.length);

        assertThat(output.length(), is(101));
        assertThat(output.at(0), is((byte)'x'));
        assertThat(output.at(100), is((byte)'y'));
    }

    @Test
    public void testDefaultFixedCapacity()
    {
        RawCanonOutput output = new RawCanonOutput();
        assertThat(output.capacity(), is(RawCanonOutput.DEFAULT_FIXED_CAPACITY));
    }

    @Test
    public void testSetLengthBacksUp()
    {
        RawCanonOutput output = new RawCanonOutput();
        output.append("/a/b/../c");
        output.setLength(4);
        output.append('c');

        assertThat(output.toString(), is("/a/bc"));
    }

    @Test
    public void testSetLengthBeyondCapacity()
    {
        RawCanonOutput output = new RawCanonOutput(4);
        assertThrows(IllegalArgumentException.class, () -> output.setLength(5));
        assertThrows(IllegalArgumentException.class, () -> output.setLength(-1));
    }

    @Test
    public void testSetAndAtOutsideContent()
    {
        RawCanonOutput output = new RawCanonOutput();
        output.append("ab");
        output.set(1, 'B');

        assertThat(output.toString(), is("aB"));
        assertThrows(IndexOutOfBoundsException.class, () -> output.at(2));
        assertThrows(IndexOutOfBoundsException.class, () -> output.set(-1, 'x'));
    }

    @Test
    public void testToStringDecodesUtf8()
    {
        RawCanonOutput output = new RawCanonOutput();
        byte[] ref = "#café".getBytes(StandardCharsets.UTF_8);
        output.append(ref, 0, ref.length);

        assertThat(output.toString(), is("#café"));
    }

    @Test
    public void testWideGrowthKeepsContent()
    {
        RawCanonOutputW output = new RawCanonOutputW(2);
        output.append("üb");
        assertTrue(output.isUsingFixedBuffer());

        output.append("er.de");

        assertFalse(output.isUsingFixedBuffer());
        assertThat(output.length(), is(7));
        assertThat(output.toString(), is("über.de"));
    }

    @Test
    public void testZeroCapacityGrows()
    {
        RawCanonOutputW output = new RawCanonOutputW(0);
        output.append('a');

        assertThat(output.toString(), is("a"));
        assertThat(output.capacity(), greaterThan(0));
    }

    @Test
    public void testCapacityCeiling()
    {
        RecordingOutput output = new RecordingOutput(16);

        assertFalse(output.grow(CanonOutput.MAX_CAPACITY + 1));
        assertThat(output.requested, is(-1));

        assertTrue(output.grow(CanonOutput.MAX_CAPACITY));
        assertThat(output.requested, is(CanonOutput.MAX_CAPACITY));
    }

    @Test
    public void testOverflowingWriteIsDropped()
    {
        RecordingOutput output = new RecordingOutput(16);
        output.append("abc");

        assertFalse(output.grow(output.length() + Integer.MAX_VALUE));
        assertThat(output.requested, is(-1));
        assertThat(output.toString(), is("abc"));
    }

    /**
     * Records the requested capacity instead of allocating it.
     */
    private static class RecordingOutput extends CanonOutput
    {
        int requested = -1;

        RecordingOutput(int capacity)
        {
            _buffer = new byte[capacity];
        }

        @Override
        protected void resize(int newCapacity)
        {
            requested = newCapacity;
        }
    }
}
