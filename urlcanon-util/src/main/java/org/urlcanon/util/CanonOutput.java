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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Append-only buffer of 8-bit code units that receives canonicalized URLs.</p>
 *
 * <p>The only operation a subclass provides is {@link #resize(int)}, called
 * when the current storage cannot hold a write. All other operations are
 * final and work directly on the array installed by the subclass.</p>
 *
 * <p>The content in {@code [0, length())} is always valid written data and
 * {@code capacity() >= length()} holds at all times. Growth doubles the
 * capacity until the requested size fits, up to {@link #MAX_CAPACITY}
 * elements; past that the write is dropped.</p>
 *
 * @see CanonOutputW
 */
public abstract class CanonOutput
{
    private static final Logger LOG = LoggerFactory.getLogger(CanonOutput.class);

    /**
     * The hard ceiling on capacity, in code units.
     */
    public static final int MAX_CAPACITY = 1 << 30;

    static final int MIN_GROWTH = 16;

    protected byte[] _buffer;
    protected int _length;

    protected CanonOutput()
    {
        _buffer = new byte[0];
    }

    /**
     * Replaces the storage with one of at least {@code newCapacity} elements.
     * Implementations must install the new array in {@link #_buffer} and copy
     * over the first {@link #length()} elements.
     *
     * @param newCapacity the new capacity, always larger than the current one
     */
    protected abstract void resize(int newCapacity);

    public final byte at(int offset)
    {
        if (offset < 0 || offset >= _length)
            throw new IndexOutOfBoundsException("offset " + offset + " not in [0," + _length + ")");
        return _buffer[offset];
    }

    public final void set(int offset, int value)
    {
        if (offset < 0 || offset >= _length)
            throw new IndexOutOfBoundsException("offset " + offset + " not in [0," + _length + ")");
        _buffer[offset] = (byte)value;
    }

    public final int length()
    {
        return _length;
    }

    public final int capacity()
    {
        return _buffer.length;
    }

    /**
     * @return the raw storage; only {@code [0, length())} is meaningful, the
     * rest may be written to before declaring it with {@link #setLength(int)}
     */
    public final byte[] getData()
    {
        return _buffer;
    }

    /**
     * Declares a new length. Used to back up over written content, or to
     * declare content written directly into {@link #getData()}.
     *
     * @param length the new length, never beyond {@link #capacity()}
     */
    public final void setLength(int length)
    {
        if (length < 0 || length > _buffer.length)
            throw new IllegalArgumentException("length " + length + " not in [0," + _buffer.length + "]");
        _length = length;
    }

    /**
     * Appends a single code unit. Only the low 8 bits of {@code value} are kept.
     *
     * @param value the code unit
     */
    public final void append(int value)
    {
        if (_length < _buffer.length)
        {
            _buffer[_length++] = (byte)value;
            return;
        }
        if (!grow(_length + 1))
            return;
        _buffer[_length++] = (byte)value;
    }

    public final void append(byte[] values, int offset, int length)
    {
        if (length > _buffer.length - _length && !grow(_length + length))
            return;
        System.arraycopy(values, offset, _buffer, _length, length);
        _length += length;
    }

    /**
     * Appends the characters of an ASCII string, one code unit each.
     *
     * @param ascii the characters, all below 0x80
     */
    public final void append(String ascii)
    {
        int length = ascii.length();
        if (length > _buffer.length - _length && !grow(_length + length))
            return;
        for (int i = 0; i < length; i++)
        {
            _buffer[_length++] = (byte)ascii.charAt(i);
        }
    }

    /**
     * Ensures the capacity is at least {@code minCapacity}, doubling the
     * current capacity as many times as needed.
     *
     * @param minCapacity the capacity required
     * @return false if the capacity ceiling would be passed, in which case
     * nothing changed
     */
    protected final boolean grow(int minCapacity)
    {
        if (minCapacity < 0)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Capacity overflow, dropping write at length {}", _length);
            return false;
        }
        int capacity = _buffer.length;
        if (capacity >= minCapacity)
            return true;
        int newCapacity = Math.max(capacity, MIN_GROWTH / 2);
        do
        {
            if (newCapacity >= MAX_CAPACITY)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Capacity ceiling reached, dropping write of {} at length {}", minCapacity - _length, _length);
                return false;
            }
            newCapacity *= 2;
        }
        while (newCapacity < minCapacity);
        resize(newCapacity);
        return true;
    }

    /**
     * @return the content decoded as UTF-8
     */
    @Override
    public String toString()
    {
        return new String(_buffer, 0, _length, StandardCharsets.UTF_8);
    }
}
