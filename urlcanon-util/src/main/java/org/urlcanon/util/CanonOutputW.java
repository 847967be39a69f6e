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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wide (UTF-16) counterpart of {@link CanonOutput}, for the text exchanged
 * with the IDN and character set collaborators.
 *
 * @see CanonOutput
 */
public abstract class CanonOutputW
{
    private static final Logger LOG = LoggerFactory.getLogger(CanonOutputW.class);

    public static final int MAX_CAPACITY = CanonOutput.MAX_CAPACITY;

    protected char[] _buffer;
    protected int _length;

    protected CanonOutputW()
    {
        _buffer = new char[0];
    }

    /**
     * Replaces the storage with one of at least {@code newCapacity} elements.
     * Implementations must install the new array in {@link #_buffer} and copy
     * over the first {@link #length()} elements.
     *
     * @param newCapacity the new capacity, always larger than the current one
     */
    protected abstract void resize(int newCapacity);

    public final char at(int offset)
    {
        if (offset < 0 || offset >= _length)
            throw new IndexOutOfBoundsException("offset " + offset + " not in [0," + _length + ")");
        return _buffer[offset];
    }

    public final void set(int offset, int value)
    {
        if (offset < 0 || offset >= _length)
            throw new IndexOutOfBoundsException("offset " + offset + " not in [0," + _length + ")");
        _buffer[offset] = (char)value;
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
    public final char[] getData()
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
     * Appends a single code unit. Only the low 16 bits of {@code value} are kept.
     *
     * @param value the code unit
     */
    public final void append(int value)
    {
        if (_length < _buffer.length)
        {
            _buffer[_length++] = (char)value;
            return;
        }
        if (!grow(_length + 1))
            return;
        _buffer[_length++] = (char)value;
    }

    public final void append(char[] values, int offset, int length)
    {
        if (length > _buffer.length - _length && !grow(_length + length))
            return;
        System.arraycopy(values, offset, _buffer, _length, length);
        _length += length;
    }

    public final void append(CharSequence chars)
    {
        int length = chars.length();
        if (length > _buffer.length - _length && !grow(_length + length))
            return;
        for (int i = 0; i < length; i++)
        {
            _buffer[_length++] = chars.charAt(i);
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
        int newCapacity = Math.max(capacity, CanonOutput.MIN_GROWTH / 2);
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

    @Override
    public String toString()
    {
        return new String(_buffer, 0, _length);
    }
}
