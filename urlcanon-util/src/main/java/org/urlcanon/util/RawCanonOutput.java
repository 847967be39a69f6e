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

import java.util.Arrays;

/**
 * <p>A {@link CanonOutput} that starts in a fixed array allocated with the
 * buffer, so most URLs are canonicalized without any further allocation.
 * Once the fixed array overflows the content moves to a heap array sized by
 * {@link CanonOutput#grow(int)} and the fixed array is abandoned.</p>
 */
public class RawCanonOutput extends CanonOutput
{
    public static final int DEFAULT_FIXED_CAPACITY = 1024;

    private final byte[] _fixed;

    public RawCanonOutput()
    {
        this(DEFAULT_FIXED_CAPACITY);
    }

    public RawCanonOutput(int fixedCapacity)
    {
        if (fixedCapacity < 0 || fixedCapacity > MAX_CAPACITY)
            throw new IllegalArgumentException("Bad fixed capacity " + fixedCapacity);
        _fixed = new byte[fixedCapacity];
        _buffer = _fixed;
    }

    /**
     * @return true while the content still lives in the fixed array
     */
    public boolean isUsingFixedBuffer()
    {
        return _buffer == _fixed;
    }

    @Override
    protected void resize(int newCapacity)
    {
        _buffer = Arrays.copyOf(_buffer, newCapacity);
    }
}
