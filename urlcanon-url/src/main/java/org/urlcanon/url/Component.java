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

/**
 * <p>A range {@code [begin, begin + length)} of one URL part within a source
 * string, or {@link #ABSENT} when the part does not exist at all.</p>
 *
 * <p>An absent component and an empty one are different things: a URL
 * ending in {@code ?} has an empty query, a URL without {@code ?} has none.</p>
 */
public final class Component
{
    public static final Component ABSENT = new Component(0, -1);

    private final int _begin;
    private final int _length;

    private Component(int begin, int length)
    {
        _begin = begin;
        _length = length;
    }

    /**
     * @param begin the offset of the first code unit
     * @param length the number of code units, possibly zero
     * @return a present component
     */
    public static Component of(int begin, int length)
    {
        if (begin < 0 || length < 0)
            throw new IllegalArgumentException("Bad component [" + begin + "," + length + ")");
        return new Component(begin, length);
    }

    /**
     * @param begin the offset of the first code unit
     * @param end the offset after the last code unit
     * @return a present component covering {@code [begin, end)}
     */
    public static Component range(int begin, int end)
    {
        return of(begin, end - begin);
    }

    public boolean isPresent()
    {
        return _length >= 0;
    }

    /**
     * @return true if present and holding at least one code unit
     */
    public boolean isNonEmpty()
    {
        return _length > 0;
    }

    public int getBegin()
    {
        checkPresent();
        return _begin;
    }

    public int getLength()
    {
        checkPresent();
        return _length;
    }

    public int getEnd()
    {
        checkPresent();
        return _begin + _length;
    }

    private void checkPresent()
    {
        if (_length < 0)
            throw new IllegalStateException("Absent component");
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Component))
            return false;
        Component that = (Component)o;
        return _begin == that._begin && _length == that._length;
    }

    @Override
    public int hashCode()
    {
        return 31 * _begin + _length;
    }

    @Override
    public String toString()
    {
        if (!isPresent())
            return "Component{absent}";
        return String.format("Component{%d,%d}", _begin, _length);
    }
}
