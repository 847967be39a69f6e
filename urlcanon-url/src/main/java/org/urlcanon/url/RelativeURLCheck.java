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

import java.util.Objects;

/**
 * The classification of a URL reference against a base URL.
 *
 * @see RelativeURLResolver#isRelativeURL(byte[], Parsed, CharSequence, boolean)
 */
public final class RelativeURLCheck
{
    private static final RelativeURLCheck INVALID = new RelativeURLCheck(false, false, Component.ABSENT);
    private static final RelativeURLCheck ABSOLUTE = new RelativeURLCheck(true, false, Component.ABSENT);

    private final boolean _valid;
    private final boolean _relative;
    private final Component _relativeComponent;

    private RelativeURLCheck(boolean valid, boolean relative, Component relativeComponent)
    {
        _valid = valid;
        _relative = relative;
        _relativeComponent = relativeComponent;
    }

    static RelativeURLCheck invalid()
    {
        return INVALID;
    }

    static RelativeURLCheck absolute()
    {
        return ABSOLUTE;
    }

    static RelativeURLCheck relative(Component relativeComponent)
    {
        return new RelativeURLCheck(true, true, Objects.requireNonNull(relativeComponent));
    }

    /**
     * @return false if the reference cannot be used with the base, such as a
     * scheme-less reference against a URL that is not hierarchical
     */
    public boolean isValid()
    {
        return _valid;
    }

    public boolean isRelative()
    {
        return _relative;
    }

    /**
     * @return the part of the reference to resolve, without surrounding spaces
     * or a scheme equal to the base's; absent unless {@link #isRelative()}
     */
    public Component getRelativeComponent()
    {
        return _relativeComponent;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof RelativeURLCheck))
            return false;
        RelativeURLCheck that = (RelativeURLCheck)o;
        return _valid == that._valid && _relative == that._relative && _relativeComponent.equals(that._relativeComponent);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_valid, _relative, _relativeComponent);
    }

    @Override
    public String toString()
    {
        return String.format("%s{valid=%b,relative=%b,%s}", getClass().getSimpleName(), _valid, _relative, _relativeComponent);
    }
}
