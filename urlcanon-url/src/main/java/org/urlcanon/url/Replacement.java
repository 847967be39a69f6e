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
 * <p>What to do with one component when replacing components of a URL:
 * keep the base URL's component, delete it, or replace it with new text.</p>
 *
 * <p>A replacement text is never empty; an empty string given to
 * {@link #of(CharSequence)} means delete.</p>
 */
public final class Replacement
{
    public enum Kind
    {
        KEEP_EXISTING,
        DELETE,
        REPLACE
    }

    private static final Replacement KEEP_EXISTING = new Replacement(Kind.KEEP_EXISTING, null);
    private static final Replacement DELETE = new Replacement(Kind.DELETE, null);

    private final Kind _kind;
    private final UrlChars _text;

    private Replacement(Kind kind, UrlChars text)
    {
        _kind = kind;
        _text = text;
    }

    public static Replacement keepExisting()
    {
        return KEEP_EXISTING;
    }

    public static Replacement delete()
    {
        return DELETE;
    }

    /**
     * @param text the new component, which must not be empty
     * @return a replacement with the given text
     */
    public static Replacement replace(CharSequence text)
    {
        if (text.length() == 0)
            throw new IllegalArgumentException("Empty replacement, use delete()");
        return new Replacement(Kind.REPLACE, UrlChars.of(text));
    }

    /**
     * @param utf8 the new component as UTF-8, which must not be empty
     * @return a replacement with the given text
     */
    public static Replacement replace(byte[] utf8)
    {
        if (utf8.length == 0)
            throw new IllegalArgumentException("Empty replacement, use delete()");
        return new Replacement(Kind.REPLACE, UrlChars.of(utf8));
    }

    /**
     * @param text the new component, may be null or empty
     * @return keep for null, delete for an empty string, replace otherwise
     */
    public static Replacement of(CharSequence text)
    {
        if (text == null)
            return KEEP_EXISTING;
        if (text.length() == 0)
            return DELETE;
        return replace(text);
    }

    public static Replacement of(byte[] utf8)
    {
        if (utf8 == null)
            return KEEP_EXISTING;
        if (utf8.length == 0)
            return DELETE;
        return replace(utf8);
    }

    public Kind getKind()
    {
        return _kind;
    }

    /**
     * @return the replacement text
     * @throws IllegalStateException if this is not a {@link Kind#REPLACE}
     */
    public UrlChars getText()
    {
        if (_kind != Kind.REPLACE)
            throw new IllegalStateException("No text for " + _kind);
        return _text;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Replacement))
            return false;
        Replacement that = (Replacement)o;
        return _kind == that._kind && Objects.equals(String.valueOf(_text), String.valueOf(that._text));
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_kind, String.valueOf(_text));
    }

    @Override
    public String toString()
    {
        if (_kind == Kind.REPLACE)
            return _kind + "(" + _text + ")";
        return _kind.toString();
    }
}
