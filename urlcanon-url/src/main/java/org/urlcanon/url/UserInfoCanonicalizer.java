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

import org.urlcanon.util.CanonOutput;

/**
 * <p>Canonicalizes the user info as {@code username:password@} or
 * {@code username@}. An empty password is dropped and an entirely empty
 * user info is omitted, {@code @} included.</p>
 *
 * <p>The user name and password may come from different source strings.
 * When they come from the same one their ranges must not overlap.</p>
 */
public final class UserInfoCanonicalizer
{
    private UserInfoCanonicalizer()
    {
    }

    public static boolean canonicalize(byte[] usernameSource, Component username,
                                       byte[] passwordSource, Component password,
                                       CanonOutput output, Parsed parsed)
    {
        UrlChars user = UrlChars.of(usernameSource);
        UrlChars pass = usernameSource == passwordSource ? user : UrlChars.of(passwordSource);
        return canonicalize(user, username, pass, password, output, parsed);
    }

    public static boolean canonicalize(CharSequence usernameSource, Component username,
                                       CharSequence passwordSource, Component password,
                                       CanonOutput output, Parsed parsed)
    {
        UrlChars user = UrlChars.of(usernameSource);
        UrlChars pass = usernameSource == passwordSource ? user : UrlChars.of(passwordSource);
        return canonicalize(user, username, pass, password, output, parsed);
    }

    public static boolean canonicalize(UrlChars usernameSource, Component username,
                                       UrlChars passwordSource, Component password,
                                       CanonOutput output, Parsed parsed)
    {
        if (usernameSource == passwordSource && username.isNonEmpty() && password.isNonEmpty() &&
            username.getBegin() < password.getEnd() && password.getBegin() < username.getEnd())
            throw new IllegalArgumentException("Overlapping user info " + username + " " + password);

        if (!username.isNonEmpty() && !password.isNonEmpty())
        {
            parsed.setUsername(Component.ABSENT);
            parsed.setPassword(Component.ABSENT);
            return true;
        }

        boolean success = true;
        int begin = output.length();
        if (username.isNonEmpty())
            success = CanonUtil.appendStringOfType(usernameSource, username.getBegin(), username.getEnd(), CanonUtil.USERINFO, output);
        parsed.setUsername(Component.range(begin, output.length()));

        if (password.isNonEmpty())
        {
            output.append(':');
            begin = output.length();
            success &= CanonUtil.appendStringOfType(passwordSource, password.getBegin(), password.getEnd(), CanonUtil.USERINFO, output);
            parsed.setPassword(Component.range(begin, output.length()));
        }
        else
        {
            parsed.setPassword(Component.ABSENT);
        }

        output.append('@');
        return success;
    }
}
