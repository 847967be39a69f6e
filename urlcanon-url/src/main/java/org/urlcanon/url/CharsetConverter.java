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
 * <p>Converts query strings from UTF-16 into the character set a page was
 * served in. Only used for the query, and only when the query holds
 * non-ASCII characters.</p>
 *
 * <p>A conversion never fails. A character the target character set cannot
 * represent is written as a decimal numeric character reference with its
 * {@code &}, {@code #} and {@code ;} escaped, so U+4F60 becomes
 * {@code %26%2320320%3B}. Invalid input is replaced, not reported.</p>
 *
 * @see QueryCanonicalizer
 */
public interface CharsetConverter
{
    /**
     * Appends the converted form of {@code input[offset, offset + length)}.
     *
     * @param input UTF-16 code units
     * @param offset the first code unit to convert
     * @param length the number of code units to convert
     * @param output the buffer receiving the converted bytes
     */
    void convertFromUtf16(char[] input, int offset, int length, CanonOutput output);
}
