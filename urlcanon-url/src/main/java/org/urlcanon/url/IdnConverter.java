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

import org.urlcanon.util.CanonOutputW;

/**
 * <p>Converts a Unicode host name to its ASCII form using IDNA rules.</p>
 *
 * @see HostCanonicalizer
 */
public interface IdnConverter
{
    /**
     * Converts {@code input[offset, offset + length)} to ASCII. The output is
     * assumed empty at entry; on success it holds the ASCII host name, still
     * as UTF-16 code units, starting at offset 0.
     *
     * @param input the Unicode host name as UTF-16 code units
     * @param offset the first code unit of the host name
     * @param length the number of code units
     * @param output the buffer receiving the ASCII host name
     * @return false if the name cannot be converted, in which case the
     * output content is undefined
     */
    boolean toAscii(char[] input, int offset, int length, CanonOutputW output);
}
