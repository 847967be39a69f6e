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

import java.util.EnumSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urlcanon.util.CanonOutput;

/**
 * <p>Replaces components of a canonical URL and canonicalizes the result.</p>
 *
 * <p>Each component of the {@link URLComponentSource} is kept from the base,
 * deleted, or taken from the replacement text. The base decides the shape of
 * the result: a scheme replacement that would turn a file URL into another
 * kind of URL, or the reverse, is refused, as is deleting the scheme. The
 * other replacements still apply and the result is reported as failed.</p>
 */
public final class URLReplacer
{
    private static final Logger LOG = LoggerFactory.getLogger(URLReplacer.class);

    private static final Set<URLPart> STANDARD_PARTS = EnumSet.range(URLPart.USERNAME, URLPart.REF);
    private static final Set<URLPart> FILE_PARTS = EnumSet.of(URLPart.HOST, URLPart.PATH, URLPart.QUERY, URLPart.REF);
    private static final Set<URLPart> PATH_PARTS = EnumSet.of(URLPart.PATH);

    private URLReplacer()
    {
    }

    /**
     * @param base a canonical standard URL
     * @param baseParsed the components of {@code base}
     * @param replacements what to do with each component
     * @param config the collaborators and default ports
     * @param output receives the new canonical URL
     * @param newParsed receives its components
     * @return false if the result is not a valid URL or a replacement was refused
     */
    public static boolean replaceStandardURL(byte[] base, Parsed baseParsed, URLComponentSource replacements,
                                             CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        CanonSource source = new CanonSource(UrlChars.of(base));
        Parsed parsed = new Parsed(baseParsed);
        boolean success = replaceScheme(replacements.getScheme(), false, source, parsed);
        apply(replacements, STANDARD_PARTS, source, parsed);
        return StandardURLCanonicalizer.canonicalize(source, parsed, config, output, newParsed) && success;
    }

    /**
     * Replaces components of a file URL. User name, password and port
     * replacements are ignored.
     *
     * @see #replaceStandardURL(byte[], Parsed, URLComponentSource, CanonConfig, CanonOutput, Parsed)
     */
    public static boolean replaceFileURL(byte[] base, Parsed baseParsed, URLComponentSource replacements,
                                         CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        CanonSource source = new CanonSource(UrlChars.of(base));
        Parsed parsed = new Parsed(baseParsed);
        boolean success = replaceScheme(replacements.getScheme(), true, source, parsed);
        apply(replacements, FILE_PARTS, source, parsed);
        return FileURLCanonicalizer.canonicalize(source, parsed, config, output, newParsed) && success;
    }

    /**
     * Replaces components of a path URL. Only the scheme and path
     * replacements are used.
     *
     * @see #replaceStandardURL(byte[], Parsed, URLComponentSource, CanonConfig, CanonOutput, Parsed)
     */
    public static boolean replacePathURL(byte[] base, Parsed baseParsed, URLComponentSource replacements,
                                         CanonConfig config, CanonOutput output, Parsed newParsed)
    {
        CanonSource source = new CanonSource(UrlChars.of(base));
        Parsed parsed = new Parsed(baseParsed);
        boolean success = replaceScheme(replacements.getScheme(), false, source, parsed);
        apply(replacements, PATH_PARTS, source, parsed);
        return PathURLCanonicalizer.canonicalize(source, parsed, config, output, newParsed) && success;
    }

    /**
     * @return false if the scheme replacement was refused
     */
    private static boolean replaceScheme(Replacement scheme, boolean fileBase, CanonSource source, Parsed parsed)
    {
        switch (scheme.getKind())
        {
            case KEEP_EXISTING:
                return true;
            case DELETE:
                if (LOG.isDebugEnabled())
                    LOG.debug("Refusing to delete the scheme");
                return false;
            default:
                UrlChars text = scheme.getText();
                if ("file".equalsIgnoreCase(text.toString()) != fileBase)
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("Refusing scheme {} on a {} URL", text, fileBase ? "file" : "non-file");
                    return false;
                }
                source.set(URLPart.SCHEME, text);
                parsed.setScheme(Component.of(0, text.length()));
                return true;
        }
    }

    private static void apply(URLComponentSource replacements, Set<URLPart> parts, CanonSource source, Parsed parsed)
    {
        for (URLPart part : parts)
        {
            Replacement replacement = replacements.get(part);
            switch (replacement.getKind())
            {
                case DELETE:
                    parsed.set(part, Component.ABSENT);
                    break;
                case REPLACE:
                    UrlChars text = replacement.getText();
                    source.set(part, text);
                    parsed.set(part, Component.of(0, text.length()));
                    break;
                default:
                    break;
            }
        }
    }
}
