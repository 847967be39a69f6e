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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urlcanon.util.CanonOutput;
import org.urlcanon.util.StringUtil;

/**
 * <p>Resolves URL references against a canonical base URL, as described
 * by RFC 3986 section 5.</p>
 *
 * <p>{@link #isRelativeURL(byte[], Parsed, UrlChars, boolean)} decides
 * whether a reference is relative, and
 * {@link #resolveRelativeURL(byte[], Parsed, boolean, UrlChars, Component, CanonConfig, CanonOutput, Parsed)}
 * merges a relative one with the base and canonicalizes the result. Dot
 * segments are removed from the merged path in the output buffer itself;
 * {@code ..} never goes above the root of the path.</p>
 */
public final class RelativeURLResolver
{
    private static final Logger LOG = LoggerFactory.getLogger(RelativeURLResolver.class);

    private static final String FILE_SCHEME = "file";

    private RelativeURLResolver()
    {
    }

    public static RelativeURLCheck isRelativeURL(byte[] base, Parsed baseParsed, byte[] fragment, boolean isBaseHierarchical)
    {
        return isRelativeURL(base, baseParsed, UrlChars.of(fragment), isBaseHierarchical);
    }

    public static RelativeURLCheck isRelativeURL(byte[] base, Parsed baseParsed, CharSequence fragment, boolean isBaseHierarchical)
    {
        return isRelativeURL(base, baseParsed, UrlChars.of(fragment), isBaseHierarchical);
    }

    /**
     * @param base a canonical URL
     * @param baseParsed the components of {@code base}
     * @param fragment the reference
     * @param isBaseHierarchical true if the base has a hierarchical path, as
     * standard and file URLs do
     * @return whether the reference is relative and, if so, the part to resolve
     */
    public static RelativeURLCheck isRelativeURL(byte[] base, Parsed baseParsed, UrlChars fragment, boolean isBaseHierarchical)
    {
        Component trimmed = URLParser.trimURL(fragment, 0, fragment.length());
        int begin = trimmed.getBegin();
        int end = trimmed.getEnd();
        if (begin == end)
            return RelativeURLCheck.relative(trimmed);

        if (isFileBase(base, baseParsed) && URLParser.doesBeginWindowsDriveSpec(fragment, begin, end))
            return RelativeURLCheck.relative(trimmed);

        Component scheme = URLParser.extractScheme(fragment, begin, end);
        if (!isValidScheme(fragment, scheme))
        {
            if (!isBaseHierarchical)
                return RelativeURLCheck.invalid();
            return RelativeURLCheck.relative(trimmed);
        }

        if (!isSameScheme(fragment, scheme, base, baseParsed.getScheme()) || !isBaseHierarchical)
            return RelativeURLCheck.absolute();

        int afterColon = scheme.getEnd() + 1;
        int afterSlashes = afterColon;
        while (afterSlashes < end && URLParser.isSlash(fragment.at(afterSlashes)))
        {
            afterSlashes++;
        }
        if (afterSlashes - afterColon >= 2)
            return RelativeURLCheck.absolute();
        return RelativeURLCheck.relative(Component.range(afterColon, end));
    }

    public static boolean resolveRelativeURL(byte[] base, Parsed baseParsed, boolean baseIsFile,
                                             byte[] relative, Component relativeComponent,
                                             CanonConfig config, CanonOutput output, Parsed outParsed)
    {
        return resolveRelativeURL(base, baseParsed, baseIsFile, UrlChars.of(relative), relativeComponent, config, output, outParsed);
    }

    public static boolean resolveRelativeURL(byte[] base, Parsed baseParsed, boolean baseIsFile,
                                             CharSequence relative, Component relativeComponent,
                                             CanonConfig config, CanonOutput output, Parsed outParsed)
    {
        return resolveRelativeURL(base, baseParsed, baseIsFile, UrlChars.of(relative), relativeComponent, config, output, outParsed);
    }

    /**
     * <p>Resolves a relative reference against the base.</p>
     *
     * <p>The base must have a path and, unless it is a file URL, a host.
     * Otherwise it is copied to the output unchanged and the resolution
     * fails.</p>
     *
     * @param base a canonical URL
     * @param baseParsed the components of {@code base}
     * @param baseIsFile true if the base is a file URL
     * @param relative the reference
     * @param relativeComponent the part of the reference to resolve, as given
     * by {@link RelativeURLCheck#getRelativeComponent()}
     * @param config the collaborators and default ports
     * @param output receives the resolved canonical URL
     * @param outParsed receives its components
     * @return false if the result is not a valid URL
     */
    public static boolean resolveRelativeURL(byte[] base, Parsed baseParsed, boolean baseIsFile,
                                             UrlChars relative, Component relativeComponent,
                                             CanonConfig config, CanonOutput output, Parsed outParsed)
    {
        boolean hasHost = baseIsFile || baseParsed.getHost().isNonEmpty();
        if (!baseParsed.getPath().isPresent() || !hasHost)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Cannot resolve against {}", UrlChars.of(base));
            copyBase(base, base.length, baseParsed, output, outParsed);
            return false;
        }

        int begin = relativeComponent.getBegin();
        int end = relativeComponent.getEnd();
        if (begin == end)
        {
            copyBaseWithoutRef(base, baseParsed, output, outParsed);
            return true;
        }

        int afterSlashes = begin;
        while (afterSlashes < end && URLParser.isSlash(relative.at(afterSlashes)))
        {
            afterSlashes++;
        }

        if (baseIsFile && URLParser.doesBeginWindowsDriveSpec(relative, afterSlashes, end))
            return resolveAbsoluteFile(base, baseParsed, relative, begin, end, config, output, outParsed);

        if (afterSlashes - begin >= 2)
            return resolveNetworkPath(base, baseParsed, baseIsFile, relative, begin, end, config, output, outParsed);

        Parsed reference = new Parsed();
        URLParser.parsePathInternal(relative, Component.range(begin, end), reference);
        return resolvePath(base, baseParsed, baseIsFile, relative, reference, config, output, outParsed);
    }

    /**
     * Removes {@code .} and {@code ..} segments from the path in
     * {@code [begin, end)} of the buffer, which must start with {@code /}.
     *
     * @return the new end of the path
     */
    static int removeDotSegments(byte[] path, int begin, int end)
    {
        int read = begin;
        int write = begin;
        while (read < end)
        {
            // read is at a slash, the segment runs to the next one
            int segmentBegin = read + 1;
            int segmentEnd = segmentBegin;
            while (segmentEnd < end && path[segmentEnd] != '/')
            {
                segmentEnd++;
            }
            boolean last = segmentEnd == end;

            if (isDotSegment(path, segmentBegin, segmentEnd))
            {
                if (last)
                    path[write++] = '/';
            }
            else if (isDoubleDotSegment(path, segmentBegin, segmentEnd))
            {
                while (write > begin)
                {
                    if (path[--write] == '/')
                        break;
                }
                if (last)
                    path[write++] = '/';
            }
            else
            {
                System.arraycopy(path, read, path, write, segmentEnd - read);
                write += segmentEnd - read;
            }
            read = segmentEnd;
        }
        return write;
    }

    private static boolean resolveAbsoluteFile(byte[] base, Parsed baseParsed, UrlChars relative, int begin, int end,
                                               CanonConfig config, CanonOutput output, Parsed outParsed)
    {
        CanonSource source = new CanonSource(relative).set(URLPart.SCHEME, UrlChars.of(base));
        Parsed parsed = new Parsed();
        parsed.setScheme(baseParsed.getScheme());
        URLParser.parsePathInternal(relative, Component.range(begin, end), parsed);
        return FileURLCanonicalizer.canonicalize(source, parsed, config, output, outParsed);
    }

    private static boolean resolveNetworkPath(byte[] base, Parsed baseParsed, boolean baseIsFile, UrlChars relative, int begin, int end,
                                              CanonConfig config, CanonOutput output, Parsed outParsed)
    {
        CanonSource source = new CanonSource(relative).set(URLPart.SCHEME, UrlChars.of(base));
        Parsed parsed = new Parsed();
        if (baseIsFile)
        {
            URLParser.parseFileAfterScheme(relative, begin, end, parsed);
            parsed.setScheme(baseParsed.getScheme());
            return FileURLCanonicalizer.canonicalize(source, parsed, config, output, outParsed);
        }
        URLParser.parseAfterScheme(relative, begin, end, parsed);
        parsed.setScheme(baseParsed.getScheme());
        return StandardURLCanonicalizer.canonicalize(source, parsed, config, output, outParsed);
    }

    private static boolean resolvePath(byte[] base, Parsed baseParsed, boolean baseIsFile, UrlChars relative, Parsed reference,
                                       CanonConfig config, CanonOutput output, Parsed outParsed)
    {
        UrlChars baseChars = UrlChars.of(base);
        Component basePath = baseParsed.getPath();

        if (!reference.getPath().isPresent() && !reference.getQuery().isPresent())
        {
            // Only a ref: the base with a new ref
            copyBaseWithoutRef(base, baseParsed, output, outParsed);
            RefCanonicalizer.canonicalize(relative, reference.getRef(), output, outParsed);
            return true;
        }

        // The base up to its path: scheme and authority
        copyBase(base, basePath.getBegin(), baseParsed, output, outParsed);

        boolean success = true;
        int pathBegin = output.length();
        if (!reference.getPath().isPresent())
        {
            output.append(base, basePath.getBegin(), basePath.getLength());
        }
        else
        {
            Component path = reference.getPath();
            if (URLParser.isSlash(relative.at(path.getBegin())))
            {
                Parsed pathParsed = new Parsed();
                if (baseIsFile)
                    success = PathCanonicalizer.canonicalizeFilePath(relative, path, output, pathParsed);
                else
                    success = PathCanonicalizer.canonicalizePath(relative, path, output, pathParsed);
            }
            else
            {
                int lastSlash = basePath.getEnd() - 1;
                while (lastSlash > basePath.getBegin() && baseChars.at(lastSlash) != '/')
                {
                    lastSlash--;
                }
                output.append(base, basePath.getBegin(), lastSlash + 1 - basePath.getBegin());
                // A bare drive "/C:" is its own directory
                if (baseIsFile && isBareDrive(baseChars, basePath))
                {
                    output.append(base, basePath.getBegin() + 1, 2);
                    output.append('/');
                }
                success = PathCanonicalizer.appendPartialPath(relative, path.getBegin(), path.getEnd(), output);
            }

            int root = pathBegin;
            if (baseIsFile && hasDrive(output, pathBegin))
                root += 3;
            int pathEnd = removeDotSegments(output.getData(), root, output.length());
            output.setLength(pathEnd);
        }
        outParsed.setPath(Component.range(pathBegin, output.length()));

        QueryCanonicalizer.canonicalize(relative, reference.getQuery(), config.getCharsetConverter(), output, outParsed);
        RefCanonicalizer.canonicalize(relative, reference.getRef(), output, outParsed);

        if (!success && LOG.isDebugEnabled())
            LOG.debug("Invalid path resolving {} against {}", relative, baseChars);
        return success;
    }

    private static void copyBaseWithoutRef(byte[] base, Parsed baseParsed, CanonOutput output, Parsed outParsed)
    {
        Component ref = baseParsed.getRef();
        copyBase(base, ref.isPresent() ? ref.getBegin() - 1 : base.length, baseParsed, output, outParsed);
    }

    /**
     * Appends {@code [0, end)} of the base and the components that lie
     * entirely within it; the others become absent.
     */
    private static void copyBase(byte[] base, int end, Parsed baseParsed, CanonOutput output, Parsed outParsed)
    {
        int offset = output.length();
        output.append(base, 0, end);
        for (URLPart part : URLPart.values())
        {
            Component component = baseParsed.get(part);
            if (component.isPresent() && component.getEnd() <= end)
                outParsed.set(part, Component.of(component.getBegin() + offset, component.getLength()));
            else
                outParsed.set(part, Component.ABSENT);
        }
    }

    /**
     * @return true if the canonical path at {@code begin} starts with a drive such as {@code /C:}
     */
    private static boolean isBareDrive(UrlChars path, Component component)
    {
        int begin = component.getBegin();
        return component.getLength() == 3 &&
            path.at(begin) == '/' &&
            StringUtil.isAsciiAlpha(path.at(begin + 1)) &&
            path.at(begin + 2) == ':';
    }

    private static boolean hasDrive(CanonOutput output, int begin)
    {
        return output.length() - begin >= 3 &&
            output.at(begin) == '/' &&
            StringUtil.isAsciiAlpha(output.at(begin + 1)) &&
            output.at(begin + 2) == ':' &&
            (output.length() - begin == 3 || output.at(begin + 3) == '/');
    }

    private static boolean isDotSegment(byte[] path, int begin, int end)
    {
        return end - begin == 1 && path[begin] == '.';
    }

    private static boolean isDoubleDotSegment(byte[] path, int begin, int end)
    {
        return end - begin == 2 && path[begin] == '.' && path[begin + 1] == '.';
    }

    private static boolean isFileBase(byte[] base, Parsed baseParsed)
    {
        Component scheme = baseParsed.getScheme();
        return scheme.isPresent() && StringUtil.equalsIgnoreCaseAscii(FILE_SCHEME, base, scheme.getBegin(), scheme.getLength());
    }

    private static boolean isValidScheme(UrlChars spec, Component scheme)
    {
        if (!scheme.isNonEmpty())
            return false;
        for (int i = scheme.getBegin(); i < scheme.getEnd(); i++)
        {
            if (!SchemeCanonicalizer.isSchemeChar(spec.at(i)))
                return false;
        }
        return true;
    }

    private static boolean isSameScheme(UrlChars fragment, Component scheme, byte[] base, Component baseScheme)
    {
        if (!baseScheme.isPresent() || baseScheme.getLength() != scheme.getLength())
            return false;
        for (int i = 0; i < scheme.getLength(); i++)
        {
            int c = StringUtil.asciiToLowerCase(fragment.at(scheme.getBegin() + i));
            if (c != StringUtil.asciiToLowerCase(base[baseScheme.getBegin() + i] & 0xFF))
                return false;
        }
        return true;
    }
}
