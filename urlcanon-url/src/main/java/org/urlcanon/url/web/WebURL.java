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

package org.urlcanon.url.web;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urlcanon.url.CanonConfig;
import org.urlcanon.url.Component;
import org.urlcanon.url.FileURLCanonicalizer;
import org.urlcanon.url.IPAddressCanonicalizer;
import org.urlcanon.url.Parsed;
import org.urlcanon.url.PathURLCanonicalizer;
import org.urlcanon.url.PortCanonicalizer;
import org.urlcanon.url.RelativeURLCheck;
import org.urlcanon.url.RelativeURLResolver;
import org.urlcanon.url.Replacement;
import org.urlcanon.url.StandardURLCanonicalizer;
import org.urlcanon.url.URLComponentSource;
import org.urlcanon.url.URLParser;
import org.urlcanon.url.URLReplacer;
import org.urlcanon.url.UrlChars;
import org.urlcanon.util.RawCanonOutput;

/**
 * <p>An immutable canonical URL.</p>
 *
 * <p>{@link #parse(String)} picks the kind of URL from its scheme through a
 * {@link SchemeRegistry}, parses and canonicalizes it. A URL that fails to
 * canonicalize is kept, with its best effort canonical form, and reports
 * {@link #isValid()} false. Two URLs are equal when their canonical forms
 * are.</p>
 *
 * <pre>
 * WebURL url = WebURL.parse("HTTP://Example.COM:80/a/./b?q#r");
 * url.getSpec();                // http://example.com/a/./b?q#r
 * url.resolve("../c").getSpec() // http://example.com/c
 * </pre>
 */
public final class WebURL
{
    private static final Logger LOG = LoggerFactory.getLogger(WebURL.class);

    private final byte[] _spec;
    private final Parsed _parsed;
    private final boolean _valid;
    private final SchemeRegistry _registry;
    private final CanonConfig _config;

    private WebURL(byte[] spec, Parsed parsed, boolean valid, SchemeRegistry registry, CanonConfig config)
    {
        _spec = spec;
        _parsed = parsed;
        _valid = valid;
        _registry = registry;
        _config = config;
    }

    /**
     * Parses a URL with the standard schemes and no IDN or query charset conversion.
     *
     * @param url the URL
     * @return the canonical URL, which may be invalid
     */
    public static WebURL parse(String url)
    {
        return parse(url, SchemeRegistry.standard(), CanonConfig.DEFAULT);
    }

    /**
     * @param url the URL
     * @param registry the kinds of URL schemes introduce, and their default ports
     * @param config the collaborators; default ports of the registry are added to it
     * @return the canonical URL, which may be invalid
     */
    public static WebURL parse(String url, SchemeRegistry registry, CanonConfig config)
    {
        Objects.requireNonNull(url);
        CanonConfig configured = registry.configure(config);
        UrlChars chars = UrlChars.of(url);
        Component trimmed = URLParser.trimURL(chars, 0, chars.length());

        SchemeRegistry.Shape shape;
        Component scheme = URLParser.extractScheme(chars, trimmed.getBegin(), trimmed.getEnd());
        if (URLParser.doesBeginWindowsDriveSpec(chars, trimmed.getBegin(), trimmed.getEnd()))
            shape = SchemeRegistry.Shape.FILE;
        else if (scheme.isNonEmpty())
            shape = registry.getShape(chars.substring(scheme));
        else
            return invalid(url, registry, configured);

        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        boolean valid;
        switch (shape)
        {
            case STANDARD:
                valid = StandardURLCanonicalizer.canonicalize(chars, URLParser.parseStandardURL(chars), configured, output, parsed);
                break;
            case FILE:
                valid = FileURLCanonicalizer.canonicalize(chars, URLParser.parseFileURL(chars), configured, output, parsed);
                break;
            default:
                valid = PathURLCanonicalizer.canonicalize(chars, URLParser.parsePathURL(chars), configured, output, parsed);
                break;
        }
        if (!valid && LOG.isDebugEnabled())
            LOG.debug("Invalid URL {} canonicalized as {}", url, output);
        return new WebURL(Arrays.copyOf(output.getData(), output.length()), parsed, valid, registry, configured);
    }

    private static WebURL invalid(String url, SchemeRegistry registry, CanonConfig config)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("No scheme in {}", url);
        return new WebURL(new byte[0], new Parsed(), false, registry, config);
    }

    /**
     * Resolves a reference against this URL. A relative reference is merged
     * with this URL; an absolute one is parsed on its own.
     *
     * @param reference the reference
     * @return the resolved URL, invalid if this URL is invalid; this URL,
     * marked invalid, if the reference cannot be resolved against it
     */
    public WebURL resolve(String reference)
    {
        Objects.requireNonNull(reference);
        if (!_valid)
            return invalid(reference, _registry, _config);

        SchemeRegistry.Shape shape = _registry.getShape(getScheme());
        RelativeURLCheck check = RelativeURLResolver.isRelativeURL(_spec, _parsed, reference, shape != SchemeRegistry.Shape.PATH);
        if (!check.isValid())
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Cannot resolve {} against {}", reference, this);
            return new WebURL(_spec, _parsed, false, _registry, _config);
        }
        if (!check.isRelative())
            return parse(reference, _registry, _config);

        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        boolean valid = RelativeURLResolver.resolveRelativeURL(_spec, _parsed, shape == SchemeRegistry.Shape.FILE,
            reference, check.getRelativeComponent(), _config, output, parsed);
        return new WebURL(Arrays.copyOf(output.getData(), output.length()), parsed, valid, _registry, _config);
    }

    /**
     * @param replacements the components to keep, delete or replace
     * @return the URL with the replacements applied, invalid if this URL is
     * invalid or the result is; this URL, marked invalid, if the new scheme
     * introduces a different kind of URL
     */
    public WebURL replaceComponents(URLComponentSource replacements)
    {
        Objects.requireNonNull(replacements);
        if (!_valid)
            return this;

        SchemeRegistry.Shape shape = _registry.getShape(getScheme());
        Replacement scheme = replacements.getScheme();
        if (scheme.getKind() == Replacement.Kind.REPLACE)
        {
            String newScheme = scheme.getText().toString();
            if (_registry.getShape(newScheme) != shape)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Refusing scheme {} on {} URL {}", newScheme, shape, this);
                return new WebURL(_spec, _parsed, false, _registry, _config);
            }
        }

        RawCanonOutput output = new RawCanonOutput();
        Parsed parsed = new Parsed();
        boolean valid;
        switch (shape)
        {
            case STANDARD:
                valid = URLReplacer.replaceStandardURL(_spec, _parsed, replacements, _config, output, parsed);
                break;
            case FILE:
                valid = URLReplacer.replaceFileURL(_spec, _parsed, replacements, _config, output, parsed);
                break;
            default:
                valid = URLReplacer.replacePathURL(_spec, _parsed, replacements, _config, output, parsed);
                break;
        }
        return new WebURL(Arrays.copyOf(output.getData(), output.length()), parsed, valid, _registry, _config);
    }

    public boolean isValid()
    {
        return _valid;
    }

    /**
     * @return the canonical URL; for an invalid URL a best effort form, possibly empty
     */
    public String getSpec()
    {
        return new String(_spec, StandardCharsets.UTF_8);
    }

    /**
     * @return a copy of the components of {@link #getSpec()}
     */
    public Parsed getParsed()
    {
        return new Parsed(_parsed);
    }

    public String getScheme()
    {
        return component(_parsed.getScheme());
    }

    public String getUsername()
    {
        return component(_parsed.getUsername());
    }

    public String getPassword()
    {
        return component(_parsed.getPassword());
    }

    public String getHost()
    {
        return component(_parsed.getHost());
    }

    public String getPort()
    {
        return component(_parsed.getPort());
    }

    /**
     * @return the explicit port, or the default port of the scheme, or
     * {@link PortCanonicalizer#PORT_UNSPECIFIED}
     */
    public int getEffectivePort()
    {
        int port = PortCanonicalizer.parsePort(UrlChars.of(_spec), _parsed.getPort());
        if (port == PortCanonicalizer.PORT_UNSPECIFIED && _parsed.getScheme().isPresent())
            return _registry.getDefaultPort(getScheme());
        return port;
    }

    public String getPath()
    {
        return component(_parsed.getPath());
    }

    public String getQuery()
    {
        return component(_parsed.getQuery());
    }

    public String getRef()
    {
        return component(_parsed.getRef());
    }

    public boolean isFile()
    {
        return _valid && _registry.getShape(getScheme()) == SchemeRegistry.Shape.FILE;
    }

    /**
     * @return true if the host is an IPv4 or bracketed IPv6 address
     */
    public boolean hostIsIPAddress()
    {
        if (!_valid || !_parsed.getHost().isNonEmpty())
            return false;
        return IPAddressCanonicalizer.canonicalize(_spec, _parsed.getHost(), new RawCanonOutput()).isIPAddress();
    }

    /**
     * @param scheme a scheme
     * @return true if this URL has the scheme, compared without case
     */
    public boolean schemeIs(String scheme)
    {
        String own = getScheme();
        return own != null && own.equals(scheme.toLowerCase(Locale.ENGLISH));
    }

    private String component(Component component)
    {
        if (!component.isPresent())
            return null;
        return new String(_spec, component.getBegin(), component.getLength(), StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof WebURL))
            return false;
        WebURL that = (WebURL)o;
        return _valid == that._valid && Arrays.equals(_spec, that._spec);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(_spec);
    }

    @Override
    public String toString()
    {
        return getSpec();
    }
}
