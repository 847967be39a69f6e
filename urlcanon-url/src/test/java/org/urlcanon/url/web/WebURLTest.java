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

import org.junit.jupiter.api.Test;
import org.urlcanon.url.CanonConfig;
import org.urlcanon.url.JavaCharsetConverter;
import org.urlcanon.url.JavaIdnConverter;
import org.urlcanon.url.Parsed;
import org.urlcanon.url.PortCanonicalizer;
import org.urlcanon.url.Replacement;
import org.urlcanon.url.URLComponentSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class WebURLTest
{
    @Test
    public void testParse()
    {
        WebURL url = WebURL.parse(" HTTP://User:Pw@Example.COM:8080/a b?q=1#frag ");

        assertThat(url.isValid(), is(true));
        assertThat(url.getSpec(), is("http://User:Pw@example.com:8080/a%20b?q=1#frag"));
        assertThat(url.getScheme(), is("http"));
        assertThat(url.getUsername(), is("User"));
        assertThat(url.getPassword(), is("Pw"));
        assertThat(url.getHost(), is("example.com"));
        assertThat(url.getPort(), is("8080"));
        assertThat(url.getEffectivePort(), is(8080));
        assertThat(url.getPath(), is("/a%20b"));
        assertThat(url.getQuery(), is("q=1"));
        assertThat(url.getRef(), is("frag"));
        assertThat(url.toString(), is(url.getSpec()));
    }

    @Test
    public void testDefaultPortAndResolve()
    {
        WebURL url = WebURL.parse("HTTP://Example.COM:80/a/./b?q#r");
        assertThat(url.getSpec(), is("http://example.com/a/./b?q#r"));
        assertThat(url.getPort(), nullValue());
        assertThat(url.getEffectivePort(), is(80));

        WebURL resolved = url.resolve("../c");
        assertThat(resolved.isValid(), is(true));
        assertThat(resolved.getSpec(), is("http://example.com/c"));
        assertThat(resolved.getQuery(), nullValue());
    }

    @Test
    public void testResolveAbsolute()
    {
        WebURL base = WebURL.parse("http://a/b/c");
        assertThat(base.resolve("HTTPS://Other/x").getSpec(), is("https://other/x"));
        assertThat(base.resolve("mailto:x@y").getSpec(), is("mailto:x@y"));
        assertThat(base.resolve("//other").getSpec(), is("http://other/"));
        assertThat(base.resolve("#f").getSpec(), is("http://a/b/c#f"));
    }

    @Test
    public void testEquals()
    {
        WebURL a = WebURL.parse("http://EXAMPLE.com");
        WebURL b = WebURL.parse("http://example.com:80/");

        assertThat(a, is(b));
        assertThat(a.hashCode(), is(b.hashCode()));
        assertThat(a, not(WebURL.parse("https://example.com/")));
    }

    @Test
    public void testInvalid()
    {
        WebURL url = WebURL.parse("http://ho st/");
        assertThat(url.isValid(), is(false));
        assertThat(url.getSpec(), is("http://ho%20st/"));
        assertThat(url.isFile(), is(false));
        assertThat(url.hostIsIPAddress(), is(false));
        assertThat(url.resolve("x").isValid(), is(false));
        assertThat(url.replaceComponents(new URLComponentSource()), sameInstance(url));
    }

    @Test
    public void testNoScheme()
    {
        WebURL url = WebURL.parse("foo/bar");
        assertThat(url.isValid(), is(false));
        assertThat(url.getSpec(), is(""));
        assertThat(url.getScheme(), nullValue());

        assertThat(WebURL.parse(":x").isValid(), is(false));
        assertThat(WebURL.parse("").isValid(), is(false));
    }

    @Test
    public void testFile()
    {
        WebURL url = WebURL.parse("c:\\dir\\f.txt");
        assertThat(url.isValid(), is(true));
        assertThat(url.isFile(), is(true));
        assertThat(url.getSpec(), is("file:///C:/dir/f.txt"));
        assertThat(url.getHost(), nullValue());
        assertThat(url.getPath(), is("/C:/dir/f.txt"));
        assertThat(WebURL.parse("file:///C:/dir").getHost(), is(""));

        assertThat(url.resolve("..\\g.txt").getSpec(), is("file:///C:/g.txt"));
        assertThat(url.resolve("d:/x").getSpec(), is("file:///D:/x"));

        WebURL unc = WebURL.parse("FILE://Server/Share/x");
        assertThat(unc.getSpec(), is("file://server/Share/x"));
        assertThat(unc.getHost(), is("server"));
    }

    @Test
    public void testPathURL()
    {
        WebURL url = WebURL.parse("MailTo:Someone@Example.com");
        assertThat(url.isValid(), is(true));
        assertThat(url.getSpec(), is("mailto:Someone@Example.com"));
        assertThat(url.getHost(), nullValue());
        assertThat(url.getPath(), is("Someone@Example.com"));
        assertThat(url.getEffectivePort(), is(PortCanonicalizer.PORT_UNSPECIFIED));
        assertThat(url.schemeIs("MAILTO"), is(true));
        assertThat(url.schemeIs("http"), is(false));

        assertThat(url.resolve("x").isValid(), is(false));
        assertThat(url.resolve("http://h/").getSpec(), is("http://h/"));
    }

    @Test
    public void testResolveAgainstPathURLKeepsBase()
    {
        WebURL base = WebURL.parse("javascript:alert(1)");
        assertThat(base.isValid(), is(true));

        WebURL relative = base.resolve("g");
        assertThat(relative.isValid(), is(false));
        assertThat(relative.getSpec(), is("javascript:alert(1)"));
        assertThat(relative.getPath(), is("alert(1)"));

        WebURL ref = base.resolve("#x");
        assertThat(ref.isValid(), is(false));
        assertThat(ref.getSpec(), is("javascript:alert(1)"));
    }

    @Test
    public void testHostIsIPAddress()
    {
        WebURL ipv4 = WebURL.parse("http://0x7f.1/");
        assertThat(ipv4.getHost(), is("127.0.0.1"));
        assertThat(ipv4.hostIsIPAddress(), is(true));
        assertThat(WebURL.parse("http://[0::1]/").hostIsIPAddress(), is(true));
        assertThat(WebURL.parse("http://[0::1]/").getHost(), is("[::1]"));
        assertThat(WebURL.parse("http://example.com/").hostIsIPAddress(), is(false));
    }

    @Test
    public void testReplaceComponents()
    {
        WebURL url = WebURL.parse("http://example.com/p?a=1#r");
        WebURL replaced = url.replaceComponents(new URLComponentSource()
            .setQuery(Replacement.replace("b=2"))
            .setRef(Replacement.delete())
            .setPort(Replacement.replace("81")));

        assertThat(replaced.isValid(), is(true));
        assertThat(replaced.getSpec(), is("http://example.com:81/p?b=2"));
        assertThat(url.getSpec(), is("http://example.com/p?a=1#r"));

        WebURL refused = url.replaceComponents(new URLComponentSource().setScheme(Replacement.replace("file")));
        assertThat(refused.isValid(), is(false));
        assertThat(refused.getScheme(), is("http"));
    }

    @Test
    public void testReplaceSchemeOfAnotherShape()
    {
        WebURL url = WebURL.parse("http://h/p");

        WebURL refused = url.replaceComponents(new URLComponentSource().setScheme(Replacement.replace("javascript")));
        assertThat(refused.isValid(), is(false));
        assertThat(refused.getSpec(), is("http://h/p"));
        assertThat(refused.getHost(), is("h"));

        WebURL secure = url.replaceComponents(new URLComponentSource().setScheme(Replacement.replace("HTTPS")));
        assertThat(secure.isValid(), is(true));
        assertThat(secure.getSpec(), is("https://h/p"));
        assertThat(secure, is(WebURL.parse("https://h/p")));

        WebURL mail = WebURL.parse("mailto:a@b");
        WebURL news = mail.replaceComponents(new URLComponentSource().setScheme(Replacement.replace("news")));
        assertThat(news.isValid(), is(true));
        assertThat(news.getSpec(), is("news:a@b"));
        assertThat(mail.replaceComponents(new URLComponentSource().setScheme(Replacement.replace("ftp"))).isValid(), is(false));
    }

    @Test
    public void testCustomRegistry()
    {
        SchemeRegistry registry = new SchemeRegistry().withStandardScheme("myapp", 1234);

        WebURL url = WebURL.parse("MyApp://H:1234/x", registry, CanonConfig.DEFAULT);
        assertThat(url.getSpec(), is("myapp://h/x"));
        assertThat(url.getEffectivePort(), is(1234));

        WebURL opaque = WebURL.parse("http://H/x", registry, CanonConfig.DEFAULT);
        assertThat(opaque.getSpec(), is("http://H/x"));
        assertThat(opaque.getHost(), nullValue());
    }

    @Test
    public void testConfigCollaborators()
    {
        CanonConfig config = CanonConfig.DEFAULT
            .withIdnConverter(new JavaIdnConverter())
            .withCharsetConverter(new JavaCharsetConverter(StandardCharsets.ISO_8859_1));

        WebURL url = WebURL.parse("http://Bücher.de/?q=é", SchemeRegistry.standard(), config);
        assertThat(url.isValid(), is(true));
        assertThat(url.getSpec(), is("http://xn--bcher-kva.de/?q=%E9"));

        assertThat(WebURL.parse("http://Bücher.de/").isValid(), is(false));
    }

    @Test
    public void testGetParsedIsCopy()
    {
        WebURL url = WebURL.parse("http://h/");
        Parsed parsed = url.getParsed();
        parsed.clear();
        assertThat(url.getHost(), is("h"));
    }
}
