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
 * <p>The logical structure of one URL string: one {@link Component} per
 * part, each referring into that string. Every part starts absent.</p>
 *
 * <p>Canonicalizers write the components of their output into a
 * {@code Parsed} supplied by the caller.</p>
 */
public class Parsed
{
    private Component _scheme = Component.ABSENT;
    private Component _username = Component.ABSENT;
    private Component _password = Component.ABSENT;
    private Component _host = Component.ABSENT;
    private Component _port = Component.ABSENT;
    private Component _path = Component.ABSENT;
    private Component _query = Component.ABSENT;
    private Component _ref = Component.ABSENT;

    public Parsed()
    {
    }

    public Parsed(Parsed parsed)
    {
        set(parsed);
    }

    /**
     * Copies every component of another {@code Parsed}.
     *
     * @param parsed the components to copy
     */
    public void set(Parsed parsed)
    {
        _scheme = parsed._scheme;
        _username = parsed._username;
        _password = parsed._password;
        _host = parsed._host;
        _port = parsed._port;
        _path = parsed._path;
        _query = parsed._query;
        _ref = parsed._ref;
    }

    public void clear()
    {
        set(new Parsed());
    }

    public Component getScheme()
    {
        return _scheme;
    }

    public void setScheme(Component scheme)
    {
        _scheme = Objects.requireNonNull(scheme);
    }

    public Component getUsername()
    {
        return _username;
    }

    public void setUsername(Component username)
    {
        _username = Objects.requireNonNull(username);
    }

    public Component getPassword()
    {
        return _password;
    }

    public void setPassword(Component password)
    {
        _password = Objects.requireNonNull(password);
    }

    public Component getHost()
    {
        return _host;
    }

    public void setHost(Component host)
    {
        _host = Objects.requireNonNull(host);
    }

    public Component getPort()
    {
        return _port;
    }

    public void setPort(Component port)
    {
        _port = Objects.requireNonNull(port);
    }

    public Component getPath()
    {
        return _path;
    }

    public void setPath(Component path)
    {
        _path = Objects.requireNonNull(path);
    }

    public Component getQuery()
    {
        return _query;
    }

    public void setQuery(Component query)
    {
        _query = Objects.requireNonNull(query);
    }

    public Component getRef()
    {
        return _ref;
    }

    public void setRef(Component ref)
    {
        _ref = Objects.requireNonNull(ref);
    }

    Component get(URLPart part)
    {
        switch (part)
        {
            case SCHEME:
                return _scheme;
            case USERNAME:
                return _username;
            case PASSWORD:
                return _password;
            case HOST:
                return _host;
            case PORT:
                return _port;
            case PATH:
                return _path;
            case QUERY:
                return _query;
            case REF:
                return _ref;
            default:
                throw new IllegalArgumentException("Unknown part " + part);
        }
    }

    void set(URLPart part, Component component)
    {
        switch (part)
        {
            case SCHEME:
                setScheme(component);
                break;
            case USERNAME:
                setUsername(component);
                break;
            case PASSWORD:
                setPassword(component);
                break;
            case HOST:
                setHost(component);
                break;
            case PORT:
                setPort(component);
                break;
            case PATH:
                setPath(component);
                break;
            case QUERY:
                setQuery(component);
                break;
            case REF:
                setRef(component);
                break;
            default:
                throw new IllegalArgumentException("Unknown part " + part);
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof Parsed))
            return false;
        Parsed that = (Parsed)o;
        return _scheme.equals(that._scheme) &&
            _username.equals(that._username) &&
            _password.equals(that._password) &&
            _host.equals(that._host) &&
            _port.equals(that._port) &&
            _path.equals(that._path) &&
            _query.equals(that._query) &&
            _ref.equals(that._ref);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_scheme, _username, _password, _host, _port, _path, _query, _ref);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{scheme=%s,user=%s,password=%s,host=%s,port=%s,path=%s,query=%s,ref=%s}",
            getClass().getSimpleName(), hashCode(),
            _scheme, _username, _password, _host, _port, _path, _query, _ref);
    }
}
