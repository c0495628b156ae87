package com.mirrorwatch.common.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HostNamesTest {

    @Test
    @DisplayName("strips scheme, userinfo, port and path")
    void normalizesUrl() {
        assertEquals("mirror.example.net", HostNames.normalize("https://user@Mirror.Example.NET:8443/path?q=1"));
    }

    @Test
    @DisplayName("bare host with trailing slash")
    void bareHost() {
        assertEquals("mirror.example.net", HostNames.normalize("mirror.example.net/"));
    }

    @Test
    @DisplayName("base URL keeps scheme and port, defaults to https")
    void baseUrl() {
        assertEquals("http://mirror.example.net:8080", HostNames.toBaseUrl("http://mirror.example.net:8080/about"));
        assertEquals("https://mirror.example.net", HostNames.toBaseUrl("mirror.example.net"));
    }

    @Test
    @DisplayName("blank or unparseable input → null")
    void unusableInput() {
        assertNull(HostNames.normalize(null));
        assertNull(HostNames.normalize("   "));
        assertNull(HostNames.normalize("https://exa mple.com"));
        assertNull(HostNames.toBaseUrl("/"));
    }
}
