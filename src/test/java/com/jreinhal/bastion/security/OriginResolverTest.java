package com.jreinhal.bastion.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockHttpServletRequest;

class OriginResolverTest {
    private final OriginResolver direct = new OriginResolver("");
    private final OriginResolver behindProxies = new OriginResolver("10.0.0.1, 10.0.0.2, ::1");

    private static MockHttpServletRequest from(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/chat");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    @Test
    void ignoresForwardingHeadersFromUntrustedPeer() {
        MockHttpServletRequest request = from("203.0.113.7");
        request.addHeader("X-Forwarded-For", "198.51.100.1");
        request.addHeader("X-Real-IP", "198.51.100.2");

        assertThat(this.direct.resolve(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void takesRightmostUntrustedHop() {
        MockHttpServletRequest request = from("10.0.0.1");
        request.addHeader("X-Forwarded-For", "1.1.1.1, 203.0.113.9, 10.0.0.2");

        assertThat(this.behindProxies.resolve(request)).isEqualTo("203.0.113.9");
    }

    @Test
    void prependedHopsCannotChooseTheKey() {
        MockHttpServletRequest first = from("10.0.0.1");
        first.addHeader("X-Forwarded-For", "203.0.113.9");
        MockHttpServletRequest spoofed = from("10.0.0.1");
        spoofed.addHeader("X-Forwarded-For", "192.0.2.55, 203.0.113.9");

        assertThat(this.behindProxies.resolve(spoofed)).isEqualTo(this.behindProxies.resolve(first));
    }

    @Test
    void fallsBackToRealIpThenPeer() {
        MockHttpServletRequest realIp = from("10.0.0.2");
        realIp.addHeader("X-Real-IP", " 198.51.100.9 ");
        MockHttpServletRequest onlyProxies = from("10.0.0.2");
        onlyProxies.addHeader("X-Forwarded-For", "10.0.0.1");

        assertThat(this.behindProxies.resolve(realIp)).isEqualTo("198.51.100.9");
        assertThat(this.behindProxies.resolve(onlyProxies)).isEqualTo("10.0.0.2");
    }

    @Test
    void equivalentIpv6SpellingsShareOneKey() {
        assertThat(this.direct.resolve(from("::1"))).isEqualTo(this.direct.resolve(from("0:0:0:0:0:0:0:1")));
        assertThat(this.direct.resolve(from("2001:DB8::1"))).isEqualTo("2001:db8:0:0:0:0:0:1");
    }

    @Test
    void trustedProxyMatchesInAnyIpv6Spelling() {
        MockHttpServletRequest request = from("0:0:0:0:0:0:0:1");
        request.addHeader("X-Forwarded-For", "198.51.100.4");

        assertThat(this.behindProxies.resolve(request)).isEqualTo("198.51.100.4");
    }

    @Test
    void dropsPortsBracketsAndMappedPrefix() {
        assertThat(OriginResolver.canonical("198.51.100.4:5123")).isEqualTo("198.51.100.4");
        assertThat(OriginResolver.canonical("[2001:db8::1]:443")).isEqualTo("2001:db8:0:0:0:0:0:1");
        assertThat(OriginResolver.canonical("::ffff:198.51.100.4")).isEqualTo("198.51.100.4");
    }

    @ParameterizedTest
    @ValueSource(strings = {"not-an-ip", "example.com", "999.1.1.1", "1.2.3", "  "})
    void nonLiteralsAreNotAddresses(String value) {
        assertThat(OriginResolver.canonical(value)).isNull();
    }

    @Test
    void garbageForwardedHopIsUnknown() {
        MockHttpServletRequest request = from("10.0.0.1");
        request.addHeader("X-Forwarded-For", "evil\nvalue");

        assertThat(this.behindProxies.resolve(request)).isEqualTo(OriginResolver.UNKNOWN);
    }

    @Test
    void missingPeerIsUnknown() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("");

        assertThat(this.direct.resolve(request)).isEqualTo(OriginResolver.UNKNOWN);
        assertThat(this.direct.resolve(null)).isEqualTo(OriginResolver.UNKNOWN);
    }
}
