package com.jreinhal.bastion.security;

import jakarta.servlet.http.HttpServletRequest;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns a request into the origin key that per-minute rate limits and the daily
 * {@code budget:ip:} counters are kept under.
 *
 * <p>Keys are canonical address literals: {@code ::1} and {@code 0:0:0:0:0:0:0:1} count as
 * one origin, IPv4-mapped IPv6 collapses to dotted form, and ports and brackets are dropped.
 * Anything that is not an address literal becomes {@link #UNKNOWN}.</p>
 *
 * <p>Forwarding headers are read only when the direct peer is a trusted proxy. The
 * {@code X-Forwarded-For} chain is walked from the right, skipping trusted hops, so a
 * client cannot pick its own key by prepending addresses.</p>
 */
@Component
public class OriginResolver {
    private static final Logger log = LoggerFactory.getLogger(OriginResolver.class);
    public static final String UNKNOWN = "unknown";
    private static final Pattern IPV4 = Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})");
    private static final Pattern IPV4_WITH_PORT = Pattern.compile("(\\d{1,3}(?:\\.\\d{1,3}){3}):\\d{1,5}");
    private static final Pattern BRACKETED_IPV6 = Pattern.compile("\\[([^\\]]+)\\](?::\\d{1,5})?");
    private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.]+");
    private final Set<String> trustedProxies;

    public OriginResolver(@Value("${bastion.security.trusted-proxies:}") String trustedProxyList) {
        this.trustedProxies = trustedProxyList == null ? Set.of() : Arrays.stream(trustedProxyList.split(","))
                .map(OriginResolver::canonical)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
        if (!this.trustedProxies.isEmpty()) {
            log.info("Forwarding headers honored from {} trusted proxies: {}", this.trustedProxies.size(), this.trustedProxies);
        }
    }

    public String resolve(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String peer = canonical(request.getRemoteAddr());
        if (peer == null) {
            return UNKNOWN;
        }
        if (!this.trustedProxies.contains(peer)) {
            return peer;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            List<String> hops = Arrays.asList(forwardedFor.split(","));
            for (int i = hops.size() - 1; i >= 0; --i) {
                String hop = canonical(hops.get(i));
                if (hop == null) {
                    log.debug("Unparseable X-Forwarded-For hop from proxy {}", peer);
                    return UNKNOWN;
                }
                if (!this.trustedProxies.contains(hop)) {
                    return hop;
                }
            }
        }
        String realIp = canonical(request.getHeader("X-Real-IP"));
        return realIp != null ? realIp : peer;
    }

    /**
     * Canonical text form of an address literal, or {@code null} when the value is not one.
     * Never performs a name lookup.
     */
    static String canonical(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        Matcher bracketed = BRACKETED_IPV6.matcher(value);
        if (bracketed.matches()) {
            value = bracketed.group(1);
        } else {
            Matcher withPort = IPV4_WITH_PORT.matcher(value);
            if (withPort.matches()) {
                value = withPort.group(1);
            }
        }
        int zone = value.indexOf('%');
        if (zone > 0) {
            value = value.substring(0, zone);
        }
        Matcher ipv4 = IPV4.matcher(value);
        if (ipv4.matches()) {
            for (int group = 1; group <= 4; ++group) {
                if (Integer.parseInt(ipv4.group(group)) > 255) {
                    return null;
                }
            }
        } else if (value.indexOf(':') < 0 || !IPV6_CHARS.matcher(value).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(value).getHostAddress().toLowerCase(Locale.ROOT);
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
