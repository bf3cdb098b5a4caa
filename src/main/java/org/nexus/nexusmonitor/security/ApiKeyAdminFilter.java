package org.nexus.nexusmonitor.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * Guards /api/admin/**: admin key first, then caller IP against the allowlist.
 * Allowlist entries are an exact IPv4 address, an IPv4 CIDR block or {@code *};
 * they are parsed once at startup and a malformed entry fails the boot.
 */
@Slf4j
@Component
public class ApiKeyAdminFilter implements Filter {
    static final String ADMIN_PREFIX = "/api/admin/";

    private final String adminKey;
    private final List<IpRule> allowlist;

    public ApiKeyAdminFilter(MonitoringProps props) {
        this.adminKey = props.adminApiKey();
        var raw = props.adminAllowIps() == null || props.adminAllowIps().isBlank() ? "127.0.0.1" : props.adminAllowIps();
        List<IpRule> rules = new ArrayList<>();
        for (var entry : raw.trim().split("\\s*,\\s*")) {
            rules.add(IpRule.parse(entry));
        }
        this.allowlist = List.copyOf(rules);
        log.info("[Security] admin allowlist: {}", raw);
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var w = (HttpServletResponse) res;

        if (!r.getRequestURI().startsWith(ADMIN_PREFIX)) {
            chain.doFilter(req, res);
            return;
        }

        String k = r.getHeader("X-ADMIN-API-KEY");
        if (k == null || adminKey == null || !k.equals(adminKey)) {
            w.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing/invalid admin key");
            return;
        }

        String ip = normalize(r.getRemoteAddr());
        if (!isAllowed(ip)) {
            log.warn("[Security] admin call to {} from disallowed ip {}", r.getRequestURI(), ip);
            w.sendError(HttpServletResponse.SC_FORBIDDEN, "IP not allowed: " + ip);
            return;
        }
        chain.doFilter(req, res);
    }

    boolean isAllowed(String ip) {
        Integer addr = ipv4(ip);
        return allowlist.stream().anyMatch(rule -> rule.matches(addr));
    }

    private static String normalize(String ip) {
        return "0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip) ? "127.0.0.1" : ip;
    }

    /** Null for anything that is not a literal IPv4 address. */
    private static Integer ipv4(String ip) {
        if (ip == null || !ip.matches("\\d{1,3}(\\.\\d{1,3}){3}")) return null;
        try {
            byte[] b = InetAddress.getByName(ip).getAddress();
            return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    record IpRule(boolean any, int network, int mask) {

        static IpRule parse(String entry) {
            if (entry.equals("*")) return new IpRule(true, 0, 0);
            int slash = entry.indexOf('/');
            String base = slash < 0 ? entry : entry.substring(0, slash);
            int prefix;
            try {
                prefix = slash < 0 ? 32 : Integer.parseInt(entry.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid admin allowlist entry: " + entry, e);
            }
            Integer net = ipv4(base);
            if (net == null || prefix < 0 || prefix > 32) {
                throw new IllegalArgumentException("Invalid admin allowlist entry: " + entry);
            }
            int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
            return new IpRule(false, net & mask, mask);
        }

        boolean matches(Integer addr) {
            if (any) return true;
            return addr != null && (addr & mask) == network;
        }
    }
}
