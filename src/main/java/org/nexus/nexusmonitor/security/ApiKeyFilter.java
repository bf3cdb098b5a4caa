package org.nexus.nexusmonitor.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nexus.nexusmonitor.config.MonitoringProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Vitals ingestion and simulation require {@code X-API-KEY}. Reads are open.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    private final MonitoringProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        if (needsKey(req.getRequestURI(), req.getMethod())) {
            String key = req.getHeader("X-API-KEY");
            if (key == null || props.apiKey() == null || !key.equals(props.apiKey())) {
                log.debug("[Security] rejected {} {} without valid api key", req.getMethod(), req.getRequestURI());
                res.setStatus(HttpStatus.UNAUTHORIZED.value());
                res.setContentType("application/json");
                res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
                return;
            }
        }

        chain.doFilter(req, res);
    }

    static boolean needsKey(String path, String method) {
        if (!"POST".equalsIgnoreCase(method) || !path.startsWith("/api/patients/")) return false;
        return path.equals("/api/patients/simulate") || path.endsWith("/vitals");
    }
}
