package com.loopPhones.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Set;

/**
 * Checks the shared device key on telemetry uploads from handsets.
 * Header: X-Device-API-Key: &lt;configured-key&gt;
 */
@Slf4j
@Component
public class DeviceApiKeyFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Device-API-Key";

    private static final Set<String> PROTECTED_DEVICE_PATHS = Set.of("/api/v1/telemetry");

    @Value("${device.api-key}")
    private String validApiKey;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        boolean isDeviceUpload = "POST".equalsIgnoreCase(request.getMethod())
                && PROTECTED_DEVICE_PATHS.stream().anyMatch(path::equals);

        if (!isDeviceUpload) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(HEADER);
        if (providedKey == null || !providedKey.equals(validApiKey)) {
            log.warn("Telemetry upload rejected: missing or invalid device key from {}", request.getRemoteAddr());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.setCharacterEncoding("UTF-8");
            response.getWriter().write("""
                    {"error": "INVALID_DEVICE_API_KEY", "message": "X-Device-API-Key header is invalid or missing"}
                    """);
            return;
        }

        filterChain.doFilter(request, response);
    }
}
