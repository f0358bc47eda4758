package uk.gegc.gosuraksha.shared.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class ClientIpResolver {

    private final boolean enableForwardedHeaders;
    private final List<String> trustedProxies;

    public ClientIpResolver(
            @Value("${app.security.enable-forwarded-headers:false}") boolean enableForwardedHeaders,
            @Value("${app.security.trusted-proxies:}") String trustedProxiesConfig
    ) {
        this.enableForwardedHeaders = enableForwardedHeaders;
        this.trustedProxies = trustedProxiesConfig == null || trustedProxiesConfig.isBlank()
                ? List.of("127.0.0.1", "::1")
                : Arrays.stream(trustedProxiesConfig.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    /**
     * Extracts the client IP address, honouring X-Forwarded-For only when the direct peer is a
     * trusted proxy. Per-IP throttles key on this value.
     */
    public String resolve(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!enableForwardedHeaders) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.isBlank() || !isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }

        String clientIp = forwardedFor.split(",")[0].trim();
        return looksLikeIp(clientIp) ? clientIp : remoteAddr;
    }

    private boolean isTrustedProxy(String ip) {
        return ip != null && trustedProxies.stream().anyMatch(ip::startsWith);
    }

    private boolean looksLikeIp(String ip) {
        if (ip.isEmpty()) {
            return false;
        }
        String[] parts = ip.split("\\.");
        if (parts.length == 4) {
            try {
                for (String part : parts) {
                    int num = Integer.parseInt(part);
                    if (num < 0 || num > 255) {
                        return false;
                    }
                }
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return ip.contains(":") && ip.matches("^[0-9a-fA-F:]+$");
    }
}
