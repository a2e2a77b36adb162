package restopm.billing.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import restopm.billing.context.OperatorContext;

import java.io.IOException;

/**
 * Captures the operator's bearer token (and the optional X-Operator header) so the
 * backend clients can propagate them. Token validation is the backend's job.
 */
@Component
public class BearerTokenRelayFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenRelayFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                OperatorContext.setBearerToken(token);
            }
        } else if (authorization != null) {
            logger.warn("Ignoring non-bearer Authorization header on {}", request.getRequestURI());
        }

        String operator = request.getHeader("X-Operator");
        if (operator != null && !operator.isBlank()) {
            OperatorContext.setOperator(operator.trim());
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            OperatorContext.clear();
        }
    }
}
