package de.htwsaar.assetserver.common.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Filter that protects the admin endpoints of the asset server by validating a shared admin token.
 *
 * <p>Asset requests are never affected, only paths below {@link #ADMIN_PREFIX}. The prefix is matched
 * against the decoded path without path parameters, the same form Spring's handler mapping sees,
 * so {@code /_assetserver/%61dmin/stats} is protected as well.</p>
 */
public class AdminAuthFilter extends OncePerRequestFilter {

    /** Name of the HTTP header expected to carry the admin token. */
    public static final String AUTH_HEADER = "X-Admin-Token";

    /** Path prefix of all admin routes. */
    public static final String ADMIN_PREFIX = "/_assetserver/admin/";

    /** Token value configured on the server that incoming admin requests must match. */
    private final String expectedToken;

    /**
     * Creates a new admin authentication filter.
     *
     * @param expectedToken the token that must match the value provided in the admin header
     */
    public AdminAuthFilter(String expectedToken) {
        this.expectedToken = Objects.requireNonNull(expectedToken, "expectedToken must not be null");
    }

    /**
     * Checks requests to admin routes for the presence and validity of the admin token.
     * Missing token: 401 Unauthorized. Wrong token: 403 Forbidden.
     *
     * @param request the HTTP request
     * @param response the HTTP response
     * @param filterChain the remaining filter chain
     * @throws ServletException if filtering fails
     * @throws IOException if an I/O error occurs
     */
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (isAdminPath(request)) {
            String providedToken = request.getHeader(AUTH_HEADER);

            if (providedToken == null || providedToken.isBlank()) {
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Admin Token");
                return;
            }

            if (!expectedToken.equals(providedToken)) {
                response.sendError(HttpServletResponse.SC_FORBIDDEN, "Invalid Admin Token");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private static boolean isAdminPath(HttpServletRequest request) {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return path.replaceAll("/{2,}", "/").startsWith(ADMIN_PREFIX);
    }
}
