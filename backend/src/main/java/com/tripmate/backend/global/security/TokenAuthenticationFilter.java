package com.tripmate.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.tripmate.backend.global.error.ProblemException;
import com.tripmate.backend.global.error.ProblemResponseWriter;
import com.tripmate.backend.modules.auth.application.RequestAuthenticator;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer tokens on protected routes. Failures are written straight to the response
 * as a problem envelope; requests without a token continue unauthenticated and are rejected by
 * the entry point if the route needs a user.
 */
public class TokenAuthenticationFilter extends OncePerRequestFilter {

    static final String ROLE_SUPERADMIN = "ROLE_SUPERADMIN";
    static final String ROLE_USER = "ROLE_USER";

    private static final String AUTH_PREFIX = "/api/auth/";
    private static final Set<String> AUTHENTICATED_AUTH_ROUTES = Set.of(
            "/api/auth/logout",
            "/api/auth/change-password",
            "/api/auth/me"
    );

    private final RequestAuthenticator requestAuthenticator;
    private final ProblemResponseWriter problemResponseWriter;

    public TokenAuthenticationFilter(RequestAuthenticator requestAuthenticator, ProblemResponseWriter problemResponseWriter) {
        this.requestAuthenticator = requestAuthenticator;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            AuthenticatedPrincipal principal = requestAuthenticator.authenticate(token.get());
            List<SimpleGrantedAuthority> authorities = principal.superAdmin()
                    ? List.of(new SimpleGrantedAuthority(ROLE_USER), new SimpleGrantedAuthority(ROLE_SUPERADMIN))
                    : List.of(new SimpleGrantedAuthority(ROLE_USER));
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token.get(), authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (ProblemException ex) {
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(request, response, ex);
            return;
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getServletPath();
        if (path.startsWith(AUTH_PREFIX)) {
            return !AUTHENTICATED_AUTH_ROUTES.contains(path);
        }
        return !path.startsWith("/api/");
    }
}
