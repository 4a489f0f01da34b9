package com.ecommerce.user.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.ecommerce.user.modules.account.application.JwtTokenService;
import com.ecommerce.user.modules.account.application.JwtTokenService.AccessClaims;
import com.ecommerce.user.modules.account.application.JwtTokenService.InvalidTokenException;
import com.ecommerce.user.modules.account.application.UserDirectory;
import com.ecommerce.user.modules.account.domain.UserAccount;

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
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer access tokens. The token only proves identity; active state and staff rights are read from
 * the stored account on every request.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = "auth.error";
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final UserDirectory userDirectory;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, UserDirectory userDirectory) {
        this.jwtTokenService = jwtTokenService;
        this.userDirectory = userDirectory;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                AccessClaims claims = jwtTokenService.verify(token);
                Optional<UserAccount> user = userDirectory.findById(claims.userId());
                if (user.isEmpty()) {
                    reject(request, "User not found.");
                } else if (!user.get().isActive()) {
                    reject(request, "User account is disabled.");
                } else {
                    authenticate(request, user.get(), token);
                }
            } catch (InvalidTokenException ex) {
                reject(request, ex.getMessage());
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, UserAccount user, String token) {
        List<SimpleGrantedAuthority> authorities = user.isStaff()
                ? List.of(new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_STAFF"))
                : List.of(new SimpleGrantedAuthority("ROLE_USER"));
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(user.getId(), user.getEmail(), user.isStaff());

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    // the entry point renders the 401 if the route needs authentication
    private void reject(HttpServletRequest request, String detail) {
        SecurityContextHolder.clearContext();
        request.setAttribute(AUTH_ERROR_ATTRIBUTE, detail);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.equals("/api/auth/register")
                || path.equals("/api/auth/login")
                || path.equals("/api/auth/refresh")
                || path.startsWith("/api/health")
                || path.startsWith("/healthz")
                || path.startsWith("/readyz")
                || path.startsWith("/actuator/health");
    }
}
