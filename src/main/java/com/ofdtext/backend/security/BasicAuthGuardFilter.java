package com.ofdtext.backend.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Authenticates requests with HTTP Basic credentials accepted by the {@link AuthGuard}.
 *
 * Never rejects by itself: requests without valid credentials continue unauthenticated and
 * protected routes are then answered by {@link JsonAuthenticationEntryPoint}.
 */
@Component
@RequiredArgsConstructor
public class BasicAuthGuardFilter extends OncePerRequestFilter {

    static final String ROLE_CLIENT = "ROLE_CLIENT";

    private final AuthGuard authGuard;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        Optional<BasicCredentials> credentials =
                BasicCredentials.fromAuthorizationHeader(request.getHeader(HttpHeaders.AUTHORIZATION));

        if (credentials.isPresent()
                && SecurityContextHolder.getContext().getAuthentication() == null
                && authGuard.check(credentials.get())) {
            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    credentials.get().username(),
                    null,
                    List.of(new SimpleGrantedAuthority(ROLE_CLIENT))
            );
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        }

        filterChain.doFilter(request, response);
    }
}
