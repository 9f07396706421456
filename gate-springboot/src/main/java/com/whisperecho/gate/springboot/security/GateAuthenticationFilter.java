package com.whisperecho.gate.springboot.security;

import com.whisperecho.gate.server.model.GatePrincipal;
import com.whisperecho.gate.server.model.RequestCredentials;
import com.whisperecho.gate.server.resolver.IdentityResolver;
import com.whisperecho.gate.server.resolver.Resolution;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the request's credentials once and records the outcome.
 * <p>
 * A resolved principal becomes the Spring Security authentication, so controllers can take
 * {@code @AuthenticationPrincipal GatePrincipal}. Every outcome, failures included, is stored as
 * the {@link #RESOLUTION_ATTRIBUTE} request attribute for the authorization interceptor. This
 * filter never rejects a request itself.
 */
public class GateAuthenticationFilter extends OncePerRequestFilter {

  public static final String RESOLUTION_ATTRIBUTE = "com.whisperecho.gate.resolution";

  private final IdentityResolver identityResolver;

  public GateAuthenticationFilter(IdentityResolver identityResolver) {
    this.identityResolver = identityResolver;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    Resolution resolution = identityResolver.resolve(RequestCredentials.fromHeaders(request::getHeader));
    request.setAttribute(RESOLUTION_ATTRIBUTE, resolution);
    resolution.principalIfResolved().ifPresent(principal -> {
      UsernamePasswordAuthenticationToken auth =
          new UsernamePasswordAuthenticationToken(principal, null, authoritiesOf(principal));
      SecurityContextHolder.getContext().setAuthentication(auth);
    });
    filterChain.doFilter(request, response);
  }

  private static List<SimpleGrantedAuthority> authoritiesOf(GatePrincipal principal) {
    return List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
  }
}
