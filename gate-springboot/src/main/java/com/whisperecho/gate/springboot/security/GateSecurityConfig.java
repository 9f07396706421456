package com.whisperecho.gate.springboot.security;

import com.whisperecho.gate.server.resolver.IdentityResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security only authenticates here. Authorization is per handler, by
 * {@code @RequiresCapability}, in the gate's MVC interceptor.
 */
@Configuration
@EnableWebSecurity
public class GateSecurityConfig {

  @Bean
  public GateAuthenticationFilter gateAuthenticationFilter(IdentityResolver identityResolver) {
    return new GateAuthenticationFilter(identityResolver);
  }

  @Bean
  public SecurityFilterChain gateSecurityFilterChain(HttpSecurity http,
                                                     GateAuthenticationFilter gateFilter) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(gateFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
