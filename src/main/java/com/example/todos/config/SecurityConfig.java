package com.example.todos.config;

import com.example.todos.security.RequestAuthorizer;
import com.example.todos.security.filter.TokenAuthenticationFilter;
import com.example.todos.web.rest.errors.DelegatedAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.web.servlet.HandlerExceptionResolver;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

/**
 * Stateless bearer-token security.
 * <p>
 * PUBLIC CHAIN (@Order(1)): signup, login, health probes, API docs and the error page.
 * PROTECTED CHAIN (@Order(2)): everything else; TokenAuthenticationFilter resolves the bearer
 * token to a principal or renders the failure through the MVC exception resolver.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(SIGNUP,
                         AUTH_BASE + "/**",
                         HEALTH_BASE,
                         HEALTH_BASE + "/**",
                         "/v3/api-docs/**",
                         "/error")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(
      HttpSecurity http,
      RequestAuthorizer requestAuthorizer,
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver handlerExceptionResolver)
      throws Exception {
    // Registered only in this chain
    TokenAuthenticationFilter tokenAuthenticationFilter =
        new TokenAuthenticationFilter(requestAuthorizer, handlerExceptionResolver);

    http
        .addFilterBefore(tokenAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Bearer tokens only, no cookies to forge
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable)
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.NO_REFERRER)
                                    )
                     .addHeaderWriter((request, response) -> {
                       // Responses carry per-user data
                       response.setHeader("Cache-Control", "no-store");
                       response.setHeader("Pragma", "no-cache");
                     })
                );
  }
}
