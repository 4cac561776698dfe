package com.techStack.geoVault.security.config;

import com.techStack.geoVault.config.security.CorsProperties;
import com.techStack.geoVault.security.authentication.TokenAuthenticationManager;
import com.techStack.geoVault.security.authentication.TokenSecurityContextRepository;
import com.techStack.geoVault.security.authorization.CustomAccessDeniedHandler;
import com.techStack.geoVault.security.filter.CsrfProtectionWebFilter;
import com.techStack.geoVault.security.support.SecurityResponseWriter;
import com.techStack.geoVault.service.token.CsrfTokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsConfigurationSource;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import static com.techStack.geoVault.constants.SecurityConstants.CSRF_HEADER;

@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final TokenSecurityContextRepository securityContextRepository;
    private final TokenAuthenticationManager authenticationManager;
    private final CustomAuthenticationEntryPoint authenticationEntryPoint;
    private final CustomAccessDeniedHandler accessDeniedHandler;
    private final CsrfTokenService csrfTokenService;
    private final SecurityResponseWriter responseWriter;
    private final CorsProperties corsProperties;

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                // cookie sessions are covered by CsrfProtectionWebFilter
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .authenticationManager(authenticationManager)
                .securityContextRepository(securityContextRepository)
                .authorizeExchange(exchange -> exchange
                        .pathMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .pathMatchers(
                                "/api/auth/login",
                                "/api/auth/resend-otp",
                                "/api/auth/verify-otp",
                                "/api/auth/refresh-token",
                                "/api/auth/forgot-password",
                                "/api/auth/reset-password",
                                "/api/time",
                                "/actuator/health"
                        ).permitAll()
                        .pathMatchers("/api/admin/**", "/api/crypto/**").hasRole("ADMIN")
                        .pathMatchers(HttpMethod.POST, "/api/files/upload").hasRole("ADMIN")
                        .pathMatchers(HttpMethod.DELETE, "/api/files/**").hasRole("ADMIN")
                        .pathMatchers("/api/files/stats").hasRole("ADMIN")
                        .pathMatchers("/api/wfh-request/**").hasRole("EMPLOYEE")
                        .anyExchange().authenticated()
                )
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .addFilterAfter(new CsrfProtectionWebFilter(csrfTokenService, responseWriter),
                        SecurityWebFiltersOrder.AUTHORIZATION)
                .build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(corsProperties.getAllowedOrigins());
        configuration.setAllowedMethods(corsProperties.getAllowedMethods());
        configuration.setAllowedHeaders(corsProperties.getAllowedHeaders());
        configuration.addExposedHeader(CSRF_HEADER);
        configuration.addExposedHeader("Retry-After");
        configuration.setAllowCredentials(true);
        configuration.setMaxAge(corsProperties.getMaxAge());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
