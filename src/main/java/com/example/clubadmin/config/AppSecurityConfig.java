package com.example.clubadmin.config;

import com.example.clubadmin.domain.User;
import com.example.clubadmin.domain.UserRole;
import com.example.clubadmin.domain.UserState;
import com.example.clubadmin.repository.UserRepository;
import com.example.clubadmin.security.ClubUserDetailsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.csrf.CookieCsrfTokenRepository;
import org.springframework.security.web.csrf.CsrfTokenRequestAttributeHandler;

@Slf4j
@Configuration
@EnableMethodSecurity
@RequiredArgsConstructor
public class AppSecurityConfig {

    private final ClubUserDetailsService userDetailsService;
    private final ClubProperties properties;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain appSecurity(HttpSecurity http) throws Exception {
        // Thymeleaf forms read the token as "_csrf"
        var handler = new CsrfTokenRequestAttributeHandler();
        handler.setCsrfRequestAttributeName("_csrf");

        http
                .csrf(csrf -> csrf
                        .csrfTokenRequestHandler(handler)
                        .csrfTokenRepository(CookieCsrfTokenRepository.withHttpOnlyFalse()))
                .userDetailsService(userDetailsService)
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/login", "/css/**", "/js/**", "/error", "/actuator/health").permitAll()
                        .requestMatchers("/admin/**").hasRole(UserRole.ADMIN.name())
                        .requestMatchers("/expensereport/**").authenticated()
                        .anyRequest().authenticated())
                .formLogin(form -> form
                        .loginPage("/login")
                        .loginProcessingUrl("/login")
                        .usernameParameter("email")
                        .defaultSuccessUrl("/", false)
                        .permitAll())
                .rememberMe(rem -> rem
                        .key(properties.getSecurity().getRememberMeKey())
                        .tokenValiditySeconds(24 * 60 * 60))
                .logout(logout -> logout
                        .logoutUrl("/logout")
                        .logoutSuccessUrl("/login?logout")
                        .permitAll());

        return http.build();
    }

    @Bean
    public ApplicationRunner adminInitializer(UserRepository users, PasswordEncoder passwordEncoder) {
        return args -> {
            if (users.existsByRole(UserRole.ADMIN)) {
                log.info("Admin account present, skipping bootstrap");
                return;
            }
            ClubProperties.Admin admin = properties.getAdmin();
            log.warn("No admin account found, creating {}", admin.getEmail());
            User user = new User(admin.getEmail(), "club", "admin");
            user.setPasswordHash(passwordEncoder.encode(admin.getInitialPassword()));
            user.setRole(UserRole.ADMIN);
            user.setState(UserState.ACTIVE);
            users.save(user);
        };
    }
}
