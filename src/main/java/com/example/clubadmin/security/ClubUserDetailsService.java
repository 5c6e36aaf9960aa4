package com.example.clubadmin.security;

import com.example.clubadmin.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Login id (e-mail) → {@link ClubUserDetails}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClubUserDetailsService implements UserDetailsService {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        return userRepository.findByEmailIgnoreCase(username == null ? "" : username.trim())
                .filter(u -> u.getPasswordHash() != null)
                .map(ClubUserDetails::new)
                .orElseThrow(() -> {
                    log.warn("Login failed, no user for {}", username);
                    return new UsernameNotFoundException("User not found: " + username);
                });
    }
}
