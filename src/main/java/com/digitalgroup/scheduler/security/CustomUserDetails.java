package com.digitalgroup.scheduler.security;

import com.digitalgroup.scheduler.domain.task.Requester;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.Collections;

/**
 * Authenticated caller built from the bearer token claims. The scheduler keeps no user table.
 */
@Getter
public class CustomUserDetails implements UserDetails {

    private final Long id;
    private final String username;
    private final String role;
    private final boolean system;
    private final Collection<? extends GrantedAuthority> authorities;

    public CustomUserDetails(Long id, String username, String role, boolean system) {
        this.id = id;
        this.username = username;
        this.role = role;
        this.system = system;
        this.authorities = Collections.singletonList(
                new SimpleGrantedAuthority("ROLE_" + (role != null ? role.toUpperCase() : "USER"))
        );
    }

    public Requester toRequester() {
        return system ? Requester.systemCaller() : Requester.user(id);
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return authorities;
    }

    @Override
    public String getPassword() {
        return null;
    }

    @Override
    public String getUsername() {
        return username;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
