package com.apidoc.generator.link;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered set of external documentation authorities.
 *
 * Prefixes may nest (UnityEngine.UI. inside UnityEngine.), so lookup tries
 * the longest prefix first; authorities with equally long prefixes keep their
 * configured order.
 */
public class AuthorityTable {

    private final List<ExternalAuthority> authorities;

    public AuthorityTable(List<ExternalAuthority> authorities) {
        List<ExternalAuthority> sorted = new ArrayList<>(authorities);
        sorted.sort(Comparator.comparingInt((ExternalAuthority a) -> a.getPrefix().length()).reversed());
        this.authorities = List.copyOf(sorted);
    }

    public static AuthorityTable empty() {
        return new AuthorityTable(List.of());
    }

    /**
     * The most specific authority whose prefix the UID starts with.
     */
    public Optional<ExternalAuthority> find(String uid) {
        return authorities.stream()
                .filter(a -> a.matches(uid))
                .findFirst();
    }

    public boolean isExternal(String uid) {
        return find(uid).isPresent();
    }

    public List<ExternalAuthority> getAuthorities() {
        return authorities;
    }
}
