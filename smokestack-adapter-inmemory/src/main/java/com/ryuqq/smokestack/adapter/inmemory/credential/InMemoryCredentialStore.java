package com.ryuqq.smokestack.adapter.inmemory.credential;

import com.ryuqq.smokestack.core.spi.CredentialStore;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CredentialStore}.
 *
 * <p>Tokens are random UUID strings mapped to usernames in a {@link ConcurrentHashMap}.
 * Every call to {@link #issue(String)} produces a new token; earlier tokens of the same user stay valid.
 * Tokens do not expire and are lost on restart.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CredentialStore credentials = new InMemoryCredentialStore();
 * String token = credentials.issue("alice");
 * credentials.resolve(token); // Optional[alice]
 * </pre>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public class InMemoryCredentialStore implements CredentialStore {

    /**
     * token → username.
     */
    private final ConcurrentHashMap<String, String> tokens = new ConcurrentHashMap<>();

    @Override
    public String issue(String username) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username cannot be null or blank");
        }
        String token = UUID.randomUUID().toString();
        tokens.put(token, username);
        return token;
    }

    @Override
    public Optional<String> resolve(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(token));
    }

    /**
     * Number of issued tokens.
     *
     * @return token count
     */
    public int size() {
        return tokens.size();
    }
}
