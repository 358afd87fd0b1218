package com.example.authservice.store;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.User;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.TokenHasher;
import com.example.authservice.support.MutableClock;
import com.example.authservice.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Store operations against the Flyway schema, one rolled-back transaction per test.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import({JpaCredentialStore.class, TokenHasher.class, TestClockConfig.class})
class JpaCredentialStoreTest {

    @Autowired
    private JpaCredentialStore store;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private TokenHasher tokenHasher;

    @Autowired
    private MutableClock clock;

    private Instant now;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
        now = clock.instant();
    }

    @Test
    void createIdentity_sameEmailTwice_throwsDuplicateEmail() {
        store.createIdentity(new NewIdentity("dup@example.com", "hash-1", null, User.PROVIDER_EMAIL));

        assertThatThrownBy(() ->
                store.createIdentity(new NewIdentity("dup@example.com", "hash-2", null, User.PROVIDER_EMAIL)))
                .isInstanceOf(DuplicateEmailException.class);
    }

    @Test
    void createIdentity_setsTimestampsFromClock() {
        User user = store.createIdentity(new NewIdentity("clock@example.com", "hash", "Clock", User.PROVIDER_EMAIL));

        assertThat(user.getId()).isNotNull();
        assertThat(user.getCreatedAt()).isEqualTo(now);
        assertThat(user.getUpdatedAt()).isEqualTo(now);
        assertThat(store.findIdentityByEmail("clock@example.com")).map(User::getId).contains(user.getId());
    }

    @Test
    void createRefreshToken_storesOnlyDigest() {
        User user = newUser("digest@example.com");

        RefreshToken record = store.createRefreshToken(user.getId(), "raw-token-value", now, now.plus(Duration.ofDays(7)));

        RefreshToken stored = refreshTokenRepository.findById(record.getId()).orElseThrow();
        assertThat(stored.getTokenHash())
                .isEqualTo(tokenHasher.sha256Hex("raw-token-value"))
                .isNotEqualTo("raw-token-value")
                .hasSize(64);
    }

    @Test
    void createRefreshToken_unknownIdentity_throwsNotFound() {
        assertThatThrownBy(() -> store.createRefreshToken(UUID.randomUUID(), "value", now, now.plusSeconds(60)))
                .isInstanceOf(IdentityNotFoundException.class);
    }

    @Test
    void consumeRefreshToken_succeedsExactlyOnce() {
        User user = newUser("consume@example.com");
        store.createRefreshToken(user.getId(), "single-use", now, now.plus(Duration.ofDays(7)));

        Optional<RefreshToken> first = store.consumeRefreshToken("single-use", now);
        Optional<RefreshToken> second = store.consumeRefreshToken("single-use", now);

        assertThat(first).isPresent();
        assertThat(first.get().isRevoked()).isTrue();
        assertThat(first.get().getRevokedAt()).isEqualTo(now);
        assertThat(first.get().getUser().getId()).isEqualTo(user.getId());
        assertThat(second).isEmpty();
    }

    @Test
    void consumeRefreshToken_expiredOrUnknown_isEmpty() {
        User user = newUser("expired@example.com");
        Instant expiresAt = now.plus(Duration.ofHours(1));
        store.createRefreshToken(user.getId(), "short-lived", now, expiresAt);

        assertThat(store.consumeRefreshToken("short-lived", expiresAt)).isEmpty();
        assertThat(store.consumeRefreshToken("never-issued", now)).isEmpty();
    }

    @Test
    void linkReplacement_recordsChild() {
        User user = newUser("chain@example.com");
        RefreshToken parent = store.createRefreshToken(user.getId(), "parent", now, now.plus(Duration.ofDays(7)));
        store.consumeRefreshToken("parent", now);
        RefreshToken child = store.createRefreshToken(user.getId(), "child", now, now.plus(Duration.ofDays(7)));

        store.linkReplacement(parent.getId(), child.getId());

        assertThat(refreshTokenRepository.findById(parent.getId()).orElseThrow().getReplacedBy())
                .isEqualTo(child.getId());
    }

    @Test
    void revokeSession_onlyForOwner_andIdempotent() {
        User owner = newUser("owner@example.com");
        User stranger = newUser("stranger@example.com");
        RefreshToken record = store.createRefreshToken(owner.getId(), "owned", now, now.plus(Duration.ofDays(7)));

        assertThat(store.revokeSession(record.getId(), stranger.getId(), now)).isFalse();
        assertThat(store.revokeSession(record.getId(), owner.getId(), now)).isTrue();
        assertThat(store.revokeSession(record.getId(), owner.getId(), now)).isFalse();
        assertThat(store.consumeRefreshToken("owned", now)).isEmpty();
    }

    @Test
    void revokeRefreshToken_byValue_onlyForOwner() {
        User owner = newUser("value-owner@example.com");
        User stranger = newUser("value-stranger@example.com");
        store.createRefreshToken(owner.getId(), "by-value", now, now.plus(Duration.ofDays(7)));

        assertThat(store.revokeRefreshToken("by-value", stranger.getId(), now)).isFalse();
        assertThat(store.revokeRefreshToken("by-value", owner.getId(), now)).isTrue();
        assertThat(store.consumeRefreshToken("by-value", now)).isEmpty();
    }

    @Test
    void revokeAllForIdentity_countsOnlyActiveTokens() {
        User user = newUser("all@example.com");
        User other = newUser("other@example.com");
        store.createRefreshToken(user.getId(), "a", now, now.plus(Duration.ofDays(7)));
        store.createRefreshToken(user.getId(), "b", now, now.plus(Duration.ofDays(7)));
        store.createRefreshToken(user.getId(), "c", now, now.plus(Duration.ofDays(7)));
        store.createRefreshToken(other.getId(), "d", now, now.plus(Duration.ofDays(7)));
        store.consumeRefreshToken("c", now);

        assertThat(store.revokeAllForIdentity(user.getId(), now)).isEqualTo(2);
        assertThat(store.consumeRefreshToken("a", now)).isEmpty();
        assertThat(store.consumeRefreshToken("d", now)).isPresent();
    }

    @Test
    void updateIdentity_appliesMutationAndBumpsUpdatedAt() {
        User user = newUser("update@example.com");
        clock.advance(Duration.ofMinutes(5));

        User updated = store.updateIdentity(user.getId(), u -> u.setDisplayName("Updated"));

        assertThat(updated.getDisplayName()).isEqualTo("Updated");
        assertThat(updated.getUpdatedAt()).isEqualTo(now.plus(Duration.ofMinutes(5)));
        assertThat(updated.getCreatedAt()).isEqualTo(now);
    }

    @Test
    void updateIdentity_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> store.updateIdentity(UUID.randomUUID(), u -> u.setDisplayName("x")))
                .isInstanceOf(IdentityNotFoundException.class);
    }

    @Test
    void touchLastLogin_setsInstant() {
        User user = newUser("touch@example.com");
        Instant loginAt = now.plus(Duration.ofHours(2));

        User touched = store.touchLastLogin(user.getId(), loginAt);

        assertThat(touched.getLastLoginAt()).isEqualTo(loginAt);
        assertThat(userRepository.findById(user.getId()).orElseThrow().getLastLoginAt()).isEqualTo(loginAt);
    }

    private User newUser(String email) {
        return store.createIdentity(new NewIdentity(email, "hash", null, User.PROVIDER_EMAIL));
    }
}
