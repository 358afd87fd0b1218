package com.example.authservice.service;

import com.example.authservice.exception.AuthenticationFailedException;
import com.example.authservice.exception.ConflictException;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.support.MutableClock;
import com.example.authservice.support.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Concurrent register and refresh calls for the same email or token.
 * Every call starts from a shared gate so the requests overlap in the database.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class RaceConditionTest {

    private static final String PASSWORD = "Password123";

    @Autowired
    private AuthService authService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private MutableClock clock;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
        refreshTokenRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
        executor = Executors.newFixedThreadPool(10);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentRegistrations_sameEmail_exactlyOneWins() throws Exception {
        List<Outcome<AuthResult>> outcomes = runConcurrently(10,
                () -> authService.register("race@example.com", PASSWORD, PASSWORD, null));

        long successes = outcomes.stream().filter(Outcome::succeeded).count();
        long conflicts = outcomes.stream().filter(o -> o.error() instanceof ConflictException).count();

        assertThat(outcomes).hasSize(10);
        assertThat(successes).isEqualTo(1);
        assertThat(conflicts).isEqualTo(9);
        assertThat(userRepository.findAll())
                .filteredOn(u -> u.getEmail().equals("race@example.com"))
                .hasSize(1);
    }

    @Test
    void concurrentRegistrations_emailDiffersOnlyByCase_exactlyOneWins() throws Exception {
        List<String> variants = List.of("Case@Example.com", "case@example.com", "CASE@EXAMPLE.COM",
                "case@EXAMPLE.com", " case@example.com ");
        List<Outcome<AuthResult>> outcomes = new ArrayList<>();
        CountDownLatch gate = new CountDownLatch(1);
        List<Future<Outcome<AuthResult>>> futures = new ArrayList<>();
        for (String email : variants) {
            futures.add(executor.submit(gated(gate, () -> authService.register(email, PASSWORD, PASSWORD, null))));
        }
        gate.countDown();
        for (Future<Outcome<AuthResult>> future : futures) {
            outcomes.add(future.get(30, TimeUnit.SECONDS));
        }

        assertThat(outcomes.stream().filter(Outcome::succeeded).count()).isEqualTo(1);
        assertThat(outcomes.stream().filter(o -> o.error() instanceof ConflictException).count()).isEqualTo(4);
        assertThat(userRepository.findByEmail("case@example.com")).isPresent();
    }

    @Test
    void concurrentRefresh_sameToken_atMostOneWins() throws Exception {
        AuthResult registered = authService.register("refresh-race@example.com", PASSWORD, PASSWORD, null);
        String token = registered.refreshToken();

        List<Outcome<AuthResult>> outcomes = runConcurrently(5, () -> authService.refresh(token));

        List<AuthResult> winners = outcomes.stream().filter(Outcome::succeeded).map(Outcome::value).toList();
        long rejected = outcomes.stream().filter(o -> o.error() instanceof AuthenticationFailedException).count();

        assertThat(outcomes).hasSize(5);
        assertThat(winners.size()).isLessThanOrEqualTo(1);
        assertThat(winners.size() + rejected).isEqualTo(5);

        if (winners.size() == 1) {
            String next = winners.get(0).refreshToken();
            assertThat(authService.refresh(next).refreshToken()).isNotEqualTo(next);
            assertThatThrownBy(() -> authService.refresh(next)).isInstanceOf(AuthenticationFailedException.class);
        }
        assertThatThrownBy(() -> authService.refresh(token)).isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void concurrentRefresh_winnerChainIsRecorded() throws Exception {
        AuthResult registered = authService.register("chain-race@example.com", PASSWORD, PASSWORD, null);

        List<Outcome<AuthResult>> outcomes = runConcurrently(5, () -> authService.refresh(registered.refreshToken()));
        Optional<AuthResult> winner = outcomes.stream().filter(Outcome::succeeded).map(Outcome::value).findFirst();

        var consumed = refreshTokenRepository.findById(registered.sessionId()).orElseThrow();
        assertThat(consumed.isRevoked()).isEqualTo(winner.isPresent());
        winner.ifPresent(w -> assertThat(consumed.getReplacedBy()).isEqualTo(w.sessionId()));
    }

    private <T> List<Outcome<T>> runConcurrently(int calls, Callable<T> action) throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        List<Future<Outcome<T>>> futures = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            futures.add(executor.submit(gated(gate, action)));
        }
        gate.countDown();

        List<Outcome<T>> outcomes = new ArrayList<>();
        for (Future<Outcome<T>> future : futures) {
            outcomes.add(future.get(30, TimeUnit.SECONDS));
        }
        assertThat(outcomes).allSatisfy(o -> assertThat(o.error())
                .as("unexpected failure")
                .satisfiesAnyOf(
                        e -> assertThat(e).isNull(),
                        e -> assertThat(e).isInstanceOfAny(ConflictException.class,
                                AuthenticationFailedException.class)));
        return outcomes;
    }

    private static <T> Callable<Outcome<T>> gated(CountDownLatch gate, Callable<T> action) {
        return () -> {
            gate.await();
            try {
                return new Outcome<>(action.call(), null);
            } catch (RuntimeException e) {
                return new Outcome<>(null, e);
            }
        };
    }

    private record Outcome<T>(T value, RuntimeException error) {
        boolean succeeded() {
            return error == null;
        }
    }
}
