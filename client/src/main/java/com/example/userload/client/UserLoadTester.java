package com.example.userload.client;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.example.userload.grpc.LoginRequest;
import com.example.userload.grpc.LoginResponse;
import com.example.userload.grpc.RegisterRequest;
import com.example.userload.grpc.RegisterResponse;
import com.example.userload.grpc.UserServiceGrpc;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives Register and Login calls against the user service and keeps score of what it answered.
 * Failures are never retried; every attempt ends up in exactly one counter.
 */
public class UserLoadTester implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UserLoadTester.class);

    static final String REGISTER_EXPECTED_LIMIT = "3 per hour";
    static final String LOGIN_EXPECTED_LIMIT = "5 per 15 minutes";
    static final String LOGIN_PROBE_LABEL = "999999";
    static final String REGISTER_PROBE_PREFIX = "ratelimit_test_";

    private static final String RULE = "=".repeat(60);
    private static final long SHUTDOWN_SECONDS = 10;

    private final LoadTestConfig config;
    private final ManagedChannel channel;
    private final UserServiceGrpc.UserServiceBlockingStub stub;
    private final PrintStream out;
    private final CredentialGenerator credentials;
    private final LoadTestStats stats = new LoadTestStats();
    private final List<CreatedUser> createdUsers = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong failures = new AtomicLong();

    public UserLoadTester(LoadTestConfig config, ManagedChannel channel, PrintStream out) {
        this(config, channel, out, new CredentialGenerator());
    }

    UserLoadTester(LoadTestConfig config, ManagedChannel channel, PrintStream out, CredentialGenerator credentials) {
        this.config = config;
        this.channel = channel;
        this.stub = UserServiceGrpc.newBlockingStub(channel);
        this.out = out;
        this.credentials = credentials;
    }

    public static UserLoadTester connect(LoadTestConfig config, PrintStream out) {
        ManagedChannel channel = ManagedChannelBuilder.forTarget(config.getTarget())
                .usePlaintext()
                .build();
        out.printf("Connected to gRPC server at %s%n", config.getTarget());
        return new UserLoadTester(config, channel, out);
    }

    public RegistrationResult registerUser(int index) {
        return registerUser(String.valueOf(index));
    }

    public RegistrationResult registerUser(String label) {
        String email = credentials.email(label);
        String password = credentials.password();
        String username = credentials.username(label);
        RegisterRequest request = RegisterRequest.newBuilder()
                .setEmail(email)
                .setPassword(password)
                .setUsername(username)
                .build();

        long start = System.nanoTime();
        try {
            RegisterResponse response = stub
                    .withDeadlineAfter(config.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .register(request);
            String userId = response.hasUser() ? response.getUser().getId() : "";
            if (userId.isEmpty()) {
                stats.record(Operation.REGISTER, CallOutcome.FAILED, System.nanoTime() - start);
                log.warn("Register for {} returned no user id", email);
                return RegistrationResult.failure(CallOutcome.FAILED, "register response carried no user id");
            }
            CreatedUser user = new CreatedUser(email, password, username, userId);
            createdUsers.add(user);
            stats.record(Operation.REGISTER, CallOutcome.SUCCESS, System.nanoTime() - start);
            return RegistrationResult.success(user);
        } catch (RuntimeException e) {
            CallOutcome outcome = recordFailure(Operation.REGISTER, "Register failed", start, e);
            return RegistrationResult.failure(outcome, GrpcFailures.describe(e));
        }
    }

    public LoginResult loginUser(String email, String password) {
        LoginRequest request = LoginRequest.newBuilder()
                .setEmail(email)
                .setPassword(password)
                .build();

        long start = System.nanoTime();
        try {
            LoginResponse response = stub
                    .withDeadlineAfter(config.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .login(request);
            stats.record(Operation.LOGIN, CallOutcome.SUCCESS, System.nanoTime() - start);
            return LoginResult.success(response.getAccessToken());
        } catch (RuntimeException e) {
            CallOutcome outcome = recordFailure(Operation.LOGIN, "Login failed", start, e);
            return LoginResult.failure(outcome, GrpcFailures.describe(e));
        }
    }

    private CallOutcome recordFailure(Operation operation, String prefix, long start, RuntimeException e) {
        CallOutcome outcome = CallOutcome.classify(e);
        stats.record(operation, outcome, System.nanoTime() - start);
        if (outcome == CallOutcome.RATE_LIMITED) {
            log.debug("{} call rate limited: {}", operation.label(), GrpcFailures.describe(e));
        } else {
            long failureNumber = failures.incrementAndGet();
            if (failureNumber <= config.getErrorLogCap()) {
                GrpcFailures.logFailure(log, prefix, failureNumber, config.getErrorLogCap(), config.getTarget(), e);
            }
        }
        return outcome;
    }

    /**
     * Registers {@code numUsers} users from a fixed pool of {@code workers} threads. At most
     * {@code batchSize} registrations are outstanding at once (never fewer than {@code workers});
     * completions are consumed in the order they finish.
     */
    public void createUsersBatch(int batchSize, int workers) throws InterruptedException {
        int numUsers = config.getNumUsers();
        int progressInterval = config.getProgressInterval();
        int window = Math.max(batchSize, workers);

        out.println();
        out.println(RULE);
        out.printf("Creating %d users...%n", numUsers);
        out.printf("Batch size: %d, Workers: %d%n", batchSize, workers);
        out.println(RULE);
        out.println();

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads());
        CompletionService<RegistrationResult> completions = new ExecutorCompletionService<>(executor);
        long start = System.nanoTime();
        int outstanding = 0;
        int completed = 0;
        try {
            for (int i = 0; i < numUsers; i++) {
                if (outstanding >= window) {
                    collect(completions.take());
                    outstanding--;
                    completed++;
                    reportCompleted(completed, numUsers, progressInterval, start);
                }
                int index = i;
                completions.submit(() -> registerUser(index));
                outstanding++;

                if ((i + 1) % progressInterval == 0) {
                    out.printf("Submitted %d/%d registration requests...%n", i + 1, numUsers);
                }
            }
            while (outstanding > 0) {
                collect(completions.take());
                outstanding--;
                completed++;
                reportCompleted(completed, numUsers, progressInterval, start);
            }
        } finally {
            stats.recordBulkRun(completed, System.nanoTime() - start);
            shutdown(executor);
        }

        out.println();
        out.println(RULE);
        out.println("User Creation Complete!");
        out.println(RULE);
        out.printf(Locale.US, "Total time: %.2fs%n", stats.bulkSeconds());
        out.printf(Locale.US, "Average rate: %.1f req/s%n", stats.bulkThroughput());
        out.printf("Successful: %d%n", stats.count(Operation.REGISTER, CallOutcome.SUCCESS));
        out.printf("Failed: %d%n", stats.count(Operation.REGISTER, CallOutcome.FAILED));
        out.printf("Rate Limited: %d%n", stats.count(Operation.REGISTER, CallOutcome.RATE_LIMITED));
        out.println(RULE);
        out.println();
    }

    private void collect(Future<RegistrationResult> future) throws InterruptedException {
        try {
            future.get();
        } catch (ExecutionException e) {
            // registerUser records its own outcome unless the task died before reaching it
            stats.recordWithoutLatency(Operation.REGISTER, CallOutcome.FAILED);
            log.error("Registration task failed", e.getCause());
        }
    }

    private void reportCompleted(int completed, int total, int progressInterval, long start) {
        if (completed % progressInterval != 0) {
            return;
        }
        double elapsed = (System.nanoTime() - start) / 1_000_000_000.0;
        double rate = elapsed > 0 ? completed / elapsed : 0.0;
        out.printf(Locale.US, "Completed %d/%d registrations (%.1f req/s, %.1fs elapsed)%n",
                completed, total, rate, elapsed);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "register-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Registration workers still busy after {}s, interrupting", SHUTDOWN_SECONDS);
            executor.shutdownNow();
        }
    }

    public RateLimitProbeReport testRateLimitingRegister(int attempts) throws InterruptedException {
        out.println();
        out.println(RULE);
        out.println("Testing Registration Rate Limiting");
        out.printf("Attempting %d rapid registrations from same IP...%n", attempts);
        out.printf("Expected limit: %s%n", REGISTER_EXPECTED_LIMIT);
        out.println(RULE);
        out.println();

        RateLimitProbeReport report = RateLimitProbeReport.start(Operation.REGISTER, REGISTER_EXPECTED_LIMIT);
        for (int i = 0; i < attempts; i++) {
            RegistrationResult result = registerUser(REGISTER_PROBE_PREFIX + i);
            report.record(result.getOutcome());
            printAttempt(i + 1, result.getOutcome(), result.getError(), "3");
            pause(config.getProbeDelay().toMillis());
        }

        printProbeResults(report, "First 3 succeed, rest rate limited");
        return report;
    }

    public RateLimitProbeReport testRateLimitingLogin(int attempts) throws InterruptedException {
        out.println();
        out.println(RULE);
        out.println("Testing Login Rate Limiting");
        out.printf("Attempting %d rapid logins...%n", attempts);
        out.printf("Expected limit: %s%n", LOGIN_EXPECTED_LIMIT);
        out.println(RULE);
        out.println();

        CreatedUser testUser = firstCreatedUser();
        if (testUser == null) {
            out.println("Creating test user for login rate limit test...");
            RegistrationResult result = registerUser(LOGIN_PROBE_LABEL);
            if (!result.isSuccess()) {
                out.println("Failed to create test user. Skipping login rate limit test.");
                return RateLimitProbeReport.skipped(Operation.LOGIN, LOGIN_EXPECTED_LIMIT);
            }
            testUser = result.getUser().orElseThrow();
        }

        RateLimitProbeReport report = RateLimitProbeReport.start(Operation.LOGIN, LOGIN_EXPECTED_LIMIT);
        for (int i = 0; i < attempts; i++) {
            LoginResult result = loginUser(testUser.getEmail(), testUser.getPassword());
            report.record(result.getOutcome());
            printAttempt(i + 1, result.getOutcome(), result.getError(), "5");
            pause(config.getProbeDelay().toMillis());
        }

        printProbeResults(report, "First 5 succeed, rest rate limited");
        return report;
    }

    private void printAttempt(int attempt, CallOutcome outcome, String error, String allowed) {
        switch (outcome) {
            case RATE_LIMITED -> out.printf("  [%d] Rate limited (as expected after %s attempts)%n", attempt, allowed);
            case SUCCESS -> out.printf("  [%d] Success%n", attempt);
            case FAILED -> out.printf("  [%d] Failed: %s%n", attempt, error == null ? "Unknown error" : error);
        }
    }

    private void printProbeResults(RateLimitProbeReport report, String expectedBehavior) {
        out.println();
        out.println("Rate Limiting Test Results:");
        out.printf("  Successful: %d%n", report.getSuccesses());
        out.printf("  Rate Limited: %d%n", report.getRateLimited());
        out.printf("  Failed: %d%n", report.getFailed());
        out.printf("  Expected behavior: %s%n", expectedBehavior);
        if (report.limitObserved()) {
            out.println("  Rate limiting is WORKING");
        } else {
            out.println("  Rate limiting may not be working properly");
        }
        out.println(RULE);
        out.println();
    }

    private static void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    public void printSummary() {
        out.println();
        out.println(RULE);
        out.println("LOAD TEST SUMMARY");
        out.println(RULE);
        out.printf("Target Users: %d%n", config.getNumUsers());
        out.printf(Locale.US, "Total Time: %.2fs%n", stats.bulkSeconds());
        for (Operation operation : Operation.values()) {
            String name = operation == Operation.REGISTER ? "Registration" : "Login";
            LatencySnapshot latency = stats.latency(operation);
            out.println();
            out.printf("%s Stats:%n", name);
            out.printf("  Success: %d%n", stats.count(operation, CallOutcome.SUCCESS));
            out.printf("  Failed: %d%n", stats.count(operation, CallOutcome.FAILED));
            out.printf("  Rate Limited: %d%n", stats.count(operation, CallOutcome.RATE_LIMITED));
            if (latency.getCount() > 0) {
                out.printf(Locale.US, "  Latency: avg=%.3fms p95=%.3fms p99=%.3fms%n",
                        latency.getAvgMillis(), latency.getP95Millis(), latency.getP99Millis());
            }
        }
        out.println();
        out.println("Performance:");
        if (stats.bulkSeconds() > 0) {
            out.printf(Locale.US, "  Average throughput: %.1f req/s%n", stats.bulkThroughput());
        }
        out.println(RULE);
        out.println();
    }

    private CreatedUser firstCreatedUser() {
        synchronized (createdUsers) {
            return createdUsers.isEmpty() ? null : createdUsers.get(0);
        }
    }

    public List<CreatedUser> getCreatedUsers() {
        synchronized (createdUsers) {
            return List.copyOf(createdUsers);
        }
    }

    public LoadTestStats getStats() {
        return stats;
    }

    public void disconnect() {
        if (channel.isShutdown()) {
            return;
        }
        channel.shutdown();
        try {
            if (!channel.awaitTermination(SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
        out.println("Disconnected from gRPC server");
    }

    @Override
    public void close() {
        disconnect();
    }
}
