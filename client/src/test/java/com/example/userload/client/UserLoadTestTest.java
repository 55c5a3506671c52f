package com.example.userload.client;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UserLoadTestTest {

    private final FakeUserService service = new FakeUserService();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);

    private Server server;
    private ManagedChannel channel;

    @BeforeEach
    void startServer() throws IOException {
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(service)
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).build();
    }

    @AfterEach
    void stopServer() throws InterruptedException {
        channel.shutdownNow();
        server.shutdownNow();
        channel.awaitTermination(5, TimeUnit.SECONDS);
        server.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static LoadTestConfig.Builder quickRun() {
        return LoadTestConfig.builder()
                .numUsers(30)
                .batchSize(5)
                .workers(3)
                .probeAttempts(4)
                .probeDelay(Duration.ZERO)
                .phasePause(Duration.ZERO);
    }

    private static BufferedReader answer(String text) {
        return new BufferedReader(new StringReader(text));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static int occurrences(String text, String line) {
        return text.split(Pattern.quote(line), -1).length - 1;
    }

    private void assertFinishedOnce() {
        String printed = printed();
        assertThat(occurrences(printed, "LOAD TEST SUMMARY")).isEqualTo(1);
        assertThat(occurrences(printed, "Disconnected from gRPC server")).isEqualTo(1);
        assertThat(occurrences(printed, "End time: ")).isEqualTo(1);
        assertThat(printed.indexOf("LOAD TEST SUMMARY")).isLessThan(printed.indexOf("End time: "));
        assertThat(channel.isShutdown()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"yes", "y", "YES", " Y "})
    void acceptsYes(String answer) {
        assertThat(UserLoadTest.isYes(answer)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"no", "n", "", "yep", "sure"})
    void anythingElseIsNo(String answer) {
        assertThat(UserLoadTest.isYes(answer)).isFalse();
    }

    @Test
    void endOfInputIsNo() throws IOException {
        assertThat(UserLoadTest.confirmBulk(quickRun().build(), answer(""), out)).isFalse();
    }

    @Test
    void assumeYesSkipsThePrompt() throws IOException {
        assertThat(UserLoadTest.confirmBulk(quickRun().assumeYes(true).build(), answer("no\n"), out)).isTrue();
        assertThat(printed()).doesNotContain("Proceed with creating");
    }

    @Test
    void declinedRunOnlyChecksLimits() throws Exception {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);

        UserLoadTest.runPhases(tester, config, answer("no\n"), out);

        assertThat(service.registerCalls()).isEqualTo(4);
        assertThat(service.loginCalls()).isEqualTo(4);
        assertThat(printed())
                .contains("Phase 1: Rate Limiting Verification")
                .contains("Proceed with creating 30 users? (yes/no): ")
                .contains("Skipping bulk user creation.");
    }

    @Test
    void confirmedRunCreatesUsers() throws Exception {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);

        UserLoadTest.runPhases(tester, config, answer("yes\n"), out);

        LoadTestStats stats = tester.getStats();
        assertThat(stats.count(Operation.REGISTER, CallOutcome.SUCCESS)).isEqualTo(34);
        assertThat(stats.bulkCompleted()).isEqualTo(30);
        assertThat(tester.getCreatedUsers()).hasSize(34);
        assertThat(printed()).contains("User Creation Complete!");
    }

    @Test
    void completedRunPrintsSummaryThenDisconnects() {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);

        UserLoadTest.run(tester, config, answer("no\n"), out, new UserLoadTest.RunCompletion(tester, out));

        assertFinishedOnce();
        assertThat(printed()).doesNotContain("Test interrupted");
    }

    @Test
    void unreadableConsoleStillEndsTheRun() {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);
        BufferedReader broken = new BufferedReader(new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("console closed");
            }

            @Override
            public void close() {
            }
        });

        UserLoadTest.run(tester, config, broken, out, new UserLoadTest.RunCompletion(tester, out));

        assertFinishedOnce();
        assertThat(printed()).doesNotContain("User Creation Complete!");
        assertThat(service.loginCalls()).isEqualTo(4);
    }

    @Test
    void unexpectedFailureStillEndsTheRun() {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);
        BufferedReader failing = new BufferedReader(new StringReader("yes\n")) {
            @Override
            public String readLine() {
                throw new IllegalStateException("terminal detached");
            }
        };

        UserLoadTest.run(tester, config, failing, out, new UserLoadTest.RunCompletion(tester, out));

        assertFinishedOnce();
        assertThat(tester.getStats().bulkCompleted()).isZero();
    }

    @Test
    void interruptedRunEndsOnceAndKeepsTheInterruptFlag() {
        LoadTestConfig config = quickRun().phasePause(Duration.ofMillis(50)).build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);

        boolean flagRestored;
        Thread.currentThread().interrupt();
        try {
            UserLoadTest.run(tester, config, answer("yes\n"), out, new UserLoadTest.RunCompletion(tester, out));
        } finally {
            flagRestored = Thread.interrupted();
        }

        assertThat(flagRestored).isTrue();
        assertFinishedOnce();
        assertThat(printed()).contains("Test interrupted");
        assertThat(service.loginCalls()).isZero();
    }

    @Test
    void interruptHookPrintsEverythingOnce() {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);
        UserLoadTest.RunCompletion completion = new UserLoadTest.RunCompletion(tester, out);

        completion.interruptedByUser();
        completion.interruptedByUser();
        completion.summaryOnce();
        completion.finishOnce();

        assertFinishedOnce();
        assertThat(occurrences(printed(), "Test interrupted by user")).isEqualTo(1);
    }

    @Test
    void interruptHookIsQuietAfterTheRunFinished() {
        LoadTestConfig config = quickRun().build();
        UserLoadTester tester = new UserLoadTester(config, channel, out);
        UserLoadTest.RunCompletion completion = new UserLoadTest.RunCompletion(tester, out);

        UserLoadTest.run(tester, config, answer("no\n"), out, completion);
        completion.interruptedByUser();

        assertFinishedOnce();
        assertThat(printed()).doesNotContain("Test interrupted by user");
    }
}
