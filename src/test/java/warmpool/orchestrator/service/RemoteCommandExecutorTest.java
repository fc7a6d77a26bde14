package warmpool.orchestrator.service;

import org.junit.jupiter.api.*;
import warmpool.orchestrator.error.RemoteCommandFailedException;
import warmpool.orchestrator.error.RemoteCommandTimedOutException;
import warmpool.orchestrator.model.RemoteCommand;
import warmpool.orchestrator.model.RemoteCommandRequest;
import warmpool.orchestrator.model.RemoteCommandStatus;
import warmpool.orchestrator.support.TestPool;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RemoteCommandExecutor: bounded waits and output capture.
 */
class RemoteCommandExecutorTest {

    private TestPool pool;
    private RemoteCommandExecutor executor;

    @BeforeEach
    void setUp() {
        pool = TestPool.withDefaults();
        executor = pool.deps.commands();
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void successReturnsOutput() {
        pool.commands.finishWith(RemoteCommandStatus.SUCCESS, "ok\n", "").pollsBeforeDone(3);

        RemoteCommand command = executor.runRemoteScript("vm-1", RemoteCommandRequest.of(10, "uptime"));

        assertEquals(RemoteCommandStatus.SUCCESS, command.status());
        assertEquals("ok\n", command.stdout());
        assertEquals(List.of("uptime"), pool.commands.lastSubmission().request().argv());
        assertEquals(Duration.ofSeconds(2), pool.time.totalSlept());
    }

    @Test
    @DisplayName("Command not yet visible on the instance is polled again")
    void notFoundMeansNotYet() {
        pool.commands.invisibleFor(2);

        RemoteCommand command = executor.runRemoteScript("vm-1", RemoteCommandRequest.of(10, "uptime"));

        assertEquals(RemoteCommandStatus.SUCCESS, command.status());
    }

    @Test
    @DisplayName("A hanging command times out exactly at its bound")
    void hangingCommandTimesOut() {
        pool.commands.hang();

        RemoteCommandTimedOutException e = assertThrows(RemoteCommandTimedOutException.class,
                () -> executor.runRemoteScript("vm-1", RemoteCommandRequest.of(10, "sleep", "999"),
                        Duration.ofSeconds(15)));

        assertEquals("cmd-1", e.commandId());
        assertEquals(Duration.ofSeconds(15), e.timeout());
        assertEquals(Duration.ofSeconds(15), pool.time.totalSlept());
    }

    @Test
    void failureCarriesOutput() {
        pool.commands.finishWith(RemoteCommandStatus.FAILED, "partial", "line 1\nimage not found");

        RemoteCommandFailedException e = assertThrows(RemoteCommandFailedException.class,
                () -> executor.runRemoteScript("vm-1", RemoteCommandRequest.of(10, "restart")));

        assertEquals("partial", e.stdout());
        assertTrue(e.getMessage().endsWith("image not found"));
    }

    @Test
    void agentReportedTimeout() {
        pool.commands.finishWith(RemoteCommandStatus.TIMEOUT, "", "");

        assertThrows(RemoteCommandTimedOutException.class,
                () -> executor.runRemoteScript("vm-1", RemoteCommandRequest.of(10, "restart")));
    }

    @Test
    void submitFailure() {
        pool.commands.failSubmit(new IllegalStateException("connection refused"));

        RemoteCommandFailedException e = assertThrows(RemoteCommandFailedException.class,
                () -> executor.runRemoteScript("vm-1", RemoteCommandRequest.of(10, "uptime")));

        assertEquals("<unsent>", e.commandId());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("Log tail is clamped to 10..500 lines")
    void fetchLogsClampsTail() {
        pool.commands.finishWith(RemoteCommandStatus.SUCCESS, "log line", "");

        assertEquals("log line", executor.fetchLogs("vm-1", 3));
        assertEquals(List.of("docker", "logs", "workload", "--tail", "10"),
                pool.commands.lastSubmission().request().argv());

        executor.fetchLogs("vm-1", 100_000);
        assertEquals("500", pool.commands.lastSubmission().request().argv().get(4));
    }

    @Test
    void fetchLogsFallsBackOnFailure() {
        pool.commands.finishWith(RemoteCommandStatus.FAILED, "", "No such container: workload");
        assertEquals("No such container: workload", executor.fetchLogs("vm-1", 50));

        pool.commands.finishWith(RemoteCommandStatus.FAILED, "", "");
        assertEquals("Command failed", executor.fetchLogs("vm-1", 50));
    }
}
