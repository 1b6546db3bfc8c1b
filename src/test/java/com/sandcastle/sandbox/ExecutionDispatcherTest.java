package com.sandcastle.sandbox;

import com.sandcastle.core.model.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionDispatcherTest {

    private final ExecutionDispatcher dispatcher = new ExecutionDispatcher();

    @Test
    void sendsCodeAsExecCommand() {
        var handle = new FakeRuntimeHandle().then(FakeRuntimeHandle.ok("4"));

        DispatchResult result = dispatcher.execute(handle, "print(2 + 2)", Duration.ofSeconds(5));

        assertEquals(ExecutionStatus.SUCCEEDED, result.status());
        assertFalse(result.processLost());
        assertNull(result.failure());
        assertEquals(1, handle.received().size());
        var command = handle.received().get(0);
        assertEquals(RuntimeProtocol.Op.EXEC, command.op());
        assertTrue(command.unit().matches("1-[0-9a-f]{32}"), command.unit());
        assertEquals("print(2 + 2)", command.payload());
    }

    @Test
    void runtimeErrorMeansFailedButAlive() {
        var handle = new FakeRuntimeHandle().then(FakeRuntimeHandle.failed("", "ZeroDivisionError", "division by zero"));

        DispatchResult result = dispatcher.execute(handle, "1/0", Duration.ofSeconds(5));

        assertEquals(ExecutionStatus.FAILED, result.status());
        assertFalse(result.processLost());
        assertFalse(handle.isTerminated());
    }

    @Test
    void missedDeadlineKillsRuntime() {
        var handle = new FakeRuntimeHandle().then(FakeRuntimeHandle.hang("partial"));

        DispatchResult result = dispatcher.execute(handle, "while True: pass", Duration.ofMillis(100));

        assertEquals(ExecutionStatus.TIMED_OUT, result.status());
        assertTrue(result.processLost());
        assertTrue(handle.isTerminated());
        assertTrue(result.failure().contains("100ms"));
        assertEquals("partial", new String(result.capture().stdout()));
        assertTrue(result.durationMs() >= 90, "duration was " + result.durationMs());
    }

    @Test
    void processExitIsReportedAsLost() {
        var handle = new FakeRuntimeHandle().then(FakeRuntimeHandle.exit("Segmentation fault"));

        DispatchResult result = dispatcher.execute(handle, "import os; os._exit(1)", Duration.ofSeconds(5));

        assertEquals(ExecutionStatus.FAILED, result.status());
        assertTrue(result.processLost());
        assertEquals("Runtime process exited unexpectedly", result.failure());
    }

    @Test
    void brokenPipeIsReportedAsLost() {
        var handle = new FakeRuntimeHandle();
        handle.rejectWrites();

        DispatchResult result = dispatcher.execute(handle, "x = 1", Duration.ofSeconds(5));

        assertEquals(ExecutionStatus.FAILED, result.status());
        assertTrue(result.processLost());
        assertTrue(handle.isTerminated());
        assertEquals(0, result.capture().stdout().length);
    }

    @Test
    void invokeUsesRequestedOperation() {
        var handle = new FakeRuntimeHandle();

        dispatcher.invoke(handle, RuntimeProtocol.Op.VARS, "", Duration.ofSeconds(5));
        dispatcher.invoke(handle, RuntimeProtocol.Op.INSTALL, "{\"name\":\"six\"}", Duration.ofSeconds(5));

        assertEquals(RuntimeProtocol.Op.VARS, handle.received().get(0).op());
        assertEquals(RuntimeProtocol.Op.INSTALL, handle.received().get(1).op());
        assertTrue(handle.received().get(1).unit().startsWith("2-"));
        assertNotEquals(handle.received().get(0).unit().substring(2), handle.received().get(1).unit().substring(2));
        assertEquals("{\"name\":\"six\"}", handle.received().get(1).payload());
    }
}
