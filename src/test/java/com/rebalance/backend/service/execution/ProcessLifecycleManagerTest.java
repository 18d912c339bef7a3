package com.rebalance.backend.service.execution;

import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.exception.TradingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProcessLifecycleManagerTest {

    @Mock
    private ProcessControl processControl;

    @Mock
    private TaskPoller taskPoller;

    private ExecutionProperties properties;
    private ProcessLifecycleManager manager;

    @BeforeEach
    void setUp() {
        properties = new ExecutionProperties();
        properties.setLauncherCommand(List.of("launcher", "--config", "{config}", "--run", "{runId}"));
        properties.setTerminateGraceSeconds(5);
        manager = new ProcessLifecycleManager(processControl, taskPoller, properties, Clock.systemUTC());
    }

    @Test
    void launchSubstitutesConfigAndRunId() throws IOException {
        Path config = Path.of("/tmp/artifacts/trade_run_12.json");
        Path outputDir = Path.of("/tmp/artifacts/run_12");
        when(processControl.launch(any(), eq(outputDir), eq(outputDir.resolve("log.txt")))).thenReturn(4321L);

        ProcessLifecycleManager.LaunchedProcess launched = manager.launch(12L, config, outputDir);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(processControl).launch(command.capture(), eq(outputDir), any());
        assertThat(command.getValue()).containsExactly("launcher", "--config", config.toAbsolutePath().toString(),
                "--run", "12");
        assertThat(launched.pid()).isEqualTo(4321L);
    }

    @Test
    void launchWithoutTemplateFails() {
        properties.setLauncherCommand(List.of());

        assertThatThrownBy(() -> manager.launch(1L, Path.of("c.json"), Path.of("out")))
                .isInstanceOf(TradingException.class)
                .hasMessage("launcher_not_configured");
    }

    @Test
    void launchIoFailureIsWrapped() throws IOException {
        when(processControl.launch(any(), any(), any())).thenThrow(new IOException("no such file"));

        assertThatThrownBy(() -> manager.launch(1L, Path.of("c.json"), Path.of("out")))
                .isInstanceOf(TradingException.class)
                .hasMessage("launch_failed:no such file");
    }

    @Test
    void deadProcessIsNotSignalled() {
        when(processControl.isAlive(99L)).thenReturn(false);

        assertThat(manager.terminateIfRunning(1L, 99L, null)).isEqualTo(ProcessLifecycleManager.OUTCOME_NOT_RUNNING);
        assertThat(manager.terminateIfRunning(1L, null, null)).isEqualTo(ProcessLifecycleManager.OUTCOME_NOT_RUNNING);
        verify(processControl, never()).requestTerminate(99L);
    }

    @Test
    void leaderProcessIsProtected() {
        when(processControl.isAlive(50L)).thenReturn(true);

        assertThat(manager.terminateIfRunning(1L, 50L, 50L)).isEqualTo(ProcessLifecycleManager.OUTCOME_LEADER_PROTECTED);
        verify(processControl, never()).requestTerminate(50L);
        verifyNoInteractions(taskPoller);
    }

    @Test
    void processExitingOnRequestIsTerminated() {
        when(processControl.isAlive(77L)).thenReturn(true, false);

        assertThat(manager.terminateIfRunning(1L, 77L, 50L)).isEqualTo(ProcessLifecycleManager.OUTCOME_TERMINATED);
        verify(processControl).requestTerminate(77L);
        verifyNoInteractions(taskPoller);
    }

    @Test
    void stubbornProcessIsKilledAfterGrace() {
        when(processControl.isAlive(77L)).thenReturn(true);
        CancellableTask task = new CancellableTask("terminate-77");
        ArgumentCaptor<Runnable> onTimeout = ArgumentCaptor.forClass(Runnable.class);
        when(taskPoller.pollUntil(anyString(), any(BooleanSupplier.class), eq(Duration.ofSeconds(5)), any(Duration.class),
                onTimeout.capture())).thenReturn(task);

        assertThat(manager.terminateIfRunning(1L, 77L, 50L)).isEqualTo(ProcessLifecycleManager.OUTCOME_KILL_REQUESTED);
        // A second request while the escalation is pending does not signal again
        assertThat(manager.terminateIfRunning(1L, 77L, 50L)).isEqualTo(ProcessLifecycleManager.OUTCOME_KILL_REQUESTED);
        verify(processControl).requestTerminate(77L);

        onTimeout.getValue().run();
        verify(processControl).forceKill(77L);
    }

    @Test
    void escalationIsForgottenOnceProcessExits() {
        when(processControl.isAlive(77L)).thenReturn(true);
        CancellableTask task = new CancellableTask("terminate-77");
        ArgumentCaptor<BooleanSupplier> done = ArgumentCaptor.forClass(BooleanSupplier.class);
        when(taskPoller.pollUntil(anyString(), done.capture(), any(Duration.class), any(Duration.class), any(Runnable.class)))
                .thenReturn(task);

        manager.terminateIfRunning(1L, 77L, 50L);
        assertThat(manager.pendingEscalations()).isEqualTo(1);

        when(processControl.isAlive(77L)).thenReturn(false);
        assertThat(done.getValue().getAsBoolean()).isTrue();

        assertThat(manager.pendingEscalations()).isZero();
    }

    @Test
    void escalationIsForgottenAfterForcedKill() {
        when(processControl.isAlive(78L)).thenReturn(true);
        ArgumentCaptor<Runnable> onTimeout = ArgumentCaptor.forClass(Runnable.class);
        when(taskPoller.pollUntil(anyString(), any(BooleanSupplier.class), any(Duration.class), any(Duration.class),
                onTimeout.capture())).thenReturn(new CancellableTask("terminate-78"));

        manager.terminateIfRunning(2L, 78L, 50L);
        onTimeout.getValue().run();

        assertThat(manager.pendingEscalations()).isZero();
        verify(processControl).forceKill(78L);
    }

    @Test
    void notRunningCheckDropsStaleEscalation() {
        when(processControl.isAlive(79L)).thenReturn(true);
        when(taskPoller.pollUntil(anyString(), any(BooleanSupplier.class), any(Duration.class), any(Duration.class),
                any(Runnable.class))).thenReturn(new CancellableTask("terminate-79"));
        manager.terminateIfRunning(3L, 79L, 50L);

        when(processControl.isAlive(79L)).thenReturn(false);

        assertThat(manager.terminateIfRunning(3L, 79L, 50L)).isEqualTo(ProcessLifecycleManager.OUTCOME_NOT_RUNNING);
        assertThat(manager.pendingEscalations()).isZero();
    }
}
