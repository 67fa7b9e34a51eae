package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.sandbox.worker.WorkerMain;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerLauncherTest {

    Budget budget = new Budget(1_500, 128, 10_000, 4096, 0, 5_000, 64, 100, 1000);

    @Test
    void command_withoutUlimit_startsJavaDirectly() {
        WorkerLauncher launcher = new WorkerLauncher("/opt/jdk/bin/java", "/cp", false, 10, 64);

        List<String> cmd = launcher.command(budget, Path.of("/tmp/w"));

        assertThat(cmd.get(0)).isEqualTo("/opt/jdk/bin/java");
        assertThat(cmd).contains("-Xmx128m", "-XX:ActiveProcessorCount=1", "-Djava.io.tmpdir=/tmp/w", "/cp");
        assertThat(cmd.get(cmd.size() - 1)).isEqualTo(WorkerMain.class.getName());
    }

    @Test
    void budget_belowWorkerHeapFloor_isRejected() {
        assertThatThrownBy(() -> new Budget(1_500, 64, 10_000, 4096, 0, 5_000, 64, 100, 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("memMb must be at least " + Budget.MIN_MEM_MB);
    }

    @Test
    void command_heapIsExactlyTheBudget() {
        WorkerLauncher launcher = new WorkerLauncher("/opt/jdk/bin/java", "/cp", false, 10, 64);
        Budget big = new Budget(1_500, 512, 10_000, 4096, 0, 5_000, 64, 100, 1000);

        assertThat(launcher.command(big, Path.of("/tmp/w"))).contains("-Xmx512m");
    }

    @Test
    void defaults_useRunningJvmAndClasspath() {
        WorkerLauncher launcher = new WorkerLauncher("", "", false, 10, 64);

        assertThat(launcher.javaBinary()).startsWith(System.getProperty("java.home"));
        assertThat(launcher.javaAvailable()).isTrue();
    }
}
