package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.sandbox.worker.WorkerMain;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds and starts worker JVMs.
 *
 * <pre>
 *   /bin/sh -c 'ulimit -S -t CPU; ulimit -S -n FDS; exec "$0" "$@"' \
 *       java -Xmx{mem}m -XX:ActiveProcessorCount=1 ... WorkerMain
 * </pre>
 *
 * The environment is cleared, the working directory is a private temp dir
 * and stderr goes to a file inside it. The shell wrapper is only used on
 * Linux and macOS and can be switched off.
 */
@Component
public class WorkerLauncher {

    static final String STDERR_FILE = "stderr.log";

    private final String  javaBinary;
    private final String  classpath;
    private final boolean ulimitEnabled;
    private final int     startupCpuSeconds;
    private final int     maxOpenFiles;

    public WorkerLauncher(@Value("${patina.sandbox.java-binary:}") String javaBinary,
                          @Value("${patina.sandbox.worker-classpath:}") String classpath,
                          @Value("${patina.sandbox.ulimit-enabled:true}") boolean ulimitEnabled,
                          @Value("${patina.sandbox.jvm-startup-cpu-seconds:10}") int startupCpuSeconds,
                          @Value("${patina.sandbox.max-open-files:1024}") int maxOpenFiles) {
        this.javaBinary        = javaBinary == null || javaBinary.isBlank() ? defaultJava() : javaBinary;
        this.classpath         = classpath == null || classpath.isBlank()
                ? System.getProperty("java.class.path") : classpath;
        this.ulimitEnabled     = ulimitEnabled && isUnixLike();
        this.startupCpuSeconds = startupCpuSeconds;
        this.maxOpenFiles      = maxOpenFiles;
    }

    public Process launch(Budget budget, Path workDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command(budget, workDir))
                .directory(workDir.toFile())
                .redirectError(workDir.resolve(STDERR_FILE).toFile());
        pb.environment().clear();
        return pb.start();
    }

    List<String> command(Budget budget, Path workDir) {
        List<String> cmd = new ArrayList<>();
        if (ulimitEnabled) {
            long cpuSeconds = (budget.cpuMs() + 999) / 1000 + startupCpuSeconds;
            cmd.add("/bin/sh");
            cmd.add("-c");
            cmd.add("ulimit -S -t " + cpuSeconds + " 2>/dev/null; "
                    + "ulimit -S -n " + maxOpenFiles + " 2>/dev/null; "
                    + "exec \"$0\" \"$@\"");
        }
        cmd.add(javaBinary);
        cmd.add("-Xmx" + budget.memMb() + "m");
        cmd.add("-XX:ActiveProcessorCount=1");
        cmd.add("-XX:+UseSerialGC");
        cmd.add("-XX:TieredStopAtLevel=1");
        cmd.add("-Dpolyglot.engine.WarnInterpreterOnly=false");
        cmd.add("-Dfile.encoding=UTF-8");
        cmd.add("-Djava.io.tmpdir=" + workDir);
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(WorkerMain.class.getName());
        return cmd;
    }

    public boolean javaAvailable() {
        return Files.isExecutable(Path.of(javaBinary));
    }

    public String javaBinary() {
        return javaBinary;
    }

    private static String defaultJava() {
        String exe = isWindows() ? "java.exe" : "java";
        return Path.of(System.getProperty("java.home"), "bin", exe).toString();
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    private static boolean isUnixLike() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return (os.contains("linux") || os.contains("mac")) && Files.isExecutable(Path.of("/bin/sh"));
    }
}
