package com.bookharvest.core.tier.multiprocess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 부모와 같은 java 바이너리/클래스패스로 {@link ShardWorkerMain}을 자식 JVM에서 띄운다.
 * stdin: 지시서 한 줄, stdout: 메시지, stderr: 워커 로그(부모 stderr로 그대로).
 */
public final class ProcessShardLauncher implements ShardWorkerLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessShardLauncher.class);

    private final Path javaBinary;
    private final String classPath;
    private final List<String> jvmArgs;

    public ProcessShardLauncher() {
        this(defaultJavaBinary(), System.getProperty("java.class.path"), List.of());
    }

    public ProcessShardLauncher(Path javaBinary, String classPath, List<String> jvmArgs) {
        this.javaBinary = Objects.requireNonNull(javaBinary, "javaBinary");
        this.classPath = Objects.requireNonNull(classPath, "classPath");
        this.jvmArgs = List.copyOf(jvmArgs);
    }

    public static Path defaultJavaBinary() {
        Path bin = Path.of(System.getProperty("java.home"), "bin");
        Path java = bin.resolve("java");
        return Files.isExecutable(java) ? java : bin.resolve("java.exe");
    }

    @Override
    public WorkerHandle launch(ShardAssignment assignment) throws IOException {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaBinary.toString());
        cmd.addAll(jvmArgs);
        cmd.add("-cp");
        cmd.add(classPath);
        cmd.add(ShardWorkerMain.class.getName());

        Process p = new ProcessBuilder(cmd)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        LOG.debug("Launched shard worker pid={} for {}", p.pid(), assignment);

        try (OutputStream stdin = p.getOutputStream()) {
            stdin.write((ShardChannel.encodeAssignment(assignment) + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            p.destroyForcibly();
            throw e;
        }

        BufferedReader out = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8));
        return new WorkerHandle() {
            @Override public BufferedReader output() { return out; }
            @Override public int waitFor() throws InterruptedException { return p.waitFor(); }
            @Override public void destroy() { p.destroyForcibly(); }
        };
    }
}
