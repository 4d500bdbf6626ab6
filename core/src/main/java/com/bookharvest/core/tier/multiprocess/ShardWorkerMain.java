package com.bookharvest.core.tier.multiprocess;

import com.bookharvest.core.http.HttpSession;
import com.bookharvest.core.util.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

/** 자식 JVM 진입점: stdin에서 지시서 한 줄 → 샤드 처리 → stdout으로 메시지. */
public final class ShardWorkerMain {

    private static final Logger LOG = LoggerFactory.getLogger(ShardWorkerMain.class);

    private ShardWorkerMain() {}

    public static void main(String[] args) {
        LoggingConfigurator.initStderr(Level.INFO);
        int code;
        try {
            code = run(System.in, System.out);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Shard worker interrupted");
            code = 130;
        } catch (IOException | RuntimeException e) {
            LOG.error("Shard worker failed", e);
            code = 1;
        }
        System.exit(code);
    }

    static int run(InputStream in, OutputStream out) throws IOException, InterruptedException {
        BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line = r.readLine();
        if (line == null || line.isBlank()) throw new IOException("no shard assignment on stdin");
        ShardAssignment assignment = ShardChannel.decodeAssignment(line);

        Writer w = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        try (HttpSession session = new HttpSession(assignment.toConfig())) {
            return new ShardWorker(assignment, session, w).run();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
