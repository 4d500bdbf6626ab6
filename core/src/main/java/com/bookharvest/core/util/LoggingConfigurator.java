package com.bookharvest.core.util;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.*;

/** JUL 루트 핸들러 구성. SLF4J(jdk14 바인딩)와 StructuredLog 모두 여기로 모인다. */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    /** 콘솔 + 회전 파일(app-%g.log). logDir이 null이면 콘솔만. */
    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = resetRoot(rootLevel);
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(new LineFormatter());
        root.addHandler(console);

        if (logDir == null) return;
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("app-%g.log").toString();
            FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
            file.setLevel(rootLevel);
            file.setFormatter(console.getFormatter()); // 같은 포맷
            root.addHandler(file);
        } catch (IOException e) {
            System.err.println("Failed to init file handler: " + e.getMessage());
        }
    }

    /**
     * 샤드 워커 프로세스용: 모든 로그를 stderr로.
     * NOTE: stdout은 부모와의 메시지 채널이므로 절대 쓰면 안 된다.
     */
    public static void initStderr(Level rootLevel) {
        Logger root = resetRoot(rootLevel);
        StreamHandler err = new StreamHandler(System.err, new LineFormatter()) {
            @Override public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        err.setLevel(rootLevel);
        root.addHandler(err);
    }

    private static Logger resetRoot(Level rootLevel) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);
        root.setLevel(rootLevel);
        return root;
    }

    /** 한 줄 포맷: 메시지 + (있으면) 스택트레이스 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            StringBuilder sb = new StringBuilder(formatMessage(r)).append(System.lineSeparator());
            if (r.getThrown() != null) {
                var out = new java.io.ByteArrayOutputStream();
                r.getThrown().printStackTrace(new PrintStream(out, true));
                sb.append(out);
            }
            return sb.toString();
        }
    }
}
