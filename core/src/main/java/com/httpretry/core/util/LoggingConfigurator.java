package com.httpretry.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 루트 설정: 콘솔 + 사이즈 롤링 파일(retry-%g.log).
 * StructuredLog는 이미 JSON 한 줄을 만들므로 포맷터는 메시지만 출력한다.
 * slf4j-jdk14 바인딩을 쓰면 slf4j 로그도 같은 핸들러로 모인다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    static final Formatter MESSAGE_ONLY = new Formatter() {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            if (r.getThrown() != null) msg = msg + " | " + r.getThrown();
            return msg + System.lineSeparator();
        }
    };

    /** @return 파일 핸들러를 붙였으면 true (디렉터리 생성/파일 열기 실패 시 콘솔만) */
    public static boolean init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(MESSAGE_ONLY);
        root.addHandler(console);
        root.setLevel(rootLevel);

        if (logDir == null) return false;
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("retry-%g.log").toString();
            FileHandler file = new FileHandler(pattern, Math.max(1024, maxBytes), Math.max(1, fileCount), true);
            file.setLevel(rootLevel);
            file.setFormatter(MESSAGE_ONLY);
            root.addHandler(file);
            return true;
        } catch (IOException e) {
            root.log(Level.WARNING, "file log disabled: " + e.getMessage());
            return false;
        }
    }

    /** -Dhr.log.level=FINE|INFO|WARNING|SEVERE, 잘못된 값이면 fallback */
    public static Level levelFromSystemProperty(Level fallback) {
        String v = System.getProperty("hr.log.level");
        if (v == null || v.isBlank()) return fallback;
        try {
            return Level.parse(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
