package com.sitepulse.core.util;

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
 * java.util.logging 루트 설정. SLF4J는 slf4j-jdk14 바인딩으로 여기로 흘러온다.
 * logDir/audit-%g.log 롤링 + 콘솔.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    private static volatile boolean initialized = false; // 재초기화 방지

    public static synchronized void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        if (initialized) return;
        initialized = true;

        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        Formatter fmt = new LineFormatter();
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(fmt);
        root.addHandler(console);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("audit-%g.log").toString();
            FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
            file.setLevel(rootLevel);
            file.setEncoding("UTF-8");
            file.setFormatter(fmt); // 같은 포맷
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 핸들러 실패 시 콘솔만으로 진행
            Logger.getLogger(LoggingConfigurator.class.getName())
                    .log(Level.WARNING, "Failed to init file handler: " + e.getMessage(), e);
        }

        root.setLevel(rootLevel);
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /** 한 줄 포맷 + 스레드명 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));
            Throwable t = r.getThrown();
            return t == null ? base : base + t + System.lineSeparator();
        }
    }
}
