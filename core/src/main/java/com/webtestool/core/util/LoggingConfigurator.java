package com.webtestool.core.util;

import java.io.IOException;
import java.io.InputStream;
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
 * java.util.logging 전역 설정. slf4j(jdk14 바인딩)와 StructuredLog 가 같은 핸들러를 쓴다.
 * - bootstrap(): 클래스패스 webtestool-logging.properties 로 초기화(없으면 JUL 기본값 유지)
 * - init(logDir, ...): 콘솔 + 사이즈 롤링 파일(app-%g.log)
 * 레벨은 -Dwt.log.level=FINE|INFO|WARNING|SEVERE 가 우선.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static final String CLASSPATH_CONFIG = "/webtestool-logging.properties";

    private static volatile boolean bootstrapped = false;

    /** 클래스패스 설정 로드. 여러 번 불러도 한 번만 적용. */
    public static synchronized boolean bootstrap() {
        if (bootstrapped) return true;
        try (InputStream in = LoggingConfigurator.class.getResourceAsStream(CLASSPATH_CONFIG)) {
            if (in == null) return false;
            LogManager.getLogManager().readConfiguration(in);
            String sys = System.getProperty("wt.log.level");
            if (sys != null) Logger.getLogger("").setLevel(levelOf(sys, Level.INFO));
            bootstrapped = true;
            return true;
        } catch (IOException e) {
            Logger.getAnonymousLogger().log(Level.WARNING, "Logging bootstrap failed: " + e.getMessage(), e);
            return false;
        }
    }

    /** 콘솔 + 롤링 파일 핸들러로 루트 로거 재구성 */
    public static synchronized void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) throws IOException {
        Files.createDirectories(logDir);
        Level level = levelOf(System.getProperty("wt.log.level"), rootLevel == null ? Level.INFO : rootLevel);

        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        Formatter fmt = new LineFormatter();
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(fmt);
        root.addHandler(console);

        String pattern = logDir.resolve("app-%g.log").toString();
        FileHandler file = new FileHandler(pattern, Math.max(1, maxBytes), Math.max(1, fileCount), true);
        file.setLevel(level);
        file.setFormatter(fmt);
        root.addHandler(file);

        root.setLevel(level);
        bootstrapped = true;
    }

    static Level levelOf(String s, Level def) {
        if (s == null || s.isBlank()) return def;
        try { return Level.parse(s.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return def; }
    }

    /** 한 줄 포맷: 시각 [레벨] (스레드) 로거 - 메시지 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));
            Throwable t = r.getThrown();
            if (t == null) return base;
            java.io.StringWriter sw = new java.io.StringWriter(256);
            t.printStackTrace(new java.io.PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
