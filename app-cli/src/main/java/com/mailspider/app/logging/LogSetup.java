package com.mailspider.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.*;
import java.util.Locale;
import java.util.logging.*;

/**
 * java.util.logging 전역 설정 (+옵션: 파일 사이즈 롤링, 기본 2MB x 5)
 * - init(debug): --debug 면 FINE, 아니면 -Dms.log.level (기본 WARNING → 조용한 CLI)
 * - System props:
 *   -Dms.log.level=FINE|INFO|WARNING|SEVERE
 *   -Dms.log.dir=logs        (없으면 파일 로그 안 씀)
 *   -Dms.log.sizeMb=2
 *   -Dms.log.files=5
 * SLF4J 는 slf4j-jdk14 바인딩으로 같은 핸들러를 탄다.
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter(); // 단일 인스턴스

    public static synchronized void init(boolean debug) {
        if (initialized) return;
        initialized = true;

        Level level = debug ? Level.FINE : levelOf(System.getProperty("ms.log.level", "WARNING"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        String dir = System.getProperty("ms.log.dir");
        if (dir != null && !dir.isBlank()) {
            try {
                Path logDir = Paths.get(dir);
                Files.createDirectories(logDir);
                int sizeMb  = parseInt(System.getProperty("ms.log.sizeMb"), 2);
                int fileCnt = parseInt(System.getProperty("ms.log.files"), 5);
                String pattern = logDir.resolve("mailspider-%g.log").toString();
                FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
                file.setLevel(level);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 실패는 콘솔에만 남기고 진행
                Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }

        root.setLevel(level);
        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE, () -> "Log initialized. level=" + level.getName());
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
