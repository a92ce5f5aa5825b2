package com.seedforge.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5)
 * - configure(outRoot): outRoot/logs 기준 초기화
 * - init(logDir): logs 디렉터리를 직접 넘겨 초기화
 *
 * 콘솔(stderr)에는 메시지만, 파일에는 시각/레벨/스레드/로거까지 남긴다.
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter FILE_FORMATTER = new LineFormatter();
    private static final Formatter CONSOLE_FORMATTER = new MessageOnlyFormatter();

    /** outRoot/logs/seedforge-%g.log 로 저장. System props:
     *  -Dsf.log.level=FINE|INFO|WARNING|SEVERE
     *  -Dsf.log.sizeMb=2
     *  -Dsf.log.files=5
     *  -Dsf.log.console=true|false (기본 true)
     */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("sf.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("sf.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("sf.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("sf.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(CONSOLE_FORMATTER);
            root.addHandler(console);
        }
        root.setLevel(level);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("seedforge-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(FILE_FORMATTER);
            root.addHandler(file);
            Logger.getLogger(LogSetup.class.getName()).fine(
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getAnonymousLogger().log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException e) { return def; }
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

    /** 사람용 진행 줄(✅/❌, Wrote "...")은 메시지 그대로 */
    static final class MessageOnlyFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            return formatMessage(r) + System.lineSeparator();
        }
    }
}
