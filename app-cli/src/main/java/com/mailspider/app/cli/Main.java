package com.mailspider.app.cli;

import com.mailspider.app.logging.LogSetup;
import com.mailspider.core.model.CrawlConfig;
import com.mailspider.core.model.ExtractionReport;
import com.mailspider.core.service.ExtractionService;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * mailspider 진입점.
 * 종료 코드: 0 = 성공(이메일 0개 포함), 1 = 인자/설정 오류, 시드 오류, 출력 실패 등 모든 오류
 */
public final class Main {

    static final String VERSION = "mailspider 0.1.0";

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private final PrintStream out;
    private final PrintStream err;
    private final Function<CrawlConfig, ExtractionReport> runner;

    public Main(PrintStream out, PrintStream err) {
        this(out, err, cfg -> new ExtractionService(cfg).run());
    }

    /** 테스트용: 실제 크롤 대신 runner 주입 */
    Main(PrintStream out, PrintStream err, Function<CrawlConfig, ExtractionReport> runner) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err).run(args));
    }

    public int run(String... args) {
        try {
            CliOptions opts = CliOptions.parse(args);
            if (opts.isHelp()) {
                out.println(CliOptions.USAGE);
                return 0;
            }
            if (opts.isVersion()) {
                out.println(VERSION);
                return 0;
            }

            CrawlConfig cfg = opts.toConfig();
            LogSetup.init(cfg.isDebug());
            if (cfg.isDebug()) out.println("[DEBUG] Debug mode is active");

            out.println("Starting email extraction from: " + cfg.getTarget());
            ExtractionReport report = runner.apply(cfg);
            printSummary(report);
            return 0;
        } catch (CliArgsException e) {
            err.println("Error: " + e.getMessage());
            err.println("Try --help for usage.");
            return 1;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            LOG.log(Level.FINE, "extraction failed", e);
            return 1;
        }
    }

    private void printSummary(ExtractionReport r) {
        out.println();
        out.println("Extraction complete!");
        out.println("Pages visited: " + r.crawl().pagesVisited()
                + " (failed: " + r.crawl().pagesFailed() + ")");
        out.println("Emails found: " + r.extracted());
        out.println("New unique emails saved: " + r.saved());
        out.println("Results saved to: " + r.output());
    }
}
