package com.mailspider.app.cli;

import com.mailspider.core.model.CrawlConfig;
import com.mailspider.core.util.YamlConfigLoader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 명령행 인자 파싱 결과.
 * 값이 주어진 옵션만 YAML(--config) 위에 덮어쓴다. 지정 안 한 값은 null.
 *
 * 지원 형식: "--depth 2", "--depth=2", "-d 2"
 */
public final class CliOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: mailspider --url <url> --output <file.csv> [options]",
            "",
            "Recursively crawl a website and extract email addresses into a CSV file.",
            "",
            "  -u, --url <url>          Target URL to crawl (required)",
            "  -o, --output <file>      Output CSV file path (required)",
            "  -d, --depth <n>          Maximum crawl depth (default: 3)",
            "      --cross-domain       Follow links to other hosts",
            "      --max-pages <n>      Maximum number of pages to visit (default: 100)",
            "      --max-queue <n>      Maximum pending queue size (default: 10000)",
            "      --timeout-ms <n>     Per-request timeout in milliseconds (default: 10000)",
            "  -c, --config <file>      YAML config file; command line values win",
            "      --debug              Print crawl decisions as JSON log lines",
            "  -h, --help               Show this help",
            "  -V, --version            Show version");

    private String url;
    private Path output;
    private Integer depth;
    private Integer maxPages;
    private Integer maxQueue;
    private Long timeoutMs;
    private Path config;
    private boolean crossDomain;
    private boolean debug;
    private boolean help;
    private boolean version;

    private CliOptions() {}

    public static CliOptions parse(String... args) throws CliArgsException {
        CliOptions o = new CliOptions();
        if (args == null) return o;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 2) {
                name = arg.substring(0, eq);
                inline = arg.substring(eq + 1);
            }

            switch (name) {
                case "-h": case "--help":       o.help = true; break;
                case "-V": case "--version":    o.version = true; break;
                case "--cross-domain":          o.crossDomain = true; break;
                case "--debug":                 o.debug = true; break;
                case "-u": case "--url":
                    o.url = inline != null ? inline : next(args, ++i, name); break;
                case "-o": case "--output":
                    o.output = Path.of(inline != null ? inline : next(args, ++i, name)); break;
                case "-c": case "--config":
                    o.config = Path.of(inline != null ? inline : next(args, ++i, name)); break;
                case "-d": case "--depth":
                    o.depth = parseInt(name, inline != null ? inline : next(args, ++i, name)); break;
                case "--max-pages":
                    o.maxPages = parseInt(name, inline != null ? inline : next(args, ++i, name)); break;
                case "--max-queue":
                    o.maxQueue = parseInt(name, inline != null ? inline : next(args, ++i, name)); break;
                case "--timeout-ms":
                    o.timeoutMs = (long) parseInt(name, inline != null ? inline : next(args, ++i, name)); break;
                default:
                    throw new CliArgsException("unknown option: " + arg);
            }
        }
        return o;
    }

    /**
     * (옵션) YAML → CLI 값 덮어쓰기 → 필수값/범위 검증.
     * @throws IOException      설정 파일 없음/깨짐
     * @throws CliArgsException 필수 옵션 누락, 범위 위반
     */
    public CrawlConfig toConfig() throws IOException, CliArgsException {
        CrawlConfig cfg = (config != null) ? YamlConfigLoader.load(config) : CrawlConfig.defaults();

        if (url != null) cfg.setTarget(url);
        if (output != null) cfg.setOutput(output);
        if (depth != null) cfg.setMaxDepth(depth);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (maxQueue != null) cfg.setMaxQueueSize(maxQueue);
        if (timeoutMs != null) cfg.getHttp().setTimeoutMs(timeoutMs);
        if (crossDomain) cfg.setCrossDomain(true);
        if (debug) cfg.setDebug(true);

        if (cfg.getTarget() == null || cfg.getTarget().isBlank())
            throw new CliArgsException("missing required option --url");
        if (cfg.getOutput() == null)
            throw new CliArgsException("missing required option --output");
        try {
            cfg.validate();
        } catch (IllegalArgumentException e) {
            throw new CliArgsException(e.getMessage());
        }
        return cfg;
    }

    public boolean isHelp() { return help; }
    public boolean isVersion() { return version; }
    public boolean isDebug() { return debug; }

    private static String next(String[] args, int i, String name) throws CliArgsException {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new CliArgsException("option " + name + " requires a value");
        }
        return args[i];
    }

    private static int parseInt(String name, String s) throws CliArgsException {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new CliArgsException("Invalid integer for " + name + ": " + s);
        }
    }
}
