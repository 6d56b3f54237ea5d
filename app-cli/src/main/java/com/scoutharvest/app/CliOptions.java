package com.scoutharvest.app;

import com.scoutharvest.core.model.ScrapeConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 명령행 플래그.
 * -c/--config, -m/--max-records, -o/--output, -f/--format, -u/--start-url(반복), -v/-vv, -h/--help
 */
public record CliOptions(Path config,
                         Integer maxRecords,
                         String output,
                         ScrapeConfig.OutputFormat format,
                         List<String> startUrls,
                         int verbosity,
                         boolean help) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: scout-harvest [options] [start-url ...]",
            "  -c, --config <path>       scrape.yml to load (default: ./scrape.yml if present)",
            "  -m, --max-records <n>     record budget",
            "  -o, --output <file>       output file",
            "  -f, --format json|csv     output format",
            "  -u, --start-url <url>     start URL (repeatable)",
            "  -v, -vv                   verbose logging",
            "  -h, --help                show this help");

    /** 잘못된 플래그/값이면 IllegalArgumentException */
    public static CliOptions parse(String[] args) {
        Path config = null;
        Integer maxRecords = null;
        String output = null;
        ScrapeConfig.OutputFormat format = null;
        List<String> urls = new ArrayList<>();
        int verbosity = 0;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-c", "--config" -> config = Path.of(value(args, ++i, a));
                case "-m", "--max-records" -> {
                    String v = value(args, ++i, a);
                    try {
                        maxRecords = Integer.parseInt(v.trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Not a number for " + a + ": " + v);
                    }
                    if (maxRecords < 1) throw new IllegalArgumentException(a + " must be >= 1");
                }
                case "-o", "--output" -> output = value(args, ++i, a);
                case "-f", "--format" -> {
                    String v = value(args, ++i, a);
                    try {
                        format = ScrapeConfig.OutputFormat.valueOf(v.trim().toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Unknown format: " + v + " (json|csv)");
                    }
                }
                case "-u", "--start-url" -> urls.add(value(args, ++i, a));
                case "-v" -> verbosity += 1;
                case "-vv" -> verbosity += 2;
                case "-h", "--help" -> help = true;
                default -> {
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    urls.add(a);
                }
            }
        }
        return new CliOptions(config, maxRecords, output, format, List.copyOf(urls), verbosity, help);
    }

    /** 설정 위에 플래그 덮어쓰기 */
    public ScrapeConfig applyTo(ScrapeConfig cfg) {
        if (maxRecords != null) cfg.setMaxRecords(maxRecords);
        if (output != null) cfg.getOutput().setFile(output);
        if (format != null) cfg.getOutput().setFormat(format);
        if (!startUrls.isEmpty()) cfg.setStartUrls(startUrls);
        return cfg;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length || args[i].isBlank()) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[i];
    }
}
