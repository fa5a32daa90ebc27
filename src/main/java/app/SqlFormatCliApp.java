package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.SqlFormatCli;
import domain.format.FallbackPolicy;
import domain.format.FormattedSql;
import domain.format.SqlCommentDetector;
import domain.format.SqlFormatException;
import domain.format.SqlFormatter;
import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.model.FormatWarningCode;
import domain.model.FormatWarningSink;
import domain.model.ListFormatWarningSink;
import domain.output.FormattedFilePolicy;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import infra.sql.SqlFileScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link SqlFormatCli}). */
public final class SqlFormatCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String COMMENTS_DROPPED = "COMMENTS_DROPPED";

    private static final Logger log = LoggerFactory.getLogger(SqlFormatCliApp.class);

    private static final String USAGE = "usage: --in=<file|dir> [--out=<dir>] [--inPlace] [--check]"
            + " [--policy=strict|lenient] [--failFast] [--result=<report.xlsx|report.csv>] [--noResult]"
            + " [--slowMs=500] [--logEvery=100]";

    private SqlFormatCliApp() {}

    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        String inRaw = CliPathResolver.trimToNull(argv.get("in"));
        if (inRaw == null) {
            log.error("[USAGE] --in is required");
            log.error("[USAGE] {}", USAGE);
            return EXIT_USAGE;
        }

        FallbackPolicy policy;
        try {
            policy = CliArgParser.parsePolicy(argv);
        } catch (IllegalArgumentException e) {
            log.error("[USAGE] {}", e.getMessage());
            return EXIT_USAGE;
        }

        Path inputPath = CliPathResolver.resolvePath(baseDir, inRaw);
        Path outputDir = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", "output/formatted"));

        boolean inPlace = CliArgParser.flag(argv, "inPlace");
        boolean check = CliArgParser.flag(argv, "check");
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean noResult = CliArgParser.flag(argv, "noResult");
        String resultRaw = CliPathResolver.trimToNull(argv.get("result"));
        Path resultFile = (resultRaw == null) ? null : CliPathResolver.resolvePath(baseDir, resultRaw);
        boolean enableResult = !noResult && resultFile != null;

        int logEvery = CliArgParser.parseInt(argv.get("logEvery"), 100);
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 500L);

        log.info("==================================================");
        log.info("[START] SQL formatting");
        log.info("[CONF] baseDir   = {}", baseDir);
        log.info("[CONF] in        = {}", inputPath);
        log.info("[CONF] out       = {}", check ? "(check mode)" : inPlace ? "(in place)" : outputDir);
        log.info("[CONF] policy    = {} (use --policy or -D{})", policy, SqlFormatCli.PROP_POLICY);
        log.info("[CONF] failFast  = {}", failFast);
        log.info("[CONF] result    = {}", enableResult ? resultFile : "(disabled)");
        log.info("[CONF] slowMs    = {}", slowMs);
        log.info("[CONF] logEvery  = {}", logEvery);
        log.info("==================================================");

        try {
            CliPathResolver.validateExists(inputPath, "input (--in)");
        } catch (IllegalArgumentException e) {
            log.error("[USAGE] {}", e.getMessage());
            return EXIT_USAGE;
        }

        // warnings (collected even when the report is disabled)
        List<FormatWarning> warnings = new ArrayList<>(128);
        FormatWarningSink warningSink = new ListFormatWarningSink(warnings);

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        SqlFormatComponentsFactory factory = new SqlFormatComponentsFactory();
        SqlFormatter formatter = factory.createFormatter(policy, warningSink);
        SqlFileScanner scanner = factory.createScanner();
        SqlOutputWriter outputWriter = factory.createSqlOutputWriter(!check);
        ResultWriter resultWriter = factory.createResultWriter(enableResult, resultFile);

        List<Path> files = scanner.scan(inputPath, inPlace ? null : outputDir);
        int total = files.size();
        log.info("[STEP1] input scanned. files={}", total);

        List<FormatResult> results = new ArrayList<>(Math.max(16, total));
        int ok = 0;
        int failed = 0;
        int needsFormat = 0;

        long tLoop0 = System.nanoTime();
        log.info("[STEP2] formatting start. total={}", total);

        for (int i = 0; i < total; i++) {
            Path file = files.get(i);
            String name = FormattedFilePolicy.relativeName(inputPath, file);
            long one0 = System.nanoTime();

            try {
                String original = Files.readString(file, StandardCharsets.UTF_8);
                if (original.isBlank()) {
                    results.add(new FormatResult(FormatResult.SKIP, name, "SQL_TEXT_EMPTY"));
                    warningSink.warn(FormatWarning.of(FormatWarningCode.SQL_TEXT_EMPTY, name, "SQL text empty"));
                    ok++;
                } else {
                    FormattedSql formatted = formatter.formatDocument(original, name);
                    boolean unchanged = formatted.getText().equals(original);
                    // comments never survive formatting: such a file is neither canonical nor safe to overwrite
                    boolean hasComments = !unchanged && SqlCommentDetector.containsComment(original);
                    String status;
                    String message = "";
                    if (hasComments && (check || inPlace)) {
                        status = FormatResult.SKIP;
                        message = COMMENTS_DROPPED;
                        warningSink.warn(FormatWarning.of(FormatWarningCode.COMMENTS_DROPPED, name,
                                check ? "comments present, not checked" : "comments present, file left untouched"));
                        log.warn("[SKIP] comments would be lost: {}", name);
                    } else if (check) {
                        status = unchanged ? FormatResult.UNCHANGED : FormatResult.NEEDS_FORMAT;
                        if (!unchanged) {
                            needsFormat++;
                            log.info("[CHECK] not canonical: {}", name);
                        }
                    } else {
                        Path target = inPlace ? file : FormattedFilePolicy.target(inputPath, file, outputDir);
                        if (!(inPlace && unchanged)) outputWriter.write(target, formatted.getText());
                        status = unchanged ? FormatResult.UNCHANGED : FormatResult.FORMATTED;
                        if (hasComments) {
                            message = COMMENTS_DROPPED;
                            warningSink.warn(FormatWarning.of(FormatWarningCode.COMMENTS_DROPPED, name,
                                    "comments not carried into the formatted copy"));
                        }
                    }
                    ok++;
                    results.add(new FormatResult(status, name, formatted.getStatementCount(), message, null, ms(one0)));
                }

            } catch (SqlFormatException | IOException | IllegalStateException e) {
                failed++;
                results.add(new FormatResult(FormatResult.FAILED, name, 0,
                        e.getClass().getSimpleName(), e.getMessage(), ms(one0)));
                warningSink.warn(new FormatWarning(FormatWarningCode.FORMAT_ERROR, name, 0,
                        e.getClass().getSimpleName(), e.getMessage()));
                log.error("[ERROR] format failed: {}", name, e);

                if (failFast) {
                    log.error("[FAILFAST] stop on first error.");
                    break;
                }
            }

            long oneMs = ms(one0);
            if (oneMs >= slowMs) {
                log.warn("[SLOW] {}ms : {}", oneMs, name);
                warningSink.warn(new FormatWarning(FormatWarningCode.SLOW_FILE, name, 0,
                        "slowMs=" + slowMs + ", actualMs=" + oneMs, ""));
            }

            if (CliProgressMonitor.due(i + 1, total, logEvery)) {
                CliProgressMonitor.logProgress(i + 1, total, ok, failed, tLoop0, name);
            }
        }

        log.info("[STEP2] formatting done. elapsed={}ms", ms(tLoop0));
        log.info("[STAT] ok={}, failed={}, needsFormat={}", ok, failed, needsFormat);
        log.info("[STAT] warnings={}", warnings.size());

        if (enableResult) {
            long tReport0 = System.nanoTime();
            resultWriter.write(resultFile, results, warnings);
            log.info("[STEP3] report written: {} elapsed={}ms", resultFile, ms(tReport0));
        } else {
            log.info("[STEP3] report skipped. rows={}", results.size());
        }

        log.info("==================================================");
        log.info("[DONE] totalElapsed={}ms", ms(t0));
        log.info("==================================================");

        return (failed > 0 || needsFormat > 0) ? EXIT_FAILED : EXIT_OK;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
