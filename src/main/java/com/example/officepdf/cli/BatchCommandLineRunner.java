package com.example.officepdf.cli;

import com.example.officepdf.exception.PreflightFailedException;
import com.example.officepdf.exception.RendererException;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.model.BatchReport;
import com.example.officepdf.model.BatchRequest;
import com.example.officepdf.renderer.LibreOfficeCommand;
import com.example.officepdf.renderer.RendererType;
import com.example.officepdf.service.BatchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line front end. Runs one batch when the application is started with
 * batch arguments and stays inactive otherwise (REST mode).
 *
 * <pre>
 * office-pdf-batch [data] [out] [templates]
 *     --data=FILE --out=DIR --templates=DIR --sheet=NAME|INDEX --pattern=PATTERN
 *     --default-template=FILE --renderer=auto|libreoffice --parallelism=N
 *     --strict --fail-on-missing-columns --dry-run
 *     --from=N --to=N --where=EXPR
 *     --job=FILE.yml    (options given on the command line override the job file)
 *     --check           (verify that LibreOffice can be started)
 *     --version
 * </pre>
 *
 * Exit codes: 0 success, 1 invalid input or environment, 2 some rows failed,
 * 3 preflight failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_ROW_ERRORS = 2;
    static final int EXIT_PREFLIGHT = 3;

    private static final Set<String> BATCH_OPTIONS = Set.of(
            "data", "out", "templates", "sheet", "pattern", "default-template", "renderer", "parallelism",
            "strict", "fail-on-missing-columns", "dry-run", "from", "to", "where", "job", "check", "version");

    private final BatchOrchestrator orchestrator;
    private final JobFileLoader jobFileLoader;
    private final LibreOfficeCommand libreOffice;

    private int exitCode = EXIT_OK;

    /**
     * True when the arguments ask for a command-line run rather than the REST server.
     */
    public static boolean isCommandLineInvocation(String... args) {
        ApplicationArguments parsed = new DefaultApplicationArguments(args);
        if (!parsed.getNonOptionArgs().isEmpty()) {
            return true;
        }
        return parsed.getOptionNames().stream().anyMatch(BATCH_OPTIONS::contains);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!isCommandLineInvocation(args.getSourceArgs())) {
            return;
        }
        if (args.containsOption("version")) {
            log.info("office-pdf-batch {}", version());
            return;
        }
        if (args.containsOption("check")) {
            exitCode = check();
            return;
        }

        try {
            BatchRequest request = toRequest(args);
            BatchReport report = orchestrator.run(request);
            exitCode = report.hasErrors() ? EXIT_ROW_ERRORS : EXIT_OK;
        } catch (PreflightFailedException e) {
            log.error("[Preflight] {}", e.getDescription());
            exitCode = EXIT_PREFLIGHT;
        } catch (TemplateProcessingException e) {
            log.error("{}: {}", e.getCode(), e.getDescription());
            exitCode = EXIT_INVALID;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    BatchRequest toRequest(ApplicationArguments args) {
        String job = last(args, "job");
        BatchRequest request = job != null ? jobFileLoader.load(Path.of(job)) : new BatchRequest();

        List<String> positional = args.getNonOptionArgs();
        if (positional.size() > 0) {
            request.setDataPath(positional.get(0));
        }
        if (positional.size() > 1) {
            request.setOutputDir(positional.get(1));
        }
        if (positional.size() > 2) {
            request.setTemplateDir(positional.get(2));
        }

        String value;
        if ((value = last(args, "data")) != null) request.setDataPath(value);
        if ((value = last(args, "out")) != null) request.setOutputDir(value);
        if ((value = last(args, "templates")) != null) request.setTemplateDir(value);
        if ((value = last(args, "sheet")) != null) request.setSheet(value);
        if ((value = last(args, "pattern")) != null) request.setFilenamePattern(value);
        if ((value = last(args, "default-template")) != null) request.setDefaultTemplate(value);
        if ((value = last(args, "where")) != null) request.setWhere(value);
        if ((value = last(args, "renderer")) != null) request.setRenderer(rendererType(value));
        if ((value = last(args, "from")) != null) request.setFromRow(integer("from", value));
        if ((value = last(args, "to")) != null) request.setToRow(integer("to", value));
        if ((value = last(args, "parallelism")) != null) request.setParallelism(integer("parallelism", value));

        if (args.containsOption("strict")) request.setStrict(flag(args, "strict"));
        if (args.containsOption("fail-on-missing-columns")) request.setFailOnMissingColumns(flag(args, "fail-on-missing-columns"));
        if (args.containsOption("dry-run")) request.setDryRun(flag(args, "dry-run"));
        return request;
    }

    private int check() {
        try {
            log.info("LibreOffice: {}", libreOffice.detectVersion());
            return EXIT_OK;
        } catch (RendererException e) {
            log.error("LibreOffice not available: {}", e.getMessage());
            return EXIT_INVALID;
        }
    }

    private String version() {
        String version = getClass().getPackage().getImplementationVersion();
        return version != null ? version : "development build";
    }

    private static String last(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static boolean flag(ApplicationArguments args, String name) {
        String value = last(args, name);
        return value == null || value.isEmpty() || Boolean.parseBoolean(value);
    }

    private static Integer integer(String option, String value) {
        try {
            return Integer.valueOf(value.strip());
        } catch (NumberFormatException e) {
            throw new TemplateProcessingException("INVALID_REQUEST", "--" + option + " expects a number, got '" + value + "'");
        }
    }

    private static RendererType rendererType(String value) {
        try {
            return RendererType.valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TemplateProcessingException("INVALID_REQUEST", "Unknown renderer '" + value + "'");
        }
    }
}
