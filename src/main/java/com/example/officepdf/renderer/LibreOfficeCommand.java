package com.example.officepdf.renderer;

import com.example.officepdf.config.LibreOfficeProperties;
import com.example.officepdf.exception.RendererException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs {@code soffice --headless --convert-to <target> --outdir <dir> <file>}.
 * The conversion target must come before {@code --outdir}, and the input file last.
 */
@Slf4j
@Component
public class LibreOfficeCommand {
    private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_OUTPUT_IN_MESSAGE = 2000;

    private final LibreOfficeProperties properties;

    @Autowired
    public LibreOfficeCommand(LibreOfficeProperties properties) {
        this.properties = properties;
    }

    /**
     * @param target LibreOffice conversion target, e.g. {@code pdf}, {@code docx} or
     *               {@code pdf:writer_pdf_Export}
     */
    public void convert(Path input, Path outputDir, String target) throws RendererException {
        List<String> command = new ArrayList<>();
        command.add(properties.getBinary());
        command.add("--headless");
        Path profile = null;
        try {
            if (properties.isReentrant()) {
                profile = Files.createTempDirectory("lo-profile-");
                command.add("-env:UserInstallation=" + profile.toUri());
            }
            command.add("--convert-to");
            command.add(target);
            command.add("--outdir");
            command.add(outputDir.toAbsolutePath().toString());
            command.add(input.toAbsolutePath().toString());

            ProcessOutcome outcome = run(command, properties.getTimeout());
            if (outcome.exitCode != 0) {
                throw new RendererException("LibreOffice returned exit code " + outcome.exitCode
                        + "\nCMD: " + String.join(" ", command) + "\nOUTPUT:\n" + outcome.output);
            }
        } catch (IOException e) {
            throw new RendererException("Cannot run " + properties.getBinary() + ": " + e.getMessage(), e);
        } finally {
            if (profile != null) {
                deleteQuietly(profile);
            }
        }
    }

    /**
     * Output of {@code soffice --version}.
     *
     * @throws RendererException when the binary is missing or exits with an error
     */
    public String detectVersion() throws RendererException {
        List<String> command = List.of(properties.getBinary(), "--version");
        try {
            ProcessOutcome outcome = run(command, VERSION_TIMEOUT);
            if (outcome.exitCode != 0) {
                throw new RendererException("soffice --version exited with " + outcome.exitCode + ": " + outcome.output);
            }
            return outcome.output.strip();
        } catch (IOException e) {
            throw new RendererException("Cannot run " + properties.getBinary() + ": " + e.getMessage(), e);
        }
    }

    private ProcessOutcome run(List<String> command, Duration timeout) throws IOException, RendererException {
        Path logFile = Files.createTempFile("soffice-", ".log");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new RendererException("Interrupted while waiting for LibreOffice", e);
            }
            if (!finished) {
                process.destroyForcibly();
                throw new RendererException("LibreOffice did not finish within " + timeout.toSeconds() + "s");
            }
            String output = Files.readString(logFile, StandardCharsets.UTF_8);
            if (output.length() > MAX_OUTPUT_IN_MESSAGE) {
                output = output.substring(output.length() - MAX_OUTPUT_IN_MESSAGE);
            }
            return new ProcessOutcome(process.exitValue(), output);
        } finally {
            Files.deleteIfExists(logFile);
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not remove LibreOffice profile {}: {}", dir, e.getMessage());
        }
    }

    private static final class ProcessOutcome {
        final int exitCode;
        final String output;

        ProcessOutcome(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }
    }
}
