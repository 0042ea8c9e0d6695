package com.multigallery.core.convert.impl;

import com.multigallery.core.convert.ConversionException;
import com.multigallery.core.convert.DocumentConverter;
import com.multigallery.core.convert.RtfStyleTable;
import com.multigallery.core.convert.StyleReplacement;
import com.multigallery.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Document conversion through the LibreOffice command line.
 *
 * <ul>
 *   <li>text extraction: {@code libreoffice --cat <document>}</li>
 *   <li>rich text: {@code libreoffice --convert-to "rtf:Rich Text Format" --outdir <dir> <file>},
 *       followed by a rewrite of the paragraph styles</li>
 * </ul>
 *
 * <p>Each invocation is killed if it does not finish within the timeout. A running
 * LibreOffice Writer instance makes headless invocations return empty output or fail, so
 * the converter logs a warning once if it finds one.
 */
public class LibreOfficeDocumentConverter implements DocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(LibreOfficeDocumentConverter.class);

    /** Default executable, looked up on the {@code PATH}. */
    public static final String DEFAULT_EXECUTABLE = "libreoffice";

    /** Default timeout for one invocation. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    private static final String RTF_FILTER = "rtf:Rich Text Format";

    private final String executable;
    private final Duration timeout;
    private volatile boolean writerChecked;

    /**
     * Creates a converter using {@value #DEFAULT_EXECUTABLE} with the default timeout.
     */
    public LibreOfficeDocumentConverter() {
        this(DEFAULT_EXECUTABLE, DEFAULT_TIMEOUT);
    }

    /**
     * Creates a converter.
     *
     * @param executable LibreOffice executable name or path
     * @param timeout maximum duration of one invocation
     */
    public LibreOfficeDocumentConverter(String executable, Duration timeout) {
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String extractText(Path document) throws ConversionException {
        warnIfWriterRunning();
        Path output = null;
        try {
            output = Files.createTempFile("multigallery-cat-", ".txt");
            run(List.of(executable, "--cat", document.toString()), output);
            return FileUtils.stripByteOrderMark(Files.readString(output, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConversionException("Failed to extract text from " + document, e);
        } finally {
            deleteQuietly(output);
        }
    }

    @Override
    public Path convertToRtf(Path plainText, Path outputDir, StyleReplacement styles) throws ConversionException {
        warnIfWriterRunning();
        Path rtfPath = outputDir.resolve(FileUtils.baseName(plainText) + ".rtf");
        try {
            run(List.of(executable, "--convert-to", RTF_FILTER, "--outdir", outputDir.toString(),
                plainText.toString()), null);
            if (!Files.isRegularFile(rtfPath)) {
                throw new ConversionException("LibreOffice did not produce " + rtfPath);
            }
            // RTF is 7-bit; ISO-8859-1 keeps any stray byte unchanged on the way back.
            String rtf = Files.readString(rtfPath, StandardCharsets.ISO_8859_1);
            String rewritten = RtfStyleTable.parse(rtf).replace(rtf, styles);
            Files.writeString(rtfPath, rewritten, StandardCharsets.ISO_8859_1);
            log.debug("Replaced RTF style '{}' with '{}' in {}", styles.sourceStyle(), styles.targetStyle(), rtfPath);
            return rtfPath;
        } catch (IOException e) {
            throw new ConversionException("Failed to convert " + plainText + " to RTF", e);
        }
    }

    /**
     * Runs one LibreOffice invocation.
     *
     * @param command command line
     * @param stdout file receiving standard output, or null to discard it
     */
    private void run(List<String> command, Path stdout) throws IOException, ConversionException {
        log.debug("Running: {}", String.join(" ", command));
        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectError(ProcessBuilder.Redirect.DISCARD)
            .redirectOutput(stdout == null
                ? ProcessBuilder.Redirect.DISCARD
                : ProcessBuilder.Redirect.to(stdout.toFile()));

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ConversionException("Could not start '" + executable + "'; is LibreOffice installed?", e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ConversionException("Timed out after " + timeout.toSeconds() + "s: "
                    + String.join(" ", command));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted while running: " + String.join(" ", command), e);
        }

        if (process.exitValue() != 0) {
            throw new ConversionException("Exit code " + process.exitValue() + ": " + String.join(" ", command));
        }
    }

    private void warnIfWriterRunning() {
        if (writerChecked) {
            return;
        }
        writerChecked = true;
        boolean running = ProcessHandle.allProcesses()
            .map(ProcessHandle::info)
            .anyMatch(info -> info.command().map(LibreOfficeDocumentConverter::isLibreOffice).orElse(false)
                && info.arguments().map(arguments -> Arrays.asList(arguments).contains("--writer")).orElse(false));
        if (running) {
            log.warn("LibreOffice Writer appears to be running. Conversions may fail or return empty files until it is closed.");
        }
    }

    private static boolean isLibreOffice(String command) {
        return command.contains("libreoffice") || command.contains("soffice");
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
