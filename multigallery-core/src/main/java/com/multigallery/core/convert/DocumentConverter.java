package com.multigallery.core.convert;

import com.multigallery.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Converts documents with an external office application.
 *
 * <p>Conversions may be slow and may fail for reasons outside this program (the
 * application is missing, busy or times out); failures are reported as
 * {@link ConversionException}.
 *
 * @see com.multigallery.core.convert.impl.LibreOfficeDocumentConverter
 */
public interface DocumentConverter {

    /**
     * Extracts the plain text of an office document.
     *
     * @param document document in any format the application reads
     * @return document text
     * @throws ConversionException if the conversion fails
     */
    String extractText(Path document) throws ConversionException;

    /**
     * Converts a plain text file to rich text.
     *
     * @param plainText text file to convert
     * @param outputDir directory to write the {@code .rtf} file to
     * @param styles paragraph style to replace in the result
     * @return path of the written {@code .rtf} file
     * @throws ConversionException if the conversion fails
     */
    Path convertToRtf(Path plainText, Path outputDir, StyleReplacement styles) throws ConversionException;

    /**
     * Reads the text of a document: {@code .txt} files directly, anything else through
     * {@link #extractText(Path)}.
     *
     * @param document document to read
     * @return document text without byte order mark
     * @throws ConversionException if the document cannot be read
     */
    default String readText(Path document) throws ConversionException {
        if (!"txt".equals(FileUtils.getExtension(document))) {
            return extractText(document);
        }
        try {
            return FileUtils.stripByteOrderMark(Files.readString(document));
        } catch (IOException e) {
            throw new ConversionException("Failed to read " + document, e);
        }
    }
}
