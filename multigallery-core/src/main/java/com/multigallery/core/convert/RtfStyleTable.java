package com.multigallery.core.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Paragraph styles declared in the {@code \stylesheet} group of an RTF document.
 *
 * <p>Each style is kept as the control word sequence that applies it, for example
 * {@code \s20\ql\widctlpar\hyphpar0\ltrpar\cf0\f4\fs20}, so that replacing one sequence by
 * another in the document body switches every paragraph from one style to the other.
 */
public final class RtfStyleTable {

    private static final Pattern STYLE_PATTERN = Pattern.compile(
        "\\\\s(\\d+)(?:\\\\sbasedon\\d+)?\\\\snext\\d+((?:\\\\[a-z0-9]+ ?)+)(?: ([A-Z][a-zA-Z ]*));");

    private final Map<String, String> byName;
    private final Map<Integer, String> byNumber;

    private RtfStyleTable(Map<String, String> byName, Map<Integer, String> byNumber) {
        this.byName = Collections.unmodifiableMap(byName);
        this.byNumber = Collections.unmodifiableMap(byNumber);
    }

    /**
     * Reads the style table of an RTF document.
     *
     * @param rtf RTF source
     * @return styles found, possibly none
     */
    public static RtfStyleTable parse(String rtf) {
        Map<String, String> byName = new LinkedHashMap<>();
        Map<Integer, String> byNumber = new LinkedHashMap<>();
        Matcher matcher = STYLE_PATTERN.matcher(rtf);
        while (matcher.find()) {
            String controlWords = "\\s" + matcher.group(1) + matcher.group(2);
            byNumber.put(Integer.parseInt(matcher.group(1)), controlWords);
            byName.put(matcher.group(3), controlWords);
        }
        return new RtfStyleTable(byName, byNumber);
    }

    /**
     * Returns the control words of a named style.
     *
     * @param name style name, e.g. "Normal"
     * @return control words, or empty if the document declares no such style
     */
    public Optional<String> style(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Returns the control words of a numbered style.
     *
     * @param number style number
     * @return control words, or empty if the document declares no such style
     */
    public Optional<String> style(int number) {
        return Optional.ofNullable(byNumber.get(number));
    }

    /**
     * Returns the declared style names.
     *
     * @return names in declaration order
     */
    public Iterable<String> names() {
        return byName.keySet();
    }

    /**
     * Switches every use of one style in a document to another.
     *
     * @param rtf RTF source the table was parsed from
     * @param replacement styles to swap
     * @return rewritten RTF source
     * @throws ConversionException if either style is not declared
     */
    public String replace(String rtf, StyleReplacement replacement) throws ConversionException {
        String source = style(replacement.sourceStyle()).orElseThrow(() -> new ConversionException(
            "RTF style '" + replacement.sourceStyle() + "' not found; declared styles: " + byName.keySet()));
        String target = style(replacement.targetStyle()).orElseThrow(() -> new ConversionException(
            "RTF style '" + replacement.targetStyle() + "' not found; declared styles: " + byName.keySet()));
        return rtf.replace(source, target);
    }
}
