package com.sysdiagram.core.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sysdiagram.core.parser.LineDeclaration.ActorDecl;
import com.sysdiagram.core.parser.LineDeclaration.DescriptionDecl;
import com.sysdiagram.core.parser.LineDeclaration.PackageDecl;
import com.sysdiagram.core.parser.LineDeclaration.PartDecl;
import com.sysdiagram.core.parser.LineDeclaration.Unrecognized;

/**
 * Classifies model source lines.
 *
 * <p>Recognised syntax:
 * <pre>{@code
 * package <Name> [as <Alias>]
 * part <Name> [as <Alias>] : <Type>
 * actor <Name> [as <Alias>] [<<stereotype>>]
 * description = "..."
 * }</pre>
 *
 * <p>Leading whitespace is ignored and trailing brace punctuation is removed before
 * matching. Keywords are case-sensitive. Patterns are compiled once at class
 * loading time.
 */
public final class LineClassifier {

    // Names: letters, digits, underscore and internal whitespace, optionally double-quoted
    private static final String NAME = "(?:\"([^\"]+)\"|([A-Za-z0-9_][A-Za-z0-9_\\s]*?))";
    private static final String ALIAS = "(?:\\s+as\\s+(\\w+))?";

    public static final Pattern PACKAGE_PATTERN =
        Pattern.compile("^package\\s+" + NAME + ALIAS + "\\s*$");

    public static final Pattern PART_PATTERN =
        Pattern.compile("^part\\s+([\\w\\[\\]]+)" + ALIAS + "\\s*:\\s*(\\w+)");

    public static final Pattern ACTOR_PATTERN =
        Pattern.compile("^actor\\s+" + NAME + ALIAS + "(?:\\s*<<[^>]*>>)?\\s*$");

    public static final Pattern DESCRIPTION_PATTERN =
        Pattern.compile("^description\\s*=\\s*\"([^\"]*)\"");

    private LineClassifier() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Classifies one raw line.
     *
     * @param line raw line, including its leading whitespace
     * @return the matched declaration, or {@link Unrecognized}
     */
    public static LineDeclaration classify(String line) {
        String content = stripScopePunctuation(line);

        Matcher matcher = PACKAGE_PATTERN.matcher(content);
        if (matcher.matches()) {
            return new PackageDecl(quotedOrPlain(matcher), matcher.group(3));
        }

        matcher = PART_PATTERN.matcher(content);
        if (matcher.lookingAt()) {
            return new PartDecl(matcher.group(1).strip(), matcher.group(2), matcher.group(3));
        }

        matcher = ACTOR_PATTERN.matcher(content);
        if (matcher.matches()) {
            return new ActorDecl(quotedOrPlain(matcher), matcher.group(3));
        }

        matcher = DESCRIPTION_PATTERN.matcher(content);
        if (matcher.lookingAt()) {
            return new DescriptionDecl(matcher.group(1).strip());
        }

        return new Unrecognized(line);
    }

    /**
     * Returns the width of the leading whitespace of a line. Each whitespace
     * character counts as one, tabs included.
     *
     * @param line raw line
     * @return number of leading whitespace characters
     */
    public static int indentWidth(String line) {
        int width = 0;
        while (width < line.length() && Character.isWhitespace(line.charAt(width))) {
            width++;
        }
        return width;
    }

    /**
     * Trims a line and removes any trailing run of braces.
     *
     * @param line raw line
     * @return content used for pattern matching
     */
    static String stripScopePunctuation(String line) {
        String content = line.strip();
        int end = content.length();
        while (end > 0 && (content.charAt(end - 1) == '{' || content.charAt(end - 1) == '}')) {
            end--;
        }
        return content.substring(0, end).strip();
    }

    private static String quotedOrPlain(Matcher matcher) {
        String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        return name.strip();
    }
}
