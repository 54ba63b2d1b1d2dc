package com.sysdiagram.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sysdiagram.core.model.ParsedModel;
import com.sysdiagram.core.parser.LineDeclaration.DescriptionDecl;
import com.sysdiagram.core.parser.LineDeclaration.ElementDecl;
import com.sysdiagram.core.parser.LineDeclaration.Unrecognized;

/**
 * Builds the model tree from indentation-structured source lines.
 *
 * <p>The parser makes a single forward pass. For each non-blank line it:
 * <ol>
 *   <li>classifies the line with {@link LineClassifier}</li>
 *   <li>closes the scopes the line's indentation cannot nest under ({@link ScopeStack})</li>
 *   <li>appends a new node to the innermost open scope, or attaches a description to the
 *       innermost open node</li>
 *   <li>opens a scope for the new node when the {@link ScopePolicy} says so</li>
 * </ol>
 *
 * <p>Unrecognised lines never fail the parse: each produces one
 * {@code "Unhandled line: <line>"} warning in the returned {@link ParsedModel} and leaves the
 * scope stack untouched. Scopes still open at the end of input are closed implicitly.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParsedModel parsed = new ModelParser().parse(Files.readAllLines(path));
 * parsed.warnings().forEach(System.err::println);
 * ModelNode root = parsed.root();
 * }</pre>
 *
 * <p>Instances are stateless between calls and may be reused.
 */
public class ModelParser {

    private static final Logger log = LoggerFactory.getLogger(ModelParser.class);

    static final String UNHANDLED_LINE_PREFIX = "Unhandled line: ";

    private final ScopePolicy policy;

    /**
     * Creates a parser using {@link ScopePolicy#INDENTATION}.
     */
    public ModelParser() {
        this(ScopePolicy.INDENTATION);
    }

    /**
     * Creates a parser with the given scope policy.
     *
     * @param policy scope policy, fixed for the lifetime of the parser
     */
    public ModelParser(ScopePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Returns the scope policy of this parser.
     *
     * @return scope policy
     */
    public ScopePolicy getPolicy() {
        return policy;
    }

    /**
     * Parses model text.
     *
     * @param text complete model source
     * @return parsed tree and warnings
     */
    public ParsedModel parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return parse(text.lines().toList());
    }

    /**
     * Parses model lines.
     *
     * @param lines model source lines, without line terminators
     * @return parsed tree and warnings
     */
    public ParsedModel parse(List<String> lines) {
        Objects.requireNonNull(lines, "lines must not be null");

        NodeDraft root = NodeDraft.root();
        ScopeStack scopes = new ScopeStack(root);
        List<String> warnings = new ArrayList<>();
        int elements = 0;

        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }

            LineDeclaration declaration = LineClassifier.classify(line);

            if (declaration instanceof Unrecognized) {
                if (policy.isStructural(line)) {
                    continue;
                }
                log.warn("Unhandled line: {}", line);
                warnings.add(UNHANDLED_LINE_PREFIX + line);
                continue;
            }

            int indent = LineClassifier.indentWidth(line);
            scopes.closeScopesFor(indent);

            if (declaration instanceof DescriptionDecl description) {
                scopes.innermost().setDescription(description.text());
                continue;
            }

            ElementDecl element = (ElementDecl) declaration;
            NodeDraft node = new NodeDraft(element.typeName(), element.name(), element.alias());
            scopes.innermostScope().addChild(node);
            elements++;
            log.debug("Declared {} '{}' at indent {} (depth {})",
                element.typeName(), element.name(), indent, scopes.depth());

            if (policy.opensScope(line)) {
                scopes.open(indent, node);
            }
        }

        log.debug("Parsed {} elements from {} lines ({} warnings, policy {})",
            elements, lines.size(), warnings.size(), policy);
        return new ParsedModel(root.freeze(), warnings);
    }
}
