package com.nsformatter.plugins.clojure;

import com.nsformatter.api.FormatterPlugin;
import com.nsformatter.api.FormatterResult;
import com.nsformatter.api.Refactoring;
import com.nsformatter.api.error.FormatterError;
import com.nsformatter.api.error.Severity;
import com.nsformatter.config.ConfigurationLoader;
import com.nsformatter.config.FormatterConfig;
import com.nsformatter.plugins.clojure.ns.NsFormatException;
import com.nsformatter.plugins.clojure.ns.NsFormRewriter;
import com.nsformatter.plugins.clojure.ns.NsFormatOptions;
import com.nsformatter.plugins.clojure.ns.NsParser;
import com.nsformatter.plugins.clojure.ns.NsRewriteResult;
import com.nsformatter.plugins.clojure.syntax.ClojureReader;
import com.nsformatter.plugins.clojure.syntax.FormsNode;
import com.nsformatter.plugins.clojure.syntax.ReaderException;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.util.LoggerUtil;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Clojure formatter plugin. Reads a file losslessly, rewrites every top-level ns form in
 * place and leaves all other text exactly as written.
 */
public class ClojureFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(ClojureFormatter.class);

    private NsFormRewriter rewriter;
    private boolean rewriteNs = true;

    @Override
    public void initialize(FormatterConfig config) {
        NsFormatOptions options = NsFormatOptions.fromConfig(config);
        this.rewriter = new NsFormRewriter(options);
        this.rewriteNs = config.getPluginConfig(FormatterConfig.CLOJURE_PLUGIN, ConfigurationLoader.REWRITE_NS, true);
        logger.fine("Clojure formatter initialized with " + options + ", rewriteNs=" + rewriteNs);
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        if (rewriter == null) {
            throw new IllegalStateException("ClojureFormatter used before initialize()");
        }

        FormsNode original;
        try {
            original = ClojureReader.read(sourceCode);
        } catch (ReaderException e) {
            logger.warning("Cannot read " + filePath + ": " + e.getMessage());
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.FATAL,
                    "Failed to read Clojure source: " + e.getMessage(),
                    e.getLine(), e.getColumn(),
                    "Check for unbalanced delimiters or unterminated strings"));
        }

        if (!rewriteNs) {
            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(sourceCode)
                    .build();
        }

        List<FormatterError> errors = new ArrayList<>();
        List<Refactoring> refactorings = new ArrayList<>();
        FormsNode formatted = original;

        int line = 1;
        int column = 1;
        List<SyntaxNode> children = original.getChildren();
        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            String text = child.toSource();

            if (NsParser.isHeaderForm(child)) {
                try {
                    NsRewriteResult result = rewriter.rewrite(child);
                    for (FormatterError note : result.getNotes()) {
                        errors.add(note.at(line, column));
                    }
                    if (!result.getNode().toSource().equals(text)) {
                        formatted = formatted.replaceChild(i, result.getNode());
                        refactorings.add(new Refactoring(
                                Refactoring.NS_FORM_REWRITE,
                                line,
                                line + countLines(text),
                                "Canonicalized ns " + result.getNamespace()));
                    }
                } catch (NsFormatException e) {
                    logger.warning("Leaving ns form at " + filePath + ":" + line + " unformatted: " + e.getMessage());
                    errors.add(new FormatterError(Severity.ERROR, e.getMessage(), line, column,
                            suggestionFor(e.getKind())));
                }
            }

            for (int c = 0; c < text.length(); c++) {
                if (text.charAt(c) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
        }

        boolean successful = errors.stream().noneMatch(e -> e.getSeverity().isBlocking());

        return FormatterResult.builder()
                .successful(successful)
                .formattedCode(formatted.toSource())
                .errors(errors)
                .appliedRefactorings(refactorings)
                .build();
    }

    private static int countLines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static String suggestionFor(NsFormatException.Kind kind) {
        return switch (kind) {
            case UNRECOGNIZED_ELEMENT -> "Directive lists may only hold symbols, keywords, strings, vectors, maps, lists and reader conditionals";
            case MALFORMED_CONDITIONAL -> "Every reader conditional key needs a form after it";
            case UNKNOWN_SECTION -> "ns takes a name, an optional docstring, directive lists and reader conditionals";
            case MISSING_NAME -> "Add a namespace symbol after ns";
            case INVALID_REQUIRE_GROUP -> "Prefix lists may only hold symbols and vectors";
        };
    }
}
