package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.api.error.FormatterError;
import com.nsformatter.api.error.Severity;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Rewrites a single ns form into canonical layout: parse, fold legacy directives into
 * {@code :require}, then render. Instances hold no per-form state and may be shared
 * between threads.
 */
public class NsFormRewriter {
    private static final Logger logger = LoggerUtil.getLogger(NsFormRewriter.class);

    private final NsRenderer renderer;

    public NsFormRewriter(NsFormatOptions options) {
        this.renderer = new NsRenderer(options);
    }

    /**
     * @throws NsFormatException if the form contains an element the engine cannot classify
     */
    public NsRewriteResult rewrite(SyntaxNode form) {
        ParsedHeader parsed = NsParser.parseHeader(form);
        String namespace = parsed.getName().getValue();
        List<FormatterError> notes = collectNotes(parsed);

        ParsedHeader normalized = DirectiveNormalizer.normalize(parsed);
        SyntaxNode rendered = renderer.render(normalized);
        logger.fine("Rewrote ns " + namespace + " with " + notes.size() + " notes");
        return new NsRewriteResult(rendered, namespace, notes);
    }

    /**
     * Convenience for callers that only need the rewritten node.
     */
    public SyntaxNode rewriteNode(SyntaxNode form) {
        return rewrite(form).getNode();
    }

    private static List<FormatterError> collectNotes(ParsedHeader parsed) {
        List<FormatterError> notes = new ArrayList<>();
        for (Map.Entry<String, Integer> occurrence : parsed.getSectionOccurrences().entrySet()) {
            if (occurrence.getValue() > 1) {
                notes.add(new FormatterError(Severity.INFO,
                        "Merged " + occurrence.getValue() + " :" + occurrence.getKey() + " lists", 0, 0,
                        "Keep a single :" + occurrence.getKey() + " list per ns form"));
            }
        }
        if (parsed.hasSection(Directive.USE)) {
            notes.add(new FormatterError(Severity.WARNING,
                    "Deprecated :use directive rewritten as :require", 0, 0,
                    "Prefer :require with :refer"));
        }
        if (parsed.hasSection(Directive.LOAD)) {
            notes.add(new FormatterError(Severity.INFO,
                    ":load directive rewritten as :require", 0, 0));
        }
        return notes;
    }
}
