package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.CommentNode;
import com.nsformatter.plugins.clojure.syntax.KeywordNode;
import com.nsformatter.plugins.clojure.syntax.MetaNode;
import com.nsformatter.plugins.clojure.syntax.NodeTag;
import com.nsformatter.plugins.clojure.syntax.Nodes;
import com.nsformatter.plugins.clojure.syntax.PrefixNode;
import com.nsformatter.plugins.clojure.syntax.ReaderConditionalNode;
import com.nsformatter.plugins.clojure.syntax.SyntaxNode;
import com.nsformatter.plugins.clojure.syntax.TokenNode;
import com.nsformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns an ns form into a {@link ParsedHeader}. Comments are never positional: each one is
 * buffered until the next content node and then owned by the element built for it.
 */
public final class NsParser {
    private static final Logger logger = LoggerUtil.getLogger(NsParser.class);

    public static final String HEADER_MARKER = "ns";

    private NsParser() {
    }

    /**
     * True if {@code node} is a list whose first form is the symbol {@code ns}.
     */
    public static boolean isHeaderForm(SyntaxNode node) {
        if (node == null || node.getTag() != NodeTag.LIST) {
            return false;
        }
        List<SyntaxNode> content = node.getContentChildren();
        return !content.isEmpty()
                && content.get(0) instanceof TokenNode
                && HEADER_MARKER.equals(((TokenNode) content.get(0)).getValue());
    }

    /**
     * Parses a header form into its name, metadata, docstring, sections and conditionals.
     *
     * @throws NsFormatException if a child of the form has an unsupported shape
     */
    public static ParsedHeader parseHeader(SyntaxNode node) {
        if (!isHeaderForm(node)) {
            throw new IllegalArgumentException("Not an ns form: " + node);
        }

        List<SyntaxNode> children = node.getChildren();
        int index = indexOfFirstContent(children) + 1;
        List<String> pending = new ArrayList<>();

        SyntaxNode nameForm = null;
        for (; index < children.size(); index++) {
            SyntaxNode child = children.get(index);
            if (child.isComment()) {
                pending.add(chompComment((CommentNode) child));
            } else if (!child.isWhitespace()) {
                nameForm = child;
                index++;
                break;
            }
        }

        ParsedHeader.Builder header = ParsedHeader.builder();
        readName(nameForm, header);

        for (; index < children.size(); index++) {
            SyntaxNode child = children.get(index);
            if (child.isWhitespace()) {
                continue;
            }
            if (child.isComment()) {
                pending.add(chompComment((CommentNode) child));
                continue;
            }

            switch (child.getTag()) {
                case STRING:
                    header.doc(child).addDocComments(pending);
                    break;
                case LIST: {
                    ParsedList parsed = parseListWithComments(child);
                    String key = directiveKey(parsed.getHead(), child);
                    header.addSection(key, parsed.getElements())
                            .addSectionComments(key, pending)
                            .addSectionComments(key, parsed.getDanglingComments());
                    logger.fine("Parsed :" + key + " with " + parsed.getElements().size() + " elements");
                    break;
                }
                case READER_CONDITIONAL:
                    header.addConditional(parseBranchSet((ReaderConditionalNode) child).withComments(pending));
                    break;
                default:
                    throw NsFormatException.unknownSection(child);
            }
            pending = new ArrayList<>();
        }

        return header.addTrailingComments(pending).build();
    }

    /**
     * Parses a list or vector into its head and comment-carrying elements. Nested lists
     * are parsed the same way, recursively.
     *
     * @throws NsFormatException if a child is not a token, vector, map, list or reader conditional
     */
    public static ParsedList parseListWithComments(SyntaxNode seq) {
        SyntaxNode head = null;
        List<Element> elements = new ArrayList<>();
        List<String> pending = new ArrayList<>();

        for (SyntaxNode child : seq.getChildren()) {
            if (child.isWhitespace()) {
                continue;
            }
            if (child.isComment()) {
                pending.add(chompComment((CommentNode) child));
                continue;
            }

            SyntaxNode content = unquote(child);
            if (head == null) {
                head = content;
                continue;
            }

            switch (content.getTag()) {
                case TOKEN:
                case KEYWORD:
                case STRING:
                case VECTOR:
                case MAP:
                case READER_CONDITIONAL:
                    elements.add(Element.of(content, pending));
                    break;
                case LIST:
                    elements.add(Element.ofList(content, parseListWithComments(content), pending));
                    break;
                default:
                    throw NsFormatException.unrecognizedElement(content);
            }
            pending = new ArrayList<>();
        }

        if (!pending.isEmpty() && !elements.isEmpty()) {
            int last = elements.size() - 1;
            elements.set(last, elements.get(last).withTrailingComments(pending));
            pending = new ArrayList<>();
        }
        return new ParsedList(head, elements, pending);
    }

    /**
     * Reads the key/clause pairs of a reader conditional into a sorted branch set.
     *
     * @throws NsFormatException if a key has no clause
     */
    public static BranchSet parseBranchSet(ReaderConditionalNode node) {
        List<BranchSet.Branch> branches = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        SyntaxNode key = null;
        List<String> keyComments = new ArrayList<>();

        for (SyntaxNode child : node.getChildren()) {
            if (child.isWhitespace()) {
                continue;
            }
            if (child.isComment()) {
                pending.add(chompComment((CommentNode) child));
                continue;
            }
            if (key == null) {
                key = child;
                keyComments = pending;
            } else {
                keyComments.addAll(pending);
                branches.add(new BranchSet.Branch(key, child, keyComments));
                key = null;
            }
            pending = new ArrayList<>();
        }

        if (key != null) {
            throw NsFormatException.malformedConditional(node);
        }
        return new BranchSet(node.isSpliced(), branches, new ArrayList<>(), pending);
    }

    /**
     * Comment text without its marker and without trailing line breaks.
     */
    static String chompComment(CommentNode comment) {
        return comment.getText().replaceAll("[\\r\\n]+$", "");
    }

    private static void readName(SyntaxNode nameForm, ParsedHeader.Builder header) {
        if (nameForm == null) {
            throw NsFormatException.missingName(null);
        }
        Map<SyntaxNode, SyntaxNode> metadata = new LinkedHashMap<>();
        SyntaxNode form = nameForm;
        List<SyntaxNode> metaForms = new ArrayList<>();
        while (form instanceof MetaNode) {
            metaForms.add(((MetaNode) form).getMeta());
            form = ((MetaNode) form).getInner();
        }
        if (!(form instanceof TokenNode)) {
            throw NsFormatException.missingName(form);
        }
        // Innermost metadata first so that outer entries win.
        for (int i = metaForms.size() - 1; i >= 0; i--) {
            metadata.putAll(readMetadata(metaForms.get(i)));
        }
        header.name((TokenNode) form).metadata(metadata);
    }

    private static Map<SyntaxNode, SyntaxNode> readMetadata(SyntaxNode meta) {
        Map<SyntaxNode, SyntaxNode> entries = new LinkedHashMap<>();
        switch (meta.getTag()) {
            case KEYWORD:
                entries.put(meta, Nodes.token("true"));
                break;
            case TOKEN:
            case STRING:
                entries.put(Nodes.keyword("tag"), meta);
                break;
            case VECTOR:
                entries.put(Nodes.keyword("param-tags"), meta);
                break;
            case MAP: {
                List<SyntaxNode> content = meta.getContentChildren();
                if (content.size() % 2 != 0) {
                    throw NsFormatException.unrecognizedElement(meta);
                }
                for (int i = 0; i < content.size(); i += 2) {
                    entries.put(content.get(i), content.get(i + 1));
                }
                break;
            }
            default:
                throw NsFormatException.unrecognizedElement(meta);
        }
        return entries;
    }

    private static String directiveKey(SyntaxNode head, SyntaxNode list) {
        if (head instanceof KeywordNode) {
            return ((KeywordNode) head).getName();
        }
        if (head instanceof TokenNode) {
            return ((TokenNode) head).getValue();
        }
        throw NsFormatException.unknownSection(list);
    }

    private static SyntaxNode unquote(SyntaxNode node) {
        if (node.getTag() == NodeTag.QUOTE) {
            return ((PrefixNode) node).getInner();
        }
        return node;
    }

    private static int indexOfFirstContent(List<SyntaxNode> children) {
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isWhitespaceOrComment()) {
                return i;
            }
        }
        return -1;
    }
}
