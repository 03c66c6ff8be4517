package com.nsformatter.plugins.clojure.ns;

import com.nsformatter.plugins.clojure.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The branches of one top-level reader conditional, keyed by platform and kept in
 * ascending key order. A repeated key replaces the earlier branch.
 */
public final class BranchSet {
    private final boolean spliced;
    private final SortedMap<String, Branch> branches;
    private final List<String> comments;
    private final List<String> trailingComments;

    public BranchSet(boolean spliced, List<Branch> branchList, List<String> comments, List<String> trailingComments) {
        this.spliced = spliced;
        TreeMap<String, Branch> sorted = new TreeMap<>();
        for (Branch branch : branchList) {
            sorted.put(branch.getKeyText(), branch);
        }
        this.branches = Collections.unmodifiableSortedMap(sorted);
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        this.trailingComments = Collections.unmodifiableList(new ArrayList<>(trailingComments));
    }

    /**
     * True when read from the splicing {@code #?@} form.
     */
    public boolean isSpliced() {
        return spliced;
    }

    public SortedMap<String, Branch> getBranches() {
        return branches;
    }

    /**
     * Comments that preceded the conditional inside the ns form.
     */
    public List<String> getComments() {
        return comments;
    }

    public List<String> getTrailingComments() {
        return trailingComments;
    }

    public BranchSet withComments(List<String> leading) {
        return new BranchSet(spliced, new ArrayList<>(branches.values()), leading, trailingComments);
    }

    /**
     * One platform key and the clause selected for it.
     */
    public static final class Branch {
        private final SyntaxNode key;
        private final SyntaxNode clause;
        private final List<String> comments;

        public Branch(SyntaxNode key, SyntaxNode clause, List<String> comments) {
            this.key = key;
            this.clause = clause;
            this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
        }

        public SyntaxNode getKey() {
            return key;
        }

        public String getKeyText() {
            return key.toSource();
        }

        public SyntaxNode getClause() {
            return clause;
        }

        public List<String> getComments() {
            return comments;
        }
    }
}
