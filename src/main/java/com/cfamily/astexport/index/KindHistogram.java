package com.cfamily.astexport.index;

import com.cfamily.astexport.model.NodeKind;
import com.cfamily.astexport.model.comment.Comment;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.type.Type;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Number of defined nodes per kind, keyed by variant name. Sentinels count under their
 * own kinds.
 */
public class KindHistogram {

    private final Map<String, Integer> counts = new TreeMap<>();

    public static KindHistogram of(Decl root) {
        KindHistogram histogram = new KindHistogram();
        AstTraversal.walk(root, new NodeVisitor() {
            @Override
            public void visitDecl(Decl decl) {
                histogram.add(decl.getKind());
            }

            @Override
            public void visitStmt(Stmt stmt) {
                histogram.add(stmt.getKind());
            }

            @Override
            public void visitType(Type type) {
                histogram.add(type.getKind());
            }

            @Override
            public void visitComment(Comment comment) {
                histogram.add(comment.getKind());
            }
        });
        return histogram;
    }

    private void add(NodeKind kind) {
        String name = kind == null ? "<none>" : kind.getVariantName();
        counts.merge(name, 1, Integer::sum);
    }

    public int count(String variantName) {
        return counts.getOrDefault(variantName, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }
}
