package com.cfamily.astexport.index;

import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.type.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rebuilds identity to node maps from a tree, as a consumer of an exported document
 * would see them.
 * <p>
 * Storage is cleared before and after every build, so an indexer can be reused across
 * trees. Not thread-safe; a build running on this instance rejects any other.
 */
public class IdentityIndexer {

    private static final Logger log = LoggerFactory.getLogger(IdentityIndexer.class);

    private final Map<NodeId, Decl> declarations = new HashMap<>();
    private final Map<NodeId, Stmt> statements = new HashMap<>();
    private final Map<NodeId, Type> types = new HashMap<>();
    private final AtomicBoolean inUse = new AtomicBoolean();

    public IdentityIndex build(Decl root) {
        if (!inUse.compareAndSet(false, true)) {
            throw new IllegalStateException("Identity indexer is already building an index");
        }
        try {
            reset();
            AstTraversal.walk(root, new Collector());
            IdentityIndex index = IdentityIndex.builder()
                    .declarations(declarations)
                    .statements(statements)
                    .types(types)
                    .build();
            log.debug("Indexed {} declarations, {} statements, {} types",
                    declarations.size(), statements.size(), types.size());
            return index;
        } finally {
            reset();
            inUse.set(false);
        }
    }

    public void reset() {
        declarations.clear();
        statements.clear();
        types.clear();
    }

    private class Collector implements NodeVisitor {

        @Override
        public void visitDecl(Decl decl) {
            declarations.put(decl.getId(), decl);
        }

        @Override
        public void visitStmt(Stmt stmt) {
            statements.put(stmt.getId(), stmt);
        }

        @Override
        public void visitType(Type type) {
            types.put(type.getId(), type);
        }
    }
}
