package com.cfamily.astexport.writer;

import com.cfamily.astexport.exception.ArityMismatchException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Count bookkeeping for {@link AstWriter}; subclasses only encode.
 */
public abstract class AbstractAstWriter implements AstWriter {

    private final Deque<Frame> frames = new ArrayDeque<>();
    private boolean rootWritten;

    @Override
    public Scope openObject(int fieldCount) throws IOException {
        Frame frame = open(ScopeKind.OBJECT, fieldCount);
        writeStartObject(fieldCount);
        return () -> closeScope(frame);
    }

    @Override
    public Scope openArray(int elementCount) throws IOException {
        Frame frame = open(ScopeKind.ARRAY, elementCount);
        writeStartArray(elementCount);
        return () -> closeScope(frame);
    }

    @Override
    public Scope openTuple(int elementCount) throws IOException {
        Frame frame = open(ScopeKind.TUPLE, elementCount);
        writeStartTuple(elementCount);
        return () -> closeScope(frame);
    }

    @Override
    public Scope openVariant(String tag) throws IOException {
        Frame frame = open(ScopeKind.VARIANT, 1);
        writeStartVariant(tag);
        return () -> closeScope(frame);
    }

    @Override
    public void emitSimpleVariant(String tag) throws IOException {
        beforeValue();
        writeSimpleVariant(tag);
    }

    @Override
    public void emitTag(String name) throws IOException {
        Frame top = frames.peek();
        if (top == null || top.kind != ScopeKind.OBJECT) {
            throw new ArityMismatchException("Tag '" + name + "' emitted outside an object");
        }
        if (top.tagPending) {
            throw new ArityMismatchException("Tag '" + name + "' emitted while a previous tag awaits its value");
        }
        top.tagPending = true;
        writeTag(name);
    }

    @Override
    public void emitFlag(String name, boolean value) throws IOException {
        if (value) {
            emitTag(name);
            emitBoolean(true);
        }
    }

    @Override
    public void emitString(String value) throws IOException {
        beforeValue();
        writeString(value == null ? "" : value);
    }

    @Override
    public void emitInteger(long value) throws IOException {
        beforeValue();
        writeInteger(value);
    }

    @Override
    public void emitBoolean(boolean value) throws IOException {
        beforeValue();
        writeBoolean(value);
    }

    /**
     * Number of scopes currently open.
     */
    public int depth() {
        return frames.size();
    }

    private Frame open(ScopeKind kind, int declared) {
        if (declared < 0) {
            throw new ArityMismatchException("Negative size " + declared + " declared for " + kind);
        }
        beforeValue();
        Frame frame = new Frame(kind, declared);
        frames.push(frame);
        return frame;
    }

    private void beforeValue() {
        Frame top = frames.peek();
        if (top == null) {
            if (rootWritten) {
                throw new ArityMismatchException("Second root value emitted");
            }
            rootWritten = true;
            return;
        }
        if (top.kind == ScopeKind.OBJECT && !top.tagPending) {
            throw new ArityMismatchException("Object field emitted without a tag");
        }
        if (top.emitted >= top.declared) {
            throw new ArityMismatchException(
                    top.kind + " declared " + top.declared + " values but received more");
        }
        top.emitted++;
        top.tagPending = false;
    }

    private void closeScope(Frame frame) throws IOException {
        if (frames.peek() != frame) {
            throw new ArityMismatchException("Closing " + frame.kind + " that is not the innermost open scope");
        }
        if (frame.emitted != frame.declared) {
            throw new ArityMismatchException(
                    frame.kind + " declared " + frame.declared + " values but received " + frame.emitted);
        }
        if (frame.tagPending) {
            throw new ArityMismatchException("Object closed with a dangling tag");
        }
        frames.pop();
        writeEnd(frame.kind);
    }

    protected abstract void writeStartObject(int fieldCount) throws IOException;

    protected abstract void writeStartArray(int elementCount) throws IOException;

    protected abstract void writeStartTuple(int elementCount) throws IOException;

    protected abstract void writeStartVariant(String tag) throws IOException;

    protected abstract void writeEnd(ScopeKind kind) throws IOException;

    protected abstract void writeSimpleVariant(String tag) throws IOException;

    protected abstract void writeTag(String name) throws IOException;

    protected abstract void writeString(String value) throws IOException;

    protected abstract void writeInteger(long value) throws IOException;

    protected abstract void writeBoolean(boolean value) throws IOException;

    private static final class Frame {
        private final ScopeKind kind;
        private final int declared;
        private int emitted;
        private boolean tagPending;

        private Frame(ScopeKind kind, int declared) {
            this.kind = kind;
            this.declared = declared;
        }
    }
}
