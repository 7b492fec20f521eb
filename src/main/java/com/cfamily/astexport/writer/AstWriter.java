package com.cfamily.astexport.writer;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * Scoped, arity-pre-declared emission protocol.
 * <p>
 * Every scope states up front how many values it will hold. Each scalar, simple variant
 * or nested scope counts as one value of the enclosing scope. Inside an object every value
 * must be preceded by {@link #emitTag(String)}. Call order for an object with one string
 * field and one set flag:
 *
 * <pre>
 * try (Scope o = writer.openObject(2)) {
 *     writer.emitTag("name");
 *     writer.emitString("x");
 *     writer.emitFlag("is_used", true);
 * }
 * </pre>
 *
 * Any deviation from the declared counts raises
 * {@link com.cfamily.astexport.exception.ArityMismatchException}.
 */
public interface AstWriter extends Closeable, Flushable {

    Scope openObject(int fieldCount) throws IOException;

    Scope openArray(int elementCount) throws IOException;

    Scope openTuple(int elementCount) throws IOException;

    /**
     * Opens a tagged variant holding exactly one argument value.
     */
    Scope openVariant(String tag) throws IOException;

    /**
     * Writes a tagged variant without an argument.
     */
    void emitSimpleVariant(String tag) throws IOException;

    /**
     * Names the next value of the enclosing object.
     */
    void emitTag(String name) throws IOException;

    /**
     * Writes {@code name: true} when {@code value} is set, nothing otherwise. Only a set flag
     * counts towards the object's field count.
     */
    void emitFlag(String name, boolean value) throws IOException;

    void emitString(String value) throws IOException;

    void emitInteger(long value) throws IOException;

    void emitBoolean(boolean value) throws IOException;
}
