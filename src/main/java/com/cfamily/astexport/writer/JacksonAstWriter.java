package com.cfamily.astexport.writer;

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;

/**
 * {@link AstWriter} over a Jackson streaming generator.
 * <p>
 * Objects map to JSON objects, arrays and tuples to arrays, a variant with argument to
 * {@code ["Tag", value]} and a simple variant to {@code "Tag"}. Declared sizes are passed
 * on to the generator, which binary formats such as CBOR turn into definite-length headers.
 */
public class JacksonAstWriter extends AbstractAstWriter {

    private final JsonGenerator generator;

    public JacksonAstWriter(JsonGenerator generator) {
        this.generator = generator;
    }

    @Override
    protected void writeStartObject(int fieldCount) throws IOException {
        generator.writeStartObject(null, fieldCount);
    }

    @Override
    protected void writeStartArray(int elementCount) throws IOException {
        generator.writeStartArray(null, elementCount);
    }

    @Override
    protected void writeStartTuple(int elementCount) throws IOException {
        generator.writeStartArray(null, elementCount);
    }

    @Override
    protected void writeStartVariant(String tag) throws IOException {
        generator.writeStartArray(null, 2);
        generator.writeString(tag);
    }

    @Override
    protected void writeEnd(ScopeKind kind) throws IOException {
        if (kind == ScopeKind.OBJECT) {
            generator.writeEndObject();
        } else {
            generator.writeEndArray();
        }
    }

    @Override
    protected void writeSimpleVariant(String tag) throws IOException {
        generator.writeString(tag);
    }

    @Override
    protected void writeTag(String name) throws IOException {
        generator.writeFieldName(name);
    }

    @Override
    protected void writeString(String value) throws IOException {
        generator.writeString(value);
    }

    @Override
    protected void writeInteger(long value) throws IOException {
        generator.writeNumber(value);
    }

    @Override
    protected void writeBoolean(boolean value) throws IOException {
        generator.writeBoolean(value);
    }

    @Override
    public void flush() throws IOException {
        generator.flush();
    }

    @Override
    public void close() throws IOException {
        generator.close();
    }
}
