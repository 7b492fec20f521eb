package com.cfamily.astexport.writer;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Creates writers for an output format. The target stream stays open when the writer is
 * closed; its owner closes it.
 */
public class AstWriterFactory {

    private final JsonFactory jsonFactory = new JsonFactory();
    private final CBORFactory cborFactory = new CBORFactory();

    public AstWriter create(OutputStream out, OutputFormat format, boolean prettyPrint) throws IOException {
        JsonGenerator generator = switch (format) {
            case JSON -> {
                JsonGenerator json = jsonFactory.createGenerator(out, JsonEncoding.UTF8);
                if (prettyPrint) {
                    json.useDefaultPrettyPrinter();
                }
                yield json;
            }
            case CBOR -> cborFactory.createGenerator(out);
        };
        generator.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        return new JacksonAstWriter(generator);
    }
}
