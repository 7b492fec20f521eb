package com.cfamily.astexport.writer;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open writer scope. Closing checks that exactly the declared number of values was
 * emitted.
 */
public interface Scope extends Closeable {

    @Override
    void close() throws IOException;
}
