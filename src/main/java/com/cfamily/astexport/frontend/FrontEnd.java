package com.cfamily.astexport.frontend;

import com.cfamily.astexport.model.decl.TranslationUnitDecl;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source of translation units. Implementations are discovered through
 * {@link java.util.ServiceLoader} and must have a public no-argument constructor.
 */
public interface FrontEnd {

    /** Short name used to select the front end on the command line. */
    String name();

    boolean supports(Path source);

    /**
     * Parses {@code source} into a translation unit whose {@code types} list holds every type
     * the unit registered, in creation order.
     */
    TranslationUnitDecl parse(Path source) throws IOException;
}
