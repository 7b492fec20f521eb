package com.cfamily.astexport.frontend;

import com.cfamily.astexport.AstFixtures;
import com.cfamily.astexport.model.decl.TranslationUnitDecl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Front end for {@code *.fixture} files: every file parses to the sample unit, with the
 * file itself as main file. Registered in {@code META-INF/services}.
 */
public class FixtureFrontEnd implements FrontEnd {

    @Override
    public String name() {
        return "fixture";
    }

    @Override
    public boolean supports(Path source) {
        return source.getFileName().toString().endsWith(".fixture");
    }

    @Override
    public TranslationUnitDecl parse(Path source) throws IOException {
        if (!Files.isReadable(source)) {
            throw new IOException("Cannot read " + source);
        }
        return new AstFixtures().sampleUnit(source.toAbsolutePath().normalize().toString());
    }
}
