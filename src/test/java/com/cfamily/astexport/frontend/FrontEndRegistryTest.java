package com.cfamily.astexport.frontend;

import com.cfamily.astexport.model.decl.TranslationUnitDecl;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FrontEndRegistryTest {

    @Test
    void testLoadDiscoversRegisteredFrontEnds() {
        FrontEndRegistry registry = FrontEndRegistry.load();

        assertThat(registry.isEmpty()).isFalse();
        assertThat(registry.getFrontEnds()).extracting(FrontEnd::name).contains("fixture");
    }

    @Test
    void testSelectByNameIgnoresCase() {
        FrontEndRegistry registry = new FrontEndRegistry(List.of(new FixtureFrontEnd(), new NamedFrontEnd("clang")));

        assertThat(registry.select("CLANG", Path.of("a.fixture")))
                .get()
                .extracting(FrontEnd::name)
                .isEqualTo("clang");
        assertThat(registry.byName("gcc")).isEmpty();
    }

    @Test
    void testSelectWithoutNamePicksFirstSupporting() {
        FrontEndRegistry registry = new FrontEndRegistry(List.of(new NamedFrontEnd("clang"), new FixtureFrontEnd()));

        assertThat(registry.select(null, Path.of("/tmp/a.fixture")))
                .get()
                .extracting(FrontEnd::name)
                .isEqualTo("fixture");
        assertThat(registry.select(" ", Path.of("/tmp/a.c"))).isEmpty();
    }

    @Test
    void testEmptyRegistry() {
        FrontEndRegistry registry = new FrontEndRegistry(List.of());

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.select(null, Path.of("a.fixture"))).isEmpty();
    }

    private static final class NamedFrontEnd implements FrontEnd {

        private final String name;

        NamedFrontEnd(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean supports(Path source) {
            return false;
        }

        @Override
        public TranslationUnitDecl parse(Path source) {
            throw new UnsupportedOperationException("parse");
        }
    }
}
