package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ExportConfigurationException;
import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.writer.OutputFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ExporterOptionsValidatorTest {

    private final ExporterOptionsValidator validator = new ExporterOptionsValidator();

    @Test
    void testDefaultsAreValid() {
        assertThatCode(() -> validator.validate(ExporterOptions.defaults())).doesNotThrowAnyException();
    }

    @Test
    void testAllProblemsAreReported() {
        ExporterOptions options = ExporterOptions.builder()
                .pathNormalizer(null)
                .format(null)
                .build();

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(ExportConfigurationException.class,
                        e -> assertThat(e.getErrors()).hasSize(2));
    }

    @Test
    void testMissingOptionsAreRejected() {
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(ExportConfigurationException.class);
    }

    @Test
    void testIgnoredSettingsOnlyWarn() {
        ExporterOptions options = ExporterOptions.builder()
                .format(OutputFormat.CBOR)
                .prettyPrint(true)
                .identityTable(new IdentityTable())
                .build();

        assertThatCode(() -> validator.validate(options)).doesNotThrowAnyException();
    }

    @Test
    void testExporterValidatesOnConstruction() {
        ExporterOptions options = ExporterOptions.builder().format(null).build();

        assertThatThrownBy(() -> new AstExporter(options)).isInstanceOf(ExportConfigurationException.class);
    }

    @Test
    void testIdentityTableRenumbersInEncounterOrder() {
        IdentityTable table = new IdentityTable();
        IdentityEncoder encoder = new IdentityEncoder(false, table);

        assertThat(encoder.encode(NodeId.of(0x500))).isEqualTo("0");
        assertThat(encoder.encode(NodeId.of(0x100))).isEqualTo("1");
        assertThat(encoder.encode(NodeId.of(0x500))).isEqualTo("0");
        assertThat(encoder.encode(null)).isEqualTo("2");
        assertThat(table.size()).isEqualTo(3);
    }
}
