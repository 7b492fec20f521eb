package com.cfamily.astexport.export;

import com.cfamily.astexport.exception.ExportConfigurationException;
import com.cfamily.astexport.writer.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class ExporterOptionsValidator {

    private static final Logger log = LoggerFactory.getLogger(ExporterOptionsValidator.class);

    public void validate(ExporterOptions o) {
        List<String> errors = new ArrayList<>();

        if (o == null) {
            throw new ExportConfigurationException(List.of("Exporter options are required."));
        }
        if (o.getPathNormalizer() == null) {
            errors.add("A path normalizer is required; use PathNormalizer.identity() to keep paths as is.");
        }
        if (o.getFormat() == null) {
            errors.add("An output format is required.");
        }

        if (!errors.isEmpty()) {
            throw new ExportConfigurationException(errors);
        }

        if (o.isPrettyPrint() && o.getFormat() == OutputFormat.CBOR) {
            log.warn("Pretty printing has no effect on {} output", o.getFormat());
        }
        if (o.isEmitRawIdentities() && o.getIdentityTable().isPresent()) {
            log.warn("Identity table supplied but raw identities are enabled; the table is not used");
        }
    }
}
