package com.cfamily.astexport.export;

import com.cfamily.astexport.model.decl.Decl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Skips declarations from files another translation unit already exported.
 * <p>
 * The first unit whose declarations come from a header claims it; later units drop their
 * copies of that header's declarations. A unit's main file and declarations without a
 * location are always kept. Files are compared after normalization, so one header
 * spelled two ways is claimed once. One instance spans all units of a run.
 */
public class FileDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(FileDeduplicator.class);

    private final Map<String, String> owners = new HashMap<>();
    private String currentUnit = "";
    private PathNormalizer normalizer = PathNormalizer.identity();

    public void beginUnit(String mainFile) {
        beginUnit(mainFile, PathNormalizer.identity());
    }

    public void beginUnit(String mainFile, PathNormalizer normalizer) {
        this.normalizer = normalizer;
        currentUnit = mainFile == null ? "" : normalizer.normalize(mainFile);
        log.debug("Deduplicating declarations for unit {}", currentUnit);
    }

    public boolean shouldEmit(Decl decl) {
        if (decl == null || decl.getRange() == null) {
            return true;
        }
        String raw = decl.getRange().getFile();
        if (raw == null) {
            return true;
        }
        String file = normalizer.normalize(raw);
        if (file.equals(currentUnit)) {
            return true;
        }
        String owner = owners.putIfAbsent(file, currentUnit);
        return owner == null || owner.equals(currentUnit);
    }

    public int claimedFiles() {
        return owners.size();
    }
}
