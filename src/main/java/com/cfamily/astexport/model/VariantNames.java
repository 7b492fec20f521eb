package com.cfamily.astexport.model;

import java.util.Locale;

/**
 * Naming rules shared by the writer dispatchers and the schema generator.
 */
public final class VariantNames {

    private VariantNames() {
        // Utility class
    }

    /**
     * {@code PRIVATE_EXTERN} becomes {@code PrivateExtern}.
     */
    public static String of(Enum<?> constant) {
        StringBuilder sb = new StringBuilder();
        for (String part : constant.name().split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * {@code CXXRecordDecl} becomes {@code cxx_record_decl}.
     */
    public static String toSnakeCase(String variantName) {
        return variantName
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase(Locale.ROOT);
    }
}
