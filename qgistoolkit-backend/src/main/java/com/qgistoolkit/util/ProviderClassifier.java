package com.qgistoolkit.util;

/**
 * Guesses the data provider of a layer from its datasource string.
 */
public final class ProviderClassifier {

    private ProviderClassifier() {
    }

    public static String classify(String datasource) {
        if (datasource == null) {
            return "other";
        }
        int marker = datasource.indexOf("provider=");
        if (marker >= 0) {
            String rest = datasource.substring(marker + "provider=".length()).trim();
            String token = rest.isEmpty() ? "" : rest.split("\\s+")[0];
            token = token.replaceAll("^['\"]+|['\"]+$", "");
            if (!token.isEmpty()) {
                return token;
            }
        }
        if (datasource.contains("postgres://") || datasource.contains("host=")) {
            return "postgres";
        }
        if (datasource.endsWith(".shp") || datasource.contains("ogr:")) {
            return "ogr";
        }
        return "other";
    }
}
