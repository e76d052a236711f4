package com.tony.nflStats.model.csv;

/**
 * Valeurs manquantes des fichiers nflverse : null, NaN, vide, "NA".
 * Partagé par le nettoyage PBP, la lecture playstats et les tables de dimension.
 */
public final class MissingValues {

    private MissingValues() {
    }

    public static boolean isMissing(Object value) {
        if (value == null) return true;
        if (value instanceof Double && ((Double) value).isNaN()) return true;
        if (value instanceof String) {
            String s = ((String) value).trim();
            return s.isEmpty() || "NA".equals(s) || "NaN".equalsIgnoreCase(s);
        }
        return false;
    }

    /**
     * Texte nettoyé, ou null si manquant.
     */
    public static String text(Object value) {
        return isMissing(value) ? null : value.toString().trim();
    }

    /**
     * Nombre décimal, ou null si manquant ou illisible ("TRUE"/"FALSE" valent 1/0).
     */
    public static Double parseDouble(Object value) {
        if (isMissing(value)) return null;
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value instanceof Boolean) return ((Boolean) value) ? 1.0 : 0.0;

        String s = value.toString().trim();
        if ("true".equalsIgnoreCase(s)) return 1.0;
        if ("false".equalsIgnoreCase(s)) return 0.0;
        try {
            double parsed = Double.parseDouble(s);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // "12.0" -> 12
    public static Integer parseInteger(Object value) {
        Double parsed = parseDouble(value);
        return parsed != null ? parsed.intValue() : null;
    }
}
