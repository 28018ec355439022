package ai.gameadvisor.backend.repository;

import java.util.Locale;

/**
 * Conversion between float arrays and pgvector text literals like {@code [0.1,0.2,0.3]}.
 */
public final class PgVectors {

    private PgVectors() {
    }

    public static String toLiteral(float[] values) {
        if (values == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(values.length * 10);
        sb.append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(Float.toString(values[i]));
        }
        return sb.append(']').toString();
    }

    public static float[] fromLiteral(String literal) {
        if (literal == null) {
            return null;
        }
        String body = literal.trim();
        if (!body.startsWith("[") || !body.endsWith("]")) {
            throw new IllegalArgumentException("Not a vector literal: " + literal);
        }
        body = body.substring(1, body.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] values = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = Float.parseFloat(parts[i].trim().toLowerCase(Locale.ROOT));
        }
        return values;
    }
}
