package io.clubone.outreach.outreach.util;

/**
 * Normalizes contact addresses before they reach a provider.
 */
public final class ContactSanitizer {

    private ContactSanitizer() {
    }

    /**
     * Keeps digits and a single leading '+'.
     * @return sanitized phone, or null when nothing usable remains
     */
    public static String sanitizePhone(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String cleaned = raw.trim().replaceAll("[^\\d+]", "");
        if (cleaned.startsWith("+")) {
            cleaned = "+" + cleaned.substring(1).replace("+", "");
        } else {
            cleaned = cleaned.replace("+", "");
        }
        return cleaned.isEmpty() || "+".equals(cleaned) ? null : cleaned;
    }

    public static String normalizeEmail(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String email = raw.trim().toLowerCase();
        return email.contains("@") ? email : null;
    }
}
