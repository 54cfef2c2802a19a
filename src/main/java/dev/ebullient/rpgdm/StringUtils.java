package dev.ebullient.rpgdm;

public class StringUtils {

    private StringUtils() {
    }

    /**
     * Convert a name into a file-name friendly slug.
     */
    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return "untitled";
        }
        String slug = text.toLowerCase()
                .replaceAll("[^a-z0-9\\s_-]", "") // Remove special characters
                .trim()
                .replaceAll("\\s+", "-") // Replace spaces with hyphens
                .replaceAll("-+", "-") // Replace multiple hyphens with single
                .replaceAll("^-|-$", ""); // Remove leading/trailing hyphens
        return slug.isEmpty() ? "untitled" : slug;
    }
}
