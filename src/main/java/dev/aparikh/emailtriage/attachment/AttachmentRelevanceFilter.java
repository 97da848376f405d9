package dev.aparikh.emailtriage.attachment;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tells real attachments apart from decoration such as signature images, logos and inline banners.
 * <p>
 * Rules apply in order and the first match decides: no filename, decorative MIME type, decorative
 * filename, document extension, image heuristics, then everything else is kept. Documents are
 * always kept; images only when their name suggests real content.
 */
public final class AttachmentRelevanceFilter {

    static final Set<String> DECORATIVE_MIME_TYPES = Set.of(
            "image/gif",
            "image/x-icon",
            "image/vnd.microsoft.icon",
            "image/bmp"
    );

    static final List<Pattern> DECORATIVE_NAMES = List.of(
            Pattern.compile("^image\\d*\\."),   // image001.png, image.gif
            Pattern.compile("^logo"),
            Pattern.compile("^signature"),
            Pattern.compile("^icon"),
            Pattern.compile("^banner"),
            Pattern.compile("^footer"),
            Pattern.compile("^header"),
            Pattern.compile("_signature\\."),
            Pattern.compile("_logo\\.")
    );

    static final Set<String> DOCUMENT_EXTENSIONS = Set.of(
            "pdf", "doc", "docx", "xls", "xlsx", "csv", "txt", "ppt", "pptx", "rtf", "odt", "ods", "zip", "rar"
    );

    static final List<String> MEANINGFUL_IMAGE_WORDS = List.of(
            "invoice", "receipt", "document", "scan", "contract", "report", "screenshot"
    );

    private static final int MIN_MEANINGFUL_IMAGE_NAME = 10;

    private AttachmentRelevanceFilter() {
    }

    public static boolean isRelevant(String filename, String mimeType) {
        if (filename == null || filename.isBlank()) return false;

        String name = filename.trim().toLowerCase(Locale.ROOT);
        String mime = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);

        if (DECORATIVE_MIME_TYPES.contains(mime)) return false;
        if (DECORATIVE_NAMES.stream().anyMatch(p -> p.matcher(name).find())) return false;
        if (DOCUMENT_EXTENSIONS.contains(extension(name))) return true;

        if (mime.startsWith("image/")) {
            return name.length() >= MIN_MEANINGFUL_IMAGE_NAME
                    && MEANINGFUL_IMAGE_WORDS.stream().anyMatch(name::contains);
        }
        return true;
    }

    /**
     * Lower-cased text after the last dot, or empty when there is none.
     */
    public static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return "";
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
