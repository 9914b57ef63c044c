package drimble;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.Normalizer;
import java.util.Locale;

public final class UrlUtil {

    private static final int MAX_SLUG_LENGTH = 48;

    private UrlUtil() {
    }

    // Deterministic JSON filename: <index>_<slug>_<hash>.json
    // The hash of the URL keeps two articles with the same title apart.
    public static String toArticleFilename(int index, String title, String url) {
        return String.format(Locale.ROOT, "%04d_%s_%s.json", index, slug(title), shortHash(url));
    }

    // Lowercase ASCII slug of a title, "untitled" when nothing usable is left.
    public static String slug(String title) {
        if (title == null) return "untitled";
        String ascii = Normalizer.normalize(title, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase(Locale.ROOT);
        String safe = ascii.replaceAll("[^a-z0-9]+", "-");
        if (safe.length() > MAX_SLUG_LENGTH) {
            safe = safe.substring(0, MAX_SLUG_LENGTH);
        }
        safe = safe.replaceAll("^-+|-+$", "");
        return safe.isEmpty() ? "untitled" : safe;
    }

    // Short SHA-256 prefix used in filenames.
    public static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest((s == null ? "" : s).getBytes(StandardCharsets.UTF_8));
            // 12 hex chars
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // Normalize URL path and strip fragments to reduce duplicates.
    public static String normalize(String url) {
        try {
            URI uri = new URI(url).normalize();
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return stripFragment(uri.toString());
            }
            // Raw components so existing %-escapes are kept as they are; fragment (#...) dropped
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            return uri.getScheme().toLowerCase(Locale.ROOT) + "://"
                    + uri.getRawAuthority().toLowerCase(Locale.ROOT)
                    + path
                    + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());
        } catch (URISyntaxException e) {
            return stripFragment(url);
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash < 0 ? url : url.substring(0, hash);
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        if (url == null) return false;
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    // True when both URLs point at the same host (www. prefix ignored).
    public static boolean sameHost(String a, String b) {
        String hostA = host(a);
        String hostB = host(b);
        return hostA != null && hostA.equals(hostB);
    }

    static String host(String url) {
        try {
            String host = new URI(url).getHost();
            if (host == null) return null;
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // Trim and sanitize raw href strings from HTML.
    public static String cleanHref(String href) {
        if (href == null) return null;
        String s = href.trim();
        if (s.isEmpty()) return null;

        // Strip surrounding quotes if present
        if ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'"))) {
            s = s.substring(1, s.length() - 1).trim();
        }

        String lowered = s.toLowerCase(Locale.ROOT);
        if (lowered.startsWith("mailto:") || lowered.startsWith("javascript:") || lowered.startsWith("#")) {
            return null;
        }

        // Drop trailing quote/angle bracket artifacts
        while (s.endsWith("\"") || s.endsWith("'") || s.endsWith(">")) {
            s = s.substring(0, s.length() - 1).trim();
        }

        return s.isEmpty() ? null : s;
    }

    // Resolves relative links like "/nieuws/x" into absolute "https://drimble.nl/nieuws/x"
    public static String resolveAgainst(String baseUrl, String href) {
        try {
            URI base = new URI(baseUrl);
            URI rel = new URI(href.replace(" ", "%20"));
            return base.resolve(rel).toString();
        } catch (Exception e) {
            // Bad hrefs exist in the wild; just skip them
            return null;
        }
    }

    // Search page URL: <base><path>?q=<keyword>&page=<n>
    public static String searchPageUrl(String baseUrl, String searchPath, String keyword, int page) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = searchPath.startsWith("/") ? searchPath : "/" + searchPath;
        return base + path
                + "?q=" + URLEncoder.encode(keyword, StandardCharsets.UTF_8)
                + "&page=" + page;
    }
}
