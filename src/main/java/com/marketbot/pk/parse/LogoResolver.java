package com.marketbot.pk.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks a logo URL for a company: the image on its page, then a logo service for a known
 * website, then a generated monogram. Never returns null.
 */
public final class LogoResolver {
    private static final List<String> PAGE_SELECTORS = List.of(
            "img.quote__logo",
            "img.company__logo",
            ".quote__header img",
            ".company-header img"
    );
    private static final List<String> PALETTE = List.of(
            "0ea5e9", "8b5cf6", "ec4899", "f97316", "22c55e", "06b6d4", "6366f1", "f43f5e"
    );

    private final String baseUrl;
    private final Map<String, String> websites;

    public LogoResolver(String baseUrl, Map<String, String> websites) {
        String base = baseUrl == null ? "" : baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.baseUrl = base;
        this.websites = websites == null ? Map.of() : Map.copyOf(websites);
    }

    public String resolve(Document doc, String symbol) {
        if (doc != null) {
            for (String selector : PAGE_SELECTORS) {
                Element img = doc.selectFirst(selector);
                if (img == null) {
                    continue;
                }
                String src = img.attr("src").trim();
                if (src.isEmpty()) {
                    continue;
                }
                return absolute(src);
            }
        }
        String key = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        String domain = websites.get(key);
        if (domain != null && !domain.isEmpty()) {
            return "https://logo.clearbit.com/" + domain;
        }
        return placeholderUrl(key);
    }

    public static String placeholderUrl(String symbol) {
        String sym = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        String initials = sym.length() <= 2 ? sym : sym.substring(0, 2);
        int sum = 0;
        for (int i = 0; i < sym.length(); i++) {
            sum += sym.charAt(i);
        }
        String color = PALETTE.get(sum % PALETTE.size());
        return "https://ui-avatars.com/api/?name=" + initials
                + "&background=" + color
                + "&color=fff&size=128&bold=true&format=png";
    }

    /**
     * Whether a stored logo is a generated stand-in that a real logo may replace.
     */
    public static boolean isPlaceholder(String url) {
        if (url == null || url.trim().isEmpty()) {
            return true;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.contains("ui-avatars") || lower.contains("placeholder");
    }

    private String absolute(String src) {
        if (src.startsWith("http://") || src.startsWith("https://")) {
            return src;
        }
        if (src.startsWith("//")) {
            return "https:" + src;
        }
        return baseUrl + (src.startsWith("/") ? src : "/" + src);
    }
}
