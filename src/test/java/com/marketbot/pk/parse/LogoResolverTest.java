package com.marketbot.pk.parse;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogoResolverTest {

    private final LogoResolver resolver = new LogoResolver("https://dps.psx.com.pk", Map.of("HBL", "hbl.com"));

    @Test
    void resolve_shouldPreferPageImage() {
        Document doc = Jsoup.parse("<div class='company-header'><img src='//cdn.example.com/hbl.png'></div>");

        assertEquals("https://cdn.example.com/hbl.png", resolver.resolve(doc, "HBL"));
    }

    @Test
    void resolve_shouldSkipImagesWithoutSource() {
        Document doc = Jsoup.parse("<img class='quote__logo' src=''><img class='company__logo' src='logo/x.png'>");

        assertEquals("https://dps.psx.com.pk/logo/x.png", resolver.resolve(doc, "XYZ"));
    }

    @Test
    void resolve_shouldUseKnownWebsiteWhenPageHasNoLogo() {
        Document doc = Jsoup.parse("<p>no logo</p>");

        assertEquals("https://logo.clearbit.com/hbl.com", resolver.resolve(doc, "hbl"));
    }

    @Test
    void resolve_shouldFallBackToMonogram() {
        String url = resolver.resolve(Jsoup.parse("<p></p>"), "ENGRO");

        assertTrue(url.startsWith("https://ui-avatars.com/api/?name=EN&background="));
        assertEquals(url, LogoResolver.placeholderUrl("engro"));
    }

    @Test
    void isPlaceholder_shouldOnlyFlagGeneratedOrMissingLogos() {
        assertTrue(LogoResolver.isPlaceholder(null));
        assertTrue(LogoResolver.isPlaceholder(" "));
        assertTrue(LogoResolver.isPlaceholder(LogoResolver.placeholderUrl("ABC")));
        assertTrue(LogoResolver.isPlaceholder("https://via.placeholder.com/128"));
        assertFalse(LogoResolver.isPlaceholder("https://logo.clearbit.com/hbl.com"));
    }
}
