package drimble;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlUtilTest {

    @Test
    void articleFilenameIsIndexSlugAndHash() {
        String name = UrlUtil.toArticleFilename(3, "Vuurwerkbom ontploft in Café 't Hoekje!", "https://drimble.nl/a");

        assertTrue(name.startsWith("0003_vuurwerkbom-ontploft-in-cafe-t-hoekje_"));
        assertTrue(name.endsWith(".json"));
        assertEquals(name, UrlUtil.toArticleFilename(3, "Vuurwerkbom ontploft in Café 't Hoekje!", "https://drimble.nl/a"));
    }

    @Test
    void slugFallsBackWhenTitleIsMissingOrUnusable() {
        assertEquals("untitled", UrlUtil.slug(null));
        assertEquals("untitled", UrlUtil.slug("!!!"));
        assertTrue(UrlUtil.slug("a".repeat(200)).length() <= 48);
    }

    @Test
    void normalizeDropsFragmentAndLowercasesHost() {
        assertEquals("https://drimble.nl/nieuws/1?x=1", UrlUtil.normalize("HTTPS://Drimble.NL/nieuws/./1?x=1#reacties"));
        assertEquals("https://drimble.nl/", UrlUtil.normalize("https://drimble.nl"));
        assertEquals("https://drimble.nl/a%20b", UrlUtil.normalize("https://drimble.nl/a%20b"));
    }

    @Test
    void sameHostIgnoresWwwPrefix() {
        assertTrue(UrlUtil.sameHost("https://www.drimble.nl/a", "https://drimble.nl/b"));
        assertFalse(UrlUtil.sameHost("https://nos.nl/a", "https://drimble.nl/b"));
        assertFalse(UrlUtil.sameHost("not a url", "https://drimble.nl/b"));
    }

    @Test
    void cleanHrefRejectsNonNavigableLinks() {
        assertNull(UrlUtil.cleanHref("javascript:void(0)"));
        assertNull(UrlUtil.cleanHref("mailto:redactie@drimble.nl"));
        assertNull(UrlUtil.cleanHref("#top"));
        assertNull(UrlUtil.cleanHref("   "));
        assertEquals("/nieuws/1", UrlUtil.cleanHref(" '/nieuws/1' "));
    }

    @Test
    void searchPageUrlEncodesKeyword() {
        assertEquals("https://drimble.nl/zoeken.html?q=vuurwerk&page=2",
                UrlUtil.searchPageUrl("https://drimble.nl/", "zoeken.html", "vuurwerk", 2));
        assertEquals("https://drimble.nl/zoeken.html?q=oud+en+nieuw&page=1",
                UrlUtil.searchPageUrl("https://drimble.nl", "/zoeken.html", "oud en nieuw", 1));
    }
}
