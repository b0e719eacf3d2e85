package probe.payload;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PayloadLibraryTest {

    @Test
    void testDefaultsCoverEveryCategory() {
        PayloadLibrary library = PayloadLibrary.defaults();

        for (PayloadCategory category : PayloadCategory.values()) {
            assertFalse(library.get(category).isEmpty(), category + " has no default payloads");
        }
        assertEquals("'", library.get(PayloadCategory.SQL).get(0));
        assertTrue(library.get(PayloadCategory.SQL).contains("' OR '1'='1"));
    }

    @Test
    void testSelectKeepsCategoryThenValueOrder() {
        Map<String, List<String>> document = new LinkedHashMap<>();
        document.put("xss", List.of("<x>", "<y>"));
        document.put("sql", List.of("'"));
        PayloadLibrary library = PayloadLibrary.fromDocument(document);

        List<Payload> selected = library.select(Set.of(PayloadCategory.XSS, PayloadCategory.SQL));

        assertEquals(List.of(
            new Payload(PayloadCategory.SQL, "'"),
            new Payload(PayloadCategory.XSS, "<x>"),
            new Payload(PayloadCategory.XSS, "<y>")), selected);
    }

    @Test
    void testEmptySelectionMeansAll() {
        PayloadLibrary library = PayloadLibrary.defaults();

        assertEquals(library.size(), library.select(List.of()).size());
        assertEquals(library.all(), library.select(null));
    }

    @Test
    void testUnknownCategoryInDocumentIsRejected() {
        Map<String, List<String>> document = Map.of("ldap", List.of("*"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> PayloadLibrary.fromDocument(document));
        assertTrue(e.getMessage().contains("ldap"));
    }

    @Test
    void testNullPayloadIsRejected() {
        List<String> values = new ArrayList<>(Arrays.asList("ok", null));

        assertThrows(IllegalArgumentException.class,
            () -> PayloadLibrary.fromDocument(Map.of("sql", values)));
    }

    @Test
    void testDocumentRoundTripKeepsMissingCategoriesEmpty() {
        PayloadLibrary library = PayloadLibrary.fromDocument(Map.of("command_injection", List.of("; id")));

        Map<String, List<String>> document = library.toDocument();

        assertEquals(List.of("; id"), document.get("command_injection"));
        assertEquals(List.of(), document.get("sql"));
        assertEquals(1, library.size());
    }

    @Test
    void testWithPayloadReturnsCopy() {
        PayloadLibrary original = PayloadLibrary.defaults();

        PayloadLibrary extended = original.withPayload(PayloadCategory.XSS, "<details open ontoggle=alert(1)>");

        assertEquals(original.size() + 1, extended.size());
        assertEquals("<details open ontoggle=alert(1)>",
            extended.get(PayloadCategory.XSS).get(extended.get(PayloadCategory.XSS).size() - 1));
        assertFalse(original.get(PayloadCategory.XSS).contains("<details open ontoggle=alert(1)>"));
    }

    @Test
    void testCategoryKeys() {
        assertEquals(PayloadCategory.PATH_TRAVERSAL, PayloadCategory.fromKey("Path-Traversal"));
        assertEquals(PayloadCategory.SQL, PayloadCategory.fromKey(" SQL "));
        assertThrows(IllegalArgumentException.class, () -> PayloadCategory.fromKey("nosql"));
        assertEquals("sql, xss, path_traversal, command_injection", PayloadCategory.validKeys());
    }
}
