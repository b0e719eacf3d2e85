package probe.bruteforce;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CsrfTokenExtractorTest {

    @Test
    void testExtractsValueAfterFieldName() {
        String body = "<form><input type=\"hidden\" name=\"csrf_token\" value=\"abc123\"></form>";

        assertEquals(Optional.of("abc123"), CsrfTokenExtractor.extract(body, "csrf_token"));
    }

    @Test
    void testValueBeforeNameIsSkippedForNextValue() {
        String body = "<input value=\"wrong\" name=\"token\"><input name=\"other\" value=\"next\">";

        assertEquals(Optional.of("next"), CsrfTokenExtractor.extract(body, "token"));
    }

    @Test
    void testMissingFieldGivesEmpty() {
        assertTrue(CsrfTokenExtractor.extract("<form></form>", "csrf").isEmpty());
    }

    @Test
    void testFieldWithoutValueGivesEmpty() {
        assertTrue(CsrfTokenExtractor.extract("<input name=\"csrf\">", "csrf").isEmpty());
    }

    @Test
    void testUnterminatedValueGivesEmpty() {
        assertTrue(CsrfTokenExtractor.extract("<input name=\"csrf\" value=\"abc", "csrf").isEmpty());
    }

    @Test
    void testEmptyValueIsReturned() {
        assertEquals(Optional.of(""), CsrfTokenExtractor.extract("<input name=\"csrf\" value=\"\">", "csrf"));
    }

    @Test
    void testSingleQuotedMarkupIsNotMatched() {
        assertTrue(CsrfTokenExtractor.extract("<input name='csrf' value='abc'>", "csrf").isEmpty());
    }
}
