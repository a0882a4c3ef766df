package tree.ukkonen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UkkonenConfigurationTest {

    @Test
    public void testDefaults() {
        UkkonenConfiguration defaults = UkkonenConfiguration.defaults();
        assertTrue(defaults.collectStats());
        assertEquals(0, defaults.progressInterval());
        assertEquals(3, defaults.indentWidth());
        assertEquals("inf", defaults.openEndToken());
        assertSame(defaults, UkkonenConfiguration.defaults());
    }

    @Test
    public void testToBuilderCopiesEveryField() {
        UkkonenConfiguration configuration = UkkonenConfiguration.builder()
                .collectStats(false)
                .progressInterval(1000)
                .indentWidth(2)
                .openEndToken("oo")
                .build();
        UkkonenConfiguration copy = configuration.toBuilder().build();

        assertFalse(copy.collectStats());
        assertEquals(1000, copy.progressInterval());
        assertEquals(2, copy.indentWidth());
        assertEquals("oo", copy.openEndToken());
    }

    @Test
    public void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> UkkonenConfiguration.builder().indentWidth(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> UkkonenConfiguration.builder().progressInterval(-5).build());
        assertThrows(IllegalArgumentException.class,
                () -> UkkonenConfiguration.builder().openEndToken("").build());
        assertThrows(IllegalArgumentException.class,
                () -> UkkonenConfiguration.builder().openEndToken(null).build());
    }

    @Test
    public void testProgressLoggingDoesNotChangeTheTree() {
        UkkonenConfiguration configuration = UkkonenConfiguration.builder().progressInterval(2).build();
        assertEquals(SuffixTree.build("mississippi$").toDebugString(),
                SuffixTree.build("mississippi$", configuration).toDebugString());
    }
}
