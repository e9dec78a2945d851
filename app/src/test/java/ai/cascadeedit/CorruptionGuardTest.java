package ai.cascadeedit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CorruptionGuardTest {

    @Test
    void testOrdinaryCodeIsClean() {
        assertFalse(CorruptionGuard.hasActionTagCorruption("int x = 1;\nreturn x;"));
        assertFalse(CorruptionGuard.hasActionTagCorruption(""));
    }

    @Test
    void testFewerThanThreeDistinctTagsIsClean() {
        assertFalse(CorruptionGuard.hasActionTagCorruption("// see <bash> docs\n<say>hi"));
        // repeating one tag does not count as several
        assertFalse(CorruptionGuard.hasActionTagCorruption("<end> <end> <end> <end>"));
    }

    @Test
    void testLeakedTranscriptIsDetected() {
        var leaked = """
                fixed();
                </edit>
                <say>Done, now running the tests</say>
                <bash>mvn test</bash>
                """;
        assertTrue(CorruptionGuard.hasActionTagCorruption(leaked));
    }

    @Test
    void testDetectionIgnoresCase() {
        assertTrue(CorruptionGuard.hasActionTagCorruption("<EDIT PATH=\"a.txt\">x</Edit><END>"));
    }

    @Test
    void testEditTagWithLooseSpacingIsDetected() {
        assertTrue(CorruptionGuard.hasActionTagCorruption("<edit  path =\"a.txt\">\nx\n<end>\n<say>done</say>"));
        assertTrue(CorruptionGuard.hasActionTagCorruption("<edit\tpath=\"a.txt\"><bash>ls</bash></edit>"));
        // "<editpath=" is not the edit tag
        assertFalse(CorruptionGuard.hasActionTagCorruption("<editpath=\"a.txt\"><end><say>"));
    }
}
