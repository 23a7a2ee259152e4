package com.campaignkeeper.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SaveFileNames")
class SaveFileNamesTest {

    @Test
    @DisplayName("Should slug campaign names")
    void shouldSlugNames() {
        assertEquals("the-lost-mine-of-phandelver", SaveFileNames.slug("The Lost Mine of Phandelver!"));
        assertEquals("curse-of-strahd", SaveFileNames.slug("  Curse_of  Strahd "));
        assertEquals("campaign", SaveFileNames.slug("???"));
    }

    @Test
    @DisplayName("Should name saves by slug and UTC timestamp without colons")
    void shouldBuildFileName() {
        String name = SaveFileNames.fileName("Lost Mines", Instant.parse("2026-03-01T18:05:09Z"));

        assertEquals("lost-mines_2026-03-01T18-05-09Z.dnd-save.md", name);
        assertEquals("lost-mines", SaveFileNames.slugOf(Path.of(name)));
        assertTrue(SaveFileNames.isSaveFile(Path.of("saves", name)));
    }

    @Test
    @DisplayName("Should not recognize other files")
    void shouldIgnoreOtherFiles() {
        assertFalse(SaveFileNames.isSaveFile(Path.of("notes.md")));
        assertNull(SaveFileNames.slugOf(Path.of("notes.md")));
        assertNull(SaveFileNames.slugOf(Path.of("nounderscore.dnd-save.md")));
    }
}
