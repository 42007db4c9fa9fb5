package me.christianrobert.ilcodegen.codegen.naming;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReservedWordsTest {

    @Test
    void caseSensitiveSetOnlyMatchesExactSpelling() {
        ReservedWords words = ReservedWords.caseSensitive(List.of("class", "delete"));

        assertTrue(words.isReserved("class"));
        assertFalse(words.isReserved("Class"));
        assertEquals("delete_", words.escape("delete"));
        assertEquals("Delete", words.escape("Delete"));
    }

    @Test
    void caseInsensitiveSetMatchesAnySpelling() {
        ReservedWords words = ReservedWords.caseInsensitive(List.of("begin", "end"));

        assertTrue(words.isReserved("Begin"));
        assertTrue(words.isReserved("END"));
        assertEquals("End_", words.escape("End"));
        assertEquals(2, words.size());
    }

    @Test
    void nullAndEmptyAreNeverReserved() {
        ReservedWords words = ReservedWords.caseSensitive(List.of("int"));

        assertFalse(words.isReserved(null));
        assertFalse(words.isReserved(""));
    }
}
