package org.example.storybook.service.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.model.BookOutline;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutlineParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OutlineParser parser = new OutlineParser(objectMapper);

    @Test
    void parse_jsonWrappedInProse_extractsObjectAndIgnoresUnknownFields() {
        BookOutline outline = parser.parse("""
                Sure! ```json
                {"bookTitle": " The Snail Race ", "mood": "cheerful",
                 "chapters": [{"chapterNumber": 1, "chapterTitle": "Ready", "chapterSynopses": "Sam trains."}]}
                ```""");

        assertEquals("The Snail Race", outline.bookTitle());
        assertEquals("Sam trains.", outline.chapter(1).chapterSynopses());
    }

    @Test
    void parse_missingOrDuplicateNumbers_renumbersByPosition() {
        BookOutline outline = parser.parse("""
                {"bookTitle": "T", "chapters": [
                  {"chapterNumber": 1, "chapterTitle": "A"},
                  {"chapterNumber": 1, "chapterTitle": "B"},
                  {"chapterTitle": "C"}
                ]}""");

        assertEquals(3, outline.chapters().size());
        assertEquals("B", outline.chapter(2).chapterTitle());
        assertEquals("C", outline.chapter(3).chapterTitle());
    }

    @Test
    void parse_outOfOrderNumbers_sortsChapters() {
        BookOutline outline = parser.parse("""
                {"bookTitle": "T", "chapters": [
                  {"chapterNumber": 2, "chapterTitle": "Second"},
                  {"chapterNumber": 1, "chapterTitle": "First"}
                ]}""");

        assertEquals("First", outline.chapters().get(0).chapterTitle());
        assertThrows(UnsupportedOperationException.class, () -> outline.chapters().clear());
    }

    @Test
    void parse_unusableReplies_throwInvalidOutline() {
        assertThrows(InvalidOutlineException.class, () -> parser.parse(null));
        assertThrows(InvalidOutlineException.class, () -> parser.parse("no json here"));
        assertThrows(InvalidOutlineException.class, () -> parser.parse("{\"bookTitle\": \"T\", \"chapters\": [}"));
        assertThrows(InvalidOutlineException.class, () -> parser.parse("{\"chapters\": [{\"chapterTitle\": \"A\"}]}"));
        assertThrows(InvalidOutlineException.class,
                () -> parser.parse("{\"bookTitle\": \"T\", \"chapters\": [{\"chapterNumber\": 1}]}"));
    }

    @Test
    void fromDetail_readsRecordedOutline() throws Exception {
        BookOutline outline = parser.fromDetail(objectMapper.readTree("""
                {"bookTitle": "T", "chapters": [{"chapterNumber": 1, "chapterTitle": "A"}]}"""));

        assertEquals("A", outline.chapter(1).chapterTitle());
        assertThrows(InvalidOutlineException.class, () -> parser.fromDetail(null));
    }
}
