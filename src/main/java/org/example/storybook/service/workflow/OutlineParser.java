package org.example.storybook.service.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.model.BookOutline;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads book outlines from model output and from recorded outline steps.
 */
@Component
public class OutlineParser {

    private final ObjectMapper objectMapper;

    public OutlineParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Parses and validates the JSON object in a model reply.
     *
     * @throws InvalidOutlineException when no usable outline can be read
     */
    public BookOutline parse(String generated) {
        String json = extractJsonObject(generated);
        try {
            return normalize(objectMapper.readValue(json, BookOutline.class));
        } catch (JsonProcessingException e) {
            throw new InvalidOutlineException("Outline response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public BookOutline fromDetail(JsonNode detail) {
        if (detail == null || detail.isNull()) {
            throw new InvalidOutlineException("Recorded outline step has no detail");
        }
        try {
            return normalize(objectMapper.treeToValue(detail, BookOutline.class));
        } catch (JsonProcessingException e) {
            throw new InvalidOutlineException("Recorded outline cannot be read: " + e.getOriginalMessage(), e);
        }
    }

    private BookOutline normalize(BookOutline outline) {
        if (outline == null || outline.bookTitle() == null || outline.bookTitle().isBlank()) {
            throw new InvalidOutlineException("Outline has no book title");
        }
        if (outline.chapters() == null || outline.chapters().isEmpty()) {
            throw new InvalidOutlineException("Outline has no chapters");
        }

        // Models sometimes omit or repeat chapter numbers; fall back to list order.
        Set<Integer> seen = new HashSet<>();
        boolean numbered = outline.chapters().stream()
                .allMatch(c -> c != null && c.chapterNumber() > 0 && seen.add(c.chapterNumber()));

        List<BookOutline.Chapter> chapters = new ArrayList<>();
        for (int i = 0; i < outline.chapters().size(); i++) {
            BookOutline.Chapter chapter = outline.chapters().get(i);
            if (chapter == null || chapter.chapterTitle() == null || chapter.chapterTitle().isBlank()) {
                throw new InvalidOutlineException("Outline chapter " + (i + 1) + " has no title");
            }
            int number = numbered ? chapter.chapterNumber() : i + 1;
            chapters.add(new BookOutline.Chapter(
                    number,
                    chapter.chapterTitle().trim(),
                    chapter.chapterSynopses(),
                    chapter.chapterPhotoPrompt()));
        }
        chapters.sort((a, b) -> Integer.compare(a.chapterNumber(), b.chapterNumber()));

        return new BookOutline(
                outline.bookTitle().trim(),
                outline.bookCoverPrompt(),
                outline.bookBackCoverPrompt(),
                List.copyOf(chapters));
    }

    private String extractJsonObject(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidOutlineException("No outline returned from provider");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new InvalidOutlineException("No JSON object found in outline response");
    }
}
