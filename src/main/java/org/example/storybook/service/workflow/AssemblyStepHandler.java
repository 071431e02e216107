package org.example.storybook.service.workflow;

import org.example.storybook.model.BookOutline;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryContext;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.StoryService;
import org.example.storybook.service.media.AssetKeyService;
import org.example.storybook.service.media.AssetStorage;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the finished book as a single HTML page from the recorded chapter and image steps.
 */
@Service
public class AssemblyStepHandler extends AbstractStepHandler {

    private static final Logger log = LoggerFactory.getLogger(AssemblyStepHandler.class);
    private static final String STYLESHEET = """
            body { max-width: 48rem; margin: 0 auto; padding: 1rem; font-family: Georgia, serif; line-height: 1.6; }
            h1, h2 { text-align: center; }
            img.cover { display: block; width: 100%; margin: 2rem 0; }
            img.illustration { display: block; max-width: 100%; margin: 1rem auto; }
            section.chapter { page-break-before: always; }
            """;

    private final StoryService storyService;
    private final AssetStorage assetStorage;
    private final AssetKeyService assetKeyService;

    public AssemblyStepHandler(
            RunLedgerService runLedgerService,
            ProgressTrackerService progressTracker,
            OutlineParser outlineParser,
            StoryService storyService,
            AssetStorage assetStorage,
            AssetKeyService assetKeyService) {
        super(runLedgerService, progressTracker, outlineParser);
        this.storyService = storyService;
        this.assetStorage = assetStorage;
        this.assetKeyService = assetKeyService;
    }

    public AssemblyResult assemble(StepTrigger trigger) {
        return runStep(trigger, StepName.ASSEMBLE, this::assembleBook);
    }

    private AssemblyResult assembleBook(StoryGenerationRun run) {
        BookOutline outline = requireOutline(run.runId());
        StoryContext story = storyService.getStoryContext(run.storyId());

        Document book = Document.createShell("");
        book.outputSettings().prettyPrint(true);
        book.head().appendElement("meta").attr("charset", "utf-8");
        book.head().appendElement("meta")
                .attr("name", "viewport")
                .attr("content", "width=device-width, initial-scale=1");
        book.title(outline.bookTitle());
        book.head().appendElement("style").appendChild(new DataNode(STYLESHEET));
        Element body = book.body();
        body.attr("lang", story.storyLanguage());

        int imageCount = 0;
        Optional<String> frontCover = imageUrl(run.runId(), StepName.FRONT_COVER);
        if (frontCover.isPresent()) {
            appendImage(body, frontCover.get(), outline.bookTitle(), "cover");
            imageCount++;
        }
        body.appendElement("h1").text(outline.bookTitle());

        int chapterCount = 0;
        List<Integer> missing = new ArrayList<>();
        for (BookOutline.Chapter chapter : outline.chapters()) {
            Optional<String> content = writtenChapter(run.runId(), chapter.chapterNumber());
            if (content.isEmpty()) {
                missing.add(chapter.chapterNumber());
                continue;
            }
            Element section = body.appendElement("section")
                    .addClass("chapter")
                    .attr("id", "chapter-" + chapter.chapterNumber());
            section.appendElement("h2").text(chapter.chapterTitle());

            Optional<String> illustration = imageUrl(run.runId(), StepName.chapterImage(chapter.chapterNumber()));
            if (illustration.isPresent()) {
                appendImage(section, illustration.get(), chapter.chapterTitle(), "illustration");
                imageCount++;
            }
            for (String paragraph : content.get().split("\\n\\s*\\n")) {
                if (!paragraph.isBlank()) {
                    section.appendElement("p").text(paragraph.trim());
                }
            }
            chapterCount++;
        }
        if (chapterCount == 0) {
            throw new IllegalStateException("No completed chapters to assemble for run " + run.runId());
        }

        Optional<String> backCover = imageUrl(run.runId(), StepName.BACK_COVER);
        if (backCover.isPresent()) {
            appendImage(body, backCover.get(), outline.bookTitle(), "cover");
            imageCount++;
        }

        byte[] html = book.outerHtml().getBytes(StandardCharsets.UTF_8);
        String key = assetStorage.uploadFile(assetKeyService.buildBookKey(run.storyId()), html, "text/html; charset=utf-8");
        if (!missing.isEmpty()) {
            log.warn("Assembled book for run {} without chapters {}", run.runId(), missing);
        }
        log.info("Assembled book for run {}: {} chapters, {} images, {} bytes",
                run.runId(), chapterCount, imageCount, html.length);
        return new AssemblyResult(assetStorage.getPublicUrl(key), key, outline.bookTitle(),
                chapterCount, imageCount, List.copyOf(missing));
    }

    private Optional<String> imageUrl(String runId, StepName stepName) {
        return completedDetail(runId, stepName)
                .map(detail -> detail.path("imageUrl").asText(""))
                .filter(url -> !url.isBlank());
    }

    private static void appendImage(Element parent, String url, String alt, String cssClass) {
        parent.appendElement("img")
                .addClass(cssClass)
                .attr("src", url)
                .attr("alt", alt);
    }
}
