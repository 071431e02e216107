package org.example.storybook.service;

import org.example.storybook.model.StepKind;
import org.example.storybook.model.StepName;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Static estimate of how long each workflow step takes, in seconds.
 * Per-chapter entries are multiplied by the run's chapter count.
 */
@Component
public class StepTimeModel {

    public record StepTime(int seconds, boolean perChapter) {
    }

    static final Map<String, StepTime> DEFAULT_TABLE;

    static {
        Map<String, StepTime> table = new LinkedHashMap<>();
        table.put("generate_outline", new StepTime(15, false));
        table.put("write_chapters", new StepTime(25, true));
        table.put("generate_front_cover", new StepTime(60, false));
        table.put("generate_back_cover", new StepTime(60, false));
        table.put("generate_images", new StepTime(30, true));
        table.put("assemble", new StepTime(10, false));
        table.put("generate_audiobook", new StepTime(20, false));
        table.put("done", new StepTime(1, false));
        DEFAULT_TABLE = Collections.unmodifiableMap(table);
    }

    private final Map<String, StepTime> table;

    public StepTimeModel() {
        this(DEFAULT_TABLE);
    }

    StepTimeModel(Map<String, StepTime> table) {
        this.table = table;
    }

    public int totalEstimatedTime(int chapterCount) {
        int chapters = Math.max(1, chapterCount);
        int total = 0;
        for (StepTime time : table.values()) {
            total += time.perChapter() ? time.seconds() * chapters : time.seconds();
        }
        return total;
    }

    /**
     * Estimated time of one occurrence of the step. A single chapter step counts one chapter's worth;
     * an aggregate per-chapter step counts all chapters. Unknown steps count nothing.
     */
    public int stepTime(StepName step, int chapterCount) {
        if (step == null || step.kind() == StepKind.UNKNOWN) {
            return 0;
        }
        StepTime time = table.get(step.kind().timeKey());
        if (time == null) {
            return 0;
        }
        if (step.kind().isChapterIndexed() || !time.perChapter()) {
            return time.seconds();
        }
        return time.seconds() * Math.max(1, chapterCount);
    }

    public int elapsedTime(Collection<StepName> completedSteps, int chapterCount) {
        Set<String> seen = new LinkedHashSet<>();
        int elapsed = 0;
        for (StepName step : completedSteps) {
            if (step != null && seen.add(step.format())) {
                elapsed += stepTime(step, chapterCount);
            }
        }
        return elapsed;
    }

    public int totalSteps(int chapterCount) {
        int chapters = Math.max(1, chapterCount);
        int steps = 0;
        for (StepTime time : table.values()) {
            steps += time.perChapter() ? chapters : 1;
        }
        return steps;
    }

    public static int percentage(int elapsed, int total) {
        if (total <= 0) {
            return 0;
        }
        long rounded = Math.round(100.0 * elapsed / total);
        return (int) Math.max(0, Math.min(rounded, 100));
    }
}
