package com.eyelevel.lotprocessor.service.job;

import java.util.List;

/**
 * What applying vision results left to do.
 *
 * @param applied            {@code false} when the job was no longer in a state to accept the results.
 * @param completed          {@code true} when the job completed without a translation phase.
 * @param translationWork    Lots with an English description, to be translated.
 * @param targetLanguages    Languages to translate into.
 */
public record VisionOutcome(boolean applied, boolean completed, List<TranslationWork> translationWork,
                            List<String> targetLanguages) {

    public static VisionOutcome skipped() {
        return new VisionOutcome(false, false, List.of(), List.of());
    }

    public static VisionOutcome completedJob() {
        return new VisionOutcome(true, true, List.of(), List.of());
    }

    /**
     * @param lotId       The client lot id.
     * @param englishText The lot's vision result.
     */
    public record TranslationWork(String lotId, String englishText) {
    }
}
