package eu.virtualparadox.documind.summary;

import eu.virtualparadox.documind.application.config.ApplicationConfig;
import eu.virtualparadox.documind.catalog.entity.DocumentEntity;
import eu.virtualparadox.documind.catalog.service.DocumentCatalogService;
import eu.virtualparadox.documind.metrics.EDocumentAction;
import eu.virtualparadox.documind.metrics.MetricsSink;
import eu.virtualparadox.documind.rag.answer.CompletionOptions;
import eu.virtualparadox.documind.rag.answer.SynthesisUnavailableException;
import eu.virtualparadox.documind.rag.answer.TextCompletionProvider;
import eu.virtualparadox.documind.summary.model.DocumentSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Summarizes one of the owner's documents.
 * <p>
 * The executive summary is written by the language model from up to {@link #MAX_SECTIONS}
 * overlapping sections of the cleaned text. When the model is unavailable the first usable
 * sentences of the document stand in for it. Everything else comes from {@link DocumentProfiler}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SummaryService {

    public static final String TOO_SHORT = "Document is too short for a meaningful summary.";

    static final int MIN_SUMMARY_LENGTH = 100;
    static final int SECTION_LENGTH = 1000;
    static final int SECTION_OVERLAP = 100;
    static final int MAX_SECTIONS = 3;

    private static final double SUMMARY_TEMPERATURE = 0.3;
    private static final int SUMMARY_MAX_TOKENS = 150;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOISE = Pattern.compile("[^\\w\\s.,!?;:()-]", Pattern.UNICODE_CHARACTER_CLASS);

    private final DocumentCatalogService catalogService;
    private final TextCompletionProvider completionProvider;
    private final DocumentProfiler profiler;
    private final MetricsSink metricsSink;
    private final ApplicationConfig config;

    /**
     * Summarizes a document.
     *
     * @param ownerId    requesting user
     * @param documentId document to summarize
     * @return the summary
     * @throws eu.virtualparadox.documind.catalog.DocumentNotFoundException     if the document does not exist
     * @throws eu.virtualparadox.documind.catalog.DocumentAccessDeniedException if it belongs to someone else
     */
    public DocumentSummary summarize(final String ownerId, final String documentId) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        final DocumentEntity document = catalogService.getOwned(documentId, ownerId);
        final String content = StringUtils.defaultString(document.getContent());
        final String fileType = StringUtils.defaultString(document.getFileType());

        log.info("Summarizing document {} ({})", documentId, document.getFilename());

        final List<String> sections = executiveSections(content);
        final boolean aiGenerated = !sections.isEmpty();
        final String executiveSummary;
        if (aiGenerated) {
            executiveSummary = String.join(" ", sections);
        } else if (clean(content).length() < MIN_SUMMARY_LENGTH) {
            executiveSummary = TOO_SHORT;
        } else {
            executiveSummary = profiler.fallbackSummary(content);
        }

        metricsSink.recordDocumentAction(ownerId, documentId, EDocumentAction.SUMMARIZE);

        return new DocumentSummary(
                UUID.randomUUID().toString(),
                document.getId(),
                document.getFilename(),
                fileType,
                document.getSizeBytes(),
                document.getUploadedAt(),
                Instant.now(),
                executiveSummary,
                aiGenerated,
                profiler.keyPoints(content, fileType),
                profiler.statistics(content, document.getSizeBytes()),
                profiler.analyze(content, fileType),
                profiler.quickOverview(content, fileType));
    }

    /**
     * Asks the model for a short summary of each section. Stops at the first failure and keeps
     * what was produced until then.
     *
     * @return the section summaries, empty if the text is too short or the model is unavailable
     */
    List<String> executiveSections(final String content) {
        final String cleaned = clean(content);
        if (cleaned.length() < MIN_SUMMARY_LENGTH) {
            return List.of();
        }

        final CompletionOptions options = new CompletionOptions(SUMMARY_TEMPERATURE, SUMMARY_MAX_TOKENS,
                config.getLlm().getStopSequences());

        final List<String> summaries = new ArrayList<>(MAX_SECTIONS);
        for (final String section : sections(cleaned)) {
            try {
                final String prompt = "Summarize the following text in 2-3 sentences:\n\n" + section + "\n\nSummary:";
                summaries.add(completionProvider.complete(prompt, options).strip());
            } catch (final SynthesisUnavailableException e) {
                log.warn("Section summary unavailable after {} sections: {}", summaries.size(), e.getMessage());
                break;
            }
        }
        return summaries;
    }

    static List<String> sections(final String cleaned) {
        if (cleaned.length() <= SECTION_LENGTH) {
            return List.of(cleaned);
        }
        final List<String> sections = new ArrayList<>(MAX_SECTIONS);
        for (int start = 0; start < cleaned.length() && sections.size() < MAX_SECTIONS;
             start += SECTION_LENGTH - SECTION_OVERLAP) {
            sections.add(cleaned.substring(start, Math.min(cleaned.length(), start + SECTION_LENGTH)));
        }
        return sections;
    }

    static String clean(final String content) {
        final String collapsed = WHITESPACE.matcher(content).replaceAll(" ");
        return NOISE.matcher(collapsed).replaceAll("").strip();
    }
}
