package eu.virtualparadox.documind.summary.model;

import java.util.List;

/**
 * Keyword-based classification of a document.
 */
public record ContentAnalysis(String documentType,
                              String language,
                              List<String> contentCategories,
                              List<String> dataTypes) {

    public ContentAnalysis {
        contentCategories = List.copyOf(contentCategories);
        dataTypes = List.copyOf(dataTypes);
    }
}
