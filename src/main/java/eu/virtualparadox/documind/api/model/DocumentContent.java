package eu.virtualparadox.documind.api.model;

public record DocumentContent(String documentId, String content) {
}
