package eu.virtualparadox.documind.query.question;

public enum EQuestionStatus {
    QUEUED,
    RETRIEVING,
    ANSWERING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
