package io.hearthwarrio.autoapply.core.answer;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;

/**
 * What happened to one field: resolved, skipped, failed or misplaced, plus any elements the
 * interaction revealed (follow-up questions, dialog buttons) as nodes of the later capture.
 */
public final class FieldOutcome {

    public enum Status {
        RESOLVED,
        SKIPPED,
        FAILED,
        /**
         * The field's locator no longer matches exactly one element; the page should be re-parsed.
         */
        MISPLACED
    }

    private final Status status;
    private final Decision decision;
    private final String reason;
    private final List<Element> revealed;
    private final List<String> ancestorPaths;

    private FieldOutcome(Status status, Decision decision, String reason, List<Element> revealed, List<String> ancestorPaths) {
        this.status = status;
        this.decision = decision;
        this.reason = reason;
        this.revealed = List.copyOf(revealed);
        this.ancestorPaths = List.copyOf(ancestorPaths);
    }

    public static FieldOutcome resolved(Decision decision) {
        return new FieldOutcome(Status.RESOLVED, decision, null, List.of(), List.of());
    }

    public static FieldOutcome resolved(Decision decision, List<Element> revealed, List<String> ancestorPaths) {
        return new FieldOutcome(Status.RESOLVED, decision, null,
                Objects.requireNonNull(revealed, "revealed must not be null"),
                Objects.requireNonNull(ancestorPaths, "ancestorPaths must not be null"));
    }

    public static FieldOutcome skipped(String reason) {
        return new FieldOutcome(Status.SKIPPED, null, reason, List.of(), List.of());
    }

    public static FieldOutcome failed(String reason) {
        return new FieldOutcome(Status.FAILED, null, reason, List.of(), List.of());
    }

    public static FieldOutcome misplaced() {
        return new FieldOutcome(Status.MISPLACED, null, "element misplaced", List.of(), List.of());
    }

    public Status status() {
        return status;
    }

    /**
     * Resolved and skipped fields let the page move on.
     */
    public boolean isSuccess() {
        return status == Status.RESOLVED || status == Status.SKIPPED;
    }

    public Decision decision() {
        return decision;
    }

    public String reason() {
        return reason;
    }

    public List<Element> revealed() {
        return revealed;
    }

    public List<String> ancestorPaths() {
        return ancestorPaths;
    }

    @Override
    public String toString() {
        return "FieldOutcome{" + status + (decision != null ? " " + decision : "") + (reason != null ? ", " + reason : "")
                + (revealed.isEmpty() ? "" : ", revealed=" + revealed.size()) + "}";
    }
}
