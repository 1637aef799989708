package com.sheetfunctions.docs.build;

import java.util.ArrayList;
import java.util.List;

/**
 * Checked exception signalling that the catalog cannot be documented. Invalid formulas are reported
 * together; a dependency cycle or an inconsistent expansion stops the build at once.
 */
public final class DocumentationBuildException extends Exception {

    public enum Reason {
        INVALID_FORMULAS,
        CIRCULAR_DEPENDENCY,
        EXPANSION_INCONSISTENT
    }

    private final Reason reason;
    private final List<BuildMessage> messages;

    public DocumentationBuildException(Reason reason, List<BuildMessage> messages) {
        super(describe(reason, messages));
        this.reason = reason;
        this.messages = List.copyOf(messages);
    }

    public DocumentationBuildException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.messages = List.of();
    }

    public Reason getReason() {
        return reason;
    }

    public List<BuildMessage> getMessages() {
        return messages;
    }

    public List<BuildMessage> getErrors() {
        List<BuildMessage> errors = new ArrayList<>();
        for (BuildMessage message : messages) {
            if (message.isError()) {
                errors.add(message);
            }
        }
        return errors;
    }

    private static String describe(Reason reason, List<BuildMessage> messages) {
        StringBuilder out = new StringBuilder();
        out.append("Documentation build failed (").append(reason).append(')');
        for (BuildMessage message : messages) {
            if (message.isError()) {
                out.append(System.lineSeparator()).append("  - ").append(message);
            }
        }
        return out.toString();
    }
}
