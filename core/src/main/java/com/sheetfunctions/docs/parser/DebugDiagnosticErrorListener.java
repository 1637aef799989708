package com.sheetfunctions.docs.parser;

import java.util.BitSet;
import java.util.Locale;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Records prediction diagnostics for a formula without failing the parse. The base class would
 * report through {@link Parser#notifyErrorListeners(String)}, which reaches
 * {@link ThrowingErrorListener}.
 */
final class DebugDiagnosticErrorListener extends DiagnosticErrorListener {

    DebugDiagnosticErrorListener() {
        super(true);
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        capture("ambiguity", recognizer, dfa, startIndex, stopIndex, "alts=" + getConflictingAlts(ambigAlts, configs));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        capture("full-context", recognizer, dfa, startIndex, stopIndex, null);
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        capture("context-sensitivity", recognizer, dfa, startIndex, stopIndex, "prediction=" + prediction);
    }

    private void capture(String kind, Parser recognizer, DFA dfa, int startIndex, int stopIndex, String detail) {
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        StringBuilder message =
                new StringBuilder()
                        .append(kind)
                        .append(" in ")
                        .append(getDecisionDescription(recognizer, dfa))
                        .append(String.format(Locale.ROOT, " at tokens %d..%d '%s'", startIndex, stopIndex, input));
        if (detail != null) {
            message.append(' ').append(detail);
        }
        DebugFlags.captureDiagnostic(message.toString());
    }
}
