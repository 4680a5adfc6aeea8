package io.batchreview.cli;

import io.batchreview.model.Severity;
import io.batchreview.submission.SubmissionAction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

final class ConsoleCommandParser {
    private ConsoleCommandParser() {
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (token != null && !token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    static String joinTail(List<String> tokens, int startIndex) {
        if (tokens == null || tokens.isEmpty() || startIndex >= tokens.size()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = startIndex; i < tokens.size(); i++) {
            if (i > startIndex) {
                sb.append(' ');
            }
            sb.append(tokens.get(i));
        }
        return sb.toString();
    }

    /**
     * Console operations that act on the remote server and need an explicit {@code confirm}.
     */
    static Optional<SubmissionAction> confirmedAction(String op) {
        if (op == null || op.isBlank()) {
            return Optional.empty();
        }
        return switch (op.trim().toLowerCase(Locale.ROOT)) {
            case "vote" -> Optional.of(SubmissionAction.VOTE);
            case "approve" -> Optional.of(SubmissionAction.APPROVE);
            case "submit" -> Optional.of(SubmissionAction.SUBMIT);
            case "approve-submit", "approve_submit" -> Optional.of(SubmissionAction.APPROVE_AND_SUBMIT);
            default -> Optional.empty();
        };
    }

    static boolean requiresConfirmation(String op) {
        return confirmedAction(op).isPresent();
    }

    /**
     * Parses {@code Label=Value} tokens such as {@code Code-Review=+2} or {@code Verified=-1}.
     */
    static Map<String, Integer> parseLabelVotes(List<String> tokens) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String token : tokens) {
            int eq = token.indexOf('=');
            if (eq <= 0 || eq == token.length() - 1) {
                throw new IllegalArgumentException("Expected Label=Value, got: " + token);
            }
            String label = token.substring(0, eq).trim();
            String raw = token.substring(eq + 1).trim();
            try {
                out.put(label, Integer.parseInt(raw.startsWith("+") ? raw.substring(1) : raw));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Vote value must be an integer: " + token);
            }
        }
        return out;
    }

    /**
     * Parses {@code id=SEVERITY} or {@code id=N} (legacy 1..10 confidence).
     */
    static Map.Entry<String, Severity> parseScore(String token) {
        int eq = token == null ? -1 : token.lastIndexOf('=');
        if (eq <= 0 || eq == token.length() - 1) {
            throw new IllegalArgumentException("Expected id=SEVERITY, got: " + token);
        }
        String id = token.substring(0, eq).trim();
        String raw = token.substring(eq + 1).trim();
        Optional<Severity> severity = Severity.fromToken(raw);
        if (severity.isPresent()) {
            return Map.entry(id, severity.get());
        }
        try {
            return Map.entry(id, Severity.fromLegacyScore(Integer.parseInt(raw)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown severity: " + raw);
        }
    }
}
