package com.aurelius.core.strict;

import com.aurelius.core.tool.ArtifactIds;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Strict mode: surfaced responses cite artifact ids and little else.
 *
 * A response is valid iff it contains at least one 64-hex artifact id and
 * the remaining text, whitespace-collapsed, is at most 50 characters.
 * When disabled every response is valid.
 */
public class StrictMode {

    static final int MAX_NON_ARTIFACT_CHARS = 50;

    private final boolean enabled;

    public StrictMode(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean validateResponse(String response) {
        if (!enabled) {
            return true;
        }
        if (response == null || extractArtifactIds(response).isEmpty()) {
            return false;
        }
        String remainder = ArtifactIds.PATTERN.matcher(response).replaceAll("");
        remainder = remainder.replaceAll("\\s+", " ").trim();
        return remainder.length() <= MAX_NON_ARTIFACT_CHARS;
    }

    public List<String> extractArtifactIds(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        Matcher m = ArtifactIds.PATTERN.matcher(text);
        while (m.find()) {
            ids.add(m.group());
        }
        return ids;
    }

    public String formatArtifactResponse(List<String> artifactIds, String context) {
        if (artifactIds == null || artifactIds.isEmpty()) {
            return "No artifacts";
        }
        StringBuilder sb = new StringBuilder();
        if (context != null && !context.isBlank()) {
            sb.append(context).append("\n");
        }
        sb.append("Artifacts:");
        for (String id : artifactIds) {
            sb.append("\n  ").append(id);
        }
        return sb.toString();
    }
}
