package com.quillflow.quillflow_backend.executor.phase;

import com.quillflow.quillflow_backend.model.pipeline.GenerationConstraints;
import com.quillflow.quillflow_backend.model.pipeline.QualityCriterion;

import java.util.List;
import java.util.Map;

/**
 * Prompt text for every provider-backed phase.
 */
final class PromptTemplates {

    static final String WRITER_SYSTEM = "You are an experienced writer and editor who produces accurate, "
            + "well-structured long-form articles in Markdown.";
    static final String METADATA_SYSTEM = "You are an SEO editor. You answer with a single valid JSON object "
            + "and no other text.";

    private static final int MAX_CONTEXT_CHARS = 6_000;

    private PromptTemplates() {}

    static String research(String topic, GenerationConstraints c) {
        StringBuilder sb = new StringBuilder();
        sb.append("Research the topic '").append(topic).append("' for an upcoming article.\n");
        appendIfPresent(sb, "Audience", c.getAudience());
        appendIfPresent(sb, "Tone", c.getTone());
        appendKeywords(sb, c.getKeywords());
        sb.append("\nList the key facts, recent developments, figures with their year, common questions readers ")
          .append("have, and angles worth covering. Use concise bullet points grouped under short headings.");
        return sb.toString();
    }

    static String outline(String topic, GenerationConstraints c, String researchNotes) {
        StringBuilder sb = new StringBuilder();
        sb.append("Create a detailed outline for an article about '").append(topic).append("'.\n");
        sb.append("Target length: ").append(c.getTargetLength()).append(" words.\n");
        appendIfPresent(sb, "Tone", c.getTone());
        sb.append("\nRESEARCH NOTES:\n").append(truncate(researchNotes)).append("\n\n");
        sb.append("Return a Markdown outline: one # title, 3-5 ## sections with 2-4 bullet points each, ")
          .append("an introduction and a conclusion.");
        return sb.toString();
    }

    static String draft(String topic, GenerationConstraints c, String outline, String researchNotes) {
        StringBuilder sb = new StringBuilder();
        sb.append("Write a complete article about '").append(topic).append("' following the outline below.\n\n");
        sb.append("REQUIREMENTS:\n");
        sb.append("1. Start with a Markdown heading (# Title) on the first line\n");
        sb.append("2. Use ## subheadings for 3-5 main sections\n");
        sb.append("3. Target length: ").append(c.getTargetLength()).append(" words (within 10%)\n");
        sb.append("4. Support claims with the facts and figures from the research notes\n");
        appendIfPresent(sb, "Style", c.getStyle());
        appendIfPresent(sb, "Tone", c.getTone());
        appendIfPresent(sb, "Audience", c.getAudience());
        appendKeywords(sb, c.getKeywords());
        sb.append("\nOUTLINE:\n").append(truncate(outline)).append("\n");
        sb.append("\nRESEARCH NOTES:\n").append(truncate(researchNotes)).append("\n");
        return sb.toString();
    }

    static String refine(String topic, GenerationConstraints c, String draft,
                         Map<QualityCriterion, String> feedback, double score) {
        StringBuilder sb = new StringBuilder();
        sb.append("Revise the following article about '").append(topic).append("'. ");
        sb.append("It scored ").append(score).append(" of 100 against a pass mark of ")
          .append(c.getQualityThreshold()).append(".\n\n");
        sb.append("---CRITIQUE---\n");
        if (feedback.isEmpty()) {
            sb.append("- General polish: tighten wording and strengthen the weakest sections.\n");
        } else {
            feedback.forEach((criterion, text) ->
                    sb.append("- ").append(criterion.name().toLowerCase()).append(": ").append(text).append('\n'));
        }
        sb.append("---END CRITIQUE---\n\n");
        sb.append("---DRAFT---\n").append(draft).append("\n---END DRAFT---\n\n");
        sb.append("REQUIREMENTS:\n");
        sb.append("1. Start with a Markdown heading (# Title) on the first line\n");
        sb.append("2. Preserve the original facts and data points\n");
        sb.append("3. Address every critique point\n");
        sb.append("4. Keep the length near ").append(c.getTargetLength()).append(" words\n");
        appendKeywords(sb, c.getKeywords());
        sb.append("\nReturn only the revised article.");
        return sb.toString();
    }

    static String metadata(String topic, String content) {
        return "Generate publishing metadata for the article below about '" + topic + "'.\n\n"
                + "---ARTICLE---\n" + truncate(content) + "\n---END ARTICLE---\n\n"
                + "Respond with ONLY this JSON object:\n"
                + "{\"title\": \"under 60 characters\", \"excerpt\": \"one or two sentences\", "
                + "\"metaDescription\": \"under 160 characters\"}";
    }

    static String truncate(String text) {
        if (text == null) return "";
        return text.length() > MAX_CONTEXT_CHARS ? text.substring(0, MAX_CONTEXT_CHARS) + "\n[...]" : text;
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }

    private static void appendKeywords(StringBuilder sb, List<String> keywords) {
        if (keywords != null && !keywords.isEmpty()) {
            sb.append("Keywords to include: ").append(String.join(", ", keywords)).append('\n');
        }
    }
}
