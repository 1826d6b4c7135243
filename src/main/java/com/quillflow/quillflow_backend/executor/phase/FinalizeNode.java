package com.quillflow.quillflow_backend.executor.phase;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillflow.quillflow_backend.model.llm.LlmRequest;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import com.quillflow.quillflow_backend.model.pipeline.PipelineState;
import com.quillflow.quillflow_backend.model.pipeline.QualityAssessment;
import com.quillflow.quillflow_backend.router.ModelRouter;
import com.quillflow.quillflow_backend.router.RoutedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the final text and asks a provider for title/excerpt/meta description.
 * When the reply is not usable JSON the metadata is derived from the text instead.
 */
@Slf4j
@Component
public class FinalizeNode implements PhaseNode {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern TITLE_LINE = Pattern.compile("^#\\s+(.+)$", Pattern.MULTILINE);

    private final ModelRouter router;
    private final ObjectMapper mapper;

    public FinalizeNode(ModelRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public Phase supportedPhase() {
        return Phase.FINALIZE;
    }

    @Override
    public PipelineState execute(PipelineState state, PhaseContext context) {
        QualityAssessment quality = state.getQuality();
        boolean passed = quality != null && quality.passed();
        // a passing draft is always the best one; otherwise fall back to the best seen
        String content = passed || state.getBestDraft() == null ? state.getDraft() : state.getBestDraft();

        LlmRequest request = LlmRequest.of(PromptTemplates.METADATA_SYSTEM,
                PromptTemplates.metadata(state.getTopic(), content), 400, 0.2);
        request.setJsonOutput(true);
        RoutedResponse response = router.invoke(Phase.FINALIZE, request, context);
        state.addCost(response.actualCost());

        Map<String, Object> metadata = parseMetadata(response.text());
        if (metadata == null) {
            log.warn("[Finalize] task={} metadata reply was not JSON, deriving from content", state.getTaskId());
            metadata = deriveMetadata(state.getTopic(), content);
        }
        metadata.put("provider", response.provider().name());
        metadata.put("wordCount", wordCount(content));
        metadata.put("refinementCount", state.getRefinementCount());
        metadata.put("needsReview", !passed);
        if (state.getBestScore() != null) {
            metadata.put("qualityScore", passed ? quality.overallScore() : state.getBestScore());
        }

        state.setFinalContent(content);
        state.setMetadata(metadata);
        state.setNeedsReview(!passed);
        return state;
    }

    Map<String, Object> parseMetadata(String reply) {
        if (reply == null) return null;
        Matcher m = JSON_OBJECT.matcher(reply);
        if (!m.find()) return null;
        try {
            JsonNode node = mapper.readTree(m.group());
            String title = node.path("title").asText("");
            if (title.isBlank()) return null;
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("title", title.trim());
            out.put("excerpt", node.path("excerpt").asText("").trim());
            out.put("metaDescription", node.path("metaDescription").asText(node.path("meta_description").asText("")).trim());
            return out;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static Map<String, Object> deriveMetadata(String topic, String content) {
        String text = content == null ? "" : content;
        Matcher titleMatcher = TITLE_LINE.matcher(text);
        String title = titleMatcher.find() ? titleMatcher.group(1).trim() : capitalize(topic);

        String body = TITLE_LINE.matcher(text).replaceAll("").replaceAll("(?m)^#+\\s.*$", "").trim();
        String firstParagraph = body.split("\\n\\s*\\n", 2)[0].replaceAll("\\s+", " ").trim();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("title", title);
        out.put("excerpt", clip(firstParagraph, 300));
        out.put("metaDescription", clip(firstParagraph, 160));
        return out;
    }

    private static String clip(String text, int max) {
        if (text.length() <= max) return text;
        int cut = text.lastIndexOf(' ', max - 3);
        return text.substring(0, cut > 0 ? cut : max - 3) + "...";
    }

    private static String capitalize(String s) {
        if (s == null || s.isBlank()) return "Untitled";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static int wordCount(String text) {
        String t = text == null ? "" : text.trim();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }
}
