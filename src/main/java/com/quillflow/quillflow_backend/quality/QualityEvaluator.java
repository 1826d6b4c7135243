package com.quillflow.quillflow_backend.quality;

import com.quillflow.quillflow_backend.config.PipelineProperties;
import com.quillflow.quillflow_backend.model.pipeline.QualityAssessment;
import com.quillflow.quillflow_backend.model.pipeline.QualityCriterion;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rubric scoring over plain markdown text. Pure apart from the assessment timestamp:
 * the same content and context always give the same scores and feedback.
 */
@Component
public class QualityEvaluator {

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final Pattern H1 = Pattern.compile("^#\\s", Pattern.MULTILINE);
    private static final Pattern H2 = Pattern.compile("^##\\s", Pattern.MULTILINE);
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*([*\\-+]|\\d+\\.)\\s", Pattern.MULTILINE);
    private static final List<Pattern> EVIDENCE = List.of(
            Pattern.compile("\\[\\d+\\]"),
            Pattern.compile("according to", Pattern.CASE_INSENSITIVE),
            Pattern.compile("research shows", Pattern.CASE_INSENSITIVE),
            Pattern.compile("study found", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d{4}\\b"),
            Pattern.compile("\\d+(\\.\\d+)?%"));
    private static final List<Pattern> ENGAGEMENT_MARKERS = List.of(
            Pattern.compile("\\b(check out|visit|learn more|discover|try)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\?"),
            Pattern.compile("\\b(you|your)\\b", Pattern.CASE_INSENSITIVE));

    private static final Map<QualityCriterion, String> FEEDBACK = Map.of(
            QualityCriterion.CLARITY, "Shorten long sentences and simplify sentence structure.",
            QualityCriterion.ACCURACY, "Support claims with concrete data, dates, figures or named sources.",
            QualityCriterion.COMPLETENESS, "Expand the piece towards the target length and cover the topic in more sections.",
            QualityCriterion.RELEVANCE, "Keep the focus on the topic and work the requested keywords into the text.",
            QualityCriterion.STRUCTURE, "Use one title heading and at least two section headings with a clear introduction and conclusion.",
            QualityCriterion.READABILITY, "Break up the text with paragraphs of moderate length and use lists where they help.",
            QualityCriterion.ENGAGEMENT, "Address the reader directly, ask a question or add a call to action.");

    private final PipelineProperties properties;
    private final Clock clock;

    public QualityEvaluator(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public QualityAssessment evaluate(String content, EvaluationContext context) {
        return evaluate(content, context, properties.getQuality().getWeights());
    }

    public QualityAssessment evaluate(String content, EvaluationContext context, Map<QualityCriterion, Double> weights) {
        String text = content == null ? "" : content;

        Map<QualityCriterion, Double> scores = new EnumMap<>(QualityCriterion.class);
        scores.put(QualityCriterion.CLARITY, scoreClarity(text));
        scores.put(QualityCriterion.ACCURACY, scoreAccuracy(text));
        scores.put(QualityCriterion.COMPLETENESS, scoreCompleteness(text, context.targetLength()));
        scores.put(QualityCriterion.RELEVANCE, scoreRelevance(text, context.topic(), context.keywords()));
        scores.put(QualityCriterion.STRUCTURE, scoreStructure(text));
        scores.put(QualityCriterion.READABILITY, scoreReadability(text));
        scores.put(QualityCriterion.ENGAGEMENT, scoreEngagement(text));

        double overall = overallScore(scores, weights);
        double floor = properties.getQuality().getCriterionFloor();

        Map<QualityCriterion, String> feedback = new LinkedHashMap<>();
        for (QualityCriterion criterion : QualityCriterion.values()) {
            if (scores.get(criterion) < floor) {
                feedback.put(criterion, FEEDBACK.get(criterion));
            }
        }

        return new QualityAssessment(scores, overall, context.threshold(), overall >= context.threshold(),
                feedback, context.iteration(), clock.instant());
    }

    /** Weighted average of 0-10 scores, scaled to 0-100 and rounded to one decimal. */
    static double overallScore(Map<QualityCriterion, Double> scores, Map<QualityCriterion, Double> weights) {
        double weighted = 0;
        double totalWeight = 0;
        for (Map.Entry<QualityCriterion, Double> e : scores.entrySet()) {
            double w = weights.getOrDefault(e.getKey(), e.getKey().getDefaultWeight());
            weighted += w * e.getValue();
            totalWeight += w;
        }
        if (totalWeight <= 0) return 0.0;
        return Math.round(weighted / totalWeight * 10 * 10) / 10.0;
    }

    double scoreClarity(String text) {
        List<String> sentences = sentences(text);
        if (text.isBlank()) return 0.0;
        if (sentences.isEmpty()) return 5.0;
        double avgLength = sentences.stream().mapToInt(QualityEvaluator::wordCount).average().orElse(0);
        if (avgLength > 25) return Math.max(2.0, Math.min(5.0, 10 - (avgLength - 25) * 0.1));
        if (avgLength >= 12) return 8.0;
        if (avgLength >= 8) return 8.5;
        return 7.0;
    }

    double scoreAccuracy(String text) {
        int evidence = 0;
        for (Pattern p : EVIDENCE) {
            evidence += count(p, text);
        }
        if (evidence > 10) return 9.0;
        if (evidence > 5) return 8.0;
        if (evidence > 0) return 7.0;
        return 6.0;
    }

    double scoreCompleteness(String text, int targetLength) {
        int words = wordCount(text);
        int sections = count(HEADING, text);
        double ratio = targetLength > 0 ? (double) words / targetLength : 1.0;
        if (ratio >= 0.8 && ratio <= 1.5 && sections >= 3) return 9.0;
        if (ratio >= 0.6 && sections >= 2) return 8.0;
        if (ratio >= 0.4) return 7.0;
        return 5.0;
    }

    double scoreRelevance(String text, String topic, List<String> keywords) {
        if (topic == null || topic.isBlank()) return 7.0;
        String lower = text.toLowerCase(Locale.ROOT);
        // Match on the topic's significant words so "renewable energy trends" also counts "renewable energy"
        List<String> topicWords = Arrays.stream(WHITESPACE.split(topic.toLowerCase(Locale.ROOT)))
                .filter(w -> w.length() > 3)
                .toList();
        long topicSentences = sentences(lower).stream()
                .filter(s -> topicWords.stream().anyMatch(s::contains))
                .count();
        long keywordHits = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .filter(k -> lower.contains(k.toLowerCase(Locale.ROOT)))
                .count();
        boolean allKeywords = keywordHits >= keywords.stream().filter(k -> k != null && !k.isBlank()).count();
        if (topicSentences >= 3 && allKeywords) return 9.0;
        if (topicSentences >= 2) return 8.0;
        if (topicSentences >= 1) return 7.0;
        return 5.0;
    }

    double scoreStructure(String text) {
        double score = 5.0;
        if (count(H1, text) == 1) score += 1.5;
        if (count(H2, text) >= 2) score += 1.5;
        if (count(LIST_ITEM, text) > 0) score += 1.0;
        if (paragraphs(text).size() >= 4) score += 1.0;
        return Math.min(score, 10.0);
    }

    double scoreReadability(String text) {
        List<String> paragraphs = paragraphs(text);
        if (paragraphs.isEmpty()) return 5.0;
        double score = 8.0;
        if (count(LIST_ITEM, text) > 0) score += 0.5;
        long shortParagraphs = paragraphs.stream().filter(p -> wordCount(p) < 5 && !p.startsWith("#")).count();
        long longParagraphs = paragraphs.stream().filter(p -> wordCount(p) > 200).count();
        if (shortParagraphs > paragraphs.size() * 0.3) score -= 1.0;
        if (longParagraphs > 0) score -= 2.0;
        return Math.max(5.0, Math.min(score, 10.0));
    }

    double scoreEngagement(String text) {
        int markers = 0;
        for (Pattern p : ENGAGEMENT_MARKERS) {
            markers += count(p, text);
        }
        List<String> paragraphs = paragraphs(text);
        double variety = paragraphs.stream().map(QualityEvaluator::wordCount).distinct().count()
                / (double) Math.max(1, paragraphs.size());
        if (markers >= 5 && variety > 0.5) return 8.5;
        if (markers >= 2) return 7.5;
        if (markers > 0) return 7.0;
        return 6.0;
    }

    private static List<String> sentences(String text) {
        return Arrays.stream(SENTENCE_SPLIT.split(text))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static List<String> paragraphs(String text) {
        return Arrays.stream(text.split("\\n\\s*\\n"))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    static int wordCount(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
