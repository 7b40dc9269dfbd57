package com.taskweave.core.analysis;

import com.taskweave.core.model.Complexity;
import com.taskweave.core.model.TaskAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies a raw task description into a complexity tier and a ranked list of domains.
 * <p>
 * Purely keyword driven: matching is case-insensitive substring containment, and every
 * input (including blank text) yields a best-effort analysis.
 */
@Service
public class TaskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaskAnalyzer.class);

    static final List<String> COMPLEX_MARKERS =
            List.of("system", "full", "complete", "comprehensive", "enterprise", "integrate");
    static final List<String> MEDIUM_MARKERS = List.of("multi", "several", "multiple", "few");
    static final List<String> SIMPLE_MARKERS = List.of("simple", "quick", "one", "single", "just");
    static final List<String> ACTION_VERBS = List.of(
            "create", "build", "develop", "design", "implement",
            "deploy", "test", "analyze", "integrate", "configure");

    private static final double PRIORITY_BONUS = 0.5;
    private static final int MAX_REQUIREMENTS = 10;
    private static final int MIN_REQUIREMENT_LENGTH = 6;
    private static final int MAX_ESTIMATED_SUBTASKS = 10;

    private record DomainVocabulary(String domain, List<String> keywords, List<String> priorityKeywords) {}

    /** Vocabulary order doubles as the tie-break order for equal scores. */
    private static final List<DomainVocabulary> DOMAINS = List.of(
            new DomainVocabulary("development",
                    List.of("code", "develop", "build", "implement", "api", "function", "python", "rest"),
                    List.of()),
            new DomainVocabulary("devops",
                    List.of("deploy", "infrastructure", "cloud", "docker", "kubernetes", "ci/cd", "aws"),
                    List.of("deploy", "cloud", "aws", "kubernetes", "infrastructure")),
            new DomainVocabulary("data",
                    List.of("data", "analyze", "dashboard", "report", "statistics", "visualization"),
                    List.of("data", "analyze", "dashboard")),
            new DomainVocabulary("research",
                    List.of("research", "investigate", "study", "evaluate"),
                    List.of()),
            new DomainVocabulary("design",
                    List.of("design", "ui", "ux", "mockup", "prototype", "interface"),
                    List.of()),
            new DomainVocabulary("testing",
                    List.of("test", "qa", "testing", "validation", "verify"),
                    List.of("test", "qa"))
    );

    public TaskAnalysis analyze(String description) {
        return analyze(description, Map.of());
    }

    /**
     * Analyzes a task description.
     *
     * @param description raw natural-language task, may be null or blank
     * @param context     optional caller context, carried on the analysis
     * @return the analysis; never null
     */
    public TaskAnalysis analyze(String description, Map<String, Object> context) {
        String text = description != null ? description : "";
        String lower = text.toLowerCase(Locale.ROOT);

        Complexity complexity = determineComplexity(lower);
        List<String> domains = identifyDomains(lower);
        List<String> requirements = extractRequirements(text);
        boolean requiresDecomposition = complexity != Complexity.SIMPLE;
        int estimatedSubtasks = estimateSubtasks(complexity, lower);

        log.debug("Analyzed task: complexity={}, domains={}, requirements={}, estimatedSubtasks={}",
                complexity, domains, requirements.size(), estimatedSubtasks);

        return new TaskAnalysis(text, complexity, domains, requiresDecomposition,
                estimatedSubtasks, requirements, context);
    }

    Complexity determineComplexity(String lower) {
        int complexScore = countMatches(lower, COMPLEX_MARKERS);
        int mediumScore = countMatches(lower, MEDIUM_MARKERS);
        int simpleScore = countMatches(lower, SIMPLE_MARKERS);
        int actionCount = countMatches(lower, ACTION_VERBS);

        if (complexScore > 0 || actionCount > 3) {
            return Complexity.COMPLEX;
        }
        if (actionCount >= 1 && simpleScore == 0) {
            return Complexity.MEDIUM;
        }
        if (simpleScore > 0 && actionCount <= 1) {
            return Complexity.SIMPLE;
        }
        if (mediumScore > 0 || actionCount > 1) {
            return Complexity.MEDIUM;
        }
        return Complexity.SIMPLE;
    }

    List<String> identifyDomains(String lower) {
        var scores = new LinkedHashMap<String, Double>();
        for (var vocabulary : DOMAINS) {
            int hits = countMatches(lower, vocabulary.keywords());
            if (hits == 0) {
                continue;
            }
            double score = hits;
            if (vocabulary.priorityKeywords().stream().anyMatch(lower::contains)) {
                score += PRIORITY_BONUS;
            }
            scores.put(vocabulary.domain(), score);
        }
        if (scores.isEmpty()) {
            return List.of("general");
        }
        // List.sort is stable, so equal scores keep vocabulary order
        var ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.comparing(scores::get, Comparator.reverseOrder()));
        return ranked;
    }

    List<String> extractRequirements(String text) {
        String normalized = text.replace(',', '\n').replace(" and ", "\n");
        var requirements = new ArrayList<String>();
        for (String part : normalized.split("\n")) {
            String fragment = part.strip();
            if (fragment.length() >= MIN_REQUIREMENT_LENGTH) {
                requirements.add(fragment);
            }
            if (requirements.size() == MAX_REQUIREMENTS) {
                break;
            }
        }
        return requirements;
    }

    int estimateSubtasks(Complexity complexity, String lower) {
        int base = switch (complexity) {
            case SIMPLE -> 1;
            case MEDIUM -> 3;
            case COMPLEX -> 5;
        };
        return Math.min(base + countMatches(lower, ACTION_VERBS), MAX_ESTIMATED_SUBTASKS);
    }

    private static int countMatches(String lower, List<String> keywords) {
        int count = 0;
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                count++;
            }
        }
        return count;
    }
}
