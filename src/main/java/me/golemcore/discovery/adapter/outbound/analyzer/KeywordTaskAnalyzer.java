package me.golemcore.discovery.adapter.outbound.analyzer;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.discovery.domain.model.TaskAnalysis;
import me.golemcore.discovery.domain.model.TaskComplexity;
import me.golemcore.discovery.port.outbound.TaskAnalyzerPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based {@link TaskAnalyzerPort} built on fixed keyword tables.
 *
 * <p>
 * Recognizes explicit phrasings before falling back to keyword tables:
 * {@code "Task requiring <name> domain expertise"} and {@code "<name> domain"}
 * name the domain directly (hyphens and digits included), and
 * {@code "capabilities: a, b"} lists required capabilities verbatim, case
 * preserved.
 *
 * <p>
 * Confidence grows with the number of signals detected (domain, task type,
 * capabilities, keyword richness).
 */
@Component
@Slf4j
public class KeywordTaskAnalyzer implements TaskAnalyzerPort {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9_]+");
    private static final Pattern REQUIRED_DOMAIN = Pattern.compile("^task requiring\\s+(.+?)\\s+domain expertise\\b");
    private static final Pattern EXPLICIT_DOMAIN = Pattern.compile("(?<![a-z0-9_-])([a-z0-9][a-z0-9_-]*) domain\\b");
    private static final Pattern EXPLICIT_CAPABILITIES = Pattern.compile("capabilities:\\s*([^.;\\n]+)",
            Pattern.CASE_INSENSITIVE);

    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final int COMPLEX_WORD_COUNT = 40;
    private static final int SIMPLE_WORD_COUNT = 8;
    private static final int COMPLEX_CONNECTIVES = 3;
    private static final int COMPLEX_CAPABILITIES = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "into", "onto", "your", "you", "our",
            "are", "was", "were", "will", "would", "should", "could", "can", "need", "needs", "want",
            "please", "help", "some", "any", "all", "about", "have", "has", "had", "then", "than",
            "also", "task", "requiring", "using", "use", "make", "get", "out", "its", "their", "them");

    private static final Set<String> CONNECTIVES = Set.of("and", "then", "also", "after", "multiple", "plus");

    private static final Map<String, Set<String>> DOMAIN_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, Set<String>> TASK_TYPE_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, Set<String>> CAPABILITY_KEYWORDS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.put("technology", Set.of("technology", "tech", "software", "code", "programming",
                "api", "app", "application", "server", "database", "deploy", "bug", "developer"));
        DOMAIN_KEYWORDS.put("finance", Set.of("finance", "financial", "bank", "banking", "trading", "stock",
                "stocks", "accounting", "budget", "invoice", "tax", "portfolio", "fintech"));
        DOMAIN_KEYWORDS.put("healthcare", Set.of("healthcare", "health", "medical", "patient", "patients",
                "clinical", "diagnosis", "drug", "pharmaceutical"));
        DOMAIN_KEYWORDS.put("marketing", Set.of("marketing", "campaign", "advertising", "seo", "sales",
                "brand", "promotion", "audience"));
        DOMAIN_KEYWORDS.put("education", Set.of("education", "course", "student", "students", "learning",
                "teach", "teaching", "training", "lesson", "academic"));

        TASK_TYPE_KEYWORDS.put("data_analysis", Set.of("analyze", "analyse", "analysis", "analytics",
                "statistics", "visualize", "chart", "charts", "report", "metrics", "data"));
        TASK_TYPE_KEYWORDS.put("automation", Set.of("automate", "automation", "workflow", "schedule",
                "pipeline", "recurring", "trigger"));
        TASK_TYPE_KEYWORDS.put("content_creation", Set.of("write", "draft", "blog", "article", "content",
                "copy", "post", "story"));
        TASK_TYPE_KEYWORDS.put("research", Set.of("research", "investigate", "study", "survey", "compare"));
        TASK_TYPE_KEYWORDS.put("communication", Set.of("email", "message", "notify", "reply", "translate",
                "chat"));

        CAPABILITY_KEYWORDS.put("analysis", Set.of("analyze", "analyse", "analysis", "analytics"));
        CAPABILITY_KEYWORDS.put("visualization", Set.of("chart", "charts", "plot", "visualize", "dashboard"));
        CAPABILITY_KEYWORDS.put("search", Set.of("search", "find", "lookup", "retrieve"));
        CAPABILITY_KEYWORDS.put("writing", Set.of("write", "draft", "article", "blog", "copywriting"));
        CAPABILITY_KEYWORDS.put("translation", Set.of("translate", "translation"));
        CAPABILITY_KEYWORDS.put("automation", Set.of("automate", "automation", "workflow", "schedule"));
        CAPABILITY_KEYWORDS.put("code_generation", Set.of("code", "coding", "programming", "implement"));
        CAPABILITY_KEYWORDS.put("nlp", Set.of("nlp", "summarize", "summarise", "sentiment", "classify"));
        CAPABILITY_KEYWORDS.put("data_processing", Set.of("csv", "etl", "dataset", "spreadsheet", "clean"));
    }

    @Override
    public TaskAnalysis analyzeTask(String taskDescription) {
        String original = taskDescription != null ? taskDescription.trim() : "";
        String text = original.toLowerCase(Locale.ROOT);
        List<String> tokens = tokenize(text);

        String domain = detectDomain(text, tokens);
        String taskType = bestMatch(TASK_TYPE_KEYWORDS, tokens);
        Set<String> capabilities = detectCapabilities(original, tokens);
        List<String> keywords = extractKeywords(tokens);
        TaskComplexity complexity = estimateComplexity(tokens, capabilities);

        double confidence = 0.4;
        if (domain != null && !TaskAnalysis.GENERAL_DOMAIN.equals(domain)) {
            confidence += 0.2;
        }
        if (taskType != null) {
            confidence += 0.2;
        }
        if (!capabilities.isEmpty()) {
            confidence += 0.1;
        }
        if (keywords.size() >= 3) {
            confidence += 0.1;
        }

        TaskAnalysis analysis = TaskAnalysis.builder()
                .taskType(taskType != null ? taskType : "general")
                .domain(domain != null ? domain : TaskAnalysis.GENERAL_DOMAIN)
                .complexity(complexity)
                .requiredCapabilities(capabilities)
                .keywords(keywords)
                .confidence(Math.min(1.0, confidence))
                .build();
        log.trace("[Analyzer] {}", analysis);
        return analysis;
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private String detectDomain(String text, List<String> tokens) {
        Matcher required = REQUIRED_DOMAIN.matcher(text);
        if (required.find()) {
            return required.group(1);
        }
        Matcher explicit = EXPLICIT_DOMAIN.matcher(text);
        while (explicit.find()) {
            if (!STOP_WORDS.contains(explicit.group(1))) {
                return explicit.group(1);
            }
        }
        return bestMatch(DOMAIN_KEYWORDS, tokens);
    }

    private Set<String> detectCapabilities(String original, List<String> tokens) {
        Set<String> capabilities = new LinkedHashSet<>();
        Matcher explicit = EXPLICIT_CAPABILITIES.matcher(original);
        if (explicit.find()) {
            for (String capability : explicit.group(1).split(",")) {
                if (!capability.isBlank()) {
                    capabilities.add(capability.trim());
                }
            }
            return capabilities;
        }
        for (Map.Entry<String, Set<String>> entry : CAPABILITY_KEYWORDS.entrySet()) {
            if (tokens.stream().anyMatch(entry.getValue()::contains)) {
                capabilities.add(entry.getKey());
            }
        }
        return capabilities;
    }

    private List<String> extractKeywords(List<String> tokens) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : tokens) {
            if (token.length() >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return new ArrayList<>(keywords);
    }

    private TaskComplexity estimateComplexity(List<String> tokens, Set<String> capabilities) {
        long connectives = tokens.stream().filter(CONNECTIVES::contains).count();
        if (tokens.size() > COMPLEX_WORD_COUNT || connectives >= COMPLEX_CONNECTIVES
                || capabilities.size() >= COMPLEX_CAPABILITIES) {
            return TaskComplexity.COMPLEX;
        }
        if (tokens.size() <= SIMPLE_WORD_COUNT && capabilities.size() <= 1) {
            return TaskComplexity.SIMPLE;
        }
        return TaskComplexity.MODERATE;
    }

    /**
     * Entry with the most token hits; earlier entries win ties. Null when nothing
     * matched.
     */
    private static String bestMatch(Map<String, Set<String>> table, List<String> tokens) {
        String best = null;
        long bestHits = 0;
        for (Map.Entry<String, Set<String>> entry : table.entrySet()) {
            long hits = tokens.stream().filter(entry.getValue()::contains).count();
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }
        return best;
    }
}
