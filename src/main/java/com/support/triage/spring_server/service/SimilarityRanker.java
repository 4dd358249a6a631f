package com.support.triage.spring_server.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.support.triage.spring_server.dto.CollaboratorResult;
import com.support.triage.spring_server.dto.SimilarIssue;
import com.support.triage.spring_server.entity.Issue;
import com.support.triage.spring_server.exception.InvalidInputException;
import com.support.triage.spring_server.exception.ResourceNotFoundException;
import com.support.triage.spring_server.util.EnglishStopWords;
import com.support.triage.spring_server.util.TfIdfVectorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks previously resolved issues by TF-IDF cosine similarity to a piece of text.
 * <p>
 * The vectorizer is fitted per call over the corpus plus the query, so rankings always
 * reflect the current corpus and no index has to be maintained.
 */
@Service
public class SimilarityRanker {
    private static final Logger log = LoggerFactory.getLogger(SimilarityRanker.class);

    public static final int DEFAULT_LIMIT = 5;
    public static final int MAX_LIMIT = 50;
    static final double MIN_SCORE = 0.1;
    static final int DESCRIPTION_PREVIEW_LENGTH = 200;

    private static final TypeReference<List<SimilarIssue>> SIMILAR_LIST = new TypeReference<>() {
    };

    private final IssueStore issueStore;
    private final CacheFacade cacheFacade;

    @Value("${triage.similarity.corpus-size:1000}")
    private int corpusSize;

    @Value("${triage.similarity.corpus-timeout-ms:2000}")
    private long corpusTimeoutMs;

    @Value("${triage.similarity.max-features:1000}")
    private int maxFeatures;

    @Autowired
    public SimilarityRanker(IssueStore issueStore, CacheFacade cacheFacade) {
        this.issueStore = issueStore;
        this.cacheFacade = cacheFacade;
    }

    public List<SimilarIssue> rankSimilar(String title, String description, int limit) {
        validateLimit(limit);
        return rank((title == null ? "" : title) + " " + (description == null ? "" : description), limit, null);
    }

    /**
     * Similar resolved issues for a stored issue, excluding the issue itself. Cached for an hour.
     */
    public List<SimilarIssue> findSimilarIssues(String issueId, int limit) {
        validateLimit(limit);
        Issue issue = issueStore.findIssue(issueId)
                .orElseThrow(() -> new ResourceNotFoundException("Issue", issueId));
        return cacheFacade.getOrCompute(CacheKind.SIMILAR_ISSUES, issueId + ":" + limit, SIMILAR_LIST,
                () -> rank(issue.searchableText(), limit, issueId));
    }

    private List<SimilarIssue> rank(String queryText, int limit, String excludeId) {
        CollaboratorResult<List<Issue>> corpusResult =
                issueStore.findRecentResolvedIssues(corpusSize, Duration.ofMillis(corpusTimeoutMs));
        if (!corpusResult.isSuccess()) {
            log.warn("Similarity corpus unavailable ({}): {}", corpusResult.getErrorKind(), corpusResult.getErrorMessage());
            return List.of();
        }

        List<Issue> corpus = new ArrayList<>();
        for (Issue candidate : corpusResult.getValue()) {
            if (excludeId == null || !excludeId.equals(candidate.getIssueId())) {
                corpus.add(candidate);
            }
        }
        if (corpus.isEmpty()) {
            return List.of();
        }

        List<String> documents = new ArrayList<>(corpus.size() + 1);
        for (Issue candidate : corpus) {
            documents.add(candidate.searchableText());
        }
        documents.add(queryText);

        TfIdfVectorizer vectorizer = new TfIdfVectorizer(maxFeatures, 1, 2, EnglishStopWords.WORDS);
        List<TfIdfVectorizer.SparseVector> vectors = vectorizer.fitTransform(documents);
        TfIdfVectorizer.SparseVector query = vectors.get(vectors.size() - 1);

        List<Scored> scored = new ArrayList<>(corpus.size());
        for (int i = 0; i < corpus.size(); i++) {
            scored.add(new Scored(corpus.get(i), TfIdfVectorizer.cosine(query, vectors.get(i))));
        }
        // List.sort is stable: equal scores keep corpus order
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        List<SimilarIssue> result = new ArrayList<>();
        for (Scored entry : scored.subList(0, Math.min(limit, scored.size()))) {
            if (entry.score() > MIN_SCORE) {
                result.add(toSimilarIssue(entry));
            }
        }
        log.debug("Ranked {} corpus issues, {} above threshold (vocabulary {})",
                corpus.size(), result.size(), vectorizer.vocabularySize());
        return result;
    }

    private static SimilarIssue toSimilarIssue(Scored entry) {
        Issue issue = entry.issue();
        return new SimilarIssue(
                issue.getIssueId(),
                issue.getTitle(),
                preview(issue.getDescription()),
                issue.getSeverity(),
                entry.score(),
                issue.getResolutionTimeHours());
    }

    static String preview(String description) {
        if (description == null) {
            return "";
        }
        int end = Math.min(description.length(), DESCRIPTION_PREVIEW_LENGTH);
        return description.substring(0, end) + "...";
    }

    private static void validateLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidInputException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
    }

    private record Scored(Issue issue, double score) {
    }
}
