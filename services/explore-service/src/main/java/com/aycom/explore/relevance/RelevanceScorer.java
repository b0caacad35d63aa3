package com.aycom.explore.relevance;

import com.aycom.explore.model.ProfileResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Fuzzy scoring of profile candidates against a short query. Each candidate scores the better
 * of its username and display name:
 * <ul>
 *   <li>exact match: {@value #EXACT_SCORE}</li>
 *   <li>containment in either direction: {@value #CONTAINMENT_SCORE}</li>
 *   <li>otherwise common prefix length divided by the longer string length</li>
 * </ul>
 * Candidates below {@value #MIN_SIMILARITY} never reach the recommended short-list.
 */
public class RelevanceScorer {
    public static final double EXACT_SCORE = 1.0;
    public static final double CONTAINMENT_SCORE = 0.9;
    public static final double MIN_SIMILARITY = 0.3;

    private static final Comparator<ProfileResult> RANKING = Comparator
        .comparingDouble(RelevanceScorer::scoreOf).reversed()
        .thenComparing(Comparator.comparingLong(ProfileResult::getFollowerCount).reversed())
        .thenComparing(ProfileResult::getUsername);

    private final int shortListLimit;

    public RelevanceScorer(int shortListLimit) {
        this.shortListLimit = Math.max(1, shortListLimit);
    }

    public double similarity(String query, String candidate) {
        String q = normalize(query);
        String c = normalize(candidate);
        if (q.isEmpty() || c.isEmpty()) {
            return 0.0;
        }
        if (q.equals(c)) {
            return EXACT_SCORE;
        }
        if (c.contains(q) || q.contains(c)) {
            return CONTAINMENT_SCORE;
        }
        int prefix = 0;
        int limit = Math.min(q.length(), c.length());
        while (prefix < limit && q.charAt(prefix) == c.charAt(prefix)) {
            prefix++;
        }
        return (double) prefix / Math.max(q.length(), c.length());
    }

    public double score(String query, ProfileResult candidate) {
        if (candidate == null) {
            return 0.0;
        }
        return Math.max(
            similarity(query, candidate.getUsername()),
            similarity(query, candidate.getDisplayName())
        );
    }

    /**
     * Attaches a relevance score to every candidate, keeping the input order.
     */
    public List<ProfileResult> annotate(String query, List<ProfileResult> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<ProfileResult> scored = new ArrayList<>(candidates.size());
        for (ProfileResult candidate : candidates) {
            scored.add(candidate.withRelevanceScore(score(query, candidate)));
        }
        return scored;
    }

    public List<ProfileResult> rank(String query, List<ProfileResult> candidates) {
        List<ProfileResult> scored = annotate(query, candidates);
        List<ProfileResult> eligible = new ArrayList<>();
        for (ProfileResult candidate : scored) {
            if (scoreOf(candidate) >= MIN_SIMILARITY) {
                eligible.add(candidate);
            }
        }
        eligible.sort(RANKING);
        if (eligible.size() > shortListLimit) {
            return List.copyOf(eligible.subList(0, shortListLimit));
        }
        return List.copyOf(eligible);
    }

    private static double scoreOf(ProfileResult candidate) {
        Double score = candidate.getRelevanceScore();
        return score == null ? 0.0 : score;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
