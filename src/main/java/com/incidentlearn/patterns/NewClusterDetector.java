package com.incidentlearn.patterns;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.incidentlearn.corpus.HashingTextEmbedder;
import com.incidentlearn.corpus.IncidentObservation;
import com.incidentlearn.corpus.TextEmbedder;

/**
 * Flags recent incidents far from every historical category centroid that arrive close together in
 * embedding space and in time.
 */
public class NewClusterDetector implements PatternDetector {
    private final TextEmbedder embedder;
    private final double novelDistance;
    private final int minNeighbors;
    private final Duration timeSpan;
    private final double clusterRadius;

    public NewClusterDetector(TextEmbedder embedder, double novelDistance, int minNeighbors, Duration timeSpan, double clusterRadius) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        if (novelDistance <= 0.0 || clusterRadius <= 0.0) {
            throw new IllegalArgumentException("novel distance and cluster radius must be > 0");
        }
        if (minNeighbors < 1) {
            throw new IllegalArgumentException("minNeighbors must be >= 1");
        }
        this.novelDistance = novelDistance;
        this.minNeighbors = minNeighbors;
        this.timeSpan = Objects.requireNonNull(timeSpan, "timeSpan");
        this.clusterRadius = clusterRadius;
    }

    @Override
    public String name() {
        return "new-cluster";
    }

    @Override
    public List<Pattern> detect(AnalysisInput input) {
        Map<String, double[]> centroids = historicalCentroids(input.historicalIncidents());

        List<Point> novel = new ArrayList<>();
        for (IncidentObservation incident : input.recentIncidents()) {
            double[] vector = embedder.embed(incident.description());
            double nearest = 1.0;
            for (double[] centroid : centroids.values()) {
                nearest = Math.min(nearest, TextEmbedder.distance(vector, centroid));
            }
            if (nearest > novelDistance) {
                novel.add(new Point(incident, vector, nearest));
            }
        }
        novel.sort(Comparator.comparing((Point point) -> point.incident().occurredAt())
                .thenComparing(point -> point.incident().incidentId()));

        List<Pattern> patterns = new ArrayList<>();
        boolean[] assigned = new boolean[novel.size()];
        for (int i = 0; i < novel.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            Point seed = novel.get(i);
            List<Integer> members = new ArrayList<>();
            members.add(i);
            for (int j = i + 1; j < novel.size(); j++) {
                Point other = novel.get(j);
                if (assigned[j]) {
                    continue;
                }
                Duration gap = Duration.between(seed.incident().occurredAt(), other.incident().occurredAt()).abs();
                if (gap.compareTo(timeSpan) <= 0 && TextEmbedder.distance(seed.vector(), other.vector()) <= clusterRadius) {
                    members.add(j);
                }
            }
            if (members.size() - 1 < minNeighbors) {
                continue;
            }
            members.forEach(index -> assigned[index] = true);
            patterns.add(toPattern(members.stream().map(novel::get).toList(), input));
        }
        return patterns;
    }

    private Map<String, double[]> historicalCentroids(List<IncidentObservation> history) {
        Map<String, List<double[]>> byCategory = new HashMap<>();
        for (IncidentObservation incident : history) {
            byCategory.computeIfAbsent(incident.category(), ignored -> new ArrayList<>()).add(embedder.embed(incident.description()));
        }
        Map<String, double[]> centroids = new HashMap<>();
        byCategory.forEach((category, vectors) -> centroids.put(category, TextEmbedder.centroid(vectors, embedder.dimension())));
        return centroids;
    }

    private Pattern toPattern(List<Point> members, AnalysisInput input) {
        double[] centroid = TextEmbedder.centroid(members.stream().map(Point::vector).toList(), embedder.dimension());
        double meanDistance = members.stream().mapToDouble(point -> TextEmbedder.distance(point.vector(), centroid)).average().orElse(0.0);
        double meanNovelty = members.stream().mapToDouble(Point::novelty).average().orElse(0.0);
        double confidence = 1.0 - meanDistance / novelDistance;

        String dominantCategory = members.stream()
                .collect(Collectors.groupingBy(point -> point.incident().category(), Collectors.counting()))
                .entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue().thenComparing(Map.Entry.<String, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse("uncategorized");
        List<String> keywords = topKeywords(members, 3);
        Duration span = Duration.between(members.get(0).incident().occurredAt(), members.get(members.size() - 1).incident().occurredAt());

        Map<String, Double> statistics = new HashMap<>();
        statistics.put("size", (double) members.size());
        statistics.put("meanDistanceToCentroid", meanDistance);
        statistics.put("meanNovelty", meanNovelty);
        statistics.put("spanHours", span.toMinutes() / 60.0);
        PatternEvidence evidence = new PatternEvidence(
                statistics,
                members.stream().map(point -> point.incident().incidentId()).toList(),
                Map.of("keywords", String.join(",", keywords), "category", dominantCategory));
        String subject = "cluster:" + dominantCategory + ":" + String.join("-", keywords);
        return Pattern.detected(PatternKind.NEW_CLUSTER, subject, evidence, confidence, input.analyzedAt());
    }

    private List<String> topKeywords(List<Point> members, int limit) {
        return members.stream()
                .flatMap(point -> HashingTextEmbedder.tokenize(point.incident().description()).stream())
                .filter(token -> token.length() > 3)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    private record Point(IncidentObservation incident, double[] vector, double novelty) {
    }
}
