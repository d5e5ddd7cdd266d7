package br.edu.ifba.graphmemory.dedup;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.EntitySummarizer;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.exception.CapabilityUnavailableException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds new evidence into a canonical node.
 *
 * Merge strategy:
 * - Labels: union, the canonical primary label stays first
 * - Attributes: new values only fill gaps
 * - Episode ids: union, in arrival order
 * - Summary: kept when the new description adds nothing; otherwise regenerated through the
 *   optional summarizer, falling back to concatenation. Never replaced by blank text.
 */
public class EntityMerger {

    private static final Logger logger = LoggerFactory.getLogger(EntityMerger.class);

    private static final String SUMMARY_SEPARATOR = " ";

    @Nullable
    private final EntitySummarizer summarizer;
    @Nullable
    private final CapabilityGate gate;

    public EntityMerger() {
        this(null, null);
    }

    public EntityMerger(@Nullable EntitySummarizer summarizer, @Nullable CapabilityGate gate) {
        if (summarizer != null && gate == null) {
            throw new IllegalArgumentException("A summarizer needs a capability gate");
        }
        this.summarizer = summarizer;
        this.gate = gate;
    }

    /**
     * Merges a resolved candidate into its canonical node.
     *
     * @param episodeId     episode contributing the candidate
     * @param referenceTime reference time of that episode; moves validAt back when earlier
     */
    @NotNull
    public EntityNode merge(
            @NotNull EntityNode canonical,
            @NotNull CandidateEntity candidate,
            @NotNull String episodeId,
            @NotNull Instant referenceTime,
            @NotNull List<String> warnings) {
        Set<String> labels = new LinkedHashSet<>(canonical.getLabels());
        if (candidate.type() != null) {
            labels.add(candidate.type());
        }

        Map<String, Object> attributes = new LinkedHashMap<>(canonical.getAttributes());
        candidate.attributes().forEach(attributes::putIfAbsent);

        EntityNode.Builder builder = canonical.addEpisodeId(episodeId).toBuilder()
            .labels(new ArrayList<>(labels))
            .attributes(attributes)
            .summary(mergeSummary(canonical.getName(), canonical.getSummary(), candidate.summary(), warnings));
        if (referenceTime.isBefore(canonical.getValidAt()) && canonical.isActive()) {
            builder.validAt(referenceTime);
        }
        return builder.build();
    }

    /**
     * Folds {@code source} into {@code target} for an administrative merge.
     */
    @NotNull
    public EntityNode absorb(@NotNull EntityNode target, @NotNull EntityNode source, @NotNull List<String> warnings) {
        Set<String> labels = new LinkedHashSet<>(target.getLabels());
        labels.addAll(source.getLabels());

        Map<String, Object> attributes = new LinkedHashMap<>(target.getAttributes());
        source.getAttributes().forEach(attributes::putIfAbsent);

        EntityNode merged = target;
        for (String episodeId : source.getEpisodeIds()) {
            merged = merged.addEpisodeId(episodeId);
        }
        EntityNode.Builder builder = merged.toBuilder()
            .labels(new ArrayList<>(labels))
            .attributes(attributes)
            .summary(mergeSummary(target.getName(), target.getSummary(), source.getSummary(), warnings));
        if (source.getValidAt().isBefore(target.getValidAt())) {
            builder.validAt(source.getValidAt());
        }
        return builder.build();
    }

    @NotNull
    String mergeSummary(@NotNull String entityName, @NotNull String current, @NotNull String incoming, @NotNull List<String> warnings) {
        if (incoming.isBlank() || contains(current, incoming)) {
            return current;
        }
        if (current.isBlank() || contains(incoming, current)) {
            return incoming;
        }
        if (summarizer != null) {
            try {
                String regenerated = gate.call("summarize-entity",
                    () -> summarizer.summarize(entityName, List.of(current, incoming)));
                if (regenerated != null && !regenerated.isBlank()) {
                    return regenerated.trim();
                }
                logger.warn("Entity summarizer returned no text for '{}', concatenating descriptions", entityName);
            } catch (CapabilityUnavailableException e) {
                warnings.add("Summary of '" + entityName + "' not regenerated: " + e.getMessage());
                logger.warn("Could not regenerate summary of '{}', concatenating descriptions: {}", entityName, e.getMessage());
            }
        }
        return current + SUMMARY_SEPARATOR + incoming;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle.trim().toLowerCase(Locale.ROOT));
    }
}
