package br.edu.ifba.graphmemory.ingest;

import br.edu.ifba.graphmemory.exception.ErrorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one episode run.
 *
 * <p>On success {@code stage} is {@link EpisodeStage#PERSISTED} and the counts describe what
 * was committed. On failure {@code stage} is the stage that failed, {@code errorKind} and
 * {@code errorMessage} are set, and nothing was committed.</p>
 *
 * @param entitiesCreated    new entity nodes
 * @param entitiesMerged     candidates resolved to an existing node
 * @param edgesCreated       new edges, including ones created already closed
 * @param edgesInvalidated   existing or new edges closed by this episode
 * @param edgesCorroborated  existing edges that received this episode as provenance instead of a duplicate
 * @param warnings           data-quality degradations that did not fail the run
 */
public record EpisodeResult(
    @NotNull String episodeId,
    @NotNull String namespace,
    @NotNull EpisodeStage stage,
    @Nullable EpisodeStage failedStage,
    @Nullable ErrorKind errorKind,
    @Nullable String errorMessage,
    int entitiesCreated,
    int entitiesMerged,
    int edgesCreated,
    int edgesInvalidated,
    int edgesCorroborated,
    @NotNull List<String> warnings,
    @NotNull Duration duration
) {

    public EpisodeResult {
        Objects.requireNonNull(episodeId, "episodeId must not be null");
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(stage, "stage must not be null");
        warnings = List.copyOf(warnings);
    }

    public static EpisodeResult success(
            @NotNull String episodeId,
            @NotNull String namespace,
            int entitiesCreated,
            int entitiesMerged,
            int edgesCreated,
            int edgesInvalidated,
            int edgesCorroborated,
            @NotNull List<String> warnings,
            @NotNull Duration duration) {
        return new EpisodeResult(episodeId, namespace, EpisodeStage.PERSISTED, null, null, null,
            entitiesCreated, entitiesMerged, edgesCreated, edgesInvalidated, edgesCorroborated, warnings, duration);
    }

    public static EpisodeResult failure(
            @NotNull String episodeId,
            @NotNull String namespace,
            @NotNull EpisodeStage failedStage,
            @NotNull ErrorKind errorKind,
            @Nullable String errorMessage,
            @NotNull List<String> warnings,
            @NotNull Duration duration) {
        return new EpisodeResult(episodeId, namespace, EpisodeStage.FAILED, failedStage, errorKind, errorMessage,
            0, 0, 0, 0, 0, warnings, duration);
    }

    public boolean isSuccess() {
        return stage == EpisodeStage.PERSISTED;
    }
}
