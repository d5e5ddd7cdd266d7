package br.edu.ifba.graphmemory.ingest;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a submitted episode.
 *
 * <p>The result future always completes normally with an {@link EpisodeResult}, including
 * for failed and cancelled runs.</p>
 */
public final class EpisodeSubmission {

    private final String episodeId;
    private final EpisodeRun run;
    private final CompletableFuture<EpisodeResult> result;

    EpisodeSubmission(@NotNull EpisodeRun run, @NotNull CompletableFuture<EpisodeResult> result) {
        this.episodeId = run.episode().getUuid();
        this.run = run;
        this.result = result;
    }

    @NotNull
    public String getEpisodeId() {
        return episodeId;
    }

    @NotNull
    public CompletableFuture<EpisodeResult> result() {
        return result;
    }

    /**
     * Stage the run is currently in.
     */
    @NotNull
    public EpisodeStage currentStage() {
        return run.stage();
    }

    /**
     * Requests cancellation. The run stops at its next stage boundary and commits nothing.
     *
     * @return false if the commit already started or the run already finished; the episode is then unaffected
     */
    public boolean cancel() {
        return run.cancel();
    }

    public boolean isCancelled() {
        return run.isCancelled();
    }
}
