package br.edu.ifba.graphmemory.ingest;

import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.exception.EpisodeCancelledException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one episode moving through the pipeline, shared between the worker
 * running it and the caller holding its {@link EpisodeSubmission}.
 */
final class EpisodeRun {

    private final Episode episode;
    private final List<String> warnings = new ArrayList<>();
    private volatile EpisodeStage stage = EpisodeStage.RECEIVED;
    private boolean cancelled;
    private boolean committing;

    EpisodeRun(@NotNull Episode episode) {
        this.episode = episode;
    }

    Episode episode() {
        return episode;
    }

    EpisodeStage stage() {
        return stage;
    }

    /**
     * Moves to {@code next}, failing if the run was cancelled in the meantime.
     */
    void enter(@NotNull EpisodeStage next) {
        checkpoint();
        stage = next;
    }

    void checkpoint() {
        synchronized (this) {
            if (cancelled) {
                throw new EpisodeCancelledException(episode.getUuid());
            }
        }
    }

    /**
     * Last point at which a cancellation still discards the run.
     */
    synchronized void beginCommit() {
        if (cancelled) {
            throw new EpisodeCancelledException(episode.getUuid());
        }
        committing = true;
    }

    /**
     * Stage a failure is reported against: {@link EpisodeStage#PERSISTED} once the commit has started.
     */
    synchronized EpisodeStage failingStage() {
        return committing ? EpisodeStage.PERSISTED : stage;
    }

    void persisted() {
        stage = EpisodeStage.PERSISTED;
    }

    void failed() {
        stage = EpisodeStage.FAILED;
    }

    /**
     * @return false once the commit has started
     */
    synchronized boolean cancel() {
        if (committing || stage.isTerminal()) {
            return false;
        }
        cancelled = true;
        return true;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    void warn(@NotNull String warning) {
        synchronized (warnings) {
            warnings.add(warning);
        }
    }

    void warnAll(@NotNull List<String> more) {
        synchronized (warnings) {
            warnings.addAll(more);
        }
    }

    List<String> warnings() {
        synchronized (warnings) {
            return new ArrayList<>(warnings);
        }
    }
}
