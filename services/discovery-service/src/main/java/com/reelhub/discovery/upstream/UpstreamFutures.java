package com.reelhub.discovery.upstream;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

public final class UpstreamFutures {
    private UpstreamFutures() {
    }

    /**
     * Waits for an upstream future and rethrows its failure unwrapped, so callers see the typed
     * provider exception.
     */
    public static <T> T join(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TmdbUnavailableException("tmdb_interrupted", e);
        } catch (ExecutionException e) {
            throw propagate(e);
        }
    }

    public static RuntimeException propagate(Throwable error) {
        Throwable cause = TmdbClient.unwrap(error);
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new TmdbUnavailableException("tmdb_unavailable", cause);
    }
}
