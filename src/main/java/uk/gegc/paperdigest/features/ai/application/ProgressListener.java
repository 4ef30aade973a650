package uk.gegc.paperdigest.features.ai.application;

/**
 * Sink for human-readable status updates.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param message  status text
     * @param progress completed fraction in [0, 1], or {@code null} when unknown
     */
    void onProgress(String message, Double progress);
}
