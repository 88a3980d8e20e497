package de.bsommerfeld.reddharvest.retrieval.download;

/**
 * Receives the progress of a single media download. Called on the thread
 * performing the download, once per chunk read.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    /**
     * @param bytesRead  bytes received so far
     * @param totalBytes announced {@code Content-Length}, or -1 if the server
     *                   did not send one
     */
    void onProgress(long bytesRead, long totalBytes);

    static DownloadProgressListener none() {
        return (bytesRead, totalBytes) -> {
        };
    }

    /**
     * Forwards to {@code delegate} at most once per {@code stepBytes} bytes,
     * plus the chunk that completes a download of known size.
     */
    static DownloadProgressListener throttled(long stepBytes, DownloadProgressListener delegate) {
        if (stepBytes <= 0) {
            throw new IllegalArgumentException("stepBytes must be positive: " + stepBytes);
        }
        return new DownloadProgressListener() {
            private long nextReport = stepBytes;

            @Override
            public void onProgress(long bytesRead, long totalBytes) {
                if (bytesRead >= nextReport || bytesRead == totalBytes) {
                    delegate.onProgress(bytesRead, totalBytes);
                    nextReport = bytesRead + stepBytes;
                }
            }
        };
    }
}
