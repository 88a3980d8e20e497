package de.bsommerfeld.reddharvest.retrieval.download;

import com.google.common.net.MediaType;
import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.retrieval.resolve.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP fetcher built on {@link HttpClient}. Media is read fully into
 * memory, reporting progress via {@link DownloadProgressListener}; pages are
 * read as text.
 *
 * <p>
 * {@link #READ_TIMEOUT} bounds every wait on the server: for the response
 * headers and between two body chunks. A stalled transfer is cancelled and
 * reported as {@link IOException}. Redirects are followed. There are no
 * retries.
 */
@Singleton
public class Downloader implements PageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(Downloader.class);

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    static final Duration READ_TIMEOUT = Duration.ofSeconds(8);
    static final int CHUNK_SIZE = 16 * 1024;
    /** Upper bound for buffer pre-allocation from a server-supplied Content-Length. */
    static final int MAX_PREALLOCATION = CHUNK_SIZE * 64;
    private static final long PROGRESS_LOG_STEP = 1024L * 1024L;

    private static final String USER_AGENT = "redd-harvest (media downloader)";

    private final HttpClient http;
    private final Duration readTimeout;

    public Downloader() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build(), READ_TIMEOUT);
    }

    Downloader(HttpClient http, Duration readTimeout) {
        this.http = http;
        this.readTimeout = readTimeout;
    }

    /**
     * Downloads a URL entirely into memory and returns the raw bytes.
     */
    public byte[] fetchBytes(String url, DownloadProgressListener listener) throws IOException {
        BodyCollector collector = new BodyCollector(listener);
        HttpResponse<Void> response = await(http.sendAsync(request(url), collector::handle), collector, url);
        validateStatus(response.statusCode(), url);
        return collector.bytes();
    }

    /** Downloads a URL, logging progress at DEBUG. */
    public byte[] fetchBytes(String url) throws IOException {
        return fetchBytes(url, debugProgress(url));
    }

    @Override
    public String fetchPage(String url) throws IOException {
        BodyCollector collector = new BodyCollector(DownloadProgressListener.none());
        HttpResponse<Void> response = await(http.sendAsync(request(url), collector::handle), collector, url);
        validateStatus(response.statusCode(), url);
        return new String(collector.bytes(), charset(response.headers()));
    }

    private HttpRequest request(String url) throws IOException {
        try {
            return HttpRequest.newBuilder(URI.create(url))
                    .timeout(readTimeout)
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
    }

    /**
     * Waits for the exchange while the collector keeps seeing data. The
     * deadline moves forward with every chunk received.
     */
    private HttpResponse<Void> await(CompletableFuture<HttpResponse<Void>> pending, BodyCollector collector,
            String url) throws IOException {
        long timeoutNanos = readTimeout.toNanos();
        try {
            while (true) {
                long remaining = timeoutNanos - (System.nanoTime() - collector.lastActivity());
                if (remaining <= 0) {
                    pending.cancel(true);
                    throw new IOException("No data from " + url + " for " + readTimeout.toMillis() + "ms");
                }
                try {
                    return pending.get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    // data may have arrived meanwhile, recompute the deadline
                    continue;
                }
            }
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + url, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Download failed: " + url, cause);
        }
    }

    static int initialCapacity(long contentLength) {
        if (contentLength <= 0) {
            return CHUNK_SIZE;
        }
        return (int) Math.min(contentLength, MAX_PREALLOCATION);
    }

    static Charset charset(HttpHeaders headers) {
        String contentType = headers.firstValue("Content-Type").orElse(null);
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return MediaType.parse(contentType).charset().or(StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.debug("Unusable Content-Type '{}', decoding as UTF-8", contentType);
            return StandardCharsets.UTF_8;
        }
    }

    private static DownloadProgressListener debugProgress(String url) {
        return DownloadProgressListener.throttled(PROGRESS_LOG_STEP, (bytesRead, totalBytes) ->
                LOG.debug("{}: {} / {} bytes", url, bytesRead, totalBytes < 0 ? "?" : totalBytes));
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    private static void validateStatus(int status, String url) throws IOException {
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " for " + url);
        }
    }

    // =====================================================================
    // Body Collection
    // =====================================================================

    /**
     * Buffers a 2xx response body and records when data last arrived. Error
     * bodies are discarded. Chunks are delivered serially by the client, so
     * only the activity stamp is shared with the waiting thread.
     */
    static final class BodyCollector implements Flow.Subscriber<List<ByteBuffer>> {

        private final DownloadProgressListener listener;
        private volatile long lastActivity = System.nanoTime();

        private ByteArrayOutputStream buffer = new ByteArrayOutputStream(CHUNK_SIZE);
        private long totalBytes = -1;
        private long transferred;

        BodyCollector(DownloadProgressListener listener) {
            this.listener = listener;
        }

        HttpResponse.BodySubscriber<Void> handle(HttpResponse.ResponseInfo info) {
            lastActivity = System.nanoTime();
            int status = info.statusCode();
            if (status < 200 || status >= 300) {
                return HttpResponse.BodySubscribers.discarding();
            }
            totalBytes = info.headers().firstValueAsLong("Content-Length").orElse(-1);
            buffer = new ByteArrayOutputStream(initialCapacity(totalBytes));
            return HttpResponse.BodySubscribers.fromSubscriber(this);
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> chunks) {
            lastActivity = System.nanoTime();
            byte[] chunk = new byte[CHUNK_SIZE];
            for (ByteBuffer bytes : chunks) {
                while (bytes.hasRemaining()) {
                    int read = Math.min(bytes.remaining(), CHUNK_SIZE);
                    bytes.get(chunk, 0, read);
                    buffer.write(chunk, 0, read);
                    transferred += read;
                    listener.onProgress(transferred, totalBytes);
                }
            }
        }

        @Override
        public void onError(Throwable throwable) {
            LOG.debug("Body transfer failed after {} bytes", transferred, throwable);
        }

        @Override
        public void onComplete() {
            lastActivity = System.nanoTime();
        }

        long lastActivity() {
            return lastActivity;
        }

        byte[] bytes() {
            return buffer.toByteArray();
        }
    }
}
