package de.bsommerfeld.reddharvest.retrieval.download;

import com.google.inject.Singleton;
import de.bsommerfeld.reddharvest.core.util.UrlUtils;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.apache.tika.mime.MimeType;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Sniffs downloaded bytes with Tika's magic-byte detection.
 *
 * <p>
 * Images and videos get the canonical extension of the detected type.
 * Anything else, or a type without a registered extension, keeps the
 * extension of the source URL. {@code .jpeg} always becomes {@code .jpg}.
 */
@Singleton
public class MediaKindDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MediaKindDetector.class);

    private final MimeTypes mimeTypes;

    public MediaKindDetector() {
        this.mimeTypes = MimeTypes.getDefaultMimeTypes();
    }

    public DetectedMedia detect(byte[] data, String sourceUrl) {
        String urlExtension = UrlUtils.fileExtension(sourceUrl);
        MediaType mediaType = sniff(data, sourceUrl);

        MediaKind kind = kindOf(mediaType);
        if (kind == MediaKind.UNKNOWN) {
            return new DetectedMedia(kind, urlExtension);
        }
        String extension = extensionOf(mediaType);
        return new DetectedMedia(kind, extension.isEmpty() ? urlExtension : extension);
    }

    private MediaType sniff(byte[] data, String sourceUrl) {
        try (TikaInputStream stream = TikaInputStream.get(data)) {
            return mimeTypes.detect(stream, new Metadata());
        } catch (IOException e) {
            LOG.warn("Could not sniff content of {}: {}", sourceUrl, e.getMessage());
            return MediaType.OCTET_STREAM;
        }
    }

    private static MediaKind kindOf(MediaType mediaType) {
        return switch (mediaType.getType()) {
            case "image" -> MediaKind.IMAGE;
            case "video" -> MediaKind.VIDEO;
            default -> MediaKind.UNKNOWN;
        };
    }

    private String extensionOf(MediaType mediaType) {
        try {
            MimeType mimeType = mimeTypes.forName(mediaType.toString());
            return UrlUtils.normalizeExtension(mimeType.getExtension());
        } catch (MimeTypeException e) {
            LOG.debug("No registered extension for {}", mediaType);
            return "";
        }
    }
}
