package com.sandcastle.sandbox.output;

import com.sandcastle.core.error.StorageException;
import com.sandcastle.core.metrics.SandcastleMetrics;
import com.sandcastle.core.model.ExecutionStatus;
import com.sandcastle.core.model.OutputItem;
import com.sandcastle.core.model.OutputKind;
import com.sandcastle.core.model.StorageReference;
import com.sandcastle.sandbox.DispatchResult;
import com.sandcastle.sandbox.RawCapture;
import com.sandcastle.sandbox.RuntimeProtocol;
import com.sandcastle.sandbox.SandboxProperties;
import com.sandcastle.storage.BlobPersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw runtime output into ordered {@link OutputItem}s.
 * <p>
 * Order: stdout text and displays as emitted, then stderr text, then errors.
 * Payloads above the inline limit for their kind are moved to blob storage;
 * if that fails the item stays inline, cut to the limit and flagged.
 * <p>
 * Text that is not valid UTF-8 is returned base64-encoded so the original
 * bytes survive. Display MIME types come from executed code and are only
 * trusted for common raster image formats.
 */
@Component
public class OutputCapture {

    private static final Logger log = LoggerFactory.getLogger(OutputCapture.class);

    static final String INTERNAL_MIME_PREFIX = "application/vnd.sandcastle.";
    static final String UTF8_TEXT = "text/plain; charset=utf-8";
    static final String OCTET_STREAM = "application/octet-stream";

    static final Set<String> IMAGE_TYPES = Set.of(
            "image/png", "image/jpeg", "image/gif", "image/webp", "image/bmp");

    private static final Pattern MIME_TYPE = Pattern.compile(
            "[a-z0-9][a-z0-9!#$&^_.+-]{0,63}/[a-z0-9][a-z0-9!#$&^_.+-]{0,126}");

    private final BlobPersistenceGateway gateway;
    private final SandcastleMetrics metrics;
    private final int textLimit;
    private final int imageLimit;
    private final int captureLimit;

    public OutputCapture(BlobPersistenceGateway gateway, SandboxProperties properties, SandcastleMetrics metrics) {
        this.gateway = gateway;
        this.metrics = metrics;
        this.textLimit = properties.getTextInlineLimitBytes();
        this.imageLimit = properties.getImageInlineLimitBytes();
        this.captureLimit = properties.getMaxCaptureBytes();
    }

    /**
     * @param sessionId owning session, used for object keys
     * @param label     object key segment for this unit, e.g. {@code executions/3}
     */
    public List<OutputItem> capture(DispatchResult result, String sessionId, String label) {
        RawCapture raw = result.capture();
        var builder = new ItemBuilder(sessionId, label);

        var errors = new ArrayList<RuntimeProtocol.ErrorSegment>();
        for (RuntimeProtocol.Segment segment : RuntimeProtocol.parseStdout(raw.stdout(), raw.unit())) {
            if (segment instanceof RuntimeProtocol.TextSegment text) {
                builder.text("stdout", text.data());
            } else if (segment instanceof RuntimeProtocol.DisplaySegment display) {
                builder.display(display);
            } else if (segment instanceof RuntimeProtocol.ErrorSegment error) {
                errors.add(error);
            }
        }

        byte[] stderr = RuntimeProtocol.textBytes(raw.stderr(), raw.unit());
        if (stderr.length > 0) {
            builder.text("stderr", stderr);
        }
        if (raw.overflowed()) {
            String notice = "[output exceeded " + captureLimit + " bytes and was cut]\n";
            builder.text("stderr", notice.getBytes(StandardCharsets.UTF_8));
        }

        for (RuntimeProtocol.ErrorSegment error : errors) {
            builder.error(error.render(), Map.of("ename", error.name(), "evalue", error.value()));
        }
        if (result.failure() != null) {
            String ename = result.status() == ExecutionStatus.TIMED_OUT ? "Timeout" : "ProcessCrash";
            builder.error(result.failure(), Map.of("ename", ename, "evalue", result.failure()));
        }
        return builder.items;
    }

    /**
     * Cuts UTF-8 text to at most {@code limit} bytes without splitting a character.
     */
    static byte[] truncateUtf8(byte[] data, int limit) {
        if (data.length <= limit) {
            return data;
        }
        int cut = limit;
        while (cut > 0 && (data[cut] & 0xC0) == 0x80) {
            cut--;
        }
        return Arrays.copyOf(data, cut);
    }

    static boolean isUtf8(byte[] data) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    /**
     * The MIME type to record for a display, lower-cased and without
     * parameters, or {@code application/octet-stream} when it is malformed.
     */
    static String displayType(String declared) {
        if (declared == null) {
            return OCTET_STREAM;
        }
        int semi = declared.indexOf(';');
        String type = (semi < 0 ? declared : declared.substring(0, semi)).trim().toLowerCase(Locale.ROOT);
        return MIME_TYPE.matcher(type).matches() ? type : OCTET_STREAM;
    }

    private final class ItemBuilder {

        private final String sessionId;
        private final String label;
        private final List<OutputItem> items = new ArrayList<>();

        ItemBuilder(String sessionId, String label) {
            this.sessionId = sessionId;
            this.label = label;
        }

        void text(String stream, byte[] bytes) {
            if (isUtf8(bytes)) {
                add(OutputItem.inlineText(stream, new String(bytes, StandardCharsets.UTF_8)), bytes, textLimit, UTF8_TEXT);
            } else {
                add(OutputItem.inlineRawText(stream, bytes), bytes, textLimit, OCTET_STREAM);
            }
        }

        void display(RuntimeProtocol.DisplaySegment display) {
            String mime = displayType(display.mimeType());
            if (mime.startsWith(INTERNAL_MIME_PREFIX)) {
                return;
            }
            byte[] data = display.data();
            if (IMAGE_TYPES.contains(mime)) {
                add(OutputItem.inlineImage(mime, data), data, imageLimit, mime);
                return;
            }
            if (mime.startsWith("image/") || OCTET_STREAM.equals(mime)) {
                add(OutputItem.inlineImage(OCTET_STREAM, data), data, imageLimit, OCTET_STREAM);
                return;
            }
            if (!isUtf8(data)) {
                OutputItem item = new OutputItem(OutputKind.TEXT, "stdout", mime, OutputItem.BASE64,
                        Base64.getEncoder().encodeToString(data), null, data.length, false, null, null);
                add(item, data, textLimit, OCTET_STREAM);
                return;
            }
            OutputItem item = new OutputItem(OutputKind.TEXT, "stdout", mime, OutputItem.UTF_8,
                    new String(data, StandardCharsets.UTF_8), null, data.length, false, null, null);
            add(item, data, textLimit, UTF8_TEXT);
        }

        void error(String rendered, Map<String, String> metadata) {
            byte[] bytes = rendered.getBytes(StandardCharsets.UTF_8);
            add(OutputItem.inlineError(rendered, metadata), bytes, textLimit, UTF8_TEXT);
        }

        private void add(OutputItem inline, byte[] payload, int limit, String contentType) {
            if (payload.length <= limit) {
                items.add(inline);
                return;
            }
            int ordinal = items.size();
            String prefix = BlobPersistenceGateway.keyPrefix(sessionId, label, ordinal, inline.kind().wire());
            try {
                StorageReference ref = gateway.persist(prefix, payload, contentType);
                metrics.recordSpill(inline.kind(), payload.length);
                items.add(OutputItem.stored(inline.kind(), inline.stream(), inline.mimeType(), ref, inline.metadata()));
            } catch (StorageException e) {
                log.warn("Could not spill {} output of {} bytes, returning it truncated: {}",
                        inline.kind().wire(), payload.length, e.getMessage());
                items.add(degrade(inline, payload, limit));
            }
        }

        private OutputItem degrade(OutputItem inline, byte[] payload, int limit) {
            String notice = "Output of " + payload.length + " bytes exceeded the inline limit of "
                    + limit + " bytes and could not be stored; only the first part is included";
            if (OutputItem.BASE64.equals(inline.encoding())) {
                byte[] cut = Arrays.copyOf(payload, limit);
                return inline.withTruncation(Base64.getEncoder().encodeToString(cut), notice);
            }
            byte[] cut = truncateUtf8(payload, limit);
            return inline.withTruncation(new String(cut, StandardCharsets.UTF_8), notice);
        }
    }
}
