package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * One captured piece of execution output.
 * <p>
 * Carries exactly one of an inline payload or a storage reference. Inline text
 * and error payloads are UTF-8 strings unless the bytes are not valid UTF-8;
 * inline image payloads and such text are base64.
 *
 * @param kind      text, image or error
 * @param stream    originating stream for text items ("stdout" or "stderr"), null otherwise
 * @param mimeType  MIME type of the payload
 * @param encoding  "utf-8" or "base64", describing {@code inline}
 * @param inline    the payload when small enough to return directly
 * @param storage   where the payload lives when it was spilled
 * @param sizeBytes size of the full, untruncated payload
 * @param truncated true when a spill failed and {@code inline} was cut to the inline limit
 * @param notice    human-readable explanation accompanying a truncation
 * @param metadata  kind-specific extras, e.g. error name and value
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutputItem(
    @JsonProperty("kind") OutputKind kind,
    @JsonProperty("stream") String stream,
    @JsonProperty("mime_type") String mimeType,
    @JsonProperty("encoding") String encoding,
    @JsonProperty("inline") String inline,
    @JsonProperty("storage") StorageReference storage,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("notice") String notice,
    @JsonProperty("metadata") Map<String, String> metadata
) implements Serializable {

    public static final String UTF_8 = "utf-8";
    public static final String BASE64 = "base64";

    public OutputItem {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if ((inline == null) == (storage == null)) {
            throw new IllegalArgumentException("exactly one of inline payload or storage reference is required");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static OutputItem inlineText(String stream, String text) {
        return new OutputItem(OutputKind.TEXT, stream, "text/plain", UTF_8, text,
                null, text.getBytes(StandardCharsets.UTF_8).length, false, null, null);
    }

    /**
     * Text output that is not valid UTF-8, kept byte for byte as base64.
     */
    public static OutputItem inlineRawText(String stream, byte[] data) {
        return new OutputItem(OutputKind.TEXT, stream, "text/plain", BASE64,
                Base64.getEncoder().encodeToString(data), null, data.length, false, null, null);
    }

    public static OutputItem inlineImage(String mimeType, byte[] data) {
        return new OutputItem(OutputKind.IMAGE, null, mimeType, BASE64,
                Base64.getEncoder().encodeToString(data), null, data.length, false, null, null);
    }

    public static OutputItem inlineError(String text, Map<String, String> metadata) {
        return new OutputItem(OutputKind.ERROR, null, "text/plain", UTF_8, text,
                null, text.getBytes(StandardCharsets.UTF_8).length, false, null, metadata);
    }

    public static OutputItem stored(OutputKind kind, String stream, String mimeType,
                                    StorageReference storage, Map<String, String> metadata) {
        return new OutputItem(kind, stream, mimeType, null, null, storage,
                storage.sizeBytes(), false, null, metadata);
    }

    @JsonIgnore
    public boolean isInline() {
        return inline != null;
    }

    /**
     * Decodes the inline payload back to bytes, honouring {@link #encoding()}.
     */
    public byte[] inlineBytes() {
        if (inline == null) {
            throw new IllegalStateException("output item is stored, not inline");
        }
        return BASE64.equals(encoding)
                ? Base64.getDecoder().decode(inline)
                : inline.getBytes(StandardCharsets.UTF_8);
    }

    public OutputItem withTruncation(String truncatedInline, String notice) {
        return new OutputItem(kind, stream, mimeType, encoding, truncatedInline, null,
                sizeBytes, true, notice, metadata);
    }
}
