package com.sandcastle.sandbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Line protocol spoken with the runtime driver.
 * <p>
 * Host to runtime, one line per command: {@code <OP>:<unit>:<base64 payload>}.
 * Runtime to host, each record on its own line, preceded by a newline that is
 * not part of the program output:
 * <pre>
 *   \n␞SANDCASTLE:DONE:&lt;unit&gt;:ok|error\n              (stdout and stderr)
 *   \n␞SANDCASTLE:DISPLAY:&lt;unit&gt;:&lt;mime&gt;:&lt;base64&gt;\n   (stdout)
 *   \n␞SANDCASTLE:ERROR:&lt;unit&gt;:&lt;base64 json&gt;\n         (stdout)
 * </pre>
 * A unit is {@code <sequence>-<nonce>}, where the nonce is fresh random hex
 * for every command. Records naming any other unit are program output. Unit
 * {@code 0} is the driver's startup acknowledgement, sent before any code runs.
 */
public final class RuntimeProtocol {

    private static final Logger log = LoggerFactory.getLogger(RuntimeProtocol.class);

    public static final String MARKER = "\u001eSANDCASTLE:";
    public static final String BOOT_UNIT = "0";

    public static final String VARIABLES_MIME = "application/vnd.sandcastle.variables+json";
    public static final String INSPECT_MIME = "application/vnd.sandcastle.inspect+json";
    public static final String INSTALL_MIME = "application/vnd.sandcastle.install+json";

    private static final byte[] MARKER_BYTES = MARKER.getBytes(StandardCharsets.US_ASCII);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int NONCE_BYTES = 16;

    private RuntimeProtocol() {}

    /**
     * Commands understood by the driver.
     */
    public enum Op {
        /** Run code in the session namespace. */
        EXEC,
        /** Install a package with pip; payload is JSON {name, timeout_seconds}. */
        INSTALL,
        /** Describe public globals; payload is ignored. */
        VARS,
        /** Describe one global in detail; payload is the variable name. */
        INSPECT
    }

    public enum DoneStatus { NONE, OK, ERROR }

    /** A parsed piece of stdout. */
    public interface Segment {}

    /**
     * Program output exactly as written; not necessarily valid UTF-8.
     */
    public record TextSegment(byte[] data) implements Segment {

        public String text() {
            return new String(data, StandardCharsets.UTF_8);
        }
    }

    public record DisplaySegment(String mimeType, byte[] data) implements Segment {}

    public record ErrorSegment(String name, String value, List<String> traceback) implements Segment {
        public String render() {
            if (traceback != null && !traceback.isEmpty()) {
                return String.join("", traceback);
            }
            return value == null || value.isEmpty() ? name : name + ": " + value;
        }
    }

    /**
     * Identifier for the {@code sequence}-th command on a runtime.
     */
    public static String unitId(int sequence) {
        byte[] nonce = new byte[NONCE_BYTES];
        RANDOM.nextBytes(nonce);
        return sequence + "-" + HexFormat.of().formatHex(nonce);
    }

    public static byte[] encode(Op op, String unit, String payload) {
        String b64 = Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
        return (op.name() + ":" + unit + ":" + b64 + "\n").getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Looks for the completion record of {@code unit} in the first {@code len}
     * bytes of {@code data}. An incomplete record counts as not found.
     */
    public static DoneStatus scanDone(byte[] data, int len, String unit) {
        byte[] token = (MARKER + "DONE:" + unit + ":").getBytes(StandardCharsets.US_ASCII);
        int from = 0;
        while (true) {
            int i = indexOf(data, len, token, from);
            if (i < 0) {
                return DoneStatus.NONE;
            }
            int start = i + token.length;
            int nl = indexOf(data, len, (byte) '\n', start);
            if (nl < 0) {
                return DoneStatus.NONE;
            }
            String status = new String(data, start, nl - start, StandardCharsets.US_ASCII).trim();
            if ("ok".equals(status)) {
                return DoneStatus.OK;
            }
            if ("error".equals(status)) {
                return DoneStatus.ERROR;
            }
            from = i + 1;
        }
    }

    /**
     * Splits raw stdout into text, display and error segments in emission order.
     * Only records for {@code unit} are interpreted; anything else, including
     * records for other units, stays text byte for byte. Completion records are
     * dropped and adjacent text is merged.
     */
    public static List<Segment> parseStdout(byte[] raw, String unit) {
        var segments = new ArrayList<Segment>();
        var text = new ByteArrayOutputStream();
        int pos = 0;
        while (pos < raw.length) {
            int m = indexOf(raw, raw.length, MARKER_BYTES, pos);
            if (m < 0) {
                text.write(raw, pos, raw.length - pos);
                break;
            }
            int bodyStart = m + MARKER_BYTES.length;
            int nl = indexOf(raw, raw.length, (byte) '\n', bodyStart);
            int lineEnd = nl < 0 ? raw.length : nl + 1;
            String body = new String(raw, bodyStart, (nl < 0 ? raw.length : nl) - bodyStart,
                    StandardCharsets.ISO_8859_1);

            Segment record = null;
            boolean ours;
            try {
                ours = isRecordFor(body, unit);
                if (ours) {
                    record = parseRecord(body, unit);
                }
            } catch (IllegalArgumentException | IndexOutOfBoundsException | IOException e) {
                log.debug("Treating malformed runtime record as output: {}", e.getMessage());
                ours = false;
            }

            if (!ours) {
                text.write(raw, pos, lineEnd - pos);
                pos = lineEnd;
                continue;
            }
            int textEnd = m;
            if (textEnd > pos && raw[textEnd - 1] == '\n') {
                textEnd--;
            }
            text.write(raw, pos, textEnd - pos);
            if (record != null) {
                flushText(text, segments);
                segments.add(record);
            }
            pos = lineEnd;
        }
        flushText(text, segments);
        return segments;
    }

    /**
     * Program bytes of a stream with the records of {@code unit} removed.
     */
    public static byte[] textBytes(byte[] raw, String unit) {
        var text = new ByteArrayOutputStream();
        for (Segment segment : parseStdout(raw, unit)) {
            if (segment instanceof TextSegment t) {
                text.writeBytes(t.data());
            }
        }
        return text.toByteArray();
    }

    /**
     * Like {@link #textBytes}, decoded leniently for messages and logs.
     */
    public static String stripRecords(byte[] raw, String unit) {
        return new String(textBytes(raw, unit), StandardCharsets.UTF_8);
    }

    /**
     * Decodes the JSON body of a display segment with the given MIME type,
     * or returns null when the output has none.
     */
    public static <T> T findStructured(List<Segment> segments, String mimeType, TypeReference<T> type) {
        for (Segment segment : segments) {
            if (segment instanceof DisplaySegment d && mimeType.equals(d.mimeType())) {
                try {
                    return JSON.readValue(d.data(), type);
                } catch (IOException e) {
                    log.warn("Malformed {} record from runtime: {}", mimeType, e.getMessage());
                    return null;
                }
            }
        }
        return null;
    }

    private static boolean isRecordFor(String body, String unit) {
        for (String type : List.of("DONE:", "DISPLAY:", "ERROR:")) {
            if (body.startsWith(type)) {
                return body.startsWith(type + unit + ":");
            }
        }
        return false;
    }

    private static Segment parseRecord(String body, String unit) throws IOException {
        if (body.startsWith("DONE:")) {
            return null;
        }
        if (body.startsWith("DISPLAY:")) {
            String rest = body.substring(("DISPLAY:" + unit + ":").length());
            int sep = rest.indexOf(':');
            String mime = rest.substring(0, sep);
            byte[] data = Base64.getDecoder().decode(rest.substring(sep + 1));
            return new DisplaySegment(mime, data);
        }
        byte[] json = Base64.getDecoder().decode(body.substring(("ERROR:" + unit + ":").length()));
        Map<String, Object> error = JSON.readValue(json, new TypeReference<>() {});
        return new ErrorSegment(
                String.valueOf(error.getOrDefault("ename", "Error")),
                String.valueOf(error.getOrDefault("evalue", "")),
                toStrings(error.get("traceback")));
    }

    private static List<String> toStrings(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        var out = new ArrayList<String>(list.size());
        list.forEach(item -> out.add(String.valueOf(item)));
        return out;
    }

    private static void flushText(ByteArrayOutputStream text, List<Segment> segments) {
        if (text.size() == 0) {
            return;
        }
        byte[] chunk = text.toByteArray();
        text.reset();
        if (!segments.isEmpty() && segments.get(segments.size() - 1) instanceof TextSegment last) {
            byte[] merged = new byte[last.data().length + chunk.length];
            System.arraycopy(last.data(), 0, merged, 0, last.data().length);
            System.arraycopy(chunk, 0, merged, last.data().length, chunk.length);
            segments.set(segments.size() - 1, new TextSegment(merged));
        } else {
            segments.add(new TextSegment(chunk));
        }
    }

    private static int indexOf(byte[] data, int len, byte b, int from) {
        for (int i = from; i < len; i++) {
            if (data[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOf(byte[] data, int len, byte[] needle, int from) {
        outer:
        for (int i = from; i + needle.length <= len; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
