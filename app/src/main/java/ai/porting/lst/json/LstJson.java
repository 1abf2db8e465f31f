package ai.porting.lst.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for LST documents and symbol indexes.
 */
public final class LstJson {

    public static final String DOCUMENT_SUFFIX = ".lst.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private LstJson() {
    }

    /**
     * Thread-safe once configured; callers must not reconfigure it.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Output file name of a source identifier: path separators become {@code __}.
     */
    public static String documentFileName(String identifier) {
        return identifier.replace('\\', '/').replace("/", "__") + DOCUMENT_SUFFIX;
    }
}
