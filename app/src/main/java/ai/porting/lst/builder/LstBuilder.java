package ai.porting.lst.builder;

import ai.porting.lst.tree.LstDocument;
import ai.porting.lst.tree.Node;
import ai.porting.lst.tree.SourceBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Lossless Semantic Tree of one source file. Stateless; one instance may serve many threads.
 */
public class LstBuilder {

    public static final String VERSION = "0.1";

    private static final Logger LOGGER = LoggerFactory.getLogger(LstBuilder.class);

    private final ConstructExtractor extractor;
    private final Nester nester;
    private final GapFiller gapFiller;

    public LstBuilder() {
        this(new ConstructExtractor(), new Nester(), new GapFiller());
    }

    public LstBuilder(ConstructExtractor extractor, Nester nester, GapFiller gapFiller) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.nester = Objects.requireNonNull(nester, "nester");
        this.gapFiller = Objects.requireNonNull(gapFiller, "gapFiller");
    }

    public LstDocument build(String file, byte[] source) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(source, "source");
        SourceBuffer buffer = new SourceBuffer(source);
        ExtractionContext context = ExtractionContext.of(buffer);

        List<Node> candidates = extractor.extract(context);
        List<Node> roots = nester.nest(candidates);
        List<Node> nodes = gapFiller.fill(context, roots);

        LOGGER.debug("Built LST for {}: {} candidates, {} root nodes, {} bytes",
                file, candidates.size(), nodes.size(), buffer.length());
        return new LstDocument(VERSION, file, sha256(source), buffer.length(), nodes);
    }

    static String sha256(byte[] source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
