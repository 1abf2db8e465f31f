package ai.porting.lst.builder;

import ai.porting.lst.tree.Node;
import java.util.List;

/**
 * Locates candidate nodes of one construct kind. Recognizers run independently of each other and may
 * report overlapping candidates; overlaps are resolved by the {@link Nester}.
 */
public interface ConstructRecognizer {

    List<Node> recognize(ExtractionContext context);
}
