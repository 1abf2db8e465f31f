package ai.porting.lst.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Documents written by a batch build and the identifiers of the files that failed.
 */
public record BatchOutcome(List<Path> writtenDocuments, List<String> failedFiles) {

    public BatchOutcome {
        writtenDocuments = writtenDocuments == null ? List.of() : List.copyOf(writtenDocuments);
        failedFiles = failedFiles == null ? List.of() : List.copyOf(failedFiles);
    }

    public boolean succeeded() {
        return failedFiles.isEmpty();
    }
}
