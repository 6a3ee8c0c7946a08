package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Options for one scan. Echoed into the manifest so a run can be reproduced.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class ScanOptions {
    String rootPath;

    @Builder.Default
    List<String> ignorePaths = List.of();

    boolean includeHidden;

    @Builder.Default
    int maxDepth = 10;

    boolean useClassifier;

    @Builder.Default
    boolean extractDocumentMetadata = true;

    // Hash same-sized loose files and flag repeated content
    boolean detectDuplicates;

    // Below this confidence an item is routed to review
    @Builder.Default
    double reviewThreshold = 0.5;

    @Builder.Default
    List<TaxonomyRule> taxonomy = List.of();
}
