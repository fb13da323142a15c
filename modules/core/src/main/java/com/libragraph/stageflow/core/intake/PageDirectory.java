package com.libragraph.stageflow.core.intake;

import java.util.Optional;
import java.util.UUID;

/**
 * Pages referenced by PagePerfect jobs. URLs are unique; resolving the same URL twice
 * returns the same page.
 */
public interface PageDirectory {

    Page resolveOrCreate(String url);

    Optional<Page> find(UUID id);
}
