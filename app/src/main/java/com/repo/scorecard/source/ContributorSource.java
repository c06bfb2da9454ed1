package com.repo.scorecard.source;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the contributor listing of one repository.
 */
@FunctionalInterface
public interface ContributorSource {

    /**
     * @throws IOException if the listing cannot be retrieved
     */
    List<RepositoryContributor> fetch(String repository) throws IOException;
}
