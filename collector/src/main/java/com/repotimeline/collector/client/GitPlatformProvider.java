package com.repotimeline.collector.client;

import com.repotimeline.collector.model.Commit;
import com.repotimeline.collector.model.Repository;

import java.util.List;

/**
 * Uniform repository and commit listing over one Git hosting platform.
 *
 * <p>Implementations classify every non-success response into a {@link ProviderException}
 * with a structural {@link ErrorKind}; callers never inspect messages to decide control flow.</p>
 */
public interface GitPlatformProvider {

    Platform platform();

    /**
     * Lists the identity's repositories in the platform's native order, excluding repositories
     * the platform reports as empty (and forks, where the platform marks them).
     *
     * @param identity user or account name, non-empty
     * @throws ProviderException {@link ErrorKind#NOT_FOUND} when the identity does not resolve,
     *                           {@link ErrorKind#RATE_LIMITED} on quota exhaustion,
     *                           {@link ErrorKind#PROVIDER_ERROR} otherwise
     */
    List<Repository> listRepositories(String identity) throws ProviderException, InterruptedException;

    /**
     * Lists the commit history of one repository, walking at most
     * {@link AbstractPlatformProvider#MAX_PAGES} pages. Callers must not rely on ordering.
     *
     * @return the commits, or an empty list when the repository has none
     */
    List<Commit> listCommits(String identity, String repository) throws ProviderException, InterruptedException;
}
