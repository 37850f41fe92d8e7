package io.hearthwarrio.autoapply.core.session;

import java.util.Optional;

/**
 * External job queue: hands out application URLs and receives their outcome.
 */
public interface JobQueue {

    Optional<String> nextJob();

    void reportResult(String url, boolean success);
}
