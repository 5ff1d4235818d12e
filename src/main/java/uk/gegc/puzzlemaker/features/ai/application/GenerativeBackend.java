package uk.gegc.puzzlemaker.features.ai.application;

import uk.gegc.puzzlemaker.features.ai.domain.model.BackendRequest;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendResponse;

/**
 * A generative model provider. Implementations honour {@link BackendRequest#timeoutMs()}
 * and may throw any runtime exception; callers classify failures.
 */
public interface GenerativeBackend {

    BackendResponse invoke(BackendRequest request);
}
