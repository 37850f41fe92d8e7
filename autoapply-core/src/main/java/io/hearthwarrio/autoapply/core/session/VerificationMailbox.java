package io.hearthwarrio.autoapply.core.session;

import java.util.Optional;

/**
 * Email retrieval collaborator used by the verification sub-flow.
 * <p>
 * The core only needs the code (or link) of the most recent verification message.
 */
public interface VerificationMailbox {

    VerificationMailbox NONE = new VerificationMailbox() {
        @Override
        public Optional<String> latestCode(int expectedLength) {
            return Optional.empty();
        }

        @Override
        public Optional<String> latestLink() {
            return Optional.empty();
        }
    };

    /**
     * @param expectedLength number of characters the page asks for (1, 4 or 6 input cells)
     */
    Optional<String> latestCode(int expectedLength);

    Optional<String> latestLink();
}
