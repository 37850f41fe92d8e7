package io.hearthwarrio.autoapply.core.session;

import java.util.List;

/**
 * External reasoning collaborator. Stateless request/response; retries are not the caller's concern.
 */
public interface ReasoningOracle {

    /**
     * Answers a free-text prompt.
     */
    String resolve(String prompt);

    /**
     * Chooses among options for a question.
     *
     * @param question    question text; may be null when no question could be built
     * @param options     displayed option texts
     * @param multiSelect whether more than one option may be returned
     * @param topK        how many candidate options the oracle may consider
     * @return free text naming the chosen option(s)
     */
    String resolve(String question, List<String> options, boolean multiSelect, int topK);
}
