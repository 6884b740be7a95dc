package com.bank.recovery.generation;

import java.util.List;

/**
 * Best-effort lookup of reference text for a turn. An empty result is valid.
 */
public interface ContextRetriever {

    /**
     * @param accountId optional filter, may be null
     * @param debtorId  optional filter, may be null
     * @return snippets ranked best first, at most {@code limit}
     */
    List<ReferenceSnippet> retrieve(String query, String accountId, String debtorId, int limit);
}
