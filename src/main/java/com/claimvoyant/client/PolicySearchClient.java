package com.claimvoyant.client;

import java.util.List;
import java.util.Map;

/**
 * Hybrid (keyword + vector) search over the policy document collection.
 */
public interface PolicySearchClient {

    /**
     * @return property maps of the best matching policy documents, best first; empty when nothing matches
     */
    List<Map<String, Object>> hybridSearch(String query, int limit);
}
