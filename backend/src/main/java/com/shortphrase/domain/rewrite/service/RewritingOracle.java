package com.shortphrase.domain.rewrite.service;

import com.shortphrase.domain.rewrite.model.AccessCheckResult;
import com.shortphrase.domain.rewrite.model.OracleRequest;
import com.shortphrase.domain.rewrite.model.OracleResponse;

/**
 * External rewriting service. Each call is one network attempt;
 * retries and validation are the caller's business.
 */
public interface RewritingOracle {

    /**
     * Provider name used for logs, metrics and cost-rate lookup.
     */
    String name();

    /**
     * Rewrite a batch of sentences.
     *
     * @return one item per requested sentence, in request order, plus token usage
     * @throws com.shortphrase.domain.rewrite.exception.TransientOracleException on timeouts, rate limits, 5xx
     * @throws com.shortphrase.domain.rewrite.exception.FatalOracleException     on rejected credentials or malformed requests
     */
    OracleResponse rewrite(OracleRequest request);

    /**
     * Minimal call to verify that the configured credentials work.
     */
    AccessCheckResult checkAccess();
}
