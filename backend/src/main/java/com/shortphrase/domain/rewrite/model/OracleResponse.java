package com.shortphrase.domain.rewrite.model;

import java.util.List;

/**
 * @param items one item per requested sentence, in request order
 * @param usage token usage of the call
 */
public record OracleResponse(List<OracleItem> items, OracleUsage usage) {

    public OracleResponse {
        items = List.copyOf(items);
        usage = usage == null ? OracleUsage.NONE : usage;
    }
}
