package com.shortphrase.domain.rewrite.model;

import java.util.List;

/**
 * Oracle answer for a single sentence: either fragments or a malformed marker.
 */
public record OracleItem(List<String> fragments, String malformedDetail) {

    public OracleItem {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    public static OracleItem of(List<String> fragments) {
        return new OracleItem(fragments, null);
    }

    public static OracleItem malformed(String detail) {
        return new OracleItem(List.of(), detail);
    }

    public boolean isMalformed() {
        return malformedDetail != null;
    }
}
