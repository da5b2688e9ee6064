package com.shortphrase.infrastructure.ai;

import com.shortphrase.domain.rewrite.exception.OracleException;
import com.shortphrase.domain.rewrite.model.OracleItem;

import java.util.List;

/**
 * What happened to one submission after the retry loop finished.
 *
 * @param status outcome of the submission
 * @param items  one item per submitted sentence when COMPLETED, empty otherwise
 * @param calls  one record per attempt made
 * @param error  last failure when not COMPLETED
 */
public record OracleBatchOutcome(
        Status status,
        List<OracleItem> items,
        List<OracleCallRecord> calls,
        OracleException error
) {
    public enum Status {
        COMPLETED,
        /** Credentials or request rejected; retrying cannot help. */
        FATAL,
        /** Every attempt failed transiently. */
        EXHAUSTED
    }

    public OracleBatchOutcome {
        items = List.copyOf(items);
        calls = List.copyOf(calls);
    }

    public static OracleBatchOutcome completed(List<OracleItem> items, List<OracleCallRecord> calls) {
        return new OracleBatchOutcome(Status.COMPLETED, items, calls, null);
    }

    public static OracleBatchOutcome fatal(OracleException error, List<OracleCallRecord> calls) {
        return new OracleBatchOutcome(Status.FATAL, List.of(), calls, error);
    }

    public static OracleBatchOutcome exhausted(OracleException error, List<OracleCallRecord> calls) {
        return new OracleBatchOutcome(Status.EXHAUSTED, List.of(), calls, error);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
