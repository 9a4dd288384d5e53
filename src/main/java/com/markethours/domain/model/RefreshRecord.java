package com.markethours.domain.model;

import com.markethours.domain.enums.RefreshStatus;
import com.markethours.domain.enums.RefreshTrigger;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one refresh cycle attempt.
 *
 * <p>Refresh records are append-only. The most recent SUCCESS row defines the current
 * calendar version; FAILURE rows carry the error detail so operators can tell a transient
 * network problem from an upstream format change.
 */
@Value
@Builder(toBuilder = true)
public class RefreshRecord {

    Long id;

    Instant runAt;

    RefreshStatus status;

    int recordsIngested;

    /** Null on success. */
    String error;

    RefreshTrigger trigger;

    /** Upstream the schedule was fetched from. */
    String source;

    public boolean isSuccess() {
        return status == RefreshStatus.SUCCESS;
    }
}
