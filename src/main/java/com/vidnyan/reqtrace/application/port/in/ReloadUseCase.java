package com.vidnyan.reqtrace.application.port.in;

import com.vidnyan.reqtrace.domain.error.RebuildFailureException;

/**
 * Rebuilds the index from disk.
 */
public interface ReloadUseCase {

    /**
     * Perform a full rebuild and swap it in.
     * Requests arriving while a rebuild runs are coalesced into one follow-up rebuild.
     *
     * @return version of the snapshot produced for this request
     * @throws RebuildFailureException when the rebuild was abandoned; the previous snapshot stays live
     */
    long reload() throws RebuildFailureException;

    /**
     * Version of the snapshot currently served; pollers compare this to detect change.
     */
    long version();
}
