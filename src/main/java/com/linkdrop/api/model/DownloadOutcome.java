package com.linkdrop.api.model;

/**
 * Result of one attempt to account a download against a share.
 */
public enum DownloadOutcome {
    NOT_FOUND,
    EXPIRED,
    LIMIT_REACHED,
    // Counted, the share stays active
    CONTINUING,
    // Counted, the share was removed in the same transaction and its file must go once the body is sent
    LAST_DOWNLOAD
}
