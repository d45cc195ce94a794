package io.atomledger.client;

/**
 * Progress of a submitted atom. {@link #STORED} is terminal; rejections end the state stream with
 * {@link NodeConnectionException.SubmissionRejected} instead.
 */
public enum AtomSubmissionState {
    CREATED,
    SUBMITTING,
    SUBMITTED,
    STORED
}
