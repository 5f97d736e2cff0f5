package com.adforge.core.job;

/**
 * What a handler reports for a successful run. The summary is stored on the job record.
 */
public record JobResult(String summary) {}
