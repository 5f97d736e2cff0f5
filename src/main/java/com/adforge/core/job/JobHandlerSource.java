package com.adforge.core.job;

import java.util.Collection;

/**
 * Contributes handlers built at runtime, e.g. one per configured pipeline.
 */
public interface JobHandlerSource {

    Collection<JobHandler> handlers();
}
