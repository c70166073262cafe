package com.triagedesk.support.desk.service.classify;

import com.triagedesk.support.desk.model.WorkItem;

import java.util.Optional;

/**
 * Used when no classifier endpoint is configured: items keep their ingestion defaults.
 */
public class NoopWorkItemClassifier implements WorkItemClassifier {

    @Override
    public Optional<Classification> classify(WorkItem item) {
        return Optional.empty();
    }
}
