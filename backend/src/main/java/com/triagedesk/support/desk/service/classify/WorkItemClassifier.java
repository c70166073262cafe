package com.triagedesk.support.desk.service.classify;

import com.triagedesk.support.desk.model.WorkItem;

import java.util.Optional;

/**
 * External text classifier. Called off the request path; implementations may block.
 */
public interface WorkItemClassifier {

    /**
     * @return the verdict, or empty when the classifier has nothing to say
     */
    Optional<Classification> classify(WorkItem item);
}
