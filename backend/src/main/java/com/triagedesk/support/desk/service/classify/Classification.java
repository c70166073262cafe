package com.triagedesk.support.desk.service.classify;

import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.Priority;

import java.util.Set;

/**
 * Classifier verdict. Null category or priority means "no opinion".
 */
public record Classification(Category category, Priority priority, Set<String> tags, String reasoning) {

    public Classification {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
