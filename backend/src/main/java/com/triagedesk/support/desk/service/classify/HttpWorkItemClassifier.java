package com.triagedesk.support.desk.service.classify;

import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Posts the item text to the classifier service and maps its JSON answer.
 *
 * Unknown category or priority codes are dropped rather than failing the whole verdict.
 */
public class HttpWorkItemClassifier implements WorkItemClassifier {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkItemClassifier.class);

    static final String CLASSIFY_PATH = "/classify";

    public record ClassifierResponse(String category, String priority, List<String> tags, String reasoning) {
    }

    private final RestClient restClient;

    public HttpWorkItemClassifier(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<Classification> classify(WorkItem item) {
        var body = new LinkedHashMap<String, Object>();
        body.put("id", item.id());
        body.put("channel", item.channel().code());
        body.put("subject", item.subject());
        body.put("content", item.content());

        var response = restClient.post()
                .uri(CLASSIFY_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(ClassifierResponse.class);
        if (response == null) return Optional.empty();

        var tags = new LinkedHashSet<String>();
        if (response.tags() != null) {
            for (var t : response.tags()) {
                if (t != null && !t.isBlank()) tags.add(t.trim().toLowerCase(Locale.ROOT));
            }
        }

        return Optional.of(new Classification(
                parse(response.category(), Category::fromCode, item.id()),
                parse(response.priority(), Priority::fromCode, item.id()),
                tags,
                response.reasoning()
        ));
    }

    private static <T> T parse(String raw, Function<String, T> parser, String workItemId) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            log.warn("classifier_value_ignored workItemId={} value={} error={}", workItemId, raw, e.getMessage());
            return null;
        }
    }
}
