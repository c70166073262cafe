package com.triagedesk.support.desk.service.classify;

import com.triagedesk.support.desk.model.Category;
import com.triagedesk.support.desk.model.Channel;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.WorkItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpWorkItemClassifierTest {

    private MockRestServiceServer server;
    private HttpWorkItemClassifier classifier;

    private final WorkItem item = new WorkItem("wi_42", Channel.EMAIL, "a@example.com", "Ann", null,
            "Card charged twice", "I was billed two times", Category.GENERAL, Priority.MEDIUM, Set.of(),
            ItemStatus.NEW, null, Instant.now(), null, null, null);

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder().baseUrl("http://classifier.local");
        server = MockRestServiceServer.bindTo(builder).build();
        classifier = new HttpWorkItemClassifier(builder.build());
    }

    @Test
    void maps_classifier_answer() {
        server.expect(requestTo("http://classifier.local/classify"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.id").value("wi_42"))
                .andExpect(jsonPath("$.channel").value("email"))
                .andExpect(jsonPath("$.subject").value("Card charged twice"))
                .andRespond(withSuccess("""
                        {"category":"complaint","priority":"high","tags":["Billing"," refund "],
                         "reasoning":"duplicate charge"}
                        """, MediaType.APPLICATION_JSON));

        var result = classifier.classify(item).orElseThrow();

        assertEquals(Category.COMPLAINT, result.category());
        assertEquals(Priority.HIGH, result.priority());
        assertEquals(Set.of("billing", "refund"), result.tags());
        assertEquals("duplicate charge", result.reasoning());
        server.verify();
    }

    @Test
    void unknown_codes_are_dropped() {
        server.expect(requestTo("http://classifier.local/classify"))
                .andRespond(withSuccess("""
                        {"category":"spam","priority":"critical","tags":[]}
                        """, MediaType.APPLICATION_JSON));

        var result = classifier.classify(item).orElseThrow();

        assertNull(result.category());
        assertNull(result.priority());
        assertTrue(result.tags().isEmpty());
    }

    @Test
    void server_errors_propagate_to_the_caller() {
        server.expect(requestTo("http://classifier.local/classify")).andRespond(withServerError());

        assertThrows(HttpServerErrorException.class, () -> classifier.classify(item));
    }
}
