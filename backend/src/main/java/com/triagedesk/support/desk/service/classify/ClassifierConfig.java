package com.triagedesk.support.desk.service.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ClassifierConfig {

    private static final Logger log = LoggerFactory.getLogger(ClassifierConfig.class);

    @Bean
    public WorkItemClassifier workItemClassifier(
            @Value("${app.classifier.url:}") String url,
            @Value("${app.classifier.timeout-ms:10000}") int timeoutMs
    ) {
        var baseUrl = url == null ? "" : url.trim();
        if (baseUrl.isEmpty()) {
            log.info("classifier_disabled reason=no_url");
            return new NoopWorkItemClassifier();
        }

        var timeout = Math.max(100, timeoutMs);
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        log.info("classifier_enabled url={}", baseUrl);
        return new HttpWorkItemClassifier(RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build());
    }
}
