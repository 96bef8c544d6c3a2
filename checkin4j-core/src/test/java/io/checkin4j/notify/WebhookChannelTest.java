package io.checkin4j.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.checkin4j.core.ExecutionStatus;
import io.checkin4j.support.InMemoryConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookChannelTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2023-11-14T22:13:20Z"), ZoneOffset.UTC);
    private static final String URL = "https://hook.example/notify";

    private final NotificationEvent event =
            new NotificationEvent("Daily", ExecutionStatus.SUCCESS, 200, "Check-in succeeded", "{\"ok\":1}");

    private MockRestServiceServer server;
    private WebhookChannel channel;
    private InMemoryConfigStore store;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        channel = new WebhookChannel(builder.build(), CLOCK);
        store = new InMemoryConfigStore();
        store.put("webhook_enabled", "true");
        store.put("webhook_url", URL);
    }

    private NotificationConfig config() {
        return NotificationConfig.load(store, new ObjectMapper());
    }

    @Test
    void postShouldDefaultToJson() {
        store.put("webhook_headers", "{\"X-Custom\": \"1\"}");
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Custom", "1"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.title").value("Daily"))
                .andExpect(jsonPath("$.account_name").value("Daily"))
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.response_code").value(200))
                .andExpect(jsonPath("$.date").value("2023-11-14 22:13:20"))
                .andExpect(jsonPath("$.message").value("Check-in succeeded"))
                .andExpect(jsonPath("$.response_body").doesNotExist())
                .andRespond(withSuccess());

        channel.deliver(event, config());

        server.verify();
    }

    @Test
    void responseBodyShouldBeIncludedWhenConfigured() {
        store.put("webhook_include_response", "true");
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.response_body").value("{\"ok\":1}"))
                .andRespond(withSuccess());

        channel.deliver(event, config());

        server.verify();
    }

    @Test
    void nullResponseCodeShouldStayNullInJson() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.response_code").isEmpty())
                .andRespond(withSuccess());

        channel.deliver(new NotificationEvent("Daily", ExecutionStatus.FAILED, null, "Network error: timeout", null), config());

        server.verify();
    }

    @Test
    void urlencodedContentTypeShouldSendForm() {
        store.put("webhook_headers", "{\"Content-Type\": \"application/x-www-form-urlencoded\"}");
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", containsString("application/x-www-form-urlencoded")))
                .andExpect(content().formDataContains(Map.of(
                        "title", "Daily",
                        "status", "success",
                        "response_code", "200",
                        "date", "2023-11-14 22:13:20")))
                .andRespond(withSuccess());

        channel.deliver(event, config());

        server.verify();
    }

    @Test
    void multipartContentTypeShouldSendGeneratedBoundary() {
        store.put("webhook_headers", "{\"content-type\": \"multipart/form-data\"}");
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", startsWith("multipart/form-data")))
                .andExpect(header("Content-Type", containsString("boundary=")))
                .andExpect(content().string(containsString("name=\"account_name\"")))
                .andExpect(content().string(not(containsString("name=\"response_body\""))))
                .andRespond(withSuccess());

        channel.deliver(event, config());

        server.verify();
    }

    @Test
    void getShouldSendFieldsAsQueryParameters() {
        store.put("webhook_method", "GET");
        server.expect(requestTo(startsWith(URL + "?")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("title", "Daily"))
                .andExpect(queryParam("status", "success"))
                .andExpect(queryParam("response_code", "200"))
                .andRespond(withSuccess());

        channel.deliver(event, config());

        server.verify();
    }

    @Test
    void getShouldPercentEncodePlusInValues() {
        store.put("webhook_method", "GET");
        store.put("webhook_include_response", "true");
        NotificationEvent failed =
                new NotificationEvent("Daily", ExecutionStatus.FAILED, 500, "1+1 failed", "x+y");
        server.expect(requestTo(containsString("message=1%2B1%20failed")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(requestTo(containsString("response_body=x%2By")))
                .andExpect(requestTo(not(containsString("+"))))
                .andRespond(withSuccess());

        channel.deliver(failed, config());

        server.verify();
    }
}
