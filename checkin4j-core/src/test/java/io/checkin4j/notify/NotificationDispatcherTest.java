package io.checkin4j.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.checkin4j.core.ExecutionStatus;
import io.checkin4j.core.NotificationException;
import io.checkin4j.support.InMemoryConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationDispatcherTest {

    private NotificationChannel webhook;
    private NotificationChannel telegram;
    private InMemoryConfigStore configStore;
    private NotificationDispatcher dispatcher;

    private final NotificationEvent event =
            new NotificationEvent("Daily", ExecutionStatus.FAILED, 500, "Check-in failed: HTTP 500", "oops");

    @BeforeEach
    void setUp() {
        webhook = mock(NotificationChannel.class);
        when(webhook.channelId()).thenReturn("webhook");
        when(webhook.isEnabled(any())).thenReturn(true);
        when(webhook.isConfigured(any())).thenReturn(true);

        telegram = mock(NotificationChannel.class);
        when(telegram.channelId()).thenReturn("telegram");
        when(telegram.isEnabled(any())).thenReturn(true);
        when(telegram.isConfigured(any())).thenReturn(true);

        configStore = new InMemoryConfigStore();
        dispatcher = new NotificationDispatcher(List.of(webhook, telegram), configStore, new ObjectMapper());
    }

    @Test
    void fanoutShouldDeliverToEveryEnabledChannel() {
        List<ChannelResult> results = dispatcher.fanout(event);

        verify(webhook).deliver(any(), any());
        verify(telegram).deliver(any(), any());
        assertEquals(List.of(ChannelResult.sent("webhook"), ChannelResult.sent("telegram")), results);
    }

    @Test
    void fanoutShouldSkipDisabledAndUnconfiguredChannels() {
        when(webhook.isEnabled(any())).thenReturn(false);
        when(telegram.isConfigured(any())).thenReturn(false);

        List<ChannelResult> results = dispatcher.fanout(event);

        verify(webhook, never()).deliver(any(), any());
        verify(telegram, never()).deliver(any(), any());
        assertEquals(ChannelResult.Status.SKIPPED, results.get(0).status());
        assertEquals(ChannelResult.Status.SKIPPED, results.get(1).status());
    }

    @Test
    void channelFailureShouldNotAffectOtherChannels() {
        doThrow(new NotificationException("boom")).when(webhook).deliver(any(), any());

        List<ChannelResult> results = dispatcher.fanout(event);

        verify(telegram).deliver(any(), any());
        assertEquals(ChannelResult.failed("webhook", "boom"), results.get(0));
        assertEquals(ChannelResult.sent("telegram"), results.get(1));
    }

    @Test
    void configurationShouldBeReadOnEveryFanout() {
        configStore.put("webhook_url", "https://first.example");
        dispatcher.fanout(event);
        configStore.put("webhook_url", "https://second.example");
        dispatcher.fanout(event);

        ArgumentCaptor<NotificationConfig> configs = ArgumentCaptor.forClass(NotificationConfig.class);
        verify(webhook, times(2)).deliver(any(), configs.capture());
        assertEquals("https://first.example", configs.getAllValues().get(0).webhook().url());
        assertEquals("https://second.example", configs.getAllValues().get(1).webhook().url());
    }

    @Test
    void fanoutOverloadShouldBuildEvent() {
        dispatcher.fanout("Daily", ExecutionStatus.SUCCESS, 200, "Check-in succeeded", "ok");

        ArgumentCaptor<NotificationEvent> sent = ArgumentCaptor.forClass(NotificationEvent.class);
        verify(webhook).deliver(sent.capture(), any());
        assertEquals(new NotificationEvent("Daily", ExecutionStatus.SUCCESS, 200, "Check-in succeeded", "ok"), sent.getValue());
    }

    @Test
    void sendTestShouldIgnoreEnabledFlag() {
        when(telegram.isEnabled(any())).thenReturn(false);

        ChannelResult result = dispatcher.sendTest("telegram");

        assertEquals(ChannelResult.sent("telegram"), result);
        verify(telegram).deliver(any(), any());
        verify(webhook, never()).deliver(any(), any());
    }

    @Test
    void sendTestShouldRejectUnknownChannel() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.sendTest("pager"));
    }

    @Test
    void chatTextShouldIncludeCodeOnlyWhenPresent() {
        assertEquals("❌ Daily\nCheck-in failed: HTTP 500\n(HTTP 500)", event.chatText());
        assertEquals("✅ Daily\nok",
                new NotificationEvent("Daily", ExecutionStatus.SUCCESS, null, "ok", null).chatText());
    }
}
