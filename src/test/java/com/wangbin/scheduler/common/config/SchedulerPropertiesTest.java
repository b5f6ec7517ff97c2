package com.wangbin.scheduler.common.config;

import com.wangbin.scheduler.core.schedule.ScheduleDefinition;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerPropertiesTest {

    private static SchedulerProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("scheduler", Bindable.of(SchedulerProperties.class));
    }

    @Test
    void defaultsMatchDocumentedSchedule() {
        SchedulerProperties properties = bind(Map.of());

        ScheduleDefinition digest = properties.getDigest().toScheduleDefinition();
        assertEquals(DayOfWeek.MONDAY, digest.anchorWeekday());
        assertEquals(8, digest.anchorHourUtc());
        assertEquals(Duration.ofHours(1), digest.pollInterval());

        ScheduleDefinition churn = properties.getChurn().toScheduleDefinition();
        assertTrue(churn.isDaily());
        assertEquals(9, churn.anchorHourUtc());
        assertEquals(50, properties.getChurn().getDefaultThreshold());
        assertEquals(30000, properties.getPort().getCallTimeoutMs());
        assertEquals("", properties.getChat().getWebhookUrl());
    }

    @Test
    void bindsOverrides() {
        Map<String, String> values = new HashMap<>();
        values.put("scheduler.digest.anchor-weekday", "FRIDAY");
        values.put("scheduler.digest.anchor-hour-utc", "17");
        values.put("scheduler.digest.notification-max-length", "120");
        values.put("scheduler.churn.enabled", "false");
        values.put("scheduler.churn.default-threshold", "35.5");
        values.put("scheduler.port.call-timeout-ms", "5000");
        values.put("scheduler.chat.webhook-url", "https://hooks.example.com/abc");

        SchedulerProperties properties = bind(values);

        assertEquals(DayOfWeek.FRIDAY, properties.getDigest().getAnchorWeekday());
        assertEquals(17, properties.getDigest().toScheduleDefinition().anchorHourUtc());
        assertEquals(120, properties.getDigest().toSettings().notificationMaxLength());
        assertFalse(properties.getChurn().isEnabled());
        assertEquals(35.5, properties.getChurn().getDefaultThreshold());
        assertEquals(5000, properties.getPort().getCallTimeoutMs());
        assertEquals("https://hooks.example.com/abc", properties.getChat().getWebhookUrl());
    }
}
