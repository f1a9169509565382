package com.hermes.pipeline;

import com.hermes.shared.config.RoutingConfig;
import com.hermes.shared.model.ChatMessage;
import com.hermes.shared.model.EmailMessage;
import com.hermes.shared.model.ProjectRoute;
import com.hermes.shared.model.SmsMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SenderDirectoryTest {

    private final SenderDirectory directory = new SenderDirectory(new RoutingConfig(List.of(
            new ProjectRoute("Jane@Acme.com", "acme", "siteA", "jane"),
            new ProjectRoute("+15551234567", "acme", "siteA", "jane")
    ), RoutingConfig.defaults().fallback()));

    @Test
    void matchesEmailIgnoringDisplayNameAndCase() {
        var email = new EmailMessage("<m@x>", null, null, "Jane Doe <jane@acme.com>", "s", "b");

        var route = directory.resolve(email);

        assertEquals("siteA", route.projectId());
        assertEquals("jane", route.userId());
    }

    @Test
    void matchesSmsNumber() {
        var sms = new SmsMessage("+15551234567", "+15550000000", "m1", null, "hi");

        assertEquals("acme", directory.resolve(sms).clientId());
    }

    @Test
    void unknownSenderUsesFallback() {
        var route = directory.resolve(new ChatMessage("m1", null, "stranger", "hello"));

        assertEquals("default", route.clientId());
        assertEquals("default", route.projectId());
        assertEquals("unknown", route.userId());
    }

    @Test
    void normalizeStripsDisplayName() {
        assertEquals("bob@example.com", SenderDirectory.normalize("  Bob <BOB@example.com> "));
        assertEquals("bob@example.com", SenderDirectory.normalize(" Bob@Example.com "));
    }
}
