package express.mvp.conduit.stream;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.conduit.json.Json;

/** Outbound control frames. */
final class ControlFrames {

    private static final String PING = Json.write(Json.object().put("type", "ping"));

    private ControlFrames() {}

    /**
     * Builds {@code {type:"subscribe", subscriptionId, event, filter?}}. A single event type is
     * sent as a string, several as an array.
     */
    static String subscribe(Subscription subscription) {
        ObjectNode frame = Json.object();
        frame.put("type", "subscribe");
        frame.put("subscriptionId", subscription.id());
        SubscriptionSpec spec = subscription.spec();
        if (spec.events().size() == 1) {
            frame.put("event", spec.events().get(0));
        } else {
            ArrayNode events = frame.putArray("event");
            spec.events().forEach(events::add);
        }
        if (!spec.filter().isEmpty()) {
            ObjectNode filter = frame.putObject("filter");
            spec.filter().forEach(filter::put);
        }
        return Json.write(frame);
    }

    static String unsubscribe(String subscriptionId) {
        return Json.write(
                Json.object().put("type", "unsubscribe").put("subscriptionId", subscriptionId));
    }

    static String ping() {
        return PING;
    }
}
