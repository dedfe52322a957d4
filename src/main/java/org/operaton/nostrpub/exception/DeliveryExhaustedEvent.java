package org.operaton.nostrpub.exception;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published once when an outbound activity was dropped after its last delivery attempt.
 */
@Getter
public class DeliveryExhaustedEvent extends ApplicationEvent {

    private final String activityId;
    private final String inbox;
    private final int attempts;
    private final String lastError;

    public DeliveryExhaustedEvent(Object source, String activityId, String inbox, int attempts, String lastError) {
        super(source);
        this.activityId = activityId;
        this.inbox = inbox;
        this.attempts = attempts;
        this.lastError = lastError;
    }
}
