package com.clapgrow.inbox.api.service;

import com.clapgrow.inbox.common.enums.MessageStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides which message status changes are allowed.
 *
 * <p>Pure enum-map validation: no clock, no database, no configuration, so the same
 * callback sequence always produces the same outcome.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>PENDING → SENT, DELIVERED, READ, FAILED</li>
 *   <li>SENT → DELIVERED, READ, FAILED</li>
 *   <li>DELIVERED → READ</li>
 *   <li>READ and FAILED are terminal</li>
 * </ul>
 * Delivery callbacks arrive out of order, so a status may skip ahead (PENDING → READ),
 * but never move backwards. FAILED is not reachable once the platform confirmed
 * delivery, which keeps {@code failed_at} and {@code delivered_at} mutually exclusive.
 */
@Component
@Slf4j
public class StatusTransitionValidator {

    private static final Map<MessageStatus, Set<MessageStatus>> VALID_TRANSITIONS = new EnumMap<>(MessageStatus.class);

    static {
        VALID_TRANSITIONS.put(MessageStatus.PENDING, EnumSet.of(
            MessageStatus.SENT, MessageStatus.DELIVERED, MessageStatus.READ, MessageStatus.FAILED));
        VALID_TRANSITIONS.put(MessageStatus.SENT, EnumSet.of(
            MessageStatus.DELIVERED, MessageStatus.READ, MessageStatus.FAILED));
        VALID_TRANSITIONS.put(MessageStatus.DELIVERED, EnumSet.of(MessageStatus.READ));
        VALID_TRANSITIONS.put(MessageStatus.READ, EnumSet.noneOf(MessageStatus.class));
        VALID_TRANSITIONS.put(MessageStatus.FAILED, EnumSet.noneOf(MessageStatus.class));
    }

    /**
     * Same-status updates are valid no-ops. Anything else must be listed in the transition map.
     */
    public boolean isValidTransition(MessageStatus fromStatus, MessageStatus toStatus) {
        if (fromStatus == toStatus) {
            return true;
        }
        Set<MessageStatus> allowed = VALID_TRANSITIONS.get(fromStatus);
        if (allowed == null || !allowed.contains(toStatus)) {
            log.warn("Invalid status transition attempted: {} → {}", fromStatus, toStatus);
            return false;
        }
        return true;
    }
}
