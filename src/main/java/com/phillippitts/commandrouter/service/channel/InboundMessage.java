package com.phillippitts.commandrouter.service.channel;

import java.util.Objects;

/**
 * A decoded client message.
 *
 * @param type          message kind
 * @param command       command text for {@link Type#COMMAND}, possibly blank; null otherwise
 * @param correlationId client-supplied correlation id, or null
 */
public record InboundMessage(Type type, String command, String correlationId) {

    public enum Type { COMMAND, PING, PONG }

    public InboundMessage {
        Objects.requireNonNull(type, "type");
    }
}
