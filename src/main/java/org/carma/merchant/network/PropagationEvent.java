package org.carma.merchant.network;

/**
 * Scheduled delivery of a packet to one target.
 *
 * @param delay ticks before the information arrives
 * @param reliability relationship reliability compounded with the packet's own
 */
public record PropagationEvent(
        String targetId,
        InformationPacket packet,
        int delay,
        double reliability
) {}
