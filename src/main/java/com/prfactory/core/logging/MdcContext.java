package com.prfactory.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing workflow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TICKET_ID = "ticketId";
    public static final String GRAPH_ID = "graphId";
    public static final String AGENT = "agent";

    private MdcContext() {}

    public static void setTicket(String ticketId) {
        MDC.put(TICKET_ID, ticketId);
    }

    public static void setGraph(String ticketId, String graphId) {
        MDC.put(TICKET_ID, ticketId);
        MDC.put(GRAPH_ID, graphId);
    }

    public static void setAgent(String ticketId, String graphId, String agent) {
        MDC.put(TICKET_ID, ticketId);
        MDC.put(GRAPH_ID, graphId);
        MDC.put(AGENT, agent);
    }

    public static void clearGraph() {
        MDC.remove(GRAPH_ID);
        MDC.remove(AGENT);
    }

    public static void clearAgent() {
        MDC.remove(AGENT);
    }

    public static void clear() {
        MDC.remove(TICKET_ID);
        MDC.remove(GRAPH_ID);
        MDC.remove(AGENT);
    }
}
