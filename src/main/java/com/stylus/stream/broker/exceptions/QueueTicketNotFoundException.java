package com.stylus.stream.broker.exceptions;

public class QueueTicketNotFoundException extends BrokerException {

    public QueueTicketNotFoundException(String ticketId) {
        super("queue ticket not found: " + ticketId);
    }
}
