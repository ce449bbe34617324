package com.rendezvous.mailbox;

/**
 * Message sink registered on a {@link Mailbox} by a watching session.
 * Both calls happen while the mailbox is locked, so implementations must not block.
 */
public interface Subscriber {

    void deliver(Message message);

    // mailbox deleted
    void close();
}
