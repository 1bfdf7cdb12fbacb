package org.waabox.datafeed.event;

/**
 * The user whose action produced an event.
 *
 * @param userId   the user identifier
 * @param username the username, may be null for users without one
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Initiator(long userId, String username) {
}
