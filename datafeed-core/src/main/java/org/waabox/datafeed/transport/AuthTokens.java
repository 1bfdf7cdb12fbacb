package org.waabox.datafeed.transport;

import java.util.Objects;

/**
 * The auth material sent along with every datafeed call.
 *
 * @param sessionToken    the session token, never null
 * @param keyManagerToken the key manager token, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AuthTokens(String sessionToken, String keyManagerToken) {

  /** Validates the components. */
  public AuthTokens {
    Objects.requireNonNull(sessionToken, "sessionToken cannot be null");
    Objects.requireNonNull(keyManagerToken, "keyManagerToken cannot be null");
  }

  /** Tokens must never end up in logs.
   *
   * @return a masked representation.
   */
  @Override
  public String toString() {
    return "AuthTokens[***]";
  }
}
