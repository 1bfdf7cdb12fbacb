package org.waabox.datafeed.transport;

/**
 * Supplies the auth material of the bot.
 *
 * <p>Tokens may expire independently of the polling cadence, so callers
 * fetch them again for every attempt instead of caching them across a
 * retry sequence. Implementations may block while fetching or refreshing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface AuthSession {

  /**
   * Returns the current session token.
   *
   * @return the session token, never null
   *
   * @throws TransportException if the token cannot be obtained
   */
  String sessionToken();

  /**
   * Returns the current key manager token.
   *
   * @return the key manager token, never null
   *
   * @throws TransportException if the token cannot be obtained
   */
  String keyManagerToken();

  /**
   * Discards the current tokens and authenticates again.
   *
   * @throws TransportException if the authentication fails
   */
  void refresh();

  /**
   * Fetches both tokens.
   *
   * @return the current tokens, never null
   */
  default AuthTokens tokens() {
    return new AuthTokens(sessionToken(), keyManagerToken());
  }
}
