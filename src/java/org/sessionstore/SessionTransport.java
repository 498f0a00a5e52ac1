package org.sessionstore;

/**
 * Carries the session token between the client and the {@link SessionManager} for one request, usually as
 * a cookie.
 */
public interface SessionTransport {

	/**
	* @return the token the client sent under {@code name}, or {@code null} if there is none
	*/
	String readToken(String name);

	/**
	* Sends the token back to the client.
	*/
	void writeToken(String name, String value, boolean secure);

	/**
	* @return the request parameter called {@code name}, or {@code null}
	*/
	String getParameter(String name);

}
