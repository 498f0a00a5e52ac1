package org.sessionstore;

import java.util.concurrent.TimeUnit;

import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Carries the session id in a cookie on a servlet request/response pair. The cookie is scoped to {@code /},
 * HTTP-only and kept for 30 days.
 */
public class ServletSessionTransport implements SessionTransport {

	public static final int COOKIE_MAX_AGE = (int)TimeUnit.DAYS.toSeconds(30);

	private final HttpServletRequest request;
	private final HttpServletResponse response;

	public ServletSessionTransport(final HttpServletRequest request, final HttpServletResponse response) {
		this.request = request;
		this.response = response;
	}

	protected Cookie getCookie(String name) {
		Cookie[] cookies = request.getCookies();
		if (cookies != null) {
			for (Cookie cookie : cookies) {
				if (name.equals(cookie.getName())) {
					return cookie;
				}
			}
		}

		return null;
	}

	@Override
	public String readToken(String name) {
		Cookie cookie = getCookie(name);
		return cookie == null ? null : cookie.getValue();
	}

	@Override
	public void writeToken(String name, String value, boolean secure) {
		response.addCookie(newCookie(name, value, secure));
	}

	protected Cookie newCookie(String name, String value, boolean secure) {
		Cookie cookie = new Cookie(name, value);
		cookie.setPath("/");
		cookie.setHttpOnly(true);
		cookie.setSecure(secure);
		cookie.setMaxAge(COOKIE_MAX_AGE);
		return cookie;
	}

	@Override
	public String getParameter(String name) {
		return request.getParameter(name);
	}

}
