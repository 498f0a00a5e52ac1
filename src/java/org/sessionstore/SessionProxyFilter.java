package org.sessionstore;

import java.io.IOException;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Begins a {@link Session} for every request, exposes it as the request attribute {@link #SESSION_ATTRIBUTE}
 * and commits it once the rest of the chain is done, whether or not the chain succeeded.
 *
 * @author sessionstore contributors
 */
public class SessionProxyFilter extends OncePerRequestFilter {

	public static final String SESSION_ATTRIBUTE = SessionProxyFilter.class.getName() + ".SESSION";

	private SessionManager sessionManager;
	private String[] exclusionList = new String[0];

	private final Logger log = LoggerFactory.getLogger(getClass());

	/**
	* The session begun for this request, or {@code null} if the request was excluded.
	*/
	public static Session getSession(ServletRequest request) {
		return (Session)request.getAttribute(SESSION_ATTRIBUTE);
	}

	@Override
	protected void initFilterBean() throws ServletException {
		Assert.notNull(sessionManager, "sessionManager must be specified");
	}

	@Override
	protected void doFilterInternal(final HttpServletRequest request,
			final HttpServletResponse response, final FilterChain chain)
					throws ServletException, IOException {
		if(!allowSession(request)) {
			log.debug("Not starting a session because the request is excluded: {}", request.getRequestURI());
			chain.doFilter(request, response);
			return;
		}

		final Session session;
		try {
			session = sessionManager.beginSession(new ServletSessionTransport(request, response));
		} catch(RuntimeException e) {
			log.error("Could not begin session for " + request.getRequestURI(), e);
			throw new ServletException("Could not begin session");
		}
		log.debug("Passing {} off to the next filter in the chain", session);
		request.setAttribute(SESSION_ATTRIBUTE, session);

		boolean completed = false;
		try {
			chain.doFilter(request, response);
			completed = true;
		} finally {
			try {
				session.close();
			} catch(RuntimeException e) {
				log.error("Unknown exception while committing " + session, e);
				if(completed) {
					throw new ServletException("Could not commit session");
				}
			}
		}
	}

	/**
	 * Dependency injection for the session manager.
	 * @param sessionManager the session manager
	 */
	public void setSessionManager(SessionManager sessionManager) {
		this.sessionManager = sessionManager;
	}

	protected SessionManager getSessionManager() {
		return sessionManager;
	}

	/**
	 * Regular expressions of request URIs that get no session.
	 */
	public void setExclusionList(String[] exclusionList) {
		this.exclusionList = exclusionList == null ? new String[0] : exclusionList;
	}

	protected String[] getExclusionList() {
		return exclusionList;
	}

	public boolean allowSession(final HttpServletRequest request) {
		String requestURI = request.getRequestURI();
		for(String exclusionURIRegEx : exclusionList) {
			if(requestURI != null && requestURI.matches(exclusionURIRegEx)) {
				log.debug("'{}' matches '{}'", exclusionURIRegEx, requestURI);
				return false;
			}
		}
		return true;
	}

}
