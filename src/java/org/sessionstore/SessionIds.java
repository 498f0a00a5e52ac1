package org.sessionstore;

import java.security.SecureRandom;

import com.google.common.io.BaseEncoding;

/**
 * Generates session ids and action tokens: 32 random bytes, hex encoded.
 */
public final class SessionIds {

	private static final int ID_BYTES = 32;

	private static final SecureRandom random = new SecureRandom();

	private SessionIds() {
	}

	public static String newId() {
		final byte[] buf = new byte[ID_BYTES];
		random.nextBytes(buf);
		return BaseEncoding.base16().lowerCase().encode(buf);
	}

}
