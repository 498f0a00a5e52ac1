package org.sessionstore;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;

/**
 * Serializes session values as a JSON object for the persisters that store them out of process.
 */
final class SessionValuesJson {

	private static final ObjectMapper jsonMapper = new ObjectMapper();

	private static final TypeReference<Map<String,String>> VALUES_TYPE = new TypeReference<Map<String,String>>() {};

	private SessionValuesJson() {
	}

	static String write(final String sessionId, final Map<String,String> values) {
		try {
			return jsonMapper.writeValueAsString(values);
		} catch(JsonProcessingException e) {
			throw new SessionStoreException("Cannot serialize the values of session " + sessionId, e);
		}
	}

	static Map<String,String> read(final String sessionId, final String json) {
		if(json == null || json.isEmpty()) {
			return ImmutableMap.of();
		}
		try {
			final Map<String,String> values = jsonMapper.readValue(json, VALUES_TYPE);
			if(values == null) {
				return ImmutableMap.of();
			}
			if(values.containsValue(null)) {
				throw new SessionStoreException("Stored values of session " + sessionId + " contain a null");
			}
			return values;
		} catch(IOException e) {
			throw new SessionStoreException("Cannot deserialize the values of session " + sessionId, e);
		}
	}

}
